/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.hol.term;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.Prop;

/**
 * Visits and transforms terms.
 *
 * <p>The default implementation of each {@code visit} method transforms the
 * operands of a term and, if any of them changed, creates a copy of the term
 * with the new operands. If no operand changed, the original term is
 * returned, so that unchanged sub-trees are shared rather than copied.
 */
public class Shuttle {
  protected final int maxDepth;

  /** Creates a Shuttle with the default depth limit. */
  public Shuttle() {
    this(Prop.MAX_DEPTH.intValue(ImmutableMap.of()));
  }

  /** Creates a Shuttle that rejects terms deeper than {@code maxDepth}. */
  public Shuttle(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /**
   * Transforms a term.
   *
   * @throws DepthLimitException if the term is nested too deeply
   */
  public Term apply(Term term) {
    DepthLimitException.check(term.depth, maxDepth);
    return term.accept(this);
  }

  protected List<Term> visitList(List<Term> terms) {
    final List<Term> list = new ArrayList<>(terms.size());
    for (Term term : terms) {
      list.add(apply(term));
    }
    return list;
  }

  /** Transforms the variable bound by a quantifier. */
  protected Hol.Variable visitBinder(Hol.Variable variable) {
    return variable;
  }

  protected Term visit(Hol.Variable variable) {
    return variable;
  }

  protected Term visit(Hol.Constant constant) {
    return constant;
  }

  protected Term visit(Hol.Parameter parameter) {
    return parameter;
  }

  protected Term visit(Hol.IntLiteral intLiteral) {
    return intLiteral;
  }

  protected Term visit(Hol.Literal literal) {
    return literal;
  }

  protected Term visit(Hol.Not not) {
    return not.copy(apply(not.operand));
  }

  protected Term visit(Hol.IfThen ifThen) {
    return ifThen.copy(apply(ifThen.left), apply(ifThen.right));
  }

  protected Term visit(Hol.Equals equals) {
    return equals.copy(apply(equals.left), apply(equals.right));
  }

  protected Term visit(Hol.UnaryApply unaryApply) {
    return unaryApply.copy(apply(unaryApply.fn), apply(unaryApply.arg));
  }

  protected Term visit(Hol.BinaryApply binaryApply) {
    return binaryApply.copy(
        apply(binaryApply.fn), apply(binaryApply.arg0),
        apply(binaryApply.arg1));
  }

  protected Term visit(Hol.Nary nary) {
    return nary.copy(visitList(nary.args));
  }

  protected Term visit(Hol.Quantifier quantifier) {
    return quantifier.copy(
        visitBinder(quantifier.variable), apply(quantifier.operand));
  }
}

// End Shuttle.java
