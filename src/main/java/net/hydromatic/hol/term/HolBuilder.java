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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds terms. */
public enum HolBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  hol;

  /** Creates a variable. */
  public Hol.Variable variable(int id) {
    return new Hol.Variable(id);
  }

  /** Creates a constant. */
  public Hol.Constant constant(int id) {
    return new Hol.Constant(id);
  }

  /** Creates a parameter. */
  public Hol.Parameter parameter(int id) {
    return new Hol.Parameter(id);
  }

  /** Creates an integer literal. */
  public Hol.IntLiteral intLiteral(int value) {
    return new Hol.IntLiteral(value);
  }

  /** Returns the true literal. */
  public Hol.Literal trueTerm() {
    return Hol.TRUE;
  }

  /** Returns the false literal. */
  public Hol.Literal falseTerm() {
    return Hol.FALSE;
  }

  /** Creates a negation. */
  public Hol.Not not(Hol.Term operand) {
    return new Hol.Not(requireNonNull(operand, "operand"));
  }

  /** Creates a conditional, "left → right". */
  public Hol.IfThen ifThen(Hol.Term left, Hol.Term right) {
    return new Hol.IfThen(
        requireNonNull(left, "left"), requireNonNull(right, "right"));
  }

  /** Creates an equality, "left = right". */
  public Hol.Equals equal(Hol.Term left, Hol.Term right) {
    return new Hol.Equals(
        requireNonNull(left, "left"), requireNonNull(right, "right"));
  }

  /** Creates a conjunction. */
  public Hol.Nary and(Hol.Term... args) {
    return nary(Op.AND, ImmutableList.copyOf(args));
  }

  /** Creates a conjunction. */
  public Hol.Nary and(List<? extends Hol.Term> args) {
    return nary(Op.AND, args);
  }

  /** Creates a disjunction. */
  public Hol.Nary or(Hol.Term... args) {
    return nary(Op.OR, ImmutableList.copyOf(args));
  }

  /** Creates a disjunction. */
  public Hol.Nary or(List<? extends Hol.Term> args) {
    return nary(Op.OR, args);
  }

  /** Creates a biconditional. */
  public Hol.Nary iff(Hol.Term... args) {
    return nary(Op.IFF, ImmutableList.copyOf(args));
  }

  /** Creates a biconditional. */
  public Hol.Nary iff(List<? extends Hol.Term> args) {
    return nary(Op.IFF, args);
  }

  /** Creates a conjunction, disjunction or biconditional. */
  public Hol.Nary nary(Op op, List<? extends Hol.Term> args) {
    return new Hol.Nary(op, ImmutableList.copyOf(args));
  }

  /** Creates a universal quantification, "∀x. operand". */
  public Hol.Quantifier forAll(Hol.Variable variable, Hol.Term operand) {
    return quantifier(Op.FOR_ALL, variable, operand);
  }

  /** Creates an existential quantification, "∃x. operand". */
  public Hol.Quantifier exists(Hol.Variable variable, Hol.Term operand) {
    return quantifier(Op.EXISTS, variable, operand);
  }

  /** Creates a lambda abstraction, "λx. operand". */
  public Hol.Quantifier lambda(Hol.Variable variable, Hol.Term operand) {
    return quantifier(Op.LAMBDA, variable, operand);
  }

  /** Creates a term that binds a variable. */
  public Hol.Quantifier quantifier(
      Op op, Hol.Variable variable, Hol.Term operand) {
    return new Hol.Quantifier(
        op, requireNonNull(variable, "variable"),
        requireNonNull(operand, "operand"));
  }

  /** Creates an application of a function to one argument. */
  public Hol.UnaryApply apply(Hol.Term fn, Hol.Term arg) {
    return new Hol.UnaryApply(
        requireNonNull(fn, "fn"), requireNonNull(arg, "arg"));
  }

  /** Creates an application of a function to two arguments. */
  public Hol.BinaryApply apply(Hol.Term fn, Hol.Term arg0, Hol.Term arg1) {
    return new Hol.BinaryApply(
        requireNonNull(fn, "fn"),
        requireNonNull(arg0, "arg0"),
        requireNonNull(arg1, "arg1"));
  }

  /**
   * Creates an application of a function to one or more arguments.
   *
   * <p>Arguments are consumed two at a time, left to right; for example,
   * {@code apply(f, [a, b, c])} is {@code f(a, b)(c)}.
   */
  public Hol.Term apply(Hol.Term fn, List<? extends Hol.Term> args) {
    checkArgument(!args.isEmpty(), "function must have arguments");
    Hol.Term term = fn;
    int i = 0;
    for (; i + 1 < args.size(); i += 2) {
      term = apply(term, args.get(i), args.get(i + 1));
    }
    if (i < args.size()) {
      term = apply(term, args.get(i));
    }
    return term;
  }
}

// End HolBuilder.java
