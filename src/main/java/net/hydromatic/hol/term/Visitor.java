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

import net.hydromatic.hol.term.Hol.Term;

/**
 * Visits every node in a term, in pre-order.
 *
 * <p>The variable bound by a {@link Hol.Quantifier} is not visited as a node
 * in its own right; override {@link #visit(Hol.Quantifier)} to see it.
 */
public class Visitor {
  protected void accept(Term term) {
    term.accept(this);
  }

  protected void visit(Hol.Variable variable) {}

  protected void visit(Hol.Constant constant) {}

  protected void visit(Hol.Parameter parameter) {}

  protected void visit(Hol.IntLiteral intLiteral) {}

  protected void visit(Hol.Literal literal) {}

  protected void visit(Hol.Not not) {
    accept(not.operand);
  }

  protected void visit(Hol.IfThen ifThen) {
    accept(ifThen.left);
    accept(ifThen.right);
  }

  protected void visit(Hol.Equals equals) {
    accept(equals.left);
    accept(equals.right);
  }

  protected void visit(Hol.UnaryApply unaryApply) {
    accept(unaryApply.fn);
    accept(unaryApply.arg);
  }

  protected void visit(Hol.BinaryApply binaryApply) {
    accept(binaryApply.fn);
    accept(binaryApply.arg0);
    accept(binaryApply.arg1);
  }

  protected void visit(Hol.Nary nary) {
    nary.args.forEach(this::accept);
  }

  protected void visit(Hol.Quantifier quantifier) {
    accept(quantifier.operand);
  }
}

// End Visitor.java
