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
package net.hydromatic.hol.canon;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.term.Op;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.Prop;

/** Structural subset tests on canonical terms. */
public abstract class Subsets {
  private static final int MAX_DEPTH =
      Prop.MAX_DEPTH.intValue(ImmutableMap.of());

  private Subsets() {}

  /**
   * Returns whether the set denoted by {@code first} is a subset of the set
   * denoted by {@code second}; that is, whether {@code first} implies
   * {@code second}.
   *
   * <p>The test is structural, and both terms should be canonical. A false
   * result means that the relation could not be established, not that it
   * does not hold.
   *
   * @throws UnsupportedSubsetException if the test reaches a conditional,
   *     equality, biconditional or quantifier that is not identical to its
   *     counterpart
   * @throws MalformedTermException if a term is an integer, which is not a
   *     proposition
   */
  public static boolean isSubset(Term first, Term second) {
    DepthLimitException.check(first.depth, MAX_DEPTH);
    DepthLimitException.check(second.depth, MAX_DEPTH);
    return isSubset_(first, second);
  }

  private static boolean isSubset_(Term first, Term second) {
    if (first.op == Op.TRUE) {
      return second.op == Op.TRUE;
    }
    if (second.op == Op.TRUE || first.op == Op.FALSE) {
      return true;
    }
    if (second.op == Op.FALSE) {
      return false;
    }
    if (first.equals(second)) {
      return true;
    }
    if (first.op == Op.AND || second.op == Op.AND) {
      return isConjunctionSubset(operands(first, Op.AND),
          operands(second, Op.AND));
    }
    if (first.op == Op.OR || second.op == Op.OR) {
      return isDisjunctionSubset(operands(first, Op.OR),
          operands(second, Op.OR));
    }
    checkSupported(first, second);
    checkSupported(second, first);
    switch (first.op) {
    case VARIABLE:
    case CONSTANT:
    case PARAMETER:
    case UNARY_APPLY:
    case BINARY_APPLY:
      // not equal, as we checked above
      return false;
    case NOT:
      return second.op == Op.NOT
          && isSubset_(((Hol.Not) second).operand, ((Hol.Not) first).operand);
    default:
      throw new AssertionError("unexpected op " + first.op);
    }
  }

  private static void checkSupported(Term term, Term other) {
    switch (term.op) {
    case IF_THEN:
    case EQUALS:
    case IFF:
    case FOR_ALL:
    case EXISTS:
    case LAMBDA:
      throw new UnsupportedSubsetException(term, other);
    case INTEGER:
      throw new MalformedTermException("Term " + term
          + " is not a proposition");
    default:
      break;
    }
  }

  /** Returns the operands of a term if it is a given connective, otherwise
   * a list containing just the term. */
  private static List<Term> operands(Term term, Op op) {
    return term.op == op ? ((Hol.Nary) term).args : ImmutableList.of(term);
  }

  /** Returns whether "a1 ∧ ... ∧ am" is a subset of "b1 ∧ ... ∧ bn"; that is,
   * whether each bj has some ai that is a subset of it. */
  private static boolean isConjunctionSubset(List<Term> first,
      List<Term> second) {
    for (Term b : second) {
      if (!first.contains(b) && !anySubset(first, b)) {
        return false;
      }
    }
    return true;
  }

  private static boolean anySubset(List<Term> first, Term b) {
    for (Term a : first) {
      if (isSubset_(a, b)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether "a1 ∨ ... ∨ am" is a subset of "b1 ∨ ... ∨ bn"; that is,
   * whether each ai is a subset of some bj. */
  private static boolean isDisjunctionSubset(List<Term> first,
      List<Term> second) {
    for (Term a : first) {
      if (!second.contains(a) && !subsetOfAny(a, second)) {
        return false;
      }
    }
    return true;
  }

  private static boolean subsetOfAny(Term a, List<Term> second) {
    for (Term b : second) {
      if (isSubset_(a, b)) {
        return true;
      }
    }
    return false;
  }
}

// End Subsets.java
