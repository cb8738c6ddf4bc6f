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

import static net.hydromatic.hol.term.HolBuilder.hol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.hol.term.Hol.Term;
import org.junit.jupiter.api.Test;

/** Tests for {@link Hol} and {@link HolBuilder}. */
public class TermTest {
  private static final Hol.Constant C1 = hol.constant(1);
  private static final Hol.Constant C2 = hol.constant(2);
  private static final Hol.Constant C3 = hol.constant(3);
  private static final Hol.Variable X1 = hol.variable(1);
  private static final Hol.Variable X2 = hol.variable(2);

  @Test
  void testToString() {
    assertThat(C1, hasToString("c₁"));
    assertThat(hol.variable(12), hasToString("x₁₂"));
    assertThat(hol.parameter(2), hasToString("a₂"));
    assertThat(hol.intLiteral(-3), hasToString("-3"));
    assertThat(hol.trueTerm(), hasToString("⊤"));
    assertThat(hol.falseTerm(), hasToString("⊥"));
    assertThat(hol.and(C1, hol.not(C2)), hasToString("(c₁ ∧ ¬c₂)"));
    assertThat(hol.or(C1, C2, C3), hasToString("(c₁ ∨ c₂ ∨ c₃)"));
    assertThat(hol.ifThen(C1, C2), hasToString("(c₁ → c₂)"));
    assertThat(hol.not(hol.equal(C1, C2)), hasToString("¬(c₁ = c₂)"));
    assertThat(hol.equal(C1, hol.equal(C2, C3)), hasToString("c₁ = c₂ = c₃"));
    assertThat(hol.equal(hol.equal(C1, C2), C3),
        hasToString("(c₁ = c₂) = c₃"));
    assertThat(
        hol.forAll(X1,
            hol.ifThen(hol.apply(C1, X1), hol.apply(C2, X1))),
        hasToString("∀x₁.(c₁(x₁) → c₂(x₁))"));
    assertThat(hol.and(C1, hol.exists(X1, hol.apply(C2, X1, X2))),
        hasToString("(c₁ ∧ (∃x₁.c₂(x₁, x₂)))"));
    assertThat(hol.lambda(X1, X1), hasToString("λx₁.x₁"));
  }

  /** Tests that applying a function to several arguments consumes them two
   * at a time. */
  @Test
  void testApplyList() {
    final Term t = hol.apply(C1, ImmutableList.of(X1, X2, C3));
    assertThat(t, hasToString("c₁(x₁, x₂)(c₃)"));
    assertThat(t.op, is(Op.UNARY_APPLY));
    assertThat(hol.apply(C1, ImmutableList.of(X1)).op, is(Op.UNARY_APPLY));
    assertThat(hol.apply(C1, ImmutableList.of(X1, X2)).op,
        is(Op.BINARY_APPLY));
    assertThrows(IllegalArgumentException.class,
        () -> hol.apply(C1, ImmutableList.of()));
  }

  @Test
  void testEquality() {
    final Term t1 = hol.and(hol.constant(1), hol.not(hol.variable(2)));
    final Term t2 = hol.and(hol.constant(1), hol.not(hol.variable(2)));
    assertThat(t1, not(sameInstance(t2)));
    assertThat(t1, is(t2));
    assertThat(t1.hashCode(), is(t2.hashCode()));
    assertThat(t1.compareTo(t2), is(0));

    assertThat(hol.and(C1, C2), not(hol.and(C2, C1)));
    assertThat(hol.and(C1, C2), not(hol.or(C1, C2)));
    assertThat(hol.forAll(X1, X1), not(hol.forAll(X2, X2)));
    assertThat(hol.trueTerm(), sameInstance(Hol.TRUE));
  }

  /** Tests the total order on terms: first by {@link Op}, then by
   * contents. */
  @Test
  void testCompare() {
    assertThat(X2.compareTo(C1), is(-1));
    assertThat(C1.compareTo(C2), is(-1));
    assertThat(C2.compareTo(C1), is(1));
    assertThat(hol.constant(100).compareTo(hol.parameter(0)), is(-1));
    assertThat(hol.and(C1, C2).compareTo(hol.and(C1, C2, C3)), is(-1));
    assertThat(hol.and(C1, C3).compareTo(hol.and(C2, C1)), is(-1));
    assertThat(hol.and(C1, C2).compareTo(hol.or(C1, C2)), is(-1));
    assertThat(hol.not(C1).compareTo(hol.forAll(X1, C1)), is(-1));
    assertThat(Hol.TRUE.compareTo(Hol.FALSE), is(-1));
    assertThat(Hol.FALSE.compareTo(hol.intLiteral(99)), is(1));
    assertThat(hol.forAll(X2, C1).compareTo(hol.forAll(X1, C2)), is(1));

    final List<Term> list = new ArrayList<>();
    list.add(Hol.FALSE);
    list.add(hol.not(C1));
    list.add(C2);
    list.add(hol.and(C1, C2));
    list.add(X1);
    list.add(hol.equal(C1, C2));
    Collections.sort(list);
    assertThat(list, hasToString("[x₁, c₂, (c₁ ∧ c₂), c₁ = c₂, ¬c₁, ⊥]"));
  }

  @Test
  void testDepth() {
    assertThat(C1.depth, is(1));
    assertThat(hol.not(C1).depth, is(2));
    assertThat(hol.and(C1, hol.not(hol.not(C2))).depth, is(4));
    assertThat(hol.forAll(X1, hol.apply(C1, X1)).depth, is(3));
  }

  /** Tests that {@code copy} returns the same term if its operands are
   * unchanged, so that sub-trees are shared. */
  @Test
  void testCopy() {
    final Hol.Not not = hol.not(C1);
    assertThat(not.copy(C1), sameInstance(not));
    assertThat(not.copy(C2), hasToString("¬c₂"));

    final Hol.Nary and = hol.and(C1, C2);
    assertThat(and.copy(ImmutableList.<Term>of(C1, C2)), sameInstance(and));
    assertThat(and.copy(ImmutableList.<Term>of(C1, C2, C3)),
        hasToString("(c₁ ∧ c₂ ∧ c₃)"));

    final Hol.Quantifier forAll = hol.forAll(X1, C1);
    assertThat(forAll.copy(X1, C1), sameInstance(forAll));
    assertThat(forAll.copy(X2, C1), hasToString("∀x₂.c₁"));
  }

  @Test
  void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> hol.variable(-1));
    assertThrows(IllegalArgumentException.class, () -> hol.and());
    assertThrows(IllegalArgumentException.class,
        () -> hol.nary(Op.NOT, ImmutableList.of(C1)));
    assertThrows(IllegalArgumentException.class,
        () -> hol.quantifier(Op.AND, X1, C1));
    assertThrows(NullPointerException.class, () -> hol.not(null));
  }
}

// End TermTest.java
