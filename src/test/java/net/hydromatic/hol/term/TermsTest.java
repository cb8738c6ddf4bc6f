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
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.util.DepthLimitException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Terms}. */
public class TermsTest {
  private static final Hol.Constant C1 = hol.constant(1);
  private static final Hol.Constant C2 = hol.constant(2);
  private static final Hol.Constant C3 = hol.constant(3);
  private static final Hol.Constant C9 = hol.constant(9);
  private static final Hol.Variable X1 = hol.variable(1);
  private static final Hol.Variable X2 = hol.variable(2);

  @Test
  void testSubstitute() {
    final Term t = hol.and(C1, hol.apply(C2, C1));
    assertThat(Terms.substitute(t, C1, C3), hasToString("(c₃ ∧ c₂(c₃))"));
    assertThat(Terms.substitute(t, C9, C3), sameInstance(t));

    // a whole sub-term is replaced before its descendants are visited
    assertThat(Terms.substitute(t, hol.apply(C2, C1), C1),
        hasToString("(c₁ ∧ c₁)"));
  }

  @Test
  void testSubstituteShift() {
    final Term t = hol.forAll(X2, hol.apply(C1, X2, hol.variable(3)));
    assertThat(Terms.substitute(t, C9, C3, 0), sameInstance(t));
    assertThat(Terms.substitute(t, C9, C3, 1),
        hasToString("∀x₃.c₁(x₃, x₄)"));
    assertThat(Terms.substitute(t, C1, C2, -1),
        hasToString("∀x₁.c₂(x₁, x₂)"));
  }

  /** Tests substitution by position. The positions of
   * {@code (c₁(x₁) ∧ c₂(x₁))} are 0 for the whole term, then 1 through 6 for
   * {@code c₁(x₁)}, {@code c₁}, {@code x₁}, {@code c₂(x₁)}, {@code c₂},
   * {@code x₁}. */
  @Test
  void testSubstituteIndices() {
    final Term t = hol.and(hol.apply(C1, X1), hol.apply(C2, X1));
    assertThat(Terms.nodeCount(t), is(7));
    assertThat(Terms.substitute(t, ImmutableList.of(3, 6), C9),
        hasToString("(c₁(c₉) ∧ c₂(c₉))"));
    assertThat(Terms.substitute(t, ImmutableList.of(3), C9),
        hasToString("(c₁(c₉) ∧ c₂(x₁))"));
    assertThat(Terms.substitute(t, ImmutableList.of(0), C9),
        hasToString("c₉"));
    assertThat(Terms.substitute(t, ImmutableList.of(), C9), sameInstance(t));

    // c₁ and x₁ are not the same term
    assertThat(Terms.substitute(t, ImmutableList.of(2, 3), C9),
        nullValue());

    // position 2 lies inside the sub-term at position 1
    assertThrows(IllegalArgumentException.class,
        () -> Terms.substitute(t, ImmutableList.of(1, 2), C9));
    assertThrows(IllegalArgumentException.class,
        () -> Terms.substitute(t, ImmutableList.of(7), C9));
    assertThrows(IllegalArgumentException.class,
        () -> Terms.substitute(t, ImmutableList.of(3, 3), C9));
    assertThrows(IllegalArgumentException.class,
        () -> Terms.substitute(t, ImmutableList.of(-1), C9));
  }

  /** The variable bound by a quantifier does not have a position. */
  @Test
  void testSubstituteIndicesQuantifier() {
    final Term t = hol.forAll(X1, hol.apply(C1, X1));
    assertThat(Terms.nodeCount(t), is(4));
    assertThat(Terms.substitute(t, ImmutableList.of(3), C9),
        hasToString("∀x₁.c₁(c₉)"));
  }

  @Test
  void testUnify() {
    final Term first = hol.and(hol.apply(C1, X1), hol.apply(C2, X1));
    final Term second =
        hol.and(hol.apply(C1, hol.parameter(3)),
            hol.apply(C2, hol.parameter(3)));
    final Map<Term, Term> bindings = new HashMap<>();
    assertThat(Terms.unify(first, second, X1, bindings), is(true));
    assertThat(bindings.get(X1), hasToString("a₃"));
    assertThat(Terms.unifiesParameter(first, second, X1),
        hasToString("a₃"));

    // inconsistent bindings
    final Term third =
        hol.and(hol.apply(C1, hol.parameter(3)),
            hol.apply(C2, hol.parameter(4)));
    assertThat(Terms.unify(first, third, X1, new HashMap<>()), is(false));
    assertThat(Terms.unifiesParameter(first, third, X1), nullValue());

    // different shape
    assertThat(Terms.unify(first, hol.or(C1, C2), X1, new HashMap<>()),
        is(false));

    // bound to something other than a parameter
    final Term fourth = hol.and(hol.apply(C1, C3), hol.apply(C2, C3));
    assertThat(Terms.unifiesParameter(first, fourth, X1), nullValue());
  }

  @Test
  void testClone() {
    final Term t = hol.forAll(X1, hol.apply(C1, X1, hol.parameter(2)));
    assertThat(
        Terms.clone(t, i -> i + 10, i -> i + 1, i -> i + 2),
        hasToString("∀x₂.c₁₁(x₂, a₄)"));
    assertThat(Terms.clone(t, i -> i, i -> i, i -> i), sameInstance(t));
  }

  @Test
  void testParameters() {
    final Term t =
        hol.and(hol.parameter(3), hol.apply(C1, hol.parameter(1)), C2);
    assertThat(Terms.getParameters(t), hasToString("[1, 3]"));
    assertThat(Terms.containsParameter(t, 3), is(true));
    assertThat(Terms.containsParameter(t, 2), is(false));
    assertThat(Terms.getParameters(C1).isEmpty(), is(true));
  }

  @Test
  void testFreeVariables() {
    final Term t =
        hol.and(hol.variable(3),
            hol.forAll(X2, hol.apply(C1, X2, X1)));
    assertThat(Terms.freeVariables(t), hasToString("[1, 3]"));

    // x₁ is free outside the quantifier, bound inside it
    final Term t2 = hol.and(X1, hol.exists(X1, X1));
    assertThat(Terms.freeVariables(t2), hasToString("[1]"));
    assertThat(Terms.freeVariables(hol.exists(X1, X1)).isEmpty(), is(true));
  }

  @Test
  void testDepthLimit() {
    Term t = C1;
    for (int i = 0; i < 2_000; i++) {
      t = hol.not(t);
    }
    final Term deep = t;
    final DepthLimitException e =
        assertThrows(DepthLimitException.class, () -> Terms.nodeCount(deep));
    assertThat(e.getMessage(), is("term depth 2001 exceeds limit 2000"));
    assertThat(Terms.nodeCount(((Hol.Not) deep).operand), is(2_000));
  }
}

// End TermsTest.java
