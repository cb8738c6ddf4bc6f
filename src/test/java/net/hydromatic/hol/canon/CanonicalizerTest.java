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

import static net.hydromatic.hol.term.HolBuilder.hol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.type.TypeAssignment;
import net.hydromatic.hol.type.TypeException;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.HolException;
import net.hydromatic.hol.util.Prop;
import net.hydromatic.hol.util.Tracer;
import net.hydromatic.hol.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Canonicalizer}. */
public class CanonicalizerTest {
  private static final Hol.Constant C1 = hol.constant(1);
  private static final Hol.Constant C2 = hol.constant(2);
  private static final Hol.Constant C3 = hol.constant(3);
  private static final Hol.Constant C4 = hol.constant(4);
  private static final Hol.Variable X1 = hol.variable(1);
  private static final Hol.Variable X2 = hol.variable(2);

  private static final Canonicalizer CANONICALIZER = Canonicalizer.create();

  /** Canonicalizes a term, checks that the result has the expected string
   * form, and checks that canonicalizing the result leaves it unchanged. */
  private static Term check(Canonicalizer canonicalizer, Term term,
      String expected) {
    final Term canonical = canonicalizer.canonicalize(term);
    assertThat(canonical, hasToString(expected));
    assertThat(canonicalizer.canonicalize(canonical), is(canonical));
    assertThat(canonicalizer.isCanonical(canonical), is(true));
    return canonical;
  }

  private static Term check(Term term, String expected) {
    return check(CANONICALIZER, term, expected);
  }

  @Test
  void testLiterals() {
    check(Hol.TRUE, "⊤");
    check(Hol.FALSE, "⊥");
    check(C1, "c₁");
    check(hol.not(Hol.TRUE), "⊥");
    check(hol.not(hol.not(C1)), "c₁");
    check(hol.apply(C1, X1, C2), "c₁(x₁, c₂)");
  }

  @Test
  void testAndOr() {
    check(hol.and(C1), "c₁");
    check(hol.and(hol.and(C1, C2), C3), "(c₁ ∧ c₂ ∧ c₃)");
    check(hol.and(C3, C1, C2, C1), "(c₁ ∧ c₂ ∧ c₃)");
    check(hol.and(C1, hol.not(C1)), "⊥");
    check(hol.or(C1, hol.not(C1)), "⊤");
    check(hol.and(C1, Hol.TRUE), "c₁");
    check(hol.and(C1, Hol.FALSE), "⊥");
    check(hol.or(C1, Hol.FALSE), "c₁");
    check(hol.or(C1, Hol.TRUE), "⊤");
    check(hol.and(Hol.TRUE, Hol.TRUE), "⊤");
    check(hol.or(Hol.FALSE), "⊥");
    check(hol.and(C2, hol.not(C1), C3), "(c₂ ∧ c₃ ∧ ¬c₁)");
    check(hol.or(C2, hol.and(C1, C3)), "(c₂ ∨ (c₁ ∧ c₃))");
  }

  @Test
  void testIff() {
    check(hol.iff(C1, C1), "⊤");
    check(hol.iff(C1, hol.not(C1)), "⊥");
    check(hol.iff(C2, C1), "c₁ = c₂");
    check(hol.iff(C1, C2, C3), "c₁ = c₂ = c₃");
    check(hol.iff(C1, C2, C1), "c₂");
    check(hol.not(hol.iff(C1, C2)), "¬(c₁ = c₂)");
    check(hol.iff(C1, hol.not(C2)), "¬(c₁ = c₂)");
    check(hol.iff(hol.not(C1), hol.not(C2)), "c₁ = c₂");
    check(hol.iff(C1, Hol.FALSE), "¬c₁");
    check(hol.iff(C1, hol.iff(C2, C3)), "c₁ = c₂ = c₃");
    check(hol.iff(hol.and(C1, C2), C3), "c₃ = (c₁ ∧ c₂)");
  }

  @Test
  void testEquals() {
    check(hol.equal(C2, C1), "c₁ = c₂");
    check(hol.equal(C1, C1), "⊤");
    check(hol.equal(C1, Hol.TRUE), "c₁");
    check(hol.equal(C1, Hol.FALSE), "¬c₁");
    check(hol.equal(Hol.FALSE, hol.equal(C1, C2)), "¬(c₁ = c₂)");
    check(hol.equal(hol.intLiteral(2), hol.intLiteral(1)), "1 = 2");

    final Canonicalizer distinct =
        Canonicalizer.create(
            ImmutableMap.of(Prop.ALL_CONSTANTS_DISTINCT, true),
            Tracers.empty());
    check(distinct, hol.equal(C1, C2), "⊥");
    check(distinct, hol.equal(C1, C1), "⊤");
    check(distinct, hol.equal(X1, C1), "x₁ = c₁");
  }

  /** A biconditional of two constants is written as an equation. If all
   * constants are distinct, a second pass reads that equation as a
   * comparison of two individuals, so the result is not stable. */
  @Test
  void testDistinctConstantsBiconditional() {
    final Canonicalizer distinct =
        Canonicalizer.create(
            ImmutableMap.of(Prop.ALL_CONSTANTS_DISTINCT, true),
            Tracers.empty());
    final Term canonical = distinct.canonicalize(hol.iff(C1, C2));
    assertThat(canonical, hasToString("c₁ = c₂"));
    assertThat(distinct.canonicalize(canonical), hasToString("⊥"));

    // without the property, the equation is stable
    assertThat(CANONICALIZER.canonicalize(canonical), is(canonical));
  }

  @Test
  void testPolymorphicEquality() {
    final Term t = hol.and(C1, hol.equal(C1, hol.intLiteral(1)));
    assertThrows(TypeException.class, () -> CANONICALIZER.canonicalize(t));

    final Canonicalizer polymorphic =
        Canonicalizer.create(
            ImmutableMap.of(Prop.POLYMORPHIC_EQUALITY, true),
            Tracers.empty());
    assertThat(polymorphic.canonicalize(t), hasToString("(c₁ ∧ (c₁ = 1))"));
  }

  @Test
  void testConditional() {
    check(hol.ifThen(C1, C1), "⊤");
    check(hol.ifThen(Hol.FALSE, C1), "⊤");
    check(hol.ifThen(Hol.TRUE, C1), "c₁");
    check(hol.ifThen(C1, Hol.TRUE), "⊤");
    check(hol.ifThen(C1, Hol.FALSE), "¬c₁");
    check(hol.ifThen(C1, hol.not(C1)), "¬c₁");
    check(hol.ifThen(C1, C2), "(c₁ → c₂)");
    check(hol.ifThen(hol.not(C1), C2), "(¬c₁ → c₂)");
    check(hol.ifThen(hol.and(C1, C2), C1), "⊤");
    check(hol.ifThen(C1, hol.or(C2, C1)), "⊤");
    check(hol.ifThen(hol.and(C1, C2), hol.or(C3, hol.not(C4))),
        "((c₁ ∧ c₂) → (c₃ ∨ ¬c₄))");
  }

  /** Nested conditionals merge into one; "a → (b → c)" is
   * "a ∧ b → c". */
  @Test
  void testConditionalAbsorb() {
    check(hol.ifThen(C1, hol.ifThen(C2, C3)), "((c₁ ∧ c₂) → c₃)");
    check(hol.ifThen(C1, hol.or(C2, hol.ifThen(C3, C4))),
        "((c₁ ∧ c₃) → (c₂ ∨ c₄))");
    check(hol.ifThen(C1, hol.ifThen(C2, C1)), "⊤");
    check(hol.ifThen(C1, hol.ifThen(hol.not(C1), C2)), "⊤");

    // after absorption the antecedent equals the consequent
    check(hol.ifThen(C2, hol.ifThen(C3, hol.and(C2, C3))), "⊤");
    // after absorption the consequent is the negation of the antecedent
    check(hol.ifThen(C1, hol.ifThen(C2, hol.not(hol.and(C1, C2)))),
        "¬(c₁ ∧ c₂)");
  }

  @Test
  void testQuantifier() {
    check(hol.exists(X1, C2), "c₂");
    check(hol.forAll(X1, hol.apply(C1, X1)), "∀x₀.c₁(x₀)");
    check(hol.forAll(X1, hol.exists(X2, hol.apply(C1, X1, X2))),
        "∀x₀.∃x₁.c₁(x₀, x₁)");
    check(hol.forAll(X2, hol.forAll(X1, hol.apply(C1, X2))),
        "∀x₀.c₁(x₀)");
    check(hol.apply(C1, hol.lambda(X1, C2)), "c₁(λx₀.c₂)");
  }

  /** Bound variables are numbered just above the largest free variable. */
  @Test
  void testQuantifierFreeVariables() {
    check(
        hol.and(hol.apply(C1, X2),
            hol.forAll(hol.variable(7), hol.apply(C2, hol.variable(7), X2))),
        "(c₁(x₂) ∧ (∀x₃.c₂(x₃, x₂)))");

    // x₅ vanishes, so the bound variable is renumbered from 0
    final Term t =
        hol.and(
            hol.or(hol.apply(C1, hol.variable(5)),
                hol.not(hol.apply(C1, hol.variable(5)))),
            hol.forAll(X1, hol.apply(C2, X1)));
    check(t, "∀x₀.c₂(x₀)");
  }

  /** Terms that differ only in the names of bound variables have the same
   * canonical form. */
  @Test
  void testAlphaEquivalence() {
    final Term t1 = hol.forAll(X1, hol.exists(X2, hol.apply(C1, X2, X1)));
    final Term t2 =
        hol.forAll(hol.variable(8),
            hol.exists(hol.variable(3),
                hol.apply(C1, hol.variable(3), hol.variable(8))));
    assertThat(CANONICALIZER.canonicalize(t1),
        is(CANONICALIZER.canonicalize(t2)));
  }

  /** Parts of a conjunction or disjunction that do not mention the bound
   * variable move outside the quantifier. */
  @Test
  void testMiniscope() {
    final Term t =
        check(hol.exists(X1, hol.and(hol.apply(C1, X1), C2)),
            "(c₂ ∧ (∃x₀.c₁(x₀)))");
    assertThat(
        CANONICALIZER.canonicalize(
            hol.and(hol.exists(X1, hol.apply(C1, X1)), C2)),
        is(t));

    final Term t2 =
        check(
            hol.forAll(X1,
                hol.exists(X2,
                    hol.and(hol.apply(C1, X1), hol.apply(C2, X2)))),
            "((∀x₀.c₁(x₀)) ∧ (∃x₀.c₂(x₀)))");
    assertThat(
        CANONICALIZER.canonicalize(
            hol.and(hol.forAll(X1, hol.apply(C1, X1)),
                hol.exists(X2, hol.apply(C2, X2)))),
        is(t2));
  }

  @Test
  void testMiniscopeConditional() {
    check(hol.forAll(X1, hol.ifThen(C2, hol.apply(C1, X1))),
        "(c₂ → (∀x₀.c₁(x₀)))");
    check(hol.forAll(X1, hol.ifThen(hol.apply(C1, X1), C2)),
        "(c₂ ∨ (∀x₀.¬c₁(x₀)))");
    check(
        hol.forAll(X1,
            hol.ifThen(hol.and(C3, hol.apply(C1, X1)),
                hol.apply(C2, X1))),
        "(c₃ → (∀x₀.(c₁(x₀) → c₂(x₀))))");

    // what remains under the quantifier is simplified as a conditional
    check(
        hol.exists(X1,
            hol.ifThen(hol.and(C1, hol.not(hol.apply(C3, X1))),
                hol.apply(C3, X1))),
        "(c₁ → (∃x₀.c₃(x₀)))");
    check(
        hol.forAll(X1,
            hol.ifThen(hol.and(C1, hol.apply(C3, X1)),
                hol.not(hol.apply(C3, X1)))),
        "(c₁ → (∀x₀.¬c₃(x₀)))");
    check(
        hol.forAll(X1,
            hol.ifThen(hol.and(C1, hol.apply(C3, X1)),
                hol.or(C2, hol.apply(C3, X1)))),
        "⊤");
  }

  @Test
  void testShadowing() {
    final Term t = hol.forAll(X1, hol.exists(X1, hol.apply(C1, X1)));
    final MalformedTermException e =
        assertThrows(MalformedTermException.class,
            () -> CANONICALIZER.canonicalize(t));
    assertThat(e.getMessage(),
        startsWith("Multiple declaration of variable x₁"));

    // the same variable may be bound twice if the scopes do not nest
    check(
        hol.and(hol.forAll(X1, hol.apply(C1, X1)),
            hol.exists(X1, hol.apply(C2, X1))),
        "((∀x₀.c₁(x₀)) ∧ (∃x₀.c₂(x₀)))");
  }

  @Test
  void testIsCanonical() {
    assertThat(CANONICALIZER.isCanonical(hol.and(C1, C2)), is(true));
    assertThat(CANONICALIZER.isCanonical(hol.and(C2, C1)), is(false));
    assertThat(CANONICALIZER.isCanonical(hol.forAll(X1, hol.apply(C1, X1))),
        is(false));
    assertThat(
        CANONICALIZER.isCanonical(
            hol.forAll(hol.variable(0), hol.apply(C1, hol.variable(0)))),
        is(true));
  }

  @Test
  void testIntersect() {
    assertThat(CANONICALIZER.intersect(C2, C1), hasToString("(c₁ ∧ c₂)"));
    assertThat(CANONICALIZER.intersect(C1, hol.not(C1)), hasToString("⊥"));
    assertThat(CANONICALIZER.intersect(hol.and(C1, C3), hol.and(C2, C1)),
        hasToString("(c₁ ∧ c₂ ∧ c₃)"));
  }

  @Test
  void testTracer() {
    final List<TypeAssignment> typeList = new ArrayList<>();
    final List<Term> canonicalList = new ArrayList<>();
    final List<HolException> exceptionList = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnTypes(tracer, (term, types) -> typeList.add(types));
    tracer = Tracers.withOnCanonical(tracer, canonicalList::add);
    tracer = Tracers.withOnException(tracer, exceptionList::add);
    final Canonicalizer canonicalizer =
        Canonicalizer.create(ImmutableMap.of(), tracer);

    canonicalizer.canonicalize(hol.and(C2, hol.apply(C1, X1)));
    assertThat(typeList, hasSize(1));
    assertThat(typeList.get(0).constantType(1), hasToString("(* → 𝝄)"));
    assertThat(canonicalList, hasToString("[(c₂ ∧ c₁(x₁))]"));
    assertThat(exceptionList.isEmpty(), is(true));

    final Term bad = hol.not(hol.intLiteral(3));
    assertThrows(TypeException.class, () -> canonicalizer.canonicalize(bad));
    assertThat(exceptionList, hasSize(1));
    assertThat(exceptionList.get(0), instanceOf(TypeException.class));
    assertThat(typeList, hasSize(1));
    assertThat(canonicalList, hasSize(1));
  }

  @Test
  void testDepthLimit() {
    Term t = C1;
    for (int i = 0; i < 50; i++) {
      t = hol.not(t);
    }
    final Term deep = t;
    check(deep, "c₁");

    final List<HolException> exceptionList = new ArrayList<>();
    final Canonicalizer canonicalizer =
        Canonicalizer.create(ImmutableMap.of(Prop.MAX_DEPTH, 10),
            Tracers.withOnException(Tracers.empty(), exceptionList::add));
    final DepthLimitException e =
        assertThrows(DepthLimitException.class,
            () -> canonicalizer.canonicalize(deep));
    assertThat(e.depth, is(51));
    assertThat(e.maxDepth, is(10));
    assertThat(exceptionList, hasSize(1));
  }

  /** Canonicalizes a batch of terms and checks that each result is a fixed
   * point. */
  @Test
  void testIdempotent() {
    final List<Term> terms =
        ImmutableList.of(
            hol.or(hol.and(C1, C2), hol.not(hol.and(C2, C1))),
            hol.ifThen(hol.iff(C1, C2), hol.or(C3, hol.not(hol.iff(C2, C1)))),
            hol.exists(X1,
                hol.or(hol.apply(C1, X1), hol.and(C2, hol.apply(C3, X1)))),
            hol.forAll(X1, hol.equal(X1, hol.apply(C1, X1))),
            hol.and(hol.apply(C1, X2), hol.not(hol.equal(X2, C3))),
            hol.lambda(X1, hol.and(X1, C2)));
    for (Term term : terms) {
      final Term canonical = CANONICALIZER.canonicalize(term);
      assertThat(CANONICALIZER.canonicalize(canonical), is(canonical));
    }
  }

  /** Canonicalizes generated formulas that mix conditionals, quantifiers,
   * negation and conjunction, and checks that a second pass changes
   * nothing. */
  @Test
  void testIdempotentGenerated() {
    final Random r = new Random(0);
    for (int i = 0; i < 2_000; i++) {
      final Term term = generate(r, 4, 0);
      final Term canonical = CANONICALIZER.canonicalize(term);
      assertThat("canonical form of " + term,
          CANONICALIZER.canonicalize(canonical), is(canonical));
    }
  }

  /** Generates a proposition. Boolean atoms are c₁, c₂ and c₃; c₄ is a
   * predicate on the variables bound so far, numbered from 1. */
  private static Term generate(Random r, int depth, int boundCount) {
    final int choice = depth == 0 ? r.nextInt(2) : r.nextInt(8);
    switch (choice) {
    case 0:
      return hol.constant(1 + r.nextInt(3));
    case 1:
      if (boundCount == 0) {
        return hol.constant(1 + r.nextInt(3));
      }
      return hol.apply(C4, hol.variable(1 + r.nextInt(boundCount)));
    case 2:
      return hol.not(generate(r, depth - 1, boundCount));
    case 3:
      return hol.and(generate(r, depth - 1, boundCount),
          generate(r, depth - 1, boundCount));
    case 4:
    case 5:
      return hol.ifThen(generate(r, depth - 1, boundCount),
          generate(r, depth - 1, boundCount));
    case 6:
      return hol.exists(hol.variable(boundCount + 1),
          generate(r, depth - 1, boundCount + 1));
    default:
      return hol.forAll(hol.variable(boundCount + 1),
          generate(r, depth - 1, boundCount + 1));
    }
  }
}

// End CanonicalizerTest.java
