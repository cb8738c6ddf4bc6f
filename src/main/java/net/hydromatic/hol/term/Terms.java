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
import static net.hydromatic.hol.term.HolBuilder.hol;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.IntUnaryOperator;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Hol.Term}. */
public abstract class Terms {
  private static final int MAX_DEPTH =
      Prop.MAX_DEPTH.intValue(ImmutableMap.of());

  private Terms() {}

  private static void checkDepth(Term term) {
    DepthLimitException.check(term.depth, MAX_DEPTH);
  }

  /**
   * Replaces every sub-term equal to {@code target} with {@code replacement}.
   *
   * <p>Returns {@code term} itself if there are no occurrences.
   */
  public static Term substitute(Term term, Term target, Term replacement) {
    return substitute(term, target, replacement, 0);
  }

  /**
   * Replaces every sub-term equal to {@code target} with {@code
   * replacement}, and adds {@code shift} to the id of every other variable,
   * including variables bound by quantifiers.
   *
   * <p>A non-zero shift is used when the result is to be placed under, or
   * removed from under, a binder. The replacement itself is not shifted.
   *
   * <p>Returns {@code term} itself if nothing changed.
   */
  public static Term substitute(
      Term term, Term target, Term replacement, int shift) {
    return new Shuttle() {
      @Override
      public Term apply(Term t) {
        if (t.equals(target)) {
          return replacement;
        }
        return super.apply(t);
      }

      @Override
      protected Term visit(Hol.Variable variable) {
        return visitBinder(variable);
      }

      @Override
      protected Hol.Variable visitBinder(Hol.Variable variable) {
        return shift == 0 ? variable : hol.variable(variable.id + shift);
      }
    }.apply(term);
  }

  /**
   * Replaces the sub-terms at the given positions with {@code replacement}.
   *
   * <p>Positions number the sub-terms of {@code term} in pre-order, starting
   * at 0 for {@code term} itself; the variable bound by a quantifier is not a
   * sub-term. Positions must be strictly increasing. Each replaced sub-term
   * counts as a single position along with all of its descendants, so no
   * position may fall inside a sub-term that has already been replaced.
   *
   * <p>Returns null if the sub-terms at the given positions are not all
   * equal.
   *
   * @throws IllegalArgumentException if a position is out of range, lies
   *     inside a replaced sub-term, or the positions are not increasing
   */
  public static @Nullable Term substitute(
      Term term, List<Integer> indices, Term replacement) {
    for (int i = 0; i < indices.size(); i++) {
      checkArgument(indices.get(i) >= 0, "negative index %s", indices.get(i));
      checkArgument(
          i == 0 || indices.get(i - 1) < indices.get(i),
          "indices must be strictly increasing: %s",
          indices);
    }
    final IndexShuttle shuttle = new IndexShuttle(indices, replacement);
    final Term result = shuttle.apply(term);
    if (shuttle.mismatch) {
      return null;
    }
    checkArgument(
        shuttle.next == indices.size(),
        "index %s is out of range",
        shuttle.next < indices.size() ? indices.get(shuttle.next) : -1);
    return result;
  }

  /**
   * Walks two terms of the same shape in parallel. Where {@code first} has a
   * sub-term equal to {@code target}, records the corresponding sub-term of
   * {@code second} in {@code bindings}; if a binding for {@code target} is
   * already present, the corresponding sub-term must equal it.
   *
   * <p>Returns whether the terms have the same shape and all bindings are
   * consistent.
   */
  public static boolean unify(
      Term first, Term second, Term target, Map<Term, Term> bindings) {
    checkDepth(first);
    checkDepth(second);
    return unify_(first, second, target, bindings);
  }

  private static boolean unify_(
      Term first, Term second, Term target, Map<Term, Term> bindings) {
    if (first.equals(target)) {
      final Term bound = bindings.get(target);
      if (bound == null) {
        bindings.put(target, second);
        return true;
      }
      return bound.equals(second);
    }
    if (first.op != second.op) {
      return false;
    }
    switch (first.op) {
    case VARIABLE:
    case CONSTANT:
    case PARAMETER:
      return ((Hol.Symbol) first).id == ((Hol.Symbol) second).id;
    case INTEGER:
      return ((Hol.IntLiteral) first).value == ((Hol.IntLiteral) second).value;
    case TRUE:
    case FALSE:
      return true;
    case NOT:
      return unify_(
          ((Hol.Not) first).operand,
          ((Hol.Not) second).operand,
          target,
          bindings);
    case IF_THEN:
    case EQUALS:
      final Hol.Binary binary0 = (Hol.Binary) first;
      final Hol.Binary binary1 = (Hol.Binary) second;
      return unify_(binary0.left, binary1.left, target, bindings)
          && unify_(binary0.right, binary1.right, target, bindings);
    case UNARY_APPLY:
      final Hol.UnaryApply unary0 = (Hol.UnaryApply) first;
      final Hol.UnaryApply unary1 = (Hol.UnaryApply) second;
      return unify_(unary0.fn, unary1.fn, target, bindings)
          && unify_(unary0.arg, unary1.arg, target, bindings);
    case BINARY_APPLY:
      final Hol.BinaryApply apply0 = (Hol.BinaryApply) first;
      final Hol.BinaryApply apply1 = (Hol.BinaryApply) second;
      return unify_(apply0.fn, apply1.fn, target, bindings)
          && unify_(apply0.arg0, apply1.arg0, target, bindings)
          && unify_(apply0.arg1, apply1.arg1, target, bindings);
    case AND:
    case OR:
    case IFF:
      final List<Term> args0 = ((Hol.Nary) first).args;
      final List<Term> args1 = ((Hol.Nary) second).args;
      if (args0.size() != args1.size()) {
        return false;
      }
      for (int i = 0; i < args0.size(); i++) {
        if (!unify_(args0.get(i), args1.get(i), target, bindings)) {
          return false;
        }
      }
      return true;
    case FOR_ALL:
    case EXISTS:
    case LAMBDA:
      final Hol.Quantifier quantifier0 = (Hol.Quantifier) first;
      final Hol.Quantifier quantifier1 = (Hol.Quantifier) second;
      return quantifier0.variable.id == quantifier1.variable.id
          && unify_(quantifier0.operand, quantifier1.operand, target, bindings);
    default:
      throw new AssertionError("unknown op " + first.op);
    }
  }

  /**
   * Returns the parameter that {@code second} has in place of {@code target}
   * in {@code first}, or null if the terms do not unify or if the
   * corresponding term is not a parameter.
   */
  public static Hol.@Nullable Parameter unifiesParameter(
      Term first, Term second, Term target) {
    final Map<Term, Term> bindings = new HashMap<>();
    if (!unify(first, second, target, bindings)) {
      return null;
    }
    final Term bound = bindings.get(target);
    return bound instanceof Hol.Parameter ? (Hol.Parameter) bound : null;
  }

  /**
   * Copies a term, relabeling constants, variables (including those bound by
   * quantifiers) and parameters.
   *
   * <p>Sub-terms that are unchanged by relabeling are shared with the
   * original.
   */
  public static Term clone(
      Term term,
      IntUnaryOperator constantMap,
      IntUnaryOperator variableMap,
      IntUnaryOperator parameterMap) {
    return new Shuttle() {
      @Override
      protected Term visit(Hol.Constant constant) {
        final int id = constantMap.applyAsInt(constant.id);
        return id == constant.id ? constant : hol.constant(id);
      }

      @Override
      protected Term visit(Hol.Variable variable) {
        return visitBinder(variable);
      }

      @Override
      protected Hol.Variable visitBinder(Hol.Variable variable) {
        final int id = variableMap.applyAsInt(variable.id);
        return id == variable.id ? variable : hol.variable(id);
      }

      @Override
      protected Term visit(Hol.Parameter parameter) {
        final int id = parameterMap.applyAsInt(parameter.id);
        return id == parameter.id ? parameter : hol.parameter(id);
      }
    }.apply(term);
  }

  /** Returns the ids of the parameters that occur in a term. */
  public static ImmutableSortedSet<Integer> getParameters(Term term) {
    checkDepth(term);
    final SortedSet<Integer> parameters = new TreeSet<>();
    term.accept(
        new Visitor() {
          @Override
          protected void visit(Hol.Parameter parameter) {
            parameters.add(parameter.id);
          }
        });
    return ImmutableSortedSet.copyOf(parameters);
  }

  /** Returns whether a parameter occurs in a term. */
  public static boolean containsParameter(Term term, int id) {
    return getParameters(term).contains(id);
  }

  /** Returns the ids of the variables that occur free in a term. */
  public static ImmutableSortedSet<Integer> freeVariables(Term term) {
    checkDepth(term);
    final SortedSet<Integer> variables = new TreeSet<>();
    final Map<Integer, Integer> boundCounts = new HashMap<>();
    term.accept(
        new Visitor() {
          @Override
          protected void visit(Hol.Variable variable) {
            if (!boundCounts.containsKey(variable.id)) {
              variables.add(variable.id);
            }
          }

          @Override
          protected void visit(Hol.Quantifier quantifier) {
            final int id = quantifier.variable.id;
            boundCounts.merge(id, 1, Integer::sum);
            super.visit(quantifier);
            boundCounts.computeIfPresent(id, (k, v) -> v == 1 ? null : v - 1);
          }
        });
    return ImmutableSortedSet.copyOf(variables);
  }

  /**
   * Returns the number of sub-terms of a term, including itself; the number
   * of positions that {@link #substitute(Term, List, Term)} can address.
   */
  public static int nodeCount(Term term) {
    checkDepth(term);
    final int[] count = {0};
    final Visitor visitor =
        new Visitor() {
          @Override
          protected void accept(Term t) {
            ++count[0];
            super.accept(t);
          }
        };
    visitor.accept(term);
    return count[0];
  }

  /** Shuttle that replaces sub-terms at given pre-order positions. */
  private static class IndexShuttle extends Shuttle {
    private final List<Integer> indices;
    private final Term replacement;
    /** Position of the next term to be visited. */
    int current = 0;
    /** Offset in {@link #indices} of the next position to replace. */
    int next = 0;
    @Nullable Term matched;
    boolean mismatch;

    IndexShuttle(List<Integer> indices, Term replacement) {
      this.indices = indices;
      this.replacement = replacement;
    }

    @Override
    public Term apply(Term term) {
      if (mismatch) {
        return term;
      }
      if (next < indices.size() && indices.get(next) == current) {
        if (matched == null) {
          matched = term;
        } else if (!matched.equals(term)) {
          mismatch = true;
          return term;
        }
        ++next;
        current += nodeCount(term);
        checkArgument(
            next == indices.size() || indices.get(next) >= current,
            "index %s is inside a replaced sub-term",
            next < indices.size() ? indices.get(next) : -1);
        return replacement;
      }
      ++current;
      return super.apply(term);
    }
  }
}

// End Terms.java
