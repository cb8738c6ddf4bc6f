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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.hol.term.HolBuilder.hol;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.term.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Intermediate form of a term during canonicalization.
 *
 * <p>A scope is immutable. It knows which variables occur free in it, and
 * converts itself to a term on demand. Scopes are ordered by the terms they
 * produce, so that the operands of a connective come out in the same order
 * however often a term is canonicalized.
 *
 * <p>Conjunctions and disjunctions hold their operands in two sorted lists,
 * {@code children} and {@code negated}; an entry of {@code negated} stands
 * for the negation of the entry. A biconditional holds its operands in
 * {@code children} and a parity flag that, if set, negates the whole
 * biconditional.
 */
abstract class Scope implements Comparable<Scope> {
  static final AtomScope TRUE = new AtomScope(Hol.TRUE);
  static final AtomScope FALSE = new AtomScope(Hol.FALSE);

  final Op op;

  /** Variables that occur free in this scope. */
  final ImmutableSortedSet<Integer> variables;

  /** Largest id of any variable in this scope, free or bound; -1 if none. */
  final int maxVariable;

  private @Nullable Term term;

  Scope(Op op, ImmutableSortedSet<Integer> variables, int maxVariable) {
    this.op = requireNonNull(op, "op");
    this.variables = requireNonNull(variables, "variables");
    this.maxVariable = maxVariable;
  }

  /** Returns the term that this scope represents. */
  final Term term() {
    Term t = term;
    if (t == null) {
      t = toTerm();
      term = t;
    }
    return t;
  }

  /** Converts this scope to a term. Called at most once. */
  abstract Term toTerm();

  /**
   * Returns a scope in which every variable whose id is greater than
   * {@code level} has {@code delta} subtracted from its id.
   *
   * <p>Used when a binder is removed from above this scope; the variables
   * bound inside this scope move up one level.
   */
  final Scope shift(int level, int delta) {
    return maxVariable <= level || delta == 0 ? this : shift_(level, delta);
  }

  abstract Scope shift_(int level, int delta);

  /** Returns whether a variable occurs free in this scope. */
  final boolean contains(int variable) {
    return variables.contains(variable);
  }

  @Override
  public final int compareTo(Scope o) {
    return term().compareTo(o.term());
  }

  @Override
  public final boolean equals(Object obj) {
    return obj == this
        || obj instanceof Scope && term().equals(((Scope) obj).term());
  }

  @Override
  public final int hashCode() {
    return term().hashCode();
  }

  @Override
  public String toString() {
    return term().toString();
  }

  /** Returns whether this scope is true, false or a biconditional, and
   * therefore certainly boolean. */
  boolean isBooleanValued() {
    return op == Op.TRUE || op == Op.FALSE || op == Op.IFF;
  }

  /** Returns the negation of a scope. */
  static Scope negate(Scope scope) {
    switch (scope.op) {
    case TRUE:
      return FALSE;
    case FALSE:
      return TRUE;
    case NOT:
      return ((NotScope) scope).operand;
    case IFF:
      final CommutativeScope iff = (CommutativeScope) scope;
      return iff.withParity(!iff.parity);
    default:
      return new NotScope(scope);
    }
  }

  /** Returns whether one scope is the negation of the other. */
  static boolean areNegations(Scope scope0, Scope scope1) {
    switch (scope0.op) {
    case TRUE:
      return scope1.op == Op.FALSE;
    case FALSE:
      return scope1.op == Op.TRUE;
    case NOT:
      return ((NotScope) scope0).operand.equals(scope1);
    case IFF:
      if (scope1.op == Op.IFF) {
        final CommutativeScope iff0 = (CommutativeScope) scope0;
        final CommutativeScope iff1 = (CommutativeScope) scope1;
        return iff0.parity != iff1.parity
            && iff0.children.equals(iff1.children);
      }
      return false;
    default:
      return scope1.op == Op.NOT
          && ((NotScope) scope1).operand.equals(scope0);
    }
  }

  static ImmutableSortedSet<Integer> union(Iterable<? extends Scope> scopes) {
    final ImmutableSortedSet.Builder<Integer> builder =
        ImmutableSortedSet.naturalOrder();
    for (Scope scope : scopes) {
      builder.addAll(scope.variables);
    }
    return builder.build();
  }

  static int maxVariable(Iterable<? extends Scope> scopes) {
    int max = -1;
    for (Scope scope : scopes) {
      max = Math.max(max, scope.maxVariable);
    }
    return max;
  }

  /** Shifts each scope in a list; returns the same list if none changed. */
  static ImmutableList<Scope> shift(ImmutableList<Scope> scopes, int level,
      int delta) {
    final ImmutableList.Builder<Scope> builder = ImmutableList.builder();
    boolean changed = false;
    for (Scope scope : scopes) {
      final Scope scope2 = scope.shift(level, delta);
      changed |= scope2 != scope;
      builder.add(scope2);
    }
    return changed ? builder.build() : scopes;
  }

  /** Converts a list of operands, some of which are negated, to the operand
   * of a conditional: the sole operand if there is one, otherwise a
   * connective. */
  static Term connective(Op op, List<Scope> children, List<Scope> negated) {
    final List<Term> args = new ArrayList<>();
    for (Scope child : children) {
      args.add(child.term());
    }
    for (Scope scope : negated) {
      args.add(hol.not(scope.term()));
    }
    return args.size() == 1 ? args.get(0) : hol.nary(op, args);
  }

  /** Variable, constant, parameter, integer, true or false. */
  static class AtomScope extends Scope {
    private final Term atom;

    AtomScope(Term atom) {
      super(atom.op,
          atom.op == Op.VARIABLE
              ? ImmutableSortedSet.of(((Hol.Variable) atom).id)
              : ImmutableSortedSet.of(),
          atom.op == Op.VARIABLE ? ((Hol.Variable) atom).id : -1);
      checkArgument(atom.op.atom, "not an atom: %s", atom);
      this.atom = atom;
    }

    @Override
    Term toTerm() {
      return atom;
    }

    @Override
    Scope shift_(int level, int delta) {
      // only variables have ids greater than -1
      return new AtomScope(hol.variable(maxVariable - delta));
    }
  }

  /** Negation of a scope that is not itself a negation, a literal or a
   * biconditional. */
  static class NotScope extends Scope {
    final Scope operand;

    NotScope(Scope operand) {
      super(Op.NOT, operand.variables, operand.maxVariable);
      this.operand = operand;
    }

    @Override
    Term toTerm() {
      return hol.not(operand.term());
    }

    @Override
    Scope shift_(int level, int delta) {
      return new NotScope(operand.shift(level, delta));
    }
  }

  /** Scope whose operands have fixed positions: an equality of individuals
   * (operands sorted) or a function application. */
  static class OperandScope extends Scope {
    final ImmutableList<Scope> operands;

    OperandScope(Op op, ImmutableList<Scope> operands) {
      super(op, union(operands), maxVariable(operands));
      this.operands = operands;
      switch (op) {
      case EQUALS:
      case UNARY_APPLY:
        checkArgument(operands.size() == 2);
        break;
      case BINARY_APPLY:
        checkArgument(operands.size() == 3);
        break;
      default:
        throw new IllegalArgumentException("not valid: " + op);
      }
    }

    @Override
    Term toTerm() {
      switch (op) {
      case EQUALS:
        return hol.equal(operands.get(0).term(), operands.get(1).term());
      case UNARY_APPLY:
        return hol.apply(operands.get(0).term(), operands.get(1).term());
      default:
        return hol.apply(operands.get(0).term(), operands.get(1).term(),
            operands.get(2).term());
      }
    }

    @Override
    Scope shift_(int level, int delta) {
      return new OperandScope(op, shift(operands, level, delta));
    }
  }

  /** Conjunction, disjunction or biconditional. */
  static class CommutativeScope extends Scope {
    final ImmutableList<Scope> children;
    final ImmutableList<Scope> negated;

    /** Whether a biconditional is negated. Always false for conjunction and
     * disjunction. */
    final boolean parity;

    CommutativeScope(Op op, ImmutableList<Scope> children,
        ImmutableList<Scope> negated, boolean parity) {
      super(op, union(Iterables.concat(children, negated)),
          Math.max(maxVariable(children), maxVariable(negated)));
      checkArgument(op.isCommutative(), "not commutative: %s", op);
      checkArgument(op != Op.IFF || negated.isEmpty(),
          "biconditional has no negated operands");
      checkArgument(op == Op.IFF || !parity, "only a biconditional has parity");
      checkArgument(children.size() + negated.size() >= 2,
          "connective needs two operands");
      this.children = children;
      this.negated = negated;
      this.parity = parity;
    }

    CommutativeScope withParity(boolean parity) {
      return parity == this.parity
          ? this
          : new CommutativeScope(op, children, negated, parity);
    }

    @Override
    Term toTerm() {
      if (op != Op.IFF) {
        return connective(op, children, negated);
      }
      // biconditional is a chain of equalities that associates to the right
      Term term = children.get(children.size() - 1).term();
      for (int i = children.size() - 2; i >= 0; i--) {
        term = hol.equal(children.get(i).term(), term);
      }
      return parity ? hol.not(term) : term;
    }

    @Override
    Scope shift_(int level, int delta) {
      return new CommutativeScope(op, shift(children, level, delta),
          shift(negated, level, delta), parity);
    }
  }

  /**
   * Conditional. The antecedent is the conjunction of {@code left} and the
   * negations of {@code leftNegated}; the consequent is the disjunction of
   * {@code right} and the negations of {@code rightNegated}.
   */
  static class ConditionalScope extends Scope {
    final ImmutableList<Scope> left;
    final ImmutableList<Scope> leftNegated;
    final ImmutableList<Scope> right;
    final ImmutableList<Scope> rightNegated;

    ConditionalScope(ImmutableList<Scope> left,
        ImmutableList<Scope> leftNegated, ImmutableList<Scope> right,
        ImmutableList<Scope> rightNegated) {
      super(Op.IF_THEN,
          union(
              Iterables.concat(left, leftNegated, right, rightNegated)),
          maxVariable(
              Iterables.concat(left, leftNegated, right, rightNegated)));
      checkArgument(!left.isEmpty() || !leftNegated.isEmpty(),
          "empty antecedent");
      checkArgument(!right.isEmpty() || !rightNegated.isEmpty(),
          "empty consequent");
      this.left = left;
      this.leftNegated = leftNegated;
      this.right = right;
      this.rightNegated = rightNegated;
    }

    @Override
    Term toTerm() {
      return hol.ifThen(connective(Op.AND, left, leftNegated),
          connective(Op.OR, right, rightNegated));
    }

    @Override
    Scope shift_(int level, int delta) {
      return new ConditionalScope(shift(left, level, delta),
          shift(leftNegated, level, delta), shift(right, level, delta),
          shift(rightNegated, level, delta));
    }
  }

  /** Universal or existential quantifier, or lambda. */
  static class QuantifierScope extends Scope {
    final int variable;
    final Scope operand;

    QuantifierScope(Op op, int variable, Scope operand) {
      super(op, without(operand.variables, variable),
          Math.max(variable, operand.maxVariable));
      checkArgument(op.isBinder(), "not a binder: %s", op);
      this.variable = variable;
      this.operand = operand;
    }

    private static ImmutableSortedSet<Integer> without(
        ImmutableSortedSet<Integer> variables, int variable) {
      if (!variables.contains(variable)) {
        return variables;
      }
      final ImmutableSortedSet.Builder<Integer> builder =
          ImmutableSortedSet.naturalOrder();
      for (Integer v : variables) {
        if (v != variable) {
          builder.add(v);
        }
      }
      return builder.build();
    }

    @Override
    Term toTerm() {
      return hol.quantifier(op, hol.variable(variable), operand.term());
    }

    @Override
    Scope shift_(int level, int delta) {
      return new QuantifierScope(op,
          variable > level ? variable - delta : variable,
          operand.shift(level, delta));
    }
  }
}

// End Scope.java
