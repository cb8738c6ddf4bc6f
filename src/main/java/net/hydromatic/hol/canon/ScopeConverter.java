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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.hol.term.HolBuilder.hol;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.term.Op;
import net.hydromatic.hol.type.TypeAssignment;

/**
 * Converts a term to a {@link Scope}, applying the rewrites that make the
 * result canonical.
 *
 * <p>Bound variables are renumbered. A variable bound at nesting depth
 * {@code d} (1 for the outermost binder) gets id {@code maxFree + d}, where
 * {@code maxFree} is the largest id of a free variable in the whole term.
 * When a binder is dropped or a scope moves out from under a binder, the ids
 * of the variables bound inside it are shifted down to keep this property.
 */
class ScopeConverter {
  private final TypeAssignment types;
  private final boolean allConstantsDistinct;
  private final int maxFree;

  /** Maps the id of each variable bound by an enclosing binder to its new
   * id. */
  private final Map<Integer, Integer> boundVariables = new HashMap<>();
  private int depth;

  ScopeConverter(TypeAssignment types, boolean allConstantsDistinct,
      int maxFree) {
    this.types = requireNonNull(types, "types");
    this.allConstantsDistinct = allConstantsDistinct;
    this.maxFree = maxFree;
  }

  Scope convert(Term term) {
    switch (term.op) {
    case VARIABLE:
      final Integer id = boundVariables.get(((Hol.Variable) term).id);
      return new Scope.AtomScope(id == null ? term : hol.variable(id));

    case CONSTANT:
    case PARAMETER:
    case INTEGER:
      return new Scope.AtomScope(term);

    case TRUE:
      return Scope.TRUE;

    case FALSE:
      return Scope.FALSE;

    case NOT:
      return Scope.negate(convert(((Hol.Not) term).operand));

    case AND:
    case OR:
    case IFF:
      final CommutativeBuilder builder = new CommutativeBuilder(term.op);
      for (Term arg : ((Hol.Nary) term).args) {
        builder.add(convert(arg));
      }
      return builder.build();

    case IF_THEN:
      final Hol.IfThen ifThen = (Hol.IfThen) term;
      final Scope left = convert(ifThen.left);
      return conditional(left, convert(ifThen.right));

    case EQUALS:
      return equality((Hol.Equals) term);

    case UNARY_APPLY:
      final Hol.UnaryApply apply = (Hol.UnaryApply) term;
      return new Scope.OperandScope(term.op,
          ImmutableList.of(convert(apply.fn), convert(apply.arg)));

    case BINARY_APPLY:
      final Hol.BinaryApply apply2 = (Hol.BinaryApply) term;
      return new Scope.OperandScope(term.op,
          ImmutableList.of(convert(apply2.fn), convert(apply2.arg0),
              convert(apply2.arg1)));

    case FOR_ALL:
    case EXISTS:
    case LAMBDA:
      return quantifier((Hol.Quantifier) term);

    default:
      throw new AssertionError("unknown op " + term.op);
    }
  }

  private Scope equality(Hol.Equals equals) {
    final TypeAssignment.OperandTypes operandTypes =
        types.operandTypes(equals);
    final boolean leftBoolean = operandTypes.left.isBoolean();
    final boolean rightBoolean = operandTypes.right.isBoolean();
    final Scope left = convert(equals.left);
    final Scope right = convert(equals.right);
    if (rightBoolean && left.isBooleanValued()
        || leftBoolean && right.isBooleanValued()) {
      return iff(left, right);
    }
    if (left.equals(right)) {
      return Scope.TRUE;
    }
    if (allConstantsDistinct
        && left.op == Op.CONSTANT
        && right.op == Op.CONSTANT) {
      return Scope.FALSE;
    }
    if (leftBoolean && rightBoolean) {
      return iff(left, right);
    }
    return new Scope.OperandScope(Op.EQUALS,
        left.compareTo(right) <= 0
            ? ImmutableList.of(left, right)
            : ImmutableList.of(right, left));
  }

  private static Scope iff(Scope left, Scope right) {
    final CommutativeBuilder builder = new CommutativeBuilder(Op.IFF);
    builder.add(left);
    builder.add(right);
    return builder.build();
  }

  /** Creates the scope for "left → right". */
  static Scope conditional(Scope left, Scope right) {
    switch (left.op) {
    case FALSE:
      return Scope.TRUE;
    case TRUE:
      return right;
    default:
      break;
    }
    switch (right.op) {
    case TRUE:
      return Scope.TRUE;
    case FALSE:
      return Scope.negate(left);
    default:
      break;
    }
    if (left.equals(right)) {
      return Scope.TRUE;
    }
    if (Scope.areNegations(left, right)) {
      // "a → ¬a" is "¬a"
      return right;
    }
    final CommutativeBuilder antecedent = new CommutativeBuilder(Op.AND);
    final CommutativeBuilder consequent = new CommutativeBuilder(Op.OR);
    antecedent.add(left);
    switch (right.op) {
    case IF_THEN:
      absorb((Scope.ConditionalScope) right, antecedent, consequent);
      break;
    case OR:
      final Scope.CommutativeScope or = (Scope.CommutativeScope) right;
      for (Scope child : or.children) {
        if (child.op == Op.IF_THEN) {
          absorb((Scope.ConditionalScope) child, antecedent, consequent);
        } else {
          consequent.addLiteral(child, false);
        }
      }
      for (Scope child : or.negated) {
        consequent.addLiteral(child, true);
      }
      break;
    default:
      consequent.add(right);
    }
    if (antecedent.collapsed
        || consequent.collapsed
        || antecedent.overlaps(consequent)) {
      return Scope.TRUE;
    }
    // Absorption may have made the two sides equal or complementary,
    // as in "a → (b → a ∧ b)"
    final Scope antecedentScope = antecedent.build();
    final Scope consequentScope = consequent.build();
    if (antecedentScope.equals(consequentScope)) {
      return Scope.TRUE;
    }
    if (Scope.areNegations(antecedentScope, consequentScope)) {
      return consequentScope;
    }
    return new Scope.ConditionalScope(
        ImmutableList.copyOf(antecedent.children),
        ImmutableList.copyOf(antecedent.negated),
        ImmutableList.copyOf(consequent.children),
        ImmutableList.copyOf(consequent.negated));
  }

  /** Merges a conditional that is a disjunct of a consequent into its
   * parent, "a → (b → c)" becoming "a ∧ b → c". */
  private static void absorb(Scope.ConditionalScope conditional,
      CommutativeBuilder antecedent, CommutativeBuilder consequent) {
    for (Scope scope : conditional.left) {
      antecedent.addLiteral(scope, false);
    }
    for (Scope scope : conditional.leftNegated) {
      antecedent.addLiteral(scope, true);
    }
    for (Scope scope : conditional.right) {
      consequent.addLiteral(scope, false);
    }
    for (Scope scope : conditional.rightNegated) {
      consequent.addLiteral(scope, true);
    }
  }

  private Scope quantifier(Hol.Quantifier quantifier) {
    final int id = quantifier.variable.id;
    if (boundVariables.containsKey(id)) {
      throw new MalformedTermException("Multiple declaration of variable "
          + quantifier.variable + " in " + quantifier);
    }
    final int variable = maxFree + ++depth;
    boundVariables.put(id, variable);
    final Scope operand;
    try {
      operand = convert(quantifier.operand);
    } finally {
      boundVariables.remove(id);
      --depth;
    }
    return quantify(quantifier.op, variable, operand);
  }

  /**
   * Creates a scope that binds {@code variable} in {@code operand}.
   *
   * <p>A universal or existential quantifier whose operand does not mention
   * the variable is dropped. If the operand is a conjunction, disjunction or
   * conditional, the parts that do not mention the variable are moved
   * outside the quantifier.
   */
  static Scope quantify(Op op, int variable, Scope operand) {
    if (op == Op.LAMBDA) {
      return new Scope.QuantifierScope(op, variable, operand);
    }
    if (!operand.contains(variable)) {
      return operand.shift(variable, 1);
    }
    switch (operand.op) {
    case AND:
    case OR:
      return quantifyCommutative(op, variable,
          (Scope.CommutativeScope) operand);
    case IF_THEN:
      return quantifyConditional(op, variable,
          (Scope.ConditionalScope) operand);
    default:
      return new Scope.QuantifierScope(op, variable, operand);
    }
  }

  private static Scope quantifyCommutative(Op op, int variable,
      Scope.CommutativeScope operand) {
    final CommutativeBuilder outer = new CommutativeBuilder(operand.op);
    final List<Scope> children = new ArrayList<>();
    final List<Scope> negated = new ArrayList<>();
    split(operand.children, variable, children, outer, false);
    split(operand.negated, variable, negated, outer, true);
    if (outer.children.isEmpty() && outer.negated.isEmpty()) {
      return new Scope.QuantifierScope(op, variable, operand);
    }
    final Scope inner = CommutativeBuilder.build(operand.op, children, negated);
    outer.add(quantify(op, variable, inner));
    return outer.build();
  }

  private static Scope quantifyConditional(Op op, int variable,
      Scope.ConditionalScope operand) {
    final CommutativeBuilder antecedent = new CommutativeBuilder(Op.AND);
    final CommutativeBuilder consequent = new CommutativeBuilder(Op.OR);
    final List<Scope> left = new ArrayList<>();
    final List<Scope> leftNegated = new ArrayList<>();
    final List<Scope> right = new ArrayList<>();
    final List<Scope> rightNegated = new ArrayList<>();
    split(operand.left, variable, left, antecedent, false);
    split(operand.leftNegated, variable, leftNegated, antecedent, true);
    split(operand.right, variable, right, consequent, false);
    split(operand.rightNegated, variable, rightNegated, consequent, true);
    if (antecedent.children.isEmpty()
        && antecedent.negated.isEmpty()
        && consequent.children.isEmpty()
        && consequent.negated.isEmpty()) {
      return new Scope.QuantifierScope(op, variable, operand);
    }

    // "∀x. a ∧ b(x) → c ∨ d(x)" becomes "a → c ∨ ∀x. b(x) → d(x)"
    final Scope inner =
        conditional(CommutativeBuilder.build(Op.AND, left, leftNegated),
            CommutativeBuilder.build(Op.OR, right, rightNegated));
    consequent.add(quantify(op, variable, inner));
    return conditional(antecedent.build(), consequent.build());
  }

  /** Moves the scopes that do not mention {@code variable} into
   * {@code outer}, shifted, and the others into {@code remaining}. */
  private static void split(List<Scope> scopes, int variable,
      List<Scope> remaining, CommutativeBuilder outer, boolean negative) {
    for (Scope scope : scopes) {
      if (scope.contains(variable)) {
        remaining.add(scope);
      } else {
        outer.addLiteral(scope.shift(variable, 1), negative);
      }
    }
  }
}

// End ScopeConverter.java
