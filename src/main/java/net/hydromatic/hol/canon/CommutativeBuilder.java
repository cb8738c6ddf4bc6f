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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.hol.term.Op;

/**
 * Accumulates the operands of a conjunction, disjunction or biconditional.
 *
 * <p>Operands are kept sorted and free of duplicates. Adding an operand
 * whose negation is already present makes a conjunction false and a
 * disjunction true; in a biconditional, a repeated operand cancels out.
 */
class CommutativeBuilder {
  final Op op;
  final List<Scope> children = new ArrayList<>();
  final List<Scope> negated = new ArrayList<>();
  boolean parity;

  /** Whether an operand and its negation have both been added, or, for a
   * conjunction, false has been added, or, for a disjunction, true. */
  boolean collapsed;

  CommutativeBuilder(Op op) {
    checkArgument(op.isCommutative(), "not commutative: %s", op);
    this.op = op;
  }

  /** Creates a scope from operands that are already sorted literals. */
  static Scope build(Op op, List<Scope> children, List<Scope> negated) {
    final CommutativeBuilder builder = new CommutativeBuilder(op);
    for (Scope child : children) {
      builder.addLiteral(child, false);
    }
    for (Scope scope : negated) {
      builder.addLiteral(scope, true);
    }
    return builder.build();
  }

  /** Adds an operand, flattening it if it is the same kind of connective. */
  void add(Scope scope) {
    if (collapsed) {
      return;
    }
    switch (scope.op) {
    case TRUE:
      if (op == Op.OR) {
        collapsed = true;
      }
      return;
    case FALSE:
      if (op == Op.AND) {
        collapsed = true;
      } else if (op == Op.IFF) {
        parity = !parity;
      }
      return;
    case NOT:
      final Scope operand = ((Scope.NotScope) scope).operand;
      if (op == Op.IFF) {
        addLiteral(operand, false);
        parity = !parity;
      } else {
        addLiteral(operand, true);
      }
      return;
    default:
      break;
    }
    if (scope.op == op) {
      final Scope.CommutativeScope commutative =
          (Scope.CommutativeScope) scope;
      for (Scope child : commutative.children) {
        addLiteral(child, false);
      }
      for (Scope child : commutative.negated) {
        addLiteral(child, true);
      }
      if (commutative.parity) {
        parity = !parity;
      }
      return;
    }
    if (scope.op == Op.IFF && ((Scope.CommutativeScope) scope).parity) {
      // a negated biconditional is held as a negated operand
      addLiteral(((Scope.CommutativeScope) scope).withParity(false), true);
      return;
    }
    addLiteral(scope, false);
  }

  /** Adds an operand that is not the same kind of connective, not a
   * negation, and not true or false. */
  void addLiteral(Scope scope, boolean negative) {
    if (collapsed) {
      return;
    }
    if (op == Op.IFF) {
      checkArgument(!negative);
      final int i = Collections.binarySearch(children, scope);
      if (i >= 0) {
        // "a ↔ a" is true, the identity of biconditional
        children.remove(i);
      } else {
        children.add(-(i + 1), scope);
      }
      return;
    }
    final List<Scope> same = negative ? negated : children;
    final List<Scope> opposite = negative ? children : negated;
    if (Collections.binarySearch(opposite, scope) >= 0) {
      collapsed = true;
      return;
    }
    final int i = Collections.binarySearch(same, scope);
    if (i < 0) {
      same.add(-(i + 1), scope);
    }
  }

  /** Returns whether any operand of this builder is also an operand of
   * another builder, with the same sign. */
  boolean overlaps(CommutativeBuilder other) {
    return overlaps(children, other.children)
        || overlaps(negated, other.negated);
  }

  private static boolean overlaps(List<Scope> list0, List<Scope> list1) {
    for (Scope scope : list0) {
      if (Collections.binarySearch(list1, scope) >= 0) {
        return true;
      }
    }
    return false;
  }

  /** Creates a scope, degenerating to a simpler scope if there are fewer
   * than two operands. */
  Scope build() {
    if (op == Op.IFF) {
      switch (children.size()) {
      case 0:
        return parity ? Scope.FALSE : Scope.TRUE;
      case 1:
        return parity ? Scope.negate(children.get(0)) : children.get(0);
      default:
        return new Scope.CommutativeScope(op, ImmutableList.copyOf(children),
            ImmutableList.of(), parity);
      }
    }
    if (collapsed) {
      return op == Op.AND ? Scope.FALSE : Scope.TRUE;
    }
    switch (children.size() + negated.size()) {
    case 0:
      return op == Op.AND ? Scope.TRUE : Scope.FALSE;
    case 1:
      return children.isEmpty()
          ? Scope.negate(negated.get(0))
          : children.get(0);
    default:
      return new Scope.CommutativeScope(op, ImmutableList.copyOf(children),
          ImmutableList.copyOf(negated), false);
    }
  }
}

// End CommutativeBuilder.java
