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
package net.hydromatic.hol.type;

import static java.util.Objects.requireNonNull;

/**
 * Unifies pairs of types, binding type variables in a {@link TypeTable}.
 *
 * <p>Unification never binds a variable to a type that contains it; an
 * attempt to do so throws {@link TypeException}. A failure to unify two
 * types is not an error; {@link #unify} returns {@link SpecialType#NONE}
 * and the caller decides how to report it.
 */
public class TypeUnifier {
  private final TypeTable table;

  public TypeUnifier(TypeTable table) {
    this.table = requireNonNull(table, "table");
  }

  /** Returns the most general type that is an instance of both {@code a} and
   * {@code b}, or {@link SpecialType#NONE} if there is none. */
  public HolType unify(HolType a, HolType b) {
    if (a.kind() == HolType.Kind.ANY) {
      return b;
    }
    if (b.kind() == HolType.Kind.ANY) {
      return a;
    }
    if (a.kind() == HolType.Kind.NONE || b.kind() == HolType.Kind.NONE) {
      return SpecialType.NONE;
    }
    if (a.kind() == HolType.Kind.VARIABLE) {
      return unifyVariable(table.root((TypeVar) a), b);
    }
    if (b.kind() == HolType.Kind.VARIABLE) {
      return unifyVariable(table.root((TypeVar) b), a);
    }
    switch (a.kind()) {
    case CONSTANT:
      return a.equals(b) ? a : SpecialType.NONE;
    case FUNCTION:
      if (b.kind() != HolType.Kind.FUNCTION) {
        return SpecialType.NONE;
      }
      final FnType fa = (FnType) a;
      final FnType fb = (FnType) b;
      final HolType left = unify(fa.left, fb.left);
      if (left.kind() == HolType.Kind.NONE) {
        return SpecialType.NONE;
      }
      final HolType right = unify(fa.right, fb.right);
      if (right.kind() == HolType.Kind.NONE) {
        return SpecialType.NONE;
      }
      return new FnType(left, right);
    default:
      throw new AssertionError(a.kind());
    }
  }

  private HolType unifyVariable(TypeVar root, HolType other) {
    switch (other.kind()) {
    case ANY:
      return root;
    case NONE:
      return SpecialType.NONE;
    case VARIABLE:
      final TypeVar root2 = table.root((TypeVar) other);
      if (root2.equals(root)) {
        return root;
      }
      final HolType value = table.get(root);
      final HolType value2 = table.get(root2);
      if (value2.kind() == HolType.Kind.ANY) {
        checkOccurs(root2, value);
        table.set(root2, root);
        return root;
      }
      if (value.kind() == HolType.Kind.ANY) {
        checkOccurs(root, value2);
        table.set(root, root2);
        return root2;
      }
      checkOccurs(root, value2);
      checkOccurs(root2, value);
      table.set(root2, root);
      final HolType unified = unify(value, value2);
      if (unified.kind() == HolType.Kind.NONE) {
        return SpecialType.NONE;
      }
      table.set(root, unified);
      return root;
    default:
      checkOccurs(root, other);
      final HolType current = table.get(root);
      if (current.kind() == HolType.Kind.ANY) {
        table.set(root, other);
        return root;
      }
      final HolType merged = unify(current, other);
      if (merged.kind() == HolType.Kind.NONE) {
        return SpecialType.NONE;
      }
      table.set(root, merged);
      return root;
    }
  }

  /** Throws if {@code variable} occurs in {@code type}. */
  private void checkOccurs(TypeVar variable, HolType type) {
    if (occurs(variable, type)) {
      throw new TypeException("Found infinite type "
          + variable + " = " + table.expand(type), null, null);
    }
  }

  /** Returns whether {@code variable} (a root) occurs in {@code type},
   * following bound variables. */
  boolean occurs(TypeVar variable, HolType type) {
    switch (type.kind()) {
    case FUNCTION:
      final FnType fnType = (FnType) type;
      return occurs(variable, fnType.left) || occurs(variable, fnType.right);
    case VARIABLE:
      final TypeVar root = table.root((TypeVar) type);
      if (root.equals(variable)) {
        return true;
      }
      return occurs(variable, table.get(root));
    default:
      return false;
    }
  }
}

// End TypeUnifier.java
