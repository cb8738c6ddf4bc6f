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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Values of type variables.
 *
 * <p>The value of a variable is {@link SpecialType#ANY} if it is unbound,
 * another variable if it is an alias (a "link"), or a constant or function
 * type. Following links from a variable leads to its root, as in a
 * union-find structure; {@link #root} compresses the path as it goes.
 */
public class TypeTable {
  private final List<HolType> values = new ArrayList<>();

  /** Creates a new, unbound, type variable. */
  public TypeVar newVariable() {
    values.add(SpecialType.ANY);
    return new TypeVar(values.size() - 1);
  }

  /** Returns the number of variables. */
  public int size() {
    return values.size();
  }

  /** Returns the value of a variable. */
  public HolType get(TypeVar variable) {
    return values.get(variable.ordinal);
  }

  /** Sets the value of a variable. */
  public void set(TypeVar variable, HolType value) {
    checkArgument(value.kind() != HolType.Kind.NONE, "cannot bind to NONE");
    values.set(variable.ordinal, value);
  }

  /**
   * Returns the last variable in the chain of links that starts at {@code
   * variable}, and makes every variable on the chain link directly to it.
   *
   * <p>If the chain is a cycle of links, the cycle is broken by making one of
   * its variables unbound.
   */
  public TypeVar root(TypeVar variable) {
    TypeVar root = variable;
    int steps = 0;
    while (values.get(root.ordinal) instanceof TypeVar) {
      root = (TypeVar) values.get(root.ordinal);
      if (++steps > values.size()) {
        values.set(root.ordinal, SpecialType.ANY);
        break;
      }
    }
    for (TypeVar v = variable; !v.equals(root); ) {
      final TypeVar next = (TypeVar) values.get(v.ordinal);
      values.set(v.ordinal, root);
      v = next;
    }
    return root;
  }

  /**
   * Returns a type with every bound variable replaced by its value, for use
   * in messages. Unbound variables remain. Does not modify this table.
   * Returns {@code type} itself if it contains no bound variable.
   */
  public HolType expand(HolType type) {
    return expand(type, new HashSet<>());
  }

  private HolType expand(HolType type, Set<Integer> active) {
    switch (type.kind()) {
    case FUNCTION:
      final FnType fnType = (FnType) type;
      final HolType left = expand(fnType.left, active);
      final HolType right = expand(fnType.right, active);
      return left == fnType.left && right == fnType.right
          ? fnType
          : new FnType(left, right);
    case VARIABLE:
      final TypeVar typeVar = (TypeVar) type;
      final HolType value = values.get(typeVar.ordinal);
      if (value.kind() == HolType.Kind.ANY || !active.add(typeVar.ordinal)) {
        return typeVar;
      }
      final HolType expanded = expand(value, active);
      active.remove(typeVar.ordinal);
      return expanded;
    default:
      return type;
    }
  }

  /**
   * Returns a type with no variables: each bound variable is replaced by its
   * flattened value, and each unbound variable by {@link SpecialType#ANY}.
   * Flattened values are stored back into this table.
   *
   * <p>A cycle consisting only of links between variables means that those
   * variables are mere aliases with no other constraint; each of them becomes
   * {@link SpecialType#ANY}. Any other cycle describes an infinite type.
   *
   * @throws TypeException if the type is infinite
   */
  public HolType flatten(HolType type) {
    return flatten(type, new ArrayList<>(), true);
  }

  private HolType flatten(HolType type, List<Visit> visited, boolean root) {
    switch (type.kind()) {
    case FUNCTION:
      final FnType fnType = (FnType) type;
      final HolType left = flatten(fnType.left, visited, false);
      final HolType right = flatten(fnType.right, visited, false);
      return left == fnType.left && right == fnType.right
          ? fnType
          : new FnType(left, right);
    case VARIABLE:
      return flattenVariable((TypeVar) type, visited, root);
    default:
      return type;
    }
  }

  private HolType flattenVariable(
      TypeVar variable, List<Visit> visited, boolean root) {
    boolean trivialAlias = root;
    for (int i = visited.size() - 1; i >= 0; i--) {
      final Visit visit = visited.get(i);
      if (visit.ordinal == variable.ordinal) {
        if (!trivialAlias) {
          throw new TypeException(
              "Found infinite type " + expand(variable), null, null);
        }
        for (int j = i; j < visited.size(); j++) {
          values.set(visited.get(j).ordinal, SpecialType.ANY);
        }
        return SpecialType.ANY;
      }
      trivialAlias &= visit.root;
    }
    visited.add(new Visit(variable.ordinal, root));
    final HolType value = flatten(values.get(variable.ordinal), visited, true);
    visited.remove(visited.size() - 1);
    values.set(variable.ordinal, value);
    return value;
  }

  /** Variable on the path being flattened, and whether it was reached
   * directly as the value of the previous variable. */
  private static class Visit {
    final int ordinal;
    final boolean root;

    Visit(int ordinal, boolean root) {
      this.ordinal = ordinal;
      this.root = root;
    }
  }
}

// End TypeTable.java
