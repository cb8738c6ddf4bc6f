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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import net.hydromatic.hol.term.Hol;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of type inference: the type of each subterm, the types of the two
 * operands of each equality, and the type of each symbol.
 *
 * <p>Types contain no type variables; a type that was never constrained is
 * {@link SpecialType#ANY}.
 *
 * <p>Subterms are keyed by identity. If the same {@link Hol.Equals} instance
 * occurs in several places and is boolean in any of them, it is recorded as
 * boolean.
 */
public class TypeAssignment {
  private final Map<Hol.Term, HolType> termTypes;
  private final Map<Hol.Equals, OperandTypes> equalsTypes;
  private final ImmutableSortedMap<Integer, HolType> constantTypes;
  private final ImmutableSortedMap<Integer, HolType> variableTypes;
  private final ImmutableSortedMap<Integer, HolType> parameterTypes;

  TypeAssignment(Map<Hol.Term, HolType> termTypes,
      Map<Hol.Equals, OperandTypes> equalsTypes,
      Map<Integer, HolType> constantTypes,
      Map<Integer, HolType> variableTypes,
      Map<Integer, HolType> parameterTypes) {
    this.termTypes = requireNonNull(termTypes, "termTypes");
    this.equalsTypes = requireNonNull(equalsTypes, "equalsTypes");
    this.constantTypes = ImmutableSortedMap.copyOf(constantTypes);
    this.variableTypes = ImmutableSortedMap.copyOf(variableTypes);
    this.parameterTypes = ImmutableSortedMap.copyOf(parameterTypes);
  }

  /** Returns the type of a subterm, or null if the term was not part of the
   * term whose types were computed. */
  public @Nullable HolType typeOf(Hol.Term term) {
    return termTypes.get(term);
  }

  /** Returns the types of the operands of an equality. */
  public OperandTypes operandTypes(Hol.Equals equals) {
    final OperandTypes operandTypes = equalsTypes.get(equals);
    if (operandTypes == null) {
      throw new IllegalArgumentException("no types for " + equals);
    }
    return operandTypes;
  }

  /** Returns whether the left operand of an equality is boolean. */
  public boolean isLeftBoolean(Hol.Equals equals) {
    return operandTypes(equals).left.isBoolean();
  }

  /** Returns whether the right operand of an equality is boolean. */
  public boolean isRightBoolean(Hol.Equals equals) {
    return operandTypes(equals).right.isBoolean();
  }

  /** Returns the type of a constant, or null if it does not occur. */
  public @Nullable HolType constantType(int id) {
    return constantTypes.get(id);
  }

  /** Returns the type of a free variable, or null if it does not occur
   * free. */
  public @Nullable HolType variableType(int id) {
    return variableTypes.get(id);
  }

  /** Returns the ids of the variables that occur free in the term. */
  public ImmutableSortedSet<Integer> freeVariables() {
    return variableTypes.keySet();
  }

  /** Returns the type of a parameter, or null if it does not occur. */
  public @Nullable HolType parameterType(int id) {
    return parameterTypes.get(id);
  }

  @Override
  public String toString() {
    return "constants " + constantTypes
        + ", variables " + variableTypes
        + ", parameters " + parameterTypes;
  }

  /** Types of the left and right operands of an equality. */
  public static class OperandTypes {
    public final HolType left;
    public final HolType right;

    OperandTypes(HolType left, HolType right) {
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    /** Returns whether both operands are boolean, that is, whether the
     * equality is a biconditional. */
    public boolean isBoolean() {
      return left.isBoolean() && right.isBoolean();
    }

    @Override
    public String toString() {
      return left + ", " + right;
    }
  }
}

// End TypeAssignment.java
