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

/**
 * Type of a term.
 *
 * <p>A type is a constant ({@link PrimitiveType}), a function ({@link
 * FnType}), a type variable ({@link TypeVar}), or one of the special types
 * {@link SpecialType#ANY} and {@link SpecialType#NONE}.
 */
public interface HolType {
  /** Returns what kind of type this is. */
  Kind kind();

  /** Returns whether this is the boolean type. */
  default boolean isBoolean() {
    return this == PrimitiveType.BOOLEAN;
  }

  /** Kinds of type. */
  enum Kind {
    CONSTANT,
    FUNCTION,
    VARIABLE,
    /** Unconstrained; unifies with any type. */
    ANY,
    /** Result of unifying incompatible types. */
    NONE
  }
}

// End HolType.java
