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

/**
 * Sub-types of {@link Hol.Term}.
 *
 * <p>The order of the constants is significant: it is the first key of the
 * total order on terms, and therefore decides the order of operands in
 * canonical terms.
 */
public enum Op {
  // symbols
  VARIABLE(true),
  CONSTANT(true),
  PARAMETER(true),

  // applications
  UNARY_APPLY(false),
  BINARY_APPLY(false),

  // connectives
  AND(" ∧ "),
  OR(" ∨ "),
  IF_THEN(" → "),
  EQUALS(" = "),
  IFF(" ↔ "),
  NOT("¬"),

  // binders
  FOR_ALL("∀"),
  EXISTS("∃"),
  LAMBDA("λ"),

  // literals
  INTEGER(true),
  TRUE("⊤"),
  FALSE("⊥");

  /** Symbol used when printing, or the empty string. */
  public final String padded;

  /** Whether terms of this type have no operands. */
  public final boolean atom;

  Op(boolean atom) {
    this.padded = "";
    this.atom = atom;
  }

  Op(String padded) {
    this.padded = padded;
    this.atom = padded.equals("⊤") || padded.equals("⊥");
  }

  /** Returns whether this is {@link #AND}, {@link #OR} or {@link #IFF}. */
  public boolean isCommutative() {
    return this == AND || this == OR || this == IFF;
  }

  /**
   * Returns whether this is {@link #FOR_ALL}, {@link #EXISTS} or {@link
   * #LAMBDA}.
   */
  public boolean isBinder() {
    return this == FOR_ALL || this == EXISTS || this == LAMBDA;
  }
}

// End Op.java
