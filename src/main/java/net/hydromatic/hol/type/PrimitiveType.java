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

/** Primitive type. */
public enum PrimitiveType implements HolType {
  /** Type of propositions. */
  BOOLEAN("𝝄"),
  /** Type of individuals, including integers. */
  INDIVIDUAL("𝜾");

  private final String symbol;

  PrimitiveType(String symbol) {
    this.symbol = symbol;
  }

  @Override
  public Kind kind() {
    return Kind.CONSTANT;
  }

  @Override
  public String toString() {
    return symbol;
  }
}

// End PrimitiveType.java
