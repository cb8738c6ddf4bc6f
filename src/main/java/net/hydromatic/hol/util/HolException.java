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
package net.hydromatic.hol.util;

/**
 * Error raised by the logic engine.
 *
 * <p>Sub-classes distinguish ill-typed terms, malformed terms, unsupported
 * operations and terms that are nested too deeply. All are unchecked; a
 * failed operation never leaves a partially constructed term visible to its
 * caller.
 */
public abstract class HolException extends RuntimeException {
  protected HolException(String message) {
    super(message);
  }

  protected HolException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Writes a description of this error to a buffer. */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End HolException.java
