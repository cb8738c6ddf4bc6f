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

import net.hydromatic.hol.util.HolException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Error that occurs when a term cannot be consistently typed. */
public class TypeException extends HolException {
  /** Type computed for the offending term, or null. */
  public final @Nullable HolType actual;

  /** Type that the context of the offending term required, or null. */
  public final @Nullable HolType expected;

  public TypeException(
      String message, @Nullable HolType actual, @Nullable HolType expected) {
    super(message);
    this.actual = actual;
    this.expected = expected;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    super.describeTo(buf);
    if (actual != null) {
      buf.append("\n  Computed type: ").append(actual);
    }
    if (expected != null) {
      buf.append("\n  Expected type: ").append(expected);
    }
    return buf;
  }
}

// End TypeException.java
