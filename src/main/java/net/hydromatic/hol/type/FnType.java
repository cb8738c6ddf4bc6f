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

import java.util.Objects;

/** Function type, {@code left → right}. */
public class FnType implements HolType {
  public final HolType left;
  public final HolType right;

  public FnType(HolType left, HolType right) {
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  @Override
  public Kind kind() {
    return Kind.FUNCTION;
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, right);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof FnType
            && left.equals(((FnType) obj).left)
            && right.equals(((FnType) obj).right);
  }

  @Override
  public String toString() {
    return "(" + left + " → " + right + ")";
  }
}

// End FnType.java
