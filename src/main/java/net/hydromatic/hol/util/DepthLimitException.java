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

/** Thrown when a term is nested more deeply than the configured limit. */
public class DepthLimitException extends HolException {
  public final int depth;
  public final int maxDepth;

  public DepthLimitException(int depth, int maxDepth) {
    super("term depth " + depth + " exceeds limit " + maxDepth);
    this.depth = depth;
    this.maxDepth = maxDepth;
  }

  /**
   * Throws if {@code depth} exceeds {@code maxDepth}.
   *
   * @see Prop#MAX_DEPTH
   */
  public static void check(int depth, int maxDepth) {
    if (depth > maxDepth) {
      throw new DepthLimitException(depth, maxDepth);
    }
  }
}

// End DepthLimitException.java
