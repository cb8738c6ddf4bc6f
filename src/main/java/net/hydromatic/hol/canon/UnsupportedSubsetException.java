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
package net.hydromatic.hol.canon;

import static java.util.Objects.requireNonNull;

import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.util.HolException;

/**
 * Error thrown by {@link Subsets#isSubset} when asked to compare terms whose
 * subset relation it cannot decide structurally.
 */
public class UnsupportedSubsetException extends HolException {
  public final Hol.Term first;
  public final Hol.Term second;

  public UnsupportedSubsetException(Hol.Term first, Hol.Term second) {
    super("Cannot decide whether " + first + " is a subset of " + second);
    this.first = requireNonNull(first, "first");
    this.second = requireNonNull(second, "second");
  }
}

// End UnsupportedSubsetException.java
