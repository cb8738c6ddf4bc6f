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

import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.type.TypeAssignment;

/** Called on various events during canonicalization. */
public interface Tracer {
  /** Called when types have been inferred for a term. */
  void onTypes(Hol.Term term, TypeAssignment types);

  /** Called when a term has been converted to canonical form. */
  void onCanonical(Hol.Term term, Hol.Term canonical);

  /**
   * Called with an exception thrown while processing a term. The exception is
   * re-thrown after the tracer returns.
   */
  void onException(HolException e);
}

// End Tracer.java
