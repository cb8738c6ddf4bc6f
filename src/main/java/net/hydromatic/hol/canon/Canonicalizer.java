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
import static net.hydromatic.hol.term.HolBuilder.hol;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.type.TypeAssignment;
import net.hydromatic.hol.type.TypeInference;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.HolException;
import net.hydromatic.hol.util.Prop;
import net.hydromatic.hol.util.Tracer;
import net.hydromatic.hol.util.Tracers;

/**
 * Converts terms to canonical form.
 *
 * <p>Two terms that differ only in the order of the operands of a
 * conjunction, disjunction or biconditional, in redundant or repeated
 * operands, in double negation, in the names of bound variables, or in the
 * placement of quantifiers around operands that do not mention the
 * quantified variable, have the same canonical form.
 *
 * <p>Canonicalization is idempotent: the canonical form of a canonical term
 * is the term itself.
 *
 * <p>A canonicalizer is immutable and may be used from several threads.
 */
public class Canonicalizer {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final boolean allConstantsDistinct;
  private final int maxDepth;

  private Canonicalizer(Map<Prop, Object> props, Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer, "tracer");
    this.allConstantsDistinct = Prop.ALL_CONSTANTS_DISTINCT.booleanValue(props);
    this.maxDepth = Prop.MAX_DEPTH.intValue(props);
  }

  /** Creates a canonicalizer with default properties and no tracing. */
  public static Canonicalizer create() {
    return create(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Creates a canonicalizer.
   *
   * @param props Properties; {@link Prop#POLYMORPHIC_EQUALITY},
   *     {@link Prop#ALL_CONSTANTS_DISTINCT} and {@link Prop#MAX_DEPTH} are
   *     used
   * @param tracer Receives types, results and errors
   */
  public static Canonicalizer create(Map<Prop, Object> props, Tracer tracer) {
    return new Canonicalizer(props, tracer);
  }

  /**
   * Returns the canonical form of a term.
   *
   * @throws net.hydromatic.hol.type.TypeException if the term cannot be
   *     consistently typed
   * @throws MalformedTermException if a quantifier rebinds a variable that
   *     is already bound
   * @throws DepthLimitException if the term is nested too deeply
   */
  public Term canonicalize(Term term) {
    requireNonNull(term, "term");
    try {
      DepthLimitException.check(term.depth, maxDepth);
      final TypeAssignment types = TypeInference.computeTypes(term, props);
      tracer.onTypes(term, types);

      final ImmutableSortedSet<Integer> freeVariables = types.freeVariables();
      final int maxFree = freeVariables.isEmpty() ? -1 : freeVariables.last();
      Scope scope =
          new ScopeConverter(types, allConstantsDistinct, maxFree)
              .convert(term);

      // Free variables may have vanished; renumber bound variables so that
      // they start just above the largest remaining free variable.
      final int maxFree2 =
          scope.variables.isEmpty() ? -1 : scope.variables.last();
      scope = scope.shift(maxFree, maxFree - maxFree2);

      final Term canonical = scope.term();
      tracer.onCanonical(term, canonical);
      return canonical;
    } catch (HolException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /** Returns whether a term is in canonical form. */
  public boolean isCanonical(Term term) {
    return term.equals(canonicalize(term));
  }

  /** Returns the canonical form of the conjunction of two terms. */
  public Term intersect(Term term0, Term term1) {
    return canonicalize(hol.and(term0, term1));
  }
}

// End Canonicalizer.java
