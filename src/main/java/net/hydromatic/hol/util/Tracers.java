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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.type.TypeAssignment;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the types of a term,
   * then calls the underlying tracer.
   */
  public static Tracer withOnTypes(
      Tracer tracer, BiConsumer<Hol.Term, TypeAssignment> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTypes(Hol.Term term, TypeAssignment types) {
        consumer.accept(term, types);
        super.onTypes(term, types);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a canonical term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnCanonical(
      Tracer tracer, Consumer<Hol.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCanonical(Hol.Term term, Hol.Term canonical) {
        consumer.accept(canonical);
        super.onCanonical(term, canonical);
      }
    };
  }

  public static Tracer withOnException(
      Tracer tracer, Consumer<HolException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(HolException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTypes(Hol.Term term, TypeAssignment types) {}

    @Override
    public void onCanonical(Hol.Term term, Hol.Term canonical) {}

    @Override
    public void onException(HolException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onTypes(Hol.Term term, TypeAssignment types) {
      tracer.onTypes(term, types);
    }

    @Override
    public void onCanonical(Hol.Term term, Hol.Term canonical) {
      tracer.onCanonical(term, canonical);
    }

    @Override
    public void onException(HolException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
