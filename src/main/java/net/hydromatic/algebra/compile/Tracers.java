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
package net.hydromatic.algebra.compile;

import java.util.function.BiConsumer;
import net.hydromatic.algebra.ast.Expr;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each parsed expression,
   * then calls the underlying tracer.
   */
  public static Tracer withOnParse(
      Tracer tracer, BiConsumer<String, Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onParse(String text, Expr e) {
        consumer.accept(text, e);
        super.onParse(text, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rewrite, then
   * calls the underlying tracer.
   */
  public static Tracer withOnRewrite(
      Tracer tracer, BiConsumer<Expr, Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(Expr before, Expr after) {
        consumer.accept(before, after);
        super.onRewrite(before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each derivative, then
   * calls the underlying tracer.
   */
  public static Tracer withOnDerive(
      Tracer tracer, BiConsumer<Expr, Expr> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDerive(Expr e, String name, Expr derivative) {
        consumer.accept(e, derivative);
        super.onDerive(e, name, derivative);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(String text, Expr e) {}

    @Override
    public void onRewrite(Expr before, Expr after) {}

    @Override
    public void onDerive(Expr e, String name, Expr derivative) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(String text, Expr e) {
      tracer.onParse(text, e);
    }

    @Override
    public void onRewrite(Expr before, Expr after) {
      tracer.onRewrite(before, after);
    }

    @Override
    public void onDerive(Expr e, String name, Expr derivative) {
      tracer.onDerive(e, name, derivative);
    }
  }
}

// End Tracers.java
