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
package net.hydromatic.tensor.compile;

import static java.util.Objects.requireNonNull;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.tensor.ast.IndexExpr;
import net.hydromatic.tensor.ast.TensorVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each tensor that is
   * defined, then calls the underlying tracer. */
  public static Tracer withOnDefinition(Tracer tracer,
      Consumer<TensorVar> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDefinition(TensorVar tensorVar) {
        consumer.accept(tensorVar);
        super.onDefinition(tensorVar);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * rewrite with a given name, then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer, String name,
      BiConsumer<IndexExpr, @Nullable IndexExpr> consumer) {
    final String expectedName = name;
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(String name, IndexExpr before,
          @Nullable IndexExpr after) {
        if (name.equals(expectedName)) {
          consumer.accept(before, after);
        }
        super.onRewrite(name, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on each exception,
   * then calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<NotationException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(NotationException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onDefinition(TensorVar tensorVar) {
    }

    @Override public void onRewrite(String name, IndexExpr before,
        @Nullable IndexExpr after) {
    }

    @Override public void onException(NotationException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onDefinition(TensorVar tensorVar) {
      tracer.onDefinition(tensorVar);
    }

    @Override public void onRewrite(String name, IndexExpr before,
        @Nullable IndexExpr after) {
      tracer.onRewrite(name, before, after);
    }

    @Override public void onException(NotationException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
