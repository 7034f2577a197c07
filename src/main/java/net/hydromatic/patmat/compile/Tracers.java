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
package net.hydromatic.patmat.compile;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the usefulness of each
   * row that is checked, then calls the underlying tracer.
   */
  public static Tracer withOnUseful(Tracer tracer,
      Consumer<Usefulness> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onUseful(Matrix matrix, PatStack row,
          Usefulness usefulness) {
        consumer.accept(usefulness);
        super.onUseful(matrix, row, usefulness);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each constructor and
   * the constructors it was split into, then calls the underlying tracer.
   */
  public static Tracer withOnSplit(Tracer tracer,
      BiConsumer<Constructor, List<Constructor>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSplit(Constructor constructor,
          List<Constructor> splitConstructors) {
        consumer.accept(constructor, splitConstructors);
        super.onSplit(constructor, splitConstructors);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each specialized
   * matrix, then calls the underlying tracer.
   */
  public static Tracer withOnSpecialize(Tracer tracer,
      BiConsumer<Constructor, Matrix> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSpecialize(Constructor constructor, Matrix specialized) {
        consumer.accept(constructor, specialized);
        super.onSpecialize(constructor, specialized);
      }
    };
  }

  /**
   * Returns a tracer that handles compile exceptions by passing them to a
   * consumer.
   */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        if (e != null) {
          consumer.accept(e);
        }
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onUseful(Matrix matrix, PatStack row,
        Usefulness usefulness) {}

    @Override
    public void onSplit(Constructor constructor,
        List<Constructor> splitConstructors) {}

    @Override
    public void onSpecialize(Constructor constructor, Matrix specialized) {}

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onUseful(Matrix matrix, PatStack row,
        Usefulness usefulness) {
      tracer.onUseful(matrix, row, usefulness);
    }

    @Override
    public void onSplit(Constructor constructor,
        List<Constructor> splitConstructors) {
      tracer.onSplit(constructor, splitConstructors);
    }

    @Override
    public void onSpecialize(Constructor constructor, Matrix specialized) {
      tracer.onSpecialize(constructor, specialized);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
