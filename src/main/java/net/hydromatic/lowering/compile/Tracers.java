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
package net.hydromatic.lowering.compile;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.lowering.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each lowered item,
   * then calls the underlying tracer. */
  public static Tracer withOnItem(Tracer tracer,
      Consumer<Core.Item> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onItem(Core.Item item) {
        consumer.accept(item);
        super.onItem(item);
      }
    };
  }

  /** Returns a tracer that performs the given action on a compilation unit,
   * then calls the underlying tracer. */
  public static Tracer withOnCore(Tracer tracer,
      Consumer<Core.CompUnit> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCore(Core.CompUnit compUnit) {
        consumer.accept(compUnit);
        super.onCore(compUnit);
      }
    };
  }

  public static Tracer withOnDiagnostics(Tracer tracer,
      BiConsumer<List<CompileException>, List<CompileException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDiagnostics(List<CompileException> errors,
          List<CompileException> warnings) {
        consumer.accept(errors, warnings);
        super.onDiagnostics(errors, warnings);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(
          @Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onItem(Core.Item item) {
    }

    @Override public void onCore(Core.CompUnit compUnit) {
    }

    @Override public void onDiagnostics(List<CompileException> errors,
        List<CompileException> warnings) {
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onItem(Core.Item item) {
      tracer.onItem(item);
    }

    @Override public void onCore(Core.CompUnit compUnit) {
      tracer.onCore(compUnit);
    }

    @Override public void onDiagnostics(List<CompileException> errors,
        List<CompileException> warnings) {
      tracer.onDiagnostics(errors, warnings);
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
