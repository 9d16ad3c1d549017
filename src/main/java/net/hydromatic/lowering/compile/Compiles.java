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

import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Lowerer}. */
public abstract class Compiles {
  /**
   * Lowers a crate.
   *
   * <p>Reports each lowered item and the compilation unit to the tracer,
   * then the errors and warnings that lowering buffered in the session.
   *
   * <p>If the input is malformed in a way that lowering cannot recover from,
   * offers the exception to the tracer, and returns null if the tracer
   * handled it; otherwise rethrows it.
   */
  public static Core.@Nullable CompUnit lowerCrate(Session session,
      NameResolver resolver, Ast.Crate crate, Tracer tracer) {
    final Core.CompUnit compUnit;
    try {
      compUnit = new Lowerer(session, resolver).lowerCrate(crate);
    } catch (CompileException e) {
      tracer.onDiagnostics(session.errors(), session.warnings());
      if (tracer.handleCompileException(e)) {
        return null;
      }
      throw e;
    }
    compUnit.items.values().forEach(tracer::onItem);
    tracer.onCore(compUnit);
    tracer.onDiagnostics(session.errors(), session.warnings());
    tracer.handleCompileException(null);
    return compUnit;
  }
}

// End Compiles.java
