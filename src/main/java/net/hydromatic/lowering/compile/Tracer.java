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
import net.hydromatic.lowering.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during lowering. */
public interface Tracer {
  /** Called when an item has been lowered. */
  void onItem(Core.Item item);

  /** Called when a crate has been lowered. */
  void onCore(Core.CompUnit compUnit);

  /** Called with the buffered errors and warnings at the end of a pass. */
  void onDiagnostics(List<CompileException> errors,
      List<CompileException> warnings);

  /**
   * Called with the exception that aborted lowering, or null if no exception
   * was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
