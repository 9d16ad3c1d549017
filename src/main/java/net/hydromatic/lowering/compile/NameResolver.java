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
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Name resolution results that lowering consumes.
 *
 * <p>Resolution runs before lowering. It records a resolution for each path,
 * keyed by the id of the node that contains the path (an expression, pattern,
 * type, trait reference, use tree or visibility), and for each label on a
 * {@code break} or {@code continue}, keyed by the id of that expression.
 * The resolution of a label is a definition of kind
 * {@link Def.Kind#LABEL} whose node id is the loop that the label names. */
public interface NameResolver {
  /** Returns the resolution of a node, or null. */
  @Nullable PathResolution getResolution(int nodeId);

  /** Resolves a path that lowering synthesizes, such as
   * {@code std::iter::Iterator::next}.
   *
   * @param pos Position of the construct that requires the path
   * @param components Path segments, including the crate root if any
   * @param isValue Whether the path is in the value namespace, as opposed to
   *                the type namespace
   */
  Def resolveStdPath(Pos pos, List<String> components, boolean isValue);

  /** Returns the definition registry. */
  Definitions definitions();
}

// End NameResolver.java
