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
import net.hydromatic.lowering.ast.CoreId;
import net.hydromatic.lowering.ast.DefId;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Registry of definition paths.
 *
 * <p>The registry is populated before lowering, one definition for each
 * surface node that defines something (an item, an associated item, a type
 * parameter, an {@code impl Trait} type and so forth). Lowering asks it for
 * existing definitions, and registers the region parameters that it creates;
 * it never invents a definition itself.
 */
public interface Definitions {
  /** Returns the definition of a local node. Throws if there is none. */
  DefId localDefId(int nodeId);

  /** Returns the index of the definition of a node, or null if the node
   * defines nothing. */
  @Nullable Integer optDefIndex(int nodeId);

  /** Returns the definition of a local node, or null. */
  default @Nullable DefId optLocalDefId(int nodeId) {
    final Integer index = optDefIndex(nodeId);
    return index == null ? null : DefId.local(index);
  }

  /** Returns the node that defines a definition, or null if the definition
   * is not in the local crate or has no node. */
  @Nullable Integer asLocalNodeId(DefId defId);

  /** Returns the definition that contains a given definition; for example,
   * the enum that contains a variant. */
  DefId parent(DefId defId);

  /** Registers a definition for a node that lowering has created, as a child
   * of an existing definition, and returns it. */
  DefId createDefWithParent(int parentIndex, int nodeId, String name);

  /** Returns the number of region parameters of a type or trait defined in
   * another crate. */
  int externalRegionParamCount(DefId defId);

  /** Receives the mapping from each surface node id (the list index) to its
   * core id, at the end of lowering. */
  void initNodeIdToCoreIdMapping(List<CoreId> nodeIdToCoreId);
}

// End Definitions.java
