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
package net.hydromatic.lowering;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lowering.ast.CoreId;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.compile.Definitions;
import net.hydromatic.lowering.compile.NameResolver;
import net.hydromatic.lowering.compile.PathResolution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Name resolver and definition registry whose contents a test supplies.
 *
 * <p>A test registers a definition for each node that defines something
 * (each item, associated item, type parameter and so forth) and a
 * resolution for each path that lowering will look up. Paths into the
 * standard library resolve to definitions in crate 1, numbered in order of
 * first request.
 */
public class MapResolver implements NameResolver, Definitions {
  private final Map<Integer, Integer> nodeToIndex = new HashMap<>();
  private final Map<Integer, Integer> indexToNode = new HashMap<>();
  private final Map<Integer, Integer> parents = new HashMap<>();
  private final Map<Integer, String> createdNames = new HashMap<>();
  private final Map<Integer, PathResolution> resolutions = new HashMap<>();
  private final Map<DefId, Integer> externalRegionCounts = new HashMap<>();
  private final List<String> stdPaths = new ArrayList<>();
  private int nextIndex = DefId.CRATE_DEF_INDEX + 1;

  /** Mapping from node ids to core ids, populated at the end of
   * lowering. */
  public @Nullable List<CoreId> nodeIdToCoreId;

  /** Registers a definition for a node, a child of the crate root, and
   * returns its index. */
  public int def(int nodeId) {
    return def(nodeId, DefId.CRATE_DEF_INDEX);
  }

  /** Registers a definition for a node, a child of a given definition, and
   * returns its index. */
  public int def(int nodeId, int parentIndex) {
    if (nodeToIndex.containsKey(nodeId)) {
      throw new IllegalArgumentException("node " + nodeId
          + " already has a definition");
    }
    final int index = nextIndex++;
    nodeToIndex.put(nodeId, index);
    indexToNode.put(index, nodeId);
    parents.put(index, parentIndex);
    return index;
  }

  /** Registers definitions for several nodes. */
  public MapResolver defs(int... nodeIds) {
    for (int nodeId : nodeIds) {
      def(nodeId);
    }
    return this;
  }

  /** Records the resolution of the path in a node. */
  public MapResolver resolve(int nodeId, Def def) {
    return resolve(nodeId, def, 0);
  }

  /** Records a partial resolution of the path in a node. */
  public MapResolver resolve(int nodeId, Def def, int unresolvedSegments) {
    resolutions.put(nodeId, PathResolution.of(def, unresolvedSegments));
    return this;
  }

  /** Sets the number of region parameters of a definition in another
   * crate. */
  public MapResolver externalRegions(DefId defId, int count) {
    externalRegionCounts.put(defId, count);
    return this;
  }

  /** Returns the paths into the standard library that lowering has
   * resolved, each joined with "::", in order of first request. */
  public List<String> stdPaths() {
    return ImmutableList.copyOf(stdPaths);
  }

  /** Returns the name of a definition that lowering created, or null. */
  public @Nullable String createdName(int nodeId) {
    final Integer index = nodeToIndex.get(nodeId);
    return index == null ? null : createdNames.get(index);
  }

  /** Returns the number of definitions that lowering created. */
  public int createdCount() {
    return createdNames.size();
  }

  // NameResolver

  @Override public @Nullable PathResolution getResolution(int nodeId) {
    return resolutions.get(nodeId);
  }

  @Override public Def resolveStdPath(Pos pos, List<String> components,
      boolean isValue) {
    final String path = String.join("::", components);
    int i = stdPaths.indexOf(path);
    if (i < 0) {
      i = stdPaths.size();
      stdPaths.add(path);
    }
    return Def.of(isValue ? Def.Kind.FN : Def.Kind.STRUCT, DefId.of(1, i));
  }

  @Override public Definitions definitions() {
    return this;
  }

  // Definitions

  @Override public DefId localDefId(int nodeId) {
    final Integer index = nodeToIndex.get(nodeId);
    if (index == null) {
      throw new IllegalArgumentException("node " + nodeId
          + " has no definition");
    }
    return DefId.local(index);
  }

  @Override public @Nullable Integer optDefIndex(int nodeId) {
    return nodeToIndex.get(nodeId);
  }

  @Override public @Nullable Integer asLocalNodeId(DefId defId) {
    return defId.isLocal() ? indexToNode.get(defId.index) : null;
  }

  @Override public DefId parent(DefId defId) {
    return DefId.of(defId.krate, requireNonNull(parents.get(defId.index)));
  }

  @Override public DefId createDefWithParent(int parentIndex, int nodeId,
      String name) {
    final int index = def(nodeId, parentIndex);
    createdNames.put(index, name);
    return DefId.local(index);
  }

  @Override public int externalRegionParamCount(DefId defId) {
    return externalRegionCounts.getOrDefault(defId, 0);
  }

  @Override public void initNodeIdToCoreIdMapping(
      List<CoreId> nodeIdToCoreId) {
    this.nodeIdToCoreId = ImmutableList.copyOf(nodeIdToCoreId);
  }
}

// End MapResolver.java
