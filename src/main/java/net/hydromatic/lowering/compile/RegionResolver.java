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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.lowering.ast.CoreBuilder.core;
import static net.hydromatic.lowering.util.Static.transformEager;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Attribute;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.LoweredId;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.ast.Visitor;
import net.hydromatic.lowering.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lowers regions, and creates the region parameters that are implied by
 * use rather than declared.
 *
 * <p>There are two sources of implied parameters. If property
 * {@link Prop#IN_BAND_REGIONS} is set, a region that a function signature
 * uses but nobody declares becomes a parameter of that signature; see
 * {@link #collectInBand}. And an {@code impl Trait} return type becomes an
 * existential type that has a parameter for each region that its bounds use
 * but do not bind; see {@link #captureFreeRegions}.
 */
public class RegionResolver {
  private final Session session;
  private final IdAllocator ids;
  private final Definitions definitions;

  /** Names of the regions that are in scope. */
  private final List<String> visible = new ArrayList<>();

  /** Regions that are used but not yet declared, in order of first use. */
  private final List<PendingRegion> pending = new ArrayList<>();

  /** Whether to add undeclared regions to {@link #pending}. */
  private boolean collecting;

  public RegionResolver(Session session, IdAllocator ids,
      Definitions definitions) {
    this.session = requireNonNull(session);
    this.ids = requireNonNull(ids);
    this.definitions = requireNonNull(definitions);
  }

  /** Lowers a region that occurs in the surface tree. */
  public Core.Region lowerRegion(Ast.Region region) {
    final Core.RegionName name;
    switch (region.name) {
      case "'_":
        name = Core.RegionName.UNDERSCORE;
        break;
      case "'static":
        name = Core.RegionName.STATIC;
        break;
      default:
        if (collecting
            && !visible.contains(region.name)
            && pending.stream().noneMatch(p -> p.name.equals(region.name))) {
          pending.add(new PendingRegion(region.pos, region.name));
        }
        name = Core.RegionName.of(region.name);
    }
    return core.region(ids.lower(region.id), region.pos, name);
  }

  public ImmutableList<Core.Region> lowerRegions(List<Ast.Region> regions) {
    return transformEager(regions, this::lowerRegion);
  }

  /** Creates a region where the source omits one, as in {@code &T}. */
  public Core.Region elidedRegion(Pos pos) {
    return core.region(ids.fresh(), pos, Core.RegionName.IMPLICIT);
  }

  /** Lowers a region declaration. The region and its bounds never imply a
   * parameter. */
  public Core.RegionDef lowerRegionDef(Ast.RegionDef regionDef) {
    final boolean wasCollecting = collecting;
    collecting = false;
    try {
      final Core.Region region = lowerRegion(regionDef.region);
      final ImmutableList<Core.Region> bounds =
          lowerRegions(regionDef.bounds);
      return core.regionDef(region, bounds,
          Attribute.contains(regionDef.attrs, "may_dangle"), false);
    } finally {
      collecting = wasCollecting;
    }
  }

  public ImmutableList<Core.RegionDef> lowerRegionDefs(
      List<Ast.RegionDef> regionDefs) {
    return transformEager(regionDefs, this::lowerRegionDef);
  }

  /** Runs an action with some more region names in scope. */
  public <T> T withVisibleRegions(List<String> names, Supplier<T> action) {
    final int size = visible.size();
    visible.addAll(names);
    try {
      return action.get();
    } finally {
      visible.subList(size, visible.size()).clear();
    }
  }

  /** Returns the names of a list of surface region declarations. */
  public static List<String> names(List<Ast.RegionDef> regionDefs) {
    return transformEager(regionDefs, d -> d.region.name);
  }

  /** Returns the names of a list of core region declarations. */
  public static List<String> coreNames(List<Core.RegionDef> regionDefs) {
    return transformEager(regionDefs, d -> d.region.name.name);
  }

  /**
   * Runs an action that lowers a signature, and declares a region parameter
   * for each region that the signature uses but nobody declares.
   *
   * <p>Parameters are only created if {@link Prop#IN_BAND_REGIONS} is set.
   * If {@code parent} is null, the undeclared regions are ignored.
   *
   * @param parent Definition that will own the new parameters, or null
   * @param action Action that lowers the signature
   * @return New parameters, in order of first use, and the result of the
   *   action
   */
  public <T> Pair<ImmutableList<Core.RegionDef>, T> collectInBand(
      @Nullable DefId parent, Supplier<T> action) {
    checkState(!collecting, "already collecting regions");
    checkState(pending.isEmpty(), "regions are pending");
    collecting = Prop.IN_BAND_REGIONS.booleanValue(session.map);
    final T t;
    try {
      t = action.get();
    } finally {
      collecting = false;
    }
    final List<PendingRegion> regions = new ArrayList<>(pending);
    pending.clear();
    if (parent == null) {
      return Pair.of(ImmutableList.of(), t);
    }
    final ImmutableList.Builder<Core.RegionDef> defs = ImmutableList.builder();
    for (PendingRegion region : regions) {
      final LoweredId id = ids.fresh();
      definitions.createDefWithParent(parent.index, id.nodeId, region.name);
      defs.add(
          core.regionDef(
              core.region(id, region.pos, Core.RegionName.of(region.name)),
              ImmutableList.of(), false, true));
    }
    return Pair.of(defs.build(), t);
  }

  /**
   * Finds the regions that the bounds of an existential type use but do not
   * bind, and creates a parameter for each.
   *
   * <p>Each named region is captured once. Elided regions are captured at
   * most once, as {@code '_}, and not at all inside the arguments of a
   * function type or of a parenthesized path such as {@code Fn(&u8)}. The
   * {@code 'static} region is never captured.
   *
   * @param parentIndex Index of the definition of the existential type
   * @param bounds Bounds of the existential type
   * @return Uses of the captured regions, and the corresponding parameters
   */
  public Pair<ImmutableList<Core.Region>, ImmutableList<Core.RegionDef>>
      captureFreeRegions(int parentIndex, List<Core.Bound> bounds) {
    final CaptureCollector collector = new CaptureCollector(parentIndex);
    bounds.forEach(bound -> bound.accept(collector));
    return Pair.of(ImmutableList.copyOf(collector.regions),
        ImmutableList.copyOf(collector.regionDefs));
  }

  @VisibleForTesting
  boolean isCollecting() {
    return collecting;
  }

  @VisibleForTesting
  int visibleCount() {
    return visible.size();
  }

  /** Region that is used before it is declared. */
  private static class PendingRegion {
    final Pos pos;
    final String name;

    PendingRegion(Pos pos, String name) {
      this.pos = pos;
      this.name = name;
    }
  }

  /** Visitor that finds the free regions in the bounds of an existential
   * type. */
  private class CaptureCollector extends Visitor {
    final int parentIndex;
    final List<Core.RegionName> bound = new ArrayList<>();
    final Set<Core.RegionName> captured = new HashSet<>();
    final List<Core.Region> regions = new ArrayList<>();
    final List<Core.RegionDef> regionDefs = new ArrayList<>();
    boolean collectElided = true;

    CaptureCollector(int parentIndex) {
      this.parentIndex = parentIndex;
    }

    @Override protected void visit(Core.PathParameters pathParameters) {
      if (!pathParameters.parenthesized) {
        super.visit(pathParameters);
        return;
      }
      final boolean wasCollectingElided = collectElided;
      collectElided = false;
      super.visit(pathParameters);
      collectElided = wasCollectingElided;
    }

    @Override protected void visit(Core.BareFnTy bareFnTy) {
      final boolean wasCollectingElided = collectElided;
      final int size = bound.size();
      collectElided = false;
      bareFnTy.regions.forEach(def -> bound.add(def.region.name));
      bareFnTy.decl.accept(this);
      bound.subList(size, bound.size()).clear();
      collectElided = wasCollectingElided;
    }

    @Override protected void visit(Core.PolyTraitRef polyTraitRef) {
      final int size = bound.size();
      // Bind one region at a time, so that a region's bounds may refer to
      // the regions before it
      for (Core.RegionDef regionDef : polyTraitRef.boundRegions) {
        bound.add(regionDef.region.name);
        regionDef.bounds.forEach(this::accept);
      }
      polyTraitRef.traitRef.accept(this);
      bound.subList(size, bound.size()).clear();
    }

    @Override protected void visit(Core.Region region) {
      final Core.RegionName name;
      switch (region.name.kind) {
        case IMPLICIT:
        case UNDERSCORE:
          if (!collectElided) {
            return;
          }
          name = Core.RegionName.UNDERSCORE;
          break;
        case STATIC:
          return;
        default:
          name = region.name;
      }
      if (bound.contains(name) || !captured.add(name)) {
        return;
      }
      regions.add(core.region(ids.fresh(), region.pos, name));
      final LoweredId defId = ids.fresh();
      definitions.createDefWithParent(parentIndex, defId.nodeId, name.name);
      regionDefs.add(
          core.regionDef(core.region(defId, region.pos, name),
              ImmutableList.of(), false, false));
    }
  }
}

// End RegionResolver.java
