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

import static net.hydromatic.lowering.ast.AstBuilder.ast;
import static net.hydromatic.lowering.ast.CoreBuilder.core;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.lowering.MapResolver;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for {@link RegionResolver}. */
public class RegionResolverTest {
  @Test
  void testLowerRegion() {
    final Fixture f = new Fixture();
    final Core.Region underscore = f.lower(1, "'_");
    assertThat(underscore.name, is(Core.RegionName.UNDERSCORE));
    assertThat(underscore.id.nodeId, is(1));
    assertThat(f.lower(2, "'static").name, is(Core.RegionName.STATIC));
    final Core.Region a = f.lower(3, "'a");
    assertThat(a.name.kind, is(Core.RegionName.Kind.NAME));
    assertThat(a.name.name, is("'a"));

    final Core.Region elided = f.regions.elidedRegion(Pos.ZERO);
    assertThat(elided.name, is(Core.RegionName.IMPLICIT));
    assertThat(elided.name.isElided(), is(true));
    assertThat(elided.id.nodeId, is(100));
  }

  /** Tests that a signature that uses regions it does not declare gets a
   * parameter for each, in order of first use. */
  @Test
  void testCollectInBand() {
    final Fixture f = new Fixture();
    Prop.IN_BAND_REGIONS.set(f.session.map, true);
    final DefId parent = DefId.local(f.resolver.def(10));
    final Pair<ImmutableList<Core.RegionDef>, String> pair =
        f.regions.withVisibleRegions(ImmutableList.of("'b"), () ->
            f.regions.collectInBand(parent, () -> {
              assertThat(f.regions.isCollecting(), is(true));
              f.lower(1, "'c");
              f.lower(2, "'b");
              f.lower(3, "'a");
              f.lower(4, "'c");
              f.lower(5, "'static");
              f.lower(6, "'_");
              return "signature";
            }));
    assertThat(pair.right, is("signature"));
    assertThat(f.regions.isCollecting(), is(false));
    assertThat(f.regions.visibleCount(), is(0));
    final List<Core.RegionDef> defs = pair.left;
    assertThat(defs, hasSize(2));
    assertThat(defs.get(0).region.name.name, is("'c"));
    assertThat(defs.get(0).inBand, is(true));
    assertThat(defs.get(1).region.name.name, is("'a"));
    assertThat(f.resolver.createdCount(), is(2));
    assertThat(f.resolver.createdName(defs.get(1).region.id.nodeId),
        is("'a"));
    assertThat(f.resolver.parent(
            f.resolver.localDefId(defs.get(0).region.id.nodeId)),
        is(parent));
  }

  @Test
  void testCollectInBandDisabled() {
    final Fixture f = new Fixture();
    final DefId parent = DefId.local(f.resolver.def(10));
    final Pair<ImmutableList<Core.RegionDef>, Core.Region> pair =
        f.regions.collectInBand(parent, () -> f.lower(1, "'a"));
    assertThat(pair.left, empty());
    assertThat(pair.right.name.name, is("'a"));
    assertThat(f.resolver.createdCount(), is(0));
  }

  /** Tests that regions used by a signature that has no definition, such as
   * a closure's, are dropped, and do not leak into the next signature. */
  @Test
  void testCollectInBandWithoutParent() {
    final Fixture f = new Fixture();
    Prop.IN_BAND_REGIONS.set(f.session.map, true);
    final Pair<ImmutableList<Core.RegionDef>, Core.Region> pair =
        f.regions.collectInBand(null, () -> f.lower(1, "'a"));
    assertThat(pair.left, empty());

    final DefId parent = DefId.local(f.resolver.def(10));
    final Pair<ImmutableList<Core.RegionDef>, Core.Region> pair2 =
        f.regions.collectInBand(parent, () -> f.lower(2, "'b"));
    assertThat(pair2.left, hasSize(1));
    assertThat(pair2.left.get(0).region.name.name, is("'b"));
  }

  /** Tests that declaring a region does not imply a parameter. */
  @Test
  void testRegionDefIsNotInBand() {
    final Fixture f = new Fixture();
    Prop.IN_BAND_REGIONS.set(f.session.map, true);
    final DefId parent = DefId.local(f.resolver.def(10));
    final Ast.RegionDef regionDef =
        ast.regionDef(ImmutableList.of(ast.attribute(Pos.ZERO, "may_dangle")),
            ast.region(Pos.ZERO, 1, "'d"),
            ImmutableList.of(ast.region(Pos.ZERO, 2, "'e")));
    final Pair<ImmutableList<Core.RegionDef>, Core.RegionDef> pair =
        f.regions.collectInBand(parent,
            () -> f.regions.lowerRegionDef(regionDef));
    assertThat(pair.left, empty());
    assertThat(pair.right.pureWrtDrop, is(true));
    assertThat(pair.right.inBand, is(false));
    assertThat(pair.right.bounds, hasSize(1));
  }

  /** Tests that each free region of an existential type's bounds is
   * captured once, that elided regions are captured as {@code '_}, and that
   * {@code 'static} and regions bound by {@code for<'x>} are not
   * captured. */
  @Test
  void testCaptureFreeRegions() {
    final Fixture f = new Fixture();
    final int parentIndex = f.resolver.def(10);

    // for<'x> Tr<'x, 'y>
    final Core.RegionDef x =
        core.regionDef(f.region("'x"), ImmutableList.of(), false, false);
    final Core.PathParameters parameters =
        core.pathParameters(ImmutableList.of(f.region("'x"), f.region("'y")),
            ImmutableList.of(), ImmutableList.of(), false);
    final Core.Path path =
        core.path(Pos.ZERO, Def.of(Def.Kind.TRAIT, DefId.of(1, 0)),
            ImmutableList.of(core.pathSegment("Tr", parameters, false)));
    final Core.Bound traitBound =
        core.traitBound(
            core.polyTraitRef(ImmutableList.of(x),
                core.traitRef(path, f.ids.fresh()), Pos.ZERO),
            Ast.TraitBoundModifier.NONE);

    final List<Core.Bound> bounds =
        ImmutableList.of(traitBound,
            core.regionBound(f.region("'a")),
            core.regionBound(f.region("'static")),
            core.regionBound(
                core.region(f.ids.fresh(), Pos.ZERO,
                    Core.RegionName.IMPLICIT)),
            core.regionBound(f.region("'_")),
            core.regionBound(f.region("'a")));
    final Pair<ImmutableList<Core.Region>, ImmutableList<Core.RegionDef>>
        pair = f.regions.captureFreeRegions(parentIndex, bounds);
    assertThat(pair.left, hasSize(3));
    assertThat(pair.left.get(0).name.name, is("'y"));
    assertThat(pair.left.get(1).name.name, is("'a"));
    assertThat(pair.left.get(2).name, is(Core.RegionName.UNDERSCORE));
    assertThat(pair.right, hasSize(3));
    assertThat(pair.right.get(1).inBand, is(false));
    assertThat(f.resolver.createdCount(), is(3));
    assertThat(f.resolver.createdName(pair.right.get(2).region.id.nodeId),
        is("'_"));
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final MapResolver resolver = new MapResolver();
    final Session session = new Session(new LinkedHashMap<>(), 100);
    final IdAllocator ids = new IdAllocator(session, resolver);
    final RegionResolver regions = new RegionResolver(session, ids, resolver);

    Core.Region lower(int id, String name) {
      return regions.lowerRegion(ast.region(Pos.ZERO, id, name));
    }

    /** Creates a core region with a fresh id. */
    Core.Region region(String name) {
      return regions.lowerRegion(
          ast.region(Pos.ZERO, session.nextNodeId(), name));
    }
  }
}

// End RegionResolverTest.java
