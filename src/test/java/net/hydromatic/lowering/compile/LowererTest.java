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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lowering.ast.AstBuilder.ast;
import static net.hydromatic.lowering.util.Static.transformEager;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lowering.MapResolver;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.CoreId;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.Label;
import net.hydromatic.lowering.ast.Literal;
import net.hydromatic.lowering.ast.LoweredId;
import net.hydromatic.lowering.ast.Op;
import net.hydromatic.lowering.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Lowerer}. */
public class LowererTest {
  private static final Pos POS = Pos.ZERO;

  private static final int FN_ID = 1;

  private static final Def TRAIT = Def.of(Def.Kind.TRAIT, DefId.of(2, 4));
  private static final Def STRUCT = Def.of(Def.Kind.STRUCT, DefId.of(2, 6));

  /** Creates {@code fn NAME(DECL) { STMTS }}; the body block has id
   * {@code id + 1}. */
  private static Ast.FnItem fn(int id, Ast.FnDecl decl, Ast.Generics generics,
      Ast.Stmt... stmts) {
    return ast.fnItem(POS, id, "f" + id, ast.inherited(), decl, generics,
        ast.block(POS, id + 1, ImmutableList.copyOf(stmts)));
  }

  private static Ast.FnItem fn(Ast.Stmt... stmts) {
    return fn(FN_ID, noArgs(), Ast.Generics.EMPTY, stmts);
  }

  private static Ast.FnDecl noArgs() {
    return ast.fnDecl(ImmutableList.of(), null, POS);
  }

  /** Creates the bound {@code NAME}, or {@code ?NAME}. */
  private static Ast.TraitBound traitBound(String name, int refId,
      Ast.TraitBoundModifier modifier) {
    return ast.traitBound(
        ast.polyTraitRef(POS, ImmutableList.of(),
            ast.traitRef(ast.path(POS, name), refId)),
        modifier);
  }

  /** Creates {@code impl Tr}. */
  private static Ast.ImplTraitTy implTrait(int id, int refId) {
    return ast.implTraitTy(POS, id,
        ImmutableList.of(traitBound("Tr", refId, Ast.TraitBoundModifier.NONE)));
  }

  private static Ast.PathTy pathTy(int id, String name) {
    return ast.pathTy(POS, id, null, ast.path(POS, name));
  }

  /** Creates {@code let x: TY;}; the local is {@code id + 1} and the
   * pattern is {@code id + 2}. */
  private static Ast.LocalStmt let(int id, Ast.Ty ty) {
    return ast.localStmt(POS, id,
        ast.local(POS, id + 1, ast.identPat(POS, id + 2, "x"), ty, null));
  }

  /** Creates the type {@code NAME(u8)}; the type is {@code id} and
   * {@code u8} is {@code id + 1}. */
  private static Ast.PathTy parenthesizedTy(int id, String name) {
    final Ast.PathSegment segment =
        ast.pathSegment(POS, name,
            ast.parenthesized(POS, ImmutableList.of(pathTy(id + 1, "u8")),
                null));
    return ast.pathTy(POS, id, null, ast.path(POS, ImmutableList.of(segment)));
  }

  private static Core.FnItem fnItem(Core.CompUnit compUnit, int id) {
    return (Core.FnItem) requireNonNull(compUnit.items.get(id)).kind;
  }

  /** Returns the block of the body of function {@link #FN_ID}. */
  private static Core.Block block(Core.CompUnit compUnit) {
    final Core.Body body =
        requireNonNull(compUnit.bodies.get(fnItem(compUnit, FN_ID).bodyId));
    return ((Core.BlockExp) body.value.kind).block;
  }

  /** Returns the type of the {@code i}th statement, which must be a
   * {@code let}, in the body of function {@link #FN_ID}. */
  private static Core.Ty letTy(Core.CompUnit compUnit, int i) {
    final Core.Stmt stmt = block(compUnit).stmts.get(i);
    return requireNonNull(((Core.LocalStmt) stmt).local.ty);
  }

  private static Core.Path path(Core.Ty ty) {
    final Core.QPath qpath = ((Core.PathTy) ty.kind).qpath;
    return ((Core.ResolvedQPath) qpath).path;
  }

  private static List<String> names(Core.Path path) {
    return transformEager(path.segments, segment -> segment.name);
  }

  /** Tests that a macro definition does not become an item, and that the
   * items of the root module are in the order they were declared. */
  @Test
  void testMacroDefIsSkipped() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 5, FN_ID);
    final Core.CompUnit compUnit =
        f.lower(fn(10, noArgs(), Ast.Generics.EMPTY),
            ast.macroDef(POS, 5, "m"), fn());
    assertThat(compUnit.module.itemIds, is(ImmutableList.of(10, FN_ID)));
    assertThat(compUnit.items.keySet(), is(ImmutableSet.of(FN_ID, 10)));
    assertThat(compUnit.bodies.size(), is(2));
  }

  /** Tests {@code pub use a::{b, c as d, self};}. Each nested import becomes
   * an item of its own, and the use item becomes a list stem. */
  @Test
  void testNestedUse() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 11, 12, 13);
    final Def mod = Def.of(Def.Kind.MOD, DefId.of(2, 3));
    f.resolver.resolve(10, mod)
        .resolve(11, Def.of(Def.Kind.FN, DefId.of(2, 1)))
        .resolve(12, STRUCT)
        .resolve(13, mod);
    final Ast.UseTree tree =
        ast.nestedUseTree(POS, ast.path(POS, "a"),
            ImmutableList.of(
                ast.simpleUseTree(POS, ast.path(POS, "b"), null, 11),
                ast.simpleUseTree(POS, ast.path(POS, "c"), "d", 12),
                ast.simpleUseTree(POS, ast.path(POS, "self"), null, 13)),
            10);
    final Core.CompUnit compUnit =
        f.lower(
            ast.use(POS, 10, ast.visibility(POS, Ast.VisibilityKind.PUBLIC),
                tree));
    assertThat(compUnit.module.itemIds, is(ImmutableList.of(10, 11, 12, 13)));

    final Core.Item stem = requireNonNull(compUnit.items.get(10));
    final Core.Use stemUse = (Core.Use) stem.kind;
    assertThat(stemUse.useKind, is(Core.UseKind.LIST_STEM));
    assertThat(names(stemUse.path), is(ImmutableList.of("a")));
    assertThat(stem.vis.kind, is(Ast.VisibilityKind.INHERITED));

    final Core.Item b = requireNonNull(compUnit.items.get(11));
    assertThat(b.name, is("b"));
    assertThat(b.vis.kind, is(Ast.VisibilityKind.PUBLIC));
    final Core.Use bUse = (Core.Use) b.kind;
    assertThat(bUse.useKind, is(Core.UseKind.SINGLE));
    assertThat(names(bUse.path), is(ImmutableList.of("a", "b")));
    assertThat(bUse.path.def.kind, is(Def.Kind.FN));

    // Each nested import is an owner of its own
    final int bIndex = requireNonNull(f.resolver.optDefIndex(11));
    assertThat(b.id.coreId, is(CoreId.of(bIndex, 0)));

    final Core.Item d = requireNonNull(compUnit.items.get(12));
    assertThat(d.name, is("d"));
    assertThat(names(((Core.Use) d.kind).path),
        is(ImmutableList.of("a", "c")));

    // "self" imports the prefix
    final Core.Item self = requireNonNull(compUnit.items.get(13));
    assertThat(self.name, is("a"));
    assertThat(names(((Core.Use) self.kind).path), is(ImmutableList.of("a")));
  }

  /** Tests that bodies are listed in order of position, not in the order
   * they were lowered. */
  @Test
  void testBodyIdsSortedByPosition() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 20);
    final Ast.FnItem late =
        ast.fnItem(POS, 10, "late", ast.inherited(), noArgs(),
            Ast.Generics.EMPTY,
            ast.block(new Pos("a.rs", 10, 1, 12, 2), 11, ImmutableList.of()));
    final Ast.FnItem early =
        ast.fnItem(POS, 20, "early", ast.inherited(), noArgs(),
            Ast.Generics.EMPTY,
            ast.block(new Pos("a.rs", 2, 1, 4, 2), 21, ImmutableList.of()));
    final Core.CompUnit compUnit = f.lower(late, early);
    final int lateBody = fnItem(compUnit, 10).bodyId;
    final int earlyBody = fnItem(compUnit, 20).bodyId;
    assertThat(lateBody < earlyBody, is(true));
    assertThat(compUnit.bodyIds, is(ImmutableList.of(earlyBody, lateBody)));
  }

  /** Tests that an item declared in a function body goes into the crate's
   * item table, and that the body refers to it by id. */
  @Test
  void testItemInBody() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    f.resolver.def(20, fnIndex);
    final Ast.Stmt itemStmt =
        ast.itemStmt(POS, 10, fn(20, noArgs(), Ast.Generics.EMPTY));
    final Core.CompUnit compUnit = f.lower(fn(itemStmt));
    assertThat(compUnit.module.itemIds, is(ImmutableList.of(FN_ID)));
    assertThat(compUnit.items.keySet(), is(ImmutableSet.of(FN_ID, 20)));
    final Core.Stmt stmt = block(compUnit).stmts.get(0);
    assertThat(((Core.ItemStmt) stmt).itemId, is(20));
  }

  @Test
  void testFnArgs() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(31, Def.local(21));
    final Ast.Arg arg =
        ast.arg(POS, 20, ast.identPat(POS, 21, "x"), pathTy(22, "u8"));
    final Core.CompUnit compUnit =
        f.lower(
            fn(FN_ID, ast.fnDecl(ImmutableList.of(arg), null, POS),
                Ast.Generics.EMPTY,
                ast.exprStmt(POS, 30, ast.id(POS, 31, "x"))));
    final Core.FnItem fnItem = fnItem(compUnit, FN_ID);
    final Core.Body body = requireNonNull(compUnit.bodies.get(fnItem.bodyId));
    assertThat(body.isGenerator, is(false));
    assertThat(body.arguments, hasSize(1));
    final Core.BindingPat x =
        (Core.BindingPat) body.arguments.get(0).pat.kind;
    assertThat(x.name, is("x"));
    assertThat(x.canonicalId, is(21));
    final Core.Exp value = requireNonNull(block(compUnit).expr);
    final Core.Path path =
        ((Core.ResolvedQPath) ((Core.PathExp) value.kind).qpath).path;
    assertThat(path.def, is(Def.local(21)));
    assertThat(fnItem.decl.inputs, hasSize(1));
    assertThat(fnItem.decl.hasImplicitSelf, is(false));
  }

  /** Tests that an identifier pattern that resolves to a constant or unit
   * variant becomes a path pattern. */
  @Test
  void testIdentPatThatIsAPath() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Def none = Def.of(Def.Kind.VARIANT_CTOR, DefId.of(1, 0));
    f.resolver.resolve(12, none);
    final Ast.LocalStmt let =
        ast.localStmt(POS, 10,
            ast.local(POS, 11, ast.identPat(POS, 12, "None"), null, null));
    final Core.CompUnit compUnit = f.lower(fn(let));
    final Core.Local local =
        ((Core.LocalStmt) block(compUnit).stmts.get(0)).local;
    assertThat(local.pat.id.nodeId, is(12));
    final Core.PathPat pathPat = (Core.PathPat) local.pat.kind;
    assertThat(((Core.ResolvedQPath) pathPat.qpath).path.def, is(none));
  }

  /** Tests that the segments of a path that resolution could not resolve
   * become type-relative paths, as in {@code Vec::new}. */
  @Test
  void testTypeRelativePath() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(11, STRUCT, 1);
    final Ast.PathExp vecNew =
        ast.pathExp(POS, 11, null, ast.path(POS, "Vec", "new"));
    final Core.CompUnit compUnit =
        f.lower(fn(ast.exprStmt(POS, 10, vecNew)));
    final Core.Exp value = requireNonNull(block(compUnit).expr);
    final Core.TypeRelativeQPath qpath =
        (Core.TypeRelativeQPath) ((Core.PathExp) value.kind).qpath;
    assertThat(qpath.segment.name, is("new"));
    final Core.Path base = path(qpath.base);
    assertThat(names(base), is(ImmutableList.of("Vec")));
    assertThat(base.def, is(STRUCT));
  }

  /** Tests that a {@code break} in the condition of a {@code while} loop
   * is an error, but a {@code break} in its body is not. */
  @Test
  void testBreakInWhileCondition() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Ast.While aWhile =
        ast.while_(POS, 10, ast.break_(POS, 11, null, null),
            ast.block(POS, 12,
                ImmutableList.of(
                    ast.semiStmt(POS, 13, ast.break_(POS, 14, null, null)))),
            null);
    final Core.CompUnit compUnit = f.lower(fn(ast.exprStmt(POS, 9, aWhile)));
    final Core.While coreWhile =
        (Core.While) requireNonNull(block(compUnit).expr).kind;
    final Core.Break conditionBreak = (Core.Break) coreWhile.condition.kind;
    assertThat(conditionBreak.destination.target,
        is(
            Core.ScopeTarget.loopError(
                Core.LoopIdError.UNLABELED_CF_IN_WHILE_CONDITION)));
    final Core.Exp bodyBreak =
        ((Core.SemiStmt) coreWhile.body.stmts.get(0)).exp;
    assertThat(((Core.Break) bodyBreak.kind).destination.target,
        is(Core.ScopeTarget.loop(10)));
  }

  /** Tests labeled and unlabeled jumps, including jumps to a label that does
   * not resolve and jumps outside any loop. */
  @Test
  void testJumpDestinations() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Label outer = Label.of("'outer", POS);
    f.resolver.resolve(16, Def.label(10));
    final Ast.Loop innerLoop =
        ast.loop(POS, 13,
            ast.block(POS, 14,
                ImmutableList.of(
                    ast.semiStmt(POS, 15, ast.break_(POS, 16, outer, null)),
                    ast.semiStmt(POS, 17,
                        ast.break_(POS, 18, Label.of("'nowhere", POS),
                            null)),
                    ast.exprStmt(POS, 19, ast.continue_(POS, 20, null)))),
            null);
    final Ast.Loop outerLoop =
        ast.loop(POS, 10,
            ast.block(POS, 11,
                ImmutableList.of(ast.exprStmt(POS, 12, innerLoop))),
            outer);
    final Ast.Stmt continueOutside =
        ast.semiStmt(POS, 21, ast.continue_(POS, 22, null));
    final Core.CompUnit compUnit =
        f.lower(fn(continueOutside, ast.exprStmt(POS, 9, outerLoop)));

    final Core.Block block = block(compUnit);
    final Core.Exp continueExp = ((Core.SemiStmt) block.stmts.get(0)).exp;
    assertThat(((Core.Continue) continueExp.kind).destination.target,
        is(Core.ScopeTarget.loopError(Core.LoopIdError.OUTSIDE_LOOP_SCOPE)));

    final Core.Loop loop = (Core.Loop) requireNonNull(block.expr).kind;
    assertThat(loop.source, is(Core.LoopSource.LOOP));
    assertThat(requireNonNull(loop.label).name, is("'outer"));
    final Core.Loop inner = (Core.Loop) requireNonNull(loop.body.expr).kind;
    final Core.Break toOuter =
        (Core.Break) ((Core.SemiStmt) inner.body.stmts.get(0)).exp.kind;
    assertThat(toOuter.destination.target, is(Core.ScopeTarget.loop(10)));
    assertThat(requireNonNull(toOuter.destination.label).name,
        is("'outer"));
    final Core.Break toNowhere =
        (Core.Break) ((Core.SemiStmt) inner.body.stmts.get(1)).exp.kind;
    assertThat(toNowhere.destination.target,
        is(Core.ScopeTarget.loopError(Core.LoopIdError.UNRESOLVED_LABEL)));
    final Core.Continue toInner =
        (Core.Continue) requireNonNull(inner.body.expr).kind;
    assertThat(toInner.destination.target, is(Core.ScopeTarget.loop(13)));
  }

  /** Tests that {@code impl Trait} in the type of a local variable is
   * reported, and becomes an error type. */
  @Test
  void testImplTraitNotAllowed() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(14, TRAIT);
    final Core.CompUnit compUnit = f.lower(fn(let(10, implTrait(13, 14))));
    assertThat(letTy(compUnit, 0).kind.op, is(Op.ERR_TY));
    assertThat(f.errors(), hasSize(1));
    assertThat(f.errors().get(0).code(), is("E0562"));
    assertThat(f.warnings(), empty());
  }

  /** Tests that {@code impl Trait} in argument position becomes a universal
   * type that belongs to the function. */
  @Test
  void testUniversalImplTrait() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    f.resolver.resolve(23, TRAIT);
    final Ast.Arg arg =
        ast.arg(POS, 20, ast.identPat(POS, 21, "x"), implTrait(22, 23));
    final Ast.FnItem fn =
        fn(FN_ID, ast.fnDecl(ImmutableList.of(arg), null, POS),
            Ast.Generics.EMPTY);
    final Core.CompUnit compUnit = f.lower(fn);
    final Core.Ty input = fnItem(compUnit, FN_ID).decl.inputs.get(0);
    final Core.UniversalTy universalTy = (Core.UniversalTy) input.kind;
    assertThat(universalTy.defId, is(DefId.local(fnIndex)));
    assertThat(universalTy.bounds, hasSize(1));
    assertThat(f.errors(), empty());

    // Disabled, it is an error
    final Fixture f2 = new Fixture();
    Prop.UNIVERSAL_OPAQUE_TYPES.set(f2.map, false);
    f2.resolver.def(FN_ID);
    f2.resolver.resolve(23, TRAIT);
    final Core.CompUnit compUnit2 = f2.lower(fn);
    assertThat(fnItem(compUnit2, FN_ID).decl.inputs.get(0).kind.op,
        is(Op.ERR_TY));
    assertThat(f2.errors(), hasSize(1));
    assertThat(f2.errors().get(0).getMessage(),
        startsWith("`impl Trait` in argument position"));
  }

  /** Tests that {@code impl Trait} in return position becomes an existential
   * type with a parameter for each region its bounds use. */
  @Test
  void testExistentialImplTrait() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    f.resolver.def(40, fnIndex);
    f.resolver.resolve(42, TRAIT);
    final Ast.PathSegment segment =
        ast.pathSegment(POS, "Tr",
            ast.angleBracketed(POS,
                ImmutableList.of(ast.region(POS, 41, "'a")),
                ImmutableList.of(), ImmutableList.of()));
    final Ast.TraitBound bound =
        ast.traitBound(
            ast.polyTraitRef(POS, ImmutableList.of(),
                ast.traitRef(ast.path(POS, ImmutableList.of(segment)), 42)),
            Ast.TraitBoundModifier.NONE);
    final Ast.Generics generics =
        ast.generics(POS,
            ImmutableList.of(
                ast.regionDef(ImmutableList.of(), ast.region(POS, 30, "'a"),
                    ImmutableList.of())),
            ImmutableList.of(), ast.whereClause(POS, 31, ImmutableList.of()));
    final Ast.FnItem fn =
        fn(FN_ID,
            ast.fnDecl(ImmutableList.of(),
                ast.implTraitTy(POS, 40, ImmutableList.of(bound)), POS),
            generics);
    final Core.CompUnit compUnit = f.lower(fn);
    final Core.FnItem fnItem = fnItem(compUnit, FN_ID);
    assertThat(fnItem.generics.regions, hasSize(1));
    assertThat(fnItem.generics.regions.get(0).inBand, is(false));

    final Core.ExistentialTy existentialTy =
        (Core.ExistentialTy) requireNonNull(fnItem.decl.output).kind;
    assertThat(existentialTy.bounds, hasSize(1));
    assertThat(existentialTy.regions, hasSize(1));
    assertThat(existentialTy.regions.get(0).name,
        is(Core.RegionName.of("'a")));
    assertThat(existentialTy.generics.regions, hasSize(1));
    assertThat(existentialTy.generics.regions.get(0).region.name,
        is(Core.RegionName.of("'a")));
    assertThat(f.resolver.createdCount(), is(1));
    assertThat(f.errors(), empty());

    // Disabled, it is an error
    final Fixture f2 = new Fixture();
    Prop.CONSERVATIVE_OPAQUE_TYPES.set(f2.map, false);
    f2.resolver.def(FN_ID);
    f2.resolver.resolve(42, TRAIT);
    final Core.CompUnit compUnit2 = f2.lower(fn);
    assertThat(requireNonNull(fnItem(compUnit2, FN_ID).decl.output).kind.op,
        is(Op.ERR_TY));
    assertThat(f2.errors(), hasSize(1));
    assertThat(f2.resolver.createdCount(), is(0));
  }

  /** Tests that a region that a signature uses without declaring becomes a
   * parameter of the function, if in-band regions are enabled. */
  @Test
  void testInBandRegion() {
    final Ast.Arg arg =
        ast.arg(POS, 20, ast.identPat(POS, 21, "x"),
            ast.refTy(POS, 22, ast.region(POS, 23, "'a"), pathTy(24, "u8"),
                Ast.Mutability.IMMUTABLE));
    final Ast.FnItem fn =
        fn(FN_ID, ast.fnDecl(ImmutableList.of(arg), null, POS),
            Ast.Generics.EMPTY);

    final Fixture f = new Fixture();
    Prop.IN_BAND_REGIONS.set(f.map, true);
    final int fnIndex = f.resolver.def(FN_ID);
    final Core.CompUnit compUnit = f.lower(fn);
    final Core.FnItem fnItem = fnItem(compUnit, FN_ID);
    assertThat(fnItem.generics.regions, hasSize(1));
    final Core.RegionDef regionDef = fnItem.generics.regions.get(0);
    assertThat(regionDef.inBand, is(true));
    assertThat(regionDef.region.name, is(Core.RegionName.of("'a")));
    assertThat(f.resolver.createdCount(), is(1));
    final int regionNodeId = regionDef.region.id.nodeId;
    assertThat(f.resolver.createdName(regionNodeId), is("'a"));
    assertThat(
        f.resolver.parent(f.resolver.localDefId(regionNodeId)),
        is(DefId.local(fnIndex)));
    final Core.RefTy refTy = (Core.RefTy) fnItem.decl.inputs.get(0).kind;
    assertThat(refTy.region.name, is(Core.RegionName.of("'a")));

    // Disabled, the region is not declared
    final Fixture f2 = new Fixture();
    f2.resolver.def(FN_ID);
    final Core.CompUnit compUnit2 = f2.lower(fn);
    assertThat(fnItem(compUnit2, FN_ID).generics.regions, empty());
    assertThat(f2.resolver.createdCount(), is(0));
  }

  /** Tests that a reference with no region, and a path to a type that has
   * region parameters but gives none, get elided regions. */
  @Test
  void testElidedRegions() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(14, STRUCT);
    f.resolver.externalRegions(STRUCT.defId(), 2);
    final Ast.RefTy refTy =
        ast.refTy(POS, 13, null, pathTy(14, "S"), Ast.Mutability.IMMUTABLE);
    final Core.CompUnit compUnit = f.lower(fn(let(10, refTy)));
    final Core.RefTy coreRefTy = (Core.RefTy) letTy(compUnit, 0).kind;
    assertThat(coreRefTy.region.name, is(Core.RegionName.IMPLICIT));
    assertThat(coreRefTy.region.name.isElided(), is(true));
    final Core.PathSegment segment = path(coreRefTy.ty).segments.get(0);
    final Core.PathParameters parameters =
        requireNonNull(segment.parameters);
    assertThat(parameters.regions, hasSize(2));
    assertThat(parameters.regions.get(1).name,
        is(Core.RegionName.IMPLICIT));
    assertThat(parameters.regions.get(0).id,
        not(parameters.regions.get(1).id));
  }

  /** Tests that a {@code ?Trait} bound in a where clause moves to the type
   * parameter that it constrains. */
  @Test
  void testMaybeBoundMovesToTyParam() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    final int tIndex = f.resolver.def(30, fnIndex);
    f.resolver.resolve(32, Def.of(Def.Kind.TY_PARAM, DefId.local(tIndex)));
    f.resolver.resolve(33, Def.of(Def.Kind.TRAIT, DefId.of(2, 11)));
    final Core.CompUnit compUnit = f.lower(fnWithMaybeBound());
    final Core.Generics generics = fnItem(compUnit, FN_ID).generics;
    final Core.TyParam tyParam = generics.tyParams.get(0);
    assertThat(tyParam.name, is("T"));
    assertThat(tyParam.bounds, hasSize(1));
    assertThat(((Core.TraitBound) tyParam.bounds.get(0)).modifier,
        is(Ast.TraitBoundModifier.MAYBE));
    final Core.BoundPredicate predicate =
        (Core.BoundPredicate) generics.whereClause.predicates.get(0);
    assertThat(predicate.bounds, empty());
    assertThat(f.errors(), empty());
  }

  /** Tests that a {@code ?Trait} bound on something other than a type
   * parameter of the same item is reported. */
  @Test
  void testMaybeBoundNotOnTyParam() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    f.resolver.def(30, fnIndex);
    f.resolver.resolve(32, STRUCT);
    f.resolver.resolve(33, Def.of(Def.Kind.TRAIT, DefId.of(2, 11)));
    final Core.CompUnit compUnit = f.lower(fnWithMaybeBound());
    final Core.Generics generics = fnItem(compUnit, FN_ID).generics;
    assertThat(generics.tyParams.get(0).bounds, empty());
    assertThat(f.errors(), hasSize(1));
    assertThat(f.errors().get(0).getMessage(),
        startsWith("`?Trait` bounds are only permitted"));
  }

  /** Creates {@code fn f<T>() where T: ?Sized {}}. */
  private static Ast.FnItem fnWithMaybeBound() {
    final Ast.BoundPredicate predicate =
        ast.boundPredicate(POS, ImmutableList.of(), pathTy(32, "T"),
            ImmutableList.of(
                traitBound("Sized", 33, Ast.TraitBoundModifier.MAYBE)));
    final Ast.Generics generics =
        ast.generics(POS, ImmutableList.of(),
            ImmutableList.of(
                ast.tyParam(POS, 30, "T", ImmutableList.of(), null)),
            ast.whereClause(POS, 31, ImmutableList.of(predicate)));
    return fn(FN_ID, noArgs(), generics);
  }

  /** Tests parenthesized parameters: allowed on a trait, a warning on a
   * type parameter, an error on a struct. */
  @Test
  void testParenthesizedParameters() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(13, STRUCT)
        .resolve(23, Def.of(Def.Kind.TY_PARAM, DefId.of(2, 12)))
        .resolve(33, Def.of(Def.Kind.TRAIT, DefId.of(2, 13)));
    final Core.CompUnit compUnit =
        f.lower(
            fn(let(10, parenthesizedTy(13, "S")),
                let(20, parenthesizedTy(23, "T")),
                let(30, parenthesizedTy(33, "Fn"))));
    assertThat(f.errors(), hasSize(1));
    assertThat(f.errors().get(0).code(), is("E0214"));
    assertThat(f.warnings(), hasSize(1));
    assertThat(f.warnings().get(0).getMessage(),
        is("parenthesized parameters may only be used with a trait"));

    final Core.PathSegment s = path(letTy(compUnit, 0)).segments.get(0);
    assertThat(requireNonNull(s.parameters).types, empty());
    assertThat(s.inferTypes, is(true));

    // A trait in type position is a trait object
    final Core.Ty fnTy = letTy(compUnit, 2);
    final Core.TraitObjectTy traitObjectTy = (Core.TraitObjectTy) fnTy.kind;
    final Core.Path fnPath = traitObjectTy.bounds.get(0).traitRef.path;
    final Core.PathParameters parameters =
        requireNonNull(fnPath.segments.get(0).parameters);
    assertThat(parameters.parenthesized, is(true));
    assertThat(parameters.types, hasSize(1));
    assertThat(parameters.types.get(0).kind.op, is(Op.TUP_TY));
    assertThat(parameters.bindings.get(0).name, is("Output"));
    assertThat(traitObjectTy.region.name, is(Core.RegionName.IMPLICIT));
  }

  /** Tests a trait and its items. */
  @Test
  void testTrait() {
    final Fixture f = new Fixture();
    final int traitIndex = f.resolver.def(10);
    f.resolver.def(11, traitIndex);
    f.resolver.def(12, traitIndex);
    f.resolver.def(13, traitIndex);
    final Ast.Arg self =
        ast.arg(POS, 20, ast.identPat(POS, 21, "self"),
            ast.refTy(POS, 22, null, ast.implicitSelfTy(POS, 23),
                Ast.Mutability.IMMUTABLE));
    final Ast.Trait trait =
        ast.trait(POS, 10, "Tr", ast.inherited(), Ast.IsAuto.NO,
            Ast.Generics.EMPTY, ImmutableList.of(),
            ImmutableList.of(
                ast.traitConst(POS, 11, "C", pathTy(14, "u8"), null),
                ast.traitMethod(POS, 12, "m", Ast.Generics.EMPTY,
                    ast.methodSig(
                        ast.fnDecl(ImmutableList.of(self), null, POS)),
                    null),
                ast.traitType(POS, 13, "T", ImmutableList.of(), null)));
    final Core.CompUnit compUnit = f.lower(trait);
    assertThat(compUnit.traitItems.keySet(), is(ImmutableSet.of(11, 12, 13)));

    final Core.Trait coreTrait =
        (Core.Trait) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(
        transformEager(coreTrait.itemRefs, ref -> ref.kind),
        is(
            ImmutableList.of(Core.AssociatedItemKind.CONST,
                Core.AssociatedItemKind.METHOD,
                Core.AssociatedItemKind.TYPE)));
    final Core.TraitItemRef methodRef = coreTrait.itemRefs.get(1);
    assertThat(methodRef.itemId, is(12));
    assertThat(methodRef.hasSelf, is(true));
    assertThat(methodRef.hasValue, is(false));

    final Core.TraitItem method = requireNonNull(compUnit.traitItems.get(12));
    final Core.TraitMethod traitMethod = (Core.TraitMethod) method.kind;
    assertThat(traitMethod.argNames, is(ImmutableList.of("self")));
    assertThat(traitMethod.bodyId, nullValue());
    assertThat(traitMethod.sig.decl.hasImplicitSelf, is(true));
    assertThat(compUnit.bodies.size(), is(0));
  }

  /** Tests that an impl of a trait is recorded against the trait, and that
   * its methods may not return {@code impl Trait}, whereas methods of an
   * inherent impl may. */
  @Test
  void testImpls() {
    final Fixture f = new Fixture();
    final int traitImplIndex = f.resolver.def(10);
    f.resolver.def(13, traitImplIndex);
    final int inherentImplIndex = f.resolver.def(20);
    final int methodIndex = f.resolver.def(22, inherentImplIndex);
    f.resolver.def(23, methodIndex);
    f.resolver.resolve(11, TRAIT)
        .resolve(12, STRUCT)
        .resolve(15, TRAIT)
        .resolve(21, STRUCT)
        .resolve(24, TRAIT);
    final Ast.Impl traitImpl =
        ast.impl(POS, 10, Ast.Generics.EMPTY,
            ast.traitRef(ast.path(POS, "Tr"), 11), pathTy(12, "S"),
            ImmutableList.of(
                ast.implMethod(POS, 13, "m", ast.inherited(),
                    Ast.Generics.EMPTY,
                    ast.methodSig(
                        ast.fnDecl(ImmutableList.of(), implTrait(14, 15),
                            POS)),
                    ast.block(POS, 16, ImmutableList.of()))));
    final Ast.Impl inherentImpl =
        ast.impl(POS, 20, Ast.Generics.EMPTY, null, pathTy(21, "S"),
            ImmutableList.of(
                ast.implMethod(POS, 22, "n", ast.inherited(),
                    Ast.Generics.EMPTY,
                    ast.methodSig(
                        ast.fnDecl(ImmutableList.of(), implTrait(23, 24),
                            POS)),
                    ast.block(POS, 25, ImmutableList.of()))));
    final Core.CompUnit compUnit = f.lower(traitImpl, inherentImpl);
    assertThat(compUnit.traitImpls,
        is(ImmutableMap.of(TRAIT.defId(), ImmutableList.of(10))));
    assertThat(compUnit.implItems.keySet(), is(ImmutableSet.of(13, 22)));

    final Core.Impl impl =
        (Core.Impl) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(requireNonNull(impl.traitRef).path.def, is(TRAIT));
    assertThat(impl.itemRefs.get(0).itemId, is(13));
    assertThat(impl.itemRefs.get(0).kind,
        is(Core.AssociatedItemKind.METHOD));

    final Core.ImplMethod m =
        (Core.ImplMethod) requireNonNull(compUnit.implItems.get(13)).kind;
    assertThat(requireNonNull(m.sig.decl.output).kind.op, is(Op.ERR_TY));
    assertThat(f.errors(), hasSize(1));
    assertThat(f.errors().get(0).code(), is("E0562"));

    final Core.ImplMethod n =
        (Core.ImplMethod) requireNonNull(compUnit.implItems.get(22)).kind;
    assertThat(requireNonNull(n.sig.decl.output).kind.op,
        is(Op.EXISTENTIAL_TY));
  }

  /** Tests that macros that were not expanded are internal errors. */
  @Test
  void testUnexpandedMacros() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Ast.FnItem fn =
        fn(ast.exprStmt(POS, 10, ast.macExp(POS, 11, ast.path(POS, "m"))));
    final AssertionError e =
        assertThrows(AssertionError.class, () -> f.lower(fn));
    assertThat(e.getMessage(),
        startsWith("expression macro should have been expanded"));

    final Fixture f2 = new Fixture();
    f2.resolver.def(5);
    final Ast.MacItem macItem = ast.macItem(POS, 5, ast.path(POS, "m"));
    final AssertionError e2 =
        assertThrows(AssertionError.class, () -> f2.lower(macItem));
    assertThat(e2.getMessage(),
        startsWith("item macro should have been expanded"));
  }

  /** Tests the mapping from node ids to core ids, and that it is given to
   * the definitions table. */
  @Test
  void testNodeIdToCoreId() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    final Core.CompUnit compUnit = f.lower(fn());
    final List<CoreId> nodeIdToCoreId = compUnit.nodeIdToCoreId;
    assertThat(nodeIdToCoreId.get(Ast.CRATE_NODE_ID), is(CoreId.CRATE));
    assertThat(nodeIdToCoreId.get(FN_ID), is(CoreId.of(fnIndex, 0)));
    assertThat(nodeIdToCoreId.get(FN_ID + 1).owner, is(fnIndex));
    assertThat(nodeIdToCoreId.get(3), is(CoreId.DUMMY));
    assertThat(f.resolver.nodeIdToCoreId, is(nodeIdToCoreId));
  }

  /** Tests that a macro definition is exported if it is a declarative macro,
   * or a {@code macro_rules!} macro with the {@code #[macro_export]}
   * attribute. No macro definition becomes an item, but each is an
   * owner. */
  @Test
  void testExportedMacros() {
    final Fixture f = new Fixture();
    f.resolver.defs(5, 6, 7);
    final Ast.MacroDef exported =
        ast.macroDef(POS, 5, "m1", ast.inherited(),
            ImmutableList.of(ast.attribute(POS, "macro_export")), "() => {}",
            true);
    final Ast.MacroDef local = ast.macroDef(POS, 6, "m2");
    final Ast.MacroDef declarative =
        ast.macroDef(POS, 7, "m3",
            ast.visibility(POS, Ast.VisibilityKind.PUBLIC),
            ImmutableList.of(), "($x:expr) => { $x }", false);
    final Core.CompUnit compUnit = f.lower(exported, local, declarative);
    assertThat(compUnit.module.itemIds, empty());
    assertThat(compUnit.items.keySet(), empty());
    assertThat(transformEager(compUnit.exportedMacros, m -> m.name),
        is(ImmutableList.of("m1", "m3")));

    final Core.MacroDef m1 = compUnit.exportedMacros.get(0);
    assertThat(m1.nodeId, is(5));
    assertThat(m1.legacy, is(true));
    assertThat(m1.attrs, hasSize(1));
    assertThat(m1.vis.kind, is(Ast.VisibilityKind.INHERITED));
    final Core.MacroDef m3 = compUnit.exportedMacros.get(1);
    assertThat(m3.legacy, is(false));
    assertThat(m3.body, is("($x:expr) => { $x }"));
    assertThat(m3.vis.kind, is(Ast.VisibilityKind.PUBLIC));

    final int index = requireNonNull(f.resolver.optDefIndex(6));
    assertThat(compUnit.nodeIdToCoreId.get(6), is(CoreId.of(index, 0)));
  }

  /** Tests that the path of a nested import spans its enclosing prefix, as
   * in {@code use a::{b};}. */
  @Test
  void testNestedUsePathPosition() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 11);
    final Pos treePos = new Pos("a.rs", 1, 5, 1, 11);
    final Pos aPos = new Pos("a.rs", 1, 5, 1, 6);
    final Pos bPos = new Pos("a.rs", 1, 9, 1, 10);
    final Ast.UseTree tree =
        ast.nestedUseTree(treePos, ast.path(aPos, "a"),
            ImmutableList.of(
                ast.simpleUseTree(bPos, ast.path(bPos, "b"), null, 11)),
            10);
    final Core.CompUnit compUnit =
        f.lower(
            ast.use(new Pos("a.rs", 1, 1, 1, 12), 10, ast.inherited(), tree));
    final Core.Use b = (Core.Use) requireNonNull(compUnit.items.get(11)).kind;
    assertThat(b.path.pos, is(treePos));
    assertThat(names(b.path), is(ImmutableList.of("a", "b")));
    final Core.Use stem =
        (Core.Use) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(stem.path.pos, is(treePos));
  }

  /** Tests that in-band regions come after the regions that the generics
   * declare, in order of first use: {@code fn f<'x>(a: &'b u8, b: &'a u8)}
   * has region parameters {@code 'x, 'b, 'a}. */
  @Test
  void testInBandRegionsFollowDeclaredRegions() {
    final Fixture f = new Fixture();
    Prop.IN_BAND_REGIONS.set(f.map, true);
    f.resolver.def(FN_ID);
    final Ast.Generics generics =
        ast.generics(POS,
            ImmutableList.of(
                ast.regionDef(ImmutableList.of(), ast.region(POS, 30, "'x"),
                    ImmutableList.of())),
            ImmutableList.of(), ast.whereClause(POS, 31, ImmutableList.of()));
    final Ast.Arg a =
        ast.arg(POS, 20, ast.identPat(POS, 21, "a"),
            ast.refTy(POS, 22, ast.region(POS, 23, "'b"), pathTy(24, "u8"),
                Ast.Mutability.IMMUTABLE));
    final Ast.Arg b =
        ast.arg(POS, 25, ast.identPat(POS, 26, "b"),
            ast.refTy(POS, 27, ast.region(POS, 28, "'a"), pathTy(29, "u8"),
                Ast.Mutability.IMMUTABLE));
    final Core.CompUnit compUnit =
        f.lower(
            fn(FN_ID, ast.fnDecl(ImmutableList.of(a, b), null, POS),
                generics));
    final List<Core.RegionDef> regions =
        fnItem(compUnit, FN_ID).generics.regions;
    assertThat(transformEager(regions, r -> r.region.name.name),
        is(ImmutableList.of("'x", "'b", "'a")));
    assertThat(transformEager(regions, r -> r.inBand),
        is(ImmutableList.of(false, true, true)));
    assertThat(f.resolver.createdCount(), is(2));
  }

  /** Tests a struct, a union and an enum. A field without a name is named
   * by its position. The discriminant of a variant is a body that belongs
   * to the enum. */
  @Test
  void testStructUnionEnum() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 20);
    final int enumIndex = f.resolver.def(30);
    final Ast.StructItem struct =
        ast.structItem(POS, 10, "S", ast.inherited(),
            ast.variantData(Ast.VariantKind.STRUCT,
                ImmutableList.of(
                    ast.structField(POS, 12, "x",
                        ast.visibility(POS, Ast.VisibilityKind.PUBLIC),
                        pathTy(13, "u8")),
                    ast.structField(POS, 14, "y", ast.inherited(),
                        pathTy(15, "u8"))),
                11),
            Ast.Generics.EMPTY);
    final Ast.UnionItem union =
        ast.unionItem(POS, 20, "U", ast.inherited(),
            ast.variantData(Ast.VariantKind.STRUCT,
                ImmutableList.of(
                    ast.structField(POS, 22, "f", ast.inherited(),
                        pathTy(23, "u8"))),
                21),
            Ast.Generics.EMPTY);
    final Ast.EnumItem enumItem =
        ast.enumItem(POS, 30, "E", ast.inherited(),
            ImmutableList.of(
                ast.variant(POS, "A",
                    ast.variantData(Ast.VariantKind.UNIT, ImmutableList.of(),
                        31),
                    ast.intLiteral(POS, 32, 1)),
                ast.variant(POS, "B",
                    ast.variantData(Ast.VariantKind.TUPLE,
                        ImmutableList.of(
                            ast.structField(POS, 34, null, ast.inherited(),
                                pathTy(35, "u8"))),
                        33),
                    null)),
            Ast.Generics.EMPTY);
    final Core.CompUnit compUnit = f.lower(struct, union, enumItem);
    assertThat(compUnit.module.itemIds, is(ImmutableList.of(10, 20, 30)));

    final Core.StructItem s =
        (Core.StructItem) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(s.data.kind, is(Ast.VariantKind.STRUCT));
    assertThat(s.data.id.nodeId, is(11));
    assertThat(transformEager(s.data.fields, field -> field.name),
        is(ImmutableList.of("x", "y")));
    assertThat(s.data.fields.get(0).vis.kind,
        is(Ast.VisibilityKind.PUBLIC));
    assertThat(s.data.fields.get(1).vis.kind,
        is(Ast.VisibilityKind.INHERITED));

    final Core.UnionItem u =
        (Core.UnionItem) requireNonNull(compUnit.items.get(20)).kind;
    assertThat(u.data.fields.get(0).name, is("f"));

    final Core.EnumItem e =
        (Core.EnumItem) requireNonNull(compUnit.items.get(30)).kind;
    assertThat(transformEager(e.variants, v -> v.name),
        is(ImmutableList.of("A", "B")));
    final Core.Variant b = e.variants.get(1);
    assertThat(b.disrBodyId, nullValue());
    assertThat(b.data.kind, is(Ast.VariantKind.TUPLE));
    assertThat(b.data.fields.get(0).name, is("0"));

    final int disrBodyId = requireNonNull(e.variants.get(0).disrBodyId);
    assertThat(disrBodyId, is(32));
    assertThat(compUnit.bodyIds, is(ImmutableList.of(32)));
    final Core.Body disr = requireNonNull(compUnit.bodies.get(disrBodyId));
    assertThat(disr.arguments, empty());
    assertThat(((Core.LitExp) disr.value.kind).literal,
        is(Literal.ofInt(1)));
    assertThat(disr.value.id.coreId.owner, is(enumIndex));
  }

  /** Tests static, const, module, type alias, extern crate, glob import,
   * auto impl and trait alias items. */
  @Test
  void testOtherItems() {
    final Fixture f = new Fixture();
    f.resolver.defs(10, 20, 30, 40, 50, 60, 70, 80);
    f.resolver.def(31, requireNonNull(f.resolver.optDefIndex(30)));
    final Def mod = Def.of(Def.Kind.MOD, DefId.of(2, 3));
    f.resolver.resolve(60, mod).resolve(71, TRAIT).resolve(81, TRAIT);
    final Core.CompUnit compUnit =
        f.lower(
            ast.staticItem(POS, 10, "S", ast.inherited(), pathTy(11, "u8"),
                Ast.Mutability.MUTABLE, ast.intLiteral(POS, 12, 1)),
            ast.constItem(POS, 20, "C", ast.inherited(), pathTy(21, "u8"),
                ast.litExp(POS, 22, Literal.ofBool(true))),
            ast.modItem(POS, 30, "m", ast.inherited(),
                ImmutableList.of(fn(31, noArgs(), Ast.Generics.EMPTY))),
            ast.tyAlias(POS, 40, "A", ast.inherited(),
                ast.tupTy(POS, 41, ImmutableList.of()), Ast.Generics.EMPTY),
            ast.externCrate(POS, 50, "core2", ast.inherited(), "core"),
            ast.use(POS, 60, ast.inherited(),
                ast.globUseTree(POS, ast.path(POS, "a"), 60)),
            ast.autoImpl(POS, 70, Ast.Unsafety.UNSAFE,
                ast.traitRef(ast.path(POS, "Tr"), 71)),
            ast.traitAlias(POS, 80, "TA", ast.inherited(),
                Ast.Generics.EMPTY,
                ImmutableList.of(
                    traitBound("Tr", 81, Ast.TraitBoundModifier.NONE))));
    assertThat(compUnit.module.itemIds,
        is(ImmutableList.of(10, 20, 30, 40, 50, 60, 70, 80)));

    final Core.StaticItem s =
        (Core.StaticItem) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(s.mutability, is(Ast.Mutability.MUTABLE));
    assertThat(s.bodyId, is(12));
    final Core.ConstItem c =
        (Core.ConstItem) requireNonNull(compUnit.items.get(20)).kind;
    final Core.Exp value = requireNonNull(compUnit.bodies.get(c.bodyId)).value;
    assertThat(((Core.LitExp) value.kind).literal, is(Literal.ofBool(true)));

    // An item in a module goes into the crate's item table
    final Core.ModItem m =
        (Core.ModItem) requireNonNull(compUnit.items.get(30)).kind;
    assertThat(m.module.itemIds, is(ImmutableList.of(31)));
    assertThat(compUnit.items.containsKey(31), is(true));

    final Core.TyAlias a =
        (Core.TyAlias) requireNonNull(compUnit.items.get(40)).kind;
    assertThat(a.ty.kind.op, is(Op.TUP_TY));
    final Core.Item externCrate = requireNonNull(compUnit.items.get(50));
    assertThat(externCrate.name, is("core2"));
    assertThat(((Core.ExternCrate) externCrate.kind).orig, is("core"));

    final Core.Use glob =
        (Core.Use) requireNonNull(compUnit.items.get(60)).kind;
    assertThat(glob.useKind, is(Core.UseKind.GLOB));
    assertThat(glob.path.def, is(mod));
    assertThat(names(glob.path), is(ImmutableList.of("a")));

    final Core.AutoImpl autoImpl =
        (Core.AutoImpl) requireNonNull(compUnit.items.get(70)).kind;
    assertThat(autoImpl.unsafety, is(Ast.Unsafety.UNSAFE));
    assertThat(compUnit.traitAutoImpl,
        is(ImmutableMap.of(TRAIT.defId(), 70)));
    final Core.TraitAlias traitAlias =
        (Core.TraitAlias) requireNonNull(compUnit.items.get(80)).kind;
    assertThat(traitAlias.bounds, hasSize(1));
  }

  /** Tests the items of an {@code extern} block. They belong to the block's
   * owner, and a foreign function has no body. */
  @Test
  void testForeignItems() {
    final Fixture f = new Fixture();
    final int modIndex = f.resolver.def(10);
    f.resolver.def(11, modIndex);
    f.resolver.def(12, modIndex);
    f.resolver.def(13, modIndex);
    final Ast.Arg arg =
        ast.arg(POS, 14, ast.identPat(POS, 15, "x"), pathTy(16, "u8"));
    final Ast.ForeignMod foreignMod =
        ast.foreignMod(POS, 10, "C",
            ImmutableList.of(
                ast.foreignFn(POS, 11, "g", ast.inherited(),
                    ast.fnDecl(ImmutableList.of(arg), pathTy(17, "u8"), POS),
                    Ast.Generics.EMPTY),
                ast.foreignStatic(POS, 12, "V",
                    ast.visibility(POS, Ast.VisibilityKind.PUBLIC),
                    pathTy(18, "u8"), Ast.Mutability.MUTABLE),
                ast.foreignType(POS, 13, "T", ast.inherited())));
    final Core.CompUnit compUnit = f.lower(foreignMod);
    assertThat(compUnit.items.keySet(), is(ImmutableSet.of(10)));
    assertThat(compUnit.bodies.size(), is(0));

    final Core.ForeignMod mod =
        (Core.ForeignMod) requireNonNull(compUnit.items.get(10)).kind;
    assertThat(mod.abi, is("C"));
    assertThat(transformEager(mod.items, i -> i.kind.op),
        is(
            ImmutableList.of(Op.FOREIGN_FN, Op.FOREIGN_STATIC,
                Op.FOREIGN_TYPE)));
    final Core.ForeignItem g = mod.items.get(0);
    assertThat(g.name, is("g"));
    assertThat(g.id.coreId.owner, is(modIndex));
    final Core.ForeignFn foreignFn = (Core.ForeignFn) g.kind;
    assertThat(foreignFn.argNames, is(ImmutableList.of("x")));
    assertThat(foreignFn.decl.inputs, hasSize(1));
    assertThat(requireNonNull(foreignFn.decl.output).kind.op,
        is(Op.PATH_TY));

    final Core.ForeignItem v = mod.items.get(1);
    assertThat(((Core.ForeignStatic) v.kind).mutable, is(true));
    assertThat(v.vis.kind, is(Ast.VisibilityKind.PUBLIC));
  }

  /** Tests that a restricted visibility, {@code pub(in a)}, on an impl item
   * gets its id from the impl item's owner, even though the impl lowers
   * its reference to the item first. */
  @Test
  void testRestrictedVisibilityOnImplItem() {
    final Fixture f = new Fixture();
    final int implIndex = f.resolver.def(10);
    final int constIndex = f.resolver.def(12, implIndex);
    f.resolver.def(17, implIndex);
    final Def mod = Def.of(Def.Kind.MOD, DefId.of(2, 3));
    f.resolver.resolve(11, STRUCT).resolve(13, mod);
    final Ast.Impl impl =
        ast.impl(POS, 10, Ast.Generics.EMPTY, null, pathTy(11, "S"),
            ImmutableList.of(
                ast.implConst(POS, 12, "C",
                    ast.restrictedVisibility(POS, ast.path(POS, "a"), 13),
                    pathTy(14, "u8"), ast.intLiteral(POS, 15, 0)),
                ast.implType(POS, 17, "T", ast.inherited(),
                    pathTy(18, "u8"))));
    final Core.CompUnit compUnit = f.lower(impl);
    final Core.Impl coreImpl =
        (Core.Impl) requireNonNull(compUnit.items.get(10)).kind;
    final Core.ImplItemRef constRef = coreImpl.itemRefs.get(0);
    assertThat(constRef.kind, is(Core.AssociatedItemKind.CONST));
    assertThat(constRef.vis.kind, is(Ast.VisibilityKind.RESTRICTED));
    final Core.Path visPath = requireNonNull(constRef.vis.path);
    assertThat(names(visPath), is(ImmutableList.of("a")));
    assertThat(visPath.def, is(mod));
    final LoweredId visId = requireNonNull(constRef.vis.id);
    assertThat(visId.coreId, is(CoreId.of(constIndex, 1)));
    assertThat(coreImpl.itemRefs.get(1).kind,
        is(Core.AssociatedItemKind.TYPE));

    // The impl item's own visibility has the same id
    final Core.ImplItem c = requireNonNull(compUnit.implItems.get(12));
    assertThat(requireNonNull(c.vis.id), is(visId));
    final Core.ImplConst implConst = (Core.ImplConst) c.kind;
    assertThat(implConst.bodyId, is(15));
    assertThat(
        requireNonNull(compUnit.bodies.get(15)).value.id.coreId.owner,
        is(constIndex));
    final Core.ImplType t =
        (Core.ImplType) requireNonNull(compUnit.implItems.get(17)).kind;
    assertThat(t.ty.kind.op, is(Op.PATH_TY));
  }

  /** Tests that a trait object type drops {@code ?Trait} bounds and keeps
   * only the first region bound: {@code dyn Tr + ?Sized + 'a + 'b} becomes
   * {@code dyn Tr + 'a}. */
  @Test
  void testTraitObjectTy() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(14, TRAIT)
        .resolve(15, Def.of(Def.Kind.TRAIT, DefId.of(1, 7)));
    final Ast.TraitObjectTy ty =
        ast.traitObjectTy(POS, 13,
            ImmutableList.of(
                traitBound("Tr", 14, Ast.TraitBoundModifier.NONE),
                traitBound("Sized", 15, Ast.TraitBoundModifier.MAYBE),
                ast.regionBound(ast.region(POS, 16, "'a")),
                ast.regionBound(ast.region(POS, 17, "'b"))));
    final Core.CompUnit compUnit = f.lower(fn(let(10, ty)));
    final Core.TraitObjectTy traitObjectTy =
        (Core.TraitObjectTy) letTy(compUnit, 0).kind;
    assertThat(traitObjectTy.bounds, hasSize(1));
    assertThat(names(traitObjectTy.bounds.get(0).traitRef.path),
        is(ImmutableList.of("Tr")));
    assertThat(traitObjectTy.region.name, is(Core.RegionName.of("'a")));
    assertThat(compUnit.nodeIdToCoreId.get(17), is(CoreId.DUMMY));
    assertThat(f.errors(), empty());
  }

  /** Tests {@code for<'a> fn(&'a u8) -> u8}. The region that it binds is
   * never an in-band region of the enclosing function. */
  @Test
  void testBareFnTy() {
    final Ast.Arg arg =
        ast.arg(POS, 14, ast.identPat(POS, 15, "x"),
            ast.refTy(POS, 16, ast.region(POS, 17, "'a"), pathTy(18, "u8"),
                Ast.Mutability.IMMUTABLE));
    final Ast.BareFnTy ty =
        ast.bareFnTy(POS, 13,
            ImmutableList.of(
                ast.regionDef(ImmutableList.of(), ast.region(POS, 19, "'a"),
                    ImmutableList.of())),
            ast.fnDecl(ImmutableList.of(arg), pathTy(20, "u8"), POS));

    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Core.CompUnit compUnit = f.lower(fn(let(10, ty)));
    final Core.BareFnTy bareFnTy = (Core.BareFnTy) letTy(compUnit, 0).kind;
    assertThat(bareFnTy.abi, is("Rust"));
    assertThat(bareFnTy.regions, hasSize(1));
    assertThat(bareFnTy.regions.get(0).inBand, is(false));
    assertThat(bareFnTy.argNames, is(ImmutableList.of("x")));
    assertThat(bareFnTy.decl.inputs, hasSize(1));
    final Core.RefTy input = (Core.RefTy) bareFnTy.decl.inputs.get(0).kind;
    assertThat(input.region.name, is(Core.RegionName.of("'a")));
    assertThat(requireNonNull(bareFnTy.decl.output).kind.op,
        is(Op.PATH_TY));

    final Fixture f2 = new Fixture();
    Prop.IN_BAND_REGIONS.set(f2.map, true);
    f2.resolver.def(FN_ID);
    final Ast.Arg g = ast.arg(POS, 30, ast.identPat(POS, 31, "g"), ty);
    final Core.CompUnit compUnit2 =
        f2.lower(
            fn(FN_ID, ast.fnDecl(ImmutableList.of(g), null, POS),
                Ast.Generics.EMPTY));
    assertThat(fnItem(compUnit2, FN_ID).generics.regions, empty());
    assertThat(f2.resolver.createdCount(), is(0));
  }

  /** Tests pointer, slice, array, tuple, never, inferred, error, typeof and
   * qualified types, and that a parenthesized type becomes the type it
   * contains. */
  @Test
  void testTypes() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(63, Def.ERR, 1);
    final Core.CompUnit compUnit =
        f.lower(
            fn(
                let(10,
                    ast.ptrTy(POS, 13, pathTy(14, "u8"),
                        Ast.Mutability.IMMUTABLE)),
                let(15, ast.sliceTy(POS, 18, pathTy(19, "u8"))),
                let(20,
                    ast.arrayTy(POS, 23, pathTy(24, "u8"),
                        ast.intLiteral(POS, 25, 4))),
                let(30,
                    ast.tupTy(POS, 33,
                        ImmutableList.of(ast.neverTy(POS, 34),
                            ast.inferTy(POS, 35), ast.errTy(POS, 36)))),
                let(40, ast.parenTy(POS, 43, pathTy(44, "u8"))),
                let(50, ast.typeofTy(POS, 53, ast.intLiteral(POS, 54, 1))),
                let(60,
                    ast.pathTy(POS, 63, ast.qself(pathTy(64, "S"), 0),
                        ast.path(POS, "A")))));
    final Core.PtrTy ptrTy = (Core.PtrTy) letTy(compUnit, 0).kind;
    assertThat(ptrTy.mutability, is(Ast.Mutability.IMMUTABLE));
    assertThat(ptrTy.ty.kind.op, is(Op.PATH_TY));
    assertThat(letTy(compUnit, 1).kind.op, is(Op.SLICE_TY));

    final Core.ArrayTy arrayTy = (Core.ArrayTy) letTy(compUnit, 2).kind;
    assertThat(arrayTy.lengthBodyId, is(25));
    assertThat(compUnit.bodies.containsKey(25), is(true));

    final Core.TupTy tupTy = (Core.TupTy) letTy(compUnit, 3).kind;
    assertThat(transformEager(tupTy.types, t -> t.kind.op),
        is(ImmutableList.of(Op.NEVER_TY, Op.INFER_TY, Op.ERR_TY)));

    final Core.Ty parenTy = letTy(compUnit, 4);
    assertThat(parenTy.id.nodeId, is(44));
    assertThat(compUnit.nodeIdToCoreId.get(43), is(CoreId.DUMMY));

    final Core.TypeofTy typeofTy = (Core.TypeofTy) letTy(compUnit, 5).kind;
    assertThat(typeofTy.bodyId, is(54));

    // "<S>::A" projects from the qualified self type
    final Core.QPath qpath = ((Core.PathTy) letTy(compUnit, 6).kind).qpath;
    final Core.TypeRelativeQPath relative = (Core.TypeRelativeQPath) qpath;
    assertThat(relative.segment.name, is("A"));
    assertThat(relative.base.id.nodeId, is(64));
    assertThat(f.errors(), empty());
    assertThat(f.warnings(), empty());
  }

  /** Tests region and equality predicates, and a type binding, in
   * {@code fn f<'a, 'b, T>() where 'a: 'b, T == Iterator<Item = u8>}. */
  @Test
  void testWherePredicates() {
    final Fixture f = new Fixture();
    final int fnIndex = f.resolver.def(FN_ID);
    f.resolver.def(32, fnIndex);
    final Ast.PathSegment iterator =
        ast.pathSegment(POS, "Iterator",
            ast.angleBracketed(POS, ImmutableList.of(), ImmutableList.of(),
                ImmutableList.of(
                    ast.typeBinding(POS, 39, "Item", pathTy(40, "u8")))));
    final Ast.Generics generics =
        ast.generics(POS,
            ImmutableList.of(
                ast.regionDef(ImmutableList.of(), ast.region(POS, 30, "'a"),
                    ImmutableList.of()),
                ast.regionDef(ImmutableList.of(), ast.region(POS, 31, "'b"),
                    ImmutableList.of())),
            ImmutableList.of(
                ast.tyParam(POS, 32, "T", ImmutableList.of(), null)),
            ast.whereClause(POS, 33,
                ImmutableList.of(
                    ast.regionPredicate(POS, ast.region(POS, 34, "'a"),
                        ImmutableList.of(ast.region(POS, 35, "'b"))),
                    ast.eqPredicate(POS, 36, pathTy(37, "T"),
                        ast.pathTy(POS, 38, null,
                            ast.path(POS, ImmutableList.of(iterator)))))));
    final Core.CompUnit compUnit = f.lower(fn(FN_ID, noArgs(), generics));
    final Core.WhereClause whereClause =
        fnItem(compUnit, FN_ID).generics.whereClause;
    assertThat(whereClause.id.nodeId, is(33));
    final Core.RegionPredicate regionPredicate =
        (Core.RegionPredicate) whereClause.predicates.get(0);
    assertThat(regionPredicate.region.name, is(Core.RegionName.of("'a")));
    assertThat(regionPredicate.bounds.get(0).name,
        is(Core.RegionName.of("'b")));

    final Core.EqPredicate eqPredicate =
        (Core.EqPredicate) whereClause.predicates.get(1);
    assertThat(eqPredicate.id.nodeId, is(36));
    assertThat(names(path(eqPredicate.lhs)), is(ImmutableList.of("T")));
    final Core.PathParameters parameters =
        requireNonNull(path(eqPredicate.rhs).segments.get(0).parameters);
    final Core.TypeBinding binding = parameters.bindings.get(0);
    assertThat(binding.name, is("Item"));
    assertThat(binding.id.nodeId, is(39));
    assertThat(binding.ty.kind.op, is(Op.PATH_TY));
  }

  /** Tests that each kind of pattern becomes the corresponding core
   * pattern, in the arms of a {@code match}. */
  @Test
  void testPatterns() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    final Def some = Def.of(Def.Kind.VARIANT_CTOR, DefId.of(1, 3));
    f.resolver.resolve(21, some)
        .resolve(31, STRUCT)
        .resolve(41, Def.of(Def.Kind.CONST, DefId.of(1, 4)));
    final List<Ast.Pat> pats =
        ImmutableList.of(ast.wildPat(POS, 10),
            ast.tuplePat(POS, 11,
                ImmutableList.of(ast.identPat(POS, 12, "a"),
                    ast.wildPat(POS, 13)),
                1),
            ast.tupleStructPat(POS, 21, ast.path(POS, "Some"),
                ImmutableList.of(ast.identPat(POS, 22, "b")), -1),
            ast.structPat(POS, 31, ast.path(POS, "S"),
                ImmutableList.of(
                    ast.fieldPat(POS, "f", ast.identPat(POS, 32, "f"), true)),
                true),
            ast.pathPat(POS, 41, null, ast.path(POS, "MAX")),
            ast.boxPat(POS, 51, ast.identPat(POS, 52, "c")),
            ast.refPat(POS, 53,
                ast.identPat(POS, 54, Ast.BindingMode.BY_REF_MUT, "d", null),
                Ast.Mutability.MUTABLE),
            ast.litPat(POS, 55, ast.intLiteral(POS, 56, 1)),
            ast.rangePat(POS, 57, ast.intLiteral(POS, 58, 1),
                ast.intLiteral(POS, 59, 9), Ast.RangeEnd.INCLUDED),
            ast.slicePat(POS, 60,
                ImmutableList.of(ast.identPat(POS, 61, "e")),
                ast.wildPat(POS, 62),
                ImmutableList.of(ast.identPat(POS, 63, "g"))));
    final List<Ast.Arm> arms = new ArrayList<>();
    for (int i = 0; i < pats.size(); i++) {
      final Ast.@Nullable Exp guard =
          i == 0 ? ast.litExp(POS, 250, Literal.ofBool(true)) : null;
      arms.add(
          ast.arm(ImmutableList.of(pats.get(i)), guard,
              ast.intLiteral(POS, 200 + i, i)));
    }
    final Ast.Match match = ast.match(POS, 8, ast.id(POS, 9, "x"), arms);
    final Core.CompUnit compUnit = f.lower(fn(ast.exprStmt(POS, 7, match)));

    final Core.Match coreMatch =
        (Core.Match) requireNonNull(block(compUnit).expr).kind;
    assertThat(coreMatch.source, is(Core.MatchSource.NORMAL));
    assertThat(requireNonNull(coreMatch.arms.get(0).guard).kind.op,
        is(Op.LIT));
    assertThat(coreMatch.arms.get(1).guard, nullValue());
    final List<Core.Pat> lowered =
        transformEager(coreMatch.arms, arm -> arm.pats.get(0));
    assertThat(transformEager(lowered, p -> p.kind.op),
        is(
            ImmutableList.of(Op.WILD_PAT, Op.TUPLE_PAT, Op.TUPLE_STRUCT_PAT,
                Op.STRUCT_PAT, Op.PATH_PAT, Op.BOX_PAT, Op.REF_PAT,
                Op.LIT_PAT, Op.RANGE_PAT, Op.SLICE_PAT)));
    assertThat(transformEager(lowered, p -> p.id.nodeId),
        is(ImmutableList.of(10, 11, 21, 31, 41, 51, 53, 55, 57, 60)));

    final Core.TuplePat tuplePat = (Core.TuplePat) lowered.get(1).kind;
    assertThat(tuplePat.ddpos, is(1));
    final Core.BindingPat a = (Core.BindingPat) tuplePat.pats.get(0).kind;
    assertThat(a.name, is("a"));
    assertThat(a.canonicalId, is(12));
    assertThat(a.annotation, is(Core.BindingAnnotation.UNANNOTATED));

    final Core.TupleStructPat tupleStructPat =
        (Core.TupleStructPat) lowered.get(2).kind;
    assertThat(((Core.ResolvedQPath) tupleStructPat.qpath).path.def,
        is(some));
    assertThat(tupleStructPat.ddpos, is(-1));

    final Core.StructPat structPat = (Core.StructPat) lowered.get(3).kind;
    assertThat(structPat.hasRest, is(true));
    assertThat(structPat.fields.get(0).name, is("f"));
    assertThat(structPat.fields.get(0).shorthand, is(true));

    final Core.RefPat refPat = (Core.RefPat) lowered.get(6).kind;
    assertThat(refPat.mutability, is(Ast.Mutability.MUTABLE));
    assertThat(((Core.BindingPat) refPat.pat.kind).annotation,
        is(Core.BindingAnnotation.REF_MUT));

    final Core.RangePat rangePat = (Core.RangePat) lowered.get(8).kind;
    assertThat(rangePat.end, is(Ast.RangeEnd.INCLUDED));
    assertThat(((Core.LitExp) rangePat.hi.kind).literal,
        is(Literal.ofInt(9)));

    final Core.SlicePat slicePat = (Core.SlicePat) lowered.get(9).kind;
    assertThat(slicePat.before, hasSize(1));
    assertThat(requireNonNull(slicePat.slice).kind.op, is(Op.WILD_PAT));
    assertThat(slicePat.after, hasSize(1));
  }

  private static Ast.PathExp x(int id) {
    return ast.id(POS, id, "x");
  }

  private static Ast.LitExp one(int id) {
    return ast.intLiteral(POS, id, 1);
  }

  private static Ast.SemiStmt semi(int id, Ast.Exp exp) {
    return ast.semiStmt(POS, id, exp);
  }

  /** Tests expressions that become core expressions of the same kind, and
   * keep their ids. */
  @Test
  void testExpressions() {
    final Fixture f = new Fixture();
    f.resolver.def(FN_ID);
    f.resolver.resolve(160, STRUCT);
    final Ast.If anIf =
        ast.if_(POS, 171, x(172), ast.block(POS, 173, ImmutableList.of()),
            one(174));
    final Core.CompUnit compUnit =
        f.lower(
            fn(semi(100, ast.binary(POS, 101, Ast.BinOpKind.ADD, x(102),
                    one(103))),
                semi(104, ast.unary(POS, 105, Ast.UnOp.NEG, x(106))),
                semi(107, ast.cast(POS, 108, x(109), pathTy(110, "u16"))),
                semi(111,
                    ast.typeAscription(POS, 112, x(113), pathTy(114, "u8"))),
                semi(115, ast.assign(POS, 116, x(117), one(118))),
                semi(119,
                    ast.assignOp(POS, 120, Ast.BinOpKind.MUL, x(121),
                        one(122))),
                semi(123, ast.fieldAccess(POS, 124, x(125), "f")),
                semi(126, ast.tupField(POS, 127, x(128), 0)),
                semi(129, ast.index(POS, 130, x(131), one(132))),
                semi(133,
                    ast.addrOf(POS, 134, Ast.Mutability.MUTABLE, x(135))),
                semi(136,
                    ast.methodCall(POS, 137, ast.pathSegment(POS, "len", null),
                        ImmutableList.of(x(138)))),
                semi(139, ast.box(POS, 140, x(141))),
                semi(142,
                    ast.array(POS, 143, ImmutableList.of(one(144), one(145)))),
                semi(146, ast.repeat(POS, 147, one(148), one(149))),
                semi(150, ast.ret(POS, 151, x(152))),
                semi(159,
                    ast.structExp(POS, 160, ast.path(POS, "S"),
                        ImmutableList.of(ast.field(POS, "f", one(161), false)),
                        x(162))),
                ast.exprStmt(POS, 170, anIf)));
    final Core.Block block = block(compUnit);
    final List<Core.Exp> exps =
        transformEager(block.stmts, s -> ((Core.SemiStmt) s).exp);
    assertThat(transformEager(exps, e -> e.kind.op),
        is(
            ImmutableList.of(Op.BINARY, Op.UNARY, Op.CAST,
                Op.TYPE_ASCRIPTION, Op.ASSIGN, Op.ASSIGN_OP, Op.FIELD_ACCESS,
                Op.TUP_FIELD, Op.INDEX, Op.ADDR_OF, Op.METHOD_CALL, Op.BOX,
                Op.ARRAY, Op.REPEAT, Op.RET, Op.STRUCT_EXP)));
    assertThat(transformEager(exps, e -> e.id.nodeId),
        is(
            ImmutableList.of(101, 105, 108, 112, 116, 120, 124, 127, 130,
                134, 137, 140, 143, 147, 151, 160)));

    final Core.Binary binary = (Core.Binary) exps.get(0).kind;
    assertThat(binary.binOp, is(Ast.BinOpKind.ADD));
    assertThat(binary.left.kind.op, is(Op.PATH_EXP));
    assertThat(binary.right.kind.op, is(Op.LIT));

    final Core.MethodCall methodCall = (Core.MethodCall) exps.get(10).kind;
    assertThat(methodCall.segment.name, is("len"));
    assertThat(methodCall.segment.inferTypes, is(true));
    assertThat(methodCall.args, hasSize(1));

    // The count of a repeat expression is a body of its own
    final Core.Repeat repeat = (Core.Repeat) exps.get(13).kind;
    assertThat(repeat.countBodyId, is(149));
    assertThat(compUnit.bodies.containsKey(149), is(true));

    final Core.StructExp structExp = (Core.StructExp) exps.get(15).kind;
    assertThat(((Core.ResolvedQPath) structExp.qpath).path.def, is(STRUCT));
    assertThat(structExp.fields.get(0).name, is("f"));
    assertThat(requireNonNull(structExp.base).id.nodeId, is(162));

    final Core.If coreIf = (Core.If) requireNonNull(block.expr).kind;
    assertThat(coreIf.condition.id.nodeId, is(172));
    assertThat(coreIf.ifTrue.kind.op, is(Op.BLOCK_EXP));
    assertThat(requireNonNull(coreIf.ifFalse).kind.op, is(Op.LIT));
  }

  /** Tests that macros that were not expanded in statements, types,
   * patterns, traits and impls are internal errors. */
  @Test
  void testUnexpandedMacrosInOtherPositions() {
    checkUnexpanded("statement",
        fn(ast.macStmt(POS, 10, ast.path(POS, "m"))));
    checkUnexpanded("type",
        fn(let(10, ast.macTy(POS, 13, ast.path(POS, "m")))));
    checkUnexpanded("pattern",
        fn(
            ast.localStmt(POS, 10,
                ast.local(POS, 11, ast.macPat(POS, 12, ast.path(POS, "m")),
                    null, null))));
    checkUnexpanded("trait item",
        ast.trait(POS, 5, "Tr", ast.inherited(), Ast.IsAuto.NO,
            Ast.Generics.EMPTY, ImmutableList.of(),
            ImmutableList.of(ast.traitMac(POS, 20, ast.path(POS, "m")))));
    checkUnexpanded("impl item",
        ast.impl(POS, 5, Ast.Generics.EMPTY, null, pathTy(19, "S"),
            ImmutableList.of(ast.implMac(POS, 20, ast.path(POS, "m")))));
  }

  private static void checkUnexpanded(String kind, Ast.Item item) {
    final Fixture f = new Fixture();
    f.resolver.def(20, f.resolver.def(item.id));
    final AssertionError e =
        assertThrows(AssertionError.class, () -> f.lower(item));
    assertThat(e.getMessage(),
        startsWith(kind + " macro should have been expanded"));
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final MapResolver resolver = new MapResolver();
    final Map<Prop, Object> map = new LinkedHashMap<>();
    @Nullable Session session;

    Core.CompUnit lower(Ast.Item... items) {
      session = new Session(map, 1000);
      final Lowerer lowerer = new Lowerer(session, resolver);
      return lowerer.lowerCrate(
          ast.crate(POS, ImmutableList.copyOf(items), ImmutableList.of()));
    }

    List<CompileException> errors() {
      return requireNonNull(session).errors();
    }

    List<CompileException> warnings() {
      return requireNonNull(session).warnings();
    }
  }
}

// End LowererTest.java
