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
package net.hydromatic.lowering.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds core tree nodes. */
public enum CoreBuilder {
  /** The singleton instance of the CORE builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.InferTy inferTy = new Core.InferTy();

  private final Core.ErrTy errTy = new Core.ErrTy();

  private final Core.NeverTy neverTy = new Core.NeverTy();

  private final Core.WildPat wildPat = new Core.WildPat();

  // crate structure

  /** Creates a compilation unit. */
  public Core.CompUnit compUnit(Core.Module module, List<Attribute> attrs,
      Pos pos, Map<Integer, Core.Item> items,
      Map<Integer, Core.TraitItem> traitItems,
      Map<Integer, Core.ImplItem> implItems,
      Map<Integer, Core.Body> bodies, List<Integer> bodyIds,
      Map<DefId, ? extends List<Integer>> traitImpls,
      Map<DefId, Integer> traitAutoImpl, List<CoreId> nodeIdToCoreId,
      List<Core.MacroDef> exportedMacros) {
    final ImmutableMap.Builder<DefId, ImmutableList<Integer>> impls =
        ImmutableMap.builder();
    traitImpls.forEach((defId, ids) ->
        impls.put(defId, ImmutableList.copyOf(ids)));
    return new Core.CompUnit(module, ImmutableList.copyOf(attrs), pos,
        ImmutableSortedMap.copyOf(items),
        ImmutableSortedMap.copyOf(traitItems),
        ImmutableSortedMap.copyOf(implItems),
        ImmutableSortedMap.copyOf(bodies), ImmutableList.copyOf(bodyIds),
        impls.build(), ImmutableMap.copyOf(traitAutoImpl),
        ImmutableList.copyOf(nodeIdToCoreId),
        ImmutableList.copyOf(exportedMacros));
  }

  /** Creates a module. */
  public Core.Module module(Pos inner, List<Integer> itemIds) {
    return new Core.Module(inner, ImmutableList.copyOf(itemIds));
  }

  /** Creates a visibility. */
  public Core.Visibility visibility(Ast.VisibilityKind kind) {
    switch (kind) {
      case PUBLIC:
        return Core.Visibility.PUBLIC;
      case CRATE:
        return Core.Visibility.CRATE;
      case INHERITED:
        return Core.Visibility.INHERITED;
      default:
        throw new IllegalArgumentException("restricted visibility needs a "
            + "path");
    }
  }

  /** Creates a restricted visibility, {@code pub(in PATH)}. */
  public Core.Visibility restrictedVisibility(Core.Path path, LoweredId id) {
    return new Core.Visibility(Ast.VisibilityKind.RESTRICTED, path, id);
  }

  /** Creates a body. */
  public Core.Body body(List<Core.Arg> arguments, Core.Exp value,
      boolean isGenerator) {
    return new Core.Body(ImmutableList.copyOf(arguments), value,
        isGenerator);
  }

  /** Creates an argument of a body. */
  public Core.Arg arg(LoweredId id, Core.Pat pat) {
    return new Core.Arg(id, pat);
  }

  // items

  /** Creates an item. */
  public Core.Item item(LoweredId id, String name, List<Attribute> attrs,
      Core.ItemKind kind, Core.Visibility vis, Pos pos) {
    return new Core.Item(id, name, ImmutableList.copyOf(attrs), kind, vis,
        pos);
  }

  /** Creates an exported macro definition. */
  public Core.MacroDef macroDef(String name, Core.Visibility vis,
      List<Attribute> attrs, int nodeId, Pos pos, String body,
      boolean legacy) {
    return new Core.MacroDef(name, vis, ImmutableList.copyOf(attrs), nodeId,
        pos, body, legacy);
  }

  public Core.ExternCrate externCrate(@Nullable String orig) {
    return new Core.ExternCrate(orig);
  }

  public Core.Use use(Core.Path path, Core.UseKind useKind) {
    return new Core.Use(path, useKind);
  }

  public Core.StaticItem staticItem(Core.Ty ty, Ast.Mutability mutability,
      int bodyId) {
    return new Core.StaticItem(ty, mutability, bodyId);
  }

  public Core.ConstItem constItem(Core.Ty ty, int bodyId) {
    return new Core.ConstItem(ty, bodyId);
  }

  public Core.FnItem fnItem(Core.FnDecl decl, Ast.Unsafety unsafety,
      Ast.Constness constness, String abi, Core.Generics generics,
      int bodyId) {
    return new Core.FnItem(decl, unsafety, constness, abi, generics,
        bodyId);
  }

  public Core.ModItem modItem(Core.Module module) {
    return new Core.ModItem(module);
  }

  public Core.ForeignMod foreignMod(String abi,
      List<Core.ForeignItem> items) {
    return new Core.ForeignMod(abi, ImmutableList.copyOf(items));
  }

  public Core.TyAlias tyAlias(Core.Ty ty, Core.Generics generics) {
    return new Core.TyAlias(ty, generics);
  }

  public Core.EnumItem enumItem(List<Core.Variant> variants,
      Core.Generics generics) {
    return new Core.EnumItem(ImmutableList.copyOf(variants), generics);
  }

  public Core.StructItem structItem(Core.VariantData data,
      Core.Generics generics) {
    return new Core.StructItem(data, generics);
  }

  public Core.UnionItem unionItem(Core.VariantData data,
      Core.Generics generics) {
    return new Core.UnionItem(data, generics);
  }

  public Core.AutoImpl autoImpl(Ast.Unsafety unsafety,
      Core.TraitRef traitRef) {
    return new Core.AutoImpl(unsafety, traitRef);
  }

  public Core.Impl impl(Ast.Unsafety unsafety, Ast.ImplPolarity polarity,
      Ast.Defaultness defaultness, Core.Generics generics,
      Core.@Nullable TraitRef traitRef, Core.Ty selfTy,
      List<Core.ImplItemRef> itemRefs) {
    return new Core.Impl(unsafety, polarity, defaultness, generics,
        traitRef, selfTy, ImmutableList.copyOf(itemRefs));
  }

  public Core.Trait trait(Ast.IsAuto isAuto, Ast.Unsafety unsafety,
      Core.Generics generics, List<Core.Bound> bounds,
      List<Core.TraitItemRef> itemRefs) {
    return new Core.Trait(isAuto, unsafety, generics,
        ImmutableList.copyOf(bounds), ImmutableList.copyOf(itemRefs));
  }

  public Core.TraitAlias traitAlias(Core.Generics generics,
      List<Core.Bound> bounds) {
    return new Core.TraitAlias(generics, ImmutableList.copyOf(bounds));
  }

  public Core.Variant variant(Pos pos, String name, List<Attribute> attrs,
      Core.VariantData data, @Nullable Integer disrBodyId) {
    return new Core.Variant(pos, name, ImmutableList.copyOf(attrs), data,
        disrBodyId);
  }

  public Core.VariantData variantData(Ast.VariantKind kind,
      List<Core.StructField> fields, LoweredId id) {
    return new Core.VariantData(kind, ImmutableList.copyOf(fields), id);
  }

  public Core.StructField structField(Pos pos, LoweredId id, String name,
      Core.Visibility vis, Core.Ty ty, List<Attribute> attrs) {
    return new Core.StructField(pos, id, name, vis, ty,
        ImmutableList.copyOf(attrs));
  }

  // associated and foreign items

  public Core.TraitItem traitItem(LoweredId id, String name,
      List<Attribute> attrs, Core.Generics generics,
      Core.TraitItemKind kind, Pos pos) {
    return new Core.TraitItem(id, name, ImmutableList.copyOf(attrs),
        generics, kind, pos);
  }

  public Core.TraitConst traitConst(Core.Ty ty,
      @Nullable Integer defaultBodyId) {
    return new Core.TraitConst(ty, defaultBodyId);
  }

  public Core.TraitMethod traitMethod(Core.MethodSig sig,
      List<String> argNames, @Nullable Integer bodyId) {
    return new Core.TraitMethod(sig, ImmutableList.copyOf(argNames),
        bodyId);
  }

  public Core.TraitType traitType(List<Core.Bound> bounds,
      Core.@Nullable Ty defaultTy) {
    return new Core.TraitType(ImmutableList.copyOf(bounds), defaultTy);
  }

  public Core.TraitItemRef traitItemRef(int itemId, String name,
      Core.AssociatedItemKind kind, boolean hasSelf,
      Ast.Defaultness defaultness, boolean hasValue, Pos pos) {
    return new Core.TraitItemRef(itemId, name, kind, hasSelf, defaultness,
        hasValue, pos);
  }

  public Core.ImplItem implItem(LoweredId id, String name,
      Core.Visibility vis, Ast.Defaultness defaultness,
      List<Attribute> attrs, Core.Generics generics,
      Core.ImplItemKind kind, Pos pos) {
    return new Core.ImplItem(id, name, vis, defaultness,
        ImmutableList.copyOf(attrs), generics, kind, pos);
  }

  public Core.ImplConst implConst(Core.Ty ty, int bodyId) {
    return new Core.ImplConst(ty, bodyId);
  }

  public Core.ImplMethod implMethod(Core.MethodSig sig, int bodyId) {
    return new Core.ImplMethod(sig, bodyId);
  }

  public Core.ImplType implType(Core.Ty ty) {
    return new Core.ImplType(ty);
  }

  public Core.ImplItemRef implItemRef(int itemId, String name,
      Core.AssociatedItemKind kind, boolean hasSelf, Core.Visibility vis,
      Ast.Defaultness defaultness, Pos pos) {
    return new Core.ImplItemRef(itemId, name, kind, hasSelf, vis,
        defaultness, pos);
  }

  public Core.ForeignItem foreignItem(LoweredId id, String name,
      List<Attribute> attrs, Core.ForeignItemKind kind,
      Core.Visibility vis, Pos pos) {
    return new Core.ForeignItem(id, name, ImmutableList.copyOf(attrs), kind,
        vis, pos);
  }

  public Core.ForeignFn foreignFn(Core.FnDecl decl, List<String> argNames,
      Core.Generics generics) {
    return new Core.ForeignFn(decl, ImmutableList.copyOf(argNames),
        generics);
  }

  public Core.ForeignStatic foreignStatic(Core.Ty ty, boolean mutable) {
    return new Core.ForeignStatic(ty, mutable);
  }

  public Core.ForeignType foreignType() {
    return new Core.ForeignType();
  }

  public Core.MethodSig methodSig(Ast.Unsafety unsafety,
      Ast.Constness constness, String abi, Core.FnDecl decl) {
    return new Core.MethodSig(unsafety, constness, abi, decl);
  }

  // generics

  /** Creates generics. */
  public Core.Generics generics(List<Core.RegionDef> regions,
      List<Core.TyParam> tyParams, Core.WhereClause whereClause, Pos pos) {
    return new Core.Generics(ImmutableList.copyOf(regions),
        ImmutableList.copyOf(tyParams), whereClause, pos);
  }

  /** Creates a region reference. */
  public Core.Region region(LoweredId id, Pos pos, Core.RegionName name) {
    return new Core.Region(id, pos, name);
  }

  /** Creates a region parameter definition. */
  public Core.RegionDef regionDef(Core.Region region,
      List<Core.Region> bounds, boolean pureWrtDrop, boolean inBand) {
    return new Core.RegionDef(region, ImmutableList.copyOf(bounds),
        pureWrtDrop, inBand);
  }

  /** Creates a type parameter. */
  public Core.TyParam tyParam(LoweredId id, String name,
      List<Core.Bound> bounds, Core.@Nullable Ty defaultTy, Pos pos,
      boolean pureWrtDrop, boolean synthetic, List<Attribute> attrs) {
    return new Core.TyParam(id, name, ImmutableList.copyOf(bounds),
        defaultTy, pos, pureWrtDrop, synthetic, ImmutableList.copyOf(attrs));
  }

  public Core.WhereClause whereClause(LoweredId id,
      List<Core.WherePredicate> predicates) {
    return new Core.WhereClause(id, ImmutableList.copyOf(predicates));
  }

  public Core.BoundPredicate boundPredicate(Pos pos,
      List<Core.RegionDef> boundRegions, Core.Ty boundedTy,
      List<Core.Bound> bounds) {
    return new Core.BoundPredicate(pos, ImmutableList.copyOf(boundRegions),
        boundedTy, ImmutableList.copyOf(bounds));
  }

  public Core.RegionPredicate regionPredicate(Pos pos, Core.Region region,
      List<Core.Region> bounds) {
    return new Core.RegionPredicate(pos, region,
        ImmutableList.copyOf(bounds));
  }

  public Core.EqPredicate eqPredicate(LoweredId id, Pos pos, Core.Ty lhs,
      Core.Ty rhs) {
    return new Core.EqPredicate(id, pos, lhs, rhs);
  }

  public Core.TraitBound traitBound(Core.PolyTraitRef traitRef,
      Ast.TraitBoundModifier modifier) {
    return new Core.TraitBound(traitRef, modifier);
  }

  public Core.RegionBound regionBound(Core.Region region) {
    return new Core.RegionBound(region);
  }

  public Core.PolyTraitRef polyTraitRef(List<Core.RegionDef> boundRegions,
      Core.TraitRef traitRef, Pos pos) {
    return new Core.PolyTraitRef(ImmutableList.copyOf(boundRegions),
        traitRef, pos);
  }

  public Core.TraitRef traitRef(Core.Path path, LoweredId refId) {
    return new Core.TraitRef(path, refId);
  }

  // paths

  /** Creates a path. */
  public Core.Path path(Pos pos, Def def, List<Core.PathSegment> segments) {
    return new Core.Path(pos, def, ImmutableList.copyOf(segments));
  }

  /** Creates a path segment. */
  public Core.PathSegment pathSegment(String name,
      Core.@Nullable PathParameters parameters, boolean inferTypes) {
    return new Core.PathSegment(name, parameters, inferTypes);
  }

  /** Creates a path segment with no parameters whose type arguments are
   * inferred. */
  public Core.PathSegment pathSegment(String name) {
    return new Core.PathSegment(name, null, true);
  }

  public Core.PathParameters pathParameters(List<Core.Region> regions,
      List<Core.Ty> types, List<Core.TypeBinding> bindings,
      boolean parenthesized) {
    return new Core.PathParameters(ImmutableList.copyOf(regions),
        ImmutableList.copyOf(types), ImmutableList.copyOf(bindings),
        parenthesized);
  }

  public Core.TypeBinding typeBinding(LoweredId id, String name,
      Core.Ty ty, Pos pos) {
    return new Core.TypeBinding(id, name, ty, pos);
  }

  public Core.ResolvedQPath resolvedQPath(Core.@Nullable Ty qself,
      Core.Path path) {
    return new Core.ResolvedQPath(qself, path);
  }

  public Core.TypeRelativeQPath typeRelativeQPath(Core.Ty base,
      Core.PathSegment segment) {
    return new Core.TypeRelativeQPath(base, segment);
  }

  // signatures

  public Core.FnDecl fnDecl(List<Core.Ty> inputs, Core.@Nullable Ty output,
      Pos outputPos, boolean variadic, boolean hasImplicitSelf) {
    return new Core.FnDecl(ImmutableList.copyOf(inputs), output, outputPos,
        variadic, hasImplicitSelf);
  }

  // types

  /** Creates a type. */
  public Core.Ty ty(LoweredId id, Core.TyKind kind, Pos pos) {
    return new Core.Ty(id, kind, pos);
  }

  public Core.InferTy inferTy() {
    return inferTy;
  }

  public Core.ErrTy errTy() {
    return errTy;
  }

  public Core.NeverTy neverTy() {
    return neverTy;
  }

  public Core.SliceTy sliceTy(Core.Ty elementTy) {
    return new Core.SliceTy(elementTy);
  }

  public Core.ArrayTy arrayTy(Core.Ty elementTy, int lengthBodyId) {
    return new Core.ArrayTy(elementTy, lengthBodyId);
  }

  public Core.PtrTy ptrTy(Core.Ty ty, Ast.Mutability mutability) {
    return new Core.PtrTy(ty, mutability);
  }

  public Core.RefTy refTy(Core.Region region, Core.Ty ty,
      Ast.Mutability mutability) {
    return new Core.RefTy(region, ty, mutability);
  }

  public Core.BareFnTy bareFnTy(Ast.Unsafety unsafety, String abi,
      List<Core.RegionDef> regions, Core.FnDecl decl,
      List<String> argNames) {
    return new Core.BareFnTy(unsafety, abi, ImmutableList.copyOf(regions),
        decl, ImmutableList.copyOf(argNames));
  }

  public Core.TupTy tupTy(List<Core.Ty> types) {
    return new Core.TupTy(ImmutableList.copyOf(types));
  }

  public Core.PathTy pathTy(Core.QPath qpath) {
    return new Core.PathTy(qpath);
  }

  public Core.TypeofTy typeofTy(int bodyId) {
    return new Core.TypeofTy(bodyId);
  }

  public Core.TraitObjectTy traitObjectTy(List<Core.PolyTraitRef> bounds,
      Core.Region region) {
    return new Core.TraitObjectTy(ImmutableList.copyOf(bounds), region);
  }

  public Core.UniversalTy universalTy(DefId defId,
      List<Core.Bound> bounds) {
    return new Core.UniversalTy(defId, ImmutableList.copyOf(bounds));
  }

  public Core.ExistentialTy existentialTy(Core.Generics generics,
      List<Core.Bound> bounds, List<Core.Region> regions) {
    return new Core.ExistentialTy(generics, ImmutableList.copyOf(bounds),
        ImmutableList.copyOf(regions));
  }

  // patterns

  /** Creates a pattern. */
  public Core.Pat pat(LoweredId id, Core.PatKind kind, Pos pos) {
    return new Core.Pat(id, kind, pos);
  }

  public Core.WildPat wildPat() {
    return wildPat;
  }

  public Core.BindingPat bindingPat(Core.BindingAnnotation annotation,
      int canonicalId, String name, Pos namePos, Core.@Nullable Pat sub) {
    return new Core.BindingPat(annotation, canonicalId, name, namePos, sub);
  }

  public Core.StructPat structPat(Core.QPath qpath,
      List<Core.FieldPat> fields, boolean hasRest) {
    return new Core.StructPat(qpath, ImmutableList.copyOf(fields), hasRest);
  }

  public Core.FieldPat fieldPat(Pos pos, String name, Core.Pat pat,
      boolean shorthand) {
    return new Core.FieldPat(pos, name, pat, shorthand);
  }

  public Core.TupleStructPat tupleStructPat(Core.QPath qpath,
      List<Core.Pat> pats, int ddpos) {
    return new Core.TupleStructPat(qpath, ImmutableList.copyOf(pats), ddpos);
  }

  public Core.PathPat pathPat(Core.QPath qpath) {
    return new Core.PathPat(qpath);
  }

  public Core.TuplePat tuplePat(List<Core.Pat> pats, int ddpos) {
    return new Core.TuplePat(ImmutableList.copyOf(pats), ddpos);
  }

  public Core.BoxPat boxPat(Core.Pat pat) {
    return new Core.BoxPat(pat);
  }

  public Core.RefPat refPat(Core.Pat pat, Ast.Mutability mutability) {
    return new Core.RefPat(pat, mutability);
  }

  public Core.LitPat litPat(Core.Exp exp) {
    return new Core.LitPat(exp);
  }

  public Core.RangePat rangePat(Core.Exp lo, Core.Exp hi,
      Ast.RangeEnd end) {
    return new Core.RangePat(lo, hi, end);
  }

  public Core.SlicePat slicePat(List<Core.Pat> before,
      Core.@Nullable Pat slice, List<Core.Pat> after) {
    return new Core.SlicePat(ImmutableList.copyOf(before), slice,
        ImmutableList.copyOf(after));
  }

  // expressions

  /** Creates an expression. */
  public Core.Exp exp(LoweredId id, Core.ExpKind kind, Pos pos,
      List<Attribute> attrs) {
    return new Core.Exp(id, kind, pos, ImmutableList.copyOf(attrs));
  }

  /** Creates a copy of an expression with a different position and
   * attributes but the same identity and contents. */
  public Core.Exp exp(Core.Exp exp, Pos pos, List<Attribute> attrs) {
    return new Core.Exp(exp.id, exp.kind, pos, ImmutableList.copyOf(attrs));
  }

  public Core.Box box(Core.Exp exp) {
    return new Core.Box(exp);
  }

  public Core.Array array(List<Core.Exp> exps) {
    return new Core.Array(ImmutableList.copyOf(exps));
  }

  public Core.Repeat repeat(Core.Exp value, int countBodyId) {
    return new Core.Repeat(value, countBodyId);
  }

  public Core.Tup tup(List<Core.Exp> exps) {
    return new Core.Tup(ImmutableList.copyOf(exps));
  }

  public Core.Call call(Core.Exp fn, List<Core.Exp> args) {
    return new Core.Call(fn, ImmutableList.copyOf(args));
  }

  public Core.MethodCall methodCall(Core.PathSegment segment,
      Pos segmentPos, List<Core.Exp> args) {
    return new Core.MethodCall(segment, segmentPos,
        ImmutableList.copyOf(args));
  }

  public Core.Binary binary(Ast.BinOpKind binOp, Core.Exp left,
      Core.Exp right) {
    return new Core.Binary(binOp, left, right);
  }

  public Core.Unary unary(Ast.UnOp unOp, Core.Exp exp) {
    return new Core.Unary(unOp, exp);
  }

  public Core.LitExp litExp(Literal literal) {
    return new Core.LitExp(literal);
  }

  public Core.Cast cast(Core.Exp exp, Core.Ty ty) {
    return new Core.Cast(exp, ty);
  }

  public Core.TypeAscription typeAscription(Core.Exp exp, Core.Ty ty) {
    return new Core.TypeAscription(exp, ty);
  }

  public Core.If if_(Core.Exp condition, Core.Exp ifTrue,
      Core.@Nullable Exp ifFalse) {
    return new Core.If(condition, ifTrue, ifFalse);
  }

  public Core.While while_(Core.Exp condition, Core.Block body,
      @Nullable Label label) {
    return new Core.While(condition, body, label);
  }

  public Core.Loop loop(Core.Block body, @Nullable Label label,
      Core.LoopSource source) {
    return new Core.Loop(body, label, source);
  }

  public Core.Match match(Core.Exp exp, List<Core.Arm> arms,
      Core.MatchSource source) {
    return new Core.Match(exp, ImmutableList.copyOf(arms), source);
  }

  public Core.Arm arm(List<Attribute> attrs, List<Core.Pat> pats,
      Core.@Nullable Exp guard, Core.Exp body) {
    return new Core.Arm(ImmutableList.copyOf(attrs),
        ImmutableList.copyOf(pats), guard, body);
  }

  public Core.Closure closure(Ast.CaptureBy captureBy, Core.FnDecl decl,
      int bodyId, Pos declPos, boolean isGenerator) {
    return new Core.Closure(captureBy, decl, bodyId, declPos, isGenerator);
  }

  public Core.BlockExp blockExp(Core.Block block) {
    return new Core.BlockExp(block);
  }

  public Core.Assign assign(Core.Exp target, Core.Exp value) {
    return new Core.Assign(target, value);
  }

  public Core.AssignOp assignOp(Ast.BinOpKind binOp, Core.Exp target,
      Core.Exp value) {
    return new Core.AssignOp(binOp, target, value);
  }

  public Core.FieldAccess fieldAccess(Core.Exp exp, String name) {
    return new Core.FieldAccess(exp, name);
  }

  public Core.TupField tupField(Core.Exp exp, int index) {
    return new Core.TupField(exp, index);
  }

  public Core.Index index(Core.Exp exp, Core.Exp index) {
    return new Core.Index(exp, index);
  }

  public Core.PathExp pathExp(Core.QPath qpath) {
    return new Core.PathExp(qpath);
  }

  public Core.AddrOf addrOf(Ast.Mutability mutability, Core.Exp exp) {
    return new Core.AddrOf(mutability, exp);
  }

  /** Creates the destination of a {@code break} or {@code continue}. */
  public Core.Destination destination(@Nullable Label label,
      Core.ScopeTarget target) {
    return new Core.Destination(label, target);
  }

  public Core.Break break_(Core.Destination destination,
      Core.@Nullable Exp exp) {
    return new Core.Break(destination, exp);
  }

  public Core.Continue continue_(Core.Destination destination) {
    return new Core.Continue(destination);
  }

  public Core.Ret ret(Core.@Nullable Exp exp) {
    return new Core.Ret(exp);
  }

  public Core.StructExp structExp(Core.QPath qpath, List<Core.Field> fields,
      Core.@Nullable Exp base) {
    return new Core.StructExp(qpath, ImmutableList.copyOf(fields), base);
  }

  public Core.Field field(String name, Pos namePos, Core.Exp exp, Pos pos,
      boolean shorthand) {
    return new Core.Field(name, namePos, exp, pos, shorthand);
  }

  public Core.Yield yield_(Core.Exp exp) {
    return new Core.Yield(exp);
  }

  // blocks and statements

  /** Creates a block. */
  public Core.Block block(LoweredId id, List<Core.Stmt> stmts,
      Core.@Nullable Exp expr, Ast.BlockCheckMode rules,
      Ast.@Nullable UnsafeSource unsafeSource, Pos pos,
      boolean targetedByBreak) {
    return new Core.Block(id, ImmutableList.copyOf(stmts), expr, rules,
        unsafeSource, pos, targetedByBreak);
  }

  public Core.Local local(LoweredId id, Core.Pat pat, Core.@Nullable Ty ty,
      Core.@Nullable Exp init, Pos pos, List<Attribute> attrs,
      Core.LocalSource source) {
    return new Core.Local(id, pat, ty, init, pos,
        ImmutableList.copyOf(attrs), source);
  }

  public Core.LocalStmt localStmt(LoweredId id, Core.Local local) {
    return new Core.LocalStmt(id, local);
  }

  public Core.ItemStmt itemStmt(LoweredId id, int itemId, Pos pos) {
    return new Core.ItemStmt(id, itemId, pos);
  }

  public Core.ExprStmt exprStmt(LoweredId id, Core.Exp exp, Pos pos) {
    return new Core.ExprStmt(id, exp, pos);
  }

  public Core.SemiStmt semiStmt(LoweredId id, Core.Exp exp, Pos pos) {
    return new Core.SemiStmt(id, exp, pos);
  }
}

// End CoreBuilder.java
