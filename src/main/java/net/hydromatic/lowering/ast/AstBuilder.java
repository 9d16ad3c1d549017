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
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds surface tree nodes.
 *
 * <p>The caller supplies every node id; the ids of a crate must be unique
 * and dense, as the parser would assign them.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  private static final ImmutableList<Attribute> NO_ATTRS = ImmutableList.of();

  // crate structure

  public Ast.Crate crate(Pos pos, List<? extends Ast.Item> items,
      List<Attribute> attrs) {
    return new Ast.Crate(pos, module(pos, items), ImmutableList.copyOf(attrs));
  }

  public Ast.Module module(Pos inner, List<? extends Ast.Item> items) {
    return new Ast.Module(inner, ImmutableList.copyOf(items));
  }

  public Ast.Visibility visibility(Pos pos, Ast.VisibilityKind kind) {
    return new Ast.Visibility(pos, kind, null, Ast.DUMMY_NODE_ID);
  }

  /** Creates a visibility restricted to a path, {@code pub(in PATH)}. */
  public Ast.Visibility restrictedVisibility(Pos pos, Ast.Path path, int id) {
    return new Ast.Visibility(pos, Ast.VisibilityKind.RESTRICTED, path, id);
  }

  /** Creates an inherited (private) visibility. */
  public Ast.Visibility inherited() {
    return visibility(Pos.ZERO, Ast.VisibilityKind.INHERITED);
  }

  public Attribute attribute(Pos pos, String name, String... args) {
    return Attribute.of(pos, name, ImmutableList.copyOf(args));
  }

  // items

  public Ast.ExternCrate externCrate(Pos pos, int id, String name,
      Ast.Visibility vis, @Nullable String orig) {
    return new Ast.ExternCrate(pos, id, name, vis, NO_ATTRS, orig);
  }

  public Ast.Use use(Pos pos, int id, Ast.Visibility vis, Ast.UseTree tree) {
    return new Ast.Use(pos, id, tree.ident(), vis, NO_ATTRS, tree);
  }

  /** Creates a simple use tree, {@code a::b} or {@code a::b as c}. */
  public Ast.UseTree simpleUseTree(Pos pos, Ast.Path prefix,
      @Nullable String rename, int id) {
    return new Ast.UseTree(pos, prefix, Ast.UseTreeKind.SIMPLE, rename,
        ImmutableList.of(), id);
  }

  /** Creates a glob use tree, {@code a::b::*}. */
  public Ast.UseTree globUseTree(Pos pos, Ast.Path prefix, int id) {
    return new Ast.UseTree(pos, prefix, Ast.UseTreeKind.GLOB, null,
        ImmutableList.of(), id);
  }

  /** Creates a nested use tree, {@code a::b::{c, d::e}}. */
  public Ast.UseTree nestedUseTree(Pos pos, Ast.Path prefix,
      List<Ast.UseTree> nested, int id) {
    return new Ast.UseTree(pos, prefix, Ast.UseTreeKind.NESTED, null,
        ImmutableList.copyOf(nested), id);
  }

  public Ast.StaticItem staticItem(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Ty ty, Ast.Mutability mutability, Ast.Exp exp) {
    return new Ast.StaticItem(pos, id, name, vis, NO_ATTRS, ty, mutability,
        exp);
  }

  public Ast.ConstItem constItem(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Ty ty, Ast.Exp exp) {
    return new Ast.ConstItem(pos, id, name, vis, NO_ATTRS, ty, exp);
  }

  public Ast.FnItem fnItem(Pos pos, int id, String name, Ast.Visibility vis,
      Ast.FnDecl decl, Ast.Generics generics, Ast.Block body) {
    return new Ast.FnItem(pos, id, name, vis, NO_ATTRS, decl,
        Ast.Unsafety.NORMAL, Ast.Constness.NOT_CONST, "Rust", generics, body);
  }

  public Ast.ModItem modItem(Pos pos, int id, String name, Ast.Visibility vis,
      List<? extends Ast.Item> items) {
    return new Ast.ModItem(pos, id, name, vis, NO_ATTRS, module(pos, items));
  }

  public Ast.ForeignMod foreignMod(Pos pos, int id, String abi,
      List<? extends Ast.ForeignItem> items) {
    return new Ast.ForeignMod(pos, id, "", inherited(), NO_ATTRS, abi,
        ImmutableList.copyOf(items));
  }

  public Ast.TyAlias tyAlias(Pos pos, int id, String name, Ast.Visibility vis,
      Ast.Ty ty, Ast.Generics generics) {
    return new Ast.TyAlias(pos, id, name, vis, NO_ATTRS, ty, generics);
  }

  public Ast.EnumItem enumItem(Pos pos, int id, String name,
      Ast.Visibility vis, List<Ast.Variant> variants, Ast.Generics generics) {
    return new Ast.EnumItem(pos, id, name, vis, NO_ATTRS,
        ImmutableList.copyOf(variants), generics);
  }

  public Ast.StructItem structItem(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.VariantData data, Ast.Generics generics) {
    return new Ast.StructItem(pos, id, name, vis, NO_ATTRS, data, generics);
  }

  public Ast.UnionItem unionItem(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.VariantData data, Ast.Generics generics) {
    return new Ast.UnionItem(pos, id, name, vis, NO_ATTRS, data, generics);
  }

  public Ast.AutoImpl autoImpl(Pos pos, int id, Ast.Unsafety unsafety,
      Ast.TraitRef traitRef) {
    return new Ast.AutoImpl(pos, id, "", inherited(), NO_ATTRS, unsafety,
        traitRef);
  }

  public Ast.Impl impl(Pos pos, int id, Ast.Generics generics,
      Ast.@Nullable TraitRef traitRef, Ast.Ty selfTy,
      List<? extends Ast.ImplItem> items) {
    return new Ast.Impl(pos, id, "", inherited(), NO_ATTRS,
        Ast.Unsafety.NORMAL, Ast.ImplPolarity.POSITIVE, Ast.Defaultness.FINAL,
        generics, traitRef, selfTy, ImmutableList.copyOf(items));
  }

  public Ast.Trait trait(Pos pos, int id, String name, Ast.Visibility vis,
      Ast.IsAuto isAuto, Ast.Generics generics,
      List<? extends Ast.TyParamBound> bounds,
      List<? extends Ast.TraitItem> items) {
    return new Ast.Trait(pos, id, name, vis, NO_ATTRS, isAuto,
        Ast.Unsafety.NORMAL, generics, ImmutableList.copyOf(bounds),
        ImmutableList.copyOf(items));
  }

  public Ast.TraitAlias traitAlias(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Generics generics,
      List<? extends Ast.TyParamBound> bounds) {
    return new Ast.TraitAlias(pos, id, name, vis, NO_ATTRS, generics,
        ImmutableList.copyOf(bounds));
  }

  public Ast.MacroDef macroDef(Pos pos, int id, String name) {
    return macroDef(pos, id, name, inherited(), NO_ATTRS, "", true);
  }

  public Ast.MacroDef macroDef(Pos pos, int id, String name,
      Ast.Visibility vis, List<Attribute> attrs, String body,
      boolean legacy) {
    return new Ast.MacroDef(pos, id, name, vis, ImmutableList.copyOf(attrs),
        body, legacy);
  }

  public Ast.MacItem macItem(Pos pos, int id, Ast.Path path) {
    return new Ast.MacItem(pos, id, inherited(), NO_ATTRS, path);
  }

  public Ast.Variant variant(Pos pos, String name, Ast.VariantData data,
      Ast.@Nullable Exp disrExp) {
    return new Ast.Variant(pos, name, NO_ATTRS, data, disrExp);
  }

  public Ast.VariantData variantData(Ast.VariantKind kind,
      List<Ast.StructField> fields, int id) {
    return new Ast.VariantData(kind, ImmutableList.copyOf(fields), id);
  }

  public Ast.StructField structField(Pos pos, int id, @Nullable String name,
      Ast.Visibility vis, Ast.Ty ty) {
    return new Ast.StructField(pos, id, name, vis, ty, NO_ATTRS);
  }

  // associated and foreign items

  public Ast.TraitConst traitConst(Pos pos, int id, String name, Ast.Ty ty,
      Ast.@Nullable Exp defaultExp) {
    return new Ast.TraitConst(pos, id, name, NO_ATTRS, Ast.Generics.EMPTY, ty,
        defaultExp);
  }

  public Ast.TraitMethod traitMethod(Pos pos, int id, String name,
      Ast.Generics generics, Ast.MethodSig sig, Ast.@Nullable Block body) {
    return new Ast.TraitMethod(pos, id, name, NO_ATTRS, generics, sig, body);
  }

  public Ast.TraitType traitType(Pos pos, int id, String name,
      List<? extends Ast.TyParamBound> bounds, Ast.@Nullable Ty defaultTy) {
    return new Ast.TraitType(pos, id, name, NO_ATTRS, Ast.Generics.EMPTY,
        ImmutableList.copyOf(bounds), defaultTy);
  }

  public Ast.TraitMac traitMac(Pos pos, int id, Ast.Path path) {
    return new Ast.TraitMac(pos, id, path);
  }

  public Ast.ImplConst implConst(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Ty ty, Ast.Exp exp) {
    return new Ast.ImplConst(pos, id, name, vis, Ast.Defaultness.FINAL,
        NO_ATTRS, Ast.Generics.EMPTY, ty, exp);
  }

  public Ast.ImplMethod implMethod(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Generics generics, Ast.MethodSig sig,
      Ast.Block body) {
    return new Ast.ImplMethod(pos, id, name, vis, Ast.Defaultness.FINAL,
        NO_ATTRS, generics, sig, body);
  }

  public Ast.ImplType implType(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Ty ty) {
    return new Ast.ImplType(pos, id, name, vis, Ast.Defaultness.FINAL,
        NO_ATTRS, Ast.Generics.EMPTY, ty);
  }

  public Ast.ImplMac implMac(Pos pos, int id, Ast.Path path) {
    return new Ast.ImplMac(pos, id, inherited(), path);
  }

  public Ast.ForeignFn foreignFn(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.FnDecl decl, Ast.Generics generics) {
    return new Ast.ForeignFn(pos, id, name, vis, NO_ATTRS, decl, generics);
  }

  public Ast.ForeignStatic foreignStatic(Pos pos, int id, String name,
      Ast.Visibility vis, Ast.Ty ty, Ast.Mutability mutability) {
    return new Ast.ForeignStatic(pos, id, name, vis, NO_ATTRS, ty,
        mutability);
  }

  public Ast.ForeignType foreignType(Pos pos, int id, String name,
      Ast.Visibility vis) {
    return new Ast.ForeignType(pos, id, name, vis, NO_ATTRS);
  }

  public Ast.MethodSig methodSig(Ast.FnDecl decl) {
    return new Ast.MethodSig(Ast.Unsafety.NORMAL, Ast.Constness.NOT_CONST,
        "Rust", decl);
  }

  // generics

  public Ast.Generics generics(Pos pos, List<Ast.RegionDef> regions,
      List<Ast.TyParam> tyParams, Ast.WhereClause whereClause) {
    return new Ast.Generics(pos, ImmutableList.copyOf(regions),
        ImmutableList.copyOf(tyParams), whereClause);
  }

  public Ast.Region region(Pos pos, int id, String name) {
    return new Ast.Region(pos, id, name);
  }

  public Ast.RegionDef regionDef(List<Attribute> attrs, Ast.Region region,
      List<Ast.Region> bounds) {
    return new Ast.RegionDef(ImmutableList.copyOf(attrs), region,
        ImmutableList.copyOf(bounds));
  }

  public Ast.TyParam tyParam(Pos pos, int id, String name,
      List<? extends Ast.TyParamBound> bounds, Ast.@Nullable Ty defaultTy) {
    return new Ast.TyParam(pos, id, NO_ATTRS, name,
        ImmutableList.copyOf(bounds), defaultTy);
  }

  public Ast.WhereClause whereClause(Pos pos, int id,
      List<? extends Ast.WherePredicate> predicates) {
    return new Ast.WhereClause(pos, id, ImmutableList.copyOf(predicates));
  }

  public Ast.BoundPredicate boundPredicate(Pos pos,
      List<Ast.RegionDef> boundRegions, Ast.Ty boundedTy,
      List<? extends Ast.TyParamBound> bounds) {
    return new Ast.BoundPredicate(pos, ImmutableList.copyOf(boundRegions),
        boundedTy, ImmutableList.copyOf(bounds));
  }

  public Ast.RegionPredicate regionPredicate(Pos pos, Ast.Region region,
      List<Ast.Region> bounds) {
    return new Ast.RegionPredicate(pos, region, ImmutableList.copyOf(bounds));
  }

  public Ast.EqPredicate eqPredicate(Pos pos, int id, Ast.Ty lhs,
      Ast.Ty rhs) {
    return new Ast.EqPredicate(pos, id, lhs, rhs);
  }

  public Ast.TraitBound traitBound(Ast.PolyTraitRef traitRef,
      Ast.TraitBoundModifier modifier) {
    return new Ast.TraitBound(traitRef, modifier);
  }

  public Ast.RegionBound regionBound(Ast.Region region) {
    return new Ast.RegionBound(region);
  }

  public Ast.PolyTraitRef polyTraitRef(Pos pos,
      List<Ast.RegionDef> boundRegions, Ast.TraitRef traitRef) {
    return new Ast.PolyTraitRef(pos, ImmutableList.copyOf(boundRegions),
        traitRef);
  }

  public Ast.TraitRef traitRef(Ast.Path path, int refId) {
    return new Ast.TraitRef(path, refId);
  }

  // paths

  public Ast.Path path(Pos pos, List<Ast.PathSegment> segments) {
    return new Ast.Path(pos, ImmutableList.copyOf(segments));
  }

  /** Creates a path whose segments have no parameters. */
  public Ast.Path path(Pos pos, String... names) {
    final List<Ast.PathSegment> segments = new ArrayList<>();
    for (String name : names) {
      segments.add(pathSegment(pos, name, null));
    }
    return path(pos, segments);
  }

  public Ast.PathSegment pathSegment(Pos pos, String name,
      Ast.@Nullable PathParameters parameters) {
    return new Ast.PathSegment(pos, name, parameters);
  }

  /** Creates angle-bracketed parameters, {@code <'a, T, Item = U>}. */
  public Ast.PathParameters angleBracketed(Pos pos, List<Ast.Region> regions,
      List<? extends Ast.Ty> types, List<Ast.TypeBinding> bindings) {
    return new Ast.PathParameters(pos, false, ImmutableList.copyOf(regions),
        ImmutableList.copyOf(types), ImmutableList.copyOf(bindings), null);
  }

  /** Creates parenthesized parameters, {@code (A, B) -> C}. */
  public Ast.PathParameters parenthesized(Pos pos,
      List<? extends Ast.Ty> inputs, Ast.@Nullable Ty output) {
    return new Ast.PathParameters(pos, true, ImmutableList.of(),
        ImmutableList.copyOf(inputs), ImmutableList.of(), output);
  }

  public Ast.TypeBinding typeBinding(Pos pos, int id, String name,
      Ast.Ty ty) {
    return new Ast.TypeBinding(pos, id, name, ty);
  }

  public Ast.QSelf qself(Ast.Ty ty, int position) {
    return new Ast.QSelf(ty, position);
  }

  // signatures

  public Ast.FnDecl fnDecl(List<Ast.Arg> inputs, Ast.@Nullable Ty output,
      Pos outputPos) {
    return new Ast.FnDecl(ImmutableList.copyOf(inputs), output, outputPos,
        false);
  }

  public Ast.Arg arg(Pos pos, int id, Ast.Pat pat, Ast.Ty ty) {
    return new Ast.Arg(pos, id, pat, ty);
  }

  // types

  public Ast.InferTy inferTy(Pos pos, int id) {
    return new Ast.InferTy(pos, id);
  }

  public Ast.ErrTy errTy(Pos pos, int id) {
    return new Ast.ErrTy(pos, id);
  }

  public Ast.SliceTy sliceTy(Pos pos, int id, Ast.Ty elementTy) {
    return new Ast.SliceTy(pos, id, elementTy);
  }

  public Ast.PtrTy ptrTy(Pos pos, int id, Ast.Ty ty,
      Ast.Mutability mutability) {
    return new Ast.PtrTy(pos, id, ty, mutability);
  }

  public Ast.RefTy refTy(Pos pos, int id, Ast.@Nullable Region region,
      Ast.Ty ty, Ast.Mutability mutability) {
    return new Ast.RefTy(pos, id, region, ty, mutability);
  }

  public Ast.BareFnTy bareFnTy(Pos pos, int id, List<Ast.RegionDef> regions,
      Ast.FnDecl decl) {
    return new Ast.BareFnTy(pos, id, Ast.Unsafety.NORMAL, "Rust",
        ImmutableList.copyOf(regions), decl);
  }

  public Ast.NeverTy neverTy(Pos pos, int id) {
    return new Ast.NeverTy(pos, id);
  }

  public Ast.TupTy tupTy(Pos pos, int id, List<? extends Ast.Ty> types) {
    return new Ast.TupTy(pos, id, ImmutableList.copyOf(types));
  }

  public Ast.ParenTy parenTy(Pos pos, int id, Ast.Ty ty) {
    return new Ast.ParenTy(pos, id, ty);
  }

  public Ast.PathTy pathTy(Pos pos, int id, Ast.@Nullable QSelf qself,
      Ast.Path path) {
    return new Ast.PathTy(pos, id, qself, path);
  }

  public Ast.ImplicitSelfTy implicitSelfTy(Pos pos, int id) {
    return new Ast.ImplicitSelfTy(pos, id);
  }

  public Ast.ArrayTy arrayTy(Pos pos, int id, Ast.Ty elementTy,
      Ast.Exp length) {
    return new Ast.ArrayTy(pos, id, elementTy, length);
  }

  public Ast.TypeofTy typeofTy(Pos pos, int id, Ast.Exp exp) {
    return new Ast.TypeofTy(pos, id, exp);
  }

  public Ast.TraitObjectTy traitObjectTy(Pos pos, int id,
      List<? extends Ast.TyParamBound> bounds) {
    return new Ast.TraitObjectTy(pos, id, ImmutableList.copyOf(bounds));
  }

  public Ast.ImplTraitTy implTraitTy(Pos pos, int id,
      List<? extends Ast.TyParamBound> bounds) {
    return new Ast.ImplTraitTy(pos, id, ImmutableList.copyOf(bounds));
  }

  public Ast.MacTy macTy(Pos pos, int id, Ast.Path path) {
    return new Ast.MacTy(pos, id, path);
  }

  // patterns

  public Ast.WildPat wildPat(Pos pos, int id) {
    return new Ast.WildPat(pos, id);
  }

  public Ast.IdentPat identPat(Pos pos, int id, Ast.BindingMode mode,
      String name, Ast.@Nullable Pat sub) {
    return new Ast.IdentPat(pos, id, mode, name, pos, sub);
  }

  /** Creates an identifier pattern that binds by value, {@code x}. */
  public Ast.IdentPat identPat(Pos pos, int id, String name) {
    return identPat(pos, id, Ast.BindingMode.BY_VALUE, name, null);
  }

  public Ast.StructPat structPat(Pos pos, int id, Ast.Path path,
      List<Ast.FieldPat> fields, boolean hasRest) {
    return new Ast.StructPat(pos, id, path, ImmutableList.copyOf(fields),
        hasRest);
  }

  public Ast.FieldPat fieldPat(Pos pos, String name, Ast.Pat pat,
      boolean shorthand) {
    return new Ast.FieldPat(pos, name, pat, shorthand);
  }

  public Ast.TupleStructPat tupleStructPat(Pos pos, int id, Ast.Path path,
      List<? extends Ast.Pat> pats, int ddpos) {
    return new Ast.TupleStructPat(pos, id, path, ImmutableList.copyOf(pats),
        ddpos);
  }

  public Ast.PathPat pathPat(Pos pos, int id, Ast.@Nullable QSelf qself,
      Ast.Path path) {
    return new Ast.PathPat(pos, id, qself, path);
  }

  public Ast.TuplePat tuplePat(Pos pos, int id, List<? extends Ast.Pat> pats,
      int ddpos) {
    return new Ast.TuplePat(pos, id, ImmutableList.copyOf(pats), ddpos);
  }

  public Ast.BoxPat boxPat(Pos pos, int id, Ast.Pat pat) {
    return new Ast.BoxPat(pos, id, pat);
  }

  public Ast.RefPat refPat(Pos pos, int id, Ast.Pat pat,
      Ast.Mutability mutability) {
    return new Ast.RefPat(pos, id, pat, mutability);
  }

  public Ast.LitPat litPat(Pos pos, int id, Ast.Exp exp) {
    return new Ast.LitPat(pos, id, exp);
  }

  public Ast.RangePat rangePat(Pos pos, int id, Ast.Exp lo, Ast.Exp hi,
      Ast.RangeEnd end) {
    return new Ast.RangePat(pos, id, lo, hi, end);
  }

  public Ast.SlicePat slicePat(Pos pos, int id, List<? extends Ast.Pat> before,
      Ast.@Nullable Pat slice, List<? extends Ast.Pat> after) {
    return new Ast.SlicePat(pos, id, ImmutableList.copyOf(before), slice,
        ImmutableList.copyOf(after));
  }

  public Ast.MacPat macPat(Pos pos, int id, Ast.Path path) {
    return new Ast.MacPat(pos, id, path);
  }

  // expressions

  public Ast.Box box(Pos pos, int id, Ast.Exp exp) {
    return new Ast.Box(pos, id, NO_ATTRS, exp);
  }

  public Ast.InPlace inPlace(Pos pos, int id, Ast.Exp place, Ast.Exp value) {
    return new Ast.InPlace(pos, id, NO_ATTRS, place, value);
  }

  public Ast.Array array(Pos pos, int id, List<? extends Ast.Exp> exps) {
    return new Ast.Array(pos, id, NO_ATTRS, ImmutableList.copyOf(exps));
  }

  public Ast.Repeat repeat(Pos pos, int id, Ast.Exp value, Ast.Exp count) {
    return new Ast.Repeat(pos, id, NO_ATTRS, value, count);
  }

  public Ast.Tup tup(Pos pos, int id, List<? extends Ast.Exp> exps) {
    return new Ast.Tup(pos, id, NO_ATTRS, ImmutableList.copyOf(exps));
  }

  public Ast.Call call(Pos pos, int id, Ast.Exp fn,
      List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, id, NO_ATTRS, fn, ImmutableList.copyOf(args));
  }

  public Ast.MethodCall methodCall(Pos pos, int id, Ast.PathSegment segment,
      List<? extends Ast.Exp> args) {
    return new Ast.MethodCall(pos, id, NO_ATTRS, segment,
        ImmutableList.copyOf(args));
  }

  public Ast.Binary binary(Pos pos, int id, Ast.BinOpKind binOp,
      Ast.Exp left, Ast.Exp right) {
    return new Ast.Binary(pos, id, NO_ATTRS, binOp, left, right);
  }

  public Ast.Unary unary(Pos pos, int id, Ast.UnOp unOp, Ast.Exp exp) {
    return new Ast.Unary(pos, id, NO_ATTRS, unOp, exp);
  }

  public Ast.LitExp litExp(Pos pos, int id, Literal literal) {
    return new Ast.LitExp(pos, id, NO_ATTRS, literal);
  }

  /** Creates an integer literal expression. */
  public Ast.LitExp intLiteral(Pos pos, int id, long value) {
    return litExp(pos, id, Literal.ofInt(value));
  }

  public Ast.Cast cast(Pos pos, int id, Ast.Exp exp, Ast.Ty ty) {
    return new Ast.Cast(pos, id, NO_ATTRS, exp, ty);
  }

  public Ast.TypeAscription typeAscription(Pos pos, int id, Ast.Exp exp,
      Ast.Ty ty) {
    return new Ast.TypeAscription(pos, id, NO_ATTRS, exp, ty);
  }

  public Ast.If if_(Pos pos, int id, Ast.Exp condition, Ast.Block ifTrue,
      Ast.@Nullable Exp ifFalse) {
    return new Ast.If(pos, id, NO_ATTRS, condition, ifTrue, ifFalse);
  }

  public Ast.IfLet ifLet(Pos pos, int id, Ast.Pat pat, Ast.Exp subject,
      Ast.Block ifTrue, Ast.@Nullable Exp ifFalse) {
    return new Ast.IfLet(pos, id, NO_ATTRS, pat, subject, ifTrue, ifFalse);
  }

  public Ast.While while_(Pos pos, int id, Ast.Exp condition, Ast.Block body,
      @Nullable Label label) {
    return new Ast.While(pos, id, NO_ATTRS, condition, body, label);
  }

  public Ast.WhileLet whileLet(Pos pos, int id, Ast.Pat pat,
      Ast.Exp subject, Ast.Block body, @Nullable Label label) {
    return new Ast.WhileLet(pos, id, NO_ATTRS, pat, subject, body, label);
  }

  public Ast.ForLoop forLoop(Pos pos, int id, Ast.Pat pat, Ast.Exp head,
      Ast.Block body, @Nullable Label label) {
    return new Ast.ForLoop(pos, id, NO_ATTRS, pat, head, body, label);
  }

  public Ast.Loop loop(Pos pos, int id, Ast.Block body,
      @Nullable Label label) {
    return new Ast.Loop(pos, id, NO_ATTRS, body, label);
  }

  public Ast.Match match(Pos pos, int id, Ast.Exp exp, List<Ast.Arm> arms) {
    return new Ast.Match(pos, id, NO_ATTRS, exp, ImmutableList.copyOf(arms));
  }

  public Ast.Arm arm(List<? extends Ast.Pat> pats, Ast.@Nullable Exp guard,
      Ast.Exp body) {
    return new Ast.Arm(NO_ATTRS, ImmutableList.copyOf(pats), guard, body);
  }

  public Ast.Closure closure(Pos pos, int id, Ast.CaptureBy captureBy,
      Ast.FnDecl decl, Ast.Exp body) {
    return new Ast.Closure(pos, id, NO_ATTRS, captureBy, decl, body, pos);
  }

  public Ast.BlockExp blockExp(Pos pos, int id, Ast.Block block) {
    return new Ast.BlockExp(pos, id, NO_ATTRS, block);
  }

  public Ast.Catch catch_(Pos pos, int id, Ast.Block block) {
    return new Ast.Catch(pos, id, NO_ATTRS, block);
  }

  public Ast.Assign assign(Pos pos, int id, Ast.Exp target, Ast.Exp value) {
    return new Ast.Assign(pos, id, NO_ATTRS, target, value);
  }

  public Ast.AssignOp assignOp(Pos pos, int id, Ast.BinOpKind binOp,
      Ast.Exp target, Ast.Exp value) {
    return new Ast.AssignOp(pos, id, NO_ATTRS, binOp, target, value);
  }

  public Ast.FieldAccess fieldAccess(Pos pos, int id, Ast.Exp exp,
      String name) {
    return new Ast.FieldAccess(pos, id, NO_ATTRS, exp, name);
  }

  public Ast.TupField tupField(Pos pos, int id, Ast.Exp exp, int index) {
    return new Ast.TupField(pos, id, NO_ATTRS, exp, index);
  }

  public Ast.Index index(Pos pos, int id, Ast.Exp exp, Ast.Exp index) {
    return new Ast.Index(pos, id, NO_ATTRS, exp, index);
  }

  public Ast.Range range(Pos pos, int id, Ast.@Nullable Exp start,
      Ast.@Nullable Exp end, Ast.RangeLimits limits) {
    return new Ast.Range(pos, id, NO_ATTRS, start, end, limits);
  }

  public Ast.PathExp pathExp(Pos pos, int id, Ast.@Nullable QSelf qself,
      Ast.Path path) {
    return new Ast.PathExp(pos, id, NO_ATTRS, qself, path);
  }

  /** Creates an expression that is a path with one segment, such as a
   * reference to a local variable. */
  public Ast.PathExp id(Pos pos, int id, String name) {
    return pathExp(pos, id, null, path(pos, name));
  }

  public Ast.AddrOf addrOf(Pos pos, int id, Ast.Mutability mutability,
      Ast.Exp exp) {
    return new Ast.AddrOf(pos, id, NO_ATTRS, mutability, exp);
  }

  public Ast.Break break_(Pos pos, int id, @Nullable Label label,
      Ast.@Nullable Exp exp) {
    return new Ast.Break(pos, id, NO_ATTRS, label, exp);
  }

  public Ast.Continue continue_(Pos pos, int id, @Nullable Label label) {
    return new Ast.Continue(pos, id, NO_ATTRS, label);
  }

  public Ast.Ret ret(Pos pos, int id, Ast.@Nullable Exp exp) {
    return new Ast.Ret(pos, id, NO_ATTRS, exp);
  }

  public Ast.StructExp structExp(Pos pos, int id, Ast.Path path,
      List<Ast.Field> fields, Ast.@Nullable Exp base) {
    return new Ast.StructExp(pos, id, NO_ATTRS, path,
        ImmutableList.copyOf(fields), base);
  }

  public Ast.Field field(Pos pos, String name, Ast.Exp exp,
      boolean shorthand) {
    return new Ast.Field(pos, name, pos, exp, shorthand);
  }

  public Ast.Paren paren(Pos pos, int id, List<Attribute> attrs,
      Ast.Exp exp) {
    return new Ast.Paren(pos, id, ImmutableList.copyOf(attrs), exp);
  }

  public Ast.Yield yield_(Pos pos, int id, Ast.@Nullable Exp exp) {
    return new Ast.Yield(pos, id, NO_ATTRS, exp);
  }

  public Ast.Try try_(Pos pos, int id, Ast.Exp exp) {
    return new Ast.Try(pos, id, NO_ATTRS, exp);
  }

  public Ast.MacExp macExp(Pos pos, int id, Ast.Path path) {
    return new Ast.MacExp(pos, id, NO_ATTRS, path);
  }

  // blocks and statements

  public Ast.Block block(Pos pos, int id, List<? extends Ast.Stmt> stmts) {
    return new Ast.Block(pos, id, ImmutableList.copyOf(stmts),
        Ast.BlockCheckMode.DEFAULT);
  }

  public Ast.Block block(Pos pos, int id, List<? extends Ast.Stmt> stmts,
      Ast.BlockCheckMode rules) {
    return new Ast.Block(pos, id, ImmutableList.copyOf(stmts), rules);
  }

  public Ast.Local local(Pos pos, int id, Ast.Pat pat, Ast.@Nullable Ty ty,
      Ast.@Nullable Exp init) {
    return new Ast.Local(pos, id, pat, ty, init, NO_ATTRS);
  }

  public Ast.LocalStmt localStmt(Pos pos, int id, Ast.Local local) {
    return new Ast.LocalStmt(pos, id, local);
  }

  public Ast.ItemStmt itemStmt(Pos pos, int id, Ast.Item item) {
    return new Ast.ItemStmt(pos, id, item);
  }

  public Ast.ExprStmt exprStmt(Pos pos, int id, Ast.Exp exp) {
    return new Ast.ExprStmt(pos, id, exp);
  }

  public Ast.SemiStmt semiStmt(Pos pos, int id, Ast.Exp exp) {
    return new Ast.SemiStmt(pos, id, exp);
  }

  public Ast.MacStmt macStmt(Pos pos, int id, Ast.Path path) {
    return new Ast.MacStmt(pos, id, path);
  }
}

// End AstBuilder.java
