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

/** Visits surface and core trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Attribute attribute) {}

  // surface tree

  protected void visit(Ast.Crate crate) {
    crate.module.accept(this);
    crate.attrs.forEach(this::accept);
  }

  protected void visit(Ast.Module module) {
    module.items.forEach(this::accept);
  }

  protected void visit(Ast.Visibility visibility) {
    if (visibility.path != null) {
      visibility.path.accept(this);
    }
  }

  /** Visits an item, and the parts specific to its kind. */
  protected void visit(Ast.Item item) {
    item.attrs.forEach(this::accept);
    item.vis.accept(this);
    switch (item.op) {
      case USE:
        ((Ast.Use) item).tree.accept(this);
        break;
      case STATIC:
        ((Ast.StaticItem) item).ty.accept(this);
        ((Ast.StaticItem) item).exp.accept(this);
        break;
      case CONST:
        ((Ast.ConstItem) item).ty.accept(this);
        ((Ast.ConstItem) item).exp.accept(this);
        break;
      case FN:
        final Ast.FnItem fnItem = (Ast.FnItem) item;
        fnItem.decl.accept(this);
        fnItem.generics.accept(this);
        fnItem.body.accept(this);
        break;
      case MOD:
        ((Ast.ModItem) item).module.accept(this);
        break;
      case FOREIGN_MOD:
        ((Ast.ForeignMod) item).items.forEach(this::accept);
        break;
      case TY_ALIAS:
        ((Ast.TyAlias) item).ty.accept(this);
        ((Ast.TyAlias) item).generics.accept(this);
        break;
      case ENUM:
        ((Ast.EnumItem) item).variants.forEach(this::accept);
        ((Ast.EnumItem) item).generics.accept(this);
        break;
      case STRUCT:
        ((Ast.StructItem) item).data.accept(this);
        ((Ast.StructItem) item).generics.accept(this);
        break;
      case UNION:
        ((Ast.UnionItem) item).data.accept(this);
        ((Ast.UnionItem) item).generics.accept(this);
        break;
      case AUTO_IMPL:
        ((Ast.AutoImpl) item).traitRef.accept(this);
        break;
      case IMPL:
        final Ast.Impl impl = (Ast.Impl) item;
        impl.generics.accept(this);
        if (impl.traitRef != null) {
          impl.traitRef.accept(this);
        }
        impl.selfTy.accept(this);
        impl.items.forEach(this::accept);
        break;
      case TRAIT:
        final Ast.Trait trait = (Ast.Trait) item;
        trait.generics.accept(this);
        trait.bounds.forEach(this::accept);
        trait.items.forEach(this::accept);
        break;
      case TRAIT_ALIAS:
        ((Ast.TraitAlias) item).generics.accept(this);
        ((Ast.TraitAlias) item).bounds.forEach(this::accept);
        break;
      case MAC_ITEM:
        ((Ast.MacItem) item).path.accept(this);
        break;
      default:
        // extern crate and macro definitions have no children
        break;
    }
  }

  protected void visit(Ast.UseTree useTree) {
    useTree.prefix.accept(this);
    useTree.nested.forEach(this::accept);
  }

  protected void visit(Ast.Variant variant) {
    variant.attrs.forEach(this::accept);
    variant.data.accept(this);
    if (variant.disrExp != null) {
      variant.disrExp.accept(this);
    }
  }

  protected void visit(Ast.VariantData variantData) {
    variantData.fields.forEach(this::accept);
  }

  protected void visit(Ast.StructField structField) {
    structField.vis.accept(this);
    structField.ty.accept(this);
    structField.attrs.forEach(this::accept);
  }

  protected void visit(Ast.MethodSig methodSig) {
    methodSig.decl.accept(this);
  }

  protected void visit(Ast.Generics generics) {
    generics.regions.forEach(this::accept);
    generics.tyParams.forEach(this::accept);
    generics.whereClause.accept(this);
  }

  protected void visit(Ast.Region region) {}

  protected void visit(Ast.RegionDef regionDef) {
    regionDef.attrs.forEach(this::accept);
    regionDef.region.accept(this);
    regionDef.bounds.forEach(this::accept);
  }

  protected void visit(Ast.TyParam tyParam) {
    tyParam.attrs.forEach(this::accept);
    tyParam.bounds.forEach(this::accept);
    if (tyParam.defaultTy != null) {
      tyParam.defaultTy.accept(this);
    }
  }

  protected void visit(Ast.WhereClause whereClause) {
    whereClause.predicates.forEach(this::accept);
  }

  protected void visit(Ast.BoundPredicate boundPredicate) {
    boundPredicate.boundRegions.forEach(this::accept);
    boundPredicate.boundedTy.accept(this);
    boundPredicate.bounds.forEach(this::accept);
  }

  protected void visit(Ast.RegionPredicate regionPredicate) {
    regionPredicate.region.accept(this);
    regionPredicate.bounds.forEach(this::accept);
  }

  protected void visit(Ast.EqPredicate eqPredicate) {
    eqPredicate.lhs.accept(this);
    eqPredicate.rhs.accept(this);
  }

  protected void visit(Ast.TraitBound traitBound) {
    traitBound.traitRef.accept(this);
  }

  protected void visit(Ast.RegionBound regionBound) {
    regionBound.region.accept(this);
  }

  protected void visit(Ast.PolyTraitRef polyTraitRef) {
    polyTraitRef.boundRegions.forEach(this::accept);
    polyTraitRef.traitRef.accept(this);
  }

  protected void visit(Ast.TraitRef traitRef) {
    traitRef.path.accept(this);
  }

  protected void visit(Ast.Path path) {
    path.segments.forEach(this::accept);
  }

  protected void visit(Ast.PathSegment pathSegment) {
    if (pathSegment.parameters != null) {
      pathSegment.parameters.accept(this);
    }
  }

  protected void visit(Ast.PathParameters pathParameters) {
    pathParameters.regions.forEach(this::accept);
    pathParameters.types.forEach(this::accept);
    pathParameters.bindings.forEach(this::accept);
    if (pathParameters.output != null) {
      pathParameters.output.accept(this);
    }
  }

  protected void visit(Ast.TypeBinding typeBinding) {
    typeBinding.ty.accept(this);
  }

  protected void visit(Ast.FnDecl fnDecl) {
    fnDecl.inputs.forEach(this::accept);
    if (fnDecl.output != null) {
      fnDecl.output.accept(this);
    }
  }

  protected void visit(Ast.Arg arg) {
    arg.pat.accept(this);
    arg.ty.accept(this);
  }

  protected void visit(Ast.InferTy inferTy) {}

  protected void visit(Ast.ErrTy errTy) {}

  protected void visit(Ast.SliceTy sliceTy) {
    sliceTy.elementTy.accept(this);
  }

  protected void visit(Ast.PtrTy ptrTy) {
    ptrTy.ty.accept(this);
  }

  protected void visit(Ast.RefTy refTy) {
    if (refTy.region != null) {
      refTy.region.accept(this);
    }
    refTy.ty.accept(this);
  }

  protected void visit(Ast.BareFnTy bareFnTy) {
    bareFnTy.regions.forEach(this::accept);
    bareFnTy.decl.accept(this);
  }

  protected void visit(Ast.NeverTy neverTy) {}

  protected void visit(Ast.TupTy tupTy) {
    tupTy.types.forEach(this::accept);
  }

  protected void visit(Ast.ParenTy parenTy) {
    parenTy.ty.accept(this);
  }

  protected void visit(Ast.PathTy pathTy) {
    pathTy.path.accept(this);
  }

  protected void visit(Ast.ImplicitSelfTy implicitSelfTy) {}

  protected void visit(Ast.ArrayTy arrayTy) {
    arrayTy.elementTy.accept(this);
    arrayTy.length.accept(this);
  }

  protected void visit(Ast.TypeofTy typeofTy) {
    typeofTy.exp.accept(this);
  }

  protected void visit(Ast.TraitObjectTy traitObjectTy) {
    traitObjectTy.bounds.forEach(this::accept);
  }

  protected void visit(Ast.ImplTraitTy implTraitTy) {
    implTraitTy.bounds.forEach(this::accept);
  }

  protected void visit(Ast.MacTy macTy) {
    macTy.path.accept(this);
  }

  protected void visit(Ast.WildPat wildPat) {}

  protected void visit(Ast.IdentPat identPat) {
    if (identPat.sub != null) {
      identPat.sub.accept(this);
    }
  }

  protected void visit(Ast.StructPat structPat) {
    structPat.path.accept(this);
    structPat.fields.forEach(this::accept);
  }

  protected void visit(Ast.FieldPat fieldPat) {
    fieldPat.pat.accept(this);
  }

  protected void visit(Ast.TupleStructPat tupleStructPat) {
    tupleStructPat.path.accept(this);
    tupleStructPat.pats.forEach(this::accept);
  }

  protected void visit(Ast.PathPat pathPat) {
    pathPat.path.accept(this);
  }

  protected void visit(Ast.TuplePat tuplePat) {
    tuplePat.pats.forEach(this::accept);
  }

  protected void visit(Ast.BoxPat boxPat) {
    boxPat.pat.accept(this);
  }

  protected void visit(Ast.RefPat refPat) {
    refPat.pat.accept(this);
  }

  protected void visit(Ast.LitPat litPat) {
    litPat.exp.accept(this);
  }

  protected void visit(Ast.RangePat rangePat) {
    rangePat.lo.accept(this);
    rangePat.hi.accept(this);
  }

  protected void visit(Ast.SlicePat slicePat) {
    slicePat.before.forEach(this::accept);
    if (slicePat.slice != null) {
      slicePat.slice.accept(this);
    }
    slicePat.after.forEach(this::accept);
  }

  protected void visit(Ast.MacPat macPat) {
    macPat.path.accept(this);
  }

  protected void visit(Ast.Box box) {
    box.exp.accept(this);
  }

  protected void visit(Ast.InPlace inPlace) {
    inPlace.place.accept(this);
    inPlace.value.accept(this);
  }

  protected void visit(Ast.Array array) {
    array.exps.forEach(this::accept);
  }

  protected void visit(Ast.Repeat repeat) {
    repeat.value.accept(this);
    repeat.count.accept(this);
  }

  protected void visit(Ast.Tup tup) {
    tup.exps.forEach(this::accept);
  }

  protected void visit(Ast.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.MethodCall methodCall) {
    methodCall.segment.accept(this);
    methodCall.args.forEach(this::accept);
  }

  protected void visit(Ast.Binary binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Ast.Unary unary) {
    unary.exp.accept(this);
  }

  protected void visit(Ast.LitExp litExp) {}

  protected void visit(Ast.Cast cast) {
    cast.exp.accept(this);
    cast.ty.accept(this);
  }

  protected void visit(Ast.TypeAscription typeAscription) {
    typeAscription.exp.accept(this);
    typeAscription.ty.accept(this);
  }

  protected void visit(Ast.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    if (anIf.ifFalse != null) {
      anIf.ifFalse.accept(this);
    }
  }

  protected void visit(Ast.IfLet ifLet) {
    ifLet.pat.accept(this);
    ifLet.subject.accept(this);
    ifLet.ifTrue.accept(this);
    if (ifLet.ifFalse != null) {
      ifLet.ifFalse.accept(this);
    }
  }

  protected void visit(Ast.While aWhile) {
    aWhile.condition.accept(this);
    aWhile.body.accept(this);
  }

  protected void visit(Ast.WhileLet whileLet) {
    whileLet.pat.accept(this);
    whileLet.subject.accept(this);
    whileLet.body.accept(this);
  }

  protected void visit(Ast.ForLoop forLoop) {
    forLoop.pat.accept(this);
    forLoop.head.accept(this);
    forLoop.body.accept(this);
  }

  protected void visit(Ast.Loop loop) {
    loop.body.accept(this);
  }

  protected void visit(Ast.Match match) {
    match.exp.accept(this);
    match.arms.forEach(this::accept);
  }

  protected void visit(Ast.Arm arm) {
    arm.attrs.forEach(this::accept);
    arm.pats.forEach(this::accept);
    if (arm.guard != null) {
      arm.guard.accept(this);
    }
    arm.body.accept(this);
  }

  protected void visit(Ast.Closure closure) {
    closure.decl.accept(this);
    closure.body.accept(this);
  }

  protected void visit(Ast.BlockExp blockExp) {
    blockExp.block.accept(this);
  }

  protected void visit(Ast.Catch aCatch) {
    aCatch.block.accept(this);
  }

  protected void visit(Ast.Assign assign) {
    assign.target.accept(this);
    assign.value.accept(this);
  }

  protected void visit(Ast.AssignOp assignOp) {
    assignOp.target.accept(this);
    assignOp.value.accept(this);
  }

  protected void visit(Ast.FieldAccess fieldAccess) {
    fieldAccess.exp.accept(this);
  }

  protected void visit(Ast.TupField tupField) {
    tupField.exp.accept(this);
  }

  protected void visit(Ast.Index anIndex) {
    anIndex.exp.accept(this);
    anIndex.index.accept(this);
  }

  protected void visit(Ast.Range range) {
    if (range.start != null) {
      range.start.accept(this);
    }
    if (range.end != null) {
      range.end.accept(this);
    }
  }

  protected void visit(Ast.PathExp pathExp) {
    pathExp.path.accept(this);
  }

  protected void visit(Ast.AddrOf addrOf) {
    addrOf.exp.accept(this);
  }

  protected void visit(Ast.Break aBreak) {
    if (aBreak.exp != null) {
      aBreak.exp.accept(this);
    }
  }

  protected void visit(Ast.Continue aContinue) {}

  protected void visit(Ast.Ret ret) {
    if (ret.exp != null) {
      ret.exp.accept(this);
    }
  }

  protected void visit(Ast.StructExp structExp) {
    structExp.path.accept(this);
    structExp.fields.forEach(this::accept);
    if (structExp.base != null) {
      structExp.base.accept(this);
    }
  }

  protected void visit(Ast.Field field) {
    field.exp.accept(this);
  }

  protected void visit(Ast.Paren paren) {
    paren.exp.accept(this);
  }

  protected void visit(Ast.Yield aYield) {
    if (aYield.exp != null) {
      aYield.exp.accept(this);
    }
  }

  protected void visit(Ast.Try aTry) {
    aTry.exp.accept(this);
  }

  protected void visit(Ast.MacExp macExp) {
    macExp.path.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.stmts.forEach(this::accept);
  }

  protected void visit(Ast.Local local) {
    local.pat.accept(this);
    if (local.ty != null) {
      local.ty.accept(this);
    }
    if (local.init != null) {
      local.init.accept(this);
    }
    local.attrs.forEach(this::accept);
  }

  protected void visit(Ast.LocalStmt localStmt) {
    localStmt.local.accept(this);
  }

  protected void visit(Ast.ItemStmt itemStmt) {
    itemStmt.item.accept(this);
  }

  protected void visit(Ast.ExprStmt exprStmt) {
    exprStmt.exp.accept(this);
  }

  protected void visit(Ast.SemiStmt semiStmt) {
    semiStmt.exp.accept(this);
  }

  protected void visit(Ast.MacStmt macStmt) {
    macStmt.path.accept(this);
  }

  /** Visits an associated item of a trait, and the parts specific to its
   * kind. */
  protected void visit(Ast.TraitItem traitItem) {
    traitItem.generics.accept(this);
    if (traitItem instanceof Ast.TraitConst) {
      final Ast.TraitConst traitConst = (Ast.TraitConst) traitItem;
      traitConst.ty.accept(this);
      if (traitConst.defaultExp != null) {
        traitConst.defaultExp.accept(this);
      }
    } else if (traitItem instanceof Ast.TraitMethod) {
      final Ast.TraitMethod traitMethod = (Ast.TraitMethod) traitItem;
      traitMethod.sig.accept(this);
      if (traitMethod.body != null) {
        traitMethod.body.accept(this);
      }
    } else if (traitItem instanceof Ast.TraitType) {
      final Ast.TraitType traitType = (Ast.TraitType) traitItem;
      traitType.bounds.forEach(this::accept);
      if (traitType.defaultTy != null) {
        traitType.defaultTy.accept(this);
      }
    }
  }

  protected void visit(Ast.ImplItem implItem) {
    implItem.vis.accept(this);
    implItem.generics.accept(this);
    if (implItem instanceof Ast.ImplConst) {
      ((Ast.ImplConst) implItem).ty.accept(this);
      ((Ast.ImplConst) implItem).exp.accept(this);
    } else if (implItem instanceof Ast.ImplMethod) {
      ((Ast.ImplMethod) implItem).sig.accept(this);
      ((Ast.ImplMethod) implItem).body.accept(this);
    } else if (implItem instanceof Ast.ImplType) {
      ((Ast.ImplType) implItem).ty.accept(this);
    }
  }

  protected void visit(Ast.ForeignItem foreignItem) {
    foreignItem.vis.accept(this);
    if (foreignItem instanceof Ast.ForeignFn) {
      ((Ast.ForeignFn) foreignItem).decl.accept(this);
      ((Ast.ForeignFn) foreignItem).generics.accept(this);
    } else if (foreignItem instanceof Ast.ForeignStatic) {
      ((Ast.ForeignStatic) foreignItem).ty.accept(this);
    }
  }

  // core tree

  protected void visit(Core.Module module) {}

  protected void visit(Core.Visibility visibility) {
    if (visibility.path != null) {
      visibility.path.accept(this);
    }
  }

  protected void visit(Core.Body body) {
    body.arguments.forEach(this::accept);
    body.value.accept(this);
  }

  protected void visit(Core.Arg arg) {
    arg.pat.accept(this);
  }

  protected void visit(Core.Item item) {
    item.attrs.forEach(this::accept);
    item.kind.accept(this);
    item.vis.accept(this);
  }

  protected void visit(Core.MacroDef macroDef) {
    macroDef.attrs.forEach(this::accept);
    macroDef.vis.accept(this);
  }

  protected void visit(Core.ExternCrate externCrate) {}

  protected void visit(Core.Use use) {
    use.path.accept(this);
  }

  protected void visit(Core.StaticItem staticItem) {
    staticItem.ty.accept(this);
  }

  protected void visit(Core.ConstItem constItem) {
    constItem.ty.accept(this);
  }

  protected void visit(Core.FnItem fnItem) {
    fnItem.decl.accept(this);
    fnItem.generics.accept(this);
  }

  protected void visit(Core.ModItem modItem) {
    modItem.module.accept(this);
  }

  protected void visit(Core.ForeignMod foreignMod) {
    foreignMod.items.forEach(this::accept);
  }

  protected void visit(Core.TyAlias tyAlias) {
    tyAlias.ty.accept(this);
    tyAlias.generics.accept(this);
  }

  protected void visit(Core.EnumItem enumItem) {
    enumItem.variants.forEach(this::accept);
    enumItem.generics.accept(this);
  }

  protected void visit(Core.StructItem structItem) {
    structItem.data.accept(this);
    structItem.generics.accept(this);
  }

  protected void visit(Core.UnionItem unionItem) {
    unionItem.data.accept(this);
    unionItem.generics.accept(this);
  }

  protected void visit(Core.AutoImpl autoImpl) {
    autoImpl.traitRef.accept(this);
  }

  protected void visit(Core.Impl impl) {
    impl.generics.accept(this);
    if (impl.traitRef != null) {
      impl.traitRef.accept(this);
    }
    impl.selfTy.accept(this);
    impl.itemRefs.forEach(this::accept);
  }

  protected void visit(Core.Trait trait) {
    trait.generics.accept(this);
    trait.bounds.forEach(this::accept);
    trait.itemRefs.forEach(this::accept);
  }

  protected void visit(Core.TraitAlias traitAlias) {
    traitAlias.generics.accept(this);
    traitAlias.bounds.forEach(this::accept);
  }

  protected void visit(Core.Variant variant) {
    variant.attrs.forEach(this::accept);
    variant.data.accept(this);
  }

  protected void visit(Core.VariantData variantData) {
    variantData.fields.forEach(this::accept);
  }

  protected void visit(Core.StructField structField) {
    structField.vis.accept(this);
    structField.ty.accept(this);
    structField.attrs.forEach(this::accept);
  }

  protected void visit(Core.TraitItem traitItem) {
    traitItem.attrs.forEach(this::accept);
    traitItem.generics.accept(this);
    traitItem.kind.accept(this);
  }

  protected void visit(Core.TraitConst traitConst) {
    traitConst.ty.accept(this);
  }

  protected void visit(Core.TraitMethod traitMethod) {
    traitMethod.sig.accept(this);
  }

  protected void visit(Core.TraitType traitType) {
    traitType.bounds.forEach(this::accept);
    if (traitType.defaultTy != null) {
      traitType.defaultTy.accept(this);
    }
  }

  protected void visit(Core.TraitItemRef traitItemRef) {}

  protected void visit(Core.ImplItem implItem) {
    implItem.vis.accept(this);
    implItem.attrs.forEach(this::accept);
    implItem.generics.accept(this);
    implItem.kind.accept(this);
  }

  protected void visit(Core.ImplConst implConst) {
    implConst.ty.accept(this);
  }

  protected void visit(Core.ImplMethod implMethod) {
    implMethod.sig.accept(this);
  }

  protected void visit(Core.ImplType implType) {
    implType.ty.accept(this);
  }

  protected void visit(Core.ImplItemRef implItemRef) {
    implItemRef.vis.accept(this);
  }

  protected void visit(Core.ForeignItem foreignItem) {
    foreignItem.attrs.forEach(this::accept);
    foreignItem.kind.accept(this);
    foreignItem.vis.accept(this);
  }

  protected void visit(Core.ForeignFn foreignFn) {
    foreignFn.decl.accept(this);
    foreignFn.generics.accept(this);
  }

  protected void visit(Core.ForeignStatic foreignStatic) {
    foreignStatic.ty.accept(this);
  }

  protected void visit(Core.ForeignType foreignType) {}

  protected void visit(Core.MethodSig methodSig) {
    methodSig.decl.accept(this);
  }

  protected void visit(Core.Generics generics) {
    generics.regions.forEach(this::accept);
    generics.tyParams.forEach(this::accept);
    generics.whereClause.accept(this);
  }

  protected void visit(Core.Region region) {}

  protected void visit(Core.RegionDef regionDef) {
    regionDef.region.accept(this);
    regionDef.bounds.forEach(this::accept);
  }

  protected void visit(Core.TyParam tyParam) {
    tyParam.bounds.forEach(this::accept);
    if (tyParam.defaultTy != null) {
      tyParam.defaultTy.accept(this);
    }
    tyParam.attrs.forEach(this::accept);
  }

  protected void visit(Core.WhereClause whereClause) {
    whereClause.predicates.forEach(this::accept);
  }

  protected void visit(Core.BoundPredicate boundPredicate) {
    boundPredicate.boundRegions.forEach(this::accept);
    boundPredicate.boundedTy.accept(this);
    boundPredicate.bounds.forEach(this::accept);
  }

  protected void visit(Core.RegionPredicate regionPredicate) {
    regionPredicate.region.accept(this);
    regionPredicate.bounds.forEach(this::accept);
  }

  protected void visit(Core.EqPredicate eqPredicate) {
    eqPredicate.lhs.accept(this);
    eqPredicate.rhs.accept(this);
  }

  protected void visit(Core.TraitBound traitBound) {
    traitBound.traitRef.accept(this);
  }

  protected void visit(Core.RegionBound regionBound) {
    regionBound.region.accept(this);
  }

  protected void visit(Core.PolyTraitRef polyTraitRef) {
    polyTraitRef.boundRegions.forEach(this::accept);
    polyTraitRef.traitRef.accept(this);
  }

  protected void visit(Core.TraitRef traitRef) {
    traitRef.path.accept(this);
  }

  protected void visit(Core.Path path) {
    path.segments.forEach(this::accept);
  }

  protected void visit(Core.PathSegment pathSegment) {
    if (pathSegment.parameters != null) {
      pathSegment.parameters.accept(this);
    }
  }

  protected void visit(Core.PathParameters pathParameters) {
    pathParameters.regions.forEach(this::accept);
    pathParameters.types.forEach(this::accept);
    pathParameters.bindings.forEach(this::accept);
  }

  protected void visit(Core.TypeBinding typeBinding) {
    typeBinding.ty.accept(this);
  }

  protected void visit(Core.ResolvedQPath resolvedQPath) {
    if (resolvedQPath.qself != null) {
      resolvedQPath.qself.accept(this);
    }
    resolvedQPath.path.accept(this);
  }

  protected void visit(Core.TypeRelativeQPath typeRelativeQPath) {
    typeRelativeQPath.base.accept(this);
    typeRelativeQPath.segment.accept(this);
  }

  protected void visit(Core.FnDecl fnDecl) {
    fnDecl.inputs.forEach(this::accept);
    if (fnDecl.output != null) {
      fnDecl.output.accept(this);
    }
  }

  protected void visit(Core.Ty ty) {
    ty.kind.accept(this);
  }

  protected void visit(Core.InferTy inferTy) {}

  protected void visit(Core.ErrTy errTy) {}

  protected void visit(Core.SliceTy sliceTy) {
    sliceTy.elementTy.accept(this);
  }

  protected void visit(Core.ArrayTy arrayTy) {
    arrayTy.elementTy.accept(this);
  }

  protected void visit(Core.PtrTy ptrTy) {
    ptrTy.ty.accept(this);
  }

  protected void visit(Core.RefTy refTy) {
    refTy.region.accept(this);
    refTy.ty.accept(this);
  }

  protected void visit(Core.BareFnTy bareFnTy) {
    bareFnTy.regions.forEach(this::accept);
    bareFnTy.decl.accept(this);
  }

  protected void visit(Core.NeverTy neverTy) {}

  protected void visit(Core.TupTy tupTy) {
    tupTy.types.forEach(this::accept);
  }

  protected void visit(Core.PathTy pathTy) {
    pathTy.qpath.accept(this);
  }

  protected void visit(Core.TypeofTy typeofTy) {}

  protected void visit(Core.TraitObjectTy traitObjectTy) {
    traitObjectTy.bounds.forEach(this::accept);
    traitObjectTy.region.accept(this);
  }

  protected void visit(Core.UniversalTy universalTy) {
    universalTy.bounds.forEach(this::accept);
  }

  protected void visit(Core.ExistentialTy existentialTy) {
    existentialTy.generics.accept(this);
    existentialTy.bounds.forEach(this::accept);
    existentialTy.regions.forEach(this::accept);
  }

  protected void visit(Core.Pat pat) {
    pat.kind.accept(this);
  }

  protected void visit(Core.WildPat wildPat) {}

  protected void visit(Core.BindingPat bindingPat) {
    if (bindingPat.sub != null) {
      bindingPat.sub.accept(this);
    }
  }

  protected void visit(Core.StructPat structPat) {
    structPat.qpath.accept(this);
    structPat.fields.forEach(this::accept);
  }

  protected void visit(Core.FieldPat fieldPat) {
    fieldPat.pat.accept(this);
  }

  protected void visit(Core.TupleStructPat tupleStructPat) {
    tupleStructPat.qpath.accept(this);
    tupleStructPat.pats.forEach(this::accept);
  }

  protected void visit(Core.PathPat pathPat) {
    pathPat.qpath.accept(this);
  }

  protected void visit(Core.TuplePat tuplePat) {
    tuplePat.pats.forEach(this::accept);
  }

  protected void visit(Core.BoxPat boxPat) {
    boxPat.pat.accept(this);
  }

  protected void visit(Core.RefPat refPat) {
    refPat.pat.accept(this);
  }

  protected void visit(Core.LitPat litPat) {
    litPat.exp.accept(this);
  }

  protected void visit(Core.RangePat rangePat) {
    rangePat.lo.accept(this);
    rangePat.hi.accept(this);
  }

  protected void visit(Core.SlicePat slicePat) {
    slicePat.before.forEach(this::accept);
    if (slicePat.slice != null) {
      slicePat.slice.accept(this);
    }
    slicePat.after.forEach(this::accept);
  }

  protected void visit(Core.Exp exp) {
    exp.kind.accept(this);
    exp.attrs.forEach(this::accept);
  }

  protected void visit(Core.Box box) {
    box.exp.accept(this);
  }

  protected void visit(Core.Array array) {
    array.exps.forEach(this::accept);
  }

  protected void visit(Core.Repeat repeat) {
    repeat.value.accept(this);
  }

  protected void visit(Core.Tup tup) {
    tup.exps.forEach(this::accept);
  }

  protected void visit(Core.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Core.MethodCall methodCall) {
    methodCall.segment.accept(this);
    methodCall.args.forEach(this::accept);
  }

  protected void visit(Core.Binary binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Core.Unary unary) {
    unary.exp.accept(this);
  }

  protected void visit(Core.LitExp litExp) {}

  protected void visit(Core.Cast cast) {
    cast.exp.accept(this);
    cast.ty.accept(this);
  }

  protected void visit(Core.TypeAscription typeAscription) {
    typeAscription.exp.accept(this);
    typeAscription.ty.accept(this);
  }

  protected void visit(Core.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    if (anIf.ifFalse != null) {
      anIf.ifFalse.accept(this);
    }
  }

  protected void visit(Core.While aWhile) {
    aWhile.condition.accept(this);
    aWhile.body.accept(this);
  }

  protected void visit(Core.Loop loop) {
    loop.body.accept(this);
  }

  protected void visit(Core.Match match) {
    match.exp.accept(this);
    match.arms.forEach(this::accept);
  }

  protected void visit(Core.Arm arm) {
    arm.attrs.forEach(this::accept);
    arm.pats.forEach(this::accept);
    if (arm.guard != null) {
      arm.guard.accept(this);
    }
    arm.body.accept(this);
  }

  protected void visit(Core.Closure closure) {
    closure.decl.accept(this);
  }

  protected void visit(Core.BlockExp blockExp) {
    blockExp.block.accept(this);
  }

  protected void visit(Core.Assign assign) {
    assign.target.accept(this);
    assign.value.accept(this);
  }

  protected void visit(Core.AssignOp assignOp) {
    assignOp.target.accept(this);
    assignOp.value.accept(this);
  }

  protected void visit(Core.FieldAccess fieldAccess) {
    fieldAccess.exp.accept(this);
  }

  protected void visit(Core.TupField tupField) {
    tupField.exp.accept(this);
  }

  protected void visit(Core.Index anIndex) {
    anIndex.exp.accept(this);
    anIndex.index.accept(this);
  }

  protected void visit(Core.PathExp pathExp) {
    pathExp.qpath.accept(this);
  }

  protected void visit(Core.AddrOf addrOf) {
    addrOf.exp.accept(this);
  }

  protected void visit(Core.Break aBreak) {
    if (aBreak.exp != null) {
      aBreak.exp.accept(this);
    }
  }

  protected void visit(Core.Continue aContinue) {}

  protected void visit(Core.Ret ret) {
    if (ret.exp != null) {
      ret.exp.accept(this);
    }
  }

  protected void visit(Core.StructExp structExp) {
    structExp.qpath.accept(this);
    structExp.fields.forEach(this::accept);
    if (structExp.base != null) {
      structExp.base.accept(this);
    }
  }

  protected void visit(Core.Field field) {
    field.exp.accept(this);
  }

  protected void visit(Core.Yield aYield) {
    aYield.exp.accept(this);
  }

  protected void visit(Core.Block block) {
    block.stmts.forEach(this::accept);
    if (block.expr != null) {
      block.expr.accept(this);
    }
  }

  protected void visit(Core.Local local) {
    local.pat.accept(this);
    if (local.ty != null) {
      local.ty.accept(this);
    }
    if (local.init != null) {
      local.init.accept(this);
    }
    local.attrs.forEach(this::accept);
  }

  protected void visit(Core.LocalStmt localStmt) {
    localStmt.local.accept(this);
  }

  protected void visit(Core.ItemStmt itemStmt) {}

  protected void visit(Core.ExprStmt exprStmt) {
    exprStmt.exp.accept(this);
  }

  protected void visit(Core.SemiStmt semiStmt) {
    semiStmt.exp.accept(this);
  }
}

// End Visitor.java
