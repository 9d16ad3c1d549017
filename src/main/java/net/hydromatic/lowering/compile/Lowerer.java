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
import static net.hydromatic.lowering.compile.RegionResolver.coreNames;
import static net.hydromatic.lowering.compile.RegionResolver.names;
import static net.hydromatic.lowering.util.Static.concat;
import static net.hydromatic.lowering.util.Static.last;
import static net.hydromatic.lowering.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Attribute;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.CoreId;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.Label;
import net.hydromatic.lowering.ast.LoweredId;
import net.hydromatic.lowering.ast.Op;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.ast.Visitor;
import net.hydromatic.lowering.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a surface tree ({@link Ast}) to a core tree ({@link Core}).
 *
 * <p>Lowering a crate makes three passes. The first registers every item,
 * trait item and impl item as an owner of ids, and counts the region
 * parameters of each type. The second lowers each owner, in its own id
 * scope, into the crate's tables. The third lowers the crate's root
 * module.
 *
 * <p>Sugared expressions ({@code for}, {@code while let}, {@code ?} and so
 * forth) are delegated to a {@link Desugarer}.
 *
 * <p>An instance lowers one crate, and cannot be reused.
 */
public class Lowerer {
  private static final String PARENTHESIZED_MESSAGE =
      "parenthesized parameters may only be used with a trait";

  private final Session session;
  private final NameResolver resolver;
  private final Definitions definitions;
  private final IdAllocator ids;
  private final ScopeContext scopes = new ScopeContext();
  private final RegionResolver regions;
  private final TreeBuilder builder;
  private final NameGenerator nameGenerator = new NameGenerator();
  private final Desugarer desugarer;

  private final SortedMap<Integer, Core.Item> items = new TreeMap<>();
  private final SortedMap<Integer, Core.TraitItem> traitItems =
      new TreeMap<>();
  private final SortedMap<Integer, Core.ImplItem> implItems = new TreeMap<>();
  private final SortedMap<Integer, Core.Body> bodies = new TreeMap<>();
  private final Map<DefId, List<Integer>> traitImpls = new LinkedHashMap<>();
  private final Map<DefId, Integer> traitAutoImpl = new LinkedHashMap<>();
  private final List<Core.MacroDef> exportedMacros = new ArrayList<>();

  /** Number of region parameters of each type and trait. Local definitions
   * are added before lowering starts; external definitions are added when
   * first needed. */
  private final Map<DefId, Integer> regionCounts = new HashMap<>();

  public Lowerer(Session session, NameResolver resolver) {
    this.session = requireNonNull(session);
    this.resolver = requireNonNull(resolver);
    this.definitions = requireNonNull(resolver.definitions());
    this.ids = new IdAllocator(session, definitions);
    this.regions = new RegionResolver(session, ids, definitions);
    this.builder = new TreeBuilder(session, ids, resolver);
    this.desugarer =
        new Desugarer(this, ids, scopes, builder, nameGenerator);
  }

  /** Lowers a crate. */
  public Core.CompUnit lowerCrate(Ast.Crate crate) {
    ids.lower(Ast.CRATE_NODE_ID);
    crate.accept(new OwnerCollector());
    crate.accept(new ItemLowerer());
    final Core.Module module = lowerMod(crate.module);
    final List<Integer> bodyIds = new ArrayList<>(bodies.keySet());
    bodyIds.sort(
        Comparator.comparing(id -> requireNonNull(bodies.get(id)).value.pos));
    final ImmutableList<CoreId> nodeIdToCoreId = ids.finish();
    definitions.initNodeIdToCoreIdMapping(nodeIdToCoreId);
    return core.compUnit(module, crate.attrs, crate.pos, items, traitItems,
        implItems, bodies, bodyIds, traitImpls, traitAutoImpl,
        nodeIdToCoreId, exportedMacros);
  }

  // resolution

  private PathResolution resolution(int nodeId) {
    final PathResolution resolution = resolver.getResolution(nodeId);
    return resolution == null ? PathResolution.of(Def.ERR) : resolution;
  }

  private Def expectFullDef(int nodeId) {
    final PathResolution resolution = resolver.getResolution(nodeId);
    return resolution == null ? Def.ERR : resolution.fullDef();
  }

  // items

  private Core.Module lowerMod(Ast.Module module) {
    final List<Integer> itemIds = new ArrayList<>();
    module.items.forEach(item -> itemIds.addAll(lowerItemIds(item)));
    return core.module(module.pos, itemIds);
  }

  /** Returns the ids of the core items that a surface item becomes. A
   * {@code use} with nested trees becomes several items; a macro definition
   * becomes none, even if it is exported. */
  private List<Integer> lowerItemIds(Ast.Item item) {
    switch (item.op) {
      case USE:
        final List<Integer> itemIds = new ArrayList<>();
        itemIds.add(item.id);
        addNestedUseIds(((Ast.Use) item).tree, itemIds);
        return itemIds;
      case MACRO_DEF:
        return ImmutableList.of();
      default:
        return ImmutableList.of(item.id);
    }
  }

  private static void addNestedUseIds(Ast.UseTree tree, List<Integer> itemIds) {
    for (Ast.UseTree nested : tree.nested) {
      itemIds.add(nested.id);
      addNestedUseIds(nested, itemIds);
    }
  }

  private Core.@Nullable Item lowerItem(Ast.Item i) {
    final Core.Visibility vis = lowerVisibility(i.vis, null);
    if (i.op == Op.MACRO_DEF) {
      final Ast.MacroDef macroDef = (Ast.MacroDef) i;
      if (!macroDef.legacy || Attribute.contains(i.attrs, "macro_export")) {
        exportedMacros.add(
            core.macroDef(i.name, vis, i.attrs, i.id, i.pos, macroDef.body,
                macroDef.legacy));
      }
      return null;
    }
    final UseTarget target = new UseTarget(i.name, vis);
    final Core.ItemKind kind = lowerItemKind(i, target);
    final LoweredId id = ids.lower(i.id);
    return core.item(id, target.name, i.attrs, kind, target.vis, i.pos);
  }

  private Core.ItemKind lowerItemKind(Ast.Item i, UseTarget target) {
    switch (i.op) {
      case EXTERN_CRATE:
        return core.externCrate(((Ast.ExternCrate) i).orig);

      case USE:
        final Ast.UseTree tree = ((Ast.Use) i).tree;
        return lowerUseTree(tree, ImmutableList.of(), tree.pos, i.id, target,
            i.attrs);

      case STATIC:
        final Ast.StaticItem staticItem = (Ast.StaticItem) i;
        final int staticBodyId =
            lowerBody(null, () -> lowerExp(staticItem.exp));
        return core.staticItem(
            lowerTy(staticItem.ty, OpaqueContext.DISALLOWED),
            staticItem.mutability, staticBodyId);

      case CONST:
        final Ast.ConstItem constItem = (Ast.ConstItem) i;
        final int constBodyId = lowerBody(null, () -> lowerExp(constItem.exp));
        return core.constItem(lowerTy(constItem.ty, OpaqueContext.DISALLOWED),
            constBodyId);

      case FN:
        final Ast.FnItem fnItem = (Ast.FnItem) i;
        final @Nullable DefId fnDefId = definitions.optLocalDefId(i.id);
        return scopes.withFreshFunctionScopes(() -> {
          final int bodyId =
              lowerBody(fnItem.decl,
                  () -> builder.blockExp(lowerBlock(fnItem.body, false)));
          final Pair<Core.Generics, Core.FnDecl> pair =
              addInBandDefs(fnItem.generics, fnDefId,
                  () -> lowerFnDecl(fnItem.decl, fnDefId, true));
          return core.fnItem(pair.right, fnItem.unsafety, fnItem.constness,
              fnItem.abi, pair.left, bodyId);
        });

      case MOD:
        return core.modItem(lowerMod(((Ast.ModItem) i).module));

      case FOREIGN_MOD:
        final Ast.ForeignMod foreignMod = (Ast.ForeignMod) i;
        return core.foreignMod(foreignMod.abi,
            transformEager(foreignMod.items, this::lowerForeignItem));

      case TY_ALIAS:
        final Ast.TyAlias tyAlias = (Ast.TyAlias) i;
        final Core.Ty aliasedTy = lowerTy(tyAlias.ty, OpaqueContext.DISALLOWED);
        return core.tyAlias(aliasedTy, lowerGenerics(tyAlias.generics));

      case ENUM:
        final Ast.EnumItem enumItem = (Ast.EnumItem) i;
        final ImmutableList<Core.Variant> variants =
            transformEager(enumItem.variants, this::lowerVariant);
        return core.enumItem(variants, lowerGenerics(enumItem.generics));

      case STRUCT:
        final Ast.StructItem structItem = (Ast.StructItem) i;
        final Core.VariantData structData = lowerVariantData(structItem.data);
        return core.structItem(structData, lowerGenerics(structItem.generics));

      case UNION:
        final Ast.UnionItem unionItem = (Ast.UnionItem) i;
        final Core.VariantData unionData = lowerVariantData(unionItem.data);
        return core.unionItem(unionData, lowerGenerics(unionItem.generics));

      case AUTO_IMPL:
        final Ast.AutoImpl autoImpl = (Ast.AutoImpl) i;
        final Core.TraitRef autoTraitRef =
            lowerTraitRef(autoImpl.traitRef, OpaqueContext.DISALLOWED);
        if (autoTraitRef.path.def.kind == Def.Kind.TRAIT) {
          traitAutoImpl.put(autoTraitRef.path.def.defId(), i.id);
        }
        return core.autoImpl(autoImpl.unsafety, autoTraitRef);

      case IMPL:
        return lowerImpl((Ast.Impl) i);

      case TRAIT:
        final Ast.Trait trait = (Ast.Trait) i;
        final ImmutableList<Core.Bound> traitBounds =
            lowerBounds(trait.bounds, OpaqueContext.DISALLOWED);
        final ImmutableList<Core.TraitItemRef> traitItemRefs =
            transformEager(trait.items, this::lowerTraitItemRef);
        return core.trait(trait.isAuto, trait.unsafety,
            lowerGenerics(trait.generics), traitBounds, traitItemRefs);

      case TRAIT_ALIAS:
        final Ast.TraitAlias traitAlias = (Ast.TraitAlias) i;
        final Core.Generics aliasGenerics = lowerGenerics(traitAlias.generics);
        return core.traitAlias(aliasGenerics,
            lowerBounds(traitAlias.bounds, OpaqueContext.DISALLOWED));

      case MAC_ITEM:
        throw new AssertionError("item macro should have been expanded: "
            + i);

      default:
        throw new AssertionError("unknown item " + i.op);
    }
  }

  private Core.Impl lowerImpl(Ast.Impl impl) {
    final DefId defId = definitions.localDefId(impl.id);
    final Pair<Core.Generics, Pair<Core.@Nullable TraitRef, Core.Ty>> pair =
        addInBandDefs(impl.generics, defId, () -> {
          final Core.@Nullable TraitRef traitRef = impl.traitRef == null
              ? null
              : lowerTraitRef(impl.traitRef, OpaqueContext.DISALLOWED);
          if (traitRef != null && traitRef.path.def.kind == Def.Kind.TRAIT) {
            traitImpls.computeIfAbsent(traitRef.path.def.defId(),
                d -> new ArrayList<>()).add(impl.id);
          }
          final Core.Ty selfTy = lowerTy(impl.selfTy, OpaqueContext.DISALLOWED);
          return Pair.of(traitRef, selfTy);
        });
    final ImmutableList<Core.ImplItemRef> itemRefs =
        regions.withVisibleRegions(names(impl.generics.regions),
            () -> transformEager(impl.items, this::lowerImplItemRef));
    return core.impl(impl.unsafety, impl.polarity, impl.defaultness,
        pair.left, pair.right.left, pair.right.right, itemRefs);
  }

  /** Lowers a use tree, and returns the kind of the item it becomes.
   *
   * <p>A nested tree such as {@code use a::{b, c::d}} adds an item for each
   * nested import to the crate's item table, each in its own owner, and
   * becomes a "list stem" item whose path is the common prefix.
   *
   * @param tree Use tree
   * @param prefix Path segments of the enclosing trees
   * @param prefixPos Position of the prefix
   * @param id Id of the item, or of the nested tree
   * @param target Name and visibility of the item; this method may change
   *               them
   * @param attrs Attributes of the item
   */
  private Core.ItemKind lowerUseTree(Ast.UseTree tree,
      List<Ast.PathSegment> prefix, Pos prefixPos, int id, UseTarget target,
      List<Attribute> attrs) {
    final List<Ast.PathSegment> segments = new ArrayList<>(prefix);
    segments.addAll(tree.prefix.segments);
    switch (tree.kind) {
      case SIMPLE:
        target.name = tree.rename != null
            ? tree.rename
            : last(tree.prefix.segments).name;
        // "use a::b::{self}" imports "a::b"
        if (segments.size() > 1 && last(segments).name.equals("self")) {
          segments.remove(segments.size() - 1);
          if (target.name.equals("self")) {
            target.name = last(segments).name;
          }
        }
        return core.use(
            lowerPath(id, tree.prefix.pos.plus(prefixPos), segments,
                ParamMode.EXPLICIT),
            Core.UseKind.SINGLE);

      case GLOB:
        return core.use(
            lowerPath(id, tree.prefix.pos, segments, ParamMode.EXPLICIT),
            Core.UseKind.GLOB);

      case NESTED:
        final Pos stemPos = prefixPos.plus(tree.prefix.pos);
        for (Ast.UseTree nested : tree.nested) {
          ids.beginOwner(nested.id);
          final LoweredId nestedId = ids.lower(nested.id);
          final UseTarget nestedTarget = new UseTarget(target.name, target.vis);
          final Core.ItemKind kind =
              lowerUseTree(nested, segments, stemPos, nested.id, nestedTarget,
                  attrs);
          ids.withOwner(nested.id, () -> {
            final Core.Visibility vis = copyVisibility(nestedTarget.vis);
            items.put(nested.id,
                core.item(nestedId, nestedTarget.name, attrs, kind, vis,
                    nested.pos));
          });
        }
        final Core.Path stem =
            lowerPath(id, stemPos, segments, ParamMode.EXPLICIT);
        target.vis = core.visibility(Ast.VisibilityKind.INHERITED);
        return core.use(stem, Core.UseKind.LIST_STEM);

      default:
        throw new AssertionError("unknown use tree " + tree.kind);
    }
  }

  /** Copies a visibility into another owner. A restricted visibility needs
   * a new id. */
  private Core.Visibility copyVisibility(Core.Visibility vis) {
    if (vis.kind != Ast.VisibilityKind.RESTRICTED) {
      return vis;
    }
    return core.restrictedVisibility(requireNonNull(vis.path), ids.fresh());
  }

  private Core.Visibility lowerVisibility(Ast.Visibility vis,
      @Nullable Integer owner) {
    if (vis.kind != Ast.VisibilityKind.RESTRICTED) {
      return core.visibility(vis.kind);
    }
    final Ast.Path path = requireNonNull(vis.path);
    final Core.Path corePath =
        lowerPath(vis.id, path.pos, path.segments, ParamMode.EXPLICIT);
    final LoweredId id = owner != null
        ? ids.lowerWithOwner(vis.id, owner)
        : ids.lower(vis.id);
    return core.restrictedVisibility(corePath, id);
  }

  private Core.Variant lowerVariant(Ast.Variant variant) {
    final Core.VariantData data = lowerVariantData(variant.data);
    final @Nullable Integer disrBodyId = variant.disrExp == null
        ? null
        : lowerBody(null, () -> lowerExp(variant.disrExp));
    return core.variant(variant.pos, variant.name, variant.attrs, data,
        disrBodyId);
  }

  private Core.VariantData lowerVariantData(Ast.VariantData data) {
    final ImmutableList.Builder<Core.StructField> fields =
        ImmutableList.builder();
    for (int i = 0; i < data.fields.size(); i++) {
      fields.add(lowerStructField(i, data.fields.get(i)));
    }
    final ImmutableList<Core.StructField> fieldList = fields.build();
    return core.variantData(data.kind, fieldList, ids.lower(data.id));
  }

  private Core.StructField lowerStructField(int index, Ast.StructField field) {
    final LoweredId id = ids.lower(field.id);
    final String name = field.name != null ? field.name : String.valueOf(index);
    final Core.Visibility vis = lowerVisibility(field.vis, null);
    final Core.Ty ty = lowerTy(field.ty, OpaqueContext.DISALLOWED);
    return core.structField(field.pos, id, name, vis, ty, field.attrs);
  }

  // associated and foreign items

  private Core.TraitItem lowerTraitItem(Ast.TraitItem i) {
    final LoweredId id = ids.lower(i.id);
    final DefId defId = definitions.localDefId(i.id);
    final Core.Generics generics;
    final Core.TraitItemKind kind;
    switch (i.op) {
      case TRAIT_CONST:
        final Ast.TraitConst traitConst = (Ast.TraitConst) i;
        generics = lowerGenerics(i.generics);
        final Core.Ty constTy =
            lowerTy(traitConst.ty, OpaqueContext.DISALLOWED);
        final @Nullable Integer defaultBodyId = traitConst.defaultExp == null
            ? null
            : lowerBody(null, () -> lowerExp(traitConst.defaultExp));
        kind = core.traitConst(constTy, defaultBodyId);
        break;

      case TRAIT_METHOD:
        final Ast.TraitMethod method = (Ast.TraitMethod) i;
        final Pair<Core.Generics, Core.TraitItemKind> pair;
        if (method.body == null) {
          final ImmutableList<String> argNames = argNames(method.sig.decl);
          pair = addInBandDefs(i.generics, defId,
              () -> core.traitMethod(lowerMethodSig(method.sig, defId, false),
                  argNames, null));
        } else {
          final Ast.Block body = method.body;
          final int bodyId =
              lowerBody(method.sig.decl,
                  () -> builder.blockExp(lowerBlock(body, false)));
          pair = addInBandDefs(i.generics, defId,
              () -> core.traitMethod(lowerMethodSig(method.sig, defId, false),
                  ImmutableList.of(), bodyId));
        }
        generics = pair.left;
        kind = pair.right;
        break;

      case TRAIT_TYPE:
        final Ast.TraitType traitType = (Ast.TraitType) i;
        generics = lowerGenerics(i.generics);
        final ImmutableList<Core.Bound> bounds =
            lowerBounds(traitType.bounds, OpaqueContext.DISALLOWED);
        kind = core.traitType(bounds,
            traitType.defaultTy == null
                ? null
                : lowerTy(traitType.defaultTy, OpaqueContext.DISALLOWED));
        break;

      case TRAIT_MAC:
        throw new AssertionError("trait item macro should have been expanded: "
            + i);

      default:
        throw new AssertionError("unknown trait item " + i.op);
    }
    return core.traitItem(id, i.name, i.attrs, generics, kind, i.pos);
  }

  private Core.TraitItemRef lowerTraitItemRef(Ast.TraitItem i) {
    final Core.AssociatedItemKind kind;
    final boolean hasDefault;
    boolean hasSelf = false;
    switch (i.op) {
      case TRAIT_CONST:
        kind = Core.AssociatedItemKind.CONST;
        hasDefault = ((Ast.TraitConst) i).defaultExp != null;
        break;
      case TRAIT_TYPE:
        kind = Core.AssociatedItemKind.TYPE;
        hasDefault = ((Ast.TraitType) i).defaultTy != null;
        break;
      case TRAIT_METHOD:
        final Ast.TraitMethod method = (Ast.TraitMethod) i;
        kind = Core.AssociatedItemKind.METHOD;
        hasSelf = hasSelf(method.sig.decl);
        hasDefault = method.body != null;
        break;
      case TRAIT_MAC:
        throw new AssertionError("trait item macro should have been expanded: "
            + i);
      default:
        throw new AssertionError("unexpected trait item " + i.op);
    }
    return core.traitItemRef(i.id, i.name, kind, hasSelf,
        Ast.Defaultness.DEFAULT, hasDefault, i.pos);
  }

  private Core.ImplItem lowerImplItem(Ast.ImplItem i) {
    final LoweredId id = ids.lower(i.id);
    final DefId defId = definitions.localDefId(i.id);
    final Core.Generics generics;
    final Core.ImplItemKind kind;
    switch (i.op) {
      case IMPL_CONST:
        final Ast.ImplConst implConst = (Ast.ImplConst) i;
        final int constBodyId = lowerBody(null, () -> lowerExp(implConst.exp));
        generics = lowerGenerics(i.generics);
        kind = core.implConst(lowerTy(implConst.ty, OpaqueContext.DISALLOWED),
            constBodyId);
        break;

      case IMPL_METHOD:
        final Ast.ImplMethod method = (Ast.ImplMethod) i;
        final int methodBodyId =
            lowerBody(method.sig.decl,
                () -> builder.blockExp(lowerBlock(method.body, false)));
        final boolean allowOpaqueReturn = !scopes.inTraitImpl();
        final Pair<Core.Generics, Core.ImplItemKind> pair =
            addInBandDefs(i.generics, defId,
                () -> core.implMethod(
                    lowerMethodSig(method.sig, defId, allowOpaqueReturn),
                    methodBodyId));
        generics = pair.left;
        kind = pair.right;
        break;

      case IMPL_TYPE:
        generics = lowerGenerics(i.generics);
        kind = core.implType(
            lowerTy(((Ast.ImplType) i).ty, OpaqueContext.DISALLOWED));
        break;

      case IMPL_MAC:
        throw new AssertionError("impl item macro should have been expanded: "
            + i);

      default:
        throw new AssertionError("unknown impl item " + i.op);
    }
    final Core.Visibility vis = lowerVisibility(i.vis, null);
    return core.implItem(id, i.name, vis, i.defaultness, i.attrs, generics,
        kind, i.pos);
  }

  private Core.ImplItemRef lowerImplItemRef(Ast.ImplItem i) {
    final Core.Visibility vis = lowerVisibility(i.vis, i.id);
    final Core.AssociatedItemKind kind;
    boolean hasSelf = false;
    switch (i.op) {
      case IMPL_CONST:
        kind = Core.AssociatedItemKind.CONST;
        break;
      case IMPL_TYPE:
        kind = Core.AssociatedItemKind.TYPE;
        break;
      case IMPL_METHOD:
        kind = Core.AssociatedItemKind.METHOD;
        hasSelf = hasSelf(((Ast.ImplMethod) i).sig.decl);
        break;
      case IMPL_MAC:
        throw new AssertionError("impl item macro should have been expanded: "
            + i);
      default:
        throw new AssertionError("unexpected impl item " + i.op);
    }
    return core.implItemRef(i.id, i.name, kind, hasSelf, vis, i.defaultness,
        i.pos);
  }

  private Core.ForeignItem lowerForeignItem(Ast.ForeignItem i) {
    final LoweredId id = ids.lower(i.id);
    final DefId defId = definitions.localDefId(i.id);
    final Core.ForeignItemKind kind;
    switch (i.op) {
      case FOREIGN_FN:
        final Ast.ForeignFn foreignFn = (Ast.ForeignFn) i;
        final Pair<Core.Generics, Pair<Core.FnDecl, ImmutableList<String>>>
            pair =
            addInBandDefs(foreignFn.generics, defId,
                () -> Pair.of(lowerFnDecl(foreignFn.decl, null, false),
                    argNames(foreignFn.decl)));
        kind = core.foreignFn(pair.right.left, pair.right.right, pair.left);
        break;
      case FOREIGN_STATIC:
        final Ast.ForeignStatic foreignStatic = (Ast.ForeignStatic) i;
        kind = core.foreignStatic(
            lowerTy(foreignStatic.ty, OpaqueContext.DISALLOWED),
            foreignStatic.mutability == Ast.Mutability.MUTABLE);
        break;
      case FOREIGN_TYPE:
        kind = core.foreignType();
        break;
      default:
        throw new AssertionError("unknown foreign item " + i.op);
    }
    final Core.Visibility vis = lowerVisibility(i.vis, null);
    return core.foreignItem(id, i.name, i.attrs, kind, vis, i.pos);
  }

  /** Returns the names of a function's arguments; the empty string for an
   * argument whose pattern is not a simple identifier. */
  private static ImmutableList<String> argNames(Ast.FnDecl decl) {
    return transformEager(decl.inputs, arg -> {
      if (arg.pat.op == Op.IDENT_PAT && ((Ast.IdentPat) arg.pat).sub == null) {
        return ((Ast.IdentPat) arg.pat).name;
      }
      return "";
    });
  }

  /** Returns whether the first argument of a function is {@code self}. */
  private static boolean hasSelf(Ast.FnDecl decl) {
    if (decl.inputs.isEmpty()) {
      return false;
    }
    final Ast.Pat pat = decl.inputs.get(0).pat;
    return pat.op == Op.IDENT_PAT && ((Ast.IdentPat) pat).name.equals("self");
  }

  private static boolean hasImplicitSelf(Ast.FnDecl decl) {
    if (decl.inputs.isEmpty()) {
      return false;
    }
    final Ast.Ty ty = decl.inputs.get(0).ty;
    switch (ty.op) {
      case IMPLICIT_SELF_TY:
        return true;
      case REF_TY:
        return ((Ast.RefTy) ty).ty.op == Op.IMPLICIT_SELF_TY;
      default:
        return false;
    }
  }

  // signatures and generics

  private Core.MethodSig lowerMethodSig(Ast.MethodSig sig, DefId fnDefId,
      boolean allowOpaqueReturn) {
    return core.methodSig(sig.unsafety, sig.constness, sig.abi,
        lowerFnDecl(sig.decl, fnDefId, allowOpaqueReturn));
  }

  /** Lowers a function declaration.
   *
   * @param decl Declaration
   * @param fnDefId Definition of the function, or null if it is a closure,
   *                a function type or a foreign function; if null,
   *                {@code impl Trait} is not allowed
   * @param allowOpaqueReturn Whether the return type may be
   *                          {@code impl Trait}
   */
  private Core.FnDecl lowerFnDecl(Ast.FnDecl decl, @Nullable DefId fnDefId,
      boolean allowOpaqueReturn) {
    final OpaqueContext argContext = fnDefId != null
        ? OpaqueContext.universal(fnDefId)
        : OpaqueContext.DISALLOWED;
    final ImmutableList<Core.Ty> inputs =
        transformEager(decl.inputs, arg -> lowerTy(arg.ty, argContext));
    final Core.@Nullable Ty output;
    if (decl.output == null) {
      output = null;
    } else if (fnDefId != null && allowOpaqueReturn) {
      output = lowerTy(decl.output, OpaqueContext.EXISTENTIAL);
    } else {
      output = lowerTy(decl.output, OpaqueContext.DISALLOWED);
    }
    return core.fnDecl(inputs, output, decl.outputPos, decl.variadic,
        hasImplicitSelf(decl));
  }

  /** Lowers generics and a signature, with the generics' regions in scope,
   * then appends to the generics the region parameters that the signature
   * uses without declaring. */
  private <T> Pair<Core.Generics, T> addInBandDefs(Ast.Generics g,
      @Nullable DefId parent, Supplier<T> f) {
    final Pair<ImmutableList<Core.RegionDef>, Pair<Core.Generics, T>> pair =
        regions.withVisibleRegions(names(g.regions), () ->
            regions.collectInBand(parent, () -> {
              final Core.Generics generics = lowerGenerics(g);
              return Pair.of(generics, f.get());
            }));
    final Core.Generics generics = pair.right.left;
    if (pair.left.isEmpty()) {
      return pair.right;
    }
    return Pair.of(
        core.generics(concat(generics.regions, pair.left), generics.tyParams,
            generics.whereClause, generics.pos),
        pair.right.right);
  }

  private Core.Generics lowerGenerics(Ast.Generics g) {
    // Move "?Trait" bounds in the where clause onto the type parameters
    final Map<Integer, List<Ast.TyParamBound>> addBounds = new HashMap<>();
    for (Ast.WherePredicate predicate : g.whereClause.predicates) {
      if (predicate.op != Op.BOUND_PREDICATE) {
        continue;
      }
      final Ast.BoundPredicate boundPredicate = (Ast.BoundPredicate) predicate;
      for (Ast.TyParamBound bound : boundPredicate.bounds) {
        if (!isMaybe(bound)) {
          continue;
        }
        final @Nullable Integer tyParamId = boundTyParam(g, boundPredicate);
        if (tyParamId != null) {
          addBounds.computeIfAbsent(tyParamId, id -> new ArrayList<>())
              .add(bound);
        } else {
          session.report(
              new CompileException("`?Trait` bounds are only permitted at "
                  + "the point where a type parameter is declared", false,
                  boundPredicate.boundedTy.pos));
        }
      }
    }
    final ImmutableList<Core.TyParam> tyParams =
        transformEager(g.tyParams, tyParam ->
            lowerTyParam(tyParam,
                addBounds.getOrDefault(tyParam.id, ImmutableList.of())));
    final ImmutableList<Core.RegionDef> regionDefs =
        regions.lowerRegionDefs(g.regions);
    final Core.WhereClause whereClause = lowerWhereClause(g.whereClause);
    return core.generics(regionDefs, tyParams, whereClause, g.pos);
  }

  private static boolean isMaybe(Ast.TyParamBound bound) {
    return bound.op == Op.TRAIT_BOUND
        && ((Ast.TraitBound) bound).modifier == Ast.TraitBoundModifier.MAYBE;
  }

  /** If a bound predicate constrains a type parameter declared in the same
   * generics, returns the id of that type parameter; otherwise null. */
  private @Nullable Integer boundTyParam(Ast.Generics g,
      Ast.BoundPredicate predicate) {
    if (predicate.boundedTy.op != Op.PATH_TY
        || !predicate.boundRegions.isEmpty()) {
      return null;
    }
    final Ast.PathTy pathTy = (Ast.PathTy) predicate.boundedTy;
    if (pathTy.qself != null || pathTy.path.segments.size() != 1) {
      return null;
    }
    final PathResolution resolution =
        resolver.getResolution(predicate.boundedTy.id);
    if (resolution == null || resolution.baseDef.kind != Def.Kind.TY_PARAM) {
      return null;
    }
    final Integer nodeId =
        definitions.asLocalNodeId(resolution.baseDef.defId());
    if (nodeId == null) {
      return null;
    }
    for (Ast.TyParam tyParam : g.tyParams) {
      if (tyParam.id == nodeId) {
        return tyParam.id;
      }
    }
    return null;
  }

  private Core.TyParam lowerTyParam(Ast.TyParam tyParam,
      List<Ast.TyParamBound> addBounds) {
    final String name = tyParam.name.equals("Self")
        ? nameGenerator.get("Self")
        : tyParam.name;
    final OpaqueContext context =
        OpaqueContext.universal(definitions.localDefId(tyParam.id));
    final ImmutableList<Core.Bound> bounds =
        concat(lowerBounds(tyParam.bounds, context),
            lowerBounds(addBounds, context));
    final LoweredId id = ids.lower(tyParam.id);
    final Core.@Nullable Ty defaultTy = tyParam.defaultTy == null
        ? null
        : lowerTy(tyParam.defaultTy, OpaqueContext.DISALLOWED);
    return core.tyParam(id, name, bounds, defaultTy, tyParam.pos,
        Attribute.contains(tyParam.attrs, "may_dangle"),
        Attribute.contains(tyParam.attrs, "rustc_synthetic"), tyParam.attrs);
  }

  private Core.WhereClause lowerWhereClause(Ast.WhereClause whereClause) {
    final LoweredId id = ids.lower(whereClause.id);
    return core.whereClause(id,
        transformEager(whereClause.predicates, this::lowerWherePredicate));
  }

  private Core.WherePredicate lowerWherePredicate(Ast.WherePredicate p) {
    switch (p.op) {
      case BOUND_PREDICATE:
        final Ast.BoundPredicate boundPredicate = (Ast.BoundPredicate) p;
        return regions.withVisibleRegions(names(boundPredicate.boundRegions),
            () -> {
              final ImmutableList<Core.RegionDef> boundRegions =
                  regions.lowerRegionDefs(boundPredicate.boundRegions);
              final Core.Ty boundedTy =
                  lowerTy(boundPredicate.boundedTy, OpaqueContext.DISALLOWED);
              // "?Trait" bounds were moved to the type parameter
              final ImmutableList.Builder<Core.Bound> bounds =
                  ImmutableList.builder();
              for (Ast.TyParamBound bound : boundPredicate.bounds) {
                if (!isMaybe(bound)) {
                  bounds.add(lowerBound(bound, OpaqueContext.DISALLOWED));
                }
              }
              return core.boundPredicate(p.pos, boundRegions, boundedTy,
                  bounds.build());
            });

      case REGION_PREDICATE:
        final Ast.RegionPredicate regionPredicate = (Ast.RegionPredicate) p;
        final Core.Region region = regions.lowerRegion(regionPredicate.region);
        return core.regionPredicate(p.pos, region,
            regions.lowerRegions(regionPredicate.bounds));

      case EQ_PREDICATE:
        final Ast.EqPredicate eqPredicate = (Ast.EqPredicate) p;
        final LoweredId id = ids.lower(eqPredicate.id);
        final Core.Ty lhs = lowerTy(eqPredicate.lhs, OpaqueContext.DISALLOWED);
        final Core.Ty rhs = lowerTy(eqPredicate.rhs, OpaqueContext.DISALLOWED);
        return core.eqPredicate(id, p.pos, lhs, rhs);

      default:
        throw new AssertionError("unknown predicate " + p.op);
    }
  }

  private ImmutableList<Core.Bound> lowerBounds(
      List<Ast.TyParamBound> bounds, OpaqueContext context) {
    return transformEager(bounds, bound -> lowerBound(bound, context));
  }

  private Core.Bound lowerBound(Ast.TyParamBound bound,
      OpaqueContext context) {
    switch (bound.op) {
      case TRAIT_BOUND:
        final Ast.TraitBound traitBound = (Ast.TraitBound) bound;
        return core.traitBound(lowerPolyTraitRef(traitBound.traitRef, context),
            traitBound.modifier);
      case REGION_BOUND:
        return core.regionBound(
            regions.lowerRegion(((Ast.RegionBound) bound).region));
      default:
        throw new AssertionError("unknown bound " + bound.op);
    }
  }

  private Core.PolyTraitRef lowerPolyTraitRef(Ast.PolyTraitRef p,
      OpaqueContext context) {
    final ImmutableList<Core.RegionDef> boundRegions =
        regions.lowerRegionDefs(p.boundRegions);
    final Core.TraitRef traitRef =
        regions.withVisibleRegions(coreNames(boundRegions),
            () -> lowerTraitRef(p.traitRef, context));
    return core.polyTraitRef(boundRegions, traitRef, p.pos);
  }

  private Core.TraitRef lowerTraitRef(Ast.TraitRef traitRef,
      OpaqueContext context) {
    final Core.QPath qpath =
        lowerQPath(traitRef.refId, null, traitRef.path, ParamMode.EXPLICIT,
            context);
    if (qpath.op != Op.RESOLVED_QPATH
        || ((Core.ResolvedQPath) qpath).qself != null) {
      throw new AssertionError("unexpected path in trait reference: "
          + qpath);
    }
    return core.traitRef(((Core.ResolvedQPath) qpath).path,
        ids.lower(traitRef.refId));
  }

  // paths

  /** Lowers a path whose every segment is resolved, such as the path of a
   * {@code use} or of a restricted visibility. */
  private Core.Path lowerPath(int id, Pos pos, List<Ast.PathSegment> segments,
      ParamMode mode) {
    final Def def = expectFullDef(id);
    return core.path(pos, def,
        transformEager(segments, segment ->
            lowerPathSegment(pos, segment, mode, 0, ParenthesizedArgs.ERR,
                OpaqueContext.DISALLOWED)));
  }

  /** Lowers a path that may be qualified ({@code <T as Trait>::Item}) and
   * may end in segments that name associated items and that resolution
   * could not resolve. Those segments become a chain of type-relative
   * paths. */
  private Core.QPath lowerQPath(int id, Ast.@Nullable QSelf qself,
      Ast.Path p, ParamMode mode, OpaqueContext context) {
    final Core.@Nullable Ty qselfTy =
        qself == null ? null : lowerTy(qself.ty, context);
    final PathResolution resolution = resolution(id);
    final Def def = resolution.baseDef;
    final int projStart = p.segments.size() - resolution.unresolvedSegments;
    final ImmutableList.Builder<Core.PathSegment> segments =
        ImmutableList.builder();
    for (int i = 0; i < projStart; i++) {
      final ParamMode segmentMode =
          qself != null && mode == ParamMode.OPTIONAL && i < qself.position
              ? ParamMode.EXPLICIT
              : mode;
      final @Nullable DefId typeDefId = typeDefId(def, i, projStart);
      final int regionCount =
          typeDefId == null ? 0 : regionParamCount(typeDefId);
      segments.add(
          lowerPathSegment(p.pos, p.segments.get(i), segmentMode, regionCount,
              parenthesizedArgs(def, i, projStart), context));
    }
    final Core.Path path = core.path(p.pos, def, segments.build());
    if (resolution.unresolvedSegments == 0) {
      return core.resolvedQPath(qselfTy, path);
    }

    // The type to project from is either the explicit self type, as in
    // "<&i32>::clone", or the resolved prefix, as in "Vec::new".
    Core.Ty ty;
    if (path.segments.isEmpty()) {
      ty = requireNonNull(qselfTy, "qualified self type");
    } else {
      ty = tyPath(ids.fresh(), p.pos, core.resolvedQPath(qselfTy, path));
    }
    for (int i = projStart;; i++) {
      final Core.PathSegment segment =
          lowerPathSegment(p.pos, p.segments.get(i), mode, 0,
              ParenthesizedArgs.WARN, context);
      final Core.QPath qpath = core.typeRelativeQPath(ty, segment);
      if (i == p.segments.size() - 1) {
        return qpath;
      }
      ty = tyPath(ids.fresh(), p.pos, qpath);
    }
  }

  /** Returns the type or trait whose region parameters segment {@code i}
   * of a path may carry, or null. */
  private @Nullable DefId typeDefId(Def def, int i, int projStart) {
    switch (def.kind) {
      case ASSOCIATED_TY:
        return i + 2 == projStart ? definitions.parent(def.defId()) : null;
      case VARIANT:
        return i + 1 == projStart ? definitions.parent(def.defId()) : null;
      case STRUCT:
      case UNION:
      case ENUM:
      case TY_ALIAS:
      case TRAIT:
        return i + 1 == projStart ? def.defId() : null;
      default:
        return null;
    }
  }

  private static ParenthesizedArgs parenthesizedArgs(Def def, int i,
      int projStart) {
    switch (def.kind) {
      case TRAIT:
        return i + 1 == projStart
            ? ParenthesizedArgs.OK
            : ParenthesizedArgs.WARN;
      case METHOD:
      case ASSOCIATED_CONST:
      case ASSOCIATED_TY:
        return i + 2 == projStart
            ? ParenthesizedArgs.OK
            : ParenthesizedArgs.WARN;
      case ERR:
        return ParenthesizedArgs.OK;
      case STRUCT:
      case ENUM:
      case UNION:
      case TY_ALIAS:
      case VARIANT:
        return i + 1 == projStart
            ? ParenthesizedArgs.ERR
            : ParenthesizedArgs.WARN;
      default:
        return ParenthesizedArgs.WARN;
    }
  }

  private int regionParamCount(DefId defId) {
    final Integer count = regionCounts.get(defId);
    if (count != null) {
      return count;
    }
    if (defId.isLocal()) {
      throw new AssertionError("region parameters of local definition "
          + defId + " were not counted");
    }
    final int externalCount = definitions.externalRegionParamCount(defId);
    regionCounts.put(defId, externalCount);
    return externalCount;
  }

  /** Lowers a path segment.
   *
   * @param pathPos Position of the whole path
   * @param segment Segment
   * @param mode Whether the segment's type parameters may be omitted
   * @param expectedRegions Number of elided regions to add if the segment
   *                        has no regions
   * @param policy What to do if the segment has parenthesized parameters
   * @param context Context for {@code impl Trait} types
   */
  private Core.PathSegment lowerPathSegment(Pos pathPos,
      Ast.PathSegment segment, ParamMode mode, int expectedRegions,
      ParenthesizedArgs policy, OpaqueContext context) {
    final Ast.@Nullable PathParameters params = segment.parameters;
    Core.PathParameters parameters;
    final boolean inferTypes;
    if (params == null || !params.parenthesized) {
      final List<Ast.Region> regionList =
          params == null ? ImmutableList.of() : params.regions;
      final List<Ast.Ty> types =
          params == null ? ImmutableList.of() : params.types;
      final List<Ast.TypeBinding> bindings =
          params == null ? ImmutableList.of() : params.bindings;
      parameters =
          core.pathParameters(regions.lowerRegions(regionList),
              transformEager(types, t -> lowerTy(t, context)),
              transformEager(bindings, b -> lowerTypeBinding(b, context)),
              false);
      inferTypes = types.isEmpty() && mode == ParamMode.OPTIONAL;
    } else {
      switch (policy) {
        case OK:
          parameters = lowerParenthesizedParameters(params);
          inferTypes = false;
          break;
        case WARN:
          session.report(
              new CompileException(PARENTHESIZED_MESSAGE, true, params.pos));
          parameters = emptyParameters();
          inferTypes = true;
          break;
        case ERR:
          session.report(
              new CompileException(PARENTHESIZED_MESSAGE, false, params.pos,
                  "E0214"));
          parameters = emptyParameters();
          inferTypes = true;
          break;
        default:
          throw new AssertionError(policy);
      }
    }
    if (!parameters.parenthesized
        && parameters.regions.isEmpty()
        && expectedRegions > 0) {
      final ImmutableList.Builder<Core.Region> elided =
          ImmutableList.builder();
      for (int i = 0; i < expectedRegions; i++) {
        elided.add(regions.elidedRegion(pathPos));
      }
      parameters =
          core.pathParameters(elided.build(), parameters.types,
              parameters.bindings, false);
    }
    return core.pathSegment(segment.name, parameters, inferTypes);
  }

  private static Core.PathParameters emptyParameters() {
    return core.pathParameters(ImmutableList.of(), ImmutableList.of(),
        ImmutableList.of(), false);
  }

  /** Converts {@code Fn(A, B) -> C} to {@code Fn<(A, B), Output = C>}. */
  private Core.PathParameters lowerParenthesizedParameters(
      Ast.PathParameters params) {
    final ImmutableList<Core.Ty> inputs =
        transformEager(params.types,
            t -> lowerTy(t, OpaqueContext.DISALLOWED));
    final Core.Ty tuple = core.ty(ids.fresh(), core.tupTy(inputs), params.pos);
    final LoweredId bindingId = ids.fresh();
    final Core.Ty output;
    final Pos outputPos;
    if (params.output != null) {
      output = lowerTy(params.output, OpaqueContext.DISALLOWED);
      outputPos = params.output.pos;
    } else {
      output =
          core.ty(ids.fresh(), core.tupTy(ImmutableList.of()), params.pos);
      outputPos = params.pos;
    }
    final Core.TypeBinding binding =
        core.typeBinding(bindingId, "Output", output, outputPos);
    return core.pathParameters(ImmutableList.of(), ImmutableList.of(tuple),
        ImmutableList.of(binding), true);
  }

  private Core.TypeBinding lowerTypeBinding(Ast.TypeBinding binding,
      OpaqueContext context) {
    final LoweredId id = ids.lower(binding.id);
    return core.typeBinding(id, binding.name, lowerTy(binding.ty, context),
        binding.pos);
  }

  // types

  /** Creates a type from a path. A path to a trait, such as {@code Display}
   * in {@code Box<Display>}, becomes a trait object type. */
  private Core.Ty tyPath(LoweredId id, Pos pos, Core.QPath qpath) {
    if (qpath.op == Op.RESOLVED_QPATH) {
      final Core.ResolvedQPath resolved = (Core.ResolvedQPath) qpath;
      if (resolved.qself == null
          && resolved.path.def.kind == Def.Kind.TRAIT) {
        final Core.PolyTraitRef principal =
            core.polyTraitRef(ImmutableList.of(),
                core.traitRef(resolved.path, id), pos);
        // The trait reference took the id, so the type needs another
        final LoweredId tyId = ids.fresh();
        return core.ty(tyId,
            core.traitObjectTy(ImmutableList.of(principal),
                regions.elidedRegion(pos)),
            pos);
      }
    }
    return core.ty(id, core.pathTy(qpath), pos);
  }

  Core.Ty lowerTy(Ast.Ty t, OpaqueContext context) {
    final Core.TyKind kind;
    switch (t.op) {
      case INFER_TY:
        kind = core.inferTy();
        break;
      case ERR_TY:
        kind = core.errTy();
        break;
      case SLICE_TY:
        kind = core.sliceTy(lowerTy(((Ast.SliceTy) t).elementTy, context));
        break;
      case PTR_TY:
        final Ast.PtrTy ptrTy = (Ast.PtrTy) t;
        kind = core.ptrTy(lowerTy(ptrTy.ty, context), ptrTy.mutability);
        break;
      case REF_TY:
        final Ast.RefTy refTy = (Ast.RefTy) t;
        final Core.Region region = refTy.region != null
            ? regions.lowerRegion(refTy.region)
            : regions.elidedRegion(t.pos.shrinkToStart());
        kind = core.refTy(region, lowerTy(refTy.ty, context), refTy.mutability);
        break;
      case BARE_FN_TY:
        final Ast.BareFnTy bareFnTy = (Ast.BareFnTy) t;
        kind = regions.withVisibleRegions(names(bareFnTy.regions), () ->
            core.bareFnTy(bareFnTy.unsafety, bareFnTy.abi,
                regions.lowerRegionDefs(bareFnTy.regions),
                lowerFnDecl(bareFnTy.decl, null, false),
                argNames(bareFnTy.decl)));
        break;
      case NEVER_TY:
        kind = core.neverTy();
        break;
      case TUP_TY:
        kind = core.tupTy(
            transformEager(((Ast.TupTy) t).types, ty -> lowerTy(ty, context)));
        break;
      case PAREN_TY:
        return lowerTy(((Ast.ParenTy) t).ty, context);
      case PATH_TY:
        final Ast.PathTy pathTy = (Ast.PathTy) t;
        final LoweredId pathId = ids.lower(t.id);
        final Core.QPath qpath =
            lowerQPath(t.id, pathTy.qself, pathTy.path, ParamMode.EXPLICIT,
                context);
        return tyPath(pathId, t.pos, qpath);
      case IMPLICIT_SELF_TY:
        final Core.Path selfPath =
            core.path(t.pos, expectFullDef(t.id),
                ImmutableList.of(core.pathSegment("Self")));
        kind = core.pathTy(core.resolvedQPath(null, selfPath));
        break;
      case ARRAY_TY:
        final Ast.ArrayTy arrayTy = (Ast.ArrayTy) t;
        final int lengthBodyId =
            lowerBody(null, () -> lowerExp(arrayTy.length));
        kind = core.arrayTy(lowerTy(arrayTy.elementTy, context), lengthBodyId);
        break;
      case TYPEOF_TY:
        final Ast.TypeofTy typeofTy = (Ast.TypeofTy) t;
        kind = core.typeofTy(lowerBody(null, () -> lowerExp(typeofTy.exp)));
        break;
      case TRAIT_OBJECT_TY:
        kind = lowerTraitObjectTy((Ast.TraitObjectTy) t, context);
        break;
      case IMPL_TRAIT_TY:
        kind = lowerOpaqueTy((Ast.ImplTraitTy) t, context);
        break;
      case MAC_TY:
        throw new AssertionError("type macro should have been expanded: " + t);
      default:
        throw new AssertionError("unknown type " + t.op);
    }
    return core.ty(ids.lower(t.id), kind, t.pos);
  }

  /** Lowers a trait object type. Drops "?Trait" bounds, and keeps the first
   * region bound. */
  private Core.TyKind lowerTraitObjectTy(Ast.TraitObjectTy t,
      OpaqueContext context) {
    final ImmutableList.Builder<Core.PolyTraitRef> bounds =
        ImmutableList.builder();
    Core.@Nullable Region region = null;
    for (Ast.TyParamBound bound : t.bounds) {
      switch (bound.op) {
        case TRAIT_BOUND:
          final Ast.TraitBound traitBound = (Ast.TraitBound) bound;
          if (traitBound.modifier == Ast.TraitBoundModifier.NONE) {
            bounds.add(lowerPolyTraitRef(traitBound.traitRef, context));
          }
          break;
        case REGION_BOUND:
          if (region == null) {
            region = regions.lowerRegion(((Ast.RegionBound) bound).region);
          }
          break;
        default:
          throw new AssertionError("unknown bound " + bound.op);
      }
    }
    if (region == null) {
      region = regions.elidedRegion(t.pos);
    }
    return core.traitObjectTy(bounds.build(), region);
  }

  /** Lowers an {@code impl Trait} type. What it becomes depends on the
   * context. */
  private Core.TyKind lowerOpaqueTy(Ast.ImplTraitTy t,
      OpaqueContext context) {
    switch (context.kind) {
      case EXISTENTIAL:
        if (!Prop.CONSERVATIVE_OPAQUE_TYPES.booleanValue(session.map)) {
          session.report(
              new CompileException("`impl Trait` in return position is "
                  + "experimental", false, t.pos));
          return core.errTy();
        }
        final Integer defIndex = definitions.optDefIndex(t.id);
        checkState(defIndex != null, "no definition for opaque type %s",
            t.id);
        final ImmutableList<Core.Bound> bounds = lowerBounds(t.bounds, context);
        final Pair<ImmutableList<Core.Region>, ImmutableList<Core.RegionDef>>
            captured = regions.captureFreeRegions(defIndex, bounds);
        final Core.WhereClause whereClause =
            core.whereClause(ids.fresh(), ImmutableList.of());
        return core.existentialTy(
            core.generics(captured.right, ImmutableList.of(), whereClause,
                t.pos),
            bounds, captured.left);

      case UNIVERSAL:
        if (!Prop.UNIVERSAL_OPAQUE_TYPES.booleanValue(session.map)) {
          session.report(
              new CompileException("`impl Trait` in argument position is "
                  + "experimental", false, t.pos));
          return core.errTy();
        }
        return core.universalTy(context.defId(),
            lowerBounds(t.bounds, context));

      case DISALLOWED:
        session.report(
            new CompileException("`impl Trait` not allowed outside of "
                + "function and inherent method return types", false, t.pos,
                "E0562"));
        return core.errTy();

      default:
        throw new AssertionError(context);
    }
  }

  // patterns

  Core.Pat lowerPat(Ast.Pat p) {
    final LoweredId id = ids.lower(p.id);
    final Core.PatKind kind;
    switch (p.op) {
      case WILD_PAT:
        kind = core.wildPat();
        break;
      case IDENT_PAT:
        kind = lowerIdentPat((Ast.IdentPat) p);
        break;
      case LIT_PAT:
        kind = core.litPat(lowerExp(((Ast.LitPat) p).exp));
        break;
      case TUPLE_STRUCT_PAT:
        final Ast.TupleStructPat tupleStructPat = (Ast.TupleStructPat) p;
        final Core.QPath tupleStructPath =
            lowerQPath(p.id, null, tupleStructPat.path, ParamMode.OPTIONAL,
                OpaqueContext.DISALLOWED);
        kind = core.tupleStructPat(tupleStructPath,
            transformEager(tupleStructPat.pats, this::lowerPat),
            tupleStructPat.ddpos);
        break;
      case PATH_PAT:
        final Ast.PathPat pathPat = (Ast.PathPat) p;
        kind = core.pathPat(
            lowerQPath(p.id, pathPat.qself, pathPat.path, ParamMode.OPTIONAL,
                OpaqueContext.DISALLOWED));
        break;
      case STRUCT_PAT:
        final Ast.StructPat structPat = (Ast.StructPat) p;
        final Core.QPath structPath =
            lowerQPath(p.id, null, structPat.path, ParamMode.OPTIONAL,
                OpaqueContext.DISALLOWED);
        kind = core.structPat(structPath,
            transformEager(structPat.fields, f ->
                core.fieldPat(f.pos, f.name, lowerPat(f.pat), f.shorthand)),
            structPat.hasRest);
        break;
      case TUPLE_PAT:
        final Ast.TuplePat tuplePat = (Ast.TuplePat) p;
        kind = core.tuplePat(transformEager(tuplePat.pats, this::lowerPat),
            tuplePat.ddpos);
        break;
      case BOX_PAT:
        kind = core.boxPat(lowerPat(((Ast.BoxPat) p).pat));
        break;
      case REF_PAT:
        final Ast.RefPat refPat = (Ast.RefPat) p;
        kind = core.refPat(lowerPat(refPat.pat), refPat.mutability);
        break;
      case RANGE_PAT:
        final Ast.RangePat rangePat = (Ast.RangePat) p;
        final Core.Exp lo = lowerExp(rangePat.lo);
        kind = core.rangePat(lo, lowerExp(rangePat.hi), rangePat.end);
        break;
      case SLICE_PAT:
        final Ast.SlicePat slicePat = (Ast.SlicePat) p;
        final ImmutableList<Core.Pat> before =
            transformEager(slicePat.before, this::lowerPat);
        final Core.@Nullable Pat slice =
            slicePat.slice == null ? null : lowerPat(slicePat.slice);
        kind = core.slicePat(before, slice,
            transformEager(slicePat.after, this::lowerPat));
        break;
      case MAC_PAT:
        throw new AssertionError("pattern macro should have been expanded: "
            + p);
      default:
        throw new AssertionError("unknown pattern " + p.op);
    }
    return core.pat(id, kind, p.pos);
  }

  /** Lowers an identifier pattern. If resolution says that the identifier
   * is a constant, unit struct or similar, the pattern is a path;
   * otherwise it binds a variable. */
  private Core.PatKind lowerIdentPat(Ast.IdentPat p) {
    final PathResolution resolution = resolver.getResolution(p.id);
    final @Nullable Def def = resolution == null ? null : resolution.baseDef;
    if (def == null || def.kind == Def.Kind.LOCAL) {
      final int canonicalId = def == null ? p.id : def.nodeId();
      return core.bindingPat(bindingAnnotation(p.mode), canonicalId, p.name,
          p.namePos, p.sub == null ? null : lowerPat(p.sub));
    }
    final Core.Path path =
        core.path(p.namePos, def, ImmutableList.of(core.pathSegment(p.name)));
    return core.pathPat(core.resolvedQPath(null, path));
  }

  private static Core.BindingAnnotation bindingAnnotation(
      Ast.BindingMode mode) {
    switch (mode) {
      case BY_VALUE:
        return Core.BindingAnnotation.UNANNOTATED;
      case BY_VALUE_MUT:
        return Core.BindingAnnotation.MUTABLE;
      case BY_REF:
        return Core.BindingAnnotation.REF;
      case BY_REF_MUT:
        return Core.BindingAnnotation.REF_MUT;
      default:
        throw new AssertionError(mode);
    }
  }

  // blocks and statements

  Core.Block lowerBlock(Ast.Block b, boolean targetedByBreak) {
    final List<Core.Stmt> stmts = new ArrayList<>();
    Core.@Nullable Exp expr = null;
    for (int i = 0; i < b.stmts.size(); i++) {
      final Ast.Stmt stmt = b.stmts.get(i);
      if (i == b.stmts.size() - 1 && stmt.op == Op.EXPR_STMT) {
        expr = lowerExp(((Ast.ExprStmt) stmt).exp);
      } else {
        stmts.addAll(lowerStmt(stmt));
      }
    }
    final LoweredId id = ids.lower(b.id);
    final Ast.@Nullable UnsafeSource unsafeSource =
        b.rules == Ast.BlockCheckMode.DEFAULT
            ? null
            : Ast.UnsafeSource.USER_PROVIDED;
    return core.block(id, stmts, expr, b.rules, unsafeSource, b.pos,
        targetedByBreak);
  }

  private List<Core.Stmt> lowerStmt(Ast.Stmt s) {
    switch (s.op) {
      case LOCAL_STMT:
        final Core.Local local = lowerLocal(((Ast.LocalStmt) s).local);
        return ImmutableList.of(core.localStmt(ids.lower(s.id), local));

      case ITEM_STMT:
        // The statement's own id goes to the first item; the rest get
        // fresh ids
        final List<Core.Stmt> stmts = new ArrayList<>();
        for (int itemId : lowerItemIds(((Ast.ItemStmt) s).item)) {
          final LoweredId id = stmts.isEmpty() ? ids.lower(s.id) : ids.fresh();
          stmts.add(core.itemStmt(id, itemId, s.pos));
        }
        return stmts;

      case EXPR_STMT:
        final Core.Exp exp = lowerExp(((Ast.ExprStmt) s).exp);
        return ImmutableList.of(core.exprStmt(ids.lower(s.id), exp, s.pos));

      case SEMI_STMT:
        final Core.Exp semiExp = lowerExp(((Ast.SemiStmt) s).exp);
        return ImmutableList.of(core.semiStmt(ids.lower(s.id), semiExp, s.pos));

      case MAC_STMT:
        throw new AssertionError("statement macro should have been expanded: "
            + s);

      default:
        throw new AssertionError("unknown statement " + s.op);
    }
  }

  private Core.Local lowerLocal(Ast.Local local) {
    final LoweredId id = ids.lower(local.id);
    final Core.@Nullable Ty ty = local.ty == null
        ? null
        : lowerTy(local.ty, OpaqueContext.DISALLOWED);
    final Core.Pat pat = lowerPat(local.pat);
    final Core.@Nullable Exp init =
        local.init == null ? null : lowerExp(local.init);
    return core.local(id, pat, ty, init, local.pos, local.attrs,
        Core.LocalSource.NORMAL);
  }

  private Core.Arm lowerArm(Ast.Arm arm) {
    final ImmutableList<Core.Pat> pats =
        transformEager(arm.pats, this::lowerPat);
    final Core.@Nullable Exp guard =
        arm.guard == null ? null : lowerExp(arm.guard);
    return core.arm(arm.attrs, pats, guard, lowerExp(arm.body));
  }

  /** Lowers a body of a function, closure or constant, and adds it to the
   * table of bodies. Returns the id of the body, which is the id of its
   * value. */
  int lowerBody(Ast.@Nullable FnDecl decl, Supplier<Core.Exp> f) {
    return scopes.withGeneratorScope(() -> {
      final Core.Exp value = f.get();
      final ImmutableList<Core.Arg> args = decl == null
          ? ImmutableList.of()
          : transformEager(decl.inputs, arg -> {
            final LoweredId id = ids.lower(arg.id);
            return core.arg(id, lowerPat(arg.pat));
          });
      bodies.put(value.id.nodeId,
          core.body(args, value, scopes.isGenerator()));
      return value.id.nodeId;
    });
  }

  // expressions

  /** Creates the core expression for a surface expression, with the
   * surface expression's id, position and attributes. */
  Core.Exp toExp(Ast.Exp e, Core.ExpKind kind) {
    return core.exp(ids.lower(e.id), kind, e.pos, e.attrs);
  }

  Core.Exp lowerExp(Ast.Exp e) {
    final Core.ExpKind kind;
    switch (e.op) {
      case IF_LET:
      case WHILE_LET:
      case FOR_LOOP:
      case TRY:
      case CATCH:
      case RANGE:
      case IN_PLACE:
      case PAREN:
        return desugarer.desugar(e);

      case BOX:
        kind = core.box(lowerExp(((Ast.Box) e).exp));
        break;
      case ARRAY:
        kind = core.array(transformEager(((Ast.Array) e).exps, this::lowerExp));
        break;
      case REPEAT:
        final Ast.Repeat repeat = (Ast.Repeat) e;
        final Core.Exp value = lowerExp(repeat.value);
        kind =
            core.repeat(value, lowerBody(null, () -> lowerExp(repeat.count)));
        break;
      case TUP:
        kind = core.tup(transformEager(((Ast.Tup) e).exps, this::lowerExp));
        break;
      case CALL:
        final Ast.Call call = (Ast.Call) e;
        final Core.Exp fn = lowerExp(call.fn);
        kind = core.call(fn, transformEager(call.args, this::lowerExp));
        break;
      case METHOD_CALL:
        final Ast.MethodCall methodCall = (Ast.MethodCall) e;
        final Core.PathSegment segment =
            lowerPathSegment(e.pos, methodCall.segment, ParamMode.OPTIONAL, 0,
                ParenthesizedArgs.ERR, OpaqueContext.DISALLOWED);
        kind = core.methodCall(segment, methodCall.segment.pos,
            transformEager(methodCall.args, this::lowerExp));
        break;
      case BINARY:
        final Ast.Binary binary = (Ast.Binary) e;
        final Core.Exp left = lowerExp(binary.left);
        kind = core.binary(binary.binOp, left, lowerExp(binary.right));
        break;
      case UNARY:
        final Ast.Unary unary = (Ast.Unary) e;
        kind = core.unary(unary.unOp, lowerExp(unary.exp));
        break;
      case LIT:
        kind = core.litExp(((Ast.LitExp) e).literal);
        break;
      case CAST:
        final Ast.Cast cast = (Ast.Cast) e;
        final Core.Exp castExp = lowerExp(cast.exp);
        kind = core.cast(castExp, lowerTy(cast.ty, OpaqueContext.DISALLOWED));
        break;
      case TYPE_ASCRIPTION:
        final Ast.TypeAscription ascription = (Ast.TypeAscription) e;
        final Core.Exp ascribed = lowerExp(ascription.exp);
        kind = core.typeAscription(ascribed,
            lowerTy(ascription.ty, OpaqueContext.DISALLOWED));
        break;
      case ADDR_OF:
        final Ast.AddrOf addrOf = (Ast.AddrOf) e;
        kind = core.addrOf(addrOf.mutability, lowerExp(addrOf.exp));
        break;
      case IF:
        kind = lowerIf((Ast.If) e);
        break;
      case WHILE:
        final Ast.While aWhile = (Ast.While) e;
        kind = scopes.withLoopScope(e.id, () -> {
          final Core.Exp condition =
              scopes.withLoopCondition(() -> lowerExp(aWhile.condition));
          return core.while_(condition, lowerBlock(aWhile.body, false),
              aWhile.label);
        });
        break;
      case LOOP:
        final Ast.Loop loop = (Ast.Loop) e;
        kind = scopes.withLoopScope(e.id, () ->
            core.loop(lowerBlock(loop.body, false), loop.label,
                Core.LoopSource.LOOP));
        break;
      case MATCH:
        final Ast.Match match = (Ast.Match) e;
        final Core.Exp matchExp = lowerExp(match.exp);
        kind = core.match(matchExp, transformEager(match.arms, this::lowerArm),
            Core.MatchSource.NORMAL);
        break;
      case CLOSURE:
        kind = lowerClosure((Ast.Closure) e);
        break;
      case BLOCK_EXP:
        kind = core.blockExp(lowerBlock(((Ast.BlockExp) e).block, false));
        break;
      case ASSIGN:
        final Ast.Assign assign = (Ast.Assign) e;
        final Core.Exp target = lowerExp(assign.target);
        kind = core.assign(target, lowerExp(assign.value));
        break;
      case ASSIGN_OP:
        final Ast.AssignOp assignOp = (Ast.AssignOp) e;
        final Core.Exp opTarget = lowerExp(assignOp.target);
        kind = core.assignOp(assignOp.binOp, opTarget,
            lowerExp(assignOp.value));
        break;
      case FIELD_ACCESS:
        final Ast.FieldAccess fieldAccess = (Ast.FieldAccess) e;
        kind = core.fieldAccess(lowerExp(fieldAccess.exp), fieldAccess.name);
        break;
      case TUP_FIELD:
        final Ast.TupField tupField = (Ast.TupField) e;
        kind = core.tupField(lowerExp(tupField.exp), tupField.index);
        break;
      case INDEX:
        final Ast.Index index = (Ast.Index) e;
        final Core.Exp indexed = lowerExp(index.exp);
        kind = core.index(indexed, lowerExp(index.index));
        break;
      case PATH_EXP:
        final Ast.PathExp pathExp = (Ast.PathExp) e;
        kind = core.pathExp(
            lowerQPath(e.id, pathExp.qself, pathExp.path, ParamMode.OPTIONAL,
                OpaqueContext.DISALLOWED));
        break;
      case BREAK:
        final Ast.Break aBreak = (Ast.Break) e;
        final Core.Destination breakDestination =
            jumpDestination(aBreak.label, e.id);
        kind = core.break_(breakDestination,
            aBreak.exp == null ? null : lowerExp(aBreak.exp));
        break;
      case CONTINUE:
        kind = core.continue_(jumpDestination(((Ast.Continue) e).label, e.id));
        break;
      case RET:
        final Ast.Ret ret = (Ast.Ret) e;
        kind = core.ret(ret.exp == null ? null : lowerExp(ret.exp));
        break;
      case STRUCT_EXP:
        final Ast.StructExp structExp = (Ast.StructExp) e;
        final Core.QPath structPath =
            lowerQPath(e.id, null, structExp.path, ParamMode.OPTIONAL,
                OpaqueContext.DISALLOWED);
        final ImmutableList<Core.Field> fields =
            transformEager(structExp.fields, f ->
                core.field(f.name, f.namePos, lowerExp(f.exp), f.pos,
                    f.shorthand));
        kind = core.structExp(structPath, fields,
            structExp.base == null ? null : lowerExp(structExp.base));
        break;
      case YIELD:
        final Ast.Yield yield = (Ast.Yield) e;
        scopes.markGenerator();
        kind = core.yield_(yield.exp == null
            ? builder.unitExp(e.pos)
            : lowerExp(yield.exp));
        break;
      case MAC_EXP:
        throw new AssertionError("expression macro should have been expanded: "
            + e);
      default:
        throw new AssertionError("unknown expression " + e.op);
    }
    return toExp(e, kind);
  }

  /** Lowers an {@code if}. An {@code else if let} branch is wrapped in a
   * block. */
  private Core.ExpKind lowerIf(Ast.If e) {
    final Core.@Nullable Exp ifFalse;
    if (e.ifFalse == null) {
      ifFalse = null;
    } else if (e.ifFalse.op == Op.IF_LET) {
      final Core.Exp ifLet = lowerExp(e.ifFalse);
      ifFalse =
          builder.blockExp(
              builder.block(e.ifFalse.pos, ImmutableList.of(), ifLet));
    } else {
      ifFalse = lowerExp(e.ifFalse);
    }
    final Core.Exp ifTrue = builder.blockExp(lowerBlock(e.ifTrue, false));
    return core.if_(lowerExp(e.condition), ifTrue, ifFalse);
  }

  private Core.ExpKind lowerClosure(Ast.Closure closure) {
    return scopes.withFreshFunctionScopes(() -> {
      final boolean[] generator = {false};
      final int bodyId =
          lowerBody(closure.decl, () -> {
            final Core.Exp value = lowerExp(closure.body);
            generator[0] = scopes.isGenerator();
            return value;
          });
      if (generator[0] && !closure.decl.inputs.isEmpty()) {
        throw new CompileException("generators cannot have explicit "
            + "arguments", false, closure.declPos, "E0628");
      }
      return core.closure(closure.captureBy,
          lowerFnDecl(closure.decl, null, false), bodyId, closure.declPos,
          generator[0]);
    });
  }

  /** Returns the destination of a {@code break} or {@code continue}. An
   * unlabeled jump in the condition of a {@code while} loop is an
   * error. */
  private Core.Destination jumpDestination(@Nullable Label label,
      int expId) {
    if (label == null && scopes.inLoopCondition()) {
      return core.destination(null,
          Core.ScopeTarget.loopError(
              Core.LoopIdError.UNLABELED_CF_IN_WHILE_CONDITION));
    }
    return loopDestination(label, expId);
  }

  /** Returns the loop that a jump targets: the loop that its label names,
   * or if it has no label, the innermost loop. */
  Core.Destination loopDestination(@Nullable Label label, int expId) {
    if (label != null) {
      final Def def = expectFullDef(expId);
      final Core.ScopeTarget target = def.kind == Def.Kind.LABEL
          ? Core.ScopeTarget.loop(ids.lower(def.nodeId()).nodeId)
          : Core.ScopeTarget.loopError(Core.LoopIdError.UNRESOLVED_LABEL);
      return core.destination(label, target);
    }
    final @Nullable Integer loopId = scopes.innermostLoop();
    final Core.ScopeTarget target = loopId != null
        ? Core.ScopeTarget.loop(ids.lower(loopId).nodeId)
        : Core.ScopeTarget.loopError(Core.LoopIdError.OUTSIDE_LOOP_SCOPE);
    return core.destination(null, target);
  }

  /** Whether a path segment may omit its type parameters. */
  private enum ParamMode {
    /** Parameters must be given, as in types and in {@code use} paths. */
    EXPLICIT,
    /** Parameters may be omitted, as in expressions and patterns. */
    OPTIONAL
  }

  /** What to do with parenthesized parameters, such as {@code Fn(A) -> B},
   * on a path segment. */
  private enum ParenthesizedArgs {
    OK,
    WARN,
    ERR
  }

  /** Name and visibility of an item that a use tree is lowering. */
  private static class UseTarget {
    String name;
    Core.Visibility vis;

    UseTarget(String name, Core.Visibility vis) {
      this.name = name;
      this.vis = vis;
    }
  }

  /** Registers owners and counts region parameters, before any item is
   * lowered. */
  private class OwnerCollector extends Visitor {
    @Override protected void visit(Ast.Item item) {
      ids.beginOwner(item.id);
      switch (item.op) {
        case STRUCT:
        case UNION:
        case ENUM:
        case TY_ALIAS:
        case TRAIT:
          regionCounts.put(definitions.localDefId(item.id),
              requireNonNull(item.generics()).regions.size());
          break;
        default:
          break;
      }
      super.visit(item);
    }

    @Override protected void visit(Ast.TraitItem traitItem) {
      ids.beginOwner(traitItem.id);
      super.visit(traitItem);
    }

    @Override protected void visit(Ast.ImplItem implItem) {
      ids.beginOwner(implItem.id);
      super.visit(implItem);
    }
  }

  /** Lowers each item, trait item and impl item into the crate's tables,
   * including items nested in function bodies. */
  private class ItemLowerer extends Visitor {
    @Override protected void visit(Ast.Item item) {
      final Core.@Nullable Item lowered =
          ids.withOwner(item.id, () -> lowerItem(item));
      if (lowered == null) {
        return;
      }
      items.put(item.id, lowered);

      // The items of an impl or trait can see its regions
      final List<String> regionNames;
      switch (lowered.kind.op) {
        case IMPL:
          regionNames = coreNames(((Core.Impl) lowered.kind).generics.regions);
          break;
        case TRAIT:
          regionNames =
              coreNames(((Core.Trait) lowered.kind).generics.regions);
          break;
        default:
          regionNames = ImmutableList.of();
      }
      regions.withVisibleRegions(regionNames, () -> {
        if (item.op == Op.IMPL) {
          scopes.withTraitImpl(((Ast.Impl) item).traitRef != null,
              () -> super.visit(item));
        } else {
          super.visit(item);
        }
        return null;
      });
    }

    @Override protected void visit(Ast.TraitItem traitItem) {
      ids.withOwner(traitItem.id, () -> {
        traitItems.put(traitItem.id, lowerTraitItem(traitItem));
      });
      super.visit(traitItem);
    }

    @Override protected void visit(Ast.ImplItem implItem) {
      ids.withOwner(implItem.id, () -> {
        implItems.put(implItem.id, lowerImplItem(implItem));
      });
      super.visit(implItem);
    }
  }
}

// End Lowerer.java
