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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Core tree: the canonical tree that lowering produces from the surface
 * tree ({@link Ast}).
 *
 * <p>Syntactic sugar does not occur in the core tree: {@code for},
 * {@code while let}, {@code if let}, {@code ?}, {@code catch}, placement,
 * range and parenthesized expressions have been rewritten in terms of
 * {@link Loop}, {@link Match}, {@link Call} and friends. Every node that has
 * an identity carries a {@link LoweredId}.
 *
 * <p>Expressions, patterns, types and items consist of a wrapper that holds
 * identity, position and attributes, and a "kind" node that holds the
 * contents. This class functions as a namespace, so that we can define the
 * node classes with the same names as in {@link Ast}. Nodes are created via
 * {@link CoreBuilder}.
 */
public class Core {
  private Core() {}

  /** How a binding pattern binds its value. */
  public enum BindingAnnotation {
    UNANNOTATED(""),
    MUTABLE("mut "),
    REF("ref "),
    REF_MUT("ref mut ");

    public final String prefix;

    BindingAnnotation(String prefix) {
      this.prefix = prefix;
    }
  }

  /** What kind of source construct a loop was lowered from. */
  public enum LoopSource {
    LOOP,
    WHILE_LET,
    FOR_LOOP
  }

  /** What kind of source construct a local variable was lowered from. */
  public enum LocalSource {
    NORMAL,
    FOR_LOOP_DESUGAR
  }

  /** Why the target of a {@code break} or {@code continue} is invalid. */
  public enum LoopIdError {
    OUTSIDE_LOOP_SCOPE,
    UNLABELED_CF_IN_WHILE_CONDITION,
    UNRESOLVED_LABEL
  }

  /** Kind of a lowered {@code use} item. */
  public enum UseKind {
    SINGLE,
    GLOB,
    LIST_STEM
  }

  /** Kind of an associated item. */
  public enum AssociatedItemKind {
    CONST,
    METHOD,
    TYPE
  }

  /** What kind of source construct a match was lowered from. */
  public static final class MatchSource {
    public static final MatchSource NORMAL = new MatchSource(Kind.NORMAL,
        false);
    public static final MatchSource WHILE_LET_DESUGAR =
        new MatchSource(Kind.WHILE_LET_DESUGAR, false);
    public static final MatchSource FOR_LOOP_DESUGAR =
        new MatchSource(Kind.FOR_LOOP_DESUGAR, false);
    public static final MatchSource TRY_DESUGAR =
        new MatchSource(Kind.TRY_DESUGAR, false);

    public final Kind kind;
    /** For {@link Kind#IF_LET_DESUGAR}, whether there was an else clause. */
    public final boolean containsElseClause;

    private MatchSource(Kind kind, boolean containsElseClause) {
      this.kind = kind;
      this.containsElseClause = containsElseClause;
    }

    /** Returns the source of a match lowered from {@code if let}. */
    public static MatchSource ifLet(boolean containsElseClause) {
      return new MatchSource(Kind.IF_LET_DESUGAR, containsElseClause);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, containsElseClause);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MatchSource
              && kind == ((MatchSource) o).kind
              && containsElseClause == ((MatchSource) o).containsElseClause;
    }

    @Override
    public String toString() {
      return kind == Kind.IF_LET_DESUGAR
          ? kind + "(" + containsElseClause + ")"
          : kind.toString();
    }

    /** Kind of match source. */
    public enum Kind {
      NORMAL,
      IF_LET_DESUGAR,
      WHILE_LET_DESUGAR,
      FOR_LOOP_DESUGAR,
      TRY_DESUGAR
    }
  }

  /**
   * Target of a {@code break} or {@code continue}: a block (only for breaks
   * out of a {@code catch} block) or a loop, or an error that explains why
   * there is no loop.
   */
  public static final class ScopeTarget {
    public final Kind kind;
    /** Node id of the target block or loop; -1 if there is an error. */
    public final int nodeId;
    public final @Nullable LoopIdError error;

    private ScopeTarget(Kind kind, int nodeId, @Nullable LoopIdError error) {
      this.kind = kind;
      this.nodeId = nodeId;
      this.error = error;
    }

    public static ScopeTarget block(int nodeId) {
      return new ScopeTarget(Kind.BLOCK, nodeId, null);
    }

    public static ScopeTarget loop(int nodeId) {
      return new ScopeTarget(Kind.LOOP, nodeId, null);
    }

    public static ScopeTarget loopError(LoopIdError error) {
      return new ScopeTarget(Kind.LOOP, -1, requireNonNull(error));
    }

    public boolean isError() {
      return error != null;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, nodeId, error);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ScopeTarget
              && kind == ((ScopeTarget) o).kind
              && nodeId == ((ScopeTarget) o).nodeId
              && error == ((ScopeTarget) o).error;
    }

    @Override
    public String toString() {
      return error != null ? kind + "(" + error + ")" : kind + "(" + nodeId
          + ")";
    }

    /** Kind of scope target. */
    public enum Kind {
      BLOCK,
      LOOP
    }
  }

  /** Destination of a {@code break} or {@code continue}. */
  public static final class Destination {
    public final @Nullable Label label;
    public final ScopeTarget target;

    Destination(@Nullable Label label, ScopeTarget target) {
      this.label = label;
      this.target = requireNonNull(target);
    }

    @Override
    public String toString() {
      return label == null ? target.toString() : label + " " + target;
    }
  }

  /** Name of a region, or one of the special regions. */
  public static final class RegionName {
    /** Region elided in a position where it is not written. */
    public static final RegionName IMPLICIT =
        new RegionName(Kind.IMPLICIT, "'_");
    /** Region written as {@code '_}. */
    public static final RegionName UNDERSCORE =
        new RegionName(Kind.UNDERSCORE, "'_");
    /** The {@code 'static} region. */
    public static final RegionName STATIC = new RegionName(Kind.STATIC,
        "'static");

    public final Kind kind;
    public final String name;

    private RegionName(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    /** Creates a named region. */
    public static RegionName of(String name) {
      return new RegionName(Kind.NAME, name);
    }

    /** Returns whether this region was not written by the user. */
    public boolean isElided() {
      return kind == Kind.IMPLICIT || kind == Kind.UNDERSCORE;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RegionName
              && kind == ((RegionName) o).kind
              && name.equals(((RegionName) o).name);
    }

    @Override
    public String toString() {
      return name;
    }

    /** Kind of region name. */
    public enum Kind {
      IMPLICIT,
      UNDERSCORE,
      STATIC,
      NAME
    }
  }

  // crate structure

  /** Result of lowering a crate. */
  public static class CompUnit {
    public final Module module;
    public final ImmutableList<Attribute> attrs;
    public final Pos pos;
    /** Items, keyed by node id. */
    public final ImmutableSortedMap<Integer, Item> items;
    /** Items declared in traits, keyed by node id. */
    public final ImmutableSortedMap<Integer, TraitItem> traitItems;
    /** Items declared in impls, keyed by node id. */
    public final ImmutableSortedMap<Integer, ImplItem> implItems;
    /** Bodies of functions, closures and constants, keyed by body id. */
    public final ImmutableSortedMap<Integer, Body> bodies;
    /** Ids of bodies, in order of the position of the body's value. */
    public final ImmutableList<Integer> bodyIds;
    /** For each trait, the node ids of the impls that implement it. */
    public final ImmutableMap<DefId, ImmutableList<Integer>> traitImpls;
    /** For each auto trait, the node id of its auto impl. */
    public final ImmutableMap<DefId, Integer> traitAutoImpl;
    /** Identity of each surface node, indexed by node id. */
    public final ImmutableList<CoreId> nodeIdToCoreId;
    /** Macro definitions that other crates can use, in declaration
     * order. */
    public final ImmutableList<MacroDef> exportedMacros;

    CompUnit(
        Module module,
        ImmutableList<Attribute> attrs,
        Pos pos,
        ImmutableSortedMap<Integer, Item> items,
        ImmutableSortedMap<Integer, TraitItem> traitItems,
        ImmutableSortedMap<Integer, ImplItem> implItems,
        ImmutableSortedMap<Integer, Body> bodies,
        ImmutableList<Integer> bodyIds,
        ImmutableMap<DefId, ImmutableList<Integer>> traitImpls,
        ImmutableMap<DefId, Integer> traitAutoImpl,
        ImmutableList<CoreId> nodeIdToCoreId,
        ImmutableList<MacroDef> exportedMacros) {
      this.module = requireNonNull(module);
      this.attrs = requireNonNull(attrs);
      this.pos = requireNonNull(pos);
      this.items = requireNonNull(items);
      this.traitItems = requireNonNull(traitItems);
      this.implItems = requireNonNull(implItems);
      this.bodies = requireNonNull(bodies);
      this.bodyIds = requireNonNull(bodyIds);
      this.traitImpls = requireNonNull(traitImpls);
      this.traitAutoImpl = requireNonNull(traitAutoImpl);
      this.nodeIdToCoreId = requireNonNull(nodeIdToCoreId);
      this.exportedMacros = requireNonNull(exportedMacros);
    }

    /** Returns the body with a given id; throws if not found. */
    public Body body(int bodyId) {
      final Body body = bodies.get(bodyId);
      if (body == null) {
        throw new IllegalArgumentException("no body " + bodyId);
      }
      return body;
    }

    /** Returns the item with a given id; throws if not found. */
    public Item item(int itemId) {
      final Item item = items.get(itemId);
      if (item == null) {
        throw new IllegalArgumentException("no item " + itemId);
      }
      return item;
    }

    /** Returns the first item with a given name; throws if not found. */
    public Item item(String name) {
      for (Item item : items.values()) {
        if (item.name.equals(name)) {
          return item;
        }
      }
      throw new IllegalArgumentException("no item " + name);
    }
  }

  /** Contents of a module: the ids of its items. */
  public static class Module extends AstNode {
    public final ImmutableList<Integer> itemIds;

    Module(Pos inner, ImmutableList<Integer> itemIds) {
      super(inner, Op.MODULE);
      this.itemIds = requireNonNull(itemIds);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < itemIds.size(); i++) {
        w.append(i > 0 ? " #" : "#").append(itemIds.get(i).toString());
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Visibility. */
  public static class Visibility extends AstNode {
    public static final Visibility PUBLIC =
        new Visibility(Ast.VisibilityKind.PUBLIC, null, null);
    public static final Visibility CRATE =
        new Visibility(Ast.VisibilityKind.CRATE, null, null);
    public static final Visibility INHERITED =
        new Visibility(Ast.VisibilityKind.INHERITED, null, null);

    public final Ast.VisibilityKind kind;
    public final @Nullable Path path;
    public final @Nullable LoweredId id;

    Visibility(
        Ast.VisibilityKind kind,
        @Nullable Path path,
        @Nullable LoweredId id) {
      super(Pos.ZERO, Op.VISIBILITY);
      this.kind = requireNonNull(kind);
      this.path = path;
      this.id = id;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(kind.prefix);
      if (path != null) {
        w.append("(in ").append(path).append(") ");
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Body of a function, closure, constant or static: the argument patterns
   * and the value. */
  public static class Body extends AstNode {
    public final ImmutableList<Arg> arguments;
    public final Exp value;
    public final boolean isGenerator;

    Body(ImmutableList<Arg> arguments, Exp value, boolean isGenerator) {
      super(value.pos, Op.BODY);
      this.arguments = requireNonNull(arguments);
      this.value = requireNonNull(value);
      this.isGenerator = isGenerator;
    }

    /** Returns the id of this body, which is the node id of its value. */
    public int id() {
      return value.id.nodeId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("|").appendAll(arguments, ", ").append("| ")
          .append(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Argument of a body. */
  public static class Arg extends AstNode {
    public final LoweredId id;
    public final Pat pat;

    Arg(LoweredId id, Pat pat) {
      super(pat.pos, Op.ARG);
      this.id = requireNonNull(id);
      this.pat = requireNonNull(pat);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // items

  /** Item. Its contents are in {@link #kind}. */
  public static class Item extends AstNode {
    public final LoweredId id;
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final ItemKind kind;
    public final Visibility vis;

    Item(
        LoweredId id,
        String name,
        ImmutableList<Attribute> attrs,
        ItemKind kind,
        Visibility vis,
        Pos pos) {
      super(pos, Op.ITEM);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.kind = requireNonNull(kind);
      this.vis = requireNonNull(vis);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Attribute attr : attrs) {
        w.append(attr).append(" ");
      }
      return kind.unparseItem(w.append(vis), name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Macro definition that is visible outside the crate. Unlike an
   * {@link Item}, it keeps its surface node id. */
  public static class MacroDef extends AstNode {
    public final String name;
    public final Visibility vis;
    public final ImmutableList<Attribute> attrs;
    public final int nodeId;
    public final String body;
    public final boolean legacy;

    MacroDef(
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        int nodeId,
        Pos pos,
        String body,
        boolean legacy) {
      super(pos, Op.MACRO_DEF);
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.attrs = requireNonNull(attrs);
      this.nodeId = nodeId;
      this.body = requireNonNull(body);
      this.legacy = legacy;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Attribute attr : attrs) {
        w.append(attr).append(" ");
      }
      return w.append(vis).append(legacy ? "macro_rules! " : "macro ")
          .id(name).append(" { ").append(body).append(" }");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of an item. */
  public abstract static class ItemKind extends AstNode {
    ItemKind(Op op) {
      super(Pos.ZERO, op);
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      return unparseItem(w, "_");
    }

    abstract AstWriter unparseItem(AstWriter w, String name);
  }

  /** {@code extern crate NAME;} */
  public static class ExternCrate extends ItemKind {
    public final @Nullable String orig;

    ExternCrate(@Nullable String orig) {
      super(Op.EXTERN_CRATE);
      this.orig = orig;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      w.append("extern crate ");
      if (orig != null) {
        w.id(orig).append(" as ");
      }
      return w.id(name).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code use PATH;}, {@code use PATH::*;}, or the stem of a nested
   * {@code use PATH::{...};}. */
  public static class Use extends ItemKind {
    public final Path path;
    public final UseKind useKind;

    Use(Path path, UseKind useKind) {
      super(Op.USE);
      this.path = requireNonNull(path);
      this.useKind = requireNonNull(useKind);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      w.append("use ").append(path);
      switch (useKind) {
        case GLOB:
          return w.append("::*;");
        case LIST_STEM:
          return w.append("::{};");
        default:
          if (path.segments.isEmpty()
              || !path.segments.get(path.segments.size() - 1).name
                  .equals(name)) {
            w.append(" as ").id(name);
          }
          return w.append(";");
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code static NAME: TY = BODY;} */
  public static class StaticItem extends ItemKind {
    public final Ty ty;
    public final Ast.Mutability mutability;
    public final int bodyId;

    StaticItem(Ty ty, Ast.Mutability mutability, int bodyId) {
      super(Op.STATIC);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("static ")
          .append(mutability == Ast.Mutability.MUTABLE ? "mut " : "")
          .id(name).append(": ").append(ty)
          .append(" = #").append(Integer.toString(bodyId)).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code const NAME: TY = BODY;} */
  public static class ConstItem extends ItemKind {
    public final Ty ty;
    public final int bodyId;

    ConstItem(Ty ty, int bodyId) {
      super(Op.CONST);
      this.ty = requireNonNull(ty);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("const ").id(name).append(": ").append(ty)
          .append(" = #").append(Integer.toString(bodyId)).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function. */
  public static class FnItem extends ItemKind {
    public final FnDecl decl;
    public final Ast.Unsafety unsafety;
    public final Ast.Constness constness;
    public final String abi;
    public final Generics generics;
    public final int bodyId;

    FnItem(
        FnDecl decl,
        Ast.Unsafety unsafety,
        Ast.Constness constness,
        String abi,
        Generics generics,
        int bodyId) {
      super(Op.FN);
      this.decl = requireNonNull(decl);
      this.unsafety = requireNonNull(unsafety);
      this.constness = requireNonNull(constness);
      this.abi = requireNonNull(abi);
      this.generics = requireNonNull(generics);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      if (constness == Ast.Constness.CONST) {
        w.append("const ");
      }
      if (unsafety == Ast.Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      w.append("fn ").id(name).append(generics);
      return decl.unparseSignature(w).append(generics.whereClause)
          .append(" #").append(Integer.toString(bodyId));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code mod NAME { ITEMS }} */
  public static class ModItem extends ItemKind {
    public final Module module;

    ModItem(Module module) {
      super(Op.MOD);
      this.module = requireNonNull(module);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("mod ").id(name).append(" {").append(module)
          .append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code extern "ABI" { ITEMS }} */
  public static class ForeignMod extends ItemKind {
    public final String abi;
    public final ImmutableList<ForeignItem> items;

    ForeignMod(String abi, ImmutableList<ForeignItem> items) {
      super(Op.FOREIGN_MOD);
      this.abi = requireNonNull(abi);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("extern \"").append(abi).append("\" {")
          .appendAll(" ", items, " ", " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code type NAME = TY;} */
  public static class TyAlias extends ItemKind {
    public final Ty ty;
    public final Generics generics;

    TyAlias(Ty ty, Generics generics) {
      super(Op.TY_ALIAS);
      this.ty = requireNonNull(ty);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("type ").id(name).append(generics).append(" = ")
          .append(ty).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code enum NAME { VARIANTS }} */
  public static class EnumItem extends ItemKind {
    public final ImmutableList<Variant> variants;
    public final Generics generics;

    EnumItem(ImmutableList<Variant> variants, Generics generics) {
      super(Op.ENUM);
      this.variants = requireNonNull(variants);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("enum ").id(name).append(generics).append(" {")
          .appendAll(" ", variants, ", ", " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code struct NAME { FIELDS }} */
  public static class StructItem extends ItemKind {
    public final VariantData data;
    public final Generics generics;

    StructItem(VariantData data, Generics generics) {
      super(Op.STRUCT);
      this.data = requireNonNull(data);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("struct ").id(name).append(generics).append(data);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code union NAME { FIELDS }} */
  public static class UnionItem extends ItemKind {
    public final VariantData data;
    public final Generics generics;

    UnionItem(VariantData data, Generics generics) {
      super(Op.UNION);
      this.data = requireNonNull(data);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("union ").id(name).append(generics).append(data);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code impl TRAIT for .. {}} */
  public static class AutoImpl extends ItemKind {
    public final Ast.Unsafety unsafety;
    public final TraitRef traitRef;

    AutoImpl(Ast.Unsafety unsafety, TraitRef traitRef) {
      super(Op.AUTO_IMPL);
      this.unsafety = requireNonNull(unsafety);
      this.traitRef = requireNonNull(traitRef);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      if (unsafety == Ast.Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      return w.append("impl ").append(traitRef).append(" for .. {}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Implementation of a trait for a type, or an inherent impl. */
  public static class Impl extends ItemKind {
    public final Ast.Unsafety unsafety;
    public final Ast.ImplPolarity polarity;
    public final Ast.Defaultness defaultness;
    public final Generics generics;
    public final @Nullable TraitRef traitRef;
    public final Ty selfTy;
    public final ImmutableList<ImplItemRef> itemRefs;

    Impl(
        Ast.Unsafety unsafety,
        Ast.ImplPolarity polarity,
        Ast.Defaultness defaultness,
        Generics generics,
        @Nullable TraitRef traitRef,
        Ty selfTy,
        ImmutableList<ImplItemRef> itemRefs) {
      super(Op.IMPL);
      this.unsafety = requireNonNull(unsafety);
      this.polarity = requireNonNull(polarity);
      this.defaultness = requireNonNull(defaultness);
      this.generics = requireNonNull(generics);
      this.traitRef = traitRef;
      this.selfTy = requireNonNull(selfTy);
      this.itemRefs = requireNonNull(itemRefs);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      if (unsafety == Ast.Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      w.append("impl").append(generics).append(" ");
      if (traitRef != null) {
        w.append(polarity == Ast.ImplPolarity.NEGATIVE ? "!" : "")
            .append(traitRef).append(" for ");
      }
      return w.append(selfTy).append(" {")
          .appendAll(" ", itemRefs, " ", " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code trait NAME: BOUNDS { ITEMS }} */
  public static class Trait extends ItemKind {
    public final Ast.IsAuto isAuto;
    public final Ast.Unsafety unsafety;
    public final Generics generics;
    public final ImmutableList<Bound> bounds;
    public final ImmutableList<TraitItemRef> itemRefs;

    Trait(
        Ast.IsAuto isAuto,
        Ast.Unsafety unsafety,
        Generics generics,
        ImmutableList<Bound> bounds,
        ImmutableList<TraitItemRef> itemRefs) {
      super(Op.TRAIT);
      this.isAuto = requireNonNull(isAuto);
      this.unsafety = requireNonNull(unsafety);
      this.generics = requireNonNull(generics);
      this.bounds = requireNonNull(bounds);
      this.itemRefs = requireNonNull(itemRefs);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      if (isAuto == Ast.IsAuto.YES) {
        w.append("auto ");
      }
      if (unsafety == Ast.Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      return w.append("trait ").id(name).append(generics)
          .appendAll(": ", bounds, " + ", "")
          .append(" {").appendAll(" ", itemRefs, " ", " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code trait NAME = BOUNDS;} */
  public static class TraitAlias extends ItemKind {
    public final Generics generics;
    public final ImmutableList<Bound> bounds;

    TraitAlias(Generics generics, ImmutableList<Bound> bounds) {
      super(Op.TRAIT_ALIAS);
      this.generics = requireNonNull(generics);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("trait ").id(name).append(generics).append(" = ")
          .appendAll(bounds, " + ").append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Variant of an enum. */
  public static class Variant extends AstNode {
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final VariantData data;
    /** Body that computes the discriminant, or null. */
    public final @Nullable Integer disrBodyId;

    Variant(
        Pos pos,
        String name,
        ImmutableList<Attribute> attrs,
        VariantData data,
        @Nullable Integer disrBodyId) {
      super(pos, Op.VARIANT);
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.data = requireNonNull(data);
      this.disrBodyId = disrBodyId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.id(name).append(data);
      if (disrBodyId != null) {
        w.append(" = #").append(disrBodyId.toString());
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Fields of a struct, union or variant. */
  public static class VariantData extends AstNode {
    public final Ast.VariantKind kind;
    public final ImmutableList<StructField> fields;
    public final LoweredId id;

    VariantData(
        Ast.VariantKind kind,
        ImmutableList<StructField> fields,
        LoweredId id) {
      super(Pos.ZERO, Op.VARIANT_DATA);
      this.kind = requireNonNull(kind);
      this.fields = requireNonNull(fields);
      this.id = requireNonNull(id);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (kind) {
        case STRUCT:
          return w.append(" {").appendAll(" ", fields, ", ", " ").append("}");
        case TUPLE:
          return w.append("(").appendAll(fields, ", ").append(")");
        default:
          return w;
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field of a struct, union or variant. */
  public static class StructField extends AstNode {
    public final LoweredId id;
    /** Name of the field; for tuple structs, its ordinal. */
    public final String name;
    public final Visibility vis;
    public final Ty ty;
    public final ImmutableList<Attribute> attrs;

    StructField(
        Pos pos,
        LoweredId id,
        String name,
        Visibility vis,
        Ty ty,
        ImmutableList<Attribute> attrs) {
      super(pos, Op.STRUCT_FIELD);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.ty = requireNonNull(ty);
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(vis).id(name).append(": ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // associated and foreign items

  /** Item declared in a trait. Its contents are in {@link #kind}. */
  public static class TraitItem extends AstNode {
    public final LoweredId id;
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final Generics generics;
    public final TraitItemKind kind;

    TraitItem(
        LoweredId id,
        String name,
        ImmutableList<Attribute> attrs,
        Generics generics,
        TraitItemKind kind,
        Pos pos) {
      super(pos, Op.TRAIT_ITEM);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.generics = requireNonNull(generics);
      this.kind = requireNonNull(kind);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return kind.unparseItem(w, name, generics);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of a trait item. */
  public abstract static class TraitItemKind extends AstNode {
    TraitItemKind(Op op) {
      super(Pos.ZERO, op);
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      return unparseItem(w, "_", Generics.EMPTY);
    }

    abstract AstWriter unparseItem(AstWriter w, String name,
        Generics generics);
  }

  /** {@code const NAME: TY;} in a trait. */
  public static class TraitConst extends TraitItemKind {
    public final Ty ty;
    public final @Nullable Integer defaultBodyId;

    TraitConst(Ty ty, @Nullable Integer defaultBodyId) {
      super(Op.TRAIT_CONST);
      this.ty = requireNonNull(ty);
      this.defaultBodyId = defaultBodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      w.append("const ").id(name).append(": ").append(ty);
      if (defaultBodyId != null) {
        w.append(" = #").append(defaultBodyId.toString());
      }
      return w.append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Method declared in a trait; provided if it has a body, required if
   * it has only argument names. */
  public static class TraitMethod extends TraitItemKind {
    public final MethodSig sig;
    public final ImmutableList<String> argNames;
    public final @Nullable Integer bodyId;

    TraitMethod(
        MethodSig sig,
        ImmutableList<String> argNames,
        @Nullable Integer bodyId) {
      super(Op.TRAIT_METHOD);
      this.sig = requireNonNull(sig);
      this.argNames = requireNonNull(argNames);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      w.append("fn ").id(name).append(generics);
      sig.decl.unparseSignature(w);
      return bodyId == null ? w.append(";")
          : w.append(" #").append(bodyId.toString());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code type NAME: BOUNDS = DEFAULT;} in a trait. */
  public static class TraitType extends TraitItemKind {
    public final ImmutableList<Bound> bounds;
    public final @Nullable Ty defaultTy;

    TraitType(ImmutableList<Bound> bounds, @Nullable Ty defaultTy) {
      super(Op.TRAIT_TYPE);
      this.bounds = requireNonNull(bounds);
      this.defaultTy = defaultTy;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      return w.append("type ").id(name)
          .appendAll(": ", bounds, " + ", "")
          .appendIf(" = ", defaultTy).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference from a trait to one of its items. */
  public static class TraitItemRef extends AstNode {
    public final int itemId;
    public final String name;
    public final AssociatedItemKind kind;
    public final boolean hasSelf;
    public final Ast.Defaultness defaultness;
    public final boolean hasValue;

    TraitItemRef(
        int itemId,
        String name,
        AssociatedItemKind kind,
        boolean hasSelf,
        Ast.Defaultness defaultness,
        boolean hasValue,
        Pos pos) {
      super(pos, Op.TRAIT_ITEM_REF);
      this.itemId = itemId;
      this.name = requireNonNull(name);
      this.kind = requireNonNull(kind);
      this.hasSelf = hasSelf;
      this.defaultness = requireNonNull(defaultness);
      this.hasValue = hasValue;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append("#").append(Integer.toString(itemId));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Item declared in an impl. Its contents are in {@link #kind}. */
  public static class ImplItem extends AstNode {
    public final LoweredId id;
    public final String name;
    public final Visibility vis;
    public final Ast.Defaultness defaultness;
    public final ImmutableList<Attribute> attrs;
    public final Generics generics;
    public final ImplItemKind kind;

    ImplItem(
        LoweredId id,
        String name,
        Visibility vis,
        Ast.Defaultness defaultness,
        ImmutableList<Attribute> attrs,
        Generics generics,
        ImplItemKind kind,
        Pos pos) {
      super(pos, Op.IMPL_ITEM);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.defaultness = requireNonNull(defaultness);
      this.attrs = requireNonNull(attrs);
      this.generics = requireNonNull(generics);
      this.kind = requireNonNull(kind);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(vis);
      if (defaultness == Ast.Defaultness.DEFAULT) {
        w.append("default ");
      }
      return kind.unparseItem(w, name, generics);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of an impl item. */
  public abstract static class ImplItemKind extends AstNode {
    ImplItemKind(Op op) {
      super(Pos.ZERO, op);
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      return unparseItem(w, "_", Generics.EMPTY);
    }

    abstract AstWriter unparseItem(AstWriter w, String name,
        Generics generics);
  }

  /** {@code const NAME: TY = BODY;} in an impl. */
  public static class ImplConst extends ImplItemKind {
    public final Ty ty;
    public final int bodyId;

    ImplConst(Ty ty, int bodyId) {
      super(Op.IMPL_CONST);
      this.ty = requireNonNull(ty);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      return w.append("const ").id(name).append(": ").append(ty)
          .append(" = #").append(Integer.toString(bodyId)).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Method in an impl. */
  public static class ImplMethod extends ImplItemKind {
    public final MethodSig sig;
    public final int bodyId;

    ImplMethod(MethodSig sig, int bodyId) {
      super(Op.IMPL_METHOD);
      this.sig = requireNonNull(sig);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      w.append("fn ").id(name).append(generics);
      return sig.decl.unparseSignature(w)
          .append(" #").append(Integer.toString(bodyId));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code type NAME = TY;} in an impl. */
  public static class ImplType extends ImplItemKind {
    public final Ty ty;

    ImplType(Ty ty) {
      super(Op.IMPL_TYPE);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name, Generics generics) {
      return w.append("type ").id(name).append(generics).append(" = ")
          .append(ty).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference from an impl to one of its items. */
  public static class ImplItemRef extends AstNode {
    public final int itemId;
    public final String name;
    public final AssociatedItemKind kind;
    public final boolean hasSelf;
    public final Visibility vis;
    public final Ast.Defaultness defaultness;

    ImplItemRef(
        int itemId,
        String name,
        AssociatedItemKind kind,
        boolean hasSelf,
        Visibility vis,
        Ast.Defaultness defaultness,
        Pos pos) {
      super(pos, Op.IMPL_ITEM_REF);
      this.itemId = itemId;
      this.name = requireNonNull(name);
      this.kind = requireNonNull(kind);
      this.hasSelf = hasSelf;
      this.vis = requireNonNull(vis);
      this.defaultness = requireNonNull(defaultness);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(vis).id(name).append("#")
          .append(Integer.toString(itemId));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Item in a foreign module. */
  public static class ForeignItem extends AstNode {
    public final LoweredId id;
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final ForeignItemKind kind;
    public final Visibility vis;

    ForeignItem(
        LoweredId id,
        String name,
        ImmutableList<Attribute> attrs,
        ForeignItemKind kind,
        Visibility vis,
        Pos pos) {
      super(pos, Op.FOREIGN_ITEM);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.kind = requireNonNull(kind);
      this.vis = requireNonNull(vis);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return kind.unparseItem(w.append(vis), name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of a foreign item. */
  public abstract static class ForeignItemKind extends AstNode {
    ForeignItemKind(Op op) {
      super(Pos.ZERO, op);
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      return unparseItem(w, "_");
    }

    abstract AstWriter unparseItem(AstWriter w, String name);
  }

  /** Function in a foreign module. */
  public static class ForeignFn extends ForeignItemKind {
    public final FnDecl decl;
    public final ImmutableList<String> argNames;
    public final Generics generics;

    ForeignFn(FnDecl decl, ImmutableList<String> argNames,
        Generics generics) {
      super(Op.FOREIGN_FN);
      this.decl = requireNonNull(decl);
      this.argNames = requireNonNull(argNames);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      w.append("fn ").id(name).append(generics);
      return decl.unparseSignature(w).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Static in a foreign module. */
  public static class ForeignStatic extends ForeignItemKind {
    public final Ty ty;
    public final boolean mutable;

    ForeignStatic(Ty ty, boolean mutable) {
      super(Op.FOREIGN_STATIC);
      this.ty = requireNonNull(ty);
      this.mutable = mutable;
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append(mutable ? "static mut " : "static ").id(name)
          .append(": ").append(ty).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Opaque type in a foreign module. */
  public static class ForeignType extends ForeignItemKind {
    ForeignType() {
      super(Op.FOREIGN_TYPE);
    }

    @Override
    AstWriter unparseItem(AstWriter w, String name) {
      return w.append("type ").id(name).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Signature of a method. */
  public static class MethodSig extends AstNode {
    public final Ast.Unsafety unsafety;
    public final Ast.Constness constness;
    public final String abi;
    public final FnDecl decl;

    MethodSig(
        Ast.Unsafety unsafety,
        Ast.Constness constness,
        String abi,
        FnDecl decl) {
      super(Pos.ZERO, Op.METHOD_SIG);
      this.unsafety = requireNonNull(unsafety);
      this.constness = requireNonNull(constness);
      this.abi = requireNonNull(abi);
      this.decl = requireNonNull(decl);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return decl.unparseSignature(w.append("fn"));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // generics

  /** Region parameters, type parameters and where clause of an item. */
  public static class Generics extends AstNode {
    /** Generics with no parameters. */
    public static final Generics EMPTY =
        new Generics(ImmutableList.of(), ImmutableList.of(),
            new WhereClause(LoweredId.of(Ast.DUMMY_NODE_ID, CoreId.DUMMY),
                ImmutableList.of()),
            Pos.ZERO);

    public final ImmutableList<RegionDef> regions;
    public final ImmutableList<TyParam> tyParams;
    public final WhereClause whereClause;

    Generics(
        ImmutableList<RegionDef> regions,
        ImmutableList<TyParam> tyParams,
        WhereClause whereClause,
        Pos pos) {
      super(pos, Op.GENERICS);
      this.regions = requireNonNull(regions);
      this.tyParams = requireNonNull(tyParams);
      this.whereClause = requireNonNull(whereClause);
    }

    /** Returns whether there are no region or type parameters. */
    public boolean isEmpty() {
      return regions.isEmpty() && tyParams.isEmpty();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (!isEmpty()) {
        w.append("<").appendAll(regions, ", ");
        if (!regions.isEmpty() && !tyParams.isEmpty()) {
          w.append(", ");
        }
        w.appendAll(tyParams, ", ").append(">");
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a region. */
  public static class Region extends AstNode {
    public final LoweredId id;
    public final RegionName name;

    Region(LoweredId id, Pos pos, RegionName name) {
      super(pos, Op.REGION);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
    }

    /** Returns whether this region was not written by the user. */
    public boolean isElided() {
      return name.isElided();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration of a region parameter. */
  public static class RegionDef extends AstNode {
    public final Region region;
    public final ImmutableList<Region> bounds;
    /** Whether the parameter has the {@code #[may_dangle]} attribute. */
    public final boolean pureWrtDrop;
    /** Whether the parameter was introduced by use rather than declared. */
    public final boolean inBand;

    RegionDef(
        Region region,
        ImmutableList<Region> bounds,
        boolean pureWrtDrop,
        boolean inBand) {
      super(region.pos, Op.REGION_DEF);
      this.region = requireNonNull(region);
      this.bounds = requireNonNull(bounds);
      this.pureWrtDrop = pureWrtDrop;
      this.inBand = inBand;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(region).appendAll(": ", bounds, " + ", "");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration of a type parameter. */
  public static class TyParam extends AstNode {
    public final LoweredId id;
    public final String name;
    public final ImmutableList<Bound> bounds;
    public final @Nullable Ty defaultTy;
    public final boolean pureWrtDrop;
    /** Whether the parameter stands for an {@code impl Trait} argument. */
    public final boolean synthetic;
    public final ImmutableList<Attribute> attrs;

    TyParam(
        LoweredId id,
        String name,
        ImmutableList<Bound> bounds,
        @Nullable Ty defaultTy,
        Pos pos,
        boolean pureWrtDrop,
        boolean synthetic,
        ImmutableList<Attribute> attrs) {
      super(pos, Op.TY_PARAM);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.bounds = requireNonNull(bounds);
      this.defaultTy = defaultTy;
      this.pureWrtDrop = pureWrtDrop;
      this.synthetic = synthetic;
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name)
          .appendAll(": ", bounds, " + ", "")
          .appendIf(" = ", defaultTy);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Where clause. */
  public static class WhereClause extends AstNode {
    public final LoweredId id;
    public final ImmutableList<WherePredicate> predicates;

    WhereClause(LoweredId id, ImmutableList<WherePredicate> predicates) {
      super(Pos.ZERO, Op.WHERE_CLAUSE);
      this.id = requireNonNull(id);
      this.predicates = requireNonNull(predicates);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(" where ", predicates, ", ", "");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of predicates in a where clause. */
  public abstract static class WherePredicate extends AstNode {
    WherePredicate(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** {@code for<'a> TY: BOUNDS} */
  public static class BoundPredicate extends WherePredicate {
    public final ImmutableList<RegionDef> boundRegions;
    public final Ty boundedTy;
    public final ImmutableList<Bound> bounds;

    BoundPredicate(
        Pos pos,
        ImmutableList<RegionDef> boundRegions,
        Ty boundedTy,
        ImmutableList<Bound> bounds) {
      super(pos, Op.BOUND_PREDICATE);
      this.boundRegions = requireNonNull(boundRegions);
      this.boundedTy = requireNonNull(boundedTy);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("for<", boundRegions, ", ", "> ")
          .append(boundedTy)
          .append(": ")
          .appendAll(bounds, " + ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'a: 'b + 'c} */
  public static class RegionPredicate extends WherePredicate {
    public final Region region;
    public final ImmutableList<Region> bounds;

    RegionPredicate(Pos pos, Region region, ImmutableList<Region> bounds) {
      super(pos, Op.REGION_PREDICATE);
      this.region = requireNonNull(region);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(region).append(": ").appendAll(bounds, " + ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code LHS = RHS} */
  public static class EqPredicate extends WherePredicate {
    public final LoweredId id;
    public final Ty lhs;
    public final Ty rhs;

    EqPredicate(LoweredId id, Pos pos, Ty lhs, Ty rhs) {
      super(pos, Op.EQ_PREDICATE);
      this.id = requireNonNull(id);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(lhs).append(" = ").append(rhs);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of bounds. */
  public abstract static class Bound extends AstNode {
    Bound(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Trait bound. */
  public static class TraitBound extends Bound {
    public final PolyTraitRef traitRef;
    public final Ast.TraitBoundModifier modifier;

    TraitBound(PolyTraitRef traitRef, Ast.TraitBoundModifier modifier) {
      super(traitRef.pos, Op.TRAIT_BOUND);
      this.traitRef = requireNonNull(traitRef);
      this.modifier = requireNonNull(modifier);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(modifier == Ast.TraitBoundModifier.MAYBE ? "?" : "")
          .append(traitRef);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Region bound. */
  public static class RegionBound extends Bound {
    public final Region region;

    RegionBound(Region region) {
      super(region.pos, Op.REGION_BOUND);
      this.region = requireNonNull(region);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(region);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Trait reference that may bind regions. */
  public static class PolyTraitRef extends AstNode {
    public final ImmutableList<RegionDef> boundRegions;
    public final TraitRef traitRef;

    PolyTraitRef(
        ImmutableList<RegionDef> boundRegions, TraitRef traitRef, Pos pos) {
      super(pos, Op.POLY_TRAIT_REF);
      this.boundRegions = requireNonNull(boundRegions);
      this.traitRef = requireNonNull(traitRef);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll("for<", boundRegions, ", ", "> ").append(traitRef);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a trait. */
  public static class TraitRef extends AstNode {
    public final Path path;
    public final LoweredId refId;

    TraitRef(Path path, LoweredId refId) {
      super(path.pos, Op.TRAIT_REF);
      this.path = requireNonNull(path);
      this.refId = requireNonNull(refId);
    }

    /** Returns the definition of the trait. */
    public Def traitDef() {
      return path.def;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // paths

  /** Path whose prefix has been resolved to a definition. */
  public static class Path extends AstNode {
    public final Def def;
    public final ImmutableList<PathSegment> segments;

    Path(Pos pos, Def def, ImmutableList<PathSegment> segments) {
      super(pos, Op.PATH);
      this.def = requireNonNull(def);
      this.segments = requireNonNull(segments);
    }

    /** Returns the last segment. */
    public PathSegment last() {
      return segments.get(segments.size() - 1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(segments, "::");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Segment of a path. */
  public static class PathSegment extends AstNode {
    public final String name;
    public final @Nullable PathParameters parameters;
    /** Whether omitted type arguments are to be inferred. */
    public final boolean inferTypes;

    PathSegment(
        String name, @Nullable PathParameters parameters,
        boolean inferTypes) {
      super(Pos.ZERO, Op.PATH_SEGMENT);
      this.name = requireNonNull(name);
      this.parameters = parameters;
      this.inferTypes = inferTypes;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.id(name);
      return parameters == null ? w : w.append(parameters);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Generic arguments of a path segment. Parenthesized arguments have
   * been converted to the angle-bracketed form; {@link #parenthesized}
   * records where they came from. */
  public static class PathParameters extends AstNode {
    public final ImmutableList<Region> regions;
    public final ImmutableList<Ty> types;
    public final ImmutableList<TypeBinding> bindings;
    public final boolean parenthesized;

    PathParameters(
        ImmutableList<Region> regions,
        ImmutableList<Ty> types,
        ImmutableList<TypeBinding> bindings,
        boolean parenthesized) {
      super(Pos.ZERO, Op.PATH_PARAMETERS);
      this.regions = requireNonNull(regions);
      this.types = requireNonNull(types);
      this.bindings = requireNonNull(bindings);
      this.parenthesized = parenthesized;
    }

    /** Returns whether there are no arguments. */
    public boolean isEmpty() {
      return regions.isEmpty() && types.isEmpty() && bindings.isEmpty();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final ImmutableList<AstNode> args =
          ImmutableList.<AstNode>builder()
              .addAll(regions)
              .addAll(types)
              .addAll(bindings)
              .build();
      return w.appendAll("<", args, ", ", ">");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Associated type binding, such as {@code Output = T}. */
  public static class TypeBinding extends AstNode {
    public final LoweredId id;
    public final String name;
    public final Ty ty;

    TypeBinding(LoweredId id, String name, Ty ty, Pos pos) {
      super(pos, Op.TYPE_BINDING);
      this.id = requireNonNull(id);
      this.name = requireNonNull(name);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append(" = ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of paths that may have a qualified self type. */
  public abstract static class QPath extends AstNode {
    QPath(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Path that is fully resolved, such as {@code Vec<T>} or
   * {@code <Vec<T> as Clone>::clone}. */
  public static class ResolvedQPath extends QPath {
    public final @Nullable Ty qself;
    public final Path path;

    ResolvedQPath(@Nullable Ty qself, Path path) {
      super(path.pos, Op.RESOLVED_QPATH);
      this.qself = qself;
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (qself != null) {
        w.append("<").append(qself).append(">::");
      }
      return w.append(path);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Path whose last segment is resolved relative to a type, such as
   * {@code <Vec<T>>::new} or {@code T::Item}. */
  public static class TypeRelativeQPath extends QPath {
    public final Ty base;
    public final PathSegment segment;

    TypeRelativeQPath(Ty base, PathSegment segment) {
      super(base.pos, Op.TYPE_RELATIVE_QPATH);
      this.base = requireNonNull(base);
      this.segment = requireNonNull(segment);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<").append(base).append(">::").append(segment);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // signatures

  /** Declaration of a function: argument types and return type. */
  public static class FnDecl extends AstNode {
    public final ImmutableList<Ty> inputs;
    /** Return type, or null if it is the default (unit). */
    public final @Nullable Ty output;
    public final Pos outputPos;
    public final boolean variadic;
    public final boolean hasImplicitSelf;

    FnDecl(
        ImmutableList<Ty> inputs,
        @Nullable Ty output,
        Pos outputPos,
        boolean variadic,
        boolean hasImplicitSelf) {
      super(Pos.ZERO, Op.FN_DECL);
      this.inputs = requireNonNull(inputs);
      this.output = output;
      this.outputPos = requireNonNull(outputPos);
      this.variadic = variadic;
      this.hasImplicitSelf = hasImplicitSelf;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseSignature(w);
    }

    AstWriter unparseSignature(AstWriter w) {
      w.append("(").appendAll(inputs, ", ");
      if (variadic) {
        w.append(inputs.isEmpty() ? "..." : ", ...");
      }
      return w.append(")").appendIf(" -> ", output);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // types

  /** Type. Its contents are in {@link #kind}. */
  public static class Ty extends AstNode {
    public final LoweredId id;
    public final TyKind kind;

    Ty(LoweredId id, TyKind kind, Pos pos) {
      super(pos, Op.TY);
      this.id = requireNonNull(id);
      this.kind = requireNonNull(kind);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return kind.unparse(w, left, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of a type. */
  public abstract static class TyKind extends AstNode {
    TyKind(Op op) {
      super(Pos.ZERO, op);
    }
  }

  /** Type to be inferred, {@code _}. */
  public static class InferTy extends TyKind {
    InferTy() {
      super(Op.INFER_TY);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Placeholder for a type that could not be lowered. */
  public static class ErrTy extends TyKind {
    ErrTy() {
      super(Op.ERR_TY);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{type error}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code [T]} */
  public static class SliceTy extends TyKind {
    public final Ty elementTy;

    SliceTy(Ty elementTy) {
      super(Op.SLICE_TY);
      this.elementTy = requireNonNull(elementTy);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(elementTy).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code [T; N]}; the length is a body. */
  public static class ArrayTy extends TyKind {
    public final Ty elementTy;
    public final int lengthBodyId;

    ArrayTy(Ty elementTy, int lengthBodyId) {
      super(Op.ARRAY_TY);
      this.elementTy = requireNonNull(elementTy);
      this.lengthBodyId = lengthBodyId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(elementTy).append("; #")
          .append(Integer.toString(lengthBodyId)).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code *const T} or {@code *mut T} */
  public static class PtrTy extends TyKind {
    public final Ty ty;
    public final Ast.Mutability mutability;

    PtrTy(Ty ty, Ast.Mutability mutability) {
      super(Op.PTR_TY);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Ast.Mutability.MUTABLE
              ? "*mut " : "*const ")
          .append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code &'a T} or {@code &'a mut T}; the region is always present,
   * though it may be elided. */
  public static class RefTy extends TyKind {
    public final Region region;
    public final Ty ty;
    public final Ast.Mutability mutability;

    RefTy(Region region, Ty ty, Ast.Mutability mutability) {
      super(Op.REF_TY);
      this.region = requireNonNull(region);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("&");
      if (region.name.kind != RegionName.Kind.IMPLICIT) {
        w.append(region).append(" ");
      }
      return w.append(mutability == Ast.Mutability.MUTABLE ? "mut " : "")
          .append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code fn(A) -> B} */
  public static class BareFnTy extends TyKind {
    public final Ast.Unsafety unsafety;
    public final String abi;
    public final ImmutableList<RegionDef> regions;
    public final FnDecl decl;
    public final ImmutableList<String> argNames;

    BareFnTy(
        Ast.Unsafety unsafety,
        String abi,
        ImmutableList<RegionDef> regions,
        FnDecl decl,
        ImmutableList<String> argNames) {
      super(Op.BARE_FN_TY);
      this.unsafety = requireNonNull(unsafety);
      this.abi = requireNonNull(abi);
      this.regions = requireNonNull(regions);
      this.decl = requireNonNull(decl);
      this.argNames = requireNonNull(argNames);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll("for<", regions, ", ", "> ");
      if (unsafety == Ast.Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      return decl.unparseSignature(w.append("fn"));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code !} */
  public static class NeverTy extends TyKind {
    NeverTy() {
      super(Op.NEVER_TY);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("!");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code (A, B)}; the unit type if empty. */
  public static class TupTy extends TyKind {
    public final ImmutableList<Ty> types;

    TupTy(ImmutableList<Ty> types) {
      super(Op.TUP_TY);
      this.types = requireNonNull(types);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(").appendAll(types, ", ");
      return w.append(types.size() == 1 ? ",)" : ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Type named by a path. */
  public static class PathTy extends TyKind {
    public final QPath qpath;

    PathTy(QPath qpath) {
      super(Op.PATH_TY);
      this.qpath = requireNonNull(qpath);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(qpath);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code typeof(EXP)}; the expression is a body. */
  public static class TypeofTy extends TyKind {
    public final int bodyId;

    TypeofTy(int bodyId) {
      super(Op.TYPEOF_TY);
      this.bodyId = bodyId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("typeof(#").append(Integer.toString(bodyId))
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Trait object, {@code dyn A + B + 'a}. Every trait object has exactly
   * one region bound, which may be elided. */
  public static class TraitObjectTy extends TyKind {
    public final ImmutableList<PolyTraitRef> bounds;
    public final Region region;

    TraitObjectTy(ImmutableList<PolyTraitRef> bounds, Region region) {
      super(Op.TRAIT_OBJECT_TY);
      this.bounds = requireNonNull(bounds);
      this.region = requireNonNull(region);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("dyn ").appendAll(bounds, " + ");
      if (!region.isElided()) {
        w.append(" + ").append(region);
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code impl Trait} in argument position: a reference to the anonymous
   * type parameter that stands for it. */
  public static class UniversalTy extends TyKind {
    public final DefId defId;
    public final ImmutableList<Bound> bounds;

    UniversalTy(DefId defId, ImmutableList<Bound> bounds) {
      super(Op.UNIVERSAL_TY);
      this.defId = requireNonNull(defId);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("impl ").appendAll(bounds, " + ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code impl Trait} in return position: an anonymous type with its own
   * generics (the regions it captures), instantiated with
   * {@link #regions}. */
  public static class ExistentialTy extends TyKind {
    public final Generics generics;
    public final ImmutableList<Bound> bounds;
    public final ImmutableList<Region> regions;

    ExistentialTy(
        Generics generics,
        ImmutableList<Bound> bounds,
        ImmutableList<Region> regions) {
      super(Op.EXISTENTIAL_TY);
      this.generics = requireNonNull(generics);
      this.bounds = requireNonNull(bounds);
      this.regions = requireNonNull(regions);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("impl ").appendAll(bounds, " + ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // patterns

  /** Pattern. Its contents are in {@link #kind}. */
  public static class Pat extends AstNode {
    public final LoweredId id;
    public final PatKind kind;

    Pat(LoweredId id, PatKind kind, Pos pos) {
      super(pos, Op.PAT);
      this.id = requireNonNull(id);
      this.kind = requireNonNull(kind);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return kind.unparse(w, left, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of a pattern. */
  public abstract static class PatKind extends AstNode {
    PatKind(Op op) {
      super(Pos.ZERO, op);
    }
  }

  /** Wildcard pattern, {@code _}. */
  public static class WildPat extends PatKind {
    WildPat() {
      super(Op.WILD_PAT);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that binds a variable, {@code ref mut x @ SUB}.
   *
   * <p>{@link #canonicalId} is the node id of the binding that the name
   * refers to; it differs from the pattern's own id for the second and
   * later occurrences of a name in an or-pattern. */
  public static class BindingPat extends PatKind {
    public final BindingAnnotation annotation;
    public final int canonicalId;
    public final String name;
    public final Pos namePos;
    public final @Nullable Pat sub;

    BindingPat(
        BindingAnnotation annotation,
        int canonicalId,
        String name,
        Pos namePos,
        @Nullable Pat sub) {
      super(Op.BINDING_PAT);
      this.annotation = requireNonNull(annotation);
      this.canonicalId = canonicalId;
      this.name = requireNonNull(name);
      this.namePos = requireNonNull(namePos);
      this.sub = sub;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(annotation.prefix).id(name).appendIf(" @ ", sub);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code Path { a: P, b, .. }} */
  public static class StructPat extends PatKind {
    public final QPath qpath;
    public final ImmutableList<FieldPat> fields;
    public final boolean hasRest;

    StructPat(QPath qpath, ImmutableList<FieldPat> fields, boolean hasRest) {
      super(Op.STRUCT_PAT);
      this.qpath = requireNonNull(qpath);
      this.fields = requireNonNull(fields);
      this.hasRest = hasRest;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(qpath).append(" {");
      if (!fields.isEmpty() || hasRest) {
        w.append(" ").appendAll(fields, ", ");
        if (hasRest) {
          w.append(fields.isEmpty() ? ".." : ", ..");
        }
        w.append(" ");
      }
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field of a struct pattern. */
  public static class FieldPat extends AstNode {
    public final String name;
    public final Pat pat;
    public final boolean shorthand;

    FieldPat(Pos pos, String name, Pat pat, boolean shorthand) {
      super(pos, Op.FIELD_PAT);
      this.name = requireNonNull(name);
      this.pat = requireNonNull(pat);
      this.shorthand = shorthand;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return shorthand ? w.append(pat)
          : w.id(name).append(": ").append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code Path(P, .., Q)}; {@link #ddpos} is the position of {@code ..},
   * or -1. */
  public static class TupleStructPat extends PatKind {
    public final QPath qpath;
    public final ImmutableList<Pat> pats;
    public final int ddpos;

    TupleStructPat(QPath qpath, ImmutableList<Pat> pats, int ddpos) {
      super(Op.TUPLE_STRUCT_PAT);
      this.qpath = requireNonNull(qpath);
      this.pats = requireNonNull(pats);
      this.ddpos = ddpos;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparsePats(w.append(qpath).append("("), pats, ddpos)
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that is a path to a constant or unit variant. */
  public static class PathPat extends PatKind {
    public final QPath qpath;

    PathPat(QPath qpath) {
      super(Op.PATH_PAT);
      this.qpath = requireNonNull(qpath);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(qpath);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code (P, .., Q)} */
  public static class TuplePat extends PatKind {
    public final ImmutableList<Pat> pats;
    public final int ddpos;

    TuplePat(ImmutableList<Pat> pats, int ddpos) {
      super(Op.TUPLE_PAT);
      this.pats = requireNonNull(pats);
      this.ddpos = ddpos;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      unparsePats(w.append("("), pats, ddpos);
      return w.append(pats.size() == 1 && ddpos < 0 ? ",)" : ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code box P} */
  public static class BoxPat extends PatKind {
    public final Pat pat;

    BoxPat(Pat pat) {
      super(Op.BOX_PAT);
      this.pat = requireNonNull(pat);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("box ").append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code &P} or {@code &mut P} */
  public static class RefPat extends PatKind {
    public final Pat pat;
    public final Ast.Mutability mutability;

    RefPat(Pat pat, Ast.Mutability mutability) {
      super(Op.REF_PAT);
      this.pat = requireNonNull(pat);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Ast.Mutability.MUTABLE ? "&mut " : "&")
          .append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal pattern. */
  public static class LitPat extends PatKind {
    public final Exp exp;

    LitPat(Exp exp) {
      super(Op.LIT_PAT);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code LO..=HI} */
  public static class RangePat extends PatKind {
    public final Exp lo;
    public final Exp hi;
    public final Ast.RangeEnd end;

    RangePat(Exp lo, Exp hi, Ast.RangeEnd end) {
      super(Op.RANGE_PAT);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
      this.end = requireNonNull(end);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(lo).append(end.symbol).append(hi);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code [A, B, rest.., Z]} */
  public static class SlicePat extends PatKind {
    public final ImmutableList<Pat> before;
    public final @Nullable Pat slice;
    public final ImmutableList<Pat> after;

    SlicePat(
        ImmutableList<Pat> before,
        @Nullable Pat slice,
        ImmutableList<Pat> after) {
      super(Op.SLICE_PAT);
      this.before = requireNonNull(before);
      this.slice = slice;
      this.after = requireNonNull(after);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").appendAll(before, ", ");
      if (slice != null) {
        w.append(before.isEmpty() ? "" : ", ").append(slice).append("..");
      }
      if (!after.isEmpty()) {
        w.append(before.isEmpty() && slice == null ? "" : ", ")
            .appendAll(after, ", ");
      }
      return w.append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  private static AstWriter unparsePats(AstWriter w, List<Pat> pats,
      int ddpos) {
    for (int i = 0; i < pats.size(); i++) {
      if (i == ddpos) {
        w.append(i > 0 ? ", .." : "..");
      }
      if (i > 0 || i == ddpos) {
        w.append(", ");
      }
      w.append(pats.get(i));
    }
    if (ddpos == pats.size()) {
      w.append(pats.isEmpty() ? ".." : ", ..");
    }
    return w;
  }

  // expressions

  /** Expression. Its contents are in {@link #kind}. */
  public static class Exp extends AstNode {
    public final LoweredId id;
    public final ExpKind kind;
    public final ImmutableList<Attribute> attrs;

    Exp(LoweredId id, ExpKind kind, Pos pos, ImmutableList<Attribute> attrs) {
      super(pos, Op.EXP);
      this.id = requireNonNull(id);
      this.kind = requireNonNull(kind);
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Attribute attr : attrs) {
        w.append(attr).append(" ");
      }
      return kind.unparse(w, left, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the contents of an expression. */
  public abstract static class ExpKind extends AstNode {
    ExpKind(Op op) {
      super(Pos.ZERO, op);
    }
  }

  /** {@code box EXP} */
  public static class Box extends ExpKind {
    public final Exp exp;

    Box(Exp exp) {
      super(Op.BOX);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("box ").append(exp, 99, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code [A, B, C]} */
  public static class Array extends ExpKind {
    public final ImmutableList<Exp> exps;

    Array(ImmutableList<Exp> exps) {
      super(Op.ARRAY);
      this.exps = requireNonNull(exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(exps, ", ").append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code [VALUE; COUNT]}; the count is a body. */
  public static class Repeat extends ExpKind {
    public final Exp value;
    public final int countBodyId;

    Repeat(Exp value, int countBodyId) {
      super(Op.REPEAT);
      this.value = requireNonNull(value);
      this.countBodyId = countBodyId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(value).append("; #")
          .append(Integer.toString(countBodyId)).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code (A, B)}; the unit value if empty. */
  public static class Tup extends ExpKind {
    public final ImmutableList<Exp> exps;

    Tup(ImmutableList<Exp> exps) {
      super(Op.TUP);
      this.exps = requireNonNull(exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("(").appendAll(exps, ", ");
      return w.append(exps.size() == 1 ? ",)" : ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code FN(ARGS)} */
  public static class Call extends ExpKind {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Call(Exp fn, ImmutableList<Exp> args) {
      super(Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, 99).append("(").appendAll(args, ", ")
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code RECEIVER.SEGMENT(ARGS)}; {@code args.get(0)} is the
   * receiver. */
  public static class MethodCall extends ExpKind {
    public final PathSegment segment;
    public final Pos segmentPos;
    public final ImmutableList<Exp> args;

    MethodCall(PathSegment segment, Pos segmentPos, ImmutableList<Exp> args) {
      super(Op.METHOD_CALL);
      this.segment = requireNonNull(segment);
      this.segmentPos = requireNonNull(segmentPos);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(args.get(0), left, 99).append(".").append(segment)
          .append("(").appendAll(args.subList(1, args.size()), ", ")
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a binary operator. */
  public static class Binary extends ExpKind {
    public final Ast.BinOpKind binOp;
    public final Exp left;
    public final Exp right;

    Binary(Ast.BinOpKind binOp, Exp left, Exp right) {
      super(Op.BINARY);
      this.binOp = requireNonNull(binOp);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, binOp, this.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a unary operator. */
  public static class Unary extends ExpKind {
    public final Ast.UnOp unOp;
    public final Exp exp;

    Unary(Ast.UnOp unOp, Exp exp) {
      super(Op.UNARY);
      this.unOp = requireNonNull(unOp);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(unOp.symbol).append(exp, 99, 99);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal. */
  public static class LitExp extends ExpKind {
    public final Literal literal;

    LitExp(Literal literal) {
      super(Op.LIT);
      this.literal = requireNonNull(literal);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal.toString());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code EXP as TY} */
  public static class Cast extends ExpKind {
    public final Exp exp;
    public final Ty ty;

    Cast(Exp exp, Ty ty) {
      super(Op.CAST);
      this.exp = requireNonNull(exp);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, 99).append(" as ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code EXP: TY} */
  public static class TypeAscription extends ExpKind {
    public final Exp exp;
    public final Ty ty;

    TypeAscription(Exp exp, Ty ty) {
      super(Op.TYPE_ASCRIPTION);
      this.exp = requireNonNull(exp);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, 99).append(": ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code if COND THEN else ELSE}; THEN is a block expression. */
  public static class If extends ExpKind {
    public final Exp condition;
    public final Exp ifTrue;
    public final @Nullable Exp ifFalse;

    If(Exp condition, Exp ifTrue, @Nullable Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("if ").append(condition).append(" ").append(ifTrue)
          .appendIf(" else ", ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: while COND BODY} */
  public static class While extends ExpKind {
    public final Exp condition;
    public final Block body;
    public final @Nullable Label label;

    While(Exp condition, Block body, @Nullable Label label) {
      super(Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
      this.label = label;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseLabel(w, label).append("while ").append(condition)
          .append(" ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: loop BODY}; also the result of lowering {@code while
   * let} and {@code for}, as recorded in {@link #source}. */
  public static class Loop extends ExpKind {
    public final Block body;
    public final @Nullable Label label;
    public final LoopSource source;

    Loop(Block body, @Nullable Label label, LoopSource source) {
      super(Op.LOOP);
      this.body = requireNonNull(body);
      this.label = label;
      this.source = requireNonNull(source);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseLabel(w, label).append("loop ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code match EXP { ARMS }}; also the result of lowering {@code if
   * let}, {@code while let}, {@code for} and {@code ?}, as recorded in
   * {@link #source}. */
  public static class Match extends ExpKind {
    public final Exp exp;
    public final ImmutableList<Arm> arms;
    public final MatchSource source;

    Match(Exp exp, ImmutableList<Arm> arms, MatchSource source) {
      super(Op.MATCH);
      this.exp = requireNonNull(exp);
      this.arms = requireNonNull(arms);
      this.source = requireNonNull(source);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("match ").append(exp).append(" {")
          .appendAll(" ", arms, ", ", " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Arm of a match. */
  public static class Arm extends AstNode {
    public final ImmutableList<Attribute> attrs;
    public final ImmutableList<Pat> pats;
    public final @Nullable Exp guard;
    public final Exp body;

    Arm(
        ImmutableList<Attribute> attrs,
        ImmutableList<Pat> pats,
        @Nullable Exp guard,
        Exp body) {
      super(body.pos, Op.ARM);
      this.attrs = requireNonNull(attrs);
      this.pats = requireNonNull(pats);
      this.guard = guard;
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (Attribute attr : attrs) {
        w.append(attr).append(" ");
      }
      return w.appendAll(pats, " | ").appendIf(" if ", guard)
          .append(" => ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Closure; its body is in the body table. */
  public static class Closure extends ExpKind {
    public final Ast.CaptureBy captureBy;
    public final FnDecl decl;
    public final int bodyId;
    public final Pos declPos;
    public final boolean isGenerator;

    Closure(
        Ast.CaptureBy captureBy,
        FnDecl decl,
        int bodyId,
        Pos declPos,
        boolean isGenerator) {
      super(Op.CLOSURE);
      this.captureBy = requireNonNull(captureBy);
      this.decl = requireNonNull(decl);
      this.bodyId = bodyId;
      this.declPos = requireNonNull(declPos);
      this.isGenerator = isGenerator;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(captureBy == Ast.CaptureBy.VALUE ? "move " : "")
          .append("|").appendAll(decl.inputs, ", ").append("| #")
          .append(Integer.toString(bodyId));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Block used as an expression. */
  public static class BlockExp extends ExpKind {
    public final Block block;

    BlockExp(Block block) {
      super(Op.BLOCK_EXP);
      this.block = requireNonNull(block);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(block);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code TARGET = VALUE} */
  public static class Assign extends ExpKind {
    public final Exp target;
    public final Exp value;

    Assign(Exp target, Exp value) {
      super(Op.ASSIGN);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(target).append(" = ").append(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code TARGET += VALUE} */
  public static class AssignOp extends ExpKind {
    public final Ast.BinOpKind binOp;
    public final Exp target;
    public final Exp value;

    AssignOp(Ast.BinOpKind binOp, Exp target, Exp value) {
      super(Op.ASSIGN_OP);
      this.binOp = requireNonNull(binOp);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(target)
          .append(" " + binOp.padded.trim() + "= ")
          .append(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code EXP.NAME} */
  public static class FieldAccess extends ExpKind {
    public final Exp exp;
    public final String name;

    FieldAccess(Exp exp, String name) {
      super(Op.FIELD_ACCESS);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, 99).append(".").id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code EXP.0} */
  public static class TupField extends ExpKind {
    public final Exp exp;
    public final int index;

    TupField(Exp exp, int index) {
      super(Op.TUP_FIELD);
      this.exp = requireNonNull(exp);
      this.index = index;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, 99).append(".")
          .append(Integer.toString(index));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code EXP[INDEX]} */
  public static class Index extends ExpKind {
    public final Exp exp;
    public final Exp index;

    Index(Exp exp, Exp index) {
      super(Op.INDEX);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, 99).append("[").append(index).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Path used as an expression. */
  public static class PathExp extends ExpKind {
    public final QPath qpath;

    PathExp(QPath qpath) {
      super(Op.PATH_EXP);
      this.qpath = requireNonNull(qpath);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(qpath);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code &EXP} or {@code &mut EXP} */
  public static class AddrOf extends ExpKind {
    public final Ast.Mutability mutability;
    public final Exp exp;

    AddrOf(Ast.Mutability mutability, Exp exp) {
      super(Op.ADDR_OF);
      this.mutability = requireNonNull(mutability);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Ast.Mutability.MUTABLE ? "&mut " : "&")
          .append(exp, 99, 99);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code break 'label EXP} */
  public static class Break extends ExpKind {
    public final Destination destination;
    public final @Nullable Exp exp;

    Break(Destination destination, @Nullable Exp exp) {
      super(Op.BREAK);
      this.destination = requireNonNull(destination);
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("break");
      if (destination.label != null) {
        w.append(" ").append(destination.label.name);
      }
      return w.appendIf(" ", exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code continue 'label} */
  public static class Continue extends ExpKind {
    public final Destination destination;

    Continue(Destination destination) {
      super(Op.CONTINUE);
      this.destination = requireNonNull(destination);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("continue");
      if (destination.label != null) {
        w.append(" ").append(destination.label.name);
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code return EXP} */
  public static class Ret extends ExpKind {
    public final @Nullable Exp exp;

    Ret(@Nullable Exp exp) {
      super(Op.RET);
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("return").appendIf(" ", exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code Path { a: A, b: B, ..BASE }} */
  public static class StructExp extends ExpKind {
    public final QPath qpath;
    public final ImmutableList<Field> fields;
    public final @Nullable Exp base;

    StructExp(QPath qpath, ImmutableList<Field> fields, @Nullable Exp base) {
      super(Op.STRUCT_EXP);
      this.qpath = requireNonNull(qpath);
      this.fields = requireNonNull(fields);
      this.base = base;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(qpath).append(" {");
      if (!fields.isEmpty() || base != null) {
        w.append(" ").appendAll(fields, ", ");
        if (base != null) {
          w.append(fields.isEmpty() ? ".." : ", ..").append(base);
        }
        w.append(" ");
      }
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field of a struct literal. */
  public static class Field extends AstNode {
    public final String name;
    public final Pos namePos;
    public final Exp exp;
    public final boolean shorthand;

    Field(String name, Pos namePos, Exp exp, Pos pos, boolean shorthand) {
      super(pos, Op.FIELD);
      this.name = requireNonNull(name);
      this.namePos = requireNonNull(namePos);
      this.exp = requireNonNull(exp);
      this.shorthand = shorthand;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return shorthand ? w.append(exp)
          : w.id(name).append(": ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code yield EXP} */
  public static class Yield extends ExpKind {
    public final Exp exp;

    Yield(Exp exp) {
      super(Op.YIELD);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("yield ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  private static AstWriter unparseLabel(AstWriter w, @Nullable Label label) {
    return label == null ? w : w.append(label.name).append(": ");
  }

  // blocks and statements

  /** Block: a list of statements and an optional trailing expression. */
  public static class Block extends AstNode {
    public final LoweredId id;
    public final ImmutableList<Stmt> stmts;
    public final @Nullable Exp expr;
    public final Ast.BlockCheckMode rules;
    /** Who wrote the unsafe block; null if {@link #rules} is
     * {@link Ast.BlockCheckMode#DEFAULT}. */
    public final Ast.@Nullable UnsafeSource unsafeSource;
    /** Whether a {@code break} targets this block; true for the block of
     * a {@code catch}. */
    public final boolean targetedByBreak;

    Block(
        LoweredId id,
        ImmutableList<Stmt> stmts,
        @Nullable Exp expr,
        Ast.BlockCheckMode rules,
        Ast.@Nullable UnsafeSource unsafeSource,
        Pos pos,
        boolean targetedByBreak) {
      super(pos, Op.BLOCK);
      this.id = requireNonNull(id);
      this.stmts = requireNonNull(stmts);
      this.expr = expr;
      this.rules = requireNonNull(rules);
      this.unsafeSource = unsafeSource;
      this.targetedByBreak = targetedByBreak;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(rules.prefix);
      if (stmts.isEmpty() && expr == null) {
        return w.append("{}");
      }
      w.append("{ ").appendAll(stmts, " ");
      if (expr != null) {
        w.append(stmts.isEmpty() ? "" : " ").append(expr);
      }
      return w.append(" }");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code let PAT: TY = INIT;} */
  public static class Local extends AstNode {
    public final LoweredId id;
    public final Pat pat;
    public final @Nullable Ty ty;
    public final @Nullable Exp init;
    public final ImmutableList<Attribute> attrs;
    public final LocalSource source;

    Local(
        LoweredId id,
        Pat pat,
        @Nullable Ty ty,
        @Nullable Exp init,
        Pos pos,
        ImmutableList<Attribute> attrs,
        LocalSource source) {
      super(pos, Op.LOCAL);
      this.id = requireNonNull(id);
      this.pat = requireNonNull(pat);
      this.ty = ty;
      this.init = init;
      this.attrs = requireNonNull(attrs);
      this.source = requireNonNull(source);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("let ").append(pat).appendIf(": ", ty)
          .appendIf(" = ", init).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of statements. */
  public abstract static class Stmt extends AstNode {
    public final LoweredId id;

    Stmt(LoweredId id, Pos pos, Op op) {
      super(pos, op);
      this.id = requireNonNull(id);
    }
  }

  /** Statement that declares a local variable. */
  public static class LocalStmt extends Stmt {
    public final Local local;

    LocalStmt(LoweredId id, Local local) {
      super(id, local.pos, Op.LOCAL_STMT);
      this.local = requireNonNull(local);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(local);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statement that declares an item; the item is in the item table. */
  public static class ItemStmt extends Stmt {
    public final int itemId;

    ItemStmt(LoweredId id, int itemId, Pos pos) {
      super(id, pos, Op.ITEM_STMT);
      this.itemId = itemId;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("item #").append(Integer.toString(itemId)).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression statement without a trailing semicolon. */
  public static class ExprStmt extends Stmt {
    public final Exp exp;

    ExprStmt(LoweredId id, Exp exp, Pos pos) {
      super(id, pos, Op.EXPR_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression statement with a trailing semicolon. */
  public static class SemiStmt extends Stmt {
    public final Exp exp;

    SemiStmt(LoweredId id, Exp exp, Pos pos) {
      super(id, pos, Op.SEMI_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp).append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Core.java
