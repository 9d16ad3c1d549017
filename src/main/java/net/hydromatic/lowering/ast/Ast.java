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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes of the surface tree.
 *
 * <p>Every node that has an identity carries the integer id that the parser
 * assigned to it. Ids are unique and dense over a crate. Nodes are created
 * via {@link AstBuilder}.
 */
public class Ast {
  /** Id of the crate root. */
  public static final int CRATE_NODE_ID = 0;

  /** Id of nodes that have no identity. */
  public static final int DUMMY_NODE_ID = -1;

  private Ast() {}

  /** Mutability of a binding, reference or pointer. */
  public enum Mutability {
    IMMUTABLE,
    MUTABLE
  }

  /** Whether a function, trait or impl is unsafe. */
  public enum Unsafety {
    NORMAL,
    UNSAFE
  }

  /** Whether a function is const. */
  public enum Constness {
    NOT_CONST,
    CONST
  }

  /** Whether an impl item can be overridden by specialization. */
  public enum Defaultness {
    FINAL,
    DEFAULT
  }

  /** Whether an impl is positive or negative ({@code impl !Send}). */
  public enum ImplPolarity {
    POSITIVE,
    NEGATIVE
  }

  /** Whether a trait is an auto trait. */
  public enum IsAuto {
    NO,
    YES
  }

  /** How a closure captures its environment. */
  public enum CaptureBy {
    REF,
    VALUE
  }

  /** How an identifier pattern binds its value. */
  public enum BindingMode {
    BY_VALUE(""),
    BY_VALUE_MUT("mut "),
    BY_REF("ref "),
    BY_REF_MUT("ref mut ");

    public final String prefix;

    BindingMode(String prefix) {
      this.prefix = prefix;
    }
  }

  /** End of a range pattern. */
  public enum RangeEnd {
    INCLUDED("..="),
    EXCLUDED("..");

    public final String symbol;

    RangeEnd(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Limits of a range expression. */
  public enum RangeLimits {
    HALF_OPEN(".."),
    CLOSED("..=");

    public final String symbol;

    RangeLimits(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Binary operator. */
  public enum BinOpKind {
    MUL(" * ", 11),
    DIV(" / ", 11),
    REM(" % ", 11),
    ADD(" + ", 10),
    SUB(" - ", 10),
    SHL(" << ", 9),
    SHR(" >> ", 9),
    BIT_AND(" & ", 8),
    BIT_XOR(" ^ ", 7),
    BIT_OR(" | ", 6),
    EQ(" == ", 5),
    NE(" != ", 5),
    LT(" < ", 5),
    LE(" <= ", 5),
    GT(" > ", 5),
    GE(" >= ", 5),
    AND(" && ", 4),
    OR(" || ", 3);

    public final String padded;
    public final int left;
    public final int right;

    BinOpKind(String padded, int precedence) {
      this.padded = padded;
      this.left = precedence * 2;
      this.right = precedence * 2 + 1;
    }
  }

  /** Unary operator. */
  public enum UnOp {
    DEREF("*"),
    NOT("!"),
    NEG("-");

    public final String symbol;

    UnOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Modifier of a trait bound; {@code ?Sized} is {@link #MAYBE}. */
  public enum TraitBoundModifier {
    NONE,
    MAYBE
  }

  /** Whether a block is unsafe, and how. */
  public enum BlockCheckMode {
    DEFAULT(""),
    UNSAFE("unsafe "),
    PUSH_UNSAFE("push_unsafe "),
    POP_UNSAFE("pop_unsafe ");

    public final String prefix;

    BlockCheckMode(String prefix) {
      this.prefix = prefix;
    }
  }

  /** Who wrote an unsafe block. */
  public enum UnsafeSource {
    COMPILER_GENERATED,
    USER_PROVIDED
  }

  /** Shape of a struct, variant or union. */
  public enum VariantKind {
    STRUCT,
    TUPLE,
    UNIT
  }

  /** Shape of a use tree. */
  public enum UseTreeKind {
    SIMPLE,
    GLOB,
    NESTED
  }

  /** Kind of visibility. */
  public enum VisibilityKind {
    PUBLIC("pub "),
    CRATE("crate "),
    RESTRICTED("pub"),
    INHERITED("");

    public final String prefix;

    VisibilityKind(String prefix) {
      this.prefix = prefix;
    }
  }

  /** Qualified self type of a path, as in {@code <T as Trait>::Item}. */
  public static class QSelf {
    public final Ty ty;
    /** Number of segments of the path that belong to the trait. */
    public final int position;

    QSelf(Ty ty, int position) {
      this.ty = requireNonNull(ty);
      this.position = position;
    }
  }

  // crate structure

  /** Root of a surface tree. */
  public static class Crate extends AstNode {
    public final Module module;
    public final ImmutableList<Attribute> attrs;

    Crate(Pos pos, Module module, ImmutableList<Attribute> attrs) {
      super(pos, Op.CRATE);
      this.module = requireNonNull(module);
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(attrs, "\n").append(module);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Contents of a module: a list of items. */
  public static class Module extends AstNode {
    public final ImmutableList<Item> items;

    Module(Pos inner, ImmutableList<Item> items) {
      super(inner, Op.MODULE);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(items, "\n");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Visibility of an item, field or associated item. */
  public static class Visibility extends AstNode {
    public final VisibilityKind kind;
    /** Path of a restricted visibility, such as {@code pub(super)}. */
    public final @Nullable Path path;
    /** Id of a restricted visibility; otherwise {@link #DUMMY_NODE_ID}. */
    public final int id;

    Visibility(Pos pos, VisibilityKind kind, @Nullable Path path, int id) {
      super(pos, Op.VISIBILITY);
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

  // items

  /** Abstract base class of items. */
  public abstract static class Item extends AstNode {
    public final int id;
    public final String name;
    public final Visibility vis;
    public final ImmutableList<Attribute> attrs;

    Item(
        Pos pos,
        Op op,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs) {
      super(pos, op);
      this.id = id;
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.attrs = requireNonNull(attrs);
    }

    /** Returns the generics of this item, or null if it has none. */
    public @Nullable Generics generics() {
      return null;
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll("", attrs, " ", " ").append(vis);
      return unparseItem(w);
    }

    abstract AstWriter unparseItem(AstWriter w);

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code extern crate orig as name;} */
  public static class ExternCrate extends Item {
    public final @Nullable String orig;

    ExternCrate(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        @Nullable String orig) {
      super(pos, Op.EXTERN_CRATE, id, name, vis, attrs);
      this.orig = orig;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      w.append("extern crate ");
      if (orig != null) {
        w.append(orig).append(" as ");
      }
      return w.id(name).append(";");
    }
  }

  /** {@code use tree;} */
  public static class Use extends Item {
    public final UseTree tree;

    Use(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        UseTree tree) {
      super(pos, Op.USE, id, name, vis, attrs);
      this.tree = requireNonNull(tree);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("use ").append(tree).append(";");
    }
  }

  /**
   * Tree of imports: {@code a::b as c}, {@code a::*} or
   * {@code a::{b, c::d}}.
   */
  public static class UseTree extends AstNode {
    public final Path prefix;
    public final UseTreeKind kind;
    /** Name under which a simple import is bound, or null. */
    public final @Nullable String rename;
    /** Sub-trees of a nested import. */
    public final ImmutableList<UseTree> nested;
    /**
     * Id of this tree if it is a member of a nested import; otherwise
     * {@link #DUMMY_NODE_ID}.
     */
    public final int id;

    UseTree(
        Pos pos,
        Path prefix,
        UseTreeKind kind,
        @Nullable String rename,
        ImmutableList<UseTree> nested,
        int id) {
      super(pos, Op.USE_TREE);
      this.prefix = requireNonNull(prefix);
      this.kind = requireNonNull(kind);
      this.rename = rename;
      this.nested = requireNonNull(nested);
      this.id = id;
    }

    /** Returns the name that a simple import binds. */
    public String ident() {
      if (rename != null) {
        return rename;
      }
      return prefix.segments.get(prefix.segments.size() - 1).name;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(prefix);
      switch (kind) {
        case SIMPLE:
          return rename == null ? w : w.append(" as ").id(rename);
        case GLOB:
          return w.append("::*");
        default:
          return w.append("::{").appendAll(nested, ", ").append("}");
      }
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code static mut NAME: TY = EXPR;} */
  public static class StaticItem extends Item {
    public final Ty ty;
    public final Mutability mutability;
    public final Exp exp;

    StaticItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Ty ty,
        Mutability mutability,
        Exp exp) {
      super(pos, Op.STATIC, id, name, vis, attrs);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("static ")
          .append(mutability == Mutability.MUTABLE ? "mut " : "")
          .id(name)
          .append(": ")
          .append(ty)
          .append(" = ")
          .append(exp)
          .append(";");
    }
  }

  /** {@code const NAME: TY = EXPR;} */
  public static class ConstItem extends Item {
    public final Ty ty;
    public final Exp exp;

    ConstItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Ty ty,
        Exp exp) {
      super(pos, Op.CONST, id, name, vis, attrs);
      this.ty = requireNonNull(ty);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("const ")
          .id(name)
          .append(": ")
          .append(ty)
          .append(" = ")
          .append(exp)
          .append(";");
    }
  }

  /** Function definition. */
  public static class FnItem extends Item {
    public final FnDecl decl;
    public final Unsafety unsafety;
    public final Constness constness;
    public final String abi;
    public final Generics generics;
    public final Block body;

    FnItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        FnDecl decl,
        Unsafety unsafety,
        Constness constness,
        String abi,
        Generics generics,
        Block body) {
      super(pos, Op.FN, id, name, vis, attrs);
      this.decl = requireNonNull(decl);
      this.unsafety = requireNonNull(unsafety);
      this.constness = requireNonNull(constness);
      this.abi = requireNonNull(abi);
      this.generics = requireNonNull(generics);
      this.body = requireNonNull(body);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      if (constness == Constness.CONST) {
        w.append("const ");
      }
      if (unsafety == Unsafety.UNSAFE) {
        w.append("unsafe ");
      }
      w.append("fn ").id(name).append(generics);
      return decl.unparseSignature(w).append(" ").append(body);
    }
  }

  /** {@code mod name { items }} */
  public static class ModItem extends Item {
    public final Module module;

    ModItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Module module) {
      super(pos, Op.MOD, id, name, vis, attrs);
      this.module = requireNonNull(module);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("mod ").id(name).append(" {").append(module).append("}");
    }
  }

  /** {@code extern "abi" { items }} */
  public static class ForeignMod extends Item {
    public final String abi;
    public final ImmutableList<ForeignItem> items;

    ForeignMod(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        String abi,
        ImmutableList<ForeignItem> items) {
      super(pos, Op.FOREIGN_MOD, id, name, vis, attrs);
      this.abi = requireNonNull(abi);
      this.items = requireNonNull(items);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("extern \"")
          .append(abi)
          .append("\" {")
          .appendAll(items, " ")
          .append("}");
    }
  }

  /** {@code type Name<GENERICS> = TY;} */
  public static class TyAlias extends Item {
    public final Ty ty;
    public final Generics generics;

    TyAlias(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Ty ty,
        Generics generics) {
      super(pos, Op.TY_ALIAS, id, name, vis, attrs);
      this.ty = requireNonNull(ty);
      this.generics = requireNonNull(generics);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("type ")
          .id(name)
          .append(generics)
          .append(" = ")
          .append(ty)
          .append(";");
    }
  }

  /** {@code enum Name<GENERICS> { variants }} */
  public static class EnumItem extends Item {
    public final ImmutableList<Variant> variants;
    public final Generics generics;

    EnumItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        ImmutableList<Variant> variants,
        Generics generics) {
      super(pos, Op.ENUM, id, name, vis, attrs);
      this.variants = requireNonNull(variants);
      this.generics = requireNonNull(generics);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("enum ")
          .id(name)
          .append(generics)
          .append(" {")
          .appendAll(variants, ", ")
          .append("}");
    }
  }

  /** {@code struct Name<GENERICS> DATA} */
  public static class StructItem extends Item {
    public final VariantData data;
    public final Generics generics;

    StructItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        VariantData data,
        Generics generics) {
      super(pos, Op.STRUCT, id, name, vis, attrs);
      this.data = requireNonNull(data);
      this.generics = requireNonNull(generics);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("struct ").id(name).append(generics).append(data);
    }
  }

  /** {@code union Name<GENERICS> DATA} */
  public static class UnionItem extends Item {
    public final VariantData data;
    public final Generics generics;

    UnionItem(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        VariantData data,
        Generics generics) {
      super(pos, Op.UNION, id, name, vis, attrs);
      this.data = requireNonNull(data);
      this.generics = requireNonNull(generics);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("union ").id(name).append(generics).append(data);
    }
  }

  /** {@code impl Trait for .. {}} */
  public static class AutoImpl extends Item {
    public final Unsafety unsafety;
    public final TraitRef traitRef;

    AutoImpl(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Unsafety unsafety,
        TraitRef traitRef) {
      super(pos, Op.AUTO_IMPL, id, name, vis, attrs);
      this.unsafety = requireNonNull(unsafety);
      this.traitRef = requireNonNull(traitRef);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append(unsafety == Unsafety.UNSAFE ? "unsafe " : "")
          .append("impl ")
          .append(traitRef)
          .append(" for .. {}");
    }
  }

  /** {@code impl<GENERICS> Trait for Ty { items }} */
  public static class Impl extends Item {
    public final Unsafety unsafety;
    public final ImplPolarity polarity;
    public final Defaultness defaultness;
    public final Generics generics;
    public final @Nullable TraitRef traitRef;
    public final Ty selfTy;
    public final ImmutableList<ImplItem> items;

    Impl(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Unsafety unsafety,
        ImplPolarity polarity,
        Defaultness defaultness,
        Generics generics,
        @Nullable TraitRef traitRef,
        Ty selfTy,
        ImmutableList<ImplItem> items) {
      super(pos, Op.IMPL, id, name, vis, attrs);
      this.unsafety = requireNonNull(unsafety);
      this.polarity = requireNonNull(polarity);
      this.defaultness = requireNonNull(defaultness);
      this.generics = requireNonNull(generics);
      this.traitRef = traitRef;
      this.selfTy = requireNonNull(selfTy);
      this.items = requireNonNull(items);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      w.append(unsafety == Unsafety.UNSAFE ? "unsafe " : "")
          .append("impl")
          .append(generics)
          .append(" ");
      if (traitRef != null) {
        w.append(polarity == ImplPolarity.NEGATIVE ? "!" : "")
            .append(traitRef)
            .append(" for ");
      }
      return w.append(selfTy).append(" {").appendAll(items, " ").append("}");
    }
  }

  /** {@code trait Name<GENERICS>: BOUNDS { items }} */
  public static class Trait extends Item {
    public final IsAuto isAuto;
    public final Unsafety unsafety;
    public final Generics generics;
    public final ImmutableList<TyParamBound> bounds;
    public final ImmutableList<TraitItem> items;

    Trait(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        IsAuto isAuto,
        Unsafety unsafety,
        Generics generics,
        ImmutableList<TyParamBound> bounds,
        ImmutableList<TraitItem> items) {
      super(pos, Op.TRAIT, id, name, vis, attrs);
      this.isAuto = requireNonNull(isAuto);
      this.unsafety = requireNonNull(unsafety);
      this.generics = requireNonNull(generics);
      this.bounds = requireNonNull(bounds);
      this.items = requireNonNull(items);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append(isAuto == IsAuto.YES ? "auto " : "")
          .append(unsafety == Unsafety.UNSAFE ? "unsafe " : "")
          .append("trait ")
          .id(name)
          .append(generics)
          .appendAll(": ", bounds, " + ", "")
          .append(" {")
          .appendAll(items, " ")
          .append("}");
    }
  }

  /** {@code trait Name<GENERICS> = BOUNDS;} */
  public static class TraitAlias extends Item {
    public final Generics generics;
    public final ImmutableList<TyParamBound> bounds;

    TraitAlias(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Generics generics,
        ImmutableList<TyParamBound> bounds) {
      super(pos, Op.TRAIT_ALIAS, id, name, vis, attrs);
      this.generics = requireNonNull(generics);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    public Generics generics() {
      return generics;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("trait ")
          .id(name)
          .append(generics)
          .append(" = ")
          .appendAll(bounds, " + ")
          .append(";");
    }
  }

  /** Macro definition, {@code macro_rules! NAME { BODY }} if legacy,
   * {@code macro NAME { BODY }} otherwise.
   *
   * <p>Its uses are expanded before lowering. Lowering keeps the definition
   * only if other crates can see it. */
  public static class MacroDef extends Item {
    /** Tokens of the body, as source text. */
    public final String body;
    public final boolean legacy;

    MacroDef(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        String body,
        boolean legacy) {
      super(pos, Op.MACRO_DEF, id, name, vis, attrs);
      this.body = requireNonNull(body);
      this.legacy = legacy;
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append(legacy ? "macro_rules! " : "macro ").id(name)
          .append(" { ").append(body).append(" }");
    }
  }

  /** Macro invocation in item position. */
  public static class MacItem extends Item {
    public final Path path;

    MacItem(
        Pos pos,
        int id,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Path path) {
      super(pos, Op.MAC_ITEM, id, "", vis, attrs);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append(path).append("!(...);");
    }
  }

  /** Variant of an enum. */
  public static class Variant extends AstNode {
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final VariantData data;
    /** Explicit discriminant, or null. */
    public final @Nullable Exp disrExp;

    Variant(
        Pos pos,
        String name,
        ImmutableList<Attribute> attrs,
        VariantData data,
        @Nullable Exp disrExp) {
      super(pos, Op.VARIANT);
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.data = requireNonNull(data);
      this.disrExp = disrExp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append(data).appendIf(" = ", disrExp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Fields of a struct, union or enum variant. */
  public static class VariantData extends AstNode {
    public final VariantKind kind;
    public final ImmutableList<StructField> fields;
    public final int id;

    VariantData(
        VariantKind kind, ImmutableList<StructField> fields, int id) {
      super(Pos.ZERO, Op.VARIANT_DATA);
      this.kind = requireNonNull(kind);
      this.fields = requireNonNull(fields);
      this.id = id;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (kind) {
        case STRUCT:
          return w.append(" {").appendAll(fields, ", ").append("}");
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

  /** Field of a struct, union or enum variant. */
  public static class StructField extends AstNode {
    public final int id;
    /** Name of the field, or null for a field of a tuple struct. */
    public final @Nullable String name;
    public final Visibility vis;
    public final Ty ty;
    public final ImmutableList<Attribute> attrs;

    StructField(
        Pos pos,
        int id,
        @Nullable String name,
        Visibility vis,
        Ty ty,
        ImmutableList<Attribute> attrs) {
      super(pos, Op.STRUCT_FIELD);
      this.id = id;
      this.name = name;
      this.vis = requireNonNull(vis);
      this.ty = requireNonNull(ty);
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(vis);
      if (name != null) {
        w.id(name).append(": ");
      }
      return w.append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // associated and foreign items

  /** Abstract base class of items declared in a trait. */
  public abstract static class TraitItem extends AstNode {
    public final int id;
    public final String name;
    public final ImmutableList<Attribute> attrs;
    public final Generics generics;

    TraitItem(
        Pos pos,
        Op op,
        int id,
        String name,
        ImmutableList<Attribute> attrs,
        Generics generics) {
      super(pos, op);
      this.id = id;
      this.name = requireNonNull(name);
      this.attrs = requireNonNull(attrs);
      this.generics = requireNonNull(generics);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code const NAME: TY = DEFAULT;} in a trait. */
  public static class TraitConst extends TraitItem {
    public final Ty ty;
    public final @Nullable Exp defaultExp;

    TraitConst(
        Pos pos,
        int id,
        String name,
        ImmutableList<Attribute> attrs,
        Generics generics,
        Ty ty,
        @Nullable Exp defaultExp) {
      super(pos, Op.TRAIT_CONST, id, name, attrs, generics);
      this.ty = requireNonNull(ty);
      this.defaultExp = defaultExp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("const ")
          .id(name)
          .append(": ")
          .append(ty)
          .appendIf(" = ", defaultExp)
          .append(";");
    }
  }

  /** Method declared in a trait, with or without a default body. */
  public static class TraitMethod extends TraitItem {
    public final MethodSig sig;
    public final @Nullable Block body;

    TraitMethod(
        Pos pos,
        int id,
        String name,
        ImmutableList<Attribute> attrs,
        Generics generics,
        MethodSig sig,
        @Nullable Block body) {
      super(pos, Op.TRAIT_METHOD, id, name, attrs, generics);
      this.sig = requireNonNull(sig);
      this.body = body;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fn ").id(name).append(generics);
      sig.decl.unparseSignature(w);
      return body == null ? w.append(";") : w.append(" ").append(body);
    }
  }

  /** {@code type Name: BOUNDS = DEFAULT;} in a trait. */
  public static class TraitType extends TraitItem {
    public final ImmutableList<TyParamBound> bounds;
    public final @Nullable Ty defaultTy;

    TraitType(
        Pos pos,
        int id,
        String name,
        ImmutableList<Attribute> attrs,
        Generics generics,
        ImmutableList<TyParamBound> bounds,
        @Nullable Ty defaultTy) {
      super(pos, Op.TRAIT_TYPE, id, name, attrs, generics);
      this.bounds = requireNonNull(bounds);
      this.defaultTy = defaultTy;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("type ")
          .id(name)
          .appendAll(": ", bounds, " + ", "")
          .appendIf(" = ", defaultTy)
          .append(";");
    }
  }

  /** Macro invocation in a trait. */
  public static class TraitMac extends TraitItem {
    public final Path path;

    TraitMac(Pos pos, int id, Path path) {
      super(pos, Op.TRAIT_MAC, id, "", ImmutableList.of(),
          Generics.EMPTY);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path).append("!(...);");
    }
  }

  /** Abstract base class of items declared in an impl. */
  public abstract static class ImplItem extends AstNode {
    public final int id;
    public final String name;
    public final Visibility vis;
    public final Defaultness defaultness;
    public final ImmutableList<Attribute> attrs;
    public final Generics generics;

    ImplItem(
        Pos pos,
        Op op,
        int id,
        String name,
        Visibility vis,
        Defaultness defaultness,
        ImmutableList<Attribute> attrs,
        Generics generics) {
      super(pos, op);
      this.id = id;
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.defaultness = requireNonNull(defaultness);
      this.attrs = requireNonNull(attrs);
      this.generics = requireNonNull(generics);
    }

    @Override
    final AstWriter unparse(AstWriter w, int left, int right) {
      w.append(vis);
      if (defaultness == Defaultness.DEFAULT) {
        w.append("default ");
      }
      return unparseItem(w);
    }

    abstract AstWriter unparseItem(AstWriter w);

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code const NAME: TY = EXP;} in an impl. */
  public static class ImplConst extends ImplItem {
    public final Ty ty;
    public final Exp exp;

    ImplConst(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        Defaultness defaultness,
        ImmutableList<Attribute> attrs,
        Generics generics,
        Ty ty,
        Exp exp) {
      super(pos, Op.IMPL_CONST, id, name, vis, defaultness, attrs, generics);
      this.ty = requireNonNull(ty);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("const ")
          .id(name)
          .append(": ")
          .append(ty)
          .append(" = ")
          .append(exp)
          .append(";");
    }
  }

  /** Method defined in an impl. */
  public static class ImplMethod extends ImplItem {
    public final MethodSig sig;
    public final Block body;

    ImplMethod(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        Defaultness defaultness,
        ImmutableList<Attribute> attrs,
        Generics generics,
        MethodSig sig,
        Block body) {
      super(pos, Op.IMPL_METHOD, id, name, vis, defaultness, attrs, generics);
      this.sig = requireNonNull(sig);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      w.append("fn ").id(name).append(generics);
      return sig.decl.unparseSignature(w).append(" ").append(body);
    }
  }

  /** {@code type Name = TY;} in an impl. */
  public static class ImplType extends ImplItem {
    public final Ty ty;

    ImplType(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        Defaultness defaultness,
        ImmutableList<Attribute> attrs,
        Generics generics,
        Ty ty) {
      super(pos, Op.IMPL_TYPE, id, name, vis, defaultness, attrs, generics);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append("type ").id(name).append(" = ").append(ty).append(";");
    }
  }

  /** Macro invocation in an impl. */
  public static class ImplMac extends ImplItem {
    public final Path path;

    ImplMac(Pos pos, int id, Visibility vis, Path path) {
      super(pos, Op.IMPL_MAC, id, "", vis, Defaultness.FINAL,
          ImmutableList.of(), Generics.EMPTY);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparseItem(AstWriter w) {
      return w.append(path).append("!(...);");
    }
  }

  /** Abstract base class of items declared in an {@code extern} block. */
  public abstract static class ForeignItem extends AstNode {
    public final int id;
    public final String name;
    public final Visibility vis;
    public final ImmutableList<Attribute> attrs;

    ForeignItem(
        Pos pos,
        Op op,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs) {
      super(pos, op);
      this.id = id;
      this.name = requireNonNull(name);
      this.vis = requireNonNull(vis);
      this.attrs = requireNonNull(attrs);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Foreign function. */
  public static class ForeignFn extends ForeignItem {
    public final FnDecl decl;
    public final Generics generics;

    ForeignFn(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        FnDecl decl,
        Generics generics) {
      super(pos, Op.FOREIGN_FN, id, name, vis, attrs);
      this.decl = requireNonNull(decl);
      this.generics = requireNonNull(generics);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(vis).append("fn ").id(name).append(generics);
      return decl.unparseSignature(w).append(";");
    }
  }

  /** Foreign static. */
  public static class ForeignStatic extends ForeignItem {
    public final Ty ty;
    public final Mutability mutability;

    ForeignStatic(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs,
        Ty ty,
        Mutability mutability) {
      super(pos, Op.FOREIGN_STATIC, id, name, vis, attrs);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(vis)
          .append("static ")
          .append(mutability == Mutability.MUTABLE ? "mut " : "")
          .id(name)
          .append(": ")
          .append(ty)
          .append(";");
    }
  }

  /** Foreign type. */
  public static class ForeignType extends ForeignItem {
    ForeignType(
        Pos pos,
        int id,
        String name,
        Visibility vis,
        ImmutableList<Attribute> attrs) {
      super(pos, Op.FOREIGN_TYPE, id, name, vis, attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(vis).append("type ").id(name).append(";");
    }
  }

  /** Signature of a method. */
  public static class MethodSig extends AstNode {
    public final Unsafety unsafety;
    public final Constness constness;
    public final String abi;
    public final FnDecl decl;

    MethodSig(
        Unsafety unsafety, Constness constness, String abi, FnDecl decl) {
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
        new Generics(Pos.ZERO, ImmutableList.of(), ImmutableList.of(),
            new WhereClause(Pos.ZERO, DUMMY_NODE_ID, ImmutableList.of()));

    public final ImmutableList<RegionDef> regions;
    public final ImmutableList<TyParam> tyParams;
    public final WhereClause whereClause;

    Generics(
        Pos pos,
        ImmutableList<RegionDef> regions,
        ImmutableList<TyParam> tyParams,
        WhereClause whereClause) {
      super(pos, Op.GENERICS);
      this.regions = requireNonNull(regions);
      this.tyParams = requireNonNull(tyParams);
      this.whereClause = requireNonNull(whereClause);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (!regions.isEmpty() || !tyParams.isEmpty()) {
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

  /** Reference to a region, such as {@code 'a}, {@code '_} or
   * {@code 'static}. */
  public static class Region extends AstNode {
    public final int id;
    public final String name;

    Region(Pos pos, int id, String name) {
      super(pos, Op.REGION);
      this.id = id;
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration of a region parameter, such as {@code 'a: 'b}. */
  public static class RegionDef extends AstNode {
    public final ImmutableList<Attribute> attrs;
    public final Region region;
    public final ImmutableList<Region> bounds;

    RegionDef(
        ImmutableList<Attribute> attrs,
        Region region,
        ImmutableList<Region> bounds) {
      super(region.pos, Op.REGION_DEF);
      this.attrs = requireNonNull(attrs);
      this.region = requireNonNull(region);
      this.bounds = requireNonNull(bounds);
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
    public final int id;
    public final ImmutableList<Attribute> attrs;
    public final String name;
    public final ImmutableList<TyParamBound> bounds;
    public final @Nullable Ty defaultTy;

    TyParam(
        Pos pos,
        int id,
        ImmutableList<Attribute> attrs,
        String name,
        ImmutableList<TyParamBound> bounds,
        @Nullable Ty defaultTy) {
      super(pos, Op.TY_PARAM);
      this.id = id;
      this.attrs = requireNonNull(attrs);
      this.name = requireNonNull(name);
      this.bounds = requireNonNull(bounds);
      this.defaultTy = defaultTy;
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
    public final int id;
    public final ImmutableList<WherePredicate> predicates;

    WhereClause(Pos pos, int id, ImmutableList<WherePredicate> predicates) {
      super(pos, Op.WHERE_CLAUSE);
      this.id = id;
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
    public final ImmutableList<TyParamBound> bounds;

    BoundPredicate(
        Pos pos,
        ImmutableList<RegionDef> boundRegions,
        Ty boundedTy,
        ImmutableList<TyParamBound> bounds) {
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
    public final int id;
    public final Ty lhs;
    public final Ty rhs;

    EqPredicate(Pos pos, int id, Ty lhs, Ty rhs) {
      super(pos, Op.EQ_PREDICATE);
      this.id = id;
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

  /** Abstract base class of bounds on a type parameter. */
  public abstract static class TyParamBound extends AstNode {
    TyParamBound(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Trait bound, such as {@code Clone} or {@code ?Sized}. */
  public static class TraitBound extends TyParamBound {
    public final PolyTraitRef traitRef;
    public final TraitBoundModifier modifier;

    TraitBound(PolyTraitRef traitRef, TraitBoundModifier modifier) {
      super(traitRef.pos, Op.TRAIT_BOUND);
      this.traitRef = requireNonNull(traitRef);
      this.modifier = requireNonNull(modifier);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(modifier == TraitBoundModifier.MAYBE ? "?" : "")
          .append(traitRef);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Region bound, such as {@code 'a}. */
  public static class RegionBound extends TyParamBound {
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

  /** Trait reference that may bind regions, such as
   * {@code for<'a> Fn(&'a T)}. */
  public static class PolyTraitRef extends AstNode {
    public final ImmutableList<RegionDef> boundRegions;
    public final TraitRef traitRef;

    PolyTraitRef(
        Pos pos, ImmutableList<RegionDef> boundRegions, TraitRef traitRef) {
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
    public final int refId;

    TraitRef(Path path, int refId) {
      super(path.pos, Op.TRAIT_REF);
      this.path = requireNonNull(path);
      this.refId = refId;
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

  /** Path, such as {@code std::vec::Vec<T>}. */
  public static class Path extends AstNode {
    public final ImmutableList<PathSegment> segments;

    Path(Pos pos, ImmutableList<PathSegment> segments) {
      super(pos, Op.PATH);
      this.segments = requireNonNull(segments);
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

  /** Segment of a path: an identifier and optional generic arguments. */
  public static class PathSegment extends AstNode {
    public final String name;
    public final @Nullable PathParameters parameters;

    PathSegment(Pos pos, String name, @Nullable PathParameters parameters) {
      super(pos, Op.PATH_SEGMENT);
      this.name = requireNonNull(name);
      this.parameters = parameters;
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

  /**
   * Generic arguments of a path segment: either angle-bracketed
   * ({@code <'a, T, Item = U>}) or parenthesized ({@code (A, B) -> C}).
   */
  public static class PathParameters extends AstNode {
    public final boolean parenthesized;
    public final ImmutableList<Region> regions;
    /** Type arguments; for parenthesized parameters, the inputs. */
    public final ImmutableList<Ty> types;
    public final ImmutableList<TypeBinding> bindings;
    /** Output of parenthesized parameters, or null. */
    public final @Nullable Ty output;

    PathParameters(
        Pos pos,
        boolean parenthesized,
        ImmutableList<Region> regions,
        ImmutableList<Ty> types,
        ImmutableList<TypeBinding> bindings,
        @Nullable Ty output) {
      super(pos, Op.PATH_PARAMETERS);
      this.parenthesized = parenthesized;
      this.regions = requireNonNull(regions);
      this.types = requireNonNull(types);
      this.bindings = requireNonNull(bindings);
      this.output = output;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (parenthesized) {
        return w.append("(")
            .appendAll(types, ", ")
            .append(")")
            .appendIf(" -> ", output);
      }
      final ImmutableList<AstNode> args =
          ImmutableList.<AstNode>builder()
              .addAll(regions)
              .addAll(types)
              .addAll(bindings)
              .build();
      return w.append("<").appendAll(args, ", ").append(">");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Associated type binding, such as {@code Item = T}. */
  public static class TypeBinding extends AstNode {
    public final int id;
    public final String name;
    public final Ty ty;

    TypeBinding(Pos pos, int id, String name, Ty ty) {
      super(pos, Op.TYPE_BINDING);
      this.id = id;
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

  // signatures

  /** Declaration of a function: arguments and return type. */
  public static class FnDecl extends AstNode {
    public final ImmutableList<Arg> inputs;
    /** Declared return type, or null if the return type is the default. */
    public final @Nullable Ty output;
    /** Position of the return type, or where it would be if omitted. */
    public final Pos outputPos;
    public final boolean variadic;

    FnDecl(
        ImmutableList<Arg> inputs,
        @Nullable Ty output,
        Pos outputPos,
        boolean variadic) {
      super(Pos.ZERO, Op.FN_DECL);
      this.inputs = requireNonNull(inputs);
      this.output = output;
      this.outputPos = requireNonNull(outputPos);
      this.variadic = variadic;
    }

    /** Returns whether the first argument is {@code self}. */
    public boolean hasSelf() {
      return !inputs.isEmpty() && inputs.get(0).isSelf();
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

  /** Argument of a function. */
  public static class Arg extends AstNode {
    public final int id;
    public final Pat pat;
    public final Ty ty;

    Arg(Pos pos, int id, Pat pat, Ty ty) {
      super(pos, Op.ARG);
      this.id = id;
      this.pat = requireNonNull(pat);
      this.ty = requireNonNull(ty);
    }

    /** Returns whether this is a {@code self} argument. */
    public boolean isSelf() {
      return pat instanceof IdentPat && ((IdentPat) pat).name.equals("self");
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (isSelf() && ty instanceof ImplicitSelfTy) {
        return w.append(pat);
      }
      return w.append(pat).append(": ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // types

  /** Abstract base class of types. */
  public abstract static class Ty extends AstNode {
    public final int id;

    Ty(Pos pos, Op op, int id) {
      super(pos, op);
      this.id = id;
    }
  }

  /** Type to be inferred, {@code _}. */
  public static class InferTy extends Ty {
    InferTy(Pos pos, int id) {
      super(pos, Op.INFER_TY, id);
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

  /** Type that the parser could not parse. */
  public static class ErrTy extends Ty {
    ErrTy(Pos pos, int id) {
      super(pos, Op.ERR_TY, id);
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

  /** Slice type, {@code [T]}. */
  public static class SliceTy extends Ty {
    public final Ty elementTy;

    SliceTy(Pos pos, int id, Ty elementTy) {
      super(pos, Op.SLICE_TY, id);
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

  /** Raw pointer type, {@code *const T} or {@code *mut T}. */
  public static class PtrTy extends Ty {
    public final Ty ty;
    public final Mutability mutability;

    PtrTy(Pos pos, int id, Ty ty, Mutability mutability) {
      super(pos, Op.PTR_TY, id);
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Mutability.MUTABLE ? "*mut " : "*const ")
          .append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference type, {@code &'a mut T}; the region is optional. */
  public static class RefTy extends Ty {
    public final @Nullable Region region;
    public final Ty ty;
    public final Mutability mutability;

    RefTy(
        Pos pos,
        int id,
        @Nullable Region region,
        Ty ty,
        Mutability mutability) {
      super(pos, Op.REF_TY, id);
      this.region = region;
      this.ty = requireNonNull(ty);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("&");
      if (region != null) {
        w.append(region).append(" ");
      }
      return w.append(mutability == Mutability.MUTABLE ? "mut " : "")
          .append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function pointer type, {@code for<'a> unsafe fn(&'a T) -> U}. */
  public static class BareFnTy extends Ty {
    public final Unsafety unsafety;
    public final String abi;
    public final ImmutableList<RegionDef> regions;
    public final FnDecl decl;

    BareFnTy(
        Pos pos,
        int id,
        Unsafety unsafety,
        String abi,
        ImmutableList<RegionDef> regions,
        FnDecl decl) {
      super(pos, Op.BARE_FN_TY, id);
      this.unsafety = requireNonNull(unsafety);
      this.abi = requireNonNull(abi);
      this.regions = requireNonNull(regions);
      this.decl = requireNonNull(decl);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll("for<", regions, ", ", "> ")
          .append(unsafety == Unsafety.UNSAFE ? "unsafe " : "")
          .append("fn");
      return decl.unparseSignature(w);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Never type, {@code !}. */
  public static class NeverTy extends Ty {
    NeverTy(Pos pos, int id) {
      super(pos, Op.NEVER_TY, id);
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

  /** Tuple type, {@code (A, B)}; the empty tuple is the unit type. */
  public static class TupTy extends Ty {
    public final ImmutableList<Ty> types;

    TupTy(Pos pos, int id, ImmutableList<Ty> types) {
      super(pos, Op.TUP_TY, id);
      this.types = requireNonNull(types);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(")
          .appendAll(types, ", ")
          .append(types.size() == 1 ? ",)" : ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parenthesized type, {@code (T)}. */
  public static class ParenTy extends Ty {
    public final Ty ty;

    ParenTy(Pos pos, int id, Ty ty) {
      super(pos, Op.PAREN_TY, id);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(ty).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Path type, optionally qualified, such as {@code <T as Trait>::A}. */
  public static class PathTy extends Ty {
    public final @Nullable QSelf qself;
    public final Path path;

    PathTy(Pos pos, int id, @Nullable QSelf qself, Path path) {
      super(pos, Op.PATH_TY, id);
      this.qself = qself;
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseQPath(w, qself, path);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Type of an implicit {@code self} argument. */
  public static class ImplicitSelfTy extends Ty {
    ImplicitSelfTy(Pos pos, int id) {
      super(pos, Op.IMPLICIT_SELF_TY, id);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("Self");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array type, {@code [T; N]}. */
  public static class ArrayTy extends Ty {
    public final Ty elementTy;
    public final Exp length;

    ArrayTy(Pos pos, int id, Ty elementTy, Exp length) {
      super(pos, Op.ARRAY_TY, id);
      this.elementTy = requireNonNull(elementTy);
      this.length = requireNonNull(length);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[")
          .append(elementTy)
          .append("; ")
          .append(length)
          .append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code typeof(EXP)} */
  public static class TypeofTy extends Ty {
    public final Exp exp;

    TypeofTy(Pos pos, int id, Exp exp) {
      super(pos, Op.TYPEOF_TY, id);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("typeof(").append(exp).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Trait object type, {@code dyn Trait + 'a}. */
  public static class TraitObjectTy extends Ty {
    public final ImmutableList<TyParamBound> bounds;

    TraitObjectTy(Pos pos, int id, ImmutableList<TyParamBound> bounds) {
      super(pos, Op.TRAIT_OBJECT_TY, id);
      this.bounds = requireNonNull(bounds);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("dyn ").appendAll(bounds, " + ");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Anonymous type satisfying bounds, {@code impl Trait + 'a}. */
  public static class ImplTraitTy extends Ty {
    public final ImmutableList<TyParamBound> bounds;

    ImplTraitTy(Pos pos, int id, ImmutableList<TyParamBound> bounds) {
      super(pos, Op.IMPL_TRAIT_TY, id);
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

  /** Macro invocation in type position. */
  public static class MacTy extends Ty {
    public final Path path;

    MacTy(Pos pos, int id, Path path) {
      super(pos, Op.MAC_TY, id);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path).append("!(...)");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Writes an optionally qualified path. */
  static AstWriter unparseQPath(
      AstWriter w, @Nullable QSelf qself, Path path) {
    if (qself == null) {
      return w.append(path);
    }
    w.append("<").append(qself.ty);
    if (qself.position > 0) {
      w.append(" as ")
          .appendAll(path.segments.subList(0, qself.position), "::");
    }
    w.append(">");
    for (PathSegment segment : path.segments.subList(qself.position,
        path.segments.size())) {
      w.append("::").append(segment);
    }
    return w;
  }

  // patterns

  /** Abstract base class of patterns. */
  public abstract static class Pat extends AstNode {
    public final int id;

    Pat(Pos pos, Op op, int id) {
      super(pos, op);
      this.id = id;
    }
  }

  /** Wildcard pattern, {@code _}. */
  public static class WildPat extends Pat {
    WildPat(Pos pos, int id) {
      super(pos, Op.WILD_PAT, id);
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

  /**
   * Identifier pattern, {@code ref mut x @ SUB}.
   *
   * <p>Name resolution determines whether it binds a new variable or refers
   * to a constant, unit struct or unit variant.
   */
  public static class IdentPat extends Pat {
    public final BindingMode mode;
    public final String name;
    public final Pos namePos;
    public final @Nullable Pat sub;

    IdentPat(
        Pos pos,
        int id,
        BindingMode mode,
        String name,
        Pos namePos,
        @Nullable Pat sub) {
      super(pos, Op.IDENT_PAT, id);
      this.mode = requireNonNull(mode);
      this.name = requireNonNull(name);
      this.namePos = requireNonNull(namePos);
      this.sub = sub;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mode.prefix).id(name).appendIf(" @ ", sub);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Struct pattern, {@code Point {x, y: 0, ..}}. */
  public static class StructPat extends Pat {
    public final Path path;
    public final ImmutableList<FieldPat> fields;
    public final boolean hasRest;

    StructPat(
        Pos pos,
        int id,
        Path path,
        ImmutableList<FieldPat> fields,
        boolean hasRest) {
      super(pos, Op.STRUCT_PAT, id);
      this.path = requireNonNull(path);
      this.fields = requireNonNull(fields);
      this.hasRest = hasRest;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(path).append(" {").appendAll(fields, ", ");
      if (hasRest) {
        w.append(fields.isEmpty() ? ".." : ", ..");
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
      return shorthand ? w.append(pat) : w.id(name).append(": ").append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple struct pattern, {@code Some(x)}. */
  public static class TupleStructPat extends Pat {
    public final Path path;
    public final ImmutableList<Pat> pats;
    /** Position of {@code ..} among the patterns, or -1. */
    public final int ddpos;

    TupleStructPat(
        Pos pos, int id, Path path, ImmutableList<Pat> pats, int ddpos) {
      super(pos, Op.TUPLE_STRUCT_PAT, id);
      this.path = requireNonNull(path);
      this.pats = requireNonNull(pats);
      this.ddpos = ddpos;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparsePats(w.append(path).append("("), pats, ddpos)
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Path pattern, such as {@code None} or {@code <T>::CONST}. */
  public static class PathPat extends Pat {
    public final @Nullable QSelf qself;
    public final Path path;

    PathPat(Pos pos, int id, @Nullable QSelf qself, Path path) {
      super(pos, Op.PATH_PAT, id);
      this.qself = qself;
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseQPath(w, qself, path);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple pattern, {@code (a, .., z)}. */
  public static class TuplePat extends Pat {
    public final ImmutableList<Pat> pats;
    /** Position of {@code ..} among the patterns, or -1. */
    public final int ddpos;

    TuplePat(Pos pos, int id, ImmutableList<Pat> pats, int ddpos) {
      super(pos, Op.TUPLE_PAT, id);
      this.pats = requireNonNull(pats);
      this.ddpos = ddpos;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparsePats(w.append("("), pats, ddpos).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Box pattern, {@code box p}. */
  public static class BoxPat extends Pat {
    public final Pat pat;

    BoxPat(Pos pos, int id, Pat pat) {
      super(pos, Op.BOX_PAT, id);
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

  /** Reference pattern, {@code &mut p}. */
  public static class RefPat extends Pat {
    public final Pat pat;
    public final Mutability mutability;

    RefPat(Pos pos, int id, Pat pat, Mutability mutability) {
      super(pos, Op.REF_PAT, id);
      this.pat = requireNonNull(pat);
      this.mutability = requireNonNull(mutability);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Mutability.MUTABLE ? "&mut " : "&")
          .append(pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal pattern. */
  public static class LitPat extends Pat {
    public final Exp exp;

    LitPat(Pos pos, int id, Exp exp) {
      super(pos, Op.LIT_PAT, id);
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

  /** Range pattern, {@code 1..=9}. */
  public static class RangePat extends Pat {
    public final Exp lo;
    public final Exp hi;
    public final RangeEnd end;

    RangePat(Pos pos, int id, Exp lo, Exp hi, RangeEnd end) {
      super(pos, Op.RANGE_PAT, id);
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

  /** Slice pattern, {@code [a, rest.., z]}. */
  public static class SlicePat extends Pat {
    public final ImmutableList<Pat> before;
    public final @Nullable Pat slice;
    public final ImmutableList<Pat> after;

    SlicePat(
        Pos pos,
        int id,
        ImmutableList<Pat> before,
        @Nullable Pat slice,
        ImmutableList<Pat> after) {
      super(pos, Op.SLICE_PAT, id);
      this.before = requireNonNull(before);
      this.slice = slice;
      this.after = requireNonNull(after);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseSlice(w, before, slice, after);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Macro invocation in pattern position. */
  public static class MacPat extends Pat {
    public final Path path;

    MacPat(Pos pos, int id, Path path) {
      super(pos, Op.MAC_PAT, id);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path).append("!(...)");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Writes a list of patterns, with {@code ..} at a given position. */
  static AstWriter unparsePats(
      AstWriter w, List<? extends AstNode> pats, int ddpos) {
    boolean first = true;
    for (int i = 0; i <= pats.size(); i++) {
      if (i == ddpos) {
        w.append(first ? ".." : ", ..");
        first = false;
      }
      if (i < pats.size()) {
        w.append(first ? "" : ", ").append(pats.get(i));
        first = false;
      }
    }
    return w;
  }

  /** Writes a slice pattern. */
  static AstWriter unparseSlice(
      AstWriter w,
      List<? extends AstNode> before,
      @Nullable AstNode slice,
      List<? extends AstNode> after) {
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

  // expressions

  /** Abstract base class of expressions. */
  public abstract static class Exp extends AstNode {
    public final int id;
    public final ImmutableList<Attribute> attrs;

    Exp(Pos pos, Op op, int id, ImmutableList<Attribute> attrs) {
      super(pos, op);
      this.id = id;
      this.attrs = requireNonNull(attrs);
    }
  }

  /** {@code box EXP} */
  public static class Box extends Exp {
    public final Exp exp;

    Box(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp) {
      super(pos, Op.BOX, id, attrs);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("box ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Placement expression, {@code in PLACE { VALUE }}. */
  public static class InPlace extends Exp {
    public final Exp place;
    public final Exp value;

    InPlace(
        Pos pos, int id, ImmutableList<Attribute> attrs, Exp place,
        Exp value) {
      super(pos, Op.IN_PLACE, id, attrs);
      this.place = requireNonNull(place);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("in ").append(place).append(" { ").append(value)
          .append(" }");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array expression, {@code [a, b, c]}. */
  public static class Array extends Exp {
    public final ImmutableList<Exp> exps;

    Array(Pos pos, int id, ImmutableList<Attribute> attrs,
        ImmutableList<Exp> exps) {
      super(pos, Op.ARRAY, id, attrs);
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

  /** Repeat expression, {@code [VALUE; COUNT]}. */
  public static class Repeat extends Exp {
    public final Exp value;
    public final Exp count;

    Repeat(Pos pos, int id, ImmutableList<Attribute> attrs, Exp value,
        Exp count) {
      super(pos, Op.REPEAT, id, attrs);
      this.value = requireNonNull(value);
      this.count = requireNonNull(count);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(value).append("; ").append(count)
          .append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple expression, {@code (a, b)}. */
  public static class Tup extends Exp {
    public final ImmutableList<Exp> exps;

    Tup(Pos pos, int id, ImmutableList<Attribute> attrs,
        ImmutableList<Exp> exps) {
      super(pos, Op.TUP, id, attrs);
      this.exps = requireNonNull(exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(")
          .appendAll(exps, ", ")
          .append(exps.size() == 1 ? ",)" : ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function call, {@code f(a, b)}. */
  public static class Call extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Call(Pos pos, int id, ImmutableList<Attribute> attrs, Exp fn,
        ImmutableList<Exp> args) {
      super(pos, Op.CALL, id, attrs);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn).append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Method call, {@code receiver.method::<T>(a, b)}. The first argument
   * is the receiver. */
  public static class MethodCall extends Exp {
    public final PathSegment segment;
    public final ImmutableList<Exp> args;

    MethodCall(Pos pos, int id, ImmutableList<Attribute> attrs,
        PathSegment segment, ImmutableList<Exp> args) {
      super(pos, Op.METHOD_CALL, id, attrs);
      this.segment = requireNonNull(segment);
      this.args = requireNonNull(args);
      checkReceiver(args);
    }

    private static void checkReceiver(List<Exp> args) {
      if (args.isEmpty()) {
        throw new IllegalArgumentException("method call needs a receiver");
      }
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(args.get(0))
          .append(".")
          .append(segment)
          .append("(")
          .appendAll(args.subList(1, args.size()), ", ")
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Binary operator, {@code a + b}. */
  public static class Binary extends Exp {
    public final BinOpKind binOp;
    public final Exp left;
    public final Exp right;

    Binary(Pos pos, int id, ImmutableList<Attribute> attrs, BinOpKind binOp,
        Exp left, Exp right) {
      super(pos, Op.BINARY, id, attrs);
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

  /** Unary operator, {@code -a}. */
  public static class Unary extends Exp {
    public final UnOp unOp;
    public final Exp exp;

    Unary(Pos pos, int id, ImmutableList<Attribute> attrs, UnOp unOp,
        Exp exp) {
      super(pos, Op.UNARY, id, attrs);
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

  /** Literal expression. */
  public static class LitExp extends Exp {
    public final Literal literal;

    LitExp(Pos pos, int id, ImmutableList<Attribute> attrs,
        Literal literal) {
      super(pos, Op.LIT, id, attrs);
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

  /** Cast, {@code EXP as TY}. */
  public static class Cast extends Exp {
    public final Exp exp;
    public final Ty ty;

    Cast(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp, Ty ty) {
      super(pos, Op.CAST, id, attrs);
      this.exp = requireNonNull(exp);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append(" as ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Type ascription, {@code EXP: TY}. */
  public static class TypeAscription extends Exp {
    public final Exp exp;
    public final Ty ty;

    TypeAscription(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp,
        Ty ty) {
      super(pos, Op.TYPE_ASCRIPTION, id, attrs);
      this.exp = requireNonNull(exp);
      this.ty = requireNonNull(ty);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append(": ").append(ty);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code if COND { THEN } else ELSE} */
  public static class If extends Exp {
    public final Exp condition;
    public final Block ifTrue;
    public final @Nullable Exp ifFalse;

    If(Pos pos, int id, ImmutableList<Attribute> attrs, Exp condition,
        Block ifTrue, @Nullable Exp ifFalse) {
      super(pos, Op.IF, id, attrs);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("if ")
          .append(condition)
          .append(" ")
          .append(ifTrue)
          .appendIf(" else ", ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code if let PAT = SUBJECT { THEN } else ELSE} */
  public static class IfLet extends Exp {
    public final Pat pat;
    public final Exp subject;
    public final Block ifTrue;
    public final @Nullable Exp ifFalse;

    IfLet(Pos pos, int id, ImmutableList<Attribute> attrs, Pat pat,
        Exp subject, Block ifTrue, @Nullable Exp ifFalse) {
      super(pos, Op.IF_LET, id, attrs);
      this.pat = requireNonNull(pat);
      this.subject = requireNonNull(subject);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("if let ")
          .append(pat)
          .append(" = ")
          .append(subject)
          .append(" ")
          .append(ifTrue)
          .appendIf(" else ", ifFalse);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: while COND { BODY }} */
  public static class While extends Exp {
    public final Exp condition;
    public final Block body;
    public final @Nullable Label label;

    While(Pos pos, int id, ImmutableList<Attribute> attrs, Exp condition,
        Block body, @Nullable Label label) {
      super(pos, Op.WHILE, id, attrs);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
      this.label = label;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseLabel(w, label)
          .append("while ")
          .append(condition)
          .append(" ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: while let PAT = SUBJECT { BODY }} */
  public static class WhileLet extends Exp {
    public final Pat pat;
    public final Exp subject;
    public final Block body;
    public final @Nullable Label label;

    WhileLet(Pos pos, int id, ImmutableList<Attribute> attrs, Pat pat,
        Exp subject, Block body, @Nullable Label label) {
      super(pos, Op.WHILE_LET, id, attrs);
      this.pat = requireNonNull(pat);
      this.subject = requireNonNull(subject);
      this.body = requireNonNull(body);
      this.label = label;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseLabel(w, label)
          .append("while let ")
          .append(pat)
          .append(" = ")
          .append(subject)
          .append(" ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: for PAT in HEAD { BODY }} */
  public static class ForLoop extends Exp {
    public final Pat pat;
    public final Exp head;
    public final Block body;
    public final @Nullable Label label;

    ForLoop(Pos pos, int id, ImmutableList<Attribute> attrs, Pat pat,
        Exp head, Block body, @Nullable Label label) {
      super(pos, Op.FOR_LOOP, id, attrs);
      this.pat = requireNonNull(pat);
      this.head = requireNonNull(head);
      this.body = requireNonNull(body);
      this.label = label;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseLabel(w, label)
          .append("for ")
          .append(pat)
          .append(" in ")
          .append(head)
          .append(" ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code 'label: loop { BODY }} */
  public static class Loop extends Exp {
    public final Block body;
    public final @Nullable Label label;

    Loop(Pos pos, int id, ImmutableList<Attribute> attrs, Block body,
        @Nullable Label label) {
      super(pos, Op.LOOP, id, attrs);
      this.body = requireNonNull(body);
      this.label = label;
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

  /** {@code match EXP { ARMS }} */
  public static class Match extends Exp {
    public final Exp exp;
    public final ImmutableList<Arm> arms;

    Match(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp,
        ImmutableList<Arm> arms) {
      super(pos, Op.MATCH, id, attrs);
      this.exp = requireNonNull(exp);
      this.arms = requireNonNull(arms);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("match ")
          .append(exp)
          .append(" {")
          .appendAll(" ", arms, ", ", " ")
          .append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Arm of a match, {@code PAT | PAT if GUARD => BODY}. */
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
      return w.appendAll(pats, " | ")
          .appendIf(" if ", guard)
          .append(" => ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Closure, {@code move |a, b| BODY}. */
  public static class Closure extends Exp {
    public final CaptureBy captureBy;
    public final FnDecl decl;
    public final Exp body;
    public final Pos declPos;

    Closure(Pos pos, int id, ImmutableList<Attribute> attrs,
        CaptureBy captureBy, FnDecl decl, Exp body, Pos declPos) {
      super(pos, Op.CLOSURE, id, attrs);
      this.captureBy = requireNonNull(captureBy);
      this.decl = requireNonNull(decl);
      this.body = requireNonNull(body);
      this.declPos = requireNonNull(declPos);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(captureBy == CaptureBy.VALUE ? "move " : "")
          .append("|")
          .appendAll(decl.inputs, ", ")
          .append("| ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Block expression. */
  public static class BlockExp extends Exp {
    public final Block block;

    BlockExp(Pos pos, int id, ImmutableList<Attribute> attrs, Block block) {
      super(pos, Op.BLOCK_EXP, id, attrs);
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

  /** {@code do catch { BODY }} */
  public static class Catch extends Exp {
    public final Block block;

    Catch(Pos pos, int id, ImmutableList<Attribute> attrs, Block block) {
      super(pos, Op.CATCH, id, attrs);
      this.block = requireNonNull(block);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("do catch ").append(block);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment, {@code a = b}. */
  public static class Assign extends Exp {
    public final Exp target;
    public final Exp value;

    Assign(Pos pos, int id, ImmutableList<Attribute> attrs, Exp target,
        Exp value) {
      super(pos, Op.ASSIGN, id, attrs);
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

  /** Compound assignment, {@code a += b}. */
  public static class AssignOp extends Exp {
    public final BinOpKind binOp;
    public final Exp target;
    public final Exp value;

    AssignOp(Pos pos, int id, ImmutableList<Attribute> attrs,
        BinOpKind binOp, Exp target, Exp value) {
      super(pos, Op.ASSIGN_OP, id, attrs);
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

  /** Field access, {@code exp.name}. */
  public static class FieldAccess extends Exp {
    public final Exp exp;
    public final String name;

    FieldAccess(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp,
        String name) {
      super(pos, Op.FIELD_ACCESS, id, attrs);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append(".").id(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple field access, {@code exp.0}. */
  public static class TupField extends Exp {
    public final Exp exp;
    public final int index;

    TupField(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp,
        int index) {
      super(pos, Op.TUP_FIELD, id, attrs);
      this.exp = requireNonNull(exp);
      this.index = index;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append(".").append(Integer.toString(index));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Index, {@code exp[index]}. */
  public static class Index extends Exp {
    public final Exp exp;
    public final Exp index;

    Index(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp,
        Exp index) {
      super(pos, Op.INDEX, id, attrs);
      this.exp = requireNonNull(exp);
      this.index = requireNonNull(index);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append("[").append(index).append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Range, {@code start..end} or {@code start..=end}; either bound may be
   * absent. */
  public static class Range extends Exp {
    public final @Nullable Exp start;
    public final @Nullable Exp end;
    public final RangeLimits limits;

    Range(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable Exp start, @Nullable Exp end, RangeLimits limits) {
      super(pos, Op.RANGE, id, attrs);
      this.start = start;
      this.end = end;
      this.limits = requireNonNull(limits);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (start != null) {
        w.append(start);
      }
      w.append(limits.symbol);
      return end == null ? w : w.append(end);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Path expression, optionally qualified. */
  public static class PathExp extends Exp {
    public final @Nullable QSelf qself;
    public final Path path;

    PathExp(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable QSelf qself, Path path) {
      super(pos, Op.PATH_EXP, id, attrs);
      this.qself = qself;
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return unparseQPath(w, qself, path);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Borrow, {@code &mut exp}. */
  public static class AddrOf extends Exp {
    public final Mutability mutability;
    public final Exp exp;

    AddrOf(Pos pos, int id, ImmutableList<Attribute> attrs,
        Mutability mutability, Exp exp) {
      super(pos, Op.ADDR_OF, id, attrs);
      this.mutability = requireNonNull(mutability);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutability == Mutability.MUTABLE ? "&mut " : "&")
          .append(exp, 99, 99);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code break 'label EXP} */
  public static class Break extends Exp {
    public final @Nullable Label label;
    public final @Nullable Exp exp;

    Break(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable Label label, @Nullable Exp exp) {
      super(pos, Op.BREAK, id, attrs);
      this.label = label;
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("break");
      if (label != null) {
        w.append(" ").append(label.name);
      }
      return w.appendIf(" ", exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code continue 'label} */
  public static class Continue extends Exp {
    public final @Nullable Label label;

    Continue(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable Label label) {
      super(pos, Op.CONTINUE, id, attrs);
      this.label = label;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("continue");
      return label == null ? w : w.append(" ").append(label.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code return EXP} */
  public static class Ret extends Exp {
    public final @Nullable Exp exp;

    Ret(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable Exp exp) {
      super(pos, Op.RET, id, attrs);
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

  /** Struct literal, {@code Point { x: 1, ..base }}. */
  public static class StructExp extends Exp {
    public final Path path;
    public final ImmutableList<Field> fields;
    public final @Nullable Exp base;

    StructExp(Pos pos, int id, ImmutableList<Attribute> attrs, Path path,
        ImmutableList<Field> fields, @Nullable Exp base) {
      super(pos, Op.STRUCT_EXP, id, attrs);
      this.path = requireNonNull(path);
      this.fields = requireNonNull(fields);
      this.base = base;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(path).append(" {").appendAll(fields, ", ");
      if (base != null) {
        w.append(fields.isEmpty() ? ".." : ", ..").append(base);
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

    Field(Pos pos, String name, Pos namePos, Exp exp, boolean shorthand) {
      super(pos, Op.FIELD);
      this.name = requireNonNull(name);
      this.namePos = requireNonNull(namePos);
      this.exp = requireNonNull(exp);
      this.shorthand = shorthand;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return shorthand ? w.append(exp) : w.id(name).append(": ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parenthesized expression. */
  public static class Paren extends Exp {
    public final Exp exp;

    Paren(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp) {
      super(pos, Op.PAREN, id, attrs);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code yield EXP} */
  public static class Yield extends Exp {
    public final @Nullable Exp exp;

    Yield(Pos pos, int id, ImmutableList<Attribute> attrs,
        @Nullable Exp exp) {
      super(pos, Op.YIELD, id, attrs);
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("yield").appendIf(" ", exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Error propagation, {@code exp?}. */
  public static class Try extends Exp {
    public final Exp exp;

    Try(Pos pos, int id, ImmutableList<Attribute> attrs, Exp exp) {
      super(pos, Op.TRY, id, attrs);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 99, 99).append("?");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Macro invocation in expression position. */
  public static class MacExp extends Exp {
    public final Path path;

    MacExp(Pos pos, int id, ImmutableList<Attribute> attrs, Path path) {
      super(pos, Op.MAC_EXP, id, attrs);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path).append("!(...)");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Writes the label of a loop, if present. */
  static AstWriter unparseLabel(AstWriter w, @Nullable Label label) {
    return label == null ? w : w.append(label.name).append(": ");
  }

  // statements

  /** Block, {@code { STMTS }}. If the last statement is an expression
   * without a semicolon, it is the value of the block. */
  public static class Block extends AstNode {
    public final int id;
    public final ImmutableList<Stmt> stmts;
    public final BlockCheckMode rules;

    Block(Pos pos, int id, ImmutableList<Stmt> stmts, BlockCheckMode rules) {
      super(pos, Op.BLOCK);
      this.id = id;
      this.stmts = requireNonNull(stmts);
      this.rules = requireNonNull(rules);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(rules.prefix)
          .append("{")
          .appendAll(" ", stmts, " ", " ")
          .append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** {@code let PAT: TY = INIT;} */
  public static class Local extends AstNode {
    public final int id;
    public final Pat pat;
    public final @Nullable Ty ty;
    public final @Nullable Exp init;
    public final ImmutableList<Attribute> attrs;

    Local(
        Pos pos,
        int id,
        Pat pat,
        @Nullable Ty ty,
        @Nullable Exp init,
        ImmutableList<Attribute> attrs) {
      super(pos, Op.LOCAL);
      this.id = id;
      this.pat = requireNonNull(pat);
      this.ty = ty;
      this.init = init;
      this.attrs = requireNonNull(attrs);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("let ")
          .append(pat)
          .appendIf(": ", ty)
          .appendIf(" = ", init)
          .append(";");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of statements. */
  public abstract static class Stmt extends AstNode {
    public final int id;

    Stmt(Pos pos, Op op, int id) {
      super(pos, op);
      this.id = id;
    }
  }

  /** Statement that declares a local variable. */
  public static class LocalStmt extends Stmt {
    public final Local local;

    LocalStmt(Pos pos, int id, Local local) {
      super(pos, Op.LOCAL_STMT, id);
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

  /** Statement that declares an item. */
  public static class ItemStmt extends Stmt {
    public final Item item;

    ItemStmt(Pos pos, int id, Item item) {
      super(pos, Op.ITEM_STMT, id);
      this.item = requireNonNull(item);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(item);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Expression statement without a trailing semicolon. */
  public static class ExprStmt extends Stmt {
    public final Exp exp;

    ExprStmt(Pos pos, int id, Exp exp) {
      super(pos, Op.EXPR_STMT, id);
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

    SemiStmt(Pos pos, int id, Exp exp) {
      super(pos, Op.SEMI_STMT, id);
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

  /** Macro invocation in statement position. */
  public static class MacStmt extends Stmt {
    public final Path path;

    MacStmt(Pos pos, int id, Path path) {
      super(pos, Op.MAC_STMT, id);
      this.path = requireNonNull(path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(path).append("!(...);");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
