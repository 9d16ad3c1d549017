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
import static net.hydromatic.lowering.ast.CoreBuilder.core;
import static net.hydromatic.lowering.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Attribute;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.LoweredId;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Creates core tree nodes that have no counterpart in the surface tree.
 *
 * <p>Every node that has identity gets a fresh id from the
 * {@link IdAllocator}, in the order in which the methods are called, so the
 * order of calls is significant.
 */
public class TreeBuilder {
  private final Session session;
  private final IdAllocator ids;
  private final NameResolver resolver;

  public TreeBuilder(Session session, IdAllocator ids, NameResolver resolver) {
    this.session = requireNonNull(session);
    this.ids = requireNonNull(ids);
    this.resolver = requireNonNull(resolver);
  }

  /** Creates a path to an item in the standard library, such as
   * {@code std::iter::Iterator::next}, and resolves it. */
  public Core.Path stdPath(Pos pos, List<String> components,
      boolean isValue) {
    final List<String> names = new ArrayList<>();
    final String crateRoot = Prop.CRATE_ROOT.stringValue(session.map);
    if (!crateRoot.isEmpty()) {
      names.add(crateRoot);
    }
    names.addAll(components);
    final Def def = resolver.resolveStdPath(pos, names, isValue);
    return core.path(pos, def, transformEager(names, core::pathSegment));
  }

  /** Creates an expression. */
  public Core.Exp exp(Pos pos, Core.ExpKind kind, List<Attribute> attrs) {
    return core.exp(ids.fresh(), kind, pos, attrs);
  }

  public Core.Exp exp(Pos pos, Core.ExpKind kind) {
    return exp(pos, kind, ImmutableList.of());
  }

  /** Creates an expression that refers to a value in the standard
   * library. */
  public Core.Exp stdPathExp(Pos pos, List<String> components) {
    final Core.Path path = stdPath(pos, components, true);
    return exp(pos, core.pathExp(core.resolvedQPath(null, path)));
  }

  /** Creates an expression that refers to a local variable. */
  public Core.Exp identExp(Pos pos, String name, int binding,
      List<Attribute> attrs) {
    final Core.Path path =
        core.path(pos, Def.local(binding),
            ImmutableList.of(core.pathSegment(name)));
    return exp(pos, core.pathExp(core.resolvedQPath(null, path)), attrs);
  }

  public Core.Exp identExp(Pos pos, String name, int binding) {
    return identExp(pos, name, binding, ImmutableList.of());
  }

  /** Creates a call to a function in the standard library. The path
   * expression has position {@code pathPos}, the call has position
   * {@code pos}. */
  public Core.Exp stdCall(Pos pos, Pos pathPos, List<String> components,
      Core.Exp... args) {
    final Core.Exp fn = stdPathExp(pathPos, components);
    return exp(pos, core.call(fn, ImmutableList.copyOf(args)));
  }

  /** Creates {@code &mut e}. */
  public Core.Exp addrOfMut(Pos pos, Core.Exp exp) {
    return exp(pos, core.addrOf(Ast.Mutability.MUTABLE, exp));
  }

  /** Creates {@code ()}. */
  public Core.Exp unitExp(Pos pos) {
    return exp(pos, core.tup(ImmutableList.of()));
  }

  /** Wraps a block in an expression, at the position of the block. */
  public Core.Exp blockExp(Core.Block block, List<Attribute> attrs) {
    return exp(block.pos, core.blockExp(block), attrs);
  }

  public Core.Exp blockExp(Core.Block block) {
    return blockExp(block, ImmutableList.of());
  }

  /** Creates a match expression. */
  public Core.Exp matchExp(Pos pos, Core.Exp exp, List<Core.Arm> arms,
      Core.MatchSource source) {
    return exp(pos, core.match(exp, arms, source));
  }

  /** Creates a match arm that has one pattern and no guard. */
  public Core.Arm arm(Core.Pat pat, Core.Exp body) {
    return core.arm(ImmutableList.of(), ImmutableList.of(pat), null, body);
  }

  /** Creates a pattern. */
  public Core.Pat pat(Pos pos, Core.PatKind kind) {
    return core.pat(ids.fresh(), kind, pos);
  }

  /** Creates {@code _}. */
  public Core.Pat wildPat(Pos pos) {
    return pat(pos, core.wildPat());
  }

  /** Creates a pattern that binds a new variable. The variable is identified
   * by the id of the pattern. */
  public Core.Pat bindingPat(Pos pos, String name,
      Core.BindingAnnotation annotation) {
    final LoweredId id = ids.fresh();
    return core.pat(id,
        core.bindingPat(annotation, id.nodeId, name, pos, null), pos);
  }

  /** Creates a pattern that matches a variant of an enum in the standard
   * library, such as {@code Some(val)} or {@code None}. */
  public Core.Pat stdEnumPat(Pos pos, List<String> components,
      List<Core.Pat> subPats) {
    final Core.Path path = stdPath(pos, components, true);
    final Core.QPath qpath = core.resolvedQPath(null, path);
    final Core.PatKind kind = subPats.isEmpty()
        ? core.pathPat(qpath)
        : core.tupleStructPat(qpath, subPats, -1);
    return pat(pos, kind);
  }

  /** Creates a block whose check mode is the default. */
  public Core.Block block(Pos pos, List<Core.Stmt> stmts,
      Core.@Nullable Exp expr) {
    return core.block(ids.fresh(), stmts, expr, Ast.BlockCheckMode.DEFAULT,
        null, pos, false);
  }

  /** Creates a block whose only content is an expression. */
  public Core.Block block(Core.Exp expr) {
    return block(expr.pos, ImmutableList.of(), expr);
  }

  /** Creates an expression that is a compiler-generated block with a given
   * check mode, such as {@code push_unsafe}. */
  public Core.Exp signalBlockExp(Pos pos, List<Core.Stmt> stmts,
      Core.Exp expr, Ast.BlockCheckMode rules) {
    final Core.Block block =
        core.block(ids.fresh(), stmts, expr, rules,
            Ast.UnsafeSource.COMPILER_GENERATED, pos, false);
    return blockExp(block);
  }

  /** Creates a statement that declares a variable, given its pattern. */
  public Core.Stmt letStmt(Pos pos, Core.Pat pat, Core.@Nullable Exp init,
      Core.LocalSource source) {
    final Core.Local local =
        core.local(ids.fresh(), pat, null, init, pos, ImmutableList.of(),
            source);
    return core.localStmt(ids.fresh(), local);
  }

  /** Creates a statement that declares a variable, and returns the
   * statement and the node id of the binding. */
  public Pair<Core.Stmt, Integer> letStmt(Pos pos, boolean mutable,
      String name, Core.Exp init) {
    final Core.Pat pat =
        bindingPat(pos, name, mutable
            ? Core.BindingAnnotation.MUTABLE
            : Core.BindingAnnotation.UNANNOTATED);
    final Core.Stmt stmt =
        letStmt(pos, pat, init, Core.LocalSource.NORMAL);
    return Pair.of(stmt, pat.id.nodeId);
  }

  /** Creates a statement that evaluates an expression, without a trailing
   * semicolon. */
  public Core.Stmt exprStmt(Core.Exp exp, Pos pos) {
    return core.exprStmt(ids.fresh(), exp, pos);
  }

  /** Creates a statement that evaluates an expression and discards its
   * value. */
  public Core.Stmt semiStmt(Core.Exp exp, Pos pos) {
    return core.semiStmt(ids.fresh(), exp, pos);
  }
}

// End TreeBuilder.java
