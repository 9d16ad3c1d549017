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
import static net.hydromatic.lowering.util.Static.transformEager;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.lowering.MapResolver;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.Def;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles} and {@link Tracers}. */
public class CompilesTest {
  private static final Pos POS = Pos.ZERO;

  private static final Def TRAIT = Def.of(Def.Kind.TRAIT, DefId.of(2, 4));

  /** Creates a function whose body is a statement. */
  private static Ast.FnItem fn(int id, Ast.Stmt stmt) {
    return ast.fnItem(POS, id, "f" + id, ast.inherited(),
        ast.fnDecl(ImmutableList.of(), null, POS), Ast.Generics.EMPTY,
        ast.block(POS, id + 1, ImmutableList.of(stmt)));
  }

  /** Creates {@code let x: impl Tr;}, which lowers with an error. */
  private static Ast.Stmt letImplTrait(int id) {
    final Ast.TraitBound bound =
        ast.traitBound(
            ast.polyTraitRef(POS, ImmutableList.of(),
                ast.traitRef(ast.path(POS, "Tr"), id + 4)),
            Ast.TraitBoundModifier.NONE);
    return ast.localStmt(POS, id,
        ast.local(POS, id + 1, ast.identPat(POS, id + 2, "x"),
            ast.implTraitTy(POS, id + 3, ImmutableList.of(bound)), null));
  }

  @Test
  void testTracer() {
    final Fixture f = new Fixture();
    f.resolver.defs(1, 10);
    f.resolver.resolve(24, TRAIT).resolve(34, TRAIT);
    final Ast.Crate crate =
        ast.crate(POS,
            ImmutableList.of(fn(1, letImplTrait(20)), fn(10, letImplTrait(30))),
            ImmutableList.of());
    final List<Core.Item> items = new ArrayList<>();
    final List<Core.CompUnit> compUnits = new ArrayList<>();
    final List<CompileException> errors = new ArrayList<>();
    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnItem(
            Tracers.withOnCore(
                Tracers.withOnDiagnostics(
                    Tracers.withOnCompileException(Tracers.empty(),
                        exceptions::add),
                    (e, w) -> errors.addAll(e)),
                compUnits::add),
            items::add);
    final Core.CompUnit compUnit =
        Compiles.lowerCrate(f.session, f.resolver, crate, tracer);
    assertThat(compUnit, notNullValue());
    assertThat(transformEager(items, item -> item.name),
        is(ImmutableList.of("f1", "f10")));
    assertThat(compUnits, hasSize(1));
    assertThat(compUnits.get(0), sameInstance(compUnit));
    assertThat(errors, hasSize(2));
    assertThat(errors.get(0).code(), is("E0562"));

    // The tracer is told that no exception occurred
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0), nullValue());
  }

  /** Tests that an exception that aborts lowering goes to the tracer, and is
   * rethrown if the tracer does not handle it. */
  @Test
  void testAbort() {
    final Ast.Range range =
        ast.range(POS, 11, ast.id(POS, 12, "a"), null,
            Ast.RangeLimits.CLOSED);
    final Ast.Crate crate =
        ast.crate(POS, ImmutableList.of(fn(1, ast.exprStmt(POS, 10, range))),
            ImmutableList.of());

    final Fixture f = new Fixture();
    f.resolver.def(1);
    f.resolver.resolve(12, Def.local(90));
    final List<CompileException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), exceptions::add);
    final Core.CompUnit compUnit =
        Compiles.lowerCrate(f.session, f.resolver, crate, tracer);
    assertThat(compUnit, nullValue());
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0).getMessage(),
        is("inclusive range with no end"));

    final Fixture f2 = new Fixture();
    f2.resolver.def(1);
    f2.resolver.resolve(12, Def.local(90));
    final CompileException e =
        assertThrows(CompileException.class, () ->
            Compiles.lowerCrate(f2.session, f2.resolver, crate,
                Tracers.empty()));
    assertThat(e.isWarning(), is(false));
  }

  /** Tests that errors reported before the abort still reach the
   * tracer. */
  @Test
  void testDiagnosticsBeforeAbort() {
    final Ast.Range range =
        ast.range(POS, 41, null, null, Ast.RangeLimits.CLOSED);
    final Ast.Crate crate =
        ast.crate(POS,
            ImmutableList.of(fn(1, letImplTrait(20)),
                fn(10, ast.exprStmt(POS, 40, range))),
            ImmutableList.of());
    final Fixture f = new Fixture();
    f.resolver.defs(1, 10);
    f.resolver.resolve(24, TRAIT);
    final List<CompileException> errors = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnDiagnostics(
            Tracers.withOnCompileException(Tracers.empty(), e -> { }),
            (e, w) -> errors.addAll(e));
    assertThat(Compiles.lowerCrate(f.session, f.resolver, crate, tracer),
        nullValue());
    assertThat(errors, hasSize(1));
    assertThat(errors.get(0).code(), is("E0562"));
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final MapResolver resolver = new MapResolver();
    final Session session = new Session(new LinkedHashMap<>(), 1000);
  }
}

// End CompilesTest.java
