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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopeContext}. */
public class ScopeContextTest {
  @Test
  void testLoopScopes() {
    final ScopeContext scopes = new ScopeContext();
    assertThat(scopes.innermostLoop(), nullValue());
    final int depth =
        scopes.withLoopScope(10, () ->
            scopes.withLoopScope(20, () -> {
              assertThat(scopes.innermostLoop(), is(20));
              return scopes.loopDepth();
            }));
    assertThat(depth, is(2));
    assertThat(scopes.loopDepth(), is(0));
    assertThat(scopes.innermostLoop(), nullValue());
  }

  /** Tests that a loop body is not in its loop's condition, even if the
   * loop is inside another loop's condition. */
  @Test
  void testLoopCondition() {
    final ScopeContext scopes = new ScopeContext();
    scopes.withLoopScope(10, () ->
        scopes.withLoopCondition(() -> {
          assertThat(scopes.inLoopCondition(), is(true));
          scopes.withLoopScope(20, () -> {
            assertThat(scopes.inLoopCondition(), is(false));
            return null;
          });
          assertThat(scopes.inLoopCondition(), is(true));
          return null;
        }));
    assertThat(scopes.inLoopCondition(), is(false));
  }

  /** Tests that a closure body cannot see the loops and catch blocks that
   * enclose it. */
  @Test
  void testFreshFunctionScopes() {
    final ScopeContext scopes = new ScopeContext();
    scopes.withLoopScope(10, () ->
        scopes.withCatchScope(30, () -> {
          assertThat(scopes.innermostCatch(), is(30));
          scopes.withFreshFunctionScopes(() -> {
            assertThat(scopes.innermostLoop(), nullValue());
            assertThat(scopes.innermostCatch(), nullValue());
            assertThat(scopes.loopDepth(), is(0));
            return null;
          });
          assertThat(scopes.innermostLoop(), is(10));
          assertThat(scopes.catchDepth(), is(1));
          return null;
        }));
  }

  @Test
  void testGeneratorScope() {
    final ScopeContext scopes = new ScopeContext();
    scopes.withGeneratorScope(() -> {
      scopes.markGenerator();
      final boolean inner = scopes.withGeneratorScope(scopes::isGenerator);
      assertThat(inner, is(false));
      assertThat(scopes.isGenerator(), is(true));
      return null;
    });
    assertThat(scopes.isGenerator(), is(false));
  }

  @Test
  void testTraitImpl() {
    final ScopeContext scopes = new ScopeContext();
    scopes.withTraitImpl(true, () -> {
      assertThat(scopes.inTraitImpl(), is(true));
      scopes.withTraitImpl(false, () ->
          assertThat(scopes.inTraitImpl(), is(false)));
      assertThat(scopes.inTraitImpl(), is(true));
    });
    assertThat(scopes.inTraitImpl(), is(false));
  }

  /** Tests that state is restored if the action throws. */
  @Test
  void testRestoredAfterException() {
    final ScopeContext scopes = new ScopeContext();
    final Supplier<Object> fail = () -> {
      throw new IllegalArgumentException("fail");
    };
    assertThrows(IllegalArgumentException.class,
        () -> scopes.withLoopScope(10, () ->
            scopes.withCatchScope(20, () ->
                scopes.withLoopCondition(fail))));
    assertThat(scopes.loopDepth(), is(0));
    assertThat(scopes.catchDepth(), is(0));
    assertThat(scopes.inLoopCondition(), is(false));
  }
}

// End ScopeContextTest.java
