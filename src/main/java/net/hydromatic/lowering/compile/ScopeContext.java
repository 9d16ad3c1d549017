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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lexical state of the lowering walk: the loops and {@code catch} blocks that
 * {@code break}, {@code continue} and {@code ?} may target, and some flags.
 *
 * <p>Each {@code with} method sets up some state, runs an action, and
 * restores the previous state even if the action throws.
 */
public class ScopeContext {
  private List<Integer> loopScopes = new ArrayList<>();
  private List<Integer> catchScopes = new ArrayList<>();
  private boolean inLoopCondition;
  private boolean inTraitImpl;
  private boolean generator;

  /** Runs an action inside a loop. */
  public <T> T withLoopScope(int loopId, Supplier<T> action) {
    final int size = loopScopes.size();
    final boolean wasInLoopCondition = inLoopCondition;
    loopScopes.add(loopId);
    inLoopCondition = false;
    try {
      final T t = action.get();
      checkState(loopScopes.size() == size + 1,
          "unbalanced loop scopes in loop %s", loopId);
      return t;
    } finally {
      truncate(loopScopes, size);
      inLoopCondition = wasInLoopCondition;
    }
  }

  /** Runs an action inside a {@code catch} block. */
  public <T> T withCatchScope(int catchId, Supplier<T> action) {
    final int size = catchScopes.size();
    catchScopes.add(catchId);
    try {
      final T t = action.get();
      checkState(catchScopes.size() == size + 1,
          "unbalanced catch scopes in catch %s", catchId);
      return t;
    } finally {
      truncate(catchScopes, size);
    }
  }

  /** Runs an action that lowers the condition of a {@code while} loop. */
  public <T> T withLoopCondition(Supplier<T> action) {
    final boolean wasInLoopCondition = inLoopCondition;
    inLoopCondition = true;
    try {
      return action.get();
    } finally {
      inLoopCondition = wasInLoopCondition;
    }
  }

  /** Runs an action that lowers the body of a function or closure, which
   * cannot see the loops and catch blocks around it. */
  public <T> T withFreshFunctionScopes(Supplier<T> action) {
    final List<Integer> outerLoopScopes = loopScopes;
    final List<Integer> outerCatchScopes = catchScopes;
    final boolean wasInLoopCondition = inLoopCondition;
    loopScopes = new ArrayList<>();
    catchScopes = new ArrayList<>();
    inLoopCondition = false;
    try {
      return action.get();
    } finally {
      loopScopes = outerLoopScopes;
      catchScopes = outerCatchScopes;
      inLoopCondition = wasInLoopCondition;
    }
  }

  /** Runs an action that lowers a body; the body is a generator if the
   * action calls {@link #markGenerator()}. */
  public <T> T withGeneratorScope(Supplier<T> action) {
    final boolean wasGenerator = generator;
    generator = false;
    try {
      return action.get();
    } finally {
      generator = wasGenerator;
    }
  }

  /** Runs an action that lowers the items of an impl, or of an impl of a
   * trait if {@code inTraitImpl}. */
  public void withTraitImpl(boolean inTraitImpl, Runnable action) {
    final boolean wasInTraitImpl = this.inTraitImpl;
    this.inTraitImpl = inTraitImpl;
    try {
      action.run();
    } finally {
      this.inTraitImpl = wasInTraitImpl;
    }
  }

  private static void truncate(List<Integer> list, int size) {
    list.subList(size, list.size()).clear();
  }

  /** Records that the current body contains {@code yield}. */
  public void markGenerator() {
    generator = true;
  }

  public boolean isGenerator() {
    return generator;
  }

  public boolean inLoopCondition() {
    return inLoopCondition;
  }

  public boolean inTraitImpl() {
    return inTraitImpl;
  }

  /** Returns the id of the innermost loop, or null. */
  public @Nullable Integer innermostLoop() {
    return loopScopes.isEmpty() ? null : loopScopes.get(loopScopes.size() - 1);
  }

  /** Returns the id of the innermost {@code catch} block, or null. */
  public @Nullable Integer innermostCatch() {
    return catchScopes.isEmpty()
        ? null
        : catchScopes.get(catchScopes.size() - 1);
  }

  public int loopDepth() {
    return loopScopes.size();
  }

  public int catchDepth() {
    return catchScopes.size();
  }
}

// End ScopeContext.java
