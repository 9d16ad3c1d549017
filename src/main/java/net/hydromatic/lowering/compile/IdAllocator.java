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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.CoreId;
import net.hydromatic.lowering.ast.DefId;
import net.hydromatic.lowering.ast.LoweredId;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Allocates core ids.
 *
 * <p>Each surface node id maps to at most one {@link CoreId}, allocated the
 * first time that the node is lowered, from the counter of the innermost
 * owner (an item, trait item or impl item) that is being lowered. Owners
 * must be registered, via {@link #beginOwner(int)}, before they are
 * lowered.
 */
public class IdAllocator extends LoweredId.Issuer {
  private final Session session;
  private final Definitions definitions;

  /** Counter of each registered owner. An owner that is not in the map is
   * unregistered. */
  private final Map<Integer, OwnerState> owners = new HashMap<>();

  /** Owners being lowered, innermost first. The crate is at the bottom, and
   * is never in {@link #owners}. */
  private final Deque<Frame> frames = new ArrayDeque<>();

  /** Core id of each surface node id, null if not yet lowered. */
  private final List<@Nullable CoreId> coreIds = new ArrayList<>();

  public IdAllocator(Session session, Definitions definitions) {
    this.session = requireNonNull(session);
    this.definitions = requireNonNull(definitions);
    frames.push(new Frame(Ast.CRATE_NODE_ID, DefId.CRATE_DEF_INDEX, 0));
  }

  /** Returns the id of a surface node, allocating it in the current owner
   * if this is the first request. */
  public LoweredId lower(int nodeId) {
    return lower(nodeId, index -> {
      final Frame frame = requireNonNull(frames.peek());
      return CoreId.of(frame.defIndex, frame.counter++);
    });
  }

  /** Returns the id of a surface node, allocating it in a given owner if
   * this is the first request. The owner must be registered, and must not be
   * in use. */
  public LoweredId lowerWithOwner(int nodeId, int owner) {
    return lower(nodeId, index -> {
      final OwnerState state = owners.get(owner);
      if (state == null) {
        throw new AssertionError("owner " + owner + " is not registered");
      }
      checkState(!state.inUse, "owner %s is in use", owner);
      owners.put(owner, OwnerState.active(state.counter + 1));
      return CoreId.of(defIndex(owner), state.counter);
    });
  }

  private LoweredId lower(int nodeId, IntFunction<CoreId> allocator) {
    if (nodeId == Ast.DUMMY_NODE_ID) {
      return issue(nodeId, CoreId.DUMMY);
    }
    while (coreIds.size() <= nodeId) {
      coreIds.add(null);
    }
    CoreId coreId = coreIds.get(nodeId);
    if (coreId == null) {
      coreId = allocator.apply(nodeId);
      coreIds.set(nodeId, coreId);
    }
    return issue(nodeId, coreId);
  }

  /** Returns the id of a node that lowering has created, and that did not
   * occur in the surface tree. */
  public LoweredId fresh() {
    return lower(session.nextNodeId());
  }

  /** Registers an owner. Its own id becomes local id 0. */
  public void beginOwner(int owner) {
    if (owners.put(owner, OwnerState.active(0)) != null) {
      throw new AssertionError("owner " + owner + " registered twice");
    }
    lowerWithOwner(owner, owner);
  }

  /** Runs an action while an owner is the current owner. */
  public void withOwner(int owner, Runnable action) {
    withOwner(owner, () -> {
      action.run();
      return null;
    });
  }

  /** Runs an action while an owner is the current owner, and returns its
   * result.
   *
   * <p>The owner's counter is marked in use for the duration, so that
   * allocating from it via {@link #lowerWithOwner} fails, and is written back
   * afterwards. */
  public <T> T withOwner(int owner, Supplier<T> action) {
    final OwnerState state = owners.get(owner);
    checkState(state != null, "owner %s is not registered", owner);
    checkState(!state.inUse, "owner %s is already in use", owner);
    final Frame frame = new Frame(owner, defIndex(owner), state.counter);
    owners.put(owner, OwnerState.IN_USE);
    frames.push(frame);
    try {
      return action.get();
    } finally {
      final Frame popped = frames.pop();
      final OwnerState previous =
          owners.put(owner, OwnerState.active(popped.counter));
      checkState(popped == frame, "owner %s was popped by %s", owner,
          popped.owner);
      checkState(popped.counter >= state.counter,
          "counter of owner %s went backwards", owner);
      checkState(previous == OwnerState.IN_USE,
          "owner %s was not in use", owner);
    }
  }

  private int defIndex(int owner) {
    final Integer defIndex = definitions.optDefIndex(owner);
    checkState(defIndex != null, "owner %s has no definition", owner);
    return defIndex;
  }

  /** Returns the number of owners being lowered, including the crate. */
  public int depth() {
    return frames.size();
  }

  /** Returns the next local id that a registered owner will allocate. */
  @VisibleForTesting
  public int counter(int owner) {
    final OwnerState state = owners.get(owner);
    checkState(state != null, "owner %s is not registered", owner);
    if (state.inUse) {
      for (Frame frame : frames) {
        if (frame.owner == owner) {
          return frame.counter;
        }
      }
    }
    return state.counter;
  }

  /** Returns the core id of every surface node id, {@link CoreId#DUMMY} for
   * those that were never lowered. */
  public ImmutableList<CoreId> finish() {
    final ImmutableList.Builder<CoreId> b = ImmutableList.builder();
    for (CoreId coreId : coreIds) {
      b.add(coreId == null ? CoreId.DUMMY : coreId);
    }
    return b.build();
  }

  /** Counter of a registered owner: either active, with the next local id,
   * or in use by a {@link #withOwner} call. */
  private static final class OwnerState {
    static final OwnerState IN_USE = new OwnerState(-1, true);

    final int counter;
    final boolean inUse;

    private OwnerState(int counter, boolean inUse) {
      this.counter = counter;
      this.inUse = inUse;
    }

    static OwnerState active(int counter) {
      return new OwnerState(counter, false);
    }
  }

  /** Owner that is being lowered. */
  private static final class Frame {
    final int owner;
    final int defIndex;
    int counter;

    Frame(int owner, int defIndex, int counter) {
      this.owner = owner;
      this.defIndex = defIndex;
      this.counter = counter;
    }
  }
}

// End IdAllocator.java
