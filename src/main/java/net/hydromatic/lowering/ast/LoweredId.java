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

import com.google.common.annotations.VisibleForTesting;
import java.util.Objects;

/**
 * Identity of a lowered node: the id the node had in the surface tree (or
 * was given when it was synthesized) and its {@link CoreId}.
 *
 * <p>Values of this class are created only by the identity allocator. A
 * synthesized fragment receives its own token and cannot request the same
 * surface id twice.
 */
public final class LoweredId {
  public final int nodeId;
  public final CoreId coreId;

  private LoweredId(int nodeId, CoreId coreId) {
    this.nodeId = nodeId;
    this.coreId = requireNonNull(coreId);
  }

  /** Creates a LoweredId. */
  @VisibleForTesting
  static LoweredId of(int nodeId, CoreId coreId) {
    return new LoweredId(nodeId, coreId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodeId, coreId);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof LoweredId
            && nodeId == ((LoweredId) o).nodeId
            && coreId.equals(((LoweredId) o).coreId);
  }

  @Override
  public String toString() {
    return "#" + nodeId;
  }

  /** Base class of the identity allocator, the only code outside this
   * package that may create a LoweredId. */
  public abstract static class Issuer {
    protected static LoweredId issue(int nodeId, CoreId coreId) {
      return new LoweredId(nodeId, coreId);
    }
  }
}

// End LoweredId.java
