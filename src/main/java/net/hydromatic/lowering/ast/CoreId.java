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

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a node in the core tree.
 *
 * <p>An identity is a pair: the definition index of the owner, the innermost
 * enclosing item that has its own namespace of local ids; and a local id,
 * unique within that owner. The owner itself always has local id 0.
 */
public final class CoreId implements Comparable<CoreId> {
  /** Identity of nodes that have no identity of their own. */
  public static final CoreId DUMMY = new CoreId(DefId.CRATE_DEF_INDEX, -1);

  /** Identity of the crate root. */
  public static final CoreId CRATE = new CoreId(DefId.CRATE_DEF_INDEX, 0);

  private static final Comparator<CoreId> COMPARATOR =
      Comparator.<CoreId>comparingInt(id -> id.owner)
          .thenComparingInt(id -> id.localId);

  /** Definition index of the owner. */
  public final int owner;
  /** Index within the owner. */
  public final int localId;

  private CoreId(int owner, int localId) {
    this.owner = owner;
    this.localId = localId;
  }

  /** Creates a CoreId. */
  public static CoreId of(int owner, int localId) {
    return new CoreId(owner, localId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, localId);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof CoreId
            && owner == ((CoreId) o).owner
            && localId == ((CoreId) o).localId;
  }

  @Override
  public int compareTo(CoreId o) {
    return COMPARATOR.compare(this, o);
  }

  @Override
  public String toString() {
    return this.equals(DUMMY) ? "DUMMY" : owner + ":" + localId;
  }
}

// End CoreId.java
