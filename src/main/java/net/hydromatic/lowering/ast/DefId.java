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

import java.util.Objects;

/**
 * Identifies a definition: a crate number and the index of the definition
 * within that crate.
 */
public final class DefId {
  /** Number of the crate being compiled. */
  public static final int LOCAL_CRATE = 0;

  /** Index of the definition of the crate root. */
  public static final int CRATE_DEF_INDEX = 0;

  public final int krate;
  public final int index;

  private DefId(int krate, int index) {
    this.krate = krate;
    this.index = index;
  }

  /** Creates a DefId. */
  public static DefId of(int krate, int index) {
    return new DefId(krate, index);
  }

  /** Creates a DefId in the local crate. */
  public static DefId local(int index) {
    return new DefId(LOCAL_CRATE, index);
  }

  public boolean isLocal() {
    return krate == LOCAL_CRATE;
  }

  @Override
  public int hashCode() {
    return Objects.hash(krate, index);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DefId
            && krate == ((DefId) o).krate
            && index == ((DefId) o).index;
  }

  @Override
  public String toString() {
    return "DefId(" + krate + ":" + index + ")";
  }
}

// End DefId.java
