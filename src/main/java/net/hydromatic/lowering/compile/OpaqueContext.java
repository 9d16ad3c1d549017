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

import net.hydromatic.lowering.ast.DefId;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context in which an {@code impl Trait} type occurs, which determines what
 * it lowers to. */
public final class OpaqueContext {
  /** In the return type of a function; lowers to an existential type. */
  public static final OpaqueContext EXISTENTIAL =
      new OpaqueContext(Kind.EXISTENTIAL, null);

  /** Anywhere else; an error. */
  public static final OpaqueContext DISALLOWED =
      new OpaqueContext(Kind.DISALLOWED, null);

  public final Kind kind;
  private final @Nullable DefId defId;

  private OpaqueContext(Kind kind, @Nullable DefId defId) {
    this.kind = kind;
    this.defId = defId;
  }

  /** In an argument type of a function; lowers to an anonymous type
   * parameter of the function. */
  public static OpaqueContext universal(DefId defId) {
    return new OpaqueContext(Kind.UNIVERSAL, requireNonNull(defId));
  }

  /** Returns the function whose argument this is. Only valid for
   * {@link Kind#UNIVERSAL}. */
  public DefId defId() {
    return requireNonNull(defId, "defId");
  }

  @Override public String toString() {
    return defId == null ? kind.toString() : kind + "(" + defId + ")";
  }

  /** Kind of context. */
  public enum Kind {
    UNIVERSAL,
    EXISTENTIAL,
    DISALLOWED
  }
}

// End OpaqueContext.java
