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

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a path or identifier refers to, as determined by name resolution.
 *
 * <p>Most kinds of definition carry a {@link DefId}. Local variables and
 * loop labels carry the node id of their binding or loop instead.
 */
public final class Def {
  /** Resolution of a path that could not be resolved. */
  public static final Def ERR = new Def(Kind.ERR, null, -1);

  public final Kind kind;
  private final @Nullable DefId defId;
  private final int nodeId;

  private Def(Kind kind, @Nullable DefId defId, int nodeId) {
    this.kind = requireNonNull(kind);
    this.defId = defId;
    this.nodeId = nodeId;
  }

  /** Creates a definition that has a DefId. */
  public static Def of(Kind kind, DefId defId) {
    switch (kind) {
      case LOCAL:
      case LABEL:
      case ERR:
        throw new IllegalArgumentException("kind " + kind + " has no DefId");
      default:
        return new Def(kind, requireNonNull(defId), -1);
    }
  }

  /** Creates a definition that has no DefId, such as a primitive type or
   * the {@code Self} type. */
  public static Def of(Kind kind) {
    switch (kind) {
      case PRIM_TY:
      case SELF_TY:
        return new Def(kind, null, -1);
      case ERR:
        return ERR;
      default:
        throw new IllegalArgumentException("kind " + kind + " needs a DefId");
    }
  }

  /** Creates a reference to a local variable, given the node id of the
   * pattern that binds it. */
  public static Def local(int nodeId) {
    return new Def(Kind.LOCAL, null, nodeId);
  }

  /** Creates a reference to a loop label, given the node id of the loop. */
  public static Def label(int nodeId) {
    return new Def(Kind.LABEL, null, nodeId);
  }

  /** Returns the DefId; throws if this kind of definition does not have
   * one. */
  public DefId defId() {
    if (defId == null) {
      throw new IllegalStateException("no DefId for " + this);
    }
    return defId;
  }

  /** Returns the DefId, or null. */
  public @Nullable DefId optDefId() {
    return defId;
  }

  /** Returns the node id of a local variable or label. */
  public int nodeId() {
    if (kind != Kind.LOCAL && kind != Kind.LABEL) {
      throw new IllegalStateException("no node id for " + this);
    }
    return nodeId;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, defId, nodeId);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Def
            && kind == ((Def) o).kind
            && Objects.equals(defId, ((Def) o).defId)
            && nodeId == ((Def) o).nodeId;
  }

  @Override
  public String toString() {
    switch (kind) {
      case LOCAL:
      case LABEL:
        return kind + "(" + nodeId + ")";
      default:
        return defId == null ? kind.toString() : kind + "(" + defId + ")";
    }
  }

  /** Kind of definition. */
  public enum Kind {
    MOD,
    STRUCT,
    UNION,
    ENUM,
    VARIANT,
    TRAIT,
    TY_ALIAS,
    TY_FOREIGN,
    ASSOCIATED_TY,
    PRIM_TY,
    TY_PARAM,
    SELF_TY,
    FN,
    CONST,
    STATIC,
    STRUCT_CTOR,
    VARIANT_CTOR,
    METHOD,
    ASSOCIATED_CONST,
    LOCAL,
    LABEL,
    ERR
  }
}

// End Def.java
