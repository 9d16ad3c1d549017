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

import net.hydromatic.lowering.ast.Def;

/** Resolution of a path: the definition that resolves a prefix of its
 * segments, and the number of remaining segments, which are associated items
 * that only type checking can find. */
public final class PathResolution {
  public final Def baseDef;
  public final int unresolvedSegments;

  private PathResolution(Def baseDef, int unresolvedSegments) {
    this.baseDef = requireNonNull(baseDef);
    this.unresolvedSegments = unresolvedSegments;
  }

  /** Creates a resolution of a whole path. */
  public static PathResolution of(Def def) {
    return new PathResolution(def, 0);
  }

  /** Creates a partial resolution. */
  public static PathResolution of(Def baseDef, int unresolvedSegments) {
    return new PathResolution(baseDef, unresolvedSegments);
  }

  /** Returns the definition, which must resolve the whole path. */
  public Def fullDef() {
    if (unresolvedSegments != 0) {
      throw new AssertionError("path is not fully resolved: " + this);
    }
    return baseDef;
  }

  @Override public String toString() {
    return unresolvedSegments == 0
        ? baseDef.toString()
        : baseDef + " (+" + unresolvedSegments + ")";
  }
}

// End PathResolution.java
