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
package net.hydromatic.lowering.util;

import java.util.Objects;

/**
 * Pair of values.
 *
 * @param <L> Type of left value
 * @param <R> Type of right value
 */
public final class Pair<L, R> {
  public final L left;
  public final R right;

  private Pair(L left, R right) {
    this.left = left;
    this.right = right;
  }

  /** Creates a Pair. */
  public static <L, R> Pair<L, R> of(L left, R right) {
    return new Pair<>(left, right);
  }

  @Override public int hashCode() {
    return Objects.hash(left, right);
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof Pair
        && Objects.equals(left, ((Pair<?, ?>) o).left)
        && Objects.equals(right, ((Pair<?, ?>) o).right);
  }

  @Override public String toString() {
    return "<" + left + ", " + right + ">";
  }
}

// End Pair.java
