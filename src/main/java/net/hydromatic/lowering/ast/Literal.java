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

/** Literal value, shared by the surface and the core tree. */
public final class Literal {
  public final Kind kind;
  public final Object value;

  private Literal(Kind kind, Object value) {
    this.kind = requireNonNull(kind);
    this.value = requireNonNull(value);
  }

  public static Literal ofInt(long value) {
    return new Literal(Kind.INT, value);
  }

  public static Literal ofFloat(double value) {
    return new Literal(Kind.FLOAT, value);
  }

  public static Literal ofBool(boolean value) {
    return new Literal(Kind.BOOL, value);
  }

  public static Literal ofChar(char value) {
    return new Literal(Kind.CHAR, value);
  }

  public static Literal ofString(String value) {
    return new Literal(Kind.STR, value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Literal
            && kind == ((Literal) o).kind
            && value.equals(((Literal) o).value);
  }

  @Override
  public String toString() {
    switch (kind) {
      case STR:
        return "\"" + value + "\"";
      case CHAR:
        return "'" + value + "'";
      default:
        return value.toString();
    }
  }

  /** Kind of literal. */
  public enum Kind {
    STR,
    CHAR,
    INT,
    FLOAT,
    BOOL
  }
}

// End Literal.java
