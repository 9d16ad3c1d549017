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

import net.hydromatic.lowering.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error or warning that occurred during lowering.
 *
 * <p>Most instances are reported to {@link Session#report} and lowering
 * continues. A few kinds of malformed input are thrown, and abort the pass.
 */
public class CompileException extends RuntimeException {
  private final boolean warning;
  private final Pos pos;
  private final @Nullable String code;

  public CompileException(String message, boolean warning, Pos pos) {
    this(message, warning, pos, null);
  }

  public CompileException(String message, boolean warning, Pos pos,
      @Nullable String code) {
    super(message);
    this.warning = warning;
    this.pos = requireNonNull(pos);
    this.code = code;
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public boolean isWarning() {
    return warning;
  }

  /** Returns the diagnostic code, such as "E0562", or null. */
  public @Nullable String code() {
    return code;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf).append(warning ? " Warning: " : " Error: ");
    if (code != null) {
      buf.append('[').append(code).append("] ");
    }
    return buf.append(getMessage());
  }
}

// End CompileException.java
