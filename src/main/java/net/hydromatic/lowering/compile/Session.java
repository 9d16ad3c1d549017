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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session environment.
 *
 * <p>Holds the properties that configure lowering, hands out node ids for
 * synthesized fragments, and buffers the diagnostics that lowering reports.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Next node id to hand out. */
  private int nextNodeId;

  private final List<CompileException> errors = new ArrayList<>();
  private final List<CompileException> warnings = new ArrayList<>();

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values
   * @param nextNodeId First node id that the parser did not use
   */
  public Session(Map<Prop, Object> map, int nextNodeId) {
    checkArgument(nextNodeId >= 0, "invalid node id %s", nextNodeId);
    this.map = requireNonNull(map);
    this.nextNodeId = nextNodeId;
  }

  /** Returns a node id that is not used in the surface tree. */
  public int nextNodeId() {
    return nextNodeId++;
  }

  /** Buffers a diagnostic. */
  public void report(CompileException e) {
    if (e.isWarning()) {
      warnings.add(e);
    } else {
      errors.add(e);
    }
  }

  /** Returns the errors reported so far. */
  public ImmutableList<CompileException> errors() {
    return ImmutableList.copyOf(errors);
  }

  /** Returns the warnings reported so far. */
  public ImmutableList<CompileException> warnings() {
    return ImmutableList.copyOf(warnings);
  }
}

// End Session.java
