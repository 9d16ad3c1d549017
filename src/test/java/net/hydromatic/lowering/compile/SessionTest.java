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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lowering.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link Session}, {@link Prop} and {@link CompileException}. */
public class SessionTest {
  private static final Pos POS = new Pos("a.rs", 1, 1, 1, 2);

  @Test
  void testNextNodeId() {
    final Session session = new Session(new LinkedHashMap<>(), 100);
    assertThat(session.nextNodeId(), is(100));
    assertThat(session.nextNodeId(), is(101));
    assertThrows(IllegalArgumentException.class,
        () -> new Session(new LinkedHashMap<>(), -1));
  }

  /** Tests that errors and warnings are buffered separately, and that the
   * lists handed out do not change as more are reported. */
  @Test
  void testReport() {
    final Session session = new Session(new LinkedHashMap<>(), 0);
    final List<CompileException> errors0 = session.errors();
    session.report(new CompileException("e1", false, POS));
    session.report(new CompileException("w1", true, POS));
    session.report(new CompileException("e2", false, POS, "E0214"));
    assertThat(errors0, empty());
    assertThat(session.errors(), hasSize(2));
    assertThat(session.errors().get(1).getMessage(), is("e2"));
    assertThat(session.warnings(), hasSize(1));
    assertThat(session.warnings().get(0).isWarning(), is(true));
  }

  @Test
  void testDescribe() {
    final CompileException e =
        new CompileException("`impl Trait` not allowed", false, POS, "E0562");
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("a.rs:1.1 Error: [E0562] `impl Trait` not allowed"));
    final CompileException w = new CompileException("careful", true, POS);
    assertThat(w.describeTo(new StringBuilder()),
        hasToString("a.rs:1.1 Warning: careful"));
    assertThat(w.pos(), is(POS));
  }

  @Test
  void testPropLookup() {
    assertThat(Prop.lookup("inBandRegions"), is(Prop.IN_BAND_REGIONS));
    assertThat(Prop.lookup("IN_BAND_REGIONS"), is(Prop.IN_BAND_REGIONS));
    assertThrows(RuntimeException.class, () -> Prop.lookup("noSuchProp"));
    assertThat(Prop.BY_CAMEL_NAME,
        is(
            ImmutableList.of(Prop.CONSERVATIVE_OPAQUE_TYPES, Prop.CRATE_ROOT,
                Prop.IN_BAND_REGIONS, Prop.UNIVERSAL_OPAQUE_TYPES)));
  }

  @Test
  void testPropValues() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.IN_BAND_REGIONS.booleanValue(map), is(false));
    assertThat(Prop.CONSERVATIVE_OPAQUE_TYPES.booleanValue(map), is(true));
    assertThat(Prop.CRATE_ROOT.stringValue(map), is("std"));

    Prop.IN_BAND_REGIONS.setLenient(map, "TRUE");
    assertThat(Prop.IN_BAND_REGIONS.booleanValue(map), is(true));
    Prop.CRATE_ROOT.set(map, "core");
    assertThat(Prop.CRATE_ROOT.stringValue(map), is("core"));
    assertThat(Prop.CRATE_ROOT.remove(map), is("core"));
    assertThat(Prop.CRATE_ROOT.get(map), is("std"));

    assertThrows(RuntimeException.class,
        () -> Prop.IN_BAND_REGIONS.setLenient(map, "maybe"));
    assertThrows(RuntimeException.class,
        () -> Prop.IN_BAND_REGIONS.set(map, "true"));
    assertThrows(RuntimeException.class,
        () -> Prop.CRATE_ROOT.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.CRATE_ROOT.booleanValue(map));
  }
}

// End SessionTest.java
