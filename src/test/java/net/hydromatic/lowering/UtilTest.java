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
package net.hydromatic.lowering;

import static net.hydromatic.lowering.util.Static.concat;
import static net.hydromatic.lowering.util.Static.last;
import static net.hydromatic.lowering.util.Static.transformEager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.hydromatic.lowering.ast.DesugaringKind;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.util.Pair;
import org.junit.jupiter.api.Test;

/** Tests for various utility classes. */
public class UtilTest {
  /** Tests {@link net.hydromatic.lowering.util.Static#last(List)}. */
  @Test
  void testLast() {
    final List<Integer> list = Arrays.asList(1, 7, 3);
    final List<Integer> emptyList = Collections.emptyList();
    assertThat(last(list), is(3));
    assertThrows(IndexOutOfBoundsException.class, () -> last(emptyList));
  }

  @Test
  void testConcat() {
    final List<String> ab = Arrays.asList("a", "b");
    assertThat(concat(ab, Arrays.asList("c", "d")),
        is(ImmutableList.of("a", "b", "c", "d")));
    assertThat(concat(ab, ImmutableList.of()), is(ab));
    assertThat(concat(ImmutableList.of(), ab), is(ab));
  }

  @Test
  void testTransform() {
    final List<Integer> list = Arrays.asList(1, 7, 3, 8);
    assertThat(transformEager(list, i -> i * 2),
        is(ImmutableList.of(2, 14, 6, 16)));
    assertThat(transformEager(Collections.<Integer>emptyList(), i -> i * 2),
        empty());
    assertThat(transformEager(Collections.singletonList("x"), s -> s + s),
        is(ImmutableList.of("xx")));
  }

  @Test
  void testPair() {
    final Pair<String, Integer> pair = Pair.of("a", 1);
    assertThat(pair.left, is("a"));
    assertThat(pair.right, is(1));
    assertThat(pair, is(Pair.of("a", 1)));
    assertThat(pair, not(Pair.of("a", 2)));
    assertThat(pair.hashCode(), is(Pair.of("a", 1).hashCode()));
    assertThat(pair, hasToString("<a, 1>"));
    assertThat(Pair.of(null, "b").left, nullValue());
  }

  @Test
  void testPosToString() {
    assertThat(new Pos("a.rs", 1, 1, 1, 5), hasToString("a.rs:1.1-1.5"));
    assertThat(new Pos("", 2, 3, 2, 4), hasToString("2.3"));
    assertThat(new Pos("", 2, 3, 4, 1), hasToString("2.3-4.1"));
  }

  /** Tests {@link Pos#sum(Iterable)} and {@link Pos#plus(Pos)}. */
  @Test
  void testPosSum() {
    final Pos p0 = new Pos("f", 1, 5, 1, 8);
    final Pos p1 = new Pos("f", 1, 2, 1, 4);
    assertThat(Pos.sum(Arrays.asList(p0, p1)), hasToString("f:1.2-1.8"));
    assertThat(Pos.sum(Collections.singletonList(p0)), sameInstance(p0));

    // ZERO does not contribute to a sum
    assertThat(Pos.sum(Arrays.asList(p1, Pos.ZERO)), is(p1));

    final Pos p2 = new Pos("f", 2, 1, 2, 3);
    assertThat(p1.plus(p2), hasToString("f:1.2-2.3"));
    assertThat(p2.plus(p1), hasToString("f:1.2-2.3"));
  }

  @Test
  void testPosContains() {
    final Pos outer = new Pos("", 1, 1, 3, 1);
    assertThat(outer.contains(new Pos("", 2, 5, 2, 9)), is(true));
    assertThat(outer.contains(outer), is(true));
    assertThat(outer.contains(new Pos("", 3, 1, 3, 2)), is(false));
    assertThat(new Pos("", 2, 5, 2, 9).contains(outer), is(false));
  }

  @Test
  void testPosDesugared() {
    final Pos p = new Pos("", 1, 2, 1, 4);
    final Pos d = p.desugared(DesugaringKind.DOT_FILL);
    assertThat(p.desugaring, nullValue());
    assertThat(d.desugaring, is(DesugaringKind.DOT_FILL));

    // Equality ignores desugaring
    assertThat(d, is(p));
    assertThat(d.desugared(DesugaringKind.DOT_FILL), sameInstance(d));

    final Pos start = d.shrinkToStart();
    assertThat(start, hasToString("1.2-1.2"));
    assertThat(start.desugaring, is(DesugaringKind.DOT_FILL));
  }
}

// End UtilTest.java
