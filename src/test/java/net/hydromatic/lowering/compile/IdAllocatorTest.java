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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import net.hydromatic.lowering.MapResolver;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.CoreId;
import org.junit.jupiter.api.Test;

/** Tests for {@link IdAllocator}. */
public class IdAllocatorTest {
  /** Tests that lowering a node twice gives the same id, allocated from the
   * crate's counter if no other owner is active. */
  @Test
  void testLowerIsIdempotent() {
    final Fixture f = new Fixture();
    assertThat(f.ids.lower(Ast.CRATE_NODE_ID).coreId, is(CoreId.CRATE));
    assertThat(f.ids.lower(5).coreId, is(CoreId.of(0, 1)));
    assertThat(f.ids.lower(7).coreId, is(CoreId.of(0, 2)));
    assertThat(f.ids.lower(5).coreId, is(CoreId.of(0, 1)));
    assertThat(f.ids.lower(5).nodeId, is(5));
  }

  @Test
  void testDummy() {
    final Fixture f = new Fixture();
    assertThat(f.ids.lower(Ast.DUMMY_NODE_ID).coreId, is(CoreId.DUMMY));
    assertThat(f.ids.lower(3).coreId, is(CoreId.of(0, 0)));
  }

  /** Tests that an owner's own id is local id 0, and that nodes lowered
   * while the owner is active are numbered from 1. */
  @Test
  void testOwner() {
    final Fixture f = new Fixture();
    final int index = f.resolver.def(10);
    f.ids.beginOwner(10);
    assertThat(f.ids.lower(10).coreId, is(CoreId.of(index, 0)));
    assertThat(f.ids.counter(10), is(1));
    f.ids.withOwner(10, () -> {
      assertThat(f.ids.depth(), is(2));
      assertThat(f.ids.lower(11).coreId, is(CoreId.of(index, 1)));
      assertThat(f.ids.lower(12).coreId, is(CoreId.of(index, 2)));
      assertThat(f.ids.counter(10), is(3));
    });
    assertThat(f.ids.depth(), is(1));
    assertThat(f.ids.counter(10), is(3));

    // Re-entering the owner continues from where it left off
    final CoreId coreId = f.ids.withOwner(10, () -> f.ids.lower(13).coreId);
    assertThat(coreId, is(CoreId.of(index, 3)));
  }

  /** Tests an owner inside another owner, such as a function inside a
   * function body; the inner owner's ids do not use the outer counter. */
  @Test
  void testNestedOwners() {
    final Fixture f = new Fixture();
    final int outer = f.resolver.def(10);
    final int inner = f.resolver.def(20);
    f.ids.beginOwner(10);
    f.ids.beginOwner(20);
    f.ids.withOwner(10, () -> {
      f.ids.lower(11);
      f.ids.withOwner(20, () -> {
        assertThat(f.ids.depth(), is(3));
        assertThat(f.ids.lower(21).coreId, is(CoreId.of(inner, 1)));
      });
      assertThat(f.ids.lower(12).coreId, is(CoreId.of(outer, 2)));
    });
    assertThat(f.ids.counter(20), is(2));
  }

  /** Tests allocating into an owner other than the current one, as a
   * restricted visibility of an impl item does. */
  @Test
  void testLowerWithOwner() {
    final Fixture f = new Fixture();
    final int index = f.resolver.def(10);
    f.resolver.def(20);
    f.ids.beginOwner(10);
    f.ids.beginOwner(20);
    f.ids.withOwner(20, () -> {
      assertThat(f.ids.lowerWithOwner(15, 10).coreId, is(CoreId.of(index, 1)));
    });
    assertThat(f.ids.counter(10), is(2));

    // The owner that is active cannot be allocated into from outside
    f.ids.withOwner(10, () ->
        assertThrows(IllegalStateException.class,
            () -> f.ids.lowerWithOwner(16, 10)));
  }

  @Test
  void testUnregisteredOwner() {
    final Fixture f = new Fixture();
    f.resolver.def(10);
    assertThrows(IllegalStateException.class,
        () -> f.ids.withOwner(10, () -> { }));
    assertThrows(AssertionError.class, () -> f.ids.lowerWithOwner(5, 10));
    f.ids.beginOwner(10);
    assertThrows(AssertionError.class, () -> f.ids.beginOwner(10));
  }

  /** Tests that an owner must have a definition. */
  @Test
  void testOwnerWithoutDefinition() {
    final Fixture f = new Fixture();
    assertThrows(IllegalStateException.class, () -> f.ids.beginOwner(10));
  }

  /** Tests that an owner's counter survives an exception thrown while the
   * owner is active. */
  @Test
  void testOwnerRestoredAfterException() {
    final Fixture f = new Fixture();
    f.resolver.def(10);
    f.ids.beginOwner(10);
    final Runnable action = () -> {
      f.ids.lower(11);
      throw new IllegalArgumentException();
    };
    assertThrows(IllegalArgumentException.class,
        () -> f.ids.withOwner(10, action));
    assertThat(f.ids.depth(), is(1));
    assertThat(f.ids.counter(10), is(2));
    f.ids.withOwner(10, () -> {
      f.ids.lower(12);
    });
    assertThat(f.ids.counter(10), is(3));
  }

  /** Tests that fresh ids come from the session, after the ids that the
   * parser used. */
  @Test
  void testFresh() {
    final Fixture f = new Fixture();
    assertThat(f.ids.fresh().nodeId, is(100));
    assertThat(f.ids.fresh().nodeId, is(101));
    assertThat(f.ids.fresh().coreId, is(CoreId.of(0, 2)));
  }

  /** Tests that the mapping has an entry for every node id up to the
   * highest lowered, with {@link CoreId#DUMMY} for the gaps. */
  @Test
  void testFinish() {
    final Fixture f = new Fixture();
    f.ids.lower(0);
    f.ids.lower(3);
    final List<CoreId> list = f.ids.finish();
    assertThat(list, hasSize(4));
    assertThat(list.get(0), is(CoreId.CRATE));
    assertThat(list.get(1), is(CoreId.DUMMY));
    assertThat(list.get(2), is(CoreId.DUMMY));
    assertThat(list.get(3), is(CoreId.of(0, 1)));
  }

  /** Test fixture with common setup. */
  private static class Fixture {
    final MapResolver resolver = new MapResolver();
    final Session session = new Session(new LinkedHashMap<>(), 100);
    final IdAllocator ids = new IdAllocator(session, resolver);
  }
}

// End IdAllocatorTest.java
