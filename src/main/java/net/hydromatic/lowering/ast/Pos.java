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

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import java.util.AbstractList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Position of a parse-tree node. */
public class Pos implements Comparable<Pos> {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  private static final Comparator<Pos> COMPARATOR =
      Comparator.<Pos, String>comparing(p -> p.file)
          .thenComparingInt(p -> p.startLine)
          .thenComparingInt(p -> p.startColumn)
          .thenComparingInt(p -> p.endLine)
          .thenComparingInt(p -> p.endColumn);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /**
   * If not null, the syntactic sugar that this position was synthesized
   * from. Later stages use it to attribute diagnostics to the sugar rather
   * than to code the user never wrote.
   */
  public final @Nullable DesugaringKind desugaring;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this(file, startLine, startColumn, endLine, endColumn, null);
  }

  private Pos(
      String file,
      int startLine,
      int startColumn,
      int endLine,
      int endColumn,
      @Nullable DesugaringKind desugaring) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.desugaring = desugaring;
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  @Override
  public int compareTo(Pos o) {
    return COMPARATOR.compare(this, o);
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  /** Returns a copy of this position marked as synthesized by a given kind
   * of desugaring. */
  public Pos desugared(DesugaringKind desugaring) {
    return desugaring == this.desugaring
        ? this
        : new Pos(file, startLine, startColumn, endLine, endColumn,
            desugaring);
  }

  /** Returns an empty position at the start of this position. */
  public Pos shrinkToStart() {
    return new Pos(file, startLine, startColumn, startLine, startColumn,
        desugaring);
  }

  /** Returns whether this position encloses another. */
  public boolean contains(Pos pos) {
    return (startLine < pos.startLine
            || startLine == pos.startLine && startColumn <= pos.startColumn)
        && (endLine > pos.endLine
            || endLine == pos.endLine && endColumn >= pos.endColumn);
  }

  /**
   * Combines an iterable of parser positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  public static Pos sum(Iterable<Pos> poses) {
    final List<Pos> list =
        poses instanceof List ? (List<Pos>) poses : Lists.newArrayList(poses);
    return sum_(list);
  }

  public static <E> Pos sum(Iterable<E> elements, Function<E, Pos> fn) {
    //noinspection StaticPseudoFunctionalStyleMethod
    return sum(Iterables.transform(elements, fn::apply));
  }

  /**
   * Combines a list of parser positions to create a position which spans
   * from the beginning of the first to the end of the last.
   */
  private static Pos sum_(final List<Pos> positions) {
    switch (positions.size()) {
      case 0:
        throw new AssertionError();
      case 1:
        return positions.get(0);
      default:
        final List<Pos> poses =
            new AbstractList<Pos>() {
              public Pos get(int index) {
                return positions.get(index + 1);
              }

              public int size() {
                return positions.size() - 1;
              }
            };
        final Pos p = positions.get(0);
        return sum(poses, p.startLine, p.startColumn, p.endLine, p.endColumn);
    }
  }

  /**
   * Computes the parser position which is the sum of an array of parser
   * positions and of a parser position represented by (line, column, endLine,
   * endColumn).
   */
  private static Pos sum(
      Iterable<Pos> poses, int line, int column, int endLine, int endColumn) {
    int testLine;
    int testColumn;
    String file = Pos.ZERO.file;
    for (Pos pos : poses) {
      if (pos == null || pos.equals(Pos.ZERO)) {
        continue;
      }
      file = pos.file;
      testLine = pos.startLine;
      testColumn = pos.startColumn;
      if (testLine < line || testLine == line && testColumn < column) {
        line = testLine;
        column = testColumn;
      }
      testLine = pos.endLine;
      testColumn = pos.endColumn;
      if (testLine > endLine || testLine == endLine && testColumn > endColumn) {
        endLine = testLine;
        endColumn = testColumn;
      }
    }
    return new Pos(file, line, column, endLine, endColumn);
  }

  /** Returns a position that spans this and another position. */
  public Pos plus(Pos pos) {
    int startLine = this.startLine;
    int startColumn = this.startColumn;
    if (pos.startLine < startLine
        || pos.startLine == startLine && pos.startColumn < startColumn) {
      startLine = pos.startLine;
      startColumn = pos.startColumn;
    }
    int endLine = pos.endLine;
    int endColumn = pos.endColumn;
    if (this.endLine > endLine
        || this.endLine == endLine && this.endColumn > endColumn) {
      endLine = this.endLine;
      endColumn = this.endColumn;
    }
    return new Pos(file, startLine, startColumn, endLine, endColumn);
  }
}

// End Pos.java
