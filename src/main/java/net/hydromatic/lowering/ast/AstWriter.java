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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this, 0, 0);
  }

  /** Appends a node to the output, with given precedence context. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a node, preceded by a prefix, if the node is not null. */
  public AstWriter appendIf(String prefix, @Nullable AstNode node) {
    if (node != null) {
      append(prefix).append(node);
    }
    return this;
  }

  /** Appends a list of nodes separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i));
    }
    return this;
  }

  /** Appends a list of nodes between delimiters, or nothing if the list is
   * empty. */
  public AstWriter appendAll(
      String start, List<? extends AstNode> nodes, String sep, String end) {
    if (!nodes.isEmpty()) {
      append(start).appendAll(nodes, sep).append(end);
    }
    return this;
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    return append(name);
  }

  /** Appends an identifier and its ordinal; ordinal 0 is not printed. */
  public AstWriter id(String name, int i) {
    append(name);
    if (i > 0) {
      append("_").append(Integer.toString(i));
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(
      int left, AstNode a0, Ast.BinOpKind op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
