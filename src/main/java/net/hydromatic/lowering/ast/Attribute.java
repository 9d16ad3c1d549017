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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Attribute, such as {@code #[may_dangle]} or
 * {@code #[allow(unreachable_code)]}.
 *
 * <p>Attributes occur in both trees; lowering copies them unchanged.
 */
public class Attribute extends AstNode {
  public final String name;
  public final ImmutableList<String> args;

  Attribute(Pos pos, String name, ImmutableList<String> args) {
    super(pos, Op.ATTRIBUTE);
    this.name = name;
    this.args = args;
  }

  /** Creates an attribute. */
  public static Attribute of(Pos pos, String name, List<String> args) {
    return new Attribute(pos, name, ImmutableList.copyOf(args));
  }

  /** Returns whether any attribute in a list has a given name. */
  public static boolean contains(List<Attribute> attrs, String name) {
    for (Attribute attr : attrs) {
      if (attr.name.equals(name)) {
        return true;
      }
    }
    return false;
  }

  @Override
  AstWriter unparse(AstWriter w, int left, int right) {
    w.append("#[").append(name);
    if (!args.isEmpty()) {
      w.append("(").append(String.join(", ", args)).append(")");
    }
    return w.append("]");
  }

  @Override
  public void accept(Visitor visitor) {
    visitor.visit(this);
  }
}

// End Attribute.java
