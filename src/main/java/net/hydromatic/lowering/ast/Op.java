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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // crate structure
  CRATE,
  MODULE,
  ATTRIBUTE,
  VISIBILITY,
  BODY,

  // items
  ITEM, // occurs in Core, not in Ast
  EXTERN_CRATE,
  USE,
  USE_TREE,
  STATIC,
  CONST,
  FN,
  MOD,
  FOREIGN_MOD,
  TY_ALIAS,
  ENUM,
  STRUCT,
  UNION,
  AUTO_IMPL,
  IMPL,
  TRAIT,
  TRAIT_ALIAS,
  MACRO_DEF,
  MAC_ITEM(true),
  VARIANT,
  VARIANT_DATA,
  STRUCT_FIELD,

  // associated and foreign items
  TRAIT_ITEM,
  TRAIT_CONST,
  TRAIT_METHOD,
  TRAIT_TYPE,
  TRAIT_MAC(true),
  TRAIT_ITEM_REF, // occurs in Core, not in Ast
  IMPL_ITEM,
  IMPL_CONST,
  IMPL_METHOD,
  IMPL_TYPE,
  IMPL_MAC(true),
  IMPL_ITEM_REF, // occurs in Core, not in Ast
  FOREIGN_ITEM,
  FOREIGN_FN,
  FOREIGN_STATIC,
  FOREIGN_TYPE,

  // generics
  GENERICS,
  TY_PARAM,
  REGION,
  REGION_DEF,
  WHERE_CLAUSE,
  BOUND_PREDICATE,
  REGION_PREDICATE,
  EQ_PREDICATE,
  TRAIT_BOUND,
  REGION_BOUND,
  POLY_TRAIT_REF,
  TRAIT_REF,

  // paths
  PATH,
  PATH_SEGMENT,
  PATH_PARAMETERS,
  TYPE_BINDING,
  RESOLVED_QPATH, // occurs in Core, not in Ast
  TYPE_RELATIVE_QPATH, // occurs in Core, not in Ast

  // signatures
  FN_DECL,
  ARG,
  METHOD_SIG,

  // types
  TY, // occurs in Core, not in Ast
  INFER_TY,
  ERR_TY,
  SLICE_TY,
  PTR_TY,
  REF_TY,
  BARE_FN_TY,
  NEVER_TY,
  TUP_TY,
  PAREN_TY(true),
  PATH_TY,
  IMPLICIT_SELF_TY(true),
  ARRAY_TY,
  TYPEOF_TY,
  TRAIT_OBJECT_TY,
  IMPL_TRAIT_TY(true),
  UNIVERSAL_TY, // occurs in Core, not in Ast
  EXISTENTIAL_TY, // occurs in Core, not in Ast
  MAC_TY(true),

  // patterns
  PAT, // occurs in Core, not in Ast
  WILD_PAT,
  IDENT_PAT(true),
  BINDING_PAT, // occurs in Core, not in Ast
  STRUCT_PAT,
  FIELD_PAT,
  TUPLE_STRUCT_PAT,
  PATH_PAT,
  TUPLE_PAT,
  BOX_PAT,
  REF_PAT,
  LIT_PAT,
  RANGE_PAT,
  SLICE_PAT,
  MAC_PAT(true),

  // expressions
  EXP, // occurs in Core, not in Ast
  BOX,
  IN_PLACE(true),
  ARRAY,
  REPEAT,
  TUP,
  CALL,
  METHOD_CALL,
  BINARY,
  UNARY,
  LIT,
  CAST,
  TYPE_ASCRIPTION,
  IF,
  IF_LET(true),
  WHILE,
  WHILE_LET(true),
  FOR_LOOP(true),
  LOOP,
  MATCH,
  ARM,
  CLOSURE,
  BLOCK_EXP,
  CATCH(true),
  ASSIGN,
  ASSIGN_OP,
  FIELD_ACCESS,
  TUP_FIELD,
  INDEX,
  RANGE(true),
  PATH_EXP,
  ADDR_OF,
  BREAK,
  CONTINUE,
  RET,
  STRUCT_EXP,
  FIELD,
  PAREN(true),
  YIELD,
  TRY(true),
  MAC_EXP(true),

  // statements
  BLOCK,
  LOCAL,
  LOCAL_STMT,
  ITEM_STMT,
  EXPR_STMT,
  SEMI_STMT,
  MAC_STMT(true);

  /**
   * Whether nodes of this kind occur only in the surface tree. The lowering
   * pass either rewrites them into other kinds or rejects them.
   */
  public final boolean surfaceOnly;

  Op() {
    this(false);
  }

  Op(boolean surfaceOnly) {
    this.surfaceOnly = surfaceOnly;
  }
}

// End Op.java
