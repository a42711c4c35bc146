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
package net.hydromatic.jscore.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  CONSTANT(true),
  GLOBAL(true),
  NEW_ARRAY(true),
  NEW_OBJECT(true),
  NEW_REGEX(true),
  RUNTIME(true),
  VAR(true),

  // postfix
  APPLY("", 18),
  CALL("", 18),
  FIELD_GET("", 18),
  NEW("new ", 18),

  // prefix
  FIELD_DELETE("delete ", 99, 30),
  UNARY("", 99, 30),

  /** Binary operator; precedence comes from {@link BinaryOp}. */
  BINARY,

  FIELD_SET(" := ", 2, false),
  VAR_SET(" := ", 2, false),
  SEQUENTIAL("; ", 1, false),

  // binding forms and statements; greedy to the right
  FOR_EACH_FIELD("for ", 99, 2),
  FOR_RANGE("for ", 99, 2),
  IF("if ", 99, 2),
  LAMBDA("fun ", 99, 2),
  LET("let ", 99, 2),
  LET_REC("let rec ", 99, 2),
  THROW("throw ", 99, 2),
  TRY_FINALLY("try ", 99, 2),
  TRY_WITH("try ", 99, 2),
  WHILE("while ", 99, 2);

  /** Padded name, e.g. " := ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    checkArgument(atom, "not an atom");
  }

  /** Creates a postfix operator; nothing to its right binds to it. */
  Op(String padded, int precedence) {
    this(padded, precedence * 2, 99);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this kind of node introduces a binder. */
  public boolean isBinder() {
    switch (this) {
    case FOR_EACH_FIELD:
    case FOR_RANGE:
    case LAMBDA:
    case LET:
    case LET_REC:
    case TRY_WITH:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
