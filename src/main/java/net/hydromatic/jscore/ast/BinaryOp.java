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

import com.google.common.collect.ImmutableMap;
import org.mozilla.javascript.Token;

/** Binary operators of the output language.
 *
 * <p>Assignment, comma and member access are not binary operators; they
 * have their own kinds of expression. */
public enum BinaryOp {
  NOT_EQ("!=", 9, Token.NE),
  NOT_EQ_STRICT("!==", 9, Token.SHNE),
  MOD("%", 13, Token.MOD),
  AND("&&", 5, Token.AND),
  BIT_AND("&", 8, Token.BITAND),
  TIMES("*", 13, Token.MUL),
  PLUS("+", 12, Token.ADD),
  MINUS("-", 12, Token.SUB),
  DIVIDE("/", 13, Token.DIV),
  SHIFT_LEFT("<<", 11, Token.LSH),
  LE("<=", 10, Token.LE),
  LT("<", 10, Token.LT),
  EQ_STRICT("===", 9, Token.SHEQ),
  EQ("==", 9, Token.EQ),
  GE(">=", 10, Token.GE),
  SHIFT_RIGHT_UNSIGNED(">>>", 11, Token.URSH),
  SHIFT_RIGHT(">>", 11, Token.RSH),
  GT(">", 10, Token.GT),
  BIT_XOR("^", 7, Token.BITXOR),
  IN("in", 10, Token.IN),
  INSTANCEOF("instanceof", 10, Token.INSTANCEOF),
  BIT_OR("|", 6, Token.BITOR),
  OR("||", 4, Token.OR);

  /** Operator as it appears in source code, e.g. "===". */
  public final String symbol;
  /** Padded symbol, e.g. " === ". */
  public final String padded;
  /** Left precedence. All operators are left-associative. */
  public final int left;
  /** Right precedence. */
  public final int right;
  /** Rhino token code. */
  public final int token;

  /** Operators keyed by Rhino token code. */
  public static final ImmutableMap<Integer, BinaryOp> BY_TOKEN;

  static {
    final ImmutableMap.Builder<Integer, BinaryOp> b = ImmutableMap.builder();
    for (BinaryOp op : values()) {
      b.put(op.token, op);
    }
    BY_TOKEN = b.build();
  }

  BinaryOp(String symbol, int precedence, int token) {
    this.symbol = symbol;
    this.padded = " " + symbol + " ";
    this.left = precedence * 2;
    this.right = precedence * 2 + 1;
    this.token = token;
  }

  /** Returns whether the right operand is evaluated only depending on the
   * value of the left operand. */
  public boolean isShortCircuit() {
    return this == AND || this == OR;
  }
}

// End BinaryOp.java
