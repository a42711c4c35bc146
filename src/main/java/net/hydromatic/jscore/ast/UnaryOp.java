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

/** Unary operators of the output language. */
public enum UnaryOp {
  BIT_NOT("~", Token.BITNOT),
  NEGATE("-", Token.NEG),
  NOT("!", Token.NOT),
  PLUS("+", Token.POS),
  TYPEOF("typeof ", Token.TYPEOF),
  VOID("void ", Token.VOID);

  /** Prefix as it appears in source code, e.g. "typeof ". */
  public final String prefix;
  /** Rhino token code. */
  public final int token;

  /** Operators keyed by Rhino token code. */
  public static final ImmutableMap<Integer, UnaryOp> BY_TOKEN;

  static {
    final ImmutableMap.Builder<Integer, UnaryOp> b = ImmutableMap.builder();
    for (UnaryOp op : values()) {
      b.put(op.token, op);
    }
    BY_TOKEN = b.build();
  }

  UnaryOp(String prefix, int token) {
    this.prefix = prefix;
    this.token = token;
  }
}

// End UnaryOp.java
