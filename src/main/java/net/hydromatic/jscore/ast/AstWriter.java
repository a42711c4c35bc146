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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. */
  public AstWriter id(Id id) {
    b.append(id);
    return this;
  }

  /** Appends a node, with the precedence of the operators to its left and
   * right. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes, separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a list of identifiers, separated by commas. */
  public AstWriter appendIds(List<Id> ids) {
    for (int i = 0; i < ids.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      id(ids.get(i));
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, String padded, int opLeft,
      int opRight, AstNode a1, int right) {
    if (left > opLeft || opRight < right) {
      return append("(").infix(0, a0, padded, opLeft, opRight, a1, 0)
          .append(")");
    }
    a0.unparse(this, left, opLeft);
    append(padded);
    a1.unparse(this, opRight, right);
    return this;
  }

  /** Appends a member access, ".name" if the key is a string literal that is
   * a valid identifier, otherwise "[key]". */
  public AstWriter key(Core.Exp key) {
    if (key instanceof Core.Constant) {
      final Literal literal = ((Core.Constant) key).literal;
      if (literal.kind == Literal.Kind.STRING
          && isIdentifier(literal.stringValue())) {
        return append(".").append(literal.stringValue());
      }
    }
    return append("[").append(key, 0, 0).append("]");
  }

  /** Returns whether a string is a valid JavaScript identifier name. */
  public static boolean isIdentifier(String s) {
    if (s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (!isIdentifierStart(c) && !Character.isDigit(c)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
