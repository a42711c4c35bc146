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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Literal value.
 *
 * <p>Immutable. Lifted into an expression by {@link CoreBuilder#constant}.
 */
public final class Literal {
  public static final Literal TRUE = new Literal(Kind.TRUE, null);
  public static final Literal FALSE = new Literal(Kind.FALSE, null);
  public static final Literal NULL = new Literal(Kind.NULL, null);
  public static final Literal UNDEFINED = new Literal(Kind.UNDEFINED, null);

  public final Kind kind;
  private final @Nullable Object value;

  private Literal(Kind kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  /** Creates a double literal. */
  public static Literal of(double d) {
    return new Literal(Kind.DOUBLE, d);
  }

  /** Creates a 64-bit integer literal. */
  public static Literal of(long i) {
    return new Literal(Kind.INT, i);
  }

  /** Creates a string literal. */
  public static Literal of(String s) {
    return new Literal(Kind.STRING, requireNonNull(s));
  }

  /** Returns {@link #TRUE} or {@link #FALSE}. */
  public static Literal of(boolean b) {
    return b ? TRUE : FALSE;
  }

  /** Returns whether this is a double or an integer. */
  public boolean isNumber() {
    return kind == Kind.DOUBLE || kind == Kind.INT;
  }

  /** Returns whether this is {@link #TRUE} or {@link #FALSE}. */
  public boolean isBoolean() {
    return kind == Kind.TRUE || kind == Kind.FALSE;
  }

  /** Returns the value of a numeric literal as a double. */
  public double doubleValue() {
    switch (kind) {
    case DOUBLE:
      return (Double) requireNonNull(value);
    case INT:
      return (Long) requireNonNull(value);
    default:
      throw new IllegalStateException("not a number: " + this);
    }
  }

  /** Returns the value of an integer literal. */
  public long longValue() {
    if (kind != Kind.INT) {
      throw new IllegalStateException("not an integer: " + this);
    }
    return (Long) requireNonNull(value);
  }

  /** Returns the value of a string literal. */
  public String stringValue() {
    if (kind != Kind.STRING) {
      throw new IllegalStateException("not a string: " + this);
    }
    return (String) requireNonNull(value);
  }

  /** Returns whether this value is "truthy" when used as a condition,
   * following JavaScript's conversion to boolean. */
  public boolean truthy() {
    switch (kind) {
    case TRUE:
      return true;
    case FALSE:
    case NULL:
    case UNDEFINED:
      return false;
    case STRING:
      return !stringValue().isEmpty();
    case INT:
      return longValue() != 0L;
    case DOUBLE:
      final double d = doubleValue();
      return d != 0d && !Double.isNaN(d);
    default:
      throw new AssertionError(kind);
    }
  }

  /** Returns the value as it would be returned by JavaScript's
   * {@code typeof} operator. */
  public String typeOf() {
    switch (kind) {
    case TRUE:
    case FALSE:
      return "boolean";
    case NULL:
      return "object";
    case UNDEFINED:
      return "undefined";
    case STRING:
      return "string";
    default:
      return "number";
    }
  }

  /** Returns the Java value, if this literal has one. */
  public Optional<Object> value() {
    return Optional.ofNullable(value);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Literal
        && kind == ((Literal) o).kind
        && Objects.equals(value, ((Literal) o).value);
  }

  /** Returns the JavaScript source of this literal. */
  @Override public String toString() {
    switch (kind) {
    case TRUE:
      return "true";
    case FALSE:
      return "false";
    case NULL:
      return "null";
    case UNDEFINED:
      return "undefined";
    case INT:
      return Long.toString(longValue());
    case DOUBLE:
      final double d = doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)
          && Math.abs(d) < 1e15 && !(d == 0d && 1d / d < 0d)) {
        return Long.toString((long) d);
      }
      return Double.toString(d);
    case STRING:
      return quote(stringValue());
    default:
      throw new AssertionError(kind);
    }
  }

  /** Converts a string to a double-quoted JavaScript string literal. */
  public static String quote(String s) {
    final StringBuilder b = new StringBuilder("\"");
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '"':
        b.append("\\\"");
        break;
      case '\\':
        b.append("\\\\");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\r':
        b.append("\\r");
        break;
      case '\t':
        b.append("\\t");
        break;
      default:
        if (c < 0x20) {
          b.append(String.format("\\u%04x", (int) c));
        } else {
          b.append(c);
        }
      }
    }
    return b.append('"').toString();
  }

  /** Kind of literal. */
  public enum Kind {
    DOUBLE,
    TRUE,
    FALSE,
    INT,
    NULL,
    STRING,
    UNDEFINED
  }
}

// End Literal.java
