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
package net.hydromatic.jscore.compile;

import static net.hydromatic.jscore.ast.CoreBuilder.core;

import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Literal;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Simplifier of expressions.
 *
 * <p>Applies local rewrites to the root of an expression whose children are
 * already simplified. Each rewrite preserves JavaScript semantics and does
 * not increase the size of the expression:
 *
 * <ul>
 *   <li>{@code 3 + 1} &rarr; {@code 4}, {@code "a" + "b"} &rarr;
 *   {@code "ab"}, {@code 1 < 2} &rarr; {@code true}
 *   <li>{@code !true} &rarr; {@code false},
 *   {@code typeof 1} &rarr; {@code "number"}
 *   <li>{@code if true then a else b} &rarr; {@code a}
 *   <li>{@code true && x} &rarr; {@code x}, {@code 0 || x} &rarr; {@code x}
 *   <li>{@code c; x} &rarr; {@code x} if {@code c} is pure
 * </ul>
 */
class Simplifier {
  /** Largest integer such that it and all smaller integers are exactly
   * representable as a double. */
  private static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

  private Simplifier() {}

  static Core.Exp simplify(Core.Exp exp) {
    switch (exp.op) {
    case BINARY:
      return simplifyBinary((Core.Binary) exp);
    case UNARY:
      return simplifyUnary((Core.Unary) exp);
    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      if (ifThenElse.condition instanceof Core.Constant) {
        return literal(ifThenElse.condition).truthy()
            ? ifThenElse.ifTrue
            : ifThenElse.ifFalse;
      }
      return exp;
    case SEQUENTIAL:
      final Core.Sequential sequential = (Core.Sequential) exp;
      return sequential.first.isPure() ? sequential.second : exp;
    default:
      return exp;
    }
  }

  private static Literal literal(Core.Exp exp) {
    return ((Core.Constant) exp).literal;
  }

  private static Core.Exp simplifyUnary(Core.Unary unary) {
    if (!(unary.operand instanceof Core.Constant)) {
      return unary;
    }
    final Literal literal = literal(unary.operand);
    switch (unary.unaryOp) {
    case NOT:
      return core.boolLiteral(!literal.truthy());
    case TYPEOF:
      return core.stringLiteral(literal.typeOf());
    case VOID:
      return core.undefined();
    case NEGATE:
      if (isSafeInt(literal) && literal.longValue() != 0L) {
        return core.intLiteral(-literal.longValue());
      }
      if (literal.kind == Literal.Kind.DOUBLE) {
        return core.doubleLiteral(-literal.doubleValue());
      }
      return unary;
    case PLUS:
      return literal.isNumber() ? unary.operand : unary;
    case BIT_NOT:
      if (isSafeInt(literal)) {
        return core.intLiteral(~(int) literal.longValue());
      }
      return unary;
    default:
      return unary;
    }
  }

  private static Core.Exp simplifyBinary(Core.Binary binary) {
    if (!(binary.left instanceof Core.Constant)) {
      return binary;
    }
    final Literal left = literal(binary.left);
    if (binary.binaryOp.isShortCircuit()) {
      final boolean truthy = left.truthy();
      if (binary.binaryOp == BinaryOp.AND) {
        return truthy ? binary.right : binary.left;
      } else {
        return truthy ? binary.left : binary.right;
      }
    }
    if (!(binary.right instanceof Core.Constant)) {
      return binary;
    }
    final Literal right = literal(binary.right);
    final Literal result = fold(binary.binaryOp, left, right);
    return result == null ? binary : core.constant(result);
  }

  /** Evaluates a binary operator whose operands are literals; returns null
   * if the result cannot be computed exactly at compile time. */
  static @Nullable Literal fold(BinaryOp op, Literal left, Literal right) {
    switch (op) {
    case PLUS:
      if (left.kind == Literal.Kind.STRING
          || right.kind == Literal.Kind.STRING) {
        final String s0 = concatString(left);
        final String s1 = concatString(right);
        return s0 == null || s1 == null ? null : Literal.of(s0 + s1);
      }
      // fall through
    case MINUS:
    case TIMES:
    case DIVIDE:
    case MOD:
      return arithmetic(op, left, right);
    case LT:
    case LE:
    case GT:
    case GE:
      return compare(op, left, right);
    case EQ_STRICT:
      return strictEquals(left, right);
    case NOT_EQ_STRICT:
      final Literal eq = strictEquals(left, right);
      return eq == null ? null : Literal.of(!eq.truthy());
    case BIT_AND:
    case BIT_OR:
    case BIT_XOR:
    case SHIFT_LEFT:
    case SHIFT_RIGHT:
    case SHIFT_RIGHT_UNSIGNED:
      if (!isSafeInt(left) || !isSafeInt(right)) {
        return null;
      }
      return bitwise(op, (int) left.longValue(), (int) right.longValue());
    default:
      // Loose equality, "in" and "instanceof" involve conversions
      return null;
    }
  }

  private static boolean isSafeInt(Literal literal) {
    return literal.kind == Literal.Kind.INT
        && literal.longValue() >= -MAX_SAFE_INTEGER
        && literal.longValue() <= MAX_SAFE_INTEGER;
  }

  /** Converts a literal to the string that JavaScript would use when
   * concatenating it; returns null for numbers that are not safe
   * integers. */
  private static @Nullable String concatString(Literal literal) {
    switch (literal.kind) {
    case STRING:
      return literal.stringValue();
    case INT:
      return isSafeInt(literal) ? Long.toString(literal.longValue()) : null;
    case DOUBLE:
      return null;
    default:
      return literal.toString();
    }
  }

  private static @Nullable Literal arithmetic(BinaryOp op, Literal left,
      Literal right) {
    if (!left.isNumber() || !right.isNumber()) {
      return null;
    }
    if (isSafeInt(left) && isSafeInt(right)) {
      final long x = left.longValue();
      final long y = right.longValue();
      switch (op) {
      case PLUS:
        return safe(x + y);
      case MINUS:
        return safe(x - y);
      case TIMES:
        if (x == 0 || y == 0) {
          // Product may be negative zero
          return null;
        }
        final double d = (double) x * (double) y;
        return Math.abs(d) <= MAX_SAFE_INTEGER ? safe(x * y) : null;
      case MOD:
        return x >= 0 && y != 0 ? safe(x % y) : null;
      default:
        break;
      }
    }
    final double x = left.doubleValue();
    final double y = right.doubleValue();
    final double d;
    switch (op) {
    case PLUS:
      d = x + y;
      break;
    case MINUS:
      d = x - y;
      break;
    case TIMES:
      d = x * y;
      break;
    case DIVIDE:
      d = x / y;
      break;
    case MOD:
      d = x % y;
      break;
    default:
      throw new AssertionError(op);
    }
    return Double.isFinite(d) ? Literal.of(d) : null;
  }

  private static @Nullable Literal safe(long x) {
    return x >= -MAX_SAFE_INTEGER && x <= MAX_SAFE_INTEGER
        ? Literal.of(x) : null;
  }

  private static @Nullable Literal compare(BinaryOp op, Literal left,
      Literal right) {
    final int c;
    if (left.isNumber() && right.isNumber()) {
      final double x = left.doubleValue();
      final double y = right.doubleValue();
      if (Double.isNaN(x) || Double.isNaN(y)) {
        return Literal.FALSE;
      }
      c = Double.compare(x == 0d ? 0d : x, y == 0d ? 0d : y);
    } else if (left.kind == Literal.Kind.STRING
        && right.kind == Literal.Kind.STRING) {
      c = left.stringValue().compareTo(right.stringValue());
    } else {
      return null;
    }
    switch (op) {
    case LT:
      return Literal.of(c < 0);
    case LE:
      return Literal.of(c <= 0);
    case GT:
      return Literal.of(c > 0);
    case GE:
      return Literal.of(c >= 0);
    default:
      throw new AssertionError(op);
    }
  }

  private static @Nullable Literal strictEquals(Literal left,
      Literal right) {
    if (left.isNumber() && right.isNumber()) {
      return Literal.of(left.doubleValue() == right.doubleValue());
    }
    if (left.isNumber() || right.isNumber()) {
      return Literal.FALSE;
    }
    return Literal.of(left.equals(right));
  }

  private static Literal bitwise(BinaryOp op, int x, int y) {
    switch (op) {
    case BIT_AND:
      return Literal.of((long) (x & y));
    case BIT_OR:
      return Literal.of((long) (x | y));
    case BIT_XOR:
      return Literal.of((long) (x ^ y));
    case SHIFT_LEFT:
      return Literal.of((long) (x << (y & 31)));
    case SHIFT_RIGHT:
      return Literal.of((long) (x >> (y & 31)));
    case SHIFT_RIGHT_UNSIGNED:
      return Literal.of((x >>> (y & 31)) & 0xFFFFFFFFL);
    default:
      throw new AssertionError(op);
    }
  }
}

// End Simplifier.java
