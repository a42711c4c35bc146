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
package net.hydromatic.jscore.eval;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Literal;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.mozilla.javascript.ScriptRuntime;

/**
 * Evaluates core expressions directly, with JavaScript semantics.
 *
 * <p>Values are represented as follows: numbers as {@link Double}, strings
 * as {@link String}, booleans as {@link Boolean}, {@code null} as Java
 * null, {@code undefined} as {@link Undefined#INSTANCE}, arrays as
 * {@link List}, objects as {@link JsObject}, and functions as
 * {@link Applicable}.
 *
 * <p>{@link Core.Global} paths are resolved against a global object, and
 * {@link Core.Runtime} evaluates to a runtime object.
 */
public class Interpreter {
  private final JsObject global;
  private final JsObject runtime;

  public Interpreter() {
    this(new JsObject(), new JsObject());
  }

  public Interpreter(JsObject global, JsObject runtime) {
    this.global = requireNonNull(global);
    this.runtime = requireNonNull(runtime);
  }

  /** Evaluates a ground expression.
   *
   * @throws ThrownValue if the expression throws */
  public @Nullable Object eval(Core.Exp exp) {
    return eval(EvalEnv.empty(), exp);
  }

  public @Nullable Object eval(EvalEnv env, Core.Exp exp) {
    switch (exp.op) {
    case CONSTANT:
      return value(((Core.Constant) exp).literal);

    case VAR:
      return env.get(((Core.Var) exp).id);

    case GLOBAL:
      @Nullable Object o = global;
      for (String key : ((Core.Global) exp).path) {
        o = getField(o, key);
      }
      return o;

    case RUNTIME:
      return runtime;

    case APPLY:
      final Core.Apply apply = (Core.Apply) exp;
      final Object fn = eval(env, apply.fn);
      return applicable(fn).apply(Undefined.INSTANCE,
          evalList(env, apply.args));

    case CALL:
      final Core.Call call = (Core.Call) exp;
      final Object receiver = eval(env, call.receiver);
      final Object method = getField(receiver, key(eval(env, call.method)));
      return applicable(method).apply(receiver, evalList(env, call.args));

    case NEW:
      final Core.New new_ = (Core.New) exp;
      final Object constructor = eval(env, new_.constructor);
      final JsObject object = new JsObject();
      object.constructor = constructor;
      final Object result =
          applicable(constructor).apply(object, evalList(env, new_.args));
      return result instanceof JsObject
          || result instanceof List
          || result instanceof Applicable ? result : object;

    case FIELD_GET:
      final Core.FieldGet fieldGet = (Core.FieldGet) exp;
      final Object target = eval(env, fieldGet.object);
      return getField(target, key(eval(env, fieldGet.key)));

    case FIELD_SET:
      final Core.FieldSet fieldSet = (Core.FieldSet) exp;
      final Object target2 = eval(env, fieldSet.object);
      final String key2 = key(eval(env, fieldSet.key));
      setField(target2, key2, eval(env, fieldSet.value));
      return Undefined.INSTANCE;

    case FIELD_DELETE:
      final Core.FieldDelete fieldDelete = (Core.FieldDelete) exp;
      final Object target3 = eval(env, fieldDelete.object);
      final String key3 = key(eval(env, fieldDelete.key));
      if (target3 instanceof JsObject) {
        ((JsObject) target3).delete(key3);
      } else if (target3 == null || target3 == Undefined.INSTANCE) {
        throw ThrownValue.typeError("cannot delete property '" + key3
            + "' of " + toString(target3));
      }
      return true;

    case FOR_EACH_FIELD:
      final Core.ForEachField forEachField = (Core.ForEachField) exp;
      for (String key : keys(eval(env, forEachField.object))) {
        eval(env.bind(forEachField.id, key), forEachField.body);
      }
      return Undefined.INSTANCE;

    case FOR_RANGE:
      final Core.ForRange forRange = (Core.ForRange) exp;
      final double lower = toNumber(eval(env, forRange.lower));
      final double upper = toNumber(eval(env, forRange.upper));
      for (double i = lower; i <= upper; i++) {
        eval(env.bind(forRange.id, i), forRange.body);
      }
      return Undefined.INSTANCE;

    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      return truthy(eval(env, ifThenElse.condition))
          ? eval(env, ifThenElse.ifTrue)
          : eval(env, ifThenElse.ifFalse);

    case LAMBDA:
      return new Closure(this, env, (Core.Lambda) exp);

    case LET:
      final Core.Let let = (Core.Let) exp;
      return eval(env.bind(let.id, eval(env, let.value)), let.body);

    case LET_REC:
      final Core.LetRec letRec = (Core.LetRec) exp;
      EvalEnv env2 = env;
      for (Map.Entry<Id, Core.Exp> binding : letRec.bindings) {
        env2 = env2.bind(binding.getKey(), Undefined.INSTANCE);
      }
      for (Map.Entry<Id, Core.Exp> binding : letRec.bindings) {
        env2.set(binding.getKey(), eval(env2, binding.getValue()));
      }
      return eval(env2, letRec.body);

    case NEW_ARRAY:
      return evalList(env, ((Core.NewArray) exp).elements);

    case NEW_OBJECT:
      final JsObject object2 = new JsObject();
      for (Map.Entry<String, Core.Exp> field
          : ((Core.NewObject) exp).fields) {
        object2.put(field.getKey(), eval(env, field.getValue()));
      }
      return object2;

    case NEW_REGEX:
      final Core.NewRegex newRegex = (Core.NewRegex) exp;
      return new JsObject()
          .put("source", newRegex.body())
          .put("flags", newRegex.flags());

    case SEQUENTIAL:
      final Core.Sequential sequential = (Core.Sequential) exp;
      eval(env, sequential.first);
      return eval(env, sequential.second);

    case THROW:
      throw new ThrownValue(eval(env, ((Core.Throw) exp).exp));

    case TRY_FINALLY:
      final Core.TryFinally tryFinally = (Core.TryFinally) exp;
      try {
        return eval(env, tryFinally.body);
      } finally {
        eval(env, tryFinally.handler);
      }

    case TRY_WITH:
      final Core.TryWith tryWith = (Core.TryWith) exp;
      try {
        return eval(env, tryWith.body);
      } catch (ThrownValue e) {
        return eval(env.bind(tryWith.id, e.value), tryWith.handler);
      }

    case UNARY:
      return unary((Core.Unary) exp, eval(env, ((Core.Unary) exp).operand));

    case BINARY:
      final Core.Binary binary = (Core.Binary) exp;
      final Object left = eval(env, binary.left);
      switch (binary.binaryOp) {
      case AND:
        return truthy(left) ? eval(env, binary.right) : left;
      case OR:
        return truthy(left) ? left : eval(env, binary.right);
      default:
        return binary(binary.binaryOp, left, eval(env, binary.right));
      }

    case VAR_SET:
      final Core.VarSet varSet = (Core.VarSet) exp;
      env.set(varSet.id, eval(env, varSet.value));
      return Undefined.INSTANCE;

    case WHILE:
      final Core.While while_ = (Core.While) exp;
      while (truthy(eval(env, while_.condition))) {
        eval(env, while_.body);
      }
      return Undefined.INSTANCE;

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  private List<@Nullable Object> evalList(EvalEnv env,
      List<Core.Exp> exps) {
    final List<@Nullable Object> list = new ArrayList<>();
    for (Core.Exp exp : exps) {
      list.add(eval(env, exp));
    }
    return list;
  }

  /** Converts a literal to a value. */
  public static @Nullable Object value(Literal literal) {
    switch (literal.kind) {
    case TRUE:
      return true;
    case FALSE:
      return false;
    case NULL:
      return null;
    case UNDEFINED:
      return Undefined.INSTANCE;
    case STRING:
      return literal.stringValue();
    default:
      return literal.doubleValue();
    }
  }

  private static Applicable applicable(@Nullable Object o) {
    if (o instanceof Applicable) {
      return (Applicable) o;
    }
    throw ThrownValue.typeError(toString(o) + " is not a function");
  }

  private static @Nullable Object unary(Core.Unary unary,
      @Nullable Object o) {
    switch (unary.unaryOp) {
    case BIT_NOT:
      return (double) ~ScriptRuntime.toInt32(toNumber(o));
    case NEGATE:
      return -toNumber(o);
    case NOT:
      return !truthy(o);
    case PLUS:
      return toNumber(o);
    case TYPEOF:
      return typeOf(o);
    case VOID:
      return Undefined.INSTANCE;
    default:
      throw new AssertionError(unary.unaryOp);
    }
  }

  private static @Nullable Object binary(BinaryOp op, @Nullable Object left,
      @Nullable Object right) {
    switch (op) {
    case PLUS:
      if (left instanceof String || right instanceof String
          || !isPrimitive(left) || !isPrimitive(right)) {
        return toString(left) + toString(right);
      }
      return toNumber(left) + toNumber(right);
    case MINUS:
      return toNumber(left) - toNumber(right);
    case TIMES:
      return toNumber(left) * toNumber(right);
    case DIVIDE:
      return toNumber(left) / toNumber(right);
    case MOD:
      return toNumber(left) % toNumber(right);
    case LT:
      return compare(left, right, c -> c < 0);
    case LE:
      return compare(left, right, c -> c <= 0);
    case GT:
      return compare(left, right, c -> c > 0);
    case GE:
      return compare(left, right, c -> c >= 0);
    case EQ_STRICT:
      return strictEquals(left, right);
    case NOT_EQ_STRICT:
      return !strictEquals(left, right);
    case EQ:
      return looseEquals(left, right);
    case NOT_EQ:
      return !looseEquals(left, right);
    case BIT_AND:
      return (double) (toInt32(left) & toInt32(right));
    case BIT_OR:
      return (double) (toInt32(left) | toInt32(right));
    case BIT_XOR:
      return (double) (toInt32(left) ^ toInt32(right));
    case SHIFT_LEFT:
      return (double) (toInt32(left) << (toInt32(right) & 31));
    case SHIFT_RIGHT:
      return (double) (toInt32(left) >> (toInt32(right) & 31));
    case SHIFT_RIGHT_UNSIGNED:
      return (double) (ScriptRuntime.toUint32(toNumber(left))
          >>> (toInt32(right) & 31));
    case IN:
      final String key = key(left);
      if (right instanceof JsObject) {
        return ((JsObject) right).has(key);
      }
      if (right instanceof List) {
        return keys(right).contains(key) || key.equals("length");
      }
      throw ThrownValue.typeError("cannot use 'in' operator to search for '"
          + key + "' in " + toString(right));
    case INSTANCEOF:
      if (!(right instanceof Applicable)) {
        throw ThrownValue.typeError("right-hand side of 'instanceof' is not "
            + "callable");
      }
      return left instanceof JsObject
          && ((JsObject) left).constructor == right;
    default:
      throw new AssertionError(op);
    }
  }

  /** Compares two values using JavaScript's relational comparison. Strings
   * compare lexicographically; anything else compares as numbers, and if
   * either is NaN the result is false. */
  private static boolean compare(@Nullable Object left,
      @Nullable Object right, IntPredicate predicate) {
    if (left instanceof String && right instanceof String) {
      return predicate.test(((String) left).compareTo((String) right));
    }
    final double x = toNumber(left);
    final double y = toNumber(right);
    if (Double.isNaN(x) || Double.isNaN(y)) {
      return false;
    }
    return predicate.test(x < y ? -1 : x > y ? 1 : 0);
  }

  private static int toInt32(@Nullable Object o) {
    return ScriptRuntime.toInt32(toNumber(o));
  }

  private static boolean isPrimitive(@Nullable Object o) {
    return o == null
        || o == Undefined.INSTANCE
        || o instanceof Boolean
        || o instanceof Double
        || o instanceof String;
  }

  public static boolean strictEquals(@Nullable Object left,
      @Nullable Object right) {
    if (left instanceof Double && right instanceof Double) {
      return ((Double) left).doubleValue() == ((Double) right).doubleValue();
    }
    if (left instanceof String || left instanceof Boolean) {
      return left.equals(right);
    }
    return left == right;
  }

  public static boolean looseEquals(@Nullable Object left,
      @Nullable Object right) {
    final boolean leftNullish = left == null || left == Undefined.INSTANCE;
    final boolean rightNullish = right == null || right == Undefined.INSTANCE;
    if (leftNullish || rightNullish) {
      return leftNullish && rightNullish;
    }
    if (left.getClass() == right.getClass()) {
      return strictEquals(left, right);
    }
    if (isPrimitive(left) && isPrimitive(right)) {
      return toNumber(left) == toNumber(right);
    }
    if (isPrimitive(left)) {
      return looseEquals(left, toString(right));
    }
    if (isPrimitive(right)) {
      return looseEquals(toString(left), right);
    }
    return false;
  }

  /** Returns whether a value is "truthy" when used as a condition. */
  public static boolean truthy(@Nullable Object o) {
    if (o == null || o == Undefined.INSTANCE) {
      return false;
    }
    if (o instanceof Boolean) {
      return (Boolean) o;
    }
    if (o instanceof Double) {
      final double d = (Double) o;
      return d != 0d && !Double.isNaN(d);
    }
    if (o instanceof String) {
      return !((String) o).isEmpty();
    }
    return true;
  }

  public static double toNumber(@Nullable Object o) {
    if (o instanceof Double) {
      return (Double) o;
    }
    if (o == null) {
      return 0d;
    }
    if (o instanceof Boolean) {
      return (Boolean) o ? 1d : 0d;
    }
    if (o instanceof String) {
      return ScriptRuntime.toNumber((String) o);
    }
    if (o instanceof List || o instanceof JsObject) {
      return toNumber(toString(o));
    }
    return Double.NaN;
  }

  /** Converts a value to a string, as JavaScript's {@code String(o)}
   * does. */
  public static String toString(@Nullable Object o) {
    if (o == null) {
      return "null";
    }
    if (o instanceof Double) {
      return ScriptRuntime.numberToString((Double) o, 10);
    }
    if (o instanceof List) {
      final List<?> list = (List<?>) o;
      final StringBuilder b = new StringBuilder();
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          b.append(',');
        }
        final Object element = list.get(i);
        if (element != null && element != Undefined.INSTANCE) {
          b.append(toString(element));
        }
      }
      return b.toString();
    }
    if (o instanceof JsObject) {
      return "[object Object]";
    }
    if (o instanceof Applicable) {
      return "function";
    }
    return o.toString();
  }

  public static String typeOf(@Nullable Object o) {
    if (o == Undefined.INSTANCE) {
      return "undefined";
    }
    if (o instanceof Boolean) {
      return "boolean";
    }
    if (o instanceof Double) {
      return "number";
    }
    if (o instanceof String) {
      return "string";
    }
    if (o instanceof Applicable) {
      return "function";
    }
    return "object";
  }

  /** Converts a value to a property key. */
  private static String key(@Nullable Object o) {
    return toString(o);
  }

  /** Returns the keys that "for ... in" visits. */
  private static List<String> keys(@Nullable Object o) {
    if (o instanceof JsObject) {
      return ((JsObject) o).keys();
    }
    final List<String> keys = new ArrayList<>();
    if (o instanceof List) {
      for (int i = 0; i < ((List<?>) o).size(); i++) {
        keys.add(Integer.toString(i));
      }
    }
    return keys;
  }

  private static @Nullable Object getField(@Nullable Object o, String key) {
    if (o == null || o == Undefined.INSTANCE) {
      throw ThrownValue.typeError("cannot read property '" + key + "' of "
          + toString(o));
    }
    if (o instanceof JsObject) {
      return ((JsObject) o).get(key);
    }
    if (o instanceof List) {
      final List<?> list = (List<?>) o;
      if (key.equals("length")) {
        return (double) list.size();
      }
      final int i = index(key);
      return i >= 0 && i < list.size() ? list.get(i) : Undefined.INSTANCE;
    }
    if (o instanceof String) {
      final String s = (String) o;
      if (key.equals("length")) {
        return (double) s.length();
      }
      final int i = index(key);
      return i >= 0 && i < s.length()
          ? String.valueOf(s.charAt(i)) : Undefined.INSTANCE;
    }
    return Undefined.INSTANCE;
  }

  @SuppressWarnings("unchecked")
  private static void setField(@Nullable Object o, String key,
      @Nullable Object value) {
    if (o == null || o == Undefined.INSTANCE) {
      throw ThrownValue.typeError("cannot set property '" + key + "' of "
          + toString(o));
    }
    if (o instanceof JsObject) {
      ((JsObject) o).put(key, value);
    } else if (o instanceof List) {
      final List<@Nullable Object> list = (List<@Nullable Object>) o;
      final int i = index(key);
      if (i >= 0) {
        while (list.size() <= i) {
          list.add(Undefined.INSTANCE);
        }
        list.set(i, value);
      }
    }
    // Assignments to fields of other primitive values have no effect
  }

  /** Converts a key to an array index, or returns -1. */
  private static int index(String key) {
    if (key.isEmpty() || key.length() > 9) {
      return -1;
    }
    for (int i = 0; i < key.length(); i++) {
      final char c = key.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
    }
    if (key.length() > 1 && key.charAt(0) == '0') {
      return -1;
    }
    return Integer.parseInt(key);
  }
}

// End Interpreter.java
