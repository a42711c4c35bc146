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

import static net.hydromatic.jscore.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.UnaryOp;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter}. */
public class InterpreterTest {
  private static Core.Exp i(long i) {
    return core.intLiteral(i);
  }

  private static Core.Exp s(String s) {
    return core.stringLiteral(s);
  }

  private static Object eval(Core.Exp exp) {
    return new Interpreter().eval(exp);
  }

  private static Object binary(Core.Exp left, BinaryOp op, Core.Exp right) {
    return eval(core.binary(left, op, right));
  }

  @Test void testOperators() {
    assertThat(binary(i(7), BinaryOp.PLUS, i(2)), is(9d));
    assertThat(binary(s("a"), BinaryOp.PLUS, i(2)), is("a2"));
    assertThat(binary(i(7), BinaryOp.DIVIDE, i(2)), is(3.5d));
    assertThat(binary(i(-7), BinaryOp.MOD, i(2)), is(-1d));
    assertThat(binary(i(-1), BinaryOp.SHIFT_RIGHT_UNSIGNED, i(28)), is(15d));
    assertThat(binary(i(1), BinaryOp.SHIFT_LEFT, i(33)), is(2d));
    assertThat(binary(i(6), BinaryOp.BIT_XOR, i(3)), is(5d));
    assertThat(binary(s("10"), BinaryOp.LT, s("9")), is(true));
    assertThat(binary(i(10), BinaryOp.LT, s("9")), is(false));
    assertThat(binary(i(1), BinaryOp.EQ, s("1")), is(true));
    assertThat(binary(i(1), BinaryOp.EQ_STRICT, s("1")), is(false));
    assertThat(binary(core.nullLiteral(), BinaryOp.EQ, core.undefined()),
        is(true));
    assertThat(
        binary(core.doubleLiteral(Double.NaN), BinaryOp.EQ_STRICT,
            core.doubleLiteral(Double.NaN)),
        is(false));
    assertThat(binary(i(0), BinaryOp.AND, core.throwExp(i(1))), is(0d));
    assertThat(binary(s("x"), BinaryOp.OR, core.throwExp(i(1))), is("x"));

    assertThat(eval(core.unary(UnaryOp.TYPEOF, core.nullLiteral())),
        is("object"));
    assertThat(eval(core.unary(UnaryOp.TYPEOF, core.undefined())),
        is("undefined"));
    assertThat(eval(core.unary(UnaryOp.NOT, s(""))), is(true));
    assertThat(eval(core.unary(UnaryOp.PLUS, s(" 12 "))), is(12d));
    assertThat(eval(core.unary(UnaryOp.BIT_NOT, i(5))), is(-6d));
    assertThat(eval(core.unary(UnaryOp.VOID, i(5))), is(Undefined.INSTANCE));
  }

  @Test void testToString() {
    assertThat(Interpreter.toString(1d), is("1"));
    assertThat(Interpreter.toString(0.1d), is("0.1"));
    assertThat(Interpreter.toString(-0d), is("0"));
    assertThat(Interpreter.toString(1e21), is("1e+21"));
    assertThat(Interpreter.toString(null), is("null"));
    assertThat(Interpreter.toString(Undefined.INSTANCE), is("undefined"));
    assertThat(
        Interpreter.toString(
            eval(core.newArray(i(1), core.undefined(), core.nullLiteral(),
                core.newArray(i(2), i(3))))),
        is("1,,,2,3"));
    assertThat(Interpreter.toString(new JsObject()), is("[object Object]"));
  }

  @Test void testBindings() {
    final Id x = Id.of("x");
    final Id f = Id.of("f");
    final Id y = Id.of("y");
    assertThat(
        eval(core.let(x, i(2),
            core.let(f,
                core.lambda(ImmutableList.of(y),
                    core.binary(core.var(x), BinaryOp.TIMES, core.var(y))),
                core.apply(core.var(f), i(21))))),
        is(42d));

    // A missing argument is undefined
    assertThat(
        eval(core.apply(core.lambda(ImmutableList.of(y), core.var(y)))),
        is(Undefined.INSTANCE));

    final EvalEnv env = EvalEnv.empty().bind(x, 5d);
    assertThat(new Interpreter().eval(env, core.var(x)), is(5d));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new Interpreter().eval(env, core.var(y)));
    assertThat(e.getMessage(), is("not bound: y"));
  }

  @Test void testGlobalAndRuntime() {
    final JsObject math = new JsObject()
        .put("max", (Applicable) (receiver, args) ->
            Math.max(Interpreter.toNumber(args.get(0)),
                Interpreter.toNumber(args.get(1))));
    final JsObject global = new JsObject().put("Math", math);
    final JsObject runtime = new JsObject().put("version", "1");
    final Interpreter interpreter = new Interpreter(global, runtime);
    assertThat(
        interpreter.eval(core.call(core.global("Math"), "max", i(3), i(4))),
        is(4d));
    assertThat(interpreter.eval(core.fieldGet(core.runtime(), "version")),
        is("1"));
    assertThat(interpreter.eval(core.global("Nope")), is(Undefined.INSTANCE));

    final ThrownValue e =
        assertThrows(ThrownValue.class,
            () -> interpreter.eval(core.global("Nope", "x")));
    assertThat(e.value, instanceOf(JsObject.class));
    assertThat(((JsObject) e.value).get("name"), is("TypeError"));
  }

  @Test void testObjects() {
    final Id o = Id.of("o");
    final Core.Exp exp =
        core.let(o,
            core.newObject(
                ImmutableList.of(Maps.immutableEntry("a", i(1)))),
            core.sequential(
                ImmutableList.of(
                    core.fieldSet(core.var(o), s("b"), i(2)),
                    core.fieldDelete(core.var(o), s("a")),
                    core.var(o))));
    final Object result = eval(exp);
    assertThat(result, instanceOf(JsObject.class));
    assertThat(((JsObject) result).keys(), is(ImmutableList.of("b")));
    assertThat(((JsObject) result).get("a"), is(Undefined.INSTANCE));

    final Object array = eval(core.newArray(i(1), s("x")));
    assertThat(array, instanceOf(List.class));
    assertThat(
        eval(core.fieldGet(core.newArray(i(1), s("x")), "length")), is(2d));
    assertThat(eval(core.fieldGet(s("abc"), i(1))), is("b"));
    assertThrows(ThrownValue.class,
        () -> eval(core.fieldGet(core.nullLiteral(), "a")));
  }

  /** A constructor that is invoked with "new" receives a fresh object as
   * "this"; "instanceof" recognizes objects that it constructed. */
  @Test void testNew() {
    final Id self = Id.of("self");
    final Id v = Id.of("v");
    final Id c = Id.of("C");
    final Id obj = Id.of("obj");
    final Core.Exp exp =
        core.let(c,
            core.lambda(self, ImmutableList.of(v),
                core.fieldSet(core.var(self), s("v"), core.var(v))),
            core.let(obj, core.construct(core.var(c), ImmutableList.of(i(7))),
                core.newArray(core.fieldGet(core.var(obj), "v"),
                    core.binary(core.var(obj), BinaryOp.INSTANCEOF,
                        core.var(c)))));
    assertThat(Interpreter.toString(eval(exp)), is("7,true"));
  }

  @Test void testExceptions() {
    final ThrownValue e =
        assertThrows(ThrownValue.class, () -> eval(core.throwExp(s("boom"))));
    assertThat(e.value, is("boom"));
    assertThat(e.getMessage(), is("uncaught boom"));

    final Id x = Id.of("x");
    assertThat(eval(core.tryWith(core.throwExp(i(3)), x, core.var(x))),
        is(3d));

    // The handler of "try ... finally" runs, and the exception propagates
    final Id n = Id.of("n", true);
    final Id e2 = Id.of("e");
    assertThat(
        eval(
            core.let(n, i(0),
                core.sequential(
                    core.tryWith(
                        core.tryFinally(core.throwExp(i(1)),
                            core.varSet(n, i(5))),
                        e2, core.undefined()),
                    core.var(n)))),
        is(5d));

    final ThrownValue e3 =
        assertThrows(ThrownValue.class,
            () -> eval(core.apply(i(1))));
    assertThat(((JsObject) e3.value).get("message"),
        is("1 is not a function"));
  }

  @Test void testLoops() {
    final Id total = Id.of("total", true);
    final Id i = Id.of("i");
    assertThat(
        eval(
            core.let(total, i(0),
                core.sequential(
                    core.forRange(i, i(3), i(1),
                        core.varSet(total, i(99))),
                    core.var(total)))),
        is(0d));

    final Id k = Id.of("k");
    final Id keys = Id.of("keys", true);
    assertThat(
        eval(
            core.let(keys, s(""),
                core.sequential(
                    core.forEachField(k, core.newArray(s("a"), s("b")),
                        core.varSet(keys,
                            core.binary(core.var(keys), BinaryOp.PLUS,
                                core.var(k)))),
                    core.var(keys)))),
        is("01"));
  }

  @Test void testLetRec() {
    final Id even = Id.of("even");
    final Id odd = Id.of("odd");
    final Id n = Id.of("n");
    final Id m = Id.of("m");
    final Core.Exp exp =
        core.letRec(
            ImmutableList.of(
                Maps.immutableEntry(even,
                    core.lambda(ImmutableList.of(n),
                        core.ifThenElse(
                            core.binary(core.var(n), BinaryOp.EQ_STRICT,
                                i(0)),
                            core.boolLiteral(true),
                            core.apply(core.var(odd),
                                core.binary(core.var(n), BinaryOp.MINUS,
                                    i(1)))))),
                Maps.immutableEntry(odd,
                    core.lambda(ImmutableList.of(m),
                        core.ifThenElse(
                            core.binary(core.var(m), BinaryOp.EQ_STRICT,
                                i(0)),
                            core.boolLiteral(false),
                            core.apply(core.var(even),
                                core.binary(core.var(m), BinaryOp.MINUS,
                                    i(1))))))),
            core.apply(core.var(odd), i(11)));
    assertThat(eval(exp), is(true));
    assertThat(eval(core.nullLiteral()), nullValue());
  }
}

// End InterpreterTest.java
