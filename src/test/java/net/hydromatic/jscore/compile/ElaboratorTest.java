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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.eval.Interpreter;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;

/** Tests for {@link Elaborator}.
 *
 * <p>Most tests generate JavaScript, run it in Rhino, and check that the
 * result is the same as that of {@link Interpreter}. */
public class ElaboratorTest {
  /** Script that defines the names that generated code refers to. */
  private static final String PRELUDE = "var Global = this;\n"
      + "var Runtime = {};\n"
      + "var IF = {Runtime: {}};\n"
      + "var ext = {y: 41};\n";

  private static Core.Exp i(long i) {
    return core.intLiteral(i);
  }

  private static Core.Exp binary(Core.Exp left, BinaryOp op,
      Core.Exp right) {
    return core.binary(left, op, right);
  }

  /** Evaluates JavaScript in a fresh scope and returns the result as a
   * string. */
  private static String run(String code) {
    try (Context cx = Context.enter()) {
      cx.setOptimizationLevel(-1);
      final Scriptable scope = cx.initStandardObjects();
      cx.evaluateString(scope, PRELUDE, "<prelude>", 1, null);
      return Context.toString(
          cx.evaluateString(scope, code, "<test>", 1, null));
    }
  }

  private static String js(Preferences preferences, Core.Exp exp) {
    return Compiles.toProgram(preferences, exp).toSource();
  }

  /** Checks that an expression, converted to JavaScript, evaluates to a
   * given value, and that the interpreter agrees. */
  private static void assertEvaluates(Core.Exp exp, String expected) {
    final String code = js(Preferences.READABLE, exp);
    assertThat(code, run("(" + code + ")"), is(expected));
    assertThat(Interpreter.toString(new Interpreter().eval(exp)),
        is(expected));
  }

  @Test void testSimpleExpressions() {
    final Core.Exp exp =
        binary(i(1), BinaryOp.PLUS, binary(i(2), BinaryOp.TIMES, i(3)));
    assertThat(js(Preferences.READABLE, exp), is("1 + (2 * 3)"));
    assertEvaluates(exp, "7");

    final Core.Exp max = core.call(core.global("Math"), "max", i(1), i(2));
    assertThat(js(Preferences.READABLE, max), is("Global.Math.max(1, 2)"));
    assertThat(run(js(Preferences.READABLE, max)), is("2"));

    assertEvaluates(
        binary(core.stringLiteral("a\"b"), BinaryOp.PLUS, i(-5)),
        "a\"b-5");
    assertEvaluates(core.doubleLiteral(Double.NaN), "NaN");
    assertEvaluates(
        binary(i(1), BinaryOp.DIVIDE, core.doubleLiteral(-0d)),
        "-Infinity");
    assertEvaluates(core.doubleLiteral(1.5e300), "1.5e+300");
    assertEvaluates(core.undefined(), "undefined");
    assertEvaluates(
        core.ifThenElse(binary(i(2), BinaryOp.GT, i(1)),
            core.stringLiteral("yes"), core.stringLiteral("no")),
        "yes");
    assertEvaluates(
        core.fieldGet(core.newArray(i(10), i(20), i(30)), i(1)), "20");
    final Core.Exp array =
        core.fieldGet(core.construct(core.global("Array"), i(3)), "length");
    assertThat(js(Preferences.READABLE, array),
        is("(new Global.Array(3)).length"));
    assertThat(run(js(Preferences.READABLE, array)), is("3"));
  }

  /** A statement in expression position becomes a function that is
   * invoked immediately. */
  @Test void testLet() {
    final Id x = Id.of("x");
    final Core.Exp exp =
        binary(i(1), BinaryOp.PLUS,
            core.let(x, i(2), binary(core.var(x), BinaryOp.TIMES,
                core.var(x))));
    assertEvaluates(exp, "5");
  }

  @Test void testReadableNames() {
    final Id x = Id.of("x");
    final Id x2 = Id.of("x");
    final Id v = Id.of("var");
    final Id global = Id.of("Global");
    final Core.Exp exp =
        core.let(x, i(1),
            core.let(x2, i(2),
                core.let(v, i(3),
                    core.let(global, i(4),
                        core.newArray(core.var(x), core.var(x2),
                            core.var(v), core.var(global))))));
    final String code = js(Preferences.READABLE, exp);
    assertThat(code, containsString("var x = 1;"));
    assertThat(code, containsString("var x1 = 2;"));
    assertThat(code, containsString("var var1 = 3;"));
    assertThat(code, containsString("var Global1 = 4;"));
    assertThat(code, containsString("return [x, x1, var1, Global1];"));
    assertThat(run("(" + code + ")"), is("1,2,3,4"));
  }

  @Test void testCompactNames() {
    final Id x = Id.of("x");
    final Id y = Id.of("y");
    final Core.Exp exp =
        core.lambda(ImmutableList.of(x),
            core.let(y, binary(core.var(x), BinaryOp.PLUS, i(1)),
                core.var(y)));
    final String code = js(Preferences.COMPACT, exp);
    assertThat(code, containsString("var b = a + 1;"));
    assertThat(code, containsString("return b;"));
    assertThat(js(Preferences.READABLE, exp),
        containsString("var y = x + 1;"));
    assertThat(run("(" + code + ")(2)"), is("3"));
  }

  /** A comma expression in an initializer keeps its parentheses; otherwise
   * it would declare a second variable. */
  @Test void testCommaInitializer() {
    final Id y = Id.of("y");
    final Core.Exp exp =
        core.let(y, core.sequential(i(1), i(2)),
            binary(core.var(y), BinaryOp.TIMES, i(10)));
    assertEvaluates(exp, "20");
  }

  @Test void testFreeIdentifiers() {
    final Id y = Id.of("y");
    final Core.Exp exp = binary(core.var(y), BinaryOp.PLUS, i(1));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Compiles.toProgram(Preferences.READABLE, exp));
    assertThat(e.getMessage(), is("free identifier 'y' has no external name"));

    final AstNode node =
        Compiles.toProgram(Preferences.READABLE, ImmutableMap.of(y, "ext.y"),
            exp);
    assertThat(node.toSource(), is("ext.y + 1"));
    assertThat(run(node.toSource()), is("42"));
  }

  @Test void testRuntime() {
    final Core.Exp exp =
        core.sequential(core.fieldSet(core.runtime(), core.stringLiteral("x"),
                i(5)),
            core.fieldGet(core.runtime(), "x"));
    assertEvaluates(exp, "5");

    final Preferences preferences =
        Preferences.READABLE.with(Prop.RUNTIME_NAME, "IF.Runtime")
            .with(Prop.GLOBAL_NAME, "this");
    final String code = js(preferences, exp);
    assertThat(code, containsString("IF.Runtime.x = 5"));
    assertThat(run("(" + code + ")"), is("5"));
  }

  @Test void testLoops() {
    final Id sum = Id.of("sum", true);
    final Id j = Id.of("j");
    final Core.Exp exp =
        core.let(sum, i(0),
            core.sequential(
                core.forRange(j, i(1), i(10),
                    core.varSet(sum,
                        binary(core.var(sum), BinaryOp.PLUS, core.var(j)))),
                core.var(sum)));
    assertEvaluates(exp, "55");

    final Id n = Id.of("n", true);
    final Core.Exp exp2 =
        core.let(n, i(0),
            core.sequential(
                core.whileLoop(binary(core.var(n), BinaryOp.LT, i(5)),
                    core.varSet(n,
                        binary(core.var(n), BinaryOp.PLUS, i(1)))),
                core.var(n)));
    assertEvaluates(exp2, "5");

    final Id o = Id.of("o");
    final Id s = Id.of("s", true);
    final Id k = Id.of("k");
    final Core.Exp exp3 =
        core.let(o,
            core.newObject(
                ImmutableList.of(Maps.immutableEntry("a", i(1)),
                    Maps.immutableEntry("b c", i(2)))),
            core.let(s, core.stringLiteral(""),
                core.sequential(
                    ImmutableList.of(
                        core.fieldSet(core.var(o), core.stringLiteral("d"),
                            i(3)),
                        core.forEachField(k, core.var(o),
                            core.varSet(s,
                                binary(core.var(s), BinaryOp.PLUS,
                                    core.var(k)))),
                        core.var(s)))));
    assertEvaluates(exp3, "ab cd");
  }

  /** Each iteration of a loop has its own loop variable, so closures that
   * are created in different iterations see different values. */
  @Test void testClosureInLoop() {
    final Id fs = Id.of("fs");
    final Id i = Id.of("i");
    final Core.Exp exp =
        core.let(fs, core.newArray(),
            core.sequential(
                core.forRange(i, i(0), i(2),
                    core.fieldSet(core.var(fs), core.var(i),
                        core.lambda(ImmutableList.of(), core.var(i)))),
                binary(core.apply(core.fieldGet(core.var(fs), i(0))),
                    BinaryOp.PLUS,
                    core.apply(core.fieldGet(core.var(fs), i(2))))));
    assertEvaluates(exp, "2");
  }

  @Test void testExceptions() {
    final Id e = Id.of("e");
    assertEvaluates(
        core.tryWith(core.throwExp(core.stringLiteral("boom")), e,
            binary(core.var(e), BinaryOp.PLUS, core.stringLiteral("!"))),
        "boom!");

    final Id n = Id.of("n", true);
    assertEvaluates(
        core.let(n, i(0),
            core.sequential(
                core.tryFinally(core.varSet(n, i(1)),
                    core.varSet(n,
                        binary(core.var(n), BinaryOp.TIMES, i(10)))),
                core.var(n))),
        "10");
  }

  @Test void testObjects() {
    final Id self = Id.of("self");
    final Core.Exp object =
        core.newObject(
            ImmutableList.of(Maps.immutableEntry("n", i(5)),
                Maps.immutableEntry("get",
                    core.lambda(self, ImmutableList.of(),
                        core.fieldGet(core.var(self), "n")))));
    assertEvaluates(core.call(object, "get"), "5");

    final Id o = Id.of("o");
    assertEvaluates(
        core.let(o,
            core.newObject(ImmutableList.of(Maps.immutableEntry("a", i(1)))),
            core.sequential(
                core.fieldDelete(core.var(o), core.stringLiteral("a")),
                binary(core.stringLiteral("a"), BinaryOp.IN, core.var(o)))),
        "false");
  }

  @Test void testRegex() {
    final Core.Exp exp =
        core.call(core.newRegex("/a+/"), "test",
            core.stringLiteral("caab"));
    final String code = js(Preferences.READABLE, exp);
    assertThat(code, is("/a+/.test(\"caab\")"));
    assertThat(run(code), is("true"));
  }

  /** Tail-recursive functions, once optimized, run in constant stack. */
  @Test void testTailCalls() {
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
                            binary(core.var(n), BinaryOp.EQ_STRICT, i(0)),
                            core.boolLiteral(true),
                            core.apply(core.var(odd),
                                binary(core.var(n), BinaryOp.MINUS,
                                    i(1)))))),
                Maps.immutableEntry(odd,
                    core.lambda(ImmutableList.of(m),
                        core.ifThenElse(
                            binary(core.var(m), BinaryOp.EQ_STRICT, i(0)),
                            core.boolLiteral(false),
                            core.apply(core.var(even),
                                binary(core.var(m), BinaryOp.MINUS,
                                    i(1))))))),
            core.apply(core.var(even), i(100_001)));
    final Core.Exp exp2 = Compiles.optimize(exp);
    final String code = js(Preferences.READABLE, exp2);
    assertThat(code, containsString("while (again)"));
    assertThat(run("(" + code + ")"), is("false"));
  }

  /** A script evaluates an expression for its effects. */
  @Test void testScript() {
    final Core.Exp exp =
        core.sequential(core.fieldSet(core.global(), core.stringLiteral("r"),
                i(42)),
            i(0));
    final AstRoot root =
        Elaborator.toScript(Preferences.READABLE, ImmutableMap.of(), exp);
    final String code = root.toSource();
    assertThat(code, is("Global.r = 42;\n"));
    assertThat(run(code + "r"), is("42"));
    assertThat(code, not(containsString("return")));
  }
}

// End ElaboratorTest.java
