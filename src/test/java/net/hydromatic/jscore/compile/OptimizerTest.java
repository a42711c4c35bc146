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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.UnaryOp;
import net.hydromatic.jscore.eval.Interpreter;
import org.junit.jupiter.api.Test;

/** Tests for {@link Optimizer}. */
public class OptimizerTest {
  private static Core.Exp i(long i) {
    return core.intLiteral(i);
  }

  private static Core.Exp binary(Core.Exp left, BinaryOp op,
      Core.Exp right) {
    return core.binary(left, op, right);
  }

  /** Returns whether an expression contains an application of a given
   * identifier. */
  private static boolean applies(Core.Exp exp, Id id) {
    if (exp instanceof Core.Apply
        && ((Core.Apply) exp).fn instanceof Core.Var
        && ((Core.Var) ((Core.Apply) exp).fn).id == id) {
      return true;
    }
    return exp.fold(false, (b, e) -> b || applies(e, id));
  }

  /** Creates "let rec fact = fun (n, acc) -> if n <= 1 then acc
   * else fact(n - 1, acc * n) in fact(5, 1)". */
  private static Core.LetRec factorial(Id fact) {
    final Id n = Id.of("n");
    final Id acc = Id.of("acc");
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(n, acc),
            core.ifThenElse(binary(core.var(n), BinaryOp.LE, i(1)),
                core.var(acc),
                core.apply(core.var(fact),
                    binary(core.var(n), BinaryOp.MINUS, i(1)),
                    binary(core.var(acc), BinaryOp.TIMES, core.var(n)))));
    return core.letRec(fact, lambda,
        core.apply(core.var(fact), i(5), i(1)));
  }

  /** Creates a pair of functions that call each other in tail position:
   * "even(n) = if n === 0 then true else odd(n - 1)" and
   * "odd(n) = if n === 0 then false else even(n - 1)". */
  private static Core.LetRec evenOdd(Id even, Id odd, Core.Exp body) {
    final Id n = Id.of("n");
    final Id m = Id.of("n");
    return core.letRec(
        ImmutableList.of(
            Maps.immutableEntry(even,
                core.lambda(ImmutableList.of(n),
                    core.ifThenElse(
                        binary(core.var(n), BinaryOp.EQ_STRICT, i(0)),
                        core.boolLiteral(true),
                        core.apply(core.var(odd),
                            binary(core.var(n), BinaryOp.MINUS, i(1)))))),
            Maps.immutableEntry(odd,
                core.lambda(ImmutableList.of(m),
                    core.ifThenElse(
                        binary(core.var(m), BinaryOp.EQ_STRICT, i(0)),
                        core.boolLiteral(false),
                        core.apply(core.var(even),
                            binary(core.var(m), BinaryOp.MINUS, i(1))))))),
        body);
  }

  /** A function that calls itself in tail position becomes a loop, and
   * computes the same value. */
  @Test void testSelfTailCall() {
    final Id fact = Id.of("fact");
    final Core.LetRec exp = factorial(fact);
    assertThat(new Interpreter().eval(exp), is(120d));

    final Core.Exp exp2 = Compiles.optimize(exp);
    assertThat(exp2, instanceOf(Core.LetRec.class));
    final Core.LetRec letRec = (Core.LetRec) exp2;
    final Core.Exp value = letRec.get(fact);
    assertThat(value, instanceOf(Core.Lambda.class));
    assertThat(applies(value, fact), is(false));
    assertThat(((Core.Lambda) value).params.size(), is(2));
    assertThat(new Interpreter().eval(exp2), is(120d));
    assertThat(Compiles.isGround(exp2), is(true));
  }

  /** With tail calls disabled, the optimizer leaves recursion alone. */
  @Test void testTailCallsDisabled() {
    final Core.LetRec exp = factorial(Id.of("fact"));
    final Preferences preferences =
        Preferences.READABLE.with(Prop.TAIL_CALLS, false);
    assertThat(Compiles.optimize(preferences, exp), sameInstance(exp));
  }

  /** A call that is not in tail position is not rewritten. */
  @Test void testNonTailCall() {
    final Id fib = Id.of("fib");
    final Id n = Id.of("n");
    final Core.Exp exp =
        core.letRec(fib,
            core.lambda(ImmutableList.of(n),
                core.ifThenElse(binary(core.var(n), BinaryOp.LT, i(2)),
                    core.var(n),
                    binary(
                        core.apply(core.var(fib),
                            binary(core.var(n), BinaryOp.MINUS, i(1))),
                        BinaryOp.PLUS,
                        core.apply(core.var(fib),
                            binary(core.var(n), BinaryOp.MINUS, i(2)))))),
            core.apply(core.var(fib), i(10)));
    final Core.Exp exp2 = Compiles.optimize(exp);
    assertThat(exp2, is(exp));
    assertThat(new Interpreter().eval(exp2), is(55d));
  }

  /** A call with the wrong number of arguments is not a jump. */
  @Test void testTailCallWrongArity() {
    final Id f = Id.of("f");
    final Id x = Id.of("x");
    final Core.Exp exp =
        core.letRec(f,
            core.lambda(ImmutableList.of(x),
                core.apply(core.var(f), core.var(x), core.var(x))),
            core.var(f));
    assertThat(Compiles.optimize(exp), is(exp));
  }

  /** A call to a shadowed name is not a call to the function. */
  @Test void testTailCallShadowed() {
    final Id f = Id.of("f");
    final Id x = Id.of("x");
    final Core.Exp exp =
        core.letRec(f,
            core.lambda(ImmutableList.of(x),
                core.let(f, core.global("g"),
                    core.apply(core.var(f), core.var(x)))),
            core.var(f));
    assertThat(Compiles.optimize(exp), is(exp));
  }

  /** Functions that call each other in tail position share a loop, so that
   * deep mutual recursion does not exhaust the stack. */
  @Test void testMutualTailCalls() {
    final Id even = Id.of("even");
    final Id odd = Id.of("odd");
    final Core.LetRec exp =
        evenOdd(even, odd, core.apply(core.var(even), i(100_001)));
    final Core.Exp exp2 = Compiles.optimize(exp);
    final Core.LetRec letRec = (Core.LetRec) exp2;
    assertThat(letRec.bindings.size(), is(3));
    final Core.Exp evenValue = letRec.get(even);
    final Core.Exp oddValue = letRec.get(odd);
    assertThat(evenValue, instanceOf(Core.Lambda.class));
    assertThat(applies(evenValue, odd), is(false));
    assertThat(applies(oddValue, even), is(false));
    assertThat(new Interpreter().eval(exp2), is(false));

    final Core.Exp exp3 =
        evenOdd(Id.of("even"), odd, core.apply(core.var(odd), i(7)));
    assertThat(new Interpreter().eval(Compiles.optimize(exp3)), is(true));
  }

  /** Optimizing an optimized expression changes nothing. */
  @Test void testIdempotent() {
    final Id even = Id.of("even");
    final Id odd = Id.of("odd");
    final List<Core.Exp> exps =
        ImmutableList.of(factorial(Id.of("fact")),
            evenOdd(even, odd, core.apply(core.var(even), i(10))),
            binary(binary(i(1), BinaryOp.PLUS, i(2)), BinaryOp.TIMES,
                core.global("x")));
    for (Core.Exp exp : exps) {
      final Core.Exp exp2 = Compiles.optimize(exp);
      assertThat(Compiles.optimize(exp2), is(exp2));
    }
  }

  @Test void testConstantFolding() {
    assertThat(
        Compiles.optimize(
            binary(i(1), BinaryOp.PLUS, binary(i(2), BinaryOp.TIMES, i(3)))),
        is(i(7)));
    assertThat(
        Compiles.optimize(
            binary(core.stringLiteral("a"), BinaryOp.PLUS, i(1))),
        is(core.stringLiteral("a1")));
    assertThat(
        Compiles.optimize(binary(i(1), BinaryOp.DIVIDE, i(4))),
        is(core.doubleLiteral(0.25)));
    assertThat(
        Compiles.optimize(
            core.ifThenElse(binary(i(1), BinaryOp.LT, i(2)),
                core.global("a"), core.global("b"))),
        is(core.global("a")));
    assertThat(
        Compiles.optimize(core.unary(UnaryOp.TYPEOF, i(1))),
        is(core.stringLiteral("number")));
    assertThat(
        Compiles.optimize(
            binary(core.boolLiteral(false), BinaryOp.OR, core.global("x"))),
        is(core.global("x")));
    assertThat(
        Compiles.optimize(core.sequential(i(1), core.global("x"))),
        hasToString("global.x"));

    // Not folded: division by zero, loose equality, operands with effects
    final Core.Exp divide = binary(i(1), BinaryOp.DIVIDE, i(0));
    assertThat(Compiles.optimize(divide), is(divide));
    final Core.Exp eq = binary(i(1), BinaryOp.EQ, core.stringLiteral("1"));
    assertThat(Compiles.optimize(eq), is(eq));
    final Core.Exp call =
        core.sequential(core.apply(core.global("f")), i(1));
    assertThat(Compiles.optimize(call), is(call));
    final Core.Exp deepRead =
        core.sequential(core.global("nope", "deeper"), i(1));
    assertThat(Compiles.optimize(deepRead), is(deepRead));

    final Preferences preferences =
        Preferences.READABLE.with(Prop.CONSTANT_FOLDING, false);
    final Core.Exp sum = binary(i(1), BinaryOp.PLUS, i(2));
    assertThat(Compiles.optimize(preferences, sum), sameInstance(sum));
    assertThat(Compiles.optimize(sum), not(is(sum)));
  }

  /** Folding happens inside lambdas and the scopes of binding forms. */
  @Test void testFoldingUnderBinders() {
    final Id x = Id.of("x");
    final Core.Exp exp =
        core.lambda(ImmutableList.of(x),
            core.let(Id.of("y"), binary(i(2), BinaryOp.TIMES, i(3)),
                core.var(x)));
    assertThat(Compiles.optimize(exp),
        hasToString("fun (x) -> let y = 6 in x"));
  }
}

// End OptimizerTest.java
