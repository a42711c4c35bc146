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

import static net.hydromatic.jscore.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.jscore.compile.CompileException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Core} and {@link CoreBuilder}. */
public class CoreTest {
  private static Core.Exp i(long i) {
    return core.intLiteral(i);
  }

  @Test void testToString() {
    assertThat(
        core.binary(i(1), BinaryOp.PLUS, core.binary(i(2), BinaryOp.TIMES, i(3))),
        hasToString("1 + 2 * 3"));
    assertThat(
        core.binary(core.binary(i(1), BinaryOp.PLUS, i(2)), BinaryOp.TIMES,
            i(3)),
        hasToString("(1 + 2) * 3"));

    final Id x = Id.of("x");
    assertThat(
        core.let(x, i(1), core.binary(core.var(x), BinaryOp.PLUS, i(1))),
        hasToString("let x = 1 in x + 1"));

    final Id f = Id.of("f");
    final Id n = Id.of("n");
    assertThat(
        core.lambda(ImmutableList.of(n),
            core.apply(core.var(f),
                core.binary(core.var(n), BinaryOp.MINUS, i(1)))),
        hasToString("fun (n) -> f(n - 1)"));

    final Id c = Id.of("c");
    assertThat(core.ifThenElse(core.var(c), i(1), i(2)),
        hasToString("if c then 1 else 2"));

    final Id counter = Id.of("i", true);
    assertThat(
        core.sequential(core.varSet(counter, i(1)), core.var(counter)),
        hasToString("i := 1; i"));
  }

  @Test void testToStringAtoms() {
    assertThat(core.global("Math", "max"), hasToString("global.Math.max"));
    assertThat(core.global("a b"), hasToString("global[\"a b\"]"));
    assertThat(core.runtime(), hasToString("runtime"));

    final Id o = Id.of("o");
    assertThat(core.fieldGet(core.var(o), "x"), hasToString("o.x"));
    assertThat(core.fieldGet(core.var(o), i(1)), hasToString("o[1]"));
    assertThat(core.newArray(i(1), core.stringLiteral("a")),
        hasToString("[1, \"a\"]"));
    assertThat(core.newRegex("/a+/g"), hasToString("/a+/g"));
    assertThat(core.undefined(), hasToString("undefined"));
    assertThat(core.doubleLiteral(2.5), hasToString("2.5"));
    assertThat(core.doubleLiteral(2d), hasToString("2"));
  }

  @Test void testLiteral() {
    assertThat(Literal.of(1.5).isNumber(), is(true));
    assertThat(Literal.of(7L).doubleValue(), is(7d));
    assertThat(Literal.of("a\"b"), hasToString("\"a\\\"b\""));
    assertThat(Literal.of(""), hasToString("\"\""));
    assertThat(Literal.of("").truthy(), is(false));
    assertThat(Literal.of(Double.NaN).truthy(), is(false));
    assertThat(Literal.NULL.typeOf(), is("object"));
    assertThat(Literal.of(true), sameInstance(Literal.TRUE));
    assertThrows(IllegalStateException.class, () -> Literal.TRUE.longValue());
  }

  /** Identifiers are equal only if they are the same object, regardless of
   * their names, and are ordered by creation. */
  @Test void testId() {
    final Id a = Id.of("a");
    final Id a2 = Id.of("a");
    final Id b = a.copy();
    assertThat(a.equals(a2), is(false));
    assertThat(a, hasToString(a2.toString()));
    assertThat(b.name(), is("a"));
    assertThat(b.mutable, is(false));
    assertThat(a.copy(true).mutable, is(true));
    assertThat(a.compareTo(a2), lessThan(0));
    assertThat(a2.compareTo(b), lessThan(0));
    a.setName("z");
    assertThat(a, hasToString("z"));
    assertThat(Id.of(), hasToString(not("")));
  }

  @Test void testEquals() {
    final Id x = Id.of("x");
    final Id y = Id.of("x");
    final Core.Exp e1 =
        core.lambda(ImmutableList.of(x),
            core.binary(core.var(x), BinaryOp.PLUS, i(1)));
    final Core.Exp e2 =
        core.lambda(ImmutableList.of(x),
            core.binary(core.var(x), BinaryOp.PLUS, i(1)));
    final Core.Exp e3 =
        core.lambda(ImmutableList.of(y),
            core.binary(core.var(y), BinaryOp.PLUS, i(1)));
    assertThat(e1, is(e2));
    assertThat(e1.hashCode(), is(e2.hashCode()));
    // Same string, but a different identifier
    assertThat(e1, hasToString(e3.toString()));
    assertThat(e1, not(is(e3)));
  }

  /** Transforming with the identity function returns the same object. */
  @Test void testTransformIdentity() {
    final Id x = Id.of("x");
    final Id f = Id.of("f");
    final Id e = Id.of("e");
    final List<Core.Exp> exps =
        ImmutableList.of(
            core.let(x, i(1), core.var(x)),
            core.letRec(f, core.lambda(ImmutableList.of(x), core.var(x)),
                core.apply(core.var(f), i(2))),
            core.forRange(x, i(1), i(3), core.var(x)),
            core.forEachField(x, core.newObject(ImmutableList.of()),
                core.var(x)),
            core.tryWith(core.throwExp(i(1)), e, core.var(e)),
            core.call(core.global("Math"), "max", i(1), i(2)),
            core.newObject(
                ImmutableList.of(Maps.immutableEntry("a", i(1)))));
    for (Core.Exp exp : exps) {
      assertThat(exp.transform(c -> c), sameInstance(exp));
    }
  }

  /** Tests that {@link Core.Exp#fold} presents the scope of a "let" as a
   * lambda, after the value. */
  @Test void testFold() {
    final Id x = Id.of("x");
    final Core.Exp let = core.let(x, i(1), core.var(x));
    final List<Core.Exp> children = new ArrayList<>();
    let.forEachChild(children::add);
    assertThat(children, hasSize(2));
    assertThat(children.get(0), is(i(1)));
    assertThat(children.get(1),
        is(core.lambda(ImmutableList.of(x), core.var(x))));

    // Values and body of a recursive group are packed into one scope
    final Id f = Id.of("f");
    final Id g = Id.of("g");
    final Core.Exp letRec =
        core.letRec(
            ImmutableList.of(Maps.immutableEntry(f, core.var(g)),
                Maps.immutableEntry(g, core.var(f))),
            i(0));
    final List<Core.Exp> children2 = new ArrayList<>();
    letRec.forEachChild(children2::add);
    assertThat(children2,
        is(
            ImmutableList.of(
                core.lambda(ImmutableList.of(f, g),
                    core.newArray(core.var(g), core.var(f), i(0))))));

    // Evaluation order: condition, then the branches
    final List<Core.Exp> children3 =
        core.ifThenElse(i(1), i(2), i(3))
            .fold(new ArrayList<>(), (list, e) -> {
              list.add(e);
              return list;
            });
    assertThat(children3, is(ImmutableList.of(i(1), i(2), i(3))));

    assertThat(let.size(), is(4));
  }

  /** If the scope of a "let" is transformed into something other than a
   * lambda, the "let" becomes an application. */
  @Test void testLetFallback() {
    final Id x = Id.of("x");
    final Id f = Id.of("f");
    final Core.Exp let = core.let(x, i(1), core.var(x));
    final Core.Exp exp =
        let.transform(e -> e instanceof Core.Lambda ? core.var(f) : e);
    assertThat(exp, is(core.apply(core.var(f), i(1))));
  }

  @Test void testBadScope() {
    final Id x = Id.of("x");
    final Core.Exp forRange = core.forRange(x, i(1), i(2), core.var(x));
    assertThrows(IllegalStateException.class,
        () -> forRange.transform(e -> e instanceof Core.Lambda ? i(0) : e));

    final Id f = Id.of("f");
    final Core.Exp letRec = core.letRec(f, i(1), core.var(f));
    assertThrows(IllegalStateException.class,
        () -> letRec.transform(e ->
            core.lambda(((Core.Lambda) e).params, i(0))));
  }

  @Test void testValidation() {
    final Id x = Id.of("x");
    final CompileException e =
        assertThrows(CompileException.class,
            () -> core.varSet(x, i(1)));
    assertThat(e.getMessage(), is("cannot assign immutable identifier 'x'"));
    assertThrows(IllegalArgumentException.class, () -> core.global("a", ""));
    assertThrows(IllegalArgumentException.class,
        () -> core.lambda(ImmutableList.of(x, x), i(0)));
    assertThrows(IllegalArgumentException.class,
        () -> core.letRec(
            ImmutableList.of(Maps.immutableEntry(x, i(1)),
                Maps.immutableEntry(x, i(2))),
            i(0)));
    assertThrows(IllegalArgumentException.class,
        () -> core.newObject(
            ImmutableList.of(Maps.immutableEntry("a", i(1)),
                Maps.immutableEntry("a", i(2)))));
    assertThrows(IllegalArgumentException.class,
        () -> core.newRegex("abc"));
    assertThat(core.newRegex("/a+/gi"), instanceOf(Core.NewRegex.class));
    assertThat(((Core.NewRegex) core.newRegex("/a+/gi")).flags(), is("gi"));
  }

  /** Tests that a {@link Shuttle} that replaces constants rebuilds only the
   * nodes above the constants that changed. */
  @Test void testShuttle() {
    final Id x = Id.of("x");
    final Core.Exp unchanged = core.var(x);
    final Core.Exp exp =
        core.sequential(unchanged,
            core.binary(i(1), BinaryOp.PLUS, i(2)));
    final Core.Exp exp2 =
        exp.accept(new Shuttle() {
          @Override protected Core.Exp visit(Core.Constant constant) {
            return core.intLiteral(constant.literal.longValue() * 10);
          }
        });
    assertThat(exp2, hasToString("x; 10 + 20"));
    assertThat(((Core.Sequential) exp2).first, sameInstance(unchanged));
  }
}

// End CoreTest.java
