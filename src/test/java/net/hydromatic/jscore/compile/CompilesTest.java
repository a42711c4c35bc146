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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Optional;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles}: normalization, free and mutable identifiers,
 * and substitution. */
public class CompilesTest {
  private static Core.Exp plus(Core.Exp left, Core.Exp right) {
    return core.binary(left, BinaryOp.PLUS, right);
  }

  /** An expression that binds the same identifier twice is not
   * alpha-normalized; normalizing it gives each binder a fresh identifier,
   * and keeps free identifiers. */
  @Test void testAlphaNormalize() {
    final Id x = Id.of("x");
    final Id y = Id.of("y");
    final Core.Exp exp =
        core.sequential(core.let(x, core.intLiteral(1), core.var(x)),
            core.let(x, core.intLiteral(2), plus(core.var(x), core.var(y))));
    assertThat(Compiles.isAlphaNormalized(exp), is(false));

    final Core.Exp exp2 = Compiles.alphaNormalize(exp);
    assertThat(Compiles.isAlphaNormalized(exp2), is(true));
    assertThat(exp2, hasToString(exp.toString()));
    assertThat(exp2, not(is(exp)));

    final Core.Sequential sequential = (Core.Sequential) exp2;
    final Id x1 = ((Core.Let) sequential.first).id;
    final Id x2 = ((Core.Let) sequential.second).id;
    assertThat(x1, not(is(x)));
    assertThat(x2, not(is(x)));
    assertThat(x1, not(is(x2)));
    assertThat(x1.name(), is("x"));

    assertThat(Compiles.freeIds(exp), is(ImmutableSortedSet.of(y)));
    assertThat(Compiles.freeIds(exp2), is(ImmutableSortedSet.of(y)));
    assertThat(Compiles.isGround(exp2), is(false));

    // Normalizing twice gives an expression of the same shape
    final Core.Exp exp3 = Compiles.alphaNormalize(exp2);
    assertThat(exp3, hasToString(exp2.toString()));
    assertThat(Compiles.isAlphaNormalized(exp3), is(true));
  }

  /** Each binding form introduces identifiers that alpha-normalization
   * renames, and that are not free. */
  @Test void testAlphaNormalizeBindingForms() {
    final Id f = Id.of("f");
    final Id i = Id.of("i");
    final Id k = Id.of("k");
    final Id e = Id.of("e");
    final Id self = Id.of("self");
    final Id x = Id.of("x");
    final Id y = Id.of("y");
    final Id o = Id.of("o");
    final Core.Exp letRec =
        core.letRec(f,
            core.lambda(ImmutableList.of(x),
                core.apply(core.var(f), plus(core.var(x), core.var(y)))),
            core.var(f));
    final Core.Exp forRange =
        core.forRange(i, core.intLiteral(1), core.var(y),
            core.apply(core.var(o), core.var(i)));
    final Core.Exp forEachField =
        core.forEachField(k, core.var(o),
            core.apply(core.var(o), core.var(k)));
    final Core.Exp tryWith =
        core.tryWith(core.apply(core.var(o)), e, core.var(e));
    final Core.Exp method =
        core.lambda(self, ImmutableList.of(x),
            core.fieldGet(core.var(self), core.var(x)));

    assertThat(Compiles.freeIds(letRec), is(ImmutableSortedSet.of(y)));
    assertThat(Compiles.freeIds(forRange), is(ImmutableSortedSet.of(y, o)));
    assertThat(Compiles.freeIds(forEachField), is(ImmutableSortedSet.of(o)));
    assertThat(Compiles.freeIds(tryWith), is(ImmutableSortedSet.of(o)));
    assertThat(Compiles.isGround(method), is(true));

    for (Core.Exp exp
        : ImmutableList.of(letRec, forRange, forEachField, tryWith, method)) {
      final Core.Exp twice = core.sequential(exp, exp);
      final String s = twice.toString();
      assertThat(s, Compiles.isAlphaNormalized(exp), is(true));
      assertThat(s, Compiles.isAlphaNormalized(twice), is(false));
      final Core.Exp normalized = Compiles.alphaNormalize(twice);
      assertThat(s, Compiles.isAlphaNormalized(normalized), is(true));
      assertThat(normalized, hasToString(s));
      assertThat(s, Compiles.freeIds(normalized), is(Compiles.freeIds(exp)));
    }

    final Core.Sequential methods =
        (Core.Sequential) Compiles.alphaNormalize(
            core.sequential(method, method));
    final Id self1 = ((Core.Lambda) methods.first).thisId;
    final Id self2 = ((Core.Lambda) methods.second).thisId;
    assertThat(self1, not(is(self)));
    assertThat(self2, not(is(self)));
    assertThat(self1, not(is(self2)));
    assertThat(self1.name(), is("self"));

    final Core.Sequential letRecs =
        (Core.Sequential) Compiles.alphaNormalize(
            core.sequential(letRec, letRec));
    final Id f1 = ((Core.LetRec) letRecs.first).bindings.get(0).getKey();
    final Id f2 = ((Core.LetRec) letRecs.second).bindings.get(0).getKey();
    assertThat(f1, not(is(f2)));
    assertThat(Compiles.freeIds(letRecs), is(ImmutableSortedSet.of(y)));
  }

  @Test void testAlphaNormalizeKeepsMutability() {
    final Id i = Id.of("i", true);
    final Core.Exp exp =
        core.let(i, core.intLiteral(0),
            core.sequential(core.varSet(i, core.intLiteral(1)),
                core.var(i)));
    final Core.Exp exp2 = Compiles.alphaNormalize(exp);
    final Core.Let let = (Core.Let) exp2;
    assertThat(let.id, not(is(i)));
    assertThat(let.id.mutable, is(true));
    assertThat(Compiles.mutableIds(exp2), is(ImmutableSortedSet.of(let.id)));
  }

  @Test void testFreeIds() {
    final Id f = Id.of("f");
    final Id n = Id.of("n");
    final Id e = Id.of("e");
    final Id log = Id.of("log");
    // let rec f = fun (n) -> f(n) in try f(1) with e -> log(e)
    final Core.Exp exp =
        core.letRec(f,
            core.lambda(ImmutableList.of(n),
                core.apply(core.var(f), core.var(n))),
            core.tryWith(core.apply(core.var(f), core.intLiteral(1)), e,
                core.apply(core.var(log), core.var(e))));
    assertThat(Compiles.freeIds(exp), is(ImmutableSortedSet.of(log)));
    assertThat(Compiles.isGround(exp), is(false));
    assertThat(Compiles.isGround(core.global("Math")), is(true));
    assertThat(Compiles.isGround(core.runtime()), is(true));

    // An assigned identifier is free if it is not bound
    final Id counter = Id.of("counter", true);
    final Core.Exp exp2 = core.varSet(counter, core.intLiteral(0));
    assertThat(Compiles.freeIds(exp2), is(ImmutableSortedSet.of(counter)));
  }

  /** A mutable counter is reported; an immutable "let" is not. */
  @Test void testMutableIds() {
    final Id counter = Id.of("counter", true);
    final Id k = Id.of("k");
    final Core.Exp exp =
        core.let(counter, core.intLiteral(0),
            core.let(k, core.intLiteral(1),
                core.sequential(
                    core.varSet(counter, plus(core.var(counter),
                        core.var(k))),
                    core.var(counter))));
    assertThat(Compiles.mutableIds(exp), is(ImmutableSortedSet.of(counter)));
    assertThat(
        Compiles.mutableIds(core.let(k, core.intLiteral(1), core.var(k))),
        hasSize(0));
  }

  @Test void testSubstitute() {
    final Id x = Id.of("x");
    final Id y = Id.of("y");
    final Core.Exp exp = plus(core.var(x), core.var(y));
    final Core.Exp exp2 =
        Compiles.substitute(ImmutableMap.of(x, core.intLiteral(3)), exp);
    assertThat(exp2, is(plus(core.intLiteral(3), core.var(y))));

    // Bound occurrences are not replaced
    final Core.Exp lambda =
        core.lambda(ImmutableList.of(x), plus(core.var(x), core.var(y)));
    final Core.Exp lambda2 =
        Compiles.substitute(ImmutableMap.of(x, core.intLiteral(3)), lambda);
    assertThat(lambda2, sameInstance(lambda));

    // An expression without free identifiers is returned as is
    final Core.Exp ground =
        core.lambda(ImmutableList.of(x), core.var(x));
    assertThat(
        Compiles.substitute(id -> Optional.of(core.intLiteral(0)), ground),
        sameInstance(ground));
  }

  /** Substituting "x" for "y" under a binder of "x" renames the binder, so
   * that the "x" that is substituted remains free. */
  @Test void testSubstituteAvoidsCapture() {
    final Id x = Id.of("x");
    final Id y = Id.of("y");
    final Core.Exp exp =
        core.lambda(ImmutableList.of(x), plus(core.var(x), core.var(y)));
    final Core.Exp exp2 =
        Compiles.substitute(ImmutableMap.of(y, core.var(x)), exp);
    assertThat(exp2, instanceOf(Core.Lambda.class));
    final Core.Lambda lambda = (Core.Lambda) exp2;
    final Id x2 = lambda.params.get(0);
    assertThat(x2, not(is(x)));
    assertThat(lambda.body, is(plus(core.var(x2), core.var(x))));
    assertThat(Compiles.freeIds(exp2), is(ImmutableSortedSet.of(x)));

    // A binder with the same name but a different identity captures
    // nothing, and is not renamed
    final Id otherX = Id.of("x");
    final Core.Exp exp3 =
        core.lambda(ImmutableList.of(otherX),
            plus(core.var(otherX), core.var(y)));
    final Core.Lambda lambda3 =
        (Core.Lambda) Compiles.substitute(ImmutableMap.of(y, core.var(x)),
            exp3);
    assertThat(lambda3.params.get(0), sameInstance(otherX));
    assertThat(lambda3.body, is(plus(core.var(otherX), core.var(x))));
  }

  /** An assignment to a substituted identifier is retargeted if the
   * replacement is a mutable variable, and is an error otherwise. */
  @Test void testSubstituteAssigned() {
    final Id i = Id.of("i", true);
    final Id j = Id.of("j", true);
    final Core.Exp exp = core.varSet(i, core.intLiteral(1));
    assertThat(Compiles.substitute(ImmutableMap.of(i, core.var(j)), exp),
        is(core.varSet(j, core.intLiteral(1))));

    final CompileException e =
        assertThrows(CompileException.class,
            () -> Compiles.substitute(
                ImmutableMap.of(i, core.intLiteral(2)), exp));
    assertThat(e.getMessage(),
        is("cannot substitute 2 for identifier 'i', which is assigned"));
  }
}

// End CompilesTest.java
