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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.jscore.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds core expressions. */
public enum CoreBuilder {
  /** The singleton instance of the CORE builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.Constant trueConstant = new Core.Constant(Literal.TRUE);
  private final Core.Constant falseConstant =
      new Core.Constant(Literal.FALSE);
  private final Core.Constant nullConstant = new Core.Constant(Literal.NULL);
  private final Core.Constant undefinedConstant =
      new Core.Constant(Literal.UNDEFINED);
  private final Core.Runtime runtime = new Core.Runtime();

  /** Creates a constant. */
  public Core.Constant constant(Literal literal) {
    switch (literal.kind) {
    case TRUE:
      return trueConstant;
    case FALSE:
      return falseConstant;
    case NULL:
      return nullConstant;
    case UNDEFINED:
      return undefinedConstant;
    default:
      return new Core.Constant(literal);
    }
  }

  /** Creates a boolean constant. */
  public Core.Constant boolLiteral(boolean b) {
    return b ? trueConstant : falseConstant;
  }

  /** Creates an integer constant. */
  public Core.Constant intLiteral(long i) {
    return new Core.Constant(Literal.of(i));
  }

  /** Creates a double constant. */
  public Core.Constant doubleLiteral(double d) {
    return new Core.Constant(Literal.of(d));
  }

  /** Creates a string constant. */
  public Core.Constant stringLiteral(String s) {
    return new Core.Constant(Literal.of(s));
  }

  public Core.Constant nullLiteral() {
    return nullConstant;
  }

  public Core.Constant undefined() {
    return undefinedConstant;
  }

  public Core.Apply apply(Core.Exp fn, List<? extends Core.Exp> args) {
    return new Core.Apply(fn, ImmutableList.copyOf(args));
  }

  public Core.Apply apply(Core.Exp fn, Core.Exp... args) {
    return new Core.Apply(fn, ImmutableList.copyOf(args));
  }

  public Core.Binary binary(Core.Exp left, BinaryOp op, Core.Exp right) {
    return new Core.Binary(left, op, right);
  }

  public Core.Call call(Core.Exp receiver, Core.Exp method,
      List<? extends Core.Exp> args) {
    return new Core.Call(receiver, method, ImmutableList.copyOf(args));
  }

  /** Creates a call to a method whose name is known. */
  public Core.Call call(Core.Exp receiver, String method,
      Core.Exp... args) {
    return call(receiver, stringLiteral(method), ImmutableList.copyOf(args));
  }

  /** Creates a constructor invocation, "new C(args)". */
  public Core.New construct(Core.Exp constructor,
      List<? extends Core.Exp> args) {
    return new Core.New(constructor, ImmutableList.copyOf(args));
  }

  public Core.New construct(Core.Exp constructor, Core.Exp... args) {
    return new Core.New(constructor, ImmutableList.copyOf(args));
  }

  public Core.FieldDelete fieldDelete(Core.Exp object, Core.Exp key) {
    return new Core.FieldDelete(object, key);
  }

  public Core.FieldGet fieldGet(Core.Exp object, Core.Exp key) {
    return new Core.FieldGet(object, key);
  }

  /** Creates an access to a field whose name is known. */
  public Core.FieldGet fieldGet(Core.Exp object, String name) {
    return new Core.FieldGet(object, stringLiteral(name));
  }

  public Core.FieldSet fieldSet(Core.Exp object, Core.Exp key,
      Core.Exp value) {
    return new Core.FieldSet(object, key, value);
  }

  public Core.ForEachField forEachField(Id id, Core.Exp object,
      Core.Exp body) {
    return new Core.ForEachField(id, object, body);
  }

  public Core.ForRange forRange(Id id, Core.Exp lower, Core.Exp upper,
      Core.Exp body) {
    return new Core.ForRange(id, lower, upper, body);
  }

  /** Creates a reference to the global object ({@code path} is empty) or to
   * a value reachable from it. */
  public Core.Global global(List<String> path) {
    for (String segment : path) {
      checkArgument(!segment.isEmpty(), "empty segment in global path %s",
          path);
    }
    return new Core.Global(ImmutableList.copyOf(path));
  }

  public Core.Global global(String... path) {
    return global(ImmutableList.copyOf(path));
  }

  public Core.If ifThenElse(Core.Exp condition, Core.Exp ifTrue,
      Core.Exp ifFalse) {
    return new Core.If(condition, ifTrue, ifFalse);
  }

  public Core.Lambda lambda(@Nullable Id thisId, List<Id> params,
      Core.Exp body) {
    final Set<Id> ids = new HashSet<>();
    if (thisId != null) {
      ids.add(thisId);
    }
    for (Id param : params) {
      checkArgument(ids.add(param), "duplicate parameter %s", param);
    }
    return new Core.Lambda(thisId, ImmutableList.copyOf(params), body);
  }

  public Core.Lambda lambda(List<Id> params, Core.Exp body) {
    return lambda(null, params, body);
  }

  public Core.Let let(Id id, Core.Exp value, Core.Exp body) {
    return new Core.Let(id, value, body);
  }

  public Core.LetRec letRec(List<Map.Entry<Id, Core.Exp>> bindings,
      Core.Exp body) {
    return new Core.LetRec(ImmutableList.copyOf(bindings), body);
  }

  /** Creates a recursive "let" with a single binding. */
  public Core.LetRec letRec(Id id, Core.Exp value, Core.Exp body) {
    return letRec(ImmutableList.of(Maps.immutableEntry(id, value)), body);
  }

  public Core.NewArray newArray(List<? extends Core.Exp> elements) {
    return new Core.NewArray(ImmutableList.copyOf(elements));
  }

  public Core.NewArray newArray(Core.Exp... elements) {
    return new Core.NewArray(ImmutableList.copyOf(elements));
  }

  /** Creates an object literal. Field names must be distinct. */
  public Core.NewObject newObject(List<Map.Entry<String, Core.Exp>> fields) {
    final Set<String> names = new HashSet<>();
    for (Map.Entry<String, Core.Exp> field : fields) {
      checkArgument(names.add(field.getKey()), "duplicate field %s",
          field.getKey());
    }
    return new Core.NewObject(ImmutableList.copyOf(fields));
  }

  public Core.NewRegex newRegex(String pattern) {
    return new Core.NewRegex(pattern);
  }

  public Core.Runtime runtime() {
    return runtime;
  }

  public Core.Sequential sequential(Core.Exp first, Core.Exp second) {
    return new Core.Sequential(first, second);
  }

  /** Creates a sequence of expressions, nested to the right; returns the
   * single expression if the list has one element. */
  public Core.Exp sequential(List<? extends Core.Exp> exps) {
    checkArgument(!exps.isEmpty(), "empty sequence");
    Core.Exp exp = exps.get(exps.size() - 1);
    for (int i = exps.size() - 2; i >= 0; i--) {
      exp = sequential(exps.get(i), exp);
    }
    return exp;
  }

  public Core.Throw throwExp(Core.Exp exp) {
    return new Core.Throw(exp);
  }

  public Core.TryFinally tryFinally(Core.Exp body, Core.Exp handler) {
    return new Core.TryFinally(body, handler);
  }

  public Core.TryWith tryWith(Core.Exp body, Id id, Core.Exp handler) {
    return new Core.TryWith(body, id, handler);
  }

  public Core.Unary unary(UnaryOp op, Core.Exp operand) {
    return new Core.Unary(op, operand);
  }

  public Core.Var var(Id id) {
    return new Core.Var(id);
  }

  /** Creates an assignment to a mutable identifier.
   *
   * @throws CompileException if the identifier is not mutable */
  public Core.VarSet varSet(Id id, Core.Exp value) {
    if (!id.mutable) {
      throw new CompileException("cannot assign immutable identifier '"
          + id + "'");
    }
    return new Core.VarSet(id, value);
  }

  public Core.While whileLoop(Core.Exp condition, Core.Exp body) {
    return new Core.While(condition, body);
  }
}

// End CoreBuilder.java
