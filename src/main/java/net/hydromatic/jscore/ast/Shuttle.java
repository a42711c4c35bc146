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

/** Visits and transforms core expressions.
 *
 * <p>Each {@code visit} method by default rebuilds its node from the
 * transformed children, using {@link Core.Exp#transform}. The scope of a
 * binding form arrives at {@link #visit(Core.Lambda)}. */
public class Shuttle {
  /** Transforms an expression. */
  public Core.Exp apply(Core.Exp exp) {
    return exp.accept(this);
  }

  /** Transforms the children of an expression, and rebuilds it. */
  protected Core.Exp visitChildren(Core.Exp exp) {
    return exp.transform(this::apply);
  }

  protected Core.Exp visit(Core.Apply apply) {
    return visitChildren(apply);
  }

  protected Core.Exp visit(Core.Binary binary) {
    return visitChildren(binary);
  }

  protected Core.Exp visit(Core.Call call) {
    return visitChildren(call);
  }

  protected Core.Exp visit(Core.Constant constant) {
    return constant; // leaf
  }

  protected Core.Exp visit(Core.FieldDelete fieldDelete) {
    return visitChildren(fieldDelete);
  }

  protected Core.Exp visit(Core.FieldGet fieldGet) {
    return visitChildren(fieldGet);
  }

  protected Core.Exp visit(Core.FieldSet fieldSet) {
    return visitChildren(fieldSet);
  }

  protected Core.Exp visit(Core.ForEachField forEachField) {
    return visitChildren(forEachField);
  }

  protected Core.Exp visit(Core.ForRange forRange) {
    return visitChildren(forRange);
  }

  protected Core.Exp visit(Core.Global global) {
    return global; // leaf
  }

  protected Core.Exp visit(Core.If ifThenElse) {
    return visitChildren(ifThenElse);
  }

  protected Core.Exp visit(Core.Lambda lambda) {
    return visitChildren(lambda);
  }

  protected Core.Exp visit(Core.Let let) {
    return visitChildren(let);
  }

  protected Core.Exp visit(Core.LetRec letRec) {
    return visitChildren(letRec);
  }

  protected Core.Exp visit(Core.New newExp) {
    return visitChildren(newExp);
  }

  protected Core.Exp visit(Core.NewArray newArray) {
    return visitChildren(newArray);
  }

  protected Core.Exp visit(Core.NewObject newObject) {
    return visitChildren(newObject);
  }

  protected Core.Exp visit(Core.NewRegex newRegex) {
    return newRegex; // leaf
  }

  protected Core.Exp visit(Core.Runtime runtime) {
    return runtime; // leaf
  }

  protected Core.Exp visit(Core.Sequential sequential) {
    return visitChildren(sequential);
  }

  protected Core.Exp visit(Core.Throw throwExp) {
    return visitChildren(throwExp);
  }

  protected Core.Exp visit(Core.TryFinally tryFinally) {
    return visitChildren(tryFinally);
  }

  protected Core.Exp visit(Core.TryWith tryWith) {
    return visitChildren(tryWith);
  }

  protected Core.Exp visit(Core.Unary unary) {
    return visitChildren(unary);
  }

  protected Core.Exp visit(Core.Var var) {
    return var; // leaf
  }

  protected Core.Exp visit(Core.VarSet varSet) {
    return visitChildren(varSet);
  }

  protected Core.Exp visit(Core.While whileLoop) {
    return visitChildren(whileLoop);
  }
}

// End Shuttle.java
