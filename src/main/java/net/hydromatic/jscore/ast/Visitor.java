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

/** Visits core expressions.
 *
 * <p>Each {@code visit} method by default visits the children of its node,
 * in the order given by {@link Core.Exp#fold}. The scope of a binding form
 * arrives at {@link #visit(Core.Lambda)}. */
public class Visitor {
  /** Visits an expression. */
  public void accept(Core.Exp exp) {
    exp.accept(this);
  }

  /** Visits the children of an expression. */
  protected void visitChildren(Core.Exp exp) {
    exp.forEachChild(this::accept);
  }

  protected void visit(Core.Apply apply) {
    visitChildren(apply);
  }

  protected void visit(Core.Binary binary) {
    visitChildren(binary);
  }

  protected void visit(Core.Call call) {
    visitChildren(call);
  }

  protected void visit(Core.Constant constant) {
    // leaf
  }

  protected void visit(Core.FieldDelete fieldDelete) {
    visitChildren(fieldDelete);
  }

  protected void visit(Core.FieldGet fieldGet) {
    visitChildren(fieldGet);
  }

  protected void visit(Core.FieldSet fieldSet) {
    visitChildren(fieldSet);
  }

  protected void visit(Core.ForEachField forEachField) {
    visitChildren(forEachField);
  }

  protected void visit(Core.ForRange forRange) {
    visitChildren(forRange);
  }

  protected void visit(Core.Global global) {
    // leaf
  }

  protected void visit(Core.If ifThenElse) {
    visitChildren(ifThenElse);
  }

  protected void visit(Core.Lambda lambda) {
    visitChildren(lambda);
  }

  protected void visit(Core.Let let) {
    visitChildren(let);
  }

  protected void visit(Core.LetRec letRec) {
    visitChildren(letRec);
  }

  protected void visit(Core.New newExp) {
    visitChildren(newExp);
  }

  protected void visit(Core.NewArray newArray) {
    visitChildren(newArray);
  }

  protected void visit(Core.NewObject newObject) {
    visitChildren(newObject);
  }

  protected void visit(Core.NewRegex newRegex) {
    // leaf
  }

  protected void visit(Core.Runtime runtime) {
    // leaf
  }

  protected void visit(Core.Sequential sequential) {
    visitChildren(sequential);
  }

  protected void visit(Core.Throw throwExp) {
    visitChildren(throwExp);
  }

  protected void visit(Core.TryFinally tryFinally) {
    visitChildren(tryFinally);
  }

  protected void visit(Core.TryWith tryWith) {
    visitChildren(tryWith);
  }

  protected void visit(Core.Unary unary) {
    visitChildren(unary);
  }

  protected void visit(Core.Var var) {
    // leaf
  }

  protected void visit(Core.VarSet varSet) {
    visitChildren(varSet);
  }

  protected void visit(Core.While whileLoop) {
    visitChildren(whileLoop);
  }
}

// End Visitor.java
