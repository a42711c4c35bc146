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

import com.google.common.collect.ImmutableSortedSet;
import java.util.function.Consumer;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;

/** Finds free identifiers in an expression. */
class FreeFinder extends EnvVisitor {
  final Consumer<Id> consumer;

  protected FreeFinder(Environment env, Consumer<Id> consumer) {
    super(env);
    this.consumer = consumer;
  }

  /** Finds the identifiers that are read or assigned in an expression but
   * not bound within it, ordered by creation. */
  public static ImmutableSortedSet<Id> freeIds(Core.Exp exp) {
    final ImmutableSortedSet.Builder<Id> set =
        ImmutableSortedSet.naturalOrder();
    exp.accept(new FreeFinder(Environment.empty(), set::add));
    return set.build();
  }

  @Override protected EnvVisitor push(Environment env) {
    return new FreeFinder(env, consumer);
  }

  @Override protected void visit(Core.Var var) {
    if (!env.isBound(var.id)) {
      consumer.accept(var.id);
    }
  }

  @Override protected void visit(Core.VarSet varSet) {
    if (!env.isBound(varSet.id)) {
      consumer.accept(varSet.id);
    }
    super.visit(varSet);
  }
}

// End FreeFinder.java
