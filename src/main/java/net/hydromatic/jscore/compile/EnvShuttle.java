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

import com.google.common.collect.ImmutableList;
import java.util.function.UnaryOperator;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Shuttle;

/**
 * Shuttle that keeps an environment of what identifiers are in scope, and
 * that may rename the identifiers bound by each lambda.
 */
abstract class EnvShuttle extends Shuttle {
  final Environment env;

  /** Creates an EnvShuttle. */
  protected EnvShuttle(Environment env) {
    this.env = env;
  }

  /** Creates a shuttle the same as this but with a new environment. */
  protected abstract EnvShuttle push(Environment env);

  /** Returns the function that renames the binders of a lambda. */
  protected abstract UnaryOperator<Id> binder(Core.Lambda lambda);

  /** Called for a read of an identifier that is not in scope. */
  protected Core.Exp visitFree(Core.Var var) {
    return var;
  }

  /** Called for an assignment to an identifier that is not in scope;
   * {@code value} is the transformed value. */
  protected Core.Exp visitFreeSet(Core.VarSet varSet, Core.Exp value) {
    return varSet.copy(varSet.id, value);
  }

  @Override protected Core.Exp visit(Core.Lambda lambda) {
    final UnaryOperator<Id> binder = binder(lambda);
    Environment env2 = env;
    Id thisId2 = null;
    if (lambda.thisId != null) {
      thisId2 = binder.apply(lambda.thisId);
      env2 = env2.bind(lambda.thisId, thisId2);
    }
    final ImmutableList.Builder<Id> params2 = ImmutableList.builder();
    for (Id param : lambda.params) {
      final Id param2 = binder.apply(param);
      params2.add(param2);
      env2 = env2.bind(param, param2);
    }
    final Core.Exp body2 = push(env2).apply(lambda.body);
    return lambda.copy(thisId2, params2.build(), body2);
  }

  @Override protected Core.Exp visit(Core.Var var) {
    final Id id2 = env.getOpt(var.id);
    if (id2 == null) {
      return visitFree(var);
    }
    return id2 == var.id ? var : core.var(id2);
  }

  @Override protected Core.Exp visit(Core.VarSet varSet) {
    final Core.Exp value2 = apply(varSet.value);
    final Id id2 = env.getOpt(varSet.id);
    if (id2 == null) {
      return visitFreeSet(varSet, value2);
    }
    return varSet.copy(id2, value2);
  }
}

// End EnvShuttle.java
