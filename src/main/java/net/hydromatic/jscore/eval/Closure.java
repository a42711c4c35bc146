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

import static java.util.Objects.requireNonNull;

import java.util.List;
import net.hydromatic.jscore.ast.Core;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Value of a lambda: the lambda and the environment in which it was
 * created. */
public class Closure implements Applicable {
  private final Interpreter interpreter;
  /** Environment for evaluation. Contains the variables "captured" from the
   * environment when the closure was created. */
  private final EvalEnv env;
  private final Core.Lambda lambda;

  Closure(Interpreter interpreter, EvalEnv env, Core.Lambda lambda) {
    this.interpreter = requireNonNull(interpreter);
    this.env = requireNonNull(env);
    this.lambda = requireNonNull(lambda);
  }

  @Override public String toString() {
    return "Closure(" + lambda + ")";
  }

  @Override public @Nullable Object apply(@Nullable Object receiver,
      List<@Nullable Object> args) {
    EvalEnv env2 = env;
    if (lambda.thisId != null) {
      env2 = env2.bind(lambda.thisId, receiver);
    }
    return interpreter.eval(env2.bindAll(lambda.params, args), lambda.body);
  }
}

// End Closure.java
