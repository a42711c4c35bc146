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

import java.util.List;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Visitor;

/** Visitor that keeps an environment of what identifiers are in scope. */
abstract class EnvVisitor extends Visitor {
  final Environment env;

  /** Creates an EnvVisitor. */
  protected EnvVisitor(Environment env) {
    this.env = env;
  }

  /** Creates a visitor the same as this but with a new environment. */
  protected abstract EnvVisitor push(Environment env);

  /** Creates a visitor the same as this but with overriding bindings. */
  protected EnvVisitor bind(List<Id> ids) {
    return ids.isEmpty() ? this : push(env.bindAll(ids));
  }

  @Override protected void visit(Core.Lambda lambda) {
    lambda.body.accept(bind(lambda.binders()));
  }
}

// End EnvVisitor.java
