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

import java.util.function.UnaryOperator;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;

/** Replaces every bound identifier with a fresh copy, so that no identifier
 * is bound more than once. Free identifiers are unchanged. */
class AlphaNormalizer extends EnvShuttle {
  private AlphaNormalizer(Environment env) {
    super(env);
  }

  static Core.Exp alphaNormalize(Core.Exp exp) {
    return new AlphaNormalizer(Environment.empty()).apply(exp);
  }

  @Override protected EnvShuttle push(Environment env) {
    return new AlphaNormalizer(env);
  }

  @Override protected UnaryOperator<Id> binder(Core.Lambda lambda) {
    return Id::copy;
  }
}

// End AlphaNormalizer.java
