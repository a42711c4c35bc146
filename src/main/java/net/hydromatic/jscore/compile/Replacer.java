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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.jscore.ast.CoreBuilder.core;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;

/** Replaces free identifiers with expressions, renaming binders that would
 * capture identifiers of the replacement expressions. */
public class Replacer extends EnvShuttle {
  protected final Function<Id, Optional<Core.Exp>> lookup;

  private Replacer(Environment env,
      Function<Id, Optional<Core.Exp>> lookup) {
    super(env);
    this.lookup = requireNonNull(lookup);
  }

  /** Substitutes free identifiers in an expression. Returns the expression
   * itself if {@code lookup} has no replacement for any of them. */
  static Core.Exp substitute(Function<Id, Optional<Core.Exp>> lookup,
      Core.Exp exp) {
    if (FreeFinder.freeIds(exp).stream()
        .noneMatch(id -> lookup.apply(id).isPresent())) {
      return exp;
    }
    return new Replacer(Environment.empty(), lookup).apply(exp);
  }

  static Core.Exp substitute(Map<Id, ? extends Core.Exp> substitution,
      Core.Exp exp) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return substitute(id -> Optional.ofNullable(substitution.get(id)), exp);
  }

  @Override protected Replacer push(Environment env) {
    return new Replacer(env, lookup);
  }

  @Override protected UnaryOperator<Id> binder(Core.Lambda lambda) {
    // Identifiers that occur free in the replacement of an identifier that
    // is free in the lambda, and that the lambda would capture
    final Set<Id> captured = new HashSet<>();
    for (Id id : FreeFinder.freeIds(lambda)) {
      if (!env.isBound(id)) {
        lookup.apply(id)
            .ifPresent(exp -> captured.addAll(FreeFinder.freeIds(exp)));
      }
    }
    if (captured.isEmpty()) {
      return UnaryOperator.identity();
    }
    return id -> captured.contains(id) ? id.copy() : id;
  }

  @Override protected Core.Exp visitFree(Core.Var var) {
    return lookup.apply(var.id).orElse(var);
  }

  @Override protected Core.Exp visitFreeSet(Core.VarSet varSet,
      Core.Exp value) {
    final Optional<Core.Exp> replacement = lookup.apply(varSet.id);
    if (!replacement.isPresent()) {
      return varSet.copy(varSet.id, value);
    }
    final Core.Exp exp = replacement.get();
    if (exp instanceof Core.Var && ((Core.Var) exp).id.mutable) {
      return core.varSet(((Core.Var) exp).id, value);
    }
    throw new CompileException("cannot substitute " + exp
        + " for identifier '" + varSet.id + "', which is assigned");
  }
}

// End Replacer.java
