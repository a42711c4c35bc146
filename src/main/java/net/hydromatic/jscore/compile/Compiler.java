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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.mozilla.javascript.ast.AstNode;

/** Compiles a core expression to JavaScript.
 *
 * <p>The pipeline optimizes the expression, elaborates it into a JavaScript
 * syntax tree, and renders the tree as source code. The {@link Tracer} is
 * called after each step. */
public class Compiler {
  private final Preferences preferences;
  private final Tracer tracer;

  public Compiler(Preferences preferences, Tracer tracer) {
    this.preferences = requireNonNull(preferences);
    this.tracer = requireNonNull(tracer);
  }

  /** Compiles a ground expression. */
  public @Nullable Result compile(Core.Exp exp) {
    return compile(ImmutableMap.of(), exp);
  }

  /** Compiles an expression whose free identifiers have the given names.
   *
   * <p>If a {@link CompileException} occurs and the tracer handles it,
   * returns null; otherwise the exception is rethrown. */
  public @Nullable Result compile(Map<Id, String> externals, Core.Exp exp) {
    try {
      tracer.onCore(0, exp);
      final Core.Exp exp2 = Optimizer.optimize(preferences, exp);
      tracer.onCore(1, exp2);
      final AstNode program =
          Elaborator.toProgram(preferences, externals, exp2);
      tracer.onProgram(program);
      return new Result(exp2, program, program.toSource(),
          FreeFinder.freeIds(exp2), MutableFinder.mutableIds(exp2));
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
      return null;
    }
  }

  /** Result of compiling an expression. */
  public static class Result {
    /** The expression after optimization. */
    public final Core.Exp exp;
    public final AstNode program;
    /** JavaScript source code. */
    public final String code;
    public final ImmutableSortedSet<Id> freeIds;
    public final ImmutableSortedSet<Id> mutableIds;

    Result(Core.Exp exp, AstNode program, String code,
        ImmutableSortedSet<Id> freeIds, ImmutableSortedSet<Id> mutableIds) {
      this.exp = requireNonNull(exp);
      this.program = requireNonNull(program);
      this.code = requireNonNull(code);
      this.freeIds = requireNonNull(freeIds);
      this.mutableIds = requireNonNull(mutableIds);
    }
  }
}

// End Compiler.java
