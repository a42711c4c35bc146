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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import org.mozilla.javascript.ast.AstNode;

/** Helpers for compilation.
 *
 * <p>Each method delegates to the class that implements the operation. */
public abstract class Compiles {
  private Compiles() {}

  /** Returns whether no identifier is introduced by more than one binder
   * in an expression. */
  public static boolean isAlphaNormalized(Core.Exp exp) {
    return BoundFinder.isAlphaNormalized(exp);
  }

  /** Returns an expression in which every bound identifier has been
   * replaced by a fresh copy. Free identifiers are unchanged. */
  public static Core.Exp alphaNormalize(Core.Exp exp) {
    return AlphaNormalizer.alphaNormalize(exp);
  }

  /** Returns the identifiers that are read or assigned in an expression but
   * are not bound within it. */
  public static ImmutableSortedSet<Id> freeIds(Core.Exp exp) {
    return FreeFinder.freeIds(exp);
  }

  /** Returns the identifiers in an expression that are assigned, or are
   * mutable. */
  public static ImmutableSortedSet<Id> mutableIds(Core.Exp exp) {
    return MutableFinder.mutableIds(exp);
  }

  /** Returns whether an expression has no free identifiers. */
  public static boolean isGround(Core.Exp exp) {
    return FreeFinder.freeIds(exp).isEmpty();
  }

  /** Replaces the free occurrences of identifiers in an expression,
   * renaming binders that would capture free identifiers of the
   * replacements. */
  public static Core.Exp substitute(
      Function<Id, Optional<Core.Exp>> lookup, Core.Exp exp) {
    return Replacer.substitute(lookup, exp);
  }

  /** Replaces the free occurrences of the identifiers in a map. */
  public static Core.Exp substitute(Map<Id, ? extends Core.Exp> map,
      Core.Exp exp) {
    return Replacer.substitute(map, exp);
  }

  /** Optimizes an expression with default preferences. */
  public static Core.Exp optimize(Core.Exp exp) {
    return Optimizer.optimize(Preferences.READABLE, exp);
  }

  public static Core.Exp optimize(Preferences preferences, Core.Exp exp) {
    return Optimizer.optimize(preferences, exp);
  }

  /** Converts a ground expression into a JavaScript expression. */
  public static AstNode toProgram(Preferences preferences, Core.Exp exp) {
    return Elaborator.toProgram(preferences, ImmutableMap.of(), exp);
  }

  /** Converts an expression into a JavaScript expression, using the given
   * names for its free identifiers. */
  public static AstNode toProgram(Preferences preferences,
      Map<Id, String> externals, Core.Exp exp) {
    return Elaborator.toProgram(preferences, externals, exp);
  }

  /** Converts JavaScript into a core expression, or returns empty. */
  public static Optional<Core.Exp> recognize(Preferences preferences,
      AstNode node) {
    return Recognizer.recognize(preferences, node);
  }

  /** Parses JavaScript and converts it into a core expression, or returns
   * empty. */
  public static Optional<Core.Exp> recognize(Preferences preferences,
      String source) {
    return Recognizer.recognize(preferences, source);
  }
}

// End Compiles.java
