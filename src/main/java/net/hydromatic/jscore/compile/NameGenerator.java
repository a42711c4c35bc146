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

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.jscore.ast.AstWriter;
import net.hydromatic.jscore.ast.Id;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates unique JavaScript names.
 *
 * <p>Also keeps track of how many times each given name has been used in
 * this program, so that a new occurrence of a name can be given a fresh
 * ordinal. Never generates a reserved word, a name of the host environment,
 * or any other name that has been declared taken.
 */
public class NameGenerator {
  /** Reserved words of JavaScript, including future reserved words and
   * literals. */
  public static final ImmutableSet<String> RESERVED_WORDS =
      ImmutableSet.of("abstract", "arguments", "await", "boolean", "break",
          "byte", "case", "catch", "char", "class", "const", "continue",
          "debugger", "default", "delete", "do", "double", "else", "enum",
          "eval", "export", "extends", "false", "final", "finally", "float",
          "for", "function", "goto", "if", "implements", "import", "in",
          "instanceof", "int", "interface", "let", "long", "native", "new",
          "null", "package", "private", "protected", "public", "return",
          "short", "static", "super", "switch", "synchronized", "this",
          "throw", "throws", "transient", "true", "try", "typeof", "var",
          "void", "volatile", "while", "with", "yield");

  /** Names of the host environment that generated code must not
   * shadow. */
  public static final ImmutableSet<String> HOST_NAMES =
      ImmutableSet.of("undefined", "NaN", "Infinity", "arguments", "eval");

  private final Prop.Naming naming;
  private final Set<String> taken = new HashSet<>();
  private int id = 0;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  public NameGenerator(Prop.Naming naming) {
    this.naming = requireNonNull(naming);
    taken.addAll(RESERVED_WORDS);
    taken.addAll(HOST_NAMES);
  }

  /** Declares that a name is taken, and must not be generated. */
  public void reserve(String name) {
    taken.add(name);
  }

  /** Generates a compact name that is unique in this program. */
  public String get() {
    for (;;) {
      final String name = compactName(id++);
      if (taken.add(name)) {
        return name;
      }
    }
  }

  /** Generates a name for an identifier, unique in this program. */
  public String get(Id id) {
    if (naming == Prop.Naming.COMPACT) {
      return get();
    }
    final String hint = sanitize(id.name());
    if (taken.add(hint)) {
      return hint;
    }
    for (;;) {
      final String name = hint + inc(hint);
      if (taken.add(name)) {
        return name;
      }
    }
  }

  /** Returns the number of times that "name" has been used for a
   * variable. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(1))
        .getAndIncrement();
  }

  /** Returns the {@code i}th name in the sequence "a", "b", ..., "z", "aa",
   * "ab", .... */
  static String compactName(int i) {
    final StringBuilder b = new StringBuilder();
    int n = i + 1;
    while (n > 0) {
      n--;
      b.append((char) ('a' + n % 26));
      n /= 26;
    }
    return b.reverse().toString();
  }

  /** Converts a name hint into a valid identifier. */
  static String sanitize(@Nullable String hint) {
    if (hint == null || hint.isEmpty()) {
      return "x";
    }
    final StringBuilder b = new StringBuilder();
    if (Character.isDigit(hint.charAt(0))) {
      b.append('_');
    }
    for (int i = 0; i < hint.length(); i++) {
      final char c = hint.charAt(i);
      b.append(AstWriter.isIdentifier(String.valueOf(c))
          || Character.isDigit(c) ? c : '_');
    }
    return b.toString();
  }
}

// End NameGenerator.java
