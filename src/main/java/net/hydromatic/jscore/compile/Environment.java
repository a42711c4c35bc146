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

import java.util.List;
import net.hydromatic.jscore.ast.Id;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Identifiers that are in scope, each mapped to the identifier that
 * replaces it.
 *
 * <p>Immutable. A pass that does not rename binders maps each identifier to
 * itself. */
public abstract class Environment {
  private static final Environment EMPTY = new EmptyEnvironment();

  Environment() {}

  /** Returns an environment with nothing in scope. */
  public static Environment empty() {
    return EMPTY;
  }

  /** Returns the identifier that replaces {@code id}, or null if {@code id}
   * is not in scope. */
  public abstract @Nullable Id getOpt(Id id);

  /** Returns whether an identifier is in scope. */
  public boolean isBound(Id id) {
    return getOpt(id) != null;
  }

  /** Creates an environment that is the same as this, plus an identifier
   * that replaces {@code id}. */
  public Environment bind(Id id, Id replacement) {
    return new SubEnvironment(this, id, replacement);
  }

  /** Creates an environment that is the same as this, plus some
   * identifiers, each of which replaces itself. */
  public Environment bindAll(List<Id> ids) {
    Environment env = this;
    for (Id id : ids) {
      env = env.bind(id, id);
    }
    return env;
  }

  /** Environment that has nothing in scope. */
  private static class EmptyEnvironment extends Environment {
    @Override public @Nullable Id getOpt(Id id) {
      return null;
    }
  }

  /** Environment that is its parent plus one identifier. */
  private static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Id id;
    private final Id replacement;

    SubEnvironment(Environment parent, Id id, Id replacement) {
      this.parent = requireNonNull(parent);
      this.id = requireNonNull(id);
      this.replacement = requireNonNull(replacement);
    }

    @Override public @Nullable Id getOpt(Id id) {
      for (Environment e = this; e instanceof SubEnvironment;
           e = ((SubEnvironment) e).parent) {
        final SubEnvironment sub = (SubEnvironment) e;
        if (sub.id == id) {
          return sub.replacement;
        }
      }
      return null;
    }
  }
}

// End Environment.java
