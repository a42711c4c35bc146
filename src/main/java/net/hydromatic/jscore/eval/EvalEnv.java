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
import net.hydromatic.jscore.ast.Id;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Each binding is a slot. A closure captures the environment in which it
 * was created, so an assignment to a slot is seen by every closure that
 * captured it.
 */
public class EvalEnv {
  private static final EvalEnv EMPTY = new EvalEnv(null, null, null);

  private final @Nullable EvalEnv parent;
  private final @Nullable Id id;
  private @Nullable Object value;

  private EvalEnv(@Nullable EvalEnv parent, @Nullable Id id,
      @Nullable Object value) {
    this.parent = parent;
    this.id = id;
    this.value = value;
  }

  /** Returns an environment with no bindings. */
  public static EvalEnv empty() {
    return EMPTY;
  }

  /** Creates an environment that has the same content as this one, plus
   * the binding (id, value). */
  public EvalEnv bind(Id id, @Nullable Object value) {
    return new EvalEnv(this, requireNonNull(id), value);
  }

  /** Binds a list of identifiers; missing values are
   * {@link Undefined#INSTANCE}. */
  public EvalEnv bindAll(List<Id> ids, List<@Nullable Object> values) {
    EvalEnv env = this;
    for (int i = 0; i < ids.size(); i++) {
      env = env.bind(ids.get(i),
          i < values.size() ? values.get(i) : Undefined.INSTANCE);
    }
    return env;
  }

  public @Nullable Object get(Id id) {
    return find(id).value;
  }

  /** Assigns the slot of an identifier. */
  public void set(Id id, @Nullable Object value) {
    find(id).value = value;
  }

  private EvalEnv find(Id id) {
    for (EvalEnv e = this; e.parent != null; e = e.parent) {
      if (e.id == id) {
        return e;
      }
    }
    throw new IllegalArgumentException("not bound: " + id);
  }
}

// End EvalEnv.java
