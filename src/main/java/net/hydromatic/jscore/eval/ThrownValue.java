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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Exception that carries a value thrown by JavaScript code. */
public class ThrownValue extends RuntimeException {
  public final @Nullable Object value;

  public ThrownValue(@Nullable Object value) {
    super("uncaught " + Interpreter.toString(value), null, false, false);
    this.value = value;
  }

  /** Creates an exception that carries a "TypeError" object. */
  static ThrownValue typeError(String message) {
    final JsObject error = new JsObject();
    error.put("name", "TypeError");
    error.put("message", message);
    return new ThrownValue(error);
  }
}

// End ThrownValue.java
