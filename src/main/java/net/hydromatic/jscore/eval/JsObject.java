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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** JavaScript object. Fields are kept in insertion order.
 *
 * <p>Equality is identity, as in JavaScript. */
public class JsObject {
  private final Map<String, @Nullable Object> fields = new LinkedHashMap<>();

  /** Constructor that created this object via "new", or null. */
  @Nullable Object constructor;

  /** Returns the value of a field, or {@link Undefined#INSTANCE} if the
   * object has no such field. */
  public @Nullable Object get(String key) {
    return fields.containsKey(key) ? fields.get(key) : Undefined.INSTANCE;
  }

  public boolean has(String key) {
    return fields.containsKey(key);
  }

  public JsObject put(String key, @Nullable Object value) {
    fields.put(key, value);
    return this;
  }

  public void delete(String key) {
    fields.remove(key);
  }

  /** Returns a snapshot of the field names. */
  public List<String> keys() {
    return ImmutableList.copyOf(fields.keySet());
  }

  @Override public String toString() {
    return fields.toString();
  }
}

// End JsObject.java
