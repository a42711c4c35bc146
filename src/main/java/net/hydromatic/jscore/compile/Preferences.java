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
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Immutable set of property values that control compilation.
 *
 * <p>Properties that have not been set have their default value.
 *
 * @see Prop */
public final class Preferences {
  /** Preferences with readable names; all other properties default. */
  public static final Preferences READABLE =
      new Preferences(ImmutableMap.of());

  /** Preferences with compact names; all other properties default. */
  public static final Preferences COMPACT =
      READABLE.with(Prop.NAMING, Prop.Naming.COMPACT);

  private final ImmutableMap<Prop, Object> map;

  private Preferences(ImmutableMap<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Creates preferences from a set of properties. Keys may be either the
   * camel-case or upper-case name of a {@link Prop}; values are parsed
   * leniently. */
  public static Preferences of(Properties properties) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    for (String name : properties.stringPropertyNames()) {
      Prop.lookup(name).setLenient(map, properties.getProperty(name));
    }
    return new Preferences(ImmutableMap.copyOf(map));
  }

  /** Loads preferences from a stream in {@link Properties} format. */
  public static Preferences load(InputStream in) throws IOException {
    final Properties properties = new Properties();
    properties.load(in);
    return of(properties);
  }

  /** Returns a copy of these preferences with one property changed. */
  public Preferences with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.map);
    prop.setLenient(map, value);
    return new Preferences(ImmutableMap.copyOf(map));
  }

  public Prop.Naming naming() {
    return Prop.NAMING.enumValue(map, Prop.Naming.class);
  }

  public String globalName() {
    return Prop.GLOBAL_NAME.stringValue(map);
  }

  public String runtimeName() {
    return Prop.RUNTIME_NAME.stringValue(map);
  }

  public boolean tailCalls() {
    return Prop.TAIL_CALLS.booleanValue(map);
  }

  public boolean constantFolding() {
    return Prop.CONSTANT_FOLDING.booleanValue(map);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(map);
  }

  @Override public int hashCode() {
    return map.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Preferences
        && map.equals(((Preferences) o).map);
  }

  @Override public String toString() {
    return map.toString();
  }
}

// End Preferences.java
