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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests for {@link Preferences} and {@link Prop}. */
public class PreferencesTest {
  @Test void testDefaults() {
    final Preferences preferences = Preferences.READABLE;
    assertThat(preferences.naming(), is(Prop.Naming.READABLE));
    assertThat(preferences.globalName(), is("Global"));
    assertThat(preferences.runtimeName(), is("Runtime"));
    assertThat(preferences.tailCalls(), is(true));
    assertThat(preferences.constantFolding(), is(true));
    assertThat(Preferences.COMPACT.naming(), is(Prop.Naming.COMPACT));
    assertThat(Preferences.COMPACT.globalName(), is("Global"));
  }

  @Test void testWith() {
    final Preferences preferences =
        Preferences.READABLE.with(Prop.NAMING, "Compact")
            .with(Prop.CONSTANT_FOLDING, "FALSE")
            .with(Prop.GLOBAL_NAME, "window");
    assertThat(preferences.naming(), is(Prop.Naming.COMPACT));
    assertThat(preferences.constantFolding(), is(false));
    assertThat(preferences.globalName(), is("window"));
    assertThat(preferences.get(Prop.TAIL_CALLS), is(true));

    // The original is unchanged
    assertThat(Preferences.READABLE.globalName(), is("Global"));
    assertThat(Preferences.READABLE.with(Prop.NAMING, Prop.Naming.COMPACT),
        is(Preferences.COMPACT));
  }

  @Test void testInvalid() {
    final RuntimeException e =
        assertThrows(RuntimeException.class,
            () -> Preferences.READABLE.with(Prop.NAMING, "short"));
    assertThat(e.getMessage(),
        is("value must be one of: 'COMPACT', 'READABLE'"));
    final RuntimeException e2 =
        assertThrows(RuntimeException.class,
            () -> Preferences.READABLE.with(Prop.TAIL_CALLS, "yes"));
    assertThat(e2.getMessage(), is("value must be one of: 'true', 'false'"));
    final RuntimeException e3 =
        assertThrows(RuntimeException.class,
            () -> Preferences.READABLE.with(Prop.GLOBAL_NAME, 1));
    assertThat(e3.getMessage(),
        is("value for property must have type class java.lang.String"));
    final RuntimeException e4 =
        assertThrows(RuntimeException.class,
            () -> Preferences.READABLE.with(Prop.GLOBAL_NAME, null));
    assertThat(e4.getMessage(), is("property is required"));
    final RuntimeException e5 =
        assertThrows(RuntimeException.class, () -> Prop.lookup("colour"));
    assertThat(e5.getMessage(), is("property colour not found"));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("tailCalls"), is(Prop.TAIL_CALLS));
    assertThat(Prop.lookup("TAIL_CALLS"), is(Prop.TAIL_CALLS));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.CONSTANT_FOLDING));
  }

  /** Loads preferences from a properties file; keys may be camel-case or
   * upper-case. */
  @Test void testLoad() throws IOException {
    final Preferences preferences;
    try (InputStream in =
             PreferencesTest.class.getResourceAsStream("/jscore.properties")) {
      preferences = Preferences.load(in);
    }
    assertThat(preferences.naming(), is(Prop.Naming.COMPACT));
    assertThat(preferences.runtimeName(), is("IntelliFactory.Runtime"));
    assertThat(preferences.tailCalls(), is(false));
    assertThat(preferences.constantFolding(), is(true));

    final Properties properties = new Properties();
    properties.setProperty("globalName", "self");
    assertThat(Preferences.of(properties).globalName(), is("self"));
  }
}

// End PreferencesTest.java
