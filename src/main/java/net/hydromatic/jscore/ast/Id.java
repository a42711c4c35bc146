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
package net.hydromatic.jscore.ast;

import com.google.common.collect.Ordering;
import java.util.concurrent.atomic.AtomicLong;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identifier of a bound value.
 *
 * <p>Identity is the object itself: two identifiers are equal only if they
 * are the same instance. The name is a hint for printing and never takes
 * part in equality or ordering. Identifiers sort by the order in which they
 * were created.
 *
 * <p>An identifier is created wherever a binder is introduced (a lambda
 * parameter, a let, a loop variable, a member of a recursive group, an
 * exception variable). Only a mutable identifier may be the target of
 * {@link Core.VarSet}.
 */
public final class Id implements Comparable<Id> {
  /** Ordering by creation sequence. */
  public static final Ordering<Id> ORDERING = Ordering.natural();

  /** Source of ordinals. Shared by all threads. */
  private static final AtomicLong SEQUENCE = new AtomicLong();

  /** Creation sequence; unique within this process. */
  public final long ordinal;

  /** Whether this identifier may be assigned. */
  public final boolean mutable;

  private volatile @Nullable String name;

  private Id(@Nullable String name, boolean mutable) {
    this.ordinal = SEQUENCE.getAndIncrement();
    this.name = name;
    this.mutable = mutable;
  }

  /** Creates an immutable identifier without a name. */
  public static Id of() {
    return new Id(null, false);
  }

  /** Creates an immutable identifier with a name hint. */
  public static Id of(@Nullable String name) {
    return new Id(name, false);
  }

  /** Creates an identifier with a name hint and mutability. */
  public static Id of(@Nullable String name, boolean mutable) {
    return new Id(name, mutable);
  }

  /** Creates an identifier with a fresh identity and the same name hint and
   * mutability as this. */
  public Id copy() {
    return new Id(name, mutable);
  }

  /** Creates an identifier with a fresh identity, the same name hint, and
   * the given mutability. */
  public Id copy(boolean mutable) {
    return new Id(name, mutable);
  }

  /** Returns the name hint, or null. */
  public @Nullable String name() {
    return name;
  }

  /** Sets the name hint. Does not affect identity. */
  public void setName(@Nullable String name) {
    this.name = name;
  }

  @Override public int compareTo(Id o) {
    return Long.compare(ordinal, o.ordinal);
  }

  @Override public int hashCode() {
    return Long.hashCode(ordinal);
  }

  @Override public boolean equals(Object o) {
    return o == this;
  }

  /** Returns the name hint, or "$" followed by the ordinal if there is no
   * hint. Two different identifiers may have the same string. */
  @Override public String toString() {
    final String name = this.name;
    return name != null ? name : "$" + ordinal;
  }
}

// End Id.java
