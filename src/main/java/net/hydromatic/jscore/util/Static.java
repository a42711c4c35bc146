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
package net.hydromatic.jscore.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Applies a function to each element of a list; returns the same list if
   * the function returns each element unchanged.
   *
   * <p>Callers can compare the result with the argument using {@code ==} to
   * find out whether anything changed.
   */
  public static <E> ImmutableList<E> transformIfChanged(ImmutableList<E> list,
      UnaryOperator<E> f) {
    ImmutableList.Builder<E> b = null;
    for (int i = 0; i < list.size(); i++) {
      final E e = list.get(i);
      final E e2 = f.apply(e);
      if (b == null && e2 != e) {
        b = ImmutableList.builder();
        b.addAll(list.subList(0, i));
      }
      if (b != null) {
        b.add(e2);
      }
    }
    return b == null ? list : b.build();
  }

  /** Transforms a list, applying a function to each element. */
  public static <E, T> List<T> transform(List<? extends E> elements,
      Function<E, T> mapper) {
    final ImmutableList.Builder<T> b = ImmutableList.builder();
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }
}

// End Static.java
