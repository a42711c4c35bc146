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

import com.google.common.collect.ImmutableSortedSet;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Visitor;

/** Finds the identifiers that are introduced by binders in an expression,
 * and those that are introduced more than once. */
class BoundFinder extends Visitor {
  final Set<Id> bound = new HashSet<>();
  final ImmutableSortedSet.Builder<Id> duplicates =
      ImmutableSortedSet.naturalOrder();

  /** Returns the identifiers that are bound more than once. */
  static ImmutableSortedSet<Id> duplicateBinders(Core.Exp exp) {
    final BoundFinder finder = new BoundFinder();
    exp.accept(finder);
    return finder.duplicates.build();
  }

  /** Returns whether no identifier is bound more than once. */
  static boolean isAlphaNormalized(Core.Exp exp) {
    return duplicateBinders(exp).isEmpty();
  }

  @Override protected void visit(Core.Lambda lambda) {
    for (Id id : lambda.binders()) {
      if (!bound.add(id)) {
        duplicates.add(id);
      }
    }
    super.visit(lambda);
  }
}

// End BoundFinder.java
