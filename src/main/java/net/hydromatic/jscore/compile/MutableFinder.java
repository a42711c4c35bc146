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
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Visitor;

/** Finds the mutable identifiers in an expression: those that are assigned,
 * and those that are declared mutable and are read or bound. */
class MutableFinder extends Visitor {
  final ImmutableSortedSet.Builder<Id> ids =
      ImmutableSortedSet.naturalOrder();

  static ImmutableSortedSet<Id> mutableIds(Core.Exp exp) {
    final MutableFinder finder = new MutableFinder();
    exp.accept(finder);
    return finder.ids.build();
  }

  @Override protected void visit(Core.Var var) {
    if (var.id.mutable) {
      ids.add(var.id);
    }
  }

  @Override protected void visit(Core.VarSet varSet) {
    ids.add(varSet.id);
    super.visit(varSet);
  }

  @Override protected void visit(Core.Lambda lambda) {
    for (Id id : lambda.binders()) {
      if (id.mutable) {
        ids.add(id);
      }
    }
    super.visit(lambda);
  }
}

// End MutableFinder.java
