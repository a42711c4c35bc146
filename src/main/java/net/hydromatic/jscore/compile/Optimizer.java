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

import static net.hydromatic.jscore.ast.CoreBuilder.core;
import static net.hydromatic.jscore.util.Static.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Optimizes an expression in a single bottom-up pass.
 *
 * <p>Converts tail calls among the functions of a recursive group into
 * loops, and applies the local rewrites of {@link Simplifier}.
 *
 * <p>Consider
 *
 * <pre>{@code
 * let rec fact = fun (n, acc) ->
 *     if n <= 0 then acc else fact(n - 1, acc * n)
 * in fact(5, 1)
 * }</pre>
 *
 * <p>The call to {@code fact} is in tail position, so {@code fact} becomes
 *
 * <pre>{@code
 * fun (n', acc') ->
 *   let n1 = n' in let acc1 = acc' in
 *   let again = true in let result = undefined in
 *   (while again do
 *       (again := false;
 *        let n = n1 in let acc = acc1 in
 *        if n <= 0 then result := acc
 *        else (n1 := n - 1; acc1 := acc * n; again := true));
 *    result)
 * }</pre>
 *
 * <p>in which {@code n1}, {@code acc1}, {@code again} and {@code result} are
 * mutable. If several functions of a group call each other in tail position,
 * their bodies move into a worker function that dispatches on an integer
 * argument, and each function becomes an entry point that calls the worker.
 *
 * <p>The pass is idempotent.
 */
public class Optimizer extends Shuttle {
  private final Preferences preferences;

  private Optimizer(Preferences preferences) {
    this.preferences = preferences;
  }

  /** Optimizes an expression. */
  public static Core.Exp optimize(Preferences preferences, Core.Exp exp) {
    return new Optimizer(preferences).apply(exp);
  }

  private Core.Exp simplify(Core.Exp exp) {
    return preferences.constantFolding() ? Simplifier.simplify(exp) : exp;
  }

  @Override protected Core.Exp visit(Core.Binary binary) {
    return simplify(visitChildren(binary));
  }

  @Override protected Core.Exp visit(Core.Unary unary) {
    return simplify(visitChildren(unary));
  }

  @Override protected Core.Exp visit(Core.If ifThenElse) {
    return simplify(visitChildren(ifThenElse));
  }

  @Override protected Core.Exp visit(Core.Sequential sequential) {
    return simplify(visitChildren(sequential));
  }

  @Override protected Core.Exp visit(Core.LetRec letRec) {
    final Core.LetRec letRec2 = (Core.LetRec) visitChildren(letRec);
    return preferences.tailCalls() ? eliminateTailCalls(letRec2) : letRec2;
  }

  /** Rewrites the functions of a recursive group that make tail calls to
   * each other. */
  static Core.LetRec eliminateTailCalls(Core.LetRec letRec) {
    final Map<Id, Core.Lambda> candidates = candidates(letRec);
    if (candidates.isEmpty()) {
      return letRec;
    }
    final List<Map.Entry<Id, Core.Exp>> bindings = new ArrayList<>();
    if (candidates.size() == 1) {
      for (Map.Entry<Id, Core.Exp> binding : letRec.bindings) {
        final Core.Lambda lambda = candidates.get(binding.getKey());
        bindings.add(lambda == null ? binding
            : Maps.immutableEntry(binding.getKey(),
                selfLoop(binding.getKey(), lambda)));
      }
    } else {
      final Id worker = Id.of("loop");
      final List<Id> ids = ImmutableList.copyOf(candidates.keySet());
      final int slotCount = candidates.values().stream()
          .mapToInt(lambda -> lambda.params.size()).max().orElse(0);
      for (Map.Entry<Id, Core.Exp> binding : letRec.bindings) {
        final Core.Lambda lambda = candidates.get(binding.getKey());
        bindings.add(lambda == null ? binding
            : Maps.immutableEntry(binding.getKey(),
                entry(worker, ids.indexOf(binding.getKey()), lambda,
                    slotCount)));
      }
      bindings.add(
          Maps.immutableEntry(worker, worker(candidates, slotCount)));
    }
    return letRec.copy(bindings, letRec.body);
  }

  /** Returns the members of a group that are lambdas and that make at least
   * one tail call to a member that is also a candidate. */
  private static Map<Id, Core.Lambda> candidates(Core.LetRec letRec) {
    final Map<Id, Core.Lambda> candidates = new LinkedHashMap<>();
    letRec.bindings.forEach(binding -> {
      if (binding.getValue() instanceof Core.Lambda
          && ((Core.Lambda) binding.getValue()).thisId == null) {
        candidates.put(binding.getKey(), (Core.Lambda) binding.getValue());
      }
    });
    for (;;) {
      final Set<Id> removed = new HashSet<>();
      candidates.forEach((id, lambda) -> {
        final Set<Id> targets = new HashSet<>();
        collectTailCalls(lambda.body, candidates, targets);
        if (targets.isEmpty()) {
          removed.add(id);
        }
      });
      if (removed.isEmpty()) {
        return candidates;
      }
      candidates.keySet().removeAll(removed);
    }
  }

  /** Returns the target of a call in tail position, if it is an exact-arity
   * call to one of the given functions, or null. */
  private static @Nullable Id tailCallTarget(Core.Exp exp,
      Map<Id, Core.Lambda> functions, Set<Id> shadowed) {
    if (exp instanceof Core.Apply
        && ((Core.Apply) exp).fn instanceof Core.Var) {
      final Core.Apply apply = (Core.Apply) exp;
      final Id id = ((Core.Var) apply.fn).id;
      final Core.Lambda lambda = functions.get(id);
      if (lambda != null
          && !shadowed.contains(id)
          && lambda.params.size() == apply.args.size()) {
        return id;
      }
    }
    return null;
  }

  private static void collectTailCalls(Core.Exp exp,
      Map<Id, Core.Lambda> functions, Set<Id> targets) {
    rewriteTail(exp, functions, ImmutableSet.of(),
        (id, apply) -> {
          targets.add(id);
          return apply;
        },
        Function.identity());
  }

  /** Rewrites each expression in tail position. An exact-arity call to one
   * of {@code functions} is passed to {@code onCall}; any other expression
   * except {@code throw} is passed to {@code onLeaf}. */
  private static Core.Exp rewriteTail(Core.Exp exp,
      Map<Id, Core.Lambda> functions, Set<Id> shadowed,
      TailCallHandler onCall, Function<Core.Exp, Core.Exp> onLeaf) {
    switch (exp.op) {
    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      return ifThenElse.copy(ifThenElse.condition,
          rewriteTail(ifThenElse.ifTrue, functions, shadowed, onCall, onLeaf),
          rewriteTail(ifThenElse.ifFalse, functions, shadowed, onCall,
              onLeaf));
    case SEQUENTIAL:
      final Core.Sequential sequential = (Core.Sequential) exp;
      return sequential.copy(sequential.first,
          rewriteTail(sequential.second, functions, shadowed, onCall,
              onLeaf));
    case LET:
      final Core.Let let = (Core.Let) exp;
      return let.copy(let.id, let.value,
          rewriteTail(let.body, functions,
              Sets.union(shadowed, ImmutableSet.of(let.id)), onCall,
              onLeaf));
    case LET_REC:
      final Core.LetRec letRec = (Core.LetRec) exp;
      return letRec.copy(letRec.bindings,
          rewriteTail(letRec.body, functions,
              Sets.union(shadowed, ImmutableSet.copyOf(letRec.ids())),
              onCall, onLeaf));
    case THROW:
      return exp;
    default:
      final Id target = tailCallTarget(exp, functions, shadowed);
      if (target != null) {
        return onCall.apply(target, (Core.Apply) exp);
      }
      return onLeaf.apply(exp);
    }
  }

  /** Converts a function that calls itself in tail position into a
   * loop. */
  private static Core.Lambda selfLoop(Id id, Core.Lambda lambda) {
    final List<Id> params = transform(lambda.params, Id::copy);
    final List<Id> slots =
        transform(lambda.params, param -> Id.of(param.name(), true));
    final Id again = Id.of("again", true);
    final Id result = Id.of("result", true);
    final Core.Exp body =
        rewriteTail(lambda.body, ImmutableMap.of(id, lambda),
            ImmutableSet.of(),
            (target, apply) -> jump(slots, apply.args, null, -1, again),
            leaf -> core.varSet(result, leaf));
    final Core.Exp loop =
        loop(again, result, bindParams(lambda.params, slots, body));
    return core.lambda(params,
        bindParams(slots, params, loop));
  }

  /** Creates the entry point that replaces a function that has moved into a
   * worker. */
  private static Core.Lambda entry(Id worker, int index, Core.Lambda lambda,
      int slotCount) {
    final List<Id> params = transform(lambda.params, Id::copy);
    final List<Core.Exp> args = new ArrayList<>();
    args.add(core.intLiteral(index));
    params.forEach(param -> args.add(core.var(param)));
    while (args.size() <= slotCount) {
      args.add(core.undefined());
    }
    return core.lambda(params, core.apply(core.var(worker), args));
  }

  /** Creates a worker that contains the bodies of several functions that
   * call each other in tail position. */
  private static Core.Lambda worker(Map<Id, Core.Lambda> functions,
      int slotCount) {
    final Id kParam = Id.of("k");
    final Id k = Id.of("k", true);
    final List<Id> params = new ArrayList<>();
    final List<Id> slots = new ArrayList<>();
    for (int i = 0; i < slotCount; i++) {
      params.add(Id.of("s" + i));
      slots.add(Id.of("s" + i, true));
    }
    final Id again = Id.of("again", true);
    final Id result = Id.of("result", true);
    final List<Id> ids = ImmutableList.copyOf(functions.keySet());
    final List<Core.Exp> bodies = new ArrayList<>();
    for (Core.Lambda lambda : functions.values()) {
      final Core.Exp body =
          rewriteTail(lambda.body, functions, ImmutableSet.of(),
              (target, apply) ->
                  jump(slots, apply.args, k, ids.indexOf(target), again),
              leaf -> core.varSet(result, leaf));
      bodies.add(
          bindParams(lambda.params, slots.subList(0, lambda.params.size()),
              body));
    }
    Core.Exp dispatch = bodies.get(bodies.size() - 1);
    for (int i = bodies.size() - 2; i >= 0; i--) {
      dispatch =
          core.ifThenElse(
              core.binary(core.var(k), BinaryOp.EQ_STRICT,
                  core.intLiteral(i)),
              bodies.get(i), dispatch);
    }
    final Core.Exp loop = loop(again, result, dispatch);
    final List<Id> allParams = new ArrayList<>();
    allParams.add(kParam);
    allParams.addAll(params);
    return core.lambda(allParams,
        core.let(k, core.var(kParam), bindParams(slots, params, loop)));
  }

  /** Creates "let a = b in ..." for each pair of identifiers. */
  private static Core.Exp bindParams(List<Id> ids, List<Id> values,
      Core.Exp body) {
    Core.Exp exp = body;
    for (int i = ids.size() - 1; i >= 0; i--) {
      exp = core.let(ids.get(i), core.var(values.get(i)), exp);
    }
    return exp;
  }

  /** Creates the assignments that replace a call in tail position. */
  private static Core.Exp jump(List<Id> slots, List<Core.Exp> args,
      @Nullable Id k, int index, Id again) {
    final List<Core.Exp> exps = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      exps.add(core.varSet(slots.get(i), args.get(i)));
    }
    if (k != null) {
      exps.add(core.varSet(k, core.intLiteral(index)));
    }
    exps.add(core.varSet(again, core.boolLiteral(true)));
    return core.sequential(exps);
  }

  /** Creates "let again = true in let result = undefined in
   * (while again do (again := false; body)); result". */
  private static Core.Exp loop(Id again, Id result, Core.Exp body) {
    return core.let(again, core.boolLiteral(true),
        core.let(result, core.undefined(),
            core.sequential(
                core.whileLoop(core.var(again),
                    core.sequential(
                        core.varSet(again, core.boolLiteral(false)), body)),
                core.var(result))));
  }

  /** Handles a call in tail position. */
  @FunctionalInterface
  private interface TailCallHandler {
    Core.Exp apply(Id target, Core.Apply apply);
  }
}

// End Optimizer.java
