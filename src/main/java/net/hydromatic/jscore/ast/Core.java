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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.jscore.ast.CoreBuilder.core;
import static net.hydromatic.jscore.util.Static.transformIfChanged;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import net.hydromatic.jscore.compile.CompileException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Core expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class
 * names short. Every expression is immutable; sub-trees may be shared.
 *
 * <p>Six kinds of expression introduce identifiers: {@link Lambda},
 * {@link Let}, {@link LetRec}, {@link ForEachField}, {@link ForRange} and
 * {@link TryWith}. {@link Exp#transform} and {@link Exp#fold} present the
 * scope of each of them as a {@link Lambda}, so that a pass that is
 * concerned with scope only needs to handle {@link Lambda}. */
public class Core {
  private Core() {}

  /** Base class of core expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    /** Applies a function to each immediate child, and returns an
     * expression of the same kind with the results; returns {@code this} if
     * no child changed.
     *
     * <p>Children are visited in evaluation order. The scope of a binding
     * form is presented to {@code f} as a {@link Lambda} whose parameters are
     * the bound identifiers; {@code f} must return a lambda of the same
     * shape, from which the form is rebuilt. (A {@link Let} whose scope
     * becomes something other than a lambda is rebuilt as an application of
     * that expression to the let's value.) */
    public abstract Exp transform(UnaryOperator<Exp> f);

    /** Folds over the immediate children of this expression, in evaluation
     * order, presenting the scope of a binding form as a {@link Lambda} in
     * the same way as {@link #transform}. */
    public abstract <S> S fold(S seed, BiFunction<S, Exp, S> f);

    /** Calls an action for each immediate child, in the same order as
     * {@link #fold}. */
    public void forEachChild(Consumer<Exp> action) {
      fold(0, (s, e) -> {
        action.accept(e);
        return s;
      });
    }

    /** Returns the number of nodes in this expression, counting each
     * presented scope as a node. */
    public int size() {
      return fold(1, (s, e) -> s + e.size());
    }

    /** Returns whether this expression is a constant. */
    public boolean isConstant() {
      return false;
    }

    /** Returns whether evaluating this expression has no effect and cannot
     * throw, so that it can be discarded if its value is not used. */
    public boolean isPure() {
      return false;
    }

    @Override public abstract Exp accept(Shuttle shuttle);
  }

  /** Presents the scope of a single identifier as a lambda. */
  static Lambda scope(Id id, Exp body) {
    return new Lambda(null, ImmutableList.of(id), body);
  }

  /** Checks that the result of transforming a scope is a lambda with a given
   * number of parameters. */
  static Lambda checkScope(Exp exp, int paramCount, Op op) {
    if (exp instanceof Lambda) {
      final Lambda lambda = (Lambda) exp;
      if (lambda.thisId == null && lambda.params.size() == paramCount) {
        return lambda;
      }
    }
    throw new IllegalStateException("scope of " + op + " must become a "
        + "lambda with " + paramCount + " parameter(s), but was: " + exp);
  }

  private static <S> S foldList(S seed, List<Exp> exps,
      BiFunction<S, Exp, S> f) {
    S s = seed;
    for (Exp exp : exps) {
      s = f.apply(s, exp);
    }
    return s;
  }

  /** Application of a function to a list of arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Exp fn, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && fn.equals(((Apply) o).fn)
          && args.equals(((Apply) o).args);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(fn, left, op.left)
          .append("(").appendAll(args, ", ").append(")");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(fn), transformIfChanged(args, f));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return foldList(f.apply(seed, fn), args, f);
    }

    public Apply copy(Exp fn, List<Exp> args) {
      return fn == this.fn && args == this.args ? this
          : core.apply(fn, args);
    }
  }

  /** Call to a binary operator. */
  public static class Binary extends Exp {
    public final Exp left;
    public final BinaryOp binaryOp;
    public final Exp right;

    Binary(Exp left, BinaryOp binaryOp, Exp right) {
      super(Op.BINARY);
      this.left = requireNonNull(left);
      this.binaryOp = requireNonNull(binaryOp);
      this.right = requireNonNull(right);
    }

    @Override public int hashCode() {
      return Objects.hash(left, binaryOp, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && left.equals(((Binary) o).left)
          && binaryOp == ((Binary) o).binaryOp
          && right.equals(((Binary) o).right);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, binaryOp.padded, binaryOp.left,
          binaryOp.right, this.right, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(left), f.apply(right));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, left), right);
    }

    public Binary copy(Exp left, Exp right) {
      return left == this.left && right == this.right ? this
          : core.binary(left, binaryOp, right);
    }
  }

  /** Call to a method. The receiver is bound to {@code this} during the
   * call. */
  public static class Call extends Exp {
    public final Exp receiver;
    public final Exp method;
    public final ImmutableList<Exp> args;

    Call(Exp receiver, Exp method, ImmutableList<Exp> args) {
      super(Op.CALL);
      this.receiver = requireNonNull(receiver);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(receiver, method, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && receiver.equals(((Call) o).receiver)
          && method.equals(((Call) o).method)
          && args.equals(((Call) o).args);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(receiver, left, op.left).key(method)
          .append("(").appendAll(args, ", ").append(")");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(receiver), f.apply(method),
          transformIfChanged(args, f));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return foldList(f.apply(f.apply(seed, receiver), method), args, f);
    }

    public Call copy(Exp receiver, Exp method, List<Exp> args) {
      return receiver == this.receiver
          && method == this.method
          && args == this.args
          ? this
          : core.call(receiver, method, args);
    }
  }

  /** Constant; lifts a {@link Literal} into an expression. */
  public static class Constant extends Exp {
    public final Literal literal;

    Constant(Literal literal) {
      super(Op.CONSTANT);
      this.literal = requireNonNull(literal);
    }

    @Override public int hashCode() {
      return literal.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && literal.equals(((Constant) o).literal);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal.toString());
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return seed;
    }

    @Override public boolean isConstant() {
      return true;
    }

    @Override public boolean isPure() {
      return true;
    }
  }

  /** Deletes a field from an object. */
  public static class FieldDelete extends Exp {
    public final Exp object;
    public final Exp key;

    FieldDelete(Exp object, Exp key) {
      super(Op.FIELD_DELETE);
      this.object = requireNonNull(object);
      this.key = requireNonNull(key);
    }

    @Override public int hashCode() {
      return Objects.hash(op, object, key);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldDelete
          && object.equals(((FieldDelete) o).object)
          && key.equals(((FieldDelete) o).key);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(object, op.right, Op.FIELD_GET.left)
          .key(key);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(object), f.apply(key));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, object), key);
    }

    public FieldDelete copy(Exp object, Exp key) {
      return object == this.object && key == this.key ? this
          : core.fieldDelete(object, key);
    }
  }

  /** Reads a field of an object. */
  public static class FieldGet extends Exp {
    public final Exp object;
    public final Exp key;

    FieldGet(Exp object, Exp key) {
      super(Op.FIELD_GET);
      this.object = requireNonNull(object);
      this.key = requireNonNull(key);
    }

    @Override public int hashCode() {
      return Objects.hash(op, object, key);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldGet
          && object.equals(((FieldGet) o).object)
          && key.equals(((FieldGet) o).key);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(object, left, op.left).key(key);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(object), f.apply(key));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, object), key);
    }

    public FieldGet copy(Exp object, Exp key) {
      return object == this.object && key == this.key ? this
          : core.fieldGet(object, key);
    }
  }

  /** Assigns a field of an object. Evaluates to {@code undefined}. */
  public static class FieldSet extends Exp {
    public final Exp object;
    public final Exp key;
    public final Exp value;

    FieldSet(Exp object, Exp key, Exp value) {
      super(Op.FIELD_SET);
      this.object = requireNonNull(object);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(object, key, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldSet
          && object.equals(((FieldSet) o).object)
          && key.equals(((FieldSet) o).key)
          && value.equals(((FieldSet) o).value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(object, left, Op.FIELD_GET.left).key(key)
          .append(op.padded).append(value, op.right, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(object), f.apply(key), f.apply(value));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(f.apply(seed, object), key), value);
    }

    public FieldSet copy(Exp object, Exp key, Exp value) {
      return object == this.object && key == this.key && value == this.value
          ? this
          : core.fieldSet(object, key, value);
    }
  }

  /** Loop over the enumerable property keys of an object. Evaluates to
   * {@code undefined}. */
  public static class ForEachField extends Exp {
    public final Id id;
    public final Exp object;
    public final Exp body;

    ForEachField(Id id, Exp object, Exp body) {
      super(Op.FOR_EACH_FIELD);
      this.id = requireNonNull(id);
      this.object = requireNonNull(object);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(id, object, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ForEachField
          && id.equals(((ForEachField) o).id)
          && object.equals(((ForEachField) o).object)
          && body.equals(((ForEachField) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).id(id).append(" in ")
          .append(object, 0, 0).append(" do ").append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      final Exp object2 = f.apply(object);
      final Lambda scope = checkScope(f.apply(scope(id, body)), 1, op);
      return copy(scope.params.get(0), object2, scope.body);
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, object), scope(id, body));
    }

    public ForEachField copy(Id id, Exp object, Exp body) {
      return id == this.id && object == this.object && body == this.body
          ? this
          : core.forEachField(id, object, body);
    }
  }

  /** Loop over an inclusive range of integers. The bounds are evaluated
   * once, lower first. Evaluates to {@code undefined}. */
  public static class ForRange extends Exp {
    public final Id id;
    public final Exp lower;
    public final Exp upper;
    public final Exp body;

    ForRange(Id id, Exp lower, Exp upper, Exp body) {
      super(Op.FOR_RANGE);
      this.id = requireNonNull(id);
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(id, lower, upper, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ForRange
          && id.equals(((ForRange) o).id)
          && lower.equals(((ForRange) o).lower)
          && upper.equals(((ForRange) o).upper)
          && body.equals(((ForRange) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).id(id).append(" = ")
          .append(lower, 0, 0).append(" to ").append(upper, 0, 0)
          .append(" do ").append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      final Exp lower2 = f.apply(lower);
      final Exp upper2 = f.apply(upper);
      final Lambda scope = checkScope(f.apply(scope(id, body)), 1, op);
      return copy(scope.params.get(0), lower2, upper2, scope.body);
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(f.apply(seed, lower), upper), scope(id, body));
    }

    public ForRange copy(Id id, Exp lower, Exp upper, Exp body) {
      return id == this.id
          && lower == this.lower
          && upper == this.upper
          && body == this.body
          ? this
          : core.forRange(id, lower, upper, body);
    }
  }

  /** Reference to a value in the host environment, by a path of names
   * starting at the global object. */
  public static class Global extends Exp {
    public final ImmutableList<String> path;

    Global(ImmutableList<String> path) {
      super(Op.GLOBAL);
      this.path = requireNonNull(path);
      path.forEach(s -> checkArgument(!s.isEmpty(), "empty segment"));
    }

    @Override public int hashCode() {
      return path.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Global
          && path.equals(((Global) o).path);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("global");
      for (String s : path) {
        if (AstWriter.isIdentifier(s)) {
          w.append(".").append(s);
        } else {
          w.append("[").append(Literal.quote(s)).append("]");
        }
      }
      return w;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return seed;
    }

    /** Only the root and its direct members are pure; reading "a.b" throws
     * if "a" is undefined. */
    @Override public boolean isPure() {
      return path.size() <= 1;
    }
  }

  /** Conditional expression. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Exp condition, Exp ifTrue, Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof If
          && condition.equals(((If) o).condition)
          && ifTrue.equals(((If) o).ifTrue)
          && ifFalse.equals(((If) o).ifFalse);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(condition), f.apply(ifTrue), f.apply(ifFalse));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(f.apply(seed, condition), ifTrue), ifFalse);
    }

    public If copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return condition == this.condition
          && ifTrue == this.ifTrue
          && ifFalse == this.ifFalse
          ? this
          : core.ifThenElse(condition, ifTrue, ifFalse);
    }
  }

  /** Lambda expression.
   *
   * <p>If {@link #thisId} is not null, it is bound to the receiver
   * ({@code this}) of each call. */
  public static class Lambda extends Exp {
    public final @Nullable Id thisId;
    public final ImmutableList<Id> params;
    public final Exp body;

    Lambda(@Nullable Id thisId, ImmutableList<Id> params, Exp body) {
      super(Op.LAMBDA);
      this.thisId = thisId;
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    /** Returns the identifiers bound by this lambda: {@link #thisId}, if
     * present, followed by the parameters. */
    public List<Id> binders() {
      if (thisId == null) {
        return params;
      }
      return ImmutableList.<Id>builder().add(thisId).addAll(params).build();
    }

    @Override public int hashCode() {
      return Objects.hash(thisId, params, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
          && Objects.equals(thisId, ((Lambda) o).thisId)
          && params.equals(((Lambda) o).params)
          && body.equals(((Lambda) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(op.padded);
      if (thisId != null) {
        w.append("[").id(thisId).append("] ");
      }
      return w.append("(").appendIds(params).append(") -> ")
          .append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(thisId, params, f.apply(body));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(seed, body);
    }

    @Override public boolean isPure() {
      return true;
    }

    public Lambda copy(@Nullable Id thisId, List<Id> params, Exp body) {
      return thisId == this.thisId
          && params.equals(this.params)
          && body == this.body
          ? this
          : core.lambda(thisId, params, body);
    }
  }

  /** "Let" expression; binds an identifier to a value within a body. */
  public static class Let extends Exp {
    public final Id id;
    public final Exp value;
    public final Exp body;

    Let(Id id, Exp value, Exp body) {
      super(Op.LET);
      this.id = requireNonNull(id);
      this.value = requireNonNull(value);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(id, value, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Let
          && id.equals(((Let) o).id)
          && value.equals(((Let) o).value)
          && body.equals(((Let) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).id(id).append(" = ").append(value, 0, 0)
          .append(" in ").append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      final Exp value2 = f.apply(value);
      final Exp scope = f.apply(scope(id, body));
      if (scope instanceof Lambda
          && ((Lambda) scope).thisId == null
          && ((Lambda) scope).params.size() == 1) {
        final Lambda lambda = (Lambda) scope;
        return copy(lambda.params.get(0), value2, lambda.body);
      }
      return core.apply(scope, ImmutableList.of(value2));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, value), scope(id, body));
    }

    public Let copy(Id id, Exp value, Exp body) {
      return id == this.id && value == this.value && body == this.body
          ? this
          : core.let(id, value, body);
    }
  }

  /** Recursive "let" expression; binds a group of identifiers, each of whose
   * values may refer to any identifier in the group.
   *
   * <p>{@link #transform} and {@link #fold} present the group as a single
   * lambda whose parameters are the bound identifiers and whose body is an
   * array of the values followed by the body. */
  public static class LetRec extends Exp {
    public final ImmutableList<Map.Entry<Id, Exp>> bindings;
    public final Exp body;

    LetRec(ImmutableList<Map.Entry<Id, Exp>> bindings, Exp body) {
      super(Op.LET_REC);
      this.bindings = requireNonNull(bindings);
      this.body = requireNonNull(body);
      checkArgument(!bindings.isEmpty(), "empty group");
      final Set<Id> ids = new HashSet<>();
      bindings.forEach(b ->
          checkArgument(ids.add(b.getKey()), "duplicate binder %s",
              b.getKey()));
    }

    /** Returns the bound identifiers. */
    public ImmutableList<Id> ids() {
      final ImmutableList.Builder<Id> b = ImmutableList.builder();
      bindings.forEach(e -> b.add(e.getKey()));
      return b.build();
    }

    /** Returns the values, in the same order as {@link #ids()}. */
    public ImmutableList<Exp> values() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      bindings.forEach(e -> b.add(e.getValue()));
      return b.build();
    }

    /** Returns the value bound to an identifier, or null. */
    public @Nullable Exp get(Id id) {
      for (Map.Entry<Id, Exp> binding : bindings) {
        if (binding.getKey() == id) {
          return binding.getValue();
        }
      }
      return null;
    }

    private Lambda scope() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      b.addAll(values()).add(body);
      return new Lambda(null, ids(), new NewArray(b.build()));
    }

    @Override public int hashCode() {
      return Objects.hash(bindings, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof LetRec
          && bindings.equals(((LetRec) o).bindings)
          && body.equals(((LetRec) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(op.padded);
      for (int i = 0; i < bindings.size(); i++) {
        final Map.Entry<Id, Exp> binding = bindings.get(i);
        w.append(i == 0 ? "" : " and ").id(binding.getKey()).append(" = ")
            .append(binding.getValue(), 0, 0);
      }
      return w.append(" in ").append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      final int n = bindings.size();
      final Lambda scope = checkScope(f.apply(scope()), n, op);
      if (!(scope.body instanceof NewArray)
          || ((NewArray) scope.body).elements.size() != n + 1) {
        throw new IllegalStateException("scope of " + op + " must keep "
            + "the shape of its values and body, but was: " + scope);
      }
      final List<Exp> elements = ((NewArray) scope.body).elements;
      boolean changed = false;
      final ImmutableList.Builder<Map.Entry<Id, Exp>> b =
          ImmutableList.builder();
      for (int i = 0; i < n; i++) {
        final Map.Entry<Id, Exp> binding = bindings.get(i);
        final Id id = scope.params.get(i);
        final Exp value = elements.get(i);
        if (id == binding.getKey() && value == binding.getValue()) {
          b.add(binding);
        } else {
          b.add(Maps.immutableEntry(id, value));
          changed = true;
        }
      }
      final Exp body2 = elements.get(n);
      return !changed && body2 == body ? this
          : core.letRec(b.build(), body2);
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(seed, scope());
    }

    public LetRec copy(List<Map.Entry<Id, Exp>> bindings, Exp body) {
      return bindings.equals(this.bindings) && body == this.body ? this
          : core.letRec(bindings, body);
    }
  }

  /** Invocation of a constructor. */
  public static class New extends Exp {
    public final Exp constructor;
    public final ImmutableList<Exp> args;

    New(Exp constructor, ImmutableList<Exp> args) {
      super(Op.NEW);
      this.constructor = requireNonNull(constructor);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(op, constructor, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof New
          && constructor.equals(((New) o).constructor)
          && args.equals(((New) o).args);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(constructor, 99, 99)
          .append("(").appendAll(args, ", ").append(")");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(constructor), transformIfChanged(args, f));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return foldList(f.apply(seed, constructor), args, f);
    }

    public New copy(Exp constructor, List<Exp> args) {
      return constructor == this.constructor && args == this.args ? this
          : core.construct(constructor, args);
    }
  }

  /** Array constructor. */
  public static class NewArray extends Exp {
    public final ImmutableList<Exp> elements;

    NewArray(ImmutableList<Exp> elements) {
      super(Op.NEW_ARRAY);
      this.elements = requireNonNull(elements);
    }

    @Override public int hashCode() {
      return Objects.hash(op, elements);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NewArray
          && elements.equals(((NewArray) o).elements);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(elements, ", ").append("]");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(transformIfChanged(elements, f));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return foldList(seed, elements, f);
    }

    public NewArray copy(List<Exp> elements) {
      return elements == this.elements ? this
          : core.newArray(elements);
    }
  }

  /** Object constructor; a list of fields with their values. */
  public static class NewObject extends Exp {
    public final ImmutableList<Map.Entry<String, Exp>> fields;

    NewObject(ImmutableList<Map.Entry<String, Exp>> fields) {
      super(Op.NEW_OBJECT);
      this.fields = requireNonNull(fields);
    }

    @Override public int hashCode() {
      return Objects.hash(op, fields);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NewObject
          && fields.equals(((NewObject) o).fields);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < fields.size(); i++) {
        final Map.Entry<String, Exp> field = fields.get(i);
        w.append(i == 0 ? "" : ", ").append(Literal.quote(field.getKey()))
            .append(": ").append(field.getValue(), 0, 0);
      }
      return w.append("}");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      boolean changed = false;
      final ImmutableList.Builder<Map.Entry<String, Exp>> b =
          ImmutableList.builder();
      for (Map.Entry<String, Exp> field : fields) {
        final Exp value = f.apply(field.getValue());
        if (value == field.getValue()) {
          b.add(field);
        } else {
          b.add(Maps.immutableEntry(field.getKey(), value));
          changed = true;
        }
      }
      return changed ? core.newObject(b.build()) : this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      S s = seed;
      for (Map.Entry<String, Exp> field : fields) {
        s = f.apply(s, field.getValue());
      }
      return s;
    }
  }

  /** Regular expression literal. The pattern is the complete text of the
   * literal, including delimiters and flags, for example "/a+/g". */
  public static class NewRegex extends Exp {
    public final String pattern;

    NewRegex(String pattern) {
      super(Op.NEW_REGEX);
      this.pattern = requireNonNull(pattern);
      checkArgument(pattern.length() >= 2
              && pattern.charAt(0) == '/'
              && pattern.lastIndexOf('/') > 0,
          "not a regular expression literal: %s", pattern);
    }

    /** Returns the part of the pattern between the slashes. */
    public String body() {
      return pattern.substring(1, pattern.lastIndexOf('/'));
    }

    /** Returns the flags that follow the closing slash. */
    public String flags() {
      return pattern.substring(pattern.lastIndexOf('/') + 1);
    }

    @Override public int hashCode() {
      return pattern.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NewRegex
          && pattern.equals(((NewRegex) o).pattern);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pattern);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return seed;
    }
  }

  /** Reference to the runtime support library. */
  public static class Runtime extends Exp {
    Runtime() {
      super(Op.RUNTIME);
    }

    @Override public int hashCode() {
      return op.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof Runtime;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("runtime");
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return seed;
    }

    @Override public boolean isPure() {
      return true;
    }
  }

  /** Evaluates an expression, discards its value, then evaluates another. */
  public static class Sequential extends Exp {
    public final Exp first;
    public final Exp second;

    Sequential(Exp first, Exp second) {
      super(Op.SEQUENTIAL);
      this.first = requireNonNull(first);
      this.second = requireNonNull(second);
    }

    @Override public int hashCode() {
      return Objects.hash(op, first, second);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sequential
          && first.equals(((Sequential) o).first)
          && second.equals(((Sequential) o).second);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, first, op.padded, op.left, op.right, second,
          right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(first), f.apply(second));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, first), second);
    }

    public Sequential copy(Exp first, Exp second) {
      return first == this.first && second == this.second ? this
          : core.sequential(first, second);
    }
  }

  /** Throws a value. */
  public static class Throw extends Exp {
    public final Exp exp;

    Throw(Exp exp) {
      super(Op.THROW);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Throw
          && exp.equals(((Throw) o).exp);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(exp, op.right, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(exp));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(seed, exp);
    }

    public Throw copy(Exp exp) {
      return exp == this.exp ? this : core.throwExp(exp);
    }
  }

  /** Evaluates a body, then a handler, even if the body throws. */
  public static class TryFinally extends Exp {
    public final Exp body;
    public final Exp handler;

    TryFinally(Exp body, Exp handler) {
      super(Op.TRY_FINALLY);
      this.body = requireNonNull(body);
      this.handler = requireNonNull(handler);
    }

    @Override public int hashCode() {
      return Objects.hash(op, body, handler);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TryFinally
          && body.equals(((TryFinally) o).body)
          && handler.equals(((TryFinally) o).handler);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(body, 0, 0)
          .append(" finally ").append(handler, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(body), f.apply(handler));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, body), handler);
    }

    public TryFinally copy(Exp body, Exp handler) {
      return body == this.body && handler == this.handler ? this
          : core.tryFinally(body, handler);
    }
  }

  /** Evaluates a body; if it throws, binds the thrown value to an identifier
   * and evaluates a handler. */
  public static class TryWith extends Exp {
    public final Exp body;
    public final Id id;
    public final Exp handler;

    TryWith(Exp body, Id id, Exp handler) {
      super(Op.TRY_WITH);
      this.body = requireNonNull(body);
      this.id = requireNonNull(id);
      this.handler = requireNonNull(handler);
    }

    @Override public int hashCode() {
      return Objects.hash(body, id, handler);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TryWith
          && body.equals(((TryWith) o).body)
          && id.equals(((TryWith) o).id)
          && handler.equals(((TryWith) o).handler);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(body, 0, 0)
          .append(" with ").id(id).append(" -> ").append(handler, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      final Exp body2 = f.apply(body);
      final Lambda scope = checkScope(f.apply(scope(id, handler)), 1, op);
      return copy(body2, scope.params.get(0), scope.body);
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, body), scope(id, handler));
    }

    public TryWith copy(Exp body, Id id, Exp handler) {
      return body == this.body && id == this.id && handler == this.handler
          ? this
          : core.tryWith(body, id, handler);
    }
  }

  /** Call to a unary operator. */
  public static class Unary extends Exp {
    public final UnaryOp unaryOp;
    public final Exp operand;

    Unary(UnaryOp unaryOp, Exp operand) {
      super(Op.UNARY);
      this.unaryOp = requireNonNull(unaryOp);
      this.operand = requireNonNull(operand);
    }

    @Override public int hashCode() {
      return Objects.hash(unaryOp, operand);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Unary
          && unaryOp == ((Unary) o).unaryOp
          && operand.equals(((Unary) o).operand);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(unaryOp.prefix).append(operand, op.right, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(operand));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(seed, operand);
    }

    public Unary copy(Exp operand) {
      return operand == this.operand ? this
          : core.unary(unaryOp, operand);
    }
  }

  /** Reads the value of an identifier. */
  public static class Var extends Exp {
    public final Id id;

    Var(Id id) {
      super(Op.VAR);
      this.id = requireNonNull(id);
    }

    @Override public int hashCode() {
      return id.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Var
          && id.equals(((Var) o).id);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(id);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return this;
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return seed;
    }

    @Override public boolean isPure() {
      return true;
    }
  }

  /** Assigns a mutable identifier. Evaluates to {@code undefined}. */
  public static class VarSet extends Exp {
    public final Id id;
    public final Exp value;

    VarSet(Id id, Exp value) {
      super(Op.VAR_SET);
      this.id = requireNonNull(id);
      this.value = requireNonNull(value);
      if (!id.mutable) {
        throw new CompileException("cannot assign immutable identifier '"
            + id + "'");
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, id, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarSet
          && id.equals(((VarSet) o).id)
          && value.equals(((VarSet) o).value);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.id(id).append(op.padded).append(value, op.right, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(id, f.apply(value));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(seed, value);
    }

    public VarSet copy(Id id, Exp value) {
      return id == this.id && value == this.value ? this
          : core.varSet(id, value);
    }
  }

  /** Loop that evaluates a body while a condition holds. Evaluates to
   * {@code undefined}. */
  public static class While extends Exp {
    public final Exp condition;
    public final Exp body;

    While(Exp condition, Exp body) {
      super(Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(op, condition, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof While
          && condition.equals(((While) o).condition)
          && body.equals(((While) o).body);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(op.padded).append(condition, 0, 0)
          .append(" do ").append(body, 0, right);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public Exp transform(UnaryOperator<Exp> f) {
      return copy(f.apply(condition), f.apply(body));
    }

    @Override public <S> S fold(S seed, BiFunction<S, Exp, S> f) {
      return f.apply(f.apply(seed, condition), body);
    }

    public While copy(Exp condition, Exp body) {
      return condition == this.condition && body == this.body ? this
          : core.whileLoop(condition, body);
    }
  }
}

// End Core.java
