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
import static net.hydromatic.jscore.util.Static.append;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.hydromatic.jscore.ast.BinaryOp;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Literal;
import net.hydromatic.jscore.ast.UnaryOp;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.CatchClause;
import org.mozilla.javascript.ast.ConditionalExpression;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.EmptyStatement;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForInLoop;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.IfStatement;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.NodeVisitor;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ObjectLiteral;
import org.mozilla.javascript.ast.ObjectProperty;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.PropertyGet;
import org.mozilla.javascript.ast.RegExpLiteral;
import org.mozilla.javascript.ast.ReturnStatement;
import org.mozilla.javascript.ast.Scope;
import org.mozilla.javascript.ast.StringLiteral;
import org.mozilla.javascript.ast.ThrowStatement;
import org.mozilla.javascript.ast.TryStatement;
import org.mozilla.javascript.ast.UnaryExpression;
import org.mozilla.javascript.ast.VariableDeclaration;
import org.mozilla.javascript.ast.VariableInitializer;
import org.mozilla.javascript.ast.WhileLoop;

/**
 * Converts a subset of JavaScript into a core expression.
 *
 * <p>This is a partial inverse of {@link Elaborator}. The input is a single
 * expression; function expressions within it may contain {@code var}
 * declarations, assignments, {@code if}, {@code while}, {@code for ... in},
 * {@code throw}, {@code try} and {@code return} statements. Anything outside
 * that subset makes the result empty.
 *
 * <p>A name that is assigned anywhere in the input is declared mutable.
 * A name that is not declared in the input refers to a property of the
 * global object.
 *
 * <p>A {@code var} declaration becomes a {@code let} whose scope is the rest
 * of the function body if it is declared once, at the top level of the
 * body, and not used before its declaration. Any other {@code var} is bound
 * to {@code undefined} at the start of the function, and its declarations
 * become assignments.
 */
public class Recognizer {
  private static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

  private static final ImmutableMap<Integer, BinaryOp> COMPOUND_ASSIGNMENTS =
      ImmutableMap.<Integer, BinaryOp>builder()
          .put(Token.ASSIGN_ADD, BinaryOp.PLUS)
          .put(Token.ASSIGN_SUB, BinaryOp.MINUS)
          .put(Token.ASSIGN_MUL, BinaryOp.TIMES)
          .put(Token.ASSIGN_DIV, BinaryOp.DIVIDE)
          .put(Token.ASSIGN_MOD, BinaryOp.MOD)
          .put(Token.ASSIGN_BITAND, BinaryOp.BIT_AND)
          .put(Token.ASSIGN_BITOR, BinaryOp.BIT_OR)
          .put(Token.ASSIGN_BITXOR, BinaryOp.BIT_XOR)
          .put(Token.ASSIGN_LSH, BinaryOp.SHIFT_LEFT)
          .put(Token.ASSIGN_RSH, BinaryOp.SHIFT_RIGHT)
          .put(Token.ASSIGN_URSH, BinaryOp.SHIFT_RIGHT_UNSIGNED)
          .build();

  private final List<String> globalPath;
  private final List<String> runtimePath;
  private final Set<String> assignedNames;

  /** Receivers of the enclosing functions, innermost first. */
  private final Deque<Frame> frames = new ArrayDeque<>();

  private Recognizer(Preferences preferences, Set<String> assignedNames) {
    this.globalPath = Splitter.on('.').splitToList(preferences.globalName());
    this.runtimePath =
        Splitter.on('.').splitToList(preferences.runtimeName());
    this.assignedNames = assignedNames;
  }

  /** Parses JavaScript source code and converts it into a core expression,
   * or returns empty if the code is invalid or is not in the recognized
   * subset. */
  public static Optional<Core.Exp> recognize(Preferences preferences,
      String source) {
    final AstRoot root;
    try {
      root = new Parser(new CompilerEnvirons()).parse(source, "<input>", 1);
    } catch (RhinoException e) {
      return Optional.empty();
    }
    return recognize(preferences, root);
  }

  /** Converts a JavaScript syntax tree into a core expression, or returns
   * empty if the tree is not in the recognized subset.
   *
   * <p>The tree may be a script that consists of a single expression
   * statement, an expression statement, or an expression. */
  public static Optional<Core.Exp> recognize(Preferences preferences,
      AstNode node) {
    final Recognizer recognizer =
        new Recognizer(preferences, assignedNames(node));
    try {
      return Optional.of(recognizer.top(node));
    } catch (UnrecognizedException e) {
      return Optional.empty();
    }
  }

  /** Returns the names that are the target of an assignment. */
  private static Set<String> assignedNames(AstNode node) {
    final Set<String> names = new HashSet<>();
    node.visit(n -> {
      if (n instanceof Assignment
          && ((Assignment) n).getLeft() instanceof Name) {
        names.add(((Name) ((Assignment) n).getLeft()).getIdentifier());
      }
      return true;
    });
    return names;
  }

  private Core.Exp top(AstNode node) {
    if (node instanceof AstRoot) {
      final List<AstNode> statements = new ArrayList<>();
      for (Node child : node) {
        if (!(child instanceof EmptyStatement)) {
          statements.add((AstNode) child);
        }
      }
      if (statements.size() != 1) {
        throw new UnrecognizedException(node);
      }
      return top(statements.get(0));
    }
    if (node instanceof ExpressionStatement) {
      return exp(((ExpressionStatement) node).getExpression(),
          ImmutableMap.of());
    }
    return exp(node, ImmutableMap.of());
  }

  private Id declare(String name) {
    return Id.of(name, assignedNames.contains(name));
  }

  private static Map<String, Id> with(Map<String, Id> env, String name,
      Id id) {
    final Map<String, Id> env2 = new HashMap<>(env);
    env2.put(name, id);
    return env2;
  }

  // expressions

  private Core.Exp exp(AstNode node, Map<String, Id> env) {
    if (node instanceof ParenthesizedExpression) {
      return exp(((ParenthesizedExpression) node).getExpression(), env);
    }
    if (node instanceof Name
        || node instanceof PropertyGet
        || node instanceof ElementGet) {
      final @Nullable List<String> path = rawPath(node, env);
      if (path != null) {
        return resolve(path);
      }
    }
    if (node instanceof Name) {
      return name(((Name) node).getIdentifier(), env);
    }
    if (node instanceof NumberLiteral) {
      return core.constant(number((NumberLiteral) node));
    }
    if (node instanceof StringLiteral) {
      return core.stringLiteral(((StringLiteral) node).getValue());
    }
    if (node instanceof KeywordLiteral) {
      return keyword((KeywordLiteral) node);
    }
    if (node instanceof RegExpLiteral) {
      final RegExpLiteral regex = (RegExpLiteral) node;
      final String flags = regex.getFlags();
      return core.newRegex("/" + regex.getValue() + "/"
          + (flags == null ? "" : flags));
    }
    if (node instanceof PropertyGet) {
      final PropertyGet propertyGet = (PropertyGet) node;
      return core.fieldGet(exp(propertyGet.getTarget(), env),
          propertyGet.getProperty().getIdentifier());
    }
    if (node instanceof ElementGet) {
      final ElementGet elementGet = (ElementGet) node;
      return core.fieldGet(exp(elementGet.getTarget(), env),
          exp(elementGet.getElement(), env));
    }
    if (node instanceof NewExpression) {
      final NewExpression new_ = (NewExpression) node;
      if (new_.getInitializer() != null) {
        throw new UnrecognizedException(node);
      }
      return core.construct(exp(new_.getTarget(), env),
          exps(new_.getArguments(), env));
    }
    if (node instanceof FunctionCall) {
      return call((FunctionCall) node, env);
    }
    if (node instanceof Assignment) {
      // An assignment is recognized only as a statement
      throw new UnrecognizedException(node);
    }
    if (node instanceof InfixExpression) {
      final InfixExpression infix = (InfixExpression) node;
      final Core.Exp left = exp(infix.getLeft(), env);
      final Core.Exp right = exp(infix.getRight(), env);
      if (infix.getType() == Token.COMMA) {
        return core.sequential(left, right);
      }
      final BinaryOp op = BinaryOp.BY_TOKEN.get(infix.getType());
      if (op == null) {
        throw new UnrecognizedException(node);
      }
      return core.binary(left, op, right);
    }
    if (node instanceof UnaryExpression) {
      return unary((UnaryExpression) node, env);
    }
    if (node instanceof ConditionalExpression) {
      final ConditionalExpression conditional = (ConditionalExpression) node;
      return core.ifThenElse(exp(conditional.getTestExpression(), env),
          exp(conditional.getTrueExpression(), env),
          exp(conditional.getFalseExpression(), env));
    }
    if (node instanceof ArrayLiteral) {
      return core.newArray(exps(((ArrayLiteral) node).getElements(), env));
    }
    if (node instanceof ObjectLiteral) {
      return object((ObjectLiteral) node, env);
    }
    if (node instanceof FunctionNode) {
      return function((FunctionNode) node, env);
    }
    throw new UnrecognizedException(node);
  }

  private List<Core.Exp> exps(List<AstNode> nodes, Map<String, Id> env) {
    final List<Core.Exp> list = new ArrayList<>();
    for (AstNode node : nodes) {
      list.add(exp(node, env));
    }
    return list;
  }

  private Core.Exp name(String name, Map<String, Id> env) {
    final Id id = env.get(name);
    if (id != null) {
      return core.var(id);
    }
    switch (name) {
    case "undefined":
      return core.undefined();
    case "NaN":
      return core.doubleLiteral(Double.NaN);
    case "Infinity":
      return core.doubleLiteral(Double.POSITIVE_INFINITY);
    default:
      throw new AssertionError(name);
    }
  }

  /** Returns the path of a name that is not declared in the input,
   * followed by zero or more property names; or null if the node is not
   * such a path. */
  private @Nullable List<String> rawPath(AstNode node, Map<String, Id> env) {
    if (node instanceof Name) {
      final String name = ((Name) node).getIdentifier();
      switch (name) {
      case "undefined":
      case "NaN":
      case "Infinity":
        return null;
      default:
        return env.containsKey(name) ? null : ImmutableList.of(name);
      }
    }
    if (node instanceof PropertyGet) {
      final PropertyGet propertyGet = (PropertyGet) node;
      final List<String> path = rawPath(propertyGet.getTarget(), env);
      return path == null ? null
          : append(path, propertyGet.getProperty().getIdentifier());
    }
    if (node instanceof ElementGet) {
      final ElementGet elementGet = (ElementGet) node;
      if (elementGet.getElement() instanceof StringLiteral) {
        final String key =
            ((StringLiteral) elementGet.getElement()).getValue();
        final List<String> path = rawPath(elementGet.getTarget(), env);
        return path == null || key.isEmpty() ? null : append(path, key);
      }
    }
    return null;
  }

  /** Converts a path that starts with an undeclared name. A path that starts
   * with the runtime name becomes an access to the runtime; a path that
   * starts with the global name is relative to the global object; any other
   * path is a property of the global object. */
  private Core.Exp resolve(List<String> path) {
    if (startsWith(path, runtimePath)) {
      Core.Exp exp = core.runtime();
      for (String key : path.subList(runtimePath.size(), path.size())) {
        exp = core.fieldGet(exp, key);
      }
      return exp;
    }
    if (startsWith(path, globalPath)) {
      return core.global(path.subList(globalPath.size(), path.size()));
    }
    return core.global(path);
  }

  private static boolean startsWith(List<String> list, List<String> prefix) {
    return list.size() >= prefix.size()
        && list.subList(0, prefix.size()).equals(prefix);
  }

  private static Literal number(NumberLiteral literal) {
    final double d = literal.getNumber();
    final String s = literal.getValue();
    final boolean hex = s.startsWith("0x") || s.startsWith("0X");
    if (d == Math.rint(d)
        && Math.abs(d) <= MAX_SAFE_INTEGER
        && !s.contains(".")
        && (hex || !s.contains("e") && !s.contains("E"))) {
      return Literal.of((long) d);
    }
    return Literal.of(d);
  }

  private Core.Exp keyword(KeywordLiteral literal) {
    switch (literal.getType()) {
    case Token.TRUE:
      return core.boolLiteral(true);
    case Token.FALSE:
      return core.boolLiteral(false);
    case Token.NULL:
      return core.nullLiteral();
    case Token.THIS:
      final Frame frame = frames.peek();
      if (frame == null) {
        throw new UnrecognizedException(literal);
      }
      if (frame.thisId == null) {
        frame.thisId = Id.of("self");
      }
      return core.var(frame.thisId);
    default:
      throw new UnrecognizedException(literal);
    }
  }

  private Core.Exp unary(UnaryExpression unary, Map<String, Id> env) {
    final AstNode operand = unary.getOperand();
    switch (unary.getType()) {
    case Token.VOID:
      if (operand instanceof NumberLiteral) {
        return core.undefined();
      }
      break;
    case Token.NEG:
      if (operand instanceof NumberLiteral) {
        final Literal literal = number((NumberLiteral) operand);
        return literal.kind == Literal.Kind.INT && literal.longValue() != 0L
            ? core.intLiteral(-literal.longValue())
            : core.doubleLiteral(-literal.doubleValue());
      }
      break;
    case Token.DELPROP:
      if (operand instanceof PropertyGet) {
        final PropertyGet propertyGet = (PropertyGet) operand;
        return core.fieldDelete(exp(propertyGet.getTarget(), env),
            core.stringLiteral(propertyGet.getProperty().getIdentifier()));
      }
      if (operand instanceof ElementGet) {
        final ElementGet elementGet = (ElementGet) operand;
        return core.fieldDelete(exp(elementGet.getTarget(), env),
            exp(elementGet.getElement(), env));
      }
      throw new UnrecognizedException(unary);
    default:
      break;
    }
    final UnaryOp op = UnaryOp.BY_TOKEN.get(unary.getType());
    if (op == null) {
      throw new UnrecognizedException(unary);
    }
    return core.unary(op, exp(operand, env));
  }

  private Core.Exp call(FunctionCall call, Map<String, Id> env) {
    AstNode target = call.getTarget();
    while (target instanceof ParenthesizedExpression) {
      target = ((ParenthesizedExpression) target).getExpression();
    }
    final List<Core.Exp> args = exps(call.getArguments(), env);
    if (target instanceof PropertyGet) {
      final PropertyGet propertyGet = (PropertyGet) target;
      return core.call(exp(propertyGet.getTarget(), env),
          core.stringLiteral(propertyGet.getProperty().getIdentifier()),
          args);
    }
    if (target instanceof ElementGet) {
      final ElementGet elementGet = (ElementGet) target;
      return core.call(exp(elementGet.getTarget(), env),
          exp(elementGet.getElement(), env), args);
    }
    if (target.getType() == Token.COMMA
        && target instanceof InfixExpression
        && isLiteral(((InfixExpression) target).getLeft())) {
      // "(0, o.m)(args)" calls "o.m" without a receiver
      return core.apply(exp(((InfixExpression) target).getRight(), env),
          args);
    }
    return core.apply(exp(call.getTarget(), env), args);
  }

  private static boolean isLiteral(AstNode node) {
    return node instanceof NumberLiteral
        || node instanceof StringLiteral;
  }

  private Core.Exp object(ObjectLiteral object, Map<String, Id> env) {
    final List<Map.Entry<String, Core.Exp>> fields = new ArrayList<>();
    final Set<String> keys = new HashSet<>();
    for (ObjectProperty property : object.getElements()) {
      if (property.isMethod()) {
        throw new UnrecognizedException(property);
      }
      final AstNode left = property.getLeft();
      final String key;
      if (left instanceof Name) {
        key = ((Name) left).getIdentifier();
      } else if (left instanceof StringLiteral) {
        key = ((StringLiteral) left).getValue();
      } else {
        throw new UnrecognizedException(property);
      }
      if (!keys.add(key)) {
        throw new UnrecognizedException(property);
      }
      fields.add(Maps.immutableEntry(key, exp(property.getRight(), env)));
    }
    return core.newObject(fields);
  }

  private Core.Exp function(FunctionNode fn, Map<String, Id> env) {
    if (fn.isGenerator()
        || fn.isExpressionClosure()
        || fn.getFunctionType() == FunctionNode.ARROW_FUNCTION) {
      throw new UnrecognizedException(fn);
    }
    Map<String, Id> env2 = env;
    final Name functionName = fn.getFunctionName();
    final @Nullable Id self;
    if (functionName != null) {
      self = declare(functionName.getIdentifier());
      env2 = with(env2, functionName.getIdentifier(), self);
    } else {
      self = null;
    }
    final List<Id> params = new ArrayList<>();
    final Set<String> paramNames = new HashSet<>();
    for (AstNode param : fn.getParams()) {
      if (!(param instanceof Name)) {
        throw new UnrecognizedException(param);
      }
      final String name = ((Name) param).getIdentifier();
      final Id id = declare(name);
      params.add(id);
      paramNames.add(name);
      env2 = with(env2, name, id);
    }
    final VarScanner scanner = new VarScanner(fn.getBody());
    final Map<String, Id> hoisted = new LinkedHashMap<>();
    for (String name : scanner.hoistedNames()) {
      if (paramNames.contains(name) || scanner.catchNames.contains(name)) {
        // A hoisted "var" would share its variable with the parameter or
        // the exception
        throw new UnrecognizedException(fn);
      }
      final Id id = Id.of(name, true);
      hoisted.put(name, id);
      env2 = with(env2, name, id);
    }
    frames.push(new Frame(hoisted));
    Core.Exp body = statements(statements(fn.getBody()), 0, env2);
    final Frame frame = frames.pop();
    for (Id id : ImmutableList.copyOf(hoisted.values()).reverse()) {
      body = core.let(id, core.undefined(), body);
    }
    final Core.Lambda lambda = core.lambda(frame.thisId, params, body);
    return self == null ? lambda
        : core.letRec(self, lambda, core.var(self));
  }

  // statements

  /** Converts the statements of a function body, starting at position
   * {@code i}, to an expression whose value is the value that the function
   * returns. */
  private Core.Exp statements(List<AstNode> statements, int i,
      Map<String, Id> env) {
    if (i == statements.size()) {
      return core.undefined();
    }
    final AstNode statement = statements.get(i);
    if (statement instanceof EmptyStatement) {
      return statements(statements, i + 1, env);
    }
    if (statement instanceof ReturnStatement) {
      final AstNode value = ((ReturnStatement) statement).getReturnValue();
      return value == null ? core.undefined() : exp(value, env);
    }
    if (statement instanceof ThrowStatement) {
      return core.throwExp(
          exp(((ThrowStatement) statement).getExpression(), env));
    }
    if (statement instanceof VariableDeclaration) {
      final VariableDeclaration declaration =
          (VariableDeclaration) statement;
      if (declaration.getType() != Token.VAR) {
        throw new UnrecognizedException(statement);
      }
      return declare(declaration.getVariables(), 0, statements, i + 1, env);
    }
    if (statement instanceof ExpressionStatement) {
      return then(
          effect(((ExpressionStatement) statement).getExpression(), env),
          statements, i + 1, env);
    }
    if (statement instanceof IfStatement) {
      final IfStatement ifStatement = (IfStatement) statement;
      final Core.Exp condition = exp(ifStatement.getCondition(), env);
      final List<AstNode> thenPart = statements(ifStatement.getThenPart());
      final List<AstNode> elsePart = statements(ifStatement.getElsePart());
      if (containsReturn(statement)) {
        // Each branch continues with the rest of the statements
        final List<AstNode> rest =
            statements.subList(i + 1, statements.size());
        return core.ifThenElse(condition,
            statements(concat(thenPart, rest), 0, env),
            statements(concat(elsePart, rest), 0, env));
      }
      return then(
          core.ifThenElse(condition, statements(thenPart, 0, env),
              statements(elsePart, 0, env)),
          statements, i + 1, env);
    }
    if (statement instanceof WhileLoop) {
      final WhileLoop whileLoop = (WhileLoop) statement;
      checkNoReturn(statement);
      return then(
          core.whileLoop(exp(whileLoop.getCondition(), env),
              statements(statements(whileLoop.getBody()), 0, env)),
          statements, i + 1, env);
    }
    if (statement instanceof ForInLoop) {
      final ForInLoop forInLoop = (ForInLoop) statement;
      checkNoReturn(statement);
      if (forInLoop.isForEach()
          || !(forInLoop.getIterator() instanceof VariableDeclaration)) {
        throw new UnrecognizedException(statement);
      }
      final List<VariableInitializer> variables =
          ((VariableDeclaration) forInLoop.getIterator()).getVariables();
      if (variables.size() != 1
          || !(variables.get(0).getTarget() instanceof Name)
          || variables.get(0).getInitializer() != null) {
        throw new UnrecognizedException(statement);
      }
      final String name =
          ((Name) variables.get(0).getTarget()).getIdentifier();
      final @Nullable Id hoisted = hoistedId(name);
      if (hoisted != null) {
        final Id id = Id.of(name);
        return then(
            core.forEachField(id, exp(forInLoop.getIteratedObject(), env),
                core.sequential(core.varSet(hoisted, core.var(id)),
                    statements(statements(forInLoop.getBody()), 0, env))),
            statements, i + 1, env);
      }
      final Id id = declare(name);
      return then(
          core.forEachField(id, exp(forInLoop.getIteratedObject(), env),
              statements(statements(forInLoop.getBody()), 0,
                  with(env, name, id))),
          statements, i + 1, env);
    }
    if (statement instanceof TryStatement) {
      return tryStatement((TryStatement) statement, statements, i, env);
    }
    if (isBlock(statement)) {
      return statements(
          concat(statements(statement),
              statements.subList(i + 1, statements.size())), 0, env);
    }
    throw new UnrecognizedException(statement);
  }

  private Core.Exp tryStatement(TryStatement tryStatement,
      List<AstNode> statements, int i, Map<String, Id> env) {
    final boolean returns = definitelyReturns(tryStatement);
    if (containsReturn(tryStatement) && !returns
        || tryStatement.getFinallyBlock() != null
            && containsReturn(tryStatement.getFinallyBlock())
        || tryStatement.getCatchClauses().size() > 1) {
      throw new UnrecognizedException(tryStatement);
    }
    Core.Exp exp =
        statements(statements(tryStatement.getTryBlock()), 0, env);
    for (CatchClause catchClause : tryStatement.getCatchClauses()) {
      if (catchClause.getCatchCondition() != null) {
        throw new UnrecognizedException(catchClause);
      }
      final String name = catchClause.getVarName().getIdentifier();
      final Id id = declare(name);
      final AstNode body = catchClause.getBody();
      exp = core.tryWith(exp, id,
          statements(statements(body), 0, with(env, name, id)));
    }
    if (tryStatement.getFinallyBlock() != null) {
      exp = core.tryFinally(exp,
          statements(statements(tryStatement.getFinallyBlock()), 0, env));
    }
    return returns ? exp : then(exp, statements, i + 1, env);
  }

  /** Converts the variables of a "var" declaration, starting at position
   * {@code j}, into nested "let" expressions whose innermost body is the
   * rest of the statements. */
  private Core.Exp declare(List<VariableInitializer> variables, int j,
      List<AstNode> statements, int next, Map<String, Id> env) {
    if (j == variables.size()) {
      return statements(statements, next, env);
    }
    final VariableInitializer variable = variables.get(j);
    if (!(variable.getTarget() instanceof Name)) {
      throw new UnrecognizedException(variable);
    }
    final String name = ((Name) variable.getTarget()).getIdentifier();
    final Core.Exp value = variable.getInitializer() == null
        ? core.undefined()
        : exp(variable.getInitializer(), env);
    final @Nullable Id hoisted = hoistedId(name);
    if (hoisted != null) {
      final Core.Exp rest =
          declare(variables, j + 1, statements, next, env);
      return variable.getInitializer() == null ? rest
          : core.sequential(core.varSet(hoisted, value), rest);
    }
    final Id id = declare(name);
    return core.let(id, value,
        declare(variables, j + 1, statements, next, with(env, name, id)));
  }

  /** Returns the identifier of a "var" that is bound at the start of the
   * current function, or null. */
  private @Nullable Id hoistedId(String name) {
    final Frame frame = frames.peek();
    return frame == null ? null : frame.hoisted.get(name);
  }

  /** Converts an expression that is evaluated for its effects. Assignments
   * are allowed. */
  private Core.Exp effect(AstNode node, Map<String, Id> env) {
    if (!(node instanceof Assignment)) {
      return exp(node, env);
    }
    final Assignment assignment = (Assignment) node;
    final AstNode left = assignment.getLeft();
    Core.Exp value = exp(assignment.getRight(), env);
    if (assignment.getType() != Token.ASSIGN) {
      final BinaryOp op = COMPOUND_ASSIGNMENTS.get(assignment.getType());
      if (op == null || !(left instanceof Name)) {
        throw new UnrecognizedException(node);
      }
      value = core.binary(exp(left, env), op, value);
    }
    if (left instanceof Name) {
      final String name = ((Name) left).getIdentifier();
      final Id id = env.get(name);
      if (id != null) {
        return core.varSet(id, value);
      }
      return core.fieldSet(core.global(ImmutableList.of()),
          core.stringLiteral(name), value);
    }
    if (left instanceof PropertyGet) {
      final PropertyGet propertyGet = (PropertyGet) left;
      return core.fieldSet(exp(propertyGet.getTarget(), env),
          core.stringLiteral(propertyGet.getProperty().getIdentifier()),
          value);
    }
    if (left instanceof ElementGet) {
      final ElementGet elementGet = (ElementGet) left;
      return core.fieldSet(exp(elementGet.getTarget(), env),
          exp(elementGet.getElement(), env), value);
    }
    throw new UnrecognizedException(node);
  }

  /** Sequences a statement's effect before the rest of the statements. */
  private Core.Exp then(Core.Exp effect, List<AstNode> statements, int next,
      Map<String, Id> env) {
    if (next == statements.size()) {
      switch (effect.op) {
      case FIELD_SET:
      case FOR_EACH_FIELD:
      case VAR_SET:
      case WHILE:
        // value is already undefined
        return effect;
      default:
        return core.sequential(effect, core.undefined());
      }
    }
    return core.sequential(effect, statements(statements, next, env));
  }

  private static boolean isBlock(@Nullable AstNode node) {
    return node instanceof Block
        || node != null && node.getClass() == Scope.class;
  }

  /** Returns the statements in a block, or a list containing a single
   * statement. */
  private static List<AstNode> statements(@Nullable AstNode node) {
    if (node == null) {
      return ImmutableList.of();
    }
    if (isBlock(node)) {
      final List<AstNode> list = new ArrayList<>();
      for (Node child : node) {
        list.add((AstNode) child);
      }
      return list;
    }
    return ImmutableList.of(node);
  }

  private static List<AstNode> concat(List<AstNode> list0,
      List<AstNode> list1) {
    return ImmutableList.copyOf(Iterables.concat(list0, list1));
  }

  /** Returns whether a statement contains a "return", not counting nested
   * functions. */
  private static boolean containsReturn(AstNode statement) {
    final boolean[] found = {false};
    statement.visit(node -> {
      if (node instanceof ReturnStatement) {
        found[0] = true;
      }
      return !found[0] && !(node instanceof FunctionNode);
    });
    return found[0];
  }

  private static void checkNoReturn(AstNode statement) {
    if (containsReturn(statement)) {
      throw new UnrecognizedException(statement);
    }
  }

  /** Returns whether every path through a statement ends in "return" or
   * "throw". */
  private static boolean definitelyReturns(@Nullable AstNode statement) {
    if (statement instanceof ReturnStatement
        || statement instanceof ThrowStatement) {
      return true;
    }
    if (isBlock(statement)) {
      final List<AstNode> statements = statements(statement);
      return !statements.isEmpty()
          && definitelyReturns(statements.get(statements.size() - 1));
    }
    if (statement instanceof IfStatement) {
      final IfStatement ifStatement = (IfStatement) statement;
      return definitelyReturns(ifStatement.getThenPart())
          && definitelyReturns(ifStatement.getElsePart());
    }
    if (statement instanceof TryStatement) {
      final TryStatement tryStatement = (TryStatement) statement;
      if (!definitelyReturns(tryStatement.getTryBlock())) {
        return false;
      }
      for (CatchClause catchClause : tryStatement.getCatchClauses()) {
        if (!definitelyReturns(catchClause.getBody())) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /** State of a function that is being converted. */
  private static class Frame {
    /** Identifier of the receiver, created when "this" is first seen. */
    @Nullable Id thisId;
    /** Variables bound at the start of the function. */
    final Map<String, Id> hoisted;

    Frame(Map<String, Id> hoisted) {
      this.hoisted = hoisted;
    }
  }

  /** Finds the "var" declarations in a function body, and the references
   * to each name, in source order.
   *
   * <p>Declarations in nested functions belong to those functions. Names
   * used in nested functions count as references even if the nested
   * function binds them. */
  private static class VarScanner implements NodeVisitor {
    private final Set<AstNode> topLevel = Sets.newIdentityHashSet();
    private final Map<String, Integer> declarationCounts = new HashMap<>();
    private final Map<String, Integer> referenceCounts = new HashMap<>();
    /** For each loop variable, the number of references in the body of the
     * loop that declares it. */
    private final Map<String, Integer> loopReferenceCounts = new HashMap<>();
    /** Names declared in a nested statement, or used before they are
     * declared. */
    private final Set<String> unsafe = new LinkedHashSet<>();
    final Set<String> catchNames = new HashSet<>();
    private final boolean own;

    VarScanner(AstNode body) {
      this(true);
      addTopLevel(body);
      body.visit(this);
    }

    private VarScanner(boolean own) {
      this.own = own;
    }

    private void addTopLevel(AstNode node) {
      for (AstNode statement : statements(node)) {
        if (isBlock(statement)) {
          addTopLevel(statement);
        } else if (statement instanceof VariableDeclaration) {
          topLevel.add(statement);
        }
      }
    }

    /** Returns the names that cannot become a "let" at the point of their
     * declaration. */
    Set<String> hoistedNames() {
      final Set<String> names = new LinkedHashSet<>();
      declarationCounts.forEach((name, count) -> {
        if (count > 1) {
          names.add(name);
        }
      });
      names.addAll(unsafe);
      loopReferenceCounts.forEach((name, count) -> {
        if (!count.equals(referenceCounts.getOrDefault(name, 0))) {
          // used outside the loop
          names.add(name);
        }
      });
      return names;
    }

    private void reference(String name) {
      referenceCounts.merge(name, 1, Integer::sum);
    }

    private void declare(String name, boolean topLevel) {
      declarationCounts.merge(name, 1, Integer::sum);
      if (!topLevel || referenceCounts.containsKey(name)) {
        unsafe.add(name);
      }
    }

    private void scan(@Nullable AstNode node) {
      if (node != null) {
        node.visit(this);
      }
    }

    @Override public boolean visit(AstNode node) {
      if (node instanceof Name) {
        reference(((Name) node).getIdentifier());
        return false;
      }
      if (node instanceof PropertyGet) {
        scan(((PropertyGet) node).getTarget());
        return false;
      }
      if (node instanceof ObjectProperty) {
        scan(((ObjectProperty) node).getRight());
        return false;
      }
      if (node instanceof VariableInitializer) {
        scan(((VariableInitializer) node).getInitializer());
        return false;
      }
      if (!own) {
        return true;
      }
      if (node instanceof FunctionNode) {
        // References only; the nested function has its own declarations
        final VarScanner nested = new VarScanner(false);
        node.visit(nested);
        nested.referenceCounts.forEach((name, count) ->
            referenceCounts.merge(name, count, Integer::sum));
        return false;
      }
      if (node instanceof VariableDeclaration) {
        final boolean top = topLevel.contains(node);
        for (VariableInitializer variable
            : ((VariableDeclaration) node).getVariables()) {
          scan(variable.getInitializer());
          if (variable.getTarget() instanceof Name) {
            declare(((Name) variable.getTarget()).getIdentifier(), top);
          }
        }
        return false;
      }
      if (node instanceof ForInLoop) {
        final ForInLoop loop = (ForInLoop) node;
        final @Nullable String name = iteratorName(loop);
        if (name == null) {
          return true;
        }
        scan(loop.getIteratedObject());
        declarationCounts.merge(name, 1, Integer::sum);
        final int before = referenceCounts.getOrDefault(name, 0);
        scan(loop.getBody());
        loopReferenceCounts.put(name,
            referenceCounts.getOrDefault(name, 0) - before);
        return false;
      }
      if (node instanceof CatchClause) {
        final CatchClause catchClause = (CatchClause) node;
        catchNames.add(catchClause.getVarName().getIdentifier());
        scan(catchClause.getCatchCondition());
        scan(catchClause.getBody());
        return false;
      }
      return true;
    }

    private static @Nullable String iteratorName(ForInLoop loop) {
      if (!(loop.getIterator() instanceof VariableDeclaration)) {
        return null;
      }
      final List<VariableInitializer> variables =
          ((VariableDeclaration) loop.getIterator()).getVariables();
      return variables.size() == 1
          && variables.get(0).getTarget() instanceof Name
          ? ((Name) variables.get(0).getTarget()).getIdentifier()
          : null;
    }
  }

  /** Thrown when a node is outside the recognized subset. */
  private static class UnrecognizedException extends RuntimeException {
    UnrecognizedException(AstNode node) {
      super("not recognized: " + node.getClass().getSimpleName());
    }
  }
}

// End Recognizer.java
