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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.jscore.ast.AstWriter;
import net.hydromatic.jscore.ast.Core;
import net.hydromatic.jscore.ast.Id;
import net.hydromatic.jscore.ast.Literal;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.CatchClause;
import org.mozilla.javascript.ast.ConditionalExpression;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForInLoop;
import org.mozilla.javascript.ast.ForLoop;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.IfStatement;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
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
 * Converts a core expression into a JavaScript syntax tree.
 *
 * <p>The expression is alpha-normalized first, so that each bound
 * identifier can be given a name that is unique in the program. Binding
 * forms become {@code var} declarations; where a binding form occurs in
 * expression position, it is wrapped in a function that is invoked
 * immediately. Loops become native loops; if the body of a loop creates
 * closures, the body is wrapped in a function so that each iteration has its
 * own variables.
 *
 * <p>Every operand that is not atomic is enclosed in parentheses, so the
 * output does not depend on JavaScript's operator precedence.
 */
public class Elaborator {
  private final Preferences preferences;
  private final Map<Id, String> externals;
  private final NameGenerator nameGenerator;
  private final Map<Id, String> names = new HashMap<>();

  private Elaborator(Preferences preferences, Map<Id, String> externals) {
    this.preferences = requireNonNull(preferences);
    this.externals = ImmutableMap.copyOf(externals);
    this.nameGenerator = new NameGenerator(preferences.naming());
    nameGenerator.reserve(root(preferences.globalName()));
    nameGenerator.reserve(root(preferences.runtimeName()));
    externals.values().forEach(name -> nameGenerator.reserve(root(name)));
  }

  /** Converts a ground expression into a JavaScript expression. */
  public static AstNode toProgram(Preferences preferences, Core.Exp exp) {
    return toProgram(preferences, ImmutableMap.of(), exp);
  }

  /** Converts an expression into a JavaScript expression. Each free
   * identifier must have a name in {@code externals}.
   *
   * @throws CompileException if a free identifier has no external name */
  public static AstNode toProgram(Preferences preferences,
      Map<Id, String> externals, Core.Exp exp) {
    final Core.Exp exp2 = prepare(externals, exp);
    return new Elaborator(preferences, externals).expr(exp2);
  }

  /** Converts an expression into a JavaScript script that evaluates the
   * expression for its effects. */
  public static AstRoot toScript(Preferences preferences,
      Map<Id, String> externals, Core.Exp exp) {
    final Core.Exp exp2 = prepare(externals, exp);
    final List<AstNode> statements = new ArrayList<>();
    new Elaborator(preferences, externals)
        .statements(exp2, Dest.DISCARD, statements);
    final AstRoot root = new AstRoot();
    statements.forEach(root::addChild);
    return root;
  }

  private static Core.Exp prepare(Map<Id, String> externals, Core.Exp exp) {
    final Core.Exp exp2 = AlphaNormalizer.alphaNormalize(exp);
    for (Id id : FreeFinder.freeIds(exp2)) {
      if (!externals.containsKey(id)) {
        throw new CompileException("free identifier '" + id
            + "' has no external name");
      }
    }
    return exp2;
  }

  /** Returns the first segment of a dotted name. */
  private static String root(String path) {
    final int i = path.indexOf('.');
    return i < 0 ? path : path.substring(0, i);
  }

  private String nameOf(Id id) {
    final String external = externals.get(id);
    if (external != null) {
      return external;
    }
    return names.computeIfAbsent(id, nameGenerator::get);
  }

  // expressions

  AstNode expr(Core.Exp exp) {
    switch (exp.op) {
    case CONSTANT:
      return literal(((Core.Constant) exp).literal);

    case VAR:
      return dotted(nameOf(((Core.Var) exp).id));

    case GLOBAL:
      AstNode node = dotted(preferences.globalName());
      for (String segment : ((Core.Global) exp).path) {
        node = member(node, segment);
      }
      return node;

    case RUNTIME:
      return dotted(preferences.runtimeName());

    case APPLY:
      final Core.Apply apply = (Core.Apply) exp;
      AstNode fn = expr(apply.fn);
      if (fn instanceof PropertyGet || fn instanceof ElementGet) {
        // Call the function without binding a receiver
        fn =
            new ParenthesizedExpression(
                new InfixExpression(Token.COMMA, number(0), fn, 0));
      }
      return call(new FunctionCall(), operand(fn), apply.args);

    case CALL:
      final Core.Call call = (Core.Call) exp;
      return call(new FunctionCall(),
          member(expr(call.receiver), call.method), call.args);

    case NEW:
      final Core.New new_ = (Core.New) exp;
      final AstNode constructor = expr(new_.constructor);
      return call(new NewExpression(),
          isPath(constructor) ? constructor
              : new ParenthesizedExpression(constructor),
          new_.args);

    case FIELD_GET:
      final Core.FieldGet fieldGet = (Core.FieldGet) exp;
      return member(expr(fieldGet.object), fieldGet.key);

    case FIELD_DELETE:
      final Core.FieldDelete fieldDelete = (Core.FieldDelete) exp;
      return new UnaryExpression(Token.DELPROP, 0,
          member(expr(fieldDelete.object), fieldDelete.key));

    case FIELD_SET:
      final Core.FieldSet fieldSet = (Core.FieldSet) exp;
      return new ParenthesizedExpression(
          new InfixExpression(Token.COMMA,
              assign(member(expr(fieldSet.object), fieldSet.key),
                  expr(fieldSet.value)),
              undefined(), 0));

    case VAR_SET:
      final Core.VarSet varSet = (Core.VarSet) exp;
      return new ParenthesizedExpression(
          new InfixExpression(Token.COMMA,
              assign(dotted(nameOf(varSet.id)), expr(varSet.value)),
              undefined(), 0));

    case BINARY:
      final Core.Binary binary = (Core.Binary) exp;
      return new InfixExpression(binary.binaryOp.token,
          operand(expr(binary.left)), operand(expr(binary.right)), 0);

    case UNARY:
      final Core.Unary unary = (Core.Unary) exp;
      return new UnaryExpression(unary.unaryOp.token, 0,
          operand(expr(unary.operand)));

    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      final ConditionalExpression conditional = new ConditionalExpression();
      conditional.setTestExpression(operand(expr(ifThenElse.condition)));
      conditional.setTrueExpression(operand(expr(ifThenElse.ifTrue)));
      conditional.setFalseExpression(operand(expr(ifThenElse.ifFalse)));
      return conditional;

    case SEQUENTIAL:
      final Core.Sequential sequential = (Core.Sequential) exp;
      return new InfixExpression(Token.COMMA,
          operand(expr(sequential.first)), operand(expr(sequential.second)),
          0);

    case LAMBDA:
      final Core.Lambda lambda = (Core.Lambda) exp;
      final List<String> params = new ArrayList<>();
      lambda.params.forEach(param -> params.add(nameOf(param)));
      return function(params,
          lambda.thisId == null ? null : nameOf(lambda.thisId),
          lambda.body, Dest.RETURN);

    case NEW_ARRAY:
      final ArrayLiteral array = new ArrayLiteral();
      for (Core.Exp element : ((Core.NewArray) exp).elements) {
        array.addElement(operand(expr(element)));
      }
      return array;

    case NEW_OBJECT:
      final ObjectLiteral object = new ObjectLiteral();
      for (Map.Entry<String, Core.Exp> field
          : ((Core.NewObject) exp).fields) {
        final ObjectProperty property = new ObjectProperty();
        property.setLeftAndRight(string(field.getKey()),
            operand(expr(field.getValue())));
        object.addElement(property);
      }
      return object;

    case NEW_REGEX:
      final Core.NewRegex newRegex = (Core.NewRegex) exp;
      final RegExpLiteral regex = new RegExpLiteral();
      regex.setValue(newRegex.body());
      if (!newRegex.flags().isEmpty()) {
        regex.setFlags(newRegex.flags());
      }
      return regex;

    default:
      // A statement in expression position
      return call(new FunctionCall(),
          new ParenthesizedExpression(
              function(ImmutableList.of(), null, exp, Dest.RETURN)),
          ImmutableList.of());
    }
  }

  private FunctionCall call(FunctionCall call, AstNode target,
      List<Core.Exp> args) {
    call.setTarget(target);
    for (Core.Exp arg : args) {
      call.addArgument(operand(expr(arg)));
    }
    return call;
  }

  /** Creates an access to a field, ".name" if the key is a string constant
   * that is a valid identifier, otherwise "[key]". */
  private AstNode member(AstNode target, Core.Exp key) {
    if (key instanceof Core.Constant
        && ((Core.Constant) key).literal.kind == Literal.Kind.STRING) {
      return member(target, ((Core.Constant) key).literal.stringValue());
    }
    return new ElementGet(memberTarget(target), expr(key));
  }

  private static AstNode member(AstNode target, String key) {
    if (AstWriter.isIdentifier(key)
        && !NameGenerator.RESERVED_WORDS.contains(key)) {
      return new PropertyGet(memberTarget(target), name(key));
    }
    return new ElementGet(memberTarget(target), string(key));
  }

  private static AstNode memberTarget(AstNode node) {
    return node instanceof NumberLiteral
        ? new ParenthesizedExpression(node)
        : operand(node);
  }

  private FunctionNode function(List<String> params, @Nullable String self,
      Core.Exp body, Dest dest) {
    final FunctionNode fn = new FunctionNode();
    params.forEach(param -> fn.addParam(name(param)));
    final Block block = new Block();
    if (self != null) {
      block.addStatement(var(self, keyword(Token.THIS)));
    }
    final List<AstNode> statements = new ArrayList<>();
    statements(body, dest, statements);
    statements.forEach(block::addStatement);
    fn.setBody(block);
    return fn;
  }

  // statements

  /** Converts an expression to a list of statements. */
  void statements(Core.Exp exp, Dest dest, List<AstNode> out) {
    switch (exp.op) {
    case LET:
      final Core.Let let = (Core.Let) exp;
      out.add(var(nameOf(let.id), expr(let.value)));
      statements(let.body, dest, out);
      return;

    case LET_REC:
      final Core.LetRec letRec = (Core.LetRec) exp;
      // Declare all names first, because a value may refer to a member that
      // is declared after it
      letRec.bindings.forEach(binding ->
          out.add(var(nameOf(binding.getKey()), null)));
      letRec.bindings.forEach(binding ->
          out.add(
              statement(
                  assign(name(nameOf(binding.getKey())),
                      expr(binding.getValue())))));
      statements(letRec.body, dest, out);
      return;

    case SEQUENTIAL:
      final Core.Sequential sequential = (Core.Sequential) exp;
      statements(sequential.first, Dest.DISCARD, out);
      statements(sequential.second, dest, out);
      return;

    case IF:
      final Core.If ifThenElse = (Core.If) exp;
      final IfStatement ifStatement = new IfStatement();
      ifStatement.setCondition(expr(ifThenElse.condition));
      ifStatement.setThenPart(block(ifThenElse.ifTrue, dest));
      if (dest == Dest.RETURN || !isUndefined(ifThenElse.ifFalse)) {
        ifStatement.setElsePart(block(ifThenElse.ifFalse, dest));
      }
      out.add(ifStatement);
      return;

    case WHILE:
      final Core.While while_ = (Core.While) exp;
      final WhileLoop whileLoop = new WhileLoop();
      whileLoop.setCondition(expr(while_.condition));
      whileLoop.setBody(loopBody(while_.body, ImmutableList.of()));
      out.add(whileLoop);
      returnUndefined(dest, out);
      return;

    case FOR_RANGE:
      final Core.ForRange forRange = (Core.ForRange) exp;
      final String i = nameOf(forRange.id);
      final String end = nameGenerator.get(Id.of("end"));
      final VariableDeclaration declaration = declaration(false);
      declaration.addVariable(initializer(i, expr(forRange.lower)));
      declaration.addVariable(initializer(end, expr(forRange.upper)));
      final ForLoop forLoop = new ForLoop();
      forLoop.setInitializer(declaration);
      forLoop.setCondition(
          new InfixExpression(Token.LE, name(i), name(end), 0));
      forLoop.setIncrement(
          assign(name(i),
              new InfixExpression(Token.ADD, name(i), number(1), 0)));
      forLoop.setBody(loopBody(forRange.body, ImmutableList.of(i)));
      out.add(forLoop);
      returnUndefined(dest, out);
      return;

    case FOR_EACH_FIELD:
      final Core.ForEachField forEachField = (Core.ForEachField) exp;
      final String x = nameOf(forEachField.id);
      final VariableDeclaration iterator = declaration(false);
      iterator.addVariable(initializer(x, null));
      final ForInLoop forInLoop = new ForInLoop();
      forInLoop.setIterator(iterator);
      forInLoop.setIteratedObject(expr(forEachField.object));
      forInLoop.setBody(loopBody(forEachField.body, ImmutableList.of(x)));
      out.add(forInLoop);
      returnUndefined(dest, out);
      return;

    case THROW:
      out.add(new ThrowStatement(expr(((Core.Throw) exp).exp)));
      return;

    case TRY_FINALLY:
      final Core.TryFinally tryFinally = (Core.TryFinally) exp;
      final TryStatement tryStatement = new TryStatement();
      tryStatement.setTryBlock(block(tryFinally.body, dest));
      tryStatement.setFinallyBlock(block(tryFinally.handler, Dest.DISCARD));
      out.add(tryStatement);
      return;

    case TRY_WITH:
      final Core.TryWith tryWith = (Core.TryWith) exp;
      final TryStatement tryCatch = new TryStatement();
      tryCatch.setTryBlock(block(tryWith.body, dest));
      final CatchClause catchClause = new CatchClause();
      catchClause.setVarName(name(nameOf(tryWith.id)));
      final Scope catchBody = new Scope();
      final List<AstNode> handler = new ArrayList<>();
      statements(tryWith.handler, dest, handler);
      handler.forEach(catchBody::addChild);
      catchClause.setBody(catchBody);
      tryCatch.addCatchClause(catchClause);
      out.add(tryCatch);
      return;

    case VAR_SET:
      final Core.VarSet varSet = (Core.VarSet) exp;
      out.add(
          statement(
              assign(dotted(nameOf(varSet.id)), expr(varSet.value))));
      returnUndefined(dest, out);
      return;

    case FIELD_SET:
      final Core.FieldSet fieldSet = (Core.FieldSet) exp;
      out.add(
          statement(
              assign(member(expr(fieldSet.object), fieldSet.key),
                  expr(fieldSet.value))));
      returnUndefined(dest, out);
      return;

    default:
      if (dest == Dest.RETURN) {
        final ReturnStatement returnStatement = new ReturnStatement();
        returnStatement.setReturnValue(expr(exp));
        out.add(returnStatement);
      } else if (!exp.isPure()) {
        out.add(statement(expr(exp)));
      }
    }
  }

  private Block block(Core.Exp exp, Dest dest) {
    final List<AstNode> statements = new ArrayList<>();
    statements(exp, dest, statements);
    final Block block = new Block();
    statements.forEach(block::addStatement);
    return block;
  }

  /** Converts the body of a loop. If the body creates closures, wraps it in
   * a function that is invoked with the loop variables, so that the
   * closures of each iteration see that iteration's variables. */
  private Block loopBody(Core.Exp body, List<String> vars) {
    if (!containsLambda(body)) {
      return block(body, Dest.DISCARD);
    }
    final FunctionCall call = new FunctionCall();
    call.setTarget(
        new ParenthesizedExpression(
            function(vars, null, body, Dest.DISCARD)));
    vars.forEach(v -> call.addArgument(name(v)));
    final Block block = new Block();
    block.addStatement(statement(call));
    return block;
  }

  private static void returnUndefined(Dest dest, List<AstNode> out) {
    if (dest == Dest.RETURN) {
      final ReturnStatement returnStatement = new ReturnStatement();
      returnStatement.setReturnValue(undefined());
      out.add(returnStatement);
    }
  }

  /** Returns whether an expression contains a lambda. The scopes that
   * {@link Core.Exp#fold} presents as lambdas do not count. */
  static boolean containsLambda(Core.Exp exp) {
    switch (exp.op) {
    case LAMBDA:
      return true;
    case LET:
      final Core.Let let = (Core.Let) exp;
      return containsLambda(let.value) || containsLambda(let.body);
    case LET_REC:
      final Core.LetRec letRec = (Core.LetRec) exp;
      return letRec.values().stream().anyMatch(Elaborator::containsLambda)
          || containsLambda(letRec.body);
    case FOR_EACH_FIELD:
      final Core.ForEachField forEachField = (Core.ForEachField) exp;
      return containsLambda(forEachField.object)
          || containsLambda(forEachField.body);
    case FOR_RANGE:
      final Core.ForRange forRange = (Core.ForRange) exp;
      return containsLambda(forRange.lower)
          || containsLambda(forRange.upper)
          || containsLambda(forRange.body);
    case TRY_WITH:
      final Core.TryWith tryWith = (Core.TryWith) exp;
      return containsLambda(tryWith.body) || containsLambda(tryWith.handler);
    default:
      return exp.fold(false, (b, e) -> b || containsLambda(e));
    }
  }

  private static boolean isUndefined(Core.Exp exp) {
    return exp instanceof Core.Constant
        && ((Core.Constant) exp).literal == Literal.UNDEFINED;
  }

  // node factories

  private static Name name(String name) {
    return new Name(0, name);
  }

  /** Converts a dotted name such as "a.b.c" into a chain of property
   * accesses. */
  private static AstNode dotted(String path) {
    final String[] segments = path.split("\\.");
    AstNode node = name(segments[0]);
    for (int i = 1; i < segments.length; i++) {
      node = new PropertyGet(node, name(segments[i]));
    }
    return node;
  }

  private static StringLiteral string(String s) {
    final StringLiteral literal = new StringLiteral();
    literal.setValue(s);
    literal.setQuoteCharacter('"');
    return literal;
  }

  private static KeywordLiteral keyword(int token) {
    final KeywordLiteral literal = new KeywordLiteral();
    literal.setType(token);
    return literal;
  }

  private static AstNode undefined() {
    return new UnaryExpression(Token.VOID, 0, number(0));
  }

  private static AstNode number(double d) {
    if (Double.isNaN(d)) {
      return new InfixExpression(Token.DIV, number(0), number(0), 0);
    }
    if (d < 0d || d == 0d && 1d / d < 0d) {
      return new UnaryExpression(Token.NEG, 0, operand(number(-d)));
    }
    if (Double.isInfinite(d)) {
      return new InfixExpression(Token.DIV, number(1), number(0), 0);
    }
    return new NumberLiteral(0, Literal.of(d).toString(), d);
  }

  private static AstNode literal(Literal literal) {
    switch (literal.kind) {
    case TRUE:
      return keyword(Token.TRUE);
    case FALSE:
      return keyword(Token.FALSE);
    case NULL:
      return keyword(Token.NULL);
    case UNDEFINED:
      return undefined();
    case STRING:
      return string(literal.stringValue());
    case INT:
      final long i = literal.longValue();
      if (i < 0) {
        return new UnaryExpression(Token.NEG, 0,
            new NumberLiteral(0, Long.toString(i).substring(1), -(double) i));
      }
      return new NumberLiteral(0, Long.toString(i), i);
    case DOUBLE:
      return number(literal.doubleValue());
    default:
      throw new AssertionError(literal.kind);
    }
  }

  private static Assignment assign(AstNode target, AstNode value) {
    return new Assignment(Token.ASSIGN, target, operand(value), 0);
  }

  private static VariableDeclaration declaration(boolean statement) {
    final VariableDeclaration declaration = new VariableDeclaration();
    declaration.setType(Token.VAR);
    declaration.setIsStatement(statement);
    return declaration;
  }

  private static VariableInitializer initializer(String name,
      @Nullable AstNode value) {
    final VariableInitializer initializer = new VariableInitializer();
    initializer.setTarget(name(name));
    if (value != null) {
      initializer.setInitializer(value.getType() == Token.COMMA
          ? new ParenthesizedExpression(value)
          : value);
    }
    return initializer;
  }

  /** Creates "var name = value;". */
  private static VariableDeclaration var(String name,
      @Nullable AstNode value) {
    final VariableDeclaration declaration = declaration(true);
    declaration.addVariable(initializer(name, value));
    return declaration;
  }

  /** Creates an expression statement, adding parentheses if the statement
   * would otherwise start with "function" or "{". */
  private static ExpressionStatement statement(AstNode node) {
    AstNode leftmost = node;
    for (;;) {
      if (leftmost instanceof InfixExpression) {
        leftmost = ((InfixExpression) leftmost).getLeft();
      } else if (leftmost instanceof ElementGet) {
        leftmost = ((ElementGet) leftmost).getTarget();
      } else if (leftmost instanceof FunctionCall
          && !(leftmost instanceof NewExpression)) {
        leftmost = ((FunctionCall) leftmost).getTarget();
      } else if (leftmost instanceof ConditionalExpression) {
        leftmost = ((ConditionalExpression) leftmost).getTestExpression();
      } else {
        break;
      }
    }
    if (leftmost instanceof FunctionNode
        || leftmost instanceof ObjectLiteral) {
      return new ExpressionStatement(new ParenthesizedExpression(node));
    }
    return new ExpressionStatement(node);
  }

  /** Returns whether a node is an identifier or a chain of property
   * accesses that starts with an identifier. */
  private static boolean isPath(AstNode node) {
    if (node instanceof PropertyGet) {
      return isPath(((PropertyGet) node).getTarget());
    }
    return node instanceof Name;
  }

  private static boolean isAtomic(AstNode node) {
    return node instanceof Name
        || node instanceof StringLiteral
        || node instanceof NumberLiteral
        || node instanceof KeywordLiteral
        || node instanceof RegExpLiteral
        || node instanceof PropertyGet
        || node instanceof ElementGet
        || node instanceof FunctionCall && !(node instanceof NewExpression)
        || node instanceof ArrayLiteral
        || node instanceof ObjectLiteral
        || node instanceof ParenthesizedExpression;
  }

  /** Encloses a node in parentheses if it is not atomic. */
  private static AstNode operand(AstNode node) {
    return isAtomic(node) ? node : new ParenthesizedExpression(node);
  }

  /** What to do with the value of an expression that is converted to
   * statements. */
  enum Dest {
    /** Return the value from the enclosing function. */
    RETURN,
    /** Evaluate the expression for its effects, and discard the value. */
    DISCARD
  }
}

// End Elaborator.java
