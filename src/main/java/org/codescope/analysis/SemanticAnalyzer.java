/*
 * Copyright 2025 The Codescope Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.codescope.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.codescope.compiler.Diagnostic;
import org.codescope.compiler.Diagnostics;
import org.codescope.compiler.InternalFault;
import org.codescope.compiler.ParseNode;
import org.codescope.compiler.ParseNode.ArrayLiteral;
import org.codescope.compiler.ParseNode.Assign;
import org.codescope.compiler.ParseNode.Binary;
import org.codescope.compiler.ParseNode.Block;
import org.codescope.compiler.ParseNode.Call;
import org.codescope.compiler.ParseNode.ExprStatement;
import org.codescope.compiler.ParseNode.For;
import org.codescope.compiler.ParseNode.ForClause;
import org.codescope.compiler.ParseNode.Identifier;
import org.codescope.compiler.ParseNode.If;
import org.codescope.compiler.ParseNode.Index;
import org.codescope.compiler.ParseNode.Literal;
import org.codescope.compiler.ParseNode.Member;
import org.codescope.compiler.ParseNode.Program;
import org.codescope.compiler.ParseNode.Return;
import org.codescope.compiler.ParseNode.Unary;
import org.codescope.compiler.ParseNode.VarDecl;
import org.codescope.compiler.ParseNode.While;
import org.codescope.compiler.ParseTree;
import org.codescope.compiler.VisitorBase;
import org.jspecify.annotations.Nullable;

/**
 * Builds the scope tree for a ParseTree and checks it for name-resolution and type errors.
 *
 * <p>A scope is opened for the program, for each function (shared by its parameters and body), for
 * each for loop (shared by its header and body), and for every other block. Function declarations
 * are visible throughout the block that contains them; every other name is visible from its
 * declaration onwards. A few builtins ({@code print}, {@code len}, {@code console} and {@code
 * Math}) resolve without a declaration.
 *
 * <p>A scope's depth is the number of scopes enclosing it, so it matches the brace nesting of the
 * source with one exception: a for loop's scope is opened by its header, and a for loop whose body
 * has no braces still gets one scope level for its header's declarations.
 *
 * <p>Each visit method returns the static type of the visited expression; statements return
 * {@link Type#UNKNOWN}. Only number, string and boolean are checked; an operand of any other type
 * never causes a mismatch.
 */
public final class SemanticAnalyzer extends VisitorBase<Type> {

  /** The scopes of a program, in the order they were opened, and the problems found. */
  public record Result(ImmutableList<VariableScope> scopes, ImmutableList<Diagnostic> errors) {}

  static final ImmutableMap<String, Type> BUILTINS =
      ImmutableMap.of(
          "print", Type.FUNCTION,
          "len", Type.FUNCTION,
          "console", Type.UNKNOWN,
          "Math", Type.UNKNOWN);

  private static final ImmutableSet<String> ARITHMETIC_OPERATORS =
      ImmutableSet.of("-", "*", "/", "%", "<<", ">>");

  private static final ImmutableSet<String> COMPARISON_OPERATORS =
      ImmutableSet.of("<", ">", "<=", ">=");

  private static final ImmutableSet<String> EQUALITY_OPERATORS =
      ImmutableSet.of("==", "!=", "===", "!==");

  private static final ImmutableSet<String> LOGICAL_OPERATORS = ImmutableSet.of("&&", "||");

  /** A scope that is still being filled in. */
  private static class Frame {
    final int id;
    final @Nullable Frame parent;
    final int owner;
    final String label;
    final int line;
    final int column;
    final int depth;
    final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Frame(int id, @Nullable Frame parent, ParseNode owner, String label) {
      this.id = id;
      this.parent = parent;
      this.owner = owner.id();
      this.label = label;
      this.line = owner.line();
      this.column = owner.column();
      this.depth = (parent == null) ? 0 : parent.depth + 1;
    }

    VariableScope freeze() {
      return new VariableScope(
          id,
          (parent == null) ? VariableScope.NO_PARENT : parent.id,
          owner,
          label,
          line,
          column,
          depth,
          ImmutableMap.copyOf(symbols));
    }
  }

  private final List<Frame> frames = new ArrayList<>();

  /** Function declarations that were declared ahead of their position. */
  private final Set<Integer> hoisted = new HashSet<>();

  private @Nullable Frame current;

  private SemanticAnalyzer(ParseTree tree, Diagnostics diagnostics) {
    super(tree, diagnostics);
  }

  /**
   * Analyzes the given tree, adding any problems found to {@code diagnostics} and also returning
   * them, sorted by position.
   *
   * @throws InternalFault if there is no tree, or its root is not a PROGRAM
   */
  public static Result analyze(@Nullable ParseTree tree, Diagnostics diagnostics) {
    if (tree == null) {
      throw new InternalFault("Semantic analysis requires a parse tree");
    }
    ParseNode root = tree.root();
    if (!(root instanceof Program)) {
      throw new InternalFault(
          String.format("Parse tree root is %s, not PROGRAM", root.kind()),
          root.line(),
          root.column());
    }
    int start = diagnostics.size();
    SemanticAnalyzer analyzer = new SemanticAnalyzer(tree, diagnostics);
    analyzer.visit(tree.rootId());
    ImmutableList<VariableScope> scopes =
        analyzer.frames.stream().map(Frame::freeze).collect(ImmutableList.toImmutableList());
    return new Result(
        scopes, ImmutableList.sortedCopyOf(Diagnostic.BY_POSITION, diagnostics.since(start)));
  }

  private void push(ParseNode owner, String label) {
    current = new Frame(frames.size(), current, owner, label);
    frames.add(current);
  }

  private void pop() {
    current = current.parent;
  }

  /** Declares a name in the current scope, reporting a redeclaration. */
  private void declare(ParseNode at, String name, Type type, boolean constant) {
    Symbol previous = current.symbols.get(name);
    if (previous != null) {
      errorAt(
          at,
          "Redeclaration of '%s' in the same scope (first declared at line %s)",
          name,
          previous.line());
      return;
    }
    current.symbols.put(name, new Symbol(name, type, at.line(), at.column(), constant));
  }

  /** Returns the innermost visible declaration of {@code name}, or null. */
  private @Nullable Symbol resolve(String name) {
    for (Frame frame = current; frame != null; frame = frame.parent) {
      Symbol symbol = frame.symbols.get(name);
      if (symbol != null) {
        return symbol;
      }
    }
    return null;
  }

  /** Visits a statement list, after declaring the functions it contains. */
  private void statements(List<Integer> statements) {
    for (int id : statements) {
      if (tree.node(id) instanceof ParseNode.Function function) {
        declare(function, function.name(), Type.FUNCTION, false);
        hoisted.add(id);
      }
    }
    boolean returned = false;
    boolean reported = false;
    for (int id : statements) {
      ParseNode statement = tree.node(id);
      if (returned && !reported) {
        // Only the first statement after a return is reported.
        warningAt(statement, "Unreachable code after return statement");
        reported = true;
      }
      visit(id);
      returned |= statement instanceof Return;
    }
  }

  @Override
  public Type visitProgram(Program node) {
    push(node, "global");
    statements(node.statements());
    pop();
    return Type.UNKNOWN;
  }

  @Override
  public Type visitBlock(Block node) {
    push(node, "block");
    statements(node.statements());
    pop();
    return Type.UNKNOWN;
  }

  @Override
  public Type visitFunction(ParseNode.Function node) {
    if (!hoisted.contains(node.id())) {
      declare(node, node.name(), Type.FUNCTION, false);
    }
    push(node, "function " + node.name());
    for (int param : node.params()) {
      Identifier identifier = tree.node(param, Identifier.class);
      declare(identifier, identifier.name(), Type.UNKNOWN, false);
    }
    statements(tree.node(node.body(), Block.class).statements());
    pop();
    return Type.UNKNOWN;
  }

  @Override
  public Type visitVarDecl(VarDecl node) {
    @Nullable Type initType = (node.init() == ParseNode.NONE) ? null : visit(node.init());
    Type declared = Type.forKeyword(node.keyword());
    if (initType == null) {
      if (node.isConstant()) {
        error("Missing initializer for constant '%s'", node.name());
      }
    } else if (declared == Type.UNKNOWN) {
      declared = initType;
    } else if (declared.conflictsWith(initType)) {
      error(
          "Type mismatch: cannot initialize %s variable '%s' with %s",
          declared,
          node.name(),
          initType);
    }
    declare(node, node.name(), declared, node.isConstant());
    return Type.UNKNOWN;
  }

  @Override
  public Type visitReturn(Return node) {
    if (node.value() != ParseNode.NONE) {
      visit(node.value());
    }
    return Type.UNKNOWN;
  }

  @Override
  public Type visitIf(If node) {
    visit(node.condition());
    if (node.thenBranch() != ParseNode.NONE) {
      visit(node.thenBranch());
    }
    if (node.elseBranch() != ParseNode.NONE) {
      visit(node.elseBranch());
    }
    return Type.UNKNOWN;
  }

  @Override
  public Type visitWhile(While node) {
    visit(node.condition());
    if (node.body() != ParseNode.NONE) {
      visit(node.body());
    }
    return Type.UNKNOWN;
  }

  @Override
  public Type visitFor(For node) {
    push(node, "for");
    for (int id : ImmutableList.of(node.init(), node.condition(), node.increment())) {
      ForClause clause = tree.node(id, ForClause.class);
      if (clause.parsed() != ParseNode.NONE) {
        visit(clause.parsed());
      }
    }
    ForClause body = tree.node(node.body(), ForClause.class);
    if (body.parsed() != ParseNode.NONE) {
      statements(tree.node(body.parsed(), Block.class).statements());
    }
    pop();
    return Type.UNKNOWN;
  }

  @Override
  public Type visitExprStatement(ExprStatement node) {
    visit(node.expression());
    return Type.UNKNOWN;
  }

  @Override
  public Type visitError(ParseNode.Error node) {
    return Type.UNKNOWN;
  }

  @Override
  public Type visitAssign(Assign node) {
    Type value = visit(node.value());
    ParseNode target = tree.node(node.target());
    if (!(target instanceof Identifier identifier)) {
      visit(node.target());
      return value;
    }
    Symbol symbol = resolve(identifier.name());
    if (symbol == null) {
      if (!BUILTINS.containsKey(identifier.name())) {
        errorAt(identifier, "Undeclared variable '%s'", identifier.name());
      }
      return value;
    }
    if (symbol.constant()) {
      error("Cannot assign to constant '%s'", symbol.name());
    }
    if (node.operator().equals("=")) {
      if (symbol.type().conflictsWith(value)) {
        error(
            "Type mismatch: cannot assign %s to %s variable '%s'",
            value,
            symbol.type(),
            symbol.name());
      }
      return symbol.type();
    }
    String operator = node.operator().substring(0, node.operator().length() - 1);
    return binaryType(operator, symbol.type(), value);
  }

  @Override
  public Type visitBinary(Binary node) {
    Type left = visit(node.left());
    Type right = visit(node.right());
    return binaryType(node.operator(), left, right);
  }

  /** Returns the result type of a binary operation, reporting a mismatch at the current node. */
  private Type binaryType(String operator, Type left, Type right) {
    Type result;
    boolean ok;
    if (operator.equals("+")) {
      if (left == Type.STRING || right == Type.STRING) {
        result = Type.STRING;
        ok = left != Type.BOOLEAN && right != Type.BOOLEAN;
      } else {
        result = (left == Type.NUMBER && right == Type.NUMBER) ? Type.NUMBER : Type.UNKNOWN;
        ok = !(left.isChecked() && right.isChecked()) || result == Type.NUMBER;
      }
    } else if (ARITHMETIC_OPERATORS.contains(operator)) {
      result = Type.NUMBER;
      ok = isA(left, Type.NUMBER) && isA(right, Type.NUMBER);
    } else if (COMPARISON_OPERATORS.contains(operator)) {
      result = Type.BOOLEAN;
      ok =
          !(left.isChecked() && right.isChecked())
              ? isA(left, Type.NUMBER, Type.STRING) && isA(right, Type.NUMBER, Type.STRING)
              : left == right && left != Type.BOOLEAN;
    } else if (EQUALITY_OPERATORS.contains(operator)) {
      result = Type.BOOLEAN;
      ok = !left.conflictsWith(right);
    } else if (LOGICAL_OPERATORS.contains(operator)) {
      result = Type.BOOLEAN;
      ok = isA(left, Type.BOOLEAN) && isA(right, Type.BOOLEAN);
    } else {
      throw new InternalFault(
          String.format("Unknown binary operator '%s'", operator),
          currentNode().line(),
          currentNode().column());
    }
    if (!ok) {
      error(
          "Type mismatch: operator '%s' cannot be applied to %s and %s", operator, left, right);
    }
    return result;
  }

  /** True if {@code type} is unchecked or one of {@code allowed}. */
  private static boolean isA(Type type, Type... allowed) {
    if (!type.isChecked()) {
      return true;
    }
    for (Type t : allowed) {
      if (type == t) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Type visitUnary(Unary node) {
    Type operand = visit(node.operand());
    if (node.operator().equals("!")) {
      if (!isA(operand, Type.BOOLEAN)) {
        error("Type mismatch: operator '!' cannot be applied to %s", operand);
      }
      return Type.BOOLEAN;
    }
    if (!isA(operand, Type.NUMBER)) {
      error("Type mismatch: operator '%s' cannot be applied to %s", node.operator(), operand);
    }
    if (node.isUpdate() && tree.node(node.operand()) instanceof Identifier identifier) {
      Symbol symbol = resolve(identifier.name());
      if (symbol != null && symbol.constant()) {
        error("Cannot assign to constant '%s'", symbol.name());
      }
    }
    return Type.NUMBER;
  }

  @Override
  public Type visitCall(Call node) {
    Type callee = visit(node.callee());
    if (callee.isChecked()) {
      ParseNode calleeNode = tree.node(node.callee());
      String name =
          (calleeNode instanceof Identifier identifier) ? identifier.name() : "expression";
      error("Type mismatch: '%s' is a %s, not a function", name, callee);
    }
    for (int argument : node.arguments()) {
      visit(argument);
    }
    return Type.UNKNOWN;
  }

  @Override
  public Type visitMember(Member node) {
    visit(node.object());
    return node.property().equals("length") ? Type.NUMBER : Type.UNKNOWN;
  }

  @Override
  public Type visitIndex(Index node) {
    visit(node.object());
    visit(node.index());
    return Type.UNKNOWN;
  }

  @Override
  public Type visitArrayLiteral(ArrayLiteral node) {
    for (int element : node.elements()) {
      visit(element);
    }
    return Type.ARRAY;
  }

  @Override
  public Type visitIdentifier(Identifier node) {
    Symbol symbol = resolve(node.name());
    if (symbol != null) {
      return symbol.type();
    }
    Type builtin = BUILTINS.get(node.name());
    if (builtin != null) {
      return builtin;
    }
    error("Undeclared variable '%s'", node.name());
    return Type.UNKNOWN;
  }

  @Override
  public Type visitLiteral(Literal node) {
    return switch (node.type()) {
      case NUMBER -> Type.NUMBER;
      case STRING -> Type.STRING;
      case BOOLEAN -> Type.BOOLEAN;
    };
  }
}
