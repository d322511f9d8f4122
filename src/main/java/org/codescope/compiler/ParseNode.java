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

package org.codescope.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A node of a {@link ParseTree}. There is one implementation per {@link Kind} (two kinds share
 * {@link ForClause}), each carrying only the fields that kind needs. Nodes refer to each other by
 * integer handle; the ParseTree that created them owns them all.
 *
 * <p>Code that needs to handle every kind of node should implement {@link Visitor}; code that
 * handles only some kinds should extend {@link VisitorBase}.
 */
public interface ParseNode {

  /** The handle used where an optional child is absent. */
  int NONE = -1;

  enum Kind {
    PROGRAM,
    BLOCK,
    VAR_DECL,
    FUNCTION,
    RETURN,
    IF,
    WHILE,
    FOR,
    FOR_INIT,
    FOR_CONDITION,
    FOR_INCREMENT,
    FOR_BODY,
    EXPR,
    ASSIGN,
    BINARY,
    UNARY,
    CALL,
    MEMBER,
    INDEX,
    ARRAY,
    IDENTIFIER,
    LITERAL,
    TOKEN,
    ERROR
  }

  /** This node's handle in its ParseTree. */
  int id();

  Kind kind();

  /** The 1-based line of the node's first token. */
  int line();

  /** The 1-based column of the node's first token. */
  int column();

  /** Handles of this node's children, in source order. */
  ImmutableList<Integer> children();

  <T> T accept(Visitor<T> visitor);

  /** One method for each implementation of ParseNode. */
  interface Visitor<T> {
    T visitProgram(Program node);

    T visitBlock(Block node);

    T visitVarDecl(VarDecl node);

    T visitFunction(Function node);

    T visitReturn(Return node);

    T visitIf(If node);

    T visitWhile(While node);

    T visitFor(For node);

    T visitForClause(ForClause node);

    T visitExprStatement(ExprStatement node);

    T visitAssign(Assign node);

    T visitBinary(Binary node);

    T visitUnary(Unary node);

    T visitCall(Call node);

    T visitMember(Member node);

    T visitIndex(Index node);

    T visitArrayLiteral(ArrayLiteral node);

    T visitIdentifier(Identifier node);

    T visitLiteral(Literal node);

    T visitTokenLeaf(TokenLeaf node);

    T visitError(Error node);
  }

  /** Returns the given handles in order, omitting any that are {@link #NONE}. */
  static ImmutableList<Integer> handles(int... ids) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int id : ids) {
      if (id != NONE) {
        builder.add(id);
      }
    }
    return builder.build();
  }

  /** The root of every tree. */
  record Program(int id, int line, int column, ImmutableList<Integer> statements)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.PROGRAM;
    }

    @Override
    public ImmutableList<Integer> children() {
      return statements;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitProgram(this);
    }
  }

  /**
   * A braced statement list. Also used for the structured form of a FOR_BODY clause, in which case
   * it has the position of the clause's first token.
   */
  record Block(int id, int line, int column, ImmutableList<Integer> statements)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public ImmutableList<Integer> children() {
      return statements;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBlock(this);
    }
  }

  /**
   * A variable declaration, e.g. {@code let x = 1} or {@code string s}.
   *
   * @param keyword the declaring keyword, which may name the declared type
   * @param init the initializer expression, or {@link #NONE}
   * @param text the declaration's source text, for display
   */
  record VarDecl(
      int id, int line, int column, String keyword, String name, int init, String text)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.VAR_DECL;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(init);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVarDecl(this);
    }

    public boolean isConstant() {
      return keyword.equals("const");
    }
  }

  /**
   * A function declaration.
   *
   * @param params handles of the parameters' {@link Identifier} nodes
   * @param body handle of the {@link Block} body
   */
  record Function(
      int id, int line, int column, String name, ImmutableList<Integer> params, int body)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.FUNCTION;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.<Integer>builder().addAll(params).add(body).build();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /** A return statement; {@code value} may be {@link #NONE}. */
  record Return(int id, int line, int column, int value, String text) implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** An if statement; {@code elseBranch} may be {@link #NONE}. */
  record If(
      int id,
      int line,
      int column,
      int condition,
      int thenBranch,
      int elseBranch,
      String conditionText)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(condition, thenBranch, elseBranch);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  record While(int id, int line, int column, int condition, int body, String conditionText)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    public ImmutableList<Integer> children() {
      return handles(condition, body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /**
   * A for loop. Its four children are always present, in this order, and are {@link ForClause}s of
   * kind FOR_INIT, FOR_CONDITION, FOR_INCREMENT and FOR_BODY.
   */
  record For(int id, int line, int column, int init, int condition, int increment, int body)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(init, condition, increment, body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  /**
   * One of the four parts of a for loop. Its children are {@link TokenLeaf}s, one for each token
   * in the part's slice of the source.
   *
   * <p>The clause also owns the structured form of that slice, {@code parsed}: a {@link VarDecl} or
   * {@link ExprStatement} for FOR_INIT, an expression for FOR_CONDITION and FOR_INCREMENT, and a
   * {@link Block} for FOR_BODY. {@code parsed} is {@link #NONE} if the slice is empty (FOR_BODY
   * always has a Block, possibly with no statements).
   */
  record ForClause(
      int id,
      Kind kind,
      int line,
      int column,
      ImmutableList<Integer> tokens,
      int parsed,
      String text)
      implements ParseNode {
    static final ImmutableSet<Kind> KINDS =
        ImmutableSet.of(Kind.FOR_INIT, Kind.FOR_CONDITION, Kind.FOR_INCREMENT, Kind.FOR_BODY);

    public ForClause {
      Preconditions.checkArgument(KINDS.contains(kind), "Not a for clause: %s", kind);
    }

    @Override
    public ImmutableList<Integer> children() {
      return tokens;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitForClause(this);
    }
  }

  /** An expression evaluated for its side effects. */
  record ExprStatement(int id, int line, int column, int expression, String text)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.EXPR;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(expression);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExprStatement(this);
    }
  }

  /**
   * A simple ({@code =}) or compound ({@code +=} etc.) assignment. {@code target} is an {@link
   * Identifier}, {@link Index} or {@link Member}.
   */
  record Assign(int id, int line, int column, String operator, int target, int value)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(target, value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  record Binary(int id, int line, int column, String operator, int left, int right)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  /** A prefix or postfix unary operation, e.g. {@code !done} or {@code i++}. */
  record Unary(int id, int line, int column, String operator, int operand, boolean postfix)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    /** True for {@code ++} and {@code --}, which modify their operand. */
    public boolean isUpdate() {
      return operator.equals("++") || operator.equals("--");
    }
  }

  record Call(int id, int line, int column, int callee, ImmutableList<Integer> arguments)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.<Integer>builder().add(callee).addAll(arguments).build();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** A property access, e.g. {@code items.length}. */
  record Member(int id, int line, int column, int object, String property) implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.MEMBER;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(object);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMember(this);
    }
  }

  record Index(int id, int line, int column, int object, int index) implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.INDEX;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of(object, index);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIndex(this);
    }
  }

  record ArrayLiteral(int id, int line, int column, ImmutableList<Integer> elements)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.ARRAY;
    }

    @Override
    public ImmutableList<Integer> children() {
      return elements;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayLiteral(this);
    }
  }

  record Identifier(int id, int line, int column, String name) implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.IDENTIFIER;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  /**
   * A number, string or boolean literal.
   *
   * @param value the literal's value as text; string literals are unescaped and unquoted
   */
  record Literal(int id, int line, int column, String value, Type type) implements ParseNode {
    public enum Type {
      NUMBER,
      STRING,
      BOOLEAN
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /** A leaf wrapping a single token, used for the token slices of {@link ForClause}s. */
  record TokenLeaf(int id, Token token) implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.TOKEN;
    }

    @Override
    public int line() {
      return token.line();
    }

    @Override
    public int column() {
      return token.column();
    }

    /** The token's text. */
    public String value() {
      return token.lexeme();
    }

    @Override
    public ImmutableList<Integer> children() {
      return ImmutableList.of();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitTokenLeaf(this);
    }
  }

  /**
   * Marks where the parser recovered from a syntax error. Its children are {@link TokenLeaf}s for
   * the tokens that recovery skipped.
   */
  record Error(int id, int line, int column, String message, ImmutableList<Integer> skipped)
      implements ParseNode {
    @Override
    public Kind kind() {
      return Kind.ERROR;
    }

    @Override
    public ImmutableList<Integer> children() {
      return skipped;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitError(this);
    }
  }
}
