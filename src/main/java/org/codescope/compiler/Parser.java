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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;
import java.util.function.ToIntFunction;
import org.codescope.CompilerError.Kind;
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
import org.codescope.compiler.ParseNode.TokenLeaf;
import org.codescope.compiler.ParseNode.Unary;
import org.codescope.compiler.ParseNode.VarDecl;
import org.codescope.compiler.ParseNode.While;
import org.codescope.util.StringUtil;

/**
 * A recursive-descent parser that builds a {@link ParseTree} from a token sequence.
 *
 * <p>Syntax errors are reported to the {@link Diagnostics} sink rather than aborting the parse. The
 * statement that contained the error is replaced by an ERROR node, and parsing resumes after the
 * next statement terminator ({@code ;}) or at the close of the enclosing block ({@code }}). A
 * missing {@code }} at the end of the input is reported once per unclosed block and the partial
 * blocks are kept.
 *
 * <p>For loops are parsed by slicing their tokens: everything up to the first top-level {@code ;}
 * is the FOR_INIT clause, the run up to the next {@code ;} is FOR_CONDITION, the run up to the
 * matching {@code )} is FOR_INCREMENT, and the brace-balanced run that follows (excluding the outer
 * braces) is FOR_BODY. Each slice is then parsed again on its own, by a Parser over just that
 * slice, to give the clause its structured form.
 */
public final class Parser {

  static final ImmutableSet<String> DECLARATION_KEYWORDS =
      ImmutableSet.of("let", "var", "const", "number", "string", "boolean");

  static final ImmutableSet<String> ASSIGNMENT_OPERATORS =
      ImmutableSet.of("=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=");

  private static final ImmutableSet<String> PREFIX_OPERATORS =
      ImmutableSet.of("!", "-", "+", "++", "--");

  private final List<Token> tokens;
  private final ParseTree.Builder tree;
  private final Diagnostics diagnostics;
  private final int maxDepth;

  /** The position reported for problems found at the end of {@link #tokens}. */
  private final int endLine;

  private final int endColumn;

  /** Index of the next token to be consumed. */
  private int pos;

  /** Current statement and expression nesting. */
  private int depth;

  private Parser(
      List<Token> tokens,
      ParseTree.Builder tree,
      Diagnostics diagnostics,
      int maxDepth,
      int depth,
      int endLine,
      int endColumn) {
    this.tokens = tokens;
    this.tree = tree;
    this.diagnostics = diagnostics;
    this.maxDepth = maxDepth;
    this.depth = depth;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Parses the given tokens with default options; see {@link #parse(List, Diagnostics, int)}. */
  public static ParseTree parse(List<Token> tokens, Diagnostics diagnostics) {
    return parse(tokens, diagnostics, CompilerOptions.DEFAULT.maxNestingDepth());
  }

  /**
   * Parses a complete program. COMMENT tokens are ignored. The result always has a PROGRAM root,
   * however many syntax errors were reported.
   *
   * @throws InternalFault if statements or expressions are nested more than {@code maxDepth} deep
   */
  public static ParseTree parse(List<Token> tokens, Diagnostics diagnostics, int maxDepth) {
    ImmutableList<Token> significant =
        tokens.stream()
            .filter(t -> t.kind() != Token.Kind.COMMENT)
            .collect(ImmutableList.toImmutableList());
    int endLine = 1;
    int endColumn = 1;
    if (!significant.isEmpty()) {
      Token last = significant.get(significant.size() - 1);
      endLine = last.line();
      endColumn = last.column() + last.lexeme().length();
    }
    ParseTree.Builder builder = new ParseTree.Builder();
    Parser parser = new Parser(significant, builder, diagnostics, maxDepth, 0, endLine, endColumn);
    return builder.build(parser.program());
  }

  /** Returns a Parser for a slice of this Parser's tokens, sharing its tree and diagnostics. */
  private Parser subParser(List<Token> slice, int sliceEndLine, int sliceEndColumn) {
    return new Parser(slice, tree, diagnostics, maxDepth, depth, sliceEndLine, sliceEndColumn);
  }

  // Token access

  private boolean atEnd() {
    return pos >= tokens.size();
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private boolean check(String symbol) {
    return !atEnd() && peek().is(symbol);
  }

  private boolean checkKeyword(String keyword) {
    return !atEnd() && peek().isKeyword(keyword);
  }

  private boolean checkAny(ImmutableSet<String> symbols) {
    if (atEnd()) {
      return false;
    }
    Token next = peek();
    return (next.kind() == Token.Kind.OPERATOR || next.kind() == Token.Kind.PUNCTUATION)
        && symbols.contains(next.lexeme());
  }

  @CanIgnoreReturnValue
  private Token advance() {
    return tokens.get(pos++);
  }

  /** Consumes the given symbol if it is next, and returns true if it did. */
  private boolean match(String symbol) {
    if (check(symbol)) {
      pos++;
      return true;
    }
    return false;
  }

  /** Returns the text of the tokens from {@code start} up to (not including) the current one. */
  private String textFrom(int start) {
    return Token.text(tokens.subList(start, pos));
  }

  // Errors

  @FormatMethod
  private static CompileError syntaxError(Token at, String fmt, Object... fmtArgs) {
    return new CompileError(Kind.SYNTAX, String.format(fmt, fmtArgs), at.line(), at.column());
  }

  @FormatMethod
  private CompileError syntaxErrorAtEnd(String fmt, Object... fmtArgs) {
    return new CompileError(Kind.SYNTAX, String.format(fmt, fmtArgs), endLine, endColumn);
  }

  private CompileError unexpected(String expected) {
    if (atEnd()) {
      return syntaxErrorAtEnd("Missing %s at end of input", expected);
    }
    return syntaxError(peek(), "Unexpected token '%s', expected %s", peek().lexeme(), expected);
  }

  /** Consumes the given symbol, or throws an appropriate CompileError if it is not next. */
  @CanIgnoreReturnValue
  private Token expect(String symbol, String context) {
    if (check(symbol)) {
      return advance();
    } else if (atEnd()) {
      throw syntaxErrorAtEnd("Missing '%s' %s", symbol, context);
    }
    throw syntaxError(
        peek(), "Unexpected token '%s', expected '%s' %s", peek().lexeme(), symbol, context);
  }

  private Token expectIdentifier(String context) {
    if (!atEnd() && peek().kind() == Token.Kind.IDENTIFIER) {
      return advance();
    }
    throw unexpected("identifier " + context);
  }

  private void expectSemicolon() {
    expect(";", "at end of statement");
  }

  /**
   * Increments the nesting depth, which must be matched by a call to {@link #exit}.
   *
   * @throws InternalFault if that exceeds the configured maximum
   */
  private void enter(Token at) {
    if (++depth > maxDepth) {
      throw new InternalFault(
          String.format(
              "Nesting depth exceeds the limit of %s at line %s, column %s",
              maxDepth, at.line(), at.column()),
          at.line(),
          at.column());
    }
  }

  private void exit() {
    depth--;
  }

  // Statements

  private int program() {
    List<Integer> statements = new ArrayList<>();
    while (!atEnd()) {
      statementInto(statements, false);
    }
    ImmutableList<Integer> list = ImmutableList.copyOf(statements);
    return tree.add(id -> new Program(id, 1, 1, list));
  }

  /**
   * Parses one statement and adds it to {@code out}. If the statement has a syntax error, reports
   * it, skips ahead to a recovery point, and adds an ERROR node instead.
   *
   * @param inBlock true if an unmatched {@code }} closes an enclosing block (and so should be left
   *     for the caller); otherwise a stray {@code }} is skipped
   */
  private void statementInto(List<Integer> out, boolean inBlock) {
    try {
      int statement = statement();
      if (statement != ParseNode.NONE) {
        out.add(statement);
      }
    } catch (CompileError e) {
      diagnostics.add(e.toDiagnostic());
      out.add(recover(e, inBlock));
    }
  }

  /**
   * Panic-mode recovery: skips tokens up to and including the next top-level {@code ;} or the
   * {@code }} that closes a block opened while skipping, or up to an unmatched {@code }}.
   */
  private int recover(CompileError e, boolean inBlock) {
    List<Token> skipped = new ArrayList<>();
    int braces = 0;
    while (!atEnd()) {
      Token t = peek();
      if (t.is("}")) {
        if (braces == 0 && inBlock) {
          break;
        }
        skipped.add(advance());
        if (braces <= 1) {
          break;
        }
        braces--;
        continue;
      } else if (t.is("{")) {
        braces++;
      } else if (t.is(";") && braces == 0) {
        skipped.add(advance());
        break;
      }
      skipped.add(advance());
    }
    ImmutableList<Integer> leaves = leaves(skipped);
    return tree.add(id -> new ParseNode.Error(id, e.line, e.column, e.msg, leaves));
  }

  /** Parses a statement, returning {@link ParseNode#NONE} for an empty statement. */
  private int statement() {
    if (atEnd()) {
      throw syntaxErrorAtEnd("Missing statement at end of input");
    }
    Token first = peek();
    enter(first);
    try {
      if (first.is("{")) {
        return block();
      } else if (first.is(";")) {
        advance();
        return ParseNode.NONE;
      } else if (first.kind() == Token.Kind.KEYWORD) {
        String keyword = first.lexeme();
        if (DECLARATION_KEYWORDS.contains(keyword)) {
          int decl = varDecl();
          expectSemicolon();
          return decl;
        }
        return switch (keyword) {
          case "function" -> functionDecl();
          case "if" -> ifStatement();
          case "while" -> whileStatement();
          case "for" -> forStatement();
          case "return" -> returnStatement();
          default -> throw syntaxError(first, "Unexpected token '%s'", keyword);
        };
      }
      int start = pos;
      int expression = expression();
      String text = textFrom(start);
      expectSemicolon();
      return tree.add(
          id -> new ExprStatement(id, first.line(), first.column(), expression, text));
    } finally {
      exit();
    }
  }

  private int block() {
    Token open = expect("{", "to start block");
    List<Integer> statements = new ArrayList<>();
    while (!atEnd() && !check("}")) {
      statementInto(statements, true);
    }
    if (atEnd()) {
      diagnostics.error(
          Kind.SYNTAX,
          endLine,
          endColumn,
          "Missing '}' to close block opened at line %s",
          open.line());
    } else {
      advance();
    }
    ImmutableList<Integer> list = ImmutableList.copyOf(statements);
    return tree.add(id -> new Block(id, open.line(), open.column(), list));
  }

  /** Parses a declaration, not including any terminating semicolon. */
  private int varDecl() {
    int start = pos;
    Token keyword = advance();
    Token name = expectIdentifier("after '" + keyword.lexeme() + "'");
    int init = ParseNode.NONE;
    if (check("=")) {
      advance();
      init = expression();
    }
    int initId = init;
    String text = textFrom(start);
    return tree.add(
        id ->
            new VarDecl(
                id,
                keyword.line(),
                keyword.column(),
                keyword.lexeme(),
                name.lexeme(),
                initId,
                text));
  }

  private int functionDecl() {
    Token keyword = advance();
    Token name = expectIdentifier("after 'function'");
    expect("(", "after function name");
    ImmutableList.Builder<Integer> params = ImmutableList.builder();
    if (!check(")")) {
      do {
        Token param = expectIdentifier("in parameter list");
        params.add(
            tree.add(id -> new Identifier(id, param.line(), param.column(), param.lexeme())));
      } while (match(","));
    }
    expect(")", "after parameter list");
    if (!check("{")) {
      throw unexpected("'{' before function body");
    }
    int body = block();
    ImmutableList<Integer> paramList = params.build();
    return tree.add(
        id ->
            new ParseNode.Function(
                id, keyword.line(), keyword.column(), name.lexeme(), paramList, body));
  }

  private int ifStatement() {
    Token keyword = advance();
    expect("(", "after 'if'");
    int conditionStart = pos;
    int condition = expression();
    String conditionText = textFrom(conditionStart);
    expect(")", "after if condition");
    int thenBranch = statement();
    int elseBranch = ParseNode.NONE;
    if (checkKeyword("else")) {
      advance();
      elseBranch = statement();
    }
    int elseId = elseBranch;
    return tree.add(
        id ->
            new If(
                id,
                keyword.line(),
                keyword.column(),
                condition,
                thenBranch,
                elseId,
                conditionText));
  }

  private int whileStatement() {
    Token keyword = advance();
    expect("(", "after 'while'");
    int conditionStart = pos;
    int condition = expression();
    String conditionText = textFrom(conditionStart);
    expect(")", "after while condition");
    int body = statement();
    return tree.add(
        id -> new While(id, keyword.line(), keyword.column(), condition, body, conditionText));
  }

  private int returnStatement() {
    int start = pos;
    Token keyword = advance();
    int value = ParseNode.NONE;
    if (!atEnd() && !check(";")) {
      value = expression();
    }
    int valueId = value;
    String text = textFrom(start);
    expectSemicolon();
    return tree.add(id -> new Return(id, keyword.line(), keyword.column(), valueId, text));
  }

  // For loops

  private int forStatement() {
    Token keyword = advance();
    if (!check("(")) {
      throw unexpected("'(' after 'for'");
    }
    advance();

    int initStart = pos;
    int initEnd = scanHeader(";");
    pos = initEnd + 1;
    int conditionStart = pos;
    int conditionEnd = scanHeader(";");
    pos = conditionEnd + 1;
    int incrementStart = pos;
    int incrementEnd = scanHeader(")");
    pos = incrementEnd + 1;

    List<Token> bodySlice;
    int bodyEndLine;
    int bodyEndColumn;
    int braceless;
    if (check("{")) {
      Token open = advance();
      int bodyStart = pos;
      int braces = 1;
      while (!atEnd()) {
        Token t = peek();
        if (t.is("{")) {
          braces++;
        } else if (t.is("}") && --braces == 0) {
          break;
        }
        pos++;
      }
      bodySlice = tokens.subList(bodyStart, pos);
      braceless = ParseNode.NONE;
      if (atEnd()) {
        bodyEndLine = endLine;
        bodyEndColumn = endColumn;
        diagnostics.error(
            Kind.SYNTAX,
            endLine,
            endColumn,
            "Missing '}' to close for loop body opened at line %s",
            open.line());
      } else {
        Token close = advance();
        bodyEndLine = close.line();
        bodyEndColumn = close.column();
      }
    } else {
      // The body is the single statement that follows, parsed in place.
      int bodyStart = pos;
      int statement = statement();
      bodySlice = tokens.subList(bodyStart, pos);
      Token first = bodySlice.get(0);
      bodyEndLine = first.line();
      bodyEndColumn = first.column();
      braceless =
          tree.add(
              id ->
                  new Block(
                      id, first.line(), first.column(), ParseNode.handles(statement)));
    }

    Token initDelimiter = tokens.get(initEnd);
    Token conditionDelimiter = tokens.get(conditionEnd);
    Token incrementDelimiter = tokens.get(incrementEnd);
    int init =
        clause(
            ParseNode.Kind.FOR_INIT,
            tokens.subList(initStart, initEnd),
            initDelimiter.line(),
            initDelimiter.column(),
            Parser::forInit);
    int condition =
        clause(
            ParseNode.Kind.FOR_CONDITION,
            tokens.subList(conditionStart, conditionEnd),
            conditionDelimiter.line(),
            conditionDelimiter.column(),
            Parser::optionalExpression);
    int increment =
        clause(
            ParseNode.Kind.FOR_INCREMENT,
            tokens.subList(incrementStart, incrementEnd),
            incrementDelimiter.line(),
            incrementDelimiter.column(),
            Parser::optionalExpression);
    int body =
        (braceless == ParseNode.NONE)
            ? clause(
                ParseNode.Kind.FOR_BODY,
                bodySlice,
                bodyEndLine,
                bodyEndColumn,
                p -> p.statementList(bodyEndLine, bodyEndColumn))
            : forClause(
                ParseNode.Kind.FOR_BODY, bodySlice, bodyEndLine, bodyEndColumn, braceless);
    return tree.add(
        id -> new For(id, keyword.line(), keyword.column(), init, condition, increment, body));
  }

  /**
   * Returns the index of the next occurrence of {@code terminator} that is not nested in
   * parentheses or brackets, starting from the current position.
   *
   * @throws CompileError if the loop header ends (or a brace or semicolon intervenes) first; the
   *     current position is moved to the offending token so that recovery starts there
   */
  private int scanHeader(String terminator) {
    int nesting = 0;
    int i = pos;
    for (; i < tokens.size(); i++) {
      Token t = tokens.get(i);
      if (nesting == 0 && t.is(terminator)) {
        return i;
      } else if (t.is("(") || t.is("[")) {
        nesting++;
      } else if (t.is(")") || t.is("]")) {
        if (nesting == 0) {
          break;
        }
        nesting--;
      } else if (t.is("{") || t.is("}") || (t.is(";") && nesting == 0)) {
        break;
      }
    }
    pos = i;
    if (atEnd()) {
      throw syntaxErrorAtEnd("Missing '%s' in for loop header", terminator);
    }
    throw syntaxError(
        peek(), "Unexpected token '%s', missing '%s' in for loop header", peek().lexeme(),
        terminator);
  }

  /**
   * Adds a ForClause for the given slice: a TOKEN leaf for each token, plus the structured form
   * obtained by applying {@code structure} to a Parser over the slice. A syntax error in the
   * structured form is reported and leaves the clause with no structure.
   */
  private int clause(
      ParseNode.Kind kind,
      List<Token> slice,
      int sliceEndLine,
      int sliceEndColumn,
      ToIntFunction<Parser> structure) {
    Parser sub = subParser(slice, sliceEndLine, sliceEndColumn);
    int parsed;
    try {
      parsed = structure.applyAsInt(sub);
      if (!sub.atEnd()) {
        throw sub.unexpected("end of " + kind.name().toLowerCase().replace('_', ' '));
      }
    } catch (CompileError e) {
      diagnostics.add(e.toDiagnostic());
      parsed = ParseNode.NONE;
    }
    return forClause(kind, slice, sliceEndLine, sliceEndColumn, parsed);
  }

  /** Adds a ForClause with a TOKEN leaf for each token of {@code slice}. */
  private int forClause(
      ParseNode.Kind kind, List<Token> slice, int emptyLine, int emptyColumn, int parsed) {
    ImmutableList<Integer> leaves = leaves(slice);
    int line = slice.isEmpty() ? emptyLine : slice.get(0).line();
    int column = slice.isEmpty() ? emptyColumn : slice.get(0).column();
    String text = Token.text(slice);
    return tree.add(id -> new ForClause(id, kind, line, column, leaves, parsed, text));
  }

  private int forInit() {
    if (atEnd()) {
      return ParseNode.NONE;
    } else if (peek().kind() == Token.Kind.KEYWORD
        && DECLARATION_KEYWORDS.contains(peek().lexeme())) {
      return varDecl();
    }
    Token first = peek();
    int expression = expression();
    String text = textFrom(0);
    return tree.add(
        id -> new ExprStatement(id, first.line(), first.column(), expression, text));
  }

  private int optionalExpression() {
    return atEnd() ? ParseNode.NONE : expression();
  }

  /** Parses all remaining tokens as statements, recovering from errors, into a Block. */
  private int statementList(int line, int column) {
    List<Integer> statements = new ArrayList<>();
    while (!atEnd()) {
      statementInto(statements, false);
    }
    int blockLine = tokens.isEmpty() ? line : tokens.get(0).line();
    int blockColumn = tokens.isEmpty() ? column : tokens.get(0).column();
    ImmutableList<Integer> list = ImmutableList.copyOf(statements);
    return tree.add(id -> new Block(id, blockLine, blockColumn, list));
  }

  private ImmutableList<Integer> leaves(List<Token> slice) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (Token token : slice) {
      builder.add(tree.add(id -> new TokenLeaf(id, token)));
    }
    return builder.build();
  }

  // Expressions

  private int expression() {
    if (atEnd()) {
      throw syntaxErrorAtEnd("Missing expression at end of input");
    }
    Token first = peek();
    enter(first);
    try {
      return assignment();
    } finally {
      exit();
    }
  }

  private int assignment() {
    int target = logicalOr();
    if (!checkAny(ASSIGNMENT_OPERATORS)) {
      return target;
    }
    Token op = advance();
    ParseNode targetNode = tree.get(target);
    if (!isAssignable(targetNode)) {
      throw syntaxError(op, "Unexpected token '%s', invalid assignment target", op.lexeme());
    }
    int value = expression();
    return tree.add(
        id ->
            new Assign(
                id, targetNode.line(), targetNode.column(), op.lexeme(), target, value));
  }

  private static boolean isAssignable(ParseNode node) {
    return node instanceof Identifier || node instanceof Index || node instanceof Member;
  }

  /**
   * Parses a left-associative sequence of {@code operand}s separated by any of {@code ops}. Each
   * operator deepens the resulting tree by one, so each counts against the nesting limit.
   */
  private int binary(ImmutableSet<String> ops, IntSupplier operand) {
    int left = operand.getAsInt();
    int chained = 0;
    try {
      while (checkAny(ops)) {
        Token op = advance();
        enter(op);
        chained++;
        int right = operand.getAsInt();
        ParseNode leftNode = tree.get(left);
        int leftId = left;
        left =
            tree.add(
                id ->
                    new Binary(
                        id, leftNode.line(), leftNode.column(), op.lexeme(), leftId, right));
      }
    } finally {
      depth -= chained;
    }
    return left;
  }

  private static final ImmutableSet<String> OR = ImmutableSet.of("||");
  private static final ImmutableSet<String> AND = ImmutableSet.of("&&");
  private static final ImmutableSet<String> EQUALITY = ImmutableSet.of("==", "!=", "===", "!==");
  private static final ImmutableSet<String> COMPARISON = ImmutableSet.of("<", "<=", ">", ">=");
  private static final ImmutableSet<String> SHIFT = ImmutableSet.of("<<", ">>");
  private static final ImmutableSet<String> ADDITIVE = ImmutableSet.of("+", "-");
  private static final ImmutableSet<String> MULTIPLICATIVE = ImmutableSet.of("*", "/", "%");

  private int logicalOr() {
    return binary(OR, this::logicalAnd);
  }

  private int logicalAnd() {
    return binary(AND, this::equality);
  }

  private int equality() {
    return binary(EQUALITY, this::comparison);
  }

  private int comparison() {
    return binary(COMPARISON, this::shift);
  }

  private int shift() {
    return binary(SHIFT, this::additive);
  }

  private int additive() {
    return binary(ADDITIVE, this::multiplicative);
  }

  private int multiplicative() {
    return binary(MULTIPLICATIVE, this::unary);
  }

  private int unary() {
    if (!checkAny(PREFIX_OPERATORS)) {
      return postfix();
    }
    Token op = advance();
    enter(op);
    int operand;
    try {
      operand = unary();
    } finally {
      exit();
    }
    if ((op.is("++") || op.is("--")) && !isAssignable(tree.get(operand))) {
      throw syntaxError(op, "Unexpected token '%s', invalid increment target", op.lexeme());
    }
    return tree.add(id -> new Unary(id, op.line(), op.column(), op.lexeme(), operand, false));
  }

  private static final ImmutableSet<String> SUFFIXES = ImmutableSet.of("(", "[", ".", "++", "--");

  /**
   * Parses a primary expression followed by any calls, indexes, member accesses and postfix
   * increments. Each suffix counts against the nesting limit.
   */
  private int postfix() {
    int expr = primary();
    int chained = 0;
    try {
      while (checkAny(SUFFIXES)) {
        enter(peek());
        chained++;
        expr = suffix(expr);
      }
    } finally {
      depth -= chained;
    }
    return expr;
  }

  private int suffix(int object) {
    ParseNode node = tree.get(object);
    if (match("(")) {
      ImmutableList.Builder<Integer> args = ImmutableList.builder();
      if (!check(")")) {
        do {
          args.add(expression());
        } while (match(","));
      }
      expect(")", "after arguments");
      ImmutableList<Integer> argList = args.build();
      return tree.add(id -> new Call(id, node.line(), node.column(), object, argList));
    } else if (match("[")) {
      int index = expression();
      expect("]", "after index");
      return tree.add(id -> new Index(id, node.line(), node.column(), object, index));
    } else if (match(".")) {
      Token property = expectIdentifier("after '.'");
      return tree.add(
          id -> new Member(id, node.line(), node.column(), object, property.lexeme()));
    }
    Token op = peek();
    if (!isAssignable(node)) {
      throw syntaxError(op, "Unexpected token '%s', invalid increment target", op.lexeme());
    }
    advance();
    return tree.add(id -> new Unary(id, node.line(), node.column(), op.lexeme(), object, true));
  }

  private int primary() {
    if (atEnd()) {
      throw syntaxErrorAtEnd("Missing expression at end of input");
    }
    Token t = peek();
    switch (t.kind()) {
      case LITERAL:
        advance();
        return tree.add(id -> literal(id, t));
      case IDENTIFIER:
        advance();
        return tree.add(id -> new Identifier(id, t.line(), t.column(), t.lexeme()));
      default:
        break;
    }
    if (t.is("(")) {
      advance();
      int inner = expression();
      expect(")", "to close parenthesized expression");
      return inner;
    } else if (t.is("[")) {
      advance();
      ImmutableList.Builder<Integer> elements = ImmutableList.builder();
      if (!check("]")) {
        do {
          elements.add(expression());
        } while (match(","));
      }
      expect("]", "to close array literal");
      ImmutableList<Integer> list = elements.build();
      return tree.add(id -> new ArrayLiteral(id, t.line(), t.column(), list));
    }
    throw syntaxError(t, "Unexpected token '%s', expected expression", t.lexeme());
  }

  private static Literal literal(int id, Token t) {
    String text = t.lexeme();
    Literal.Type type;
    String value;
    if (Lexer.BOOLEAN_LITERALS.contains(text)) {
      type = Literal.Type.BOOLEAN;
      value = text;
    } else if (text.charAt(0) == '"' || text.charAt(0) == '\'') {
      type = Literal.Type.STRING;
      value = StringUtil.unescape(text);
    } else {
      type = Literal.Type.NUMBER;
      value = text;
    }
    return new Literal(id, t.line(), t.column(), value, type);
  }
}
