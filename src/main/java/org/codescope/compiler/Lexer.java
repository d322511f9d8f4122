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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.codescope.CompilerError.Kind;

/**
 * Splits source text into {@link Token}s.
 *
 * <p>Whitespace and comments are trivia: they are recognized (so that line and column tracking
 * stays correct) but, unless the Lexer was created with {@code keepComments}, not emitted.
 *
 * <p>Problems (an unterminated string or block comment, a malformed number, a character that
 * starts no token) are reported to the {@link Diagnostics} sink and scanning resumes after the
 * offending text, so one pass reports every lexical error. A Lexer has no state between calls.
 */
public final class Lexer {

  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "let", "var", "const", "number", "string", "boolean", "function", "if", "else", "while",
          "for", "return");

  /** Keywords that are lexed as LITERAL tokens. */
  static final ImmutableSet<String> BOOLEAN_LITERALS = ImmutableSet.of("true", "false");

  /** Operators, ordered so that the first match is always the longest. */
  static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "===", "!==", "<<=", ">>=", "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=",
          "*=", "/=", "%=", "<<", ">>", "+", "-", "*", "/", "%", "=", "<", ">", "!");

  private static final CharMatcher PUNCTUATION = CharMatcher.anyOf("(){}[];,.");

  private final boolean keepComments;

  public Lexer(boolean keepComments) {
    this.keepComments = keepComments;
  }

  public Lexer() {
    this(false);
  }

  /** Tokenizes {@code source}, reporting any lexical errors to {@code diagnostics}. */
  public ImmutableList<Token> tokenize(String source, Diagnostics diagnostics) {
    Scan scan = new Scan(source, diagnostics);
    scan.run();
    return scan.tokens.build();
  }

  /**
   * Tokenizes {@code source}, throwing a {@link CompileError} for the first lexical error rather
   * than recovering from it.
   */
  public ImmutableList<Token> tokenize(String source) {
    Diagnostics diagnostics = new Diagnostics();
    ImmutableList<Token> result = tokenize(source, diagnostics);
    if (diagnostics.size() != 0) {
      Diagnostic first = diagnostics.all().get(0);
      throw new CompileError(first.kind(), first.message(), first.line(), first.column());
    }
    return result;
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private static boolean isLineEnd(char c) {
    return c == '\n' || c == '\r';
  }

  /** The state of a single call to {@link #tokenize}. */
  private final class Scan {
    final String src;
    final Diagnostics diagnostics;
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();

    int pos;
    int line = 1;
    int column = 1;

    // Where the token currently being scanned started.
    int start;
    int startLine;
    int startColumn;

    Scan(String src, Diagnostics diagnostics) {
      this.src = src;
      this.diagnostics = diagnostics;
    }

    boolean atEnd() {
      return pos >= src.length();
    }

    /** Returns the character {@code ahead} positions past the current one, or NUL past the end. */
    char peek(int ahead) {
      int i = pos + ahead;
      return (i < src.length()) ? src.charAt(i) : '\0';
    }

    void advance() {
      char c = src.charAt(pos++);
      // A "\r\n" pair only counts as one line break, on the '\n'.
      if (c == '\n' || (c == '\r' && peek(0) != '\n')) {
        line++;
        column = 1;
      } else {
        column++;
      }
    }

    void emit(Token.Kind kind) {
      tokens.add(new Token(kind, src.substring(start, pos), startLine, startColumn, start));
    }

    void run() {
      while (!atEnd()) {
        start = pos;
        startLine = line;
        startColumn = column;
        char c = peek(0);
        if (Character.isWhitespace(c)) {
          advance();
        } else if (c == '/' && peek(1) == '/') {
          while (!atEnd() && !isLineEnd(peek(0))) {
            advance();
          }
          comment();
        } else if (c == '/' && peek(1) == '*') {
          blockComment();
        } else if (c >= '0' && c <= '9') {
          number();
        } else if (isIdentifierStart(c)) {
          word();
        } else if (c == '"' || c == '\'') {
          string(c);
        } else if (!operator()) {
          if (PUNCTUATION.matches(c)) {
            advance();
            emit(Token.Kind.PUNCTUATION);
          } else {
            int codePoint = src.codePointAt(pos);
            diagnostics.error(
                Kind.LEX,
                line,
                column,
                "Unexpected character '%s'",
                Character.toString(codePoint));
            for (int i = Character.charCount(codePoint); i > 0; i--) {
              advance();
            }
          }
        }
      }
    }

    void comment() {
      if (keepComments) {
        emit(Token.Kind.COMMENT);
      }
    }

    void blockComment() {
      advance();
      advance();
      while (!atEnd()) {
        if (peek(0) == '*' && peek(1) == '/') {
          advance();
          advance();
          comment();
          return;
        }
        advance();
      }
      diagnostics.error(Kind.LEX, startLine, startColumn, "Unterminated block comment");
    }

    void number() {
      while (Character.isDigit(peek(0))) {
        advance();
      }
      if (peek(0) == '.' && Character.isDigit(peek(1))) {
        advance();
        while (Character.isDigit(peek(0))) {
          advance();
        }
      }
      if (isIdentifierPart(peek(0))) {
        while (isIdentifierPart(peek(0))) {
          advance();
        }
        diagnostics.error(
            Kind.LEX, startLine, startColumn, "Malformed number '%s'", src.substring(start, pos));
        return;
      }
      emit(Token.Kind.LITERAL);
    }

    void word() {
      while (isIdentifierPart(peek(0))) {
        advance();
      }
      String text = src.substring(start, pos);
      if (BOOLEAN_LITERALS.contains(text)) {
        emit(Token.Kind.LITERAL);
      } else {
        emit(KEYWORDS.contains(text) ? Token.Kind.KEYWORD : Token.Kind.IDENTIFIER);
      }
    }

    void string(char quote) {
      advance();
      while (!atEnd() && !isLineEnd(peek(0))) {
        char c = peek(0);
        advance();
        if (c == quote) {
          emit(Token.Kind.LITERAL);
          return;
        } else if (c == '\\' && !atEnd() && !isLineEnd(peek(0))) {
          advance();
        }
      }
      diagnostics.error(Kind.LEX, startLine, startColumn, "Unterminated string literal");
    }

    /** If an operator starts at the current position, emits it and returns true. */
    boolean operator() {
      for (String op : OPERATORS) {
        if (src.startsWith(op, pos)) {
          for (int i = 0; i < op.length(); i++) {
            advance();
          }
          emit(Token.Kind.OPERATOR);
          return true;
        }
      }
      return false;
    }
  }
}
