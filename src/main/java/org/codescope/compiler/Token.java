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

import java.util.List;

/**
 * The smallest lexical unit.
 *
 * @param kind the token's classification
 * @param lexeme the exact source text of the token
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 * @param offset 0-based index of the first character in the source
 */
public record Token(Kind kind, String lexeme, int line, int column, int offset) {

  public enum Kind {
    KEYWORD,
    IDENTIFIER,
    LITERAL,
    OPERATOR,
    PUNCTUATION,
    COMMENT
  }

  /** The offset just past the last character of this token. */
  public int end() {
    return offset + lexeme.length();
  }

  /** True if this token is an operator or punctuation with the given text. */
  public boolean is(String symbol) {
    return (kind == Kind.OPERATOR || kind == Kind.PUNCTUATION) && lexeme.equals(symbol);
  }

  /** True if this token is the given keyword. */
  public boolean isKeyword(String keyword) {
    return kind == Kind.KEYWORD && lexeme.equals(keyword);
  }

  /**
   * Returns the source text spanned by the given tokens, with any gap between adjacent tokens
   * (whitespace or comments) collapsed to a single space.
   */
  public static String text(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    Token prev = null;
    for (Token token : tokens) {
      if (prev != null && token.offset > prev.end()) {
        sb.append(' ');
      }
      sb.append(token.lexeme);
      prev = token;
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return String.format("%s '%s' (%s:%s)", kind, lexeme, line, column);
  }
}
