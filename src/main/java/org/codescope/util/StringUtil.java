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

package org.codescope.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** A static-only class with helpers for string literals and source text. */
public class StringUtil {

  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r\n|\r|\n");

  /**
   * Given the text of a string literal including its quotes (either {@code "} or {@code '}),
   * returns the string it denotes. Unrecognized escapes ({@code \q}) stand for the escaped
   * character.
   */
  public static String unescape(String literal) {
    Preconditions.checkArgument(literal.length() >= 2, "Not a string literal: %s", literal);
    char quote = literal.charAt(0);
    Preconditions.checkArgument(
        (quote == '"' || quote == '\'') && literal.charAt(literal.length() - 1) == quote,
        "Not a string literal: %s",
        literal);
    StringBuilder sb = new StringBuilder(literal.length() - 2);
    int end = literal.length() - 1;
    for (int i = 1; i < end; i++) {
      char c = literal.charAt(i);
      if (c != '\\' || i + 1 == end) {
        sb.append(c);
        continue;
      }
      c = literal.charAt(++i);
      switch (c) {
        case 'n' -> sb.append('\n');
        case 't' -> sb.append('\t');
        case 'r' -> sb.append('\r');
        case '0' -> sb.append('\0');
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Splits source text into lines. Any of {@code \n}, {@code \r\n} or {@code \r} ends a line; the
   * result always has at least one element.
   */
  public static ImmutableList<String> lines(String source) {
    return ImmutableList.copyOf(LINE_SPLITTER.split(source));
  }

  private StringUtil() {}
}
