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

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.codescope.CompilerError;
import org.codescope.util.StringUtil;

/**
 * Turns the {@link Diagnostic}s collected during a compilation into the {@link CompilerError}s
 * reported to consumers: sorted by position, with a snippet of the surrounding source and a list of
 * suggestions attached to each.
 *
 * <p>Suggestions are advisory text chosen by matching the message against a fixed, ordered list of
 * patterns; every pattern that matches contributes its suggestions, in order.
 */
public final class ErrorReporter {

  // Static methods only
  private ErrorReporter() {}

  /** A message pattern and the suggestions offered when it matches. */
  private record SuggestionRule(Pattern pattern, ImmutableList<String> suggestions) {
    static SuggestionRule of(String regex, String... suggestions) {
      return new SuggestionRule(
          Pattern.compile(regex, Pattern.CASE_INSENSITIVE), ImmutableList.copyOf(suggestions));
    }
  }

  private static final ImmutableList<SuggestionRule> RULES =
      ImmutableList.of(
          SuggestionRule.of(
              "unexpected token",
              "Check for missing semicolons or braces",
              "Verify that all operators are valid",
              "Ensure proper syntax around the unexpected token"),
          SuggestionRule.of(
              "undefined variable|undeclared variable",
              "Declare the variable before using it",
              "Check for typos in variable names",
              "Verify the variable is in scope where it's being used"),
          SuggestionRule.of(
              "type mismatch",
              "Ensure variables are of compatible types",
              "Add explicit type conversion if needed",
              "Check the types of operands in expressions"),
          SuggestionRule.of(
              "missing \\S",
              "Add the missing element",
              "Check for proper nesting of code blocks",
              "Verify all required syntax elements are present"));

  static final ImmutableList<String> GENERIC_SUGGESTIONS =
      ImmutableList.of(
          "Review the syntax around the error location",
          "Check the language reference for correct usage",
          "Consider simplifying the code structure");

  /** Used only to recover a location from the message of an exception that doesn't carry one. */
  private static final Pattern LINE_PATTERN =
      Pattern.compile("line (\\d+)", Pattern.CASE_INSENSITIVE);

  private static final Pattern COLUMN_PATTERN =
      Pattern.compile("column (\\d+)", Pattern.CASE_INSENSITIVE);

  /**
   * Returns the given diagnostics as CompilerErrors, ordered by line and then column (diagnostics
   * at the same position keep their relative order).
   *
   * @param contextLines the number of lines before and after each error's line to include in its
   *     context snippet
   */
  public static ImmutableList<CompilerError> aggregate(
      List<Diagnostic> diagnostics, String source, int contextLines) {
    ImmutableList<String> lines = StringUtil.lines(source);
    return ImmutableList.sortedCopyOf(Diagnostic.BY_POSITION, diagnostics).stream()
        .map(
            d ->
                new CompilerError(
                    d.message(),
                    d.line(),
                    d.column(),
                    d.severity(),
                    d.kind(),
                    context(lines, d.line(), contextLines),
                    suggestions(d.message())))
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the single error reported when compilation is aborted by {@code fault}.
   *
   * <p>An {@link InternalFault} supplies its own location. Any other exception is located by
   * looking for "line N" and "column N" in its message, defaulting to line 1 and column 1.
   */
  public static CompilerError fromFault(Throwable fault, String source, int contextLines) {
    int line;
    int column;
    if (fault instanceof InternalFault internal) {
      line = internal.line;
      column = internal.column;
    } else {
      String message = MoreObjects.firstNonNull(fault.getMessage(), "");
      line = find(LINE_PATTERN, message);
      column = find(COLUMN_PATTERN, message);
    }
    String message =
        MoreObjects.firstNonNull(fault.getMessage(), fault.getClass().getSimpleName());
    return new CompilerError(
        message,
        line,
        column,
        CompilerError.Severity.ERROR,
        CompilerError.Kind.INTERNAL,
        context(StringUtil.lines(source), line, contextLines),
        suggestions(message));
  }

  private static int find(Pattern pattern, String message) {
    Matcher matcher = pattern.matcher(message);
    if (matcher.find()) {
      try {
        return Math.max(Integer.parseInt(matcher.group(1)), 1);
      } catch (NumberFormatException e) {
        // Too many digits to be a real position.
        return 1;
      }
    }
    return 1;
  }

  /**
   * Returns lines {@code line - contextLines} through {@code line + contextLines} (1-based, clamped
   * to the source) joined with newlines.
   */
  static String context(List<String> lines, int line, int contextLines) {
    int first = Math.max(1, line - contextLines);
    int last = Math.min(lines.size(), line + contextLines);
    if (first > last) {
      return "";
    }
    return Joiner.on('\n').join(lines.subList(first - 1, last));
  }

  /** Returns the suggestions for an error with the given message. */
  static ImmutableList<String> suggestions(String message) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (SuggestionRule rule : RULES) {
      if (rule.pattern().matcher(message).find()) {
        builder.addAll(rule.suggestions());
      }
    }
    ImmutableList<String> result = builder.build();
    return result.isEmpty() ? GENERIC_SUGGESTIONS : result;
  }
}
