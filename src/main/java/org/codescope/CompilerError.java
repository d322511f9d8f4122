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

package org.codescope;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A fully annotated diagnostic, as reported to consumers of a {@link CompilationResult}.
 *
 * @param message a human-readable description of the problem
 * @param line the 1-based line the problem was detected on
 * @param column the 1-based column the problem was detected at
 * @param severity whether this is an error or only a warning
 * @param kind the pipeline stage (or fault) that produced it
 * @param context the source lines surrounding {@code line}, joined with newlines
 * @param suggestions advisory hints for fixing the problem; never empty
 */
public record CompilerError(
    String message,
    int line,
    int column,
    Severity severity,
    Kind kind,
    String context,
    ImmutableList<String> suggestions) {

  public CompilerError {
    Preconditions.checkArgument(line >= 1 && column >= 1, "Bad position %s:%s", line, column);
    Preconditions.checkArgument(!suggestions.isEmpty(), "No suggestions for %s", message);
  }

  public enum Severity {
    ERROR,
    WARNING
  }

  /** The taxonomy of problems; all but {@link #INTERNAL} are recoverable. */
  public enum Kind {
    /** A malformed token, or an unterminated string or comment. */
    LEX,
    /** An unexpected or missing token. */
    SYNTAX,
    /** An undeclared identifier, redeclaration, type mismatch or unreachable code. */
    SEMANTIC,
    /** A violated stage precondition; aborts the whole compilation. */
    INTERNAL
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return String.format("%s %s at %s:%s: %s", severity, kind, line, column, message);
  }
}
