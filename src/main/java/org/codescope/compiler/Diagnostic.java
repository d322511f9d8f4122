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

import java.util.Comparator;
import org.codescope.CompilerError.Kind;
import org.codescope.CompilerError.Severity;

/**
 * A problem reported by one pipeline stage, before {@link ErrorReporter} attaches source context
 * and suggestions.
 */
public record Diagnostic(Kind kind, Severity severity, String message, int line, int column) {

  /** Orders diagnostics by line, then column. */
  public static final Comparator<Diagnostic> BY_POSITION =
      Comparator.comparingInt(Diagnostic::line).thenComparingInt(Diagnostic::column);

  public static Diagnostic error(Kind kind, String message, int line, int column) {
    return new Diagnostic(kind, Severity.ERROR, message, line, column);
  }

  public static Diagnostic warning(Kind kind, String message, int line, int column) {
    return new Diagnostic(kind, Severity.WARNING, message, line, column);
  }

  @Override
  public String toString() {
    return String.format("%s:%s %s", line, column, message);
  }
}
