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

import org.codescope.CompilerError;

/**
 * A recoverable lexical or syntax error, thrown when a caller asked for strict behavior (see {@link
 * Lexer#tokenize(String)}) and used by the {@link Parser} to unwind to its recovery point.
 */
public class CompileError extends RuntimeException {
  public final String msg;
  public final CompilerError.Kind kind;
  public final int line;
  public final int column;

  public CompileError(CompilerError.Kind kind, String msg, int line, int column) {
    super(msg);
    this.msg = msg;
    this.kind = kind;
    this.line = line;
    this.column = column;
  }

  /** Returns the equivalent Diagnostic. */
  public Diagnostic toDiagnostic() {
    return Diagnostic.error(kind, msg, line, column);
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, line, column);
  }
}
