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

import com.google.common.collect.ImmutableList;
import org.codescope.analysis.ComplexityInfo;
import org.codescope.analysis.ControlFlowGraph;
import org.codescope.analysis.VariableScope;
import org.codescope.compiler.ParseTree;
import org.codescope.compiler.Token;
import org.jspecify.annotations.Nullable;

/**
 * Everything produced by one call to {@link org.codescope.compiler.Compiler#compile}. Viewers read
 * these fields and must not depend on anything else; the field names and nesting are kept stable.
 *
 * <p>If compilation only encountered recoverable problems, every structure is present (possibly
 * partial) alongside the full error list. If it was aborted by an internal fault, {@code
 * parseTree}, {@code controlFlow} and {@code complexity} are null, {@code tokens} and {@code
 * scopes} are empty, and {@code errors} holds the single synthesized error.
 *
 * <p>All components are immutable and structurally comparable, so compiling the same source twice
 * yields equal results.
 */
public record CompilationResult(
    ImmutableList<Token> tokens,
    @Nullable ParseTree parseTree,
    ImmutableList<VariableScope> scopes,
    @Nullable ControlFlowGraph controlFlow,
    @Nullable ComplexityInfo complexity,
    ImmutableList<CompilerError> errors) {

  /** Returns the result of a compilation that was aborted with the given error. */
  public static CompilationResult aborted(CompilerError error) {
    return new CompilationResult(
        ImmutableList.of(), null, ImmutableList.of(), null, null, ImmutableList.of(error));
  }

  /** True if any entry in {@link #errors} has ERROR (rather than WARNING) severity. */
  public boolean hasErrors() {
    return errors.stream().anyMatch(CompilerError::isError);
  }

  /** Returns the errors of the given kind, in the order they appear in {@link #errors}. */
  public ImmutableList<CompilerError> errorsOfKind(CompilerError.Kind kind) {
    return errors.stream().filter(e -> e.kind() == kind).collect(ImmutableList.toImmutableList());
  }
}
