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
import org.codescope.CompilationResult;
import org.codescope.CompilerError;
import org.codescope.analysis.ComplexityEstimator;
import org.codescope.analysis.ComplexityInfo;
import org.codescope.analysis.ControlFlowBuilder;
import org.codescope.analysis.ControlFlowGraph;
import org.codescope.analysis.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline over a source text: lexing, parsing, semantic analysis, control-flow
 * construction and complexity estimation, in that order, all reporting to a single {@link
 * Diagnostics} sink.
 *
 * <p>Lexical, syntax and semantic errors never stop the pipeline; every stage runs on whatever the
 * previous one produced, and all of the problems are returned together. An {@link InternalFault}
 * (or any other unexpected exception) aborts the compilation and is returned as the only error.
 *
 * <p>Compilation is synchronous, does no I/O, and shares no state between calls.
 */
public final class Compiler {

  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /** Compiles {@code source} with {@link CompilerOptions#DEFAULT}. */
  public static CompilationResult compile(String source) {
    return compile(source, CompilerOptions.DEFAULT);
  }

  public static CompilationResult compile(String source, CompilerOptions options) {
    Preconditions.checkNotNull(source);
    Preconditions.checkNotNull(options);
    try {
      return run(source, options);
    } catch (InternalFault e) {
      logger.warn("Compilation aborted at {}:{}: {}", e.line, e.column, e.getMessage());
      return CompilationResult.aborted(ErrorReporter.fromFault(e, source, options.contextLines()));
    } catch (RuntimeException e) {
      logger.error("Unexpected failure during compilation: {}", e.getMessage(), e);
      return CompilationResult.aborted(ErrorReporter.fromFault(e, source, options.contextLines()));
    }
  }

  private static CompilationResult run(String source, CompilerOptions options) {
    Diagnostics diagnostics = new Diagnostics();

    ImmutableList<Token> tokens = new Lexer(options.keepComments()).tokenize(source, diagnostics);
    logger.debug("Lexed {} tokens ({} lexical errors)", tokens.size(), diagnostics.size());

    int start = diagnostics.size();
    ParseTree tree = Parser.parse(tokens, diagnostics, options.maxNestingDepth());
    logger.debug("Parsed {} nodes ({} syntax errors)", tree.size(), diagnostics.size() - start);

    SemanticAnalyzer.Result semantics = SemanticAnalyzer.analyze(tree, diagnostics);
    logger.debug(
        "Analyzed {} scopes ({} semantic problems)",
        semantics.scopes().size(),
        semantics.errors().size());

    ControlFlowGraph flow = ControlFlowBuilder.build(tree);
    ComplexityInfo complexity = ComplexityEstimator.estimate(flow);
    logger.debug(
        "Built {} flow nodes; cyclomatic {}, time {}, space {}",
        flow.size(),
        complexity.cyclomaticComplexity(),
        complexity.timeComplexity(),
        complexity.spaceComplexity());

    ImmutableList<CompilerError> errors =
        ErrorReporter.aggregate(diagnostics.all(), source, options.contextLines());
    return new CompilationResult(tokens, tree, semantics.scopes(), flow, complexity, errors);
  }
}
