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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import org.codescope.CompilationResult;
import org.codescope.CompilerError;
import org.codescope.CompilerError.Kind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the whole pipeline, as seen through {@link Compiler#compile}. */
@RunWith(JUnit4.class)
public class CompilerPipelineTest {

  private static final String UNTERMINATED = "function f() {\n  let x = 1;\n";

  @Test
  public void cleanProgram() {
    CompilationResult result =
        Compiler.compile("let total = 0;\nfor (let i = 0; i < 10; i++) {\n  total += i;\n}");
    assertThat(result.errors()).isEmpty();
    assertThat(result.hasErrors()).isFalse();
    assertThat(result.tokens()).isNotEmpty();
    assertThat(result.scopes()).hasSize(2);
    assertThat(result.complexity().timeComplexity()).isEqualTo("O(n)");
    assertThat(result.complexity().cyclomaticComplexity()).isEqualTo(2);
  }

  @Test
  public void forLoopHeaderIsSliced() {
    CompilationResult result = Compiler.compile("for(i=0;i<n;i++){x=x+1;}");
    ParseTree tree = result.parseTree();
    ParseNode.Program program = tree.node(tree.rootId(), ParseNode.Program.class);
    ParseNode forNode = tree.node(program.statements().get(0));
    assertThat(forNode.kind()).isEqualTo(ParseNode.Kind.FOR);
    assertThat(tree.children(forNode).stream().map(ParseNode::kind).collect(toImmutableList()))
        .containsExactly(
            ParseNode.Kind.FOR_INIT,
            ParseNode.Kind.FOR_CONDITION,
            ParseNode.Kind.FOR_INCREMENT,
            ParseNode.Kind.FOR_BODY)
        .inOrder();
    assertThat(result.complexity().timeComplexity()).isEqualTo("O(n)");
    // i, n and x are never declared.
    assertThat(result.errorsOfKind(Kind.SEMANTIC)).isNotEmpty();
  }

  @Test
  public void recoverableErrorsKeepPartialResults() {
    CompilationResult result = Compiler.compile(UNTERMINATED);
    assertThat(result.errors()).hasSize(1);
    CompilerError error = result.errors().get(0);
    assertThat(error.kind()).isEqualTo(Kind.SYNTAX);
    assertThat(error.line()).isEqualTo(2);
    assertThat(error.column()).isEqualTo(13);
    assertThat(error.suggestions()).isNotEmpty();
    assertThat(result.parseTree()).isNotNull();
    assertThat(result.controlFlow()).isNotNull();
    assertThat(result.complexity()).isNotNull();
    assertThat(result.scopes()).isNotEmpty();
  }

  @Test
  public void errorsFromSeveralStagesAreCollected() {
    CompilationResult result = Compiler.compile("let s = \"open;\nlet = 1;\ny = 2;");
    assertThat(result.errorsOfKind(Kind.LEX)).isNotEmpty();
    assertThat(result.errors()).isNotEmpty();
    for (int i = 1; i < result.errors().size(); i++) {
      CompilerError prev = result.errors().get(i - 1);
      CompilerError next = result.errors().get(i);
      boolean ordered =
          prev.line() < next.line()
              || (prev.line() == next.line() && prev.column() <= next.column());
      assertThat(ordered).isTrue();
    }
  }

  @Test
  public void internalFaultAbortsCompilation() {
    CompilationResult result =
        Compiler.compile(UNTERMINATED, CompilerOptions.DEFAULT.withMaxNestingDepth(2));
    assertThat(result.parseTree()).isNull();
    assertThat(result.controlFlow()).isNull();
    assertThat(result.complexity()).isNull();
    assertThat(result.tokens()).isEmpty();
    assertThat(result.scopes()).isEmpty();
    assertThat(result.errors()).hasSize(1);
    CompilerError error = result.errors().get(0);
    assertThat(error.kind()).isEqualTo(Kind.INTERNAL);
    assertThat(error.line()).isEqualTo(2);
    assertThat(error.message()).contains("Nesting depth exceeds the limit of 2");
    assertThat(error.context()).contains("let x = 1;");
  }

  @Test
  public void longOperatorChainIsAFaultNotACrash() {
    StringBuilder sum = new StringBuilder("let x = 1;\nlet y = x");
    for (int i = 0; i < 100_000; i++) {
      sum.append(" + x");
    }
    CompilationResult result = Compiler.compile(sum.append(';').toString());
    assertThat(result.parseTree()).isNull();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).kind()).isEqualTo(Kind.INTERNAL);
    assertThat(result.errors().get(0).line()).isEqualTo(2);
    assertThat(result.errors().get(0).message()).contains("Nesting depth exceeds the limit");
  }

  @Test
  public void longMemberChainIsAFaultNotACrash() {
    StringBuilder chain = new StringBuilder("let x = 1;\nx");
    for (int i = 0; i < 100_000; i++) {
      chain.append(".x");
    }
    CompilationResult result = Compiler.compile(chain.append(';').toString());
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).kind()).isEqualTo(Kind.INTERNAL);
  }

  @Test
  public void chainWithinTheLimitCompiles() {
    StringBuilder sum = new StringBuilder("let x = 1;\nlet y = x");
    for (int i = 0; i < 150; i++) {
      sum.append(" + x");
    }
    CompilationResult result = Compiler.compile(sum.append(';').toString());
    assertThat(result.errors()).isEmpty();
    assertThat(result.complexity().timeComplexity()).isEqualTo("O(1)");
  }

  @Test
  public void keepCommentsOnlyAffectsTokens() {
    String source = "// count\nlet x = 1; /* done */";
    CompilationResult plain = Compiler.compile(source);
    CompilationResult withComments =
        Compiler.compile(source, CompilerOptions.DEFAULT.withKeepComments(true));
    assertThat(withComments.tokens().size()).isEqualTo(plain.tokens().size() + 2);
    assertThat(withComments.errors()).isEqualTo(plain.errors());
    assertThat(withComments.complexity()).isEqualTo(plain.complexity());
  }

  @Test
  public void emptySource() {
    CompilationResult result = Compiler.compile("");
    assertThat(result.errors()).isEmpty();
    assertThat(result.controlFlow().size()).isEqualTo(2);
    assertThat(result.complexity().timeComplexity()).isEqualTo("O(1)");
  }

  @Test
  public void deterministic() {
    String source = "function fib(n) { if (n < 2) { return n; } return fib(n - 1) + fib(n - 2); }";
    assertThat(Compiler.compile(source)).isEqualTo(Compiler.compile(source));
    assertThat(Compiler.compile(UNTERMINATED)).isEqualTo(Compiler.compile(UNTERMINATED));
  }
}
