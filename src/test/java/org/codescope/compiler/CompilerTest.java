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

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.codescope.CompilationResult;
import org.codescope.CompilerError;
import org.codescope.testing.TestdataScanner;
import org.codescope.testing.TestdataScanner.TestProgram;
import org.junit.Test;
import org.junit.runner.RunWith;

/**
 * Compiles each program in the .scope files in the testdata directory and checks the result
 * against the EXPECT comment that follows it.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/codescope/compiler/testdata");

  /**
   * Each program is followed by a comment that begins "{@code /* EXPECT}" on a line of its own.
   * Each following line of the comment is one expectation:
   *
   * <ul>
   *   <li>"{@code time: O(n)}", "{@code space: O(1)}" or "{@code cyclomatic: 3}" check the
   *       corresponding complexity estimate.
   *   <li>"{@code error: 2:5 Undeclared variable 'x'}" or "{@code warning: ...}" give the
   *       position and message of a diagnostic. Together these lines must list every diagnostic
   *       the compilation reports, in order; a comment with none expects a clean compilation.
   * </ul>
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("/\\* EXPECT *\\n(.*?)\\*/\\n*", Pattern.DOTALL);

  private static final Pattern EXPECTATION = Pattern.compile("(\\w+): *(.*)");

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    CompilationResult result = Compiler.compile(testProgram.code());
    assertWithMessage("Compilation aborted: %s", result.errors())
        .that(result.parseTree())
        .isNotNull();
    List<String> expectedDiagnostics = new ArrayList<>();
    Iterable<String> lines =
        Splitter.on('\n').trimResults().omitEmptyStrings().split(testProgram.comment());
    for (String line : lines) {
      Matcher matcher = EXPECTATION.matcher(line);
      assertWithMessage("Bad EXPECT line").that(matcher.matches()).isTrue();
      String value = matcher.group(2).trim();
      switch (matcher.group(1)) {
        case "time" ->
            assertWithMessage("time").that(result.complexity().timeComplexity()).isEqualTo(value);
        case "space" ->
            assertWithMessage("space")
                .that(result.complexity().spaceComplexity())
                .isEqualTo(value);
        case "cyclomatic" ->
            assertWithMessage("cyclomatic")
                .that(result.complexity().cyclomaticComplexity())
                .isEqualTo(Integer.parseInt(value));
        case "error", "warning" -> expectedDiagnostics.add(line);
        default -> throw new AssertionError("Unknown expectation: " + line);
      }
    }
    ImmutableList<String> actualDiagnostics =
        result.errors().stream()
            .map(CompilerTest::describe)
            .collect(ImmutableList.toImmutableList());
    assertWithMessage("diagnostics")
        .that(actualDiagnostics)
        .containsExactlyElementsIn(expectedDiagnostics)
        .inOrder();
  }

  private static String describe(CompilerError error) {
    return String.format(
        "%s: %s:%s %s",
        error.isError() ? "error" : "warning", error.line(), error.column(), error.message());
  }

  /** Returns each program, with its EXPECT comment, from the testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, ".scope", COMMENT_PATTERN);
    }
  }
}
