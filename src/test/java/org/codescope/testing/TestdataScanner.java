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

package org.codescope.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Provides the programs in a testdata directory as test parameters. Each file with the given
 * extension holds one or more programs, each followed by a comment matching {@code
 * commentPattern}; group 1 of the pattern is the comment's content.
 */
public abstract class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /**
   * One program from a testdata file.
   *
   * @param name the file name and the program's 1-based index in it, e.g. "loops.scope#2"
   * @param code the program's source, starting on the line after the previous comment
   */
  public record TestProgram(String name, String code, String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final String extension;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, String extension, Pattern commentPattern) {
    this.dir = dir;
    this.extension = extension;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.toString().endsWith(extension)).sorted().toList()) {
        scan(file, result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void scan(Path file, ImmutableList.Builder<TestProgram> result) throws IOException {
    String content = Files.readString(file, StandardCharsets.UTF_8);
    Matcher matcher = commentPattern.matcher(content);
    int start = 0;
    int index = 0;
    while (matcher.find()) {
      index++;
      result.add(
          new TestProgram(
              file.getFileName() + "#" + index,
              content.substring(start, matcher.start()),
              matcher.group(1)));
      start = matcher.end();
    }
    if (start < content.length() && !content.substring(start).isBlank()) {
      throw new IllegalStateException(file + " ends with a program that has no comment");
    }
  }
}
