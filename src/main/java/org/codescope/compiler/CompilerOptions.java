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
import java.util.Properties;

/**
 * Tuning knobs for a compilation.
 *
 * @param contextLines how many source lines before and after an error line are included in its
 *     context snippet
 * @param maxNestingDepth the deepest statement or expression nesting the parser accepts; deeper
 *     input is reported as an internal fault rather than risking a stack overflow
 * @param keepComments if true, the lexer emits COMMENT tokens instead of discarding them
 */
public record CompilerOptions(int contextLines, int maxNestingDepth, boolean keepComments) {

  public static final CompilerOptions DEFAULT = new CompilerOptions(2, 200, false);

  public CompilerOptions {
    Preconditions.checkArgument(contextLines >= 0, "contextLines: %s", contextLines);
    Preconditions.checkArgument(maxNestingDepth > 0, "maxNestingDepth: %s", maxNestingDepth);
  }

  /**
   * Returns options read from {@code codescope.contextLines}, {@code codescope.maxNestingDepth}
   * and {@code codescope.keepComments}, falling back to {@link #DEFAULT} for any that are unset.
   */
  public static CompilerOptions fromProperties(Properties props) {
    String contextLines = props.getProperty("codescope.contextLines");
    String maxNestingDepth = props.getProperty("codescope.maxNestingDepth");
    String keepComments = props.getProperty("codescope.keepComments");
    return new CompilerOptions(
        (contextLines == null) ? DEFAULT.contextLines : Integer.parseInt(contextLines.trim()),
        (maxNestingDepth == null)
            ? DEFAULT.maxNestingDepth
            : Integer.parseInt(maxNestingDepth.trim()),
        (keepComments == null) ? DEFAULT.keepComments : Boolean.parseBoolean(keepComments.trim()));
  }

  /** Returns options read from the JVM's system properties; see {@link #fromProperties}. */
  public static CompilerOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  public CompilerOptions withContextLines(int contextLines) {
    return new CompilerOptions(contextLines, maxNestingDepth, keepComments);
  }

  public CompilerOptions withMaxNestingDepth(int maxNestingDepth) {
    return new CompilerOptions(contextLines, maxNestingDepth, keepComments);
  }

  public CompilerOptions withKeepComments(boolean keepComments) {
    return new CompilerOptions(contextLines, maxNestingDepth, keepComments);
  }
}
