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

package org.codescope.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Complexity estimates for a program.
 *
 * @param cyclomaticComplexity the number of IF, FOR and WHILE nodes in the control-flow graph, plus
 *     one
 * @param timeComplexity a big-O class such as "O(1)", "O(n^2)", "O(n log n)" or "O(2^n)"
 * @param spaceComplexity "O(1)" or "O(n)"
 * @param rationale the observations the estimate is based on, one sentence each
 */
public record ComplexityInfo(
    int cyclomaticComplexity,
    String timeComplexity,
    String spaceComplexity,
    ImmutableList<String> rationale) {

  public ComplexityInfo {
    Preconditions.checkArgument(cyclomaticComplexity >= 0);
  }
}
