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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * A lexical region of the program and the names declared directly in it. Scopes form a tree that
 * mirrors block nesting; they refer to their parent by index in the scope list returned from
 * {@link SemanticAnalyzer#analyze}, in which every scope appears after its parent.
 *
 * @param id this scope's index in the scope list
 * @param parent the parent scope's index, or {@link #NO_PARENT} for the global scope
 * @param owner the handle of the parse node that introduced this scope
 * @param label a short description, e.g. "global", "block", "for" or "function fib"
 * @param depth 0 for the global scope, otherwise one more than the parent's depth
 * @param symbols the names declared in this scope, in declaration order
 */
public record VariableScope(
    int id,
    int parent,
    int owner,
    String label,
    int line,
    int column,
    int depth,
    ImmutableMap<String, Symbol> symbols) {

  public static final int NO_PARENT = -1;

  public boolean isGlobal() {
    return parent == NO_PARENT;
  }

  /** Returns the symbol with the given name declared directly in this scope, or null. */
  public @Nullable Symbol symbol(String name) {
    return symbols.get(name);
  }
}
