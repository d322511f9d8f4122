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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.codescope.CompilerError.Kind;

/**
 * A mutable sink for the recoverable problems found during one compilation. The same instance is
 * passed to each stage in turn; stages only ever append to it.
 */
public final class Diagnostics {
  private final List<Diagnostic> entries = new ArrayList<>();

  @CanIgnoreReturnValue
  public Diagnostic add(Diagnostic diagnostic) {
    entries.add(diagnostic);
    return diagnostic;
  }

  @FormatMethod
  @CanIgnoreReturnValue
  public Diagnostic error(Kind kind, int line, int column, String fmt, Object... fmtArgs) {
    return add(Diagnostic.error(kind, String.format(fmt, fmtArgs), line, column));
  }

  @FormatMethod
  @CanIgnoreReturnValue
  public Diagnostic warning(Kind kind, int line, int column, String fmt, Object... fmtArgs) {
    return add(Diagnostic.warning(kind, String.format(fmt, fmtArgs), line, column));
  }

  /** Returns everything reported so far, in the order it was reported. */
  public ImmutableList<Diagnostic> all() {
    return ImmutableList.copyOf(entries);
  }

  /** Returns the entries added since the sink held {@code start} entries. */
  public ImmutableList<Diagnostic> since(int start) {
    return ImmutableList.copyOf(entries.subList(start, entries.size()));
  }

  public int size() {
    return entries.size();
  }

  public long count(Kind kind) {
    return entries.stream().filter(d -> d.kind() == kind).count();
  }
}
