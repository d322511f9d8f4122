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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a pipeline stage finds one of its preconditions violated. Unlike the diagnostics
 * collected in {@link Diagnostics}, an InternalFault is not recoverable: {@link Compiler#compile}
 * abandons the remaining stages and reports only this fault.
 *
 * <p>The location is carried as fields rather than text, so that callers never need to parse it
 * out of the message.
 */
public class InternalFault extends RuntimeException {
  public final int line;
  public final int column;

  public InternalFault(String msg, int line, int column) {
    super(msg);
    this.line = Math.max(line, 1);
    this.column = Math.max(column, 1);
  }

  /** Creates an InternalFault with no useful location; it will be reported at 1:1. */
  public InternalFault(String msg) {
    this(msg, 1, 1);
  }

  /** Throws an InternalFault with the given message (and no location) unless {@code condition}. */
  @FormatMethod
  public static void check(boolean condition, String fmt, Object... fmtArgs) {
    if (!condition) {
      throw new InternalFault(String.format(fmt, fmtArgs));
    }
  }
}
