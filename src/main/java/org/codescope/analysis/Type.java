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

/**
 * The static types tracked by semantic analysis. Only {@link #NUMBER}, {@link #STRING} and {@link
 * #BOOLEAN} take part in type checking; the others describe a symbol without ever conflicting.
 */
public enum Type {
  NUMBER("number"),
  STRING("string"),
  BOOLEAN("boolean"),
  ARRAY("array"),
  FUNCTION("function"),
  UNKNOWN("any");

  private final String displayName;

  Type(String displayName) {
    this.displayName = displayName;
  }

  /** True for the types that type checking compares. */
  public boolean isChecked() {
    return this == NUMBER || this == STRING || this == BOOLEAN;
  }

  /** True if both types are checked and differ. */
  public boolean conflictsWith(Type other) {
    return isChecked() && other.isChecked() && this != other;
  }

  /**
   * Returns the type named by a declaration keyword ({@code number}, {@code string} or {@code
   * boolean}), or UNKNOWN for the untyped keywords ({@code let}, {@code var}, {@code const}).
   */
  public static Type forKeyword(String keyword) {
    return switch (keyword) {
      case "number" -> NUMBER;
      case "string" -> STRING;
      case "boolean" -> BOOLEAN;
      default -> UNKNOWN;
    };
  }

  @Override
  public String toString() {
    return displayName;
  }
}
