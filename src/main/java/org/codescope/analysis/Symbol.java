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
 * A name declared in a {@link VariableScope}.
 *
 * @param type the declared type, or the initializer's type for untyped declarations
 * @param line the 1-based line of the declaration
 * @param column the 1-based column of the declaration
 * @param constant true if the name may not be assigned after its declaration
 */
public record Symbol(String name, Type type, int line, int column, boolean constant) {}
