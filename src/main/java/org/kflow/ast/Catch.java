/*
 * Copyright 2025 The Kflow Authors
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

package org.kflow.ast;

import org.jspecify.annotations.Nullable;

/** A catch clause; also the scope of its exception and stack trace variables. */
public final class Catch extends Node {
  /** The type this clause catches, or null if it catches everything. */
  public final @Nullable String guard;

  public final Statement.@Nullable VariableDeclaration exception;
  public final Statement.@Nullable VariableDeclaration stackTrace;
  public final Statement body;

  public Catch(
      int offset,
      @Nullable String guard,
      Statement.@Nullable VariableDeclaration exception,
      Statement.@Nullable VariableDeclaration stackTrace,
      Statement body) {
    super(offset);
    this.guard = guard;
    this.exception = exception;
    this.stackTrace = stackTrace;
    this.body = body;
  }
}
