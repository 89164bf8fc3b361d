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

package org.kflow.build;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.kflow.scope.LocalVariable;

/** Records the catch clause being built, so that {@code rethrow} knows what to rethrow. */
final class CatchBlock implements AutoCloseable {
  private final FlowGraphBuilder builder;
  private final @Nullable CatchBlock outer;
  final LocalVariable exceptionVariable;
  final LocalVariable stackTraceVariable;

  /** The try index of the region whose exceptions this clause handles. */
  final int catchTryIndex;

  CatchBlock(
      FlowGraphBuilder builder,
      LocalVariable exceptionVariable,
      LocalVariable stackTraceVariable,
      int catchTryIndex) {
    this.builder = builder;
    this.outer = builder.catchBlock;
    this.exceptionVariable = exceptionVariable;
    this.stackTraceVariable = stackTraceVariable;
    this.catchTryIndex = catchTryIndex;
    builder.catchBlock = this;
  }

  @Override
  public void close() {
    Preconditions.checkState(builder.catchBlock == this, "CatchBlocks closed out of order");
    builder.catchBlock = outer;
  }
}
