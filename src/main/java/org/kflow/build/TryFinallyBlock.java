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
import org.kflow.ast.Statement;

/**
 * Records a finally region being built, so that a jump out of it can replay its finalizer. The
 * saved state is what the finalizer must be translated with: the state in effect at the try
 * statement itself, outside the region. That includes the enclosing breakable, switch and catch
 * records, so that labels and case numbers inside the finalizer resolve as they do where it is
 * written.
 */
final class TryFinallyBlock implements AutoCloseable {
  private final FlowGraphBuilder builder;
  final @Nullable TryFinallyBlock outer;
  final Statement finalizer;
  final int contextDepth;
  final int tryDepth;
  final int tryIndex;
  final @Nullable BreakableBlock breakableBlock;
  final @Nullable SwitchBlock switchBlock;
  final @Nullable CatchBlock catchBlock;
  final int loopDepth;
  final int catchDepth;
  final int forInDepth;

  /** Must be created after the builder's try depth has been incremented for the region. */
  TryFinallyBlock(FlowGraphBuilder builder, Statement finalizer) {
    this.builder = builder;
    this.outer = builder.tryFinallyBlock;
    this.finalizer = finalizer;
    this.contextDepth = builder.contextDepth;
    this.tryDepth = builder.tryDepth - 1;
    this.tryIndex = builder.currentTryIndex();
    this.breakableBlock = builder.breakableBlock;
    this.switchBlock = builder.switchBlock;
    this.catchBlock = builder.catchBlock;
    this.loopDepth = builder.loopDepth;
    this.catchDepth = builder.catchDepth;
    this.forInDepth = builder.forInDepth;
    builder.tryFinallyBlock = this;
  }

  @Override
  public void close() {
    Preconditions.checkState(
        builder.tryFinallyBlock == this, "TryFinallyBlocks closed out of order");
    builder.tryFinallyBlock = outer;
  }
}
