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
import org.kflow.il.JoinEntry;

/**
 * A BreakableBlock records a labeled statement or loop being built, so that {@code break} (and, for
 * loops, {@code continue}) can find its target. Breakable blocks are numbered by nesting depth:
 * the outermost has index 0 and each nested one has its parent's index plus one.
 *
 * <p>The join that a break goes to is only created when the first break to this block is resolved,
 * and is shared by all later ones; likewise for the continue join of a loop. The joins get the try
 * index that was current when the block was entered, and jumps to them restore the context depth
 * and leave the finally regions that were open at that point.
 */
final class BreakableBlock implements AutoCloseable {
  private final FlowGraphBuilder builder;
  private final @Nullable BreakableBlock outer;
  private final int index;
  private final boolean isLoop;
  private final @Nullable TryFinallyBlock outerFinally;
  private final int contextDepth;
  private final int tryIndex;
  private @Nullable JoinEntry destination;
  private @Nullable JoinEntry continueDestination;

  private BreakableBlock(FlowGraphBuilder builder, boolean isLoop) {
    this.builder = builder;
    this.outer = builder.breakableBlock;
    this.index = (outer == null) ? 0 : outer.index + 1;
    this.isLoop = isLoop;
    this.outerFinally = builder.tryFinallyBlock;
    this.contextDepth = builder.contextDepth;
    this.tryIndex = builder.currentTryIndex();
    builder.breakableBlock = this;
  }

  static BreakableBlock forLabel(FlowGraphBuilder builder) {
    return new BreakableBlock(builder, false);
  }

  static BreakableBlock forLoop(FlowGraphBuilder builder) {
    return new BreakableBlock(builder, true);
  }

  int index() {
    return index;
  }

  /** True if any break to this block has been resolved. */
  boolean hadJumper() {
    return destination != null;
  }

  /** The join that breaks go to, or null if there haven't been any. */
  @Nullable JoinEntry destination() {
    return destination;
  }

  /** The join that continues go to, or null if there haven't been any. */
  @Nullable JoinEntry continueDestination() {
    return continueDestination;
  }

  JoinEntry ensureDestination() {
    if (destination == null) {
      destination = builder.buildJoinEntry(tryIndex);
    }
    return destination;
  }

  /**
   * Returns the join that continues go to, creating it if necessary. Loops call this themselves
   * when the body can fall through to the next iteration.
   */
  JoinEntry ensureContinueDestination() {
    Preconditions.checkState(isLoop, "Breakable block %s is not a loop", index);
    if (continueDestination == null) {
      continueDestination = builder.buildJoinEntry(tryIndex);
    }
    return continueDestination;
  }

  /** Resolves a break to the enclosing breakable block with index {@code labelIndex}. */
  JumpTarget breakDestination(int labelIndex) {
    BreakableBlock block = find(labelIndex);
    return new JumpTarget(block.ensureDestination(), block.outerFinally, block.contextDepth);
  }

  /** Resolves a continue to the enclosing loop with index {@code labelIndex}. */
  JumpTarget continueDestination(int labelIndex) {
    BreakableBlock block = find(labelIndex);
    Preconditions.checkState(block.isLoop, "Continue to label %s, which is not a loop", labelIndex);
    return new JumpTarget(
        block.ensureContinueDestination(), block.outerFinally, block.contextDepth);
  }

  private BreakableBlock find(int labelIndex) {
    BreakableBlock block = this;
    while (block != null && block.index != labelIndex) {
      block = block.outer;
    }
    Preconditions.checkState(block != null, "No enclosing label %s", labelIndex);
    return block;
  }

  @Override
  public void close() {
    Preconditions.checkState(builder.breakableBlock == this, "BreakableBlocks closed out of order");
    builder.breakableBlock = outer;
  }
}
