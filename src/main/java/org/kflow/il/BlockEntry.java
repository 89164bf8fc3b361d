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

package org.kflow.il;

import com.google.common.base.Preconditions;

/**
 * The first instruction of a basic block. Each block entry has a block id, allocated monotonically
 * by the builder, and the try index of the exception handler region that protects the block.
 */
public abstract class BlockEntry extends Instruction {

  /** The try index of blocks that are not protected by any exception handler. */
  public static final int INVALID_TRY_INDEX = -1;

  private final int blockId;
  private int tryIndex;

  protected BlockEntry(int blockId, int tryIndex) {
    Preconditions.checkArgument(blockId >= 0);
    this.blockId = blockId;
    this.tryIndex = tryIndex;
  }

  public final int blockId() {
    return blockId;
  }

  public final int tryIndex() {
    return tryIndex;
  }

  /**
   * Changes the try index of this block; used when a block built in one region becomes the target
   * of a resumption from another.
   */
  public final void setTryIndex(int tryIndex) {
    this.tryIndex = tryIndex;
  }

  /**
   * Returns the last instruction of this block, following {@link #next} links until an
   * instruction with no successor is found.
   */
  public final Instruction lastInstruction() {
    Instruction result = this;
    for (Instruction next = result.next(); next != null; next = next.next()) {
      result = next;
    }
    return result;
  }

  /** A short name for the kind of block, used when printing. */
  abstract String kindName();

  @Override
  public String toString(PrintOptions options) {
    StringBuilder sb = new StringBuilder(options.blockId(this)).append('[').append(kindName());
    if (tryIndex != INVALID_TRY_INDEX) {
      sb.append(" try=").append(tryIndex);
    }
    return sb.append(']').toString();
  }
}
