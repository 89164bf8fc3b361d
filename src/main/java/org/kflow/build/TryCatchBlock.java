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
import org.kflow.il.BlockEntry;

/**
 * Marks the code being built as protected by an exception handler region. Blocks created while a
 * TryCatchBlock is innermost get its try index.
 *
 * <p>Intended to be used with try-with-resources; closing it makes the enclosing region current
 * again.
 */
final class TryCatchBlock implements AutoCloseable {
  private final BaseGraphBuilder builder;
  private final @Nullable TryCatchBlock outer;
  final int tryIndex;

  /** Enters a new region with a freshly allocated try index. */
  TryCatchBlock(BaseGraphBuilder builder) {
    this(builder, BlockEntry.INVALID_TRY_INDEX);
  }

  /**
   * Enters the region {@code tryIndex}, or a new region if {@code tryIndex} is {@link
   * BlockEntry#INVALID_TRY_INDEX}.
   */
  TryCatchBlock(BaseGraphBuilder builder, int tryIndex) {
    this.builder = builder;
    this.outer = builder.tryCatchBlock;
    this.tryIndex =
        (tryIndex == BlockEntry.INVALID_TRY_INDEX) ? builder.allocateTryIndex() : tryIndex;
    builder.tryCatchBlock = this;
  }

  @Nullable TryCatchBlock outer() {
    return outer;
  }

  @Override
  public void close() {
    Preconditions.checkState(builder.tryCatchBlock == this, "TryCatchBlocks closed out of order");
    builder.tryCatchBlock = outer;
  }
}
