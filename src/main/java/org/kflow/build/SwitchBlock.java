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
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.kflow.il.JoinEntry;

/**
 * A SwitchBlock records a switch statement being built, so that {@code continue switch} can find
 * the case it jumps to.
 *
 * <p>Cases are numbered consecutively across all enclosing switches: the cases of the outermost
 * switch are numbered from 0, and the cases of a nested switch continue from the cases of the one
 * that encloses it ({@link #depth} is the number of the nested switch's first case). A case's join
 * is created on first use and cached.
 */
final class SwitchBlock implements AutoCloseable {
  private final FlowGraphBuilder builder;
  private final @Nullable SwitchBlock outer;
  private final Map<Integer, JoinEntry> destinations = new HashMap<>();
  private final int depth;
  private final int caseCount;
  private final @Nullable TryFinallyBlock outerFinally;
  private final int contextDepth;
  private final int tryIndex;

  SwitchBlock(FlowGraphBuilder builder, int caseCount) {
    this.builder = builder;
    this.outer = builder.switchBlock;
    this.depth = (outer == null) ? 0 : outer.depth + outer.caseCount;
    this.caseCount = caseCount;
    this.outerFinally = builder.tryFinallyBlock;
    this.contextDepth = builder.contextDepth;
    this.tryIndex = builder.currentTryIndex();
    builder.switchBlock = this;
  }

  int depth() {
    return depth;
  }

  /** True if the join for case {@code caseIndex} of this switch has been created. */
  boolean hadJumper(int caseIndex) {
    return destinations.containsKey(caseIndex);
  }

  /** Resolves the case with absolute number {@code targetIndex} in this or an enclosing switch. */
  JumpTarget destination(int targetIndex) {
    SwitchBlock block = this;
    while (block.depth > targetIndex) {
      block = block.outer;
      Preconditions.checkState(block != null, "No enclosing switch case %s", targetIndex);
    }
    return block.ensureDestination(targetIndex - block.depth);
  }

  /** Resolves case {@code caseIndex} of this switch. */
  JumpTarget destinationDirect(int caseIndex) {
    return ensureDestination(caseIndex);
  }

  private JumpTarget ensureDestination(int caseIndex) {
    Preconditions.checkState(
        caseIndex < caseCount, "Switch has %s cases, not %s", caseCount, caseIndex + 1);
    JoinEntry join = destinations.get(caseIndex);
    if (join == null) {
      join = builder.buildJoinEntry(tryIndex);
      destinations.put(caseIndex, join);
    }
    return new JumpTarget(join, outerFinally, contextDepth);
  }

  @Override
  public void close() {
    Preconditions.checkState(builder.switchBlock == this, "SwitchBlocks closed out of order");
    builder.switchBlock = outer;
  }
}
