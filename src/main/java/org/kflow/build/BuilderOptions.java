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
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Controls how a function is lowered. Instances are immutable; use {@link #builder} or {@link
 * #toBuilder} to make new ones. The defaults are those of a normal (non-inlining) optimizing
 * compile.
 */
public final class BuilderOptions {
  public static final BuilderOptions DEFAULT = builder().build();

  /**
   * If true, the function is being lowered to be inlined into a caller: constructs the inliner
   * can't handle cause a {@link BailoutException}, and the prologue has no stack overflow check.
   */
  public final boolean inlining;

  /** True if the graph will be optimized. */
  public final boolean optimizing;

  /** If true, every deopt id allocation is recorded with the context depth at that point. */
  public final boolean recordDeoptContexts;

  /** If true, the prologue checks argument counts against the arguments descriptor. */
  public final boolean checkArgumentCounts;

  /** If true, conditions are checked to be booleans and assert statements are compiled. */
  public final boolean checkedMode;

  /** The id of the first block allocated; the graph entry gets this id. */
  public final int firstBlockId;

  /** If true, the finished graph keeps a printed listing of itself. */
  public final boolean verbose;

  private BuilderOptions(Builder builder) {
    this.inlining = builder.inlining;
    this.optimizing = builder.optimizing;
    this.recordDeoptContexts = builder.recordDeoptContexts;
    this.checkArgumentCounts = builder.checkArgumentCounts;
    this.checkedMode = builder.checkedMode;
    this.firstBlockId = builder.firstBlockId;
    this.verbose = builder.verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setInlining(inlining)
        .setOptimizing(optimizing)
        .setRecordDeoptContexts(recordDeoptContexts)
        .setCheckArgumentCounts(checkArgumentCounts)
        .setCheckedMode(checkedMode)
        .setFirstBlockId(firstBlockId)
        .setVerbose(verbose);
  }

  @Override
  public String toString() {
    return String.format(
        "BuilderOptions{inlining=%s, optimizing=%s, recordDeoptContexts=%s,"
            + " checkArgumentCounts=%s, checkedMode=%s, firstBlockId=%s, verbose=%s}",
        inlining,
        optimizing,
        recordDeoptContexts,
        checkArgumentCounts,
        checkedMode,
        firstBlockId,
        verbose);
  }

  public static final class Builder {
    private boolean inlining;
    private boolean optimizing = true;
    private boolean recordDeoptContexts;
    private boolean checkArgumentCounts;
    private boolean checkedMode;
    private int firstBlockId;
    private boolean verbose;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setInlining(boolean inlining) {
      this.inlining = inlining;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOptimizing(boolean optimizing) {
      this.optimizing = optimizing;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setRecordDeoptContexts(boolean recordDeoptContexts) {
      this.recordDeoptContexts = recordDeoptContexts;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCheckArgumentCounts(boolean checkArgumentCounts) {
      this.checkArgumentCounts = checkArgumentCounts;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCheckedMode(boolean checkedMode) {
      this.checkedMode = checkedMode;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setFirstBlockId(int firstBlockId) {
      Preconditions.checkArgument(firstBlockId >= 0);
      this.firstBlockId = firstBlockId;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public BuilderOptions build() {
      return new BuilderOptions(this);
    }
  }
}
