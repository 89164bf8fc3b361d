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
import com.google.common.collect.ImmutableList;

/**
 * A two-way branch on a {@link Comparison}. The comparison is owned by the branch and does not
 * appear in the block's instruction list.
 */
public final class Branch extends Terminator {
  public final Comparison comparison;
  private final TargetEntry trueSuccessor;
  private final TargetEntry falseSuccessor;

  public Branch(
      Comparison comparison, TargetEntry trueSuccessor, TargetEntry falseSuccessor, int deoptId) {
    super(deoptId);
    Preconditions.checkArgument(trueSuccessor != falseSuccessor);
    this.comparison = comparison;
    this.trueSuccessor = trueSuccessor;
    this.falseSuccessor = falseSuccessor;
  }

  public TargetEntry trueSuccessor() {
    return trueSuccessor;
  }

  public TargetEntry falseSuccessor() {
    return falseSuccessor;
  }

  @Override
  public ImmutableList<BlockEntry> successors() {
    return ImmutableList.of(trueSuccessor, falseSuccessor);
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "if %s then %s else %s",
        comparison.toString(options),
        options.blockId(trueSuccessor),
        options.blockId(falseSuccessor));
  }
}
