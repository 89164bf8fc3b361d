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
import org.jspecify.annotations.Nullable;
import org.kflow.scope.InferredType;

/**
 * An instruction that produces a value. While a definition's value sits on the builder's operand
 * stack it has a temp index (its position on that stack); once it has been consumed the index is
 * cleared.
 */
public abstract class Definition extends Instruction {

  private static final int NO_TEMP_INDEX = -1;

  private int tempIndex = NO_TEMP_INDEX;

  /** True if this value was given a named stack slot by {@code makeTemporary}. */
  private boolean materialized;

  private @Nullable InferredType resultType;

  protected Definition(int deoptId) {
    super(deoptId);
  }

  protected Definition() {}

  public final boolean hasTempIndex() {
    return tempIndex != NO_TEMP_INDEX;
  }

  public final int tempIndex() {
    Preconditions.checkState(hasTempIndex(), "%s is not on the operand stack", this);
    return tempIndex;
  }

  public final void setTempIndex(int tempIndex) {
    Preconditions.checkArgument(tempIndex >= 0);
    this.tempIndex = tempIndex;
  }

  public final void clearTempIndex() {
    tempIndex = NO_TEMP_INDEX;
  }

  public final boolean isMaterialized() {
    return materialized;
  }

  public final void markMaterialized() {
    materialized = true;
  }

  /** A type inferred for this value by an earlier analysis, or null if there is none. */
  public final @Nullable InferredType resultType() {
    return resultType;
  }

  public final void setResultType(@Nullable InferredType resultType) {
    this.resultType = resultType;
  }
}
