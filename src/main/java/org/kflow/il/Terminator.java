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

import com.google.common.collect.ImmutableList;

/** An instruction that ends a block; a fragment ending in a terminator is closed. */
public abstract class Terminator extends Instruction {
  protected Terminator(int deoptId) {
    super(deoptId);
  }

  protected Terminator() {}

  @Override
  public final boolean isTerminator() {
    return true;
  }

  /**
   * Returns the blocks control may pass to from here. The default implementation returns an empty
   * list, i.e. the terminator is an exit from the function.
   */
  public ImmutableList<BlockEntry> successors() {
    return ImmutableList.of();
  }

  /** True if leaving the function through this terminator is an exceptional exit. */
  public boolean isExceptionalExit() {
    return false;
  }
}
