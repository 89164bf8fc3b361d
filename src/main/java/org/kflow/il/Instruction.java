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

/**
 * An Instruction is one step of the graph being constructed. Instructions within a basic block are
 * doubly linked through {@link #next} and {@link #previous}; the first instruction of every block
 * is a {@link BlockEntry} and the last is a {@link Terminator}.
 *
 * <p>Instructions are owned by the graph they were built for and are never shared between graphs.
 */
public abstract class Instruction {

  /** The deopt id of instructions that can never deoptimize. */
  public static final int NO_DEOPT_ID = -1;

  private final int deoptId;
  private @Nullable Instruction next;
  private @Nullable Instruction previous;

  protected Instruction(int deoptId) {
    this.deoptId = deoptId;
  }

  protected Instruction() {
    this(NO_DEOPT_ID);
  }

  public final int deoptId() {
    return deoptId;
  }

  /** The instruction that follows this one in its block, or null if none has been linked yet. */
  public final @Nullable Instruction next() {
    return next;
  }

  public final @Nullable Instruction previous() {
    return previous;
  }

  /**
   * Makes {@code successor} the instruction that follows this one. A block entry can only be
   * reached through a {@link Goto} or a {@link Branch}, never by falling through.
   */
  public final void linkTo(Instruction successor) {
    Preconditions.checkState(!isTerminator(), "Cannot link past terminator %s", this);
    Preconditions.checkArgument(
        !(successor instanceof BlockEntry), "Cannot fall through into %s", successor);
    Preconditions.checkState(next == null, "%s is already linked", this);
    next = successor;
    successor.previous = this;
  }

  /** True if this instruction ends a block. */
  public boolean isTerminator() {
    return false;
  }

  /**
   * Returns the number of values this instruction reads.
   *
   * <p>The default implementation returns zero.
   */
  public int numInputs() {
    return 0;
  }

  /** Returns one of this instruction's inputs; requires {@code index < numInputs()}. */
  public Value input(int index) {
    throw new AssertionError();
  }

  /** Returns a printable description of this instruction. */
  public abstract String toString(PrintOptions options);

  @Override
  public String toString() {
    return toString(PrintOptions.DEFAULT);
  }

  /** Returns the inputs of this instruction, formatted with {@code options} and comma-separated. */
  protected final String inputsToString(PrintOptions options) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < numInputs(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(options.valueId(input(i).definition()));
    }
    return sb.toString();
  }
}
