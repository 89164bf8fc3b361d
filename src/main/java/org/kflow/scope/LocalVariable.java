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

package org.kflow.scope;

import com.google.common.base.Preconditions;

/**
 * A variable slot chosen by the scope allocator. A variable either lives in a frame slot ({@link
 * #index}) or, if it is captured by a closure, in a heap-allocated context ({@link #contextLevel}
 * and {@link #contextIndex}).
 */
public final class LocalVariable {
  public final String name;

  /** The frame slot of an uncaptured variable; -1 for captured ones. */
  public final int index;

  public final boolean isCaptured;

  /** The context depth of the scope that owns a captured variable; 0 for uncaptured ones. */
  public final int contextLevel;

  /** The variable's slot within its context; -1 for uncaptured ones. */
  public final int contextIndex;

  /**
   * True for pseudo-locals created by the graph builder to give a stack value a name. Such a
   * variable must only be stored from a single block.
   */
  public final boolean isStackTemporary;

  private LocalVariable(
      String name,
      int index,
      boolean isCaptured,
      int contextLevel,
      int contextIndex,
      boolean isStackTemporary) {
    this.name = Preconditions.checkNotNull(name);
    this.index = index;
    this.isCaptured = isCaptured;
    this.contextLevel = contextLevel;
    this.contextIndex = contextIndex;
    this.isStackTemporary = isStackTemporary;
  }

  /** Returns an uncaptured variable stored in frame slot {@code index}. */
  public static LocalVariable local(String name, int index) {
    return new LocalVariable(name, index, false, 0, -1, false);
  }

  /** Returns a variable in slot {@code contextIndex} of the context at {@code contextLevel}. */
  public static LocalVariable captured(String name, int contextLevel, int contextIndex) {
    Preconditions.checkArgument(contextLevel >= 0 && contextIndex >= 0);
    return new LocalVariable(name, -1, true, contextLevel, contextIndex, false);
  }

  /** Returns a pseudo-local naming the operand stack slot {@code index}. */
  public static LocalVariable stackTemporary(String name, int index) {
    return new LocalVariable(name, index, false, 0, -1, true);
  }

  @Override
  public String toString() {
    return name;
  }
}
