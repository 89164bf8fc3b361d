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

/**
 * A merge point: the entry of a block that is reached by one or more {@link Goto}s. A join is
 * created once per logical target and shared by every jump to that target.
 */
public final class JoinEntry extends BlockEntry {
  private int incomingGotos;

  public JoinEntry(int blockId, int tryIndex) {
    super(blockId, tryIndex);
  }

  void addIncomingGoto() {
    incomingGotos++;
  }

  /**
   * True if at least one {@link Goto} to this join has been built. Gotos from code that later
   * turns out to be unreachable are included; {@link FlowGraph#predecessors} only counts
   * reachable ones.
   */
  public boolean isTargeted() {
    return incomingGotos != 0;
  }

  @Override
  String kindName() {
    return "join";
  }
}
