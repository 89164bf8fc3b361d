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

/** An unconditional jump to a {@link JoinEntry}. */
public final class Goto extends Terminator {
  public final JoinEntry destination;

  public Goto(JoinEntry destination, int deoptId) {
    super(deoptId);
    this.destination = destination;
    destination.addIncomingGoto();
  }

  @Override
  public ImmutableList<BlockEntry> successors() {
    return ImmutableList.of(destination);
  }

  @Override
  public String toString(PrintOptions options) {
    return "goto " + options.blockId(destination);
  }
}
