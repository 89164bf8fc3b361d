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
 * A point at which a suspended function resumes, paired with the try index that was active when it
 * suspended. The first continuation of a function is always its normal entry.
 */
public final class YieldContinuation {
  /** The instruction execution resumes after; control continues with its successor. */
  public final Instruction entry;

  public final int tryIndex;

  public YieldContinuation(Instruction entry, int tryIndex) {
    this.entry = entry;
    this.tryIndex = tryIndex;
  }

  @Override
  public String toString() {
    return String.format("YieldContinuation(%s, try=%s)", entry, tryIndex);
  }
}
