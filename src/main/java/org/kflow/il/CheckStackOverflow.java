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
 * Checks for stack overflow and pending interrupts. Loop headers carry the loop depth so that the
 * optimizer can pick which checks to turn into on-stack-replacement points.
 */
public final class CheckStackOverflow extends Instruction {
  public final int loopDepth;
  public final boolean inPrologue;

  public CheckStackOverflow(int loopDepth, boolean inPrologue, int deoptId) {
    super(deoptId);
    this.loopDepth = loopDepth;
    this.inPrologue = inPrologue;
  }

  @Override
  public String toString(PrintOptions options) {
    if (inPrologue) {
      return "CheckStackOverflow(prologue)";
    }
    return "CheckStackOverflow(depth=" + loopDepth + ")";
  }
}
