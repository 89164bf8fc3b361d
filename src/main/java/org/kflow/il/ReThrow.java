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
 * Rethrows an exception with its original stack trace. The exception bypasses the handler for
 * {@link #catchTryIndex} and propagates to the next enclosing one.
 */
public final class ReThrow extends Terminator {
  private final Value exception;
  private final Value stackTrace;
  public final int catchTryIndex;

  public ReThrow(Value exception, Value stackTrace, int catchTryIndex, int deoptId) {
    super(deoptId);
    this.exception = exception;
    this.stackTrace = stackTrace;
    this.catchTryIndex = catchTryIndex;
  }

  @Override
  public boolean isExceptionalExit() {
    return true;
  }

  @Override
  public int numInputs() {
    return 2;
  }

  @Override
  public Value input(int index) {
    return (index == 0) ? exception : stackTrace;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format("rethrow(%s) try=%s", inputsToString(options), catchTryIndex);
  }
}
