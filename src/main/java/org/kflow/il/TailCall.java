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

/** Leaves the function by jumping to a runtime stub, passing the arguments descriptor. */
public final class TailCall extends Terminator {
  public final String stub;
  private final Value argumentsDescriptor;

  public TailCall(String stub, Value argumentsDescriptor) {
    this.stub = stub;
    this.argumentsDescriptor = argumentsDescriptor;
  }

  @Override
  public boolean isExceptionalExit() {
    return true;
  }

  @Override
  public int numInputs() {
    return 1;
  }

  @Override
  public Value input(int index) {
    assert index == 0;
    return argumentsDescriptor;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format("tailcall %s(%s)", stub, inputsToString(options));
  }
}
