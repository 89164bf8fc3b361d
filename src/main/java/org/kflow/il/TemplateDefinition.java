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

/** A definition with a fixed number of inputs, supplied at construction. */
abstract class TemplateDefinition extends Definition {
  private final Value[] inputs;

  TemplateDefinition(int deoptId, Value... inputs) {
    super(deoptId);
    this.inputs = inputs;
  }

  @Override
  public final int numInputs() {
    return inputs.length;
  }

  @Override
  public final Value input(int index) {
    return inputs[index];
  }
}
