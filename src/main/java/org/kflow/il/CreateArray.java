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

/** Allocates an array given its element type arguments and length. */
public final class CreateArray extends TemplateDefinition {
  public CreateArray(Value typeArguments, Value length, int deoptId) {
    super(deoptId, typeArguments, length);
  }

  @Override
  public String toString(PrintOptions options) {
    return "CreateArray(" + inputsToString(options) + ")";
  }
}
