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

/** Reads a field of a heap object. */
public final class LoadField extends TemplateDefinition {
  public final Slot slot;

  public LoadField(Value instance, Slot slot) {
    super(NO_DEOPT_ID, instance);
    this.slot = slot;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format("LoadField(%s.%s)", inputsToString(options), slot);
  }
}
