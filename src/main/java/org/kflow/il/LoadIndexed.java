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

/** Reads an element of an array. */
public final class LoadIndexed extends TemplateDefinition {
  public LoadIndexed(Value array, Value index, int deoptId) {
    super(deoptId, array, index);
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "LoadIndexed(%s[%s])",
        options.valueId(input(0).definition()),
        options.valueId(input(1).definition()));
  }
}
