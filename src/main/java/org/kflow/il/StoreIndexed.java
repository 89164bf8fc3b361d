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

/** Writes an element of an array; the stored value is also its result. */
public final class StoreIndexed extends TemplateDefinition {
  public final boolean emitStoreBarrier;

  public StoreIndexed(Value array, Value index, Value value, boolean emitStoreBarrier) {
    super(NO_DEOPT_ID, array, index, value);
    this.emitStoreBarrier = emitStoreBarrier;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "StoreIndexed(%s[%s] = %s)",
        options.valueId(input(0).definition()),
        options.valueId(input(1).definition()),
        options.valueId(input(2).definition()));
  }
}
