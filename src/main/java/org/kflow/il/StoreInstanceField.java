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

/** Writes a field of a heap object. */
public final class StoreInstanceField extends Instruction {
  public final Slot slot;
  private final Value instance;
  private final Value value;
  public final boolean emitStoreBarrier;

  public StoreInstanceField(Slot slot, Value instance, Value value, boolean emitStoreBarrier) {
    this.slot = slot;
    this.instance = instance;
    this.value = value;
    this.emitStoreBarrier = emitStoreBarrier;
  }

  @Override
  public int numInputs() {
    return 2;
  }

  @Override
  public Value input(int index) {
    return (index == 0) ? instance : value;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "StoreInstanceField(%s.%s = %s%s)",
        options.valueId(instance.definition()),
        slot,
        options.valueId(value.definition()),
        emitStoreBarrier ? "" : ", NoStoreBarrier");
  }
}
