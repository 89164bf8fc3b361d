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

import org.jspecify.annotations.Nullable;

/**
 * Discards {@link #count} stack temporaries. If a value is given it is kept and becomes the result,
 * so the value that was on top of the dropped temporaries stays on top of the stack.
 */
public final class DropTemps extends TemplateDefinition {
  public final int count;

  public DropTemps(int count, @Nullable Value value) {
    super(NO_DEOPT_ID, value == null ? new Value[0] : new Value[] {value});
    this.count = count;
  }

  @Override
  public String toString(PrintOptions options) {
    String kept = numInputs() == 0 ? "" : ", " + inputsToString(options);
    return "DropTemps(" + count + kept + ")";
  }
}
