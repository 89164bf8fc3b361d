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
 * Copies a context, so that closures captured in one loop iteration don't see the variables of the
 * next.
 */
public final class CloneContext extends TemplateDefinition {
  public final int size;

  public CloneContext(Value context, int size, int deoptId) {
    super(deoptId, context);
    this.size = size;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format("CloneContext(%s, %s)", inputsToString(options), size);
  }
}
