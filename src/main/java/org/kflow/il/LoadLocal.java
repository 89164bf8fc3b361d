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

import org.kflow.scope.LocalVariable;

/** Reads a local variable's frame slot. */
public final class LoadLocal extends TemplateDefinition {
  public final LocalVariable variable;

  public LoadLocal(LocalVariable variable) {
    super(NO_DEOPT_ID);
    this.variable = variable;
  }

  @Override
  public String toString(PrintOptions options) {
    return "LoadLocal(" + variable + ")";
  }
}
