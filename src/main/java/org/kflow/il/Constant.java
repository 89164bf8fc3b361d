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
 * A compile-time constant. The value is a boxed Java representation of the runtime object: {@link
 * Long} for integers, {@link Boolean}, {@link String}, or null for the null object.
 */
public final class Constant extends TemplateDefinition {
  public final @Nullable Object value;

  public Constant(@Nullable Object value) {
    super(NO_DEOPT_ID);
    this.value = value;
  }

  @Override
  public String toString(PrintOptions options) {
    return "Constant(" + (value instanceof String ? "\"" + value + "\"" : value) + ")";
  }
}
