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

package org.kflow.scope;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** Result types inferred for call sites, keyed by the call's offset. */
public interface TypeHints {
  /** Returns the inferred result type of the call at {@code callOffset} or null. */
  @Nullable InferredType resultTypeAt(int callOffset);

  TypeHints NONE = callOffset -> null;

  /** Returns hints backed by an immutable copy of {@code hints}. */
  static TypeHints of(ImmutableMap<Integer, InferredType> hints) {
    return hints::get;
  }
}
