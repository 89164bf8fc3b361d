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

import com.google.common.base.Preconditions;
import java.util.Objects;

/** The result type a prior analysis inferred for a call site. */
public final class InferredType {
  public final String typeName;
  public final boolean isNullable;

  public InferredType(String typeName, boolean isNullable) {
    this.typeName = Preconditions.checkNotNull(typeName);
    this.isNullable = isNullable;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof InferredType t
        && typeName.equals(t.typeName)
        && isNullable == t.isNullable;
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeName, isNullable);
  }

  @Override
  public String toString() {
    return isNullable ? typeName + "?" : typeName;
  }
}
