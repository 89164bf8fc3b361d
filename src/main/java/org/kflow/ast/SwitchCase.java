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

package org.kflow.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** One case of a {@link Statement.Switch}. The case expressions must be literals. */
public final class SwitchCase extends Node {
  public final ImmutableList<Expression> expressions;
  public final boolean isDefault;
  public final Statement body;

  public SwitchCase(
      int offset, List<? extends Expression> expressions, boolean isDefault, Statement body) {
    super(offset);
    Preconditions.checkArgument(isDefault || !expressions.isEmpty(), "Case with no expressions");
    this.expressions = ImmutableList.copyOf(expressions);
    this.isDefault = isDefault;
    this.body = body;
  }
}
