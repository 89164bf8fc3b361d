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

/** Integer arithmetic on two small-integer operands. */
public final class BinaryOp extends TemplateDefinition {
  public final Token op;

  /** True if the result is truncated to the small-integer range rather than checked. */
  public final boolean isTruncating;

  public BinaryOp(Token op, Value left, Value right, boolean isTruncating, int deoptId) {
    super(deoptId, left, right);
    this.op = op;
    this.isTruncating = isTruncating;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "BinaryOp(%s %s %s%s)",
        options.valueId(input(0).definition()),
        op.symbol,
        options.valueId(input(1).definition()),
        isTruncating ? ", truncating" : "");
  }
}
