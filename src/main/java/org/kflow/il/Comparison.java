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

/** A definition that compares two values; usually consumed by a {@link Branch}. */
public abstract class Comparison extends TemplateDefinition {
  public final Token kind;

  Comparison(Token kind, Value left, Value right, int deoptId) {
    super(deoptId, left, right);
    this.kind = kind;
  }

  @Override
  public String toString(PrintOptions options) {
    return String.format(
        "%s(%s %s %s)",
        getClass().getSimpleName(),
        options.valueId(input(0).definition()),
        kind.symbol,
        options.valueId(input(1).definition()));
  }

  /** Identity comparison ({@code ===} or {@code !==}). */
  public static final class StrictCompare extends Comparison {
    /** True if numbers must be compared by value rather than identity. */
    public final boolean needsNumberCheck;

    public StrictCompare(
        Token kind, Value left, Value right, boolean needsNumberCheck, int deoptId) {
      super(kind, left, right, deoptId);
      assert kind == Token.EQ_STRICT || kind == Token.NE_STRICT;
      this.needsNumberCheck = needsNumberCheck;
    }
  }

  /** Equality ({@code ==} or {@code !=}) on small integers. */
  public static final class EqualityCompare extends Comparison {
    public EqualityCompare(Token kind, Value left, Value right, int deoptId) {
      super(kind, left, right, deoptId);
      assert kind == Token.EQ || kind == Token.NE;
    }
  }

  /** Ordering comparison on small integers. */
  public static final class RelationalOp extends Comparison {
    public RelationalOp(Token kind, Value left, Value right, int deoptId) {
      super(kind, left, right, deoptId);
      assert kind == Token.LT || kind == Token.GT || kind == Token.LTE || kind == Token.GTE;
    }
  }
}
