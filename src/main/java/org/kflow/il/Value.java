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
 * A use of a {@link Definition}. Values on the builder's operand stack are chained through {@link
 * #below}; a value popped from the stack and handed to an instruction as an input has no link.
 */
public final class Value {
  private final Definition definition;
  private final @Nullable Value below;

  private Value(Definition definition, @Nullable Value below) {
    this.definition = definition;
    this.below = below;
  }

  /** Returns an unlinked use of {@code definition}. */
  public static Value of(Definition definition) {
    return new Value(definition, null);
  }

  /** Returns a stack entry for {@code definition} sitting on top of {@code below}. */
  public static Value onTopOf(Definition definition, @Nullable Value below) {
    return new Value(definition, below);
  }

  public Definition definition() {
    return definition;
  }

  /** The value immediately below this one on the operand stack. */
  public @Nullable Value below() {
    return below;
  }

  @Override
  public String toString() {
    return PrintOptions.DEFAULT.valueId(definition);
  }
}
