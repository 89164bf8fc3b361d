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

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * Identifies a field of a heap object: a fixed field of a runtime object (such as a context's
 * parent link), a variable slot of a context, or a named user field.
 */
public final class Slot {
  enum Kind {
    NATIVE,
    CONTEXT_VARIABLE,
    FIELD
  }

  public static final Slot CONTEXT_PARENT = new Slot(Kind.NATIVE, "Context.parent", -1);
  public static final Slot CLOSURE_CONTEXT = new Slot(Kind.NATIVE, "Closure.context", -1);
  public static final Slot ARGS_DESC_TYPE_ARGS_LEN =
      new Slot(Kind.NATIVE, "ArgumentsDescriptor.type_args_len", -1);
  public static final Slot ARGS_DESC_POSITIONAL_COUNT =
      new Slot(Kind.NATIVE, "ArgumentsDescriptor.positional_count", -1);
  public static final Slot ARGS_DESC_COUNT = new Slot(Kind.NATIVE, "ArgumentsDescriptor.count", -1);

  private final Kind kind;
  public final String name;
  private final int index;

  private Slot(Kind kind, String name, int index) {
    this.kind = kind;
    this.name = name;
    this.index = index;
  }

  /** Returns the slot holding captured variable {@code index} of a context. */
  public static Slot contextVariable(int index) {
    Preconditions.checkArgument(index >= 0);
    return new Slot(Kind.CONTEXT_VARIABLE, "Context.var" + index, index);
  }

  public static Slot field(String name) {
    return new Slot(Kind.FIELD, name, -1);
  }

  public boolean isNative() {
    return kind == Kind.NATIVE;
  }

  public boolean isContextVariable() {
    return kind == Kind.CONTEXT_VARIABLE;
  }

  /** The variable index of a context variable slot. */
  public int contextIndex() {
    Preconditions.checkState(isContextVariable());
    return index;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Slot s && kind == s.kind && name.equals(s.name) && index == s.index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, index);
  }

  @Override
  public String toString() {
    return name;
  }
}
