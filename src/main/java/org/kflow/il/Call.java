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

import com.google.common.collect.ImmutableList;

/**
 * A call. The arguments are the {@link PushArgument}s that were pushed for it, in left-to-right
 * order; for instance calls the receiver is the first argument.
 */
public abstract class Call extends Definition {
  private final ImmutableList<PushArgument> arguments;

  Call(ImmutableList<PushArgument> arguments, int deoptId) {
    super(deoptId);
    this.arguments = arguments;
  }

  public final ImmutableList<PushArgument> arguments() {
    return arguments;
  }

  @Override
  public final int numInputs() {
    return arguments.size();
  }

  @Override
  public final Value input(int index) {
    return Value.of(arguments.get(index));
  }

  /** A short description of the call target, used when printing. */
  abstract String target();

  @Override
  public String toString(PrintOptions options) {
    String type = (resultType() == null) ? "" : " -> " + resultType();
    return String.format(
        "%s %s(%s)%s", getClass().getSimpleName(), target(), inputsToString(options), type);
  }

  /** A call to a statically resolved function. */
  public static final class StaticCall extends Call {
    public final String function;

    public StaticCall(String function, ImmutableList<PushArgument> arguments, int deoptId) {
      super(arguments, deoptId);
      this.function = function;
    }

    @Override
    String target() {
      return function;
    }
  }

  /** A dynamically dispatched call on the first argument. */
  public static final class InstanceCall extends Call {
    public final String selector;
    public final Token kind;

    /** How many of the arguments have their classes recorded by the call's inline cache. */
    public final int checkedArgumentCount;

    public InstanceCall(
        String selector,
        Token kind,
        ImmutableList<PushArgument> arguments,
        int checkedArgumentCount,
        int deoptId) {
      super(arguments, deoptId);
      this.selector = selector;
      this.kind = kind;
      this.checkedArgumentCount = checkedArgumentCount;
    }

    @Override
    String target() {
      return selector;
    }
  }

  /** A call of a closure; the closure is the last argument. */
  public static final class ClosureCall extends Call {
    public ClosureCall(ImmutableList<PushArgument> arguments, int deoptId) {
      super(arguments, deoptId);
    }

    @Override
    String target() {
      return "closure";
    }
  }
}
