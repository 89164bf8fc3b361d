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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;
import org.jspecify.annotations.Nullable;

/**
 * An immutable {@link ScopeInfo}, as produced by the scope allocator. Synthetic variables (the
 * per-depth exception, stack trace, catch context and iterator variables, and the special
 * colon-prefixed variables) are allocated frame slots after the declared ones.
 */
public final class ScopeBuildingResult implements ScopeInfo {

  /** The default limit on nested try, catch and for-in constructs. */
  public static final int DEFAULT_NESTING_LIMIT = 8;

  private final ImmutableMap<Integer, LocalVariable> variables;
  private final ImmutableMap<Integer, Integer> contextSizes;
  private final ImmutableList<LocalVariable> rawParameters;
  private final LocalVariable currentContext;
  private final @Nullable LocalVariable argumentsDescriptor;
  private final @Nullable LocalVariable closure;
  private final LocalVariable expressionTemp;
  private final LocalVariable switchVariable;
  private final LocalVariable finallyReturn;
  private final ImmutableList<LocalVariable> exceptions;
  private final ImmutableList<LocalVariable> stackTraces;
  private final ImmutableList<LocalVariable> rawExceptions;
  private final ImmutableList<LocalVariable> rawStackTraces;
  private final ImmutableList<LocalVariable> catchContexts;
  private final ImmutableList<LocalVariable> iterators;
  private final @Nullable LocalVariable yieldJump;
  private final @Nullable LocalVariable yieldContext;
  private final @Nullable LocalVariable asyncException;
  private final @Nullable LocalVariable asyncStackTrace;
  private final int numStackLocals;

  private ScopeBuildingResult(Builder builder) {
    this.variables = ImmutableMap.copyOf(builder.variables);
    this.contextSizes = ImmutableMap.copyOf(builder.contextSizes);
    this.rawParameters = builder.rawParameters.build();
    this.currentContext = builder.newLocal(":current_context_var");
    this.argumentsDescriptor =
        builder.dynamicallyCallable ? builder.newLocal(":arg_desc_var") : null;
    this.closure = builder.closure ? builder.newLocal(":closure") : null;
    this.expressionTemp = builder.newLocal(":expr_temp");
    this.switchVariable = builder.newLocal(":switch_variable");
    this.finallyReturn = builder.newLocal(":finally_ret_val");
    int limit = builder.nestingLimit;
    this.exceptions = builder.perDepth(limit, i -> ":exception" + i);
    this.stackTraces = builder.perDepth(limit, i -> ":stack_trace" + i);
    this.rawExceptions = builder.perDepth(limit, i -> ":raw_exception" + i);
    this.rawStackTraces = builder.perDepth(limit, i -> ":raw_stack_trace" + i);
    this.catchContexts = builder.perDepth(limit, i -> ":saved_try_context_var" + i);
    this.iterators = builder.perDepth(limit, i -> ":iterator" + i);
    if (builder.suspendable) {
      this.yieldJump = builder.newLocal(":await_jump_var");
      this.yieldContext = builder.newLocal(":await_ctx_var");
      this.asyncException = builder.newLocal(":exception");
      this.asyncStackTrace = builder.newLocal(":stack_trace");
    } else {
      this.yieldJump = null;
      this.yieldContext = null;
      this.asyncException = null;
      this.asyncStackTrace = null;
    }
    this.numStackLocals = builder.nextSlot;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public LocalVariable lookupVariable(int declarationOffset) {
    LocalVariable result = variables.get(declarationOffset);
    Preconditions.checkArgument(result != null, "No variable declared at %s", declarationOffset);
    return result;
  }

  @Override
  public int contextSize(int scopeOffset) {
    return contextSizes.getOrDefault(scopeOffset, 0);
  }

  @Override
  public LocalVariable rawParameter(int index) {
    return rawParameters.get(index);
  }

  @Override
  public LocalVariable currentContextVariable() {
    return currentContext;
  }

  @Override
  public @Nullable LocalVariable argumentsDescriptorVariable() {
    return argumentsDescriptor;
  }

  @Override
  public @Nullable LocalVariable closureVariable() {
    return closure;
  }

  @Override
  public LocalVariable expressionTempVariable() {
    return expressionTemp;
  }

  @Override
  public LocalVariable switchVariable() {
    return switchVariable;
  }

  @Override
  public LocalVariable finallyReturnVariable() {
    return finallyReturn;
  }

  @Override
  public LocalVariable exceptionVariable(int catchDepth) {
    return exceptions.get(catchDepth);
  }

  @Override
  public LocalVariable stackTraceVariable(int catchDepth) {
    return stackTraces.get(catchDepth);
  }

  @Override
  public LocalVariable rawExceptionVariable(int catchDepth) {
    return rawExceptions.get(catchDepth);
  }

  @Override
  public LocalVariable rawStackTraceVariable(int catchDepth) {
    return rawStackTraces.get(catchDepth);
  }

  @Override
  public LocalVariable catchContextVariable(int tryDepth) {
    return catchContexts.get(tryDepth);
  }

  @Override
  public LocalVariable iteratorVariable(int forInDepth) {
    return iterators.get(forInDepth);
  }

  @Override
  public @Nullable LocalVariable yieldJumpVariable() {
    return yieldJump;
  }

  @Override
  public @Nullable LocalVariable yieldContextVariable() {
    return yieldContext;
  }

  @Override
  public @Nullable LocalVariable asyncExceptionParameter() {
    return asyncException;
  }

  @Override
  public @Nullable LocalVariable asyncStackTraceParameter() {
    return asyncStackTrace;
  }

  @Override
  public int numStackLocals() {
    return numStackLocals;
  }

  /**
   * Collects the layout of one function. Frame slots are handed out in the order variables are
   * created: parameters first, then declared locals, then the synthetic variables added by {@link
   * #build}.
   */
  public static final class Builder {
    private int nextSlot;
    private final Map<Integer, LocalVariable> variables = new HashMap<>();
    private final Map<Integer, Integer> contextSizes = new HashMap<>();
    private final ImmutableList.Builder<LocalVariable> rawParameters = ImmutableList.builder();
    private int nestingLimit = DEFAULT_NESTING_LIMIT;
    private boolean dynamicallyCallable;
    private boolean closure;
    private boolean suspendable;

    private Builder() {}

    /** Returns a new uncaptured variable in the next free frame slot. */
    public LocalVariable newLocal(String name) {
      return LocalVariable.local(name, nextSlot++);
    }

    /** Allocates the frame slot for the next positional parameter and returns it. */
    public LocalVariable addParameter(String name) {
      LocalVariable result = newLocal(name);
      rawParameters.add(result);
      return result;
    }

    @CanIgnoreReturnValue
    public Builder declare(int declarationOffset, LocalVariable variable) {
      LocalVariable prev = variables.put(declarationOffset, variable);
      Preconditions.checkArgument(prev == null, "Offset %s declared twice", declarationOffset);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setContextSize(int scopeOffset, int size) {
      Preconditions.checkArgument(size > 0);
      contextSizes.put(scopeOffset, size);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNestingLimit(int nestingLimit) {
      Preconditions.checkArgument(nestingLimit > 0);
      this.nestingLimit = nestingLimit;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDynamicallyCallable(boolean dynamicallyCallable) {
      this.dynamicallyCallable = dynamicallyCallable;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setClosure(boolean closure) {
      this.closure = closure;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSuspendable(boolean suspendable) {
      this.suspendable = suspendable;
      return this;
    }

    private ImmutableList<LocalVariable> perDepth(int count, IntFunction<String> name) {
      ImmutableList.Builder<LocalVariable> result = ImmutableList.builderWithExpectedSize(count);
      for (int i = 0; i < count; i++) {
        result.add(newLocal(name.apply(i)));
      }
      return result.build();
    }

    public ScopeBuildingResult build() {
      return new ScopeBuildingResult(this);
    }
  }
}
