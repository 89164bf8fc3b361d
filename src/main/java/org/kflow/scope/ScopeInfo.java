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

import org.jspecify.annotations.Nullable;

/**
 * Everything the graph builder needs to know about how the scope allocator laid out a function's
 * variables. Implementations are immutable; the builder trusts them completely.
 */
public interface ScopeInfo {

  /** Returns the variable declared at {@code declarationOffset}. */
  LocalVariable lookupVariable(int declarationOffset);

  /**
   * Returns the number of captured variables of the scope that starts at {@code scopeOffset}, or
   * zero if that scope does not allocate a context.
   */
  int contextSize(int scopeOffset);

  /** The frame slot the caller stored positional argument {@code index} in. */
  LocalVariable rawParameter(int index);

  /** {@code :current_context_var}: the innermost allocated context. */
  LocalVariable currentContextVariable();

  /** {@code :arg_desc_var}, or null if the function is never called dynamically. */
  @Nullable LocalVariable argumentsDescriptorVariable();

  /** The closure parameter of a closure function, or null for other functions. */
  @Nullable LocalVariable closureVariable();

  /** {@code :expr_temp}: merges the values of conditional and logical expressions. */
  LocalVariable expressionTempVariable();

  /** {@code :switch_variable}: holds the scrutinee of the switch being translated. */
  LocalVariable switchVariable();

  /** {@code :finally_ret_val}: holds a return value while finalizers run. */
  LocalVariable finallyReturnVariable();

  /** The exception visible to user code in catch clauses at nesting {@code catchDepth}. */
  LocalVariable exceptionVariable(int catchDepth);

  LocalVariable stackTraceVariable(int catchDepth);

  /** The exception as delivered by the runtime to the handler at nesting {@code catchDepth}. */
  LocalVariable rawExceptionVariable(int catchDepth);

  LocalVariable rawStackTraceVariable(int catchDepth);

  /** Saves the context on entry to the try region at nesting {@code tryDepth}. */
  LocalVariable catchContextVariable(int tryDepth);

  /** Holds the iterator of the for-in loop at nesting {@code forInDepth}. */
  LocalVariable iteratorVariable(int forInDepth);

  /** {@code :await_jump_var}, or null if the function never suspends. */
  @Nullable LocalVariable yieldJumpVariable();

  /** {@code :await_ctx_var}, or null if the function never suspends. */
  @Nullable LocalVariable yieldContextVariable();

  /** The exception parameter passed when an async function is resumed. */
  @Nullable LocalVariable asyncExceptionParameter();

  @Nullable LocalVariable asyncStackTraceParameter();

  /** The number of frame slots used by declared locals; stack temporaries come after them. */
  int numStackLocals();
}
