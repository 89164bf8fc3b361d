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
import com.google.common.collect.ImmutableList;
import org.kflow.scope.LocalVariable;

/**
 * The entry of an exception handler. The runtime transfers control here, with the exception and
 * stack trace in the raw variables, when an exception escapes a block whose try index is {@link
 * #catchTryIndex}. The handler itself runs in the region named by {@link #tryIndex}.
 */
public final class CatchBlockEntry extends BlockEntry {
  /** The guard type of a clause that catches everything. */
  public static final String ANY_TYPE = "dynamic";

  /** The guard types of the handler's clauses, in declaration order. */
  public final ImmutableList<String> handlerTypes;

  public final int catchTryIndex;
  public final boolean needsStackTrace;

  /** True if this handler was added by the builder for a finally region, not a catch. */
  public final boolean isSynthesized;

  public final LocalVariable exceptionVariable;
  public final LocalVariable stackTraceVariable;
  public final LocalVariable rawExceptionVariable;
  public final LocalVariable rawStackTraceVariable;

  public CatchBlockEntry(
      int blockId,
      int tryIndex,
      int catchTryIndex,
      ImmutableList<String> handlerTypes,
      boolean needsStackTrace,
      boolean isSynthesized,
      LocalVariable exceptionVariable,
      LocalVariable stackTraceVariable,
      LocalVariable rawExceptionVariable,
      LocalVariable rawStackTraceVariable) {
    super(blockId, tryIndex);
    Preconditions.checkArgument(catchTryIndex != INVALID_TRY_INDEX);
    this.catchTryIndex = catchTryIndex;
    this.handlerTypes = handlerTypes;
    this.needsStackTrace = needsStackTrace;
    this.isSynthesized = isSynthesized;
    this.exceptionVariable = exceptionVariable;
    this.stackTraceVariable = stackTraceVariable;
    this.rawExceptionVariable = rawExceptionVariable;
    this.rawStackTraceVariable = rawStackTraceVariable;
  }

  @Override
  String kindName() {
    return "catch handles=" + catchTryIndex + (isSynthesized ? " synthesized" : "");
  }
}
