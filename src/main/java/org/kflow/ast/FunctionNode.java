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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * A function to be lowered: its signature and body. The function is also the outermost scope,
 * identified by its offset.
 */
public final class FunctionNode extends Node {
  public enum AsyncMarker {
    SYNC,
    /** Suspends at each yield; an exception may be passed in when it is resumed. */
    ASYNC,
    /** A generator: suspends at each yield, and is only ever resumed normally. */
    SYNC_STAR
  }

  public final String name;
  public final ImmutableList<Statement.VariableDeclaration> positionalParameters;
  public final int requiredParameterCount;
  public final int typeParameterCount;
  public final AsyncMarker asyncMarker;
  public final boolean isClosure;

  /** False if this function must never be inlined into a caller. */
  public final boolean isInlinable;

  public final Statement body;

  private FunctionNode(Builder builder) {
    super(builder.offset);
    this.name = builder.name;
    this.positionalParameters = builder.positionalParameters.build();
    this.requiredParameterCount =
        (builder.requiredParameterCount < 0)
            ? positionalParameters.size()
            : builder.requiredParameterCount;
    Preconditions.checkArgument(requiredParameterCount <= positionalParameters.size());
    this.typeParameterCount = builder.typeParameterCount;
    this.asyncMarker = builder.asyncMarker;
    this.isClosure = builder.isClosure;
    this.isInlinable = builder.isInlinable;
    this.body = Preconditions.checkNotNull(builder.body, "Function %s has no body", name);
  }

  public static Builder builder(int offset, String name) {
    return new Builder(offset, name);
  }

  public boolean isSuspendable() {
    return asyncMarker != AsyncMarker.SYNC;
  }

  public boolean isGeneric() {
    return typeParameterCount != 0;
  }

  @Override
  public String toString() {
    return name;
  }

  public static final class Builder {
    private final int offset;
    private final String name;
    private final ImmutableList.Builder<Statement.VariableDeclaration> positionalParameters =
        ImmutableList.builder();
    private int requiredParameterCount = -1;
    private int typeParameterCount;
    private AsyncMarker asyncMarker = AsyncMarker.SYNC;
    private boolean isClosure;
    private boolean isInlinable = true;
    private @Nullable Statement body;

    private Builder(int offset, String name) {
      this.offset = offset;
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder addParameter(Statement.VariableDeclaration parameter) {
      positionalParameters.add(parameter);
      return this;
    }

    /** Defaults to the number of parameters added, i.e. none of them optional. */
    @CanIgnoreReturnValue
    public Builder setRequiredParameterCount(int count) {
      Preconditions.checkArgument(count >= 0);
      this.requiredParameterCount = count;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeParameterCount(int count) {
      Preconditions.checkArgument(count >= 0);
      this.typeParameterCount = count;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAsyncMarker(AsyncMarker asyncMarker) {
      this.asyncMarker = asyncMarker;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setClosure(boolean isClosure) {
      this.isClosure = isClosure;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setInlinable(boolean isInlinable) {
      this.isInlinable = isInlinable;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBody(Statement body) {
      this.body = body;
      return this;
    }

    public FunctionNode build() {
      return new FunctionNode(this);
    }
  }
}
