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
import org.jspecify.annotations.Nullable;

/**
 * A statement. The set of statement classes is closed: each is a final nested class of this one
 * and reports its {@link Kind}.
 */
public abstract class Statement extends Node {
  public enum Kind {
    BLOCK,
    EXPRESSION_STATEMENT,
    EMPTY,
    VARIABLE_DECLARATION,
    IF,
    WHILE,
    DO,
    FOR,
    FOR_IN,
    LABELED,
    BREAK,
    CONTINUE,
    SWITCH,
    CONTINUE_SWITCH,
    TRY_CATCH,
    TRY_FINALLY,
    RETURN,
    THROW,
    RETHROW,
    YIELD,
    ASSERT
  }

  Statement(int offset) {
    super(offset);
  }

  public abstract Kind kind();

  /** A sequence of statements; also a scope, identified by its offset. */
  public static final class Block extends Statement {
    public final ImmutableList<Statement> statements;

    public Block(int offset, List<? extends Statement> statements) {
      super(offset);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }
  }

  public static final class ExpressionStatement extends Statement {
    public final Expression expression;

    public ExpressionStatement(int offset, Expression expression) {
      super(offset);
      this.expression = expression;
    }

    @Override
    public Kind kind() {
      return Kind.EXPRESSION_STATEMENT;
    }
  }

  public static final class Empty extends Statement {
    public Empty(int offset) {
      super(offset);
    }

    @Override
    public Kind kind() {
      return Kind.EMPTY;
    }
  }

  /**
   * Declares a variable; the scope allocator identifies the variable by this statement's offset.
   */
  public static final class VariableDeclaration extends Statement {
    public final String name;
    public final @Nullable Expression initializer;

    public VariableDeclaration(int offset, String name, @Nullable Expression initializer) {
      super(offset);
      this.name = name;
      this.initializer = initializer;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_DECLARATION;
    }
  }

  public static final class If extends Statement {
    public final Expression condition;
    public final Statement then;
    public final @Nullable Statement otherwise;

    public If(int offset, Expression condition, Statement then, @Nullable Statement otherwise) {
      super(offset);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }
  }

  public static final class While extends Statement {
    public final Expression condition;
    public final Statement body;

    public While(int offset, Expression condition, Statement body) {
      super(offset);
      this.condition = condition;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }
  }

  public static final class Do extends Statement {
    public final Statement body;
    public final Expression condition;

    public Do(int offset, Statement body, Expression condition) {
      super(offset);
      this.body = body;
      this.condition = condition;
    }

    @Override
    public Kind kind() {
      return Kind.DO;
    }
  }

  /** A C-style for loop; also the scope of its loop variables. */
  public static final class For extends Statement {
    public final ImmutableList<VariableDeclaration> variables;
    public final @Nullable Expression condition;
    public final ImmutableList<Expression> updates;
    public final Statement body;

    public For(
        int offset,
        List<VariableDeclaration> variables,
        @Nullable Expression condition,
        List<? extends Expression> updates,
        Statement body) {
      super(offset);
      this.variables = ImmutableList.copyOf(variables);
      this.condition = condition;
      this.updates = ImmutableList.copyOf(updates);
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }
  }

  /** Iterates over an iterable; also the scope of the loop variable. */
  public static final class ForIn extends Statement {
    public final VariableDeclaration variable;
    public final Expression iterable;
    public final Statement body;

    public ForIn(int offset, VariableDeclaration variable, Expression iterable, Statement body) {
      super(offset);
      this.variable = variable;
      this.iterable = iterable;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR_IN;
    }
  }

  /** A statement that {@link Break} can leave. */
  public static final class Labeled extends Statement {
    public final Statement body;

    public Labeled(int offset, Statement body) {
      super(offset);
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.LABELED;
    }
  }

  /**
   * Leaves an enclosing labeled statement or loop. Labeled statements and loops are numbered by
   * nesting depth, starting from 0 for the outermost one in the function.
   */
  public static final class Break extends Statement {
    public final int labelIndex;

    public Break(int offset, int labelIndex) {
      super(offset);
      Preconditions.checkArgument(labelIndex >= 0);
      this.labelIndex = labelIndex;
    }

    @Override
    public Kind kind() {
      return Kind.BREAK;
    }
  }

  /** Starts the next iteration of an enclosing loop, identified as for {@link Break}. */
  public static final class Continue extends Statement {
    public final int labelIndex;

    public Continue(int offset, int labelIndex) {
      super(offset);
      Preconditions.checkArgument(labelIndex >= 0);
      this.labelIndex = labelIndex;
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }
  }

  public static final class Switch extends Statement {
    public final Expression expression;
    public final ImmutableList<SwitchCase> cases;

    public Switch(int offset, Expression expression, List<SwitchCase> cases) {
      super(offset);
      this.expression = expression;
      this.cases = ImmutableList.copyOf(cases);
    }

    @Override
    public Kind kind() {
      return Kind.SWITCH;
    }
  }

  /**
   * Jumps to a case of an enclosing switch. Cases are numbered consecutively across all enclosing
   * switches, outermost first; i.e. the first case of a switch nested in a switch with three cases
   * is case 3.
   */
  public static final class ContinueSwitch extends Statement {
    public final int targetIndex;

    public ContinueSwitch(int offset, int targetIndex) {
      super(offset);
      Preconditions.checkArgument(targetIndex >= 0);
      this.targetIndex = targetIndex;
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE_SWITCH;
    }
  }

  public static final class TryCatch extends Statement {
    public final Statement body;
    public final ImmutableList<Catch> catches;
    public final boolean needsStackTrace;

    public TryCatch(int offset, Statement body, List<Catch> catches, boolean needsStackTrace) {
      super(offset);
      Preconditions.checkArgument(!catches.isEmpty());
      this.body = body;
      this.catches = ImmutableList.copyOf(catches);
      this.needsStackTrace = needsStackTrace;
    }

    @Override
    public Kind kind() {
      return Kind.TRY_CATCH;
    }
  }

  public static final class TryFinally extends Statement {
    public final Statement body;
    public final Statement finalizer;

    public TryFinally(int offset, Statement body, Statement finalizer) {
      super(offset);
      this.body = body;
      this.finalizer = finalizer;
    }

    @Override
    public Kind kind() {
      return Kind.TRY_FINALLY;
    }
  }

  public static final class Return extends Statement {
    public final @Nullable Expression expression;

    public Return(int offset, @Nullable Expression expression) {
      super(offset);
      this.expression = expression;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }
  }

  public static final class Throw extends Statement {
    public final Expression expression;

    public Throw(int offset, Expression expression) {
      super(offset);
      this.expression = expression;
    }

    @Override
    public Kind kind() {
      return Kind.THROW;
    }
  }

  /** Rethrows the exception being handled by the innermost enclosing catch clause. */
  public static final class Rethrow extends Statement {
    public Rethrow(int offset) {
      super(offset);
    }

    @Override
    public Kind kind() {
      return Kind.RETHROW;
    }
  }

  /** Suspends the function, passing {@link #expression} to whoever resumes it. */
  public static final class Yield extends Statement {
    public final Expression expression;

    public Yield(int offset, Expression expression) {
      super(offset);
      this.expression = expression;
    }

    @Override
    public Kind kind() {
      return Kind.YIELD;
    }
  }

  public static final class Assert extends Statement {
    public final Expression condition;
    public final @Nullable Expression message;

    public Assert(int offset, Expression condition, @Nullable Expression message) {
      super(offset);
      this.condition = condition;
      this.message = message;
    }

    @Override
    public Kind kind() {
      return Kind.ASSERT;
    }
  }
}
