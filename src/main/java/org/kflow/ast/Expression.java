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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An expression. As with {@link Statement}, the set of expression classes is closed and each
 * reports its {@link Kind}.
 */
public abstract class Expression extends Node {
  public enum Kind {
    INT_LITERAL,
    BOOL_LITERAL,
    NULL_LITERAL,
    STRING_LITERAL,
    VARIABLE_GET,
    VARIABLE_SET,
    STATIC_INVOCATION,
    METHOD_INVOCATION,
    PROPERTY_GET,
    PROPERTY_SET,
    NOT,
    LOGICAL,
    CONDITIONAL,
    IS,
    LIST_LITERAL,
    LET
  }

  Expression(int offset) {
    super(offset);
  }

  public abstract Kind kind();

  /** True for the literal kinds, which can be used as switch case expressions. */
  public boolean isLiteral() {
    return false;
  }

  /** A literal expression. */
  public abstract static class Literal extends Expression {
    Literal(int offset) {
      super(offset);
    }

    @Override
    public final boolean isLiteral() {
      return true;
    }

    /** The literal's value: a Long, Boolean, String, or null. */
    public abstract @Nullable Object value();
  }

  public static final class IntLiteral extends Literal {
    public final long value;

    public IntLiteral(int offset, long value) {
      super(offset);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.INT_LITERAL;
    }

    @Override
    public Object value() {
      return value;
    }
  }

  public static final class BoolLiteral extends Literal {
    public final boolean value;

    public BoolLiteral(int offset, boolean value) {
      super(offset);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.BOOL_LITERAL;
    }

    @Override
    public Object value() {
      return value;
    }
  }

  public static final class NullLiteral extends Literal {
    public NullLiteral(int offset) {
      super(offset);
    }

    @Override
    public Kind kind() {
      return Kind.NULL_LITERAL;
    }

    @Override
    public @Nullable Object value() {
      return null;
    }
  }

  public static final class StringLiteral extends Literal {
    public final String value;

    public StringLiteral(int offset, String value) {
      super(offset);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.STRING_LITERAL;
    }

    @Override
    public Object value() {
      return value;
    }
  }

  public static final class VariableGet extends Expression {
    public final Statement.VariableDeclaration variable;

    public VariableGet(int offset, Statement.VariableDeclaration variable) {
      super(offset);
      this.variable = variable;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_GET;
    }
  }

  /** Assigns a variable; the value of the expression is the assigned value. */
  public static final class VariableSet extends Expression {
    public final Statement.VariableDeclaration variable;
    public final Expression value;

    public VariableSet(int offset, Statement.VariableDeclaration variable, Expression value) {
      super(offset);
      this.variable = variable;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE_SET;
    }
  }

  public static final class StaticInvocation extends Expression {
    public final String target;
    public final ImmutableList<Expression> arguments;

    public StaticInvocation(int offset, String target, List<? extends Expression> arguments) {
      super(offset);
      this.target = target;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public Kind kind() {
      return Kind.STATIC_INVOCATION;
    }
  }

  public static final class MethodInvocation extends Expression {
    public final Expression receiver;
    public final String name;
    public final ImmutableList<Expression> arguments;

    public MethodInvocation(
        int offset, Expression receiver, String name, List<? extends Expression> arguments) {
      super(offset);
      this.receiver = receiver;
      this.name = name;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public Kind kind() {
      return Kind.METHOD_INVOCATION;
    }
  }

  public static final class PropertyGet extends Expression {
    public final Expression receiver;
    public final String name;

    public PropertyGet(int offset, Expression receiver, String name) {
      super(offset);
      this.receiver = receiver;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.PROPERTY_GET;
    }
  }

  /** Calls a setter; the value of the expression is the assigned value. */
  public static final class PropertySet extends Expression {
    public final Expression receiver;
    public final String name;
    public final Expression value;

    public PropertySet(int offset, Expression receiver, String name, Expression value) {
      super(offset);
      this.receiver = receiver;
      this.name = name;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.PROPERTY_SET;
    }
  }

  public static final class Not extends Expression {
    public final Expression operand;

    public Not(int offset, Expression operand) {
      super(offset);
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.NOT;
    }
  }

  /** A short-circuiting {@code &&} or {@code ||}. */
  public static final class Logical extends Expression {
    public final Expression left;
    public final boolean isAnd;
    public final Expression right;

    public Logical(int offset, Expression left, boolean isAnd, Expression right) {
      super(offset);
      this.left = left;
      this.isAnd = isAnd;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.LOGICAL;
    }
  }

  public static final class Conditional extends Expression {
    public final Expression condition;
    public final Expression then;
    public final Expression otherwise;

    public Conditional(int offset, Expression condition, Expression then, Expression otherwise) {
      super(offset);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    @Override
    public Kind kind() {
      return Kind.CONDITIONAL;
    }
  }

  public static final class Is extends Expression {
    public final Expression operand;
    public final String typeName;

    public Is(int offset, Expression operand, String typeName) {
      super(offset);
      this.operand = operand;
      this.typeName = typeName;
    }

    @Override
    public Kind kind() {
      return Kind.IS;
    }
  }

  public static final class ListLiteral extends Expression {
    public final ImmutableList<Expression> elements;

    public ListLiteral(int offset, List<? extends Expression> elements) {
      super(offset);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public Kind kind() {
      return Kind.LIST_LITERAL;
    }
  }

  /** Declares a variable, then evaluates {@link #body} in its scope. */
  public static final class Let extends Expression {
    public final Statement.VariableDeclaration variable;
    public final Expression body;

    public Let(int offset, Statement.VariableDeclaration variable, Expression body) {
      super(offset);
      this.variable = variable;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.LET;
    }
  }
}
