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

/** The operator of a comparison, arithmetic operation or call. */
public enum Token {
  EQ("=="),
  NE("!="),
  EQ_STRICT("==="),
  NE_STRICT("!=="),
  LT("<"),
  GT(">"),
  LTE("<="),
  GTE(">="),
  ADD("+"),
  SUB("-"),
  MUL("*"),
  TRUNCDIV("~/"),
  MOD("%"),
  BIT_AND("&"),
  BIT_OR("|"),
  INDEX("[]"),
  ASSIGN_INDEX("[]="),
  GET("get:"),
  SET("set:"),
  /** Any call that is not one of the operators above. */
  ILLEGAL("");

  public final String symbol;

  Token(String symbol) {
    this.symbol = symbol;
  }

  /** True for the binary operators, whose calls check the types of both arguments. */
  public boolean isBinaryOperator() {
    return ordinal() >= EQ.ordinal() && ordinal() <= BIT_OR.ordinal();
  }

  /** Returns the token with the given operator method name, or {@link #ILLEGAL} if none. */
  public static Token forMethodName(String name) {
    Token result = lookup(name);
    return result == null ? ILLEGAL : result;
  }

  private static @Nullable Token lookup(String name) {
    if (name.isEmpty()) {
      return null;
    }
    for (Token token : values()) {
      if (token.symbol.equals(name)) {
        return token;
      }
    }
    return null;
  }
}
