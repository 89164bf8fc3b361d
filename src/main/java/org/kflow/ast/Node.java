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

/**
 * A node of a decoded function body. Each node carries the offset at which it was found in the
 * binary AST; offsets identify declarations and scopes when talking to the scope allocator.
 */
public abstract class Node {
  public final int offset;

  Node(int offset) {
    this.offset = offset;
  }
}
