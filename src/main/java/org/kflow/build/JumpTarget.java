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

package org.kflow.build;

import org.jspecify.annotations.Nullable;
import org.kflow.il.JoinEntry;

/**
 * The resolution of a non-local jump: the join to go to, the innermost finally region that
 * encloses the target (every finally region between the jump and it must be replayed), and the
 * context depth at the target.
 */
final class JumpTarget {
  final JoinEntry join;
  final @Nullable TryFinallyBlock outerFinally;
  final int contextDepth;

  JumpTarget(JoinEntry join, @Nullable TryFinallyBlock outerFinally, int contextDepth) {
    this.join = join;
    this.outerFinally = outerFinally;
    this.contextDepth = contextDepth;
  }
}
