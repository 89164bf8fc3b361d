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
import java.util.Arrays;

/**
 * Records, for each allocated deopt id, the context depth that was active when it was allocated,
 * so that a deoptimized frame can find its context. Entries are stored as (deopt id, depth) pairs
 * in allocation order.
 */
public final class DeoptContextTable {
  private int[] pairs = new int[16];
  private int size;

  public void record(int deoptId, int contextDepth) {
    if (2 * size == pairs.length) {
      pairs = Arrays.copyOf(pairs, pairs.length * 2);
    }
    pairs[2 * size] = deoptId;
    pairs[2 * size + 1] = contextDepth;
    size++;
  }

  public int size() {
    return size;
  }

  public int deoptId(int i) {
    Preconditions.checkElementIndex(i, size);
    return pairs[2 * i];
  }

  public int contextDepth(int i) {
    Preconditions.checkElementIndex(i, size);
    return pairs[2 * i + 1];
  }

  /** Returns the context depth recorded for {@code deoptId}, or -1 if it was never recorded. */
  public int contextDepthFor(int deoptId) {
    for (int i = 0; i < size; i++) {
      if (pairs[2 * i] == deoptId) {
        return pairs[2 * i + 1];
      }
    }
    return -1;
  }
}
