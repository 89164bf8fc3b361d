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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DeoptContextTableTest {

  @Test
  public void recordsPairsInOrder() {
    DeoptContextTable table = new DeoptContextTable();
    table.record(0, 0);
    table.record(1, 2);
    table.record(5, 1);

    assertThat(table.size()).isEqualTo(3);
    assertThat(table.deoptId(2)).isEqualTo(5);
    assertThat(table.contextDepth(1)).isEqualTo(2);
    assertThat(table.contextDepthFor(5)).isEqualTo(1);
    assertThat(table.contextDepthFor(3)).isEqualTo(-1);
    assertThrows(IndexOutOfBoundsException.class, () -> table.deoptId(3));
  }

  @Test
  public void grows() {
    DeoptContextTable table = new DeoptContextTable();
    for (int i = 0; i < 100; i++) {
      table.record(i, i % 4);
    }

    assertThat(table.size()).isEqualTo(100);
    assertThat(table.contextDepthFor(99)).isEqualTo(3);
    assertThat(table.deoptId(64)).isEqualTo(64);
  }
}
