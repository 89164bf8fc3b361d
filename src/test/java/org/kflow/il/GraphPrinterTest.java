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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GraphPrinterTest {
  private static final int NO_TRY = BlockEntry.INVALID_TRY_INDEX;

  private static FlowGraph finish(GraphEntry graphEntry) {
    return FlowGraph.finish(graphEntry, 10, null, ImmutableList.of(), false);
  }

  private static List<String> lines(FlowGraph graph) {
    return Splitter.on('\n').omitEmptyStrings().splitToList(new GraphPrinter().print(graph));
  }

  @Test
  public void straightLine() {
    TargetEntry entry = new TargetEntry(1, NO_TRY);
    GraphEntry graphEntry = new GraphEntry(0, entry);
    Constant value = new Constant(null);
    new Fragment(entry).append(value).append(new Return(Value.of(value), 0));

    assertThat(new GraphPrinter().print(finish(graphEntry)))
        .isEqualTo(
            " B0[graph]\n"
                + " B1[target] <- B0\n"
                + "    v1 <- Constant(null)\n"
                + "    return v1"
                + " ".repeat(39)
                + " // deopt 0\n");
  }

  @Test
  public void blockMarks() {
    TargetEntry entry = new TargetEntry(1, NO_TRY);
    GraphEntry graphEntry = new GraphEntry(0, entry);
    JoinEntry head = new JoinEntry(2, 0);
    new Fragment(entry).append(new Goto(head, 0));
    Constant flag = new Constant(true);
    TargetEntry body = new TargetEntry(3, 0);
    TargetEntry exit = new TargetEntry(4, NO_TRY);
    Comparison test =
        new Comparison.StrictCompare(Token.EQ_STRICT, Value.of(flag), Value.of(flag), false, 1);
    new Fragment(head).append(flag).append(new Branch(test, body, exit, 2));
    new Fragment(body).append(new Goto(head, 3));
    Constant result = new Constant("done");
    new Fragment(exit).append(result).append(new Return(Value.of(result), 4));

    List<String> lines = lines(finish(graphEntry));

    assertThat(lines).contains("=B2[join try=0] <- B1, B3");
    assertThat(lines).contains("-B3[target try=0] <- B2");
    assertThat(lines).contains(" B4[target] <- B2");
    assertThat(lines).contains("    v2 <- Constant(\"done\")");
  }

  @Test
  public void deoptIdsAreAligned() {
    TargetEntry entry = new TargetEntry(1, NO_TRY);
    GraphEntry graphEntry = new GraphEntry(0, entry);
    Constant value = new Constant(7L);
    new Fragment(entry).append(value).append(new Return(Value.of(value), 12));

    for (String line : lines(finish(graphEntry))) {
      if (line.contains("//")) {
        assertThat(line.indexOf(" // deopt 12")).isEqualTo(4 + 48);
      }
    }
  }
}
