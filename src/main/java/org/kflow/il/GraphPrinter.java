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

import com.google.common.collect.ImmutableList;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Renders a {@link FlowGraph} as text, one block per paragraph in reverse postorder. Values are
 * named {@code v1}, {@code v2}, ... in the order they are first printed.
 *
 * <p>Each block header is prefixed with a mark: "=" if it is the target of a backward edge, "-" if
 * it is reached other than by falling out of the preceding block, and "?" if it has no
 * predecessors. Instructions with a deopt id show it as a trailing comment.
 */
public final class GraphPrinter implements PrintOptions {
  private static final String DEOPT_PAD = " ".repeat(48);

  private final Map<Definition, Integer> valueIds = new IdentityHashMap<>();

  @Override
  public String blockId(BlockEntry block) {
    return "B" + block.blockId();
  }

  @Override
  public String valueId(Definition definition) {
    return "v" + valueIds.computeIfAbsent(definition, d -> valueIds.size() + 1);
  }

  public String print(FlowGraph graph) {
    StringBuilder sb = new StringBuilder();
    ImmutableList<BlockEntry> blocks = graph.reversePostorder();
    Map<BlockEntry, Integer> positions = new IdentityHashMap<>();
    for (int i = 0; i < blocks.size(); i++) {
      positions.put(blocks.get(i), i);
    }
    for (int i = 0; i < blocks.size(); i++) {
      BlockEntry block = blocks.get(i);
      ImmutableList<BlockEntry> preds = graph.predecessors(block);
      int pos = i;
      String mark = " ";
      if (preds.isEmpty()) {
        mark = (block instanceof GraphEntry) ? " " : "?";
      } else if (preds.stream().anyMatch(p -> positions.get(p) >= pos)) {
        mark = "=";
      } else if (preds.size() > 1 || positions.get(preds.get(0)) != pos - 1) {
        mark = "-";
      }
      sb.append(mark).append(block.toString(this));
      if (!preds.isEmpty()) {
        sb.append(" <- ");
        for (int j = 0; j < preds.size(); j++) {
          sb.append(j == 0 ? "" : ", ").append(blockId(preds.get(j)));
        }
      }
      sb.append('\n');
      for (Instruction instr = block.next(); instr != null; instr = instr.next()) {
        String s = printInstruction(instr);
        sb.append("    ").append(s);
        if (instr.deoptId() != Instruction.NO_DEOPT_ID) {
          if (s.length() < DEOPT_PAD.length()) {
            sb.append(DEOPT_PAD, s.length(), DEOPT_PAD.length());
          }
          sb.append(" // deopt ").append(instr.deoptId());
        }
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private String printInstruction(Instruction instr) {
    if (instr instanceof Definition def) {
      return valueId(def) + " <- " + instr.toString(this);
    }
    return instr.toString(this);
  }
}
