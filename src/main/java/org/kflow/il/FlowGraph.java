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

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.kflow.scope.LocalVariable;

/**
 * The finished control-flow graph of one function. {@link #finish} discovers the blocks reachable
 * from the graph entry, computes their predecessors and a reverse postorder, collects the exits,
 * and verifies the structural invariants later passes rely on:
 *
 * <ul>
 *   <li>every reachable block ends in a {@link Terminator};
 *   <li>every {@link TargetEntry} other than the normal entry has exactly one predecessor;
 *   <li>a stack temporary is stored from at most one block.
 * </ul>
 *
 * Blocks that were built but turned out to be unreachable (e.g. the code after a join that nothing
 * jumped to) are not part of the graph.
 */
public final class FlowGraph {
  private final GraphEntry graphEntry;
  private final ImmutableList<BlockEntry> reversePostorder;
  private final ImmutableListMultimap<BlockEntry, BlockEntry> predecessors;
  private final ImmutableList<Terminator> normalExits;
  private final ImmutableList<Terminator> exceptionalExits;
  private final int maxBlockId;
  private final @Nullable DeoptContextTable deoptContexts;
  private final ImmutableList<YieldContinuation> yieldContinuations;
  private @Nullable String debugText;

  private FlowGraph(
      GraphEntry graphEntry,
      ImmutableList<BlockEntry> reversePostorder,
      ImmutableListMultimap<BlockEntry, BlockEntry> predecessors,
      ImmutableList<Terminator> normalExits,
      ImmutableList<Terminator> exceptionalExits,
      int maxBlockId,
      @Nullable DeoptContextTable deoptContexts,
      ImmutableList<YieldContinuation> yieldContinuations) {
    this.graphEntry = graphEntry;
    this.reversePostorder = reversePostorder;
    this.predecessors = predecessors;
    this.normalExits = normalExits;
    this.exceptionalExits = exceptionalExits;
    this.maxBlockId = maxBlockId;
    this.deoptContexts = deoptContexts;
    this.yieldContinuations = yieldContinuations;
  }

  /**
   * Returns the graph rooted at {@code graphEntry}.
   *
   * @param maxBlockId the largest block id allocated while building it
   * @param deoptContexts the deopt side table, or null if it was not recorded
   * @param keepListing if true, {@link #debugText} will return a printed listing of the graph
   */
  public static FlowGraph finish(
      GraphEntry graphEntry,
      int maxBlockId,
      @Nullable DeoptContextTable deoptContexts,
      List<YieldContinuation> yieldContinuations,
      boolean keepListing) {
    Discovery discovery = new Discovery();
    discovery.run(graphEntry);
    FlowGraph result =
        new FlowGraph(
            graphEntry,
            discovery.reversePostorder(),
            discovery.predecessors.build(),
            ImmutableList.copyOf(discovery.normalExits),
            ImmutableList.copyOf(discovery.exceptionalExits),
            maxBlockId,
            deoptContexts,
            ImmutableList.copyOf(yieldContinuations));
    result.verifyTargets();
    if (keepListing) {
      result.debugText = new GraphPrinter().print(result);
    }
    return result;
  }

  public GraphEntry graphEntry() {
    return graphEntry;
  }

  public TargetEntry normalEntry() {
    return graphEntry.normalEntry();
  }

  /** The reachable blocks in reverse postorder, starting with the graph entry. */
  public ImmutableList<BlockEntry> reversePostorder() {
    return reversePostorder;
  }

  /**
   * Returns the reachable blocks that end with a jump or branch to {@code block}, once per edge, in
   * the order they were discovered.
   */
  public ImmutableList<BlockEntry> predecessors(BlockEntry block) {
    return predecessors.get(block);
  }

  /** The reachable {@link JoinEntry}s, in reverse postorder. */
  public ImmutableList<JoinEntry> joinEntries() {
    ImmutableList.Builder<JoinEntry> result = ImmutableList.builder();
    for (BlockEntry block : reversePostorder) {
      if (block instanceof JoinEntry join) {
        result.add(join);
      }
    }
    return result.build();
  }

  /** Returns the instructions of {@code block}, starting with the block entry itself. */
  public static ImmutableList<Instruction> instructions(BlockEntry block) {
    ImmutableList.Builder<Instruction> result = ImmutableList.builder();
    for (Instruction instr = block; instr != null; instr = instr.next()) {
      result.add(instr);
    }
    return result.build();
  }

  /** All reachable instructions, block by block in reverse postorder. */
  public ImmutableList<Instruction> allInstructions() {
    ImmutableList.Builder<Instruction> result = ImmutableList.builder();
    for (BlockEntry block : reversePostorder) {
      result.addAll(instructions(block));
    }
    return result.build();
  }

  /** The {@link Return}s of the function. */
  public ImmutableList<Terminator> normalExits() {
    return normalExits;
  }

  /** The terminators that leave the function by throwing. */
  public ImmutableList<Terminator> exceptionalExits() {
    return exceptionalExits;
  }

  public int maxBlockId() {
    return maxBlockId;
  }

  public @Nullable DeoptContextTable deoptContexts() {
    return deoptContexts;
  }

  /** Empty unless the function suspends; otherwise element 0 is the normal entry. */
  public ImmutableList<YieldContinuation> yieldContinuations() {
    return yieldContinuations;
  }

  /** A printed listing of the graph, if one was requested when it was finished. */
  public @Nullable String debugText() {
    return debugText;
  }

  private void verifyTargets() {
    for (BlockEntry block : reversePostorder) {
      if (block instanceof TargetEntry && block != normalEntry()) {
        Verify.verify(
            predecessors(block).size() == 1,
            "%s has predecessors %s",
            block,
            predecessors(block));
      }
    }
  }

  /** Depth-first traversal of the block graph. */
  private static class Discovery {
    final ImmutableListMultimap.Builder<BlockEntry, BlockEntry> predecessors =
        ImmutableListMultimap.builder();
    final List<Terminator> normalExits = new ArrayList<>();
    final List<Terminator> exceptionalExits = new ArrayList<>();
    final List<BlockEntry> postorder = new ArrayList<>();
    final Set<BlockEntry> visited = Sets.newIdentityHashSet();
    final Map<LocalVariable, BlockEntry> temporaryStores = new IdentityHashMap<>();

    /** A block whose successors are being visited. */
    private static class Frame {
      final BlockEntry block;
      final ImmutableList<BlockEntry> successors;
      int next;

      Frame(BlockEntry block, ImmutableList<BlockEntry> successors) {
        this.block = block;
        this.successors = successors;
      }
    }

    void run(GraphEntry root) {
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(visit(root));
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.next == frame.successors.size()) {
          postorder.add(frame.block);
          stack.pop();
          continue;
        }
        BlockEntry successor = frame.successors.get(frame.next++);
        if (visited.add(successor)) {
          stack.push(visit(successor));
        }
      }
    }

    private Frame visit(BlockEntry block) {
      visited.add(block);
      ImmutableList<BlockEntry> successors;
      if (block instanceof GraphEntry graphEntry) {
        successors = graphEntry.successors();
      } else {
        checkTemporaryStores(block);
        Instruction last = block.lastInstruction();
        Verify.verify(
            last instanceof Terminator, "%s ends in %s, not a terminator", block, last);
        Terminator terminator = (Terminator) last;
        successors = terminator.successors();
        if (terminator instanceof Return) {
          normalExits.add(terminator);
        } else if (terminator.isExceptionalExit()) {
          exceptionalExits.add(terminator);
        }
      }
      for (BlockEntry successor : successors) {
        predecessors.put(successor, block);
      }
      return new Frame(block, successors);
    }

    private void checkTemporaryStores(BlockEntry block) {
      for (Instruction instr = block.next(); instr != null; instr = instr.next()) {
        if (instr instanceof StoreLocal store && store.variable.isStackTemporary) {
          BlockEntry prev = temporaryStores.putIfAbsent(store.variable, block);
          Verify.verify(
              prev == null || prev == block,
              "Stack temporary %s is stored in both %s and %s",
              store.variable,
              prev,
              block);
        }
      }
    }

    ImmutableList<BlockEntry> reversePostorder() {
      return ImmutableList.copyOf(postorder).reverse();
    }
  }
}
