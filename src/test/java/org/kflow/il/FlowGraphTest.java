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

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kflow.scope.LocalVariable;

@RunWith(JUnit4.class)
public class FlowGraphTest {
  private static final int NO_TRY = BlockEntry.INVALID_TRY_INDEX;

  private int nextDeoptId;
  private TargetEntry normalEntry;
  private GraphEntry graphEntry;

  @Before
  public void setup() {
    normalEntry = new TargetEntry(1, NO_TRY);
    graphEntry = new GraphEntry(0, normalEntry);
  }

  private FlowGraph finish(int maxBlockId) {
    return FlowGraph.finish(graphEntry, maxBlockId, null, ImmutableList.of(), false);
  }

  /** Ends {@code start} with a branch on a constant, returning the two targets. */
  private TargetEntry[] branch(Fragment start, int thenId, int otherwiseId) {
    Constant value = new Constant(true);
    TargetEntry then = new TargetEntry(thenId, NO_TRY);
    TargetEntry otherwise = new TargetEntry(otherwiseId, NO_TRY);
    Comparison test =
        new Comparison.StrictCompare(
            Token.EQ_STRICT, Value.of(value), Value.of(value), false, nextDeoptId++);
    start.append(value).append(new Branch(test, then, otherwise, nextDeoptId++));
    return new TargetEntry[] {then, otherwise};
  }

  private Fragment returnNull(Fragment start) {
    Constant value = new Constant(null);
    return start.append(value).append(new Return(Value.of(value), nextDeoptId++));
  }

  @Test
  public void diamond() {
    TargetEntry[] targets = branch(new Fragment(normalEntry), 2, 3);
    JoinEntry join = new JoinEntry(4, NO_TRY);
    new Fragment(targets[0]).append(new Goto(join, nextDeoptId++));
    new Fragment(targets[1]).append(new Goto(join, nextDeoptId++));
    returnNull(new Fragment(join));

    FlowGraph graph = finish(4);

    assertThat(graph.reversePostorder())
        .containsExactly(graphEntry, normalEntry, targets[1], targets[0], join)
        .inOrder();
    assertThat(graph.predecessors(join)).containsExactly(targets[0], targets[1]).inOrder();
    assertThat(graph.predecessors(normalEntry)).containsExactly(graphEntry);
    assertThat(graph.joinEntries()).containsExactly(join);
    assertThat(graph.normalExits()).hasSize(1);
    assertThat(graph.exceptionalExits()).isEmpty();
    assertThat(graph.maxBlockId()).isEqualTo(4);
    assertThat(graph.debugText()).isNull();
  }

  @Test
  public void unreachableBlocksAreNotPartOfTheGraph() {
    returnNull(new Fragment(normalEntry));
    JoinEntry orphan = new JoinEntry(2, NO_TRY);
    returnNull(new Fragment(orphan));

    FlowGraph graph = finish(2);

    assertThat(graph.reversePostorder()).containsExactly(graphEntry, normalEntry).inOrder();
    assertThat(graph.joinEntries()).isEmpty();
  }

  @Test
  public void loop() {
    JoinEntry head = new JoinEntry(2, NO_TRY);
    new Fragment(normalEntry).append(new Goto(head, nextDeoptId++));
    TargetEntry[] targets = branch(new Fragment(head), 3, 4);
    new Fragment(targets[0]).append(new Goto(head, nextDeoptId++));
    returnNull(new Fragment(targets[1]));

    FlowGraph graph = finish(4);

    assertThat(graph.predecessors(head)).containsExactly(normalEntry, targets[0]).inOrder();
    assertThat(graph.reversePostorder().indexOf(head))
        .isLessThan(graph.reversePostorder().indexOf(targets[0]));
  }

  @Test
  public void blockWithoutTerminator() {
    new Fragment(normalEntry).append(new Constant(null));

    VerifyException e = assertThrows(VerifyException.class, () -> finish(1));
    assertThat(e).hasMessageThat().contains("not a terminator");
  }

  @Test
  public void targetWithTwoPredecessors() {
    TargetEntry[] first = branch(new Fragment(normalEntry), 2, 3);
    returnNull(new Fragment(first[0]));
    Constant value = new Constant(true);
    TargetEntry other = new TargetEntry(4, NO_TRY);
    Comparison test =
        new Comparison.StrictCompare(
            Token.EQ_STRICT, Value.of(value), Value.of(value), false, nextDeoptId++);
    new Fragment(first[1]).append(value).append(new Branch(test, first[0], other, nextDeoptId++));
    returnNull(new Fragment(other));

    assertThrows(VerifyException.class, () -> finish(4));
  }

  @Test
  public void stackTemporaryStoredInOneBlock() {
    LocalVariable temp = LocalVariable.stackTemporary(":temp0", 5);
    Constant value = new Constant(1L);
    Fragment body =
        new Fragment(normalEntry)
            .append(value)
            .append(new StoreLocal(temp, Value.of(value)))
            .append(new StoreLocal(temp, Value.of(value)));
    returnNull(body);

    assertThat(finish(1).reversePostorder()).hasSize(2);
  }

  @Test
  public void stackTemporaryStoredInTwoBlocks() {
    LocalVariable temp = LocalVariable.stackTemporary(":temp0", 5);
    TargetEntry[] targets = branch(new Fragment(normalEntry), 2, 3);
    for (TargetEntry target : targets) {
      Constant value = new Constant(1L);
      returnNull(new Fragment(target).append(value).append(new StoreLocal(temp, Value.of(value))));
    }

    VerifyException e = assertThrows(VerifyException.class, () -> finish(3));
    assertThat(e).hasMessageThat().contains(":temp0");
  }

  @Test
  public void ordinaryLocalMayBeStoredInManyBlocks() {
    LocalVariable local = LocalVariable.local("x", 0);
    TargetEntry[] targets = branch(new Fragment(normalEntry), 2, 3);
    for (TargetEntry target : targets) {
      Constant value = new Constant(1L);
      returnNull(new Fragment(target).append(value).append(new StoreLocal(local, Value.of(value))));
    }

    assertThat(finish(3).normalExits()).hasSize(2);
  }

  @Test
  public void exits() {
    TargetEntry[] targets = branch(new Fragment(normalEntry), 2, 3);
    returnNull(new Fragment(targets[0]));
    Constant exception = new Constant("boom");
    new Fragment(targets[1]).append(exception).append(new Throw(Value.of(exception), 7));

    FlowGraph graph = finish(3);

    assertThat(graph.normalExits()).hasSize(1);
    assertThat(graph.exceptionalExits()).hasSize(1);
    assertThat(graph.exceptionalExits().get(0)).isInstanceOf(Throw.class);
  }

  @Test
  public void catchEntriesAreReachedFromTheGraphEntry() {
    returnNull(new Fragment(normalEntry));
    CatchBlockEntry handler =
        new CatchBlockEntry(
            2,
            NO_TRY,
            0,
            ImmutableList.of(CatchBlockEntry.ANY_TYPE),
            true,
            false,
            LocalVariable.local(":exception0", 1),
            LocalVariable.local(":stack_trace0", 2),
            LocalVariable.local(":raw_exception0", 3),
            LocalVariable.local(":raw_stack_trace0", 4));
    graphEntry.addCatchEntry(handler);
    Constant exception = new Constant(null);
    Constant stackTrace = new Constant(null);
    new Fragment(handler)
        .append(exception)
        .append(stackTrace)
        .append(new ReThrow(Value.of(exception), Value.of(stackTrace), 0, 9));

    FlowGraph graph = finish(2);

    assertThat(graph.reversePostorder()).contains(handler);
    assertThat(graph.predecessors(handler)).containsExactly(graphEntry);
    assertThat(graph.exceptionalExits()).hasSize(1);
  }

  @Test
  public void keepListing() {
    returnNull(new Fragment(normalEntry));

    FlowGraph graph = FlowGraph.finish(graphEntry, 1, null, ImmutableList.of(), true);

    assertThat(graph.debugText()).contains("return v1");
  }
}
