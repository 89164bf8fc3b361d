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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.kflow.build.FunctionFixture.blockOf;
import static org.kflow.build.FunctionFixture.callsTo;
import static org.kflow.build.FunctionFixture.instructionsOf;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.kflow.ast.FunctionNode.AsyncMarker;
import org.kflow.ast.Statement;
import org.kflow.ast.Statement.VariableDeclaration;
import org.kflow.il.AllocateObject;
import org.kflow.il.AssertBoolean;
import org.kflow.il.BinaryOp;
import org.kflow.il.BlockEntry;
import org.kflow.il.BooleanNegate;
import org.kflow.il.Call;
import org.kflow.il.CatchBlockEntry;
import org.kflow.il.CheckStackOverflow;
import org.kflow.il.CloneContext;
import org.kflow.il.Comparison;
import org.kflow.il.CreateArray;
import org.kflow.il.FlowGraph;
import org.kflow.il.Goto;
import org.kflow.il.InstanceOf;
import org.kflow.il.Instruction;
import org.kflow.il.JoinEntry;
import org.kflow.il.LoadField;
import org.kflow.il.ReThrow;
import org.kflow.il.Return;
import org.kflow.il.Slot;
import org.kflow.il.StoreIndexed;
import org.kflow.il.StoreInstanceField;
import org.kflow.il.StoreLocal;
import org.kflow.il.TailCall;
import org.kflow.il.Throw;
import org.kflow.il.Token;
import org.kflow.scope.TypeHints;

@RunWith(JUnit4.class)
public class FlowGraphBuilderTest {

  private FunctionFixture f;

  @Before
  public void setup() {
    f = new FunctionFixture();
  }

  private static BuilderOptions.Builder options() {
    return BuilderOptions.builder();
  }

  /**
   * Follows the gotos from the normal entry to the first block that doesn't end in one, returning
   * the blocks visited.
   */
  private static List<BlockEntry> normalPath(FlowGraph graph) {
    List<BlockEntry> result = new ArrayList<>();
    BlockEntry block = graph.normalEntry();
    while (true) {
      result.add(block);
      if (!(block.lastInstruction() instanceof Goto)) {
        return result;
      }
      block = ((Goto) block.lastInstruction()).destination;
    }
  }

  private static ImmutableList<String> staticCallsOn(List<BlockEntry> blocks) {
    return blocks.stream()
        .flatMap(block -> instructionsOf(block, Call.StaticCall.class).stream())
        .map(call -> call.function)
        .collect(toImmutableList());
  }

  private static BlockEntry blockCalling(List<BlockEntry> blocks, String function) {
    return blocks.stream()
        .filter(block -> staticCallsOn(ImmutableList.of(block)).contains(function))
        .findFirst()
        .orElseThrow();
  }

  private static JoinEntry joinBefore(Call call) {
    return (JoinEntry) blockOf(call);
  }

  @Test
  public void straightLine() {
    FlowGraph graph = f.buildGraph(f.block(f.callStatement("g"), f.returnValue(f.intLiteral(1))));

    assertThat(graph.reversePostorder()).hasSize(2);
    assertThat(graph.joinEntries()).isEmpty();
    assertThat(graph.normalExits()).hasSize(1);
    assertThat(callsTo(graph, "g")).hasSize(1);
    CheckStackOverflow check = instructionsOf(graph, CheckStackOverflow.class).get(0);
    assertThat(check.inPrologue).isTrue();
  }

  @Test
  public void fallingOffTheEndReturnsNull() {
    FlowGraph graph = f.buildGraph(f.block(f.callStatement("g")));

    Return exit = (Return) graph.normalExits().get(0);
    assertThat(exit.input(0).definition().toString()).contains("Constant(null)");
  }

  @Test
  public void breaksShareOneJoin() {
    VariableDeclaration p = f.parameter("p");
    Statement body =
        f.block(
            f.labeled(
                f.block(
                    f.ifElse(f.get(p), f.breakTo(0), null),
                    f.callStatement("g"),
                    f.breakTo(0))),
            f.returnValue(f.nullLiteral()));

    FlowGraph graph = f.buildGraph(body);

    assertThat(graph.joinEntries()).hasSize(1);
    JoinEntry join = graph.joinEntries().get(0);
    assertThat(graph.predecessors(join)).hasSize(2);
    assertThat(join.lastInstruction()).isInstanceOf(Return.class);
  }

  @Test
  public void ifWithBothBranchesOpenJoins() {
    VariableDeclaration p = f.parameter("p");
    Statement body =
        f.block(
            f.ifElse(f.get(p), f.callStatement("a"), f.callStatement("b")),
            f.callStatement("c"));

    FlowGraph graph = f.buildGraph(body);

    Call c = callsTo(graph, "c").get(0);
    assertThat(graph.predecessors(joinBefore(c))).hasSize(2);
  }

  @Test
  public void ifWithOneBranchClosedNeedsNoJoin() {
    VariableDeclaration p = f.parameter("p");
    Statement body =
        f.block(
            f.ifElse(f.get(p), f.returnValue(f.intLiteral(1)), null), f.callStatement("c"));

    FlowGraph graph = f.buildGraph(body);

    assertThat(graph.joinEntries()).isEmpty();
    assertThat(graph.normalExits()).hasSize(2);
  }

  @Test
  public void notInConditionNegatesTheBranch() {
    VariableDeclaration p = f.parameter("p");
    FlowGraph graph =
        f.buildGraph(f.ifElse(f.not(f.get(p)), f.callStatement("a"), f.callStatement("b")));

    assertThat(instructionsOf(graph, BooleanNegate.class)).isEmpty();
    assertThat(graph.allInstructions().stream().anyMatch(i -> i.toString().contains("!==")))
        .isTrue();
  }

  @Test
  public void whileLoop() {
    VariableDeclaration p = f.parameter("p");
    FlowGraph graph = f.buildGraph(f.whileLoop(f.get(p), f.callStatement("g")));

    assertThat(graph.joinEntries()).hasSize(1);
    JoinEntry head = graph.joinEntries().get(0);
    assertThat(graph.predecessors(head)).hasSize(2);
    CheckStackOverflow check = (CheckStackOverflow) head.next();
    assertThat(check.loopDepth).isEqualTo(1);
    assertThat(check.inPrologue).isFalse();
  }

  @Test
  public void jumpsOutOfFinallyReplayTheFinalizer() {
    VariableDeclaration c = f.parameter("c");
    Statement loop =
        f.whileLoop(
            f.get(c),
            f.tryFinally(
                f.ifElse(f.get(c), f.breakTo(0), f.continueTo(0)), f.callStatement("f")));

    FlowGraph graph = f.buildGraph(loop);

    ImmutableList<Call.StaticCall> finalizers = callsTo(graph, "f");
    assertThat(finalizers).hasSize(3);
    assertThat(finalizers.stream().filter(call -> blockOf(call) instanceof CatchBlockEntry))
        .hasSize(1);
    // The replayed finalizers run outside the try region, each in a join of its own.
    for (Call call : finalizers) {
      BlockEntry block = blockOf(call);
      if (!(block instanceof CatchBlockEntry)) {
        assertThat(block.tryIndex()).isEqualTo(BlockEntry.INVALID_TRY_INDEX);
        assertThat(graph.predecessors(block)).hasSize(1);
        Goto exit = (Goto) block.lastInstruction();
        assertThat(graph.predecessors(exit.destination)).hasSize(2);
      }
    }
    assertThat(graph.exceptionalExits()).hasSize(1);
    assertThat(((ReThrow) graph.exceptionalExits().get(0)).catchTryIndex).isEqualTo(0);
  }

  @Test
  public void returnRunsEnclosingFinalizersInnermostFirst() {
    Statement body =
        f.tryFinally(
            f.tryFinally(f.returnValue(f.intLiteral(1)), f.callStatement("f1")),
            f.callStatement("f2"));

    FlowGraph graph = f.buildGraph(body);

    List<BlockEntry> path = normalPath(graph);
    assertThat(staticCallsOn(path)).containsExactly("f1", "f2").inOrder();
    assertThat(path.get(path.size() - 1).lastInstruction()).isInstanceOf(Return.class);
    BlockEntry f1Block = blockCalling(path, "f1");
    BlockEntry f2Block = blockCalling(path, "f2");
    assertThat(f1Block.tryIndex()).isEqualTo(0);
    assertThat(f2Block.tryIndex()).isEqualTo(BlockEntry.INVALID_TRY_INDEX);

    assertThat(graph.normalExits()).hasSize(1);
    assertThat(graph.exceptionalExits()).hasSize(2);
    assertThat(graph.graphEntry().catchEntries()).hasSize(2);
    for (CatchBlockEntry handler : graph.graphEntry().catchEntries()) {
      assertThat(handler.isSynthesized).isTrue();
      assertThat(handler.needsStackTrace).isTrue();
      assertThat(handler.handlerTypes).containsExactly(CatchBlockEntry.ANY_TYPE);
    }
  }

  @Test
  public void finallyAfterNormalCompletion() {
    Statement body = f.block(f.tryFinally(f.callStatement("g"), f.callStatement("f")));

    FlowGraph graph = f.buildGraph(body);

    assertThat(callsTo(graph, "f")).hasSize(2);
    assertThat(staticCallsOn(normalPath(graph))).containsExactly("g", "f").inOrder();
    assertThat(graph.normalExits()).hasSize(1);
  }

  @Test
  public void switchWithSharedCaseBody() {
    VariableDeclaration x = f.parameter("x");
    Statement body =
        f.labeled(
            f.switchOn(
                f.get(x),
                f.switchCase(f.block(f.callStatement("a"), f.breakTo(0)), 1),
                f.switchCase(f.block(f.callStatement("b"), f.breakTo(0)), 2, 3),
                f.defaultCase(f.callStatement("c"))));

    FlowGraph graph = f.buildGraph(body);

    JoinEntry caseJoin = joinBefore(callsTo(graph, "b").get(0));
    assertThat(graph.predecessors(caseJoin)).hasSize(2);
    JoinEntry breakJoin = (JoinEntry) ((Goto) caseJoin.lastInstruction()).destination;
    assertThat(graph.predecessors(breakJoin)).hasSize(3);
    assertThat(
            instructionsOf(graph, Call.InstanceCall.class).stream()
                .filter(call -> call.kind == Token.EQ))
        .hasSize(3);
  }

  @Test
  public void switchCaseFallingThroughThrows() {
    VariableDeclaration x = f.parameter("x");
    Statement body =
        f.switchOn(
            f.get(x),
            f.switchCase(f.callStatement("a"), 1),
            f.switchCase(f.callStatement("b"), 2));

    FlowGraph graph = f.buildGraph(body);

    ImmutableList<AllocateObject> errors = instructionsOf(graph, AllocateObject.class);
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).className).isEqualTo(FlowGraphBuilder.FALL_THROUGH_ERROR);
    assertThat(callsTo(graph, FlowGraphBuilder.FALL_THROUGH_ERROR_CREATE)).hasSize(1);
    assertThat(graph.exceptionalExits()).hasSize(1);
    assertThat(graph.exceptionalExits().get(0)).isInstanceOf(Throw.class);
    // No default: the last body and the last failed test both continue after the switch.
    assertThat(graph.joinEntries()).hasSize(1);
    assertThat(graph.predecessors(graph.joinEntries().get(0))).hasSize(2);
  }

  @Test
  public void continueSwitchJumpsToCase() {
    VariableDeclaration x = f.parameter("x");
    Statement body =
        f.switchOn(
            f.get(x),
            f.switchCase(f.block(f.callStatement("a"), f.continueSwitch(1)), 1),
            f.defaultCase(f.callStatement("b")));

    FlowGraph graph = f.buildGraph(body);

    JoinEntry defaultJoin = joinBefore(callsTo(graph, "b").get(0));
    assertThat(graph.predecessors(defaultJoin)).hasSize(2);
    assertThat(instructionsOf(graph, AllocateObject.class)).isEmpty();
  }

  @Test
  public void typedCatchClauses() {
    VariableDeclaration e = f.local("e");
    Statement body =
        f.tryCatch(
            f.callStatement("g"),
            f.catchType("FormatException", e, f.callStatement("h1")),
            f.catchType("StateError", null, f.callStatement("h2")));

    FlowGraph graph = f.buildGraph(body);

    CatchBlockEntry handler = graph.graphEntry().catchEntries().get(0);
    assertThat(handler.handlerTypes).containsExactly("FormatException", "StateError").inOrder();
    assertThat(handler.catchTryIndex).isEqualTo(0);
    assertThat(handler.needsStackTrace).isFalse();
    assertThat(handler.isSynthesized).isFalse();
    assertThat(handler.tryIndex()).isEqualTo(BlockEntry.INVALID_TRY_INDEX);
    assertThat(instructionsOf(graph, InstanceOf.class).stream().map(test -> test.typeName))
        .containsExactly("FormatException", "StateError")
        .inOrder();
    assertThat(
            instructionsOf(graph, StoreLocal.class).stream()
                .filter(store -> store.variable.name.equals("e")))
        .hasSize(1);
    ReThrow rethrow = (ReThrow) graph.exceptionalExits().get(0);
    assertThat(rethrow.catchTryIndex).isEqualTo(0);
    // The try body and both clauses continue after the statement.
    Call g = callsTo(graph, "g").get(0);
    JoinEntry afterTry = (JoinEntry) ((Goto) blockOf(g).lastInstruction()).destination;
    assertThat(graph.predecessors(afterTry)).hasSize(3);
    assertThat(blockOf(g).tryIndex()).isEqualTo(0);
  }

  @Test
  public void catchAllEndsTheDispatch() {
    Statement body =
        f.tryCatch(
            f.callStatement("g"),
            f.catchAll(f.callStatement("h1")),
            f.catchType("StateError", null, f.callStatement("h2")));

    FlowGraph graph = f.buildGraph(body);

    assertThat(instructionsOf(graph, InstanceOf.class)).isEmpty();
    assertThat(callsTo(graph, "h2")).isEmpty();
    assertThat(graph.exceptionalExits()).isEmpty();
  }

  @Test
  public void rethrowInCatchClause() {
    Statement body = f.tryCatch(f.callStatement("g"), f.catchAll(f.rethrow()));

    FlowGraph graph = f.buildGraph(body);

    assertThat(graph.exceptionalExits()).hasSize(1);
    assertThat(((ReThrow) graph.exceptionalExits().get(0)).catchTryIndex).isEqualTo(0);
  }

  @Test
  public void tryWhoseBodyAndHandlersAllExit() {
    Statement body =
        f.block(
            f.tryCatch(f.returnValue(f.intLiteral(1)), f.catchAll(f.returnValue(f.intLiteral(2)))),
            f.callStatement("unreachable"));

    FlowGraph graph = f.buildGraph(body);

    assertThat(callsTo(graph, "unreachable")).isEmpty();
    assertThat(graph.normalExits()).hasSize(2);
  }

  @Test
  public void forLoopClonesCapturedVariables() {
    VariableDeclaration i = f.captured("i", 1, 0, f.intLiteral(0));
    Statement.For loop =
        f.forLoop(
            ImmutableList.of(i),
            f.invoke(f.get(i), "<", f.intLiteral(10)),
            ImmutableList.of(f.set(i, f.invoke(f.get(i), "+", f.intLiteral(1)))),
            f.expr(f.call("g", f.get(i))));
    f.scope.setContextSize(loop.offset, 1);

    FlowGraph graph =
        f.buildGraph(loop, options().setRecordDeoptContexts(true).build());

    ImmutableList<CloneContext> clones = instructionsOf(graph, CloneContext.class);
    assertThat(clones).hasSize(1);
    assertThat(clones.get(0).size).isEqualTo(1);
    assertThat(graph.deoptContexts().contextDepthFor(clones.get(0).deoptId())).isEqualTo(1);
    Return exit = (Return) graph.normalExits().get(0);
    assertThat(graph.deoptContexts().contextDepthFor(exit.deoptId())).isEqualTo(0);
    assertThat(
            instructionsOf(graph, StoreInstanceField.class).stream()
                .filter(store -> store.slot.equals(Slot.contextVariable(0))))
        .hasSize(2);
  }

  @Test
  public void forInLoop() {
    VariableDeclaration items = f.parameter("items");
    VariableDeclaration item = f.local("item");
    FlowGraph graph =
        f.buildGraph(f.forIn(item, f.get(items), f.expr(f.call("g", f.get(item)))));

    assertThat(
            instructionsOf(graph, Call.InstanceCall.class).stream().map(call -> call.selector))
        .containsExactly(
            FlowGraphBuilder.ITERATOR_GETTER,
            FlowGraphBuilder.MOVE_NEXT,
            FlowGraphBuilder.CURRENT_GETTER)
        .inOrder();
    JoinEntry head = graph.joinEntries().get(0);
    assertThat(graph.predecessors(head)).hasSize(2);
    assertThat(
            instructionsOf(graph, StoreLocal.class).stream()
                .filter(store -> store.variable.name.equals(":iterator0")))
        .hasSize(1);
  }

  @Test
  public void doWhileWithContinue() {
    VariableDeclaration c = f.parameter("c");
    VariableDeclaration d = f.parameter("d");
    Statement loop =
        f.doWhile(
            f.block(f.ifElse(f.get(c), f.continueTo(0), null), f.callStatement("g")), f.get(d));

    FlowGraph graph = f.buildGraph(loop);

    assertThat(graph.joinEntries()).hasSize(2);
    for (JoinEntry join : graph.joinEntries()) {
      assertThat(graph.predecessors(join)).hasSize(2);
    }
  }

  @Test
  public void breakOutOfNestedLoops() {
    VariableDeclaration c = f.parameter("c");
    Statement loops =
        f.whileLoop(
            f.get(c),
            f.whileLoop(f.get(c), f.ifElse(f.get(c), f.breakTo(0), f.callStatement("g"))));

    FlowGraph graph = f.buildGraph(loops);

    ImmutableList<CheckStackOverflow> checks = instructionsOf(graph, CheckStackOverflow.class);
    assertThat(checks.stream().map(check -> check.loopDepth)).containsExactly(0, 1, 2);
    assertThat(graph.normalExits()).hasSize(1);
  }

  @Test
  public void logicalAndUsesExpressionTemp() {
    VariableDeclaration a = f.parameter("a");
    VariableDeclaration b = f.parameter("b");
    FlowGraph graph = f.buildGraph(f.returnValue(f.and(f.get(a), f.get(b))));

    ImmutableList<StoreLocal> stores =
        instructionsOf(graph, StoreLocal.class).stream()
            .filter(store -> store.variable.name.equals(":expr_temp"))
            .collect(toImmutableList());
    assertThat(stores).hasSize(2);
    assertThat(blockOf(stores.get(0))).isNotSameInstanceAs(blockOf(stores.get(1)));
    JoinEntry join = graph.joinEntries().get(0);
    assertThat(graph.predecessors(join)).hasSize(2);
    assertThat(join.lastInstruction()).isInstanceOf(Return.class);
  }

  @Test
  public void conditionalExpression() {
    VariableDeclaration a = f.parameter("a");
    FlowGraph graph =
        f.buildGraph(
            f.returnValue(f.conditional(f.get(a), f.call("x"), f.call("y"))));

    assertThat(callsTo(graph, "x")).hasSize(1);
    assertThat(callsTo(graph, "y")).hasSize(1);
    assertThat(graph.predecessors(graph.joinEntries().get(0))).hasSize(2);
  }

  @Test
  public void listLiteral() {
    VariableDeclaration x = f.parameter("x");
    FlowGraph graph = f.buildGraph(f.returnValue(f.list(f.intLiteral(1), f.get(x))));

    assertThat(instructionsOf(graph, CreateArray.class)).hasSize(1);
    assertThat(instructionsOf(graph, StoreIndexed.class)).hasSize(2);
    assertThat(callsTo(graph, FlowGraphBuilder.LIST_FROM_LITERAL)).hasSize(1);
  }

  @Test
  public void propertyAccess() {
    VariableDeclaration o = f.parameter("o");
    Statement body =
        f.block(
            f.expr(f.setProperty(f.get(o), "x", f.intLiteral(5))),
            f.returnValue(f.getProperty(f.get(o), "x")));

    FlowGraph graph = f.buildGraph(body);

    ImmutableList<Call.InstanceCall> calls = instructionsOf(graph, Call.InstanceCall.class);
    assertThat(calls.stream().map(call -> call.selector))
        .containsExactly("set:x", "get:x")
        .inOrder();
    assertThat(calls.get(0).kind).isEqualTo(Token.SET);
    // The assigned value is kept in a stack temporary while the setter runs.
    assertThat(
            instructionsOf(graph, StoreLocal.class).stream()
                .filter(store -> store.variable.isStackTemporary))
        .hasSize(1);
  }

  @Test
  public void isExpressionAndLet() {
    VariableDeclaration o = f.parameter("o");
    VariableDeclaration t = f.local("t");
    FlowGraph graph =
        f.buildGraph(f.returnValue(f.let(t, f.is(f.get(o), "String"))));

    assertThat(instructionsOf(graph, InstanceOf.class).get(0).typeName).isEqualTo("String");
  }

  @Test
  public void integerLiteralArithmetic() {
    FlowGraph graph =
        f.buildGraph(f.returnValue(f.invoke(f.intLiteral(7), "~/", f.intLiteral(2))));

    BinaryOp op = instructionsOf(graph, BinaryOp.class).get(0);
    assertThat(op.op).isEqualTo(Token.TRUNCDIV);
    assertThat(instructionsOf(graph, Call.InstanceCall.class)).isEmpty();
  }

  @Test
  public void integerLiteralComparisons() {
    FlowGraph graph =
        f.buildGraph(
            f.block(
                f.expr(f.invoke(f.intLiteral(1), "==", f.intLiteral(2))),
                f.returnValue(f.invoke(f.intLiteral(1), "<", f.intLiteral(2)))));

    Return exit = (Return) graph.normalExits().get(0);
    assertThat(exit.input(0).definition()).isInstanceOf(Comparison.RelationalOp.class);
    assertThat(
            graph.allInstructions().stream()
                .filter(instr -> instr.toString().startsWith("EqualityCompare")))
        .hasSize(1);
  }

  @Test
  public void unoptimizedArithmeticIsACall() {
    FlowGraph graph =
        f.buildGraph(
            f.returnValue(f.invoke(f.intLiteral(3), "+", f.intLiteral(4))),
            options().setOptimizing(false).build());

    assertThat(instructionsOf(graph, BinaryOp.class)).isEmpty();
    Call.InstanceCall call = instructionsOf(graph, Call.InstanceCall.class).get(0);
    assertThat(call.selector).isEqualTo("+");
    assertThat(call.checkedArgumentCount).isEqualTo(2);
  }

  @Test
  public void assertOnlyInCheckedMode() {
    VariableDeclaration c = f.parameter("c");
    Statement body = f.assertion(f.get(c), f.string("failed"));

    FlowGraph unchecked = f.buildGraph(body);
    assertThat(unchecked.exceptionalExits()).isEmpty();

    FunctionFixture g = new FunctionFixture();
    VariableDeclaration d = g.parameter("d");
    FlowGraph checked =
        g.buildGraph(
            g.assertion(g.get(d), g.string("failed")), options().setCheckedMode(true).build());
    assertThat(instructionsOf(checked, AssertBoolean.class)).hasSize(1);
    assertThat(callsTo(checked, FlowGraphBuilder.ASSERTION_ERROR_CREATE)).hasSize(1);
    assertThat(checked.exceptionalExits()).hasSize(1);
  }

  @Test
  public void closureLoadsItsContext() {
    f.function.setClosure(true);
    f.scope.setClosure(true);

    FlowGraph graph = f.buildGraph(f.returnValue(f.nullLiteral()));

    LoadField load = instructionsOf(graph, LoadField.class).get(0);
    assertThat(load.slot).isEqualTo(Slot.CLOSURE_CONTEXT);
    assertThat(blockOf(load)).isSameInstanceAs(graph.normalEntry());
  }

  @Test
  public void capturedParameterIsMovedToTheContext() {
    VariableDeclaration p = f.capturedParameter("p", 0);
    f.scope.setContextSize(f.functionOffset, 1);

    FlowGraph graph = f.buildGraph(f.returnValue(f.get(p)));

    assertThat(
            instructionsOf(graph, StoreInstanceField.class).stream()
                .filter(store -> store.slot.equals(Slot.contextVariable(0))))
        .hasSize(1);
    Return exit = (Return) graph.normalExits().get(0);
    LoadField load = (LoadField) exit.input(0).definition();
    assertThat(load.slot).isEqualTo(Slot.contextVariable(0));
    assertThat(
            instructionsOf(graph, StoreLocal.class).stream()
                .filter(store -> store.variable.name.equals("p")))
        .hasSize(1);
  }

  @Test
  public void argumentChecksForOptionalAndTypeParameters() {
    f.parameter("a");
    f.parameter("b");
    f.function.setRequiredParameterCount(1).setTypeParameterCount(1);
    f.scope.setDynamicallyCallable(true);

    FlowGraph graph =
        f.buildGraph(
            f.returnValue(f.nullLiteral()), options().setCheckArgumentCounts(true).build());

    JoinEntry nsm = noSuchMethodJoin(graph);
    assertThat(graph.predecessors(nsm)).hasSize(4);
    assertThat(
            instructionsOf(graph, LoadField.class).stream()
                .filter(load -> load.slot.equals(Slot.ARGS_DESC_TYPE_ARGS_LEN)))
        .hasSize(2);
  }

  @Test
  public void argumentChecksForRequiredParameters() {
    f.parameter("a");
    f.parameter("b");
    f.scope.setDynamicallyCallable(true);

    FlowGraph graph =
        f.buildGraph(
            f.returnValue(f.nullLiteral()), options().setCheckArgumentCounts(true).build());

    assertThat(graph.predecessors(noSuchMethodJoin(graph))).hasSize(3);
    assertThat(graph.normalExits()).hasSize(1);
  }

  @Test
  public void prologueIsNumberedBeforeTheBody() {
    VariableDeclaration a = f.parameter("a");
    f.scope.setDynamicallyCallable(true);
    Statement body =
        f.block(
            f.whileLoop(f.get(a), f.callStatement("g")), f.returnValue(f.nullLiteral()));

    FlowGraph graph = f.buildGraph(body, options().setCheckArgumentCounts(true).build());

    JoinEntry nsm = noSuchMethodJoin(graph);
    for (JoinEntry join : graph.joinEntries()) {
      assertThat(nsm.blockId()).isAtMost(join.blockId());
    }
    CheckStackOverflow entryCheck =
        instructionsOf(graph, CheckStackOverflow.class).stream()
            .filter(check -> check.inPrologue)
            .findFirst()
            .orElseThrow();
    assertThat(entryCheck.deoptId()).isLessThan(callsTo(graph, "g").get(0).deoptId());
  }

  @Test
  public void noArgumentChecksUnlessRequested() {
    f.parameter("a");
    f.scope.setDynamicallyCallable(true);

    FlowGraph graph = f.buildGraph(f.returnValue(f.nullLiteral()));

    assertThat(graph.exceptionalExits()).isEmpty();
  }

  private static JoinEntry noSuchMethodJoin(FlowGraph graph) {
    ImmutableList<Instruction> tailCalls =
        graph.exceptionalExits().stream()
            .filter(exit -> exit instanceof TailCall)
            .collect(toImmutableList());
    assertThat(tailCalls).hasSize(1);
    return (JoinEntry) blockOf(tailCalls.get(0));
  }

  @Test
  public void generatorResumesAfterEachYield() {
    f.function.setAsyncMarker(AsyncMarker.SYNC_STAR);
    f.scope.setSuspendable(true);
    Statement body =
        f.block(
            f.yieldValue(f.intLiteral(1)),
            f.callStatement("g"),
            f.yieldValue(f.intLiteral(2)),
            f.callStatement("h"));

    FlowGraph graph = f.buildGraph(body);

    assertThat(graph.yieldContinuations()).hasSize(3);
    assertThat(graph.normalExits()).hasSize(3);
    assertThat(callsTo(graph, "g")).hasSize(1);
    assertThat(callsTo(graph, "h")).hasSize(1);
    for (int i = 0; i < 3; i++) {
      assertThat(graph.yieldContinuations().get(i).tryIndex)
          .isEqualTo(BlockEntry.INVALID_TRY_INDEX);
    }
  }

  @Test
  public void yieldInsideTry() {
    f.function.setAsyncMarker(AsyncMarker.SYNC_STAR);
    f.scope.setSuspendable(true);
    Statement body =
        f.tryCatch(f.yieldValue(f.intLiteral(1)), f.catchAll(f.callStatement("h")));

    FlowGraph graph = f.buildGraph(body);

    assertThat(graph.yieldContinuations()).hasSize(2);
    assertThat(graph.yieldContinuations().get(1).tryIndex).isEqualTo(0);
  }

  @Test
  public void asyncResumptionRethrowsError() {
    f.function.setAsyncMarker(AsyncMarker.ASYNC);
    f.scope.setSuspendable(true);

    FlowGraph graph =
        f.buildGraph(f.block(f.yieldValue(f.intLiteral(1)), f.callStatement("g")));

    assertThat(graph.exceptionalExits()).hasSize(1);
    ReThrow rethrow = (ReThrow) graph.exceptionalExits().get(0);
    assertThat(rethrow.catchTryIndex).isEqualTo(BlockEntry.INVALID_TRY_INDEX);
    assertThat(callsTo(graph, "g")).hasSize(1);
  }

  @Test
  public void verboseKeepsListing() {
    FlowGraph graph =
        f.buildGraph(f.returnValue(f.nullLiteral()), options().setVerbose(true).build());

    assertThat(graph.debugText()).contains("CheckStackOverflow(prologue)");
  }

  @Test
  public void blockScopeWithContext() {
    VariableDeclaration v = f.captured("v", 1, 0, f.intLiteral(3));
    Statement.Block inner = f.block(v, f.expr(f.call("g", f.get(v))));
    f.scope.setContextSize(inner.offset, 1);

    FlowGraph graph =
        f.buildGraph(
            f.block(inner, f.callStatement("h")), options().setRecordDeoptContexts(true).build());

    Call h = callsTo(graph, "h").get(0);
    Call g = callsTo(graph, "g").get(0);
    assertThat(graph.deoptContexts().contextDepthFor(g.deoptId())).isEqualTo(1);
    assertThat(graph.deoptContexts().contextDepthFor(h.deoptId())).isEqualTo(0);
  }

  @Test
  public void labelInReplayedFinalizerIsNumberedWhereWritten() {
    VariableDeclaration c = f.parameter("c");
    // The loop in the body and the label in the finalizer both have label index 0.
    Statement body =
        f.tryFinally(
            f.whileLoop(f.get(c), f.returnValue(f.intLiteral(1))),
            f.block(f.labeled(f.breakTo(0)), f.callStatement("g")));

    FlowGraph graph = f.buildGraph(body);

    // Once for the return, once after normal completion, once in the handler.
    assertThat(callsTo(graph, "g")).hasSize(3);
    assertThat(graph.normalExits()).hasSize(2);
  }

  @Test
  public void switchInReplayedFinalizerIsNumberedWhereWritten() {
    VariableDeclaration x = f.parameter("x");
    VariableDeclaration y = f.parameter("y");
    Statement body =
        f.tryFinally(
            f.switchOn(
                f.get(x), f.defaultCase(f.whileLoop(f.get(x), f.returnValue(f.nullLiteral())))),
            f.switchOn(
                f.get(y),
                f.switchCase(f.block(f.callStatement("g"), f.continueSwitch(1)), 1),
                f.defaultCase(f.callStatement("h"))));

    FlowGraph graph = f.buildGraph(body);

    ImmutableList<Call.StaticCall> gs = callsTo(graph, "g");
    assertThat(gs).hasSize(3);
    for (Call g : gs) {
      Goto jump = (Goto) blockOf(g).lastInstruction();
      assertThat(staticCallsOn(ImmutableList.of(jump.destination))).containsExactly("h");
    }
  }

  @Test
  public void failedReplayLeavesBuilderConsistent() {
    // The finalizer breaks to a label that doesn't exist.
    Statement body = f.labeled(f.tryFinally(f.breakTo(0), f.breakTo(7)));
    FlowGraphBuilder builder =
        new FlowGraphBuilder(f.build(body), f.scope.build(), TypeHints.NONE, options().build());

    IllegalStateException e = assertThrows(IllegalStateException.class, builder::buildGraph);

    assertThat(e.getSuppressed()).isEmpty();
    assertThat(builder.breakableBlock).isNull();
    assertThat(builder.tryFinallyBlock).isNull();
    assertThat(builder.tryCatchBlock).isNull();
    assertThat(builder.tryDepth).isEqualTo(0);
  }

  @Test
  public void replayedFinalizerRunsAtItsEntryDepth() {
    VariableDeclaration v = f.captured("v", 1, 0, f.intLiteral(3));
    Statement.Block inner =
        f.block(v, f.expr(f.call("g", f.get(v))), f.returnValue(f.get(v)));
    f.scope.setContextSize(inner.offset, 1);

    FlowGraph graph =
        f.buildGraph(
            f.tryFinally(inner, f.callStatement("h")),
            options().setRecordDeoptContexts(true).build());

    Call g = callsTo(graph, "g").get(0);
    assertThat(graph.deoptContexts().contextDepthFor(g.deoptId())).isEqualTo(1);
    ImmutableList<Call.StaticCall> hs = callsTo(graph, "h");
    // The replay before the return and the exception handler.
    assertThat(hs).hasSize(2);
    for (Call h : hs) {
      assertThat(graph.deoptContexts().contextDepthFor(h.deoptId())).isEqualTo(0);
    }
  }

  @Test
  public void breakOutOfScopedBlockRestoresContext() {
    VariableDeclaration p = f.parameter("p");
    VariableDeclaration v = f.captured("v", 1, 0, f.intLiteral(3));
    Statement.Block inner = f.block(v, f.expr(f.call("g", f.get(v))), f.breakTo(0));
    f.scope.setContextSize(inner.offset, 1);

    FlowGraph graph =
        f.buildGraph(
            f.block(f.whileLoop(f.get(p), inner), f.callStatement("h")),
            options().setRecordDeoptContexts(true).build());

    Call g = callsTo(graph, "g").get(0);
    Call h = callsTo(graph, "h").get(0);
    assertThat(graph.deoptContexts().contextDepthFor(g.deoptId())).isEqualTo(1);
    assertThat(graph.deoptContexts().contextDepthFor(h.deoptId())).isEqualTo(0);
    BlockEntry breaking = blockOf(g);
    assertThat(breaking.lastInstruction()).isInstanceOf(Goto.class);
    assertThat(
            instructionsOf(breaking, LoadField.class).stream()
                .filter(load -> load.slot.equals(Slot.CONTEXT_PARENT)))
        .hasSize(1);
  }
}
