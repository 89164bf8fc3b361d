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
import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.kflow.ast.Catch;
import org.kflow.ast.Expression;
import org.kflow.ast.FunctionNode;
import org.kflow.ast.Statement;
import org.kflow.ast.SwitchCase;
import org.kflow.il.BlockEntry;
import org.kflow.il.CatchBlockEntry;
import org.kflow.il.DropTemps;
import org.kflow.il.FlowGraph;
import org.kflow.il.Fragment;
import org.kflow.il.GraphEntry;
import org.kflow.il.GraphPrinter;
import org.kflow.il.JoinEntry;
import org.kflow.il.Slot;
import org.kflow.il.TargetEntry;
import org.kflow.il.Token;
import org.kflow.il.YieldContinuation;
import org.kflow.scope.LocalVariable;
import org.kflow.scope.ScopeInfo;
import org.kflow.scope.TypeHints;

/**
 * Lowers one {@link FunctionNode} to a {@link FlowGraph}.
 *
 * <p>Statements and expressions are translated in a single recursive pass; each translation returns
 * a {@link Fragment} and leaves the operand stack as it found it (statements) or with one more
 * value on it (expressions). Non-local jumps are resolved through the chains of {@link
 * BreakableBlock}s, {@link SwitchBlock}s, {@link TryFinallyBlock}s and {@link CatchBlock}s that
 * enclose the code being translated; each of those is pushed for the duration of the construct
 * that owns it.
 *
 * <p>A FlowGraphBuilder is used for a single call to {@link #buildGraph}.
 */
public final class FlowGraphBuilder extends BaseGraphBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String FALL_THROUGH_ERROR = "FallThroughError";
  static final String FALL_THROUGH_ERROR_CREATE = "FallThroughError._create";
  static final String ASSERTION_ERROR_CREATE = "_AssertionError._create";
  static final String LIST_FROM_LITERAL = "List._fromLiteral";
  static final String ITERATOR_GETTER = Token.GET.symbol + "iterator";
  static final String MOVE_NEXT = "moveNext";
  static final String CURRENT_GETTER = Token.GET.symbol + "current";

  private final FunctionNode function;
  private final TypeHints typeHints;

  /** Number of enclosing loops; passed to each loop's stack overflow check. */
  int loopDepth;

  /** Number of enclosing try bodies; selects the variable that saves the context for a handler. */
  int tryDepth;

  /** Number of enclosing catch clauses and finally handlers; selects the exception variables. */
  int catchDepth;

  /** Number of enclosing for-in loops; selects the iterator variable. */
  int forInDepth;

  @Nullable BreakableBlock breakableBlock;
  @Nullable SwitchBlock switchBlock;
  @Nullable TryFinallyBlock tryFinallyBlock;
  @Nullable CatchBlock catchBlock;

  private final List<YieldContinuation> yieldContinuations = new ArrayList<>();
  private @Nullable GraphEntry graphEntry;

  public FlowGraphBuilder(
      FunctionNode function, ScopeInfo scopes, TypeHints typeHints, BuilderOptions options) {
    super(scopes, options);
    this.function = function;
    this.typeHints = typeHints;
  }

  public FunctionNode function() {
    return function;
  }

  /**
   * Builds the graph for the function.
   *
   * @throws BailoutException if building for inlining and the function uses a construct that the
   *     inliner can't handle
   */
  public FlowGraph buildGraph() {
    logger.atFine().log("Building graph for %s with %s", function, options);
    if (!function.isInlinable) {
      inlineBailout("function is marked as not inlinable");
    }
    int graphEntryId = allocateBlockId();
    TargetEntry normalEntry = buildTargetEntry();
    graphEntry = new GraphEntry(graphEntryId, normalEntry);

    // The prologue runs before the function's own context is allocated, at context depth 0.
    Fragment prologue = new PrologueBuilder(this, function).buildPrologue();
    Fragment body = buildFunctionBody();
    if (!yieldContinuations.isEmpty()) {
      body = buildYieldDispatch(body);
    }

    new Fragment(normalEntry).concat(prologue).concat(body);
    FlowGraph graph =
        FlowGraph.finish(
            graphEntry, lastUsedBlockId(), deoptContexts(), yieldContinuations, options.verbose);
    logger.atFine().log(
        "Graph for %s:\n%s", function, lazy(() -> new GraphPrinter().print(graph)));
    return graph;
  }

  /** Gives up on this function if it is being built for inlining. */
  void inlineBailout(String reason) {
    if (options.inlining) {
      logger.atFine().log("Not inlining %s: %s", function, reason);
      throw new BailoutException(reason);
    }
  }

  /**
   * Allocates the function's context (if any of its variables are captured), moves captured
   * parameters into it, and translates the body. Falling off the end returns null.
   */
  private Fragment buildFunctionBody() {
    Fragment body = Fragment.EMPTY;
    int contextSize = scopes.contextSize(function.offset);
    if (contextSize > 0) {
      body = pushContext(contextSize);
      LocalVariable context = makeTemporary();
      ImmutableList<Statement.VariableDeclaration> parameters = function.positionalParameters;
      for (int i = 0; i < parameters.size(); i++) {
        LocalVariable variable = scopes.lookupVariable(parameters.get(i).offset);
        if (!variable.isCaptured) {
          continue;
        }
        LocalVariable raw = scopes.rawParameter(i);
        body =
            body.concat(loadLocal(context))
                .concat(loadLocal(raw))
                .concat(storeInstanceField(Slot.contextVariable(variable.contextIndex)));
        // Clear the frame slot so the value is only reachable through the context.
        body = body.concat(nullConstant()).concat(storeLocalRaw(raw)).concat(drop());
      }
      body = body.concat(drop());
    }
    body = body.concat(translateStatement(function.body));
    if (body.isOpen()) {
      body = body.concat(nullConstant()).concat(returnValue());
    }
    return body;
  }

  /**
   * Prefixes the body with a dispatch on the yield jump variable: 0 enters the function normally,
   * and {@code i} resumes after the {@code i}th yield.
   */
  private Fragment buildYieldDispatch(Fragment body) {
    LocalVariable jumpVariable = yieldJumpVariable();
    LocalVariable yieldContext = yieldContextVariable();
    // The dispatch runs before any of the function's contexts are allocated.
    int savedContextDepth = contextDepth;
    contextDepth = jumpVariable.isCaptured ? jumpVariable.contextLevel : 0;

    DropTemps normalAnchor = new DropTemps(0, null);
    normalAnchor.linkTo(body.entry());
    yieldContinuations.add(
        0, new YieldContinuation(normalAnchor, BlockEntry.INVALID_TRY_INDEX));

    Fragment dispatch =
        loadLocal(jumpVariable).concat(storeLocal(scopes.switchVariable())).concat(drop());
    TargetEntry lastTest = null;
    int count = yieldContinuations.size();
    for (int i = 0; i < count; i++) {
      YieldContinuation continuation = yieldContinuations.get(i);
      if (i == 1) {
        // Every later case is a resumption, which must first restore the suspended context.
        dispatch =
            dispatch
                .concat(loadLocal(yieldContext))
                .concat(storeLocal(scopes.currentContextVariable()))
                .concat(drop());
      }
      if (i == count - 1) {
        lastTest.setTryIndex(continuation.tryIndex);
        dispatch = dispatch.concat(new Fragment(continuation.entry.next()).closed());
        break;
      }
      dispatch =
          dispatch
              .concat(loadLocal(scopes.switchVariable()))
              .concat(intConstant(i));
      BranchResult branch = branchIfStrictEqual();
      dispatch = dispatch.concat(branch.fragment);
      // Skip the anchor.
      branch.then.linkTo(continuation.entry.next());
      branch.then.setTryIndex(continuation.tryIndex);
      dispatch = new Fragment(dispatch.entry(), branch.otherwise);
      lastTest = branch.otherwise;
    }
    contextDepth = savedContextDepth;
    return dispatch;
  }

  private LocalVariable yieldJumpVariable() {
    LocalVariable result = scopes.yieldJumpVariable();
    Preconditions.checkState(result != null, "%s has no yield jump variable", function);
    return result;
  }

  private LocalVariable yieldContextVariable() {
    LocalVariable result = scopes.yieldContextVariable();
    Preconditions.checkState(result != null, "%s has no yield context variable", function);
    return result;
  }

  // Scopes

  private Fragment enterScope(int scopeOffset) {
    int size = scopes.contextSize(scopeOffset);
    return (size > 0) ? pushContext(size).concat(drop()) : Fragment.EMPTY;
  }

  /**
   * Returns the instructions that leave the scope. They must be built (the context depth changes)
   * even if the caller is closed and can't use them.
   */
  private Fragment exitScope(int scopeOffset) {
    return (scopes.contextSize(scopeOffset) > 0) ? popContext() : Fragment.EMPTY;
  }

  /**
   * Appends {@code next} if {@code instructions} is open. Not for jumps: a {@link
   * org.kflow.il.Goto} marks its join as targeted as soon as it is built.
   */
  private static Fragment appendIfOpen(Fragment instructions, Fragment next) {
    return instructions.isOpen() ? instructions.concat(next) : instructions;
  }

  // Statements

  Fragment translateStatement(Statement statement) {
    switch (statement.kind()) {
      case BLOCK:
        return translateBlock((Statement.Block) statement);
      case EXPRESSION_STATEMENT:
        return translateExpression(((Statement.ExpressionStatement) statement).expression)
            .concat(drop());
      case EMPTY:
        return Fragment.EMPTY;
      case VARIABLE_DECLARATION:
        return translateVariableDeclaration((Statement.VariableDeclaration) statement);
      case IF:
        return translateIf((Statement.If) statement);
      case WHILE:
        return translateWhile((Statement.While) statement);
      case DO:
        return translateDo((Statement.Do) statement);
      case FOR:
        return translateFor((Statement.For) statement);
      case FOR_IN:
        return translateForIn((Statement.ForIn) statement);
      case LABELED:
        return translateLabeled((Statement.Labeled) statement);
      case BREAK:
        return translateBreak((Statement.Break) statement);
      case CONTINUE:
        return translateContinue((Statement.Continue) statement);
      case SWITCH:
        return translateSwitch((Statement.Switch) statement);
      case CONTINUE_SWITCH:
        return translateContinueSwitch((Statement.ContinueSwitch) statement);
      case TRY_CATCH:
        return translateTryCatch((Statement.TryCatch) statement);
      case TRY_FINALLY:
        return translateTryFinally((Statement.TryFinally) statement);
      case RETURN:
        return translateReturn((Statement.Return) statement);
      case THROW:
        return translateExpression(((Statement.Throw) statement).expression)
            .concat(pushArgument())
            .concat(throwException());
      case RETHROW:
        return translateRethrow();
      case YIELD:
        return translateYield((Statement.Yield) statement);
      case ASSERT:
        return translateAssert((Statement.Assert) statement);
    }
    throw new AssertionError(statement.kind());
  }

  private Fragment translateBlock(Statement.Block block) {
    Fragment instructions = enterScope(block.offset);
    for (Statement statement : block.statements) {
      if (instructions.isClosed()) {
        break;
      }
      instructions = instructions.concat(translateStatement(statement));
    }
    return appendIfOpen(instructions, exitScope(block.offset));
  }

  private Fragment translateVariableDeclaration(Statement.VariableDeclaration declaration) {
    LocalVariable variable = scopes.lookupVariable(declaration.offset);
    Fragment instructions =
        (declaration.initializer == null)
            ? nullConstant()
            : translateExpression(declaration.initializer);
    return instructions.concat(storeLocal(variable)).concat(drop());
  }

  private Fragment translateIf(Statement.If node) {
    TranslatedCondition condition = translateCondition(node.condition);
    BranchResult branch = branchIfTrue(condition.negate);
    Fragment instructions = condition.instructions.concat(branch.fragment);

    Fragment then = new Fragment(branch.then).concat(translateStatement(node.then));
    Fragment otherwise = new Fragment(branch.otherwise);
    if (node.otherwise != null) {
      otherwise = otherwise.concat(translateStatement(node.otherwise));
    }

    if (then.isOpen() && otherwise.isOpen()) {
      JoinEntry join = buildJoinEntry();
      then.concat(gotoJoin(join));
      otherwise.concat(gotoJoin(join));
      return new Fragment(instructions.entry(), join);
    } else if (then.isOpen()) {
      return new Fragment(instructions.entry(), then.current());
    } else if (otherwise.isOpen()) {
      return new Fragment(instructions.entry(), otherwise.current());
    }
    return instructions;
  }

  private Fragment translateWhile(Statement.While node) {
    ++loopDepth;
    Fragment result;
    try (BreakableBlock block = BreakableBlock.forLoop(this)) {
      TranslatedCondition condition = translateCondition(node.condition);
      BranchResult branch = branchIfTrue(condition.negate);
      Fragment test = condition.instructions.concat(branch.fragment);

      Fragment body = new Fragment(branch.then).concat(translateStatement(node.body));
      if (body.isOpen()) {
        body.concat(gotoJoin(block.ensureContinueDestination()));
      }
      JoinEntry head = block.continueDestination();
      Fragment loop;
      if (head != null) {
        new Fragment(head).concat(checkStackOverflow(loopDepth)).concat(test);
        loop = new Fragment(gotoJoin(head).entry(), branch.otherwise);
      } else {
        loop = new Fragment(test.entry(), branch.otherwise);
      }
      result = closeBreakable(block, loop);
    }
    --loopDepth;
    return result;
  }

  private Fragment translateDo(Statement.Do node) {
    ++loopDepth;
    Fragment result;
    try (BreakableBlock block = BreakableBlock.forLoop(this)) {
      Fragment body = translateStatement(node.body);
      if (body.isClosed() && block.continueDestination() == null) {
        result = closeBreakable(block, body);
      } else {
        JoinEntry head = buildJoinEntry();
        Fragment loop = new Fragment(head).concat(checkStackOverflow(loopDepth)).concat(body);
        JoinEntry continueDestination = block.continueDestination();
        if (continueDestination != null) {
          if (loop.isOpen()) {
            loop.concat(gotoJoin(continueDestination));
          }
          loop = new Fragment(loop.entry(), continueDestination);
        }
        TranslatedCondition condition = translateCondition(node.condition);
        BranchResult branch = branchIfTrue(condition.negate);
        loop.concat(condition.instructions).concat(branch.fragment);
        new Fragment(branch.then).concat(gotoJoin(head));
        result = closeBreakable(block, new Fragment(gotoJoin(head).entry(), branch.otherwise));
      }
    }
    --loopDepth;
    return result;
  }

  private Fragment translateFor(Statement.For node) {
    Fragment declarations = enterScope(node.offset);
    boolean newContext = scopes.contextSize(node.offset) > 0;
    for (Statement.VariableDeclaration variable : node.variables) {
      declarations = declarations.concat(translateStatement(variable));
    }

    ++loopDepth;
    Fragment loop;
    try (BreakableBlock block = BreakableBlock.forLoop(this)) {
      TranslatedCondition condition =
          (node.condition == null)
              ? new TranslatedCondition(boolConstant(true), false)
              : translateCondition(node.condition);
      BranchResult branch = branchIfTrue(condition.negate);
      Fragment test = condition.instructions.concat(branch.fragment);

      Fragment body = new Fragment(branch.then).concat(translateStatement(node.body));
      JoinEntry continueDestination = block.continueDestination();
      Fragment update;
      if (continueDestination != null) {
        if (body.isOpen()) {
          body.concat(gotoJoin(continueDestination));
        }
        update = new Fragment(continueDestination);
      } else {
        update = body;
      }

      if (update.isOpen()) {
        // Each iteration gets a fresh copy of the loop variables' context, so that closures
        // created by one iteration don't see the next one's updates.
        if (newContext) {
          update = update.concat(cloneContext(scopes.contextSize(node.offset)));
        }
        for (Expression expression : node.updates) {
          update = update.concat(translateExpression(expression)).concat(drop());
        }
        JoinEntry head = buildJoinEntry();
        declarations = declarations.concat(gotoJoin(head));
        update.concat(gotoJoin(head));
        new Fragment(head).concat(checkStackOverflow(loopDepth)).concat(test);
      } else {
        declarations = declarations.concat(test);
      }
      loop = closeBreakable(block, new Fragment(declarations.entry(), branch.otherwise));
    }
    --loopDepth;
    return loop.concat(exitScope(node.offset));
  }

  private Fragment translateForIn(Statement.ForIn node) {
    Fragment instructions =
        translateExpression(node.iterable)
            .concat(pushArgument())
            .concat(instanceCall(ITERATOR_GETTER, Token.GET, 1, 1, null));
    LocalVariable iterator = scopes.iteratorVariable(forInDepth);
    instructions = instructions.concat(storeLocal(iterator)).concat(drop());

    ++forInDepth;
    ++loopDepth;
    Fragment result;
    try (BreakableBlock block = BreakableBlock.forLoop(this)) {
      Fragment condition =
          loadLocal(iterator)
              .concat(pushArgument())
              .concat(instanceCall(MOVE_NEXT, Token.ILLEGAL, 1, 1, null));
      BranchResult branch = branchIfTrue(false);
      condition = condition.concat(branch.fragment);

      Fragment body =
          new Fragment(branch.then)
              .concat(enterScope(node.offset))
              .concat(loadLocal(iterator))
              .concat(pushArgument())
              .concat(
                  instanceCall(
                      CURRENT_GETTER, Token.GET, 1, 1, typeHints.resultTypeAt(node.offset)))
              .concat(storeLocal(scopes.lookupVariable(node.variable.offset)))
              .concat(drop())
              .concat(translateStatement(node.body));
      body = appendIfOpen(body, exitScope(node.offset));

      if (body.isOpen()) {
        body.concat(gotoJoin(block.ensureContinueDestination()));
      }
      JoinEntry head = block.continueDestination();
      if (head != null) {
        instructions = instructions.concat(gotoJoin(head));
        new Fragment(head).concat(checkStackOverflow(loopDepth)).concat(condition);
      } else {
        instructions = instructions.concat(condition);
      }
      result = closeBreakable(block, new Fragment(instructions.entry(), branch.otherwise));
    }
    --loopDepth;
    --forInDepth;
    return result;
  }

  /** If anything broke out of {@code block}, continues {@code instructions} at its join. */
  private Fragment closeBreakable(BreakableBlock block, Fragment instructions) {
    JoinEntry destination = block.destination();
    if (destination == null) {
      return instructions;
    }
    if (instructions.isOpen()) {
      instructions.concat(gotoJoin(destination));
    }
    return new Fragment(instructions.entry(), destination);
  }

  private Fragment translateLabeled(Statement.Labeled node) {
    try (BreakableBlock block = BreakableBlock.forLabel(this)) {
      return closeBreakable(block, translateStatement(node.body));
    }
  }

  private Fragment translateBreak(Statement.Break node) {
    Preconditions.checkState(breakableBlock != null, "break %s has no target", node.labelIndex);
    return jumpTo(breakableBlock.breakDestination(node.labelIndex));
  }

  private Fragment translateContinue(Statement.Continue node) {
    Preconditions.checkState(breakableBlock != null, "continue %s has no target", node.labelIndex);
    return jumpTo(breakableBlock.continueDestination(node.labelIndex));
  }

  private Fragment translateContinueSwitch(Statement.ContinueSwitch node) {
    Preconditions.checkState(
        switchBlock != null, "continue to case %s outside of a switch", node.targetIndex);
    return jumpTo(switchBlock.destination(node.targetIndex));
  }

  /** Runs the finalizers between here and {@code target}, then jumps to it. */
  private Fragment jumpTo(JumpTarget target) {
    Fragment instructions = translateFinallyFinalizers(target.outerFinally, target.contextDepth);
    return instructions.isOpen() ? instructions.concat(gotoJoin(target.join)) : instructions;
  }

  private Fragment translateSwitch(Statement.Switch node) {
    ImmutableList<SwitchCase> cases = node.cases;
    int caseCount = cases.size();
    try (SwitchBlock block = new SwitchBlock(this, caseCount)) {
      Fragment head =
          translateExpression(node.expression)
              .concat(storeLocal(scopes.switchVariable()))
              .concat(drop());

      // Translate the bodies first, to find the ones that need a join: bodies with more than one
      // case expression, and bodies that are the target of a continue.
      Fragment[] bodies = new Fragment[caseCount];
      for (int i = 0; i < caseCount; i++) {
        SwitchCase switchCase = cases.get(i);
        Preconditions.checkState(
            !switchCase.isDefault || i == caseCount - 1, "default is not the last case");
        Fragment body = translateStatement(switchCase.body);
        if (body.isEmpty()) {
          // Bodies are linked behind branch targets, so they need at least one instruction.
          body = nullConstant().concat(drop());
        }
        if (!switchCase.isDefault && body.isOpen() && i < caseCount - 1) {
          body = body.concat(throwFallThroughError());
        }
        if (switchCase.expressions.size() > 1) {
          block.destinationDirect(i);
        }
        bodies[i] = body;
      }

      Fragment current = head;
      for (int i = 0; i < caseCount; i++) {
        SwitchCase switchCase = cases.get(i);
        if (switchCase.isDefault) {
          if (block.hadJumper(i)) {
            JoinEntry join = block.destinationDirect(i).join;
            current.concat(gotoJoin(join));
            current = new Fragment(join).concat(bodies[i]);
          } else {
            current = current.concat(bodies[i]);
          }
          continue;
        }
        JoinEntry bodyJoin = null;
        if (block.hadJumper(i)) {
          bodyJoin = block.destinationDirect(i).join;
          bodies[i] = bodies[i].prepend(bodyJoin);
        }
        for (Expression expression : switchCase.expressions) {
          Preconditions.checkArgument(
              expression.isLiteral(), "Case at %s is not a constant", expression.offset);
          current =
              current
                  .concat(constant(((Expression.Literal) expression).value()))
                  .concat(pushArgument())
                  .concat(loadLocal(scopes.switchVariable()))
                  .concat(pushArgument())
                  .concat(instanceCall(Token.EQ.symbol, Token.EQ, 2, 2, null));
          BranchResult branch = branchIfTrue(false);
          current.concat(branch.fragment);
          Fragment then = new Fragment(branch.then);
          if (bodyJoin != null) {
            then.concat(gotoJoin(bodyJoin));
          } else {
            then.concat(bodies[i]);
          }
          current = new Fragment(branch.otherwise);
        }
      }

      if (caseCount > 0 && !cases.get(caseCount - 1).isDefault) {
        // Without a default, the last test's otherwise branch and the last body (if it falls
        // through) both continue after the switch.
        Fragment lastBody = bodies[caseCount - 1];
        if (lastBody.isOpen()) {
          JoinEntry join = buildJoinEntry();
          current.concat(gotoJoin(join));
          lastBody.concat(gotoJoin(join));
          current = new Fragment(join);
        }
      }
      return new Fragment(head.entry(), current.current());
    }
  }

  /** Throws an error reporting that a case body fell through to the next one. */
  private Fragment throwFallThroughError() {
    Fragment instructions = allocateObject(FALL_THROUGH_ERROR);
    LocalVariable error = makeTemporary();
    return instructions
        .concat(loadLocal(error))
        .concat(pushArgument())
        .concat(nullConstant())
        .concat(pushArgument())
        .concat(staticCall(FALL_THROUGH_ERROR_CREATE, 2))
        .concat(drop())
        .concat(pushArgument())
        .concat(throwException());
  }

  // Exceptions

  private LocalVariable currentException() {
    return scopes.exceptionVariable(catchDepth - 1);
  }

  private LocalVariable currentStackTrace() {
    return scopes.stackTraceVariable(catchDepth - 1);
  }

  private LocalVariable currentCatchContext() {
    return scopes.catchContextVariable(tryDepth);
  }

  /**
   * Saves the current context for the handler of region {@code tryIndex}, and starts a block in
   * that region.
   */
  private Fragment tryCatch(int tryIndex) {
    JoinEntry entry = buildJoinEntry(tryIndex);
    Fragment body =
        loadLocal(scopes.currentContextVariable())
            .concat(storeLocal(currentCatchContext()))
            .concat(drop())
            .concat(gotoJoin(entry));
    return new Fragment(body.entry(), entry);
  }

  /**
   * Starts a handler for the exceptions thrown in region {@code handlerIndex}, restoring the
   * context saved by {@link #tryCatch}.
   */
  private Fragment catchBlockEntry(
      ImmutableList<String> handlerTypes,
      int handlerIndex,
      boolean needsStackTrace,
      boolean isSynthesized) {
    Preconditions.checkState(graphEntry != null, "Catch entry built outside of buildGraph");
    LocalVariable exception = currentException();
    LocalVariable stackTrace = currentStackTrace();
    LocalVariable rawException = scopes.rawExceptionVariable(catchDepth - 1);
    LocalVariable rawStackTrace = scopes.rawStackTraceVariable(catchDepth - 1);
    CatchBlockEntry entry =
        new CatchBlockEntry(
            allocateBlockId(),
            currentTryIndex(),
            handlerIndex,
            handlerTypes,
            needsStackTrace,
            isSynthesized,
            exception,
            stackTrace,
            rawException,
            rawStackTrace);
    graphEntry.addCatchEntry(entry);
    Fragment instructions = new Fragment(entry);

    // On entry the current context is the function's outermost one, so a captured catch context
    // variable must be read at depth 0.
    int savedContextDepth = contextDepth;
    contextDepth = 0;
    instructions =
        instructions
            .concat(loadLocal(currentCatchContext()))
            .concat(storeLocal(scopes.currentContextVariable()))
            .concat(drop());
    contextDepth = savedContextDepth;

    if (exception.isCaptured) {
      instructions =
          instructions
              .concat(loadLocal(rawException))
              .concat(storeLocal(exception))
              .concat(drop())
              .concat(loadLocal(rawStackTrace))
              .concat(storeLocal(stackTrace))
              .concat(drop());
    }
    return instructions;
  }

  private Fragment rethrow(LocalVariable exception, LocalVariable stackTrace, int catchTryIndex) {
    return loadLocal(exception)
        .concat(pushArgument())
        .concat(loadLocal(stackTrace))
        .concat(pushArgument())
        .concat(rethrowException(catchTryIndex));
  }

  private Fragment translateTryCatch(Statement.TryCatch node) {
    inlineBailout("try/catch");

    int tryIndex = allocateTryIndex();
    Fragment instructions = tryCatch(tryIndex);
    JoinEntry afterTry = buildJoinEntry();

    ++tryDepth;
    try (TryCatchBlock block = new TryCatchBlock(this, tryIndex)) {
      instructions = instructions.concat(translateStatement(node.body));
      if (instructions.isOpen()) {
        instructions = instructions.concat(gotoJoin(afterTry));
      }
    }
    --tryDepth;

    ++catchDepth;
    ImmutableList<String> handlerTypes =
        node.catches.stream().map(FlowGraphBuilder::handlerType).collect(toImmutableList());
    Fragment catchBody =
        catchBlockEntry(handlerTypes, tryIndex, node.needsStackTrace, /* isSynthesized= */ false);
    for (Catch clause : node.catches) {
      Fragment handler = enterScope(clause.offset);
      if (clause.exception != null) {
        handler =
            handler
                .concat(loadLocal(currentException()))
                .concat(storeLocal(scopes.lookupVariable(clause.exception.offset)))
                .concat(drop());
      }
      if (clause.stackTrace != null) {
        handler =
            handler
                .concat(loadLocal(currentStackTrace()))
                .concat(storeLocal(scopes.lookupVariable(clause.stackTrace.offset)))
                .concat(drop());
      }
      try (CatchBlock block =
          new CatchBlock(this, currentException(), currentStackTrace(), tryIndex)) {
        handler = handler.concat(translateStatement(clause.body));
      }
      handler = appendIfOpen(handler, exitScope(clause.offset));
      if (handler.isOpen()) {
        handler = handler.concat(gotoJoin(afterTry));
      }

      String type = handlerType(clause);
      if (type.equals(CatchBlockEntry.ANY_TYPE)) {
        // Matches everything; any later clauses are unreachable.
        catchBody = catchBody.concat(handler);
        break;
      }
      catchBody =
          catchBody.concat(loadLocal(currentException())).concat(instanceOf(type));
      BranchResult branch = branchIfTrue(false);
      catchBody.concat(branch.fragment);
      handler.prepend(branch.then);
      catchBody = new Fragment(branch.otherwise);
    }
    if (catchBody.isOpen()) {
      catchBody.concat(rethrow(currentException(), currentStackTrace(), tryIndex));
    }
    --catchDepth;

    return afterTry.isTargeted()
        ? new Fragment(instructions.entry(), afterTry)
        : instructions.closed();
  }

  private static String handlerType(Catch clause) {
    return (clause.guard == null) ? CatchBlockEntry.ANY_TYPE : clause.guard;
  }

  private Fragment translateTryFinally(Statement.TryFinally node) {
    inlineBailout("try/finally");

    // Jumps out of the body replay the finalizer themselves (see translateFinallyFinalizers).
    // Here we handle falling off the end of the body and exceptions thrown by it.
    int tryIndex = allocateTryIndex();
    Fragment tryBody = tryCatch(tryIndex);
    JoinEntry afterTry = buildJoinEntry();

    ++tryDepth;
    try (TryFinallyBlock finallyBlock = new TryFinallyBlock(this, node.finalizer);
        TryCatchBlock tryBlock = new TryCatchBlock(this, tryIndex)) {
      tryBody = tryBody.concat(translateStatement(node.body));
    }
    --tryDepth;

    if (tryBody.isOpen()) {
      // The join is outside the region, so an exception thrown by the finalizer doesn't run it
      // again.
      JoinEntry finallyEntry = buildJoinEntry();
      tryBody = tryBody.concat(gotoJoin(finallyEntry));
      Fragment finallyBody =
          new Fragment(finallyEntry).concat(translateStatement(node.finalizer));
      if (finallyBody.isOpen()) {
        finallyBody.concat(gotoJoin(afterTry));
      }
    }

    ++catchDepth;
    Fragment handler =
        catchBlockEntry(
            ImmutableList.of(CatchBlockEntry.ANY_TYPE),
            tryIndex,
            /* needsStackTrace= */ true,
            /* isSynthesized= */ true);
    handler = handler.concat(translateStatement(node.finalizer));
    if (handler.isOpen()) {
      handler.concat(rethrow(currentException(), currentStackTrace(), tryIndex));
    }
    --catchDepth;

    return afterTry.isTargeted() ? new Fragment(tryBody.entry(), afterTry) : tryBody.closed();
  }

  /**
   * Translates the finalizers of the finally regions that enclose the current position but not
   * {@code outerFinally}, innermost first, each with the state it was entered with. Then adjusts
   * the context to {@code targetContextDepth}, unless it is -1.
   */
  Fragment translateFinallyFinalizers(
      @Nullable TryFinallyBlock outerFinally, int targetContextDepth) {
    TryFinallyBlock savedFinallyBlock = tryFinallyBlock;
    TryCatchBlock savedTryCatchBlock = tryCatchBlock;
    BreakableBlock savedBreakableBlock = breakableBlock;
    SwitchBlock savedSwitchBlock = switchBlock;
    CatchBlock savedCatchBlock = catchBlock;
    int savedContextDepth = contextDepth;
    int savedTryDepth = tryDepth;
    int savedLoopDepth = loopDepth;
    int savedCatchDepth = catchDepth;
    int savedForInDepth = forInDepth;

    Fragment instructions = Fragment.EMPTY;
    try {
      while (tryFinallyBlock != outerFinally) {
        TryFinallyBlock block = tryFinallyBlock;
        Preconditions.checkState(
            block != null, "Jump target is not enclosed by %s", outerFinally);
        tryDepth = block.tryDepth;
        instructions = instructions.concat(adjustContextTo(block.contextDepth));

        // The finalizer must run in the region that encloses its try statement.
        boolean changedTryIndex = false;
        while (currentTryIndex() != block.tryIndex) {
          tryCatchBlock = tryCatchBlock.outer();
          changedTryIndex = true;
        }
        if (changedTryIndex) {
          JoinEntry entry = buildJoinEntry();
          instructions = instructions.concat(gotoJoin(entry));
          instructions = new Fragment(instructions.entry(), entry);
        }

        tryFinallyBlock = block.outer;
        breakableBlock = block.breakableBlock;
        switchBlock = block.switchBlock;
        catchBlock = block.catchBlock;
        loopDepth = block.loopDepth;
        catchDepth = block.catchDepth;
        forInDepth = block.forInDepth;
        instructions = instructions.concat(translateStatement(block.finalizer));
        if (instructions.isClosed()) {
          break;
        }
      }
      if (instructions.isOpen() && targetContextDepth != -1) {
        instructions = instructions.concat(adjustContextTo(targetContextDepth));
      }
    } finally {
      tryFinallyBlock = savedFinallyBlock;
      tryCatchBlock = savedTryCatchBlock;
      breakableBlock = savedBreakableBlock;
      switchBlock = savedSwitchBlock;
      catchBlock = savedCatchBlock;
      contextDepth = savedContextDepth;
      tryDepth = savedTryDepth;
      loopDepth = savedLoopDepth;
      catchDepth = savedCatchDepth;
      forInDepth = savedForInDepth;
    }
    return instructions;
  }

  private Fragment translateReturn(Statement.Return node) {
    Fragment instructions =
        (node.expression == null) ? nullConstant() : translateExpression(node.expression);
    if (tryFinallyBlock == null) {
      return instructions.concat(returnValue());
    }
    LocalVariable result = scopes.finallyReturnVariable();
    instructions =
        instructions
            .concat(storeLocal(result))
            .concat(drop())
            .concat(translateFinallyFinalizers(null, -1));
    if (instructions.isOpen()) {
      instructions = instructions.concat(loadLocal(result)).concat(returnValue());
    }
    return instructions;
  }

  private Fragment translateRethrow() {
    Preconditions.checkState(catchBlock != null, "rethrow outside of a catch clause");
    return rethrow(
        catchBlock.exceptionVariable, catchBlock.stackTraceVariable, catchBlock.catchTryIndex);
  }

  /**
   * Suspends the function: records where to resume, saves the context and returns the value. The
   * returned fragment continues at the resumption point, which is only reached through the
   * dispatch that {@link #buildYieldDispatch} puts at the start of the function.
   */
  private Fragment translateYield(Statement.Yield node) {
    inlineBailout("yield");
    Preconditions.checkState(function.isSuspendable(), "yield in %s", function);

    Fragment instructions =
        intConstant(yieldContinuations.size() + 1)
            .concat(storeLocal(yieldJumpVariable()))
            .concat(drop())
            .concat(loadLocal(scopes.currentContextVariable()))
            .concat(storeLocal(yieldContextVariable()))
            .concat(drop())
            .concat(translateExpression(node.expression))
            .concat(returnValue());

    // The anchor is never linked into the graph; the dispatch jumps to whatever follows it.
    DropTemps anchor = new DropTemps(0, null);
    yieldContinuations.add(new YieldContinuation(anchor, currentTryIndex()));
    Fragment continuation = new Fragment(instructions.entry(), anchor);

    if (function.asyncMarker == FunctionNode.AsyncMarker.ASYNC) {
      // The resumed function is passed an exception (and stack trace) if the awaited future
      // completed with an error.
      LocalVariable exception = scopes.asyncExceptionParameter();
      LocalVariable stackTrace = scopes.asyncStackTraceParameter();
      Preconditions.checkState(
          exception != null && stackTrace != null, "%s has no async error parameters", function);
      continuation = continuation.concat(loadLocal(exception));
      BranchResult branch = branchIfNull(false);
      continuation.concat(branch.fragment);
      new Fragment(branch.otherwise)
          .concat(rethrow(exception, stackTrace, BlockEntry.INVALID_TRY_INDEX));
      continuation = new Fragment(continuation.entry(), branch.then);
    }
    return continuation;
  }

  private Fragment translateAssert(Statement.Assert node) {
    if (!options.checkedMode) {
      return Fragment.EMPTY;
    }
    TranslatedCondition condition = translateCondition(node.condition);
    BranchResult branch = branchIfTrue(condition.negate);
    Fragment instructions = condition.instructions.concat(branch.fragment);

    Fragment failed = new Fragment(branch.otherwise);
    failed = failed.concat(
        (node.message == null) ? nullConstant() : translateExpression(node.message));
    failed
        .concat(pushArgument())
        .concat(staticCall(ASSERTION_ERROR_CREATE, 1))
        .concat(pushArgument())
        .concat(throwException());
    return new Fragment(instructions.entry(), branch.then);
  }

  // Expressions

  /** A translated condition, and whether the branch on it should be negated. */
  private static class TranslatedCondition {
    final Fragment instructions;
    final boolean negate;

    TranslatedCondition(Fragment instructions, boolean negate) {
      this.instructions = instructions;
      this.negate = negate;
    }
  }

  /** Translates a condition to branch on; a top-level {@code !} becomes a negated branch. */
  private TranslatedCondition translateCondition(Expression expression) {
    boolean negate = expression instanceof Expression.Not;
    Expression value = negate ? ((Expression.Not) expression).operand : expression;
    return new TranslatedCondition(translateExpression(value).concat(checkBoolean()), negate);
  }

  private Fragment checkBoolean() {
    return options.checkedMode ? assertBoolean() : Fragment.EMPTY;
  }

  Fragment translateExpression(Expression expression) {
    switch (expression.kind()) {
      case INT_LITERAL:
      case BOOL_LITERAL:
      case NULL_LITERAL:
      case STRING_LITERAL:
        return constant(((Expression.Literal) expression).value());
      case VARIABLE_GET:
        return loadLocal(
            scopes.lookupVariable(((Expression.VariableGet) expression).variable.offset));
      case VARIABLE_SET:
        {
          Expression.VariableSet set = (Expression.VariableSet) expression;
          return translateExpression(set.value)
              .concat(storeLocal(scopes.lookupVariable(set.variable.offset)));
        }
      case STATIC_INVOCATION:
        return translateStaticInvocation((Expression.StaticInvocation) expression);
      case METHOD_INVOCATION:
        return translateMethodInvocation((Expression.MethodInvocation) expression);
      case PROPERTY_GET:
        {
          Expression.PropertyGet get = (Expression.PropertyGet) expression;
          return translateExpression(get.receiver)
              .concat(pushArgument())
              .concat(
                  instanceCall(
                      Token.GET.symbol + get.name,
                      Token.GET,
                      1,
                      1,
                      typeHints.resultTypeAt(get.offset)));
        }
      case PROPERTY_SET:
        return translatePropertySet((Expression.PropertySet) expression);
      case NOT:
        return translateExpression(((Expression.Not) expression).operand)
            .concat(checkBoolean())
            .concat(booleanNegate());
      case LOGICAL:
        return translateLogical((Expression.Logical) expression);
      case CONDITIONAL:
        return translateConditional((Expression.Conditional) expression);
      case IS:
        {
          Expression.Is is = (Expression.Is) expression;
          return translateExpression(is.operand).concat(instanceOf(is.typeName));
        }
      case LIST_LITERAL:
        return translateListLiteral((Expression.ListLiteral) expression);
      case LET:
        {
          Expression.Let let = (Expression.Let) expression;
          return translateStatement(let.variable).concat(translateExpression(let.body));
        }
    }
    throw new AssertionError(expression.kind());
  }

  private Fragment translateStaticInvocation(Expression.StaticInvocation node) {
    Fragment instructions = Fragment.EMPTY;
    for (Expression argument : node.arguments) {
      instructions = instructions.concat(translateExpression(argument)).concat(pushArgument());
    }
    return instructions.concat(
        staticCall(node.target, node.arguments.size(), typeHints.resultTypeAt(node.offset)));
  }

  private Fragment translateMethodInvocation(Expression.MethodInvocation node) {
    Token kind = Token.forMethodName(node.name);
    if (options.optimizing && isSmiOperation(kind, node)) {
      Fragment operands =
          translateExpression(node.receiver).concat(translateExpression(node.arguments.get(0)));
      switch (kind) {
        case EQ:
        case NE:
          return operands.concat(smiEqualityCompare(kind));
        case LT:
        case GT:
        case LTE:
        case GTE:
          return operands.concat(smiRelationalOp(kind));
        default:
          return operands.concat(smiBinaryOp(kind, kind == Token.TRUNCDIV));
      }
    }
    Fragment instructions = translateExpression(node.receiver).concat(pushArgument());
    for (Expression argument : node.arguments) {
      instructions = instructions.concat(translateExpression(argument)).concat(pushArgument());
    }
    int checkedArgumentCount = kind.isBinaryOperator() ? 2 : 1;
    return instructions.concat(
        instanceCall(
            node.name,
            kind,
            node.arguments.size() + 1,
            checkedArgumentCount,
            typeHints.resultTypeAt(node.offset)));
  }

  /** True if {@code node} applies an operator on small integers to two integer literals. */
  private static boolean isSmiOperation(Token kind, Expression.MethodInvocation node) {
    switch (kind) {
      case EQ:
      case NE:
      case LT:
      case GT:
      case LTE:
      case GTE:
      case ADD:
      case SUB:
      case MUL:
      case TRUNCDIV:
      case MOD:
      case BIT_AND:
      case BIT_OR:
        return node.receiver instanceof Expression.IntLiteral
            && node.arguments.size() == 1
            && node.arguments.get(0) instanceof Expression.IntLiteral;
      default:
        return false;
    }
  }

  /** The value of an assignment is the assigned value, which is kept in a temporary. */
  private Fragment translatePropertySet(Expression.PropertySet node) {
    Fragment instructions = nullConstant();
    LocalVariable value = makeTemporary();
    return instructions
        .concat(translateExpression(node.receiver))
        .concat(pushArgument())
        .concat(translateExpression(node.value))
        .concat(storeLocal(value))
        .concat(pushArgument())
        .concat(instanceCall(Token.SET.symbol + node.name, Token.SET, 2, 1, null))
        .concat(drop());
  }

  private Fragment translateLogical(Expression.Logical node) {
    TranslatedCondition left = translateCondition(node.left);
    BranchResult branch = branchIfTrue(left.negate);
    Fragment instructions = left.instructions.concat(branch.fragment);
    TargetEntry rightEntry = node.isAnd ? branch.then : branch.otherwise;
    TargetEntry constantEntry = node.isAnd ? branch.otherwise : branch.then;
    LocalVariable temp = scopes.expressionTempVariable();

    TranslatedCondition right = translateCondition(node.right);
    Fragment rightFragment =
        right.instructions
            .concat(boolConstant(true))
            .concat(strictCompare(right.negate ? Token.NE_STRICT : Token.EQ_STRICT))
            .concat(storeLocal(temp))
            .concat(drop());
    Fragment constantFragment = boolConstant(!node.isAnd).concat(storeLocal(temp)).concat(drop());

    JoinEntry join = buildJoinEntry();
    rightFragment.prepend(rightEntry).concat(gotoJoin(join));
    constantFragment.prepend(constantEntry).concat(gotoJoin(join));
    return new Fragment(instructions.entry(), join).concat(loadLocal(temp));
  }

  private Fragment translateConditional(Expression.Conditional node) {
    TranslatedCondition condition = translateCondition(node.condition);
    BranchResult branch = branchIfTrue(condition.negate);
    Fragment instructions = condition.instructions.concat(branch.fragment);
    LocalVariable temp = scopes.expressionTempVariable();

    Fragment then =
        new Fragment(branch.then)
            .concat(translateExpression(node.then))
            .concat(storeLocal(temp))
            .concat(drop());
    Fragment otherwise =
        new Fragment(branch.otherwise)
            .concat(translateExpression(node.otherwise))
            .concat(storeLocal(temp))
            .concat(drop());

    JoinEntry join = buildJoinEntry();
    then.concat(gotoJoin(join));
    otherwise.concat(gotoJoin(join));
    return new Fragment(instructions.entry(), join).concat(loadLocal(temp));
  }

  private Fragment translateListLiteral(Expression.ListLiteral node) {
    Fragment instructions =
        nullConstant().concat(intConstant(node.elements.size())).concat(createArray());
    LocalVariable array = makeTemporary();
    for (int i = 0; i < node.elements.size(); i++) {
      instructions =
          instructions
              .concat(loadLocal(array))
              .concat(intConstant(i))
              .concat(translateExpression(node.elements.get(i)))
              .concat(storeIndexed())
              .concat(drop());
    }
    return instructions
        .concat(pushArgument())
        .concat(staticCall(LIST_FROM_LITERAL, 1, typeHints.resultTypeAt(node.offset)));
  }
}
