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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.kflow.il.AllocateContext;
import org.kflow.il.AllocateObject;
import org.kflow.il.AssertBoolean;
import org.kflow.il.BinaryOp;
import org.kflow.il.BlockEntry;
import org.kflow.il.BooleanNegate;
import org.kflow.il.Branch;
import org.kflow.il.Call;
import org.kflow.il.CheckStackOverflow;
import org.kflow.il.CloneContext;
import org.kflow.il.Comparison;
import org.kflow.il.Constant;
import org.kflow.il.CreateArray;
import org.kflow.il.DeoptContextTable;
import org.kflow.il.Definition;
import org.kflow.il.DropTemps;
import org.kflow.il.Fragment;
import org.kflow.il.Goto;
import org.kflow.il.InstanceOf;
import org.kflow.il.JoinEntry;
import org.kflow.il.LoadField;
import org.kflow.il.LoadIndexed;
import org.kflow.il.LoadLocal;
import org.kflow.il.PushArgument;
import org.kflow.il.ReThrow;
import org.kflow.il.Return;
import org.kflow.il.Slot;
import org.kflow.il.StoreIndexed;
import org.kflow.il.StoreInstanceField;
import org.kflow.il.StoreLocal;
import org.kflow.il.TailCall;
import org.kflow.il.TargetEntry;
import org.kflow.il.Throw;
import org.kflow.il.Token;
import org.kflow.il.Value;
import org.kflow.scope.InferredType;
import org.kflow.scope.LocalVariable;
import org.kflow.scope.ScopeInfo;

/**
 * A BaseGraphBuilder creates the instructions of a single function's graph and returns them as
 * {@link Fragment}s for the caller to link together. It keeps
 *
 * <ul>
 *   <li>the operand stack: each value-producing primitive pops its inputs and pushes its result;
 *   <li>the counters that identify blocks, deopt points and exception handler regions;
 *   <li>the current context depth and the innermost {@link TryCatchBlock}.
 * </ul>
 *
 * <p>All counters are fields of the builder, so builders for different functions are independent.
 */
public class BaseGraphBuilder {

  /** The runtime stub that reports a call with a mismatched argument shape. */
  public static final String NO_SUCH_METHOD_STUB = "NoSuchMethodDispatcher";

  protected final ScopeInfo scopes;
  protected final BuilderOptions options;

  private final @Nullable DeoptContextTable deoptContexts;

  /** The number of contexts allocated by enclosing scopes of the code being built. */
  int contextDepth;

  /** The innermost enclosing try region, or null if none. */
  @Nullable TryCatchBlock tryCatchBlock;

  private int lastUsedBlockId;
  private int nextDeoptId;
  private int lastUsedTryIndex = BlockEntry.INVALID_TRY_INDEX;

  /** The top of the operand stack. */
  private @Nullable Value stack;

  /** The number of {@link PushArgument}s on the stack that have not yet been consumed. */
  private int pendingArgumentCount;

  public BaseGraphBuilder(ScopeInfo scopes, BuilderOptions options) {
    this.scopes = scopes;
    this.options = options;
    this.deoptContexts = options.recordDeoptContexts ? new DeoptContextTable() : null;
    this.lastUsedBlockId = options.firstBlockId - 1;
  }

  public final int contextDepth() {
    return contextDepth;
  }

  public final int allocateBlockId() {
    return ++lastUsedBlockId;
  }

  public final int lastUsedBlockId() {
    return lastUsedBlockId;
  }

  /**
   * Returns a new deopt id. If the options ask for it, the id is recorded with the current context
   * depth.
   */
  public final int nextDeoptId() {
    int result = nextDeoptId++;
    if (deoptContexts != null) {
      deoptContexts.record(result, contextDepth);
    }
    return result;
  }

  final @Nullable DeoptContextTable deoptContexts() {
    return deoptContexts;
  }

  public final int allocateTryIndex() {
    return ++lastUsedTryIndex;
  }

  public final int currentTryIndex() {
    return (tryCatchBlock == null) ? BlockEntry.INVALID_TRY_INDEX : tryCatchBlock.tryIndex;
  }

  // Block entries

  public TargetEntry buildTargetEntry() {
    return new TargetEntry(allocateBlockId(), currentTryIndex());
  }

  public JoinEntry buildJoinEntry() {
    return buildJoinEntry(currentTryIndex());
  }

  public JoinEntry buildJoinEntry(int tryIndex) {
    return new JoinEntry(allocateBlockId(), tryIndex);
  }

  // The operand stack

  /** Pushes {@code definition}'s value, giving it the next temp index. */
  public final void push(Definition definition) {
    definition.setTempIndex((stack == null) ? 0 : stack.definition().tempIndex() + 1);
    stack = Value.onTopOf(definition, stack);
  }

  /** Pops the top of the operand stack and returns an unlinked use of it. */
  public final Value pop() {
    Preconditions.checkState(stack != null, "Operand stack is empty");
    Value top = stack;
    stack = top.below();
    return Value.of(top.definition());
  }

  /** Returns the value on top of the operand stack, or null if it is empty. */
  public final @Nullable Value stackTop() {
    return stack;
  }

  public final int stackDepth() {
    int result = 0;
    for (Value v = stack; v != null; v = v.below()) {
      result++;
    }
    return result;
  }

  /**
   * Discards the top of the stack. Only a value that was given a name by {@link #makeTemporary},
   * or a {@link LoadLocal}, needs an instruction to drop it; anything else is simply forgotten.
   */
  public Fragment drop() {
    Preconditions.checkState(stack != null, "Operand stack is empty");
    Definition definition = stack.definition();
    Fragment result = Fragment.EMPTY;
    if (definition.isMaterialized() || definition instanceof LoadLocal) {
      result = new Fragment(new DropTemps(1, null));
    } else {
      definition.clearTempIndex();
    }
    pop();
    return result;
  }

  /** Discards the {@code count} values below the top of the stack, keeping the top value. */
  public Fragment dropTempsPreserveTop(int count) {
    Value value = pop();
    DropTemps dropTemps = new DropTemps(count, value);
    for (int i = 0; i < count; i++) {
      pop();
    }
    push(dropTemps);
    return new Fragment(dropTemps);
  }

  /**
   * Gives the value on top of the stack a name, so that it can be read with {@link #loadLocal}
   * while other values are pushed above it. The variable's slot is below the expression stack, and
   * must not be stored from more than one block.
   */
  public LocalVariable makeTemporary() {
    Preconditions.checkState(stack != null, "Operand stack is empty");
    Definition definition = stack.definition();
    int index = definition.tempIndex();
    definition.markMaterialized();
    return LocalVariable.stackTemporary(":temp" + index, scopes.numStackLocals() + index);
  }

  // Arguments

  /** Turns the top of the stack into an argument of the next call. */
  public Fragment pushArgument() {
    PushArgument argument = new PushArgument(pop());
    push(argument);
    pendingArgumentCount++;
    return new Fragment(argument);
  }

  /** Pops the last {@code count} pushed arguments, returning them in the order they were pushed. */
  public ImmutableList<PushArgument> getArguments(int count) {
    Preconditions.checkArgument(
        count <= pendingArgumentCount,
        "Need %s arguments but only %s are pending",
        count,
        pendingArgumentCount);
    PushArgument[] arguments = new PushArgument[count];
    for (int i = count - 1; i >= 0; i--) {
      Definition definition = pop().definition();
      Preconditions.checkState(
          definition instanceof PushArgument, "Expected an argument, found %s", definition);
      definition.clearTempIndex();
      arguments[i] = (PushArgument) definition;
    }
    pendingArgumentCount -= count;
    return ImmutableList.copyOf(arguments);
  }

  public final int pendingArgumentCount() {
    return pendingArgumentCount;
  }

  // Constants

  public Fragment constant(@Nullable Object value) {
    Constant constant = new Constant(value);
    push(constant);
    return new Fragment(constant);
  }

  public Fragment intConstant(long value) {
    return constant(Long.valueOf(value));
  }

  public Fragment boolConstant(boolean value) {
    return constant(Boolean.valueOf(value));
  }

  public Fragment nullConstant() {
    return constant(null);
  }

  // Locals, fields and elements

  /** Pushes the value of {@code variable}, reading it from its context if it is captured. */
  public Fragment loadLocal(LocalVariable variable) {
    if (variable.isCaptured) {
      return loadContextAt(variable.contextLevel)
          .concat(loadField(Slot.contextVariable(variable.contextIndex)));
    }
    LoadLocal load = new LoadLocal(variable);
    push(load);
    return new Fragment(load);
  }

  /**
   * Stores the top of the stack into {@code variable}. The stored value stays on the stack; for a
   * captured variable it is named with {@link #makeTemporary} so that it can be written to the
   * context.
   */
  public Fragment storeLocal(LocalVariable variable) {
    if (variable.isCaptured) {
      LocalVariable value = makeTemporary();
      return loadContextAt(variable.contextLevel)
          .concat(loadLocal(value))
          .concat(storeInstanceField(Slot.contextVariable(variable.contextIndex)));
    }
    return storeLocalRaw(variable);
  }

  /** Stores the top of the stack into {@code variable}'s frame slot, even if it is captured. */
  public Fragment storeLocalRaw(LocalVariable variable) {
    StoreLocal store = new StoreLocal(variable, pop());
    push(store);
    return new Fragment(store);
  }

  /** Pushes the context at {@code depth}, which must not be deeper than the current one. */
  public Fragment loadContextAt(int depth) {
    int delta = contextDepth - depth;
    Preconditions.checkArgument(
        delta >= 0, "Context depth %s is deeper than current %s", depth, contextDepth);
    Fragment instructions = loadLocal(scopes.currentContextVariable());
    for (; delta > 0; delta--) {
      instructions = instructions.concat(loadField(Slot.CONTEXT_PARENT));
    }
    return instructions;
  }

  public Fragment loadField(Slot slot) {
    LoadField load = new LoadField(pop(), slot);
    push(load);
    return new Fragment(load);
  }

  public Fragment loadNativeField(Slot slot) {
    Preconditions.checkArgument(slot.isNative(), "%s is not a native field", slot);
    return loadField(slot);
  }

  /** Pops a value and an instance and stores the value; constants need no store barrier. */
  public Fragment storeInstanceField(Slot slot) {
    Value value = pop();
    Value instance = pop();
    boolean barrier = !(value.definition() instanceof Constant);
    return new Fragment(new StoreInstanceField(slot, instance, value, barrier));
  }

  public Fragment loadIndexed() {
    Value index = pop();
    Value array = pop();
    LoadIndexed load = new LoadIndexed(array, index, nextDeoptId());
    push(load);
    return new Fragment(load);
  }

  public Fragment storeIndexed() {
    Value value = pop();
    Value index = pop();
    Value array = pop();
    boolean barrier = !(value.definition() instanceof Constant);
    StoreIndexed store = new StoreIndexed(array, index, value, barrier);
    push(store);
    return new Fragment(store);
  }

  // Contexts

  public Fragment allocateContext(int size) {
    AllocateContext allocate = new AllocateContext(size, nextDeoptId());
    push(allocate);
    return new Fragment(allocate);
  }

  /**
   * Replaces the current context with a copy of itself, so that closures created in one loop
   * iteration don't share variables with the next.
   */
  public Fragment cloneContext(int size) {
    LocalVariable currentContext = scopes.currentContextVariable();
    Fragment instructions = loadLocal(currentContext);
    CloneContext clone = new CloneContext(pop(), size, nextDeoptId());
    push(clone);
    return instructions
        .concat(new Fragment(clone))
        .concat(storeLocal(currentContext))
        .concat(drop());
  }

  /**
   * Allocates a context of {@code size} variables whose parent is the current one, and makes it
   * current. Leaves the new context on the stack.
   */
  public Fragment pushContext(int size) {
    Preconditions.checkArgument(size > 0);
    LocalVariable currentContext = scopes.currentContextVariable();
    Fragment instructions = allocateContext(size);
    LocalVariable context = makeTemporary();
    instructions =
        instructions
            .concat(loadLocal(context))
            .concat(loadLocal(currentContext))
            .concat(storeInstanceField(Slot.CONTEXT_PARENT))
            .concat(storeLocal(currentContext));
    contextDepth++;
    return instructions;
  }

  /** Makes the parent of the current context current. */
  public Fragment popContext() {
    return adjustContextTo(contextDepth - 1);
  }

  /** Makes the enclosing context at {@code depth} current; does nothing if it already is. */
  public Fragment adjustContextTo(int depth) {
    Preconditions.checkArgument(
        depth >= 0 && depth <= contextDepth, "Can't adjust context %s to %s", contextDepth, depth);
    if (depth == contextDepth) {
      return Fragment.EMPTY;
    }
    Fragment instructions =
        loadContextAt(depth).concat(storeLocal(scopes.currentContextVariable())).concat(drop());
    contextDepth = depth;
    return instructions;
  }

  // Operations

  public Fragment strictCompare(Token kind, boolean numberCheck) {
    Value right = pop();
    Value left = pop();
    Comparison compare =
        new Comparison.StrictCompare(kind, left, right, numberCheck, nextDeoptId());
    push(compare);
    return new Fragment(compare);
  }

  public Fragment strictCompare(Token kind) {
    return strictCompare(kind, false);
  }

  public Fragment smiRelationalOp(Token kind) {
    Value right = pop();
    Value left = pop();
    Comparison compare = new Comparison.RelationalOp(kind, left, right, nextDeoptId());
    push(compare);
    return new Fragment(compare);
  }

  public Fragment smiEqualityCompare(Token kind) {
    Value right = pop();
    Value left = pop();
    Comparison compare = new Comparison.EqualityCompare(kind, left, right, nextDeoptId());
    push(compare);
    return new Fragment(compare);
  }

  public Fragment smiBinaryOp(Token op, boolean isTruncating) {
    Value right = pop();
    Value left = pop();
    BinaryOp binaryOp = new BinaryOp(op, left, right, isTruncating, nextDeoptId());
    push(binaryOp);
    return new Fragment(binaryOp);
  }

  public Fragment booleanNegate() {
    BooleanNegate negate = new BooleanNegate(pop());
    push(negate);
    return new Fragment(negate);
  }

  public Fragment assertBoolean() {
    AssertBoolean check = new AssertBoolean(pop(), nextDeoptId());
    push(check);
    return new Fragment(check);
  }

  public Fragment instanceOf(String typeName) {
    InstanceOf test = new InstanceOf(pop(), typeName, nextDeoptId());
    push(test);
    return new Fragment(test);
  }

  public Fragment allocateObject(String className) {
    AllocateObject allocate = new AllocateObject(className, nextDeoptId());
    push(allocate);
    return new Fragment(allocate);
  }

  /** Pops a length and the element type arguments, and pushes a new array. */
  public Fragment createArray() {
    Value length = pop();
    Value typeArguments = pop();
    CreateArray create = new CreateArray(typeArguments, length, nextDeoptId());
    push(create);
    return new Fragment(create);
  }

  public Fragment checkStackOverflow(int loopDepth) {
    return new Fragment(new CheckStackOverflow(loopDepth, false, nextDeoptId()));
  }

  public Fragment checkStackOverflowInPrologue() {
    return new Fragment(new CheckStackOverflow(0, true, nextDeoptId()));
  }

  // Calls

  public Fragment staticCall(
      String target, int argumentCount, @Nullable InferredType resultType) {
    Call call = new Call.StaticCall(target, getArguments(argumentCount), nextDeoptId());
    call.setResultType(resultType);
    push(call);
    return new Fragment(call);
  }

  public Fragment staticCall(String target, int argumentCount) {
    return staticCall(target, argumentCount, null);
  }

  /** Builds a dynamic call; the receiver is the first of the {@code argumentCount} arguments. */
  public Fragment instanceCall(
      String selector,
      Token kind,
      int argumentCount,
      int checkedArgumentCount,
      @Nullable InferredType resultType) {
    Call call =
        new Call.InstanceCall(
            selector, kind, getArguments(argumentCount), checkedArgumentCount, nextDeoptId());
    call.setResultType(resultType);
    push(call);
    return new Fragment(call);
  }

  public Fragment closureCall(int argumentCount) {
    Call call = new Call.ClosureCall(getArguments(argumentCount), nextDeoptId());
    push(call);
    return new Fragment(call);
  }

  // Control flow

  public Fragment gotoJoin(JoinEntry destination) {
    return new Fragment(new Goto(destination, nextDeoptId()));
  }

  /** Returns the value on top of the stack, which must be the only value on it. */
  public Fragment returnValue() {
    Value value = pop();
    assert stack == null : "Values left on the operand stack at return";
    return new Fragment(new Return(value, nextDeoptId()));
  }

  /** Throws the last pushed argument. */
  public Fragment throwException() {
    PushArgument exception = getArguments(1).get(0);
    return new Fragment(new Throw(Value.of(exception), nextDeoptId()));
  }

  /** Rethrows the last two pushed arguments (exception and stack trace) past {@code tryIndex}. */
  public Fragment rethrowException(int catchTryIndex) {
    ImmutableList<PushArgument> arguments = getArguments(2);
    return new Fragment(
        new ReThrow(
            Value.of(arguments.get(0)), Value.of(arguments.get(1)), catchTryIndex, nextDeoptId()));
  }

  /** Jumps to {@code stub}, passing the value on top of the stack. */
  public Fragment tailCall(String stub) {
    return new Fragment(new TailCall(stub, pop()));
  }

  /** Pops the value to test; branches to {@code then} if it is true (false if negated). */
  public BranchResult branchIfTrue(boolean negate) {
    Fragment instructions = boolConstant(true);
    return prefix(instructions, branchIfEqual(negate));
  }

  /** Pops the value to test; branches to {@code then} if it is null (non-null if negated). */
  public BranchResult branchIfNull(boolean negate) {
    Fragment instructions = nullConstant();
    return prefix(instructions, branchIfEqual(negate));
  }

  /** Pops two values; branches to {@code then} if they are identical (not identical if negated). */
  public BranchResult branchIfEqual(boolean negate) {
    Value right = pop();
    Value left = pop();
    Token kind = negate ? Token.NE_STRICT : Token.EQ_STRICT;
    return branch(new Comparison.StrictCompare(kind, left, right, false, nextDeoptId()));
  }

  /** Pops two values; branches to {@code then} if they are identical. */
  public BranchResult branchIfStrictEqual() {
    Value right = pop();
    Value left = pop();
    return branch(
        new Comparison.StrictCompare(Token.EQ_STRICT, left, right, false, nextDeoptId()));
  }

  private BranchResult branch(Comparison comparison) {
    TargetEntry then = buildTargetEntry();
    TargetEntry otherwise = buildTargetEntry();
    Branch branch = new Branch(comparison, then, otherwise, nextDeoptId());
    return new BranchResult(new Fragment(branch), then, otherwise);
  }

  private static BranchResult prefix(Fragment instructions, BranchResult branch) {
    return new BranchResult(instructions.concat(branch.fragment), branch.then, branch.otherwise);
  }

  // Arguments descriptor tests

  public Fragment loadArgumentsDescriptor() {
    LocalVariable descriptor = scopes.argumentsDescriptorVariable();
    Preconditions.checkState(descriptor != null, "Function has no arguments descriptor");
    return loadLocal(descriptor);
  }

  /**
   * Runs {@code eqBranch} if the caller passed exactly {@code numTypeArgs} type arguments, and
   * {@code neqBranch} otherwise. The result is closed unless at least one of the branches is open;
   * the two branches only need a join if both are.
   */
  public Fragment testTypeArgsLen(Fragment eqBranch, Fragment neqBranch, int numTypeArgs) {
    Fragment test =
        loadArgumentsDescriptor()
            .concat(loadNativeField(Slot.ARGS_DESC_TYPE_ARGS_LEN))
            .concat(intConstant(numTypeArgs));
    BranchResult branch = branchIfEqual(false);
    test = test.concat(branch.fragment);
    Fragment eq = eqBranch.prepend(branch.then);
    Fragment neq = neqBranch.prepend(branch.otherwise);
    if (eq.isClosed() && neq.isClosed()) {
      return test;
    } else if (eq.isClosed()) {
      return new Fragment(test.entry(), neq.current());
    } else if (neq.isClosed()) {
      return new Fragment(test.entry(), eq.current());
    }
    JoinEntry join = buildJoinEntry();
    eq.concat(gotoJoin(join));
    neq.concat(gotoJoin(join));
    return new Fragment(test.entry(), join);
  }

  /** Runs {@code present} if the caller passed any type arguments, {@code absent} otherwise. */
  public Fragment testAnyTypeArgs(Fragment present, Fragment absent) {
    return testTypeArgsLen(absent, present, 0);
  }

  /**
   * Returns a join whose block tail-calls the no-such-method stub; every argument-shape check that
   * fails jumps to it.
   */
  public JoinEntry buildThrowNoSuchMethod() {
    JoinEntry nsm = buildJoinEntry();
    new Fragment(nsm).concat(loadArgumentsDescriptor()).concat(tailCall(NO_SUCH_METHOD_STUB));
    return nsm;
  }
}
