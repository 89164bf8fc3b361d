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

import org.kflow.ast.FunctionNode;
import org.kflow.il.Fragment;
import org.kflow.il.JoinEntry;
import org.kflow.il.Slot;
import org.kflow.il.Token;
import org.kflow.scope.LocalVariable;

/**
 * Builds the code that runs on entry to a function, before its body:
 *
 * <ul>
 *   <li>if it can be called dynamically, checks of the caller's argument descriptor against the
 *       function's parameters, all failing to a shared join that tail-calls {@link
 *       BaseGraphBuilder#NO_SUCH_METHOD_STUB};
 *   <li>a stack overflow check (unless the function is being inlined);
 *   <li>for a closure, making the closure's context current.
 * </ul>
 */
final class PrologueBuilder {
  private final BaseGraphBuilder builder;
  private final FunctionNode function;

  PrologueBuilder(BaseGraphBuilder builder, FunctionNode function) {
    this.builder = builder;
    this.function = function;
  }

  Fragment buildPrologue() {
    Fragment prologue = Fragment.EMPTY;
    if (builder.options.checkArgumentCounts
        && builder.scopes.argumentsDescriptorVariable() != null) {
      JoinEntry nsm = builder.buildThrowNoSuchMethod();
      prologue = prologue.concat(checkArgumentCounts(nsm)).concat(checkTypeArguments(nsm));
    }
    if (!builder.options.inlining) {
      prologue = prologue.concat(builder.checkStackOverflowInPrologue());
    }
    if (function.isClosure) {
      prologue = prologue.concat(loadClosureContext());
    }
    return prologue;
  }

  /**
   * Checks that no named arguments were passed and that the number of positional arguments is
   * between the required and total parameter counts.
   */
  private Fragment checkArgumentCounts(JoinEntry nsm) {
    Fragment check =
        builder
            .loadArgumentsDescriptor()
            .concat(builder.loadNativeField(Slot.ARGS_DESC_COUNT))
            .concat(builder.loadArgumentsDescriptor())
            .concat(builder.loadNativeField(Slot.ARGS_DESC_POSITIONAL_COUNT));
    check = failUnless(check, builder.branchIfEqual(false), nsm);

    int required = function.requiredParameterCount;
    int total = function.positionalParameters.size();
    if (required == total) {
      check = check.concat(loadPositionalCount()).concat(builder.intConstant(total));
      return failUnless(check, builder.branchIfEqual(false), nsm);
    }
    check =
        check
            .concat(loadPositionalCount())
            .concat(builder.intConstant(required))
            .concat(builder.smiRelationalOp(Token.GTE));
    check = failUnless(check, builder.branchIfTrue(false), nsm);
    check =
        check
            .concat(loadPositionalCount())
            .concat(builder.intConstant(total))
            .concat(builder.smiRelationalOp(Token.LTE));
    return failUnless(check, builder.branchIfTrue(false), nsm);
  }

  private Fragment loadPositionalCount() {
    return builder
        .loadArgumentsDescriptor()
        .concat(builder.loadNativeField(Slot.ARGS_DESC_POSITIONAL_COUNT));
  }

  /** Appends {@code branch} to {@code check}, sending its otherwise side to {@code nsm}. */
  private Fragment failUnless(Fragment check, BranchResult branch, JoinEntry nsm) {
    check.concat(branch.fragment);
    new Fragment(branch.otherwise).concat(builder.gotoJoin(nsm));
    return new Fragment(check.entry(), branch.then);
  }

  /**
   * Callers may always omit type arguments; a generic function also accepts exactly its own number
   * of them.
   */
  private Fragment checkTypeArguments(JoinEntry nsm) {
    if (!function.isGeneric()) {
      return builder.testTypeArgsLen(Fragment.EMPTY, builder.gotoJoin(nsm), 0);
    }
    Fragment checkCount =
        builder.testTypeArgsLen(
            Fragment.EMPTY, builder.gotoJoin(nsm), function.typeParameterCount);
    return builder.testAnyTypeArgs(checkCount, Fragment.EMPTY);
  }

  /** Makes the context captured by the closure current. */
  private Fragment loadClosureContext() {
    LocalVariable closure = builder.scopes.closureVariable();
    if (closure == null) {
      return Fragment.EMPTY;
    }
    return builder
        .loadLocal(closure)
        .concat(builder.loadField(Slot.CLOSURE_CONTEXT))
        .concat(builder.storeLocal(builder.scopes.currentContextVariable()))
        .concat(builder.drop());
  }
}
