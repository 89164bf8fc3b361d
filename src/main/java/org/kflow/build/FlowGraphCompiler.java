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

import com.google.common.flogger.FluentLogger;
import org.kflow.ast.FunctionNode;
import org.kflow.il.FlowGraph;
import org.kflow.scope.ScopeInfo;
import org.kflow.scope.TypeHints;

/**
 * Entry point for lowering a function. If building the graph for inlining bails out, the function
 * is built again as a standalone function.
 */
public final class FlowGraphCompiler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private FlowGraphCompiler() {}

  /**
   * Returns the graph for {@code function}.
   *
   * @throws BailoutException if building without inlining bails out
   */
  public static FlowGraph compile(
      FunctionNode function, ScopeInfo scopes, TypeHints typeHints, BuilderOptions options) {
    try {
      return new FlowGraphBuilder(function, scopes, typeHints, options).buildGraph();
    } catch (BailoutException e) {
      if (!options.inlining) {
        throw e;
      }
      logger.atInfo().log("Can't inline %s (%s); building it standalone", function, e.reason());
      BuilderOptions standalone = options.toBuilder().setInlining(false).build();
      return new FlowGraphBuilder(function, scopes, typeHints, standalone).buildGraph();
    }
  }
}
