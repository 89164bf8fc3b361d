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

import org.kflow.il.Fragment;
import org.kflow.il.TargetEntry;

/**
 * A closed fragment ending in a branch, together with the two targets of the branch. Code that
 * should run when the tested condition holds is prepended with {@link #then}; the rest with
 * {@link #otherwise}.
 */
public final class BranchResult {
  public final Fragment fragment;
  public final TargetEntry then;
  public final TargetEntry otherwise;

  BranchResult(Fragment fragment, TargetEntry then, TargetEntry otherwise) {
    this.fragment = fragment;
    this.then = then;
    this.otherwise = otherwise;
  }
}
