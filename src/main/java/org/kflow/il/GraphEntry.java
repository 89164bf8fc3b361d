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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The unique root of a graph. Control reaches the function through {@link #normalEntry}; each
 * exception handler is reached from here through its {@link CatchBlockEntry}.
 */
public final class GraphEntry extends BlockEntry {
  private final TargetEntry normalEntry;
  private final List<CatchBlockEntry> catchEntries = new ArrayList<>();

  public GraphEntry(int blockId, TargetEntry normalEntry) {
    super(blockId, INVALID_TRY_INDEX);
    this.normalEntry = normalEntry;
  }

  public TargetEntry normalEntry() {
    return normalEntry;
  }

  public void addCatchEntry(CatchBlockEntry entry) {
    Preconditions.checkArgument(!catchEntries.contains(entry));
    catchEntries.add(entry);
  }

  public ImmutableList<CatchBlockEntry> catchEntries() {
    return ImmutableList.copyOf(catchEntries);
  }

  /** The normal entry followed by the catch entries, in the order they were added. */
  ImmutableList<BlockEntry> successors() {
    return ImmutableList.<BlockEntry>builder().add(normalEntry).addAll(catchEntries).build();
  }

  @Override
  String kindName() {
    return "graph";
  }
}
