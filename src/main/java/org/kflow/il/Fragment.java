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
import org.jspecify.annotations.Nullable;

/**
 * A Fragment is a run of linked instructions with a single entry and at most one open exit.
 *
 * <ul>
 *   <li>The empty fragment has no entry; it is a no-op and is always open.
 *   <li>An open fragment has an entry and a {@link #current} instruction, which is where the next
 *       fragment will be linked.
 *   <li>A closed fragment has an entry but no current instruction; it ends in a {@link Terminator}
 *       (or control never leaves it normally) and nothing may be appended to it.
 * </ul>
 *
 * <p>Fragments are immutable, but {@link #concat} and {@link #prepend} link the underlying
 * instructions as a side effect, so a given fragment should be extended at most once.
 */
public final class Fragment {
  public static final Fragment EMPTY = new Fragment(null, null);

  private final @Nullable Instruction entry;
  private final @Nullable Instruction current;

  /** A fragment containing a single instruction, which is closed if it is a terminator. */
  public Fragment(Instruction instruction) {
    this(instruction, instruction.isTerminator() ? null : instruction);
  }

  public Fragment(@Nullable Instruction entry, @Nullable Instruction current) {
    Preconditions.checkArgument(entry != null || current == null, "Fragment with no entry");
    this.entry = entry;
    this.current = current;
  }

  /** Concatenates {@code fragments} from left to right; returns the empty fragment if none. */
  public static Fragment of(Fragment... fragments) {
    Fragment result = EMPTY;
    for (Fragment fragment : fragments) {
      result = result.concat(fragment);
    }
    return result;
  }

  public @Nullable Instruction entry() {
    return entry;
  }

  public @Nullable Instruction current() {
    return current;
  }

  public boolean isEmpty() {
    return entry == null;
  }

  public boolean isOpen() {
    return entry == null || current != null;
  }

  public boolean isClosed() {
    return !isOpen();
  }

  /**
   * Returns a fragment that runs this one followed by {@code other}. This fragment must be open,
   * even if {@code other} is empty.
   */
  public Fragment concat(Fragment other) {
    Preconditions.checkState(isOpen(), "Cannot append to closed fragment starting at %s", entry);
    if (entry == null) {
      return other;
    } else if (other.entry == null) {
      return this;
    }
    current.linkTo(other.entry);
    return new Fragment(entry, other.current);
  }

  /** Returns a fragment that runs this one followed by {@code instruction}. */
  public Fragment append(Instruction instruction) {
    return concat(new Fragment(instruction));
  }

  /** Returns a fragment that runs {@code start} and then this one. */
  public Fragment prepend(Instruction start) {
    Preconditions.checkArgument(!start.isTerminator());
    if (entry == null) {
      return new Fragment(start, start);
    }
    start.linkTo(entry);
    return new Fragment(start, current);
  }

  /** Returns this fragment with its exit closed. */
  public Fragment closed() {
    Preconditions.checkState(entry != null, "Cannot close an empty fragment");
    return new Fragment(entry, null);
  }

  @Override
  public String toString() {
    return String.format("Fragment(%s .. %s)", entry, isOpen() ? current : "closed");
  }
}
