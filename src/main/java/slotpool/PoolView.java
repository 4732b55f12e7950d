/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
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
package slotpool;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The read-only face of a {@link SlotPool}.
 * <p>
 * A PoolView offers lookups, queries and iteration, but no operation that
 * changes which slots are active or what elements they hold. Hand out a
 * PoolView where code should observe a pool without managing it.
 * <p>
 * If the element type has a read-only supertype {@code R}, then the view can
 * also be narrowed to it, so the elements themselves are only reachable
 * through their read-only interface:
 * <pre>{@code
 * SlotPool<Color> pool = SlotPool.of(8, Color::new);
 * PoolView<? extends ReadableColor> view = pool;
 * }</pre>
 * <p>
 * Iterating a view visits the elements of the active slots in increasing
 * index order, as described by {@link ActiveIterator}.
 *
 * @param <T> The type of elements in the pool.
 */
public interface PoolView<T> extends Iterable<T> {
  /**
   * Get the number of slots in the pool. This never changes.
   * @return The capacity of the pool.
   */
  int size();

  /**
   * Get the number of slots that are currently active. This is always between
   * zero and {@link #size()}, inclusive.
   * @return The number of active slots.
   */
  int objectsInUse();

  /**
   * Check whether the slot at the given index is active.
   * <p>
   * This check never fails. An index outside the pool is simply not in use.
   *
   * @param index The slot index to check.
   * @return {@code true} if the index is within the pool and its slot is active.
   */
  boolean isInUse(int index);

  /**
   * Get the element of an active slot.
   *
   * @param index The slot index to look up.
   * @return A result with the element, or a failure with
   * {@link PoolError#OUT_OF_RANGE} or {@link PoolError#NOT_IN_USE}.
   */
  Result<T> get(int index);

  /**
   * Get the element at the given index without checking that the slot is active.
   * <p>
   * This is the fast path for code that has already established that the index
   * is valid, for instance right after {@link SlotPool#useNext()}. The element of
   * a free slot is its reset placeholder. An index outside the pool causes an
   * {@link IndexOutOfBoundsException}.
   *
   * @param index The slot index.
   * @return The element held by the slot. Never {@code null}.
   */
  T element(int index);

  /**
   * Get an iterator positioned at the first active slot, or at the end if no
   * slot is active.
   * @return A new begin iterator.
   */
  @Override
  default ActiveIterator<T> iterator() {
    return ActiveIterator.begin(this);
  }

  /**
   * Get the end iterator of this pool. It refers to no element, and every
   * iterator of this pool that has run past its last active slot is equal to it.
   * @return A new end iterator.
   */
  default ActiveIterator<T> end() {
    return ActiveIterator.end(this);
  }

  /**
   * Get a sequential stream of the elements in the active slots, in increasing
   * index order.
   * @return A stream over the active elements.
   */
  default Stream<T> stream() {
    Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(
        iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false);
  }
}
