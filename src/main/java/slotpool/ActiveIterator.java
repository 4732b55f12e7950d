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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A forward cursor over the active slots of a pool.
 * <p>
 * The cursor references the pool without owning it, and only keeps track of a
 * slot index. Inactive slots are skipped when the cursor is created and every
 * time it advances, so it always rests on an active slot, or at the end.
 * <p>
 * Elements may be mutated freely while iterating, which is the intended way
 * of running a per-tick update over everything that is alive:
 * <pre>{@code
 * for (Particle particle : particles) {
 *   particle.update(dt);
 * }
 * }</pre>
 * Activating or freeing slots while iterating is not supported. Collect the
 * indexes of the slots to free, and free them once the iteration is done.
 * <p>
 * Two cursors are equal if they are over the same pool and rest on the same
 * slot. All end cursors of a pool are equal to each other.
 *
 * @param <T> The type of elements in the pool.
 */
public final class ActiveIterator<T> implements Iterator<T> {
  private final PoolView<T> pool;
  private int position;

  private ActiveIterator(PoolView<T> pool, int position) {
    this.pool = pool;
    this.position = position;
  }

  /**
   * Create a cursor on the first active slot of the given pool.
   * @param pool The pool to iterate.
   * @param <T> The type of elements in the pool.
   * @return A begin cursor, which is at the end if the pool has no active slots.
   */
  public static <T> ActiveIterator<T> begin(PoolView<T> pool) {
    ActiveIterator<T> iterator = new ActiveIterator<>(pool, 0);
    iterator.skipUnused();
    return iterator;
  }

  /**
   * Create the end cursor of the given pool.
   * @param pool The pool the cursor belongs to.
   * @param <T> The type of elements in the pool.
   * @return A cursor positioned one past the last slot.
   */
  public static <T> ActiveIterator<T> end(PoolView<T> pool) {
    return new ActiveIterator<>(pool, pool.size());
  }

  /**
   * @return {@code true} if this cursor has run past the last active slot.
   */
  public boolean isAtEnd() {
    return position >= pool.size();
  }

  /**
   * Get the index of the slot this cursor rests on.
   * @return The slot index, or the size of the pool if at the end.
   */
  public int index() {
    return position;
  }

  /**
   * Get the element of the slot this cursor rests on, without moving.
   * @return The current element.
   * @throws NoSuchElementException if this cursor is at the end.
   */
  public T current() {
    if (isAtEnd()) {
      throw new NoSuchElementException("Iterator is at the end of the pool.");
    }
    return pool.element(position);
  }

  /**
   * Move to the next active slot, or to the end. Does nothing when already at the end.
   * @return This cursor.
   */
  public ActiveIterator<T> advance() {
    if (!isAtEnd()) {
      position++;
      skipUnused();
    }
    return this;
  }

  @Override
  public boolean hasNext() {
    return !isAtEnd();
  }

  @Override
  public T next() {
    T element = current();
    advance();
    return element;
  }

  private void skipUnused() {
    int end = pool.size();
    while (position < end && !pool.isInUse(position)) {
      position++;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ActiveIterator<?> other)) {
      return false;
    }
    if (pool != other.pool) {
      return false;
    }
    return position == other.position || isAtEnd() && other.isAtEnd();
  }

  @Override
  public int hashCode() {
    int size = pool.size();
    return 31 * System.identityHashCode(pool) + Math.min(position, size);
  }

  @Override
  public String toString() {
    return isAtEnd() ? "ActiveIterator[END]" : "ActiveIterator[" + position + "]";
  }
}
