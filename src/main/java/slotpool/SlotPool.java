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

import slotpool.internal.PoolBuilderImpl;

/**
 * A SlotPool is a fixed number of slots, each holding one element, where every
 * slot is independently either <em>active</em> or <em>free</em>.
 * <p>
 * All elements are constructed when the pool is built. After that, slots cycle
 * between active and free, and their elements are reconstructed in place, but
 * the pool itself never grows, shrinks or allocates. This makes slot pools a
 * good fit for simulation loops and other latency-sensitive code with many
 * short-lived objects:
 * <pre>{@code
 * SlotPool<Enemy> enemies = SlotPool.of(128, Enemy::new);
 *
 * Result<Enemy> spawned = enemies.useNext();
 * if (spawned.isSuccess()) {
 *   spawned.value().spawnAt(position);
 * }
 *
 * for (Enemy enemy : enemies) {
 *   enemy.update();
 * }
 *
 * enemies.unUse(spawned.index());
 * }</pre>
 * <p>
 * Every slot starts out free. A slot becomes active through {@link #use(int)},
 * {@link #useNext()} or {@link #useNextReplace()}, and free again through
 * {@link #unUse(int)} or {@link #replace(int)}. Freeing a slot always
 * reconstructs its element, so a freed slot never keeps the state of its
 * previous occupant.
 * <p>
 * Conditions such as a full pool or a bad index are reported as a failed
 * {@link Result}, and never leave the pool partially modified. Elements and
 * results returned by the pool are only valid until the next structural
 * operation on their slot.
 * <p>
 * Slot pools are <em>not</em> thread-safe. A pool must be confined to one
 * thread at a time, or guarded by an external lock that covers each whole
 * operation.
 * <p>
 * Pools should be {@linkplain #close() closed} when no longer needed, so that
 * their elements are deallocated.
 *
 * @author Chris Vest
 * @param <T> The type of elements in the pool.
 */
public interface SlotPool<T> extends PoolView<T>, AutoCloseable {
  /**
   * Get a {@link PoolBuilder} based on the given {@link Allocator}, which can
   * then in turn be used to {@linkplain PoolBuilder#build() build} a
   * {@link SlotPool} instance with the desired configuration.
   *
   * @param allocator The allocator of the pool elements. This cannot be {@code null}.
   * @param <T> The type of elements in the pools being built.
   * @return A {@link PoolBuilder} that admits additional configurations,
   * before the pool instance is {@linkplain PoolBuilder#build() built}.
   */
  static <T> PoolBuilder<T> builder(Allocator<T> allocator) {
    return new PoolBuilderImpl<>(allocator);
  }

  /**
   * Build a pool with the given capacity, whose elements are all created by
   * the given allocator.
   *
   * @param capacity The number of slots. Must be at least 0.
   * @param allocator The allocator of the pool elements. This cannot be {@code null}.
   * @param <T> The type of elements in the pool.
   * @return A new pool where every slot is free.
   */
  static <T> SlotPool<T> of(int capacity, Allocator<T> allocator) {
    return builder(allocator).setCapacity(capacity).build();
  }

  /**
   * Activate the slot at the given index, leaving its element as it is.
   *
   * @param index The slot to activate.
   * @return A result with the element, or a failure with
   * {@link PoolError#OUT_OF_RANGE} or {@link PoolError#ALREADY_IN_USE}.
   */
  Result<T> use(int index);

  /**
   * Find a free slot and activate it, leaving its element as it is.
   * <p>
   * The search starts where the previous activation left off, and wraps
   * around, so freed slots are refilled roughly in the order they come up
   * after the last activation rather than always from index 0.
   *
   * @return A result with the element, whose {@link Result#index()} is the
   * index of the activated slot, or a failure with {@link PoolError#FULL}.
   */
  Result<T> useNext();

  /**
   * Find a free slot, reconstruct its element with the pool allocator, and
   * activate it. The search is the same as for {@link #useNext()}.
   *
   * @return A result with the fresh element and its slot index, or a failure
   * with {@link PoolError#FULL}.
   */
  Result<T> useNextReplace();

  /**
   * Find a free slot, reconstruct its element with the given allocator, and
   * activate it. The search is the same as for {@link #useNext()}.
   *
   * @param allocator The allocator that constructs the new element. Cannot be {@code null}.
   * @return A result with the fresh element and its slot index, or a failure
   * with {@link PoolError#FULL}.
   */
  Result<T> useNextReplace(Allocator<T> allocator);

  /**
   * Free the active slot at the given index, and reconstruct its element with
   * the pool allocator.
   *
   * @param index The slot to free.
   * @return A successful result, or a failure with
   * {@link PoolError#OUT_OF_RANGE} or {@link PoolError#ALREADY_UNUSED}.
   */
  Result<Void> unUse(int index);

  /**
   * Free the active slot at the given index, and reconstruct its element with
   * the given allocator.
   *
   * @param index The slot to free.
   * @param allocator The allocator that constructs the new element. Cannot be {@code null}.
   * @return A successful result, or a failure with
   * {@link PoolError#OUT_OF_RANGE} or {@link PoolError#ALREADY_UNUSED}.
   */
  Result<Void> unUse(int index, Allocator<T> allocator);

  /**
   * Reconstruct the element at the given index with the pool allocator, and
   * mark the slot as free, regardless of whether it was active.
   *
   * @param index The slot to reset.
   * @return A successful result, or a failure with {@link PoolError#OUT_OF_RANGE}.
   */
  Result<Void> replace(int index);

  /**
   * Reconstruct the element at the given index with the given allocator, and
   * mark the slot as free, regardless of whether it was active.
   *
   * @param index The slot to reset.
   * @param allocator The allocator that constructs the new element. Cannot be {@code null}.
   * @return A successful result, or a failure with {@link PoolError#OUT_OF_RANGE}.
   */
  Result<Void> replace(int index, Allocator<T> allocator);

  /**
   * Deallocate every element of the pool with the pool allocator.
   * <p>
   * Each element is deallocated exactly once. Failures to deallocate are
   * logged, and do not stop the remaining elements from being deallocated.
   * Closing a pool more than once has no further effect.
   * <p>
   * After the pool is closed, the operations that activate, free or replace
   * slots throw {@link IllegalStateException}.
   */
  @Override
  void close();
}
