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

/**
 * The {@code PoolBuilder} collects information about how big a pool should be,
 * and how it should allocate its elements, and finally acts as the factory for
 * building the pool instances themselves, with the {@link #build()} method.
 * <p>
 * Pool builder instances are obtained by calling {@link SlotPool#builder(Allocator)}.
 * <p>
 * This class is made thread-safe by having the fields be protected by the
 * intrinsic object lock on the {@code PoolBuilder} object itself. The pools it
 * builds are not thread-safe.
 * <p>
 * The various {@code set*} methods are made to return the {@code PoolBuilder} instance
 * itself, so that the method calls may be chained if so desired.
 *
 * @author Chris Vest
 * @param <T> The type of elements in the pools built by this builder.
 */
public interface PoolBuilder<T> extends Cloneable {
  /**
   * Set the capacity of the pool we are building, that is, its number of slots.
   * <p>
   * The capacity is fixed once the pool is built. A pool of capacity 0 is
   * allowed, and is always full.
   *
   * @param capacity The number of slots in the pool. Must be at least 0.
   * @return This {@code PoolBuilder} instance.
   * @throws IllegalArgumentException if the capacity is negative.
   */
  PoolBuilder<T> setCapacity(int capacity);

  /**
   * Get the currently configured capacity. The default is 10.
   * @return The configured capacity.
   */
  int getCapacity();

  /**
   * Set the pool allocator. It reconstructs elements whenever a slot is freed or
   * replaced without an explicit allocator, and it deallocates all elements.
   *
   * @param allocator The allocator to use. Cannot be {@code null}.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setAllocator(Allocator<T> allocator);

  /**
   * Get the configured pool allocator.
   * @return The configured allocator.
   */
  Allocator<T> getAllocator();

  /**
   * Set the allocator that constructs the elements when the pool is built.
   * <p>
   * This is how every slot can start out with the same non-default element,
   * while freed slots still go back to the default one. When not set, the pool
   * allocator is used.
   *
   * @param initialAllocator The allocator for the initial elements, or
   * {@code null} to use the pool allocator.
   * @return This {@code PoolBuilder} instance.
   */
  PoolBuilder<T> setInitialAllocator(Allocator<T> initialAllocator);

  /**
   * Get the allocator that constructs the elements when the pool is built.
   * @return The initial allocator, which is the pool allocator unless another
   * one has been set.
   */
  Allocator<T> getInitialAllocator();

  /**
   * Returns a shallow copy of this {@code PoolBuilder} object.
   * @return A new {@code PoolBuilder} object of the exact same type as this one, with
   * identical values in all its fields.
   */
  PoolBuilder<T> clone();

  /**
   * Build a {@link SlotPool} instance based on the collected configuration.
   * <p>
   * Every element of the pool is constructed before this method returns.
   *
   * @return A {@link SlotPool} instance as configured by this builder.
   * @throws PoolException if the initial allocator fails. Elements that were
   * already constructed are deallocated again.
   */
  SlotPool<T> build();
}
