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
package slotpool.internal;

import slotpool.Allocator;
import slotpool.PoolBuilder;
import slotpool.SlotPool;

import static java.util.Objects.requireNonNull;

/**
 * The {@link PoolBuilder} implementation.
 * @param <T> The type of pool elements.
 */
public final class PoolBuilderImpl<T> implements PoolBuilder<T> {
  /**
   * The capacity of pools built from a builder whose capacity has not been set.
   */
  public static final int DEFAULT_CAPACITY = 10;

  private Allocator<T> allocator;
  private Allocator<T> initialAllocator;
  private int capacity = DEFAULT_CAPACITY;

  /**
   * Build a new {@code PoolBuilder} object.
   * @param allocator The allocator instance to use.
   */
  public PoolBuilderImpl(Allocator<T> allocator) {
    requireNonNull(allocator, "The Allocator cannot be null.");
    this.allocator = allocator;
  }

  @Override
  public synchronized PoolBuilder<T> setCapacity(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Capacity must be at least 0, but was " + capacity + ".");
    }
    this.capacity = capacity;
    return this;
  }

  @Override
  public synchronized int getCapacity() {
    return capacity;
  }

  @Override
  public synchronized PoolBuilder<T> setAllocator(Allocator<T> allocator) {
    requireNonNull(allocator, "The Allocator cannot be null.");
    this.allocator = allocator;
    return this;
  }

  @Override
  public synchronized Allocator<T> getAllocator() {
    return allocator;
  }

  @Override
  public synchronized PoolBuilder<T> setInitialAllocator(Allocator<T> initialAllocator) {
    this.initialAllocator = initialAllocator;
    return this;
  }

  @Override
  public synchronized Allocator<T> getInitialAllocator() {
    return initialAllocator == null ? allocator : initialAllocator;
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized PoolBuilderImpl<T> clone() {
    try {
      return (PoolBuilderImpl<T>) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized SlotPool<T> build() {
    return new FixedSlotPool<>(capacity, allocator, getInitialAllocator());
  }
}
