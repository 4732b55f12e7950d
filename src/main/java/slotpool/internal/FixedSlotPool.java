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
import slotpool.PoolException;
import slotpool.Reallocator;
import slotpool.Result;
import slotpool.SlotPool;

import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;
import static slotpool.PoolError.ALREADY_IN_USE;
import static slotpool.PoolError.ALREADY_UNUSED;
import static slotpool.PoolError.FULL;
import static slotpool.PoolError.NOT_IN_USE;
import static slotpool.PoolError.OUT_OF_RANGE;

/**
 * The array-backed {@link SlotPool} implementation.
 * <p>
 * The next-free search scans circularly from a cursor, which is moved to the
 * first free slot after every activation. The cursor is only a hint, and the
 * scan is bounded by the capacity.
 *
 * @param <T> The type of pool elements.
 */
public final class FixedSlotPool<T> implements SlotPool<T> {
  private static final Logger LOGGER = Logger.getLogger(FixedSlotPool.class.getName());

  private final PoolSlot<T>[] slots;
  private final Allocator<T> allocator;
  private int objectsInUse;
  private int cursor;
  private boolean closed;

  /**
   * Build a pool and construct all of its elements.
   * @param capacity The number of slots.
   * @param allocator The pool allocator.
   * @param initialAllocator The allocator for the elements the pool starts out with.
   */
  public FixedSlotPool(int capacity, Allocator<T> allocator, Allocator<T> initialAllocator) {
    if (capacity < 0) {
      throw new IllegalArgumentException("Capacity must be at least 0, but was " + capacity + ".");
    }
    this.allocator = requireNonNull(allocator, "The Allocator cannot be null.");
    requireNonNull(initialAllocator, "The initial Allocator cannot be null.");
    @SuppressWarnings("unchecked")
    PoolSlot<T>[] array = (PoolSlot<T>[]) new PoolSlot<?>[capacity];
    for (int i = 0; i < capacity; i++) {
      try {
        array[i] = new PoolSlot<>(i, allocate(initialAllocator));
      } catch (PoolException e) {
        for (int j = 0; j < i; j++) {
          deallocate(array[j].element);
        }
        throw e;
      }
    }
    slots = array;
  }

  @Override
  public int size() {
    return slots.length;
  }

  @Override
  public int objectsInUse() {
    return objectsInUse;
  }

  @Override
  public boolean isInUse(int index) {
    if (index < 0 || index >= slots.length) {
      return false;
    }
    return slots[index].active;
  }

  @Override
  public Result<T> get(int index) {
    if (index < 0 || index >= slots.length) {
      return Result.failure(OUT_OF_RANGE);
    }
    PoolSlot<T> slot = slots[index];
    if (!slot.active) {
      return Result.failure(NOT_IN_USE);
    }
    return slot;
  }

  @Override
  public T element(int index) {
    return slots[index].element;
  }

  @Override
  public Result<T> use(int index) {
    checkOpen();
    if (index < 0 || index >= slots.length) {
      return Result.failure(OUT_OF_RANGE);
    }
    PoolSlot<T> slot = slots[index];
    if (slot.active) {
      return Result.failure(ALREADY_IN_USE);
    }
    activate(slot);
    return slot;
  }

  @Override
  public Result<T> useNext() {
    checkOpen();
    int index = findFree();
    if (index < 0) {
      return Result.failure(FULL);
    }
    PoolSlot<T> slot = slots[index];
    activate(slot);
    return slot;
  }

  @Override
  public Result<T> useNextReplace() {
    return useNextReplace(allocator);
  }

  @Override
  public Result<T> useNextReplace(Allocator<T> allocator) {
    requireNonNull(allocator, "The Allocator cannot be null.");
    checkOpen();
    int index = findFree();
    if (index < 0) {
      return Result.failure(FULL);
    }
    PoolSlot<T> slot = slots[index];
    reconstruct(slot, allocator);
    activate(slot);
    return slot;
  }

  @Override
  public Result<Void> unUse(int index) {
    return unUse(index, allocator);
  }

  @Override
  public Result<Void> unUse(int index, Allocator<T> allocator) {
    requireNonNull(allocator, "The Allocator cannot be null.");
    checkOpen();
    if (index < 0 || index >= slots.length) {
      return Result.failure(OUT_OF_RANGE);
    }
    PoolSlot<T> slot = slots[index];
    if (!slot.active) {
      return Result.failure(ALREADY_UNUSED);
    }
    reconstruct(slot, allocator);
    slot.active = false;
    objectsInUse--;
    return Result.ok();
  }

  @Override
  public Result<Void> replace(int index) {
    return replace(index, allocator);
  }

  @Override
  public Result<Void> replace(int index, Allocator<T> allocator) {
    requireNonNull(allocator, "The Allocator cannot be null.");
    checkOpen();
    if (index < 0 || index >= slots.length) {
      return Result.failure(OUT_OF_RANGE);
    }
    PoolSlot<T> slot = slots[index];
    reconstruct(slot, allocator);
    if (slot.active) {
      slot.active = false;
      objectsInUse--;
    }
    return Result.ok();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (PoolSlot<T> slot : slots) {
      deallocate(slot.element);
      slot.active = false;
    }
    objectsInUse = 0;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Pool has been closed.");
    }
  }

  private void activate(PoolSlot<T> slot) {
    slot.active = true;
    objectsInUse++;
    int next = findFree();
    if (next >= 0) {
      cursor = next;
    }
  }

  private int findFree() {
    PoolSlot<T>[] slots = this.slots;
    int capacity = slots.length;
    int pos = cursor;
    for (int i = 0; i < capacity; i++) {
      if (!slots[pos].active) {
        return pos;
      }
      pos++;
      if (pos == capacity) {
        pos = 0;
      }
    }
    return -1;
  }

  // The replacement is produced before the slot is touched, so a failing
  // allocator leaves the slot with its previous element.
  private void reconstruct(PoolSlot<T> slot, Allocator<T> allocator) {
    T previous = slot.element;
    T fresh;
    if (allocator instanceof Reallocator) {
      Reallocator<T> reallocator = (Reallocator<T>) allocator;
      try {
        fresh = reallocator.reallocate(previous);
      } catch (Exception e) {
        throw new PoolException("Reallocation failed.", e);
      }
      if (fresh == null) {
        throw new PoolException("Reallocator returned null.");
      }
    } else {
      fresh = allocate(allocator);
      if (fresh != previous) {
        deallocate(previous);
      }
    }
    slot.element = fresh;
  }

  private static <T> T allocate(Allocator<T> allocator) {
    T element;
    try {
      element = allocator.allocate();
    } catch (Exception e) {
      throw new PoolException("Allocation failed.", e);
    }
    if (element == null) {
      throw new PoolException("Allocator returned null.");
    }
    return element;
  }

  private void deallocate(T element) {
    try {
      allocator.deallocate(element);
    } catch (Exception e) {
      LOGGER.log(Level.WARNING, "Deallocation failed for " + element, e);
    }
  }
}
