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

import slotpool.Result;

/**
 * One storage cell of a {@link FixedSlotPool}.
 * <p>
 * The slot doubles as the successful {@link Result} of every activation and
 * access call on it, so handing out a result costs nothing.
 * Its value is whatever element the slot holds at the time it is read.
 *
 * @param <T> The type of pool elements.
 */
public final class PoolSlot<T> extends Result<T> {
  private final int index;
  // Written only by FixedSlotPool.
  T element;
  boolean active;

  /**
   * Create a free slot holding the given element.
   * @param index The position of the slot in its pool.
   * @param element The initial element.
   */
  PoolSlot(int index, T element) {
    super(null);
    this.index = index;
    this.element = element;
  }

  @Override
  public T value() {
    return element;
  }

  @Override
  public int index() {
    return index;
  }

  @Override
  public String toString() {
    return "PoolSlot[" + index + ", " + (active ? "ACTIVE" : "FREE") + ", element = " + element + "]";
  }
}
