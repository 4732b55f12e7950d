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
 * An Allocator is responsible for the construction and destruction of the
 * elements held in the slots of a {@link SlotPool}.
 * <p>
 * The pool allocator of a slot pool is used to construct every element when
 * the pool is built, to reconstruct elements when slots are
 * {@linkplain SlotPool#unUse(int) freed} or {@linkplain SlotPool#replace(int)
 * replaced}, and to {@linkplain #deallocate(Object) deallocate} elements.
 * <p>
 * Operations that reconstruct an element can also be given a different
 * allocator, which plays the part of constructor arguments:
 * <pre>{@code
 * SlotPool<Color> pool = SlotPool.of(16, Color::new);
 * pool.unUse(3, () -> new Color(255, 128, 64));
 * }</pre>
 * Plain allocators produce a new object for every reconstruction.
 * Implement {@link Reallocator} to reset elements in place instead.
 * <p>
 * Allocators are called on the thread that calls into the pool, and only
 * while that call is in progress.
 *
 * @author Chris Vest
 * @param <T> The type of elements being allocated.
 */
@FunctionalInterface
public interface Allocator<T> {
  /**
   * Create a fresh new element.
   * <p>
   * Exceptions thrown by this method propagate out of the pool operation,
   * wrapped in a {@link PoolException}. The slot being (re)constructed is left
   * unchanged when this happens.
   *
   * @return A newly created instance of T. Never {@code null}.
   * @throws Exception If the allocation fails.
   */
  T allocate() throws Exception;

  /**
   * Deallocate, if applicable, the given element and free any resources
   * associated with it.
   * <p>
   * The pool calls this exactly once for every element it discards, which is
   * when a plain allocator has produced a replacement, and for every element
   * still held when the pool is {@linkplain SlotPool#close() closed}.
   * <p>
   * Exceptions thrown by this method are logged by the pool and then
   * disregarded, since a replacement has already taken the place of the
   * element by the time it is deallocated.
   * <p>
   * The default implementation does nothing.
   *
   * @param element The non-null element to be deallocated.
   * @throws Exception if the deallocation encounters an error.
   */
  default void deallocate(T element) throws Exception {
  }
}
