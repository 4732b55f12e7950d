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

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reallocators are a special kind of {@link Allocator} that can reconstruct
 * an element by resetting it in place.
 * <p>
 * A {@link SlotPool} that reconstructs elements through a plain allocator
 * produces garbage for every freed slot. Pools keep their elements around for
 * a long time, so the discarded elements have usually been tenured, and the
 * churn ends up in the old generation. A reallocator that reuses the instance
 * makes freeing and replacing slots allocation-free.
 *
 * @author Chris Vest
 * @param <T> The type of elements being allocated.
 */
public interface Reallocator<T> extends Allocator<T> {
  /**
   * Reset the given element to the state of a freshly allocated one, and
   * return it, or return a fresh replacement if the element cannot be reset.
   * <p>
   * This method is effectively equivalent to the following:
   * <pre>{@code
   * deallocate(element);
   * return allocate();
   * }</pre>
   * With the only difference that it may, if possible, reuse the given
   * element, either wholly or in part.
   * <p>
   * The pool does not deallocate the given element after this call, even if a
   * different instance is returned. A reallocator that gives up on an element
   * is responsible for cleaning it up.
   *
   * @param element The non-null element to be reallocated.
   * @return A fresh or rejuvenated instance of T. Never {@code null}.
   * @throws Exception If the reallocation fails.
   * @see #allocate()
   * @see #deallocate(Object)
   */
  T reallocate(T element) throws Exception;

  /**
   * Build a reallocator that creates elements with the given allocator, and
   * reallocates them by applying the given reset action to them in place.
   * <p>
   * Deallocation is delegated to the given allocator.
   *
   * @param allocator The allocator for new elements. Cannot be {@code null}.
   * @param reset The action that brings an element back to its fresh state.
   *             Cannot be {@code null}.
   * @param <T> The type of elements being allocated.
   * @return A reallocator that reuses elements.
   */
  static <T> Reallocator<T> resetting(Allocator<T> allocator, Consumer<? super T> reset) {
    Objects.requireNonNull(allocator, "The Allocator cannot be null.");
    Objects.requireNonNull(reset, "The reset action cannot be null.");
    return new Reallocator<>() {
      @Override
      public T reallocate(T element) {
        reset.accept(element);
        return element;
      }

      @Override
      public T allocate() throws Exception {
        return allocator.allocate();
      }

      @Override
      public void deallocate(T element) throws Exception {
        allocator.deallocate(element);
      }
    };
  }
}
