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

/**
 * An abstract wrapper for {@link Allocator} and {@link Reallocator} instances, that adds a logging callback
 * when allocator operations fail.
 * <p>
 * The pool itself never logs allocation failures; it wraps them in a {@link PoolException} and leaves
 * the slot unchanged. Wrap the allocator in a {@code LoggingAllocator} to have every failure reported
 * to the logging framework of the application, right where it happens.
 *
 * @param <T> The type of elements being allocated.
 */
public abstract class LoggingAllocator<T> implements Reallocator<T> {
  /**
   * Indicates an exception was thrown by {@link Reallocator#reallocate(Object)}, or by the
   * allocation in the allocate-then-deallocate fallback for plain allocators.
   */
  public static final String REALLOCATION_FAILED = "Reallocation failed";
  /**
   * Indicates an exception was thrown by {@link Allocator#allocate()}.
   */
  public static final String ALLOCATION_FAILED = "Allocation failed";
  /**
   * Indicates an exception was thrown by {@link Allocator#deallocate(Object)}. When this happens in the
   * reallocation fallback for plain allocators, the failure is only logged, and the new element is returned.
   */
  public static final String DEALLOCATION_FAILED = "Deallocation failed";

  private final Allocator<T> allocator;
  private final Reallocator<T> reallocator;

  /**
   * Constructs a LoggingAllocator by wrapping the provided {@code Allocator}.
   * If the given {@code Allocator} is an instance of {@code Reallocator}, then the reallocator methods are
   * delegated directly, otherwise they are re-implemented in terms of the {@link Allocator} API.
   *
   * @param allocator The allocator to wrap. It must not be {@code null}.
   */
  public LoggingAllocator(Allocator<T> allocator) {
    Objects.requireNonNull(allocator, "The Allocator cannot be null.");
    if (allocator instanceof Reallocator) {
      this.reallocator = (Reallocator<T>) allocator;
    } else {
      reallocator = null;
    }
    this.allocator = allocator;
  }

  @Override
  public T reallocate(T element) throws Exception {
    T fresh;
    try {
      if (reallocator != null) {
        return reallocator.reallocate(element);
      }
      fresh = allocator.allocate();
    } catch (Exception e) {
      logMessage(REALLOCATION_FAILED, e);
      throw e;
    }
    // The replacement is already built, so a failed deallocation is only logged.
    try {
      allocator.deallocate(element);
    } catch (Exception e) {
      logMessage(DEALLOCATION_FAILED, e);
    }
    return fresh;
  }

  @Override
  public T allocate() throws Exception {
    try {
      return allocator.allocate();
    } catch (Exception e) {
      logMessage(ALLOCATION_FAILED, e);
      throw e;
    }
  }

  @Override
  public void deallocate(T element) throws Exception {
    try {
      allocator.deallocate(element);
    } catch (Exception e) {
      logMessage(DEALLOCATION_FAILED, e);
      throw e;
    }
  }

  /**
   * Logs a message and an associated throwable for diagnostic or debugging purposes.
   * The message will be one of the string constants defined on the {@link LoggingAllocator} class.
   * <p>
   * Subclasses must implement this method and delegate to their preferred logging framework.
   *
   * @param message   The log message to record, never {@code null}.
   * @param throwable The throwable associated with the log message, never {@code null}.
   */
  protected abstract void logMessage(String message, Throwable throwable);
}
