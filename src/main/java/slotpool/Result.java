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
 * The outcome of a fallible {@link SlotPool} operation: either a success,
 * possibly carrying an element and the index of its slot, or one of the
 * {@link PoolError} kinds.
 * <p>
 * Results are meant to be inspected right away:
 * <pre>{@code
 * Result<Enemy> result = enemies.useNext();
 * if (result.isSuccess()) {
 *   result.value().spawnAt(position);
 * } else {
 *   log.warn("Enemy pool: " + result.error().description());
 * }
 * }</pre>
 * <p>
 * Obtaining a result never allocates. Failures are shared constants, and the
 * successful results of activation and access calls are owned by the slot
 * they refer to. A successful result is therefore a <em>handle</em>: its
 * {@link #value()} is only meaningful until the next structural operation
 * ({@link SlotPool#replace(int)}, {@link SlotPool#unUse(int)},
 * {@link SlotPool#close()}) on that slot. The pool does not track or
 * invalidate outstanding handles.
 *
 * @param <T> The type of element carried by a successful result.
 */
public class Result<T> {
  private static final Result<Void> OK = new Result<>(null);
  private static final Result<?>[] FAILURES;

  static {
    PoolError[] errors = PoolError.values();
    FAILURES = new Result<?>[errors.length];
    for (PoolError error : errors) {
      FAILURES[error.ordinal()] = new Result<>(error);
    }
  }

  private final PoolError error;

  /**
   * Create a result for the given error, or a success if the error is {@code null}.
   * @param error The error of this result, or {@code null}.
   */
  protected Result(PoolError error) {
    this.error = error;
  }

  /**
   * Get the successful result of an operation that produces no value.
   * @return The shared success result.
   */
  public static Result<Void> ok() {
    return OK;
  }

  /**
   * Get the failed result for the given error.
   * @param error The error to report. Cannot be {@code null}.
   * @param <T> The value type of the operation that failed.
   * @return The shared failure result for the error.
   */
  @SuppressWarnings("unchecked")
  public static <T> Result<T> failure(PoolError error) {
    Objects.requireNonNull(error, "The PoolError cannot be null.");
    return (Result<T>) FAILURES[error.ordinal()];
  }

  /**
   * @return {@code true} if the operation succeeded.
   */
  public final boolean isSuccess() {
    return error == null;
  }

  /**
   * @return {@code true} if the operation failed.
   */
  public final boolean isFailure() {
    return error != null;
  }

  /**
   * Get the error of a failed result.
   * @return The error, or {@code null} if the operation succeeded.
   */
  public final PoolError error() {
    return error;
  }

  /**
   * Get the value of a successful result.
   * <p>
   * Operations that produce no value return {@code null} on success.
   *
   * @return The element produced by the operation.
   * @throws PoolException if this result is a failure.
   */
  public T value() {
    if (error != null) {
      throw new PoolException(error);
    }
    return null;
  }

  /**
   * Get the slot index that a successful result refers to. This is how
   * {@link SlotPool#useNext()} reports the index of the slot it found.
   *
   * @return The slot index, or -1 if the result does not refer to a slot.
   */
  public int index() {
    return -1;
  }

  /**
   * Get the value of this result, or the given fallback if this result is a failure.
   * @param other The value to return on failure.
   * @return The value of a successful result, otherwise {@code other}.
   */
  public final T orElse(T other) {
    return error == null ? value() : other;
  }

  @Override
  public String toString() {
    if (error != null) {
      return "Result[" + error + "]";
    }
    return "Result[OK]";
  }
}
