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

import java.io.Serial;

/**
 * The PoolException may be thrown by a pool implementation in a number of
 * circumstances:
 *
 * * If an {@link Allocator} fails to construct, or a {@link Reallocator} fails
 *   to reset, an element. The exception from the allocator is then the cause.
 * * If an allocator returns {@code null}.
 * * If {@link Result#value()} is called on a failed {@link Result}. The
 *   {@link PoolError} is then available from {@link #getError()}.
 *
 * @author Chris Vest
 */
public class PoolException extends RuntimeException {
  @Serial
  private static final long serialVersionUID = -1908093409167496640L;

  private final PoolError error;

  /**
   * Construct a new PoolException with the given message.
   * @param message A description of the exception to be returned from
   * {@link #getMessage()}.
   * @see RuntimeException#RuntimeException(String)
   */
  public PoolException(String message) {
    super(message);
    error = null;
  }

  /**
   * Construct a new PoolException with the given message and cause.
   * @param message A description for the exception to be returned form
   * {@link #getMessage()}.
   * @param cause The underlying cause of this exception, as to be shown in the
   * stack trace, and available through {@link #getCause()}.
   * @see RuntimeException#RuntimeException(String, Throwable)
   */
  public PoolException(String message, Throwable cause) {
    super(message, cause);
    error = null;
  }

  /**
   * Construct a new PoolException that represents the given pool error.
   * The message is the {@linkplain PoolError#description() description} of the error.
   * @param error The pool error being raised. Cannot be {@code null}.
   */
  public PoolException(PoolError error) {
    super(error.description());
    this.error = error;
  }

  /**
   * Get the {@link PoolError} this exception was raised for, if any.
   * @return The pool error, or {@code null} if this exception was caused by something else.
   */
  public PoolError getError() {
    return error;
  }
}
