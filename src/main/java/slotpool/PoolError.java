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
 * The recoverable conditions that a {@link SlotPool} operation can report
 * through its {@link Result}.
 * <p>
 * None of these are fatal. They are returned inline, and the pool is left
 * exactly as it was before the failing call.
 */
public enum PoolError {
  /**
   * The index is negative, or not less than the {@linkplain PoolView#size() size} of the pool.
   */
  OUT_OF_RANGE("Index out of range"),
  /**
   * An attempt was made to activate a slot that is already active.
   */
  ALREADY_IN_USE("Slot already in use"),
  /**
   * Checked access was attempted on a slot that is not active.
   */
  NOT_IN_USE("Slot is not in use"),
  /**
   * An attempt was made to deactivate a slot that is already free.
   */
  ALREADY_UNUSED("Slot already unused"),
  /**
   * A search for a free slot went all the way around the pool without finding one.
   */
  FULL("Pool is full");

  private final String description;

  PoolError(String description) {
    this.description = description;
  }

  /**
   * Get a short human-readable description of this error, suitable for log messages.
   * @return The description, never {@code null}.
   */
  public String description() {
    return description;
  }
}
