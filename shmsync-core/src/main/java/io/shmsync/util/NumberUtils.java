/*
 * Copyright 2015-present the original author or authors.
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

package io.shmsync.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public final class NumberUtils {

  private NumberUtils() {}

  /**
   * Requires that an {@code int} is greater than or equal to zero.
   *
   * @param i the {@code int} to test
   * @param message detail message to be used in the event that a {@link IllegalArgumentException}
   *     is thrown
   * @return the {@code int} if greater than or equal to zero
   * @throws IllegalArgumentException if {@code i} is less than zero
   */
  public static int requireNonNegative(int i, String message) {
    Objects.requireNonNull(message, "message must not be null");

    if (i < 0) {
      throw new IllegalArgumentException(message);
    }

    return i;
  }

  /**
   * Requires that an {@code int} is greater than zero.
   *
   * @param i the {@code int} to test
   * @param message detail message to be used in the event that a {@link IllegalArgumentException}
   *     is thrown
   * @return the {@code int} if greater than zero
   * @throws IllegalArgumentException if {@code i} is less than or equal to zero
   */
  public static int requirePositive(int i, String message) {
    Objects.requireNonNull(message, "message must not be null");

    if (i <= 0) {
      throw new IllegalArgumentException(message);
    }

    return i;
  }

  /**
   * Requires that an {@code int} is at least {@code min}.
   *
   * @param i the {@code int} to test
   * @param min the smallest accepted value
   * @param message detail message to be used in the event that a {@link IllegalArgumentException}
   *     is thrown
   * @return the {@code int} if greater than or equal to {@code min}
   * @throws IllegalArgumentException if {@code i} is less than {@code min}
   */
  public static int requireAtLeast(int i, int min, String message) {
    Objects.requireNonNull(message, "message must not be null");

    if (i < min) {
      throw new IllegalArgumentException(message);
    }

    return i;
  }

  /**
   * Requires that the slot range {@code [first, first + count)} lies within {@code [0,
   * capacity)}.
   *
   * @param first index of the first slot of the range
   * @param count number of slots in the range
   * @param capacity number of slots available
   * @return {@code first}
   * @throws IndexOutOfBoundsException if the range does not fit
   */
  public static int requireSlotRange(int first, int count, int capacity) {
    if (first < 0 || count < 0 || (long) first + count > capacity) {
      throw new IndexOutOfBoundsException(
          String.format(
              "slot range [%d, %d) is out of bounds for capacity %d",
              first, (long) first + count, capacity));
    }

    return first;
  }

  /**
   * Converts a timeout to nanoseconds, clamping negative values to zero.
   *
   * @param timeout the timeout amount
   * @param unit the unit of {@code timeout}
   * @return the timeout in nanoseconds, never negative
   */
  public static long toNonNegativeNanos(long timeout, TimeUnit unit) {
    Objects.requireNonNull(unit, "unit must not be null");
    return Math.max(0L, unit.toNanos(timeout));
  }

  /**
   * Converts a timeout to nanoseconds, clamping negative values to zero and durations too long for
   * a {@code long} to {@link Long#MAX_VALUE}.
   *
   * @param timeout the timeout
   * @return the timeout in nanoseconds, never negative
   * @throws NullPointerException if {@code timeout} is {@code null}
   */
  public static long toNanos(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    try {
      return Math.max(0L, timeout.toNanos());
    } catch (ArithmeticException e) {
      return timeout.isNegative() ? 0L : Long.MAX_VALUE;
    }
  }
}
