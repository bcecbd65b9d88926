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

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

final class NumberUtilsTest {

  @DisplayName("returns int value with postitive int")
  @Test
  void requireNonNegativeInt() {
    assertThat(NumberUtils.requireNonNegative(Integer.MAX_VALUE, "test-message"))
        .isEqualTo(Integer.MAX_VALUE);
  }

  @DisplayName(
      "requireNonNegative with int argument throws IllegalArgumentException with negative value")
  @Test
  void requireNonNegativeIntNegative() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NumberUtils.requireNonNegative(Integer.MIN_VALUE, "test-message"))
        .withMessage("test-message");
  }

  @DisplayName("requireNonNegative with int argument throws NullPointerException with null message")
  @Test
  void requireNonNegativeIntNullMessage() {
    assertThatNullPointerException()
        .isThrownBy(() -> NumberUtils.requireNonNegative(Integer.MIN_VALUE, null))
        .withMessage("message must not be null");
  }

  @DisplayName("requireNonNegative returns int value with zero")
  @Test
  void requireNonNegativeIntZero() {
    assertThat(NumberUtils.requireNonNegative(0, "test-message")).isEqualTo(0);
  }

  @DisplayName("requirePositive returns int value with positive int")
  @Test
  void requirePositiveInt() {
    assertThat(NumberUtils.requirePositive(Integer.MAX_VALUE, "test-message"))
        .isEqualTo(Integer.MAX_VALUE);
  }

  @DisplayName("requirePositive with int argument throws IllegalArgumentException with zero value")
  @Test
  void requirePositiveIntZero() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NumberUtils.requirePositive(0, "test-message"))
        .withMessage("test-message");
  }

  @DisplayName("requireAtLeast accepts the minimum and rejects anything below")
  @Test
  void requireAtLeast() {
    assertThat(NumberUtils.requireAtLeast(2, 2, "test-message")).isEqualTo(2);
    assertThatIllegalArgumentException()
        .isThrownBy(() -> NumberUtils.requireAtLeast(1, 2, "test-message"))
        .withMessage("test-message");
  }

  @DisplayName("requireSlotRange accepts ranges ending at capacity")
  @Test
  void requireSlotRangeUpToCapacity() {
    assertThat(NumberUtils.requireSlotRange(2, 6, 8)).isEqualTo(2);
    assertThat(NumberUtils.requireSlotRange(0, 0, 0)).isEqualTo(0);
  }

  @DisplayName("requireSlotRange throws IndexOutOfBoundsException past capacity or on overflow")
  @Test
  void requireSlotRangeOutOfBounds() {
    assertThatThrownBy(() -> NumberUtils.requireSlotRange(3, 6, 8))
        .isInstanceOf(IndexOutOfBoundsException.class)
        .hasMessage("slot range [3, 9) is out of bounds for capacity 8");
    assertThatThrownBy(() -> NumberUtils.requireSlotRange(-1, 1, 8))
        .isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> NumberUtils.requireSlotRange(Integer.MAX_VALUE, 2, 8))
        .isInstanceOf(IndexOutOfBoundsException.class);
  }

  @DisplayName("toNonNegativeNanos clamps negative timeouts to zero")
  @Test
  void toNonNegativeNanos() {
    assertThat(NumberUtils.toNonNegativeNanos(3, TimeUnit.MILLISECONDS)).isEqualTo(3_000_000L);
    assertThat(NumberUtils.toNonNegativeNanos(-1, TimeUnit.SECONDS)).isZero();
    assertThat(NumberUtils.toNonNegativeNanos(Long.MAX_VALUE, TimeUnit.DAYS))
        .isEqualTo(Long.MAX_VALUE);
  }

  @DisplayName("toNanos saturates durations that do not fit in a long")
  @Test
  void toNanosSaturates() {
    assertThat(NumberUtils.toNanos(Duration.ofMillis(3))).isEqualTo(3_000_000L);
    assertThat(NumberUtils.toNanos(Duration.ofMillis(-3))).isZero();
    assertThat(NumberUtils.toNanos(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
    assertThat(NumberUtils.toNanos(Duration.ofSeconds(Long.MIN_VALUE))).isZero();
  }

  @DisplayName("toNanos throws NullPointerException with null timeout")
  @Test
  void toNanosNull() {
    assertThatNullPointerException()
        .isThrownBy(() -> NumberUtils.toNanos(null))
        .withMessage("timeout must not be null");
  }
}
