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

package io.shmsync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shmsync.exceptions.InvalidHandleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

final class RegionDescriptorTest {

  @DisplayName("of(capacity) describes 32-bit slots starting at byte 0")
  @Test
  void defaults() {
    RegionDescriptor descriptor = RegionDescriptor.of(16);

    assertThat(descriptor.capacity()).isEqualTo(16);
    assertThat(descriptor.slotWidth()).isEqualTo(4);
    assertThat(descriptor.baseOffset()).isZero();
    assertThat(descriptor.endOffset()).isEqualTo(64);
  }

  @DisplayName("malformed fields are rejected with InvalidHandleException")
  @Test
  void rejectsMalformedFields() {
    assertThatThrownBy(() -> RegionDescriptor.of(0, 4, 0))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining("capacity");
    assertThatThrownBy(() -> RegionDescriptor.of(8, 8, 0))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining("slot width");
    assertThatThrownBy(() -> RegionDescriptor.of(8, 4, 6))
        .isInstanceOf(InvalidHandleException.class)
        .hasMessageContaining("base offset");
    assertThatThrownBy(() -> RegionDescriptor.of(8, 4, -4))
        .isInstanceOf(InvalidHandleException.class);
    assertThatThrownBy(() -> RegionDescriptor.of(Integer.MAX_VALUE, 4, 0))
        .isInstanceOf(InvalidHandleException.class);
  }

  @DisplayName("validateAgainst rejects descriptors that do not fit the memory block")
  @Test
  void validateAgainstMemorySize() {
    RegionDescriptor descriptor = RegionDescriptor.of(4, 4, 64);

    assertThat(descriptor.validateAgainst(80)).isSameAs(descriptor);
    assertThatThrownBy(() -> descriptor.validateAgainst(79))
        .isInstanceOf(InvalidHandleException.class);
  }

  @Test
  void equalsAndHashCode() {
    assertThat(RegionDescriptor.of(4, 4, 8))
        .isEqualTo(RegionDescriptor.of(4, 4, 8))
        .hasSameHashCodeAs(RegionDescriptor.of(4, 4, 8))
        .isNotEqualTo(RegionDescriptor.of(4, 4, 12));
  }
}
