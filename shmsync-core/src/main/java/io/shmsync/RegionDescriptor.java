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

import io.shmsync.exceptions.InvalidHandleException;
import io.shmsync.internal.Constants;

/**
 * The transferable description of a {@link SharedRegion}: how many slots it has, how wide each
 * slot is and where slot 0 starts, in bytes, inside the backing {@link SharedMemory}. Given the
 * same backing memory, a descriptor is enough to rebuild an equivalent region.
 */
public final class RegionDescriptor {

  private final int capacity;

  private final int slotWidth;

  private final int baseOffset;

  private RegionDescriptor(int capacity, int slotWidth, int baseOffset) {
    this.capacity = capacity;
    this.slotWidth = slotWidth;
    this.baseOffset = baseOffset;
  }

  /**
   * Creates a descriptor.
   *
   * @throws InvalidHandleException if the fields are malformed
   */
  public static RegionDescriptor of(int capacity, int slotWidth, int baseOffset) {
    if (capacity <= 0) {
      throw new InvalidHandleException("capacity must be positive: " + capacity);
    }
    if (slotWidth != Constants.SLOT_WIDTH) {
      throw new InvalidHandleException(
          "unsupported slot width " + slotWidth + ", expected " + Constants.SLOT_WIDTH);
    }
    if (baseOffset < 0 || baseOffset % slotWidth != 0) {
      throw new InvalidHandleException(
          "base offset " + baseOffset + " is not a non-negative multiple of " + slotWidth);
    }
    if ((long) baseOffset + (long) capacity * slotWidth > Integer.MAX_VALUE) {
      throw new InvalidHandleException("region exceeds addressable memory: " + capacity + " slots");
    }
    return new RegionDescriptor(capacity, slotWidth, baseOffset);
  }

  /** A descriptor of {@code capacity} 32-bit slots starting at byte 0. */
  public static RegionDescriptor of(int capacity) {
    return of(capacity, Constants.SLOT_WIDTH, 0);
  }

  public int capacity() {
    return capacity;
  }

  public int slotWidth() {
    return slotWidth;
  }

  public int baseOffset() {
    return baseOffset;
  }

  /** Byte offset just past the last slot. */
  public int endOffset() {
    return baseOffset + capacity * slotWidth;
  }

  /**
   * Checks that this descriptor fits inside a memory block of {@code memoryBytes}.
   *
   * @throws InvalidHandleException if it does not
   */
  public RegionDescriptor validateAgainst(int memoryBytes) {
    if (endOffset() > memoryBytes) {
      throw new InvalidHandleException(
          this + " does not fit in a shared memory block of " + memoryBytes + " bytes");
    }
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RegionDescriptor that = (RegionDescriptor) o;
    return capacity == that.capacity
        && slotWidth == that.slotWidth
        && baseOffset == that.baseOffset;
  }

  @Override
  public int hashCode() {
    int result = capacity;
    result = 31 * result + slotWidth;
    result = 31 * result + baseOffset;
    return result;
  }

  @Override
  public String toString() {
    return "RegionDescriptor{"
        + "capacity="
        + capacity
        + ", slotWidth="
        + slotWidth
        + ", baseOffset="
        + baseOffset
        + '}';
  }
}
