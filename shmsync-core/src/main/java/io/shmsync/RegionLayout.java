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

import io.shmsync.internal.Constants;
import io.shmsync.util.NumberUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns named, non-overlapping slot ranges of a region. Each primitive must own its range
 * exclusively; building the layout from the same sequence of reservations on every side of a
 * handle transfer yields the same slot indices everywhere.
 *
 * <pre>{@code
 * RegionLayout layout =
 *     RegionLayout.builder()
 *         .cacheLinePadded(true)
 *         .reserve("lock", SpinLock.SLOTS)
 *         .reserve("queue", RingBuffer.requiredSlots(64))
 *         .build();
 * SharedRegion region = SharedRegion.allocate(layout.requiredCapacity());
 * SpinLock lock = new SpinLock(region, layout.firstSlot("lock"));
 * }</pre>
 */
public final class RegionLayout {

  private final Map<String, int[]> ranges;

  private final int requiredCapacity;

  private RegionLayout(Map<String, int[]> ranges, int requiredCapacity) {
    this.ranges = ranges;
    this.requiredCapacity = requiredCapacity;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** First slot of the range reserved under {@code name}. */
  public int firstSlot(String name) {
    return range(name)[0];
  }

  /** Number of slots reserved under {@code name}. */
  public int slots(String name) {
    return range(name)[1];
  }

  /** Smallest region capacity that holds every reserved range. */
  public int requiredCapacity() {
    return requiredCapacity;
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(ranges.keySet());
  }

  private int[] range(String name) {
    Objects.requireNonNull(name, "name must not be null");
    int[] range = ranges.get(name);
    if (range == null) {
      throw new IllegalArgumentException("no slots reserved under '" + name + "'");
    }
    return range;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RegionLayout{");
    ranges.forEach(
        (name, range) ->
            sb.append(name)
                .append("=[")
                .append(range[0])
                .append(", ")
                .append(range[0] + range[1])
                .append("), "));
    return sb.append("capacity=").append(requiredCapacity).append('}').toString();
  }

  public static final class Builder {

    private final Map<String, int[]> ranges = new LinkedHashMap<>();

    private boolean padded;

    private int next;

    private Builder() {}

    /**
     * Starts every subsequent range on its own cache line and keeps the next range off its last
     * line, so primitives written by different threads do not share lines.
     */
    public Builder cacheLinePadded(boolean padded) {
      this.padded = padded;
      return this;
    }

    public Builder reserve(String name, int slots) {
      Objects.requireNonNull(name, "name must not be null");
      NumberUtils.requirePositive(slots, "slots must be positive");
      if (ranges.containsKey(name)) {
        throw new IllegalArgumentException("slots already reserved under '" + name + "'");
      }

      int first = padded ? alignUp(next) : next;
      long end = (long) first + slots;
      if (end > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("layout exceeds " + Integer.MAX_VALUE + " slots");
      }
      ranges.put(name, new int[] {first, slots});
      next = (int) end;
      return this;
    }

    public RegionLayout build() {
      int capacity = padded ? alignUp(next) : next;
      NumberUtils.requirePositive(capacity, "layout must reserve at least one slot");
      return new RegionLayout(new LinkedHashMap<>(ranges), capacity);
    }

    private static int alignUp(int slot) {
      int line = Constants.CACHE_LINE_SLOTS;
      int mod = slot % line;
      return mod == 0 ? slot : slot + line - mod;
    }
  }
}
