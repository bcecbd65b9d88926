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

package io.shmsync.ring;

import io.shmsync.AtomicView;
import io.shmsync.SharedRegion;
import io.shmsync.exceptions.InvariantViolationException;
import io.shmsync.util.NumberUtils;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Bounded single-producer/single-consumer queue of {@code int}s over slots of a region: a head
 * index written only by the consumer, a tail index written only by the producer and {@code
 * dataSlots} data slots.
 *
 * <p>One data slot always stays unused so that {@code head == tail} means empty and {@code tail +
 * 1 == head} (modulo {@code dataSlots}) means full; the ring therefore holds at most {@link
 * #capacity()} {@code = dataSlots - 1} elements. The producer stores the element before it
 * publishes the new tail, so a consumer that sees the tail move always reads a written slot.
 *
 * <p>Neither operation blocks. Calling {@link #push(int)} from two threads at once, or {@link
 * #pop()} from two threads at once, is outside the contract of this class.
 */
public final class RingBuffer {

  /** Smallest number of data slots. */
  public static final int MIN_DATA_SLOTS = 2;

  final AtomicView head;

  final AtomicView tail;

  private final AtomicView[] data;

  private final int dataSlots;

  /**
   * Lays the ring out contiguously: head at {@code firstSlot}, tail right after it, data slots
   * after the tail.
   *
   * @see #requiredSlots(int)
   */
  public RingBuffer(SharedRegion region, int firstSlot, int dataSlots) {
    this(region, firstSlot, firstSlot + 1, firstSlot + 2, dataSlots);
  }

  /**
   * @throws IllegalArgumentException if {@code dataSlots < 2} or the index slots overlap the data
   * @throws IndexOutOfBoundsException if any slot is outside of the region
   * @throws InvariantViolationException if the index slots already hold indices out of range
   */
  public RingBuffer(
      SharedRegion region, int headSlot, int tailSlot, int firstDataSlot, int dataSlots) {
    Objects.requireNonNull(region, "region must not be null");
    this.dataSlots =
        NumberUtils.requireAtLeast(
            dataSlots, MIN_DATA_SLOTS, "dataSlots must be at least " + MIN_DATA_SLOTS);
    NumberUtils.requireSlotRange(firstDataSlot, dataSlots, region.capacity());
    if (headSlot == tailSlot
        || inData(headSlot, firstDataSlot)
        || inData(tailSlot, firstDataSlot)) {
      throw new IllegalArgumentException(
          String.format(
              "head %d and tail %d must be distinct slots outside of data [%d, %d)",
              headSlot, tailSlot, firstDataSlot, firstDataSlot + dataSlots));
    }

    this.head = region.view(headSlot);
    this.tail = region.view(tailSlot);
    this.data = new AtomicView[dataSlots];
    for (int i = 0; i < dataSlots; i++) {
      data[i] = region.view(firstDataSlot + i);
    }

    checkIndex(head.load(), "head");
    checkIndex(tail.load(), "tail");
  }

  /** Slots needed by a contiguous ring with {@code dataSlots} data slots. */
  public static int requiredSlots(int dataSlots) {
    NumberUtils.requireAtLeast(
        dataSlots, MIN_DATA_SLOTS, "dataSlots must be at least " + MIN_DATA_SLOTS);
    return dataSlots + 2;
  }

  /** Data slots needed to hold {@code elements} elements at once. */
  public static int dataSlotsFor(int elements) {
    NumberUtils.requirePositive(elements, "elements must be positive");
    return elements + 1;
  }

  /**
   * Appends a value. Producer side only.
   *
   * @return {@link RingStatus#OK}, or {@link RingStatus#FULL} without touching the ring
   */
  public RingStatus push(int value) {
    final int t = checkIndex(tail.load(), "tail");
    final int next = next(t);
    final int h = checkIndex(head.load(), "head");
    if (next == h) {
      return RingStatus.FULL;
    }

    data[t].store(value);
    tail.store(next);
    return RingStatus.OK;
  }

  /**
   * Removes the oldest value. Consumer side only.
   *
   * @return the value, or {@link RingStatus#EMPTY} without touching the ring
   */
  public PopResult pop() {
    final int h = checkIndex(head.load(), "head");
    final int t = checkIndex(tail.load(), "tail");
    if (h == t) {
      return PopResult.EMPTY;
    }

    final int value = data[h].load();
    head.store(next(h));
    return PopResult.ok(value);
  }

  /**
   * Pops up to {@code limit} values into {@code consumer}. Consumer side only.
   *
   * @return the number of values popped
   */
  public int drain(IntConsumer consumer, int limit) {
    Objects.requireNonNull(consumer, "consumer must not be null");
    int drained = 0;
    while (drained < limit) {
      PopResult result = pop();
      if (!result.isOk()) {
        break;
      }
      consumer.accept(result.value());
      drained++;
    }
    return drained;
  }

  /** Number of elements at the time of the call; may be stale by the time it returns. */
  public int size() {
    final int h = checkIndex(head.load(), "head");
    final int t = checkIndex(tail.load(), "tail");
    return (t - h + dataSlots) % dataSlots;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /** Maximum number of elements the ring holds. */
  public int capacity() {
    return dataSlots - 1;
  }

  public int dataSlots() {
    return dataSlots;
  }

  private int next(int index) {
    return index + 1 == dataSlots ? 0 : index + 1;
  }

  private int checkIndex(int index, String name) {
    if (index < 0 || index >= dataSlots) {
      throw new InvariantViolationException(
          name + " index " + index + " is outside of [0, " + dataSlots + ")");
    }
    return index;
  }

  private boolean inData(int slot, int firstDataSlot) {
    return slot >= firstDataSlot && slot < firstDataSlot + dataSlots;
  }

  @Override
  public String toString() {
    if (head.region().isClosed()) {
      return "RingBuffer{dataSlots=" + dataSlots + ", closed}";
    }
    return "RingBuffer"
        + "{head="
        + head.load()
        + ", tail="
        + tail.load()
        + ", dataSlots="
        + dataSlots
        + '}';
  }
}
