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
import io.shmsync.util.NumberUtils;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Wraps a {@link RingBuffer} so that a producer facing a full ring, or a consumer facing an empty
 * one, sleeps on the opposite index slot instead of spinning.
 *
 * <p>A successful push signals one waiter on the tail slot and a successful pop signals one waiter
 * on the head slot: with a single producer and a single consumer there is at most one waiter on
 * each. Every wake-up, genuine or spurious, only leads to another attempt on the inner ring, so
 * correctness never depends on how many threads a signal reaches.
 */
public final class BlockingRingBuffer {

  private final RingBuffer ring;

  private final AtomicView head;

  private final AtomicView tail;

  public BlockingRingBuffer(RingBuffer ring) {
    this.ring = Objects.requireNonNull(ring, "ring must not be null");
    this.head = ring.head;
    this.tail = ring.tail;
  }

  /** Builds a contiguous ring at {@code firstSlot} and wraps it. */
  public BlockingRingBuffer(SharedRegion region, int firstSlot, int dataSlots) {
    this(new RingBuffer(region, firstSlot, dataSlots));
  }

  /**
   * Appends a value, waiting up to {@code timeout} for room. Producer side only.
   *
   * @return {@link RingStatus#OK}, or {@link RingStatus#TIMED_OUT} with the ring untouched
   * @throws InterruptedException if interrupted while waiting; the value was not pushed
   */
  public RingStatus push(int value, long timeout, TimeUnit unit) throws InterruptedException {
    final long timeoutNs = NumberUtils.toNonNegativeNanos(timeout, unit);
    final long start = System.nanoTime();
    for (; ; ) {
      // read before the attempt so a pop racing with a failed push changes it and the wait below
      // returns at once
      final int observedHead = head.load();
      if (ring.push(value) == RingStatus.OK) {
        tail.signal(1);
        return RingStatus.OK;
      }

      final long remainingNs = timeoutNs - (System.nanoTime() - start);
      if (remainingNs <= 0) {
        return RingStatus.TIMED_OUT;
      }
      head.await(observedHead, remainingNs, TimeUnit.NANOSECONDS);
    }
  }

  /** @see #push(int, long, TimeUnit) */
  public RingStatus push(int value, Duration timeout) throws InterruptedException {
    return push(value, NumberUtils.toNanos(timeout), TimeUnit.NANOSECONDS);
  }

  /**
   * Removes the oldest value, waiting up to {@code timeout} for one. Consumer side only.
   *
   * @return the value, or {@link RingStatus#TIMED_OUT} with the ring untouched
   * @throws InterruptedException if interrupted while waiting; nothing was popped
   */
  public PopResult pop(long timeout, TimeUnit unit) throws InterruptedException {
    final long timeoutNs = NumberUtils.toNonNegativeNanos(timeout, unit);
    final long start = System.nanoTime();
    for (; ; ) {
      final int observedTail = tail.load();
      final PopResult result = ring.pop();
      if (result.isOk()) {
        head.signal(1);
        return result;
      }

      final long remainingNs = timeoutNs - (System.nanoTime() - start);
      if (remainingNs <= 0) {
        return PopResult.TIMED_OUT;
      }
      tail.await(observedTail, remainingNs, TimeUnit.NANOSECONDS);
    }
  }

  /** @see #pop(long, TimeUnit) */
  public PopResult pop(Duration timeout) throws InterruptedException {
    return pop(NumberUtils.toNanos(timeout), TimeUnit.NANOSECONDS);
  }

  /** Non-blocking push that still wakes a waiting consumer. */
  public RingStatus tryPush(int value) {
    RingStatus status = ring.push(value);
    if (status == RingStatus.OK) {
      tail.signal(1);
    }
    return status;
  }

  /** Non-blocking pop that still wakes a waiting producer. */
  public PopResult tryPop() {
    PopResult result = ring.pop();
    if (result.isOk()) {
      head.signal(1);
    }
    return result;
  }

  public int size() {
    return ring.size();
  }

  public int capacity() {
    return ring.capacity();
  }

  public RingBuffer ring() {
    return ring;
  }

  @Override
  public String toString() {
    return "BlockingRingBuffer{" + ring + '}';
  }
}
