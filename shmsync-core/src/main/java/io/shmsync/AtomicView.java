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
import io.shmsync.internal.SlotWaiters;
import io.shmsync.util.NumberUtils;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import org.agrona.concurrent.AtomicBuffer;

/**
 * Atomic accessor for a single slot of a {@link SharedRegion}. Every operation is sequentially
 * consistent with respect to all other operations on the same slot.
 *
 * <p>{@link #await(int, long, TimeUnit)} and {@link #signal(int)} form a futex-like pair: a waiter
 * blocks only while the slot still holds the value it expects, and a writer that changed the slot
 * wakes waiters explicitly. Callers must re-read the slot after any return from {@code await}.
 *
 * <p>A view does not own a reference to the memory: it is usable while its region is open, and
 * every operation on a view of a closed region throws {@link InvalidHandleException}.
 */
public final class AtomicView {

  private final SharedRegion region;

  private final int slot;

  private final int offset;

  private final AtomicBuffer buffer;

  private final SlotWaiters waiters;

  private final boolean interprocess;

  /**
   * @param region region owning the slot
   * @param slot index of the slot in the region
   * @throws IndexOutOfBoundsException if {@code slot} is not in {@code [0, region.capacity())}
   * @throws InvalidHandleException if {@code region} is closed
   */
  public AtomicView(SharedRegion region, int slot) {
    this.region = Objects.requireNonNull(region, "region must not be null");
    region.ensureOpen();
    this.offset = region.offset(slot);
    this.slot = slot;
    SharedMemory memory = region.memory();
    this.buffer = memory.buffer();
    this.waiters = memory.waiters();
    this.interprocess = memory.isInterprocess();
  }

  public int load() {
    region.ensureOpen();
    return buffer.getIntVolatile(offset);
  }

  public void store(int value) {
    region.ensureOpen();
    buffer.putIntVolatile(offset, value);
  }

  /** @return the value before the addition */
  public int add(int delta) {
    region.ensureOpen();
    return buffer.getAndAddInt(offset, delta);
  }

  /** @return the value before the subtraction */
  public int sub(int delta) {
    region.ensureOpen();
    return buffer.getAndAddInt(offset, -delta);
  }

  /** @return the value before the update */
  public int and(int mask) {
    region.ensureOpen();
    int current;
    do {
      current = buffer.getIntVolatile(offset);
    } while (!buffer.compareAndSetInt(offset, current, current & mask));
    return current;
  }

  /** @return the value before the update */
  public int or(int mask) {
    region.ensureOpen();
    int current;
    do {
      current = buffer.getIntVolatile(offset);
    } while (!buffer.compareAndSetInt(offset, current, current | mask));
    return current;
  }

  /** @return the value before the update */
  public int xor(int mask) {
    region.ensureOpen();
    int current;
    do {
      current = buffer.getIntVolatile(offset);
    } while (!buffer.compareAndSetInt(offset, current, current ^ mask));
    return current;
  }

  /** @return the value before the swap */
  public int exchange(int value) {
    region.ensureOpen();
    return buffer.getAndSetInt(offset, value);
  }

  /**
   * Replaces the slot value with {@code update} if it equals {@code expected}.
   *
   * @return the value observed by the attempt, equal to {@code expected} exactly when the swap
   *     happened
   */
  public int compareExchange(int expected, int update) {
    region.ensureOpen();
    for (; ; ) {
      int current = buffer.getIntVolatile(offset);
      if (current != expected) {
        return current;
      }
      if (buffer.compareAndSetInt(offset, expected, update)) {
        return expected;
      }
    }
  }

  /**
   * Blocks while the slot holds {@code expected}, until signalled or until {@code timeout}
   * elapses.
   *
   * <p>On memory shared with other processes the slot is also re-read every {@code
   * shmsync.wait.pollIntervalNs}; an observed change returns {@link WaitResult#OK} as a signal
   * would.
   *
   * @return {@link WaitResult#NOT_EQUAL} without blocking if the slot differs from {@code
   *     expected}, {@link WaitResult#OK} once woken, {@link WaitResult#TIMED_OUT} otherwise
   * <p>The memory stays allocated for the duration of the wait. Closing the region while a thread
   * waits makes that wait throw {@link InvalidHandleException}, unless it was signalled first.
   *
   * @throws InterruptedException if the thread is interrupted before being signalled
   */
  public WaitResult await(int expected, long timeout, TimeUnit unit) throws InterruptedException {
    final long timeoutNs = NumberUtils.toNonNegativeNanos(timeout, unit);
    if (Thread.interrupted()) {
      throw new InterruptedException();
    }

    final SharedMemory memory = region.retainMemory();
    try {
      return awaitRetained(expected, timeoutNs);
    } finally {
      memory.release();
    }
  }

  private WaitResult awaitRetained(int expected, long timeoutNs) throws InterruptedException {
    final SlotWaiters.Waiter waiter = waiters.enqueue(offset);
    if (buffer.getIntVolatile(offset) != expected) {
      waiter.cancel();
      waiters.remove(offset, waiter);
      return WaitResult.NOT_EQUAL;
    }

    final long start = System.nanoTime();
    long remainingNs = timeoutNs;
    for (; ; ) {
      if (waiter.isNotified()) {
        return WaitResult.OK;
      }

      if (region.isClosed()) {
        if (waiter.cancel()) {
          waiters.remove(offset, waiter);
          throw new InvalidHandleException("region was closed while waiting on slot " + slot);
        }
        return WaitResult.OK;
      }

      if (remainingNs <= 0) {
        if (waiter.cancel()) {
          waiters.remove(offset, waiter);
          return WaitResult.TIMED_OUT;
        }
        return WaitResult.OK;
      }

      LockSupport.parkNanos(
          this,
          interprocess ? Math.min(remainingNs, Constants.WAIT_POLL_INTERVAL_NS) : remainingNs);

      if (Thread.interrupted()) {
        if (waiter.cancel()) {
          waiters.remove(offset, waiter);
          throw new InterruptedException();
        }
        // the signal already counted this thread, keep it and let the caller see the interrupt
        Thread.currentThread().interrupt();
        return WaitResult.OK;
      }

      if (interprocess && buffer.getIntVolatile(offset) != expected) {
        if (waiter.cancel()) {
          waiters.remove(offset, waiter);
        }
        return WaitResult.OK;
      }

      remainingNs = timeoutNs - (System.nanoTime() - start);
    }
  }

  /** @see #await(int, long, TimeUnit) */
  public WaitResult await(int expected, Duration timeout) throws InterruptedException {
    return await(expected, NumberUtils.toNanos(timeout), TimeUnit.NANOSECONDS);
  }

  /** Blocks while the slot holds {@code expected}, without timeout. */
  public WaitResult await(int expected) throws InterruptedException {
    return await(expected, Long.MAX_VALUE, TimeUnit.NANOSECONDS);
  }

  /**
   * Wakes up to {@code count} threads of this JVM blocked in {@code await} on this slot.
   *
   * @return the number of threads woken, 0 if none was waiting
   */
  public int signal(int count) {
    NumberUtils.requireNonNegative(count, "count must not be negative");
    region.ensureOpen();
    return waiters.wake(offset, count);
  }

  /** Wakes every thread of this JVM blocked on this slot. */
  public int signalAll() {
    region.ensureOpen();
    return waiters.wake(offset, Integer.MAX_VALUE);
  }

  /** Number of threads of this JVM currently blocked on this slot. */
  public int waiting() {
    return waiters.waiting(offset);
  }

  public int slot() {
    return slot;
  }

  public SharedRegion region() {
    return region;
  }

  @Override
  public String toString() {
    if (region.isClosed()) {
      return "AtomicView{slot=" + slot + ", closed}";
    }
    return "AtomicView{slot=" + slot + ", value=" + buffer.getIntVolatile(offset) + '}';
  }
}
