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

package io.shmsync.internal;

import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.locks.LockSupport;

/**
 * Parking lots for threads blocked on slots of one shared memory block, keyed by byte offset.
 *
 * <p>A waiter is enqueued <em>before</em> it re-reads its slot. A signaller mutates the slot first
 * and then dequeues waiters under the same queue monitor, so a waiter that read the old value is
 * always found by the signal that follows the write.
 *
 * <p>A queue exists only while it has waiters: every change to a queue happens inside {@link
 * ConcurrentMap#compute} for its offset, and a queue that becomes empty is removed there.
 */
public final class SlotWaiters {

  private final ConcurrentMap<Integer, WaitQueue> queues = new ConcurrentHashMap<>();

  /** Registers the calling thread as a waiter on {@code offset}. */
  public Waiter enqueue(int offset) {
    Waiter waiter = new Waiter(Thread.currentThread());
    queues.compute(
        offset,
        (__, queue) -> {
          WaitQueue q = queue == null ? new WaitQueue() : queue;
          q.add(waiter);
          return q;
        });
    return waiter;
  }

  /** Removes a waiter that gave up (timeout, value mismatch or interrupt). */
  public void remove(int offset, Waiter waiter) {
    queues.computeIfPresent(
        offset,
        (__, queue) -> {
          queue.remove(waiter);
          return queue.isEmpty() ? null : queue;
        });
  }

  /**
   * Wakes up to {@code count} waiters on {@code offset}, oldest first.
   *
   * @return the number of threads actually woken
   */
  public int wake(int offset, int count) {
    if (count <= 0) {
      return 0;
    }
    int[] woken = new int[1];
    queues.computeIfPresent(
        offset,
        (__, queue) -> {
          woken[0] = queue.wake(count);
          return queue.isEmpty() ? null : queue;
        });
    return woken[0];
  }

  /**
   * Unparks every waiting thread without signalling it, so that each one re-checks why it waits.
   */
  public void unparkAll() {
    for (WaitQueue queue : queues.values()) {
      queue.unparkAll();
    }
  }

  /** Number of offsets that currently have waiters. */
  int activeOffsets() {
    return queues.size();
  }

  /** Number of threads currently parked on {@code offset}. */
  public int waiting(int offset) {
    WaitQueue queue = queues.get(offset);
    return queue == null ? 0 : queue.size();
  }

  static final class WaitQueue {

    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();

    synchronized void add(Waiter waiter) {
      waiters.addLast(waiter);
    }

    synchronized void remove(Waiter waiter) {
      waiters.remove(waiter);
    }

    synchronized int size() {
      return waiters.size();
    }

    synchronized boolean isEmpty() {
      return waiters.isEmpty();
    }

    synchronized void unparkAll() {
      for (Waiter waiter : waiters) {
        LockSupport.unpark(waiter.thread);
      }
    }

    synchronized int wake(int count) {
      int woken = 0;
      Waiter waiter;
      while (woken < count && (waiter = waiters.pollFirst()) != null) {
        if (waiter.notifyWaiter()) {
          woken++;
        }
      }
      return woken;
    }
  }

  public static final class Waiter {

    static final int WAITING = 0;
    static final int NOTIFIED = 1;
    static final int CANCELLED = 2;

    final Thread thread;

    volatile int state;
    static final AtomicIntegerFieldUpdater<Waiter> STATE =
        AtomicIntegerFieldUpdater.newUpdater(Waiter.class, "state");

    Waiter(Thread thread) {
      this.thread = thread;
    }

    public boolean isNotified() {
      return state == NOTIFIED;
    }

    /**
     * Withdraws this waiter.
     *
     * @return {@code false} if a signal won the race and already claimed this waiter
     */
    public boolean cancel() {
      return STATE.compareAndSet(this, WAITING, CANCELLED);
    }

    boolean notifyWaiter() {
      if (STATE.compareAndSet(this, WAITING, NOTIFIED)) {
        LockSupport.unpark(thread);
        return true;
      }
      return false;
    }
  }
}
