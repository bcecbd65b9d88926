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

package io.shmsync.sync;

import io.shmsync.AtomicView;
import io.shmsync.SharedRegion;
import io.shmsync.internal.Constants;
import io.shmsync.util.NumberUtils;
import java.util.concurrent.TimeUnit;
import org.agrona.concurrent.IdleStrategy;

/**
 * Mutual exclusion over one slot: {@code 0} when unlocked, {@code 1} when held.
 *
 * <p>The lock does not record its owner, so {@link #unlock()} from a thread that does not hold it
 * silently releases somebody else's lock. Contended acquisitions back off with the idle strategy
 * selected by {@code shmsync.spinlock.idleStrategy}. The default spins for {@code
 * shmsync.spinlock.maxSpins} attempts and then yields between attempts; it never parks the thread.
 * The {@code parking} and {@code sleeping} strategies do park. Only suitable for very short
 * critical sections.
 */
public final class SpinLock {

  /** Slots used by one lock. */
  public static final int SLOTS = 1;

  static final int UNLOCKED = 0;
  static final int LOCKED = 1;

  private final AtomicView state;

  public SpinLock(SharedRegion region, int slot) {
    this.state = region.view(slot);
  }

  public void lock() {
    if (tryLock()) {
      return;
    }

    final IdleStrategy idleStrategy = Constants.SPIN_LOCK_IDLE_STRATEGY.get();
    idleStrategy.reset();
    while (state.compareExchange(UNLOCKED, LOCKED) != UNLOCKED) {
      idleStrategy.idle();
    }
  }

  /** Attempts to take the lock exactly once. */
  public boolean tryLock() {
    return state.compareExchange(UNLOCKED, LOCKED) == UNLOCKED;
  }

  /**
   * Spins until the lock is taken or {@code timeout} elapses.
   *
   * @return whether the lock was taken
   */
  public boolean tryLock(long timeout, TimeUnit unit) {
    final long timeoutNs = NumberUtils.toNonNegativeNanos(timeout, unit);
    if (tryLock()) {
      return true;
    }

    final IdleStrategy idleStrategy = Constants.SPIN_LOCK_IDLE_STRATEGY.get();
    final long start = System.nanoTime();
    idleStrategy.reset();
    for (; ; ) {
      if (System.nanoTime() - start >= timeoutNs) {
        return false;
      }
      idleStrategy.idle();
      if (tryLock()) {
        return true;
      }
    }
  }

  public void unlock() {
    state.store(UNLOCKED);
  }

  public boolean isLocked() {
    return state.load() != UNLOCKED;
  }

  @Override
  public String toString() {
    if (state.region().isClosed()) {
      return "SpinLock{slot=" + state.slot() + ", closed}";
    }
    return "SpinLock{slot=" + state.slot() + ", locked=" + isLocked() + '}';
  }
}
