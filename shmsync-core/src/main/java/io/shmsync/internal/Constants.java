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

import java.io.File;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.NoOpIdleStrategy;
import org.agrona.concurrent.SleepingIdleStrategy;
import org.agrona.concurrent.YieldingIdleStrategy;

public final class Constants {

  /** Width in bytes of every slot. */
  public static final int SLOT_WIDTH = Integer.BYTES;

  public static final int CACHE_LINE_BYTES = 64;

  public static final int CACHE_LINE_SLOTS =
      Integer.getInteger("shmsync.layout.cacheLineSlots", CACHE_LINE_BYTES / SLOT_WIDTH);

  public static final int SPIN_LOCK_MAX_SPINS = Integer.getInteger("shmsync.spinlock.maxSpins", 64);

  public static final int SPIN_LOCK_MAX_YIELDS =
      Integer.getInteger("shmsync.spinlock.maxYields", 16);

  /** Park slice for waits on memory that another process may write. */
  public static final long WAIT_POLL_INTERVAL_NS =
      Long.getLong("shmsync.wait.pollIntervalNs", TimeUnit.MICROSECONDS.toNanos(100));

  public static final File MAPPED_DIRECTORY;

  /**
   * Creates a fresh idle strategy for one contended lock acquisition. The default {@code backoff}
   * spins and then yields without ever parking; {@code parking} parks after the yields.
   */
  public static final Supplier<IdleStrategy> SPIN_LOCK_IDLE_STRATEGY;

  static {
    String idleStrategy = System.getProperty("shmsync.spinlock.idleStrategy", "backoff");

    if ("noop".equalsIgnoreCase(idleStrategy)) {
      SPIN_LOCK_IDLE_STRATEGY = NoOpIdleStrategy::new;
    } else if ("yielding".equalsIgnoreCase(idleStrategy)) {
      SPIN_LOCK_IDLE_STRATEGY = YieldingIdleStrategy::new;
    } else if ("sleeping".equalsIgnoreCase(idleStrategy)) {
      SPIN_LOCK_IDLE_STRATEGY =
          () -> new SleepingIdleStrategy(TimeUnit.MICROSECONDS.toNanos(50));
    } else if ("parking".equalsIgnoreCase(idleStrategy)) {
      SPIN_LOCK_IDLE_STRATEGY =
          () ->
              new BackoffIdleStrategy(
                  SPIN_LOCK_MAX_SPINS,
                  SPIN_LOCK_MAX_YIELDS,
                  TimeUnit.MICROSECONDS.toNanos(1),
                  TimeUnit.MICROSECONDS.toNanos(100));
    } else {
      // unbounded yields, the park phase is never reached
      SPIN_LOCK_IDLE_STRATEGY =
          () ->
              new BackoffIdleStrategy(
                  SPIN_LOCK_MAX_SPINS,
                  Long.MAX_VALUE,
                  TimeUnit.MICROSECONDS.toNanos(1),
                  TimeUnit.MICROSECONDS.toNanos(1));
    }

    String directory = System.getProperty("shmsync.mapped.directory");
    if (directory != null) {
      MAPPED_DIRECTORY = new File(directory);
    } else {
      // under linux, prefer tmpfs
      File shm = new File("/dev/shm");
      MAPPED_DIRECTORY =
          shm.isDirectory() && shm.canWrite()
              ? shm
              : new File(System.getProperty("java.io.tmpdir"));
    }
  }

  private Constants() {}
}
