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
import io.shmsync.exceptions.InvariantViolationException;
import io.shmsync.util.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reusable rendezvous of a fixed number of parties over two slots: an arrival counter and a
 * generation number.
 *
 * <p>Every caller of {@link #await()} blocks until {@code parties} callers of the same generation
 * have arrived. The caller whose arrival completes the generation resets the counter, advances the
 * generation and wakes the others; the next generation starts right away.
 */
public final class Barrier {

  private static final Logger logger = LoggerFactory.getLogger(Barrier.class);

  /** Slots used by one barrier: the counter followed by the generation. */
  public static final int SLOTS = 2;

  private final int parties;

  private final AtomicView count;

  private final AtomicView generation;

  /** Uses {@code firstSlot} as counter and {@code firstSlot + 1} as generation. */
  public Barrier(SharedRegion region, int firstSlot, int parties) {
    this(region, firstSlot, firstSlot + 1, parties);
  }

  public Barrier(SharedRegion region, int countSlot, int generationSlot, int parties) {
    if (countSlot == generationSlot) {
      throw new IllegalArgumentException("count and generation must use distinct slots");
    }
    this.parties = NumberUtils.requirePositive(parties, "parties must be positive");
    this.count = region.view(countSlot);
    this.generation = region.view(generationSlot);
  }

  /**
   * Waits until all parties of the current generation have arrived.
   *
   * @return the arrival index of this caller, {@code parties - 1} for the caller that released the
   *     generation
   * @throws InterruptedException if interrupted while waiting; the arrival is not withdrawn, so the
   *     generation still needs a replacement party
   */
  public int await() throws InterruptedException {
    final int g = generation.load();
    final int arrived = count.add(1) + 1;

    if (arrived > parties || arrived <= 0) {
      throw new InvariantViolationException(
          "barrier counter reached " + arrived + " with " + parties + " parties");
    }

    if (arrived == parties) {
      count.store(0);
      generation.add(1);
      int woken = generation.signal(parties - 1);
      if (logger.isDebugEnabled()) {
        logger.debug("generation {} released {} parties, woke {}", g, parties, woken);
      }
      return arrived - 1;
    }

    while (generation.load() == g) {
      generation.await(g);
    }
    return arrived - 1;
  }

  public int parties() {
    return parties;
  }

  /** Number of completed rendezvous. */
  public int generation() {
    return generation.load();
  }

  /** Parties of the current generation that are waiting. */
  public int arrived() {
    return count.load();
  }

  @Override
  public String toString() {
    if (count.region().isClosed()) {
      return "Barrier{parties=" + parties + ", closed}";
    }
    return "Barrier{parties="
        + parties
        + ", arrived="
        + arrived()
        + ", generation="
        + generation()
        + '}';
  }
}
