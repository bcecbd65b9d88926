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

import io.netty.util.IllegalReferenceCountException;
import io.shmsync.exceptions.InvalidHandleException;
import io.shmsync.util.NumberUtils;
import java.io.Closeable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed number of atomically accessed 32-bit slots inside a {@link SharedMemory} block.
 *
 * <p>Every instance is one holder of the block. Instances are handed between threads through a
 * {@link RegionHandle} (see {@link #handle()} and {@link #attach(RegionHandle)}) and the memory
 * lives until the last holder is {@link #close() closed}. Slots are only ever read or written
 * through {@link AtomicView}s.
 */
public final class SharedRegion implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(SharedRegion.class);

  private final SharedMemory memory;

  private final RegionDescriptor descriptor;

  volatile int closed;
  static final AtomicIntegerFieldUpdater<SharedRegion> CLOSED =
      AtomicIntegerFieldUpdater.newUpdater(SharedRegion.class, "closed");

  private SharedRegion(SharedMemory memory, RegionDescriptor descriptor) {
    this.memory = memory;
    this.descriptor = descriptor;
  }

  /**
   * Allocates a region of {@code capacity} zeroed slots in fresh direct memory.
   *
   * @param capacity number of slots
   * @return the only holder of the new memory
   */
  public static SharedRegion allocate(int capacity) {
    NumberUtils.requirePositive(capacity, "capacity must be positive");
    RegionDescriptor descriptor = RegionDescriptor.of(capacity);
    return new SharedRegion(SharedMemory.allocateDirect(descriptor.endOffset()), descriptor);
  }

  /**
   * Builds a region over memory whose reference the caller owns; the reference passes to the
   * returned region.
   *
   * @throws InvalidHandleException if the descriptor does not fit in the memory
   */
  public static SharedRegion create(SharedMemory memory, RegionDescriptor descriptor) {
    Objects.requireNonNull(memory, "memory must not be null");
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    try {
      descriptor.validateAgainst(memory.buffer().capacity());
    } catch (InvalidHandleException e) {
      memory.release();
      throw e;
    }
    return new SharedRegion(memory, descriptor);
  }

  /**
   * Rebuilds the region described by a handle received from another execution context. The
   * handle's reference is taken over by the returned region.
   *
   * @throws InvalidHandleException if the handle was already attached or released, or its memory
   *     has been freed
   */
  public static SharedRegion attach(RegionHandle handle) {
    Objects.requireNonNull(handle, "handle must not be null");
    SharedMemory memory = handle.consume();
    if (memory.refCnt() == 0) {
      throw new InvalidHandleException("shared memory of " + handle.descriptor() + " was freed");
    }
    SharedRegion region = create(memory, handle.descriptor());
    if (logger.isDebugEnabled()) {
      logger.debug("attached {}", region);
    }
    return region;
  }

  /**
   * Produces a handle that owns a new reference to this region's memory.
   *
   * @throws InvalidHandleException if this region is already closed
   */
  public RegionHandle handle() {
    return new RegionHandle(descriptor, retainMemory());
  }

  /**
   * Returns a new holder over {@code capacity} slots of this region starting at {@code firstSlot}.
   *
   * @throws IndexOutOfBoundsException if the sub-range does not fit in this region
   */
  public SharedRegion slice(int firstSlot, int capacity) {
    NumberUtils.requirePositive(capacity, "capacity must be positive");
    NumberUtils.requireSlotRange(firstSlot, capacity, descriptor.capacity());
    RegionDescriptor sliced =
        RegionDescriptor.of(capacity, descriptor.slotWidth(), offset(firstSlot));
    return new SharedRegion(retainMemory(), sliced);
  }

  /**
   * Creates an accessor for one slot. The view, and every primitive built on it, is usable only
   * while this region is open.
   *
   * @throws InvalidHandleException if this region is closed
   */
  public AtomicView view(int slot) {
    return new AtomicView(this, slot);
  }

  public int capacity() {
    return descriptor.capacity();
  }

  public int slotWidth() {
    return descriptor.slotWidth();
  }

  public RegionDescriptor descriptor() {
    return descriptor;
  }

  public SharedMemory memory() {
    return memory;
  }

  public boolean isClosed() {
    return closed == 1;
  }

  /**
   * Absolute byte offset of {@code slot} within the backing memory.
   *
   * @throws IndexOutOfBoundsException if {@code slot} is not in {@code [0, capacity)}
   */
  public int offset(int slot) {
    if (slot < 0 || slot >= descriptor.capacity()) {
      throw new IndexOutOfBoundsException(
          "slot " + slot + " is out of bounds for capacity " + descriptor.capacity());
    }
    return descriptor.baseOffset() + slot * descriptor.slotWidth();
  }

  /**
   * Releases this holder's reference. Further calls do nothing. Views of this region fail with
   * {@link InvalidHandleException} from then on; closing must not race with operations still
   * running on them in other threads, except {@link AtomicView#await(int) waits}.
   */
  @Override
  public void close() {
    if (CLOSED.compareAndSet(this, 0, 1)) {
      // waiters on this region notice the close, the others park again
      memory.waiters().unparkAll();
      memory.release();
    }
  }

  /** @throws InvalidHandleException if this region is closed */
  void ensureOpen() {
    if (closed == 1) {
      throw new InvalidHandleException("region is closed: " + descriptor);
    }
  }

  SharedMemory retainMemory() {
    ensureOpen();
    try {
      return memory.retain();
    } catch (IllegalReferenceCountException e) {
      throw new InvalidHandleException("shared memory of " + descriptor + " was freed", e);
    }
  }

  @Override
  public String toString() {
    return "SharedRegion{" + descriptor + ", memory=" + memory + '}';
  }
}
