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

import io.netty.util.AbstractReferenceCounted;
import io.shmsync.internal.SlotWaiters;
import io.shmsync.util.NumberUtils;
import java.nio.ByteBuffer;
import java.util.Objects;
import org.agrona.BufferUtil;
import org.agrona.concurrent.AtomicBuffer;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A block of memory shared by every {@link SharedRegion} carved out of it. The block is reference
 * counted: each region holder owns one reference and the memory is freed when the last one is
 * released.
 */
public class SharedMemory extends AbstractReferenceCounted {

  private static final Logger logger = LoggerFactory.getLogger(SharedMemory.class);

  private final AtomicBuffer buffer;

  private final SlotWaiters waiters = new SlotWaiters();

  protected SharedMemory(AtomicBuffer buffer) {
    this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    buffer.verifyAlignment();
  }

  /**
   * Allocates zeroed direct memory.
   *
   * @param bytes size of the block
   * @return a block holding one reference
   */
  public static SharedMemory allocateDirect(int bytes) {
    NumberUtils.requirePositive(bytes, "bytes must be positive");
    SharedMemory memory = new SharedMemory(new UnsafeBuffer(ByteBuffer.allocateDirect(bytes)));
    if (logger.isDebugEnabled()) {
      logger.debug("allocated {} bytes of shared memory", bytes);
    }
    return memory;
  }

  public final AtomicBuffer buffer() {
    return buffer;
  }

  /** Threads of this JVM parked on slots of this block. */
  public final SlotWaiters waiters() {
    return waiters;
  }

  /**
   * Whether participants outside this JVM may write the block. Waits on such memory cannot rely on
   * in-process signals alone and re-read their slot periodically.
   */
  public boolean isInterprocess() {
    return false;
  }

  @Override
  public SharedMemory retain() {
    super.retain();
    return this;
  }

  @Override
  public SharedMemory retain(int increment) {
    super.retain(increment);
    return this;
  }

  @Override
  public SharedMemory touch() {
    return this;
  }

  @Override
  public SharedMemory touch(Object hint) {
    return this;
  }

  @Override
  protected void deallocate() {
    BufferUtil.free(buffer);
    if (logger.isDebugEnabled()) {
      logger.debug("freed {} bytes of shared memory", buffer.capacity());
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{bytes="
        + buffer.capacity()
        + ", refCnt="
        + refCnt()
        + "}";
  }
}
