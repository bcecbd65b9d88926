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
import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * A region descriptor together with one reference to the memory it describes. This is what moves
 * between execution contexts: the receiver turns it into a region with {@link
 * SharedRegion#attach(RegionHandle)}, which takes over the reference. A handle that is never
 * attached must be {@link #release() released}.
 */
public final class RegionHandle {

  private final RegionDescriptor descriptor;

  private final SharedMemory memory;

  volatile int consumed;
  static final AtomicIntegerFieldUpdater<RegionHandle> CONSUMED =
      AtomicIntegerFieldUpdater.newUpdater(RegionHandle.class, "consumed");

  RegionHandle(RegionDescriptor descriptor, SharedMemory memory) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
    this.memory = Objects.requireNonNull(memory, "memory must not be null");
  }

  public RegionDescriptor descriptor() {
    return descriptor;
  }

  /** The backing memory, exposed so that non-heap backends can publish its location. */
  public SharedMemory memory() {
    return memory;
  }

  public boolean isConsumed() {
    return consumed == 1;
  }

  /**
   * Drops the reference owned by this handle unless it was already attached or released.
   *
   * @return {@code true} if this call released the reference
   */
  public boolean release() {
    if (CONSUMED.compareAndSet(this, 0, 1)) {
      memory.release();
      return true;
    }
    return false;
  }

  SharedMemory consume() {
    if (!CONSUMED.compareAndSet(this, 0, 1)) {
      throw new InvalidHandleException("handle was already attached or released: " + descriptor);
    }
    return memory;
  }

  @Override
  public String toString() {
    return "RegionHandle{" + descriptor + ", consumed=" + isConsumed() + '}';
  }
}
