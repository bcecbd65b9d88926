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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shmsync.exceptions.InvalidHandleException;
import io.shmsync.test.util.TestThreads;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

final class SharedRegionTest {

  @DisplayName("allocate creates zeroed 32-bit slots")
  @Test
  void allocateZeroedSlots() {
    try (SharedRegion region = SharedRegion.allocate(8)) {
      assertThat(region.capacity()).isEqualTo(8);
      assertThat(region.slotWidth()).isEqualTo(4);
      assertThat(region.descriptor()).isEqualTo(RegionDescriptor.of(8));
      for (int i = 0; i < region.capacity(); i++) {
        assertThat(region.view(i).load()).isZero();
      }
      assertThat(region.memory().refCnt()).isEqualTo(1);
    }
  }

  @DisplayName("an attached handle shares memory with the region it came from")
  @Test
  void attachedHandleSharesMemory() {
    SharedRegion region = SharedRegion.allocate(4);
    region.view(1).store(9);

    SharedRegion attached = SharedRegion.attach(region.handle());

    assertThat(attached.descriptor()).isEqualTo(region.descriptor());
    assertThat(attached.view(1).load()).isEqualTo(9);
    attached.view(2).store(5);
    assertThat(region.view(2).load()).isEqualTo(5);
    assertThat(region.memory().refCnt()).isEqualTo(2);

    region.close();
    assertThat(attached.memory().refCnt()).isEqualTo(1);
    assertThat(attached.view(1).load()).isEqualTo(9);

    attached.close();
    assertThat(attached.memory().refCnt()).isZero();
  }

  @DisplayName("a handle can be attached only once")
  @Test
  void handleAttachesOnce() {
    try (SharedRegion region = SharedRegion.allocate(4)) {
      RegionHandle handle = region.handle();
      SharedRegion attached = SharedRegion.attach(handle);

      assertThat(handle.isConsumed()).isTrue();
      assertThatThrownBy(() -> SharedRegion.attach(handle))
          .isInstanceOf(InvalidHandleException.class);
      attached.close();
    }
  }

  @DisplayName("releasing a handle that was never attached drops its reference")
  @Test
  void releaseUnattachedHandle() {
    try (SharedRegion region = SharedRegion.allocate(4)) {
      RegionHandle handle = region.handle();
      assertThat(region.memory().refCnt()).isEqualTo(2);

      assertThat(handle.release()).isTrue();
      assertThat(handle.release()).isFalse();
      assertThat(region.memory().refCnt()).isEqualTo(1);
      assertThatThrownBy(() -> SharedRegion.attach(handle))
          .isInstanceOf(InvalidHandleException.class);
    }
  }

  @DisplayName("close releases the holder once and handle() then fails")
  @Test
  void closeIsIdempotent() {
    SharedRegion region = SharedRegion.allocate(4);
    SharedRegion other = SharedRegion.attach(region.handle());

    region.close();
    region.close();

    assertThat(region.isClosed()).isTrue();
    assertThat(other.memory().refCnt()).isEqualTo(1);
    assertThatThrownBy(region::handle).isInstanceOf(InvalidHandleException.class);
    assertThatThrownBy(() -> region.view(0)).isInstanceOf(InvalidHandleException.class);
    other.close();
  }

  @DisplayName("a slice aliases a sub-range of its parent")
  @Test
  void sliceAliasesParent() {
    try (SharedRegion region = SharedRegion.allocate(8);
        SharedRegion slice = region.slice(2, 3)) {
      assertThat(slice.capacity()).isEqualTo(3);
      assertThat(slice.descriptor().baseOffset()).isEqualTo(8);
      assertThat(region.memory().refCnt()).isEqualTo(2);

      slice.view(0).store(11);
      assertThat(region.view(2).load()).isEqualTo(11);
      region.view(4).store(12);
      assertThat(slice.view(2).load()).isEqualTo(12);

      assertThatThrownBy(() -> slice.view(3)).isInstanceOf(IndexOutOfBoundsException.class);
      assertThatThrownBy(() -> region.slice(6, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }
  }

  @DisplayName("a handle of a slice rebuilds the slice, not the parent")
  @Test
  void sliceHandle() {
    try (SharedRegion region = SharedRegion.allocate(8);
        SharedRegion slice = region.slice(4, 4);
        SharedRegion attached = SharedRegion.attach(slice.handle())) {
      attached.view(0).store(3);

      assertThat(attached.descriptor()).isEqualTo(RegionDescriptor.of(4, 4, 16));
      assertThat(region.view(4).load()).isEqualTo(3);
    }
  }

  @DisplayName("create rejects a descriptor larger than the memory and releases the memory")
  @Test
  void createRejectsOversizedDescriptor() {
    SharedMemory memory = SharedMemory.allocateDirect(16);

    assertThatThrownBy(() -> SharedRegion.create(memory, RegionDescriptor.of(5)))
        .isInstanceOf(InvalidHandleException.class);
    assertThat(memory.refCnt()).isZero();
  }

  @DisplayName("a worker thread attaches a handed-over region and its writes are visible")
  @Test
  void handOverToWorkerThread() throws Exception {
    SharedRegion region = SharedRegion.allocate(2);
    RegionHandle handle = region.handle();

    CompletableFuture<Integer> worker =
        TestThreads.fork(
            "worker",
            () -> {
              try (SharedRegion attached = SharedRegion.attach(handle)) {
                return attached.view(0).add(42);
              }
            });

    assertThat(TestThreads.join(worker)).isZero();
    assertThat(region.view(0).load()).isEqualTo(42);
    assertThat(region.memory().refCnt()).isEqualTo(1);
    region.close();
  }
}
