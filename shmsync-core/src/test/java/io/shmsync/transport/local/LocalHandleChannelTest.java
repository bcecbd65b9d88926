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

package io.shmsync.transport.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shmsync.RegionHandle;
import io.shmsync.SharedRegion;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

final class LocalHandleChannelTest {

  private LocalHandleChannel channel;

  private SharedRegion region;

  @BeforeEach
  void setUp() {
    channel = LocalHandleChannel.create("test");
    region = SharedRegion.allocate(8);
  }

  @AfterEach
  void tearDown() {
    channel.dispose();
    region.close();
  }

  @DisplayName("creates channels with the given or a random name")
  @Test
  void names() {
    assertThat(channel.name()).isEqualTo("test");
    assertThat(LocalHandleChannel.createEphemeral().name()).isNotEmpty();
    assertThatThrownBy(() -> LocalHandleChannel.create(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("name must not be null");
  }

  @DisplayName("a received handle attaches to the sender's memory")
  @Test
  void sendThenReceive() {
    region.view(3).store(99);

    StepVerifier.create(channel.send(region.handle())).verifyComplete();
    assertThat(channel.pending()).isEqualTo(1);

    RegionHandle received = channel.receive().block(Duration.ofSeconds(5));
    assertThat(received).isNotNull();
    assertThat(channel.pending()).isZero();

    try (SharedRegion attached = SharedRegion.attach(received)) {
      assertThat(attached.view(3).load()).isEqualTo(99);
      attached.view(4).store(7);
      assertThat(region.view(4).load()).isEqualTo(7);
    }
  }

  @DisplayName("a receiver that subscribes first gets the next handle sent")
  @Test
  void receiveBeforeSend() {
    StepVerifier.create(channel.receive())
        .then(() -> channel.send(region.handle()).subscribe())
        .assertNext(handle -> assertThat(handle.release()).isTrue())
        .verifyComplete();
  }

  @DisplayName("handles are delivered in the order they were sent")
  @Test
  void preservesOrder() {
    try (SharedRegion first = region.slice(0, 2);
        SharedRegion second = region.slice(2, 2)) {
      channel.send(first.handle()).block();
      channel.send(second.handle()).block();

      StepVerifier.create(channel.receive())
          .assertNext(
              handle -> {
                assertThat(handle.descriptor()).isEqualTo(first.descriptor());
                assertThat(handle.release()).isTrue();
              })
          .verifyComplete();
      StepVerifier.create(channel.receive())
          .assertNext(
              handle -> {
                assertThat(handle.descriptor()).isEqualTo(second.descriptor());
                assertThat(handle.release()).isTrue();
              })
          .verifyComplete();
    }
  }

  @DisplayName("hands a region over to a receiver on another thread")
  @Test
  void crossThread() {
    Mono<Integer> remote =
        channel
            .receive()
            .publishOn(Schedulers.boundedElastic())
            .map(
                handle -> {
                  try (SharedRegion attached = SharedRegion.attach(handle)) {
                    return attached.view(0).add(1);
                  }
                });

    region.view(0).store(41);
    StepVerifier.create(remote)
        .then(() -> channel.send(region.handle()).subscribe())
        .expectNext(41)
        .expectComplete()
        .verify(Duration.ofSeconds(5));
    assertThat(region.view(0).load()).isEqualTo(42);
  }

  @DisplayName("dispose releases undelivered handles and fails waiting receivers")
  @Test
  void disposeReleasesPending() {
    int before = region.memory().refCnt();
    RegionHandle handle = region.handle();
    channel.send(handle).block();
    assertThat(region.memory().refCnt()).isEqualTo(before + 1);

    channel.dispose();

    assertThat(handle.isConsumed()).isTrue();
    assertThat(region.memory().refCnt()).isEqualTo(before);
    assertThat(channel.pending()).isZero();
    assertThat(channel.isDisposed()).isTrue();
    StepVerifier.create(channel.onClose()).verifyComplete();
  }

  @DisplayName("dispose fails receivers that were waiting")
  @Test
  void disposeFailsReceivers() {
    StepVerifier.create(channel.receive())
        .then(channel::dispose)
        .verifyError(ClosedChannelException.class);
    StepVerifier.create(channel.receive()).verifyError(ClosedChannelException.class);
  }

  @DisplayName("send after dispose fails and releases the handle")
  @Test
  void sendAfterDispose() {
    int before = region.memory().refCnt();
    channel.dispose();
    RegionHandle handle = region.handle();

    StepVerifier.create(channel.send(handle)).verifyError(ClosedChannelException.class);

    assertThat(handle.isConsumed()).isTrue();
    assertThat(region.memory().refCnt()).isEqualTo(before);
  }

  @DisplayName("a cancelled receiver does not swallow the next handle")
  @Test
  void cancelledReceiver() {
    StepVerifier.create(channel.receive()).thenCancel().verify();

    channel.send(region.handle()).block();

    assertThat(channel.pending()).isEqualTo(1);
    StepVerifier.create(channel.receive())
        .assertNext(handle -> assertThat(handle.release()).isTrue())
        .verifyComplete();
  }
}
