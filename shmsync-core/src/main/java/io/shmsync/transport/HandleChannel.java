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

package io.shmsync.transport;

import io.shmsync.RegionHandle;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Moves {@link RegionHandle}s between execution contexts without copying the memory they refer
 * to. Each handle is delivered to exactly one receiver, in the order handles were sent.
 */
public interface HandleChannel extends Disposable {

  /**
   * Hands {@code handle} over to the channel on subscription. From then on the channel owns the
   * handle's reference: it either reaches a receiver or is released when the channel is disposed.
   *
   * @return a {@code Mono} completing once the handle is queued, or failing with {@link
   *     java.nio.channels.ClosedChannelException} if the channel is disposed
   */
  Mono<Void> send(RegionHandle handle);

  /**
   * Returns a {@code Mono} that, on subscription, waits for the next handle. The subscriber owns
   * the reference of the handle it receives and usually passes it to {@link
   * io.shmsync.SharedRegion#attach(RegionHandle)}.
   */
  Mono<RegionHandle> receive();

  /** Returns a {@code Mono} that completes when this channel is disposed. */
  Mono<Void> onClose();
}
