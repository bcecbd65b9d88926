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

import io.shmsync.RegionHandle;
import io.shmsync.transport.HandleChannel;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;

/**
 * A {@link HandleChannel} between threads of the same JVM. Handles are passed by reference;
 * pending handles and pending receivers are matched by a single draining thread at a time.
 */
public final class LocalHandleChannel implements HandleChannel {

  private static final Logger logger = LoggerFactory.getLogger(LocalHandleChannel.class);

  private final String name;

  private final Queue<RegionHandle> handles = new ConcurrentLinkedQueue<>();

  private final Queue<Receiver> receivers = new ConcurrentLinkedQueue<>();

  private final Sinks.Empty<Void> onClose = Sinks.empty();

  volatile boolean disposed;

  volatile int wip;
  static final AtomicIntegerFieldUpdater<LocalHandleChannel> WIP =
      AtomicIntegerFieldUpdater.newUpdater(LocalHandleChannel.class, "wip");

  private LocalHandleChannel(String name) {
    this.name = name;
  }

  /**
   * Creates an instance.
   *
   * @param name name used in log messages
   * @return a new channel
   * @throws NullPointerException if {@code name} is {@code null}
   */
  public static LocalHandleChannel create(String name) {
    Objects.requireNonNull(name, "name must not be null");
    return new LocalHandleChannel(name);
  }

  /** Creates an instance with a random name. */
  public static LocalHandleChannel createEphemeral() {
    return create(UUID.randomUUID().toString());
  }

  public String name() {
    return name;
  }

  @Override
  public Mono<Void> send(RegionHandle handle) {
    Objects.requireNonNull(handle, "handle must not be null");
    return Mono.defer(
        () -> {
          if (disposed) {
            handle.release();
            return Mono.error(new ClosedChannelException());
          }
          handles.offer(handle);
          if (logger.isDebugEnabled()) {
            logger.debug("[{}] queued {}", name, handle);
          }
          drain();
          return Mono.empty();
        });
  }

  @Override
  public Mono<RegionHandle> receive() {
    return Mono.<RegionHandle>create(
            sink -> {
              Receiver receiver = new Receiver(sink);
              sink.onCancel(
                  () -> {
                    receiver.cancelled = true;
                    drain();
                  });
              receivers.offer(receiver);
              drain();
            })
        .doOnDiscard(RegionHandle.class, RegionHandle::release);
  }

  /** Number of handles sent but not yet received. */
  public int pending() {
    return handles.size();
  }

  @Override
  public void dispose() {
    if (disposed) {
      return;
    }
    disposed = true;
    drain();
    onClose.tryEmitEmpty();
    if (logger.isDebugEnabled()) {
      logger.debug("[{}] disposed", name);
    }
  }

  @Override
  public boolean isDisposed() {
    return disposed;
  }

  @Override
  public Mono<Void> onClose() {
    return onClose.asMono();
  }

  void drain() {
    if (WIP.getAndIncrement(this) != 0) {
      return;
    }

    int missed = 1;
    for (; ; ) {
      for (; ; ) {
        Receiver receiver = receivers.peek();
        if (receiver == null) {
          break;
        }
        if (receiver.cancelled) {
          receivers.poll();
          continue;
        }
        if (disposed) {
          receivers.poll();
          receiver.sink.error(new ClosedChannelException());
          continue;
        }

        RegionHandle handle = handles.poll();
        if (handle == null) {
          break;
        }
        receivers.poll();
        receiver.sink.success(handle);
      }

      if (disposed) {
        RegionHandle handle;
        while ((handle = handles.poll()) != null) {
          handle.release();
        }
      }

      missed = WIP.addAndGet(this, -missed);
      if (missed == 0) {
        break;
      }
    }
  }

  static final class Receiver {

    final MonoSink<RegionHandle> sink;

    volatile boolean cancelled;

    Receiver(MonoSink<RegionHandle> sink) {
      this.sink = sink;
    }
  }

  @Override
  public String toString() {
    return "LocalHandleChannel{name=" + name + ", pending=" + handles.size() + '}';
  }
}
