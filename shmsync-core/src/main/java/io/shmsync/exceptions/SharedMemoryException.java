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

package io.shmsync.exceptions;

import reactor.util.annotation.Nullable;

/** The root of the shared memory exception hierarchy. */
public abstract class SharedMemoryException extends RuntimeException {

  private static final long serialVersionUID = -4719031356042860563L;

  /**
   * Constructs a new exception with the specified message.
   *
   * @param message the message
   */
  public SharedMemoryException(String message) {
    this(message, null);
  }

  /**
   * Constructs a new exception with the specified message and cause.
   *
   * @param message the message
   * @param cause the cause of this exception
   */
  public SharedMemoryException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
