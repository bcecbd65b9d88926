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

/**
 * Thrown when a region descriptor or handle cannot be turned into a region: malformed fields, a
 * slot width or capacity that does not match the backing memory, or a handle that was already
 * attached or released.
 */
public final class InvalidHandleException extends SharedMemoryException {

  private static final long serialVersionUID = 3190447288315826131L;

  /**
   * Constructs a new exception with the specified message.
   *
   * @param message the message
   */
  public InvalidHandleException(String message) {
    super(message);
  }

  /**
   * Constructs a new exception with the specified message and cause.
   *
   * @param message the message
   * @param cause the cause of this exception
   */
  public InvalidHandleException(String message, @Nullable Throwable cause) {
    super(message, cause);
  }
}
