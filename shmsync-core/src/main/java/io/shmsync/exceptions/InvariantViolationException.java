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

/**
 * Thrown when a primitive observes shared state that it could never have produced itself, for
 * example a ring index outside of its data range. Such state means some participant wrote the
 * slots without going through the owning primitive, so the operation that noticed it stops instead
 * of trying to repair it.
 */
public final class InvariantViolationException extends SharedMemoryException {

  private static final long serialVersionUID = -1524885364420193410L;

  /**
   * Constructs a new exception with the specified message.
   *
   * @param message the message
   */
  public InvariantViolationException(String message) {
    super(message);
  }
}
