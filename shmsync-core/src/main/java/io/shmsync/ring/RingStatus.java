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

package io.shmsync.ring;

/** Status of a ring buffer operation. None of these are errors. */
public enum RingStatus {
  OK,

  /** The ring holds {@link RingBuffer#capacity()} elements, nothing was written. */
  FULL,

  /** The ring holds no element, nothing was read. */
  EMPTY,

  /** A blocking operation gave up without changing the ring. */
  TIMED_OUT
}
