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

/** Outcome of {@link AtomicView#await(int, long, java.util.concurrent.TimeUnit)}. */
public enum WaitResult {

  /** Woken by a signal or, on interprocess memory, by an observed change of the slot. */
  OK,

  /** The slot did not hold the expected value, the call returned without blocking. */
  NOT_EQUAL,

  /** No signal arrived before the timeout elapsed. */
  TIMED_OUT
}
