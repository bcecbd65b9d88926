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

import java.util.NoSuchElementException;

/** The outcome of a pop: a value when {@link #isOk()}, otherwise the reason there is none. */
public final class PopResult {

  static final PopResult EMPTY = new PopResult(RingStatus.EMPTY, 0);

  static final PopResult TIMED_OUT = new PopResult(RingStatus.TIMED_OUT, 0);

  private final RingStatus status;

  private final int value;

  private PopResult(RingStatus status, int value) {
    this.status = status;
    this.value = value;
  }

  static PopResult ok(int value) {
    return new PopResult(RingStatus.OK, value);
  }

  public RingStatus status() {
    return status;
  }

  public boolean isOk() {
    return status == RingStatus.OK;
  }

  /**
   * @return the popped value
   * @throws NoSuchElementException if nothing was popped
   */
  public int value() {
    if (status != RingStatus.OK) {
      throw new NoSuchElementException("no value, status " + status);
    }
    return value;
  }

  @Override
  public String toString() {
    return status == RingStatus.OK
        ? "PopResult{OK, value=" + value + '}'
        : "PopResult{" + status + '}';
  }
}
