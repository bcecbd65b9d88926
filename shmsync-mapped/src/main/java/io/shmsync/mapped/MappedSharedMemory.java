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

package io.shmsync.mapped;

import io.shmsync.SharedMemory;
import java.io.File;
import java.nio.MappedByteBuffer;
import org.agrona.concurrent.UnsafeBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared memory backed by a memory-mapped file. Other processes that map the same file see the
 * same slots, so waits on this memory poll the slot in addition to parking.
 */
public final class MappedSharedMemory extends SharedMemory {

  private static final Logger logger = LoggerFactory.getLogger(MappedSharedMemory.class);

  private final File file;

  private final MappedByteBuffer mappedByteBuffer;

  private final boolean deleteOnRelease;

  MappedSharedMemory(File file, MappedByteBuffer mappedByteBuffer, boolean deleteOnRelease) {
    super(new UnsafeBuffer(mappedByteBuffer));
    this.file = file;
    this.mappedByteBuffer = mappedByteBuffer;
    this.deleteOnRelease = deleteOnRelease;
  }

  @Override
  public boolean isInterprocess() {
    return true;
  }

  public File getFile() {
    return file;
  }

  public String getPath() {
    return file.getAbsolutePath();
  }

  /** Flushes the mapped content to the file. */
  public void force() {
    mappedByteBuffer.force();
  }

  /**
   * Deletes the file to make it harder to sniff the region. Can be called (at least under linux)
   * once every participant has mapped the file.
   *
   * @return whether the file was deleted
   */
  public boolean deleteFile() {
    boolean deleted = file.delete();
    if (deleted && logger.isDebugEnabled()) {
      logger.debug("deleted {}", file);
    }
    return deleted;
  }

  @Override
  protected void deallocate() {
    super.deallocate();
    if (deleteOnRelease && file.exists()) {
      deleteFile();
    }
  }

  @Override
  public String toString() {
    return "MappedSharedMemory{file="
        + file
        + ", bytes="
        + buffer().capacity()
        + ", refCnt="
        + refCnt()
        + '}';
  }
}
