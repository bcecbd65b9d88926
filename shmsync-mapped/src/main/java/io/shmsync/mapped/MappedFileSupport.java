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

import io.shmsync.RegionDescriptor;
import io.shmsync.SharedMemory;
import io.shmsync.SharedRegion;
import io.shmsync.exceptions.InvalidHandleException;
import io.shmsync.internal.Constants;
import io.shmsync.util.NumberUtils;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileChannel.MapMode;
import java.util.Objects;
import java.util.UUID;
import org.agrona.concurrent.AtomicBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and opens region files. A region file starts with a one cache line header (magic,
 * capacity, slot width) followed by the slots:
 *
 * <pre>
 *  0        4          8            64
 *  +--------+----------+------------+-------------------------------+
 *  | magic  | capacity | slot width | padding | slot 0 | slot 1 ... |
 *  +--------+----------+------------+-------------------------------+
 * </pre>
 *
 * The creator passes {@link SharedRegion#descriptor()} and the file path to its peers, which call
 * {@link #open(File, RegionDescriptor)} to map the very same slots.
 */
public final class MappedFileSupport {

  private static final Logger logger = LoggerFactory.getLogger(MappedFileSupport.class);

  static final String FILE_PREFIX = "shmsync-";

  static final int MAGIC = 0x53484D52;

  static final int META_MAGIC = 0;

  static final int META_CAPACITY = META_MAGIC + 4;

  static final int META_SLOT_WIDTH = META_CAPACITY + 4;

  /** Position at which slots start. */
  public static final int HEADER_LENGTH = Constants.CACHE_LINE_BYTES;

  private MappedFileSupport() {}

  /** Creates a new region file in {@code shmsync.mapped.directory}. */
  public static SharedRegion create(int capacity) throws IOException {
    return create(createTempFile(), capacity, true);
  }

  /**
   * Creates (or truncates) {@code file} and maps a region of {@code capacity} zeroed slots.
   *
   * @param deleteOnRelease whether the file is deleted once the last local holder is closed
   */
  public static SharedRegion create(File file, int capacity, boolean deleteOnRelease)
      throws IOException {
    Objects.requireNonNull(file, "file must not be null");
    NumberUtils.requirePositive(capacity, "capacity must be positive");
    RegionDescriptor descriptor =
        RegionDescriptor.of(capacity, Constants.SLOT_WIDTH, HEADER_LENGTH);
    int size = descriptor.endOffset();

    MappedByteBuffer mappedBuffer;
    try (RandomAccessFile io = new RandomAccessFile(file, "rw")) {
      io.setLength(0);

      // append data instead of just setting the size: in case we are using
      // a real filesystem, this could avoid getting a fragmented file
      byte[] zeros = new byte[1024];
      for (int i = 0; i < size; i += zeros.length) {
        io.write(zeros, 0, Math.min(zeros.length, size - i));
      }
      io.setLength(size);

      mappedBuffer = map(io);
    }

    MappedSharedMemory memory = new MappedSharedMemory(file, mappedBuffer, deleteOnRelease);
    AtomicBuffer buffer = memory.buffer();
    buffer.putIntVolatile(META_CAPACITY, capacity);
    buffer.putIntVolatile(META_SLOT_WIDTH, Constants.SLOT_WIDTH);
    // magic last: a peer that sees it also sees the rest of the header
    buffer.putIntVolatile(META_MAGIC, MAGIC);
    memory.force();

    if (logger.isDebugEnabled()) {
      logger.debug("created region file {} with {} slots", file, capacity);
    }
    return SharedRegion.create(memory, descriptor);
  }

  /** Maps the whole region stored in {@code file}. */
  public static SharedRegion open(File file) throws IOException {
    return open(file, null);
  }

  /**
   * Maps {@code file} and rebuilds the region described by {@code descriptor}.
   *
   * @param descriptor the region to rebuild, or {@code null} for the whole file
   * @throws FileNotFoundException if the file does not exist
   * @throws InvalidHandleException if the file is not a region file or the descriptor does not
   *     describe slots of it
   */
  public static SharedRegion open(File file, RegionDescriptor descriptor) throws IOException {
    Objects.requireNonNull(file, "file must not be null");
    if (!file.exists()) {
      throw new FileNotFoundException("File does not exist: " + file);
    }

    MappedByteBuffer mappedBuffer;
    try (RandomAccessFile io = new RandomAccessFile(file, "rw")) {
      if (io.length() < HEADER_LENGTH) {
        throw new InvalidHandleException(file + " is too short to be a region file");
      }
      mappedBuffer = map(io);
    }

    MappedSharedMemory memory = new MappedSharedMemory(file, mappedBuffer, false);
    RegionDescriptor stored;
    try {
      stored = readHeader(memory, file);
      if (descriptor == null) {
        descriptor = stored;
      } else if (descriptor.slotWidth() != stored.slotWidth()
          || descriptor.baseOffset() < stored.baseOffset()
          || descriptor.endOffset() > stored.endOffset()) {
        throw new InvalidHandleException(descriptor + " does not describe slots of " + file);
      }
    } catch (InvalidHandleException e) {
      memory.release();
      throw e;
    }

    if (logger.isDebugEnabled()) {
      logger.debug("opened region file {} as {}", file, descriptor);
    }
    return SharedRegion.create(memory, descriptor);
  }

  /**
   * Returns the file behind a mapped region.
   *
   * @throws IllegalArgumentException if the region is not backed by a file
   */
  public static File fileOf(SharedRegion region) {
    SharedMemory memory = region.memory();
    if (!(memory instanceof MappedSharedMemory)) {
      throw new IllegalArgumentException(region + " is not backed by a mapped file");
    }
    return ((MappedSharedMemory) memory).getFile();
  }

  private static RegionDescriptor readHeader(SharedMemory memory, File file) {
    AtomicBuffer buffer = memory.buffer();
    if (buffer.getIntVolatile(META_MAGIC) != MAGIC) {
      throw new InvalidHandleException(file + " is not a region file");
    }
    RegionDescriptor stored =
        RegionDescriptor.of(
            buffer.getIntVolatile(META_CAPACITY),
            buffer.getIntVolatile(META_SLOT_WIDTH),
            HEADER_LENGTH);
    return stored.validateAgainst(buffer.capacity());
  }

  private static MappedByteBuffer map(RandomAccessFile io) throws IOException {
    FileChannel channel = io.getChannel();
    MappedByteBuffer mappedBuffer = channel.map(MapMode.READ_WRITE, 0, io.length());
    mappedBuffer.load();
    return mappedBuffer;
  }

  private static File createTempFile() throws IOException {
    File dir = Constants.MAPPED_DIRECTORY;
    if (!dir.isDirectory() && !dir.mkdirs()) {
      throw new IOException("Cannot create directory " + dir);
    }
    return File.createTempFile(FILE_PREFIX, "-" + UUID.randomUUID(), dir);
  }
}
