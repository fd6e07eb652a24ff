/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.chainhouse.core.codec;

import net.chainhouse.core.ColumnType;
import net.chainhouse.core.CorruptionException;
import net.chainhouse.core.data.ByteArrays;
import net.chainhouse.core.data.ColumnVector;
import org.roaringbitmap.RoaringBitmap;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.CRC32;

/**
 * Random access to the granules of a segment file written by
 * {@link SegmentWriter}. The directory is read once at construction.
 */
public class SegmentReader {

  private final Path file;
  private final String column;
  private final ColumnType type;
  private final ColumnCodec codec;
  private final int rows;
  private final long[] offsets;
  private final int[] lengths;
  private final int[] granuleRows;
  private final int[] rawBytes;
  private final int[] checksums;

  /**
   * @throws CorruptionException if the header or directory is invalid.
   */
  public SegmentReader(final Path file,
                       final String column,
                       final ColumnType type,
                       final ColumnCodec codec) {
    this.file = file;
    this.column = column;
    this.type = type;
    this.codec = codec;
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
      final byte[] header = readFully(channel, 0, SegmentWriter.HEADER_SIZE);
      if (ByteArrays.getInt(header, 0) != SegmentWriter.MAGIC) {
        throw new CorruptionException("Bad magic in " + file);
      }
      if (header[4] != SegmentWriter.VERSION) {
        throw new CorruptionException("Unsupported segment version " + header[4] + " in " + file);
      }
      if (header[5] != type.getId()) {
        throw new CorruptionException("Segment " + file + " holds type id " + header[5]
            + " but column " + column + " is " + type);
      }
      final int granules = ByteArrays.getInt(header, 6);
      this.rows = ByteArrays.getInt(header, 10);
      if (granules < 0 || rows < 0) {
        throw new CorruptionException("Invalid segment header in " + file);
      }
      final byte[] directory = readFully(channel, SegmentWriter.HEADER_SIZE,
          SegmentWriter.DIRECTORY_ENTRY_SIZE * granules);
      offsets = new long[granules];
      lengths = new int[granules];
      granuleRows = new int[granules];
      rawBytes = new int[granules];
      checksums = new int[granules];
      for (int i = 0; i < granules; i++) {
        final int position = i * SegmentWriter.DIRECTORY_ENTRY_SIZE;
        offsets[i] = ByteArrays.getLong(directory, position);
        lengths[i] = ByteArrays.getInt(directory, position + 8);
        granuleRows[i] = ByteArrays.getInt(directory, position + 12);
        rawBytes[i] = ByteArrays.getInt(directory, position + 16);
        checksums[i] = ByteArrays.getInt(directory, position + 20);
      }
    } catch (NoSuchFileException e) {
      throw new CorruptionException("Missing segment " + file, e);
    } catch (EOFException e) {
      throw new CorruptionException("Truncated segment " + file, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open segment " + file, e);
    }
  }

  public int rowCount() {
    return rows;
  }

  public int granuleCount() {
    return offsets.length;
  }

  public int compressedBytes(final int granule) {
    return lengths[granule];
  }

  public int rawBytes(final int granule) {
    return rawBytes[granule];
  }

  /**
   * Reads and decodes one granule.
   *
   * @throws CorruptionException if the checksum does not match or decoding fails.
   */
  public ColumnVector read(final int granule) {
    final byte[] block;
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
      block = readFully(channel, offsets[granule], lengths[granule]);
    } catch (NoSuchFileException e) {
      throw new CorruptionException("Missing segment " + file, e);
    } catch (EOFException e) {
      throw new CorruptionException("Truncated granule " + granule + " in " + file, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
    final CRC32 crc = new CRC32();
    crc.update(block);
    if ((int) crc.getValue() != checksums[granule]) {
      throw new CorruptionException("Checksum mismatch in granule " + granule + " of " + file);
    }
    try {
      final DataInputStream in = new DataInputStream(new ByteArrayInputStream(block));
      final int nullsLength = in.readInt();
      if (nullsLength < 0 || nullsLength > block.length - 4) {
        throw new CorruptionException("Invalid null bitmap length in " + file);
      }
      final RoaringBitmap nulls = new RoaringBitmap();
      nulls.deserialize(in);
      final int valuesOffset = 4 + nullsLength;
      final ColumnVector vector = codec.decode(column, block, valuesOffset,
          block.length - valuesOffset, granuleRows[granule], nulls);
      if (vector.size() != granuleRows[granule]) {
        throw new CorruptionException("Granule " + granule + " of " + file + " decoded "
            + vector.size() + " rows, expected " + granuleRows[granule]);
      }
      return vector;
    } catch (IOException | RuntimeException e) {
      if (e instanceof CorruptionException) {
        throw (CorruptionException) e;
      }
      throw new CorruptionException("Failed to decode granule " + granule + " of " + file, e);
    }
  }

  private static byte[] readFully(final FileChannel channel,
                                  final long position,
                                  final int length) throws IOException {
    final ByteBuffer buffer = ByteBuffer.allocate(length);
    long at = position;
    while (buffer.hasRemaining()) {
      final int read = channel.read(buffer, at);
      if (read < 0) {
        throw new EOFException("Unexpected end of file at " + at);
      }
      at += read;
    }
    return buffer.array();
  }
}
