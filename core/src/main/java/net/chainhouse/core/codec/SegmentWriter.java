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
import net.chainhouse.core.data.ByteArrays;
import net.chainhouse.core.data.ColumnVector;
import org.roaringbitmap.RoaringBitmap;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Writes one column of a partition as a segment file:
 *
 * <pre>
 *   header     magic(4) version(1) type(1) granules(4) rows(4)
 *   directory  per granule: offset(8) length(4) rows(4) rawBytes(4) crc32(4)
 *   blocks     per granule: nullsLength(4) nulls(n) values(..)
 * </pre>
 *
 * Each block is self contained so a reader can decode any granule alone.
 */
public class SegmentWriter {

  public static final int MAGIC = 0x43485347;
  public static final byte VERSION = 1;
  public static final int HEADER_SIZE = 14;
  public static final int DIRECTORY_ENTRY_SIZE = 24;

  private final ColumnCodec codec;

  public SegmentWriter(final ColumnCodec codec) {
    this.codec = codec;
  }

  /**
   * @param granules the column's values split into granules, in row order.
   * @return sizes of what was written.
   */
  public SegmentInfo write(final Path file,
                           final ColumnType type,
                           final List<ColumnVector> granules) throws IOException {
    final List<byte[]> blocks = new ArrayList<>(granules.size());
    int rows = 0;
    long rawBytes = 0;
    for (ColumnVector granule : granules) {
      blocks.add(encodeBlock(granule));
      rows += granule.size();
      rawBytes += granule.sizeInBytes();
    }

    final int headerBytes = HEADER_SIZE + DIRECTORY_ENTRY_SIZE * blocks.size();
    final byte[] header = new byte[headerBytes];
    ByteArrays.putInt(MAGIC, header, 0);
    header[4] = VERSION;
    header[5] = type.getId();
    ByteArrays.putInt(blocks.size(), header, 6);
    ByteArrays.putInt(rows, header, 10);
    long offset = headerBytes;
    int position = HEADER_SIZE;
    for (int i = 0; i < blocks.size(); i++) {
      final byte[] block = blocks.get(i);
      final CRC32 crc = new CRC32();
      crc.update(block);
      ByteArrays.putLong(offset, header, position);
      ByteArrays.putInt(block.length, header, position + 8);
      ByteArrays.putInt(granules.get(i).size(), header, position + 12);
      ByteArrays.putInt((int) Math.min(Integer.MAX_VALUE, granules.get(i).sizeInBytes()),
          header, position + 16);
      ByteArrays.putInt((int) crc.getValue(), header, position + 20);
      position += DIRECTORY_ENTRY_SIZE;
      offset += block.length;
    }

    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
      final OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel));
      out.write(header);
      for (byte[] block : blocks) {
        out.write(block);
      }
      out.flush();
      channel.force(true);
    }
    return new SegmentInfo(offset, rawBytes);
  }

  private byte[] encodeBlock(final ColumnVector granule) throws IOException {
    final RoaringBitmap nulls = granule.nulls();
    nulls.runOptimize();
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.writeInt(nulls.serializedSizeInBytes());
      nulls.serialize(out);
      out.write(codec.encode(granule));
    }
    return bytes.toByteArray();
  }
}
