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
import net.chainhouse.core.data.BitReader;
import net.chainhouse.core.data.BitWriter;
import net.chainhouse.core.data.ColumnVector;
import org.roaringbitmap.RoaringBitmap;

/**
 * Delta-of-delta encoding for integral columns. Timestamps and sequence
 * numbers with a steady cadence collapse to a single bit per value.
 *
 * <p>Control prefixes:
 * <pre>
 *   0      delta unchanged
 *   10     7 bit delta-of-delta
 *   110    9 bit
 *   1110   12 bit
 *   11110  32 bit
 *   11111  raw 64 bit
 * </pre>
 */
public class LongDeltaCodec implements ColumnCodec {

  private static final int[] WIDTHS = {7, 9, 12, 32};

  private final ColumnType type;

  public LongDeltaCodec(final ColumnType type) {
    if (!type.isIntegral()) {
      throw new IllegalArgumentException(type + " is not integral");
    }
    this.type = type;
  }

  @Override
  public byte[] encode(final ColumnVector vector) {
    final int rows = vector.size();
    final BitWriter writer = new BitWriter(Math.max(1, rows / 8));
    if (rows == 0) {
      return new byte[0];
    }
    long last = vector.getLong(0);
    long lastDelta = 0;
    writer.write(last, 64);
    for (int i = 1; i < rows; i++) {
      final long value = vector.getLong(i);
      final long delta = value - last;
      final long deltaOfDelta = delta - lastDelta;
      writeDeltaOfDelta(writer, deltaOfDelta);
      last = value;
      lastDelta = delta;
    }
    return writer.toByteArray();
  }

  private static void writeDeltaOfDelta(final BitWriter writer, final long deltaOfDelta) {
    if (deltaOfDelta == 0) {
      writer.write(0, 1);
      return;
    }
    for (int i = 0; i < WIDTHS.length; i++) {
      final int width = WIDTHS[i];
      final long bound = 1L << (width - 1);
      if (deltaOfDelta >= -bound && deltaOfDelta < bound) {
        // i + 1 ones followed by a zero
        writer.write((1L << (i + 2)) - 2, i + 2);
        writer.write(deltaOfDelta + bound, width);
        return;
      }
    }
    writer.write(0b11111, 5);
    writer.write(deltaOfDelta, 64);
  }

  @Override
  public ColumnVector decode(final String column,
                             final byte[] block,
                             final int offset,
                             final int length,
                             final int rows,
                             final RoaringBitmap nulls) {
    final long[] values = new long[rows];
    if (rows > 0) {
      final BitReader reader = new BitReader(block, offset, length);
      long last = reader.read(64);
      long lastDelta = 0;
      values[0] = last;
      for (int i = 1; i < rows; i++) {
        final long deltaOfDelta = readDeltaOfDelta(reader);
        lastDelta += deltaOfDelta;
        last += lastDelta;
        values[i] = last;
      }
    }
    return ColumnVector.ofLongs(column, type, values, nulls);
  }

  private static long readDeltaOfDelta(final BitReader reader) {
    for (int i = 0; i < WIDTHS.length; i++) {
      if (!reader.readBit()) {
        if (i == 0) {
          return 0;
        }
        final int width = WIDTHS[i - 1];
        return reader.read(width) - (1L << (width - 1));
      }
    }
    // four ones read, the next bit picks 32 bit or raw
    if (!reader.readBit()) {
      return reader.read(32) - (1L << 31);
    }
    return reader.read(64);
  }
}
