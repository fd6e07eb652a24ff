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

import net.chainhouse.core.data.BitReader;
import net.chainhouse.core.data.BitWriter;
import net.chainhouse.core.data.ColumnVector;
import org.roaringbitmap.RoaringBitmap;

/**
 * XOR encoding of doubles against the previous value. Repeated values take a
 * single bit; small changes reuse the previous meaningful bit window.
 */
public class GorillaDoubleCodec implements ColumnCodec {

  private static final int LEADING_BITS = 7;
  private static final int LENGTH_BITS = 6;

  @Override
  public byte[] encode(final ColumnVector vector) {
    final int rows = vector.size();
    if (rows == 0) {
      return new byte[0];
    }
    final BitWriter writer = new BitWriter(Math.max(1, rows / 2));
    long previous = Double.doubleToRawLongBits(vector.getDouble(0));
    writer.write(previous, 64);
    int lastLeading = -1;
    int lastTrailing = 0;
    for (int i = 1; i < rows; i++) {
      final long current = Double.doubleToRawLongBits(vector.getDouble(i));
      final long xor = current ^ previous;
      if (xor == 0) {
        writer.write(0, 1);
      } else {
        final int leading = Long.numberOfLeadingZeros(xor);
        final int trailing = Long.numberOfTrailingZeros(xor);
        if (lastLeading >= 0 && leading >= lastLeading && trailing >= lastTrailing) {
          writer.write(0b10, 2);
          writer.write(xor >>> lastTrailing, 64 - lastLeading - lastTrailing);
        } else {
          final int meaningful = 64 - leading - trailing;
          writer.write(0b11, 2);
          writer.write(leading, LEADING_BITS);
          writer.write(meaningful - 1, LENGTH_BITS);
          writer.write(xor >>> trailing, meaningful);
          lastLeading = leading;
          lastTrailing = trailing;
        }
      }
      previous = current;
    }
    return writer.toByteArray();
  }

  @Override
  public ColumnVector decode(final String column,
                             final byte[] block,
                             final int offset,
                             final int length,
                             final int rows,
                             final RoaringBitmap nulls) {
    final double[] values = new double[rows];
    if (rows > 0) {
      final BitReader reader = new BitReader(block, offset, length);
      long previous = reader.read(64);
      values[0] = Double.longBitsToDouble(previous);
      int lastLeading = 0;
      int lastTrailing = 0;
      for (int i = 1; i < rows; i++) {
        if (reader.readBit()) {
          if (reader.readBit()) {
            lastLeading = (int) reader.read(LEADING_BITS);
            final int meaningful = (int) reader.read(LENGTH_BITS) + 1;
            lastTrailing = 64 - lastLeading - meaningful;
            if (lastTrailing < 0) {
              throw new IndexOutOfBoundsException("Invalid xor window " + lastLeading + "/" + meaningful);
            }
          }
          final long xor = reader.read(64 - lastLeading - lastTrailing) << lastTrailing;
          previous ^= xor;
        }
        values[i] = Double.longBitsToDouble(previous);
      }
    }
    return ColumnVector.ofDoubles(column, values, nulls);
  }
}
