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
import net.chainhouse.core.data.ColumnVector;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ColumnCodecsTest {

  private static Random random = new Random(42);

  @Test
  void longDeltaHandlesExtremeJumps() throws IOException {
    final Object[] values = {0L, Long.MAX_VALUE, Long.MIN_VALUE, -1L, 1L, null, 1L, 1L, 2L};
    final ColumnVector decoded = roundTrip(ColumnType.LONG, values);
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], decoded.get(i), "row " + i);
    }
  }

  @Test
  void steadyTimestampsCompressToAboutABitPerRow() throws IOException {
    final int rows = 8192;
    final Object[] values = new Object[rows];
    for (int i = 0; i < rows; i++) {
      values[i] = 1609459200000L + i * 12_000L;
    }
    final ColumnCodec codec = ColumnCodecs.forType(ColumnType.TIMESTAMP, 16);
    final byte[] encoded = codec.encode(ColumnVector.fromValues("t", ColumnType.TIMESTAMP, values));
    assertTrue(encoded.length < rows / 4, "encoded " + encoded.length + " bytes");
  }

  @Test
  void randomLongs() throws IOException {
    final Object[] values = new Object[1000];
    for (int i = 0; i < values.length; i++) {
      values[i] = random.nextInt(10) == 0 ? null : random.nextLong() >> random.nextInt(64);
    }
    final ColumnVector decoded = roundTrip(ColumnType.LONG, values);
    for (int i = 0; i < values.length; i++) {
      assertEquals(values[i], decoded.get(i));
    }
  }

  @Test
  void gorillaKeepsSpecialDoubles() throws IOException {
    final Object[] values = {1.5, 1.5, Double.NaN, -0.0, Double.POSITIVE_INFINITY,
        Double.NEGATIVE_INFINITY, Double.MIN_VALUE, null, 1e300, -1e-300};
    final ColumnVector decoded = roundTrip(ColumnType.DOUBLE, values);
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        assertNull(decoded.get(i));
      } else {
        assertEquals(Double.doubleToRawLongBits((Double) values[i]),
            Double.doubleToRawLongBits(decoded.getDouble(i)), "row " + i);
      }
    }
  }

  @Test
  void stringsUseDictionaryThenFallBack() throws IOException {
    final Object[] lowCardinality = new Object[100];
    final Object[] highCardinality = new Object[100];
    for (int i = 0; i < 100; i++) {
      lowCardinality[i] = i % 3 == 0 ? null : "pool-" + (i % 4);
      highCardinality[i] = "0x" + Integer.toHexString(i * 7919) + "é";
    }
    final ColumnVector low = roundTrip(ColumnType.STRING, lowCardinality);
    final ColumnVector high = roundTrip(ColumnType.STRING, highCardinality);
    for (int i = 0; i < 100; i++) {
      assertEquals(lowCardinality[i], low.get(i));
      assertEquals(highCardinality[i], high.get(i));
    }
  }

  @Test
  void emptyGranule() throws IOException {
    assertEquals(0, roundTrip(ColumnType.LONG, new Object[0]).size());
    assertEquals(0, roundTrip(ColumnType.DOUBLE, new Object[0]).size());
    assertEquals(0, roundTrip(ColumnType.STRING, new Object[0]).size());
  }

  private static ColumnVector roundTrip(final ColumnType type, final Object[] values)
      throws IOException {
    final ColumnVector vector = ColumnVector.fromValues("c", type, values);
    final ColumnCodec codec = ColumnCodecs.forType(type, 16);
    final byte[] encoded = codec.encode(vector);
    final byte[] padded = new byte[encoded.length + 3];
    System.arraycopy(encoded, 0, padded, 3, encoded.length);
    return codec.decode("c", padded, 3, encoded.length, values.length, vector.nulls());
  }
}
