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

package net.chainhouse.core.data;

import net.chainhouse.core.ColumnType;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;

/**
 * Decoded values of one column over a contiguous row range. Null rows are
 * tracked in a bitmap and hold a placeholder in the value array.
 */
public final class ColumnVector {

  private final String name;
  private final ColumnType type;
  private final int size;
  private final long[] longs;
  private final double[] doubles;
  private final String[] strings;
  private final RoaringBitmap nulls;

  private ColumnVector(final String name,
                       final ColumnType type,
                       final int size,
                       final long[] longs,
                       final double[] doubles,
                       final String[] strings,
                       final RoaringBitmap nulls) {
    this.name = name;
    this.type = type;
    this.size = size;
    this.longs = longs;
    this.doubles = doubles;
    this.strings = strings;
    this.nulls = nulls == null ? new RoaringBitmap() : nulls;
  }

  public static ColumnVector ofLongs(final String name,
                                     final ColumnType type,
                                     final long[] values,
                                     final RoaringBitmap nulls) {
    if (!type.isIntegral()) {
      throw new IllegalArgumentException(type + " is not integral");
    }
    return new ColumnVector(name, type, values.length, values, null, null, nulls);
  }

  public static ColumnVector ofDoubles(final String name,
                                       final double[] values,
                                       final RoaringBitmap nulls) {
    return new ColumnVector(name, ColumnType.DOUBLE, values.length, null, values, null, nulls);
  }

  public static ColumnVector ofStrings(final String name,
                                       final String[] values,
                                       final RoaringBitmap nulls) {
    return new ColumnVector(name, ColumnType.STRING, values.length, null, null, values, nulls);
  }

  /**
   * Builds a vector from boxed, already coerced values where {@code null}
   * marks a null row.
   */
  public static ColumnVector fromValues(final String name,
                                        final ColumnType type,
                                        final Object[] values) {
    final RoaringBitmap nulls = new RoaringBitmap();
    switch (type) {
      case TIMESTAMP:
      case LONG:
        final long[] longs = new long[values.length];
        for (int i = 0; i < values.length; i++) {
          if (values[i] == null) {
            nulls.add(i);
          } else {
            longs[i] = (Long) values[i];
          }
        }
        return ofLongs(name, type, longs, nulls);
      case DOUBLE:
        final double[] doubles = new double[values.length];
        for (int i = 0; i < values.length; i++) {
          if (values[i] == null) {
            nulls.add(i);
          } else {
            doubles[i] = (Double) values[i];
          }
        }
        return ofDoubles(name, doubles, nulls);
      case STRING:
        final String[] strings = new String[values.length];
        for (int i = 0; i < values.length; i++) {
          if (values[i] == null) {
            nulls.add(i);
            strings[i] = "";
          } else {
            strings[i] = (String) values[i];
          }
        }
        return ofStrings(name, strings, nulls);
      default:
        throw new IllegalArgumentException("Unsupported type " + type);
    }
  }

  /** Concatenates vectors of the same column in order. */
  public static ColumnVector concat(final ColumnVector... parts) {
    if (parts.length == 1) {
      return parts[0];
    }
    final ColumnVector first = parts[0];
    int total = 0;
    for (ColumnVector part : parts) {
      total += part.size;
    }
    final RoaringBitmap nulls = new RoaringBitmap();
    int base = 0;
    switch (first.type) {
      case TIMESTAMP:
      case LONG:
        final long[] longs = new long[total];
        for (ColumnVector part : parts) {
          System.arraycopy(part.longs, 0, longs, base, part.size);
          addShifted(nulls, part.nulls, base);
          base += part.size;
        }
        return ofLongs(first.name, first.type, longs, nulls);
      case DOUBLE:
        final double[] doubles = new double[total];
        for (ColumnVector part : parts) {
          System.arraycopy(part.doubles, 0, doubles, base, part.size);
          addShifted(nulls, part.nulls, base);
          base += part.size;
        }
        return ofDoubles(first.name, doubles, nulls);
      default:
        final String[] strings = new String[total];
        for (ColumnVector part : parts) {
          System.arraycopy(part.strings, 0, strings, base, part.size);
          addShifted(nulls, part.nulls, base);
          base += part.size;
        }
        return ofStrings(first.name, strings, nulls);
    }
  }

  /** @return rows {@code [from, to)} of this vector as a new vector. */
  public ColumnVector slice(final int from, final int to) {
    if (from == 0 && to == size) {
      return this;
    }
    final RoaringBitmap sliced = new RoaringBitmap();
    nulls.forEach((int row) -> {
      if (row >= from && row < to) {
        sliced.add(row - from);
      }
    });
    switch (type) {
      case TIMESTAMP:
      case LONG:
        return ofLongs(name, type, Arrays.copyOfRange(longs, from, to), sliced);
      case DOUBLE:
        return ofDoubles(name, Arrays.copyOfRange(doubles, from, to), sliced);
      default:
        return ofStrings(name, Arrays.copyOfRange(strings, from, to), sliced);
    }
  }

  private static void addShifted(final RoaringBitmap target,
                                 final RoaringBitmap source,
                                 final int base) {
    source.forEach((int row) -> target.add(row + base));
  }

  public String name() {
    return name;
  }

  public ColumnType type() {
    return type;
  }

  public int size() {
    return size;
  }

  public RoaringBitmap nulls() {
    return nulls;
  }

  public boolean isNull(final int row) {
    return nulls.contains(row);
  }

  public long getLong(final int row) {
    return longs[row];
  }

  public double getDouble(final int row) {
    return type == ColumnType.DOUBLE ? doubles[row] : longs[row];
  }

  public String getString(final int row) {
    return strings[row];
  }

  /** @return the boxed value of the row or null. */
  public Object get(final int row) {
    if (nulls.contains(row)) {
      return null;
    }
    switch (type) {
      case TIMESTAMP:
      case LONG:
        return longs[row];
      case DOUBLE:
        return doubles[row];
      default:
        return strings[row];
    }
  }

  long[] longs() {
    return longs;
  }

  double[] doubles() {
    return doubles;
  }

  String[] strings() {
    return strings;
  }

  /** Approximate decoded footprint used for scan statistics. */
  public long sizeInBytes() {
    long bytes = nulls.serializedSizeInBytes();
    if (type == ColumnType.STRING) {
      for (String s : strings) {
        bytes += s.length();
      }
      return bytes;
    }
    return bytes + 8L * size;
  }
}
