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

package net.chainhouse.index.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.ColumnVector;
import net.chainhouse.index.ColumnStats;
import org.roaringbitmap.RoaringBitmap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@code lower <(=) column <(=) upper} where either bound may be open.
 */
public class RangePredicate extends Predicate {

  private static final BigDecimal MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE);
  private static final BigDecimal BEYOND_MIN = MIN.subtract(BigDecimal.ONE);
  private static final BigDecimal BEYOND_MAX = MAX.add(BigDecimal.ONE);

  private final String column;
  private final Object lower;
  private final boolean lowerInclusive;
  private final Object upper;
  private final boolean upperInclusive;
  private volatile LongRange longRange;

  @JsonCreator
  public RangePredicate(@JsonProperty("column") final String column,
                        @JsonProperty("lower") final Object lower,
                        @JsonProperty("lowerInclusive") final boolean lowerInclusive,
                        @JsonProperty("upper") final Object upper,
                        @JsonProperty("upperInclusive") final boolean upperInclusive) {
    this.column = Objects.requireNonNull(column, "column");
    if (lower == null && upper == null) {
      throw new IllegalArgumentException("Range on " + column + " needs at least one bound");
    }
    this.lower = lower;
    this.lowerInclusive = lowerInclusive;
    this.upper = upper;
    this.upperInclusive = upperInclusive;
  }

  @JsonProperty("column")
  public String getColumn() {
    return column;
  }

  @JsonProperty("lower")
  public Object getLower() {
    return lower;
  }

  @JsonProperty("lowerInclusive")
  public boolean isLowerInclusive() {
    return lowerInclusive;
  }

  @JsonProperty("upper")
  public Object getUpper() {
    return upper;
  }

  @JsonProperty("upperInclusive")
  public boolean isUpperInclusive() {
    return upperInclusive;
  }

  @Override
  public Set<String> columns() {
    return Collections.singleton(column);
  }

  @Override
  public boolean mightMatch(final Map<String, ColumnStats> stats) {
    final ColumnStats columnStats = stats.get(column);
    if (columnStats == null) {
      return true;
    }
    if (columnStats.min() == null) {
      return false;
    }
    final ColumnType type = columnStats.type();
    if (type.isIntegral()) {
      final LongRange range = longRange(type);
      return !range.isEmpty()
          && (Long) columnStats.max() >= range.lo && (Long) columnStats.min() <= range.hi;
    }
    return aboveLower(type, columnStats.max()) && belowUpper(type, columnStats.min());
  }

  @Override
  public boolean mustMatch(final Map<String, ColumnStats> stats) {
    final ColumnStats columnStats = stats.get(column);
    if (columnStats == null || columnStats.nullCount() > 0 || columnStats.min() == null) {
      return false;
    }
    final ColumnType type = columnStats.type();
    if (type.isIntegral()) {
      final LongRange range = longRange(type);
      return range.contains((Long) columnStats.min()) && range.contains((Long) columnStats.max());
    }
    return aboveLower(type, columnStats.min()) && belowUpper(type, columnStats.max());
  }

  @Override
  public RoaringBitmap evaluate(final ColumnBlockSet block, final RoaringBitmap candidates) {
    final ColumnVector vector = block.vector(column);
    final RoaringBitmap result = new RoaringBitmap();
    if (vector.type().isIntegral()) {
      final LongRange range = longRange(vector.type());
      if (range.isEmpty()) {
        return result;
      }
      candidates.forEach((int row) -> {
        if (!vector.isNull(row) && range.contains(vector.getLong(row))) {
          result.add(row);
        }
      });
      return result;
    }
    candidates.forEach((int row) -> {
      if (!vector.isNull(row) && matches(vector.type(), vector.get(row))) {
        result.add(row);
      }
    });
    return result;
  }

  @Override
  public boolean test(final ColumnBlockSet block, final int row) {
    final ColumnVector vector = block.vector(column);
    if (vector.isNull(row)) {
      return false;
    }
    if (vector.type().isIntegral()) {
      return longRange(vector.type()).contains(vector.getLong(row));
    }
    return matches(vector.type(), vector.get(row));
  }

  private boolean matches(final ColumnType type, final Object value) {
    return aboveLower(type, value) && belowUpper(type, value);
  }

  private boolean aboveLower(final ColumnType type, final Object value) {
    if (lower == null) {
      return true;
    }
    final int cmp = compareToBound(type, value, lower);
    return lowerInclusive ? cmp >= 0 : cmp > 0;
  }

  private boolean belowUpper(final ColumnType type, final Object value) {
    if (upper == null) {
      return true;
    }
    final int cmp = compareToBound(type, value, upper);
    return upperInclusive ? cmp <= 0 : cmp < 0;
  }

  /** Compares a non-integral column value with a bound. */
  private static int compareToBound(final ColumnType type, final Object value, final Object bound) {
    if (type == ColumnType.DOUBLE && isExactNumber(bound)) {
      // a long bound may not survive the conversion to double
      final double d = (Double) value;
      if (Double.isNaN(d)) {
        return 1;
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? 1 : -1;
      }
      return new BigDecimal(d).compareTo(exact(type, bound));
    }
    return type.compare(value, type.coerce(bound));
  }

  /**
   * @return the bounds of an integral column as an inclusive long range,
   * rounding fractional bounds inward and saturating at the long limits.
   */
  private LongRange longRange(final ColumnType type) {
    LongRange range = longRange;
    if (range == null) {
      final BigDecimal lo = lower == null ? MIN : inclusiveBound(type, lower, lowerInclusive, true);
      final BigDecimal hi = upper == null ? MAX : inclusiveBound(type, upper, upperInclusive, false);
      range = lo == null || hi == null ? LongRange.EMPTY : LongRange.of(lo, hi);
      longRange = range;
    }
    return range;
  }

  /** @return the bound rounded to an integer, or null if no value can satisfy it. */
  private static BigDecimal inclusiveBound(final ColumnType type,
                                           final Object bound,
                                           final boolean inclusive,
                                           final boolean isLower) {
    final BigDecimal exact;
    if (bound instanceof Double || bound instanceof Float) {
      final double d = ((Number) bound).doubleValue();
      if (Double.isNaN(d)) {
        return null;
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? BEYOND_MAX : BEYOND_MIN;
      }
      exact = new BigDecimal(d);
    } else {
      exact = exact(type, bound);
    }
    BigDecimal rounded = exact.setScale(0, isLower ? RoundingMode.CEILING : RoundingMode.FLOOR);
    if (!inclusive && rounded.compareTo(exact) == 0) {
      rounded = isLower ? rounded.add(BigDecimal.ONE) : rounded.subtract(BigDecimal.ONE);
    }
    return rounded;
  }

  private static boolean isExactNumber(final Object bound) {
    return bound instanceof Long || bound instanceof Integer || bound instanceof Short
        || bound instanceof Byte || bound instanceof BigInteger || bound instanceof BigDecimal;
  }

  private static BigDecimal exact(final ColumnType type, final Object bound) {
    if (bound instanceof BigDecimal) {
      return (BigDecimal) bound;
    }
    if (bound instanceof BigInteger) {
      return new BigDecimal((BigInteger) bound);
    }
    if (isExactNumber(bound)) {
      return BigDecimal.valueOf(((Number) bound).longValue());
    }
    return BigDecimal.valueOf((Long) type.coerce(bound));
  }

  /** Inclusive range of long values, empty when {@code lo > hi}. */
  private static final class LongRange {
    private static final LongRange EMPTY = new LongRange(1, 0);

    private final long lo;
    private final long hi;

    private LongRange(final long lo, final long hi) {
      this.lo = lo;
      this.hi = hi;
    }

    static LongRange of(final BigDecimal from, final BigDecimal to) {
      if (from.compareTo(MAX) > 0 || to.compareTo(MIN) < 0 || from.compareTo(to) > 0) {
        return EMPTY;
      }
      return new LongRange(from.max(MIN).longValueExact(), to.min(MAX).longValueExact());
    }

    boolean isEmpty() {
      return lo > hi;
    }

    boolean contains(final long value) {
      return value >= lo && value <= hi;
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RangePredicate)) {
      return false;
    }
    final RangePredicate other = (RangePredicate) o;
    return lowerInclusive == other.lowerInclusive
        && upperInclusive == other.upperInclusive
        && column.equals(other.column)
        && Objects.equals(normalize(lower), normalize(other.lower))
        && Objects.equals(normalize(upper), normalize(other.upper));
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, normalize(lower), normalize(upper));
  }

  static Object normalize(final Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    return value;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    if (lower != null) {
      buf.append(lower).append(lowerInclusive ? " <= " : " < ");
    }
    buf.append(column);
    if (upper != null) {
      buf.append(upperInclusive ? " <= " : " < ").append(upper);
    }
    return buf.toString();
  }
}
