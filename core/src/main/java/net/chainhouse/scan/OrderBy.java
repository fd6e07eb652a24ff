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

package net.chainhouse.scan;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;

/**
 * Sort key on a named value. Nulls sort last in both directions.
 */
public final class OrderBy {

  private final String column;
  private final boolean descending;

  private OrderBy(final String column, final boolean descending) {
    this.column = Objects.requireNonNull(column, "column");
    this.descending = descending;
  }

  public static OrderBy asc(final String column) {
    return new OrderBy(column, false);
  }

  public static OrderBy desc(final String column) {
    return new OrderBy(column, true);
  }

  public String column() {
    return column;
  }

  public boolean descending() {
    return descending;
  }

  /** @return a comparator on the value extracted by {@code getter}. */
  public <T> Comparator<T> comparator(final Function<T, Object> getter) {
    return (a, b) -> {
      final Object x = getter.apply(a);
      final Object y = getter.apply(b);
      if (x == null || y == null) {
        return x == null ? (y == null ? 0 : 1) : -1;
      }
      final int cmp = compareValues(x, y);
      return descending ? -cmp : cmp;
    };
  }

  /**
   * Compares two non-null values. Numbers compare exactly across types and
   * strings compare lexicographically.
   *
   * @throws IllegalArgumentException if the values are not both numbers or
   * both strings.
   */
  public static int compareValues(final Object x, final Object y) {
    if (x instanceof String && y instanceof String) {
      return ((String) x).compareTo((String) y);
    }
    if (x instanceof Number && y instanceof Number) {
      return compareNumbers((Number) x, (Number) y);
    }
    throw new IllegalArgumentException("Cannot compare " + x.getClass().getSimpleName()
        + " with " + y.getClass().getSimpleName());
  }

  private static int compareNumbers(final Number x, final Number y) {
    if (isIntegral(x) && isIntegral(y)) {
      return Long.compare(x.longValue(), y.longValue());
    }
    if (isFloating(x) && isFloating(y)) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    if (!isFinite(x) || !isFinite(y)) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    return toBigDecimal(x).compareTo(toBigDecimal(y));
  }

  private static boolean isIntegral(final Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  private static boolean isFloating(final Number n) {
    return n instanceof Double || n instanceof Float;
  }

  private static boolean isFinite(final Number n) {
    return !isFloating(n) || Double.isFinite(n.doubleValue());
  }

  private static BigDecimal toBigDecimal(final Number n) {
    if (n instanceof BigDecimal) {
      return (BigDecimal) n;
    }
    if (n instanceof BigInteger) {
      return new BigDecimal((BigInteger) n);
    }
    if (isFloating(n)) {
      return new BigDecimal(n.doubleValue());
    }
    if (isIntegral(n)) {
      return BigDecimal.valueOf(n.longValue());
    }
    return new BigDecimal(n.toString());
  }

  @Override
  public String toString() {
    return column + (descending ? " DESC" : " ASC");
  }
}
