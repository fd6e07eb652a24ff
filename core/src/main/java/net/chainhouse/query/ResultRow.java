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

package net.chainhouse.query;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;

/** One output row of an aggregation, values keyed by group key and aggregate name. */
public final class ResultRow {

  private final Map<String, Object> values;
  private final long firstSeen;

  ResultRow(final Map<String, Object> values, final long firstSeen) {
    this.values = Collections.unmodifiableMap(values);
    this.firstSeen = firstSeen;
  }

  public Object get(final String name) {
    return values.get(name);
  }

  public Long getLong(final String name) {
    final Object value = values.get(name);
    return value == null ? null : ((Number) value).longValue();
  }

  public Double getDouble(final String name) {
    final Object value = values.get(name);
    return value == null ? null : ((Number) value).doubleValue();
  }

  public BigDecimal getDecimal(final String name) {
    final Object value = values.get(name);
    if (value == null || value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Double) {
      return BigDecimal.valueOf((Double) value);
    }
    return BigDecimal.valueOf(((Number) value).longValue());
  }

  public String getString(final String name) {
    return (String) values.get(name);
  }

  public Map<String, Object> values() {
    return values;
  }

  /**
   * Scan ordinal of the group's first row, or the index of its first rollup
   * bucket. Breaks ties of the requested order.
   */
  public long firstSeen() {
    return firstSeen;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ResultRow)) {
      return false;
    }
    return values.equals(((ResultRow) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
