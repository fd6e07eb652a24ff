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

package net.chainhouse.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.ColumnType;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Min, max and null count of one column over a granule or a whole partition.
 * Low cardinality string columns also keep their exact value set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ColumnStats {

  private final ColumnType type;
  private final Object min;
  private final Object max;
  private final int rowCount;
  private final int nullCount;
  private final SortedSet<String> values;

  @JsonCreator
  public ColumnStats(@JsonProperty("type") final ColumnType type,
                     @JsonProperty("min") final Object min,
                     @JsonProperty("max") final Object max,
                     @JsonProperty("rowCount") final int rowCount,
                     @JsonProperty("nullCount") final int nullCount,
                     @JsonProperty("values") final Collection<String> values) {
    this.type = Objects.requireNonNull(type, "type");
    this.min = min == null ? null : type.coerce(min);
    this.max = max == null ? null : type.coerce(max);
    this.rowCount = rowCount;
    this.nullCount = nullCount;
    this.values = values == null ? null : Collections.unmodifiableSortedSet(new TreeSet<>(values));
  }

  public static Builder newBuilder(final ColumnType type, final int valueSetLimit) {
    return new Builder(type, valueSetLimit);
  }

  @JsonProperty("type")
  public ColumnType type() {
    return type;
  }

  /** @return the smallest non-null value or null if every row is null. */
  @JsonProperty("min")
  public Object min() {
    return min;
  }

  @JsonProperty("max")
  public Object max() {
    return max;
  }

  @JsonProperty("rowCount")
  public int rowCount() {
    return rowCount;
  }

  @JsonProperty("nullCount")
  public int nullCount() {
    return nullCount;
  }

  /** @return the exact set of non-null values or null when it was not kept. */
  @JsonProperty("values")
  public SortedSet<String> values() {
    return values;
  }

  @JsonIgnore
  public boolean allNull() {
    return nullCount == rowCount;
  }

  /**
   * @return false only when no row can hold {@code value}. The value must be
   * coerced to this column's type.
   */
  public boolean mayContain(final Object value) {
    if (min == null) {
      return false;
    }
    if (values != null) {
      return values.contains(value);
    }
    return type.compare(min, value) <= 0 && type.compare(max, value) >= 0;
  }

  /** Merges granule stats into partition stats. */
  public static ColumnStats merge(final Collection<ColumnStats> parts, final int valueSetLimit) {
    ColumnType type = null;
    Object min = null;
    Object max = null;
    int rows = 0;
    int nulls = 0;
    SortedSet<String> values = new TreeSet<>();
    for (ColumnStats part : parts) {
      type = part.type;
      rows += part.rowCount;
      nulls += part.nullCount;
      if (part.min != null) {
        if (min == null || type.compare(part.min, min) < 0) {
          min = part.min;
        }
        if (max == null || type.compare(part.max, max) > 0) {
          max = part.max;
        }
      }
      if (values != null) {
        if (part.values == null && !part.allNull()) {
          values = null;
        } else if (part.values != null) {
          values.addAll(part.values);
          if (values.size() > valueSetLimit) {
            values = null;
          }
        }
      }
    }
    if (type == null) {
      throw new IllegalArgumentException("Nothing to merge");
    }
    return new ColumnStats(type, min, max, rows, nulls,
        type == ColumnType.STRING ? values : null);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnStats)) {
      return false;
    }
    final ColumnStats other = (ColumnStats) o;
    return rowCount == other.rowCount
        && nullCount == other.nullCount
        && type == other.type
        && Objects.equals(min, other.min)
        && Objects.equals(max, other.max)
        && Objects.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, min, max, rowCount, nullCount);
  }

  @Override
  public String toString() {
    return "ColumnStats{" + type + " [" + min + ", " + max + "] rows=" + rowCount
        + " nulls=" + nullCount + (values == null ? "" : " values=" + values) + "}";
  }

  public static class Builder {
    private final ColumnType type;
    private final int valueSetLimit;
    private Object min;
    private Object max;
    private int rows;
    private int nulls;
    private SortedSet<String> values;

    private Builder(final ColumnType type, final int valueSetLimit) {
      this.type = type;
      this.valueSetLimit = valueSetLimit;
      this.values = type == ColumnType.STRING && valueSetLimit > 0 ? new TreeSet<>() : null;
    }

    /** Adds an already coerced value, null for a null row. */
    public Builder add(final Object value) {
      rows++;
      if (value == null) {
        nulls++;
        return this;
      }
      if (min == null || type.compare(value, min) < 0) {
        min = value;
      }
      if (max == null || type.compare(value, max) > 0) {
        max = value;
      }
      if (values != null) {
        values.add((String) value);
        if (values.size() > valueSetLimit) {
          values = null;
        }
      }
      return this;
    }

    public ColumnStats build() {
      return new ColumnStats(type, min, max, rows, nulls, values);
    }
  }
}
