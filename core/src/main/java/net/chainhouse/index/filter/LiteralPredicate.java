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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.ColumnVector;
import net.chainhouse.index.ColumnStats;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Equality or set membership, {@code column IN (values)}. With
 * {@link Predicate.Operator#NOT} it becomes {@code column NOT IN (values)}.
 * Null rows match neither form.
 */
public class LiteralPredicate extends Predicate {

  private final String column;
  private final List<Object> values;
  private final Operator operator;

  private transient volatile Coerced coerced;

  @JsonCreator
  public LiteralPredicate(@JsonProperty("column") final String column,
                          @JsonProperty("values") final List<Object> values,
                          @JsonProperty("operator") final Operator operator) {
    this.column = Objects.requireNonNull(column, "column");
    if (values == null || values.isEmpty()) {
      throw new IllegalArgumentException("Literal filter on " + column + " needs values");
    }
    for (Object value : values) {
      if (value == null) {
        throw new IllegalArgumentException("Literal filter on " + column + " has a null value");
      }
    }
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.operator = operator == null ? Operator.OR : operator;
    if (this.operator == Operator.AND) {
      throw new IllegalArgumentException("Literal filters support OR (IN) and NOT (NOT IN)");
    }
  }

  @JsonProperty("column")
  public String getColumn() {
    return column;
  }

  @JsonProperty("values")
  public List<Object> getValues() {
    return values;
  }

  @JsonProperty("operator")
  public Operator getOperator() {
    return operator;
  }

  @JsonIgnore
  public boolean isNotFilter() {
    return operator == Operator.NOT;
  }

  @Override
  public Set<String> columns() {
    return Collections.singleton(column);
  }

  private Set<Object> coerced(final ColumnType type) {
    Coerced current = coerced;
    if (current == null || current.type != type) {
      final Set<Object> set = new HashSet<>(values.size());
      for (Object value : values) {
        set.add(type.coerce(value));
      }
      current = new Coerced(type, set);
      coerced = current;
    }
    return current.values;
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
    final Set<Object> set = coerced(columnStats.type());
    if (isNotFilter()) {
      return !allValuesIn(columnStats, set);
    }
    for (Object value : set) {
      if (columnStats.mayContain(value)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean mustMatch(final Map<String, ColumnStats> stats) {
    final ColumnStats columnStats = stats.get(column);
    if (columnStats == null || columnStats.nullCount() > 0 || columnStats.min() == null) {
      return false;
    }
    final Set<Object> set = coerced(columnStats.type());
    if (isNotFilter()) {
      for (Object value : set) {
        if (columnStats.mayContain(value)) {
          return false;
        }
      }
      return true;
    }
    return allValuesIn(columnStats, set);
  }

  /** @return true if the stats prove every non-null value is in the set. */
  private static boolean allValuesIn(final ColumnStats stats, final Set<Object> set) {
    if (stats.values() != null) {
      return set.containsAll(stats.values());
    }
    return stats.min().equals(stats.max()) && set.contains(stats.min());
  }

  @Override
  public RoaringBitmap evaluate(final ColumnBlockSet block, final RoaringBitmap candidates) {
    final ColumnVector vector = block.vector(column);
    final Set<Object> set = coerced(vector.type());
    final boolean not = isNotFilter();
    final RoaringBitmap result = new RoaringBitmap();
    candidates.forEach((int row) -> {
      final Object value = vector.get(row);
      if (value != null && set.contains(value) != not) {
        result.add(row);
      }
    });
    return result;
  }

  @Override
  public boolean test(final ColumnBlockSet block, final int row) {
    final ColumnVector vector = block.vector(column);
    final Object value = vector.get(row);
    return value != null && coerced(vector.type()).contains(value) != isNotFilter();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LiteralPredicate)) {
      return false;
    }
    final LiteralPredicate other = (LiteralPredicate) o;
    return column.equals(other.column)
        && operator == other.operator
        && normalized().equals(other.normalized());
  }

  private Set<Object> normalized() {
    final Set<Object> set = new HashSet<>();
    for (Object value : values) {
      set.add(RangePredicate.normalize(value));
    }
    return set;
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, operator, normalized());
  }

  @Override
  public String toString() {
    return column + (isNotFilter() ? " NOT IN " : " IN ") + values;
  }

  /** The values coerced to one column type, published as a unit. */
  private static final class Coerced {

    private final ColumnType type;
    private final Set<Object> values;

    private Coerced(final ColumnType type, final Set<Object> values) {
      this.type = type;
      this.values = Collections.unmodifiableSet(values);
    }
  }
}
