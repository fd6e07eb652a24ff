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

package net.chainhouse.rollup.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.Schema;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.index.filter.Predicate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One aggregate of a query or rollup: a function over a column, optionally
 * restricted to the rows matching a condition ({@code sumIf}, {@code countIf}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AggregateSpec {

  private final AggregatorType type;
  private final String column;
  private final Double quantile;
  private final Predicate condition;
  private final String alias;

  @JsonCreator
  public AggregateSpec(@JsonProperty("type") final AggregatorType type,
                       @JsonProperty("column") final String column,
                       @JsonProperty("quantile") final Double quantile,
                       @JsonProperty("condition") final Predicate condition,
                       @JsonProperty("alias") final String alias) {
    this.type = Objects.requireNonNull(type, "type");
    if (type.requiresColumn() && column == null) {
      throw new IllegalArgumentException(type + " needs a column");
    }
    if (type == AggregatorType.quantile
        && (quantile == null || quantile < 0 || quantile > 1)) {
      throw new IllegalArgumentException("Quantile must be in [0, 1]: " + quantile);
    }
    this.column = column;
    this.quantile = type == AggregatorType.quantile ? quantile : null;
    this.condition = condition == null || condition.isMatchAll() ? null : condition;
    this.alias = alias;
  }

  /** Counts rows. */
  public static AggregateSpec count() {
    return new AggregateSpec(AggregatorType.count, null, null, null, null);
  }

  /** Counts non-null values of a column. */
  public static AggregateSpec count(final String column) {
    return new AggregateSpec(AggregatorType.count, column, null, null, null);
  }

  public static AggregateSpec sum(final String column) {
    return new AggregateSpec(AggregatorType.sum, column, null, null, null);
  }

  public static AggregateSpec min(final String column) {
    return new AggregateSpec(AggregatorType.min, column, null, null, null);
  }

  public static AggregateSpec max(final String column) {
    return new AggregateSpec(AggregatorType.max, column, null, null, null);
  }

  public static AggregateSpec avg(final String column) {
    return new AggregateSpec(AggregatorType.avg, column, null, null, null);
  }

  public static AggregateSpec quantile(final String column, final double q) {
    return new AggregateSpec(AggregatorType.quantile, column, q, null, null);
  }

  public static AggregateSpec uniq(final String column) {
    return new AggregateSpec(AggregatorType.uniq, column, null, null, null);
  }

  public AggregateSpec as(final String alias) {
    return new AggregateSpec(type, column, quantile, condition, alias);
  }

  public AggregateSpec when(final Predicate condition) {
    return new AggregateSpec(type, column, quantile, condition, alias);
  }

  @JsonProperty("type")
  public AggregatorType type() {
    return type;
  }

  @JsonProperty("column")
  public String column() {
    return column;
  }

  @JsonProperty("quantile")
  public Double quantile() {
    return quantile;
  }

  @JsonProperty("condition")
  public Predicate condition() {
    return condition;
  }

  @JsonProperty("alias")
  public String alias() {
    return alias;
  }

  /** @return the alias, or a name derived from the function and its arguments. */
  public String name() {
    if (alias != null) {
      return alias;
    }
    final StringBuilder buf = new StringBuilder(type.name());
    if (condition != null) {
      buf.append("If");
    }
    buf.append('(');
    if (column != null) {
      buf.append(column);
    }
    if (quantile != null) {
      buf.append(", ").append(quantile);
    }
    return buf.append(')').toString();
  }

  /** @return the columns read to evaluate this aggregate. */
  public Set<String> columns() {
    if (column == null && condition == null) {
      return Collections.emptySet();
    }
    final Set<String> columns = new LinkedHashSet<>();
    if (column != null) {
      columns.add(column);
    }
    if (condition != null) {
      columns.addAll(condition.columns());
    }
    return columns;
  }

  /** @throws IllegalArgumentException if the schema cannot feed this aggregate. */
  public void validate(final Schema schema) {
    if (column != null) {
      final ColumnType columnType = schema.typeOf(column);
      if (type.requiresNumeric() && !columnType.isNumeric()) {
        throw new IllegalArgumentException(name() + " needs a numeric column, "
            + column + " is " + columnType);
      }
    }
    if (condition != null) {
      for (String c : condition.columns()) {
        schema.typeOf(c);
      }
    }
  }

  /**
   * @param columnType type of the aggregated value, ignored for a row count.
   */
  public AggregateState newState(final ColumnType columnType) {
    return type.create(this, column == null ? null : columnType);
  }

  public boolean accepts(final ColumnBlockSet block, final int row) {
    return condition == null || condition.test(block, row);
  }

  /** @return the value to fold for a row, a non-null marker for a row count. */
  public Object input(final ColumnBlockSet block, final int row) {
    return column == null ? Boolean.TRUE : block.value(column, row);
  }

  /** @return true if both compute the same value, whatever their aliases. */
  public boolean sameAggregate(final AggregateSpec other) {
    return type == other.type
        && Objects.equals(column, other.column)
        && Objects.equals(quantile, other.quantile)
        && Objects.equals(condition, other.condition);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AggregateSpec)) {
      return false;
    }
    final AggregateSpec other = (AggregateSpec) o;
    return sameAggregate(other) && Objects.equals(alias, other.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, column, quantile, condition, alias);
  }

  @Override
  public String toString() {
    return name();
  }
}
