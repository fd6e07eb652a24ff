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

package net.chainhouse.rollup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import net.chainhouse.core.Schema;
import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.rollup.aggregate.AggregateSpec;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declares a rollup: the rows of {@code table} matching {@code filter},
 * grouped by time bucket and dimension values, summarised by mergeable
 * aggregates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RollupDefinition {

  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

  private final String name;
  private final String table;
  private final BucketGranularity granularity;
  private final List<String> dimensions;
  private final List<AggregateSpec> aggregates;
  private final Predicate filter;

  @JsonCreator
  public RollupDefinition(@JsonProperty("name") final String name,
                          @JsonProperty("table") final String table,
                          @JsonProperty("granularity") final BucketGranularity granularity,
                          @JsonProperty("dimensions") final List<String> dimensions,
                          @JsonProperty("aggregates") final List<AggregateSpec> aggregates,
                          @JsonProperty("filter") final Predicate filter) {
    if (name == null || !NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid rollup name: " + name);
    }
    this.name = name;
    this.table = Objects.requireNonNull(table, "table");
    this.granularity = Objects.requireNonNull(granularity, "granularity");
    this.dimensions = dimensions == null ? ImmutableList.of() : ImmutableList.copyOf(dimensions);
    if (aggregates == null || aggregates.isEmpty()) {
      throw new IllegalArgumentException("Rollup " + name + " has no aggregates");
    }
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.filter = filter == null ? Predicates.all() : filter;
    final Set<String> names = new HashSet<>();
    for (AggregateSpec spec : this.aggregates) {
      if (!names.add(spec.name())) {
        throw new IllegalArgumentException("Duplicate aggregate " + spec.name() + " in " + name);
      }
    }
  }

  public static Builder newBuilder(final String name, final String table) {
    return new Builder(name, table);
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  @JsonProperty("table")
  public String table() {
    return table;
  }

  @JsonProperty("granularity")
  public BucketGranularity granularity() {
    return granularity;
  }

  @JsonProperty("dimensions")
  public List<String> dimensions() {
    return dimensions;
  }

  @JsonProperty("aggregates")
  public List<AggregateSpec> aggregates() {
    return aggregates;
  }

  @JsonProperty("filter")
  public Predicate filter() {
    return filter;
  }

  /** @throws IllegalArgumentException if a column is unknown or of the wrong type. */
  public void validate(final Schema schema) {
    for (String dimension : dimensions) {
      schema.typeOf(dimension);
    }
    for (String column : filter.columns()) {
      schema.typeOf(column);
    }
    for (AggregateSpec spec : aggregates) {
      spec.validate(schema);
    }
  }

  /** @return the columns a fold reads besides the filter's. */
  public Set<String> columns(final Schema schema) {
    final Set<String> columns = new LinkedHashSet<>();
    columns.add(schema.timeColumn());
    columns.addAll(dimensions);
    for (AggregateSpec spec : aggregates) {
      columns.addAll(spec.columns());
    }
    return columns;
  }

  /** @return the position of the aggregate computing the same value, or -1. */
  public int indexOf(final AggregateSpec spec) {
    for (int i = 0; i < aggregates.size(); i++) {
      if (aggregates.get(i).sameAggregate(spec)) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RollupDefinition)) {
      return false;
    }
    final RollupDefinition other = (RollupDefinition) o;
    return name.equals(other.name)
        && table.equals(other.table)
        && granularity == other.granularity
        && dimensions.equals(other.dimensions)
        && aggregates.equals(other.aggregates)
        && filter.equals(other.filter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, table, granularity, dimensions, aggregates, filter);
  }

  @Override
  public String toString() {
    return "RollupDefinition{name=" + name + ", table=" + table + ", granularity=" + granularity
        + ", dimensions=" + dimensions + ", aggregates=" + aggregates + ", filter=" + filter + "}";
  }

  public static class Builder {
    private final String name;
    private final String table;
    private BucketGranularity granularity = BucketGranularity._1_HR;
    private List<String> dimensions = ImmutableList.of();
    private final ImmutableList.Builder<AggregateSpec> aggregates = ImmutableList.builder();
    private Predicate filter = Predicates.all();

    private Builder(final String name, final String table) {
      this.name = name;
      this.table = table;
    }

    public Builder granularity(final BucketGranularity granularity) {
      this.granularity = granularity;
      return this;
    }

    public Builder dimensions(final String... dimensions) {
      this.dimensions = Arrays.asList(dimensions);
      return this;
    }

    public Builder aggregate(final AggregateSpec... specs) {
      aggregates.add(specs);
      return this;
    }

    public Builder filter(final Predicate filter) {
      this.filter = filter;
      return this;
    }

    public RollupDefinition build() {
      return new RollupDefinition(name, table, granularity, dimensions, aggregates.build(), filter);
    }
  }
}
