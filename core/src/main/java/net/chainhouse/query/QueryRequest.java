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

import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.rollup.aggregate.AggregateSpec;
import net.chainhouse.scan.CancellationToken;
import net.chainhouse.scan.OrderBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grouped aggregation over one table: filters, an optional time range,
 * group keys, aggregates, a having clause, an order over output names and a
 * limit.
 */
public final class QueryRequest {

  private final String table;
  private final Predicate primary;
  private final Predicate secondary;
  private final Long fromTime;
  private final Long toTime;
  private final List<GroupKey> groupKeys;
  private final List<AggregateSpec> aggregates;
  private final Having having;
  private final List<OrderBy> orderBy;
  private final int limit;
  private final List<LookupJoin> joins;
  private final QuerySource source;
  private final String rollup;
  private final CancellationToken cancellation;

  private QueryRequest(final Builder builder) {
    this.table = builder.table;
    this.primary = builder.primary;
    this.secondary = builder.secondary;
    this.fromTime = builder.fromTime;
    this.toTime = builder.toTime;
    this.groupKeys = Collections.unmodifiableList(new ArrayList<>(builder.groupKeys));
    this.aggregates = Collections.unmodifiableList(new ArrayList<>(builder.aggregates));
    this.having = builder.having;
    this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
    this.limit = builder.limit;
    this.joins = Collections.unmodifiableList(new ArrayList<>(builder.joins));
    this.source = builder.source;
    this.rollup = builder.rollup;
    this.cancellation = builder.cancellation;
    if (aggregates.isEmpty() && groupKeys.isEmpty()) {
      throw new IllegalArgumentException("Query on " + table + " has no group keys and no aggregates");
    }
    if (source == QuerySource.ROLLUP && rollup == null) {
      throw new IllegalArgumentException("A rollup query needs the rollup name");
    }
  }

  public static Builder newBuilder(final String table) {
    return new Builder(table);
  }

  public String table() {
    return table;
  }

  public Predicate primary() {
    return primary;
  }

  public Predicate secondary() {
    return secondary;
  }

  public Long fromTime() {
    return fromTime;
  }

  public Long toTime() {
    return toTime;
  }

  public List<GroupKey> groupKeys() {
    return groupKeys;
  }

  public List<AggregateSpec> aggregates() {
    return aggregates;
  }

  public Having having() {
    return having;
  }

  public List<OrderBy> orderBy() {
    return orderBy;
  }

  /** Zero for no limit. */
  public int limit() {
    return limit;
  }

  public List<LookupJoin> joins() {
    return joins;
  }

  public QuerySource source() {
    return source;
  }

  /** The rollup to read, null to let the executor pick one. */
  public String rollup() {
    return rollup;
  }

  public CancellationToken cancellation() {
    return cancellation;
  }

  @Override
  public String toString() {
    return "QueryRequest{table=" + table + ", primary=" + primary + ", secondary=" + secondary
        + ", from=" + fromTime + ", to=" + toTime + ", groupKeys=" + groupKeys
        + ", aggregates=" + aggregates + ", orderBy=" + orderBy + ", limit=" + limit
        + ", joins=" + joins + ", source=" + source + (rollup == null ? "" : ":" + rollup) + "}";
  }

  public static class Builder {
    private final String table;
    private Predicate primary = Predicates.all();
    private Predicate secondary = Predicates.all();
    private Long fromTime;
    private Long toTime;
    private List<GroupKey> groupKeys = new ArrayList<>();
    private List<AggregateSpec> aggregates = new ArrayList<>();
    private Having having = Having.NONE;
    private List<OrderBy> orderBy = new ArrayList<>();
    private int limit;
    private final List<LookupJoin> joins = new ArrayList<>();
    private QuerySource source = QuerySource.AUTO;
    private String rollup;
    private CancellationToken cancellation = CancellationToken.NONE;

    private Builder(final String table) {
      this.table = Objects.requireNonNull(table, "table");
    }

    public Builder primary(final Predicate primary) {
      this.primary = Objects.requireNonNull(primary, "primary");
      return this;
    }

    public Builder secondary(final Predicate secondary) {
      this.secondary = Objects.requireNonNull(secondary, "secondary");
      return this;
    }

    /** Restricts the query to events in {@code [fromTime, toTime)}. Either end may be null. */
    public Builder timeRange(final Long fromTime, final Long toTime) {
      this.fromTime = fromTime;
      this.toTime = toTime;
      return this;
    }

    public Builder groupBy(final GroupKey... keys) {
      this.groupKeys = new ArrayList<>(Arrays.asList(keys));
      return this;
    }

    public Builder aggregate(final AggregateSpec... specs) {
      this.aggregates = new ArrayList<>(Arrays.asList(specs));
      return this;
    }

    public Builder having(final Having having) {
      this.having = Objects.requireNonNull(having, "having");
      return this;
    }

    public Builder orderBy(final OrderBy... orderBy) {
      this.orderBy = new ArrayList<>(Arrays.asList(orderBy));
      return this;
    }

    public Builder limit(final int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("Negative limit " + limit);
      }
      this.limit = limit;
      return this;
    }

    public Builder join(final LookupJoin join) {
      joins.add(Objects.requireNonNull(join, "join"));
      return this;
    }

    public Builder source(final QuerySource source) {
      this.source = Objects.requireNonNull(source, "source");
      return this;
    }

    /** Reads the named rollup. */
    public Builder fromRollup(final String rollup) {
      this.source = QuerySource.ROLLUP;
      this.rollup = Objects.requireNonNull(rollup, "rollup");
      return this;
    }

    public Builder cancellation(final CancellationToken cancellation) {
      this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
      return this;
    }

    public QueryRequest build() {
      return new QueryRequest(this);
    }
  }
}
