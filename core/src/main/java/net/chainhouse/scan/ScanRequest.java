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

import net.chainhouse.index.AccessPattern;
import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What to read from a table. The primary filter is applied first on its
 * columns alone; the remaining columns are read only for granules with
 * surviving rows.
 */
public final class ScanRequest {

  private final String table;
  private final Predicate primary;
  private final Predicate secondary;
  private final Long fromTime;
  private final Long toTime;
  private final List<String> projection;
  private final List<OrderBy> orderBy;
  private final int limit;
  private final AccessPattern accessPattern;
  private final CancellationToken cancellation;
  private final boolean allowPartialResults;

  private ScanRequest(final Builder builder) {
    this.table = Objects.requireNonNull(builder.table, "table");
    this.primary = builder.primary;
    this.secondary = builder.secondary;
    this.fromTime = builder.fromTime;
    this.toTime = builder.toTime;
    this.projection = Collections.unmodifiableList(new ArrayList<>(builder.projection));
    this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
    this.limit = builder.limit;
    this.accessPattern = builder.accessPattern;
    this.cancellation = builder.cancellation;
    this.allowPartialResults = builder.allowPartialResults;
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

  /** @return the primary filter combined with the time range, if any. */
  public Predicate effectivePrimary(final String timeColumn) {
    if (fromTime == null && toTime == null) {
      return primary;
    }
    final Predicate range;
    if (fromTime != null && toTime != null) {
      range = Predicates.between(timeColumn, fromTime, toTime);
    } else if (fromTime != null) {
      range = Predicates.gte(timeColumn, fromTime);
    } else {
      range = Predicates.lt(timeColumn, toTime);
    }
    return Predicates.and(range, primary);
  }

  public Long fromTime() {
    return fromTime;
  }

  public Long toTime() {
    return toTime;
  }

  /** @return the columns to return; empty means every column. */
  public List<String> projection() {
    return projection;
  }

  public List<OrderBy> orderBy() {
    return orderBy;
  }

  /** @return the row limit or 0 for none. */
  public int limit() {
    return limit;
  }

  public AccessPattern accessPattern() {
    return accessPattern;
  }

  public CancellationToken cancellation() {
    return cancellation;
  }

  public boolean allowPartialResults() {
    return allowPartialResults;
  }

  public Builder toBuilder() {
    final Builder builder = new Builder(table);
    builder.primary = primary;
    builder.secondary = secondary;
    builder.fromTime = fromTime;
    builder.toTime = toTime;
    builder.projection = new ArrayList<>(projection);
    builder.orderBy = new ArrayList<>(orderBy);
    builder.limit = limit;
    builder.accessPattern = accessPattern;
    builder.cancellation = cancellation;
    builder.allowPartialResults = allowPartialResults;
    return builder;
  }

  @Override
  public String toString() {
    return "ScanRequest{" + table + " primary=" + primary + " secondary=" + secondary
        + " time=[" + fromTime + ", " + toTime + ") projection=" + projection
        + " orderBy=" + orderBy + " limit=" + limit + " " + accessPattern + "}";
  }

  public static class Builder {
    private final String table;
    private Predicate primary = Predicates.all();
    private Predicate secondary = Predicates.all();
    private Long fromTime;
    private Long toTime;
    private List<String> projection = new ArrayList<>();
    private List<OrderBy> orderBy = new ArrayList<>();
    private int limit;
    private AccessPattern accessPattern = AccessPattern.ASCENDING;
    private CancellationToken cancellation = CancellationToken.NONE;
    private boolean allowPartialResults;

    private Builder(final String table) {
      this.table = table;
    }

    public Builder primary(final Predicate primary) {
      this.primary = Objects.requireNonNull(primary, "primary");
      return this;
    }

    public Builder secondary(final Predicate secondary) {
      this.secondary = Objects.requireNonNull(secondary, "secondary");
      return this;
    }

    /** Restricts the scan to events in {@code [fromTime, toTime)}. Either end may be null. */
    public Builder timeRange(final Long fromTime, final Long toTime) {
      this.fromTime = fromTime;
      this.toTime = toTime;
      return this;
    }

    public Builder project(final String... columns) {
      this.projection = new ArrayList<>(Arrays.asList(columns));
      return this;
    }

    public Builder project(final List<String> columns) {
      this.projection = new ArrayList<>(columns);
      return this;
    }

    public Builder orderBy(final OrderBy... orderBy) {
      this.orderBy = new ArrayList<>(Arrays.asList(orderBy));
      return this;
    }

    public Builder orderBy(final List<OrderBy> orderBy) {
      this.orderBy = new ArrayList<>(orderBy);
      return this;
    }

    public Builder limit(final int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("Negative limit " + limit);
      }
      this.limit = limit;
      return this;
    }

    public Builder accessPattern(final AccessPattern accessPattern) {
      this.accessPattern = Objects.requireNonNull(accessPattern, "accessPattern");
      return this;
    }

    public Builder cancellation(final CancellationToken cancellation) {
      this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
      return this;
    }

    public Builder allowPartialResults(final boolean allowPartialResults) {
      this.allowPartialResults = allowPartialResults;
      return this;
    }

    public ScanRequest build() {
      return new ScanRequest(this);
    }
  }
}
