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

import net.chainhouse.rollup.BucketGranularity;

import java.util.Objects;

import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;

/**
 * A GROUP BY expression: a column value, the start of the time bucket
 * holding a timestamp, or the hour of day of a timestamp.
 */
public final class GroupKey {

  private static final long DAY = DAYS.toMillis(1);
  private static final long HOUR = HOURS.toMillis(1);

  public enum Kind {
    COLUMN,
    TIME_BUCKET,
    HOUR_OF_DAY
  }

  private final Kind kind;
  private final String column;
  private final BucketGranularity granularity;
  private final String alias;

  private GroupKey(final Kind kind,
                   final String column,
                   final BucketGranularity granularity,
                   final String alias) {
    this.kind = kind;
    this.column = Objects.requireNonNull(column, "column");
    this.granularity = granularity;
    this.alias = alias;
  }

  public static GroupKey column(final String column) {
    return new GroupKey(Kind.COLUMN, column, null, null);
  }

  public static GroupKey timeBucket(final String column, final BucketGranularity granularity) {
    return new GroupKey(Kind.TIME_BUCKET, column, Objects.requireNonNull(granularity), null);
  }

  public static GroupKey hourOfDay(final String column) {
    return new GroupKey(Kind.HOUR_OF_DAY, column, null, null);
  }

  public GroupKey as(final String alias) {
    return new GroupKey(kind, column, granularity, alias);
  }

  public Kind kind() {
    return kind;
  }

  public String column() {
    return column;
  }

  public BucketGranularity granularity() {
    return granularity;
  }

  public String name() {
    if (alias != null) {
      return alias;
    }
    switch (kind) {
      case TIME_BUCKET:
        return function(granularity) + "(" + column + ")";
      case HOUR_OF_DAY:
        return "toHour(" + column + ")";
      default:
        return column;
    }
  }

  private static String function(final BucketGranularity granularity) {
    switch (granularity) {
      case _1_MIN:
        return "toStartOfMinute";
      case _5_MIN:
        return "toStartOfFiveMinutes";
      case _15_MIN:
        return "toStartOfFifteenMinutes";
      case _1_HR:
        return "toStartOfHour";
      default:
        return "toStartOfDay";
    }
  }

  /** @return the key for a column value, null for a null value. */
  public Object apply(final Object value) {
    if (value == null || kind == Kind.COLUMN) {
      return value;
    }
    final long time = ((Number) value).longValue();
    if (kind == Kind.TIME_BUCKET) {
      return granularity.bucketStart(time);
    }
    return Math.floorMod(time, DAY) / HOUR;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    final GroupKey other = (GroupKey) o;
    return kind == other.kind
        && column.equals(other.column)
        && granularity == other.granularity
        && Objects.equals(alias, other.alias);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, column, granularity, alias);
  }

  @Override
  public String toString() {
    return name();
  }
}
