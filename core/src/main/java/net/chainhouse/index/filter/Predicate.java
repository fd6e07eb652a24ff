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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.index.ColumnStats;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;
import java.util.Set;

/**
 * A row filter that can also be checked against column stats.
 *
 * <p>{@link #mightMatch(Map)} must never return false for stats of a block
 * holding a row that {@link #evaluate} would select, and
 * {@link #mustMatch(Map)} must never return true for a block holding a row it
 * would reject. Null values never satisfy a comparison.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MatchAllPredicate.class, name = "all"),
    @JsonSubTypes.Type(value = RangePredicate.class, name = "range"),
    @JsonSubTypes.Type(value = LiteralPredicate.class, name = "in"),
    @JsonSubTypes.Type(value = ChainPredicate.class, name = "chain")
})
public abstract class Predicate {

  /** @return the columns this predicate reads. */
  @JsonIgnore
  public abstract Set<String> columns();

  /**
   * @param stats column stats of a partition or granule keyed by column.
   * @return false if no row described by the stats can match.
   */
  public abstract boolean mightMatch(Map<String, ColumnStats> stats);

  /** @return true if every row described by the stats matches. */
  public abstract boolean mustMatch(Map<String, ColumnStats> stats);

  /**
   * @param block decoded columns including every column in {@link #columns()}.
   * @param candidates rows of the block to consider.
   * @return the subset of candidates that match. Never the same instance as
   * {@code candidates}.
   */
  public abstract RoaringBitmap evaluate(ColumnBlockSet block, RoaringBitmap candidates);

  /** @return true if row {@code row} of the block matches. */
  public abstract boolean test(ColumnBlockSet block, int row);

  @JsonIgnore
  public boolean isMatchAll() {
    return false;
  }

  public Predicate and(final Predicate other) {
    return Predicates.and(this, other);
  }

  public Predicate or(final Predicate other) {
    return Predicates.or(this, other);
  }

  public enum Operator {
    AND {
      @Override
      public void aggregate(final RoaringBitmap bitmap1, final RoaringBitmap bitmap2) {
        bitmap1.and(bitmap2);
      }
    },
    OR {
      @Override
      public void aggregate(final RoaringBitmap bitmap1, final RoaringBitmap bitmap2) {
        bitmap1.or(bitmap2);
      }
    },
    NOT {
      @Override
      public void aggregate(final RoaringBitmap bitmap1, final RoaringBitmap bitmap2) {
        bitmap1.andNot(bitmap2);
      }
    };

    public abstract void aggregate(RoaringBitmap bitmap1, RoaringBitmap bitmap2);
  }
}
