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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Mergeable quantile sketch with relative error guarantees. Values are
 * counted in logarithmic buckets of ratio {@code (1 + a) / (1 - a)}, so any
 * returned quantile is within {@link #RELATIVE_ACCURACY} of a value holding
 * the requested rank. Merging adds bucket counts and loses nothing.
 */
public final class QuantileSketch {

  public static final double RELATIVE_ACCURACY = 0.005;

  private static final double GAMMA = (1 + RELATIVE_ACCURACY) / (1 - RELATIVE_ACCURACY);
  private static final double LOG_GAMMA = Math.log(GAMMA);

  private final NavigableMap<Integer, Long> positive;
  private final NavigableMap<Integer, Long> negative;
  private long zeroCount;
  private long count;

  public QuantileSketch() {
    this(null, null, 0);
  }

  @JsonCreator
  public QuantileSketch(@JsonProperty("positive") final Map<Integer, Long> positive,
                        @JsonProperty("negative") final Map<Integer, Long> negative,
                        @JsonProperty("zeroCount") final long zeroCount) {
    this.positive = positive == null ? new TreeMap<>() : new TreeMap<>(positive);
    this.negative = negative == null ? new TreeMap<>() : new TreeMap<>(negative);
    this.zeroCount = zeroCount;
    this.count = zeroCount;
    for (long c : this.positive.values()) {
      count += c;
    }
    for (long c : this.negative.values()) {
      count += c;
    }
  }

  @JsonProperty("positive")
  public Map<Integer, Long> positive() {
    return positive;
  }

  @JsonProperty("negative")
  public Map<Integer, Long> negative() {
    return negative;
  }

  @JsonProperty("zeroCount")
  public long zeroCount() {
    return zeroCount;
  }

  public long count() {
    return count;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return count == 0;
  }

  /** Adds a value. NaN is ignored. */
  public void add(final double value) {
    if (Double.isNaN(value)) {
      return;
    }
    count++;
    final double magnitude = Math.abs(value);
    if (magnitude < Double.MIN_NORMAL) {
      zeroCount++;
    } else if (value > 0) {
      positive.merge(key(magnitude), 1L, Long::sum);
    } else {
      negative.merge(key(magnitude), 1L, Long::sum);
    }
  }

  public void merge(final QuantileSketch other) {
    other.positive.forEach((k, c) -> positive.merge(k, c, Long::sum));
    other.negative.forEach((k, c) -> negative.merge(k, c, Long::sum));
    zeroCount += other.zeroCount;
    count += other.count;
  }

  /**
   * @param q the quantile in [0, 1].
   * @return an estimate of the value at rank {@code floor(q * (count - 1))}
   * in ascending order, NaN if the sketch is empty.
   */
  public double quantile(final double q) {
    if (q < 0 || q > 1) {
      throw new IllegalArgumentException("Quantile must be in [0, 1]: " + q);
    }
    if (count == 0) {
      return Double.NaN;
    }
    final long rank = (long) Math.floor(q * (count - 1));
    long seen = 0;
    for (Map.Entry<Integer, Long> entry : negative.descendingMap().entrySet()) {
      seen += entry.getValue();
      if (seen > rank) {
        return -value(entry.getKey());
      }
    }
    seen += zeroCount;
    if (seen > rank) {
      return 0;
    }
    for (Map.Entry<Integer, Long> entry : positive.entrySet()) {
      seen += entry.getValue();
      if (seen > rank) {
        return value(entry.getKey());
      }
    }
    return value(positive.lastKey());
  }

  public QuantileSketch copy() {
    return new QuantileSketch(positive, negative, zeroCount);
  }

  private static int key(final double magnitude) {
    return (int) Math.ceil(Math.log(magnitude) / LOG_GAMMA);
  }

  private static double value(final int key) {
    return 2 * Math.pow(GAMMA, key) / (GAMMA + 1);
  }
}
