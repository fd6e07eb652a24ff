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
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.scan.OrderBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Time bucket start plus dimension values, ordered by time then dimensions with nulls first. */
public final class BucketKey implements Comparable<BucketKey> {

  private final long bucketStart;
  private final List<Object> dimensions;

  @JsonCreator
  public BucketKey(@JsonProperty("bucketStart") final long bucketStart,
                   @JsonProperty("dimensions") final List<Object> dimensions) {
    this.bucketStart = bucketStart;
    if (dimensions == null || dimensions.isEmpty()) {
      this.dimensions = Collections.emptyList();
    } else {
      final List<Object> normalized = new ArrayList<>(dimensions.size());
      for (Object value : dimensions) {
        normalized.add(normalize(value));
      }
      this.dimensions = Collections.unmodifiableList(normalized);
    }
  }

  /** JSON reads small integers back as Integer and decimals as Double. */
  private static Object normalize(final Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float) {
      return ((Float) value).doubleValue();
    }
    return value;
  }

  @JsonProperty("bucketStart")
  public long bucketStart() {
    return bucketStart;
  }

  @JsonProperty("dimensions")
  public List<Object> dimensions() {
    return dimensions;
  }

  public Object dimension(final int index) {
    return dimensions.get(index);
  }

  @Override
  public int compareTo(final BucketKey other) {
    int cmp = Long.compare(bucketStart, other.bucketStart);
    if (cmp != 0) {
      return cmp;
    }
    final int n = Math.min(dimensions.size(), other.dimensions.size());
    for (int i = 0; i < n; i++) {
      final Object x = dimensions.get(i);
      final Object y = other.dimensions.get(i);
      if (x == null || y == null) {
        cmp = x == null ? (y == null ? 0 : -1) : 1;
      } else {
        cmp = OrderBy.compareValues(x, y);
      }
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(dimensions.size(), other.dimensions.size());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BucketKey)) {
      return false;
    }
    final BucketKey other = (BucketKey) o;
    return bucketStart == other.bucketStart && dimensions.equals(other.dimensions);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(bucketStart) + dimensions.hashCode();
  }

  @Override
  public String toString() {
    return "BucketKey{" + bucketStart + ", " + dimensions + "}";
  }
}
