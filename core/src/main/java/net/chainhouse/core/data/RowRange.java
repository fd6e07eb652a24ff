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

package net.chainhouse.core.data;

import java.util.Objects;

/**
 * Half open range of row ordinals within a partition, {@code [from, to)}.
 */
public final class RowRange {

  private final int from;
  private final int to;

  private RowRange(final int from, final int to) {
    if (from < 0 || to < from) {
      throw new IllegalArgumentException("Invalid row range [" + from + ", " + to + ")");
    }
    this.from = from;
    this.to = to;
  }

  public static RowRange of(final int from, final int to) {
    return new RowRange(from, to);
  }

  public static RowRange all(final int rowCount) {
    return new RowRange(0, rowCount);
  }

  /** @return the rows of granule {@code granule} given a granule size. */
  public static RowRange granule(final int granule, final int granuleRows, final int rowCount) {
    final int start = granule * granuleRows;
    return new RowRange(start, Math.min(rowCount, start + granuleRows));
  }

  public int from() {
    return from;
  }

  public int to() {
    return to;
  }

  public int size() {
    return to - from;
  }

  public boolean isEmpty() {
    return from == to;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowRange)) {
      return false;
    }
    final RowRange other = (RowRange) o;
    return from == other.from && to == other.to;
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to);
  }

  @Override
  public String toString() {
    return "[" + from + ", " + to + ")";
  }
}
