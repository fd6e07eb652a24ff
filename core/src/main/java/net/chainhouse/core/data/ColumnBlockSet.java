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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The decoded columns of one partition over a single {@link RowRange}. Row
 * ordinals passed to accessors are relative to the start of the range.
 */
public final class ColumnBlockSet {

  private final RowRange range;
  private final Map<String, ColumnVector> vectors;
  private final long bytesRead;
  private final long bytesDecompressed;

  public ColumnBlockSet(final RowRange range,
                        final Map<String, ColumnVector> vectors,
                        final long bytesRead,
                        final long bytesDecompressed) {
    this.range = range;
    this.vectors = Collections.unmodifiableMap(new LinkedHashMap<>(vectors));
    this.bytesRead = bytesRead;
    this.bytesDecompressed = bytesDecompressed;
  }

  public RowRange range() {
    return range;
  }

  public int rowCount() {
    return range.size();
  }

  public boolean has(final String column) {
    return vectors.containsKey(column);
  }

  /**
   * @throws IllegalArgumentException if the column was not read.
   */
  public ColumnVector vector(final String column) {
    final ColumnVector vector = vectors.get(column);
    if (vector == null) {
      throw new IllegalArgumentException("Column " + column + " was not read for " + range);
    }
    return vector;
  }

  public Object value(final String column, final int row) {
    return vector(column).get(row);
  }

  public Collection<String> columns() {
    return vectors.keySet();
  }

  public long bytesRead() {
    return bytesRead;
  }

  public long bytesDecompressed() {
    return bytesDecompressed;
  }

  /** @return a block holding the columns of both sets. Must share a range. */
  public ColumnBlockSet with(final ColumnBlockSet other) {
    if (!range.equals(other.range)) {
      throw new IllegalArgumentException("Range mismatch " + range + " vs " + other.range);
    }
    final Map<String, ColumnVector> merged = new LinkedHashMap<>(vectors);
    merged.putAll(other.vectors);
    return new ColumnBlockSet(range, merged,
        bytesRead + other.bytesRead, bytesDecompressed + other.bytesDecompressed);
  }
}
