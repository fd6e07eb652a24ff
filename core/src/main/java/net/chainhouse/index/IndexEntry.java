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

package net.chainhouse.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.data.RowRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Skip index data for one partition: column stats for the whole partition and
 * for each granule of {@code granuleRows} rows.
 */
public final class IndexEntry {

  private final PartitionHandle handle;
  private final int granuleRows;
  private final Map<String, ColumnStats> stats;
  private final List<Map<String, ColumnStats>> granuleStats;

  @JsonCreator
  public IndexEntry(@JsonProperty("handle") final PartitionHandle handle,
                    @JsonProperty("granuleRows") final int granuleRows,
                    @JsonProperty("stats") final Map<String, ColumnStats> stats,
                    @JsonProperty("granuleStats") final List<Map<String, ColumnStats>> granuleStats) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.granuleRows = granuleRows;
    this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    final List<Map<String, ColumnStats>> granules = new ArrayList<>(granuleStats.size());
    for (Map<String, ColumnStats> granule : granuleStats) {
      granules.add(Collections.unmodifiableMap(new LinkedHashMap<>(granule)));
    }
    this.granuleStats = Collections.unmodifiableList(granules);
  }

  @JsonProperty("handle")
  public PartitionHandle handle() {
    return handle;
  }

  @JsonProperty("granuleRows")
  public int granuleRows() {
    return granuleRows;
  }

  @JsonProperty("stats")
  public Map<String, ColumnStats> stats() {
    return stats;
  }

  @JsonProperty("granuleStats")
  public List<Map<String, ColumnStats>> granuleStats() {
    return granuleStats;
  }

  @JsonIgnore
  public int granuleCount() {
    return granuleStats.size();
  }

  public Map<String, ColumnStats> granule(final int granule) {
    return granuleStats.get(granule);
  }

  public RowRange granuleRange(final int granule) {
    return RowRange.granule(granule, granuleRows, handle.rowCount());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IndexEntry)) {
      return false;
    }
    final IndexEntry other = (IndexEntry) o;
    return granuleRows == other.granuleRows
        && handle.equals(other.handle)
        && stats.equals(other.stats)
        && granuleStats.equals(other.granuleStats);
  }

  @Override
  public int hashCode() {
    return Objects.hash(handle, granuleRows, stats);
  }

  @Override
  public String toString() {
    return "IndexEntry{" + handle + ", granules=" + granuleStats.size() + "}";
  }
}
