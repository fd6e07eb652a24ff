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

package net.chainhouse.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identifies one committed, immutable partition of a table. The commit id
 * orders partitions by commit within a table: every partition of a batch gets
 * a larger id than every partition of earlier batches.
 */
public final class PartitionHandle {

  private final String table;
  private final long commitId;
  private final long partitionStart;
  private final long partitionEnd;
  private final long minSequence;
  private final long maxSequence;
  private final long minTime;
  private final long maxTime;
  private final int rowCount;

  @JsonCreator
  public PartitionHandle(@JsonProperty("table") final String table,
                         @JsonProperty("commitId") final long commitId,
                         @JsonProperty("partitionStart") final long partitionStart,
                         @JsonProperty("partitionEnd") final long partitionEnd,
                         @JsonProperty("minSequence") final long minSequence,
                         @JsonProperty("maxSequence") final long maxSequence,
                         @JsonProperty("minTime") final long minTime,
                         @JsonProperty("maxTime") final long maxTime,
                         @JsonProperty("rowCount") final int rowCount) {
    this.table = Objects.requireNonNull(table, "table");
    this.commitId = commitId;
    this.partitionStart = partitionStart;
    this.partitionEnd = partitionEnd;
    this.minSequence = minSequence;
    this.maxSequence = maxSequence;
    this.minTime = minTime;
    this.maxTime = maxTime;
    this.rowCount = rowCount;
  }

  @JsonProperty("table")
  public String table() {
    return table;
  }

  @JsonProperty("commitId")
  public long commitId() {
    return commitId;
  }

  @JsonProperty("partitionStart")
  public long partitionStart() {
    return partitionStart;
  }

  /** Exclusive end of the partition window. */
  @JsonProperty("partitionEnd")
  public long partitionEnd() {
    return partitionEnd;
  }

  @JsonProperty("minSequence")
  public long minSequence() {
    return minSequence;
  }

  @JsonProperty("maxSequence")
  public long maxSequence() {
    return maxSequence;
  }

  @JsonProperty("minTime")
  public long minTime() {
    return minTime;
  }

  @JsonProperty("maxTime")
  public long maxTime() {
    return maxTime;
  }

  @JsonProperty("rowCount")
  public int rowCount() {
    return rowCount;
  }

  /** Stable name of the partition, also its directory name. */
  @JsonIgnore
  public String id() {
    return partitionStart + "-" + commitId;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionHandle)) {
      return false;
    }
    final PartitionHandle other = (PartitionHandle) o;
    return commitId == other.commitId
        && partitionStart == other.partitionStart
        && partitionEnd == other.partitionEnd
        && minSequence == other.minSequence
        && maxSequence == other.maxSequence
        && minTime == other.minTime
        && maxTime == other.maxTime
        && rowCount == other.rowCount
        && table.equals(other.table);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, commitId, partitionStart, minSequence, maxSequence);
  }

  @Override
  public String toString() {
    return table + "/" + id() + "[seq " + minSequence + ".." + maxSequence
        + ", rows " + rowCount + "]";
  }
}
