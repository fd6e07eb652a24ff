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

public final class TableStats {

  private final String table;
  private final long rows;
  private final int partitions;
  private final int quarantinedPartitions;
  private final long compressedBytes;
  private final long uncompressedBytes;
  private final Long minTime;
  private final Long maxTime;

  public TableStats(final String table,
                    final long rows,
                    final int partitions,
                    final int quarantinedPartitions,
                    final long compressedBytes,
                    final long uncompressedBytes,
                    final Long minTime,
                    final Long maxTime) {
    this.table = table;
    this.rows = rows;
    this.partitions = partitions;
    this.quarantinedPartitions = quarantinedPartitions;
    this.compressedBytes = compressedBytes;
    this.uncompressedBytes = uncompressedBytes;
    this.minTime = minTime;
    this.maxTime = maxTime;
  }

  public String table() {
    return table;
  }

  public long rows() {
    return rows;
  }

  public int partitions() {
    return partitions;
  }

  public int quarantinedPartitions() {
    return quarantinedPartitions;
  }

  public long compressedBytes() {
    return compressedBytes;
  }

  public long uncompressedBytes() {
    return uncompressedBytes;
  }

  /** @return the earliest event time or null for an empty table. */
  public Long minTime() {
    return minTime;
  }

  public Long maxTime() {
    return maxTime;
  }

  public double compressionRatio() {
    return compressedBytes == 0 ? 0 : (double) uncompressedBytes / compressedBytes;
  }

  @Override
  public String toString() {
    return "TableStats{" + table + " rows=" + rows + " partitions=" + partitions
        + " compressed=" + compressedBytes + " uncompressed=" + uncompressedBytes + "}";
  }
}
