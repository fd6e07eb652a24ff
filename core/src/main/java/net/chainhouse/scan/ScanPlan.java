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

import net.chainhouse.core.PartitionHandle;
import net.chainhouse.index.AccessPattern;
import net.chainhouse.index.filter.Predicate;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * What a scan would read, without reading it.
 */
public final class ScanPlan {

  private final String table;
  private final Predicate primary;
  private final Predicate secondary;
  private final AccessPattern accessPattern;
  private final int partitionsTotal;
  private final List<PartitionHandle> candidates;
  private final int granulesTotal;
  private final int granulesCandidate;
  private final Set<String> primaryColumns;
  private final Set<String> otherColumns;
  private final List<OrderBy> orderBy;
  private final int limit;

  ScanPlan(final String table,
           final Predicate primary,
           final Predicate secondary,
           final AccessPattern accessPattern,
           final int partitionsTotal,
           final List<PartitionHandle> candidates,
           final int granulesTotal,
           final int granulesCandidate,
           final Set<String> primaryColumns,
           final Set<String> otherColumns,
           final List<OrderBy> orderBy,
           final int limit) {
    this.table = table;
    this.primary = primary;
    this.secondary = secondary;
    this.accessPattern = accessPattern;
    this.partitionsTotal = partitionsTotal;
    this.candidates = Collections.unmodifiableList(candidates);
    this.granulesTotal = granulesTotal;
    this.granulesCandidate = granulesCandidate;
    this.primaryColumns = Collections.unmodifiableSet(primaryColumns);
    this.otherColumns = Collections.unmodifiableSet(otherColumns);
    this.orderBy = orderBy;
    this.limit = limit;
  }

  public String table() {
    return table;
  }

  public int partitionsTotal() {
    return partitionsTotal;
  }

  public List<PartitionHandle> candidates() {
    return candidates;
  }

  public int partitionsPruned() {
    return partitionsTotal - candidates.size();
  }

  /** Granules of the candidate partitions. */
  public int granulesTotal() {
    return granulesTotal;
  }

  /** Granules that survive granule level pruning. */
  public int granulesCandidate() {
    return granulesCandidate;
  }

  public Set<String> primaryColumns() {
    return primaryColumns;
  }

  public Set<String> otherColumns() {
    return otherColumns;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append("Scan ").append(table).append(" (").append(accessPattern).append(")\n");
    buf.append("  primary:   ").append(primary).append(" reading ").append(primaryColumns).append('\n');
    buf.append("  secondary: ").append(secondary).append(" reading ").append(otherColumns).append('\n');
    buf.append("  partitions: ").append(candidates.size()).append(" of ").append(partitionsTotal)
        .append(" (").append(partitionsPruned()).append(" pruned)\n");
    buf.append("  granules: ").append(granulesCandidate).append(" of ").append(granulesTotal).append('\n');
    if (!orderBy.isEmpty()) {
      buf.append("  order by: ").append(orderBy).append('\n');
    }
    if (limit > 0) {
      buf.append("  limit: ").append(limit).append('\n');
    }
    return buf.toString();
  }
}
