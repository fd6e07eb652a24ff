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

import com.google.common.collect.ImmutableSortedMap;
import net.chainhouse.core.IndexConsistencyException;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.index.filter.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory skip index over the committed partitions of every table.
 *
 * <p>Readers see immutable snapshots; a batch of entries becomes visible all
 * at once. Once an inconsistency is detected the table's writes halt until
 * {@link #repair(String, Collection)} is called.
 */
public class PartitionIndex {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionIndex.class);

  private static final Comparator<IndexEntry> TIME_ORDER =
      Comparator.<IndexEntry>comparingLong(e -> e.handle().partitionStart())
          .thenComparingLong(e -> e.handle().commitId());

  private final Map<String, TableIndex> tables = new ConcurrentHashMap<>();

  public void createTable(final String table) {
    tables.putIfAbsent(table, new TableIndex());
  }

  public void dropTable(final String table) {
    tables.remove(table);
  }

  public boolean hasTable(final String table) {
    return tables.containsKey(table);
  }

  private TableIndex table(final String table) {
    final TableIndex index = tables.get(table);
    if (index == null) {
      throw new IllegalArgumentException("Unknown table " + table);
    }
    return index;
  }

  /**
   * Publishes the entries of one committed batch atomically. Recording an
   * entry identical to an existing one is a no-op.
   *
   * @throws IndexConsistencyException if an entry conflicts with an existing
   * entry for the same partition, or the table is halted.
   */
  public void record(final String table, final Collection<IndexEntry> entries) {
    final TableIndex index = table(table);
    synchronized (index) {
      checkWritable(table);
      final TreeMap<Long, IndexEntry> next = new TreeMap<>(index.entries);
      for (IndexEntry entry : entries) {
        if (!entry.handle().table().equals(table)) {
          throw new IllegalArgumentException("Entry " + entry + " does not belong to " + table);
        }
        final IndexEntry existing = next.get(entry.handle().commitId());
        if (existing != null && !existing.equals(entry)) {
          halt(table, "conflicting index entry for " + entry.handle());
          throw new IndexConsistencyException("Partition " + entry.handle()
              + " is already indexed with different stats");
        }
        next.put(entry.handle().commitId(), entry);
      }
      index.entries = ImmutableSortedMap.copyOf(next);
      for (IndexEntry entry : entries) {
        index.lastCommitId = Math.max(index.lastCommitId, entry.handle().commitId());
        index.lastSequence = Math.max(index.lastSequence, entry.handle().maxSequence());
      }
    }
  }

  /**
   * @throws IndexConsistencyException if writes to the table are halted.
   */
  public void checkWritable(final String table) {
    final TableIndex index = table(table);
    if (index.haltReason != null) {
      throw new IndexConsistencyException("Writes to " + table + " are halted: "
          + index.haltReason);
    }
  }

  public void halt(final String table, final String reason) {
    final TableIndex index = table(table);
    if (index.haltReason == null) {
      LOGGER.error("Halting writes to {}: {}", table, reason);
      index.haltReason = reason;
    }
  }

  public boolean isHalted(final String table) {
    return table(table).haltReason != null;
  }

  /**
   * Replaces the table's entries with the given ones and resumes writes.
   */
  public void repair(final String table, final Collection<IndexEntry> entries) {
    final TableIndex index = table(table);
    synchronized (index) {
      final TreeMap<Long, IndexEntry> next = new TreeMap<>();
      for (IndexEntry entry : entries) {
        next.put(entry.handle().commitId(), entry);
        index.lastCommitId = Math.max(index.lastCommitId, entry.handle().commitId());
        index.lastSequence = Math.max(index.lastSequence, entry.handle().maxSequence());
      }
      index.entries = ImmutableSortedMap.copyOf(next);
      index.quarantined.retainAll(next.keySet());
      index.haltReason = null;
    }
    LOGGER.info("Repaired index of {} with {} partitions", table, entries.size());
  }

  /**
   * @return entries of partitions that may hold rows matching the predicate,
   * quarantined partitions excluded, in the requested order.
   */
  public List<IndexEntry> candidates(final String table,
                                     final Predicate predicate,
                                     final AccessPattern pattern) {
    return candidates(table, predicate, pattern, false);
  }

  /**
   * @param includeQuarantined whether quarantined partitions whose stats
   * match are returned too.
   */
  public List<IndexEntry> candidates(final String table,
                                     final Predicate predicate,
                                     final AccessPattern pattern,
                                     final boolean includeQuarantined) {
    final TableIndex index = table(table);
    final List<IndexEntry> result = new ArrayList<>();
    for (IndexEntry entry : index.entries.values()) {
      if (!includeQuarantined && index.quarantined.contains(entry.handle().commitId())) {
        continue;
      }
      if (predicate.mightMatch(entry.stats())) {
        result.add(entry);
      }
    }
    result.sort(pattern == AccessPattern.MOST_RECENT_FIRST ? TIME_ORDER.reversed() : TIME_ORDER);
    return result;
  }

  /** @return every live entry of the table in time order, quarantined included. */
  public List<IndexEntry> entries(final String table) {
    final List<IndexEntry> result = new ArrayList<>(table(table).entries.values());
    result.sort(TIME_ORDER);
    return result;
  }

  /** @return entries committed after {@code commitId}, in commit order. */
  public List<IndexEntry> committedAfter(final String table, final long commitId) {
    return new ArrayList<>(table(table).entries.tailMap(commitId, false).values());
  }

  public IndexEntry get(final String table, final long commitId) {
    return table(table).entries.get(commitId);
  }

  public int size(final String table) {
    return table(table).entries.size();
  }

  /**
   * @return the largest commit id ever recorded for the table, evicted
   * partitions included, or -1.
   */
  public long lastCommitId(final String table) {
    return table(table).lastCommitId;
  }

  /** @return the largest sequence ever recorded for the table or -1. */
  public long lastSequence(final String table) {
    return table(table).lastSequence;
  }

  /** Excludes a partition from future scans. */
  public void quarantine(final PartitionHandle handle) {
    if (table(handle.table()).quarantined.add(handle.commitId())) {
      LOGGER.error("Quarantined partition {}", handle);
    }
  }

  public boolean isQuarantined(final PartitionHandle handle) {
    return table(handle.table()).quarantined.contains(handle.commitId());
  }

  /** Removes evicted partitions. */
  public void remove(final String table, final Collection<PartitionHandle> handles) {
    final TableIndex index = table(table);
    synchronized (index) {
      final TreeMap<Long, IndexEntry> next = new TreeMap<>(index.entries);
      for (PartitionHandle handle : handles) {
        next.remove(handle.commitId());
        index.quarantined.remove(handle.commitId());
      }
      index.entries = ImmutableSortedMap.copyOf(next);
    }
  }

  public IndexSnapshot snapshot(final String table) {
    final TableIndex index = table(table);
    synchronized (index) {
      return new IndexSnapshot(table, index.lastCommitId, index.lastSequence,
          new ArrayList<>(index.entries.values()),
          new ArrayList<>(index.quarantined));
    }
  }

  /** Restores a persisted snapshot, replacing what is held for the table. */
  public void load(final IndexSnapshot snapshot) {
    createTable(snapshot.table());
    final TableIndex index = table(snapshot.table());
    synchronized (index) {
      final TreeMap<Long, IndexEntry> next = new TreeMap<>();
      index.lastCommitId = snapshot.lastCommitId();
      index.lastSequence = snapshot.lastSequence();
      for (IndexEntry entry : snapshot.entries()) {
        next.put(entry.handle().commitId(), entry);
        index.lastCommitId = Math.max(index.lastCommitId, entry.handle().commitId());
        index.lastSequence = Math.max(index.lastSequence, entry.handle().maxSequence());
      }
      index.entries = ImmutableSortedMap.copyOf(next);
      index.quarantined.clear();
      index.quarantined.addAll(snapshot.quarantined());
    }
  }

  private static final class TableIndex {
    private volatile ImmutableSortedMap<Long, IndexEntry> entries = ImmutableSortedMap.of();
    private final Set<Long> quarantined = ConcurrentHashMap.newKeySet();
    private volatile String haltReason;
    private volatile long lastCommitId = -1;
    private volatile long lastSequence = -1;
  }
}
