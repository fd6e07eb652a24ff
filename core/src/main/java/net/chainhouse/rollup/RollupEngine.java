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

import io.ultrabrew.metrics.Counter;
import io.ultrabrew.metrics.Gauge;
import io.ultrabrew.metrics.MetricRegistry;
import io.ultrabrew.metrics.Timer;
import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.CorruptionException;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.ReadLease;
import net.chainhouse.core.Schema;
import net.chainhouse.core.StorageIOException;
import net.chainhouse.core.StoreConfig;
import net.chainhouse.index.IndexEntry;
import net.chainhouse.index.PartitionIndex;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.scan.CancellationToken;
import net.chainhouse.scan.ScanEngine;
import net.chainhouse.scan.ScanStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains rollups incrementally. {@link #advance(String)} folds the
 * partitions committed after a rollup's checkpoint, one at a time in commit
 * order: it scans the partition into a {@link PartitionPartial}, persists the
 * partial under the partition's id, then persists the checkpoint. A crash
 * between the two writes makes the next advance fold the partition again and
 * overwrite its partial, which leaves the buckets unchanged.
 *
 * <p>Advances of one rollup are serialized by a per rollup lock; different
 * rollups advance independently. Ingestion never waits on a rollup.
 */
public class RollupEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(RollupEngine.class);

  private final ColumnStore store;
  private final PartitionIndex index;
  private final ScanEngine scanEngine;
  private final RollupStore rollupStore;
  private final StoreConfig config;
  private final Clock clock;
  private final ConcurrentMap<String, Rollup> rollups = new ConcurrentHashMap<>();
  private final List<RollupAlarmListener> alarmListeners = new CopyOnWriteArrayList<>();
  private final Object registration = new Object();
  private final Timer foldTimer;
  private final Counter foldedCounter;
  private final Gauge lagGauge;
  private final Counter alarmCounter;

  /** Reports its metrics to the store's {@link MetricRegistry}. */
  public RollupEngine(final ColumnStore store,
                      final ScanEngine scanEngine,
                      final RollupStore rollupStore) {
    this.store = store;
    final MetricRegistry registry = store.metricRegistry();
    this.foldTimer = registry.timer("rollup.fold.timeTaken");
    this.foldedCounter = registry.counter("rollup.partitions.folded");
    this.lagGauge = registry.gauge("rollup.lag.millis");
    this.alarmCounter = registry.counter("rollup.staleness.alarms");
    this.index = store.index();
    this.scanEngine = scanEngine;
    this.rollupStore = rollupStore;
    this.config = store.config();
    this.clock = store.clock();
  }

  /** Restores the persisted rollups of tables the store knows. */
  public void load() throws IOException {
    for (RollupDefinition definition : rollupStore.loadDefinitions()) {
      if (!store.hasTable(definition.table())) {
        LOGGER.warn("Skipping rollup {} of unknown table {}", definition.name(), definition.table());
        continue;
      }
      final Rollup rollup = new Rollup(definition);
      final RollupCheckpoint checkpoint = rollupStore.readCheckpoint(definition.name());
      rollup.checkpoint = checkpoint == null
          ? RollupCheckpoint.initial(definition.name(), clock.millis()) : checkpoint;
      rollup.table.loadAll(rollupStore.loadPartials(definition.name()));
      rollups.put(definition.name(), rollup);
      LOGGER.info("Loaded rollup {} folded up to commit {} with {} partials",
          definition.name(), rollup.checkpoint.foldedCommitId(), rollup.table.partialCount());
    }
  }

  /**
   * Declares a rollup. Registering the same definition again is a no-op.
   *
   * @return true if the rollup is new.
   * @throws IllegalArgumentException if the name is taken by another
   * definition or a column does not fit.
   */
  public boolean registerRollup(final RollupDefinition definition) throws StorageIOException {
    definition.validate(store.schema(definition.table()));
    synchronized (registration) {
      final Rollup existing = rollups.get(definition.name());
      if (existing != null) {
        if (existing.definition.equals(definition)) {
          return false;
        }
        throw new IllegalArgumentException("Rollup " + definition.name()
            + " is registered with another definition");
      }
      final Rollup rollup = new Rollup(definition);
      rollup.checkpoint = RollupCheckpoint.initial(definition.name(), clock.millis());
      rollupStore.writeDefinition(definition);
      rollupStore.writeCheckpoint(rollup.checkpoint);
      rollups.put(definition.name(), rollup);
    }
    LOGGER.info("Registered {}", definition);
    return true;
  }

  /**
   * Folds every partition committed after the checkpoint. Stops at a
   * quarantined or corrupt partition, leaving the rollup stale until the
   * partition is repaired.
   *
   * @return the number of partitions folded.
   * @throws StorageIOException if a write still fails after the configured retries.
   */
  public int advance(final String name) throws StorageIOException {
    final Rollup rollup = rollup(name);
    final RollupDefinition definition = rollup.definition;
    rollup.lock.lock();
    try {
      if (rollup.dropped) {
        throw new IllegalArgumentException("Rollup " + name + " was dropped");
      }
      final Schema schema = store.schema(definition.table());
      final List<IndexEntry> pending =
          index.committedAfter(definition.table(), rollup.checkpoint.foldedCommitId());
      int folded = 0;
      for (IndexEntry entry : pending) {
        final PartitionHandle handle = entry.handle();
        if (index.isQuarantined(handle)) {
          LOGGER.warn("Rollup {} waits on quarantined partition {}", name, handle);
          break;
        }
        final PartitionPartial partial;
        try (ReadLease lease = store.acquire(handle)) {
          if (lease == null) {
            LOGGER.warn("Partition {} was evicted before rollup {} folded it", handle, name);
            continue;
          }
          final long start = foldTimer.start();
          partial = fold(definition, schema, entry);
          foldTimer.stop(start, "rollup", name);
        } catch (CorruptionException e) {
          store.quarantine(handle);
          LOGGER.error("Rollup {} stopped at corrupt partition {}", name, handle, e);
          break;
        }
        write("partial " + handle.id() + " of " + name, () -> rollupStore.writePartial(partial));
        rollup.table.put(partial);
        final RollupCheckpoint next = rollup.checkpoint.advance(handle, clock.millis());
        write("checkpoint of " + name, () -> rollupStore.writeCheckpoint(next));
        rollup.checkpoint = next;
        foldedCounter.inc("rollup", name);
        folded++;
      }
      if (folded > 0) {
        LOGGER.info("Rollup {} folded {} partitions up to commit {}", name, folded,
            rollup.checkpoint.foldedCommitId());
      }
      return folded;
    } finally {
      rollup.lock.unlock();
    }
  }

  /**
   * Advances every rollup, logging failures.
   *
   * @return the number of partitions folded.
   */
  public int advanceAll() {
    int folded = 0;
    for (String name : new ArrayList<>(rollups.keySet())) {
      try {
        folded += advance(name);
      } catch (StorageIOException e) {
        LOGGER.error("Failed to advance rollup {}", name, e);
      } catch (IllegalArgumentException e) {
        LOGGER.debug("Rollup {} went away while advancing", name, e);
      }
    }
    return folded;
  }

  private PartitionPartial fold(final RollupDefinition definition,
                                final Schema schema,
                                final IndexEntry entry) {
    final Map<BucketKey, RollupBucket> buckets = new TreeMap<>();
    final String timeColumn = schema.timeColumn();
    final List<String> dimensions = definition.dimensions();
    scanEngine.scanPartition(entry, definition.filter(), Predicates.all(),
        definition.columns(schema), CancellationToken.NONE, new ScanStats(),
        (partition, block, row, rowInPartition) -> {
          final long time = block.vector(timeColumn).getLong(row);
          final List<Object> values = new ArrayList<>(dimensions.size());
          for (String dimension : dimensions) {
            values.add(block.value(dimension, row));
          }
          final BucketKey key =
              new BucketKey(definition.granularity().bucketStart(time), values);
          buckets.computeIfAbsent(key, k -> RollupBucket.empty(k, definition, schema))
              .add(definition, block, row);
          return true;
        });
    return new PartitionPartial(definition.name(), entry.handle(), new ArrayList<>(buckets.values()));
  }

  private void write(final String what, final StorageAction action) throws StorageIOException {
    final int attempts = Math.max(0, config.rollupMergeRetries) + 1;
    for (int attempt = 1; ; attempt++) {
      try {
        action.run();
        return;
      } catch (StorageIOException e) {
        if (attempt >= attempts) {
          LOGGER.error("Giving up writing {} after {} attempts", what, attempt, e);
          throw e;
        }
        LOGGER.warn("Retrying write of {} after attempt {} failed", what, attempt, e);
      }
    }
  }

  /**
   * @return the time between now and the newest event folded, zero when no
   * committed partition is waiting.
   */
  public Duration rollupLag(final String name) {
    final Rollup rollup = rollup(name);
    final RollupCheckpoint checkpoint = rollup.checkpoint;
    final List<IndexEntry> pending =
        index.committedAfter(rollup.definition.table(), checkpoint.foldedCommitId());
    if (pending.isEmpty()) {
      lagGauge.set(0, "rollup", name);
      return Duration.ZERO;
    }
    long reference;
    if (checkpoint.lastFoldedMaxTime() != null) {
      reference = checkpoint.lastFoldedMaxTime();
    } else {
      reference = Long.MAX_VALUE;
      for (IndexEntry entry : pending) {
        reference = Math.min(reference, entry.handle().minTime());
      }
    }
    final long lag = Math.max(0, clock.millis() - reference);
    lagGauge.set(lag, "rollup", name);
    return Duration.ofMillis(lag);
  }

  /** @return the number of committed partitions the rollup has not folded. */
  public int pendingPartitions(final String name) {
    final Rollup rollup = rollup(name);
    return index.committedAfter(rollup.definition.table(),
        rollup.checkpoint.foldedCommitId()).size();
  }

  /**
   * Raises an alarm for every rollup lagging more than
   * {@code rollupLagAlarmSeconds} behind its table.
   */
  public List<RollupStalenessAlarm> checkStaleness() {
    final Duration threshold = Duration.ofSeconds(config.rollupLagAlarmSeconds);
    final List<RollupStalenessAlarm> alarms = new ArrayList<>();
    for (String name : new ArrayList<>(rollups.keySet())) {
      if (!rollups.containsKey(name)) {
        continue;
      }
      final Duration lag = rollupLag(name);
      if (lag.compareTo(threshold) <= 0) {
        continue;
      }
      final RollupStalenessAlarm alarm = new RollupStalenessAlarm(name, lag, threshold,
          pendingPartitions(name), clock.instant());
      LOGGER.warn("{}", alarm);
      alarmCounter.inc("rollup", name);
      alarms.add(alarm);
      for (RollupAlarmListener listener : alarmListeners) {
        try {
          listener.onAlarm(alarm);
        } catch (RuntimeException e) {
          LOGGER.error("Alarm listener {} failed", listener, e);
        }
      }
    }
    return alarms;
  }

  /** Removes a rollup and its files. */
  public boolean dropRollup(final String name) throws IOException {
    final Rollup rollup;
    synchronized (registration) {
      rollup = rollups.remove(name);
    }
    if (rollup == null) {
      return false;
    }
    rollup.lock.lock();
    try {
      rollup.dropped = true;
      rollupStore.drop(name);
    } finally {
      rollup.lock.unlock();
    }
    LOGGER.info("Dropped rollup {}", name);
    return true;
  }

  /** @return merged buckets starting in [from, to), in key order. */
  public List<RollupBucket> buckets(final String name, final long from, final long to) {
    return rollup(name).table.buckets(from, to);
  }

  /**
   * @return true if every live partition of the table with events in
   * [from, to) is folded.
   */
  public boolean covers(final String name, final long from, final long to) {
    final Rollup rollup = rollup(name);
    final long folded = rollup.checkpoint.foldedCommitId();
    for (IndexEntry entry : index.entries(rollup.definition.table())) {
      final PartitionHandle handle = entry.handle();
      if (handle.maxTime() >= from && handle.minTime() < to && handle.commitId() > folded) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the smallest folded commit id among the table's rollups, or
   * {@link Long#MAX_VALUE} if it has none.
   */
  public long minFoldedCommitId(final String table) {
    long min = Long.MAX_VALUE;
    for (Rollup rollup : rollups.values()) {
      if (rollup.definition.table().equals(table)) {
        min = Math.min(min, rollup.checkpoint.foldedCommitId());
      }
    }
    return min;
  }

  public RollupDefinition definition(final String name) {
    return rollup(name).definition;
  }

  public Collection<RollupDefinition> definitions() {
    final List<RollupDefinition> definitions = new ArrayList<>();
    for (Rollup rollup : rollups.values()) {
      definitions.add(rollup.definition);
    }
    return Collections.unmodifiableList(definitions);
  }

  public RollupCheckpoint checkpoint(final String name) {
    return rollup(name).checkpoint;
  }

  public void addAlarmListener(final RollupAlarmListener listener) {
    alarmListeners.add(listener);
  }

  public void removeAlarmListener(final RollupAlarmListener listener) {
    alarmListeners.remove(listener);
  }

  private Rollup rollup(final String name) {
    final Rollup rollup = rollups.get(name);
    if (rollup == null) {
      throw new IllegalArgumentException("Unknown rollup " + name);
    }
    return rollup;
  }

  @FunctionalInterface
  private interface StorageAction {
    void run() throws StorageIOException;
  }

  private static final class Rollup {
    private final RollupDefinition definition;
    private final RollupTable table;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile RollupCheckpoint checkpoint;
    private volatile boolean dropped;

    private Rollup(final RollupDefinition definition) {
      this.definition = definition;
      this.table = new RollupTable(definition);
    }
  }
}
