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
import net.chainhouse.TestClock;
import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.EventRow;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.StorageIOException;
import net.chainhouse.index.PartitionIndex;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.rollup.aggregate.AggregateSpec;
import net.chainhouse.scan.ScanEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static net.chainhouse.TestUtil.HOUR;
import static net.chainhouse.TestUtil.MINUTE;
import static net.chainhouse.TestUtil.T0;
import static net.chainhouse.TestUtil.TRADES;
import static net.chainhouse.TestUtil.config;
import static net.chainhouse.TestUtil.trades;
import static net.chainhouse.TestUtil.tradesSchema;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RollupEngineTest {

  private static final String HOURLY = "pool_hourly";

  @TempDir
  Path dir;

  private final TestClock clock = new TestClock(T0 + 4 * HOUR);
  private final List<EventRow> ingested = new ArrayList<>();
  private ColumnStore store;
  private ScanEngine scanEngine;
  private RollupStore rollupStore;
  private RollupEngine engine;

  @BeforeEach
  void beforeEach() throws IOException {
    store = ColumnStore.open(config(dir), new PartitionIndex(), clock);
    store.createTable(tradesSchema());
    scanEngine = new ScanEngine(store, 2);
    rollupStore = new RollupStore(store.root().resolve(ColumnStore.ROLLUP_DIR));
    engine = new RollupEngine(store, scanEngine, rollupStore);
  }

  @AfterEach
  void afterEach() {
    scanEngine.close();
    store.close();
  }

  @Test
  void foldedBucketsMatchTheRawRows() throws IOException {
    assertTrue(engine.registerRollup(hourly()));
    ingest(1, 100);
    ingest(101, 80);

    assertEquals(4, engine.advance(HOURLY));
    assertEquals(0, engine.advance(HOURLY));
    assertEquals(3, engine.checkpoint(HOURLY).foldedCommitId());
    assertEquals(180, engine.checkpoint(HOURLY).foldedSequence());
    assertBucketsMatch(engine);
  }

  @Test
  void registrationIsIdempotent() throws IOException {
    assertTrue(engine.registerRollup(hourly()));
    assertFalse(engine.registerRollup(hourly()));
    assertThrows(IllegalArgumentException.class, () -> engine.registerRollup(
        RollupDefinition.newBuilder(HOURLY, TRADES).aggregate(AggregateSpec.count()).build()));
    assertThrows(IllegalArgumentException.class, () -> engine.registerRollup(
        RollupDefinition.newBuilder("bad", TRADES).aggregate(AggregateSpec.sum("pool")).build()));
    assertThrows(IllegalArgumentException.class, () -> engine.registerRollup(
        RollupDefinition.newBuilder("bad", "nope").aggregate(AggregateSpec.count()).build()));
    assertEquals(1, engine.definitions().size());
  }

  @Test
  void filteredRollup() throws IOException {
    engine.registerRollup(RollupDefinition.newBuilder("usdc_daily", TRADES)
        .granularity(BucketGranularity._1_DAY)
        .filter(Predicates.eq("pool", "usdc-eth"))
        .aggregate(AggregateSpec.count(), AggregateSpec.count("fee").when(Predicates.gt("fee", 1000L)))
        .build());
    ingest(1, 180);
    engine.advance("usdc_daily");

    final List<RollupBucket> buckets = engine.buckets("usdc_daily", T0, T0 + 24 * HOUR);
    assertEquals(1, buckets.size());
    assertEquals(60L, buckets.get(0).state(0).value());
    long expected = 0;
    for (long seq = 3; seq <= 180; seq += 3) {
      if (seq % 7 != 0 && seq * 10 > 1000) {
        expected++;
      }
    }
    assertEquals(expected, buckets.get(0).state(1).value());
  }

  @Test
  void failedCheckpointWriteIsRepairedByTheNextAdvance() throws IOException {
    final RollupStore failing = spy(rollupStore);
    final RollupEngine crashing = new RollupEngine(store, scanEngine, failing);
    crashing.registerRollup(hourly());
    ingest(1, 180);
    clearInvocations(failing);
    doThrow(new StorageIOException("disk full")).when(failing).writeCheckpoint(any());

    assertThrows(StorageIOException.class, () -> crashing.advance(HOURLY));
    // one retry configured
    verify(failing, times(2)).writeCheckpoint(any());
    verify(failing, times(1)).writePartial(any());
    assertEquals(-1, crashing.checkpoint(HOURLY).foldedCommitId());

    // restart: the partial of the first partition is on disk, the checkpoint is not
    final RollupEngine recovered = new RollupEngine(store, scanEngine, rollupStore);
    recovered.load();
    assertEquals(-1, recovered.checkpoint(HOURLY).foldedCommitId());
    assertEquals(3, recovered.advance(HOURLY));
    assertBucketsMatch(recovered);
  }

  @Test
  void transientWriteFailureIsRetried() throws IOException {
    final RollupStore flaky = spy(rollupStore);
    final RollupEngine retrying = new RollupEngine(store, scanEngine, flaky);
    retrying.registerRollup(hourly());
    ingest(1, 60);
    doThrow(new StorageIOException("busy")).doCallRealMethod().when(flaky).writePartial(any());

    assertEquals(1, retrying.advance(HOURLY));
    verify(flaky, times(2)).writePartial(any());
    assertEquals(0, retrying.checkpoint(HOURLY).foldedCommitId());
  }

  @Test
  void reloadRestoresBuckets() throws IOException {
    engine.registerRollup(hourly());
    ingest(1, 180);
    engine.advance(HOURLY);

    final RollupEngine reloaded = new RollupEngine(store, scanEngine, rollupStore);
    reloaded.load();
    assertEquals(engine.checkpoint(HOURLY), reloaded.checkpoint(HOURLY));
    assertEquals(0, reloaded.advance(HOURLY));
    assertBucketsMatch(reloaded);
  }

  @Test
  void lagAndStaleness() throws IOException {
    engine.registerRollup(hourly());
    final List<RollupStalenessAlarm> raised = new ArrayList<>();
    engine.addAlarmListener(raised::add);
    assertEquals(Duration.ZERO, engine.rollupLag(HOURLY));

    ingest(1, 180);
    // nothing folded yet: lag runs from the oldest pending event
    assertEquals(Duration.ofHours(4), engine.rollupLag(HOURLY));
    assertEquals(3, engine.pendingPartitions(HOURLY));
    assertEquals(1, engine.checkStaleness().size());
    assertEquals(1, raised.size());
    assertEquals(HOURLY, raised.get(0).rollup());
    assertEquals(3, raised.get(0).pendingPartitions());

    engine.advance(HOURLY);
    assertEquals(Duration.ZERO, engine.rollupLag(HOURLY));
    assertTrue(engine.checkStaleness().isEmpty());

    // once folded, lag runs from the newest folded event
    clock.advance(10 * MINUTE);
    ingestRows(trades(181, T0 + 3 * HOUR, 1));
    assertEquals(Duration.ofMinutes(71), engine.rollupLag(HOURLY));
    assertEquals(1, engine.checkStaleness().size());
    assertEquals(2, raised.size());
  }

  @Test
  void foldsAndLagAreReported() throws IOException {
    final MetricRegistry registry = mock(MetricRegistry.class);
    final Timer foldTimer = mock(Timer.class);
    final Counter folded = mock(Counter.class);
    final Counter alarms = mock(Counter.class);
    final Gauge lag = mock(Gauge.class);
    when(registry.counter(anyString())).thenReturn(mock(Counter.class));
    when(registry.timer(anyString())).thenReturn(mock(Timer.class));
    when(registry.gauge(anyString())).thenReturn(mock(Gauge.class));
    when(registry.timer("rollup.fold.timeTaken")).thenReturn(foldTimer);
    when(registry.counter("rollup.partitions.folded")).thenReturn(folded);
    when(registry.counter("rollup.staleness.alarms")).thenReturn(alarms);
    when(registry.gauge("rollup.lag.millis")).thenReturn(lag);
    when(foldTimer.start()).thenReturn(7L);

    final ColumnStore metered =
        ColumnStore.open(config(dir.resolve("metered")), new PartitionIndex(), clock, registry);
    final ScanEngine meteredScans = new ScanEngine(metered, 1);
    try {
      metered.createTable(tradesSchema());
      final RollupEngine rollups = new RollupEngine(metered, meteredScans,
          new RollupStore(metered.root().resolve(ColumnStore.ROLLUP_DIR)));
      rollups.registerRollup(hourly());
      metered.appendBatch(TRADES, trades(1, T0, 180));

      assertEquals(Duration.ofHours(4), rollups.rollupLag(HOURLY));
      assertEquals(1, rollups.checkStaleness().size());
      verify(lag, times(2)).set(4 * HOUR, "rollup", HOURLY);
      verify(alarms).inc("rollup", HOURLY);

      assertEquals(3, rollups.advance(HOURLY));
      verify(foldTimer, times(3)).stop(7L, "rollup", HOURLY);
      verify(folded, times(3)).inc("rollup", HOURLY);
      assertEquals(Duration.ZERO, rollups.rollupLag(HOURLY));
      verify(lag).set(0L, "rollup", HOURLY);
    } finally {
      meteredScans.close();
      metered.close();
    }
  }

  @Test
  void quarantinedPartitionStopsTheFold() throws IOException {
    engine.registerRollup(hourly());
    final List<PartitionHandle> handles = ingest(1, 180);
    store.quarantine(handles.get(1));

    assertEquals(1, engine.advance(HOURLY));
    assertEquals(0, engine.checkpoint(HOURLY).foldedCommitId());
    assertEquals(2, engine.pendingPartitions(HOURLY));
    assertEquals(0, engine.minFoldedCommitId(TRADES));
    assertTrue(engine.covers(HOURLY, T0, T0 + HOUR));
    assertFalse(engine.covers(HOURLY, T0, T0 + 2 * HOUR));
  }

  @Test
  void corruptPartitionStopsTheFold() throws IOException {
    engine.registerRollup(hourly());
    final List<PartitionHandle> handles = ingest(1, 180);
    Files.delete(store.partitionDir(handles.get(2)).resolve("trader.seg"));

    assertEquals(2, engine.advance(HOURLY));
    assertTrue(store.index().isQuarantined(handles.get(2)));
    assertEquals(1, engine.pendingPartitions(HOURLY));
  }

  @Test
  void minFoldedCommitId() throws IOException {
    assertEquals(Long.MAX_VALUE, engine.minFoldedCommitId(TRADES));
    engine.registerRollup(hourly());
    engine.registerRollup(RollupDefinition.newBuilder("daily", TRADES)
        .granularity(BucketGranularity._1_DAY)
        .aggregate(AggregateSpec.count())
        .build());
    assertEquals(-1, engine.minFoldedCommitId(TRADES));

    ingest(1, 180);
    engine.advance("daily");
    assertEquals(-1, engine.minFoldedCommitId(TRADES));
    engine.advance(HOURLY);
    assertEquals(2, engine.minFoldedCommitId(TRADES));
  }

  @Test
  void drop() throws IOException {
    engine.registerRollup(hourly());
    ingest(1, 60);
    engine.advance(HOURLY);

    assertTrue(engine.dropRollup(HOURLY));
    assertFalse(engine.dropRollup(HOURLY));
    assertFalse(Files.exists(rollupStore.root().resolve(HOURLY)));
    assertTrue(engine.definitions().isEmpty());
    assertThrows(IllegalArgumentException.class, () -> engine.advance(HOURLY));
    assertThrows(IllegalArgumentException.class, () -> engine.rollupLag(HOURLY));
    assertEquals(0, engine.advanceAll());
  }

  private static RollupDefinition hourly() {
    return RollupDefinition.newBuilder(HOURLY, TRADES)
        .granularity(BucketGranularity._1_HR)
        .dimensions("pool")
        .aggregate(AggregateSpec.count(), AggregateSpec.sum("fee"), AggregateSpec.count("fee"),
            AggregateSpec.max("amount"), AggregateSpec.uniq("trader"))
        .build();
  }

  private List<PartitionHandle> ingest(final long firstSequence, final int count)
      throws IOException {
    return ingestRows(trades(firstSequence, T0 + (firstSequence - 1) * MINUTE, count));
  }

  private List<PartitionHandle> ingestRows(final List<EventRow> rows) throws IOException {
    ingested.addAll(rows);
    return store.appendBatch(TRADES, rows);
  }

  /** Compares every bucket of the hourly rollup with a direct computation over the rows. */
  private void assertBucketsMatch(final RollupEngine rollups) {
    final Map<BucketKey, Object[]> expected = new TreeMap<>();
    final Map<BucketKey, Set<Object>> traders = new TreeMap<>();
    for (EventRow row : ingested) {
      final long time = (Long) row.get("block_time");
      final BucketKey key = new BucketKey(BucketGranularity._1_HR.bucketStart(time),
          Collections.singletonList(row.get("pool")));
      final Object[] values = expected.computeIfAbsent(key, k -> new Object[] {0L, 0L, 0L, null});
      values[0] = (Long) values[0] + 1;
      final Long fee = (Long) row.get("fee");
      if (fee != null) {
        values[1] = (Long) values[1] + fee;
        values[2] = (Long) values[2] + 1;
      }
      final Double amount = (Double) row.get("amount");
      values[3] = values[3] == null ? amount : Math.max((Double) values[3], amount);
      traders.computeIfAbsent(key, k -> new HashSet<>()).add(row.get("trader"));
    }

    final List<RollupBucket> buckets = rollups.buckets(HOURLY, Long.MIN_VALUE, Long.MAX_VALUE);
    assertEquals(expected.size(), buckets.size());
    for (RollupBucket bucket : buckets) {
      final Object[] values = expected.get(bucket.key());
      final Map<String, Object> actual = bucket.values(rollups.definition(HOURLY));
      assertEquals(values[0], actual.get("count()"), bucket.toString());
      assertEquals(values[1], actual.get("sum(fee)"), bucket.toString());
      assertEquals(values[2], actual.get("count(fee)"), bucket.toString());
      assertEquals(values[3], actual.get("max(amount)"), bucket.toString());
      assertEquals((long) traders.get(bucket.key()).size(), actual.get("uniq(trader)"));
    }
  }
}
