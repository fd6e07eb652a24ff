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

import io.ultrabrew.metrics.Counter;
import io.ultrabrew.metrics.MetricRegistry;
import io.ultrabrew.metrics.Timer;
import net.chainhouse.TestClock;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.RowRange;
import net.chainhouse.index.PartitionIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static net.chainhouse.TestUtil.HOUR;
import static net.chainhouse.TestUtil.MINUTE;
import static net.chainhouse.TestUtil.T0;
import static net.chainhouse.TestUtil.TRADES;
import static net.chainhouse.TestUtil.config;
import static net.chainhouse.TestUtil.trade;
import static net.chainhouse.TestUtil.trades;
import static net.chainhouse.TestUtil.tradesSchema;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ColumnStoreTest {

  @TempDir
  Path dir;

  private final TestClock clock = new TestClock(T0 + 24 * HOUR);
  private ColumnStore store;

  @AfterEach
  void afterEach() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  void batchSplitsByPartitionWindow() throws IOException {
    store = open();
    final List<PartitionHandle> handles =
        store.appendBatch(TRADES, trades(1, T0 + 50 * MINUTE, 20));

    assertEquals(2, handles.size());
    assertEquals(0, handles.get(0).commitId());
    assertEquals(1, handles.get(1).commitId());
    assertEquals(T0, handles.get(0).partitionStart());
    assertEquals(T0 + HOUR, handles.get(1).partitionStart());
    assertEquals(10, handles.get(0).rowCount());
    assertEquals(1, handles.get(0).minSequence());
    assertEquals(10, handles.get(0).maxSequence());
    assertEquals(T0 + 59 * MINUTE, handles.get(0).maxTime());
    assertEquals(2, store.index().size(TRADES));
    assertEquals(20, store.index().lastSequence(TRADES));

    final ColumnBlockSet block = store.readColumns(handles.get(1),
        Arrays.asList("pool", "fee", "amount", "trader"), RowRange.of(3, 9));
    assertEquals(6, block.rowCount());
    assertEquals("usdc-eth", block.value("pool", 1));
    assertEquals(150L, block.value("fee", 1));
    assertNull(block.value("fee", 0));
    assertEquals(3.5, block.value("amount", 0));
    assertTrue(block.bytesRead() > 0);
  }

  @Test
  void rejectedBatchesLeaveNothingVisible() throws IOException {
    store = open();
    store.appendBatch(TRADES, trades(1, T0, 5));

    final IngestionException replay =
        assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, trades(5, T0, 2)));
    assertEquals(0, replay.getRowIndex());

    final IngestionException decreasing = assertThrows(IngestionException.class,
        () -> store.appendBatch(TRADES, Arrays.asList(
            trade(10, T0, "a", null, 1L, 1.0),
            trade(9, T0, "a", null, 1L, 1.0))));
    assertEquals(1, decreasing.getRowIndex());

    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, Collections.singletonList(
        EventRow.newBuilder(10).set("block_time", T0).set("pool", "a").set("gas", 1L).build())));
    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, Collections.singletonList(
        EventRow.newBuilder(10).set("block_time", T0).build())));
    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, Collections.singletonList(
        EventRow.newBuilder(10).set("block_time", T0).set("pool", "a").set("fee", "cheap").build())));
    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, Collections.singletonList(
        EventRow.newBuilder(10).set("block_time", T0).set("pool", "a")
            .set("fee", new BigInteger("99999999999999999999")).build())));

    assertEquals(1, store.index().size(TRADES));
    assertEquals(5, store.index().lastSequence(TRADES));
    assertEquals(5, store.tableStats(TRADES).rows());
  }

  @Test
  void failedPublishRollsBackTheWholeBatch() throws IOException {
    final FailingColumnStore failing = new FailingColumnStore(1);
    store = failing;

    assertThrows(StorageIOException.class,
        () -> store.appendBatch(TRADES, trades(1, T0, 150)));
    assertEquals(0, store.index().size(TRADES));
    assertEquals(-1, store.index().lastSequence(TRADES));
    assertEquals(Arrays.asList(ColumnStore.INDEX_FILE, ColumnStore.SCHEMA_FILE), listTable());

    failing.failAfter.set(Integer.MAX_VALUE);
    final List<PartitionHandle> handles = store.appendBatch(TRADES, trades(1, T0, 150));
    assertEquals(3, handles.size());
    assertEquals(0, handles.get(0).commitId());
  }

  @Test
  void reopenRestoresPartitionsAndWatermarks() throws IOException {
    store = open();
    store.appendBatch(TRADES, trades(1, T0, 90));
    final TableStats before = store.tableStats(TRADES);
    store.close();

    store = open();
    assertEquals(2, store.index().size(TRADES));
    assertEquals(1, store.index().lastCommitId(TRADES));
    assertEquals(90, store.index().lastSequence(TRADES));
    assertEquals(before.rows(), store.tableStats(TRADES).rows());
    assertEquals(before.compressedBytes(), store.tableStats(TRADES).compressedBytes());
    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, trades(90, T0, 1)));
    assertEquals(2, store.appendBatch(TRADES, trades(91, T0 + 2 * HOUR, 1)).get(0).commitId());
  }

  @Test
  void reopenCompletesAnInterruptedCommit() throws IOException {
    store = open();
    final PartitionHandle handle = store.appendBatch(TRADES, trades(1, T0, 10)).get(0);
    store.close();

    final Path table = dir.resolve(TRADES);
    Files.move(table.resolve(handle.id()), table.resolve(ColumnStore.TMP_PREFIX + handle.id()));
    StoreFiles.writeJson(table.resolve(ColumnStore.COMMIT_PREFIX + handle.commitId() + ".json"),
        Collections.singletonList(handle.id()));
    Files.createDirectories(table.resolve(ColumnStore.TMP_PREFIX + "abandoned"));

    store = open();
    assertFalse(store.index().isHalted(TRADES));
    assertEquals(1, store.index().size(TRADES));
    assertEquals(Arrays.asList(handle.id(), ColumnStore.INDEX_FILE, ColumnStore.SCHEMA_FILE),
        listTable());
    assertEquals(10, store.tableStats(TRADES).rows());
  }

  @Test
  void missingPartitionHaltsWritesUntilRepaired() throws IOException {
    store = open();
    final List<PartitionHandle> handles = store.appendBatch(TRADES, trades(1, T0, 90));
    store.close();
    StoreFiles.deleteDirectory(dir.resolve(TRADES).resolve(handles.get(0).id()));

    store = open();
    assertTrue(store.index().isHalted(TRADES));
    assertThrows(IndexConsistencyException.class,
        () -> store.appendBatch(TRADES, trades(91, T0 + 2 * HOUR, 1)));

    store.repairIndex(TRADES);
    assertFalse(store.index().isHalted(TRADES));
    assertEquals(1, store.index().size(TRADES));
    final PartitionHandle next = store.appendBatch(TRADES, trades(91, T0 + 2 * HOUR, 1)).get(0);
    assertEquals(2, next.commitId());
  }

  @Test
  void evictionWaitsForLeases() throws IOException {
    store = open();
    final List<PartitionHandle> handles = store.appendBatch(TRADES, trades(1, T0, 150));
    final ReadLease lease = store.acquire(handles.get(0));
    assertNotNull(lease);

    final List<PartitionHandle> evicted = store.evict(TRADES, T0 + 2 * HOUR, Long.MAX_VALUE);
    assertEquals(handles.subList(0, 2), evicted);
    assertEquals(1, store.index().size(TRADES));
    assertNull(store.acquire(handles.get(1)));

    assertEquals(1, store.collectGarbage());
    assertTrue(Files.exists(store.partitionDir(handles.get(0))));
    assertFalse(Files.exists(store.partitionDir(handles.get(1))));

    lease.close();
    lease.close();
    assertEquals(1, store.collectGarbage());
    assertFalse(Files.exists(store.partitionDir(handles.get(0))));
    assertEquals(0, store.pendingGarbage());

    store.close();
    store = open();
    assertEquals(1, store.index().size(TRADES));
    assertEquals(2, store.index().lastCommitId(TRADES));
  }

  @Test
  void evictionRespectsTheCommitBound() throws IOException {
    store = open();
    final List<PartitionHandle> handles = store.appendBatch(TRADES, trades(1, T0, 150));
    final List<PartitionHandle> evicted = store.evict(TRADES, T0 + 3 * HOUR, 0);
    assertEquals(Collections.singletonList(handles.get(0)), evicted);
  }

  @Test
  void createTable() throws IOException {
    store = open();
    store.createTable(tradesSchema());
    assertThrows(IllegalArgumentException.class, () -> store.createTable(
        Schema.newBuilder(TRADES).timeColumn("block_time").build()));
    assertThrows(IllegalArgumentException.class, () -> store.createTable(
        Schema.newBuilder(ColumnStore.ROLLUP_DIR).timeColumn("t").build()));
    assertThrows(IllegalArgumentException.class, () -> store.createTable(
        Schema.newBuilder("logs").timeColumn("t").childOf("receipts").build()));

    store.createTable(Schema.newBuilder("logs").timeColumn("t").childOf(TRADES).build());
    assertTrue(store.schema("logs").has(Schema.PARENT_SEQUENCE_COLUMN));
    assertThrows(IngestionException.class, () -> store.appendBatch("logs", Collections.singletonList(
        EventRow.newBuilder(1).set("t", T0).build())));
  }

  @Test
  void schemaValidation() {
    assertThrows(IllegalArgumentException.class,
        () -> Schema.newBuilder("bad/name").timeColumn("t").build());
    assertThrows(IllegalArgumentException.class,
        () -> Schema.newBuilder("t").timeColumn("t").column("t", ColumnType.LONG).build());
    assertThrows(IllegalArgumentException.class,
        () -> Schema.newBuilder("t").timeColumn("t").column("bad-name", ColumnType.LONG).build());
    assertThrows(IllegalArgumentException.class,
        () -> Schema.newBuilder("t").timeColumn("t").column(Schema.SEQUENCE_COLUMN, ColumnType.LONG)
            .build());
  }

  @Test
  void commitListenersSeeEveryBatch() throws IOException {
    store = open();
    final AtomicInteger partitions = new AtomicInteger();
    store.addCommitListener((table, handles) -> partitions.addAndGet(handles.size()));
    store.addCommitListener((table, handles) -> {
      throw new IllegalStateException("listener failure");
    });
    store.appendBatch(TRADES, trades(1, T0, 90));
    store.appendBatch(TRADES, Collections.emptyList());
    assertEquals(2, partitions.get());
  }

  @Test
  void commitsQuarantinesAndEvictionsAreCounted() throws IOException {
    final MetricRegistry registry = mock(MetricRegistry.class);
    final Counter commits = mock(Counter.class);
    final Counter rows = mock(Counter.class);
    final Counter errors = mock(Counter.class);
    final Counter quarantined = mock(Counter.class);
    final Counter evicted = mock(Counter.class);
    final Timer commitTimer = mock(Timer.class);
    when(registry.counter(anyString())).thenReturn(mock(Counter.class));
    when(registry.counter("store.partition.commits")).thenReturn(commits);
    when(registry.counter("store.rows.appended")).thenReturn(rows);
    when(registry.counter("store.commit.errors")).thenReturn(errors);
    when(registry.counter("store.partition.quarantined")).thenReturn(quarantined);
    when(registry.counter("store.partition.evicted")).thenReturn(evicted);
    when(registry.timer("store.commit.timeTaken")).thenReturn(commitTimer);
    when(commitTimer.start()).thenReturn(42L);

    store = ColumnStore.open(config(dir), new PartitionIndex(), clock, registry);
    store.createTable(tradesSchema());
    final List<PartitionHandle> handles = store.appendBatch(TRADES, trades(1, T0, 150));
    assertEquals(3, handles.size());
    verify(commits).inc(3L, "table", TRADES);
    verify(rows).inc(150L, "table", TRADES);
    verify(commitTimer).stop(42L, "table", TRADES);

    assertThrows(IngestionException.class, () -> store.appendBatch(TRADES, trades(1, T0, 1)));
    verify(errors, never()).inc("table", TRADES);

    store.quarantine(handles.get(2));
    verify(quarantined).inc("table", TRADES);

    assertEquals(2, store.evict(TRADES, T0 + 2 * HOUR, Long.MAX_VALUE).size());
    verify(evicted).inc(2L, "table", TRADES);
    assertSame(registry, store.metricRegistry());
  }

  private ColumnStore open() throws IOException {
    final ColumnStore opened = ColumnStore.open(config(dir), new PartitionIndex(), clock);
    opened.createTable(tradesSchema());
    return opened;
  }

  private List<String> listTable() throws IOException {
    try (Stream<Path> files = Files.list(dir.resolve(TRADES))) {
      return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }

  private class FailingColumnStore extends ColumnStore {

    private final AtomicInteger failAfter;

    private FailingColumnStore(final int failAfter) throws IOException {
      super(net.chainhouse.TestUtil.config(dir), new PartitionIndex(), clock);
      this.failAfter = new AtomicInteger(failAfter);
      recover();
      createTable(tradesSchema());
    }

    @Override
    protected void publish(final Path tmp, final Path target) throws IOException {
      if (failAfter.getAndDecrement() <= 0) {
        throw new IOException("disk full");
      }
      super.publish(tmp, target);
    }
  }
}
