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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.PartitionQuarantinedException;
import net.chainhouse.core.ReadLease;
import net.chainhouse.core.Schema;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.RowRange;
import net.chainhouse.index.ColumnStats;
import net.chainhouse.index.IndexEntry;
import net.chainhouse.index.PartitionIndex;
import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

/**
 * Filtered, projected and optionally ordered reads over a table.
 *
 * <p>Partitions are pruned with the skip index, then scanned in parallel.
 * Inside a partition each granule is pruned with its stats, the primary
 * filter is evaluated on its columns alone and the other columns are decoded
 * only for granules with surviving rows.
 */
public class ScanEngine implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanEngine.class);

  private final ColumnStore store;
  private final PartitionIndex index;
  private final ExecutorService workers;
  private final int inFlight;

  public ScanEngine(final ColumnStore store, final int threads) {
    this.store = store;
    this.index = store.index();
    this.inFlight = threads;
    this.workers = Executors.newFixedThreadPool(threads,
        new ThreadFactoryBuilder().setNameFormat("scan-worker-%d").setDaemon(true).build());
  }

  public ColumnStore store() {
    return store;
  }

  /** Describes the partitions and granules a scan would read. */
  public ScanPlan explain(final ScanRequest request) {
    final Schema schema = store.schema(request.table());
    final Predicate primary = request.effectivePrimary(schema.timeColumn());
    final Set<String> output = outputColumns(request, schema, Collections.emptySet());
    final List<IndexEntry> candidates = index.candidates(request.table(),
        Predicates.and(primary, request.secondary()), request.accessPattern());
    final List<PartitionHandle> handles = new ArrayList<>(candidates.size());
    int granules = 0;
    int granuleCandidates = 0;
    for (IndexEntry entry : candidates) {
      handles.add(entry.handle());
      for (int g = 0; g < entry.granuleCount(); g++) {
        granules++;
        final Map<String, ColumnStats> stats = entry.granule(g);
        if (primary.mightMatch(stats) && request.secondary().mightMatch(stats)) {
          granuleCandidates++;
        }
      }
    }
    final Set<String> other = new LinkedHashSet<>(request.secondary().columns());
    other.addAll(output);
    other.removeAll(primary.columns());
    return new ScanPlan(request.table(), primary, request.secondary(), request.accessPattern(),
        index.size(request.table()), handles, granules, granuleCandidates, primary.columns(),
        other, request.orderBy(), request.limit());
  }

  /**
   * Runs a scan. Without an order the rows stream in candidate partition
   * order; with an order and a limit each worker keeps a bounded top-k, the
   * top-ks are merged through one heap of the same size and ties break on
   * the rows' scan ordinal. Quarantined candidate partitions count as failed.
   *
   * @throws PartialScanException while iterating if a partition fails and
   * partial results are not allowed.
   */
  public ScanResult scan(final ScanRequest request) {
    final Schema schema = store.schema(request.table());
    final List<String> projection = request.projection().isEmpty()
        ? schema.columnNames() : request.projection();
    for (String column : projection) {
      schema.typeOf(column);
    }
    final List<OrderBy> orderBy = request.orderBy();
    final int limit = request.limit();
    final ScanStats stats = new ScanStats();

    if (orderBy.isEmpty()) {
      final PartitionTasks<List<Row>> tasks = submit(request, Collections.emptySet(),
          position -> new ProjectionWorker(position, projection, orderBy, limit), stats);
      return new ScanResult(new StreamingIterator(tasks, limit), stats, tasks::cancel);
    }

    final Comparator<Row> comparator = rowComparator(orderBy);
    final PartitionTasks<List<Row>> tasks = submit(request, Collections.emptySet(),
        position -> limit > 0
            ? new TopKWorker(position, projection, orderBy, limit, comparator)
            : new ProjectionWorker(position, projection, orderBy, 0), stats);
    final List<Row> rows;
    if (limit > 0) {
      // one bounded heap over every partition's top-k, worst row on top
      final PriorityQueue<Row> heap = new PriorityQueue<>(limit + 1, comparator.reversed());
      PartitionOutput<List<Row>> output;
      while ((output = tasks.next()) != null) {
        for (Row row : output.result()) {
          if (heap.size() < limit) {
            heap.add(row);
          } else if (comparator.compare(row, heap.peek()) < 0) {
            heap.poll();
            heap.add(row);
          } else {
            // partition results are sorted, the rest cannot enter the heap
            break;
          }
        }
      }
      rows = new ArrayList<>(heap);
    } else {
      rows = new ArrayList<>();
      PartitionOutput<List<Row>> output;
      while ((output = tasks.next()) != null) {
        rows.addAll(output.result());
      }
    }
    rows.sort(comparator);
    return new ScanResult(rows.iterator(), stats, () -> { });
  }

  /** Orders rows by the given keys, then by scan ordinal. */
  static Comparator<Row> rowComparator(final List<OrderBy> orderBy) {
    Comparator<Row> comparator = null;
    for (int i = 0; i < orderBy.size(); i++) {
      final int key = i;
      final Comparator<Row> next = orderBy.get(i).comparator(row -> row.sortKey(key));
      comparator = comparator == null ? next : comparator.thenComparing(next);
    }
    final Comparator<Row> byOrdinal = Comparator.comparingLong(Row::ordinal);
    return comparator == null ? byOrdinal : comparator.thenComparing(byOrdinal);
  }

  /**
   * Prunes partitions and submits one task per candidate.
   *
   * @param extraColumns columns the workers need besides the projection.
   */
  public <T> PartitionTasks<T> submit(final ScanRequest request,
                                      final Collection<String> extraColumns,
                                      final PartitionWorker.Factory<T> factory,
                                      final ScanStats stats) {
    request.cancellation().throwIfCancelled();
    final Schema schema = store.schema(request.table());
    final Predicate primary = request.effectivePrimary(schema.timeColumn());
    for (String column : primary.columns()) {
      schema.typeOf(column);
    }
    for (String column : request.secondary().columns()) {
      schema.typeOf(column);
    }
    final Set<String> columns = outputColumns(request, schema, extraColumns);
    final List<IndexEntry> candidates = index.candidates(request.table(),
        Predicates.and(primary, request.secondary()), request.accessPattern(), true);
    final int total = index.size(request.table());
    stats.addPartitionsTotal(total);
    stats.addPartitionsPruned(total - candidates.size());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Scanning {} of {} partitions for {}", candidates.size(), total, request);
    }

    final IntFunction<Future<T>> submitter = position -> {
      final IndexEntry entry = candidates.get(position);
      if (index.isQuarantined(entry.handle())) {
        stats.incrementPartitionsQuarantined();
        return CompletableFuture.failedFuture(new PartitionQuarantinedException(entry.handle()));
      }
      return workers.submit(() -> {
        final PartitionWorker<T> worker = factory.create(position);
        try (ReadLease lease = store.acquire(entry.handle())) {
          if (lease == null) {
            stats.incrementPartitionsEvicted();
            return worker.result();
          }
          scanPartition(entry, primary, request.secondary(), columns,
              request.cancellation(), stats, worker);
        }
        return worker.result();
      });
    };
    return new PartitionTasks<>(request.table(), candidates, submitter, inFlight, stats, store,
        request.allowPartialResults());
  }

  private static Set<String> outputColumns(final ScanRequest request,
                                           final Schema schema,
                                           final Collection<String> extraColumns) {
    final Set<String> columns = new LinkedHashSet<>(request.projection().isEmpty()
        ? schema.columnNames() : request.projection());
    for (OrderBy order : request.orderBy()) {
      columns.add(order.column());
    }
    columns.addAll(extraColumns);
    for (String column : columns) {
      schema.typeOf(column);
    }
    return columns;
  }

  /**
   * Scans one partition on the calling thread, passing every matching row
   * to the visitor in row order.
   *
   * @param columns the columns the visitor reads besides the filter columns.
   * @throws QueryCancelledException if the token is cancelled between granules.
   */
  public void scanPartition(final IndexEntry entry,
                            final Predicate primary,
                            final Predicate secondary,
                            final Collection<String> columns,
                            final CancellationToken cancellation,
                            final ScanStats stats,
                            final RowVisitor visitor) {
    final PartitionHandle handle = entry.handle();
    stats.incrementPartitionsScanned();
    final Set<String> primaryColumns = primary.columns();
    final Set<String> needed = new LinkedHashSet<>(secondary.columns());
    needed.addAll(columns);

    for (int g = 0; g < entry.granuleCount(); g++) {
      cancellation.throwIfCancelled();
      final Map<String, ColumnStats> granuleStats = entry.granule(g);
      if (!primary.mightMatch(granuleStats) || !secondary.mightMatch(granuleStats)) {
        stats.incrementGranulesPruned();
        continue;
      }
      stats.incrementGranulesScanned();
      final RowRange range = entry.granuleRange(g);
      stats.addRowsRead(range.size());
      RoaringBitmap rows = RoaringBitmap.bitmapOfRange(0, range.size());

      ColumnBlockSet block = null;
      if (!primary.mustMatch(granuleStats)) {
        block = store.readColumns(handle, primaryColumns, range);
        stats.addBytes(block.bytesRead(), block.bytesDecompressed());
        rows = primary.evaluate(block, rows);
        if (rows.isEmpty()) {
          continue;
        }
      }

      final Set<String> toRead = new LinkedHashSet<>(needed);
      if (block != null) {
        toRead.removeAll(block.columns());
      }
      if (!toRead.isEmpty()) {
        final ColumnBlockSet rest = store.readColumns(handle, toRead, range);
        stats.addBytes(rest.bytesRead(), rest.bytesDecompressed());
        block = block == null ? rest : block.with(rest);
      } else if (block == null) {
        block = new ColumnBlockSet(range, Collections.emptyMap(), 0, 0);
      }

      if (!secondary.mustMatch(granuleStats)) {
        rows = secondary.evaluate(block, rows);
      }
      stats.addRowsMatched(rows.getCardinality());
      final IntIterator iterator = rows.getIntIterator();
      while (iterator.hasNext()) {
        final int row = iterator.next();
        if (!visitor.visit(handle, block, row, range.from() + row)) {
          return;
        }
      }
    }
  }

  @Override
  public void close() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        LOGGER.warn("Scan workers did not terminate");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Streams rows partition by partition, stopping at the limit. */
  private static final class StreamingIterator implements Iterator<Row> {
    private final PartitionTasks<List<Row>> tasks;
    private final int limit;
    private Iterator<Row> current = Collections.emptyIterator();
    private int emitted;
    private boolean done;

    private StreamingIterator(final PartitionTasks<List<Row>> tasks, final int limit) {
      this.tasks = tasks;
      this.limit = limit;
    }

    @Override
    public boolean hasNext() {
      if (done) {
        return false;
      }
      if (limit > 0 && emitted >= limit) {
        finish();
        return false;
      }
      while (!current.hasNext()) {
        final PartitionOutput<List<Row>> output = tasks.next();
        if (output == null) {
          finish();
          return false;
        }
        current = output.result().iterator();
      }
      return true;
    }

    @Override
    public Row next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      emitted++;
      return current.next();
    }

    private void finish() {
      done = true;
      tasks.cancel();
    }
  }
}
