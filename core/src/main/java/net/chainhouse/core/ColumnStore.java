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

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.ultrabrew.metrics.Counter;
import io.ultrabrew.metrics.MetricRegistry;
import io.ultrabrew.metrics.Timer;
import net.chainhouse.core.codec.ColumnCodec;
import net.chainhouse.core.codec.ColumnCodecs;
import net.chainhouse.core.codec.SegmentInfo;
import net.chainhouse.core.codec.SegmentReader;
import net.chainhouse.core.codec.SegmentWriter;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.ColumnVector;
import net.chainhouse.core.data.RowRange;
import net.chainhouse.index.ColumnStats;
import net.chainhouse.index.IndexEntry;
import net.chainhouse.index.IndexSnapshot;
import net.chainhouse.index.PartitionIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only columnar storage of event tables.
 *
 * <p>A batch is split by partition window and every window becomes a new
 * immutable partition directory holding one segment file per column. The
 * batch commits when its commit record is written: either every partition of
 * the batch becomes visible or none does, also across a crash.
 *
 * <pre>
 *   dataDir/table/schema.json
 *   dataDir/table/partitions.idx
 *   dataDir/table/start-commitId/column.seg
 *   dataDir/table/start-commitId/manifest.json
 * </pre>
 */
public class ColumnStore implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ColumnStore.class);

  public static final String ROLLUP_DIR = "_rollups";
  static final String SCHEMA_FILE = "schema.json";
  static final String INDEX_FILE = "partitions.idx";
  static final String TMP_PREFIX = ".tmp-";
  static final String COMMIT_PREFIX = "commit-";
  static final String EVICTED_MARKER = ".evicted";
  static final String SEGMENT_SUFFIX = ".seg";

  private final StoreConfig config;
  private final Path root;
  private final PartitionIndex index;
  private final Clock clock;
  private final Map<String, TableState> tables = new ConcurrentHashMap<>();
  private final List<CommitListener> listeners = new CopyOnWriteArrayList<>();
  private final PartitionCollector collector;
  private final Cache<String, SegmentReader> readers;
  private final MetricRegistry metricRegistry;
  private final Counter commitCounter;
  private final Counter rowCounter;
  private final Counter commitErrorCounter;
  private final Timer commitTimer;
  private final Counter quarantineCounter;
  private final Counter evictionCounter;

  protected ColumnStore(final StoreConfig config, final PartitionIndex index, final Clock clock) {
    this(config, index, clock, new MetricRegistry());
  }

  protected ColumnStore(final StoreConfig config,
                        final PartitionIndex index,
                        final Clock clock,
                        final MetricRegistry metricRegistry) {
    config.validate();
    this.config = config;
    this.root = config.getDataPath();
    this.index = index;
    this.clock = clock;
    this.collector = new PartitionCollector(config.collectionDelaySeconds * 1000L, clock,
        this::leaseCount);
    this.readers = CacheBuilder.newBuilder().maximumSize(4096).build();
    this.metricRegistry = metricRegistry;
    this.commitCounter = metricRegistry.counter("store.partition.commits");
    this.rowCounter = metricRegistry.counter("store.rows.appended");
    this.commitErrorCounter = metricRegistry.counter("store.commit.errors");
    this.commitTimer = metricRegistry.timer("store.commit.timeTaken");
    this.quarantineCounter = metricRegistry.counter("store.partition.quarantined");
    this.evictionCounter = metricRegistry.counter("store.partition.evicted");
  }

  /**
   * Opens the store, finishing or discarding batches interrupted by a crash
   * and verifying every table's index against the committed partitions. A
   * table whose index disagrees with its data has its writes halted until
   * {@link #repairIndex(String)} is called.
   */
  public static ColumnStore open(final StoreConfig config,
                                 final PartitionIndex index,
                                 final Clock clock) throws IOException {
    return open(config, index, clock, new MetricRegistry());
  }

  public static ColumnStore open(final StoreConfig config,
                                 final PartitionIndex index,
                                 final Clock clock,
                                 final MetricRegistry metricRegistry) throws IOException {
    final ColumnStore store = new ColumnStore(config, index, clock, metricRegistry);
    store.recover();
    return store;
  }

  void recover() throws IOException {
    Files.createDirectories(root);
    for (Path dir : StoreFiles.list(root)) {
      final Path schemaFile = dir.resolve(SCHEMA_FILE);
      if (!Files.isDirectory(dir) || !Files.exists(schemaFile)) {
        continue;
      }
      final Schema schema = StoreFiles.readJson(schemaFile, Schema.class);
      final TableState state = new TableState(schema, dir);
      tables.put(schema.table(), state);
      index.createTable(schema.table());
      recoverTable(state);
    }
    LOGGER.info("Opened column store at {} with tables {}", root, tables.keySet());
  }

  private void recoverTable(final TableState state) throws IOException {
    final String table = state.schema.table();
    final List<String> problems = new ArrayList<>();

    final List<Path> commitRecords = new ArrayList<>();
    for (Path child : StoreFiles.list(state.dir)) {
      final String name = child.getFileName().toString();
      if (name.startsWith(COMMIT_PREFIX)) {
        commitRecords.add(child);
        final List<String> ids = StoreFiles.MAPPER.readValue(child.toFile(),
            new TypeReference<List<String>>() {});
        for (String id : ids) {
          final Path tmp = state.dir.resolve(TMP_PREFIX + id);
          final Path target = state.dir.resolve(id);
          if (Files.exists(tmp) && !Files.exists(target)) {
            StoreFiles.move(tmp, target);
            LOGGER.info("Completed interrupted commit of {}/{}", table, id);
          } else if (!Files.exists(target)) {
            problems.add("committed partition " + id + " is missing");
          }
        }
      }
    }

    final Map<Long, PartitionManifest> onDisk = new TreeMap<>();
    final Set<String> evicted = new HashSet<>();
    for (Path child : StoreFiles.list(state.dir)) {
      final String name = child.getFileName().toString();
      if (!Files.isDirectory(child)) {
        continue;
      }
      if (name.startsWith(TMP_PREFIX)) {
        StoreFiles.deleteDirectory(child);
        continue;
      }
      if (Files.exists(child.resolve(EVICTED_MARKER))) {
        evicted.add(name);
        StoreFiles.deleteDirectory(child);
        continue;
      }
      final Path manifestFile = child.resolve(PartitionManifest.FILE_NAME);
      if (!Files.exists(manifestFile)) {
        problems.add("partition directory " + name + " has no manifest");
        continue;
      }
      final PartitionManifest manifest = StoreFiles.readJson(manifestFile, PartitionManifest.class);
      onDisk.put(manifest.handle().commitId(), manifest);
    }

    final Path indexFile = state.dir.resolve(INDEX_FILE);
    final IndexSnapshot snapshot = Files.exists(indexFile)
        ? StoreFiles.readJson(indexFile, IndexSnapshot.class) : null;
    long lastCommitId = -1;
    long lastSequence = -1;
    List<Long> quarantined = Collections.emptyList();
    if (snapshot != null) {
      lastCommitId = snapshot.lastCommitId();
      lastSequence = snapshot.lastSequence();
      quarantined = snapshot.quarantined();
      final Map<Long, IndexEntry> indexed = new TreeMap<>();
      for (IndexEntry entry : snapshot.entries()) {
        if (evicted.contains(entry.handle().id())) {
          continue;
        }
        indexed.put(entry.handle().commitId(), entry);
        final PartitionManifest manifest = onDisk.get(entry.handle().commitId());
        if (manifest == null) {
          problems.add("indexed partition " + entry.handle() + " has no data");
        } else if (!manifest.entry().equals(entry)) {
          problems.add("index entry of " + entry.handle() + " differs from its manifest");
        }
      }
      for (Map.Entry<Long, PartitionManifest> entry : onDisk.entrySet()) {
        if (!indexed.containsKey(entry.getKey()) && entry.getKey() <= snapshot.lastCommitId()) {
          problems.add("committed partition " + entry.getValue().handle() + " is not indexed");
        }
      }
    }

    final List<IndexEntry> entries = new ArrayList<>(onDisk.size());
    for (PartitionManifest manifest : onDisk.values()) {
      entries.add(manifest.entry());
    }
    index.load(new IndexSnapshot(table, lastCommitId, lastSequence, entries, quarantined));
    state.manifests.putAll(onDisk);

    if (!problems.isEmpty()) {
      index.halt(table, String.join("; ", problems));
      return;
    }
    persistIndex(table);
    for (Path record : commitRecords) {
      Files.deleteIfExists(record);
    }
  }

  /**
   * Rebuilds a table's index from the committed partition manifests and
   * resumes writes.
   */
  public void repairIndex(final String table) throws IOException {
    final TableState state = state(table);
    state.writeLock.lock();
    try {
      final Map<Long, PartitionManifest> onDisk = new TreeMap<>();
      for (Path child : StoreFiles.list(state.dir)) {
        final Path manifestFile = child.resolve(PartitionManifest.FILE_NAME);
        if (Files.isDirectory(child) && Files.exists(manifestFile)
            && !child.getFileName().toString().startsWith(TMP_PREFIX)
            && !Files.exists(child.resolve(EVICTED_MARKER))) {
          final PartitionManifest manifest =
              StoreFiles.readJson(manifestFile, PartitionManifest.class);
          onDisk.put(manifest.handle().commitId(), manifest);
        }
      }
      final List<IndexEntry> entries = new ArrayList<>();
      for (PartitionManifest manifest : onDisk.values()) {
        entries.add(manifest.entry());
      }
      index.repair(table, entries);
      state.manifests.clear();
      state.manifests.putAll(onDisk);
      persistIndex(table);
      for (Path child : StoreFiles.list(state.dir)) {
        if (child.getFileName().toString().startsWith(COMMIT_PREFIX)) {
          Files.deleteIfExists(child);
        }
      }
    } finally {
      state.writeLock.unlock();
    }
  }

  /**
   * Creates a table. Creating a table that exists with the same schema is a
   * no-op.
   *
   * @throws IllegalArgumentException if the table exists with another schema
   * or a child table's parent does not exist.
   */
  public void createTable(final Schema schema) throws IOException {
    synchronized (tables) {
      final TableState existing = tables.get(schema.table());
      if (existing != null) {
        if (!existing.schema.equals(schema)) {
          throw new IllegalArgumentException("Table " + schema.table()
              + " already exists with a different schema");
        }
        return;
      }
      if (schema.isChild() && !tables.containsKey(schema.parentTable())) {
        throw new IllegalArgumentException("Parent table " + schema.parentTable()
            + " of " + schema.table() + " does not exist");
      }
      if (schema.table().equals(ROLLUP_DIR)) {
        throw new IllegalArgumentException("Reserved table name " + schema.table());
      }
      final Path dir = root.resolve(schema.table());
      Files.createDirectories(dir);
      StoreFiles.writeJson(dir.resolve(SCHEMA_FILE), schema);
      tables.put(schema.table(), new TableState(schema, dir));
      index.createTable(schema.table());
      persistIndex(schema.table());
      LOGGER.info("Created table {}", schema);
    }
  }

  public Schema schema(final String table) {
    return state(table).schema;
  }

  public boolean hasTable(final String table) {
    return tables.containsKey(table);
  }

  public Collection<String> tables() {
    return Collections.unmodifiableSet(tables.keySet());
  }

  public PartitionIndex index() {
    return index;
  }

  public StoreConfig config() {
    return config;
  }

  public void addCommitListener(final CommitListener listener) {
    listeners.add(listener);
  }

  public void removeCommitListener(final CommitListener listener) {
    listeners.remove(listener);
  }

  /**
   * Appends a batch of events. The batch becomes visible atomically.
   *
   * @return the partitions created, in time order.
   * @throws IngestionException if the batch fails validation.
   * @throws StorageIOException on a storage failure; nothing is visible.
   * @throws IndexConsistencyException if writes to the table are halted.
   */
  public List<PartitionHandle> appendBatch(final String table,
                                           final List<EventRow> rows) throws StorageIOException {
    final TableState state = state(table);
    if (rows == null || rows.isEmpty()) {
      return Collections.emptyList();
    }
    final List<PartitionHandle> handles;
    final String[] tags = {"table", table};
    state.writeLock.lock();
    final long start = commitTimer.start();
    try {
      index.checkWritable(table);
      final List<Object[]> coerced = validate(state.schema, rows, index.lastSequence(table));
      handles = commit(state, coerced);
    } catch (StorageIOException e) {
      commitErrorCounter.inc(tags);
      throw e;
    } finally {
      state.writeLock.unlock();
    }
    commitTimer.stop(start, tags);
    commitCounter.inc(handles.size(), tags);
    rowCounter.inc(rows.size(), tags);
    for (CommitListener listener : listeners) {
      try {
        listener.onCommit(table, handles);
      } catch (RuntimeException e) {
        LOGGER.error("Commit listener failed for {}", table, e);
      }
    }
    return handles;
  }

  private static List<Object[]> validate(final Schema schema,
                                         final List<EventRow> rows,
                                         final long lastSequence) {
    final List<ColumnDefinition> columns = schema.columns();
    final List<Object[]> result = new ArrayList<>(rows.size());
    long previous = lastSequence;
    for (int i = 0; i < rows.size(); i++) {
      final EventRow row = rows.get(i);
      if (row == null) {
        throw new IngestionException("null row", i);
      }
      if (i == 0 && row.sequence() <= lastSequence) {
        throw new IngestionException("sequence " + row.sequence()
            + " is not after the last committed sequence " + lastSequence, i);
      }
      if (row.sequence() < previous) {
        throw new IngestionException("sequence " + row.sequence()
            + " is smaller than the previous row's " + previous, i);
      }
      previous = row.sequence();
      for (String name : row.values().keySet()) {
        if (!schema.has(name) || Schema.SEQUENCE_COLUMN.equals(name)) {
          throw new IngestionException("unknown column " + name, i);
        }
      }
      final Object[] values = new Object[columns.size()];
      for (int c = 0; c < columns.size(); c++) {
        final ColumnDefinition column = columns.get(c);
        final Object raw = c == 0 ? (Object) row.sequence() : row.get(column.name());
        if (raw == null) {
          if (!column.nullable()) {
            throw new IngestionException("missing value for non-null column " + column.name(), i);
          }
          continue;
        }
        try {
          values[c] = column.type().coerce(raw);
        } catch (IllegalArgumentException e) {
          throw new IngestionException("column " + column.name() + ": " + e.getMessage(), i);
        }
      }
      result.add(values);
    }
    return result;
  }

  private List<PartitionHandle> commit(final TableState state,
                                       final List<Object[]> rows) throws StorageIOException {
    final Schema schema = state.schema;
    final String table = schema.table();
    final int timeIndex = schema.columnNames().indexOf(schema.timeColumn());
    final PartitionWidth width = config.getPartitionWidth();

    final TreeMap<Long, List<Object[]>> windows = new TreeMap<>();
    for (Object[] row : rows) {
      final long start = width.partitionStart((Long) row[timeIndex]);
      windows.computeIfAbsent(start, k -> new ArrayList<>()).add(row);
    }

    long commitId = index.lastCommitId(table) + 1;
    final List<PartitionManifest> manifests = new ArrayList<>(windows.size());
    final List<Path> tmpDirs = new ArrayList<>(windows.size());
    final List<Path> targets = new ArrayList<>(windows.size());
    Path commitRecord = null;
    try {
      for (Map.Entry<Long, List<Object[]>> window : windows.entrySet()) {
        final List<Object[]> windowRows = window.getValue();
        long minTime = Long.MAX_VALUE;
        long maxTime = Long.MIN_VALUE;
        for (Object[] row : windowRows) {
          minTime = Math.min(minTime, (Long) row[timeIndex]);
          maxTime = Math.max(maxTime, (Long) row[timeIndex]);
        }
        final PartitionHandle handle = new PartitionHandle(table, commitId++,
            window.getKey(), window.getKey() + width.getMillis(),
            (Long) windowRows.get(0)[0], (Long) windowRows.get(windowRows.size() - 1)[0],
            minTime, maxTime, windowRows.size());
        final Path tmp = state.dir.resolve(TMP_PREFIX + handle.id());
        tmpDirs.add(tmp);
        targets.add(state.dir.resolve(handle.id()));
        manifests.add(writePartition(schema, tmp, handle, windowRows));
      }

      final List<String> ids = new ArrayList<>(manifests.size());
      for (PartitionManifest manifest : manifests) {
        ids.add(manifest.handle().id());
      }
      commitRecord = state.dir.resolve(COMMIT_PREFIX + manifests.get(0).handle().commitId()
          + ".json");
      StoreFiles.writeJson(commitRecord, ids);
    } catch (IOException e) {
      discard(tmpDirs, commitRecord, e);
      throw new StorageIOException("Failed to write batch to " + table, e);
    }

    int published = 0;
    try {
      for (; published < tmpDirs.size(); published++) {
        publish(tmpDirs.get(published), targets.get(published));
      }
    } catch (IOException e) {
      boolean rolledBack = true;
      for (int i = published - 1; i >= 0; i--) {
        try {
          StoreFiles.move(targets.get(i), tmpDirs.get(i));
        } catch (IOException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
          rolledBack = false;
        }
      }
      if (rolledBack) {
        discard(tmpDirs, commitRecord, e);
      } else {
        // the commit record stays so the next open completes the batch
        index.halt(table, "batch " + commitRecord.getFileName() + " partially published");
      }
      throw new StorageIOException("Failed to publish batch to " + table, e);
    }

    final List<IndexEntry> entries = new ArrayList<>(manifests.size());
    final List<PartitionHandle> handles = new ArrayList<>(manifests.size());
    for (PartitionManifest manifest : manifests) {
      entries.add(manifest.entry());
      handles.add(manifest.handle());
      state.manifests.put(manifest.handle().commitId(), manifest);
    }
    index.record(table, entries);
    try {
      persistIndex(table);
      Files.deleteIfExists(commitRecord);
    } catch (IOException e) {
      LOGGER.warn("Failed to persist index of {}, it will be rebuilt on open", table, e);
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Committed {} rows to {} as {}", rows.size(), table, handles);
    }
    return Collections.unmodifiableList(handles);
  }

  /** Moves a fully written partition into place and syncs the table directory. */
  protected void publish(final Path tmp, final Path target) throws IOException {
    StoreFiles.syncDirectory(tmp);
    StoreFiles.move(tmp, target);
    StoreFiles.syncDirectory(target.getParent());
  }

  private static void discard(final List<Path> tmpDirs,
                              final Path commitRecord,
                              final IOException cause) {
    for (Path tmp : tmpDirs) {
      try {
        StoreFiles.deleteDirectory(tmp);
      } catch (IOException e) {
        cause.addSuppressed(e);
      }
    }
    if (commitRecord != null) {
      try {
        Files.deleteIfExists(commitRecord);
      } catch (IOException e) {
        cause.addSuppressed(e);
      }
    }
  }

  private PartitionManifest writePartition(final Schema schema,
                                           final Path dir,
                                           final PartitionHandle handle,
                                           final List<Object[]> rows) throws IOException {
    Files.createDirectories(dir);
    final int granuleRows = config.granuleRows;
    final int granules = (rows.size() + granuleRows - 1) / granuleRows;
    final List<ColumnDefinition> columns = schema.columns();
    final List<Map<String, ColumnStats>> granuleStats = new ArrayList<>(granules);
    for (int g = 0; g < granules; g++) {
      granuleStats.add(new LinkedHashMap<>());
    }
    final Map<String, ColumnStats> partitionStats = new LinkedHashMap<>();
    final Map<String, SegmentInfo> segments = new LinkedHashMap<>();

    for (int c = 0; c < columns.size(); c++) {
      final ColumnDefinition column = columns.get(c);
      final List<ColumnVector> vectors = new ArrayList<>(granules);
      final List<ColumnStats> columnGranuleStats = new ArrayList<>(granules);
      for (int g = 0; g < granules; g++) {
        final RowRange range = RowRange.granule(g, granuleRows, rows.size());
        final Object[] values = new Object[range.size()];
        final ColumnStats.Builder stats =
            ColumnStats.newBuilder(column.type(), config.setIndexCardinality);
        for (int r = range.from(); r < range.to(); r++) {
          values[r - range.from()] = rows.get(r)[c];
          stats.add(rows.get(r)[c]);
        }
        vectors.add(ColumnVector.fromValues(column.name(), column.type(), values));
        final ColumnStats built = stats.build();
        columnGranuleStats.add(built);
        granuleStats.get(g).put(column.name(), built);
      }
      partitionStats.put(column.name(),
          ColumnStats.merge(columnGranuleStats, config.setIndexCardinality));
      final ColumnCodec codec = ColumnCodecs.forType(column.type(), config.stringDictionaryLimit);
      segments.put(column.name(), new SegmentWriter(codec)
          .write(dir.resolve(column.name() + SEGMENT_SUFFIX), column.type(), vectors));
    }
    final PartitionManifest manifest = new PartitionManifest(
        new IndexEntry(handle, granuleRows, partitionStats, granuleStats), segments);
    StoreFiles.writeJson(dir.resolve(PartitionManifest.FILE_NAME), manifest);
    return manifest;
  }

  /**
   * Reads the given columns of a partition over a row range.
   *
   * @throws CorruptionException if a segment is missing or fails its checksum.
   */
  public ColumnBlockSet readColumns(final PartitionHandle handle,
                                    final Collection<String> columns,
                                    final RowRange range) {
    final TableState state = state(handle.table());
    final PartitionManifest manifest = state.manifests.get(handle.commitId());
    if (manifest == null) {
      throw new IllegalArgumentException("Partition " + handle + " is not committed");
    }
    if (range.to() > handle.rowCount()) {
      throw new IllegalArgumentException("Range " + range + " exceeds " + handle);
    }
    final int granuleRows = manifest.entry().granuleRows();
    final Map<String, ColumnVector> vectors = new LinkedHashMap<>();
    long bytesRead = 0;
    long bytesDecompressed = 0;
    for (String column : columns) {
      final ColumnType type = state.schema.typeOf(column);
      if (range.isEmpty()) {
        vectors.put(column, ColumnVector.fromValues(column, type, new Object[0]));
        continue;
      }
      final SegmentReader reader = segmentReader(state, handle, column, type);
      final int first = range.from() / granuleRows;
      final int last = (range.to() - 1) / granuleRows;
      final ColumnVector[] parts = new ColumnVector[last - first + 1];
      for (int g = first; g <= last; g++) {
        parts[g - first] = reader.read(g);
        bytesRead += reader.compressedBytes(g);
        bytesDecompressed += reader.rawBytes(g);
      }
      final int base = first * granuleRows;
      vectors.put(column, ColumnVector.concat(parts)
          .slice(range.from() - base, range.to() - base));
    }
    return new ColumnBlockSet(range, vectors, bytesRead, bytesDecompressed);
  }

  private SegmentReader segmentReader(final TableState state,
                                      final PartitionHandle handle,
                                      final String column,
                                      final ColumnType type) {
    final String key = handle.table() + "/" + handle.id() + "/" + column;
    try {
      return readers.get(key, () -> new SegmentReader(
          state.dir.resolve(handle.id()).resolve(column + SEGMENT_SUFFIX), column, type,
          ColumnCodecs.forType(type, config.stringDictionaryLimit)));
    } catch (ExecutionException | UncheckedExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new CorruptionException("Failed to open segment " + key, e.getCause());
    }
  }

  /**
   * Pins a partition's files for reading.
   *
   * @return the lease or null if the partition was evicted.
   */
  public ReadLease acquire(final PartitionHandle handle) {
    final TableState state = state(handle.table());
    state.evictionLock.readLock().lock();
    try {
      if (!state.manifests.containsKey(handle.commitId())) {
        return null;
      }
      final AtomicInteger leases =
          state.leases.computeIfAbsent(handle.commitId(), k -> new AtomicInteger());
      leases.incrementAndGet();
      return new ReadLease() {
        private boolean closed;

        @Override
        public PartitionHandle handle() {
          return handle;
        }

        @Override
        public synchronized void close() {
          if (!closed) {
            closed = true;
            leases.decrementAndGet();
          }
        }
      };
    } finally {
      state.evictionLock.readLock().unlock();
    }
  }

  private int leaseCount(final PartitionHandle handle) {
    final TableState state = tables.get(handle.table());
    if (state == null) {
      return 0;
    }
    final AtomicInteger leases = state.leases.get(handle.commitId());
    return leases == null ? 0 : leases.get();
  }

  /**
   * Evicts the partitions of a table whose events are all older than
   * {@code cutoffMillis} and whose commit id is at most {@code maxCommitId}.
   * Files are deleted later, once readers release them.
   *
   * @return the evicted partitions.
   */
  public List<PartitionHandle> evict(final String table,
                                     final long cutoffMillis,
                                     final long maxCommitId) throws IOException {
    final TableState state = state(table);
    final List<PartitionHandle> evicted = new ArrayList<>();
    state.evictionLock.writeLock().lock();
    try {
      for (IndexEntry entry : index.entries(table)) {
        final PartitionHandle handle = entry.handle();
        if (handle.maxTime() < cutoffMillis && handle.commitId() <= maxCommitId) {
          final Path marker = state.dir.resolve(handle.id()).resolve(EVICTED_MARKER);
          if (!Files.exists(marker)) {
            Files.createFile(marker);
          }
          evicted.add(handle);
        }
      }
      if (evicted.isEmpty()) {
        return evicted;
      }
      index.remove(table, evicted);
      for (PartitionHandle handle : evicted) {
        state.manifests.remove(handle.commitId());
        for (String column : state.schema.columnNames()) {
          readers.invalidate(table + "/" + handle.id() + "/" + column);
        }
        collector.collect(handle, state.dir.resolve(handle.id()));
      }
      persistIndex(table);
    } finally {
      state.evictionLock.writeLock().unlock();
    }
    evictionCounter.inc(evicted.size(), "table", table);
    LOGGER.info("Evicted {} partitions of {} older than {}", evicted.size(), table, cutoffMillis);
    return evicted;
  }

  /** Deletes evicted partitions that are past the collection delay and unleased. */
  public int collectGarbage() {
    return collector.freePartitions();
  }

  public int pendingGarbage() {
    return collector.size();
  }

  /** Excludes a corrupt partition from future scans. */
  public void quarantine(final PartitionHandle handle) {
    index.quarantine(handle);
    quarantineCounter.inc("table", handle.table());
    try {
      persistIndex(handle.table());
    } catch (IOException e) {
      LOGGER.warn("Failed to persist quarantine of {}", handle, e);
    }
  }

  public TableStats tableStats(final String table) {
    final TableState state = state(table);
    long rows = 0;
    long compressed = 0;
    long uncompressed = 0;
    Long minTime = null;
    Long maxTime = null;
    int quarantined = 0;
    for (PartitionManifest manifest : state.manifests.values()) {
      final PartitionHandle handle = manifest.handle();
      rows += handle.rowCount();
      compressed += manifest.compressedBytes();
      uncompressed += manifest.uncompressedBytes();
      minTime = minTime == null ? handle.minTime() : Math.min(minTime, handle.minTime());
      maxTime = maxTime == null ? handle.maxTime() : Math.max(maxTime, handle.maxTime());
      if (index.isQuarantined(handle)) {
        quarantined++;
      }
    }
    return new TableStats(table, rows, state.manifests.size(), quarantined, compressed,
        uncompressed, minTime, maxTime);
  }

  /** @return the directory of a partition, for tooling and tests. */
  public Path partitionDir(final PartitionHandle handle) {
    return state(handle.table()).dir.resolve(handle.id());
  }

  public Path root() {
    return root;
  }

  public Clock clock() {
    return clock;
  }

  public MetricRegistry metricRegistry() {
    return metricRegistry;
  }

  private void persistIndex(final String table) throws IOException {
    StoreFiles.writeJson(state(table).dir.resolve(INDEX_FILE), index.snapshot(table));
  }

  private TableState state(final String table) {
    final TableState state = tables.get(table);
    if (state == null) {
      throw new IllegalArgumentException("Unknown table " + table);
    }
    return state;
  }

  @Override
  public void close() {
    readers.invalidateAll();
    collector.freePartitions();
  }

  private static final class TableState {
    private final Schema schema;
    private final Path dir;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ReentrantReadWriteLock evictionLock = new ReentrantReadWriteLock();
    private final Map<Long, AtomicInteger> leases = new ConcurrentHashMap<>();
    private final Map<Long, PartitionManifest> manifests = new ConcurrentHashMap<>();

    private TableState(final Schema schema, final Path dir) {
      this.schema = schema;
      this.dir = dir;
    }
  }
}
