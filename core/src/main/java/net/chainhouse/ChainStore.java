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

package net.chainhouse;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.ultrabrew.metrics.MetricRegistry;
import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.EventRow;
import net.chainhouse.core.Ingestor;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.Schema;
import net.chainhouse.core.StorageIOException;
import net.chainhouse.core.StoreConfig;
import net.chainhouse.core.TableStats;
import net.chainhouse.core.coordination.Gate;
import net.chainhouse.core.coordination.GatedJobWrapper;
import net.chainhouse.core.coordination.Job;
import net.chainhouse.core.coordination.JobClock;
import net.chainhouse.core.coordination.JobWrapper;
import net.chainhouse.index.PartitionIndex;
import net.chainhouse.query.AggregationExecutor;
import net.chainhouse.query.QueryRequest;
import net.chainhouse.query.QueryResponse;
import net.chainhouse.rollup.RollupDefinition;
import net.chainhouse.rollup.RollupEngine;
import net.chainhouse.rollup.RollupStore;
import net.chainhouse.scan.ScanEngine;
import net.chainhouse.scan.ScanPlan;
import net.chainhouse.scan.ScanRequest;
import net.chainhouse.scan.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.HOURS;

/**
 * One store around a data directory: column store, partition index, scan
 * engine, rollup engine and aggregation executor, plus the background jobs
 * that advance rollups and enforce retention. Rollup advance and retention
 * share a {@link Gate}, so eviction never runs while a rollup folds.
 */
public class ChainStore implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChainStore.class);

  private final StoreConfig config;
  private final Clock clock;
  private final ColumnStore store;
  private final ScanEngine scanEngine;
  private final RollupEngine rollupEngine;
  private final AggregationExecutor executor;
  private final Ingestor ingestor;
  private final Gate gate = new Gate();
  private final LinkedBlockingQueue<JobWrapper> gatedJobs = new LinkedBlockingQueue<>();
  private final ExecutorService jobRunner;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean advanceRequested = new AtomicBoolean();

  private ChainStore(final StoreConfig config,
                     final Clock clock,
                     final ColumnStore store,
                     final RollupStore rollupStore) throws IOException {
    this.config = config;
    this.clock = clock;
    this.store = store;
    this.scanEngine = new ScanEngine(store, config.getScanThreads());
    this.rollupEngine = new RollupEngine(store, scanEngine, rollupStore);
    this.executor = new AggregationExecutor(scanEngine, rollupEngine);
    this.ingestor = new Ingestor(store, config);
    this.jobRunner = Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder().setNameFormat("chainhouse-jobs-%d").setDaemon(true).build());
    this.scheduler = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("chainhouse-scheduler-%d").setDaemon(true).build());
    rollupEngine.load();
  }

  /** Opens the store and starts the background jobs. */
  public static ChainStore open(final StoreConfig config) throws IOException {
    return open(config, Clock.systemUTC(), true);
  }

  /**
   * @param startJobs false to leave rollup advance and retention to explicit calls.
   */
  public static ChainStore open(final StoreConfig config,
                                final Clock clock,
                                final boolean startJobs) throws IOException {
    return open(config, clock, startJobs, new MetricRegistry());
  }

  /**
   * @param metricRegistry receives the store and rollup metrics.
   */
  public static ChainStore open(final StoreConfig config,
                                final Clock clock,
                                final boolean startJobs,
                                final MetricRegistry metricRegistry) throws IOException {
    final ColumnStore store = ColumnStore.open(config, new PartitionIndex(), clock, metricRegistry);
    final RollupStore rollupStore =
        new RollupStore(store.root().resolve(ColumnStore.ROLLUP_DIR));
    final ChainStore chainStore = new ChainStore(config, clock, store, rollupStore);
    if (startJobs) {
      chainStore.startJobs();
    }
    LOGGER.info("Opened store at {} with tables {}", store.root(), store.tables());
    return chainStore;
  }

  private void startJobs() {
    final GatedJobWrapper.Submitter submitter = run -> {
      try {
        jobRunner.submit(run);
        return true;
      } catch (RejectedExecutionException e) {
        LOGGER.error("Failed to submit job", e);
        return false;
      }
    };
    final Duration rollupPeriod = Duration.ofSeconds(config.rollupFrequencySeconds);
    initJob(new GatedJobWrapper(new RollupJob(),
        new JobClock(clock::millis, rollupPeriod, rollupPeriod), gate, Gate.Owner.ROLLUP, submitter));
    if (config.retentionHours > 0) {
      final Duration retentionPeriod = Duration.ofSeconds(config.retentionCheckSeconds);
      initJob(new GatedJobWrapper(new RetentionJob(),
          new JobClock(clock::millis, retentionPeriod, retentionPeriod), gate, Gate.Owner.RETENTION,
          submitter));
    }
    store.addCommitListener((table, partitions) -> requestAdvance());
    scheduler.scheduleWithFixedDelay(this::pollJobs, 1, 1, TimeUnit.SECONDS);
    LOGGER.info("Started rollup job every {} s and retention of {} h",
        config.rollupFrequencySeconds, config.retentionHours);
  }

  private void initJob(final JobWrapper jobWrapper) {
    if (!gatedJobs.offer(jobWrapper)) {
      throw new IllegalStateException("Unable to queue job: " + jobWrapper);
    }
  }

  void pollJobs() {
    try {
      final List<JobWrapper> next = new ArrayList<>();
      JobWrapper jobWrapper;
      while ((jobWrapper = gatedJobs.poll()) != null) {
        if (jobWrapper.tryToRun()) {
          LOGGER.debug("Submitted: {}", jobWrapper);
          next.add(jobWrapper.createNext());
        } else {
          next.add(jobWrapper);
        }
      }
      gatedJobs.addAll(next);
    } catch (Throwable t) {
      LOGGER.error("Job polling failed", t);
    }
  }

  /** Folds new partitions soon after a commit, unless retention holds the gate. */
  private void requestAdvance() {
    if (!advanceRequested.compareAndSet(false, true)) {
      return;
    }
    try {
      jobRunner.submit(() -> {
        advanceRequested.set(false);
        if (!gate.tryAcquire(Gate.Owner.ROLLUP)) {
          LOGGER.debug("Gate held by {}, leaving the fold to the rollup job", gate.holder());
          return;
        }
        try {
          rollupEngine.advanceAll();
        } finally {
          gate.release(Gate.Owner.ROLLUP);
        }
      });
    } catch (RejectedExecutionException e) {
      advanceRequested.set(false);
      LOGGER.warn("Store is closing, skipping commit triggered rollup advance");
    }
  }

  public void createTable(final Schema schema) throws IOException {
    store.createTable(schema);
  }

  /**
   * Appends a batch, retrying transient storage failures.
   *
   * @return the partitions the batch created.
   */
  public List<PartitionHandle> ingest(final String table, final List<EventRow> rows)
      throws StorageIOException, InterruptedException {
    return ingestor.ingest(table, rows);
  }

  public ScanResult scan(final ScanRequest request) {
    return scanEngine.scan(request);
  }

  public ScanPlan explain(final ScanRequest request) {
    return scanEngine.explain(request);
  }

  public QueryResponse query(final QueryRequest request) {
    return executor.execute(request);
  }

  public boolean registerRollup(final RollupDefinition definition) throws StorageIOException {
    return rollupEngine.registerRollup(definition);
  }

  public int advance(final String rollup) throws StorageIOException {
    return rollupEngine.advance(rollup);
  }

  public Duration rollupLag(final String rollup) {
    return rollupEngine.rollupLag(rollup);
  }

  public boolean dropRollup(final String rollup) throws IOException {
    return rollupEngine.dropRollup(rollup);
  }

  public TableStats tableStats(final String table) {
    return store.tableStats(table);
  }

  /**
   * Evicts partitions older than the retention window that every rollup of
   * their table has folded.
   *
   * @return the number of partitions evicted.
   */
  public int enforceRetention() throws IOException {
    if (config.retentionHours <= 0) {
      return 0;
    }
    final long cutoff = clock.millis() - HOURS.toMillis(config.retentionHours);
    int evicted = 0;
    for (String table : new ArrayList<>(store.tables())) {
      evicted += store.evict(table, cutoff, rollupEngine.minFoldedCommitId(table)).size();
    }
    return evicted;
  }

  public StoreConfig config() {
    return config;
  }

  public MetricRegistry metricRegistry() {
    return store.metricRegistry();
  }

  public ColumnStore store() {
    return store;
  }

  public ScanEngine scanEngine() {
    return scanEngine;
  }

  public RollupEngine rollups() {
    return rollupEngine;
  }

  public AggregationExecutor executor() {
    return executor;
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
    jobRunner.shutdown();
    try {
      if (!jobRunner.awaitTermination(30, TimeUnit.SECONDS)) {
        LOGGER.warn("Background jobs did not finish, interrupting");
        jobRunner.shutdownNow();
      }
    } catch (InterruptedException e) {
      jobRunner.shutdownNow();
      Thread.currentThread().interrupt();
    }
    scanEngine.close();
    store.close();
    LOGGER.info("Closed store at {}", store.root());
  }

  private class RollupJob implements Job {

    private volatile boolean complete;

    @Override
    public void run() {
      try {
        rollupEngine.advanceAll();
        rollupEngine.checkStaleness();
      } catch (Throwable t) {
        LOGGER.error("Rollup job failed", t);
      } finally {
        complete = true;
      }
    }

    @Override
    public boolean isComplete() {
      return complete;
    }

    @Override
    public void close() {
    }

    @Override
    public Job createNext() {
      return new RollupJob();
    }

    @Override
    public String toString() {
      return "Rollup job " + (complete ? "completed" : "pending");
    }
  }

  private class RetentionJob implements Job {

    private volatile boolean complete;

    @Override
    public void run() {
      try {
        final int evicted = enforceRetention();
        final int freed = store.collectGarbage();
        if (evicted > 0 || freed > 0) {
          LOGGER.info("Retention evicted {} partitions and freed {}", evicted, freed);
        }
      } catch (Throwable t) {
        LOGGER.error("Retention job failed", t);
      } finally {
        complete = true;
      }
    }

    @Override
    public boolean isComplete() {
      return complete;
    }

    @Override
    public void close() {
    }

    @Override
    public Job createNext() {
      return new RetentionJob();
    }

    @Override
    public String toString() {
      return "Retention job " + (complete ? "completed" : "pending");
    }
  }
}
