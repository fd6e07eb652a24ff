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

import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.CorruptionException;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.PartitionQuarantinedException;
import net.chainhouse.index.IndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

/**
 * The partition tasks of one scan, consumed in candidate order. At most
 * {@code inFlight} partitions are submitted ahead of the consumer, so
 * finished partition results wait in memory only for that window.
 */
public final class PartitionTasks<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionTasks.class);

  private final String table;
  private final List<IndexEntry> entries;
  private final IntFunction<Future<T>> submitter;
  private final int inFlight;
  private final List<Future<T>> futures;
  private final ScanStats stats;
  private final ColumnStore store;
  private final boolean allowPartialResults;
  private final List<PartitionHandle> succeeded = new ArrayList<>();
  private final Map<PartitionHandle, Throwable> failed = new LinkedHashMap<>();
  private int next;
  private boolean cancelled;

  PartitionTasks(final String table,
                 final List<IndexEntry> entries,
                 final IntFunction<Future<T>> submitter,
                 final int inFlight,
                 final ScanStats stats,
                 final ColumnStore store,
                 final boolean allowPartialResults) {
    this.table = table;
    this.entries = entries;
    this.submitter = submitter;
    this.inFlight = Math.max(1, inFlight);
    this.futures = new ArrayList<>(entries.size());
    this.stats = stats;
    this.store = store;
    this.allowPartialResults = allowPartialResults;
    fill();
  }

  /**
   * @return the next successful partition result or null when every
   * partition was consumed.
   * @throws PartialScanException if a partition failed and partial results
   * are not allowed.
   * @throws QueryCancelledException if the scan was cancelled.
   */
  public PartitionOutput<T> next() {
    while (next < entries.size()) {
      final int position = next++;
      final PartitionHandle handle = entries.get(position).handle();
      final Throwable failure = await(position);
      if (failure == null) {
        succeeded.add(handle);
        final T result = resultOf(position);
        futures.set(position, null);
        fill();
        return new PartitionOutput<>(handle, position, result);
      }
      futures.set(position, null);
      failed.put(handle, failure);
      if (!allowPartialResults) {
        while (next < entries.size()) {
          final int remaining = next++;
          fill();
          final Throwable other = await(remaining);
          futures.set(remaining, null);
          if (other == null) {
            succeeded.add(entries.get(remaining).handle());
          } else {
            failed.put(entries.get(remaining).handle(), other);
          }
        }
        throw new PartialScanException(succeeded, failed);
      }
      fill();
    }
    return null;
  }

  /** Submits partitions until the window ahead of the consumer is full. */
  private void fill() {
    final int end = Math.min(entries.size(), next + inFlight);
    while (!cancelled && futures.size() < end) {
      futures.add(submitter.apply(futures.size()));
    }
  }

  /** @return null on success or the partition's failure. */
  private Throwable await(final int position) {
    final PartitionHandle handle = entries.get(position).handle();
    if (position >= futures.size()) {
      throw new QueryCancelledException("Scan of " + table + " was cancelled");
    }
    try {
      futures.get(position).get();
      return null;
    } catch (InterruptedException e) {
      cancel();
      Thread.currentThread().interrupt();
      throw new QueryCancelledException("Interrupted while scanning " + table);
    } catch (CancellationException e) {
      cancel();
      throw new QueryCancelledException("Scan of " + table + " was cancelled");
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof QueryCancelledException) {
        cancel();
        throw (QueryCancelledException) cause;
      }
      if (cause instanceof PartitionQuarantinedException) {
        LOGGER.warn("Partition {} of a scan is quarantined", handle);
      } else {
        if (cause instanceof CorruptionException) {
          store.quarantine(handle);
        }
        LOGGER.warn("Scan of partition {} failed", handle, cause);
      }
      stats.incrementPartitionsFailed();
      return cause;
    }
  }

  private T resultOf(final int position) {
    try {
      return futures.get(position).get();
    } catch (InterruptedException | ExecutionException e) {
      throw new IllegalStateException("Partition result requested before completion", e);
    }
  }

  public List<PartitionHandle> succeeded() {
    return succeeded;
  }

  public Map<PartitionHandle, Throwable> failed() {
    return failed;
  }

  /** Cancels the partitions not yet consumed and stops submitting new ones. */
  public void cancel() {
    cancelled = true;
    for (int i = next; i < futures.size(); i++) {
      final Future<T> future = futures.get(i);
      if (future != null) {
        future.cancel(true);
      }
    }
  }
}
