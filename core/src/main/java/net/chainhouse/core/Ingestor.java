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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Appends batches, retrying transient storage failures with exponential
 * backoff. Validation failures are never retried.
 */
public class Ingestor {

  private static final Logger LOGGER = LoggerFactory.getLogger(Ingestor.class);

  private final ColumnStore store;
  private final int retryAttempts;
  private final long backoffMillis;

  public Ingestor(final ColumnStore store, final StoreConfig config) {
    this.store = store;
    this.retryAttempts = config.ingestRetryAttempts;
    this.backoffMillis = config.ingestRetryBackoffMillis;
  }

  /**
   * @throws StorageIOException once the retries are exhausted.
   * @throws InterruptedException if interrupted while backing off.
   */
  public List<PartitionHandle> ingest(final String table,
                                      final List<EventRow> rows)
      throws StorageIOException, InterruptedException {
    int attempt = 0;
    while (true) {
      try {
        return store.appendBatch(table, rows);
      } catch (StorageIOException e) {
        if (attempt >= retryAttempts) {
          LOGGER.error("Giving up on batch of {} rows for {} after {} attempts",
              rows.size(), table, attempt + 1, e);
          throw e;
        }
        final long sleep = backoffMillis << Math.min(attempt, 20);
        LOGGER.warn("Batch for {} failed, retrying in {} ms (attempt {} of {})",
            table, sleep, attempt + 1, retryAttempts, e);
        Thread.sleep(sleep);
        attempt++;
      }
    }
  }
}
