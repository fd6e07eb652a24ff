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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static net.chainhouse.TestUtil.T0;
import static net.chainhouse.TestUtil.TRADES;
import static net.chainhouse.TestUtil.trades;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class IngestorTest {

  @Mock
  private ColumnStore store;

  @Test
  void retriesTransientFailures() throws Exception {
    final List<PartitionHandle> handles = Collections.singletonList(
        new PartitionHandle(TRADES, 0, T0, T0 + 1, 1, 3, T0, T0, 3));
    when(store.appendBatch(eq(TRADES), anyList()))
        .thenThrow(new StorageIOException("busy"))
        .thenThrow(new StorageIOException("busy"))
        .thenReturn(handles);

    final Ingestor ingestor = new Ingestor(store, config(3));
    assertSame(handles, ingestor.ingest(TRADES, trades(1, T0, 3)));
    verify(store, times(3)).appendBatch(eq(TRADES), anyList());
  }

  @Test
  void givesUpAfterTheConfiguredAttempts() throws Exception {
    when(store.appendBatch(any(), anyList())).thenThrow(new StorageIOException("disk gone"));

    final Ingestor ingestor = new Ingestor(store, config(2));
    assertThrows(StorageIOException.class, () -> ingestor.ingest(TRADES, trades(1, T0, 3)));
    verify(store, times(3)).appendBatch(eq(TRADES), anyList());
  }

  @Test
  void validationErrorsAreNotRetried() throws Exception {
    when(store.appendBatch(any(), anyList())).thenThrow(new IngestionException("bad row", 0));

    final Ingestor ingestor = new Ingestor(store, config(5));
    assertThrows(IngestionException.class, () -> ingestor.ingest(TRADES, trades(1, T0, 3)));
    verify(store, times(1)).appendBatch(eq(TRADES), anyList());
  }

  private static StoreConfig config(final int retries) {
    final StoreConfig config = new StoreConfig();
    config.ingestRetryAttempts = retries;
    config.ingestRetryBackoffMillis = 1;
    return config;
  }
}
