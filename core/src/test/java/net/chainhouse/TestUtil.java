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

import net.chainhouse.core.ColumnType;
import net.chainhouse.core.EventRow;
import net.chainhouse.core.Schema;
import net.chainhouse.core.StoreConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.concurrent.TimeUnit.MINUTES;

public class TestUtil {

  /** 2021-01-01T00:00:00Z */
  public static final long T0 = 1609459200000L;
  public static final long MINUTE = MINUTES.toMillis(1);
  public static final long HOUR = 60 * MINUTE;

  public static final String TRADES = "trades";
  public static final String POOLS = "pools";

  public static StoreConfig config(final Path dir) {
    final StoreConfig config = new StoreConfig();
    config.dataDir = dir.toString();
    config.granuleRows = 4;
    config.scanThreads = 2;
    config.collectionDelaySeconds = 0;
    config.ingestRetryBackoffMillis = 1;
    config.rollupMergeRetries = 1;
    return config;
  }

  public static Schema tradesSchema() {
    return Schema.newBuilder(TRADES)
        .timeColumn("block_time")
        .requiredColumn("pool", ColumnType.STRING)
        .column("trader", ColumnType.STRING)
        .column("fee", ColumnType.LONG)
        .column("amount", ColumnType.DOUBLE)
        .build();
  }

  public static Schema poolsSchema() {
    return Schema.newBuilder(POOLS)
        .timeColumn("created_at")
        .requiredColumn("pool", ColumnType.STRING)
        .column("dex", ColumnType.STRING)
        .column("token", ColumnType.STRING)
        .build();
  }

  public static EventRow trade(final long sequence,
                               final long time,
                               final String pool,
                               final String trader,
                               final Long fee,
                               final Double amount) {
    return EventRow.newBuilder(sequence)
        .set("block_time", time)
        .set("pool", pool)
        .set("trader", trader)
        .set("fee", fee)
        .set("amount", amount)
        .build();
  }

  /**
   * @return {@code count} trades one minute apart starting at {@code start},
   * cycling over three pools and five traders.
   */
  public static List<EventRow> trades(final long firstSequence, final long start, final int count) {
    final String[] pools = {"usdc-eth", "wbtc-eth", "dai-usdc"};
    final List<EventRow> rows = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final long sequence = firstSequence + i;
      rows.add(trade(sequence, start + i * MINUTE, pools[(int) (sequence % pools.length)],
          "trader-" + (sequence % 5), sequence % 7 == 0 ? null : sequence * 10,
          sequence * 0.25));
    }
    return rows;
  }
}
