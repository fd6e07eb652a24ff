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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Rows of a scan. Unordered scans stream partition by partition; iterate
 * once and close to release unconsumed partitions.
 */
public final class ScanResult implements Iterable<Row>, AutoCloseable {

  private final Iterator<Row> rows;
  private final ScanStats stats;
  private final Runnable onClose;
  private boolean iterated;

  ScanResult(final Iterator<Row> rows, final ScanStats stats, final Runnable onClose) {
    this.rows = rows;
    this.stats = stats;
    this.onClose = onClose;
  }

  /**
   * @throws IllegalStateException on a second call.
   */
  @Override
  public synchronized Iterator<Row> iterator() {
    if (iterated) {
      throw new IllegalStateException("Scan results can only be iterated once");
    }
    iterated = true;
    return rows;
  }

  /** Drains the remaining rows into a list. */
  public List<Row> toList() {
    final List<Row> list = new ArrayList<>();
    for (Row row : this) {
      list.add(row);
    }
    return list;
  }

  public ScanStats stats() {
    return stats;
  }

  @Override
  public void close() {
    onClose.run();
  }
}
