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

package net.chainhouse.query;

import net.chainhouse.scan.ScanStats;

import java.util.Collections;
import java.util.List;

/** Ordered result rows plus how they were computed. */
public final class QueryResponse {

  private final List<ResultRow> rows;
  private final ScanStats stats;
  private final String rollup;

  QueryResponse(final List<ResultRow> rows, final ScanStats stats, final String rollup) {
    this.rows = Collections.unmodifiableList(rows);
    this.stats = stats;
    this.rollup = rollup;
  }

  public List<ResultRow> rows() {
    return rows;
  }

  /** Scan statistics of the raw path, all zero when a rollup answered. */
  public ScanStats stats() {
    return stats;
  }

  /** The rollup that answered, null for the raw path. */
  public String rollup() {
    return rollup;
  }

  public boolean fromRollup() {
    return rollup != null;
  }

  @Override
  public String toString() {
    return "QueryResponse{rows=" + rows.size() + ", source="
        + (rollup == null ? "raw" : "rollup " + rollup) + ", stats=" + stats + "}";
  }
}
