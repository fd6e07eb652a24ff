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

package net.chainhouse.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted form of one table's index.
 */
public final class IndexSnapshot {

  private final String table;
  private final long lastCommitId;
  private final long lastSequence;
  private final List<IndexEntry> entries;
  private final List<Long> quarantined;

  @JsonCreator
  public IndexSnapshot(@JsonProperty("table") final String table,
                       @JsonProperty("lastCommitId") final long lastCommitId,
                       @JsonProperty("lastSequence") final long lastSequence,
                       @JsonProperty("entries") final List<IndexEntry> entries,
                       @JsonProperty("quarantined") final List<Long> quarantined) {
    this.table = table;
    this.lastCommitId = lastCommitId;
    this.lastSequence = lastSequence;
    this.entries = entries == null ? Collections.emptyList() : new ArrayList<>(entries);
    this.quarantined = quarantined == null ? Collections.emptyList() : new ArrayList<>(quarantined);
  }

  @JsonProperty("table")
  public String table() {
    return table;
  }

  /** Largest commit id ever recorded, evicted partitions included. */
  @JsonProperty("lastCommitId")
  public long lastCommitId() {
    return lastCommitId;
  }

  @JsonProperty("lastSequence")
  public long lastSequence() {
    return lastSequence;
  }

  @JsonProperty("entries")
  public List<IndexEntry> entries() {
    return entries;
  }

  /** Commit ids of quarantined partitions. */
  @JsonProperty("quarantined")
  public List<Long> quarantined() {
    return quarantined;
  }
}
