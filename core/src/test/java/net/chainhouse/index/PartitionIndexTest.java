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

import net.chainhouse.core.ColumnType;
import net.chainhouse.core.IndexConsistencyException;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.index.filter.Predicates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static net.chainhouse.TestUtil.HOUR;
import static net.chainhouse.TestUtil.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PartitionIndexTest {

  private static final String TABLE = "transfers";

  private PartitionIndex index;

  @BeforeEach
  void beforeEach() {
    index = new PartitionIndex();
    index.createTable(TABLE);
  }

  @Test
  void candidatesArePrunedAndOrdered() {
    // commit order differs from time order: a late batch for an early window
    index.record(TABLE, Arrays.asList(entry(0, T0 + HOUR, 10, 100), entry(1, T0 + 2 * HOUR, 5, 50)));
    index.record(TABLE, Collections.singletonList(entry(2, T0, 1000, 2000)));

    assertEquals(Arrays.asList(2L, 0L, 1L),
        commitIds(index.candidates(TABLE, Predicates.all(), AccessPattern.ASCENDING)));
    assertEquals(Arrays.asList(1L, 0L, 2L),
        commitIds(index.candidates(TABLE, Predicates.all(), AccessPattern.MOST_RECENT_FIRST)));
    assertEquals(Collections.singletonList(2L),
        commitIds(index.candidates(TABLE, Predicates.gt("value", 500L), AccessPattern.ASCENDING)));
    assertEquals(Arrays.asList(0L, 1L),
        commitIds(index.candidates(TABLE,
            Predicates.between("block_time", T0 + HOUR, T0 + 3 * HOUR), AccessPattern.ASCENDING)));
    assertEquals(Arrays.asList(1L, 2L), commitIds(index.committedAfter(TABLE, 0)));
    assertEquals(2, index.lastCommitId(TABLE));
  }

  @Test
  void quarantinedPartitionsAreSkipped() {
    index.record(TABLE, Arrays.asList(entry(0, T0, 1, 2), entry(1, T0 + HOUR, 1, 2)));
    final PartitionHandle handle = index.get(TABLE, 0).handle();
    index.quarantine(handle);

    assertTrue(index.isQuarantined(handle));
    assertEquals(Collections.singletonList(1L),
        commitIds(index.candidates(TABLE, Predicates.all(), AccessPattern.ASCENDING)));
    assertEquals(2, index.entries(TABLE).size());
    assertEquals(Collections.singletonList(0L), index.snapshot(TABLE).quarantined());
  }

  @Test
  void conflictingEntryHaltsWrites() {
    final IndexEntry entry = entry(0, T0, 1, 2);
    index.record(TABLE, Collections.singletonList(entry));
    index.record(TABLE, Collections.singletonList(entry(0, T0, 1, 2)));
    assertFalse(index.isHalted(TABLE));

    assertThrows(IndexConsistencyException.class,
        () -> index.record(TABLE, Collections.singletonList(entry(0, T0, 1, 3))));
    assertTrue(index.isHalted(TABLE));
    assertEquals(entry, index.get(TABLE, 0));
    assertThrows(IndexConsistencyException.class, () -> index.checkWritable(TABLE));
    assertThrows(IndexConsistencyException.class,
        () -> index.record(TABLE, Collections.singletonList(entry(1, T0, 1, 3))));

    index.repair(TABLE, Collections.singletonList(entry));
    index.checkWritable(TABLE);
  }

  @Test
  void removalKeepsWatermarks() {
    index.record(TABLE, Arrays.asList(entry(0, T0, 1, 2), entry(1, T0 + HOUR, 1, 2)));
    index.remove(TABLE, Collections.singletonList(index.get(TABLE, 0).handle()));

    assertNull(index.get(TABLE, 0));
    assertEquals(1, index.size(TABLE));
    assertEquals(1, index.lastCommitId(TABLE));
    assertEquals(20, index.lastSequence(TABLE));

    final PartitionIndex restored = new PartitionIndex();
    restored.load(index.snapshot(TABLE));
    assertEquals(1, restored.lastCommitId(TABLE));
    assertEquals(index.entries(TABLE), restored.entries(TABLE));
  }

  @Test
  void unknownTable() {
    assertThrows(IllegalArgumentException.class,
        () -> index.candidates("nope", Predicates.all(), AccessPattern.ASCENDING));
  }

  private static IndexEntry entry(final long commitId,
                                  final long start,
                                  final long minValue,
                                  final long maxValue) {
    final PartitionHandle handle = new PartitionHandle(TABLE, commitId, start, start + HOUR,
        commitId * 10 + 1, commitId * 10 + 10, start, start + HOUR - 1, 10);
    final ColumnStats.Builder time = ColumnStats.newBuilder(ColumnType.TIMESTAMP, 0);
    time.add(start).add(start + HOUR - 1);
    final ColumnStats.Builder value = ColumnStats.newBuilder(ColumnType.LONG, 0);
    value.add(minValue).add(maxValue);
    final Map<String, ColumnStats> stats = Map.of("block_time", time.build(), "value", value.build());
    return new IndexEntry(handle, 10, stats, Collections.singletonList(stats));
  }

  private static List<Long> commitIds(final List<IndexEntry> entries) {
    final List<Long> ids = new ArrayList<>();
    for (IndexEntry entry : entries) {
      ids.add(entry.handle().commitId());
    }
    return ids;
  }
}
