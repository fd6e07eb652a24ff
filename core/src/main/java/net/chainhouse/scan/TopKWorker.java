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

import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.data.ColumnBlockSet;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the best {@code k} rows of a partition in a bounded heap whose head
 * is the worst row kept.
 */
class TopKWorker extends ProjectionWorker {

  private final int k;
  private final Comparator<Row> comparator;
  private final PriorityQueue<Row> heap;

  TopKWorker(final int position,
             final List<String> projection,
             final List<OrderBy> orderBy,
             final int k,
             final Comparator<Row> comparator) {
    super(position, projection, orderBy, 0);
    this.k = k;
    this.comparator = comparator;
    this.heap = new PriorityQueue<>(k + 1, comparator.reversed());
  }

  @Override
  public boolean visit(final PartitionHandle partition,
                       final ColumnBlockSet block,
                       final int row,
                       final int rowInPartition) {
    final Row candidate = toRow(partition, block, row, rowInPartition);
    if (heap.size() < k) {
      heap.add(candidate);
    } else if (comparator.compare(candidate, heap.peek()) < 0) {
      heap.poll();
      heap.add(candidate);
    }
    return true;
  }

  @Override
  public List<Row> result() {
    final List<Row> rows = new ArrayList<>(heap);
    rows.sort(comparator);
    return rows;
  }
}
