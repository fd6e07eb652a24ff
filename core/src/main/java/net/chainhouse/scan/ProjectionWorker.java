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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes projected rows of one partition, up to an optional limit.
 */
class ProjectionWorker implements PartitionWorker<List<Row>> {

  private final int position;
  private final List<String> projection;
  private final List<OrderBy> orderBy;
  private final int limit;
  private final List<Row> rows = new ArrayList<>();

  ProjectionWorker(final int position,
                   final List<String> projection,
                   final List<OrderBy> orderBy,
                   final int limit) {
    this.position = position;
    this.projection = projection;
    this.orderBy = orderBy;
    this.limit = limit;
  }

  @Override
  public boolean visit(final PartitionHandle partition,
                       final ColumnBlockSet block,
                       final int row,
                       final int rowInPartition) {
    rows.add(toRow(partition, block, row, rowInPartition));
    return limit == 0 || rows.size() < limit;
  }

  Row toRow(final PartitionHandle partition,
            final ColumnBlockSet block,
            final int row,
            final int rowInPartition) {
    final Map<String, Object> values = new LinkedHashMap<>();
    for (String column : projection) {
      values.put(column, block.value(column, row));
    }
    Object[] sortKeys = null;
    if (!orderBy.isEmpty()) {
      sortKeys = new Object[orderBy.size()];
      for (int i = 0; i < sortKeys.length; i++) {
        sortKeys[i] = block.value(orderBy.get(i).column(), row);
      }
    }
    return new Row(values, partition, ((long) position << 32) | rowInPartition, sortKeys);
  }

  @Override
  public List<Row> result() {
    return rows;
  }
}
