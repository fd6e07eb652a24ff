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

/**
 * Receives the matching rows of a partition.
 */
@FunctionalInterface
public interface RowVisitor {

  /**
   * @param block the decoded columns of the granule holding the row.
   * @param row the row within the block.
   * @param rowInPartition the row's ordinal within the partition.
   * @return false to stop scanning the partition.
   */
  boolean visit(PartitionHandle partition, ColumnBlockSet block, int row, int rowInPartition);
}
