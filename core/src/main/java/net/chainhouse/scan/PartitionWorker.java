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

/**
 * Per-partition accumulator run on a scan worker thread.
 *
 * @param <T> the partial result of one partition.
 */
public interface PartitionWorker<T> extends RowVisitor {

  T result();

  @FunctionalInterface
  interface Factory<T> {
    /**
     * @param position the partition's position among the scan's candidates.
     */
    PartitionWorker<T> create(int position);
  }
}
