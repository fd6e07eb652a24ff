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

/**
 * The result of scanning one partition.
 */
public final class PartitionOutput<T> {

  private final PartitionHandle partition;
  private final int position;
  private final T result;

  PartitionOutput(final PartitionHandle partition, final int position, final T result) {
    this.partition = partition;
    this.position = position;
    this.result = result;
  }

  public PartitionHandle partition() {
    return partition;
  }

  /** Position of the partition among the scan's candidates. */
  public int position() {
    return position;
  }

  public T result() {
    return result;
  }
}
