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

import java.util.Collections;
import java.util.Map;

/**
 * One projected row of a scan.
 */
public final class Row {

  private final Map<String, Object> values;
  private final PartitionHandle partition;
  private final long ordinal;
  private final Object[] sortKeys;

  public Row(final Map<String, Object> values, final PartitionHandle partition, final long ordinal) {
    this(values, partition, ordinal, null);
  }

  Row(final Map<String, Object> values,
      final PartitionHandle partition,
      final long ordinal,
      final Object[] sortKeys) {
    this.values = Collections.unmodifiableMap(values);
    this.partition = partition;
    this.ordinal = ordinal;
    this.sortKeys = sortKeys;
  }

  Object sortKey(final int index) {
    return sortKeys[index];
  }

  public Object get(final String column) {
    return values.get(column);
  }

  public Long getLong(final String column) {
    return (Long) values.get(column);
  }

  public Double getDouble(final String column) {
    final Object value = values.get(column);
    return value == null ? null : ((Number) value).doubleValue();
  }

  public String getString(final String column) {
    return (String) values.get(column);
  }

  public Map<String, Object> values() {
    return values;
  }

  public PartitionHandle partition() {
    return partition;
  }

  /**
   * Position of the row in scan order: the partition's position among the
   * candidates in the high bits and the row within the partition in the low
   * bits. Used to break ties deterministically.
   */
  public long ordinal() {
    return ordinal;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
