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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.Schema;
import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.scan.Row;
import net.chainhouse.scan.ScanEngine;
import net.chainhouse.scan.ScanRequest;
import net.chainhouse.scan.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory lookup built from a scan of a small table, such as token
 * metadata keyed by mint address. When a key occurs more than once the row
 * scanned last wins.
 */
public final class DimensionTable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DimensionTable.class);

  private final String table;
  private final String keyColumn;
  private final List<String> columns;
  private final Map<String, ColumnType> types;
  private final Map<Object, Map<String, Object>> rows;

  private DimensionTable(final String table,
                         final String keyColumn,
                         final List<String> columns,
                         final Map<String, ColumnType> types,
                         final Map<Object, Map<String, Object>> rows) {
    this.table = table;
    this.keyColumn = keyColumn;
    this.columns = columns;
    this.types = types;
    this.rows = rows;
  }

  /** Scans every row of {@code table}. */
  public static DimensionTable load(final ScanEngine engine,
                                    final String table,
                                    final String keyColumn,
                                    final String... columns) {
    return load(engine, table, Predicates.all(), keyColumn, columns);
  }

  /** Scans the rows of {@code table} matching {@code filter}. */
  public static DimensionTable load(final ScanEngine engine,
                                    final String table,
                                    final Predicate filter,
                                    final String keyColumn,
                                    final String... columns) {
    final Schema schema = engine.store().schema(table);
    final List<String> projection = new ArrayList<>();
    projection.add(keyColumn);
    final ImmutableMap.Builder<String, ColumnType> types = ImmutableMap.builder();
    for (String column : columns) {
      if (column.equals(keyColumn)) {
        throw new IllegalArgumentException("Key column " + keyColumn + " cannot be looked up");
      }
      types.put(column, schema.typeOf(column));
      projection.add(column);
    }
    final Map<Object, Map<String, Object>> rows = new HashMap<>();
    final ScanRequest request = ScanRequest.newBuilder(table)
        .secondary(filter)
        .project(projection)
        .build();
    try (ScanResult result = engine.scan(request)) {
      for (Row row : result) {
        final Object key = row.get(keyColumn);
        if (key == null) {
          continue;
        }
        final Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
          values.put(column, row.get(column));
        }
        rows.put(key, Collections.unmodifiableMap(values));
      }
    }
    LOGGER.info("Loaded {} keys from {} for lookups on {}", rows.size(), table, keyColumn);
    return new DimensionTable(table, keyColumn, ImmutableList.copyOf(columns), types.build(), rows);
  }

  public String table() {
    return table;
  }

  public String keyColumn() {
    return keyColumn;
  }

  public List<String> columns() {
    return columns;
  }

  public ColumnType typeOf(final String column) {
    final ColumnType type = types.get(column);
    if (type == null) {
      throw new IllegalArgumentException("Unknown lookup column " + column + " of " + table);
    }
    return type;
  }

  /** @return the looked up values, or null if the key is unknown. */
  public Map<String, Object> lookup(final Object key) {
    return key == null ? null : rows.get(key);
  }

  public int size() {
    return rows.size();
  }
}
