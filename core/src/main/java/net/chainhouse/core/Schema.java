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

package net.chainhouse.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table definition. Every table carries a non-null ingestion sequence column
 * and a non-null time column; child tables also carry a non-null reference to
 * the parent row's sequence.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Schema {

  public static final String SEQUENCE_COLUMN = "_sequence";
  public static final String PARENT_SEQUENCE_COLUMN = "parent_sequence";

  private final String table;
  private final String timeColumn;
  private final String parentTable;
  private final List<ColumnDefinition> userColumns;
  private final Map<String, ColumnDefinition> columns;

  @JsonCreator
  Schema(@JsonProperty("table") final String table,
         @JsonProperty("timeColumn") final String timeColumn,
         @JsonProperty("parentTable") final String parentTable,
         @JsonProperty("columns") final List<ColumnDefinition> userColumns) {
    if (table == null || table.isEmpty() || !table.matches("[A-Za-z0-9_\\-]+")) {
      throw new IllegalArgumentException("Invalid table name: " + table);
    }
    this.table = table;
    this.timeColumn = Objects.requireNonNull(timeColumn, "timeColumn");
    this.parentTable = parentTable;
    this.userColumns = Collections.unmodifiableList(new ArrayList<>(userColumns));

    final Map<String, ColumnDefinition> all = new LinkedHashMap<>();
    all.put(SEQUENCE_COLUMN, new ColumnDefinition(SEQUENCE_COLUMN, ColumnType.LONG, false));
    if (parentTable != null) {
      all.put(PARENT_SEQUENCE_COLUMN,
          new ColumnDefinition(PARENT_SEQUENCE_COLUMN, ColumnType.LONG, false));
    }
    for (ColumnDefinition column : userColumns) {
      if (all.containsKey(column.name())) {
        throw new IllegalArgumentException("Duplicate or reserved column " + column.name());
      }
      if (!column.name().matches("[A-Za-z0-9_]+")) {
        throw new IllegalArgumentException("Invalid column name: " + column.name());
      }
      all.put(column.name(), column);
    }
    final ColumnDefinition time = all.get(timeColumn);
    if (time == null || time.type() != ColumnType.TIMESTAMP || time.nullable()) {
      throw new IllegalArgumentException(
          "Time column " + timeColumn + " must be a non-null TIMESTAMP column");
    }
    this.columns = Collections.unmodifiableMap(all);
  }

  public static Builder newBuilder(final String table) {
    return new Builder(table);
  }

  @JsonProperty("table")
  public String table() {
    return table;
  }

  @JsonProperty("timeColumn")
  public String timeColumn() {
    return timeColumn;
  }

  @JsonProperty("parentTable")
  public String parentTable() {
    return parentTable;
  }

  @JsonIgnore
  public boolean isChild() {
    return parentTable != null;
  }

  @JsonProperty("columns")
  List<ColumnDefinition> userColumns() {
    return userColumns;
  }

  /** @return every column including the system columns, in storage order. */
  public List<ColumnDefinition> columns() {
    return new ArrayList<>(columns.values());
  }

  public List<String> columnNames() {
    return new ArrayList<>(columns.keySet());
  }

  /** @return the column or null if the table has no such column. */
  public ColumnDefinition column(final String name) {
    return columns.get(name);
  }

  public boolean has(final String name) {
    return columns.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException if the column does not exist.
   */
  public ColumnType typeOf(final String name) {
    final ColumnDefinition column = columns.get(name);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column " + name + " in table " + table);
    }
    return column.type();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schema)) {
      return false;
    }
    final Schema other = (Schema) o;
    return table.equals(other.table)
        && timeColumn.equals(other.timeColumn)
        && Objects.equals(parentTable, other.parentTable)
        && userColumns.equals(other.userColumns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(table, timeColumn, parentTable, userColumns);
  }

  @Override
  public String toString() {
    return "Schema{" + table + " " + columns.values() + "}";
  }

  public static class Builder {
    private final String table;
    private String timeColumn;
    private String parentTable;
    private final List<ColumnDefinition> columns = new ArrayList<>();

    private Builder(final String table) {
      this.table = table;
    }

    /** Declares the non-null time column. */
    public Builder timeColumn(final String name) {
      this.timeColumn = name;
      columns.add(new ColumnDefinition(name, ColumnType.TIMESTAMP, false));
      return this;
    }

    public Builder column(final String name, final ColumnType type) {
      columns.add(new ColumnDefinition(name, type, true));
      return this;
    }

    public Builder requiredColumn(final String name, final ColumnType type) {
      columns.add(new ColumnDefinition(name, type, false));
      return this;
    }

    /** Makes this a child table whose rows reference a row of {@code parent}. */
    public Builder childOf(final String parent) {
      this.parentTable = parent;
      return this;
    }

    public Schema build() {
      return new Schema(table, timeColumn, parentTable, columns);
    }
  }
}
