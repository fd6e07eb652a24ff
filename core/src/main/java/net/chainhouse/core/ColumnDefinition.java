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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class ColumnDefinition {

  private final String name;
  private final ColumnType type;
  private final boolean nullable;

  @JsonCreator
  public ColumnDefinition(@JsonProperty("name") final String name,
                          @JsonProperty("type") final ColumnType type,
                          @JsonProperty("nullable") final boolean nullable) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Column name must not be empty");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
    this.nullable = nullable;
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  @JsonProperty("type")
  public ColumnType type() {
    return type;
  }

  @JsonProperty("nullable")
  public boolean nullable() {
    return nullable;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnDefinition)) {
      return false;
    }
    final ColumnDefinition other = (ColumnDefinition) o;
    return nullable == other.nullable && name.equals(other.name) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, nullable);
  }

  @Override
  public String toString() {
    return name + " " + type + (nullable ? "" : " NOT NULL");
  }
}
