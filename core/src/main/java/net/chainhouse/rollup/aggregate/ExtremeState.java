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

package net.chainhouse.rollup.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.ColumnType;

/** Minimum or maximum of a column. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtremeState extends AggregateState {

  private final boolean max;
  private final ColumnType type;
  private Object current;

  public ExtremeState(final boolean max, final ColumnType type) {
    this(max, type, null);
  }

  @JsonCreator
  public ExtremeState(@JsonProperty("max") final boolean max,
                      @JsonProperty("type") final ColumnType type,
                      @JsonProperty("value") final Object current) {
    this.max = max;
    this.type = type;
    this.current = current == null ? null : type.coerce(current);
  }

  @JsonProperty("max")
  public boolean isMax() {
    return max;
  }

  @JsonProperty("type")
  public ColumnType type() {
    return type;
  }

  @JsonProperty("value")
  public Object current() {
    return current;
  }

  @Override
  public void add(final Object value) {
    if (value == null) {
      return;
    }
    if (current == null) {
      current = value;
      return;
    }
    final int cmp = type.compare(value, current);
    if (max ? cmp > 0 : cmp < 0) {
      current = value;
    }
  }

  @Override
  public void merge(final AggregateState other) {
    final ExtremeState extreme = cast(other, ExtremeState.class);
    if (extreme.max != max) {
      throw new IllegalArgumentException("Cannot merge max and min");
    }
    add(extreme.current);
  }

  @Override
  public Object value() {
    return current;
  }

  @Override
  public AggregateState copy() {
    return new ExtremeState(max, type, current);
  }
}
