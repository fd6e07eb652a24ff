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

import java.util.Map;
import java.util.Objects;

/**
 * Enriches scanned rows with the columns of a {@link DimensionTable} whose
 * key equals the row's {@code column}. An inner join drops rows without a
 * match; a left join keeps them with null lookup values.
 */
public final class LookupJoin {

  public enum Kind {
    INNER,
    LEFT
  }

  private final Kind kind;
  private final String column;
  private final DimensionTable dimensions;

  private LookupJoin(final Kind kind, final String column, final DimensionTable dimensions) {
    this.kind = kind;
    this.column = Objects.requireNonNull(column, "column");
    this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
  }

  public static LookupJoin inner(final String column, final DimensionTable dimensions) {
    return new LookupJoin(Kind.INNER, column, dimensions);
  }

  public static LookupJoin left(final String column, final DimensionTable dimensions) {
    return new LookupJoin(Kind.LEFT, column, dimensions);
  }

  public Kind kind() {
    return kind;
  }

  public String column() {
    return column;
  }

  public DimensionTable dimensions() {
    return dimensions;
  }

  public boolean provides(final String name) {
    return dimensions.columns().contains(name);
  }

  /**
   * @return the looked up values, an empty map for an unmatched left join,
   * null if the row is dropped.
   */
  Map<String, Object> match(final Object key) {
    final Map<String, Object> values = dimensions.lookup(key);
    if (values != null) {
      return values;
    }
    return kind == Kind.LEFT ? Map.of() : null;
  }

  @Override
  public String toString() {
    return kind + " JOIN " + dimensions.table() + " ON " + column + " = " + dimensions.keyColumn();
  }
}
