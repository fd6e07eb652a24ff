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

import net.chainhouse.scan.OrderBy;

import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Filter over grouped result rows, evaluated after partial aggregates are
 * merged. A null value never satisfies a comparison.
 */
@FunctionalInterface
public interface Having {

  Having NONE = row -> true;

  boolean test(ResultRow row);

  static Having gt(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp > 0);
  }

  static Having gte(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp >= 0);
  }

  static Having lt(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp < 0);
  }

  static Having lte(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp <= 0);
  }

  static Having eq(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp == 0);
  }

  static Having notEq(final String name, final Object value) {
    return row -> compare(row, name, value, cmp -> cmp != 0);
  }

  static Having and(final Having... clauses) {
    final List<Having> all = Arrays.asList(clauses);
    return row -> all.stream().allMatch(h -> h.test(row));
  }

  static Having or(final Having... clauses) {
    final List<Having> all = Arrays.asList(clauses);
    return row -> all.stream().anyMatch(h -> h.test(row));
  }

  static Having not(final Having clause) {
    return row -> !clause.test(row);
  }

  private static boolean compare(final ResultRow row,
                                 final String name,
                                 final Object value,
                                 final IntPredicate test) {
    final Object actual = row.get(name);
    if (actual == null || value == null) {
      return false;
    }
    return test.test(OrderBy.compareValues(actual, value));
  }
}
