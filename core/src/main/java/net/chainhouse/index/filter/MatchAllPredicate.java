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

package net.chainhouse.index.filter;

import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.index.ColumnStats;
import org.roaringbitmap.RoaringBitmap;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

public class MatchAllPredicate extends Predicate {

  @Override
  public Set<String> columns() {
    return Collections.emptySet();
  }

  @Override
  public boolean mightMatch(final Map<String, ColumnStats> stats) {
    return true;
  }

  @Override
  public boolean mustMatch(final Map<String, ColumnStats> stats) {
    return true;
  }

  @Override
  public RoaringBitmap evaluate(final ColumnBlockSet block, final RoaringBitmap candidates) {
    return candidates.clone();
  }

  @Override
  public boolean test(final ColumnBlockSet block, final int row) {
    return true;
  }

  @Override
  public boolean isMatchAll() {
    return true;
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof MatchAllPredicate;
  }

  @Override
  public int hashCode() {
    return MatchAllPredicate.class.hashCode();
  }

  @Override
  public String toString() {
    return "ALL";
  }
}
