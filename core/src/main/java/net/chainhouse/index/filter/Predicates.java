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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for building predicates.
 */
public final class Predicates {

  public static final Predicate MATCH_ALL = new MatchAllPredicate();

  private Predicates() {
  }

  public static Predicate all() {
    return MATCH_ALL;
  }

  public static Predicate eq(final String column, final Object value) {
    return new LiteralPredicate(column, Arrays.asList(value), Predicate.Operator.OR);
  }

  public static Predicate in(final String column, final Object... values) {
    return new LiteralPredicate(column, Arrays.asList(values), Predicate.Operator.OR);
  }

  public static Predicate notEq(final String column, final Object value) {
    return new LiteralPredicate(column, Arrays.asList(value), Predicate.Operator.NOT);
  }

  public static Predicate notIn(final String column, final Object... values) {
    return new LiteralPredicate(column, Arrays.asList(values), Predicate.Operator.NOT);
  }

  public static Predicate gt(final String column, final Object value) {
    return new RangePredicate(column, value, false, null, false);
  }

  public static Predicate gte(final String column, final Object value) {
    return new RangePredicate(column, value, true, null, false);
  }

  public static Predicate lt(final String column, final Object value) {
    return new RangePredicate(column, null, false, value, false);
  }

  public static Predicate lte(final String column, final Object value) {
    return new RangePredicate(column, null, false, value, true);
  }

  /** {@code from <= column < to}. */
  public static Predicate between(final String column, final Object from, final Object to) {
    return new RangePredicate(column, from, true, to, false);
  }

  public static Predicate not(final Predicate predicate) {
    return new ChainPredicate(Predicate.Operator.NOT, Arrays.asList(predicate));
  }

  /** AND of the given predicates with match-all terms dropped. */
  public static Predicate and(final Predicate... predicates) {
    return combine(Predicate.Operator.AND, predicates);
  }

  public static Predicate or(final Predicate... predicates) {
    for (Predicate predicate : predicates) {
      if (predicate.isMatchAll()) {
        return MATCH_ALL;
      }
    }
    return combine(Predicate.Operator.OR, predicates);
  }

  private static Predicate combine(final Predicate.Operator operator, final Predicate... predicates) {
    final List<Predicate> chain = new ArrayList<>(predicates.length);
    for (Predicate predicate : predicates) {
      if (predicate == null || predicate.isMatchAll()) {
        continue;
      }
      if (predicate instanceof ChainPredicate
          && ((ChainPredicate) predicate).getOperator() == operator) {
        chain.addAll(((ChainPredicate) predicate).getChain());
      } else {
        chain.add(predicate);
      }
    }
    if (chain.isEmpty()) {
      return MATCH_ALL;
    }
    if (chain.size() == 1) {
      return chain.get(0);
    }
    return new ChainPredicate(operator, chain);
  }
}
