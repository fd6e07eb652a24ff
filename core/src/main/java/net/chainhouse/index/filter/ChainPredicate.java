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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.index.ColumnStats;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Combines child predicates with AND or OR, or negates a single child with
 * NOT. A negated predicate matches every row its child rejects, nulls
 * included.
 */
public class ChainPredicate extends Predicate {

  private final Operator operator;
  private final List<Predicate> chain;

  @JsonCreator
  public ChainPredicate(@JsonProperty("operator") final Operator operator,
                        @JsonProperty("chain") final List<Predicate> chain) {
    this.operator = Objects.requireNonNull(operator, "operator");
    if (chain == null || chain.isEmpty()) {
      throw new IllegalArgumentException("Empty predicate chain");
    }
    if (operator == Operator.NOT && chain.size() != 1) {
      throw new IllegalArgumentException("NOT takes exactly one predicate");
    }
    this.chain = Collections.unmodifiableList(new ArrayList<>(chain));
  }

  @JsonProperty("operator")
  public Operator getOperator() {
    return operator;
  }

  @JsonProperty("chain")
  public List<Predicate> getChain() {
    return chain;
  }

  @Override
  public Set<String> columns() {
    final Set<String> columns = new LinkedHashSet<>();
    for (Predicate predicate : chain) {
      columns.addAll(predicate.columns());
    }
    return columns;
  }

  @Override
  public boolean mightMatch(final Map<String, ColumnStats> stats) {
    switch (operator) {
      case AND:
        for (Predicate predicate : chain) {
          if (!predicate.mightMatch(stats)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Predicate predicate : chain) {
          if (predicate.mightMatch(stats)) {
            return true;
          }
        }
        return false;
      default:
        return !chain.get(0).mustMatch(stats);
    }
  }

  @Override
  public boolean mustMatch(final Map<String, ColumnStats> stats) {
    switch (operator) {
      case AND:
        for (Predicate predicate : chain) {
          if (!predicate.mustMatch(stats)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Predicate predicate : chain) {
          if (predicate.mustMatch(stats)) {
            return true;
          }
        }
        return false;
      default:
        return !chain.get(0).mightMatch(stats);
    }
  }

  @Override
  public RoaringBitmap evaluate(final ColumnBlockSet block, final RoaringBitmap candidates) {
    switch (operator) {
      case AND:
        RoaringBitmap narrowed = candidates;
        for (Predicate predicate : chain) {
          narrowed = predicate.evaluate(block, narrowed);
          if (narrowed.isEmpty()) {
            break;
          }
        }
        return narrowed == candidates ? candidates.clone() : narrowed;
      case OR:
        final RoaringBitmap union = new RoaringBitmap();
        for (Predicate predicate : chain) {
          operator.aggregate(union, predicate.evaluate(block, candidates));
        }
        return union;
      default:
        final RoaringBitmap result = candidates.clone();
        operator.aggregate(result, chain.get(0).evaluate(block, candidates));
        return result;
    }
  }

  @Override
  public boolean test(final ColumnBlockSet block, final int row) {
    switch (operator) {
      case AND:
        for (Predicate predicate : chain) {
          if (!predicate.test(block, row)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Predicate predicate : chain) {
          if (predicate.test(block, row)) {
            return true;
          }
        }
        return false;
      default:
        return !chain.get(0).test(block, row);
    }
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChainPredicate)) {
      return false;
    }
    final ChainPredicate other = (ChainPredicate) o;
    return operator == other.operator && chain.equals(other.chain);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, chain);
  }

  @Override
  public String toString() {
    if (operator == Operator.NOT) {
      return "NOT (" + chain.get(0) + ")";
    }
    final StringBuilder buf = new StringBuilder("(");
    for (int i = 0; i < chain.size(); i++) {
      if (i > 0) {
        buf.append(' ').append(operator).append(' ');
      }
      buf.append(chain.get(i));
    }
    return buf.append(')').toString();
  }
}
