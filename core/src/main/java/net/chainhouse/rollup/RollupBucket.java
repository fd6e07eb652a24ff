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

package net.chainhouse.rollup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.Schema;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.rollup.aggregate.AggregateSpec;
import net.chainhouse.rollup.aggregate.AggregateState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregate states of one bucket, in the order of the rollup's aggregates. */
public final class RollupBucket {

  private final BucketKey key;
  private final List<AggregateState> states;

  @JsonCreator
  public RollupBucket(@JsonProperty("key") final BucketKey key,
                      @JsonProperty("states") final List<AggregateState> states) {
    this.key = key;
    this.states = states;
  }

  public static RollupBucket empty(final BucketKey key,
                                   final RollupDefinition definition,
                                   final Schema schema) {
    final List<AggregateState> states = new ArrayList<>(definition.aggregates().size());
    for (AggregateSpec spec : definition.aggregates()) {
      states.add(spec.newState(spec.column() == null ? null : schema.typeOf(spec.column())));
    }
    return new RollupBucket(key, states);
  }

  @JsonProperty("key")
  public BucketKey key() {
    return key;
  }

  @JsonProperty("states")
  public List<AggregateState> states() {
    return states;
  }

  public AggregateState state(final int index) {
    return states.get(index);
  }

  /** Folds one scanned row into the states. */
  void add(final RollupDefinition definition, final ColumnBlockSet block, final int row) {
    final List<AggregateSpec> specs = definition.aggregates();
    for (int i = 0; i < specs.size(); i++) {
      final AggregateSpec spec = specs.get(i);
      if (spec.accepts(block, row)) {
        states.get(i).add(spec.input(block, row));
      }
    }
  }

  void merge(final RollupBucket other) {
    for (int i = 0; i < states.size(); i++) {
      states.get(i).merge(other.states.get(i));
    }
  }

  public RollupBucket copy() {
    final List<AggregateState> copies = new ArrayList<>(states.size());
    for (AggregateState state : states) {
      copies.add(state.copy());
    }
    return new RollupBucket(key, copies);
  }

  /** @return final values keyed by aggregate name. */
  public Map<String, Object> values(final RollupDefinition definition) {
    final Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < states.size(); i++) {
      values.put(definition.aggregates().get(i).name(), states.get(i).value());
    }
    return values;
  }

  @Override
  public String toString() {
    return "RollupBucket{" + key + ", " + states + "}";
  }
}
