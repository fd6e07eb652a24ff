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

import net.chainhouse.core.ColumnType;
import net.chainhouse.rollup.aggregate.AggregateSpec;
import net.chainhouse.rollup.aggregate.AggregateState;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Aggregate states per group, in the order groups were first seen. */
final class GroupAccumulator {

  private final List<AggregateSpec> specs;
  private final List<ColumnType> inputTypes;
  private final Map<List<Object>, Group> groups = new LinkedHashMap<>();

  /**
   * @param inputTypes type of each aggregate's input column, null entries for row counts.
   */
  GroupAccumulator(final List<AggregateSpec> specs, final List<ColumnType> inputTypes) {
    this.specs = specs;
    this.inputTypes = inputTypes;
  }

  Group group(final List<Object> keys, final long ordinal) {
    Group group = groups.get(keys);
    if (group == null) {
      final AggregateState[] states = new AggregateState[specs.size()];
      for (int i = 0; i < states.length; i++) {
        states[i] = specs.get(i).newState(inputTypes.get(i));
      }
      group = new Group(keys, states, ordinal);
      groups.put(keys, group);
    }
    return group;
  }

  /** Folds another accumulator in, taking over its groups. */
  void merge(final GroupAccumulator other) {
    for (Group theirs : other.groups.values()) {
      final Group ours = groups.get(theirs.keys);
      if (ours == null) {
        groups.put(theirs.keys, theirs);
        continue;
      }
      for (int i = 0; i < ours.states.length; i++) {
        ours.states[i].merge(theirs.states[i]);
      }
      ours.firstSeen = Math.min(ours.firstSeen, theirs.firstSeen);
    }
  }

  Collection<Group> groups() {
    return groups.values();
  }

  boolean isEmpty() {
    return groups.isEmpty();
  }

  static final class Group {
    final List<Object> keys;
    final AggregateState[] states;
    long firstSeen;

    private Group(final List<Object> keys, final AggregateState[] states, final long firstSeen) {
      this.keys = keys;
      this.states = states;
      this.firstSeen = firstSeen;
    }
  }
}
