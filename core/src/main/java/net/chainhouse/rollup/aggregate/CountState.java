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
import com.fasterxml.jackson.annotation.JsonProperty;

/** Counts non-null values, or rows when fed a non-null marker. */
public final class CountState extends AggregateState {

  private long count;

  public CountState() {
  }

  @JsonCreator
  public CountState(@JsonProperty("count") final long count) {
    this.count = count;
  }

  @JsonProperty("count")
  public long count() {
    return count;
  }

  @Override
  public void add(final Object value) {
    if (value != null) {
      count++;
    }
  }

  @Override
  public void merge(final AggregateState other) {
    count += cast(other, CountState.class).count;
  }

  @Override
  public Object value() {
    return count;
  }

  @Override
  public AggregateState copy() {
    return new CountState(count);
  }
}
