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

/** Mean kept as an exact sum and a count. */
public final class AvgState extends AggregateState {

  private final SumState sum;
  private long count;

  public AvgState(final boolean integral) {
    this(new SumState(integral), 0);
  }

  @JsonCreator
  public AvgState(@JsonProperty("sum") final SumState sum,
                  @JsonProperty("count") final long count) {
    this.sum = sum;
    this.count = count;
  }

  @JsonProperty("sum")
  public SumState sum() {
    return sum;
  }

  @JsonProperty("count")
  public long count() {
    return count;
  }

  @Override
  public void add(final Object value) {
    if (value != null) {
      sum.add(value);
      count++;
    }
  }

  @Override
  public void merge(final AggregateState other) {
    final AvgState avg = cast(other, AvgState.class);
    sum.merge(avg.sum);
    count += avg.count;
  }

  @Override
  public Object value() {
    return sum.mean(count);
  }

  @Override
  public AggregateState copy() {
    return new AvgState((SumState) sum.copy(), count);
  }
}
