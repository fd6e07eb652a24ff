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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Mutable partial result of one aggregate. States of the same kind merge
 * associatively and commutatively, so partials computed per partition or per
 * scan worker can be combined in any grouping.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CountState.class, name = "count"),
    @JsonSubTypes.Type(value = SumState.class, name = "sum"),
    @JsonSubTypes.Type(value = ExtremeState.class, name = "extreme"),
    @JsonSubTypes.Type(value = AvgState.class, name = "avg"),
    @JsonSubTypes.Type(value = QuantileState.class, name = "quantile"),
    @JsonSubTypes.Type(value = UniqState.class, name = "uniq")
})
public abstract class AggregateState {

  /**
   * Folds one value in.
   *
   * @param value the coerced value, null for a null cell.
   */
  public abstract void add(Object value);

  /**
   * Folds another partial of the same kind in.
   *
   * @throws IllegalArgumentException if the other state is of another kind.
   */
  public abstract void merge(AggregateState other);

  /** @return the final value, null when no value was folded and the aggregate has no identity. */
  @JsonIgnore
  public abstract Object value();

  public abstract AggregateState copy();

  protected <T extends AggregateState> T cast(final AggregateState other, final Class<T> type) {
    if (!type.isInstance(other)) {
      throw new IllegalArgumentException("Cannot merge " + other.getClass().getSimpleName()
          + " into " + getClass().getSimpleName());
    }
    return type.cast(other);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + value() + "}";
  }
}
