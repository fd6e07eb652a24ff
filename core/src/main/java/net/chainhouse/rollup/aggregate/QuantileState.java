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

/** Approximate quantile of a numeric column. */
public final class QuantileState extends AggregateState {

  private final double quantile;
  private final QuantileSketch sketch;

  public QuantileState(final double quantile) {
    this(quantile, new QuantileSketch());
  }

  @JsonCreator
  public QuantileState(@JsonProperty("quantile") final double quantile,
                       @JsonProperty("sketch") final QuantileSketch sketch) {
    this.quantile = quantile;
    this.sketch = sketch;
  }

  @JsonProperty("quantile")
  public double quantile() {
    return quantile;
  }

  @JsonProperty("sketch")
  public QuantileSketch sketch() {
    return sketch;
  }

  @Override
  public void add(final Object value) {
    if (value != null) {
      sketch.add(((Number) value).doubleValue());
    }
  }

  @Override
  public void merge(final AggregateState other) {
    sketch.merge(cast(other, QuantileState.class).sketch);
  }

  @Override
  public Object value() {
    return sketch.isEmpty() ? null : sketch.quantile(quantile);
  }

  @Override
  public AggregateState copy() {
    return new QuantileState(quantile, sketch.copy());
  }
}
