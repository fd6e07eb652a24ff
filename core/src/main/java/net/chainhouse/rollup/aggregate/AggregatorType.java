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

import net.chainhouse.core.ColumnType;

public enum AggregatorType {
  count {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new CountState();
    }
  },
  sum {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new SumState(type == null || type.isIntegral());
    }
  },
  min {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new ExtremeState(false, type);
    }
  },
  max {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new ExtremeState(true, type);
    }
  },
  avg {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new AvgState(type == null || type.isIntegral());
    }
  },
  quantile {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new QuantileState(spec.quantile());
    }
  },
  uniq {
    @Override
    public AggregateState create(final AggregateSpec spec, final ColumnType type) {
      return new UniqState();
    }
  };

  /**
   * @param type the aggregated column's type, null for a row count or when
   * no value was seen to infer it from.
   */
  public abstract AggregateState create(AggregateSpec spec, ColumnType type);

  public boolean requiresColumn() {
    return this != count;
  }

  public boolean requiresNumeric() {
    return this == sum || this == avg || this == quantile;
  }
}
