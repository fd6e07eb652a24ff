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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Exact sum. Integral sums stay in a long until they overflow and continue
 * in a {@link BigDecimal}; floating point sums accumulate the exact binary
 * value of every double, so the result does not depend on merge order.
 * Non-finite doubles are summed apart and win over the finite part.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SumState extends AggregateState {

  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private final boolean integral;
  private long longSum;
  private BigDecimal exact;
  private Double special;

  public SumState(final boolean integral) {
    this.integral = integral;
  }

  @JsonCreator
  public SumState(@JsonProperty("integral") final boolean integral,
                  @JsonProperty("longSum") final long longSum,
                  @JsonProperty("exact") final BigDecimal exact,
                  @JsonProperty("special") final Double special) {
    this.integral = integral;
    this.longSum = longSum;
    this.exact = exact;
    this.special = special;
  }

  @JsonProperty("integral")
  public boolean integral() {
    return integral;
  }

  @JsonProperty("longSum")
  public long longSum() {
    return longSum;
  }

  @JsonProperty("exact")
  public BigDecimal exact() {
    return exact;
  }

  @JsonProperty("special")
  public Double special() {
    return special;
  }

  @Override
  public void add(final Object value) {
    if (value == null) {
      return;
    }
    if (integral) {
      addLong(((Number) value).longValue());
    } else {
      addDouble(((Number) value).doubleValue());
    }
  }

  private void addLong(final long value) {
    if (exact != null) {
      exact = exact.add(BigDecimal.valueOf(value));
      return;
    }
    final long result = longSum + value;
    if (((longSum ^ result) & (value ^ result)) < 0) {
      exact = BigDecimal.valueOf(longSum).add(BigDecimal.valueOf(value));
    } else {
      longSum = result;
    }
  }

  private void addDouble(final double value) {
    if (!Double.isFinite(value)) {
      special = special == null ? value : special + value;
      return;
    }
    final BigDecimal decimal = new BigDecimal(value);
    exact = exact == null ? decimal : exact.add(decimal);
  }

  @Override
  public void merge(final AggregateState other) {
    final SumState sum = cast(other, SumState.class);
    if (sum.special != null) {
      special = special == null ? sum.special : special + sum.special;
    }
    if (integral && exact == null && sum.exact == null) {
      addLong(sum.longSum);
    } else if (sum.exact != null || sum.longSum != 0) {
      exact = decimal().add(sum.decimal());
    }
  }

  private BigDecimal decimal() {
    if (exact != null) {
      return exact;
    }
    return integral ? BigDecimal.valueOf(longSum) : BigDecimal.ZERO;
  }

  /** @return the sum divided by {@code count}, null for a zero count. */
  Double mean(final long count) {
    if (count == 0) {
      return null;
    }
    if (special != null) {
      return special / count;
    }
    return decimal().divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue();
  }

  /**
   * @return a Long for integral sums that fit, a BigDecimal for those that do
   * not, a Double for floating point sums.
   */
  @Override
  public Object value() {
    if (special != null) {
      return special;
    }
    if (!integral) {
      return decimal().doubleValue();
    }
    if (exact == null) {
      return longSum;
    }
    if (exact.compareTo(LONG_MIN) >= 0 && exact.compareTo(LONG_MAX) <= 0) {
      return exact.longValue();
    }
    return exact;
  }

  @Override
  public AggregateState copy() {
    return new SumState(integral, longSum, exact, special);
  }
}
