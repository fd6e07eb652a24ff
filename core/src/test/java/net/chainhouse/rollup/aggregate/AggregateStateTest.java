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

import net.chainhouse.TestUtil;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.StoreFiles;
import net.chainhouse.index.filter.Predicates;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AggregateStateTest {

  @Test
  void integralSumPromotesOnOverflow() {
    final SumState sum = new SumState(true);
    sum.add(Long.MAX_VALUE);
    sum.add(null);
    assertEquals(Long.MAX_VALUE, sum.value());

    sum.add(1L);
    assertEquals(new BigDecimal("9223372036854775808"), sum.value());

    sum.add(-2L);
    assertEquals(Long.MAX_VALUE - 1, sum.value());
  }

  @Test
  void integralSumOverflowAcrossMerges() {
    final SumState a = new SumState(true);
    a.add(Long.MAX_VALUE);
    final SumState b = new SumState(true);
    b.add(Long.MAX_VALUE);
    a.merge(b);
    assertEquals(BigDecimal.valueOf(Long.MAX_VALUE).multiply(BigDecimal.valueOf(2)), a.value());
  }

  @Test
  void doubleSumDoesNotDependOnMergeOrder() {
    final List<Double> values = Arrays.asList(1e16, 1.0, -1e16);
    final SumState sequential = new SumState(false);
    for (double value : values) {
      sequential.add(value);
    }
    assertEquals(1.0, sequential.value());

    final SumState merged = new SumState(false);
    for (int i = values.size() - 1; i >= 0; i--) {
      final SumState part = new SumState(false);
      part.add(values.get(i));
      merged.merge(part);
    }
    assertEquals(1.0, merged.value());
  }

  @Test
  void nonFiniteValuesWin() {
    final SumState sum = new SumState(false);
    sum.add(1.5);
    sum.add(Double.POSITIVE_INFINITY);
    assertEquals(Double.POSITIVE_INFINITY, sum.value());

    final SumState other = new SumState(false);
    other.add(Double.NEGATIVE_INFINITY);
    sum.merge(other);
    assertTrue(Double.isNaN((Double) sum.value()));
  }

  @Test
  void emptyStates() {
    assertEquals(0L, new CountState().value());
    assertEquals(0L, new SumState(true).value());
    assertEquals(0.0, new SumState(false).value());
    assertNull(new AvgState(true).value());
    assertNull(new ExtremeState(true, ColumnType.LONG).value());
    assertNull(new QuantileState(0.5).value());
    assertEquals(0L, new UniqState().value());
  }

  @Test
  void avg() {
    final AvgState avg = new AvgState(true);
    avg.add(1L);
    avg.add(null);
    avg.add(2L);
    final AvgState other = new AvgState(true);
    other.add(6L);
    avg.merge(other);
    assertEquals(3.0, avg.value());
    assertEquals(3, avg.count());
  }

  @Test
  void extremesOnStrings() {
    final ExtremeState min = new ExtremeState(false, ColumnType.STRING);
    final ExtremeState max = new ExtremeState(true, ColumnType.STRING);
    for (String pool : Arrays.asList("wbtc-eth", "dai-usdc", null, "usdc-eth")) {
      min.add(pool);
      max.add(pool);
    }
    assertEquals("dai-usdc", min.value());
    assertEquals("wbtc-eth", max.value());
    assertThrows(IllegalArgumentException.class, () -> min.merge(max));
  }

  @Test
  void uniq() {
    final UniqState a = new UniqState();
    a.add("trader-1");
    a.add("trader-2");
    a.add("trader-1");
    a.add(null);
    final UniqState b = new UniqState();
    b.add("trader-2");
    b.add("trader-3");
    b.add(7L);
    a.merge(b);
    assertEquals(4L, a.value());
    assertEquals(3L, b.value());
  }

  @Test
  void copiesAreIndependent() {
    final CountState count = new CountState();
    count.add(Boolean.TRUE);
    final AggregateState copy = count.copy();
    count.add(Boolean.TRUE);
    assertEquals(1L, copy.value());
    assertEquals(2L, count.value());
  }

  @Test
  void mergingDifferentKindsFails() {
    assertThrows(IllegalArgumentException.class, () -> new CountState().merge(new SumState(true)));
    assertThrows(IllegalArgumentException.class, () -> new UniqState().merge(new AvgState(false)));
  }

  @Test
  void statesSurviveJson() throws Exception {
    final List<AggregateState> states = Arrays.asList(
        new CountState(), new SumState(true), new SumState(false), new AvgState(false),
        new ExtremeState(true, ColumnType.LONG), new QuantileState(0.9), new UniqState());
    for (AggregateState state : states) {
      for (long i = 1; i <= 100; i++) {
        state.add(state instanceof SumState && !((SumState) state).integral()
            || state instanceof AvgState ? (Object) (i * 0.5) : (Object) (i * 1000));
      }
      if (state instanceof SumState && ((SumState) state).integral()) {
        state.add(Long.MAX_VALUE);
      }
      final String json = StoreFiles.MAPPER.writeValueAsString(state);
      final AggregateState restored = StoreFiles.MAPPER.readValue(json, AggregateState.class);
      assertEquals(state.getClass(), restored.getClass());
      assertEquals(state.value(), restored.value(), json);
    }
  }

  @Test
  void specNames() {
    assertEquals("sum(fee)", AggregateSpec.sum("fee").name());
    assertEquals("count()", AggregateSpec.count().name());
    assertEquals("countIf()", AggregateSpec.count().when(Predicates.gt("fee", 100L)).name());
    assertEquals("quantile(amount, 0.99)", AggregateSpec.quantile("amount", 0.99).name());
    assertEquals("volume", AggregateSpec.sum("amount").as("volume").name());
    assertTrue(AggregateSpec.sum("amount").as("volume").sameAggregate(AggregateSpec.sum("amount")));
  }

  @Test
  void specValidation() {
    assertThrows(IllegalArgumentException.class, () -> AggregateSpec.quantile("amount", 1.5));
    assertThrows(IllegalArgumentException.class,
        () -> new AggregateSpec(AggregatorType.sum, null, null, null, null));
    assertThrows(IllegalArgumentException.class,
        () -> AggregateSpec.sum("pool").validate(TestUtil.tradesSchema()));
    assertThrows(IllegalArgumentException.class,
        () -> AggregateSpec.max("gas").validate(TestUtil.tradesSchema()));
    AggregateSpec.max("pool").validate(TestUtil.tradesSchema());
  }
}
