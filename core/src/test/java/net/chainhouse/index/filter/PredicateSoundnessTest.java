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

import net.chainhouse.core.ColumnType;
import net.chainhouse.core.StoreFiles;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.ColumnVector;
import net.chainhouse.core.data.RowRange;
import net.chainhouse.index.ColumnStats;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PredicateSoundnessTest {

  private static final String[] STRINGS = {"a", "b", "c", "d", "e", "f"};
  private static final double[] DOUBLES = {-1.5, 0.5, 2.25, 3.0, 7.5, 100.0};

  private final Random random = new Random(20210101L);

  @Test
  void statsNeverPruneAMatchingRow() {
    for (int trial = 0; trial < 2000; trial++) {
      final int rows = 1 + random.nextInt(12);
      final int valueSetLimit = random.nextBoolean() ? 2 : 64;
      final Map<String, ColumnVector> vectors = new HashMap<>();
      final Map<String, ColumnStats> stats = new HashMap<>();
      fill("n", ColumnType.LONG, rows, valueSetLimit, vectors, stats);
      fill("x", ColumnType.DOUBLE, rows, valueSetLimit, vectors, stats);
      fill("s", ColumnType.STRING, rows, valueSetLimit, vectors, stats);
      final ColumnBlockSet block = new ColumnBlockSet(RowRange.of(0, rows), vectors, 0, 0);

      final Predicate predicate = randomPredicate(3);
      final RoaringBitmap matching = new RoaringBitmap();
      for (int row = 0; row < rows; row++) {
        if (predicate.test(block, row)) {
          matching.add(row);
        }
      }
      final String context = predicate + " over " + stats;
      assertEquals(matching, predicate.evaluate(block, RoaringBitmap.bitmapOfRange(0, rows)),
          context);
      if (!predicate.mightMatch(stats)) {
        assertTrue(matching.isEmpty(), "pruned a match: " + context);
      }
      if (predicate.mustMatch(stats)) {
        assertEquals(rows, matching.getCardinality(), "claimed all rows: " + context);
      }
    }
  }

  @Test
  void integralColumnsCompareBeyondDoublePrecision() {
    final long twoTo53 = 1L << 53;
    final long[] values = {twoTo53 - 1, twoTo53, twoTo53 + 1, twoTo53 + 3,
        Long.MAX_VALUE - 1, Long.MAX_VALUE, Long.MIN_VALUE, Long.MIN_VALUE + 1, 0L};
    final Object[] bounds = {(double) twoTo53, twoTo53 + 2.0, twoTo53 + 1, 9.3e18,
        (double) Long.MAX_VALUE, 1e19, -1e19, Double.POSITIVE_INFINITY,
        Double.NEGATIVE_INFINITY, Long.MAX_VALUE, Long.MIN_VALUE, -0.5};
    for (long value : values) {
      final Object[] row = {value};
      final ColumnBlockSet block = new ColumnBlockSet(RowRange.of(0, 1),
          Collections.singletonMap("n", ColumnVector.fromValues("n", ColumnType.LONG, row)), 0, 0);
      final Map<String, ColumnStats> stats = Collections.singletonMap("n",
          ColumnStats.newBuilder(ColumnType.LONG, 0).add(value).build());
      for (Object bound : bounds) {
        final int cmp = new BigDecimal(value).compareTo(bound instanceof Double
            ? new BigDecimal((Double) bound) : BigDecimal.valueOf((Long) bound));
        check(Predicates.gt("n", bound), cmp > 0, block, stats);
        check(Predicates.gte("n", bound), cmp >= 0, block, stats);
        check(Predicates.lt("n", bound), cmp < 0, block, stats);
        check(Predicates.lte("n", bound), cmp <= 0, block, stats);
      }
    }
  }

  @Test
  void boundsPastTheLongRangeSaturate() {
    final Object[] fees = {1L, Long.MAX_VALUE, null, Long.MIN_VALUE};
    final Object[] pools = {"usdc-eth", "wbtc-eth", "usdc-eth", "dai-usdc"};
    final Map<String, ColumnVector> vectors = new HashMap<>();
    vectors.put("fee", ColumnVector.fromValues("fee", ColumnType.LONG, fees));
    vectors.put("pool", ColumnVector.fromValues("pool", ColumnType.STRING, pools));
    final ColumnBlockSet block = new ColumnBlockSet(RowRange.of(0, 4), vectors, 0, 0);
    final RoaringBitmap all = RoaringBitmap.bitmapOfRange(0, 4);

    assertEquals(RoaringBitmap.bitmapOf(0, 2),
        Predicates.or(Predicates.gt("fee", 1e19), Predicates.eq("pool", "usdc-eth"))
            .evaluate(block, all));
    assertEquals(new RoaringBitmap(), Predicates.gte("fee", 1e19).evaluate(block, all));
    assertEquals(new RoaringBitmap(), Predicates.lt("fee", -1e19).evaluate(block, all));
    assertEquals(RoaringBitmap.bitmapOf(0, 1, 3), Predicates.gt("fee", -1e19).evaluate(block, all));
    assertEquals(RoaringBitmap.bitmapOf(0, 1, 3), Predicates.lte("fee", 1e19).evaluate(block, all));
    assertEquals(new RoaringBitmap(), Predicates.gt("fee", Long.MAX_VALUE).evaluate(block, all));
    assertEquals(new RoaringBitmap(), Predicates.lt("fee", Long.MIN_VALUE).evaluate(block, all));
    assertEquals(new RoaringBitmap(), Predicates.gt("fee", Double.NaN).evaluate(block, all));
  }

  @Test
  void doubleColumnsCompareExactlyWithLongBounds() {
    final long big = (1L << 53) + 1;
    final Object[] values = {(double) (1L << 53)};
    final ColumnBlockSet block = new ColumnBlockSet(RowRange.of(0, 1),
        Collections.singletonMap("x", ColumnVector.fromValues("x", ColumnType.DOUBLE, values)), 0, 0);
    final Map<String, ColumnStats> stats = Collections.singletonMap("x",
        ColumnStats.newBuilder(ColumnType.DOUBLE, 0).add(values[0]).build());

    check(Predicates.lt("x", big), true, block, stats);
    check(Predicates.gte("x", big), false, block, stats);
    check(Predicates.gte("x", big - 1), true, block, stats);
  }

  private static void check(final Predicate predicate,
                            final boolean expected,
                            final ColumnBlockSet block,
                            final Map<String, ColumnStats> stats) {
    final String context = predicate + " over " + stats;
    assertEquals(expected, predicate.test(block, 0), context);
    assertEquals(expected, !predicate.evaluate(block, RoaringBitmap.bitmapOf(0)).isEmpty(), context);
    assertEquals(expected, predicate.mightMatch(stats), context);
    assertEquals(expected, predicate.mustMatch(stats), context);
  }

  @Test
  void literalSharedAcrossColumnTypesStaysConsistent() throws Exception {
    final Predicate eq = Predicates.eq("v", 3L);
    final Map<String, ColumnStats> longs = Collections.singletonMap("v",
        ColumnStats.newBuilder(ColumnType.LONG, 4).add(3L).build());
    final Map<String, ColumnStats> doubles = Collections.singletonMap("v",
        ColumnStats.newBuilder(ColumnType.DOUBLE, 4).add(3.0).build());
    final ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      final List<Future<Boolean>> results = new ArrayList<>();
      for (Map<String, ColumnStats> stats : Arrays.asList(longs, doubles)) {
        results.add(pool.submit(() -> {
          for (int i = 0; i < 20_000; i++) {
            if (!eq.mightMatch(stats) || !eq.mustMatch(stats)) {
              return false;
            }
          }
          return true;
        }));
      }
      for (Future<Boolean> result : results) {
        assertTrue(result.get(30, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void mergedStatsStaySound() {
    for (int trial = 0; trial < 500; trial++) {
      final Map<String, ColumnVector> first = new HashMap<>();
      final Map<String, ColumnStats> firstStats = new HashMap<>();
      final Map<String, ColumnVector> second = new HashMap<>();
      final Map<String, ColumnStats> secondStats = new HashMap<>();
      fill("n", ColumnType.LONG, 4, 3, first, firstStats);
      fill("n", ColumnType.LONG, 4, 3, second, secondStats);
      final Map<String, ColumnStats> merged = Collections.singletonMap("n",
          ColumnStats.merge(Arrays.asList(firstStats.get("n"), secondStats.get("n")), 3));

      final Predicate predicate = leaf("n");
      boolean any = false;
      for (Map<String, ColumnVector> vectors : Arrays.asList(first, second)) {
        final ColumnBlockSet block = new ColumnBlockSet(RowRange.of(0, 4), vectors, 0, 0);
        for (int row = 0; row < 4; row++) {
          any |= predicate.test(block, row);
        }
      }
      if (any) {
        assertTrue(predicate.mightMatch(merged), predicate + " over " + merged);
      }
    }
  }

  @Test
  void valueSetsPruneAbsentStrings() {
    final ColumnStats.Builder builder = ColumnStats.newBuilder(ColumnType.STRING, 8);
    builder.add("usdc-eth").add("wbtc-eth").add(null);
    final Map<String, ColumnStats> stats = Collections.singletonMap("pool", builder.build());

    assertFalse(Predicates.eq("pool", "dai-usdc").mightMatch(stats));
    assertTrue(Predicates.eq("pool", "usdc-eth").mightMatch(stats));
    assertFalse(Predicates.notIn("pool", "usdc-eth", "wbtc-eth").mightMatch(stats));
    assertFalse(Predicates.in("pool", "usdc-eth", "wbtc-eth").mustMatch(stats));
    assertTrue(Predicates.gt("fee", 10L).mightMatch(stats));
  }

  @Test
  void rangesPruneOnMinMax() {
    final ColumnStats.Builder builder = ColumnStats.newBuilder(ColumnType.LONG, 0);
    for (long fee = 100; fee <= 500; fee += 100) {
      builder.add(fee);
    }
    final Map<String, ColumnStats> stats = Collections.singletonMap("fee", builder.build());

    assertFalse(Predicates.gt("fee", 500L).mightMatch(stats));
    assertTrue(Predicates.gte("fee", 500).mightMatch(stats));
    assertFalse(Predicates.lt("fee", 99.5).mightMatch(stats));
    assertTrue(Predicates.between("fee", 100L, 501L).mustMatch(stats));
    assertFalse(Predicates.between("fee", 100L, 500L).mustMatch(stats));
    assertTrue(Predicates.not(Predicates.gt("fee", 1000L)).mustMatch(stats));
  }

  @Test
  void predicatesSurviveJson() throws IOException {
    final Predicate predicate = Predicates.and(
        Predicates.in("pool", "usdc-eth", "wbtc-eth"),
        Predicates.or(Predicates.gte("fee", 100L), Predicates.not(Predicates.eq("trader", "0xabc"))),
        Predicates.between("amount", -1.5, 2.5));
    final byte[] json = StoreFiles.MAPPER.writeValueAsBytes(predicate);
    assertEquals(predicate, StoreFiles.MAPPER.readValue(json, Predicate.class));
    assertEquals(Predicates.all(), StoreFiles.MAPPER.readValue(
        StoreFiles.MAPPER.writeValueAsBytes(Predicates.all()), Predicate.class));
  }

  @Test
  void matchAllCollapses() {
    final Predicate eq = Predicates.eq("pool", "x");
    assertTrue(Predicates.and(Predicates.all(), Predicates.all()).isMatchAll());
    assertEquals(eq, Predicates.and(Predicates.all(), eq));
    assertTrue(Predicates.or(eq, Predicates.all()).isMatchAll());
  }

  private void fill(final String column,
                    final ColumnType type,
                    final int rows,
                    final int valueSetLimit,
                    final Map<String, ColumnVector> vectors,
                    final Map<String, ColumnStats> stats) {
    final Object[] values = new Object[rows];
    final ColumnStats.Builder builder = ColumnStats.newBuilder(type, valueSetLimit);
    for (int i = 0; i < rows; i++) {
      values[i] = random.nextInt(5) == 0 ? null : randomValue(type);
      builder.add(values[i]);
    }
    vectors.put(column, ColumnVector.fromValues(column, type, values));
    stats.put(column, builder.build());
  }

  private Object randomValue(final ColumnType type) {
    switch (type) {
      case LONG:
        return (long) (random.nextInt(21) - 10);
      case DOUBLE:
        return DOUBLES[random.nextInt(DOUBLES.length)];
      default:
        return STRINGS[random.nextInt(STRINGS.length)];
    }
  }

  private Predicate randomPredicate(final int depth) {
    if (depth == 0 || random.nextInt(3) == 0) {
      return leaf(new String[] {"n", "x", "s"}[random.nextInt(3)]);
    }
    switch (random.nextInt(3)) {
      case 0:
        return Predicates.and(randomPredicate(depth - 1), randomPredicate(depth - 1));
      case 1:
        return Predicates.or(randomPredicate(depth - 1), randomPredicate(depth - 1));
      default:
        return Predicates.not(randomPredicate(depth - 1));
    }
  }

  private Predicate leaf(final String column) {
    final ColumnType type = column.equals("n") ? ColumnType.LONG
        : column.equals("x") ? ColumnType.DOUBLE : ColumnType.STRING;
    final int kind = random.nextInt(9);
    final Object a = literal(type, kind >= 4);
    final Object b = literal(type, kind >= 4);
    switch (kind) {
      case 0:
        return Predicates.eq(column, a);
      case 1:
        return Predicates.in(column, a, b);
      case 2:
        return Predicates.notEq(column, a);
      case 3:
        return Predicates.notIn(column, a, b);
      case 4:
        return Predicates.gt(column, a);
      case 5:
        return Predicates.gte(column, a);
      case 6:
        return Predicates.lt(column, a);
      case 7:
        return Predicates.lte(column, a);
      default:
        return Predicates.between(column, a, b);
    }
  }

  private Object literal(final ColumnType type, final boolean bound) {
    if (type == ColumnType.LONG && random.nextInt(4) == 0) {
      final int value = random.nextInt(21) - 10;
      // fractional bounds against an integral column
      return bound && random.nextBoolean() ? (Object) (value + 0.5) : (Object) value;
    }
    return randomValue(type);
  }
}
