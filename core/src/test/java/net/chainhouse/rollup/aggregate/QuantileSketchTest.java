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

import net.chainhouse.core.StoreFiles;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QuantileSketchTest {

  @Test
  void relativeAccuracy() {
    final QuantileSketch sketch = new QuantileSketch();
    for (int i = 1; i <= 10000; i++) {
      sketch.add(i);
    }
    assertEquals(10000, sketch.count());
    for (double q : new double[] {0, 0.25, 0.5, 0.9, 0.99, 0.999, 1}) {
      final double expected = Math.floor(q * 9999) + 1;
      assertWithin(expected, sketch.quantile(q));
    }
  }

  @Test
  void negativesAndZero() {
    final QuantileSketch sketch = new QuantileSketch();
    sketch.add(3);
    sketch.add(-1);
    sketch.add(0);
    sketch.add(-5);
    sketch.add(Double.NaN);

    assertEquals(4, sketch.count());
    assertWithin(-5, sketch.quantile(0));
    assertWithin(-1, sketch.quantile(0.5));
    assertEquals(0.0, sketch.quantile(0.7));
    assertWithin(3, sketch.quantile(1));
  }

  @Test
  void mergeLosesNothing() {
    final Random random = new Random(42);
    final QuantileSketch whole = new QuantileSketch();
    final QuantileSketch left = new QuantileSketch();
    final QuantileSketch right = new QuantileSketch();
    for (int i = 0; i < 5000; i++) {
      final double value = Math.exp(random.nextGaussian() * 3);
      whole.add(value);
      (i % 2 == 0 ? left : right).add(value);
    }
    left.merge(right);
    assertEquals(whole.count(), left.count());
    for (double q : new double[] {0.01, 0.5, 0.95}) {
      assertEquals(whole.quantile(q), left.quantile(q));
    }
  }

  @Test
  void emptyAndInvalid() {
    final QuantileSketch sketch = new QuantileSketch();
    assertTrue(sketch.isEmpty());
    assertTrue(Double.isNaN(sketch.quantile(0.5)));
    assertThrows(IllegalArgumentException.class, () -> sketch.quantile(-0.1));
  }

  @Test
  void json() throws Exception {
    final QuantileSketch sketch = new QuantileSketch();
    for (int i = -50; i <= 50; i++) {
      sketch.add(i * 1.5);
    }
    final QuantileSketch restored = StoreFiles.MAPPER.readValue(
        StoreFiles.MAPPER.writeValueAsString(sketch), QuantileSketch.class);
    assertEquals(sketch.count(), restored.count());
    assertEquals(sketch.quantile(0.3), restored.quantile(0.3));
  }

  private static void assertWithin(final double expected, final double actual) {
    assertTrue(Math.abs(actual - expected) <= Math.abs(expected) * QuantileSketch.RELATIVE_ACCURACY
        + 1e-9, () -> "expected ~" + expected + " got " + actual);
  }
}
