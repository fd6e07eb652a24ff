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

package net.chainhouse.rollup;

import org.junit.jupiter.api.Test;

import static net.chainhouse.TestUtil.HOUR;
import static net.chainhouse.TestUtil.MINUTE;
import static net.chainhouse.TestUtil.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BucketGranularityTest {

  @Test
  void bucketStart() {
    assertEquals(T0, BucketGranularity._1_HR.bucketStart(T0));
    assertEquals(T0, BucketGranularity._1_HR.bucketStart(T0 + HOUR - 1));
    assertEquals(T0 + 15 * MINUTE, BucketGranularity._15_MIN.bucketStart(T0 + 29 * MINUTE));
    assertEquals(T0, BucketGranularity._1_DAY.bucketStart(T0 + 23 * HOUR));
    // before the epoch
    assertEquals(-HOUR, BucketGranularity._1_HR.bucketStart(-1));
  }

  @Test
  void divides() {
    assertTrue(BucketGranularity._1_MIN.divides(BucketGranularity._1_HR));
    assertTrue(BucketGranularity._15_MIN.divides(BucketGranularity._1_DAY));
    assertTrue(BucketGranularity._1_HR.divides(BucketGranularity._1_HR));
    assertFalse(BucketGranularity._1_HR.divides(BucketGranularity._15_MIN));
  }

  @Test
  void lookups() {
    assertEquals(BucketGranularity._5_MIN, BucketGranularity.getByMinutes(5));
    assertEquals(BucketGranularity._1_DAY, BucketGranularity.getByMinutes(1440));
    assertThrows(IllegalArgumentException.class, () -> BucketGranularity.getByMinutes(7));
    for (BucketGranularity granularity : BucketGranularity.values()) {
      assertEquals(granularity, BucketGranularity.getById(granularity.getId()));
    }
  }
}
