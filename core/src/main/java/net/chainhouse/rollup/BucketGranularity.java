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

import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MINUTES;

/**
 * Width of a rollup bucket or a time group key. Buckets are aligned to the
 * epoch, so every bucket of a finer granularity lies in exactly one bucket of
 * a coarser one.
 */
public enum BucketGranularity {
  _1_MIN((byte) 0, MINUTES.toMillis(1)),
  _5_MIN((byte) 1, MINUTES.toMillis(5)),
  _15_MIN((byte) 2, MINUTES.toMillis(15)),
  _1_HR((byte) 3, HOURS.toMillis(1)),
  _1_DAY((byte) 4, DAYS.toMillis(1));

  private final byte id;
  private final long millis;

  BucketGranularity(final byte id, final long millis) {
    this.id = id;
    this.millis = millis;
  }

  public byte getId() {
    return id;
  }

  public long getMillis() {
    return millis;
  }

  public long bucketStart(final long timestamp) {
    return timestamp - Math.floorMod(timestamp, millis);
  }

  /** @return true if buckets of {@code coarser} are unions of buckets of this granularity. */
  public boolean divides(final BucketGranularity coarser) {
    return coarser.millis % millis == 0;
  }

  public static BucketGranularity getById(final byte id) {
    return values()[id];
  }

  public static BucketGranularity getByMinutes(final int minutes) {
    final long ms = MINUTES.toMillis(minutes);
    for (BucketGranularity granularity : values()) {
      if (granularity.millis == ms) {
        return granularity;
      }
    }
    throw new IllegalArgumentException("No bucket granularity found for " + minutes + " minutes");
  }
}
