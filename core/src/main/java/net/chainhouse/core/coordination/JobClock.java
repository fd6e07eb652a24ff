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
package net.chainhouse.core.coordination;

import java.time.Duration;
import java.time.Instant;
import java.util.function.LongSupplier;

/**
 * Decides when a periodic job is due. The first run is due after the initial
 * delay, later runs one period after the previous submission.
 */
public class JobClock {

  private final LongSupplier millis;
  private final long periodMillis;
  private volatile long nextRunMillis;

  public JobClock(final LongSupplier millis, final Duration initialDelay, final Duration period) {
    if (period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("Job period must be positive: " + period);
    }
    this.millis = millis;
    this.periodMillis = period.toMillis();
    this.nextRunMillis = millis.getAsLong() + initialDelay.toMillis();
  }

  public boolean isDue() {
    return millis.getAsLong() >= nextRunMillis;
  }

  /** Schedules the next run one period from now. */
  public void advance() {
    nextRunMillis = millis.getAsLong() + periodMillis;
  }

  public long nextRunMillis() {
    return nextRunMillis;
  }

  @Override
  public String toString() {
    return "next run " + Instant.ofEpochMilli(nextRunMillis) + " every "
        + Duration.ofMillis(periodMillis);
  }
}
