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

import java.time.Duration;
import java.time.Instant;

/**
 * Raised when a rollup lags behind its table by more than the configured
 * threshold. Queries keep working on the raw path.
 */
public final class RollupStalenessAlarm {

  private final String rollup;
  private final Duration lag;
  private final Duration threshold;
  private final long pendingPartitions;
  private final Instant raisedAt;

  public RollupStalenessAlarm(final String rollup,
                              final Duration lag,
                              final Duration threshold,
                              final long pendingPartitions,
                              final Instant raisedAt) {
    this.rollup = rollup;
    this.lag = lag;
    this.threshold = threshold;
    this.pendingPartitions = pendingPartitions;
    this.raisedAt = raisedAt;
  }

  public String rollup() {
    return rollup;
  }

  public Duration lag() {
    return lag;
  }

  public Duration threshold() {
    return threshold;
  }

  public long pendingPartitions() {
    return pendingPartitions;
  }

  public Instant raisedAt() {
    return raisedAt;
  }

  @Override
  public String toString() {
    return "Rollup " + rollup + " is " + lag + " behind (threshold " + threshold + ", "
        + pendingPartitions + " partitions pending)";
  }
}
