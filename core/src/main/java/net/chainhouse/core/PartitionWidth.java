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

package net.chainhouse.core;

import static java.util.concurrent.TimeUnit.HOURS;

/**
 * Width of the time window covered by a partition. Partition boundaries are
 * aligned to the epoch.
 */
public enum PartitionWidth {
  _1_HR((byte) 0, (int) HOURS.toSeconds(1)),
  _2_HR((byte) 1, (int) HOURS.toSeconds(2)),
  _6_HR((byte) 2, (int) HOURS.toSeconds(6)),
  _24_HR((byte) 3, (int) HOURS.toSeconds(24));

  private final byte id;
  private final int seconds;

  PartitionWidth(final byte id, final int seconds) {
    this.id = id;
    this.seconds = seconds;
  }

  public byte getId() {
    return id;
  }

  public int getSeconds() {
    return seconds;
  }

  public long getMillis() {
    return seconds * 1000L;
  }

  /** @return the start of the partition holding {@code timestampMillis}. */
  public long partitionStart(final long timestampMillis) {
    return timestampMillis - Math.floorMod(timestampMillis, getMillis());
  }

  public static PartitionWidth getById(final byte id) {
    return values()[id];
  }

  public static PartitionWidth getBySeconds(final int seconds) {
    if (seconds == _1_HR.seconds) {
      return _1_HR;
    } else if (seconds == _2_HR.seconds) {
      return _2_HR;
    } else if (seconds == _6_HR.seconds) {
      return _6_HR;
    } else if (seconds == _24_HR.seconds) {
      return _24_HR;
    } else {
      throw new IllegalArgumentException("No partition width found for " + seconds + " seconds");
    }
  }

  public static PartitionWidth getByHours(final int hours) {
    try {
      return getBySeconds((int) HOURS.toSeconds(hours));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("No partition width found for " + hours + " hours");
    }
  }
}
