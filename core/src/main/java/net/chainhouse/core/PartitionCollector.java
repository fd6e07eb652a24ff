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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.ToIntFunction;

/**
 * Deletes the files of evicted partitions once the collection delay has
 * passed and no reader holds a lease on them.
 */
public class PartitionCollector {

  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionCollector.class);

  private final Deque<Garbage> garbageQueue = new ArrayDeque<>();
  private final long collectionDelayMillis;
  private final Clock clock;
  private final ToIntFunction<PartitionHandle> leaseCount;

  public PartitionCollector(final long collectionDelayMillis,
                            final Clock clock,
                            final ToIntFunction<PartitionHandle> leaseCount) {
    this.collectionDelayMillis = collectionDelayMillis;
    this.clock = clock;
    this.leaseCount = leaseCount;
  }

  public synchronized void collect(final PartitionHandle handle, final Path dir) {
    garbageQueue.add(new Garbage(handle, dir, clock.millis()));
  }

  /** @return the number of partitions whose files were deleted. */
  public synchronized int freePartitions() {
    int count = 0;
    final long now = clock.millis();
    final Iterator<Garbage> iterator = garbageQueue.iterator();
    while (iterator.hasNext()) {
      final Garbage garbage = iterator.next();
      if (now - garbage.time < collectionDelayMillis) {
        break;
      }
      if (leaseCount.applyAsInt(garbage.handle) > 0) {
        continue;
      }
      try {
        StoreFiles.deleteDirectory(garbage.dir);
        iterator.remove();
        count++;
      } catch (IOException e) {
        LOGGER.warn("Failed to delete evicted partition {}, will retry", garbage.handle, e);
      }
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Partitions collected: {} pending: {}", count, garbageQueue.size());
    }
    return count;
  }

  public synchronized int size() {
    return garbageQueue.size();
  }

  private static final class Garbage {
    private final PartitionHandle handle;
    private final Path dir;
    private final long time;

    private Garbage(final PartitionHandle handle, final Path dir, final long time) {
      this.handle = handle;
      this.dir = dir;
      this.time = time;
    }
  }
}
