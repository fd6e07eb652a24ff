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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory view of a rollup: the partial of every folded partition keyed by
 * commit id, and the merged bucket states. Putting a partial for a partition
 * that already has one replaces it, and the buckets it touches are rebuilt
 * from their contributors.
 */
class RollupTable {

  private final RollupDefinition definition;
  private final NavigableMap<Long, PartitionPartial> partials = new TreeMap<>();
  private final NavigableMap<BucketKey, RollupBucket> merged = new TreeMap<>();
  private final Map<BucketKey, Set<Long>> contributors = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  RollupTable(final RollupDefinition definition) {
    this.definition = definition;
  }

  RollupDefinition definition() {
    return definition;
  }

  void put(final PartitionPartial partial) {
    lock.writeLock().lock();
    try {
      final PartitionPartial previous = partials.put(partial.commitId(), partial);
      if (previous == null) {
        for (RollupBucket bucket : partial.buckets()) {
          contributors.computeIfAbsent(bucket.key(), k -> new TreeSet<>()).add(partial.commitId());
          final RollupBucket existing = merged.get(bucket.key());
          if (existing == null) {
            merged.put(bucket.key(), bucket.copy());
          } else {
            existing.merge(bucket);
          }
        }
        return;
      }
      final Set<BucketKey> affected = new TreeSet<>();
      for (RollupBucket bucket : previous.buckets()) {
        affected.add(bucket.key());
        final Set<Long> ids = contributors.get(bucket.key());
        if (ids != null) {
          ids.remove(previous.commitId());
        }
      }
      for (RollupBucket bucket : partial.buckets()) {
        affected.add(bucket.key());
        contributors.computeIfAbsent(bucket.key(), k -> new TreeSet<>()).add(partial.commitId());
      }
      for (BucketKey key : affected) {
        rebuild(key);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void rebuild(final BucketKey key) {
    final Set<Long> ids = contributors.get(key);
    merged.remove(key);
    if (ids == null || ids.isEmpty()) {
      contributors.remove(key);
      return;
    }
    for (long id : ids) {
      for (RollupBucket bucket : partials.get(id).buckets()) {
        if (bucket.key().equals(key)) {
          final RollupBucket existing = merged.get(key);
          if (existing == null) {
            merged.put(key, bucket.copy());
          } else {
            existing.merge(bucket);
          }
        }
      }
    }
  }

  boolean hasPartial(final long commitId) {
    lock.readLock().lock();
    try {
      return partials.containsKey(commitId);
    } finally {
      lock.readLock().unlock();
    }
  }

  int partialCount() {
    lock.readLock().lock();
    try {
      return partials.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return copies of the buckets starting in [from, to), in key order. */
  List<RollupBucket> buckets(final long from, final long to) {
    lock.readLock().lock();
    try {
      final List<RollupBucket> result = new ArrayList<>();
      if (from >= to) {
        return result;
      }
      final BucketKey lower = new BucketKey(from, null);
      final BucketKey upper = new BucketKey(to, null);
      for (RollupBucket bucket : merged.subMap(lower, true, upper, false).values()) {
        result.add(bucket.copy());
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  void loadAll(final Collection<PartitionPartial> loaded) {
    for (PartitionPartial partial : loaded) {
      put(partial);
    }
  }
}
