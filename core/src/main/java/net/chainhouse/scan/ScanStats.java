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

package net.chainhouse.scan;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one scan. Updated concurrently by the scan workers.
 */
public class ScanStats {

  private final AtomicLong partitionsTotal = new AtomicLong();
  private final AtomicLong partitionsPruned = new AtomicLong();
  private final AtomicLong partitionsScanned = new AtomicLong();
  private final AtomicLong partitionsFailed = new AtomicLong();
  private final AtomicLong partitionsEvicted = new AtomicLong();
  private final AtomicLong partitionsQuarantined = new AtomicLong();
  private final AtomicLong granulesScanned = new AtomicLong();
  private final AtomicLong granulesPruned = new AtomicLong();
  private final AtomicLong rowsRead = new AtomicLong();
  private final AtomicLong rowsMatched = new AtomicLong();
  private final AtomicLong bytesRead = new AtomicLong();
  private final AtomicLong bytesDecompressed = new AtomicLong();

  void addPartitionsTotal(final long n) {
    partitionsTotal.addAndGet(n);
  }

  void addPartitionsPruned(final long n) {
    partitionsPruned.addAndGet(n);
  }

  void incrementPartitionsScanned() {
    partitionsScanned.incrementAndGet();
  }

  void incrementPartitionsFailed() {
    partitionsFailed.incrementAndGet();
  }

  void incrementPartitionsEvicted() {
    partitionsEvicted.incrementAndGet();
  }

  void incrementPartitionsQuarantined() {
    partitionsQuarantined.incrementAndGet();
  }

  void incrementGranulesScanned() {
    granulesScanned.incrementAndGet();
  }

  void incrementGranulesPruned() {
    granulesPruned.incrementAndGet();
  }

  void addRowsRead(final long n) {
    rowsRead.addAndGet(n);
  }

  void addRowsMatched(final long n) {
    rowsMatched.addAndGet(n);
  }

  void addBytes(final long read, final long decompressed) {
    bytesRead.addAndGet(read);
    bytesDecompressed.addAndGet(decompressed);
  }

  /** Partitions of the table that were live when the scan started. */
  public long partitionsTotal() {
    return partitionsTotal.get();
  }

  /** Partitions skipped by the index without reading any data. */
  public long partitionsPruned() {
    return partitionsPruned.get();
  }

  /** Partitions whose data was read. */
  public long partitionsScanned() {
    return partitionsScanned.get();
  }

  public long partitionsFailed() {
    return partitionsFailed.get();
  }

  public long partitionsEvicted() {
    return partitionsEvicted.get();
  }

  /** Candidate partitions that were quarantined before the scan, also counted as failed. */
  public long partitionsQuarantined() {
    return partitionsQuarantined.get();
  }

  public long granulesScanned() {
    return granulesScanned.get();
  }

  public long granulesPruned() {
    return granulesPruned.get();
  }

  public long rowsRead() {
    return rowsRead.get();
  }

  public long rowsMatched() {
    return rowsMatched.get();
  }

  public long bytesRead() {
    return bytesRead.get();
  }

  public long bytesDecompressed() {
    return bytesDecompressed.get();
  }

  @Override
  public String toString() {
    return "ScanStats{partitions total=" + partitionsTotal + " pruned=" + partitionsPruned
        + " scanned=" + partitionsScanned + " failed=" + partitionsFailed
        + " quarantined=" + partitionsQuarantined
        + ", granules scanned=" + granulesScanned + " pruned=" + granulesPruned
        + ", rows read=" + rowsRead + " matched=" + rowsMatched
        + ", bytes read=" + bytesRead + " decompressed=" + bytesDecompressed + "}";
  }
}
