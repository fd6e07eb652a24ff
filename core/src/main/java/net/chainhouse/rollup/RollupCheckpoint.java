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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.PartitionHandle;

import java.util.Objects;

/**
 * Durable progress of a rollup: every partition with a commit id up to
 * {@code foldedCommitId} is folded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RollupCheckpoint {

  private final String rollup;
  private final long foldedCommitId;
  private final long foldedSequence;
  private final Long lastFoldedMaxTime;
  private final long foldedPartitions;
  private final long updatedAt;

  @JsonCreator
  public RollupCheckpoint(@JsonProperty("rollup") final String rollup,
                          @JsonProperty("foldedCommitId") final long foldedCommitId,
                          @JsonProperty("foldedSequence") final long foldedSequence,
                          @JsonProperty("lastFoldedMaxTime") final Long lastFoldedMaxTime,
                          @JsonProperty("foldedPartitions") final long foldedPartitions,
                          @JsonProperty("updatedAt") final long updatedAt) {
    this.rollup = rollup;
    this.foldedCommitId = foldedCommitId;
    this.foldedSequence = foldedSequence;
    this.lastFoldedMaxTime = lastFoldedMaxTime;
    this.foldedPartitions = foldedPartitions;
    this.updatedAt = updatedAt;
  }

  public static RollupCheckpoint initial(final String rollup, final long now) {
    return new RollupCheckpoint(rollup, -1, -1, null, 0, now);
  }

  /** @return the checkpoint after folding {@code partition}. */
  public RollupCheckpoint advance(final PartitionHandle partition, final long now) {
    final long maxTime = lastFoldedMaxTime == null
        ? partition.maxTime() : Math.max(lastFoldedMaxTime, partition.maxTime());
    return new RollupCheckpoint(rollup, partition.commitId(),
        Math.max(foldedSequence, partition.maxSequence()), maxTime, foldedPartitions + 1, now);
  }

  @JsonProperty("rollup")
  public String rollup() {
    return rollup;
  }

  @JsonProperty("foldedCommitId")
  public long foldedCommitId() {
    return foldedCommitId;
  }

  @JsonProperty("foldedSequence")
  public long foldedSequence() {
    return foldedSequence;
  }

  /** Largest event time folded so far, null before the first fold. */
  @JsonProperty("lastFoldedMaxTime")
  public Long lastFoldedMaxTime() {
    return lastFoldedMaxTime;
  }

  @JsonProperty("foldedPartitions")
  public long foldedPartitions() {
    return foldedPartitions;
  }

  @JsonProperty("updatedAt")
  public long updatedAt() {
    return updatedAt;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RollupCheckpoint)) {
      return false;
    }
    final RollupCheckpoint other = (RollupCheckpoint) o;
    return foldedCommitId == other.foldedCommitId
        && foldedSequence == other.foldedSequence
        && foldedPartitions == other.foldedPartitions
        && updatedAt == other.updatedAt
        && rollup.equals(other.rollup)
        && Objects.equals(lastFoldedMaxTime, other.lastFoldedMaxTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rollup, foldedCommitId, foldedSequence, lastFoldedMaxTime,
        foldedPartitions, updatedAt);
  }

  @Override
  public String toString() {
    return "RollupCheckpoint{" + rollup + ", foldedCommitId=" + foldedCommitId
        + ", foldedSequence=" + foldedSequence + ", lastFoldedMaxTime=" + lastFoldedMaxTime
        + ", foldedPartitions=" + foldedPartitions + "}";
  }
}
