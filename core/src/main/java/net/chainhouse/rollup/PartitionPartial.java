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
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.PartitionHandle;

import java.util.List;

/**
 * The buckets one partition contributes to a rollup. Stored per partition id
 * and replaced as a whole, so folding a partition twice leaves the rollup
 * unchanged.
 */
public final class PartitionPartial {

  private final String rollup;
  private final PartitionHandle partition;
  private final List<RollupBucket> buckets;

  @JsonCreator
  public PartitionPartial(@JsonProperty("rollup") final String rollup,
                          @JsonProperty("partition") final PartitionHandle partition,
                          @JsonProperty("buckets") final List<RollupBucket> buckets) {
    this.rollup = rollup;
    this.partition = partition;
    this.buckets = buckets;
  }

  @JsonProperty("rollup")
  public String rollup() {
    return rollup;
  }

  @JsonProperty("partition")
  public PartitionHandle partition() {
    return partition;
  }

  @JsonProperty("buckets")
  public List<RollupBucket> buckets() {
    return buckets;
  }

  public long commitId() {
    return partition.commitId();
  }

  @Override
  public String toString() {
    return "PartitionPartial{" + rollup + ", " + partition.id() + ", buckets=" + buckets.size() + "}";
  }
}
