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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.chainhouse.core.codec.SegmentInfo;
import net.chainhouse.index.IndexEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Written last into a partition directory; describes its segments and skip
 * index data.
 */
public final class PartitionManifest {

  public static final String FILE_NAME = "manifest.json";

  private final IndexEntry entry;
  private final Map<String, SegmentInfo> segments;

  @JsonCreator
  public PartitionManifest(@JsonProperty("entry") final IndexEntry entry,
                           @JsonProperty("segments") final Map<String, SegmentInfo> segments) {
    this.entry = entry;
    this.segments = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
  }

  @JsonProperty("entry")
  public IndexEntry entry() {
    return entry;
  }

  @JsonProperty("segments")
  public Map<String, SegmentInfo> segments() {
    return segments;
  }

  @JsonIgnore
  public PartitionHandle handle() {
    return entry.handle();
  }

  @JsonIgnore
  public long compressedBytes() {
    long total = 0;
    for (SegmentInfo info : segments.values()) {
      total += info.compressedBytes();
    }
    return total;
  }

  @JsonIgnore
  public long uncompressedBytes() {
    long total = 0;
    for (SegmentInfo info : segments.values()) {
      total += info.uncompressedBytes();
    }
    return total;
  }
}
