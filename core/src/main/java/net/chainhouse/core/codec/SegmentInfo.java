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

package net.chainhouse.core.codec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk and decoded sizes of a column segment.
 */
public final class SegmentInfo {

  private final long compressedBytes;
  private final long uncompressedBytes;

  @JsonCreator
  public SegmentInfo(@JsonProperty("compressedBytes") final long compressedBytes,
                     @JsonProperty("uncompressedBytes") final long uncompressedBytes) {
    this.compressedBytes = compressedBytes;
    this.uncompressedBytes = uncompressedBytes;
  }

  @JsonProperty("compressedBytes")
  public long compressedBytes() {
    return compressedBytes;
  }

  @JsonProperty("uncompressedBytes")
  public long uncompressedBytes() {
    return uncompressedBytes;
  }
}
