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

import net.chainhouse.core.ColumnType;

/**
 * Picks the codec for a column type.
 */
public final class ColumnCodecs {

  private ColumnCodecs() {
  }

  public static ColumnCodec forType(final ColumnType type, final int stringDictionaryLimit) {
    switch (type) {
      case TIMESTAMP:
      case LONG:
        return new LongDeltaCodec(type);
      case DOUBLE:
        return new GorillaDoubleCodec();
      case STRING:
        return new StringDictionaryCodec(stringDictionaryLimit);
      default:
        throw new IllegalArgumentException("No codec for " + type);
    }
  }
}
