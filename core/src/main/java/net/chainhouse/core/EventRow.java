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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event to ingest. Values are keyed by column name; absent columns are
 * null.
 */
public final class EventRow {

  private final long sequence;
  private final Map<String, Object> values;

  private EventRow(final long sequence, final Map<String, Object> values) {
    this.sequence = sequence;
    this.values = Collections.unmodifiableMap(values);
  }

  public static Builder newBuilder(final long sequence) {
    return new Builder(sequence);
  }

  public long sequence() {
    return sequence;
  }

  public Object get(final String column) {
    return values.get(column);
  }

  public Map<String, Object> values() {
    return values;
  }

  @Override
  public String toString() {
    return "EventRow{seq=" + sequence + ", " + values + "}";
  }

  public static class Builder {
    private final long sequence;
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder(final long sequence) {
      this.sequence = sequence;
    }

    public Builder set(final String column, final Object value) {
      values.put(column, value);
      return this;
    }

    public EventRow build() {
      return new EventRow(sequence, new LinkedHashMap<>(values));
    }
  }
}
