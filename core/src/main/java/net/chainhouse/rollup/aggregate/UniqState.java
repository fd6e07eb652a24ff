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

package net.chainhouse.rollup.aggregate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.roaringbitmap.longlong.Roaring64NavigableMap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Distinct count over 64 bit fingerprints of the values. Exact up to
 * fingerprint collisions.
 */
public final class UniqState extends AggregateState {

  private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();

  private final Roaring64NavigableMap fingerprints;

  public UniqState() {
    this.fingerprints = new Roaring64NavigableMap();
  }

  @JsonCreator
  public UniqState(@JsonProperty("fingerprints") final byte[] serialized) {
    this.fingerprints = new Roaring64NavigableMap();
    if (serialized != null) {
      try {
        fingerprints.deserialize(new DataInputStream(new ByteArrayInputStream(serialized)));
      } catch (IOException e) {
        throw new UncheckedIOException("Malformed uniq state", e);
      }
    }
  }

  @JsonProperty("fingerprints")
  public byte[] serialized() {
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      fingerprints.serialize(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return bytes.toByteArray();
  }

  static long fingerprint(final Object value) {
    if (value instanceof Long) {
      return FINGERPRINT.hashLong((Long) value).asLong();
    }
    if (value instanceof Double) {
      return FINGERPRINT.hashLong(Double.doubleToLongBits((Double) value)).asLong();
    }
    return FINGERPRINT.hashString(value.toString(), StandardCharsets.UTF_8).asLong();
  }

  @Override
  public void add(final Object value) {
    if (value != null) {
      fingerprints.addLong(fingerprint(value));
    }
  }

  @Override
  public void merge(final AggregateState other) {
    fingerprints.or(cast(other, UniqState.class).fingerprints);
  }

  @Override
  public Object value() {
    return fingerprints.getLongCardinality();
  }

  @Override
  public AggregateState copy() {
    final UniqState copy = new UniqState();
    copy.fingerprints.or(fingerprints);
    return copy;
  }
}
