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

import net.chainhouse.core.data.ColumnVector;
import org.roaringbitmap.RoaringBitmap;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Dictionary encodes low cardinality string granules and falls back to plain
 * length prefixed values past {@code dictionaryLimit} distinct entries. The
 * payload is GZIP compressed in both modes.
 */
public class StringDictionaryCodec implements ColumnCodec {

  private static final byte PLAIN = 0;
  private static final byte DICTIONARY = 1;

  private final int dictionaryLimit;

  public StringDictionaryCodec(final int dictionaryLimit) {
    this.dictionaryLimit = dictionaryLimit;
  }

  @Override
  public byte[] encode(final ColumnVector vector) throws IOException {
    final int rows = vector.size();
    final Map<String, Integer> dictionary = new HashMap<>();
    final List<String> entries = new ArrayList<>();
    boolean useDictionary = true;
    for (int i = 0; i < rows && useDictionary; i++) {
      final String value = vector.getString(i);
      if (!dictionary.containsKey(value)) {
        if (entries.size() == dictionaryLimit) {
          useDictionary = false;
        } else {
          dictionary.put(value, entries.size());
          entries.add(value);
        }
      }
    }

    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(new GZIPOutputStream(bytes))) {
      if (useDictionary) {
        out.writeByte(DICTIONARY);
        writeVarInt(out, entries.size());
        for (String entry : entries) {
          writeString(out, entry);
        }
        for (int i = 0; i < rows; i++) {
          writeVarInt(out, dictionary.get(vector.getString(i)));
        }
      } else {
        out.writeByte(PLAIN);
        for (int i = 0; i < rows; i++) {
          writeString(out, vector.getString(i));
        }
      }
    }
    return bytes.toByteArray();
  }

  @Override
  public ColumnVector decode(final String column,
                             final byte[] block,
                             final int offset,
                             final int length,
                             final int rows,
                             final RoaringBitmap nulls) throws IOException {
    final String[] values = new String[rows];
    try (DataInputStream in = new DataInputStream(
        new GZIPInputStream(new ByteArrayInputStream(block, offset, length)))) {
      final byte mode = in.readByte();
      if (mode == DICTIONARY) {
        final int size = readVarInt(in);
        final String[] entries = new String[size];
        for (int i = 0; i < size; i++) {
          entries[i] = readString(in);
        }
        for (int i = 0; i < rows; i++) {
          final int code = readVarInt(in);
          if (code < 0 || code >= size) {
            throw new IOException("Dictionary code " + code + " out of range " + size);
          }
          values[i] = entries[code];
        }
      } else if (mode == PLAIN) {
        for (int i = 0; i < rows; i++) {
          values[i] = readString(in);
        }
      } else {
        throw new IOException("Unknown string encoding mode " + mode);
      }
    }
    return ColumnVector.ofStrings(column, values, nulls);
  }

  private static void writeString(final DataOutput out, final String value) throws IOException {
    final byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    writeVarInt(out, utf8.length);
    out.write(utf8);
  }

  private static String readString(final DataInput in) throws IOException {
    final int length = readVarInt(in);
    if (length < 0) {
      throw new IOException("Negative string length " + length);
    }
    final byte[] utf8 = new byte[length];
    in.readFully(utf8);
    return new String(utf8, StandardCharsets.UTF_8);
  }

  static void writeVarInt(final DataOutput out, int value) throws IOException {
    while ((value & ~0x7F) != 0) {
      out.writeByte((value & 0x7F) | 0x80);
      value >>>= 7;
    }
    out.writeByte(value);
  }

  static int readVarInt(final DataInput in) throws IOException {
    int value = 0;
    for (int shift = 0; shift < 32; shift += 7) {
      final byte b = in.readByte();
      value |= (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        return value;
      }
    }
    throw new IOException("Malformed varint");
  }
}
