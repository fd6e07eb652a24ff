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

package net.chainhouse.core.data;

import java.util.Arrays;

/**
 * Growable, most-significant-bit first bit stream used by the gorilla style
 * column codecs.
 */
public class BitWriter {

  private long[] words;
  private int bitIndex;

  public BitWriter() {
    this(16);
  }

  public BitWriter(final int initialWords) {
    this.words = new long[Math.max(1, initialWords)];
  }

  /**
   * Appends the low {@code bitsToWrite} bits of {@code value}.
   */
  public void write(final long value, final int bitsToWrite) {
    if (bitsToWrite < 0 || bitsToWrite > 64) {
      throw new IllegalArgumentException("Invalid bit count: " + bitsToWrite);
    }
    if (bitsToWrite == 0) {
      return;
    }
    final long v = bitsToWrite == 64 ? value : value & ((1L << bitsToWrite) - 1);
    final int wordIndex = bitIndex >>> 6;
    final int free = 64 - (bitIndex & 63);
    ensureCapacity(wordIndex + 2);
    if (bitsToWrite <= free) {
      words[wordIndex] |= v << (free - bitsToWrite);
    } else {
      final int spill = bitsToWrite - free;
      words[wordIndex] |= v >>> spill;
      words[wordIndex + 1] |= v << (64 - spill);
    }
    bitIndex += bitsToWrite;
  }

  public void writeBit(final boolean bit) {
    write(bit ? 1 : 0, 1);
  }

  public int bitLength() {
    return bitIndex;
  }

  public byte[] toByteArray() {
    final int numBytes = (bitIndex + 7) >>> 3;
    final byte[] out = new byte[numBytes];
    for (int i = 0; i < numBytes; i++) {
      final long word = words[i >>> 3];
      out[i] = (byte) (word >>> (56 - ((i & 7) << 3)));
    }
    return out;
  }

  private void ensureCapacity(final int required) {
    if (required > words.length) {
      words = Arrays.copyOf(words, Math.max(required, words.length * 2));
    }
  }
}
