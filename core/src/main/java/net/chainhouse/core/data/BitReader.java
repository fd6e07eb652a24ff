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

/**
 * Reads a bit stream written by {@link BitWriter}.
 */
public class BitReader {

  private final byte[] buffer;
  private final int offset;
  private final int end;
  private int bitIndex;

  public BitReader(final byte[] buffer) {
    this(buffer, 0, buffer.length);
  }

  public BitReader(final byte[] buffer, final int offset, final int length) {
    this.buffer = buffer;
    this.offset = offset;
    this.end = offset + length;
  }

  /**
   * Reads the next {@code bitsToRead} bits as an unsigned value.
   *
   * @throws IndexOutOfBoundsException if the stream is exhausted.
   */
  public long read(final int bitsToRead) {
    if (bitsToRead < 0 || bitsToRead > 64) {
      throw new IllegalArgumentException("Invalid bit count: " + bitsToRead);
    }
    long result = 0;
    int remaining = bitsToRead;
    while (remaining > 0) {
      final int byteIndex = offset + (bitIndex >>> 3);
      if (byteIndex >= end) {
        throw new IndexOutOfBoundsException("Bit stream exhausted at bit " + bitIndex);
      }
      final int available = 8 - (bitIndex & 7);
      final int take = Math.min(available, remaining);
      final int chunk = ((buffer[byteIndex] & 0xFF) >>> (available - take)) & ((1 << take) - 1);
      result = (result << take) | chunk;
      bitIndex += take;
      remaining -= take;
    }
    return result;
  }

  public boolean readBit() {
    return read(1) == 1;
  }
}
