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
 * Big-endian helpers for packing primitives into byte arrays.
 */
public class ByteArrays {

  public static void putLong(final long n, final byte[] b, final int offset) {
    b[offset + 0] = (byte) (n >>> 56);
    b[offset + 1] = (byte) (n >>> 48);
    b[offset + 2] = (byte) (n >>> 40);
    b[offset + 3] = (byte) (n >>> 32);
    b[offset + 4] = (byte) (n >>> 24);
    b[offset + 5] = (byte) (n >>> 16);
    b[offset + 6] = (byte) (n >>> 8);
    b[offset + 7] = (byte) (n >>> 0);
  }

  public static long getLong(final byte[] b, final int offset) {
    return (b[offset + 0] & 0xFFL) << 56
        | (b[offset + 1] & 0xFFL) << 48
        | (b[offset + 2] & 0xFFL) << 40
        | (b[offset + 3] & 0xFFL) << 32
        | (b[offset + 4] & 0xFFL) << 24
        | (b[offset + 5] & 0xFFL) << 16
        | (b[offset + 6] & 0xFFL) << 8
        | (b[offset + 7] & 0xFFL) << 0;
  }

  public static void putInt(final int n, final byte[] b, final int offset) {
    b[offset + 0] = (byte) (n >>> 24);
    b[offset + 1] = (byte) (n >>> 16);
    b[offset + 2] = (byte) (n >>> 8);
    b[offset + 3] = (byte) (n >>> 0);
  }

  public static int getInt(final byte[] b, final int offset) {
    return (b[offset + 0] & 0xFF) << 24
        | (b[offset + 1] & 0xFF) << 16
        | (b[offset + 2] & 0xFF) << 8
        | (b[offset + 3] & 0xFF) << 0;
  }

  /** Zig-zag maps signed values onto unsigned so small magnitudes stay short. */
  public static long zigZag(final long n) {
    return (n << 1) ^ (n >> 63);
  }

  public static long unZigZag(final long n) {
    return (n >>> 1) ^ -(n & 1);
  }
}
