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

import java.io.IOException;

/**
 * Encodes the values of one granule of a column. Null tracking is handled by
 * the segment layer so codecs see placeholders for null rows.
 */
public interface ColumnCodec {

  byte[] encode(ColumnVector vector) throws IOException;

  /**
   * @param column the column name given to the decoded vector.
   * @param block the buffer holding the encoded values.
   * @param offset start of the encoded values.
   * @param length byte length of the encoded values.
   * @param rows the number of rows encoded.
   * @param nulls the null rows of the granule.
   * @throws IOException or {@link IndexOutOfBoundsException} on malformed input.
   */
  ColumnVector decode(String column,
                      byte[] block,
                      int offset,
                      int length,
                      int rows,
                      RoaringBitmap nulls) throws IOException;
}
