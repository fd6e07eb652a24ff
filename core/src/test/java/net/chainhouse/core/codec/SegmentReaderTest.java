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
import net.chainhouse.core.CorruptionException;
import net.chainhouse.core.data.ColumnVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SegmentReaderTest {

  @TempDir
  Path dir;

  @Test
  void readsGranulesBack() throws IOException {
    final Path file = write();
    final SegmentReader reader = reader(file);
    assertEquals(2, reader.granuleCount());
    assertEquals(6, reader.rowCount());
    assertEquals(40L, reader.read(0).get(3));
    assertEquals(60L, reader.read(1).get(1));
  }

  @Test
  void flippedByteFailsTheChecksum() throws IOException {
    final Path file = write();
    final byte[] bytes = Files.readAllBytes(file);
    bytes[bytes.length - 1] ^= 0x5A;
    Files.write(file, bytes);

    final SegmentReader reader = reader(file);
    assertEquals(10L, reader.read(0).get(0));
    assertThrows(CorruptionException.class, () -> reader.read(1));
  }

  @Test
  void badMagic() throws IOException {
    final Path file = write();
    final byte[] bytes = Files.readAllBytes(file);
    bytes[0] = 0;
    Files.write(file, bytes);
    assertThrows(CorruptionException.class, () -> reader(file));
  }

  @Test
  void truncatedDirectory() throws IOException {
    final Path file = write();
    Files.write(file, Arrays.copyOf(Files.readAllBytes(file), SegmentWriter.HEADER_SIZE + 4));
    assertThrows(CorruptionException.class, () -> reader(file));
  }

  @Test
  void typeMismatch() throws IOException {
    final Path file = write();
    assertThrows(CorruptionException.class, () -> new SegmentReader(file, "fee", ColumnType.DOUBLE,
        ColumnCodecs.forType(ColumnType.DOUBLE, 16)));
  }

  @Test
  void missingFile() {
    assertThrows(CorruptionException.class, () -> reader(dir.resolve("nope.seg")));
  }

  private Path write() throws IOException {
    final Path file = dir.resolve("fee.seg");
    new SegmentWriter(ColumnCodecs.forType(ColumnType.LONG, 16)).write(file, ColumnType.LONG,
        Arrays.asList(
            ColumnVector.fromValues("fee", ColumnType.LONG, new Object[] {10L, 20L, null, 40L}),
            ColumnVector.fromValues("fee", ColumnType.LONG, new Object[] {50L, 60L})));
    return file;
  }

  private static SegmentReader reader(final Path file) {
    return new SegmentReader(file, "fee", ColumnType.LONG,
        ColumnCodecs.forType(ColumnType.LONG, 16));
  }
}
