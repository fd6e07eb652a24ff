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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StoreFilesTest {

  @TempDir
  Path dir;

  @Test
  void atomicWriteReplacesTheFileWithoutLeavingTempFiles() throws IOException {
    final Path file = dir.resolve("index.json");
    StoreFiles.writeAtomically(file, "a much longer first version".getBytes(StandardCharsets.UTF_8));
    StoreFiles.writeAtomically(file, "second".getBytes(StandardCharsets.UTF_8));

    assertEquals("second", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    assertEquals(Collections.singletonList(file), StoreFiles.list(dir));
  }

  @Test
  void jsonRoundTripsThroughTheAtomicWrite() throws IOException {
    final Path file = dir.resolve("commit-7.json");
    final List<String> ids = Arrays.asList("p-7", "p-8");
    StoreFiles.writeJson(file, ids);
    assertEquals(ids, StoreFiles.readJson(file, List.class));
    StoreFiles.writeJson(file, Collections.singletonMap("id", "p-9"));
    assertEquals("p-9", StoreFiles.readJson(file, Map.class).get("id"));
  }

  @Test
  void syncDirectory() throws IOException {
    StoreFiles.syncDirectory(dir);
    assertThrows(NoSuchFileException.class, () -> StoreFiles.syncDirectory(dir.resolve("missing")));
  }
}
