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
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class StoreConfigTest {

  @TempDir
  Path dir;

  @Test
  void packagedDefaults() {
    final StoreConfig config = StoreConfig.defaults();
    assertEquals(8192, config.granuleRows);
    assertEquals(PartitionWidth._1_HR, config.getPartitionWidth());
    assertEquals(900, config.rollupLagAlarmSeconds);
    assertEquals(0, config.retentionHours);
  }

  @Test
  void fileOverridesOnlyTheKeysItSets() throws IOException {
    final Path file = dir.resolve("store.json");
    Files.write(file, ("{\"dataDir\": \"" + dir.toString().replace("\\", "\\\\")
        + "\", \"partitionWidthHours\": 6, \"retentionHours\": 48, \"scanThreads\": 0}")
        .getBytes(StandardCharsets.UTF_8));

    final StoreConfig config = StoreConfig.load(file);
    assertEquals(dir, config.getDataPath());
    assertEquals(PartitionWidth._6_HR, config.getPartitionWidth());
    assertEquals(48, config.retentionHours);
    assertEquals(Runtime.getRuntime().availableProcessors(), config.getScanThreads());
    assertEquals(8192, config.granuleRows);
  }

  @Test
  void invalidSettings() throws IOException {
    final Path file = dir.resolve("store.json");
    Files.write(file, "{\"partitionWidthHours\": 5}".getBytes(StandardCharsets.UTF_8));
    assertThrows(IllegalArgumentException.class, () -> StoreConfig.load(file));

    final StoreConfig config = new StoreConfig();
    config.granuleRows = 0;
    assertThrows(IllegalArgumentException.class, config::validate);
    assertThrows(IllegalStateException.class, new StoreConfig()::getDataPath);
  }
}
