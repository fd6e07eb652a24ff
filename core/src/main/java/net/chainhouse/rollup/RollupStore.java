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

package net.chainhouse.rollup;

import net.chainhouse.core.CorruptionException;
import net.chainhouse.core.StorageIOException;
import net.chainhouse.core.StoreFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists rollups under {@code <dataDir>/_rollups/<name>/}: the definition,
 * one partial per folded partition and the checkpoint. Every file is written
 * to a temp file and moved into place.
 */
public class RollupStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RollupStore.class);

  static final String DEFINITION_FILE = "definition.json";
  static final String CHECKPOINT_FILE = "checkpoint.json";
  static final String PARTIALS_DIR = "partials";
  private static final String JSON_SUFFIX = ".json";

  private final Path root;

  public RollupStore(final Path root) {
    this.root = root;
  }

  public Path root() {
    return root;
  }

  Path dir(final String rollup) {
    return root.resolve(rollup);
  }

  public void writeDefinition(final RollupDefinition definition) throws StorageIOException {
    try {
      Files.createDirectories(dir(definition.name()).resolve(PARTIALS_DIR));
      StoreFiles.writeJson(dir(definition.name()).resolve(DEFINITION_FILE), definition);
    } catch (IOException e) {
      throw new StorageIOException("Failed to write definition of " + definition.name(), e);
    }
  }

  /** @return every persisted definition, in name order. */
  public List<RollupDefinition> loadDefinitions() throws IOException {
    final List<RollupDefinition> definitions = new ArrayList<>();
    for (Path dir : StoreFiles.list(root)) {
      final Path file = dir.resolve(DEFINITION_FILE);
      if (Files.isRegularFile(file)) {
        definitions.add(StoreFiles.readJson(file, RollupDefinition.class));
      } else if (Files.isDirectory(dir)) {
        LOGGER.warn("Ignoring rollup directory without definition: {}", dir);
      }
    }
    return definitions;
  }

  public void writePartial(final PartitionPartial partial) throws StorageIOException {
    final Path file = dir(partial.rollup()).resolve(PARTIALS_DIR)
        .resolve(partial.partition().id() + JSON_SUFFIX);
    try {
      StoreFiles.writeJson(file, partial);
    } catch (IOException e) {
      throw new StorageIOException("Failed to write partial " + file, e);
    }
  }

  public List<PartitionPartial> loadPartials(final String rollup) throws IOException {
    final List<PartitionPartial> partials = new ArrayList<>();
    for (Path file : StoreFiles.list(dir(rollup).resolve(PARTIALS_DIR))) {
      final String name = file.getFileName().toString();
      if (!name.endsWith(JSON_SUFFIX)) {
        Files.deleteIfExists(file);
        continue;
      }
      try {
        partials.add(StoreFiles.readJson(file, PartitionPartial.class));
      } catch (IOException e) {
        throw new CorruptionException("Unreadable rollup partial " + file, e);
      }
    }
    return partials;
  }

  public void writeCheckpoint(final RollupCheckpoint checkpoint) throws StorageIOException {
    try {
      StoreFiles.writeJson(dir(checkpoint.rollup()).resolve(CHECKPOINT_FILE), checkpoint);
    } catch (IOException e) {
      throw new StorageIOException("Failed to write checkpoint of " + checkpoint.rollup(), e);
    }
  }

  /** @return the persisted checkpoint or null if the rollup never folded. */
  public RollupCheckpoint readCheckpoint(final String rollup) throws IOException {
    final Path file = dir(rollup).resolve(CHECKPOINT_FILE);
    if (!Files.isRegularFile(file)) {
      return null;
    }
    return StoreFiles.readJson(file, RollupCheckpoint.class);
  }

  public void drop(final String rollup) throws IOException {
    StoreFiles.deleteDirectory(dir(rollup));
  }
}
