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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File helpers shared by the stores. Metadata files are written to a sibling
 * temp file, forced to disk and moved into place so readers never see a
 * partial file, even after a power loss.
 */
public final class StoreFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(StoreFiles.class);

  public static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private StoreFiles() {
  }

  public static void writeAtomically(final Path file, final byte[] content) throws IOException {
    final Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
      final ByteBuffer buffer = ByteBuffer.wrap(content);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
    move(tmp, file);
    syncDirectory(file.getParent());
  }

  /**
   * Forces a directory's entries to disk so a completed rename survives a
   * crash. File systems that cannot open a directory for reading are skipped.
   */
  public static void syncDirectory(final Path dir) throws IOException {
    try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
      channel.force(true);
    } catch (AccessDeniedException e) {
      LOGGER.debug("Directory sync is not supported for {}", dir, e);
    }
  }

  public static void writeJson(final Path file, final Object value) throws IOException {
    writeAtomically(file, MAPPER.writeValueAsBytes(value));
  }

  public static <T> T readJson(final Path file, final Class<T> type) throws IOException {
    return MAPPER.readValue(file.toFile(), type);
  }

  /** Renames {@code from} to {@code to}, atomically where the file system allows. */
  public static void move(final Path from, final Path to) throws IOException {
    try {
      Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Recursively deletes a directory and all its contents. Missing
   * directories are ignored.
   */
  public static void deleteDirectory(final Path dir) throws IOException {
    if (!Files.exists(dir)) {
      return;
    }
    final List<Path> paths;
    try (Stream<Path> walk = Files.walk(dir)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    }
    for (Path path : paths) {
      Files.delete(path);
    }
  }

  /** @return the immediate children of {@code dir}, sorted by name. */
  public static List<Path> list(final Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> children = Files.list(dir)) {
      return children.sorted().collect(Collectors.toList());
    }
  }
}
