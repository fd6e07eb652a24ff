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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Store settings. Defaults ship in {@code chainhouse-defaults.json} and a user
 * file may override any subset of the keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

  public static final String DEFAULTS_RESOURCE = "/chainhouse-defaults.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public String dataDir;

  public int partitionWidthHours = 1;
  public int granuleRows = 8192;
  public int scanThreads = 4;

  public int retentionHours;
  public int retentionCheckSeconds = 300;
  public int collectionDelaySeconds = 60;

  public int rollupFrequencySeconds = 60;
  public int rollupLagAlarmSeconds = 900;
  public int rollupMergeRetries = 3;

  public int ingestRetryAttempts = 3;
  public long ingestRetryBackoffMillis = 100;

  public int stringDictionaryLimit = 4096;
  public int setIndexCardinality = 64;

  public PartitionWidth getPartitionWidth() {
    return PartitionWidth.getByHours(partitionWidthHours);
  }

  /** @return the scan pool size, the number of processors when set to 0. */
  public int getScanThreads() {
    return scanThreads == 0 ? Runtime.getRuntime().availableProcessors() : scanThreads;
  }

  public Path getDataPath() {
    if (dataDir == null || dataDir.isEmpty()) {
      throw new IllegalStateException("dataDir is not configured");
    }
    return Path.of(dataDir);
  }

  /**
   * @throws IllegalArgumentException if a setting is out of range.
   */
  public void validate() {
    getPartitionWidth();
    if (granuleRows < 1) {
      throw new IllegalArgumentException("granuleRows must be positive: " + granuleRows);
    }
    if (scanThreads < 0) {
      throw new IllegalArgumentException("scanThreads must not be negative: " + scanThreads);
    }
    if (retentionHours < 0) {
      throw new IllegalArgumentException("retentionHours must not be negative: " + retentionHours);
    }
    if (rollupMergeRetries < 0 || ingestRetryAttempts < 0) {
      throw new IllegalArgumentException("Retry counts must not be negative");
    }
    if (stringDictionaryLimit < 1 || setIndexCardinality < 0) {
      throw new IllegalArgumentException("Invalid dictionary or set index limits");
    }
  }

  /** @return the packaged defaults. */
  public static StoreConfig defaults() {
    try (InputStream in = StoreConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        return new StoreConfig();
      }
      return MAPPER.readValue(in, StoreConfig.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
    }
  }

  /** @return the packaged defaults overlaid with the keys present in {@code file}. */
  public static StoreConfig load(final Path file) throws IOException {
    final StoreConfig config = defaults();
    try (InputStream in = Files.newInputStream(file)) {
      MAPPER.readerForUpdating(config).readValue(in);
    }
    config.validate();
    return config;
  }
}
