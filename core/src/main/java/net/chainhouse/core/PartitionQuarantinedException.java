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

/**
 * A scan needed a partition that an earlier read quarantined.
 */
public class PartitionQuarantinedException extends CorruptionException {

  private final PartitionHandle handle;

  public PartitionQuarantinedException(final PartitionHandle handle) {
    super("Partition " + handle + " is quarantined");
    this.handle = handle;
  }

  public PartitionHandle getHandle() {
    return handle;
  }
}
