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

package net.chainhouse.scan;

import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.StoreException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Some partitions of a scan failed and partial results were not allowed.
 */
public class PartialScanException extends StoreException {

  private final List<PartitionHandle> succeeded;
  private final Map<PartitionHandle, Throwable> failed;

  public PartialScanException(final List<PartitionHandle> succeeded,
                              final Map<PartitionHandle, Throwable> failed) {
    super(failed.size() + " partitions failed, " + succeeded.size() + " succeeded: "
        + failed.keySet(), failed.isEmpty() ? null : failed.values().iterator().next());
    this.succeeded = Collections.unmodifiableList(succeeded);
    this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
  }

  public List<PartitionHandle> getSucceeded() {
    return succeeded;
  }

  public Map<PartitionHandle, Throwable> getFailed() {
    return failed;
  }
}
