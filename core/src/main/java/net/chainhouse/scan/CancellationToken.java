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

/**
 * Cooperative cancellation of a running scan. Workers check the token
 * between granules.
 */
public final class CancellationToken {

  public static final CancellationToken NONE = new CancellationToken();

  private volatile boolean cancelled;

  public void cancel() {
    if (this != NONE) {
      cancelled = true;
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * @throws QueryCancelledException if {@link #cancel()} was called.
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new QueryCancelledException("Scan cancelled");
    }
  }
}
