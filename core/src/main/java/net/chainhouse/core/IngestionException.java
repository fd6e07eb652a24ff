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
 * A batch was rejected during validation. Nothing from the batch is visible.
 */
public class IngestionException extends StoreException {

  private final int rowIndex;

  public IngestionException(final String message) {
    this(message, -1);
  }

  public IngestionException(final String message, final int rowIndex) {
    super(rowIndex < 0 ? message : "Row " + rowIndex + ": " + message);
    this.rowIndex = rowIndex;
  }

  /** @return the offending row within the batch or -1 if not row specific. */
  public int getRowIndex() {
    return rowIndex;
  }
}
