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
package net.chainhouse.core.coordination;

/** A scheduled run of a {@link Job}, polled until it gets submitted. */
public interface JobWrapper {

  /** @return true if the job was submitted. */
  boolean tryToRun();

  /** @return the wrapper of the next run. */
  JobWrapper createNext();
}
