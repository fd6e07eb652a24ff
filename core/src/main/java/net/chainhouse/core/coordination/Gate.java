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

import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets one kind of background work hold the store at a time, so rollup
 * folding and retention never overlap.
 */
public class Gate {

  /** The kinds of work that take turns on the gate. */
  public enum Owner {
    ROLLUP,
    RETENTION
  }

  private final AtomicReference<Owner> holder = new AtomicReference<>();

  /**
   * Takes the gate if it is free. Taking it again with the owner already
   * holding it succeeds.
   *
   * @return true if {@code owner} holds the gate.
   */
  public boolean tryAcquire(final Owner owner) {
    return holder.compareAndSet(null, owner) || holder.get() == owner;
  }

  /** @return true if {@code owner} held the gate and released it. */
  public boolean release(final Owner owner) {
    return holder.compareAndSet(owner, null);
  }

  /** @return the current holder, null when free. */
  public Owner holder() {
    return holder.get();
  }

  public boolean isFree() {
    return holder.get() == null;
  }

  @Override
  public String toString() {
    final Owner current = holder.get();
    return "Gate[" + (current == null ? "free" : current.name()) + "]";
  }
}
