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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link Job} while holding the {@link Gate} for its owner. A run is
 * submitted only when the previous run completed, the clock says it is due
 * and the gate is free. The gate is released when the run finishes or the
 * submission is rejected.
 */
public class GatedJobWrapper implements JobWrapper {

  private static final Logger LOGGER = LoggerFactory.getLogger(GatedJobWrapper.class);

  /** Hands a gated run to an executor. */
  @FunctionalInterface
  public interface Submitter {

    /** @return false if the run was rejected. */
    boolean submit(Runnable run);
  }

  private final Job previous;
  private final Job job;
  private final JobClock clock;
  private final Gate gate;
  private final Gate.Owner owner;
  private final Submitter submitter;
  private volatile boolean submitted;

  public GatedJobWrapper(final Job job,
                         final JobClock clock,
                         final Gate gate,
                         final Gate.Owner owner,
                         final Submitter submitter) {
    this(null, job, clock, gate, owner, submitter);
  }

  private GatedJobWrapper(final Job previous,
                          final Job job,
                          final JobClock clock,
                          final Gate gate,
                          final Gate.Owner owner,
                          final Submitter submitter) {
    this.previous = previous;
    this.job = job;
    this.clock = clock;
    this.gate = gate;
    this.owner = owner;
    this.submitter = submitter;
  }

  @Override
  public boolean tryToRun() {
    if (submitted || !previousFinished() || !clock.isDue()) {
      return false;
    }
    if (!gate.tryAcquire(owner)) {
      LOGGER.debug("{} job waits, {}", owner, gate);
      return false;
    }
    if (!submitter.submit(this::runAndRelease)) {
      gate.release(owner);
      LOGGER.warn("{} job was rejected, released {}", owner, gate);
      return false;
    }
    clock.advance();
    submitted = true;
    return true;
  }

  private boolean previousFinished() {
    if (previous == null) {
      return true;
    }
    if (!previous.isComplete()) {
      LOGGER.debug("Previous {} job {} is still running", owner, previous);
      return false;
    }
    previous.close();
    return true;
  }

  private void runAndRelease() {
    try {
      job.run();
    } finally {
      gate.release(owner);
    }
  }

  @Override
  public JobWrapper createNext() {
    return new GatedJobWrapper(job, job.createNext(), clock, gate, owner, submitter);
  }

  public boolean isSubmitted() {
    return submitted;
  }

  @Override
  public String toString() {
    return owner + " job " + job + ", " + clock + ", " + gate;
  }
}
