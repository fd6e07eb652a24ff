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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GatedJobWrapperTest {

  private static final Duration MINUTE = Duration.ofMinutes(1);

  private final AtomicLong now = new AtomicLong(TimeUnit.HOURS.toMillis(500_000));
  private final List<Runnable> submitted = new ArrayList<>();
  private final Gate gate = new Gate();

  @Test
  void gateIsHeldByOneOwnerAtATime() {
    assertTrue(gate.isFree());
    assertTrue(gate.tryAcquire(Gate.Owner.ROLLUP));
    assertTrue(gate.tryAcquire(Gate.Owner.ROLLUP));
    assertFalse(gate.tryAcquire(Gate.Owner.RETENTION));
    assertFalse(gate.release(Gate.Owner.RETENTION));
    assertEquals(Gate.Owner.ROLLUP, gate.holder());
    assertTrue(gate.release(Gate.Owner.ROLLUP));
    assertNull(gate.holder());
    assertFalse(gate.release(Gate.Owner.ROLLUP));
  }

  @Test
  void rollupAndRetentionExcludeEachOther() {
    final CountingJob rollup = new CountingJob();
    final CountingJob retention = new CountingJob();
    final GatedJobWrapper rollupWrapper = wrapper(rollup, Gate.Owner.ROLLUP);
    final GatedJobWrapper retentionWrapper = wrapper(retention, Gate.Owner.RETENTION);

    assertTrue(rollupWrapper.tryToRun());
    assertTrue(rollupWrapper.isSubmitted());
    assertFalse(rollupWrapper.tryToRun());
    assertEquals(Gate.Owner.ROLLUP, gate.holder());

    assertFalse(retentionWrapper.tryToRun());
    assertEquals(1, submitted.size());

    submitted.get(0).run();
    assertEquals(1, rollup.runs);
    assertTrue(gate.isFree());

    assertTrue(retentionWrapper.tryToRun());
    assertEquals(Gate.Owner.RETENTION, gate.holder());
    submitted.get(1).run();
    assertEquals(1, retention.runs);
    assertTrue(gate.isFree());
  }

  @Test
  void nextRunWaitsForPreviousJobAndClock() {
    final CountingJob job = new CountingJob();
    final GatedJobWrapper first = wrapper(job, Gate.Owner.ROLLUP);
    assertTrue(first.tryToRun());

    final JobWrapper next = first.createNext();
    assertFalse(next.tryToRun());

    submitted.get(0).run();
    assertFalse(next.tryToRun());
    assertTrue(job.closed);

    now.addAndGet(MINUTE.toMillis());
    assertTrue(next.tryToRun());
    assertEquals(2, submitted.size());
  }

  @Test
  void failingJobStillReleasesTheGate() {
    final GatedJobWrapper failing = wrapper(new CountingJob() {
      @Override
      public void run() {
        throw new IllegalStateException("fold failed");
      }
    }, Gate.Owner.ROLLUP);
    assertTrue(failing.tryToRun());
    assertThrows(IllegalStateException.class, () -> submitted.get(0).run());
    assertTrue(gate.isFree());
  }

  @Test
  void rejectedSubmissionReleasesGate() {
    final GatedJobWrapper rejecting = new GatedJobWrapper(new CountingJob(),
        new JobClock(now::get, Duration.ZERO, MINUTE), gate, Gate.Owner.ROLLUP, r -> false);
    assertFalse(rejecting.tryToRun());
    assertFalse(rejecting.isSubmitted());
    assertTrue(gate.isFree());
  }

  @Test
  void clockHonoursTheInitialDelay() {
    final JobClock clock = new JobClock(now::get, Duration.ofSeconds(30), MINUTE);
    assertFalse(clock.isDue());
    now.addAndGet(30_000);
    assertTrue(clock.isDue());
    clock.advance();
    assertFalse(clock.isDue());
    assertEquals(now.get() + MINUTE.toMillis(), clock.nextRunMillis());
    assertThrows(IllegalArgumentException.class,
        () -> new JobClock(now::get, Duration.ZERO, Duration.ZERO));
  }

  private GatedJobWrapper wrapper(final Job job, final Gate.Owner owner) {
    return new GatedJobWrapper(job, new JobClock(now::get, Duration.ZERO, MINUTE), gate, owner,
        submitted::add);
  }

  private static class CountingJob implements Job {

    private int runs;
    private boolean closed;

    @Override
    public void run() {
      runs++;
    }

    @Override
    public boolean isComplete() {
      return runs > 0;
    }

    @Override
    public void close() {
      closed = true;
    }

    @Override
    public Job createNext() {
      return this;
    }
  }
}
