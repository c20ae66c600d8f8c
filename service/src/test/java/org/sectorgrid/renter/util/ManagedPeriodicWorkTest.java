/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ManagedPeriodicWorkTest {

  private ScheduledExecutorService scheduledExecutorService;
  private TestWork testWork;

  @BeforeEach
  void setup() {
    scheduledExecutorService = Executors.newSingleThreadScheduledExecutor();
    testWork = new TestWork(Duration.ofMinutes(5), scheduledExecutorService);
  }

  @AfterEach
  void teardown() throws Exception {
    scheduledExecutorService.shutdown();

    assertTrue(scheduledExecutorService.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void test() throws Exception {
    testWork.start();
    testWork.awaitStarted();

    testWork.stop();

    assertEquals(1, testWork.getCount());
  }

  @Test
  void testStartTwice() throws Exception {
    testWork.start();
    testWork.start();
    testWork.awaitStarted();

    testWork.stop();

    assertEquals(1, testWork.getCount());
  }

  @Test
  void testSlowWorkShutdown() throws Exception {
    testWork.setWorkSleepDuration(Duration.ofSeconds(1));

    testWork.start();
    testWork.awaitStarted();

    final long startMillis = System.currentTimeMillis();

    testWork.stop();

    final long runMillis = System.currentTimeMillis() - startMillis;

    assertTrue(runMillis > 500);
    assertEquals(1, testWork.getCount());
  }

  @Test
  void testWorkException() throws Exception {
    testWork = new ExceptionalTestWork(Duration.ofMinutes(5), scheduledExecutorService);
    testWork.setSleepDurationAfterUnexpectedException(Duration.ZERO);

    testWork.start();
    testWork.awaitStarted();

    testWork.stop();

    assertEquals(0, testWork.getCount());
  }

  @Test
  void testStopWithoutStart() throws Exception {
    testWork.stop();

    assertEquals(0, testWork.getCount());
  }

  private static class TestWork extends ManagedPeriodicWork {

    private final CountDownLatch started = new CountDownLatch(1);
    private final AtomicInteger workCounter = new AtomicInteger();
    private Duration workSleepDuration = Duration.ZERO;

    TestWork(final Duration runInterval, final ScheduledExecutorService scheduledExecutorService) {
      super(runInterval, scheduledExecutorService);
    }

    @Override
    protected void doPeriodicWork() throws Exception {
      notifyStarted();

      if (!workSleepDuration.isZero()) {
        Uninterruptibles.sleepUninterruptibly(workSleepDuration);
      }

      workCounter.incrementAndGet();
    }

    void notifyStarted() {
      started.countDown();
    }

    void awaitStarted() throws InterruptedException {
      assertTrue(started.await(5, TimeUnit.SECONDS));
    }

    int getCount() {
      return workCounter.get();
    }

    void setWorkSleepDuration(final Duration workSleepDuration) {
      this.workSleepDuration = workSleepDuration;
    }
  }

  private static class ExceptionalTestWork extends TestWork {

    ExceptionalTestWork(final Duration runInterval, final ScheduledExecutorService scheduledExecutorService) {
      super(runInterval, scheduledExecutorService);
    }

    @Override
    protected void doPeriodicWork() throws Exception {
      notifyStarted();

      throw new RuntimeException();
    }
  }
}
