/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.util;

import static org.sectorgrid.renter.metrics.MetricsUtil.name;

import com.google.common.util.concurrent.Uninterruptibles;
import io.dropwizard.lifecycle.Managed;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link #doPeriodicWork()} at a fixed rate while managed. A failed execution is logged and does not cancel
 * future executions.
 */
public abstract class ManagedPeriodicWork implements Managed {

  private final Logger logger = LoggerFactory.getLogger(getClass());

  private static final String FUTURE_DONE_GAUGE_NAME = "futureDone";

  private final Duration runInterval;
  private final ScheduledExecutorService executorService;

  private Duration sleepDurationAfterUnexpectedException = Duration.ofSeconds(10);

  @Nullable
  private ScheduledFuture<?> scheduledFuture;
  private final AtomicReference<CompletableFuture<Void>> activeExecutionFuture =
      new AtomicReference<>(CompletableFuture.completedFuture(null));

  public ManagedPeriodicWork(final Duration runInterval, final ScheduledExecutorService scheduledExecutorService) {
    this.runInterval = runInterval;
    this.executorService = scheduledExecutorService;
  }

  protected abstract void doPeriodicWork() throws Exception;

  @Override
  public synchronized void start() throws Exception {

    if (scheduledFuture != null) {
      return;
    }

    scheduledFuture = executorService.scheduleAtFixedRate(this::execute, 0, runInterval.toMillis(),
        TimeUnit.MILLISECONDS);

    Metrics.gauge(name(getClass(), FUTURE_DONE_GAUGE_NAME), scheduledFuture, future -> future.isDone() ? 1 : 0);
  }

  @Override
  public synchronized void stop() throws Exception {

    if (scheduledFuture != null) {

      scheduledFuture.cancel(false);

      try {
        activeExecutionFuture.get().join();
      } catch (final Exception e) {
        logger.warn("error while awaiting final execution", e);
      }
    }
  }

  public void setSleepDurationAfterUnexpectedException(final Duration sleepDurationAfterUnexpectedException) {
    this.sleepDurationAfterUnexpectedException = sleepDurationAfterUnexpectedException;
  }

  private void execute() {
    activeExecutionFuture.set(new CompletableFuture<>());

    try {
      doPeriodicWork();
    } catch (final Exception e) {
      logger.warn("Periodic work failed", e);

      // wait a bit, in case the error is caused by external instability
      Uninterruptibles.sleepUninterruptibly(sleepDurationAfterUnexpectedException);
    } finally {
      activeExecutionFuture.get().complete(null);
    }
  }
}
