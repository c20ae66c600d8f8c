/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Arrays;
import org.sectorgrid.renter.configuration.TimeoutTrackerConfiguration;

/**
 * Estimates a scan timeout from the latencies of recent successful scans. The most recent {@code numDataPoints}
 * latencies are kept in a ring buffer; once at least {@code minDataPoints} have been observed, the timeout is the
 * configured percentile of the buffered latencies.
 */
public class TimeoutTracker {

  private final int minDataPoints;
  private final double percentile;
  private final Duration defaultTimeout;

  // latencies in nanoseconds; guarded by this
  private final long[] dataPoints;
  private int next;
  private int count;

  public TimeoutTracker(final int minDataPoints, final int numDataPoints, final double percentile,
      final Duration defaultTimeout) {

    Preconditions.checkArgument(numDataPoints > 0, "numDataPoints must be positive");
    Preconditions.checkArgument(minDataPoints > 0 && minDataPoints <= numDataPoints,
        "minDataPoints must be between 1 and numDataPoints");
    Preconditions.checkArgument(percentile > 0 && percentile <= 100, "percentile must be in (0, 100]");

    this.minDataPoints = minDataPoints;
    this.percentile = percentile;
    this.defaultTimeout = defaultTimeout;
    this.dataPoints = new long[numDataPoints];
  }

  public static TimeoutTracker fromConfiguration(final TimeoutTrackerConfiguration configuration) {
    return new TimeoutTracker(configuration.getMinDataPoints(),
        configuration.getNumDataPoints(),
        configuration.getPercentile(),
        configuration.getDefaultTimeout());
  }

  public synchronized void addDataPoint(final Duration latency) {
    if (latency.isZero() || latency.isNegative()) {
      return;
    }

    dataPoints[next] = latency.toNanos();
    next = (next + 1) % dataPoints.length;

    if (count < dataPoints.length) {
      count++;
    }
  }

  public Duration timeout() {
    final long[] sorted;

    synchronized (this) {
      if (count < minDataPoints) {
        return defaultTimeout;
      }

      sorted = Arrays.copyOf(dataPoints, count);
    }

    Arrays.sort(sorted);

    // nearest rank
    final int rank = (int) Math.ceil(percentile * sorted.length / 100);
    return Duration.ofNanos(sorted[Math.max(rank, 1) - 1]);
  }
}
