/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class HostScannerConfiguration {

  @JsonProperty
  @Min(1)
  private int scanBatchSize = 100;

  @JsonProperty
  @Min(1)
  private int scanThreads = 100;

  /**
   * The minimum time between the start of two consecutive sweeps.
   */
  @JsonProperty
  @NotNull
  private Duration scanMinInterval = Duration.ofMinutes(1);

  /**
   * How often the host population is expected to be swept; also the unit used to turn a tolerated downtime into a
   * number of failed scans.
   */
  @JsonProperty
  @NotNull
  private Duration scanInterval = Duration.ofHours(24);

  /**
   * How often the periodic trigger checks whether a sweep is due.
   */
  @JsonProperty
  @NotNull
  private Duration triggerInterval = Duration.ofMinutes(1);

  @JsonProperty
  @NotNull
  private Duration minTimeout = Duration.ofSeconds(10);

  @JsonProperty
  @NotNull
  @Valid
  private TimeoutTrackerConfiguration timeoutTracker = new TimeoutTrackerConfiguration();

  public HostScannerConfiguration() {
  }

  @VisibleForTesting
  public HostScannerConfiguration(final int scanBatchSize, final int scanThreads, final Duration scanMinInterval,
      final Duration minTimeout) {
    this.scanBatchSize = scanBatchSize;
    this.scanThreads = scanThreads;
    this.scanMinInterval = scanMinInterval;
    this.minTimeout = minTimeout;
  }

  public int getScanBatchSize() {
    return scanBatchSize;
  }

  public int getScanThreads() {
    return scanThreads;
  }

  public Duration getScanMinInterval() {
    return scanMinInterval;
  }

  public Duration getScanInterval() {
    return scanInterval;
  }

  public Duration getTriggerInterval() {
    return triggerInterval;
  }

  public Duration getMinTimeout() {
    return minTimeout;
  }

  public TimeoutTrackerConfiguration getTimeoutTracker() {
    return timeoutTracker;
  }

  @AssertTrue
  public boolean isTriggerIntervalPositive() {
    return triggerInterval == null || (!triggerInterval.isZero() && !triggerInterval.isNegative());
  }
}
