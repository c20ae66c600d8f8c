/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class TimeoutTrackerConfiguration {

  @JsonProperty
  @Min(1)
  private int minDataPoints = 25;

  @JsonProperty
  @Min(1)
  private int numDataPoints = 1000;

  @JsonProperty
  @DecimalMin(value = "0", inclusive = false)
  @DecimalMax("100")
  private double percentile = 99;

  @JsonProperty
  @NotNull
  private Duration defaultTimeout = Duration.ofSeconds(10);

  public int getMinDataPoints() {
    return minDataPoints;
  }

  public int getNumDataPoints() {
    return numDataPoints;
  }

  public double getPercentile() {
    return percentile;
  }

  public Duration getDefaultTimeout() {
    return defaultTimeout;
  }

  @AssertTrue
  public boolean isMinDataPointsWithinNumDataPoints() {
    return minDataPoints <= numDataPoints;
  }
}
