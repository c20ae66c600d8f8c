/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Host selection settings consulted at the start of every sweep.
 */
public class HostsConfiguration {

  /**
   * How long a host may be unreachable before it is removed from the host set. Zero disables removal.
   */
  @JsonProperty
  @NotNull
  private Duration maxDowntime = Duration.ZERO;

  public HostsConfiguration() {
  }

  public HostsConfiguration(final Duration maxDowntime) {
    this.maxDowntime = maxDowntime;
  }

  public Duration getMaxDowntime() {
    return maxDowntime;
  }
}
