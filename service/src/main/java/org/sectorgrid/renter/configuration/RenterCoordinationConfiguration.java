/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public class RenterCoordinationConfiguration extends Configuration {

  @NotNull
  @Valid
  @JsonProperty
  private UploadingSectorsConfiguration uploadingSectors = new UploadingSectorsConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private HostScannerConfiguration hostScanner = new HostScannerConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private HostsConfiguration hosts = new HostsConfiguration();

  public UploadingSectorsConfiguration getUploadingSectorsConfiguration() {
    return uploadingSectors;
  }

  public HostScannerConfiguration getHostScannerConfiguration() {
    return hostScanner;
  }

  public HostsConfiguration getHostsConfiguration() {
    return hosts;
  }
}
