/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class UploadingSectorsConfiguration {

  /**
   * Uploads are expected to finish well within this window; the expiry only exists to reclaim memory held by uploads
   * whose worker never called finish.
   */
  @JsonProperty
  @NotNull
  private Duration cacheExpiry = Duration.ofHours(24);

  public Duration getCacheExpiry() {
    return cacheExpiry;
  }
}
