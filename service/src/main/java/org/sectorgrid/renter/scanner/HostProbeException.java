/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import org.sectorgrid.renter.util.NoStackTraceException;

public class HostProbeException extends NoStackTraceException {

  public HostProbeException(final String message) {
    super(message);
  }

  public HostProbeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
