/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.util;

/**
 * An abstract base class for exceptions that do not include a stack trace. Stackless exceptions are intended for
 * expected, recoverable conditions that are reported to the immediate caller rather than logged.
 */
public abstract class NoStackTraceException extends Exception {

  public NoStackTraceException() {
    super(null, null, true, false);
  }

  public NoStackTraceException(final String message) {
    super(message, null, true, false);
  }

  public NoStackTraceException(final String message, final Throwable cause) {
    super(message, cause, true, false);
  }
}
