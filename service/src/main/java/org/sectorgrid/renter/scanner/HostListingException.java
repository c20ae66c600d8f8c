/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

/**
 * Indicates that a sweep was cut short because the host store could not list the next page of hosts.
 */
public class HostListingException extends Exception {

  private final int offset;

  public HostListingException(final int offset, final Throwable cause) {
    super("failed to list hosts for scanning at offset " + offset, cause);
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }
}
