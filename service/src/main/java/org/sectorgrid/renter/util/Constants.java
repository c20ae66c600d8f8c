/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.util;

import io.dropwizard.util.DataSize;

public class Constants {

  /**
   * The size of a single sector stored on a host.
   */
  public static final long SECTOR_SIZE = DataSize.mebibytes(4).toBytes();

  public static final int IDENTIFIER_LENGTH = 32;
}
