/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.util;

import org.sectorgrid.renter.entities.FileContractId;
import org.sectorgrid.renter.entities.HostAddress;
import org.sectorgrid.renter.entities.HostKey;
import org.sectorgrid.renter.entities.SectorRoot;

/**
 * Builds identifiers whose first byte is the given value and whose remaining bytes are zero.
 */
public class IdentifierHelper {

  public static FileContractId contractId(final int value) {
    return new FileContractId(leadingByte(value));
  }

  public static SectorRoot sectorRoot(final int value) {
    return new SectorRoot(leadingByte(value));
  }

  public static HostKey hostKey(final int value) {
    return new HostKey(leadingByte(value));
  }

  public static HostAddress hostAddress(final int value) {
    return new HostAddress("host" + value + ".example:9982", hostKey(value));
  }

  private static byte[] leadingByte(final int value) {
    final byte[] bytes = new byte[Constants.IDENTIFIER_LENGTH];
    bytes[0] = (byte) value;
    return bytes;
  }
}
