/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

import java.util.Arrays;
import java.util.HexFormat;
import org.sectorgrid.renter.util.Constants;

/**
 * Base class for the opaque 32-byte identifiers exchanged with the rest of the renter. Identifiers are immutable,
 * compare by content and render as lowercase hex.
 */
public abstract class FixedSizeIdentifier {

  private final byte[] bytes;

  protected FixedSizeIdentifier(final byte[] bytes) {
    if (bytes == null || bytes.length != Constants.IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException(
          "Identifier must be exactly " + Constants.IDENTIFIER_LENGTH + " bytes, got "
              + (bytes == null ? "null" : bytes.length));
    }

    this.bytes = bytes.clone();
  }

  public byte[] toByteArray() {
    return bytes.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(bytes, ((FixedSizeIdentifier) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return HexFormat.of().formatHex(bytes);
  }
}
