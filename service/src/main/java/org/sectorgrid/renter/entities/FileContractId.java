/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

public final class FileContractId extends FixedSizeIdentifier {

  public FileContractId(final byte[] bytes) {
    super(bytes);
  }
}
