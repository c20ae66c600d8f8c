/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

/**
 * The Merkle root of a sector's content.
 */
public final class SectorRoot extends FixedSizeIdentifier {

  public SectorRoot(final byte[] bytes) {
    super(bytes);
  }
}
