/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

/**
 * A host's ed25519 public key.
 */
public final class HostKey extends FixedSizeIdentifier {

  public HostKey(final byte[] bytes) {
    super(bytes);
  }
}
