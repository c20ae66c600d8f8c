/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

import java.util.Objects;

/**
 * A host eligible for scanning.
 *
 * @param netAddress the host's announced network address, e.g. {@code host.example:9982}
 * @param publicKey the host's public key
 */
public record HostAddress(String netAddress, HostKey publicKey) {

  public HostAddress {
    Objects.requireNonNull(netAddress, "netAddress");
    Objects.requireNonNull(publicKey, "publicKey");
  }
}
