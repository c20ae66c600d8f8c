/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import java.time.Duration;
import org.sectorgrid.renter.entities.HostKey;
import org.sectorgrid.renter.entities.HostScanResponse;

/**
 * Performs the network round-trip that establishes whether a host is reachable. Implementations must be safe for
 * concurrent use and must give up once {@code timeout} has elapsed.
 */
@FunctionalInterface
public interface HostProber {

  HostScanResponse probeHost(HostKey publicKey, String netAddress, Duration timeout) throws HostProbeException;
}
