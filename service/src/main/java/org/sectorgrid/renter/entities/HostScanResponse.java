/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

import java.time.Duration;

/**
 * The outcome of a successful probe.
 *
 * @param ping the observed round-trip time
 */
public record HostScanResponse(Duration ping) {
}
