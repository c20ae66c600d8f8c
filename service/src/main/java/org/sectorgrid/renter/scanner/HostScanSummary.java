/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import java.time.Duration;

/**
 * Describes a completed sweep.
 *
 * @param hostsScanned the number of hosts that were probed
 * @param hostsFailed how many of those probes failed
 * @param pagesRequested the number of pages requested from the host store
 * @param hostsRemoved the number of hosts removed for excessive downtime after the sweep
 * @param elapsed wall-clock duration of the sweep
 */
public record HostScanSummary(int hostsScanned, int hostsFailed, int pagesRequested, long hostsRemoved,
                              Duration elapsed) {
}
