/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.storage;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.sectorgrid.renter.entities.HostAddress;
import org.sectorgrid.renter.entities.HostKey;

/**
 * The persistent host database. Implementations must be safe for concurrent use.
 */
public interface HostStore {

  /**
   * Returns one page of hosts that have not been scanned since {@code maxLastScan}. Paging must be stable for the
   * duration of one sweep; mutations made while a sweep is in progress need not be reflected.
   *
   * @param maxLastScan only hosts last scanned before this instant are returned
   * @param offset the number of eligible hosts to skip
   * @param limit the maximum number of hosts to return
   */
  List<HostAddress> listHostsForScanning(Instant maxLastScan, int offset, int limit) throws IOException;

  void recordScanOutcome(HostKey publicKey, boolean success);

  /**
   * Removes hosts that have failed at least {@code minRecentScanFailures} recent scans and have been unreachable for
   * longer than {@code maxDowntime}.
   *
   * @return the number of hosts removed
   */
  long evictIfThresholdExceeded(long minRecentScanFailures, Duration maxDowntime) throws IOException;
}
