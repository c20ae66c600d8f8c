/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import java.time.Duration;

public class DowntimePolicy {

  private DowntimePolicy() {
  }

  /**
   * Converts a tolerated downtime into the number of consecutive recent scan failures a host must accumulate before it
   * may be removed from the host set. Hosts are not scanned exactly once per interval, so the threshold is scaled down
   * to roughly five failures per week of downtime at a daily scan interval.
   *
   * @param scanInterval how often hosts are scanned
   * @param maxDowntime how long a host may be unreachable
   *
   * @return the failure threshold; zero if the tolerated downtime is shorter than one scan interval
   */
  public static long minRecentScanFailures(final Duration scanInterval, final Duration maxDowntime) {
    if (scanInterval.isZero() || scanInterval.isNegative() || maxDowntime.compareTo(scanInterval) < 0) {
      return 0;
    }

    final double intervals = (double) maxDowntime.toMillis() / scanInterval.toMillis();
    return Math.max(1, Math.round(intervals * 5 / 7));
  }
}
