/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import org.sectorgrid.renter.configuration.HostsConfiguration;
import org.sectorgrid.renter.util.ManagedPeriodicWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically asks the {@link HostScanner} to sweep the host population. Host settings are read anew for every
 * attempt so changes take effect with the next sweep.
 */
public class HostScanWork extends ManagedPeriodicWork {

  private static final Logger logger = LoggerFactory.getLogger(HostScanWork.class);

  private final HostScanner hostScanner;
  private final Supplier<HostsConfiguration> hostsConfigurationSupplier;

  public HostScanWork(final HostScanner hostScanner,
      final Supplier<HostsConfiguration> hostsConfigurationSupplier,
      final Duration triggerInterval,
      final ScheduledExecutorService scheduledExecutorService) {

    super(triggerInterval, scheduledExecutorService);

    this.hostScanner = hostScanner;
    this.hostsConfigurationSupplier = hostsConfigurationSupplier;
  }

  @Override
  protected void doPeriodicWork() {
    hostScanner.tryPerformHostScan(hostsConfigurationSupplier.get())
        .ifPresent(sweep -> sweep.whenComplete((summary, throwable) -> {
          if (throwable != null) {
            logger.warn("Host scan failed", throwable);
          }
        }));
  }

  @Override
  public synchronized void stop() throws Exception {
    super.stop();
    hostScanner.stop();
  }
}
