/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter;

import static org.sectorgrid.renter.metrics.MetricsUtil.name;

import io.dropwizard.core.setup.Environment;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.sectorgrid.renter.configuration.HostScannerConfiguration;
import org.sectorgrid.renter.configuration.RenterCoordinationConfiguration;
import org.sectorgrid.renter.scanner.HostProber;
import org.sectorgrid.renter.scanner.HostScanWork;
import org.sectorgrid.renter.scanner.HostScanner;
import org.sectorgrid.renter.scanner.TimeoutTracker;
import org.sectorgrid.renter.storage.HostStore;
import org.sectorgrid.renter.storage.UploadingSectorsCache;

/**
 * Builds the in-memory coordination components from configuration and the host store and prober supplied by the
 * surrounding application.
 */
public class RenterCoordination {

  private final UploadingSectorsCache uploadingSectorsCache;
  private final TimeoutTracker timeoutTracker;
  private final HostScanner hostScanner;
  private final HostScanWork hostScanWork;

  public RenterCoordination(final RenterCoordinationConfiguration configuration,
      final HostStore hostStore,
      final HostProber hostProber,
      final ScheduledExecutorService scanTriggerExecutor,
      final ExecutorService scanSweepExecutor,
      final ExecutorService scanWorkerExecutor,
      final Clock clock) {

    final HostScannerConfiguration hostScannerConfiguration = configuration.getHostScannerConfiguration();

    this.uploadingSectorsCache = new UploadingSectorsCache(configuration.getUploadingSectorsConfiguration(), clock);
    this.timeoutTracker = TimeoutTracker.fromConfiguration(hostScannerConfiguration.getTimeoutTracker());
    this.hostScanner = new HostScanner(hostStore, hostProber, timeoutTracker, hostScannerConfiguration,
        scanSweepExecutor, scanWorkerExecutor, clock);
    this.hostScanWork = new HostScanWork(hostScanner,
        configuration::getHostsConfiguration,
        hostScannerConfiguration.getTriggerInterval(),
        scanTriggerExecutor);
  }

  /**
   * Creates the coordination components and registers the periodic host scan with the environment's lifecycle.
   */
  public static RenterCoordination register(final RenterCoordinationConfiguration configuration,
      final Environment environment,
      final HostStore hostStore,
      final HostProber hostProber) {

    final ScheduledExecutorService scanTriggerExecutor = environment.lifecycle()
        .scheduledExecutorService(name(RenterCoordination.class, "hostScanTrigger-%d"))
        .threads(1)
        .build();

    final int scanThreads = configuration.getHostScannerConfiguration().getScanThreads();

    final ExecutorService scanSweepExecutor = environment.lifecycle()
        .executorService(name(RenterCoordination.class, "hostScanSweep-%d"))
        .minThreads(1)
        .maxThreads(1)
        .build();

    final ExecutorService scanWorkerExecutor = environment.lifecycle()
        .executorService(name(RenterCoordination.class, "hostScanWorker-%d"))
        .minThreads(scanThreads)
        .maxThreads(scanThreads)
        .build();

    final RenterCoordination renterCoordination = new RenterCoordination(configuration, hostStore, hostProber,
        scanTriggerExecutor, scanSweepExecutor, scanWorkerExecutor, Clock.systemUTC());

    environment.lifecycle().manage(renterCoordination.getHostScanWork());

    return renterCoordination;
  }

  public UploadingSectorsCache getUploadingSectorsCache() {
    return uploadingSectorsCache;
  }

  public TimeoutTracker getTimeoutTracker() {
    return timeoutTracker;
  }

  public HostScanner getHostScanner() {
    return hostScanner;
  }

  public HostScanWork getHostScanWork() {
    return hostScanWork;
  }
}
