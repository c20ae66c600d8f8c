/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.sectorgrid.renter.util.IdentifierHelper.contractId;
import static org.sectorgrid.renter.util.IdentifierHelper.hostAddress;
import static org.sectorgrid.renter.util.IdentifierHelper.sectorRoot;

import com.codahale.metrics.MetricRegistry;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.lifecycle.setup.LifecycleEnvironment;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.sectorgrid.renter.configuration.RenterCoordinationConfiguration;
import org.sectorgrid.renter.entities.HostScanResponse;
import org.sectorgrid.renter.entities.UploadId;
import org.sectorgrid.renter.scanner.HostProber;
import org.sectorgrid.renter.storage.HostStore;
import org.sectorgrid.renter.storage.UploadingSectorsCache;
import org.sectorgrid.renter.util.Constants;
import org.sectorgrid.renter.util.MutableClock;

class RenterCoordinationTest {

  private ScheduledExecutorService scheduledExecutorService;
  private HostStore hostStore;
  private HostProber hostProber;

  private RenterCoordination renterCoordination;

  @BeforeEach
  void setUp() {
    scheduledExecutorService = Executors.newSingleThreadScheduledExecutor();
    hostStore = mock(HostStore.class);
    hostProber = mock(HostProber.class);

    renterCoordination = new RenterCoordination(new RenterCoordinationConfiguration(), hostStore, hostProber,
        scheduledExecutorService, Executors.newSingleThreadExecutor(), Executors.newFixedThreadPool(4),
        new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
  }

  @AfterEach
  void tearDown() throws Exception {
    renterCoordination.getHostScanWork().stop();
    scheduledExecutorService.shutdown();

    assertTrue(scheduledExecutorService.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void testUploadingSectorsCache() throws Exception {
    final UploadingSectorsCache cache = renterCoordination.getUploadingSectorsCache();
    final UploadId uploadId = UploadId.random();

    cache.trackUpload(uploadId);
    cache.addUploadingSector(uploadId, contractId(1), sectorRoot(1));

    assertEquals(Constants.SECTOR_SIZE, cache.pending(contractId(1)));
  }

  @Test
  void testPeriodicHostScan() throws Exception {
    when(hostStore.listHostsForScanning(any(), anyInt(), anyInt())).thenReturn(List.of(hostAddress(1)));
    when(hostProber.probeHost(any(), any(), any())).thenReturn(new HostScanResponse(Duration.ofMillis(20)));

    renterCoordination.getHostScanWork().start();

    verify(hostStore, timeout(5_000)).recordScanOutcome(hostAddress(1).publicKey(), true);
    // too few latencies observed yet, so the default timeout applies
    verify(hostProber).probeHost(hostAddress(1).publicKey(), hostAddress(1).netAddress(), Duration.ofSeconds(10));
  }

  @Test
  void testRegister() throws Exception {
    final Environment environment = mock(Environment.class);
    final LifecycleEnvironment lifecycleEnvironment = new LifecycleEnvironment(new MetricRegistry());
    when(environment.lifecycle()).thenReturn(lifecycleEnvironment);

    final RenterCoordination registered =
        RenterCoordination.register(new RenterCoordinationConfiguration(), environment, hostStore, hostProber);

    // the trigger, sweep and worker executors, plus the periodic scan itself
    assertEquals(4, lifecycleEnvironment.getManagedObjects().size());

    registered.getHostScanWork().stop();
  }
}
