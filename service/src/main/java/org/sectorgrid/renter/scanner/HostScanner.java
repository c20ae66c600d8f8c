/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.scanner;

import static org.sectorgrid.renter.metrics.MetricsUtil.name;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Uninterruptibles;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.sectorgrid.renter.configuration.HostScannerConfiguration;
import org.sectorgrid.renter.configuration.HostsConfiguration;
import org.sectorgrid.renter.entities.HostAddress;
import org.sectorgrid.renter.entities.HostKey;
import org.sectorgrid.renter.entities.HostScanResponse;
import org.sectorgrid.renter.storage.HostStore;
import org.sectorgrid.renter.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps the host population, probing every host that is due for a scan with a fixed number of concurrent workers.
 * Probe timeouts follow the latencies observed in recent successful probes. After a complete sweep, hosts that have
 * been unreachable for longer than the configured downtime are removed from the host store.
 * <p>
 * At most one sweep runs at a time, and sweeps start at least {@code scanMinInterval} apart; requests that arrive
 * sooner are dropped.
 */
public class HostScanner {

  private static final Logger logger = LoggerFactory.getLogger(HostScanner.class);

  private static final Timer SWEEP_TIMER = Metrics.timer(name(HostScanner.class, "sweep"));
  private static final String PROBE_COUNTER_NAME = name(HostScanner.class, "probe");
  private static final String TIMEOUT_GAUGE_NAME = name(HostScanner.class, "timeout");
  private static final Counter HOSTS_REMOVED_COUNTER = Metrics.counter(name(HostScanner.class, "hostsRemoved"));

  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(1);

  // marks the end of a sweep for one worker; compared by identity
  private static final HostAddress END_OF_SWEEP =
      new HostAddress("", new HostKey(new byte[Constants.IDENTIFIER_LENGTH]));

  private final HostStore hostStore;
  private final HostProber hostProber;
  private final TimeoutTracker timeoutTracker;
  private final Clock clock;

  private final int scanBatchSize;
  private final int scanThreads;
  private final Duration scanMinInterval;
  private final Duration scanInterval;
  private final Duration minTimeout;

  private final ExecutorService sweepExecutor;
  private final ExecutorService workerExecutor;

  private final Object lock = new Object();
  private boolean scanning;
  private Instant lastScanStart = Instant.EPOCH;

  private volatile boolean stopped;

  /**
   * @param sweepExecutor runs sweeps; a single thread suffices since sweeps never overlap
   * @param workerExecutor runs probes; must be able to run {@code scanThreads} tasks concurrently
   */
  public HostScanner(final HostStore hostStore,
      final HostProber hostProber,
      final TimeoutTracker timeoutTracker,
      final HostScannerConfiguration configuration,
      final ExecutorService sweepExecutor,
      final ExecutorService workerExecutor,
      final Clock clock) {

    this.hostStore = hostStore;
    this.hostProber = hostProber;
    this.timeoutTracker = timeoutTracker;
    this.clock = clock;

    this.scanBatchSize = configuration.getScanBatchSize();
    this.scanThreads = configuration.getScanThreads();
    this.scanMinInterval = configuration.getScanMinInterval();
    this.scanInterval = configuration.getScanInterval();
    this.minTimeout = configuration.getMinTimeout();

    this.sweepExecutor = sweepExecutor;
    this.workerExecutor = workerExecutor;

    Metrics.gauge(TIMEOUT_GAUGE_NAME, this, scanner -> scanner.currentTimeout().toMillis());
  }

  /**
   * Starts a sweep unless one is already running, the previous one started less than {@code scanMinInterval} ago, or
   * the scanner has been stopped.
   *
   * @param hostsConfiguration the host settings to apply to this sweep
   *
   * @return a future that completes when the started sweep is done, or empty if no sweep was started; the future
   * completes exceptionally with a {@link HostListingException} if the host store could not be paged
   */
  public Optional<CompletableFuture<HostScanSummary>> tryPerformHostScan(final HostsConfiguration hostsConfiguration) {
    final Instant scanStart;

    synchronized (lock) {
      final Instant now = clock.instant();

      if (stopped || scanning || now.isBefore(lastScanStart.plus(scanMinInterval))) {
        return Optional.empty();
      }

      scanning = true;
      lastScanStart = now;
      scanStart = now;
    }

    final CompletableFuture<HostScanSummary> sweepFuture = new CompletableFuture<>();

    try {
      sweepExecutor.execute(() -> {
        HostScanSummary summary = null;
        Throwable failure = null;

        try {
          summary = sweep(scanStart, hostsConfiguration);
        } catch (final Throwable t) {
          failure = t;
        } finally {
          synchronized (lock) {
            scanning = false;
          }
        }

        if (failure != null) {
          sweepFuture.completeExceptionally(failure);
        } else {
          sweepFuture.complete(summary);
        }
      });
    } catch (final RejectedExecutionException e) {
      synchronized (lock) {
        scanning = false;
      }

      return Optional.empty();
    }

    return Optional.of(sweepFuture);
  }

  public boolean isScanning() {
    synchronized (lock) {
      return scanning;
    }
  }

  /**
   * Prevents new sweeps from starting and stops requesting hosts for a sweep in progress. Probes that have already
   * started are allowed to finish.
   */
  public void stop() throws InterruptedException {
    stopped = true;

    sweepExecutor.shutdown();
    if (!sweepExecutor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
      logger.warn("Host scan sweep did not complete within {}", SHUTDOWN_TIMEOUT);
    }

    workerExecutor.shutdown();
    if (!workerExecutor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
      logger.warn("Host scan workers did not complete within {}", SHUTDOWN_TIMEOUT);
    }
  }

  @VisibleForTesting
  void resetLastScanStart() {
    synchronized (lock) {
      lastScanStart = Instant.EPOCH;
    }
  }

  @VisibleForTesting
  Duration currentTimeout() {
    final Duration timeout = timeoutTracker.timeout();
    return timeout.compareTo(minTimeout) < 0 ? minTimeout : timeout;
  }

  private HostScanSummary sweep(final Instant scanStart, final HostsConfiguration hostsConfiguration)
      throws HostListingException {

    final long startNanos = System.nanoTime();
    final Instant maxLastScan = scanStart.minus(scanInterval);

    logger.info("Starting host scan for hosts last scanned before {}", maxLastScan);

    final BlockingQueue<HostAddress> hosts = new ArrayBlockingQueue<>(scanBatchSize);
    final AtomicInteger hostsScanned = new AtomicInteger();
    final AtomicInteger hostsFailed = new AtomicInteger();

    final List<CompletableFuture<Void>> workers = new ArrayList<>(scanThreads);
    for (int i = 0; i < scanThreads; i++) {
      workers.add(CompletableFuture.runAsync(() -> scanHosts(hosts, hostsScanned, hostsFailed), workerExecutor));
    }

    int pagesRequested = 0;
    HostListingException listingException = null;

    try {
      for (int offset = 0; !stopped; offset += scanBatchSize) {
        final List<HostAddress> page;

        try {
          pagesRequested++;
          page = hostStore.listHostsForScanning(maxLastScan, offset, scanBatchSize);
        } catch (final IOException e) {
          listingException = new HostListingException(offset, e);
          break;
        }

        logger.debug("Scanning {} hosts at offset {}", page.size(), offset);

        for (final HostAddress host : page) {
          Uninterruptibles.putUninterruptibly(hosts, host);
        }

        if (page.size() < scanBatchSize) {
          break;
        }
      }
    } finally {
      for (int i = 0; i < scanThreads; i++) {
        Uninterruptibles.putUninterruptibly(hosts, END_OF_SWEEP);
      }

      CompletableFuture.allOf(workers.toArray(CompletableFuture[]::new)).join();
    }

    final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    SWEEP_TIMER.record(elapsed);

    if (listingException != null) {
      logger.warn("Host scan aborted after {} hosts", hostsScanned.get(), listingException);
      throw listingException;
    }

    long hostsRemoved = 0;
    final Duration maxDowntime = hostsConfiguration.getMaxDowntime();

    if (!stopped && !maxDowntime.isZero() && !maxDowntime.isNegative()) {
      hostsRemoved = removeOfflineHosts(maxDowntime);
    }

    logger.info("Finished host scan in {}: {} hosts scanned, {} failed, {} removed",
        elapsed, hostsScanned.get(), hostsFailed.get(), hostsRemoved);

    return new HostScanSummary(hostsScanned.get(), hostsFailed.get(), pagesRequested, hostsRemoved, elapsed);
  }

  private void scanHosts(final BlockingQueue<HostAddress> hosts,
      final AtomicInteger hostsScanned,
      final AtomicInteger hostsFailed) {

    while (true) {
      final HostAddress host = Uninterruptibles.takeUninterruptibly(hosts);

      if (host == END_OF_SWEEP) {
        return;
      }

      hostsScanned.incrementAndGet();

      if (!scanHost(host)) {
        hostsFailed.incrementAndGet();
      }
    }
  }

  private boolean scanHost(final HostAddress host) {
    final Duration timeout = currentTimeout();
    boolean success = false;

    try {
      final HostScanResponse response = hostProber.probeHost(host.publicKey(), host.netAddress(), timeout);
      timeoutTracker.addDataPoint(response.ping());
      success = true;
    } catch (final HostProbeException e) {
      logger.debug("Failed to scan host {} at {}: {}", host.publicKey(), host.netAddress(), e.getMessage());
    } catch (final RuntimeException e) {
      logger.warn("Unexpected error while scanning host {} at {}", host.publicKey(), host.netAddress(), e);
    }

    Metrics.counter(PROBE_COUNTER_NAME, "outcome", success ? "success" : "failure").increment();

    try {
      hostStore.recordScanOutcome(host.publicKey(), success);
    } catch (final RuntimeException e) {
      logger.warn("Failed to record scan outcome for host {}", host.publicKey(), e);
    }

    return success;
  }

  private long removeOfflineHosts(final Duration maxDowntime) {
    final long minRecentScanFailures = DowntimePolicy.minRecentScanFailures(scanInterval, maxDowntime);

    logger.debug("Removing hosts that have been offline for more than {} with at least {} recent scan failures",
        maxDowntime, minRecentScanFailures);

    try {
      final long removed = hostStore.evictIfThresholdExceeded(minRecentScanFailures, maxDowntime);

      if (removed > 0) {
        HOSTS_REMOVED_COUNTER.increment(removed);
        logger.info("Removed {} offline hosts", removed);
      }

      return removed;
    } catch (final IOException e) {
      logger.warn("Failed to remove offline hosts", e);
      return 0;
    }
  }
}
