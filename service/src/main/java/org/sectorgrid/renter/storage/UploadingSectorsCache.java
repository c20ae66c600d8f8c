/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.storage;

import static org.sectorgrid.renter.metrics.MetricsUtil.name;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.sectorgrid.renter.configuration.UploadingSectorsConfiguration;
import org.sectorgrid.renter.entities.FileContractId;
import org.sectorgrid.renter.entities.SectorRoot;
import org.sectorgrid.renter.entities.UploadId;
import org.sectorgrid.renter.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps track of the sectors that ongoing uploads have pushed to each contract but that are not yet part of a
 * persisted object. The placement logic uses this to account for capacity that is already spoken for and to avoid
 * uploading a sector twice.
 * <p>
 * Queries are renewal-transparent: once a contract has been renewed, asking about either the old or the new contract
 * id yields the sectors uploaded under both. Only a single renewal per contract is supported over the course of one
 * upload; older links in the chain are pruned when a renewed contract renews again.
 * <p>
 * Nothing here is persisted. Uploads that are never finished are ignored once they exceed the configured expiry and
 * are removed the next time any upload finishes.
 */
public class UploadingSectorsCache {

  private static final Logger logger = LoggerFactory.getLogger(UploadingSectorsCache.class);

  private static final String TRACKED_UPLOADS_GAUGE_NAME = name(UploadingSectorsCache.class, "trackedUploads");
  private static final Counter EXPIRED_UPLOADS_COUNTER =
      Metrics.counter(name(UploadingSectorsCache.class, "expiredUploads"));

  private final Clock clock;
  private final Duration cacheExpiry;

  // guards uploads, renewedFrom and renewedTo; never held while an upload's own lock is held
  private final Object lock = new Object();

  private final Map<UploadId, OngoingUpload> uploads = new HashMap<>();
  private final Map<FileContractId, FileContractId> renewedFrom = new HashMap<>();
  private final Map<FileContractId, FileContractId> renewedTo = new HashMap<>();

  /**
   * The ids to consult for a contract: the most recent contract in its renewal chain and the contract that one was
   * renewed from, if any.
   */
  public record ContractIds(FileContractId contractId, @Nullable FileContractId renewedFrom) {
  }

  public UploadingSectorsCache(final UploadingSectorsConfiguration configuration, final Clock clock) {
    this(configuration.getCacheExpiry(), clock);
  }

  @VisibleForTesting
  UploadingSectorsCache(final Duration cacheExpiry, final Clock clock) {
    this.cacheExpiry = cacheExpiry;
    this.clock = clock;

    Metrics.gauge(TRACKED_UPLOADS_GAUGE_NAME, this, UploadingSectorsCache::trackedUploads);
  }

  public void trackUpload(final UploadId uploadId) throws UploadAlreadyExistsException {
    synchronized (lock) {
      if (uploads.containsKey(uploadId)) {
        throw new UploadAlreadyExistsException(uploadId);
      }

      uploads.put(uploadId, new OngoingUpload(clock.instant()));
    }
  }

  public void addUploadingSector(final UploadId uploadId, final FileContractId contractId, final SectorRoot root)
      throws UnknownUploadException {

    final OngoingUpload ongoingUpload;
    synchronized (lock) {
      ongoingUpload = uploads.get(uploadId);
    }

    if (ongoingUpload == null) {
      throw new UnknownUploadException(uploadId);
    }

    ongoingUpload.addSector(contractId, root);
  }

  /**
   * Records that {@code renewedFromId} was renewed into {@code contractId}.
   */
  public void addRenewal(final FileContractId contractId, final FileContractId renewedFromId) {
    synchronized (lock) {
      // drop the grandparent link; this assumes a contract doesn't renew twice within the course of one upload
      final FileContractId previous = renewedFrom.remove(renewedFromId);
      if (previous != null) {
        renewedTo.remove(previous);
      }

      renewedFrom.put(contractId, renewedFromId);
      renewedTo.put(renewedFromId, contractId);
    }
  }

  public ContractIds contractIds(final FileContractId contractId) {
    synchronized (lock) {
      final FileContractId renewed = renewedTo.get(contractId);

      if (renewed != null) {
        return new ContractIds(renewed, contractId);
      }

      return new ContractIds(contractId, renewedFrom.get(contractId));
    }
  }

  /**
   * @return the number of bytes ongoing uploads have pushed to the given contract or the contract it renewed from
   */
  public long pending(final FileContractId contractId) {
    final ContractIds contractIds = contractIds(contractId);
    final Instant now = clock.instant();

    long sectors = 0;
    for (final OngoingUpload ongoingUpload : ongoingUploads()) {
      sectors += ongoingUpload.sectorCount(contractIds.contractId(), now);
      if (contractIds.renewedFrom() != null) {
        sectors += ongoingUpload.sectorCount(contractIds.renewedFrom(), now);
      }
    }

    return sectors * Constants.SECTOR_SIZE;
  }

  /**
   * @return the roots of all sectors ongoing uploads have pushed to the given contract or the contract it renewed
   * from; the roots contributed by any one upload appear in the order they were added
   */
  public List<SectorRoot> sectors(final FileContractId contractId) {
    final ContractIds contractIds = contractIds(contractId);
    final Instant now = clock.instant();

    final List<SectorRoot> roots = new ArrayList<>();
    for (final OngoingUpload ongoingUpload : ongoingUploads()) {
      roots.addAll(ongoingUpload.sectors(contractIds.contractId(), now));
      if (contractIds.renewedFrom() != null) {
        roots.addAll(ongoingUpload.sectors(contractIds.renewedFrom(), now));
      }
    }

    return roots;
  }

  /**
   * Stops tracking the given upload and removes any other upload that has outlived the cache expiry.
   */
  public void finishUpload(final UploadId uploadId) {
    final Instant now = clock.instant();
    int expired = 0;

    synchronized (lock) {
      uploads.remove(uploadId);

      final Iterator<Map.Entry<UploadId, OngoingUpload>> iterator = uploads.entrySet().iterator();
      while (iterator.hasNext()) {
        final Map.Entry<UploadId, OngoingUpload> entry = iterator.next();

        if (entry.getValue().isExpired(now)) {
          logger.debug("Pruning expired upload {} started at {}", entry.getKey(), entry.getValue().started);
          iterator.remove();
          expired++;
        }
      }
    }

    if (expired > 0) {
      EXPIRED_UPLOADS_COUNTER.increment(expired);
      logger.info("Pruned {} uploads that were not finished within {}", expired, cacheExpiry);
    }
  }

  public int trackedUploads() {
    synchronized (lock) {
      return uploads.size();
    }
  }

  @VisibleForTesting
  Map<FileContractId, FileContractId> renewedFrom() {
    synchronized (lock) {
      return Map.copyOf(renewedFrom);
    }
  }

  @VisibleForTesting
  Map<FileContractId, FileContractId> renewedTo() {
    synchronized (lock) {
      return Map.copyOf(renewedTo);
    }
  }

  private List<OngoingUpload> ongoingUploads() {
    synchronized (lock) {
      return new ArrayList<>(uploads.values());
    }
  }

  private class OngoingUpload {

    private final Instant started;

    // guarded by this
    private final Map<FileContractId, List<SectorRoot>> contractSectors = new HashMap<>();

    OngoingUpload(final Instant started) {
      this.started = started;
    }

    synchronized void addSector(final FileContractId contractId, final SectorRoot root) {
      contractSectors.computeIfAbsent(contractId, ignored -> new ArrayList<>()).add(root);
    }

    synchronized List<SectorRoot> sectors(final FileContractId contractId, final Instant now) {
      final List<SectorRoot> roots = contractSectors.get(contractId);

      if (roots == null || isExpired(now)) {
        return Collections.emptyList();
      }

      return new ArrayList<>(roots);
    }

    synchronized int sectorCount(final FileContractId contractId, final Instant now) {
      final List<SectorRoot> roots = contractSectors.get(contractId);
      return roots == null || isExpired(now) ? 0 : roots.size();
    }

    boolean isExpired(final Instant now) {
      return !now.isBefore(started.plus(cacheExpiry));
    }
  }
}
