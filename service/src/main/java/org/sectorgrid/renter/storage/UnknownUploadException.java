/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.storage;

import org.sectorgrid.renter.entities.UploadId;
import org.sectorgrid.renter.util.NoStackTraceException;

/**
 * Indicates that an upload was never tracked or has already been finished.
 */
public class UnknownUploadException extends NoStackTraceException {

  private final UploadId uploadId;

  public UnknownUploadException(final UploadId uploadId) {
    super("unknown upload; id '" + uploadId + "'");
    this.uploadId = uploadId;
  }

  public UploadId getUploadId() {
    return uploadId;
  }
}
