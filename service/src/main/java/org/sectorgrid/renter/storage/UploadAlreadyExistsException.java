/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.storage;

import org.sectorgrid.renter.entities.UploadId;
import org.sectorgrid.renter.util.NoStackTraceException;

public class UploadAlreadyExistsException extends NoStackTraceException {

  private final UploadId uploadId;

  public UploadAlreadyExistsException(final UploadId uploadId) {
    super("upload already exists; id '" + uploadId + "'");
    this.uploadId = uploadId;
  }

  public UploadId getUploadId() {
    return uploadId;
  }
}
