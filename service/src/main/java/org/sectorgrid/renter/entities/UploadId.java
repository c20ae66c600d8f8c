/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.sectorgrid.renter.entities;

import java.security.SecureRandom;
import org.sectorgrid.renter.util.Constants;

/**
 * Identifies one ongoing upload. Chosen by the uploading worker, typically at random.
 */
public final class UploadId extends FixedSizeIdentifier {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  public UploadId(final byte[] bytes) {
    super(bytes);
  }

  public static UploadId random() {
    final byte[] bytes = new byte[Constants.IDENTIFIER_LENGTH];
    SECURE_RANDOM.nextBytes(bytes);
    return new UploadId(bytes);
  }
}
