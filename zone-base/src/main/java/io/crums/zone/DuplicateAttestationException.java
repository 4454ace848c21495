/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import java.nio.ByteBuffer;

import io.crums.util.IntegralStrings;

/**
 * Thrown on attempting to append an attestation whose ID is already in the
 * ledger. Non-fatal: the attestation is already recorded.
 */
@SuppressWarnings("serial")
public class DuplicateAttestationException extends ZoneException {
  
  private final ByteBuffer attestationId;

  /**
   * @param attestationId   the (already recorded) attestation ID
   */
  public DuplicateAttestationException(ByteBuffer attestationId) {
    super("attestation already recorded: " + IntegralStrings.toHex(attestationId.slice()));
    this.attestationId = attestationId.asReadOnlyBuffer();
  }
  
  
  /**
   * Returns the ID of the attestation already recorded.
   */
  public ByteBuffer attestationId() {
    return attestationId.slice();
  }

}
