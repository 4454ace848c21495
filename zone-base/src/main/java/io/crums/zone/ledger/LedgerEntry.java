/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.nio.ByteBuffer;

import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * A row in the ledger's append log.
 *
 * @param appendNo        1-based append number (also the ledger version it created)
 * @param attestationId   the appended attestation's ID
 * @param root            the ledger root after this append
 */
public record LedgerEntry(long appendNo, ByteBuffer attestationId, ByteBuffer root) {

  public LedgerEntry {
    if (appendNo < 1)
      throw new InvalidInputException("append no. " + appendNo + " < 1");
    attestationId = Hashes.checkHash(attestationId, "attestation_id");
    root = Hashes.checkHash(root, "root");
  }

  @Override
  public ByteBuffer attestationId() {
    return attestationId.asReadOnlyBuffer();
  }

  @Override
  public ByteBuffer root() {
    return root.asReadOnlyBuffer();
  }

}
