/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.nio.ByteBuffer;

import io.crums.zone.Hashes;

/**
 * Outcome of a successful append.
 *
 * @param root      the ledger root after the append
 * @param index     the attestation's leaf index in the new (sorted) tree
 * @param appendNo  the attestation's append number (= the new version)
 */
public record AppendResult(ByteBuffer root, int index, long appendNo) {

  public AppendResult {
    root = Hashes.checkHash(root, "root");
  }

  @Override
  public ByteBuffer root() {
    return root.asReadOnlyBuffer();
  }

}
