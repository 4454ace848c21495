/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

import io.crums.zone.anchor.Anchor;

/**
 * The ledger's current root, its size, and the latest anchor (if any).
 *
 * @param root              current Merkle root
 * @param attestationCount  number of attestations in the ledger
 * @param lastAnchor        the most recently recorded anchor
 */
public record RootInfo(ByteBuffer root, long attestationCount, Optional<Anchor> lastAnchor) {

  public RootInfo {
    root = Hashes.checkHash(root, "merkle_root");
    if (attestationCount < 0)
      throw new InvalidInputException("negative attestation count: " + attestationCount);
    Objects.requireNonNull(lastAnchor, "null lastAnchor");
  }

  @Override
  public ByteBuffer root() {
    return root.asReadOnlyBuffer();
  }

}
