/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.anchor;


import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * External evidence binding a Merkle root to a point in time. How the evidence
 * itself is checked (a blockchain transaction, a newspaper print, a beacon
 * pulse..) is not this library's concern: only the anchor's timestamp and its
 * root linkage are consumed.
 *
 * @param root        the anchored Merkle root
 * @param type        the anchoring mechanism (e.g. {@code "bitcoin"}, {@code "nist-beacon"})
 * @param utc         the external timestamp (Unix seconds)
 * @param reference   optional mechanism-specific reference (e.g. a txid, or URL)
 */
public record Anchor(ByteBuffer root, String type, long utc, Optional<String> reference) {

  /**
   * @throws InvalidInputException if {@code root} is not 32 bytes wide, {@code type}
   *         is blank, or {@code utc} is negative
   */
  public Anchor {
    root = Hashes.checkHash(root, "merkle_root");
    if (type == null || type.isBlank())
      throw new InvalidInputException("blank anchor type");
    type = type.trim();
    Hashes.checkTimestamp(utc);
    reference = Objects.requireNonNull(reference, "null reference").filter(s -> !s.isBlank());
  }


  /** Creates an instance with no reference. */
  public Anchor(ByteBuffer root, String type, long utc) {
    this(root, type, utc, Optional.empty());
  }


  /** Returns the anchored root (a fresh read-only view). */
  @Override
  public ByteBuffer root() {
    return root.asReadOnlyBuffer();
  }


  /** Determines whether this anchor binds the given root. */
  public boolean anchors(ByteBuffer merkleRoot) {
    return merkleRoot != null && root.equals(merkleRoot.slice());
  }


  /**
   * Determines whether this anchor is strictly earlier than the given one.
   * Equal timestamps do not order.
   */
  public boolean precedes(Anchor other) {
    return utc < other.utc;
  }


  @Override
  public String toString() {
    return "Anchor[" + type + ":" + utc + ":" + Hashes.toHex(root) + "]";
  }

}
