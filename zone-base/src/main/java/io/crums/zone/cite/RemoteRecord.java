/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import java.util.Objects;
import java.util.Optional;

import io.crums.zone.anchor.Anchor;
import io.crums.zone.att.Attestation;
import io.crums.zone.id.ZoneKey;
import io.crums.zone.mrkl.MerkleProof;

/**
 * What a zone serves about one of its attestations to a verifier: the
 * attestation, its proof against the enclosing anchored root, that root's
 * anchor (if any), and the zone's public key (if disclosed).
 *
 * @param attestation the attestation
 * @param proof       its Merkle proof
 * @param anchor      the anchor binding the proof's root, if any
 * @param zoneKey     the zone's public key, if disclosed
 */
public record RemoteRecord(
    Attestation attestation, MerkleProof proof, Optional<Anchor> anchor, Optional<ZoneKey> zoneKey) {

  public RemoteRecord {
    Objects.requireNonNull(attestation, "null attestation");
    Objects.requireNonNull(proof, "null proof");
    Objects.requireNonNull(anchor, "null anchor");
    Objects.requireNonNull(zoneKey, "null zoneKey");
  }

}
