/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.att;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.zone.Hashes;
import io.crums.zone.IdentityException;
import io.crums.zone.InvalidInputException;
import io.crums.zone.id.ZoneIdentity;

/**
 * Builds and signs attestations. Pure: building an attestation has no side
 * effects (appending it to a ledger is the caller's business).
 *
 * <p>
 * Usage:
 * </p>
 * <pre>
 *   Attestation att = new AttestationBuilder(identity)
 *       .claimHash(claim)
 *       .evidenceHash(evidence)
 *       .cite(otherId)
 *       .timestamp(utc)
 *       .build();
 * </pre>
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public class AttestationBuilder {


  /**
   * Builds and returns a signed attestation.
   *
   * @param identity          the signing zone
   * @param canonId           canon ID ({@code null} for {@linkplain CanonIds#DEFAULT})
   * @param claimHash         32-byte claim hash
   * @param evidenceHash      32-byte evidence hash
   * @param evidenceLocation  optional evidence URI (may be {@code null})
   * @param citations         cited attestation IDs (duplicates are removed)
   * @param timestamp         Unix seconds, &ge; 0
   *
   * @throws InvalidInputException on malformed hashes, or negative timestamp
   * @throws IdentityException     on signing failure
   */
  public static Attestation build(
      ZoneIdentity identity,
      ByteBuffer canonId,
      ByteBuffer claimHash,
      ByteBuffer evidenceHash,
      String evidenceLocation,
      Collection<ByteBuffer> citations,
      long timestamp)
          throws InvalidInputException, IdentityException {

    Objects.requireNonNull(identity, "null identity");
    if (canonId == null)
      canonId = CanonIds.DEFAULT;
    canonId = Hashes.checkHash(canonId, "canon_id");
    claimHash = Hashes.checkHash(claimHash, "claim_hash");
    evidenceHash = Hashes.checkHash(evidenceHash, "evidence_hash");
    Hashes.checkTimestamp(timestamp);
    var cites = Attestations.canonicalCitations(citations == null ? List.of() : citations);

    ByteBuffer zoneId = identity.zoneId();
    ByteBuffer attId = Attestations.attestationId(zoneId, canonId, claimHash, timestamp);
    ByteBuffer preimage = Attestations.signingPreimage(
        attId, claimHash, evidenceHash, timestamp, Attestations.citationsHash(cites));

    byte[] signature = identity.sign(preimage);

    return new Attestation(
        attId,
        zoneId,
        canonId,
        claimHash,
        evidenceHash,
        Optional.ofNullable(evidenceLocation),
        cites,
        timestamp,
        ByteBuffer.wrap(signature));
  }



  private final ZoneIdentity identity;

  private ByteBuffer canonId;
  private ByteBuffer claimHash;
  private ByteBuffer evidenceHash;
  private String evidenceLocation;
  private final List<ByteBuffer> citations = new ArrayList<>();
  private long timestamp = -1;


  /**
   * @param identity the signing zone
   */
  public AttestationBuilder(ZoneIdentity identity) {
    this.identity = Objects.requireNonNull(identity, "null identity");
  }


  /** Sets the canon ID. Optional; defaults to {@linkplain CanonIds#DEFAULT}. */
  public AttestationBuilder canonId(ByteBuffer canonId) {
    this.canonId = canonId;
    return this;
  }

  /** Sets the claim hash. Required. */
  public AttestationBuilder claimHash(ByteBuffer claimHash) {
    this.claimHash = claimHash;
    return this;
  }

  /** Sets the evidence hash. Required. */
  public AttestationBuilder evidenceHash(ByteBuffer evidenceHash) {
    this.evidenceHash = evidenceHash;
    return this;
  }

  /** Sets the evidence location. Optional. */
  public AttestationBuilder evidenceLocation(String evidenceLocation) {
    this.evidenceLocation = evidenceLocation;
    return this;
  }

  /** Adds a citation. */
  public AttestationBuilder cite(ByteBuffer attestationId) {
    citations.add(Hashes.checkHash(attestationId, "citation"));
    return this;
  }

  /** Adds the given citations. */
  public AttestationBuilder citeAll(Collection<ByteBuffer> attestationIds) {
    attestationIds.forEach(this::cite);
    return this;
  }

  /** Sets the timestamp (Unix seconds). Required. */
  public AttestationBuilder timestamp(long timestamp) {
    this.timestamp = Hashes.checkTimestamp(timestamp);
    return this;
  }


  /**
   * Builds and returns the signed attestation.
   *
   * @throws InvalidInputException if a required field is missing or malformed
   * @see #build(ZoneIdentity, ByteBuffer, ByteBuffer, ByteBuffer, String, Collection, long)
   */
  public Attestation build() throws InvalidInputException, IdentityException {
    if (claimHash == null)
      throw new InvalidInputException("missing claim_hash");
    if (evidenceHash == null)
      throw new InvalidInputException("missing evidence_hash");
    if (timestamp < 0)
      throw new InvalidInputException("missing timestamp");
    return build(
        identity, canonId, claimHash, evidenceHash, evidenceLocation, citations, timestamp);
  }

}
