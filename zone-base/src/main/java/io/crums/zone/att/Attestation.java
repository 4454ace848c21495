/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.att;


import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.util.Lists;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * An attestation: a signed record that a zone recorded a claim at a
 * given time. Immutable.
 *
 * <p>
 * All hash-valued components are 32-byte read-only buffers. The
 * {@code citations} list is kept in canonical form: deduplicated and
 * sorted (see {@linkplain Attestations#canonicalCitations(java.util.Collection)}).
 * </p>
 * <p>
 * Instances constructed directly (e.g. when parsed from json) are not
 * checked for internal consistency. Use
 * {@linkplain Attestations#isIdConsistent(Attestation)} and
 * {@linkplain Attestations#verifySignature(Attestation, io.crums.zone.id.ZoneKey)}
 * for that.
 * </p>
 *
 * @param attestationId     {@code H(zoneId || canonId || claimHash || timestamp)}
 * @param zoneId            {@code H(publicKey)} of the issuing zone
 * @param canonId           canon (verification methodology) ID
 * @param claimHash         hash of the claim
 * @param evidenceHash      hash of the evidence
 * @param evidenceLocation  optional URI where the evidence may be retrieved
 * @param citations         IDs of cited attestations (canonical order)
 * @param timestamp         Unix seconds (self-reported)
 * @param signature         signature over the {@linkplain Attestations#signingPreimage(Attestation) preimage}
 *
 * @see AttestationBuilder
 */
public record Attestation(
    ByteBuffer attestationId,
    ByteBuffer zoneId,
    ByteBuffer canonId,
    ByteBuffer claimHash,
    ByteBuffer evidenceHash,
    Optional<String> evidenceLocation,
    List<ByteBuffer> citations,
    long timestamp,
    ByteBuffer signature) {


  /**
   * @throws InvalidInputException if any of the hashes is not 32 bytes wide,
   *         or on negative timestamp, or on empty signature
   */
  public Attestation {
    attestationId = Hashes.checkHash(attestationId, "attestation_id");
    zoneId = Hashes.checkHash(zoneId, "zone_id");
    canonId = Hashes.checkHash(canonId, "canon_id");
    claimHash = Hashes.checkHash(claimHash, "claim_hash");
    evidenceHash = Hashes.checkHash(evidenceHash, "evidence_hash");
    evidenceLocation = Objects.requireNonNull(evidenceLocation, "null evidenceLocation")
        .filter(s -> !s.isBlank());
    citations = Attestations.canonicalCitations(
        Objects.requireNonNull(citations, "null citations"));
    Hashes.checkTimestamp(timestamp);
    if (signature == null || !signature.hasRemaining())
      throw new InvalidInputException("missing signature");
    signature = signature.asReadOnlyBuffer().slice();
  }


  // Buffer-valued accessors return fresh read-only views: the record's own
  // buffers stay at position zero.

  @Override
  public ByteBuffer attestationId() {
    return attestationId.asReadOnlyBuffer();
  }

  @Override
  public ByteBuffer zoneId() {
    return zoneId.asReadOnlyBuffer();
  }

  @Override
  public ByteBuffer canonId() {
    return canonId.asReadOnlyBuffer();
  }

  @Override
  public ByteBuffer claimHash() {
    return claimHash.asReadOnlyBuffer();
  }

  @Override
  public ByteBuffer evidenceHash() {
    return evidenceHash.asReadOnlyBuffer();
  }

  @Override
  public List<ByteBuffer> citations() {
    return Lists.map(citations, ByteBuffer::asReadOnlyBuffer);
  }

  @Override
  public ByteBuffer signature() {
    return signature.asReadOnlyBuffer();
  }


  /** Returns the attestation ID in hex. */
  public String attestationIdHex() {
    return Hashes.toHex(attestationId);
  }


  /** Returns the signature bytes (a copy). */
  public byte[] signatureBytes() {
    byte[] sig = new byte[signature.remaining()];
    signature.slice().get(sig);
    return sig;
  }


  /** Returns the signature in standard Base64 (its wire form). */
  public String signatureBase64() {
    return Base64.getEncoder().encodeToString(signatureBytes());
  }


  /**
   * Determines whether this attestation cites the given attestation ID.
   */
  public boolean cites(ByteBuffer citedId) {
    return citedId != null && citations.contains(citedId.slice());
  }


  @Override
  public String toString() {
    return "Attestation[" + attestationIdHex() + "]";
  }

}
