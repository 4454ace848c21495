/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;

/**
 * Outcome of a citation check. There is exactly one valid outcome,
 * {@linkplain #VALID}; every other constant names the reason the citation
 * is invalid.
 */
public enum CitationResult {

  /** Proof verifies, and the cited anchor strictly precedes the citing anchor. */
  VALID("valid"),

  /** The citing attestation is not in the local ledger. */
  CITING_NOT_FOUND("citing attestation not found"),
  /** The citing attestation does not cite the cited ID. */
  NOT_CITED("attestation does not cite the given ID"),
  /** The cited zone reports no such attestation. */
  CITED_NOT_FOUND("cited attestation not found at remote zone"),
  /** The cited zone could not be reached. */
  UNREACHABLE("remote zone unreachable"),
  /** The check did not complete in time. */
  TIMEOUT("timed out"),
  /** The remote record is not about the cited ID. */
  RECORD_MISMATCH("remote record does not match cited ID"),
  /** The Merkle proof does not verify. */
  BAD_PROOF("Merkle proof does not verify"),
  /** The remote zone's key does not derive the attestation's zone ID. */
  ZONE_MISMATCH("zone ID does not match remote public key"),
  /** The cited attestation's signature does not verify. */
  BAD_SIGNATURE("signature does not verify"),
  /** The cited attestation's enclosing root has no anchor. */
  CITED_UNANCHORED("cited root not anchored"),
  /** The cited anchor binds a root other than the proof's. */
  ANCHOR_MISMATCH("cited anchor does not bind proof root"),
  /** The citing attestation's enclosing root has no anchor. */
  CITING_UNANCHORED("citing root not anchored"),
  /** The cited anchor is not strictly earlier than the citing anchor. */
  NOT_BEFORE("cited anchor not strictly before citing anchor"),
  /** Unexpected failure. */
  ERROR("unexpected error");


  private final String description;

  private CitationResult(String description) {
    this.description = description;
  }


  /** Returns {@code true} iff this is {@linkplain #VALID}. */
  public boolean isValid() {
    return this == VALID;
  }


  /** Human readable description. */
  public String description() {
    return description;
  }

}
