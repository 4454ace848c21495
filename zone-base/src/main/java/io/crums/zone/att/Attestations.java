/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.att;


import static io.crums.zone.ZoneConstants.HASH_WIDTH;
import static io.crums.zone.ZoneConstants.TIMESTAMP_WIDTH;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import io.crums.util.Strings;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.ZoneConstants;
import io.crums.zone.id.ZoneKey;

/**
 * Attestation hashing rules: ID derivation, citation hashing and the
 * signature preimage.
 *
 * <h2>Citations Hash</h2>
 * <p>
 * The citations are first put in canonical form: deduplicated and sorted.
 * Their lowercase hex strings are then concatenated and the UTF-8 bytes of the
 * result hashed. No citations hashes to {@linkplain ZoneConstants#GLSR H("")}.
 * </p>
 */
public class Attestations {

  /** Width of the signature preimage in bytes (136). */
  public final static int PREIMAGE_WIDTH = 4 * HASH_WIDTH + TIMESTAMP_WIDTH;



  /**
   * Returns the attestation ID,
   * {@code H(zoneId || canonId || claimHash || timestamp)}, where the timestamp
   * is encoded as 8 big-endian bytes.
   *
   * @throws InvalidInputException on malformed hash widths, or negative timestamp
   */
  public static ByteBuffer attestationId(
      ByteBuffer zoneId, ByteBuffer canonId, ByteBuffer claimHash, long timestamp)
          throws InvalidInputException {

    return Hashes.hash(
        Hashes.checkHash(zoneId, "zone_id"),
        Hashes.checkHash(canonId, "canon_id"),
        Hashes.checkHash(claimHash, "claim_hash"),
        Hashes.timestampBytes(timestamp));
  }


  /**
   * Returns the given citations in canonical form: deduplicated, sorted,
   * each a read-only 32-byte buffer.
   *
   * @return read-only list
   * @throws InvalidInputException if any citation is not 32 bytes wide
   */
  public static List<ByteBuffer> canonicalCitations(Collection<ByteBuffer> citations)
      throws InvalidInputException {

    if (citations.isEmpty())
      return List.of();
    var set = new TreeSet<ByteBuffer>(Hashes.ORDER);
    for (var cite : citations)
      set.add(Hashes.checkHash(cite, "citation"));
    return Collections.unmodifiableList(new ArrayList<>(set));
  }


  /**
   * Returns the citations hash.
   *
   * @see #canonicalCitations(Collection)
   */
  public static ByteBuffer citationsHash(Collection<ByteBuffer> citations)
      throws InvalidInputException {
    var canon = canonicalCitations(citations);
    var concat = new StringBuilder(canon.size() * ZoneConstants.HEX_WIDTH);
    for (var cite : canon)
      concat.append(Hashes.toHex(cite));
    return Hashes.hash(Strings.utf8Bytes(concat.toString()));
  }


  /**
   * Returns the bytes the zone signs:
   * {@code attestationId || claimHash || evidenceHash || timestamp || citationsHash}.
   */
  public static ByteBuffer signingPreimage(
      ByteBuffer attestationId, ByteBuffer claimHash, ByteBuffer evidenceHash,
      long timestamp, ByteBuffer citationsHash) throws InvalidInputException {

    var preimage = ByteBuffer.allocate(PREIMAGE_WIDTH);
    preimage.put(Hashes.checkHash(attestationId, "attestation_id"))
        .put(Hashes.checkHash(claimHash, "claim_hash"))
        .put(Hashes.checkHash(evidenceHash, "evidence_hash"))
        .put(Hashes.timestampBytes(timestamp))
        .put(Hashes.checkHash(citationsHash, "citations_hash"));
    return preimage.flip().asReadOnlyBuffer();
  }


  /**
   * Returns the signing preimage of the given attestation.
   */
  public static ByteBuffer signingPreimage(Attestation att) {
    return signingPreimage(
        att.attestationId(),
        att.claimHash(),
        att.evidenceHash(),
        att.timestamp(),
        citationsHash(att.citations()));
  }


  /**
   * Determines whether the attestation's ID is the one derived from its
   * other fields.
   */
  public static boolean isIdConsistent(Attestation att) {
    var expected = attestationId(att.zoneId(), att.canonId(), att.claimHash(), att.timestamp());
    return expected.equals(att.attestationId());
  }


  /**
   * Verifies the attestation was signed by the given key. Fails closed:
   * returns {@code false} if
   * <ul>
   * <li>the attestation's {@code zone_id} is not {@code H(key)}, or</li>
   * <li>the attestation's ID does not match its fields, or</li>
   * <li>the signature does not verify.</li>
   * </ul>
   */
  public static boolean verifySignature(Attestation att, ZoneKey key) {
    if (att == null || key == null)
      return false;
    if (!key.bindsTo(att.zoneId()) || !isIdConsistent(att))
      return false;
    return key.verify(signingPreimage(att), att.signatureBytes());
  }



  private Attestations() {  }

}
