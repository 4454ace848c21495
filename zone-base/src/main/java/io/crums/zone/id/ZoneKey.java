/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.id;


import java.nio.ByteBuffer;
import java.util.Objects;

import io.crums.util.IntegralStrings;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * A zone's public key, tagged with its algorithm. The zone ID is
 * never assigned: it is always {@code H(publicKey)}.
 *
 * @param algo        signature algorithm
 * @param publicKey   public key bytes (read-only, positioned at zero)
 */
public record ZoneKey(KeyAlgo algo, ByteBuffer publicKey) {

  /**
   * @throws InvalidInputException if the key width does not match the algo's
   */
  public ZoneKey {
    Objects.requireNonNull(algo, "null algo");
    Objects.requireNonNull(publicKey, "null publicKey");
    publicKey = publicKey.asReadOnlyBuffer().slice();
    if (publicKey.remaining() != algo.publicKeyWidth())
      throw new InvalidInputException(
          algo.symbol() + " public key must be " + algo.publicKeyWidth() +
          " bytes; actual was " + publicKey.remaining());
  }


  /** Returns the public key bytes (a fresh read-only view). */
  @Override
  public ByteBuffer publicKey() {
    return publicKey.asReadOnlyBuffer();
  }


  /**
   * Creates an instance from the given hex-encoded public key.
   */
  public static ZoneKey fromHex(KeyAlgo algo, String publicKeyHex) throws InvalidInputException {
    try {
      return new ZoneKey(algo, ByteBuffer.wrap(IntegralStrings.hexToBytes(publicKeyHex)));
    } catch (IllegalArgumentException iax) {
      throw new InvalidInputException("malformed public key hex: '" + publicKeyHex + "'", iax);
    }
  }


  /**
   * Returns the zone ID, {@code H(publicKey)}.
   */
  public ByteBuffer zoneId() {
    return Hashes.hash(publicKey);
  }


  /**
   * Determines whether this is the key the given zone ID was derived from.
   */
  public boolean bindsTo(ByteBuffer zoneId) {
    return zoneId != null && zoneId().equals(zoneId.slice());
  }


  /** Returns the public key in lowercase hex. */
  public String publicKeyHex() {
    return IntegralStrings.toHex(publicKey.slice());
  }


  /** Returns a copy of the public key bytes. */
  public byte[] publicKeyBytes() {
    return KeyAlgo.toBytes(publicKey);
  }


  /**
   * Verifies the signature over the given message. Fails closed.
   *
   * @param message     the signed bytes (remaining)
   * @param signature   the signature
   *
   * @return {@code false} on a bad or malformed signature
   */
  public boolean verify(ByteBuffer message, byte[] signature) {
    if (message == null)
      return false;
    return algo.verify(publicKeyBytes(), KeyAlgo.toBytes(message), signature);
  }


  @Override
  public String toString() {
    return "ZoneKey[" + algo.symbol() + ":" + publicKeyHex() + "]";
  }

}
