/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import static io.crums.zone.ZoneConstants.DIGEST;
import static io.crums.zone.ZoneConstants.HASH_WIDTH;
import static io.crums.zone.ZoneConstants.HEX_WIDTH;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.util.Comparator;

import io.crums.util.IntegralStrings;

/**
 * Hash value utilities. Hashes are passed around as 32-byte
 * {@code ByteBuffer}s and rendered as 64-char lowercase hex at the
 * boundaries.
 *
 * <h2>Buffer conventions</h2>
 * <p>
 * Arguments are never modified (their positions and limits are left as is).
 * Returned buffers are read-only, positioned at zero.
 * </p>
 */
public class Hashes {

  /**
   * Lexicographic (unsigned) byte order. This is the same as the
   * lexicographic order of the hashes' lowercase hex.
   */
  public final static Comparator<ByteBuffer> ORDER = Hashes::compareUnsigned;


  // ByteBuffer.compareTo compares signed bytes
  private static int compareUnsigned(ByteBuffer a, ByteBuffer b) {
    int index = a.mismatch(b);
    if (index == -1)
      return 0;
    if (index == a.remaining() || index == b.remaining())
      return a.remaining() - b.remaining();
    return Integer.compare(
        Byte.toUnsignedInt(a.get(a.position() + index)),
        Byte.toUnsignedInt(b.get(b.position() + index)));
  }



  /**
   * Returns the SHA-256 hash of the concatenation of the given buffers'
   * remaining bytes.
   */
  public static ByteBuffer hash(ByteBuffer... parts) {
    MessageDigest digest = DIGEST.newDigest();
    for (var part : parts)
      digest.update(part.slice());
    return ByteBuffer.wrap(digest.digest()).asReadOnlyBuffer();
  }


  /**
   * Returns the SHA-256 hash of the given bytes.
   */
  public static ByteBuffer hash(byte[] bytes) {
    return ByteBuffer.wrap(DIGEST.newDigest().digest(bytes)).asReadOnlyBuffer();
  }


  /**
   * Returns the hash of the concatenation of the two given hashes,
   * {@code H(left || right)}.
   */
  public static ByteBuffer hashPair(ByteBuffer left, ByteBuffer right) {
    return hash(left, right);
  }



  /**
   * Checks the given buffer has exactly {@linkplain ZoneConstants#HASH_WIDTH}
   * bytes remaining and returns a read-only slice of it.
   *
   * @param hash  not {@code null}
   * @param name  name of the argument (for the error message)
   *
   * @throws InvalidInputException if not 32 bytes wide
   */
  public static ByteBuffer checkHash(ByteBuffer hash, String name) throws InvalidInputException {
    if (hash == null)
      throw new InvalidInputException("null " + name);
    if (hash.remaining() != HASH_WIDTH)
      throw new InvalidInputException(
          name + " must be " + HASH_WIDTH + " bytes; actual was " + hash.remaining());
    return hash.asReadOnlyBuffer().slice();
  }


  /**
   * Checks and wraps the given byte array.
   *
   * @see #checkHash(ByteBuffer, String)
   */
  public static ByteBuffer checkHash(byte[] hash, String name) throws InvalidInputException {
    if (hash == null)
      throw new InvalidInputException("null " + name);
    return checkHash(ByteBuffer.wrap(hash), name);
  }


  /**
   * Parses the given 64-char lowercase hex string (the only form hashes take
   * on the wire and in storage).
   *
   * @param hex   64 lowercase hex digits
   * @param name  name of the argument (for the error message)
   *
   * @throws InvalidInputException if {@code hex} is malformed, or has uppercase digits
   */
  public static ByteBuffer fromHex(CharSequence hex, String name) throws InvalidInputException {
    if (hex == null)
      throw new InvalidInputException("null " + name);
    if (hex.length() != HEX_WIDTH)
      throw new InvalidInputException(
          name + " must be " + HEX_WIDTH + " hex chars; actual length was " +
          hex.length() + ": '" + hex + "'");
    for (int index = 0; index < HEX_WIDTH; ++index) {
      char c = hex.charAt(index);
      if ((c < '0' || c > '9') && (c < 'a' || c > 'f'))
        throw new InvalidInputException(
            name + " is not lowercase hex (at index " + index + "): '" + hex + "'");
    }
    return ByteBuffer.wrap(IntegralStrings.hexToBytes(hex)).asReadOnlyBuffer();
  }


  /**
   * Returns the lowercase hex representation of the given hash
   * (its remaining bytes).
   */
  public static String toHex(ByteBuffer hash) {
    return IntegralStrings.toHex(hash.slice());
  }


  /**
   * Returns the given timestamp as 8 big-endian bytes.
   *
   * @param utc   Unix seconds, &ge; 0
   *
   * @throws InvalidInputException if {@code utc} is negative
   */
  public static ByteBuffer timestampBytes(long utc) throws InvalidInputException {
    checkTimestamp(utc);
    return ByteBuffer.allocate(ZoneConstants.TIMESTAMP_WIDTH).putLong(0, utc).asReadOnlyBuffer();
  }


  /**
   * @throws InvalidInputException if {@code utc} is negative
   */
  public static long checkTimestamp(long utc) throws InvalidInputException {
    if (utc < 0)
      throw new InvalidInputException("negative timestamp: " + utc);
    return utc;
  }



  private Hashes() {  }

}
