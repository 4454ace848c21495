/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.json;


import java.nio.ByteBuffer;
import java.util.Base64;

import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * Hash and byte-string codecs shared by the parsers. On the wire, hashes are
 * 64-char lowercase hex; signatures, standard Base64.
 */
final class HashCodec {

  private HashCodec() {  }


  /** Returns the hash in lowercase hex. */
  static String encode(ByteBuffer hash) {
    return Hashes.toHex(hash);
  }


  /**
   * Decodes the given hex string as a 32-byte hash.
   *
   * @param tag   field name (for the error message)
   */
  static ByteBuffer decode(Object hex, String tag) throws JsonParsingException {
    if (!(hex instanceof String str))
      throw new JsonParsingException("expected hex string for '" + tag + "': " + hex);
    try {
      return Hashes.fromHex(str, tag);
    } catch (InvalidInputException iix) {
      throw new JsonParsingException(iix.getMessage(), iix);
    }
  }


  /**
   * Reads the required hash-valued field.
   */
  static ByteBuffer getHash(JSONObject jObj, String tag) throws JsonParsingException {
    return decode(JsonUtils.getString(jObj, tag, true), tag);
  }


  /** Encodes the given bytes in standard Base64. */
  static String toBase64(ByteBuffer bytes) {
    byte[] b = new byte[bytes.remaining()];
    bytes.slice().get(b);
    return Base64.getEncoder().encodeToString(b);
  }


  /**
   * Reads the required Base64-valued field.
   */
  static ByteBuffer getBase64(JSONObject jObj, String tag) throws JsonParsingException {
    var str = JsonUtils.getString(jObj, tag, true);
    try {
      return ByteBuffer.wrap(Base64.getDecoder().decode(str));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("'" + tag + "' is not Base64: " + str, iax);
    }
  }


  /**
   * Reads the required, non-negative long-valued field.
   */
  static long getNonNegativeLong(JSONObject jObj, String tag) throws JsonParsingException {
    Number n = JsonUtils.getNumber(jObj, tag, true);
    if (n instanceof Double || n instanceof Float)
      throw new JsonParsingException("'" + tag + "' is not an integer: " + n);
    long value = n.longValue();
    if (value < 0)
      throw new JsonParsingException("negative '" + tag + "': " + value);
    return value;
  }

}
