/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import java.lang.System.Logger;
import java.nio.ByteBuffer;

import io.crums.util.IntegralStrings;
import io.crums.util.hash.Digest;
import io.crums.util.hash.Digests;

/**
 * Library constants.
 */
public class ZoneConstants {
  
  
  /**
   * Digest used by the library is defined here. SHA-256.
   * 
   * @see Digests#SHA_256
   */
  public final static Digest DIGEST = Digests.SHA_256;
  
  /**
   * Digest hash width in bytes (32). Derived from {@linkplain #DIGEST DIGEST.hashWidth()}.
   */
  public final static int HASH_WIDTH = DIGEST.hashWidth();
  
  /**
   * Length of a hash in hex (64).
   */
  public final static int HEX_WIDTH = 2 * HASH_WIDTH;
  
  
  /**
   * The genesis constant (GLSR): the hash of the empty input. Also the
   * root of the empty Merkle tree.
   */
  public final static String GLSR_HEX =
      "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
  
  /**
   * {@linkplain #GLSR_HEX} as a read-only buffer.
   */
  public final static ByteBuffer GLSR =
      ByteBuffer.wrap(IntegralStrings.hexToBytes(GLSR_HEX)).asReadOnlyBuffer();
  
  
  /**
   * Number of bytes a timestamp takes in hash preimages (big endian).
   */
  public final static int TIMESTAMP_WIDTH = 8;
  
  
  /**
   * Proof format version used in json.
   */
  public final static String PROOF_VERSION = "1.0";
  
  /**
   * Protocol version advertised in zone info.
   */
  public final static String PROTOCOL_VERSION = "1.0-rc.0";
  

  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public final static String LOGGER_NAME = "zone";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }
  
  
  
  private ZoneConstants() {  }

}
