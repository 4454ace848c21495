/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.att;


import java.nio.ByteBuffer;

import io.crums.util.Strings;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;

/**
 * Canon ID derivation. A canon is named by its name and version;
 * its ID is {@code H(utf8(name + ":" + version))}.
 */
public class CanonIds {

  /** Name of the default canon. */
  public final static String DEFAULT_NAME = "timestamp";
  /** Version of the default canon. */
  public final static String DEFAULT_VERSION = "1.0";

  /**
   * The default canon's ID. Used when the caller names no canon.
   */
  public final static ByteBuffer DEFAULT = canonId(DEFAULT_NAME, DEFAULT_VERSION);


  /**
   * Returns the canon ID for the given name and version.
   *
   * @throws InvalidInputException if either argument is blank
   */
  public static ByteBuffer canonId(String name, String version) throws InvalidInputException {
    if (name == null || name.isBlank())
      throw new InvalidInputException("blank canon name");
    if (version == null || version.isBlank())
      throw new InvalidInputException("blank canon version");
    return Hashes.hash(Strings.utf8Bytes(name + ":" + version));
  }


  private CanonIds() {  }

}
