/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.id;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import io.crums.util.IntegralStrings;
import io.crums.util.Strings;
import io.crums.zone.IdentityException;
import io.crums.zone.ZoneConstants;

/**
 * A zone's signing identity: a private key and its derived {@linkplain ZoneKey}.
 * Instances are immutable and safe to share across threads.
 *
 * <h2>Key Persistence</h2>
 * <p>
 * The private key is persisted as 64 hex digits (its raw 32 bytes), either in a
 * file or in the {@linkplain #ENV_PRIVATE_KEY} environment variable.
 * </p>
 */
public class ZoneIdentity {

  /**
   * Name of the environment variable the private key (hex) may be read from.
   *
   * @see #load(KeyAlgo, File, boolean)
   */
  public final static String ENV_PRIVATE_KEY = "ZONE_PRIVATE_KEY";


  private final static SecureRandom RANDOM = new SecureRandom();


  /**
   * Generates and returns a new identity.
   */
  public static ZoneIdentity generate(KeyAlgo algo) {
    return new ZoneIdentity(algo, algo.newPrivateKey(RANDOM));
  }


  /**
   * Creates an instance from the given hex-encoded private key.
   *
   * @throws IdentityException if the key is malformed
   */
  public static ZoneIdentity fromPrivateHex(KeyAlgo algo, String hex) throws IdentityException {
    if (hex == null)
      throw new IdentityException("missing private key");
    hex = hex.trim();
    if (!IntegralStrings.isHex(hex))
      throw new IdentityException("private key is not hex");
    return new ZoneIdentity(algo, IntegralStrings.hexToBytes(hex));
  }


  /**
   * Loads the identity from the given file.
   *
   * @param algo      key algo
   * @param keyFile   text file containing the private key in hex
   *
   * @throws IdentityException if the file does not exist or is malformed
   */
  public static ZoneIdentity load(KeyAlgo algo, File keyFile) throws IdentityException {
    if (!keyFile.isFile())
      throw new IdentityException("key file not found: " + keyFile);
    try {
      return fromPrivateHex(algo, Files.readString(keyFile.toPath()));
    } catch (IOException iox) {
      throw new IdentityException("on reading key file " + keyFile + ": " + iox.getMessage(), iox);
    }
  }


  /**
   * Loads the identity the usual way. In order of precedence,
   * <ol>
   * <li>the {@linkplain #ENV_PRIVATE_KEY} environment variable, if set;</li>
   * <li>the {@code keyFile}, if it exists;</li>
   * <li>a newly generated key, if {@code autoGenerate} is {@code true}. If
   * {@code keyFile} is not {@code null}, the new key is saved there.</li>
   * </ol>
   *
   * @param algo          key algo
   * @param keyFile       optional key file (may be {@code null})
   * @param autoGenerate  if {@code true}, a new key is generated when none is found
   *
   * @throws IdentityException if no key is found and {@code autoGenerate} is {@code false}
   */
  public static ZoneIdentity load(KeyAlgo algo, File keyFile, boolean autoGenerate)
      throws IdentityException {

    var log = ZoneConstants.getLogger();

    String envHex = System.getenv(ENV_PRIVATE_KEY);
    if (envHex != null && !envHex.isBlank()) {
      log.log(Level.INFO, "loading zone key from environment variable " + ENV_PRIVATE_KEY);
      return fromPrivateHex(algo, envHex);
    }
    if (keyFile != null && keyFile.exists()) {
      log.log(Level.INFO, "loading zone key from " + keyFile);
      return load(algo, keyFile);
    }
    if (!autoGenerate)
      throw new IdentityException(
          "no private key found" + (keyFile == null ? "" : " (key file " + keyFile + ")"));

    var identity = generate(algo);
    log.log(Level.WARNING, "generated new " + algo.symbol() + " zone key");
    if (keyFile != null)
      identity.save(keyFile);
    return identity;
  }



  private final KeyAlgo algo;
  private final byte[] privateKey;
  private final ZoneKey key;


  private ZoneIdentity(KeyAlgo algo, byte[] privateKey) {
    this.algo = Objects.requireNonNull(algo, "null algo");
    KeyAlgo.checkPrivateKey(privateKey);
    this.privateKey = privateKey;
    try {
      this.key = new ZoneKey(algo, ByteBuffer.wrap(algo.publicKey(privateKey)));
    } catch (IdentityException ix) {
      throw ix;
    } catch (RuntimeException rx) {
      throw new IdentityException("invalid " + algo.symbol() + " private key", rx);
    }
  }


  /** Returns the key algo. */
  public KeyAlgo algo() {
    return algo;
  }


  /** Returns the public key. */
  public ZoneKey key() {
    return key;
  }


  /** Returns the zone ID, {@code H(publicKey)}. */
  public ByteBuffer zoneId() {
    return key.zoneId();
  }


  /**
   * Signs the given message.
   *
   * @param message the bytes to sign (remaining); not modified
   *
   * @return the signature
   * @throws IdentityException on a signing failure
   */
  public byte[] sign(ByteBuffer message) throws IdentityException {
    if (message == null)
      throw new IdentityException("null message");
    try {
      return algo.sign(privateKey, KeyAlgo.toBytes(message));
    } catch (IdentityException ix) {
      throw ix;
    } catch (RuntimeException rx) {
      throw new IdentityException("signing failed: " + rx.getMessage(), rx);
    }
  }


  /** Returns the private key in hex. Handle with care. */
  public String toPrivateHex() {
    return IntegralStrings.toHex(privateKey);
  }


  /**
   * Saves the private key (as hex) to the given file. The file must not already exist.
   *
   * @throws IdentityException if the file already exists
   * @throws UncheckedIOException on I/O error
   */
  public void save(File keyFile) throws IdentityException, UncheckedIOException {
    if (keyFile.exists())
      throw new IdentityException("key file already exists: " + keyFile);
    var parent = keyFile.getAbsoluteFile().getParentFile();
    if (parent != null)
      parent.mkdirs();
    try {
      Files.write(
          keyFile.toPath(),
          Strings.utf8Bytes(toPrivateHex()),
          StandardOpenOption.CREATE_NEW);
    } catch (IOException iox) {
      throw new UncheckedIOException("on saving key to " + keyFile, iox);
    }
  }


  /** Equality is based on the private key. */
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof ZoneIdentity other &&
        other.algo == algo &&
        Arrays.equals(other.privateKey, privateKey);
  }


  @Override
  public int hashCode() {
    return key.hashCode();
  }


  @Override
  public String toString() {
    return "ZoneIdentity[" + key + "]";
  }

}
