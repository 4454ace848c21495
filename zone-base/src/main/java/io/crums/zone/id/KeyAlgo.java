/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.id;


import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.Arrays;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

import io.crums.zone.Hashes;
import io.crums.zone.IdentityException;

/**
 * Signature algorithms a zone may sign with. Each constant carries its own
 * key-generation, sign and verify functions. The private key is always
 * represented as its raw 32-byte encoding (the Ed25519 seed, or the
 * secp256k1 scalar).
 *
 * @see ZoneKey
 * @see ZoneIdentity
 */
public enum KeyAlgo {

  /**
   * Ed25519 (RFC 8032). 32-byte public keys, 64-byte signatures.
   */
  ED25519("ed25519", 32, 64) {

    @Override
    byte[] newPrivateKey(SecureRandom random) {
      return new Ed25519PrivateKeyParameters(random).getEncoded();
    }

    @Override
    byte[] publicKey(byte[] privateKey) {
      checkPrivateKey(privateKey);
      return new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    }

    @Override
    byte[] sign(byte[] privateKey, byte[] message) {
      checkPrivateKey(privateKey);
      var signer = new Ed25519Signer();
      signer.init(true, new Ed25519PrivateKeyParameters(privateKey, 0));
      signer.update(message, 0, message.length);
      return signer.generateSignature();
    }

    @Override
    boolean verifyImpl(byte[] publicKey, byte[] message, byte[] signature) {
      var signer = new Ed25519Signer();
      signer.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
      signer.update(message, 0, message.length);
      return signer.verifySignature(signature);
    }
  },

  /**
   * ECDSA over secp256k1 with SHA-256. Public keys are 33-byte compressed
   * points; signatures are 64-byte {@code r || s} with low-{@code s}
   * normalization and deterministic (RFC 6979) nonces.
   */
  SECP256K1("secp256k1", 33, 64) {

    @Override
    byte[] newPrivateKey(SecureRandom random) {
      var gen = new ECKeyPairGenerator();
      gen.init(new ECKeyGenerationParameters(Secp256k1.DOMAIN, random));
      AsymmetricCipherKeyPair pair = gen.generateKeyPair();
      BigInteger d = ((ECPrivateKeyParameters) pair.getPrivate()).getD();
      return BigIntegers.asUnsignedByteArray(PRIVATE_KEY_WIDTH, d);
    }

    @Override
    byte[] publicKey(byte[] privateKey) {
      var d = Secp256k1.scalar(privateKey);
      return Secp256k1.DOMAIN.getG().multiply(d).normalize().getEncoded(true);
    }

    @Override
    byte[] sign(byte[] privateKey, byte[] message) {
      var d = Secp256k1.scalar(privateKey);
      var signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
      signer.init(true, new ECPrivateKeyParameters(d, Secp256k1.DOMAIN));
      BigInteger[] rs = signer.generateSignature(sha256(message));
      BigInteger s = rs[1];
      if (s.compareTo(Secp256k1.HALF_N) > 0)
        s = Secp256k1.DOMAIN.getN().subtract(s);

      byte[] sig = new byte[64];
      System.arraycopy(BigIntegers.asUnsignedByteArray(32, rs[0]), 0, sig, 0, 32);
      System.arraycopy(BigIntegers.asUnsignedByteArray(32, s), 0, sig, 32, 32);
      return sig;
    }

    @Override
    boolean verifyImpl(byte[] publicKey, byte[] message, byte[] signature) {
      ECPoint q = Secp256k1.DOMAIN.getCurve().decodePoint(publicKey);
      var r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
      var s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
      var signer = new ECDSASigner();
      signer.init(false, new ECPublicKeyParameters(q, Secp256k1.DOMAIN));
      return signer.verifySignature(sha256(message), r, s);
    }
  };


  /** Private keys are always 32 bytes. */
  public final static int PRIVATE_KEY_WIDTH = 32;


  private final String symbol;
  private final int publicKeyWidth;
  private final int signatureWidth;


  private KeyAlgo(String symbol, int publicKeyWidth, int signatureWidth) {
    this.symbol = symbol;
    this.publicKeyWidth = publicKeyWidth;
    this.signatureWidth = signatureWidth;
  }


  /**
   * Returns the lowercase name used on the wire ({@code "ed25519"},
   * {@code "secp256k1"}).
   */
  public String symbol() {
    return symbol;
  }

  /** Public key width in bytes. */
  public int publicKeyWidth() {
    return publicKeyWidth;
  }

  /** Signature width in bytes. */
  public int signatureWidth() {
    return signatureWidth;
  }


  /**
   * Returns the instance with the given {@linkplain #symbol() symbol}
   * (case insensitive).
   *
   * @throws IllegalArgumentException if no such algo
   */
  public static KeyAlgo forSymbol(String symbol) throws IllegalArgumentException {
    for (var algo : values())
      if (algo.symbol.equalsIgnoreCase(symbol.trim()))
        return algo;
    throw new IllegalArgumentException("unknown key algo: '" + symbol + "'");
  }



  /**
   * Verifies the given signature. Fails closed: malformed keys or signatures
   * return {@code false}; this method never throws.
   *
   * @param publicKey   public key in this algo's encoding
   * @param message     the signed bytes
   * @param signature   the signature
   */
  public boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
    if (publicKey == null || message == null || signature == null)
      return false;
    if (publicKey.length != publicKeyWidth || signature.length != signatureWidth)
      return false;
    try {
      return verifyImpl(publicKey, message, signature);
    } catch (RuntimeException x) {
      return false;
    }
  }



  abstract byte[] newPrivateKey(SecureRandom random);

  abstract byte[] publicKey(byte[] privateKey);

  abstract byte[] sign(byte[] privateKey, byte[] message);

  abstract boolean verifyImpl(byte[] publicKey, byte[] message, byte[] signature);




  static void checkPrivateKey(byte[] privateKey) {
    if (privateKey == null)
      throw new IdentityException("missing private key");
    if (privateKey.length != PRIVATE_KEY_WIDTH)
      throw new IdentityException(
          "private key must be " + PRIVATE_KEY_WIDTH + " bytes; actual was " +
          privateKey.length);
  }


  private static byte[] sha256(byte[] message) {
    var hash = Hashes.hash(message);
    byte[] out = new byte[hash.remaining()];
    hash.get(out);
    return out;
  }


  /** secp256k1 curve parameters. */
  private static class Secp256k1 {

    final static ECDomainParameters DOMAIN;
    final static BigInteger HALF_N;

    static {
      X9ECParameters params = CustomNamedCurves.getByName("secp256k1");
      DOMAIN = new ECDomainParameters(
          params.getCurve(), params.getG(), params.getN(), params.getH());
      HALF_N = DOMAIN.getN().shiftRight(1);
    }

    static BigInteger scalar(byte[] privateKey) {
      checkPrivateKey(privateKey);
      var d = new BigInteger(1, privateKey);
      if (d.signum() == 0 || d.compareTo(DOMAIN.getN()) >= 0)
        throw new IdentityException("secp256k1 private key out of range");
      return d;
    }
  }


  /**
   * Buffer convenience.
   */
  static byte[] toBytes(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.slice().get(bytes);
    return bytes;
  }

}
