/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import io.crums.util.Strings;


public class HashesTest {


  /** Returns a random 32-byte hash. */
  public static ByteBuffer randomHash(Random random) {
    byte[] hash = new byte[ZoneConstants.HASH_WIDTH];
    random.nextBytes(hash);
    return ByteBuffer.wrap(hash).asReadOnlyBuffer();
  }


  /** Returns {@code count} random 32-byte hashes. */
  public static List<ByteBuffer> randomHashes(int count, Random random) {
    var hashes = new ArrayList<ByteBuffer>(count);
    while (count-- > 0)
      hashes.add(randomHash(random));
    return hashes;
  }


  @Test
  public void testGlsr() {
    assertEquals(Hashes.hash(new byte[0]), ZoneConstants.GLSR);
    assertEquals(ZoneConstants.GLSR_HEX, Hashes.toHex(ZoneConstants.GLSR));
    assertEquals(ZoneConstants.GLSR, Hashes.hash(Strings.utf8Bytes("")));
  }


  @Test
  public void testHexRoundtrip() {
    var hash = randomHash(new Random(1));
    var hex = Hashes.toHex(hash);
    assertEquals(ZoneConstants.HEX_WIDTH, hex.length());
    assertEquals(hex.toLowerCase(), hex);
    assertEquals(hash, Hashes.fromHex(hex, "test"));
  }


  @Test
  public void testBadHex() {
    var hex = Hashes.toHex(randomHash(new Random(2)));
    assertThrows(InvalidInputException.class, () -> Hashes.fromHex(hex.substring(1), "test"));
    assertThrows(InvalidInputException.class, () -> Hashes.fromHex("z" + hex.substring(1), "test"));
    assertThrows(InvalidInputException.class, () -> Hashes.fromHex(null, "test"));
    assertThrows(
        InvalidInputException.class,
        () -> Hashes.fromHex(ZoneConstants.GLSR_HEX.toUpperCase(), "test"));
    assertThrows(
        InvalidInputException.class,
        () -> Hashes.fromHex("A" + ZoneConstants.GLSR_HEX.substring(1), "test"));
  }


  @Test
  public void testCheckHash() {
    assertThrows(InvalidInputException.class, () -> Hashes.checkHash(new byte[31], "short"));
    assertThrows(InvalidInputException.class, () -> Hashes.checkHash(new byte[33], "long"));
    var hash = Hashes.checkHash(new byte[32], "zeroes");
    assertTrue(hash.isReadOnly());
    assertEquals(32, hash.remaining());
  }


  @Test
  public void testHashPair() {
    var random = new Random(3);
    var a = randomHash(random);
    var b = randomHash(random);
    var concat = ByteBuffer.allocate(64).put(a.slice()).put(b.slice()).flip();
    assertEquals(Hashes.hash(concat), Hashes.hashPair(a, b));
    assertNotEquals(Hashes.hashPair(a, b), Hashes.hashPair(b, a));
    // arguments' positions are untouched
    assertEquals(32, a.remaining());
  }


  @Test
  public void testTimestampBytes() {
    var bytes = Hashes.timestampBytes(0x0102030405060708L);
    assertEquals(8, bytes.remaining());
    assertEquals(1, bytes.get(0));
    assertEquals(8, bytes.get(7));
    assertThrows(InvalidInputException.class, () -> Hashes.timestampBytes(-1));
  }


  @Test
  public void testOrderMatchesHex() {
    var random = new Random(4);
    for (int count = 0; count < 100; ++count) {
      var a = randomHash(random);
      var b = randomHash(random);
      int byteCmp = Integer.signum(Hashes.ORDER.compare(a, b));
      int hexCmp = Integer.signum(Hashes.toHex(a).compareTo(Hashes.toHex(b)));
      assertEquals(hexCmp, byteCmp);
    }
  }

}
