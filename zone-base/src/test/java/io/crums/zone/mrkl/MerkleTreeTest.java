/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.mrkl;


import static io.crums.zone.HashesTest.randomHash;
import static io.crums.zone.HashesTest.randomHashes;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import io.crums.util.Strings;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.ZoneConstants;


public class MerkleTreeTest {


  @Test
  public void testEmpty() {
    var tree = new MerkleTree(List.of());
    assertTrue(tree.isEmpty());
    assertEquals(ZoneConstants.GLSR, tree.root());
    assertEquals(ZoneConstants.GLSR, MerkleTree.rootOf(List.of()));
    assertEquals(-1, tree.indexOf(randomHash(new Random(1))));
  }


  @Test
  public void testOne() {
    var leaf = randomHash(new Random(2));
    var tree = new MerkleTree(List.of(leaf));
    assertEquals(leaf, tree.root());
    assertEquals(0, tree.height());
    var proof = tree.proof(leaf);
    assertTrue(proof.siblings().isEmpty());
    assertTrue(proof.verify());
    assertTrue(proof.verify(leaf));
  }


  @Test
  public void testTwo() {
    var random = new Random(3);
    var sorted = MerkleTree.sortLeaves(List.of(randomHash(random), randomHash(random)));
    var a = sorted.get(0);
    var b = sorted.get(1);
    assertEquals(Hashes.hashPair(a, b), MerkleTree.rootOf(List.of(b, a)));
  }


  /**
   * Leaves a &lt; b &lt; c: the tree pairs c with itself, and the
   * proof for b is {@code [a, H(c||c)]}.
   */
  @Test
  public void testThree() {
    var random = new Random(4);
    var sorted = MerkleTree.sortLeaves(randomHashes(3, random));
    var a = sorted.get(0);
    var b = sorted.get(1);
    var c = sorted.get(2);
    var cc = Hashes.hashPair(c, c);
    var expectedRoot = Hashes.hashPair(Hashes.hashPair(a, b), cc);

    var tree = new MerkleTree(List.of(c, a, b));
    assertEquals(expectedRoot, tree.root());
    assertEquals(List.of(a, b, c), tree.leaves());

    var proof = tree.proof(b);
    assertEquals(1, proof.leafIndex());
    assertEquals(List.of(a, cc), proof.siblings());
    assertTrue(proof.verify(expectedRoot));

    var proofC = tree.proof(c);
    assertEquals(2, proofC.leafIndex());
    assertEquals(1, proofC.dupCount());
    assertTrue(MerkleProof.isDup(proofC.siblings().get(0)));
    assertEquals(Hashes.hashPair(a, b), proofC.siblings().get(1));
    assertTrue(proofC.verify(expectedRoot));
  }


  /**
   * Known answer: the tree over {@code H("leaf_a")}, {@code H("leaf_b")},
   * {@code H("leaf_c")}. Sorted, the leaves are b &lt; a &lt; c.
   */
  @Test
  public void testThreeKnownAnswer() {
    var a = Hashes.hash(Strings.utf8Bytes("leaf_a"));
    var b = Hashes.hash(Strings.utf8Bytes("leaf_b"));
    var c = Hashes.hash(Strings.utf8Bytes("leaf_c"));
    assertEquals(
        "b532cf011d665a43446d4083a95144877686692823a55a4c82b62038a7bea0e2", Hashes.toHex(a));
    assertEquals(
        "0ad8269a37926e20e76a6c70ea86f052ee4ae90bcf2665546b8b008ec5c8b144", Hashes.toHex(b));
    assertEquals(
        "b8013849e38f1e2d12b4fb3510ba5c4af3b5854c1f16e09f14c93ba642aaed7a", Hashes.toHex(c));

    var ba = Hashes.fromHex(
        "f88f9e43c36be20ffaf2020da0f73bc2be9e282dc8978450bb976f3d34ba1a53", "node");
    var cc = Hashes.fromHex(
        "056f9c437663ca3c9bf798078bfd87c67b3a559c8aed26a747f607948079da83", "node");
    var root = Hashes.fromHex(
        "35b67f5b1e9840f286b46148bba18cc8782c3dad73d87c1931c98a084f9ef327", "root");

    var tree = new MerkleTree(List.of(a, b, c));
    assertEquals(List.of(b, a, c), tree.leaves());
    assertEquals(root, tree.root());

    var proofA = tree.proof(a);
    assertEquals(1, proofA.leafIndex());
    assertEquals(List.of(b, cc), proofA.siblings());
    assertTrue(MerkleProof.verify(a, 1, List.of(b, cc), root));

    var proofC = tree.proof(c);
    assertEquals(List.of(MerkleProof.DUP, ba), proofC.siblings());
    assertTrue(proofC.verify(root));
  }


  @Test
  public void testEveryLeafVerifies() {
    var random = new Random(5);
    for (int count = 1; count <= 70; ++count) {
      var leaves = randomHashes(count, random);
      var tree = new MerkleTree(leaves);
      assertEquals(count, tree.leafCount());
      var root = tree.root();
      for (var leaf : leaves) {
        var proof = tree.proof(leaf);
        assertEquals(tree.height(), proof.siblings().size());
        assertTrue(proof.dupCount() <= 1, "count " + count);
        for (int index = 1; index < proof.siblings().size(); ++index)
          assertFalse(MerkleProof.isDup(proof.siblings().get(index)));
        assertTrue(proof.verify(root), "count " + count + ", leaf " + Hashes.toHex(leaf));
      }
    }
  }


  @Test
  public void testOrderIndependent() {
    var random = new Random(6);
    var leaves = randomHashes(37, random);
    var root = MerkleTree.rootOf(leaves);
    for (int trial = 0; trial < 5; ++trial) {
      var shuffled = new ArrayList<>(leaves);
      Collections.shuffle(shuffled, random);
      assertEquals(root, MerkleTree.rootOf(shuffled));
    }
    // duplicates are ignored
    var dups = new ArrayList<>(leaves);
    dups.addAll(leaves.subList(0, 10));
    assertEquals(root, MerkleTree.rootOf(dups));
  }


  @Test
  public void testParallelSameRoot() {
    var random = new Random(7);
    var leaves = randomHashes(1025, random);
    var sequential = new MerkleTree(leaves, Integer.MAX_VALUE);
    var parallel = new MerkleTree(leaves, 2);
    assertEquals(sequential.root(), parallel.root());
    var leaf = leaves.get(517);
    assertEquals(sequential.proof(leaf), parallel.proof(leaf));
  }


  @Test
  public void testWithLeaf() {
    var random = new Random(8);
    var leaves = randomHashes(20, random);
    var tree = new MerkleTree(List.of());
    for (int index = 0; index < leaves.size(); ++index) {
      var next = tree.withLeaf(leaves.get(index), 4);
      assertEquals(index, tree.leafCount());
      assertEquals(MerkleTree.rootOf(leaves.subList(0, index + 1)), next.root());
      tree = next;
    }
    var dup = leaves.get(3);
    var full = tree;
    assertThrows(IllegalArgumentException.class, () -> full.withLeaf(dup, 4));
  }


  @Test
  public void testTamperedProofs() {
    var random = new Random(9);
    var leaves = randomHashes(13, random);
    var tree = new MerkleTree(leaves);
    var root = tree.root();
    var proof = tree.proof(leaves.get(5));
    assertTrue(proof.verify(root));

    // wrong root
    assertFalse(proof.verify(randomHash(random)));
    assertFalse(proof.verify(null));

    // wrong leaf
    assertFalse(
        MerkleProof.verify(randomHash(random), proof.leafIndex(), proof.siblings(), root));

    // wrong index
    assertFalse(
        MerkleProof.verify(proof.leafHash(), proof.leafIndex() ^ 1, proof.siblings(), root));
    assertFalse(
        MerkleProof.verify(
            proof.leafHash(), proof.leafIndex() + (1L << proof.siblings().size()),
            proof.siblings(), root));
    assertFalse(MerkleProof.verify(proof.leafHash(), -1, proof.siblings(), root));

    // altered sibling
    for (int index = 0; index < proof.siblings().size(); ++index) {
      var sibs = new ArrayList<>(proof.siblings());
      sibs.set(index, randomHash(random));
      assertFalse(MerkleProof.verify(proof.leafHash(), proof.leafIndex(), sibs, root));
    }

    // truncated, extended
    var sibs = proof.siblings();
    assertFalse(
        MerkleProof.verify(proof.leafHash(), proof.leafIndex(), sibs.subList(1, sibs.size()), root));
    var longer = new ArrayList<>(sibs);
    longer.add(randomHash(random));
    assertFalse(MerkleProof.verify(proof.leafHash(), proof.leafIndex(), longer, root));

    // malformed entries
    var malformed = new ArrayList<>(sibs);
    malformed.set(0, ByteBuffer.allocate(5));
    assertFalse(MerkleProof.verify(proof.leafHash(), proof.leafIndex(), malformed, root));
    assertFalse(MerkleProof.verify(ByteBuffer.allocate(31), proof.leafIndex(), sibs, root));
  }


  @Test
  public void testNotALeaf() {
    var random = new Random(10);
    var tree = new MerkleTree(randomHashes(5, random));
    assertThrows(IllegalArgumentException.class, () -> tree.proof(randomHash(random)));
    assertThrows(IndexOutOfBoundsException.class, () -> tree.proof(5));
    assertThrows(
        InvalidInputException.class,
        () -> new MerkleTree(List.of(ByteBuffer.allocate(33))));
  }

}
