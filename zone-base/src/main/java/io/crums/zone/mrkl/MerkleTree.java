/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.mrkl;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.IntStream;

import io.crums.util.Lists;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.ZoneConstants;

/**
 * Immutable binary Merkle tree over a set of 32-byte leaves. The tree is a
 * pure function of its leaf <em>set</em>: leaves are deduplicated and
 * sorted (lexicographically, which is the same as their hex order) before
 * hashing, so insertion order never matters.
 *
 * <h2>Structure</h2>
 * <p>
 * A parent node is {@code H(left || right)}. A level with an odd number of
 * nodes pairs its last node with itself, {@code H(x || x)}. The root of a
 * single-leaf tree is the leaf itself; the root of the empty tree is
 * {@linkplain ZoneConstants#GLSR H("")}.
 * </p>
 * <h2>Proofs</h2>
 * <p>
 * In a {@linkplain MerkleProof proof}, a self-paired node at the bottom
 * (leaf) level is recorded with the {@linkplain MerkleProof#DUP "*"} marker.
 * A self-paired node at any higher level is recorded with its literal hash.
 * So a generated proof contains at most one marker. The positional verify
 * algorithm works unchanged on both forms, since a literal copy of the running
 * hash computes the same parent as the marker.
 * </p>
 */
public class MerkleTree {

  /**
   * Default leaf count at or above which level hashing is done in parallel.
   */
  public final static int DEFAULT_PARALLEL_THRESHOLD = 4096;


  /**
   * Returns the root of the tree over the given leaves.
   *
   * @param leaves  32-byte hashes, in any order (duplicates are ignored)
   */
  public static ByteBuffer rootOf(Collection<ByteBuffer> leaves) {
    return new MerkleTree(leaves).root();
  }


  /**
   * Returns the given leaves as a sorted, deduplicated list of read-only
   * buffers.
   *
   * @throws InvalidInputException if any leaf is not 32 bytes wide
   */
  public static List<ByteBuffer> sortLeaves(Collection<ByteBuffer> leaves) {
    var set = new TreeSet<ByteBuffer>(Hashes.ORDER);
    for (var leaf : leaves)
      set.add(Hashes.checkHash(leaf, "leaf"));
    return new ArrayList<>(set);
  }



  /** levels.get(0) are the sorted leaves; the last level is the root (if any). */
  private final List<ByteBuffer[]> levels;


  /**
   * Creates an instance with the {@linkplain #DEFAULT_PARALLEL_THRESHOLD
   * default} parallel threshold.
   *
   * @param leaves  32-byte hashes, in any order (duplicates are ignored)
   */
  public MerkleTree(Collection<ByteBuffer> leaves) {
    this(leaves, DEFAULT_PARALLEL_THRESHOLD);
  }


  /**
   * @param leaves              32-byte hashes, in any order (duplicates are ignored)
   * @param parallelThreshold   minimum level width hashed in parallel
   *
   * @throws InvalidInputException if any leaf is not 32 bytes wide
   */
  public MerkleTree(Collection<ByteBuffer> leaves, int parallelThreshold) {
    this(sortLeaves(leaves).toArray(new ByteBuffer[0]), parallelThreshold);
  }


  /**
   * Creates an instance from an already sorted, deduplicated array.
   * Package-private: {@linkplain #withLeaf(ByteBuffer, int)} uses it.
   */
  MerkleTree(ByteBuffer[] sortedLeaves, int parallelThreshold) {
    this.levels = buildLevels(sortedLeaves, Math.max(2, parallelThreshold));
  }


  private static List<ByteBuffer[]> buildLevels(ByteBuffer[] leaves, int parallelThreshold) {
    var lvls = new ArrayList<ByteBuffer[]>();
    lvls.add(leaves);
    ByteBuffer[] level = leaves;
    while (level.length > 1) {
      final ByteBuffer[] below = level;
      final int width = (below.length + 1) / 2;
      final ByteBuffer[] above = new ByteBuffer[width];
      IntStream range = IntStream.range(0, width);
      if (below.length >= parallelThreshold)
        range = range.parallel();
      range.forEach(p -> {
        int left = 2 * p;
        int right = left + 1 < below.length ? left + 1 : left;
        above[p] = Hashes.hashPair(below[left], below[right]);
      });
      lvls.add(above);
      level = above;
    }
    return Collections.unmodifiableList(lvls);
  }



  /**
   * Returns a new tree with the given leaf added. This instance is not modified.
   *
   * @param leaf                32-byte hash not already in this tree
   * @param parallelThreshold   minimum level width hashed in parallel
   *
   * @throws IllegalArgumentException if {@code leaf} is already a leaf
   */
  public MerkleTree withLeaf(ByteBuffer leaf, int parallelThreshold) {
    leaf = Hashes.checkHash(leaf, "leaf");
    ByteBuffer[] leaves = levels.get(0);
    int index = Arrays.binarySearch(leaves, leaf, Hashes.ORDER);
    if (index >= 0)
      throw new IllegalArgumentException("already a leaf: " + Hashes.toHex(leaf));
    int insert = -index - 1;
    ByteBuffer[] next = new ByteBuffer[leaves.length + 1];
    System.arraycopy(leaves, 0, next, 0, insert);
    next[insert] = leaf;
    System.arraycopy(leaves, insert, next, insert + 1, leaves.length - insert);
    return new MerkleTree(next, parallelThreshold);
  }


  /** Returns the number of leaves. */
  public int leafCount() {
    return levels.get(0).length;
  }


  /** Returns {@code true} iff there are no leaves. */
  public boolean isEmpty() {
    return leafCount() == 0;
  }


  /** Returns the sorted leaves (each a fresh read-only view). */
  public List<ByteBuffer> leaves() {
    return Lists.map(Lists.asReadOnlyList(levels.get(0)), ByteBuffer::asReadOnlyBuffer);
  }


  /**
   * Returns the number of levels above the leaves (the length of every
   * proof in this tree).
   */
  public int height() {
    return levels.size() - 1;
  }


  /**
   * Returns the root hash. If empty, {@linkplain ZoneConstants#GLSR}.
   */
  public ByteBuffer root() {
    if (isEmpty())
      return ZoneConstants.GLSR.slice();
    return levels.get(levels.size() - 1)[0].slice();
  }


  /**
   * Returns the index of the given leaf in the sorted order,
   * or -1 if not a leaf.
   */
  public int indexOf(ByteBuffer leaf) {
    if (leaf == null || leaf.remaining() != ZoneConstants.HASH_WIDTH)
      return -1;
    int index = Arrays.binarySearch(levels.get(0), leaf.slice(), Hashes.ORDER);
    return index < 0 ? -1 : index;
  }


  /** Determines whether the given hash is a leaf. */
  public boolean contains(ByteBuffer leaf) {
    return indexOf(leaf) != -1;
  }


  /**
   * Returns the inclusion proof for the given leaf.
   *
   * @throws IllegalArgumentException if {@code leaf} is not in the tree
   */
  public MerkleProof proof(ByteBuffer leaf) {
    int index = indexOf(leaf);
    if (index == -1)
      throw new IllegalArgumentException(
          "not a leaf: " + (leaf == null ? null : Hashes.toHex(leaf)));
    return proof(index);
  }


  /**
   * Returns the inclusion proof for the leaf at the given index.
   *
   * @param index &ge; 0 and &lt; {@linkplain #leafCount()}
   */
  public MerkleProof proof(int index) {
    ByteBuffer[] leaves = levels.get(0);
    if (index < 0 || index >= leaves.length)
      throw new IndexOutOfBoundsException(index + ":" + leaves.length);

    var siblings = new ArrayList<ByteBuffer>(height());
    int pos = index;
    for (int lvl = 0; lvl < height(); ++lvl) {
      ByteBuffer[] level = levels.get(lvl);
      int sib = pos ^ 1;
      if (sib < level.length)
        siblings.add(level[sib]);
      else if (lvl == 0)
        siblings.add(MerkleProof.DUP);
      else
        siblings.add(level[pos]);
      pos >>= 1;
    }
    return new MerkleProof(leaves[index], index, siblings, root());
  }


  @Override
  public String toString() {
    return "MerkleTree[" + leafCount() + ":" + Hashes.toHex(root()) + "]";
  }

}
