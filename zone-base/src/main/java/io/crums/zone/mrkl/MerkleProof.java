/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.mrkl;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.crums.util.Lists;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.ZoneConstants;

/**
 * Merkle inclusion proof. The sibling hashes are ordered from the leaf
 * up to the root. The position of the leaf alone determines whether
 * the running hash is a left or right operand at each level: an even
 * index is a left child. The index is halved (floor division) at each
 * step up.
 *
 * <h2>Duplicate Marker</h2>
 * <p>
 * A sibling entry may be the {@linkplain #DUP} marker (rendered {@code "*"}
 * in json), meaning the running hash is paired with itself. Proofs
 * generated by {@linkplain MerkleTree} use it at most once, and only
 * at the bottom (leaf) level.
 * </p>
 *
 * @param leafHash    the leaf (attestation ID)
 * @param leafIndex   the leaf's position in the sorted leaf set
 * @param siblings    sibling hashes, leaf level first (read-only)
 * @param root        the root the proof claims to reach
 *
 * @see #verify()
 */
public record MerkleProof(
    ByteBuffer leafHash, int leafIndex, List<ByteBuffer> siblings, ByteBuffer root) {

  /**
   * The duplicate marker: a zero-width buffer.
   *
   * @see #isDup(ByteBuffer)
   */
  public final static ByteBuffer DUP = ByteBuffer.allocate(0).asReadOnlyBuffer();

  /** Json token for {@linkplain #DUP}. */
  public final static String DUP_TOKEN = "*";


  /**
   * Determines whether the given sibling entry is the duplicate marker.
   */
  public static boolean isDup(ByteBuffer sibling) {
    return sibling != null && !sibling.hasRemaining();
  }



  /**
   * @throws InvalidInputException if a hash is malformed, or the leaf index is negative
   */
  public MerkleProof {
    leafHash = Hashes.checkHash(leafHash, "leaf_hash");
    root = Hashes.checkHash(root, "root");
    if (leafIndex < 0)
      throw new InvalidInputException("negative leaf_index: " + leafIndex);
    var copy = new ArrayList<ByteBuffer>(siblings.size());
    for (var sib : siblings)
      copy.add(isDup(sib) ? DUP : Hashes.checkHash(sib, "proof entry"));
    siblings = Collections.unmodifiableList(copy);
  }


  @Override
  public ByteBuffer leafHash() {
    return leafHash.asReadOnlyBuffer();
  }

  @Override
  public List<ByteBuffer> siblings() {
    return Lists.map(siblings, ByteBuffer::asReadOnlyBuffer);
  }

  @Override
  public ByteBuffer root() {
    return root.asReadOnlyBuffer();
  }


  /**
   * Returns the number of duplicate markers in the proof.
   */
  public int dupCount() {
    return (int) siblings.stream().filter(MerkleProof::isDup).count();
  }


  /**
   * Verifies this proof against its own {@linkplain #root()}.
   */
  public boolean verify() {
    return verify(root);
  }


  /**
   * Verifies this proof reaches the given root.
   *
   * @return {@code false}, if {@code expectedRoot} differs from this proof's root
   *         or if the proof does not compute
   */
  public boolean verify(ByteBuffer expectedRoot) {
    return expectedRoot != null && root.equals(expectedRoot.slice()) &&
        verify(leafHash, leafIndex, siblings, expectedRoot);
  }


  /**
   * Replays the positional algorithm and returns whether the computed
   * hash equals {@code expectedRoot}, byte-for-byte. Never throws: any
   * malformed input verifies {@code false}.
   *
   * @param leafHash      the leaf
   * @param leafIndex     the leaf's position
   * @param siblings      sibling hashes (or {@linkplain #DUP}), leaf level first
   * @param expectedRoot  the expected root
   */
  public static boolean verify(
      ByteBuffer leafHash, long leafIndex, List<ByteBuffer> siblings, ByteBuffer expectedRoot) {

    if (leafHash == null || siblings == null || expectedRoot == null || leafIndex < 0)
      return false;
    if (leafHash.remaining() != ZoneConstants.HASH_WIDTH ||
        expectedRoot.remaining() != ZoneConstants.HASH_WIDTH)
      return false;

    ByteBuffer current = leafHash.slice();
    long index = leafIndex;
    for (var sib : siblings) {
      if (sib == null)
        return false;
      ByteBuffer sibling;
      if (isDup(sib))
        sibling = current;
      else if (sib.remaining() == ZoneConstants.HASH_WIDTH)
        sibling = sib;
      else
        return false;

      current = (index & 1) == 0 ?
          Hashes.hashPair(current, sibling) :
          Hashes.hashPair(sibling, current);
      index >>= 1;
    }
    // a leaf index with more bits than the proof has levels is a lie
    return index == 0 && current.equals(expectedRoot.slice());
  }

}
