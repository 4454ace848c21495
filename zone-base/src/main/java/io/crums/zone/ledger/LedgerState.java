/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import io.crums.util.Lists;
import io.crums.zone.HashConflictException;
import io.crums.zone.Hashes;
import io.crums.zone.ZoneConstants;
import io.crums.zone.mrkl.MerkleTree;

/**
 * An immutable snapshot of a ledger at some version. The version is the
 * number of attestations appended so far. Besides the current Merkle tree,
 * an instance knows the append order of its leaves and the root at every
 * earlier version.
 *
 * <h2>Model &amp; state transitions</h2>
 * <p>
 * Instances are played forward one attestation at a time with
 * {@linkplain #next(ByteBuffer, int)}, starting from {@linkplain #EMPTY}.
 * Successive instances share their append-log arrays (the prefix an
 * instance sees is never written again), so a transition costs a tree
 * rebuild but no history copy, except when the arrays grow.
 * </p><p>
 * States are played forward along a single line: calling {@code next} twice
 * on the same instance invalidates the first successor. The resulting
 * instances may be read from any thread once safely published.
 * </p>
 */
public final class LedgerState {

  /**
   * The empty ledger: version zero, root {@linkplain ZoneConstants#GLSR}.
   */
  public final static LedgerState EMPTY =
      new LedgerState(new MerkleTree(List.of()), new ByteBuffer[0], new ByteBuffer[0], 0);


  private final MerkleTree tree;
  /** Attestation IDs in append order. Only [0, version) belongs to this instance. */
  private final ByteBuffer[] idLog;
  /** rootLog[v - 1] is the root at version v. */
  private final ByteBuffer[] rootLog;
  private final int version;


  private LedgerState(MerkleTree tree, ByteBuffer[] idLog, ByteBuffer[] rootLog, int version) {
    this.tree = tree;
    this.idLog = idLog;
    this.rootLog = rootLog;
    this.version = version;
  }


  /**
   * Returns the next state, with the given attestation ID appended.
   * This instance is unaffected.
   *
   * @param attestationId       not already a leaf
   * @param parallelThreshold   Merkle level width at which hashing goes parallel
   *
   * @throws IllegalArgumentException if {@code attestationId} is already a leaf
   */
  public LedgerState next(ByteBuffer attestationId, int parallelThreshold) {
    var nextTree = tree.withLeaf(attestationId, parallelThreshold);
    return next(nextTree, attestationId, nextTree.root());
  }


  /**
   * Returns the next state, with the given attestation ID and its
   * (already known) tree and root.
   */
  private LedgerState next(MerkleTree nextTree, ByteBuffer attestationId, ByteBuffer root) {
    ByteBuffer[] ids = idLog;
    ByteBuffer[] roots = rootLog;
    if (version == ids.length) {
      int cap = Math.max(16, 2 * version);
      ids = Arrays.copyOf(ids, cap);
      roots = Arrays.copyOf(roots, cap);
    }
    ids[version] = Hashes.checkHash(attestationId, "attestation_id");
    roots[version] = root;
    return new LedgerState(nextTree, ids, roots, version + 1);
  }


  /**
   * Replays the given append log (in append order) from the empty state.
   * Intermediate roots are taken from the log; only the final tree is
   * built and checked against the last entry's root.
   *
   * @param entries           the append log
   * @param parallelThreshold Merkle level width at which hashing goes parallel
   *
   * @throws HashConflictException if the log's last root does not
   *         match the tree its IDs build, or append numbers are out of sequence
   */
  public static LedgerState replay(List<LedgerEntry> entries, int parallelThreshold) {
    if (entries.isEmpty())
      return EMPTY;

    final int count = entries.size();
    ByteBuffer[] ids = new ByteBuffer[Math.max(16, count + count / 2)];
    ByteBuffer[] roots = new ByteBuffer[ids.length];
    for (int index = 0; index < count; ++index) {
      var entry = entries.get(index);
      if (entry.appendNo() != index + 1)
        throw new HashConflictException(
            "append log out of sequence at index " + index + ": " + entry);
      ids[index] = entry.attestationId();
      roots[index] = entry.root();
    }
    var tree = new MerkleTree(Arrays.asList(ids).subList(0, count), parallelThreshold);
    if (tree.leafCount() != count)
      throw new HashConflictException(
          "append log contains " + (count - tree.leafCount()) + " duplicate IDs");
    if (!tree.root().equals(roots[count - 1]))
      throw new HashConflictException(
          "recorded root at version " + count + " (" + Hashes.toHex(roots[count - 1]) +
          ") does not match computed root " + Hashes.toHex(tree.root()));
    return new LedgerState(tree, ids, roots, count);
  }


  /** Returns the version (number of attestations appended). */
  public long version() {
    return version;
  }


  /** Returns the current Merkle tree. */
  public MerkleTree tree() {
    return tree;
  }


  /** Returns the current root. */
  public ByteBuffer root() {
    return tree.root();
  }


  /**
   * Returns the root at the given version.
   *
   * @param ver &ge; 0 and &le; {@linkplain #version()}
   */
  public ByteBuffer rootAt(long ver) {
    if (ver < 0 || ver > version)
      throw new IndexOutOfBoundsException("version " + ver + " not in [0, " + version + "]");
    return ver == 0 ? ZoneConstants.GLSR.slice() : rootLog[(int) ver - 1].slice();
  }


  /**
   * Returns the attestation IDs in append order (each a fresh read-only view).
   */
  public List<ByteBuffer> appendLog() {
    return Lists.map(
        Lists.asReadOnlyList(idLog).subList(0, version), ByteBuffer::asReadOnlyBuffer);
  }


  /**
   * Returns the attestation ID appended at the given (1-based) append number.
   */
  public ByteBuffer idAt(long appendNo) {
    if (appendNo < 1 || appendNo > version)
      throw new IndexOutOfBoundsException("append no. " + appendNo + " not in [1, " + version + "]");
    return idLog[(int) appendNo - 1].slice();
  }


  /**
   * Returns the Merkle tree at the given (earlier) version. Unless {@code ver}
   * is the current version, the tree is rebuilt.
   */
  public MerkleTree treeAt(long ver, int parallelThreshold) {
    if (ver == version)
      return tree;
    rootAt(ver);  // bounds check
    return new MerkleTree(appendLog().subList(0, (int) ver), parallelThreshold);
  }


  @Override
  public String toString() {
    return "LedgerState[" + version + ":" + Hashes.toHex(root()) + "]";
  }

}
