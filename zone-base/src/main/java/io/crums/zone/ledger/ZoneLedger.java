/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import io.crums.zone.DuplicateAttestationException;
import io.crums.zone.HashConflictException;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.UnreachableException;
import io.crums.zone.ZoneConstants;
import io.crums.zone.att.Attestation;
import io.crums.zone.att.Attestations;
import io.crums.zone.mrkl.MerkleProof;
import io.crums.zone.mrkl.MerkleTree;

/**
 * A zone's append-only ledger of attestations, and the Merkle root over
 * their IDs.
 *
 * <h2>Versions</h2>
 * <p>
 * Every append creates a new version, numbered by the count of attestations
 * appended so far. The root at each version is remembered, and a proof may be
 * requested against any of them. Note a leaf's index (its position in the
 * sorted leaf set) may shift as later attestations are appended; a proof
 * verifies only against the root it was issued for.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Appends are serialized. Readers never block: they work off an immutable
 * {@linkplain LedgerState} snapshot which an append swaps in only after the
 * new tree is built and the attestation is stored.
 * </p>
 */
public class ZoneLedger implements AutoCloseable {

  private final static Logger log = ZoneConstants.getLogger();

  private final AttestationStore store;
  private final int parallelThreshold;
  private final ReentrantLock appendLock = new ReentrantLock();

  /** Append numbers, keyed by attestation ID. May run ahead of {@linkplain #state}. */
  private final Map<ByteBuffer, Long> appendNos = new ConcurrentHashMap<>();
  /** Versions, keyed by root. May run ahead of {@linkplain #state}. */
  private final Map<ByteBuffer, Long> versions = new ConcurrentHashMap<>();

  private volatile LedgerState state;


  /**
   * Creates an instance with the default parallel threshold.
   *
   * @see #ZoneLedger(AttestationStore, int)
   */
  public ZoneLedger(AttestationStore store) {
    this(store, MerkleTree.DEFAULT_PARALLEL_THRESHOLD);
  }


  /**
   * Creates an instance on the given store. If the store is not empty, the
   * ledger is rebuilt from its append log.
   *
   * @param store               the backing store
   * @param parallelThreshold   Merkle level width at which hashing goes parallel
   *
   * @throws HashConflictException if the store's append log is inconsistent
   * @throws UnreachableException  if the store is unavailable
   */
  public ZoneLedger(AttestationStore store, int parallelThreshold) {
    this.store = Objects.requireNonNull(store, "null store");
    this.parallelThreshold = parallelThreshold;

    var entries = store.entries();
    var loaded = LedgerState.replay(entries, parallelThreshold);
    for (var entry : entries) {
      appendNos.put(entry.attestationId(), entry.appendNo());
      versions.putIfAbsent(entry.root(), entry.appendNo());
    }
    versions.put(ZoneConstants.GLSR.slice(), 0L);
    this.state = loaded;
    if (loaded.version() > 0)
      log.log(Level.INFO, "loaded ledger " + loaded);
  }


  /**
   * Appends the given attestation.
   *
   * @return the new root, the attestation's leaf index, and its append number
   *
   * @throws DuplicateAttestationException if the attestation is already recorded;
   *         the ledger is unchanged
   * @throws InvalidInputException if the attestation's ID does not match its fields
   * @throws HashConflictException if another writer appended to the store;
   *         neither the store nor the ledger is changed
   * @throws UnreachableException  if the store fails; the ledger is unchanged
   */
  public AppendResult append(Attestation att)
      throws DuplicateAttestationException, InvalidInputException, HashConflictException,
          UnreachableException {

    Objects.requireNonNull(att, "null attestation");
    if (!Attestations.isIdConsistent(att))
      throw new InvalidInputException(
          "attestation_id does not match its fields: " + att.attestationIdHex());

    final ByteBuffer id = Hashes.checkHash(att.attestationId(), "attestation_id");

    appendLock.lock();
    try {
      if (store.contains(id) || appendNos.containsKey(id))
        throw new DuplicateAttestationException(id);

      var next = state.next(id, parallelThreshold);
      final long appendNo = next.version();
      ByteBuffer root = next.root();

      store.append(att, appendNo, root);

      appendNos.put(id, appendNo);
      versions.putIfAbsent(next.root(), appendNo);
      state = next;

      int index = next.tree().indexOf(id);
      log.log(Level.DEBUG, () -> "appended " + att.attestationIdHex() + " as [" + appendNo +
          "], index " + index + ", root " + Hashes.toHex(root));
      return new AppendResult(root, index, appendNo);

    } finally {
      appendLock.unlock();
    }
  }


  /** Returns the current state snapshot. */
  public LedgerState state() {
    return state;
  }


  /** Returns the current root. */
  public ByteBuffer root() {
    return state.root();
  }


  /** Returns the number of attestations in the ledger (its version). */
  public long size() {
    return state.version();
  }


  /**
   * Returns the attestation with the given ID, if it is in the ledger.
   */
  public Optional<Attestation> get(ByteBuffer attestationId) throws UnreachableException {
    if (appendNo(attestationId).isEmpty())
      return Optional.empty();
    return store.get(attestationId);
  }


  /**
   * Returns the append number of the given attestation, if it is in the
   * ledger. The attestation is included in every version &ge; this number.
   */
  public OptionalLong appendNo(ByteBuffer attestationId) {
    return appendNo(attestationId, state);
  }


  private OptionalLong appendNo(ByteBuffer attestationId, LedgerState snapshot) {
    if (attestationId == null || attestationId.remaining() != ZoneConstants.HASH_WIDTH)
      return OptionalLong.empty();
    Long no = appendNos.get(attestationId.slice());
    return no == null || no > snapshot.version() ? OptionalLong.empty() : OptionalLong.of(no);
  }


  /**
   * Returns the proof of the given attestation against the current root,
   * if it is in the ledger.
   */
  public Optional<MerkleProof> proofFor(ByteBuffer attestationId) {
    var snapshot = state;
    var tree = snapshot.tree();
    int index = tree.indexOf(attestationId);
    return index == -1 ? Optional.empty() : Optional.of(tree.proof(index));
  }


  /**
   * Returns the proof of the given attestation against the root at the given
   * version, if the attestation is included in that version.
   *
   * @param version &ge; 0 and &le; {@linkplain #size()}
   */
  public Optional<MerkleProof> proofFor(ByteBuffer attestationId, long version) {
    var snapshot = state;
    var no = appendNo(attestationId, snapshot);
    if (no.isEmpty() || no.getAsLong() > version)
      return Optional.empty();
    return Optional.of(snapshot.treeAt(version, parallelThreshold).proof(attestationId));
  }


  /**
   * Returns the root at the given version.
   *
   * @param version &ge; 0 and &le; {@linkplain #size()}
   */
  public ByteBuffer rootAt(long version) {
    return state.rootAt(version);
  }


  /**
   * Returns the version at which the ledger had the given root, if ever.
   * The empty root ({@linkplain ZoneConstants#GLSR}) is version zero.
   */
  public OptionalLong versionOf(ByteBuffer root) {
    if (root == null || root.remaining() != ZoneConstants.HASH_WIDTH)
      return OptionalLong.empty();
    var snapshot = state;
    Long ver = versions.get(root.slice());
    return ver == null || ver > snapshot.version() ? OptionalLong.empty() : OptionalLong.of(ver);
  }


  /** Closes the backing store. */
  @Override
  public void close() throws UnreachableException {
    store.close();
  }

}
