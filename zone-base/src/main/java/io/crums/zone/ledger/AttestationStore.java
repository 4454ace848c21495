/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

import io.crums.zone.HashConflictException;
import io.crums.zone.UnreachableException;
import io.crums.zone.att.Attestation;

/**
 * Durable storage for a ledger's attestations and its append log. The
 * ledger treats the store as authoritative on whether an attestation
 * already exists.
 *
 * <h2>Concurrency</h2>
 * <p>
 * The {@linkplain ZoneLedger} serializes calls to {@linkplain #append(Attestation, long, ByteBuffer)};
 * the read methods may be invoked concurrently with each other and with
 * an append.
 * </p>
 * <p>
 * Implementations signal an unavailable backend with
 * {@linkplain UnreachableException}.
 * </p>
 *
 * @see InMemoryAttestationStore
 */
public interface AttestationStore extends AutoCloseable {

  /**
   * Returns the number of attestations appended.
   */
  long size() throws UnreachableException;


  /**
   * Determines whether an attestation with the given ID is stored.
   */
  boolean contains(ByteBuffer attestationId) throws UnreachableException;


  /**
   * Returns the attestation with the given ID, if stored.
   */
  Optional<Attestation> get(ByteBuffer attestationId) throws UnreachableException;


  /**
   * Appends the given attestation under the given append number, together
   * with the ledger root it yields. Atomic: on failure, nothing is written.
   *
   * @param att       not already stored
   * @param appendNo  the store's next append number ({@linkplain #size()} + 1)
   * @param root      the ledger root after the append
   *
   * @throws HashConflictException if {@code appendNo} is not the next append
   *         number (another writer appended first)
   */
  void append(Attestation att, long appendNo, ByteBuffer root)
      throws UnreachableException, HashConflictException;


  /**
   * Returns the append log, in append order.
   */
  List<LedgerEntry> entries() throws UnreachableException;


  /**
   * Releases resources. Does nothing, by default.
   */
  @Override
  default void close() throws UnreachableException {  }

}
