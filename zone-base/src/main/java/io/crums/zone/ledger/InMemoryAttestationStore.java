/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.crums.zone.DuplicateAttestationException;
import io.crums.zone.HashConflictException;
import io.crums.zone.Hashes;
import io.crums.zone.att.Attestation;

/**
 * Volatile, in-memory store. For tests, demos, and zones whose records are
 * persisted elsewhere.
 */
public class InMemoryAttestationStore implements AttestationStore {

  private final Map<ByteBuffer, Attestation> byId = new ConcurrentHashMap<>();
  private final List<LedgerEntry> log = new ArrayList<>();


  @Override
  public long size() {
    synchronized (log) {
      return log.size();
    }
  }

  @Override
  public boolean contains(ByteBuffer attestationId) {
    return byId.containsKey(attestationId.slice());
  }

  @Override
  public Optional<Attestation> get(ByteBuffer attestationId) {
    return Optional.ofNullable(byId.get(attestationId.slice()));
  }

  @Override
  public void append(Attestation att, long appendNo, ByteBuffer root) {
    var id = Hashes.checkHash(att.attestationId(), "attestation_id");
    synchronized (log) {
      if (byId.containsKey(id))
        throw new DuplicateAttestationException(id);
      if (appendNo != log.size() + 1)
        throw new HashConflictException(
            "append no. " + appendNo + " out of sequence; next is " + (log.size() + 1));
      log.add(new LedgerEntry(appendNo, id, root));
      byId.put(id, att);
    }
  }

  @Override
  public List<LedgerEntry> entries() {
    synchronized (log) {
      return List.copyOf(log);
    }
  }

}
