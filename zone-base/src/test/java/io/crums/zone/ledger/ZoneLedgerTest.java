/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.ledger;


import static io.crums.zone.HashesTest.randomHash;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import io.crums.zone.DuplicateAttestationException;
import io.crums.zone.HashConflictException;
import io.crums.zone.InvalidInputException;
import io.crums.zone.UnreachableException;
import io.crums.zone.ZoneConstants;
import io.crums.zone.att.Attestation;
import io.crums.zone.att.AttestationBuilder;
import io.crums.zone.id.KeyAlgo;
import io.crums.zone.id.ZoneIdentity;
import io.crums.zone.mrkl.MerkleTree;


public class ZoneLedgerTest {

  final static ZoneIdentity IDENTITY = ZoneIdentity.generate(KeyAlgo.ED25519);


  /** Returns a new, signed attestation with random claim and evidence. */
  public static Attestation newAttestation(ZoneIdentity identity, Random random, long utc) {
    return AttestationBuilder.build(
        identity, null, randomHash(random), randomHash(random), null, List.of(), utc);
  }


  /** Returns {@code count} new attestations. */
  public static List<Attestation> newAttestations(int count, Random random) {
    var atts = new ArrayList<Attestation>(count);
    for (int index = 0; index < count; ++index)
      atts.add(newAttestation(IDENTITY, random, 1_700_000_000L + index));
    return atts;
  }


  /**
   * Returns a new, empty instance. Subclasses override this to test
   * other stores.
   */
  protected AttestationStore newStore(Object methodLabel) throws Exception {
    return new InMemoryAttestationStore();
  }


  @Test
  public void testEmpty() throws Exception {
    final Object label = new Object() {  };
    try (var ledger = new ZoneLedger(newStore(label))) {
      assertEquals(0, ledger.size());
      assertEquals(ZoneConstants.GLSR, ledger.root());
      assertEquals(ZoneConstants.GLSR, ledger.rootAt(0));
      assertEquals(0L, ledger.versionOf(ZoneConstants.GLSR).getAsLong());
      assertTrue(ledger.get(randomHash(new Random(1))).isEmpty());
      assertTrue(ledger.proofFor(randomHash(new Random(1))).isEmpty());
    }
  }


  @Test
  public void testAppend() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(2);
    var atts = newAttestations(9, random);
    try (var ledger = new ZoneLedger(newStore(label))) {
      var ids = new ArrayList<ByteBuffer>();
      for (var att : atts) {
        var result = ledger.append(att);
        ids.add(att.attestationId());
        assertEquals(ids.size(), result.appendNo());
        assertEquals(MerkleTree.rootOf(ids), result.root());
        assertEquals(result.root(), ledger.root());
        assertEquals(ledger.state().tree().indexOf(att.attestationId()), result.index());
      }
      assertEquals(atts.size(), ledger.size());

      for (var att : atts) {
        assertEquals(att, ledger.get(att.attestationId()).get());
        var proof = ledger.proofFor(att.attestationId()).get();
        assertEquals(att.attestationId(), proof.leafHash());
        assertTrue(proof.verify(ledger.root()));
      }
    }
  }


  @Test
  public void testDuplicate() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(3);
    var atts = newAttestations(3, random);
    try (var ledger = new ZoneLedger(newStore(label))) {
      atts.forEach(ledger::append);
      var root = ledger.root();
      var dup = assertThrows(DuplicateAttestationException.class, () -> ledger.append(atts.get(1)));
      assertEquals(atts.get(1).attestationId(), dup.attestationId());
      assertEquals(root, ledger.root());
      assertEquals(3, ledger.size());
    }
  }


  @Test
  public void testInconsistentId() throws Exception {
    final Object label = new Object() {  };
    var att = newAttestation(IDENTITY, new Random(4), 100);
    var forged = new Attestation(
        att.attestationId(), att.zoneId(), att.canonId(), att.claimHash(),
        att.evidenceHash(), att.evidenceLocation(), att.citations(),
        att.timestamp() + 1, att.signature());
    try (var ledger = new ZoneLedger(newStore(label))) {
      assertThrows(InvalidInputException.class, () -> ledger.append(forged));
      assertEquals(0, ledger.size());
    }
  }


  @Test
  public void testHistory() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(5);
    var atts = newAttestations(12, random);
    try (var ledger = new ZoneLedger(newStore(label))) {
      var roots = new ArrayList<ByteBuffer>();
      roots.add(ledger.root());
      for (var att : atts)
        roots.add(ledger.append(att).root());

      for (int ver = 0; ver < roots.size(); ++ver) {
        assertEquals(roots.get(ver), ledger.rootAt(ver));
        assertEquals(ver, ledger.versionOf(roots.get(ver)).getAsLong());
      }
      assertThrows(IndexOutOfBoundsException.class, () -> ledger.rootAt(13));
      assertTrue(ledger.versionOf(randomHash(random)).isEmpty());

      // the 5th attestation is in every version >= 5
      var id = atts.get(4).attestationId();
      assertEquals(5L, ledger.appendNo(id).getAsLong());
      assertTrue(ledger.proofFor(id, 4).isEmpty());
      for (int ver = 5; ver <= atts.size(); ++ver) {
        var proof = ledger.proofFor(id, ver).get();
        assertEquals(roots.get(ver), proof.root());
        assertTrue(proof.verify(ledger.rootAt(ver)));
      }
    }
  }


  @Test
  public void testRebuild() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(6);
    var atts = newAttestations(17, random);
    var store = newStore(label);
    var ledger = new ZoneLedger(store);
    atts.forEach(ledger::append);
    var root = ledger.root();
    var root9 = ledger.rootAt(9);

    // same store, new ledger
    var rebuilt = new ZoneLedger(store);
    assertEquals(root, rebuilt.root());
    assertEquals(root9, rebuilt.rootAt(9));
    assertEquals(atts.size(), rebuilt.size());
    var id = atts.get(3).attestationId();
    assertEquals(4L, rebuilt.appendNo(id).getAsLong());
    assertTrue(rebuilt.proofFor(id).get().verify(root));
    assertThrows(DuplicateAttestationException.class, () -> rebuilt.append(atts.get(0)));
    rebuilt.close();
  }


  @Test
  public void testReplayConflict() {
    var random = new Random(7);
    var atts = newAttestations(3, random);
    var entries = new ArrayList<LedgerEntry>();
    var ids = new ArrayList<ByteBuffer>();
    for (var att : atts) {
      ids.add(att.attestationId());
      entries.add(new LedgerEntry(ids.size(), att.attestationId(), MerkleTree.rootOf(ids)));
    }
    assertEquals(MerkleTree.rootOf(ids), LedgerState.replay(entries, 2).root());

    // bad last root
    var tampered = new ArrayList<>(entries);
    tampered.set(2, new LedgerEntry(3, ids.get(2), randomHash(random)));
    assertThrows(HashConflictException.class, () -> LedgerState.replay(tampered, 2));

    // out of sequence
    var gapped = List.of(entries.get(0), entries.get(2));
    assertThrows(HashConflictException.class, () -> LedgerState.replay(gapped, 2));
  }


  /**
   * A ledger that falls behind its store (another writer appended) fails
   * the append without writing to the store.
   */
  @Test
  public void testStaleLedger() throws Exception {
    var random = new Random(13);
    var atts = newAttestations(3, random);
    var store = new InMemoryAttestationStore();
    var first = new ZoneLedger(store);
    var second = new ZoneLedger(store);

    first.append(atts.get(0));
    assertThrows(HashConflictException.class, () -> second.append(atts.get(1)));
    assertEquals(0, second.size());
    assertEquals(1, store.size());
    assertFalse(store.contains(atts.get(1).attestationId()));
    assertThrows(
        HashConflictException.class,
        () -> store.append(atts.get(1), 3, randomHash(random)));

    var reopened = new ZoneLedger(store);
    assertEquals(first.root(), reopened.root());
    assertEquals(2, reopened.append(atts.get(1)).appendNo());
    assertEquals(2, store.entries().size());
  }


  /**
   * Relative reads of the buffers handed out by the ledger and its
   * records don't disturb lookups.
   */
  @Test
  public void testRelativeReads() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(14);
    var atts = newAttestations(5, random);
    try (var ledger = new ZoneLedger(newStore(label))) {
      var results = new ArrayList<AppendResult>();
      for (var att : atts)
        results.add(ledger.append(att));

      var att = atts.get(2);
      byte[] sink = new byte[ZoneConstants.HASH_WIDTH];
      att.attestationId().get(sink);
      results.get(4).root().get(sink);
      ledger.root().get(sink);
      ledger.state().appendLog().get(2).get(sink);

      assertEquals(3L, ledger.appendNo(att.attestationId()).getAsLong());
      assertEquals(att, ledger.get(att.attestationId()).get());
      assertEquals(5L, ledger.versionOf(results.get(4).root()).getAsLong());
      assertEquals(results.get(4).root(), ledger.root());
      assertTrue(ledger.proofFor(att.attestationId()).get().verify(ledger.root()));
    }
  }


  @Test
  public void testStoreFailure() throws Exception {
    var random = new Random(8);
    var atts = newAttestations(3, random);
    var failing = new AtomicBoolean();
    var store = new InMemoryAttestationStore() {
      @Override
      public void append(Attestation att, long appendNo, ByteBuffer root) {
        if (failing.get())
          throw new UnreachableException("mock outage");
        super.append(att, appendNo, root);
      }
    };
    try (var ledger = new ZoneLedger(store)) {
      ledger.append(atts.get(0));
      var root = ledger.root();
      failing.set(true);
      assertThrows(UnreachableException.class, () -> ledger.append(atts.get(1)));
      assertEquals(root, ledger.root());
      assertEquals(1, ledger.size());
      assertTrue(ledger.get(atts.get(1).attestationId()).isEmpty());

      failing.set(false);
      assertEquals(2, ledger.append(atts.get(2)).appendNo());
      assertEquals(MerkleTree.rootOf(
          List.of(atts.get(0).attestationId(), atts.get(2).attestationId())), ledger.root());
    }
  }


  @Test
  public void testConcurrent() throws Exception {
    final Object label = new Object() {  };
    final int writers = 4;
    final int perWriter = 50;
    var random = new Random(9);
    var atts = newAttestations(writers * perWriter, random);

    ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
    try (var ledger = new ZoneLedger(newStore(label), 8)) {
      var start = new CountDownLatch(1);
      var done = new AtomicBoolean();
      var futures = new ArrayList<Future<?>>();
      for (int w = 0; w < writers; ++w) {
        final var batch = atts.subList(w * perWriter, (w + 1) * perWriter);
        futures.add(pool.submit(() -> {
          start.await();
          batch.forEach(ledger::append);
          return null;
        }));
      }
      // readers: every snapshot is self-consistent
      var readerErrors = new ArrayList<Future<Integer>>();
      for (int r = 0; r < 2; ++r) {
        readerErrors.add(pool.submit(() -> {
          start.await();
          int bad = 0;
          while (!done.get()) {
            var snapshot = ledger.state();
            if (snapshot.version() == 0)
              continue;
            var id = snapshot.idAt(snapshot.version());
            var proof = snapshot.tree().proof(id);
            if (!proof.verify(snapshot.root()) ||
                !snapshot.root().equals(snapshot.rootAt(snapshot.version())))
              ++bad;
          }
          return bad;
        }));
      }
      start.countDown();
      for (var future : futures)
        future.get(30, TimeUnit.SECONDS);
      done.set(true);
      for (var future : readerErrors)
        assertEquals(0, future.get(30, TimeUnit.SECONDS));

      assertEquals(atts.size(), ledger.size());
      var ids = atts.stream().map(Attestation::attestationId).toList();
      assertEquals(MerkleTree.rootOf(ids), ledger.root());
      for (var att : atts)
        assertTrue(ledger.proofFor(att.attestationId()).get().verify(ledger.root()));
    } finally {
      pool.shutdownNow();
    }
  }

}
