/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import static io.crums.zone.HashesTest.randomHash;
import static io.crums.zone.HashesTest.randomHashes;
import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import io.crums.zone.NotFoundException;
import io.crums.zone.UnreachableException;
import io.crums.zone.anchor.Anchor;
import io.crums.zone.att.Attestation;
import io.crums.zone.att.AttestationBuilder;
import io.crums.zone.id.KeyAlgo;
import io.crums.zone.id.ZoneIdentity;
import io.crums.zone.mrkl.MerkleProof;
import io.crums.zone.mrkl.MerkleTree;


public class CitationVerifierTest {

  private final static URI REMOTE = URI.create("https://remote.example.com");
  private final static URI HANGING = URI.create("https://hanging.example.com");

  private final static long CITED_UTC = 1_700_000_000L;
  private final static long CITING_UTC = CITED_UTC + 3600;


  /**
   * A remote zone with one cited attestation (among others), and a
   * local zone with one attestation citing it.
   */
  static class Fixture implements CitingRecords {

    final Random random;
    final ZoneIdentity remoteId = ZoneIdentity.generate(KeyAlgo.SECP256K1);
    final ZoneIdentity localId = ZoneIdentity.generate(KeyAlgo.ED25519);

    final Attestation cited;
    final MerkleProof citedProof;
    final Anchor citedAnchor;

    final Attestation citing;
    Optional<Anchor> citingAnchor;

    Fixture(long seed) {
      this.random = new Random(seed);
      cited = AttestationBuilder.build(
          remoteId, null, randomHash(random), randomHash(random), null, List.of(), CITED_UTC - 60);
      var leaves = new ArrayList<>(randomHashes(6, random));
      leaves.add(cited.attestationId());
      var tree = new MerkleTree(leaves);
      citedProof = tree.proof(cited.attestationId());
      citedAnchor = new Anchor(tree.root(), "mock", CITED_UTC, Optional.of("ref-1"));

      citing = AttestationBuilder.build(
          localId, null, randomHash(random), randomHash(random), null,
          List.of(cited.attestationId()), CITING_UTC - 60);
      citingAnchor = Optional.of(
          new Anchor(MerkleTree.rootOf(List.of(citing.attestationId())), "mock", CITING_UTC));
    }

    RemoteRecord record() {
      return new RemoteRecord(
          cited, citedProof, Optional.of(citedAnchor), Optional.of(remoteId.key()));
    }

    @Override
    public Optional<Attestation> attestation(ByteBuffer attestationId) {
      return citing.attestationId().equals(attestationId) ?
          Optional.of(citing) : Optional.empty();
    }

    @Override
    public Optional<Anchor> enclosingAnchor(ByteBuffer attestationId) {
      return attestation(attestationId).isPresent() ? citingAnchor : Optional.empty();
    }
  }


  private CitationResult check(Fixture fixture, ZoneTransport transport) {
    try (var verifier = new CitationVerifier(fixture, transport, 1, Duration.ofSeconds(5))) {
      return verifier.check(fixture.citing.attestationId(), fixture.cited.attestationId(), REMOTE);
    }
  }


  @Test
  public void testValid() {
    var fixture = new Fixture(1L);
    assertEquals(CitationResult.VALID, check(fixture, (uri, id) -> fixture.record()));

    // the key need not be disclosed
    var keyless = new RemoteRecord(
        fixture.cited, fixture.citedProof, Optional.of(fixture.citedAnchor), Optional.empty());
    assertEquals(CitationResult.VALID, check(fixture, (uri, id) -> keyless));
  }


  @Test
  public void testVerify() {
    var fixture = new Fixture(2L);
    try (var verifier = new CitationVerifier(
        fixture, (uri, id) -> fixture.record(), 2, CitationVerifier.DEFAULT_TIMEOUT)) {
      assertTrue(verifier.verify(
          fixture.citing.attestationId(), fixture.cited.attestationId(), REMOTE));
      assertFalse(verifier.verify(
          randomHash(fixture.random), fixture.cited.attestationId(), REMOTE));
    }
  }


  @Test
  public void testCitingNotFound() {
    var fixture = new Fixture(3L);
    try (var verifier = new CitationVerifier(fixture, (uri, id) -> fixture.record(), 1, Duration.ofSeconds(5))) {
      assertEquals(
          CitationResult.CITING_NOT_FOUND,
          verifier.check(randomHash(fixture.random), fixture.cited.attestationId(), REMOTE));
    }
  }


  @Test
  public void testNotCited() {
    var fixture = new Fixture(4L);
    try (var verifier = new CitationVerifier(fixture, (uri, id) -> fixture.record(), 1, Duration.ofSeconds(5))) {
      assertEquals(
          CitationResult.NOT_CITED,
          verifier.check(fixture.citing.attestationId(), randomHash(fixture.random), REMOTE));
    }
  }


  @Test
  public void testCitedNotFound() {
    var fixture = new Fixture(5L);
    assertEquals(
        CitationResult.CITED_NOT_FOUND,
        check(fixture, (uri, id) -> { throw new NotFoundException("no such"); }));
  }


  @Test
  public void testUnreachable() {
    var fixture = new Fixture(6L);
    assertEquals(
        CitationResult.UNREACHABLE,
        check(fixture, (uri, id) -> { throw new UnreachableException("connection refused"); }));
  }


  @Test
  public void testError() {
    var fixture = new Fixture(7L);
    assertEquals(
        CitationResult.ERROR,
        check(fixture, (uri, id) -> { throw new IllegalStateException("bug"); }));
  }


  @Test
  public void testRecordMismatch() {
    var fixture = new Fixture(8L);
    var other = new Fixture(9L);
    assertEquals(CitationResult.RECORD_MISMATCH, check(fixture, (uri, id) -> other.record()));
  }


  @Test
  public void testBadProof() {
    var fixture = new Fixture(10L);
    var proof = fixture.citedProof;
    var badProof = new MerkleProof(
        proof.leafHash(), proof.leafIndex(), proof.siblings(), randomHash(fixture.random));
    var record = new RemoteRecord(
        fixture.cited, badProof, Optional.of(fixture.citedAnchor), Optional.empty());
    assertEquals(CitationResult.BAD_PROOF, check(fixture, (uri, id) -> record));
  }


  @Test
  public void testZoneMismatch() {
    var fixture = new Fixture(11L);
    var record = new RemoteRecord(
        fixture.cited, fixture.citedProof, Optional.of(fixture.citedAnchor),
        Optional.of(fixture.localId.key()));
    assertEquals(CitationResult.ZONE_MISMATCH, check(fixture, (uri, id) -> record));
  }


  @Test
  public void testBadSignature() {
    var fixture = new Fixture(12L);
    var att = fixture.cited;
    var forged = new Attestation(
        att.attestationId(), att.zoneId(), att.canonId(), att.claimHash(),
        randomHash(fixture.random), att.evidenceLocation(), att.citations(),
        att.timestamp(), att.signature());
    var record = new RemoteRecord(
        forged, fixture.citedProof, Optional.of(fixture.citedAnchor),
        Optional.of(fixture.remoteId.key()));
    assertEquals(CitationResult.BAD_SIGNATURE, check(fixture, (uri, id) -> record));
  }


  @Test
  public void testCitedUnanchored() {
    var fixture = new Fixture(13L);
    var record = new RemoteRecord(
        fixture.cited, fixture.citedProof, Optional.empty(), Optional.of(fixture.remoteId.key()));
    assertEquals(CitationResult.CITED_UNANCHORED, check(fixture, (uri, id) -> record));
  }


  @Test
  public void testAnchorMismatch() {
    var fixture = new Fixture(14L);
    var wrongAnchor = new Anchor(randomHash(fixture.random), "mock", CITED_UTC);
    var record = new RemoteRecord(
        fixture.cited, fixture.citedProof, Optional.of(wrongAnchor), Optional.empty());
    assertEquals(CitationResult.ANCHOR_MISMATCH, check(fixture, (uri, id) -> record));
  }


  @Test
  public void testCitingUnanchored() {
    var fixture = new Fixture(15L);
    fixture.citingAnchor = Optional.empty();
    assertEquals(CitationResult.CITING_UNANCHORED, check(fixture, (uri, id) -> fixture.record()));
  }


  @Test
  public void testNotBefore() {
    var fixture = new Fixture(16L);
    var citingRoot = fixture.citingAnchor.get().root();

    // same anchor time
    fixture.citingAnchor = Optional.of(new Anchor(citingRoot, "mock", CITED_UTC));
    assertEquals(CitationResult.NOT_BEFORE, check(fixture, (uri, id) -> fixture.record()));

    // citing anchored first
    fixture.citingAnchor = Optional.of(new Anchor(citingRoot, "mock", CITED_UTC - 1));
    assertEquals(CitationResult.NOT_BEFORE, check(fixture, (uri, id) -> fixture.record()));

    // self-reported timestamps play no part
    fixture.citingAnchor = Optional.of(new Anchor(citingRoot, "mock", CITED_UTC + 1));
    assertEquals(CitationResult.VALID, check(fixture, (uri, id) -> fixture.record()));
  }


  @Test
  public void testTimeout() throws Exception {
    var fixture = new Fixture(17L);
    var interrupted = new CountDownLatch(1);
    ZoneTransport hanging = (uri, id) -> {
      try {
        Thread.sleep(60_000);
      } catch (InterruptedException ix) {
        interrupted.countDown();
        throw new UnreachableException("interrupted");
      }
      return fixture.record();
    };
    try (var verifier = new CitationVerifier(fixture, hanging, 1, Duration.ofMillis(200))) {
      long start = System.currentTimeMillis();
      var result = verifier.check(
          fixture.citing.attestationId(), fixture.cited.attestationId(), REMOTE);
      long elapsed = System.currentTimeMillis() - start;
      assertEquals(CitationResult.TIMEOUT, result);
      assertTrue(elapsed < 10_000, "elapsed " + elapsed);
      // the hung task is cancelled
      assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }
  }


  @Test
  public void testCheckAllIsolation() {
    var fixture = new Fixture(18L);
    var second = new Fixture(19L);
    var unlocatable = randomHash(fixture.random);

    // the citing attestation cites 3: one valid, one hanging, one unlocatable
    var citing = AttestationBuilder.build(
        fixture.localId, null, randomHash(fixture.random), randomHash(fixture.random), null,
        List.of(fixture.cited.attestationId(), second.cited.attestationId(), unlocatable),
        CITING_UTC - 30);
    CitingRecords local = new CitingRecords() {
      @Override
      public Optional<Attestation> attestation(ByteBuffer id) {
        return citing.attestationId().equals(id) ? Optional.of(citing) : Optional.empty();
      }
      @Override
      public Optional<Anchor> enclosingAnchor(ByteBuffer id) {
        return Optional.of(
            new Anchor(MerkleTree.rootOf(List.of(citing.attestationId())), "mock", CITING_UTC));
      }
    };

    Map<ByteBuffer, URI> endpoints = new HashMap<>();
    endpoints.put(fixture.cited.attestationId(), REMOTE);
    endpoints.put(second.cited.attestationId(), HANGING);

    ZoneTransport transport = (uri, id) -> {
      if (uri.equals(HANGING)) {
        try {
          Thread.sleep(60_000);
        } catch (InterruptedException ix) {
          throw new UnreachableException("interrupted");
        }
      }
      return fixture.record();
    };

    try (var verifier = new CitationVerifier(local, transport, 4, Duration.ofMillis(300))) {
      var results = verifier.checkAll(citing.attestationId(), ZoneDirectory.of(endpoints));
      assertEquals(3, results.size());
      assertEquals(CitationResult.VALID, results.get(fixture.cited.attestationId()));
      assertEquals(CitationResult.TIMEOUT, results.get(second.cited.attestationId()));
      assertEquals(CitationResult.UNREACHABLE, results.get(unlocatable));
      // in canonical citation order
      assertEquals(citing.citations(), List.copyOf(results.keySet()));

      assertTrue(verifier.checkAll(randomHash(fixture.random), ZoneDirectory.of(endpoints)).isEmpty());
    }
  }


  @Test
  public void testAsyncNeverThrows() {
    var fixture = new Fixture(20L);
    var verifier = new CitationVerifier(fixture, (uri, id) -> fixture.record(), 1, Duration.ofSeconds(5));
    verifier.close();
    // rejected after close
    var result = verifier.checkAsync(
        fixture.citing.attestationId(), fixture.cited.attestationId(), REMOTE).join();
    assertEquals(CitationResult.ERROR, result);
  }

}
