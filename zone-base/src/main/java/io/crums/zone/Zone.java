/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import io.crums.util.TaskStack;
import io.crums.zone.anchor.Anchor;
import io.crums.zone.anchor.AnchorLog;
import io.crums.zone.att.Attestation;
import io.crums.zone.att.AttestationBuilder;
import io.crums.zone.att.CanonRegistry;
import io.crums.zone.cite.CitationResult;
import io.crums.zone.cite.CitationVerifier;
import io.crums.zone.cite.CitingRecords;
import io.crums.zone.cite.RemoteRecord;
import io.crums.zone.cite.ZoneDirectory;
import io.crums.zone.cite.ZoneTransport;
import io.crums.zone.config.ZoneConfig;
import io.crums.zone.id.ZoneIdentity;
import io.crums.zone.ledger.AttestationStore;
import io.crums.zone.ledger.ZoneLedger;
import io.crums.zone.mrkl.MerkleProof;

/**
 * A zone: its identity, its ledger, its anchors, and a citation verifier.
 * This is the surface an HTTP or CLI layer calls.
 *
 * <h2>Enclosing Anchors</h2>
 * <p>
 * An attestation's <em>enclosing anchored root</em> is the root of the
 * earliest ledger version that both includes the attestation and has been
 * anchored. Records served to other zones carry a proof against that root
 * (when there is one), so that remote verifiers can order citations by
 * anchor time.
 * </p>
 * <p>
 * Instances are safe for concurrent use.
 * </p>
 */
public class Zone implements CitingRecords, AutoCloseable {

  private final static Logger log = ZoneConstants.getLogger();


  /**
   * Opens a zone per the given configuration. The zone's identity is loaded
   * (or generated) per the configuration.
   *
   * @param config      configuration
   * @param store       attestation store (may already hold records)
   * @param anchors     anchor log
   * @param transport   fetches records from other zones
   */
  public static Zone open(
      ZoneConfig config, AttestationStore store, AnchorLog anchors, ZoneTransport transport) {
    return new Zone(
        config, config.loadIdentity(), store, anchors, transport,
        CanonRegistry.OPEN, Clock.systemUTC());
  }



  private final ZoneInfo info;
  private final ZoneIdentity identity;
  private final ZoneLedger ledger;
  private final AnchorLog anchors;
  private final CitationVerifier verifier;
  private final CanonRegistry canons;
  private final Clock clock;


  /**
   * Full constructor.
   *
   * @param config      configuration (name, description, concurrency settings)
   * @param identity    signing identity
   * @param store       attestation store (may already hold records)
   * @param anchors     anchor log
   * @param transport   fetches records from other zones
   * @param canons      supported canons
   * @param clock       attestation timestamp source
   */
  public Zone(
      ZoneConfig config,
      ZoneIdentity identity,
      AttestationStore store,
      AnchorLog anchors,
      ZoneTransport transport,
      CanonRegistry canons,
      Clock clock) {

    this.identity = Objects.requireNonNull(identity, "null identity");
    this.info = new ZoneInfo(config.name(), config.description(), identity.key());
    this.ledger = new ZoneLedger(store, config.parallelThreshold());
    this.anchors = Objects.requireNonNull(anchors, "null anchors");
    this.canons = Objects.requireNonNull(canons, "null canons");
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.verifier = new CitationVerifier(
        this, transport, config.citationThreads(), config.citationTimeout());

    log.log(Level.INFO, "zone '" + info.name() + "' open: " + Hashes.toHex(info.zoneId()));
  }


  /** Returns the zone's self-description. */
  public ZoneInfo zoneInfo() {
    return info;
  }


  /** Returns the zone ID. */
  public ByteBuffer zoneId() {
    return info.zoneId();
  }


  /** Returns the ledger. */
  public ZoneLedger ledger() {
    return ledger;
  }


  /** Returns the anchor log. */
  public AnchorLog anchors() {
    return anchors;
  }


  /**
   * Builds, signs, and appends a new attestation, timestamped now.
   *
   * @param canonId           canon ID ({@code null} for the default canon)
   * @param claimHash         32-byte claim hash
   * @param evidenceHash      32-byte evidence hash
   * @param evidenceLocation  optional evidence URI (may be {@code null})
   * @param citations         cited attestation IDs (may be empty)
   *
   * @return the appended attestation
   *
   * @throws InvalidInputException on malformed input, or an unsupported canon
   * @throws DuplicateAttestationException if an identical attestation
   *         (same canon, claim, and second) is already recorded
   * @throws UnreachableException if the store fails
   */
  public Attestation submit(
      ByteBuffer canonId,
      ByteBuffer claimHash,
      ByteBuffer evidenceHash,
      String evidenceLocation,
      Collection<ByteBuffer> citations)
          throws InvalidInputException, DuplicateAttestationException, UnreachableException {

    if (canonId != null && !canons.supports(canonId))
      throw new InvalidInputException("unsupported canon: " + Hashes.toHex(canonId));

    long now = clock.instant().getEpochSecond();
    var att = AttestationBuilder.build(
        identity, canonId, claimHash, evidenceHash, evidenceLocation,
        citations == null ? List.of() : citations, now);
    ledger.append(att);
    return att;
  }


  /**
   * Returns the attestation with the given ID, its proof, and (if the
   * attestation is enclosed by an anchored root) that anchor. If anchored, the
   * proof is against the enclosing anchored root; otherwise, the current root.
   * The zone's public key is included.
   */
  public Optional<RemoteRecord> getAttestation(ByteBuffer attestationId) {
    var att = ledger.get(attestationId);
    if (att.isEmpty())
      return Optional.empty();

    var enclosing = enclosingVersion(attestationId);
    Optional<MerkleProof> proof;
    Optional<Anchor> anchor;
    if (enclosing.isPresent()) {
      var found = enclosing.get();
      proof = ledger.proofFor(attestationId, found.version());
      anchor = Optional.of(found.anchor());
    } else {
      proof = ledger.proofFor(attestationId);
      anchor = Optional.empty();
    }
    // the snapshot may have moved on between the calls, but never backward
    return proof.map(p -> new RemoteRecord(att.get(), p, anchor, Optional.of(identity.key())));
  }


  /**
   * Returns the attestation with the given ID, if in the ledger.
   */
  @Override
  public Optional<Attestation> attestation(ByteBuffer attestationId) {
    return ledger.get(attestationId);
  }


  /**
   * Returns the current root, attestation count, and latest anchor.
   */
  public RootInfo currentRoot() {
    var state = ledger.state();
    return new RootInfo(state.root(), state.version(), anchors.latest());
  }


  /**
   * Records an anchor for one of this ledger's roots (current or past).
   *
   * @throws InvalidInputException if the anchor's root was never this ledger's
   */
  public void recordAnchor(Anchor anchor) throws InvalidInputException, UnreachableException {
    var version = ledger.versionOf(anchor.root());
    if (version.isEmpty())
      throw new InvalidInputException(
          "not a root of this ledger: " + Hashes.toHex(anchor.root()));
    anchors.record(anchor);
    log.log(Level.INFO, "anchored version " + version.getAsLong() + " via " + anchor);
  }


  /**
   * Anchors the current root. Convenience for {@linkplain #recordAnchor(Anchor)}.
   *
   * @param type        anchor mechanism
   * @param utc         external timestamp (Unix seconds)
   * @param reference   mechanism-specific reference (may be {@code null})
   *
   * @return the recorded anchor
   */
  public Anchor anchorCurrentRoot(String type, long utc, String reference) {
    var anchor = new Anchor(ledger.root(), type, utc, Optional.ofNullable(reference));
    recordAnchor(anchor);
    return anchor;
  }


  @Override
  public Optional<Anchor> enclosingAnchor(ByteBuffer attestationId) {
    return enclosingVersion(attestationId).map(AnchoredVersion::anchor);
  }


  private record AnchoredVersion(long version, Anchor anchor) {  }


  private Optional<AnchoredVersion> enclosingVersion(ByteBuffer attestationId) {
    var appendNo = ledger.appendNo(attestationId);
    if (appendNo.isEmpty())
      return Optional.empty();
    final long minVersion = appendNo.getAsLong();
    return anchors.list().stream()
        .flatMap(a -> {
          var ver = ledger.versionOf(a.root());
          return ver.isPresent() && ver.getAsLong() >= minVersion ?
              Stream.of(new AnchoredVersion(ver.getAsLong(), a)) :
              Stream.empty();
        })
        .min(Comparator.comparingLong(AnchoredVersion::version)
            .thenComparingLong(av -> av.anchor().utc()));
  }


  /**
   * Checks the citation from a local attestation to one at another zone.
   *
   * @see CitationVerifier#check(ByteBuffer, ByteBuffer, URI)
   */
  public CitationResult checkCitation(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {
    return verifier.check(citingId, citedId, endpoint);
  }


  /**
   * Verifies the citation from a local attestation to one at another zone.
   *
   * @return {@code true} iff the citation checks {@linkplain CitationResult#VALID valid}
   */
  public boolean verifyCitation(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {
    return checkCitation(citingId, citedId, endpoint).isValid();
  }


  /**
   * Checks every citation of the given local attestation, concurrently.
   *
   * @see CitationVerifier#checkAll(ByteBuffer, ZoneDirectory)
   */
  public Map<ByteBuffer, CitationResult> verifyCitations(
      ByteBuffer citingId, ZoneDirectory directory) {
    return verifier.checkAll(citingId, directory);
  }


  /**
   * Closes the citation verifier, the ledger (and its store), and the anchor log.
   */
  @Override
  public void close() {
    try (var closer = new TaskStack()) {
      closer.pushClose(anchors);
      closer.pushClose(ledger);
      closer.pushClose(verifier);
    }
  }

}
