/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.crums.zone.Hashes;
import io.crums.zone.NotFoundException;
import io.crums.zone.UnreachableException;
import io.crums.zone.ZoneConstants;
import io.crums.zone.att.Attestations;

/**
 * Verifies citations across zones. A citation from a local (citing)
 * attestation to a remote (cited) one is valid only if the cited record's
 * proof verifies and the cited root's anchor is <em>strictly earlier</em> than
 * the anchor of the citing attestation's enclosing root. The attestations'
 * own timestamps are self-reported, and play no part.
 *
 * <h2>Check sequence</h2>
 * <ol>
 * <li>The citing attestation is found locally and cites the cited ID.</li>
 * <li>The cited record is fetched from the remote zone.</li>
 * <li>The record is about the cited ID, and its Merkle proof verifies.</li>
 * <li>If the remote zone disclosed its key, the cited attestation's zone ID
 * derives from it and its signature verifies.</li>
 * <li>The cited record carries an anchor binding the proof's root.</li>
 * <li>The citing attestation's enclosing root is anchored.</li>
 * <li>The cited anchor's timestamp is strictly less than the citing anchor's.</li>
 * </ol>
 * <p>
 * The first failing step determines the (invalid) {@linkplain CitationResult result}.
 * </p>
 * <h2>Concurrency</h2>
 * <p>
 * Checks run off the caller's thread, on this instance's executor, each with
 * its own timeout. A check that times out yields {@linkplain CitationResult#TIMEOUT}
 * (and its task is interrupted); no other check is affected. Checks never
 * throw.
 * </p>
 */
public class CitationVerifier implements AutoCloseable {

  private final static Logger log = ZoneConstants.getLogger();

  /** Default per-check timeout (10 seconds). */
  public final static Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);


  private final CitingRecords local;
  private final ZoneTransport transport;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final long timeoutMillis;


  /**
   * Creates an instance with its own fixed thread pool.
   *
   * @param local     citing-side records
   * @param transport fetches cited records
   * @param threads   number of threads in the pool (&ge; 1)
   * @param timeout   per-check timeout
   */
  public CitationVerifier(
      CitingRecords local, ZoneTransport transport, int threads, Duration timeout) {
    this(local, transport, newPool(threads), true, timeout);
  }


  /**
   * Creates an instance using the given executor. The executor is not shut down on
   * {@linkplain #close()}.
   */
  public CitationVerifier(
      CitingRecords local, ZoneTransport transport, ExecutorService executor, Duration timeout) {
    this(local, transport, executor, false, timeout);
  }


  private CitationVerifier(
      CitingRecords local, ZoneTransport transport, ExecutorService executor,
      boolean ownsExecutor, Duration timeout) {
    this.local = Objects.requireNonNull(local, "null local");
    this.transport = Objects.requireNonNull(transport, "null transport");
    this.executor = Objects.requireNonNull(executor, "null executor");
    this.ownsExecutor = ownsExecutor;
    this.timeoutMillis = timeout.toMillis();
    if (timeoutMillis <= 0)
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
  }


  private static ExecutorService newPool(int threads) {
    if (threads < 1)
      throw new IllegalArgumentException("threads " + threads + " < 1");
    var count = new AtomicInteger();
    ThreadFactory factory = r -> {
      var thread = new Thread(r, "zone-cite-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(threads, factory);
  }


  /** Returns the per-check timeout. */
  public Duration timeout() {
    return Duration.ofMillis(timeoutMillis);
  }


  /**
   * Checks the citation and returns the result. Blocks at most (about) the
   * {@linkplain #timeout() timeout}.
   *
   * @param citingId  local attestation ID
   * @param citedId   remote attestation ID
   * @param endpoint  the cited zone's endpoint
   */
  public CitationResult check(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {
    return checkAsync(citingId, citedId, endpoint).join();
  }


  /**
   * Returns {@code true} iff the citation {@linkplain #check(ByteBuffer, ByteBuffer, URI) checks}
   * {@linkplain CitationResult#VALID valid}.
   */
  public boolean verify(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {
    return check(citingId, citedId, endpoint).isValid();
  }


  /**
   * Checks the citation asynchronously. The returned future always completes
   * normally, with {@linkplain CitationResult#TIMEOUT} if the check does not
   * finish in time.
   *
   * @throws NullPointerException if an argument is {@code null}
   */
  public CompletableFuture<CitationResult> checkAsync(
      ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {

    Objects.requireNonNull(citingId, "null citingId");
    Objects.requireNonNull(citedId, "null citedId");
    Objects.requireNonNull(endpoint, "null endpoint");

    var result = new CompletableFuture<CitationResult>();
    try {
      var task = executor.submit(() -> result.complete(evaluate(citingId, citedId, endpoint)));
      result.whenComplete((r, x) -> task.cancel(true));
    } catch (RejectedExecutionException rx) {
      log.log(Level.ERROR, "citation check rejected: " + rx.getMessage());
      result.complete(CitationResult.ERROR);
      return result;
    }
    return result
        .completeOnTimeout(CitationResult.TIMEOUT, timeoutMillis, TimeUnit.MILLISECONDS)
        .thenApply(r -> logged(r, citingId, citedId));
  }


  /**
   * Checks every citation of the given local attestation concurrently. Each check
   * is isolated: one failing (or hanging) does not affect the others. Citations
   * whose zone the directory cannot locate are {@linkplain CitationResult#UNREACHABLE}.
   *
   * @param citingId    local attestation ID
   * @param directory   locates cited zones
   *
   * @return ordered map of citation ID to result (empty if the citing
   *         attestation is not found or has no citations)
   */
  public Map<ByteBuffer, CitationResult> checkAll(ByteBuffer citingId, ZoneDirectory directory) {
    var citing = local.attestation(citingId);
    if (citing.isEmpty())
      return Map.of();

    var futures = new LinkedHashMap<ByteBuffer, CompletableFuture<CitationResult>>();
    for (var citedId : citing.get().citations()) {
      var endpoint = directory.locate(citedId);
      futures.put(
          citedId,
          endpoint.isPresent() ?
              checkAsync(citingId, citedId, endpoint.get()) :
              CompletableFuture.completedFuture(
                  logged(CitationResult.UNREACHABLE, citingId, citedId)));
    }
    var results = new LinkedHashMap<ByteBuffer, CitationResult>();
    futures.forEach((id, future) -> results.put(id, future.join()));
    return results;
  }


  /**
   * Runs the check sequence on the current thread. Never throws.
   */
  CitationResult evaluate(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {
    try {
      return evaluateImpl(citingId, citedId, endpoint);
    } catch (RuntimeException rx) {
      log.log(Level.ERROR, "unexpected error checking citation " + Hashes.toHex(citedId) +
          ": " + rx, rx);
      return CitationResult.ERROR;
    }
  }


  private CitationResult evaluateImpl(ByteBuffer citingId, ByteBuffer citedId, URI endpoint) {

    var citing = local.attestation(citingId);
    if (citing.isEmpty())
      return CitationResult.CITING_NOT_FOUND;
    if (!citing.get().cites(citedId))
      return CitationResult.NOT_CITED;

    RemoteRecord record;
    try {
      record = transport.fetch(endpoint, citedId.slice());
    } catch (NotFoundException nfx) {
      return CitationResult.CITED_NOT_FOUND;
    } catch (UnreachableException ux) {
      log.log(Level.DEBUG, () -> "zone at " + endpoint + " unreachable: " + ux.getMessage());
      return CitationResult.UNREACHABLE;
    }

    var cited = record.attestation();
    var proof = record.proof();
    if (!cited.attestationId().equals(citedId.slice()) ||
        !proof.leafHash().equals(citedId.slice()))
      return CitationResult.RECORD_MISMATCH;
    if (!proof.verify())
      return CitationResult.BAD_PROOF;

    if (record.zoneKey().isPresent()) {
      var key = record.zoneKey().get();
      if (!key.bindsTo(cited.zoneId()))
        return CitationResult.ZONE_MISMATCH;
      if (!Attestations.verifySignature(cited, key))
        return CitationResult.BAD_SIGNATURE;
    }

    if (record.anchor().isEmpty())
      return CitationResult.CITED_UNANCHORED;
    var citedAnchor = record.anchor().get();
    if (!citedAnchor.anchors(proof.root()))
      return CitationResult.ANCHOR_MISMATCH;

    var citingAnchor = local.enclosingAnchor(citingId);
    if (citingAnchor.isEmpty())
      return CitationResult.CITING_UNANCHORED;

    return citedAnchor.precedes(citingAnchor.get()) ?
        CitationResult.VALID : CitationResult.NOT_BEFORE;
  }


  private CitationResult logged(CitationResult result, ByteBuffer citingId, ByteBuffer citedId) {
    if (result.isValid())
      log.log(Level.DEBUG, () -> "citation " + Hashes.toHex(citingId) + " -> " +
          Hashes.toHex(citedId) + " valid");
    else
      log.log(Level.WARNING, "citation " + Hashes.toHex(citingId) + " -> " +
          Hashes.toHex(citedId) + " invalid: " + result.description());
    return result;
  }


  /**
   * Shuts down the executor, if this instance created it.
   */
  @Override
  public void close() {
    if (ownsExecutor)
      executor.shutdownNow();
  }

}
