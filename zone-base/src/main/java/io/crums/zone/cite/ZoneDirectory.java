/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Optional;

/**
 * Locates the zone endpoint serving a given attestation. Discovery
 * (DNS, federation directories..) happens behind this interface; no zone is
 * assumed known in advance.
 */
@FunctionalInterface
public interface ZoneDirectory {

  /**
   * Returns the endpoint of the zone serving the given attestation, if known.
   */
  Optional<URI> locate(ByteBuffer attestationId);


  /**
   * Returns a directory backed by the given map (attestation ID to endpoint).
   * The map is not copied.
   */
  public static ZoneDirectory of(Map<ByteBuffer, URI> endpoints) {
    return id -> Optional.ofNullable(endpoints.get(id.slice()));
  }

}
