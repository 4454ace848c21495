/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import java.net.URI;
import java.nio.ByteBuffer;

import io.crums.zone.NotFoundException;
import io.crums.zone.UnreachableException;

/**
 * Fetches attestation records from (typically remote) zones. Implementations
 * must distinguish "no such attestation" from "zone unreachable", and both from
 * a successful fetch (whose contents may yet fail verification).
 */
@FunctionalInterface
public interface ZoneTransport {

  /**
   * Fetches the record of the given attestation from the zone at the given
   * endpoint. Implementations should respond to thread interruption.
   *
   * @param endpoint        the zone's endpoint
   * @param attestationId   the attestation ID
   *
   * @throws NotFoundException    if the zone has no such attestation
   * @throws UnreachableException if the zone cannot be reached
   */
  RemoteRecord fetch(URI endpoint, ByteBuffer attestationId)
      throws NotFoundException, UnreachableException;

}
