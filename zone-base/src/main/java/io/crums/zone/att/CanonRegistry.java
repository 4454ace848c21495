/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.att;


import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lookup for the canons a zone supports. No canon is assumed known in advance.
 */
@FunctionalInterface
public interface CanonRegistry {

  /** Accepts every canon. */
  public final static CanonRegistry OPEN = canonId -> true;


  /**
   * Determines whether the canon with the given ID is supported.
   */
  boolean supports(ByteBuffer canonId);


  /**
   * Returns a registry supporting only the given canon IDs.
   */
  public static CanonRegistry of(Collection<ByteBuffer> canonIds) {
    Set<ByteBuffer> ids = canonIds.stream()
        .map(id -> id.asReadOnlyBuffer().slice())
        .collect(Collectors.toUnmodifiableSet());
    return canonId -> canonId != null && ids.contains(canonId.slice());
  }

}
