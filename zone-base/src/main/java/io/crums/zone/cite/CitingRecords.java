/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.cite;


import java.nio.ByteBuffer;
import java.util.Optional;

import io.crums.zone.anchor.Anchor;
import io.crums.zone.att.Attestation;

/**
 * The citing (local) side of a citation check.
 *
 * @see io.crums.zone.Zone
 */
public interface CitingRecords {

  /**
   * Returns the local attestation with the given ID, if any.
   */
  Optional<Attestation> attestation(ByteBuffer attestationId);

  /**
   * Returns the anchor of the given attestation's enclosing root: the earliest
   * anchored root that includes the attestation.
   */
  Optional<Anchor> enclosingAnchor(ByteBuffer attestationId);

}
