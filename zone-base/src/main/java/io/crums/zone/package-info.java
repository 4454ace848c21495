/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Top-level constants, exceptions and the {@linkplain io.crums.zone.Zone Zone}
 * facade for a zone's attestation ledger.
 * 
 * @see io.crums.zone.Zone Zone, the main entry point.
 */
package io.crums.zone;
