/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


import java.nio.ByteBuffer;
import java.util.Objects;

import io.crums.zone.id.ZoneKey;

/**
 * A zone's self-description.
 *
 * @param name          display name
 * @param description   free-form description
 * @param key           the zone's public key
 * @param apiVersion    protocol version
 */
public record ZoneInfo(String name, String description, ZoneKey key, String apiVersion) {

  public ZoneInfo {
    name = Objects.requireNonNull(name, "null name").trim();
    description = description == null ? "" : description.trim();
    Objects.requireNonNull(key, "null key");
    apiVersion = apiVersion == null ? ZoneConstants.PROTOCOL_VERSION : apiVersion;
  }


  /** Creates an instance with the current protocol version. */
  public ZoneInfo(String name, String description, ZoneKey key) {
    this(name, description, key, ZoneConstants.PROTOCOL_VERSION);
  }


  /** Returns the zone ID, {@code H(publicKey)}. */
  public ByteBuffer zoneId() {
    return key.zoneId();
  }


  /** Returns the genesis constant, {@code H("")}. */
  public ByteBuffer glsr() {
    return ZoneConstants.GLSR.slice();
  }

}
