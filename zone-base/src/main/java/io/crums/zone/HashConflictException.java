/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;

/**
 * Indicates the SHA-256 hash of one thing does not match the hash another when
 * it was supposed to. Usually a sign of corrupted storage.
 */
@SuppressWarnings("serial")
public class HashConflictException extends ZoneException {

  public HashConflictException(String message) {
    super(message);
  }

  public HashConflictException(String message, Throwable cause) {
    super(message, cause);
  }

}
