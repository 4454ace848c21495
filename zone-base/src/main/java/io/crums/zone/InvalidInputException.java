/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;

/**
 * Malformed input: bad hash length, non-hex text, negative timestamp,
 * malformed proof token, and the like. Thrown before any hashing or signing.
 */
@SuppressWarnings("serial")
public class InvalidInputException extends ZoneException {

  public InvalidInputException(String message) {
    super(message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }

}
