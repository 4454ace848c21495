/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;

/**
 * Signing or key problems. Fatal to the operation attempting it.
 */
@SuppressWarnings("serial")
public class IdentityException extends ZoneException {

  public IdentityException(String message) {
    super(message);
  }

  public IdentityException(Throwable cause) {
    super(cause);
  }

  public IdentityException(String message, Throwable cause) {
    super(message, cause);
  }

}
