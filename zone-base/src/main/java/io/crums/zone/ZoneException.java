/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;


/**
 * Base exception in the <code>zone</code> modules. All exceptions thrown
 * here are unchecked.
 */
@SuppressWarnings("serial")
public class ZoneException extends RuntimeException {

  public ZoneException(String message) {
    super(message);
  }

  public ZoneException(Throwable cause) {
    super(cause);
  }

  public ZoneException(String message, Throwable cause) {
    super(message, cause);
  }

}
