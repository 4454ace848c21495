/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;

/**
 * A collaborator (storage, or a remote zone) is unavailable. Retryable by
 * the caller; local ledger state is unaffected.
 * 
 * @see NotFoundException
 */
@SuppressWarnings("serial")
public class UnreachableException extends ZoneException {

  public UnreachableException(String message) {
    super(message);
  }

  public UnreachableException(Throwable cause) {
    super(cause);
  }

  public UnreachableException(String message, Throwable cause) {
    super(message, cause);
  }

}
