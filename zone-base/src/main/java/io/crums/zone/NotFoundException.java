/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone;

/**
 * The collaborator was reached, but it doesn't know the requested item.
 * Distinct from a verification failure.
 */
@SuppressWarnings("serial")
public class NotFoundException extends UnreachableException {

  public NotFoundException(String message) {
    super(message);
  }

}
