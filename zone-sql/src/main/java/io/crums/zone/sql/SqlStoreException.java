/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import java.sql.SQLException;

import io.crums.zone.UnreachableException;

/**
 * Unchecked wrapper around {@code SQLException}s. Since the database is a
 * collaborator the zone may lose contact with, this is an
 * {@linkplain UnreachableException}.
 */
@SuppressWarnings("serial")
public class SqlStoreException extends UnreachableException {

  public SqlStoreException(String message) {
    super(message);
  }

  public SqlStoreException(String message, Throwable cause) {
    super(message, cause);
  }


  /**
   * Returns the cause as an {@code SQLException}, if castable; {@code null}, o.w.
   */
  public SQLException sqlCause() {
    Throwable cause = getCause();
    return cause instanceof SQLException ? (SQLException) cause : null;
  }

}
