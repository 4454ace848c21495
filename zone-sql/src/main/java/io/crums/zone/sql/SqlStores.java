/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQL module constants and connection utilities.
 */
public class SqlStores {

  private SqlStores() {  }


  /**
   * Logger name for this module.
   *
   * @see #getLogger()
   */
  public final static String LOGGER_NAME = "zone.sql";


  /**
   * Returns the module logger.
   *
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }


  /**
   * Returns a new database connection per the given configuration. If a
   * driver class is configured, it is loaded first (so that it registers
   * itself with the {@code DriverManager}).
   */
  public static Connection connect(SqlStoreConfig config) throws SqlStoreException {
    try {
      if (config.driverClass().isPresent())
        Class.forName(config.driverClass().get());

      var creds = config.creds();
      return creds.isPresent() ?
          DriverManager.getConnection(
              config.url(), creds.get().username(), creds.get().password()) :
          DriverManager.getConnection(config.url());

    } catch (ClassNotFoundException cnfx) {
      throw new SqlStoreException(
          "driver class not found: " + config.driverClass().get(), cnfx);
    } catch (SQLException sqx) {
      throw new SqlStoreException("on connect(" + config.url() + "): " + sqx, sqx);
    }
  }


  /**
   * Connects per the given configuration, and returns a store on its tables,
   * declaring them first if they don't exist.
   */
  public static SqlAttestationStore openStore(SqlStoreConfig config) throws SqlStoreException {
    var con = connect(config);
    var schema = config.schema();
    try {
      return tablesExist(con, schema) ?
          new SqlAttestationStore(schema, con) :
          SqlAttestationStore.declareNewInstance(con, schema);

    } catch (RuntimeException rx) {
      try {
        con.close();
      } catch (SQLException sqx) {
        rx.addSuppressed(sqx);
      }
      throw rx;
    }
  }


  /**
   * Determines whether the given schema's attestation table exists. This is
   * probed by querying it, since table-name case in database metadata varies
   * by vendor. On a failed probe, the connection is rolled back (if not in
   * auto-commit mode).
   */
  public static boolean tablesExist(Connection con, SqlZoneSchema schema)
      throws SqlStoreException {

    try (Statement stmt = con.createStatement()) {
      stmt.executeQuery("SELECT count(*) FROM " + schema.getAttTable()).close();
      return true;

    } catch (SQLException probe) {
      getLogger().log(
          Level.DEBUG, "no table " + schema.getAttTable() + ": " + probe.getMessage());
      try {
        if (!con.getAutoCommit())
          con.rollback();
      } catch (SQLException sqx) {
        throw new SqlStoreException("on rollback after probing " + schema + ": " + sqx, sqx);
      }
      return false;
    }
  }

}
