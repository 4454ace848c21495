/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

import io.crums.util.json.JsonEntityParser;
import io.crums.util.json.JsonParsingException;
import io.crums.util.json.JsonUtils;
import io.crums.util.json.simple.JSONObject;

/**
 * SQL store configuration: how to connect, and which tables to use.
 *
 * <pre>
 * {
 *   "url": "jdbc:h2:./zone-db",
 *   "driver_class": "org.h2.Driver",     (optional)
 *   "username": "..",                    (optional)
 *   "password": "..",                    (required with username)
 *   "table_prefix": "zone"               (optional)
 * }
 * </pre>
 *
 * @param url           jdbc URL. For eg, {@code jdbc:mysql://localhost:3306/mydb}
 * @param driverClass   fully qualified driver class name, if it must be loaded
 * @param creds         connection credentials, if any
 * @param tablePrefix   table name prefix
 *
 * @see SqlStores#connect(SqlStoreConfig)
 */
public record SqlStoreConfig(
    String url, Optional<String> driverClass, Optional<Credentials> creds, String tablePrefix) {

  /** Table prefix used when none is configured. */
  public final static String DEFAULT_PREFIX = "zone";

  /** JSON parser. */
  public final static JsonEntityParser<SqlStoreConfig> PARSER = new Parser();


  /**
   * @throws IllegalArgumentException if {@code url} does not use the
   *         {@code jdbc} scheme, or on an illegal table prefix
   */
  public SqlStoreConfig {
    try {
      URI uri = new URI(url);
      if (!"jdbc".equals(uri.getScheme()))
        throw new IllegalArgumentException(
            "connection URL must use 'jdbc' scheme; " + url);
    } catch (URISyntaxException usx) {
      throw new IllegalArgumentException("malformed url: " + url, usx);
    }
    if (driverClass == null || driverClass.filter(String::isBlank).isPresent())
      driverClass = Optional.empty();
    if (creds == null)
      creds = Optional.empty();
    if (tablePrefix == null)
      tablePrefix = DEFAULT_PREFIX;
    // validates the prefix
    new SqlZoneSchema(tablePrefix);
  }


  /**
   * Creates an instance with no driver class, no credentials, and the
   * default table prefix.
   */
  public SqlStoreConfig(String url) {
    this(url, Optional.empty(), Optional.empty(), DEFAULT_PREFIX);
  }


  /** Returns the schema for the configured table prefix. */
  public SqlZoneSchema schema() {
    return new SqlZoneSchema(tablePrefix);
  }


  /**
   * Loads the configuration from the given JSON file.
   */
  public static SqlStoreConfig load(File file) throws JsonParsingException {
    return PARSER.toEntity(file);
  }



  /**
   * Database credentials.
   *
   * @param username    not empty
   * @param password    not empty
   */
  public record Credentials(String username, String password) {

    public Credentials {
      if (Objects.requireNonNull(username, "null username").isEmpty())
        throw new IllegalArgumentException("empty username");
      if (Objects.requireNonNull(password, "null password").isEmpty())
        throw new IllegalArgumentException("empty password");
    }

    /** Does not reveal the password. */
    @Override
    public String toString() {
      return "Credentials[" + username + ":***]";
    }
  }



  public static class Parser implements JsonEntityParser<SqlStoreConfig> {

    public final static String URL = "url";
    public final static String DRIVER_CLASS = "driver_class";
    public final static String USERNAME = "username";
    public final static String PASSWORD = "password";
    public final static String TABLE_PREFIX = "table_prefix";

    @Override
    public JSONObject injectEntity(SqlStoreConfig config, JSONObject jObj) {
      jObj.put(URL, config.url());
      config.driverClass().ifPresent(dc -> jObj.put(DRIVER_CLASS, dc));
      config.creds().ifPresent(c -> {
        jObj.put(USERNAME, c.username());
        jObj.put(PASSWORD, c.password());
      });
      jObj.put(TABLE_PREFIX, config.tablePrefix());
      return jObj;
    }

    @Override
    public SqlStoreConfig toEntity(JSONObject jObj) throws JsonParsingException {
      String url = JsonUtils.getString(jObj, URL, true);
      String driverClass = JsonUtils.getString(jObj, DRIVER_CLASS, false);
      String username = JsonUtils.getString(jObj, USERNAME, false);
      String password = username == null ? null : JsonUtils.getString(jObj, PASSWORD, true);
      String prefix = JsonUtils.getString(jObj, TABLE_PREFIX, DEFAULT_PREFIX);
      try {
        Optional<Credentials> creds = username == null ?
            Optional.empty() : Optional.of(new Credentials(username, password));
        return new SqlStoreConfig(url, Optional.ofNullable(driverClass), creds, prefix);

      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }
  }

}
