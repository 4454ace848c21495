/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import static io.crums.zone.sql.SqlTestHarness.randomHash;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.file.Files;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

import io.crums.testing.IoTestCase;
import io.crums.util.json.JsonParsingException;


public class SqlStoresTest extends IoTestCase {

  final static String H2_DRIVER = "org.h2.Driver";


  @Test
  public void testOpenStore() throws Exception {
    final Object label = new Object() {  };
    var random = new Random(71);
    File dir = getMethodOutputFilepath(label);
    assertTrue(dir.mkdirs());
    var config = new SqlStoreConfig(
        SqlTestHarness.dbUrl(dir), Optional.of(H2_DRIVER), Optional.empty(), "notary");

    try (var con = SqlStores.connect(config)) {
      assertFalse(SqlStores.tablesExist(con, config.schema()));
    }

    var atts = SqlTestHarness.newAttestations(2, random);
    try (var store = SqlStores.openStore(config)) {
      assertEquals("notary", store.schema().getTablePrefix());
      assertEquals(0, store.size());
      store.append(atts.get(0), 1, randomHash(random));
    }

    try (var con = SqlStores.connect(config)) {
      assertTrue(SqlStores.tablesExist(con, config.schema()));
      assertFalse(SqlStores.tablesExist(con, new SqlZoneSchema("other")));
    }

    // opens the existing tables
    try (var store = SqlStores.openStore(config)) {
      assertEquals(1, store.size());
      assertEquals(atts.get(0), store.get(atts.get(0).attestationId()).get());
    }
  }


  @Test
  public void testConnectFailures() {
    var noDriver = new SqlStoreConfig(
        "jdbc:h2:mem:x", Optional.of("com.example.NoSuchDriver"), Optional.empty(), null);
    assertThrows(SqlStoreException.class, () -> SqlStores.connect(noDriver));

    var badUrl = new SqlStoreConfig("jdbc:nosuchdb://localhost/zone");
    var sqx = assertThrows(SqlStoreException.class, () -> SqlStores.connect(badUrl));
    assertNotNull(sqx.sqlCause());
  }


  @Test
  public void testConfig() throws Exception {
    var config = new SqlStoreConfig("jdbc:h2:mem:zone");
    assertEquals(SqlStoreConfig.DEFAULT_PREFIX, config.tablePrefix());
    assertTrue(config.driverClass().isEmpty());
    assertTrue(config.creds().isEmpty());

    assertThrows(IllegalArgumentException.class, () -> new SqlStoreConfig("http://localhost/db"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SqlStoreConfig("jdbc:h2:mem:zone", null, null, "bad-prefix"));

    var creds = new SqlStoreConfig.Credentials("zone_user", "s3cret");
    assertFalse(creds.toString().contains("s3cret"));
    assertThrows(IllegalArgumentException.class, () -> new SqlStoreConfig.Credentials("", "x"));
  }


  @Test
  public void testConfigJson() throws Exception {
    final Object label = new Object() {  };
    File dir = getMethodOutputFilepath(label);
    assertTrue(dir.mkdirs());
    var file = new File(dir, "sql.json");
    Files.writeString(
        file.toPath(),
        "{\n" +
        "  \"url\": \"jdbc:postgresql://localhost:5432/zone\",\n" +
        "  \"driver_class\": \"org.postgresql.Driver\",\n" +
        "  \"username\": \"zone_user\",\n" +
        "  \"password\": \"s3cret\",\n" +
        "  \"table_prefix\": \"acme\"\n" +
        "}\n");

    var config = SqlStoreConfig.load(file);
    assertEquals("jdbc:postgresql://localhost:5432/zone", config.url());
    assertEquals(Optional.of("org.postgresql.Driver"), config.driverClass());
    assertEquals("zone_user", config.creds().get().username());
    assertEquals("s3cret", config.creds().get().password());
    assertEquals("acme", config.tablePrefix());
    assertEquals("acme_att", config.schema().getAttTable());

    var parser = SqlStoreConfig.PARSER;
    assertEquals(config, parser.toEntity(parser.toJsonObject(config).toJSONString()));

    assertThrows(
        JsonParsingException.class,
        () -> parser.toEntity("{ \"url\": \"jdbc:h2:mem:z\", \"username\": \"u\" }"));
    assertThrows(
        JsonParsingException.class,
        () -> parser.toEntity("{ \"url\": \"ftp://z\" }"));
    assertThrows(JsonParsingException.class, () -> parser.toEntity("{ }"));
  }

}
