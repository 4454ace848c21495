/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import io.crums.zone.anchor.AnchorLog;
import io.crums.zone.ledger.AttestationStore;

/**
 * Schema for the SQL tables backing an {@linkplain AttestationStore} and an
 * {@linkplain AnchorLog}. As with other crums SQL backings, the schema is
 * meant to be <em>portable</em>: no vendor-specific types, no
 * {@code AUTO_INCREMENT}, no cascades.
 *
 * <h2>Schema</h2>
 * <p>
 * Three tables, their names derived from a common prefix.
 * </p>
 *
 * <h3>Attestation table</h3>
 * <pre>
 *
 * {@code CREATE TABLE} <em>prefix</em>{@code _att
 *  (append_no BIGINT NOT NULL,
 *   att_id CHAR(64) NOT NULL,
 *   zone_id CHAR(64) NOT NULL,
 *   canon_id CHAR(64) NOT NULL,
 *   claim_hash CHAR(64) NOT NULL,
 *   evid_hash CHAR(64) NOT NULL,
 *   evid_loc VARCHAR(2048),
 *   utc BIGINT NOT NULL,
 *   sig VARCHAR(256) NOT NULL,
 *   cit_cnt INT NOT NULL,
 *   mrkl_root CHAR(64) NOT NULL,
 *   PRIMARY KEY (append_no),
 *   UNIQUE (att_id)
 *  )}</pre>
 * <p>
 * Hashes are stored in lowercase hex; the signature, in standard Base64.
 * {@code mrkl_root} is the ledger root <em>after</em> the row's append.
 * </p>
 *
 * <h3>Citation table</h3>
 * <pre>
 *
 * {@code CREATE TABLE} <em>prefix</em>{@code _cit
 *  (cit_no BIGINT NOT NULL,
 *   append_no BIGINT NOT NULL,
 *   cited_id CHAR(64) NOT NULL,
 *   PRIMARY KEY (cit_no),
 *   FOREIGN KEY (append_no) REFERENCES} <em>prefix</em>{@code _att (append_no)
 *  )}</pre>
 * <p>
 * An attestation's citations occupy consecutive rows, in canonical order.
 * {@code cit_cnt} in the attestation table is their number.
 * </p>
 *
 * <h3>Anchor table</h3>
 * <pre>
 *
 * {@code CREATE TABLE} <em>prefix</em>{@code _anc
 *  (anc_no INT NOT NULL,
 *   mrkl_root CHAR(64) NOT NULL,
 *   anc_type VARCHAR(64) NOT NULL,
 *   utc BIGINT NOT NULL,
 *   anc_ref VARCHAR(1024),
 *   PRIMARY KEY (anc_no)
 *  )}</pre>
 *
 * <h3>Primary Keys</h3>
 * <p>
 * The primary key column values in each table range from 1 thru
 * {@code count(*)}. This is managed at the application level, not by the DB.
 * </p>
 */
public class SqlZoneSchema {

  public final static String APPEND_NO = "append_no";
  public final static String ATT_ID = "att_id";
  public final static String ZONE_ID = "zone_id";
  public final static String CANON_ID = "canon_id";
  public final static String CLAIM_HASH = "claim_hash";
  public final static String EVID_HASH = "evid_hash";
  public final static String EVID_LOC = "evid_loc";
  public final static String UTC = "utc";
  public final static String SIG = "sig";
  public final static String CIT_CNT = "cit_cnt";
  public final static String MRKL_ROOT = "mrkl_root";

  public final static String CIT_NO = "cit_no";
  public final static String CITED_ID = "cited_id";

  public final static String ANC_NO = "anc_no";
  public final static String ANC_TYPE = "anc_type";
  public final static String ANC_REF = "anc_ref";


  public final static String BIGINT_TYPE = "BIGINT";
  public final static String INT_TYPE = "INT";

  /** Lowercase hex, 32 bytes. */
  public final static String HEX_TYPE = "CHAR(64)";

  /** Base64 signature. Room to spare for 64-byte signatures. */
  public final static String SIG_TYPE = "VARCHAR(256)";

  public final static String LOC_TYPE = "VARCHAR(2048)";
  public final static String ANC_TYPE_TYPE = "VARCHAR(64)";
  public final static String REF_TYPE = "VARCHAR(1024)";

  /** Maximum anchor type length. */
  public final static int MAX_ANC_TYPE = 64;
  /** Maximum anchor reference length. */
  public final static int MAX_ANC_REF = 1024;
  /** Maximum evidence location length. */
  public final static int MAX_EVID_LOC = 2048;


  private final static String SOFT_TAB = "  ";


  /** Attestation table name extension. */
  public final static String ATT_TBL_EXT = "_att";
  /** Citation table name extension. */
  public final static String CIT_TBL_EXT = "_cit";
  /** Anchor table name extension. */
  public final static String ANC_TBL_EXT = "_anc";



  public static String getAttTable(String tablePrefix) {
    checkPrefix(tablePrefix);
    return tablePrefix + ATT_TBL_EXT;
  }

  public static String getCitTable(String tablePrefix) {
    checkPrefix(tablePrefix);
    return tablePrefix + CIT_TBL_EXT;
  }

  public static String getAncTable(String tablePrefix) {
    checkPrefix(tablePrefix);
    return tablePrefix + ANC_TBL_EXT;
  }


  private static void checkPrefix(String tablePrefix) {
    if (tablePrefix == null || tablePrefix.isBlank())
      throw new IllegalArgumentException("tablePrefix: " + tablePrefix);
    for (int index = tablePrefix.length(); index-- > 0; ) {
      char c = tablePrefix.charAt(index);
      if (!(Character.isLetterOrDigit(c) || c == '_'))
        throw new IllegalArgumentException(
            "illegal char '" + c + "' in tablePrefix: " + tablePrefix);
    }
  }



  public static String protoAttTableSchema(String tablePrefix) {
    return
        "CREATE TABLE " + getAttTable(tablePrefix) + " (" +
        SOFT_TAB +    APPEND_NO  + ' ' + BIGINT_TYPE + " NOT NULL," +
        SOFT_TAB +    ATT_ID     + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    ZONE_ID    + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    CANON_ID   + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    CLAIM_HASH + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    EVID_HASH  + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    EVID_LOC   + ' ' + LOC_TYPE + "," +
        SOFT_TAB +    UTC        + ' ' + BIGINT_TYPE + " NOT NULL," +
        SOFT_TAB +    SIG        + ' ' + SIG_TYPE + " NOT NULL," +
        SOFT_TAB +    CIT_CNT    + ' ' + INT_TYPE + " NOT NULL," +
        SOFT_TAB +    MRKL_ROOT  + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    "PRIMARY KEY (" + APPEND_NO + ")," +
        SOFT_TAB +    "UNIQUE (" + ATT_ID + ") )";
  }


  public static String protoCitTableSchema(String tablePrefix) {
    return
        "CREATE TABLE " + getCitTable(tablePrefix) + " (" +
        SOFT_TAB +    CIT_NO    + ' ' + BIGINT_TYPE + " NOT NULL," +
        SOFT_TAB +    APPEND_NO + ' ' + BIGINT_TYPE + " NOT NULL," +
        SOFT_TAB +    CITED_ID  + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    "PRIMARY KEY (" + CIT_NO + ")," +
        SOFT_TAB +    "FOREIGN KEY (" + APPEND_NO + ") REFERENCES " +
                          getAttTable(tablePrefix) + "(" + APPEND_NO + ") )";
  }


  public static String protoAncTableSchema(String tablePrefix) {
    return
        "CREATE TABLE " + getAncTable(tablePrefix) + " (" +
        SOFT_TAB +    ANC_NO    + ' ' + INT_TYPE + " NOT NULL," +
        SOFT_TAB +    MRKL_ROOT + ' ' + HEX_TYPE + " NOT NULL," +
        SOFT_TAB +    ANC_TYPE  + ' ' + ANC_TYPE_TYPE + " NOT NULL," +
        SOFT_TAB +    UTC       + ' ' + BIGINT_TYPE + " NOT NULL," +
        SOFT_TAB +    ANC_REF   + ' ' + REF_TYPE + "," +
        SOFT_TAB +    "PRIMARY KEY (" + ANC_NO + ") )";
  }




  private final String tablePrefix;
  private final String attTable;
  private final String citTable;
  private final String ancTable;


  /**
   * Creates a new instance using the default naming scheme.
   *
   * @param tablePrefix   letters, digits, and underscores only
   *
   * @see #ATT_TBL_EXT
   * @see #CIT_TBL_EXT
   * @see #ANC_TBL_EXT
   */
  public SqlZoneSchema(String tablePrefix) {
    this.attTable = getAttTable(tablePrefix);
    this.citTable = getCitTable(tablePrefix);
    this.ancTable = getAncTable(tablePrefix);
    this.tablePrefix = tablePrefix;
  }


  /** Returns the table name prefix. */
  public final String getTablePrefix() {
    return tablePrefix;
  }

  /** Returns the table name. */
  public final String getAttTable() {
    return attTable;
  }

  /** Returns the table name. */
  public final String getCitTable() {
    return citTable;
  }

  /** Returns the table name. */
  public final String getAncTable() {
    return ancTable;
  }


  public String getAttTableSchema() {
    return protoAttTableSchema(tablePrefix);
  }

  public String getCitTableSchema() {
    return protoCitTableSchema(tablePrefix);
  }

  public String getAncTableSchema() {
    return protoAncTableSchema(tablePrefix);
  }


  @Override
  public String toString() {
    return "SqlZoneSchema[" + tablePrefix + "]";
  }

}
