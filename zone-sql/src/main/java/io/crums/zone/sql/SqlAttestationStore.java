/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import static io.crums.zone.sql.SqlZoneSchema.*;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.zone.DuplicateAttestationException;
import io.crums.zone.HashConflictException;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.att.Attestation;
import io.crums.zone.att.Attestations;
import io.crums.zone.ledger.AttestationStore;
import io.crums.zone.ledger.LedgerEntry;

/**
 * An {@linkplain AttestationStore} that lives in an SQL database.
 * <p>
 * Each append is one transaction: the attestation row and its citation rows
 * are committed together, or not at all. Attestations read back are checked
 * against their ID.
 * </p>
 *
 * @see SqlZoneSchema
 */
public class SqlAttestationStore implements AttestationStore {

  private final static Logger log = SqlStores.getLogger();


  /**
   * Declares a new instance (its tables don't yet exist in the database)
   * using the given table prefix. The anchor table is also created.
   *
   * @param con           db connection
   * @param tablePrefix   table name prefix
   */
  public static SqlAttestationStore declareNewInstance(Connection con, String tablePrefix) {
    return declareNewInstance(con, new SqlZoneSchema(tablePrefix));
  }


  /**
   * Declares a new instance (its tables don't yet exist in the database).
   * The anchor table is also created.
   */
  public static SqlAttestationStore declareNewInstance(Connection con, SqlZoneSchema schema) {
    Objects.requireNonNull(schema, "null schema");
    try {
      if (con.getAutoCommit())
        con.setAutoCommit(false);

      try (Statement stmt = con.createStatement()) {
        stmt.execute(schema.getAttTableSchema());
        stmt.execute(schema.getCitTableSchema());
        stmt.execute(schema.getAncTableSchema());
      }
      con.commit();

      log.log(Level.INFO, "declared tables for " + schema);
      return new SqlAttestationStore(schema, con);

    } catch (SQLException sqx) {
      throw new SqlStoreException("on declareNewInstance(" + schema + "): " + sqx, sqx);
    }
  }







  //   I N S T A N C E    M E M B E R S


  private final Object lock = new Object();

  private final SqlZoneSchema schema;
  private final Connection con;

  private final PreparedStatement countStmt;
  private final PreparedStatement citCountStmt;
  private final PreparedStatement containsStmt;
  private final PreparedStatement selectByIdStmt;
  private final PreparedStatement selectCitsStmt;
  private final PreparedStatement selectEntriesStmt;

  private PreparedStatement insertAttStmt;
  private PreparedStatement insertCitStmt;

  private SqlAnchorLog anchorLog;


  /**
   * Creates a new instance from already existing tables on the backing database.
   *
   * @param tablePrefix   the prefix from which table names are inferred
   * @param con           the database the tables live in
   */
  public SqlAttestationStore(String tablePrefix, Connection con) {
    this(new SqlZoneSchema(tablePrefix), con);
  }


  /**
   * Creates a new instance from already existing tables on the backing database.
   *
   * @param schema    describes the existing tables
   * @param con       the database the tables live in
   */
  public SqlAttestationStore(SqlZoneSchema schema, Connection con) {
    this.schema = Objects.requireNonNull(schema, "null schema");
    this.con = Objects.requireNonNull(con, "null con");
    try {
      if (!con.isValid(5))
        throw new IllegalArgumentException("connection not valid: " + con);

      if (!con.isReadOnly() && con.getAutoCommit())
        con.setAutoCommit(false);

      final String attTable = schema.getAttTable();
      final String citTable = schema.getCitTable();

      this.countStmt = con.prepareStatement(
          "SELECT count(*) FROM " + attTable + " AS rcount");

      this.citCountStmt = con.prepareStatement(
          "SELECT count(*) FROM " + citTable + " AS rcount");

      this.containsStmt = con.prepareStatement(
          "SELECT " + APPEND_NO + " FROM " + attTable + " WHERE " + ATT_ID + " = ?");

      this.selectByIdStmt = con.prepareStatement(
          "SELECT " + APPEND_NO + ", " + ATT_ID + ", " + ZONE_ID + ", " + CANON_ID + ", " +
          CLAIM_HASH + ", " + EVID_HASH + ", " + EVID_LOC + ", " + UTC + ", " + SIG + ", " +
          CIT_CNT + " FROM " + attTable +
          " WHERE " + ATT_ID + " = ?");

      this.selectCitsStmt = con.prepareStatement(
          "SELECT " + CITED_ID + " FROM " + citTable +
          " WHERE " + APPEND_NO + " = ? ORDER BY " + CIT_NO);

      this.selectEntriesStmt = con.prepareStatement(
          "SELECT " + APPEND_NO + ", " + ATT_ID + ", " + MRKL_ROOT + " FROM " + attTable +
          " ORDER BY " + APPEND_NO);

    } catch (SQLException sqx) {
      throw new SqlStoreException("on <init>: " + sqx, sqx);
    }
  }


  /**
   * On demand initialization returns an 11-parameter prepared insert statement.
   * The parameter values are in column order (see {@linkplain SqlZoneSchema}).
   * Lazy, so that a read-only connection may be passed in at construction.
   */
  private PreparedStatement getInsertAttStmt() throws SQLException {
    if (insertAttStmt == null) {
      insertAttStmt = con.prepareStatement(
          "INSERT INTO " + schema.getAttTable() +
          " (" + APPEND_NO + ", " + ATT_ID + ", " + ZONE_ID + ", " + CANON_ID + ", " +
          CLAIM_HASH + ", " + EVID_HASH + ", " + EVID_LOC + ", " + UTC + ", " + SIG + ", " +
          CIT_CNT + ", " + MRKL_ROOT +
          ") VALUES ( ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
    }
    return insertAttStmt;
  }


  /** 3-parameter insert: cit_no, append_no, cited_id. */
  private PreparedStatement getInsertCitStmt() throws SQLException {
    if (insertCitStmt == null) {
      insertCitStmt = con.prepareStatement(
          "INSERT INTO " + schema.getCitTable() +
          " (" + CIT_NO + ", " + APPEND_NO + ", " + CITED_ID + ") VALUES ( ?, ?, ?)");
    }
    return insertCitStmt;
  }


  /** Returns the schema. */
  public SqlZoneSchema schema() {
    return schema;
  }


  /**
   * Returns an anchor log backed by this instance's anchor table. It shares
   * this instance's connection (and lock); closing it does nothing.
   */
  public SqlAnchorLog anchorLog() {
    synchronized (lock) {
      if (anchorLog == null)
        anchorLog = new SqlAnchorLog(schema, con, lock, false);
      return anchorLog;
    }
  }


  @Override
  public long size() throws SqlStoreException {
    synchronized (lock) {
      return countImpl();
    }
  }


  private long countImpl() {
    try {
      return queryCount(countStmt);
    } catch (SQLException sqx) {
      throw new SqlStoreException("on size(): " + sqx, sqx);
    }
  }


  private long queryCount(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      if (rs.next())
        return rs.getLong(1);
      throw new SqlStoreException("empty result set on COUNT query");
    }
  }


  @Override
  public boolean contains(ByteBuffer attestationId) throws SqlStoreException {
    var hex = Hashes.toHex(Hashes.checkHash(attestationId, "attestation_id"));
    synchronized (lock) {
      try {
        return containsImpl(hex);
      } catch (SQLException sqx) {
        throw new SqlStoreException("on contains(" + hex + "): " + sqx, sqx);
      }
    }
  }


  private boolean containsImpl(String idHex) throws SQLException {
    containsStmt.setString(1, idHex);
    try (ResultSet rs = containsStmt.executeQuery()) {
      return rs.next();
    }
  }


  /**
   * {@inheritDoc}
   *
   * @throws HashConflictException if the stored fields do not hash to the ID
   */
  @Override
  public Optional<Attestation> get(ByteBuffer attestationId)
      throws SqlStoreException, HashConflictException {

    var hex = Hashes.toHex(Hashes.checkHash(attestationId, "attestation_id"));
    synchronized (lock) {
      try {
        selectByIdStmt.setString(1, hex);
        final long appendNo;
        final String zoneId, canonId, claimHash, evidHash, evidLoc, sig;
        final long utc;
        final int citCount;
        try (ResultSet rs = selectByIdStmt.executeQuery()) {
          if (!rs.next())
            return Optional.empty();
          appendNo = rs.getLong(1);
          zoneId = rs.getString(3);
          canonId = rs.getString(4);
          claimHash = rs.getString(5);
          evidHash = rs.getString(6);
          evidLoc = rs.getString(7);
          utc = rs.getLong(8);
          sig = rs.getString(9);
          citCount = rs.getInt(10);
        }

        List<ByteBuffer> citations = new ArrayList<>(citCount);
        selectCitsStmt.setLong(1, appendNo);
        try (ResultSet rs = selectCitsStmt.executeQuery()) {
          while (rs.next())
            citations.add(Hashes.fromHex(rs.getString(1), CITED_ID));
        }
        if (citations.size() != citCount)
          throw new HashConflictException(
              "expected " + citCount + " citations for [" + appendNo + "]; found " +
              citations.size());

        var att = new Attestation(
            attestationId,
            Hashes.fromHex(zoneId, ZONE_ID),
            Hashes.fromHex(canonId, CANON_ID),
            Hashes.fromHex(claimHash, CLAIM_HASH),
            Hashes.fromHex(evidHash, EVID_HASH),
            Optional.ofNullable(evidLoc),
            citations,
            utc,
            ByteBuffer.wrap(Base64.getDecoder().decode(sig.trim())));

        if (!Attestations.isIdConsistent(att))
          throw new HashConflictException(
              "stored attestation [" + appendNo + "] does not hash to its ID " + hex);

        return Optional.of(att);

      } catch (SQLException sqx) {
        throw new SqlStoreException("on get(" + hex + "): " + sqx, sqx);
      } catch (IllegalArgumentException | InvalidInputException x) {
        throw new HashConflictException(
            "malformed row for attestation " + hex + ": " + x.getMessage(), x);
      }
    }
  }


  /**
   * {@inheritDoc}
   *
   * @throws DuplicateAttestationException if already stored
   * @throws InvalidInputException if the evidence location is too long for
   *         its column
   */
  @Override
  public void append(Attestation att, long appendNo, ByteBuffer root)
      throws SqlStoreException, DuplicateAttestationException, HashConflictException {

    Objects.requireNonNull(att, "null att");
    var rootHex = Hashes.toHex(Hashes.checkHash(root, "root"));
    var evidLoc = att.evidenceLocation().orElse(null);
    if (evidLoc != null && evidLoc.length() > MAX_EVID_LOC)
      throw new InvalidInputException(
          "evidence location length " + evidLoc.length() + " > " + MAX_EVID_LOC);

    final var idHex = att.attestationIdHex();

    synchronized (lock) {
      try {
        if (containsImpl(idHex))
          throw new DuplicateAttestationException(att.attestationId());

        final long nextNo = queryCount(countStmt) + 1;
        if (appendNo != nextNo)
          throw new HashConflictException(
              "append no. " + appendNo + " out of sequence; next is " + nextNo);
        final long citNo = queryCount(citCountStmt) + 1;
        final var citations = att.citations();

        var insertAtt = getInsertAttStmt();
        insertAtt.setLong(1, appendNo);
        insertAtt.setString(2, idHex);
        insertAtt.setString(3, Hashes.toHex(att.zoneId()));
        insertAtt.setString(4, Hashes.toHex(att.canonId()));
        insertAtt.setString(5, Hashes.toHex(att.claimHash()));
        insertAtt.setString(6, Hashes.toHex(att.evidenceHash()));
        insertAtt.setString(7, evidLoc);
        insertAtt.setLong(8, att.timestamp());
        insertAtt.setString(9, att.signatureBase64());
        insertAtt.setInt(10, citations.size());
        insertAtt.setString(11, rootHex);
        insertAtt.executeUpdate();

        if (!citations.isEmpty()) {
          var insertCit = getInsertCitStmt();
          for (int index = 0; index < citations.size(); ++index) {
            insertCit.setLong(1, citNo + index);
            insertCit.setLong(2, appendNo);
            insertCit.setString(3, Hashes.toHex(citations.get(index)));
            insertCit.addBatch();
          }
          int[] counts = insertCit.executeBatch();
          if (counts.length != citations.size())
            throw new SQLException(
                "citation batch INSERT count " + counts.length + "; expected " +
                citations.size());
        }

        con.commit();
        log.log(Level.DEBUG, "appended [" + appendNo + "] " + idHex);

      } catch (SQLException sqx) {
        boolean rb;
        try {
          con.rollback();
          rb = true;
        } catch (SQLException sqx2) {
          rb = false;
        }
        String msg = "on append " + att;
        if (!rb)
          msg += " (rollback failed!)";
        msg += " -- " + sqx;
        throw new SqlStoreException(msg, sqx);
      }
    }
  }


  @Override
  public List<LedgerEntry> entries() throws SqlStoreException {
    synchronized (lock) {
      try (ResultSet rs = selectEntriesStmt.executeQuery()) {
        var entries = new ArrayList<LedgerEntry>();
        while (rs.next()) {
          entries.add(
              new LedgerEntry(
                  rs.getLong(1),
                  Hashes.fromHex(rs.getString(2), ATT_ID),
                  Hashes.fromHex(rs.getString(3), MRKL_ROOT)));
        }
        return entries;

      } catch (SQLException sqx) {
        throw new SqlStoreException("on entries(): " + sqx, sqx);
      } catch (InvalidInputException | IllegalArgumentException x) {
        throw new HashConflictException("malformed append log row: " + x.getMessage(), x);
      }
    }
  }


  /**
   * Closes the database connection.
   */
  @Override
  public void close() throws SqlStoreException {
    synchronized (lock) {
      try {
        con.close();
      } catch (SQLException sqx) {
        throw new SqlStoreException("on close(): " + sqx, sqx);
      }
    }
  }

}
