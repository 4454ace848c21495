/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.zone.sql;


import static io.crums.zone.sql.SqlZoneSchema.*;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.zone.HashConflictException;
import io.crums.zone.Hashes;
import io.crums.zone.InvalidInputException;
import io.crums.zone.anchor.Anchor;
import io.crums.zone.anchor.AnchorLog;

/**
 * An {@linkplain AnchorLog} that lives in an SQL database.
 *
 * @see SqlZoneSchema#protoAncTableSchema(String)
 * @see SqlAttestationStore#anchorLog()
 */
public class SqlAnchorLog implements AnchorLog {

  private final static Logger log = SqlStores.getLogger();


  /**
   * Declares a new, standalone instance: only the anchor table is created.
   *
   * @param con           db connection
   * @param tablePrefix   table name prefix
   */
  public static SqlAnchorLog declareNewInstance(Connection con, String tablePrefix) {
    var schema = new SqlZoneSchema(tablePrefix);
    try {
      if (con.getAutoCommit())
        con.setAutoCommit(false);

      try (Statement stmt = con.createStatement()) {
        stmt.execute(schema.getAncTableSchema());
      }
      con.commit();

      return new SqlAnchorLog(schema, con);

    } catch (SQLException sqx) {
      throw new SqlStoreException("on declareNewInstance(" + schema + "): " + sqx, sqx);
    }
  }



  private final Object lock;
  private final boolean ownsCon;

  private final SqlZoneSchema schema;
  private final Connection con;

  private final PreparedStatement countStmt;
  private final PreparedStatement selectAllStmt;

  private PreparedStatement insertStmt;


  /**
   * Creates a standalone instance from an already existing anchor table.
   * Closing this instance closes the connection.
   */
  public SqlAnchorLog(SqlZoneSchema schema, Connection con) {
    this(schema, con, new Object(), true);
  }


  SqlAnchorLog(SqlZoneSchema schema, Connection con, Object lock, boolean ownsCon) {
    this.schema = Objects.requireNonNull(schema, "null schema");
    this.con = Objects.requireNonNull(con, "null con");
    this.lock = lock;
    this.ownsCon = ownsCon;
    try {
      if (ownsCon) {
        if (!con.isValid(5))
          throw new IllegalArgumentException("connection not valid: " + con);
        if (!con.isReadOnly() && con.getAutoCommit())
          con.setAutoCommit(false);
      }
      this.countStmt = con.prepareStatement(
          "SELECT count(*) FROM " + schema.getAncTable() + " AS rcount");

      this.selectAllStmt = con.prepareStatement(
          "SELECT " + ANC_NO + ", " + MRKL_ROOT + ", " + ANC_TYPE + ", " + UTC + ", " + ANC_REF +
          " FROM " + schema.getAncTable() + " ORDER BY " + ANC_NO);

    } catch (SQLException sqx) {
      throw new SqlStoreException("on <init>: " + sqx, sqx);
    }
  }


  /** 5-parameter insert, in column order. */
  private PreparedStatement getInsertStmt() throws SQLException {
    if (insertStmt == null) {
      insertStmt = con.prepareStatement(
          "INSERT INTO " + schema.getAncTable() +
          " (" + ANC_NO + ", " + MRKL_ROOT + ", " + ANC_TYPE + ", " + UTC + ", " + ANC_REF +
          ") VALUES ( ?, ?, ?, ?, ?)");
    }
    return insertStmt;
  }


  /**
   * {@inheritDoc}
   *
   * @throws InvalidInputException if the type or reference is too long for
   *         its column
   */
  @Override
  public void record(Anchor anchor) throws SqlStoreException {
    Objects.requireNonNull(anchor, "null anchor");
    if (anchor.type().length() > MAX_ANC_TYPE)
      throw new InvalidInputException(
          "anchor type length " + anchor.type().length() + " > " + MAX_ANC_TYPE);
    var ref = anchor.reference().orElse(null);
    if (ref != null && ref.length() > MAX_ANC_REF)
      throw new InvalidInputException(
          "anchor reference length " + ref.length() + " > " + MAX_ANC_REF);

    synchronized (lock) {
      try {
        final int ancNo;
        try (ResultSet rs = countStmt.executeQuery()) {
          if (!rs.next())
            throw new SqlStoreException("empty result set on anchor COUNT query");
          ancNo = rs.getInt(1) + 1;
        }

        var insert = getInsertStmt();
        insert.setInt(1, ancNo);
        insert.setString(2, Hashes.toHex(anchor.root()));
        insert.setString(3, anchor.type());
        insert.setLong(4, anchor.utc());
        if (ref == null)
          insert.setNull(5, Types.VARCHAR);
        else
          insert.setString(5, ref);
        insert.executeUpdate();

        con.commit();
        log.log(Level.DEBUG, "recorded anchor [" + ancNo + "] " + anchor);

      } catch (SQLException sqx) {
        boolean rb;
        try {
          con.rollback();
          rb = true;
        } catch (SQLException sqx2) {
          rb = false;
        }
        String msg = "on record " + anchor;
        if (!rb)
          msg += " (rollback failed!)";
        msg += " -- " + sqx;
        throw new SqlStoreException(msg, sqx);
      }
    }
  }


  @Override
  public List<Anchor> list() throws SqlStoreException {
    synchronized (lock) {
      try (ResultSet rs = selectAllStmt.executeQuery()) {
        var anchors = new ArrayList<Anchor>();
        while (rs.next()) {
          long ancNo = rs.getLong(1);
          if (ancNo != anchors.size() + 1)
            throw new HashConflictException(
                "expected anchor no. " + (anchors.size() + 1) + "; actual was " + ancNo);
          anchors.add(
              new Anchor(
                  Hashes.fromHex(rs.getString(2), MRKL_ROOT),
                  rs.getString(3),
                  rs.getLong(4),
                  Optional.ofNullable(rs.getString(5))));
        }
        return anchors;

      } catch (SQLException sqx) {
        throw new SqlStoreException("on list(): " + sqx, sqx);
      } catch (InvalidInputException iix) {
        throw new HashConflictException("malformed anchor row: " + iix.getMessage(), iix);
      }
    }
  }


  @Override
  public int size() throws SqlStoreException {
    synchronized (lock) {
      try (ResultSet rs = countStmt.executeQuery()) {
        if (rs.next())
          return rs.getInt(1);
        throw new SqlStoreException("empty result set on anchor COUNT query");

      } catch (SQLException sqx) {
        throw new SqlStoreException("on size(): " + sqx, sqx);
      }
    }
  }


  /**
   * Closes the database connection, if this is a standalone instance.
   * Otherwise, the owning {@linkplain SqlAttestationStore} closes it.
   */
  @Override
  public void close() throws SqlStoreException {
    if (!ownsCon)
      return;
    synchronized (lock) {
      try {
        con.close();
      } catch (SQLException sqx) {
        throw new SqlStoreException("on close(): " + sqx, sqx);
      }
    }
  }

}
