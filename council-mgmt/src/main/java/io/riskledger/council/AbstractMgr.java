/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.getLogger;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

import io.riskledger.json.JsonValues;
import io.riskledger.util.TaskStack;

/**
 * Base class for the system's table-managers.
 *
 * <h2>Transactions</h2>
 * <p>
 * Managers are light-weight views over a connection the caller owns: they
 * neither commit, roll back, nor close it. They are designed to be created
 * per transaction (see {@linkplain RiskCouncil}), and prepare their
 * statements per call.
 * </p>
 */
public abstract class AbstractMgr {

  protected final DbEnv env;

  protected final Connection con;

  protected final Clock clock;


  AbstractMgr(DbEnv env, Connection con, Clock clock) {
    this.env = Objects.requireNonNull(env, "null env");
    this.con = Objects.requireNonNull(con, "null con");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }


  /**
   * Check performed for write operations.
   *
   * @throws UnsupportedOperationException
   *         if {@linkplain #isReadOnly()} returns {@code true}
   */
  protected final void checkWrite() throws UnsupportedOperationException {
    if (env.readOnly())
      throw new UnsupportedOperationException(
          "operation not supported without write-privileges");
  }


  /**
   * Creates the manager's tables (and indexes), if they don't already exist.
   * Each statement is table-prefixed, logged, then executed.
   */
  protected void createTables(String... ddls) throws SQLException {
    checkWrite();
    for (var ddl : ddls) {
      var sql = env.applyTablePrefix(ddl);
      getLogger().log(Level.INFO, "Executing SQL DDL:%n%s".formatted(sql));
      executeDdl(sql);
    }
  }


  /** Executes ({@linkplain Statement#executeUpdate(String)}) sans substitutions. */
  protected void executeDdl(String sql) throws SQLException {
    try (var ddlStmt = con.createStatement()) {
      ddlStmt.executeUpdate(sql);
    }
  }


  protected PreparedStatement prepareStmt(String sql, TaskStack closer)
      throws SQLException {
    var stmt = prepareStmt(sql);
    closer.pushClose(stmt);
    return stmt;
  }

  /** @return {@code this.con.prepareStatement(env.applyTablePrefix(sql))} */
  protected PreparedStatement prepareStmt(String sql) throws SQLException {
    return con.prepareStatement(env.applyTablePrefix(sql));
  }


  /**
   * Prepares an {@code INSERT} statement whose auto-generated key is
   * retrieved with {@linkplain #generatedKey(PreparedStatement, TaskStack)}.
   */
  protected PreparedStatement prepareInsert(String sql, TaskStack closer)
      throws SQLException {
    var stmt = con.prepareStatement(
        env.applyTablePrefix(sql), Statement.RETURN_GENERATED_KEYS);
    closer.pushClose(stmt);
    return stmt;
  }


  protected ResultSet executeQuery(PreparedStatement stmt, TaskStack closer)
      throws SQLException {

    ResultSet rs = stmt.executeQuery();
    closer.pushClose(rs);
    return rs;
  }


  /**
   * Executes the given insert statement and returns the generated key.
   *
   * @see #prepareInsert(String, TaskStack)
   */
  protected long executeInsert(PreparedStatement insert, TaskStack closer)
      throws SQLException {
    int count = insert.executeUpdate();
    if (count != 1)
      throw new CouncilManagementException(
          "internal error: expected 1 row inserted; actual was " + count);
    ResultSet rs = insert.getGeneratedKeys();
    closer.pushClose(rs);
    if (!rs.next())
      throw new CouncilManagementException("internal error: no generated key");
    long key = rs.getLong(1);
    if (key <= 0)
      throw new CouncilManagementException(
          "internal error: positive key invariant violated: " + key);
    return key;
  }


  /** Returns the current time in epoch millis. */
  protected long now() {
    return clock.millis();
  }


  /**
   * Returns {@code true} if in read-only mode.
   *
   * @return {@code env.readOnly()}
   */
  public final boolean isReadOnly() {
    return env.readOnly();
  }



  static void setString(
      PreparedStatement stmt, int col, Optional<String> value)
          throws SQLException {
    if (value.isEmpty())
      stmt.setNull(col, Types.VARCHAR);
    else
      stmt.setString(col, value.get());
  }

  static void setLong(
      PreparedStatement stmt, int col, Optional<Long> value)
          throws SQLException {
    if (value.isEmpty())
      stmt.setNull(col, Types.BIGINT);
    else
      stmt.setLong(col, value.get());
  }

  /** Sets the JSON text of the given value; {@code null} is set as SQL NULL. */
  static void setJson(PreparedStatement stmt, int col, Object value)
      throws SQLException {
    if (value == null)
      stmt.setNull(col, Types.CLOB);
    else
      stmt.setString(col, JsonValues.toJson(value));
  }

  static Optional<String> getString(ResultSet rs, int col) throws SQLException {
    return Optional.ofNullable(rs.getString(col));
  }

  static Optional<Long> getLong(ResultSet rs, int col) throws SQLException {
    long value = rs.getLong(col);
    return rs.wasNull() ? Optional.empty() : Optional.of(value);
  }

  /** Parses the column's JSON text; SQL NULL parses to {@code null}. */
  static Object getJson(ResultSet rs, int col) throws SQLException {
    return JsonValues.parse(rs.getString(col));
  }

}
