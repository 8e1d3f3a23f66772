/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;
import static io.riskledger.council.SchemaConstants.*;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import io.riskledger.consensus.QuorumPolicy;
import io.riskledger.council.Key.LongKey;
import io.riskledger.json.JsonParsingException;
import io.riskledger.util.TaskStack;

/**
 * Manages the {@code councils} table.
 *
 * @see SchemaConstants#CREATE_COUNCILS_TABLE
 */
public class CouncilMgr extends AbstractMgr {

  /**
   * Neutral/sentinel/initial id of "args"-instances.
   * {@code INIT_ID.}{@linkplain CouncilId#isSet() isSet()} returns {@code false}.
   */
  public final static CouncilId INIT_ID = new CouncilId(0);

  /**
   * A council is identified by this typed number. Excepting
   * {@linkplain CouncilMgr#INIT_ID}, all instances encapsulate values
   * read from the database.
   */
  public final static class CouncilId extends LongKey {

    CouncilId(long id) {
      super(id);
    }

    @Override
    public boolean equals(Object o) {
      return o == this ||
          o instanceof CouncilId other &&
          other.no() == this.no();
    }
  }



  /**
   * Creates the backing table, if it doesn't exist.
   */
  static void ensureTables(DbEnv env, Connection con) throws SQLException {
    new CouncilMgr(env, con, Clock.systemUTC()).createTables(CREATE_COUNCILS_TABLE);
  }


  /**
   * Constructs a new instance. The backing table is assumed to
   * already exist.
   *
   * @param env   environment / context
   * @param con   database connection (owned by the caller)
   * @param clock time source
   */
  public CouncilMgr(DbEnv env, Connection con, Clock clock) {
    super(env, con, clock);
  }


  /**
   * Creates a new council and returns it.
   *
   * @param args an "args"-instance
   *
   * @return a {@code Council} with set key, status {@code ACTIVE}
   *
   * @throws IllegalArgumentException
   *         if not an "args"-instance
   * @throws UnsupportedOperationException
   *         if {@linkplain #isReadOnly()} returns {@code true}
   */
  public Council newCouncil(Council args)
      throws IllegalArgumentException, UnsupportedOperationException, SQLException {

    checkWrite();
    requireArgsInstance(args);

    try (var closer = new TaskStack()) {

      final long now = now();
      var insert = prepareInsert(INSERT_COUNCIL, closer);
      insert.setString(1, args.name());
      setString(insert, 2, args.description());
      setString(insert, 3, args.orgId());
      insert.setString(4, CouncilStatus.ACTIVE.name());
      insert.setInt(5, args.policy().quorum());
      insert.setInt(6, args.policy().requireUnanimous() ? 1 : 0);
      setJson(insert, 7, args.approvalPolicy());
      setJson(insert, 8, args.metadata());
      insert.setLong(9, now);
      insert.setLong(10, now);

      long id = executeInsert(insert, closer);

      var created = findById(id, false).orElseThrow(
          () -> new CouncilManagementException(
              "internal error: council [%d] not found after insert".formatted(id)));

      if (!created.equalsIgnoringId(args))
        throw new CouncilManagementException(
            "internal error: insert failed. Expected %s (ignoring id); actual %s"
            .formatted(args, created));

      getLogger().log(Level.INFO, "council %s CREATED".formatted(created));
      return created;
    }
  }


  /**
   * Returns the council with the specified {@code id}.
   *
   * @param id        council id (&gt; 0)
   * @param forUpdate if {@code true}, the row is locked till the end of the
   *                  transaction
   *
   * @throws NoSuchElementException if not found
   */
  public Council getById(long id, boolean forUpdate)
      throws NoSuchElementException, SQLException {
    return findById(id, forUpdate).orElseThrow(
        () -> new NoSuchElementException("council not found: " + id));
  }


  /**
   * Finds and returns the council with the specified {@code id}.
   *
   * @param id        council id (&gt; 0)
   * @param forUpdate if {@code true}, the row (if found) is locked till the
   *                  end of the transaction
   */
  public Optional<Council> findById(long id, boolean forUpdate)
      throws IllegalArgumentException, SQLException {

    checkId(id);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(
          forUpdate ? SELECT_COUNCIL_BY_ID_FOR_UPDATE : SELECT_COUNCIL_BY_ID,
          closer);
      query.setLong(1, id);
      ResultSet rs = executeQuery(query, closer);
      return rs.next() ? Optional.of(toCouncil(rs)) : Optional.empty();
    }
  }


  /**
   * Lists councils in ascending id order.
   *
   * @param status    optional status filter
   * @param orgId     optional organization filter
   * @param cursor    exclusive lower bound on the council id (0 for the first page)
   * @param limit     maximum number of councils returned, in [1, 100]
   *
   * @return immutable list
   */
  public List<Council> list(
      Optional<CouncilStatus> status, Optional<String> orgId, long cursor, int limit)
          throws IllegalArgumentException, SQLException {

    if (cursor < 0)
      throw new IllegalArgumentException("negative cursor: " + cursor);
    checkLimit(limit);
    orgId = normalize(orgId);

    var sql = new StringBuilder(SELECT_COUNCILS_AFTER);
    if (status.isPresent())
      sql.append(" AND status = ?");
    if (orgId.isPresent())
      sql.append(" AND org_id = ?");
    sql.append(" ORDER BY council_id LIMIT ?");

    try (var closer = new TaskStack()) {
      var query = prepareStmt(sql.toString(), closer);
      int col = 0;
      query.setLong(++col, cursor);
      if (status.isPresent())
        query.setString(++col, status.get().name());
      if (orgId.isPresent())
        query.setString(++col, orgId.get());
      query.setInt(++col, limit);

      ResultSet rs = executeQuery(query, closer);
      List<Council> councils = new ArrayList<>();
      while (rs.next())
        councils.add(toCouncil(rs));
      return councils.isEmpty() ? List.of() : Collections.unmodifiableList(councils);
    }
  }


  /**
   * Changes the name, description, organization, quorum policy, approval
   * policy, or metadata of the specified council.
   *
   * @param id    council identifier
   * @param args  an "args"-instance
   *
   * @return the updated council
   *
   * @throws NoSuchElementException  if no such council exists
   * @throws IllegalStateException   if the council is archived
   */
  public Council update(CouncilId id, Council args)
      throws
      IllegalArgumentException,
      IllegalStateException,
      NoSuchElementException,
      UnsupportedOperationException,
      SQLException {

    checkWrite();
    checkIdSet(id);
    requireArgsInstance(args);

    final var existing = getById(id.no(), true);
    if (!existing.isActive())
      throw new IllegalStateException("council %s is archived".formatted(existing));
    if (existing.equalsIgnoringId(args))
      return existing;

    try (var closer = new TaskStack()) {
      var update = prepareStmt(UPDATE_COUNCIL, closer);
      update.setString(1, args.name());
      setString(update, 2, args.description());
      setString(update, 3, args.orgId());
      update.setInt(4, args.policy().quorum());
      update.setInt(5, args.policy().requireUnanimous() ? 1 : 0);
      setJson(update, 6, args.approvalPolicy());
      setJson(update, 7, args.metadata());
      update.setLong(8, Math.max(now(), existing.updatedUtc()));
      update.setLong(9, id.no());
      checkUpdateCount(update.executeUpdate(), id);
    }

    var updated = getById(id.no(), false);
    if (!updated.equalsIgnoringId(args))
      throw new CouncilManagementException(
          """
          internal error. Update of council [%s] was ineffective: \
          args %s; after update %s"""
          .formatted(id, args, updated));

    if (!updated.policy().equals(existing.policy()))
      getLogger().log(
          Level.INFO,
          "council [%s] quorum policy changed: %s -> %s"
          .formatted(id, existing.policy(), updated.policy()));
    return updated;
  }


  /**
   * Archives the specified council. Archiving is terminal; archiving an
   * already archived council is a no-op.
   *
   * @return the archived council
   *
   * @throws NoSuchElementException  if no such council exists
   */
  public Council archive(CouncilId id)
      throws NoSuchElementException, UnsupportedOperationException, SQLException {

    checkWrite();
    checkIdSet(id);

    final var existing = getById(id.no(), true);
    if (!existing.isActive())
      return existing;

    try (var closer = new TaskStack()) {
      var update = prepareStmt(UPDATE_COUNCIL_STATUS, closer);
      update.setString(1, CouncilStatus.ARCHIVED.name());
      update.setLong(2, Math.max(now(), existing.updatedUtc()));
      update.setLong(3, id.no());
      checkUpdateCount(update.executeUpdate(), id);
    }
    getLogger().log(Level.INFO, "council [%s] ARCHIVED".formatted(id));
    return getById(id.no(), false);
  }



  private void checkUpdateCount(int count, CouncilId id) {
    if (count != 1)
      throw new CouncilManagementException(
          "internal error: expected 1 council [%s] row updated; actual was %d"
          .formatted(id, count));
  }

  private void requireArgsInstance(Council arg) {
    if (!arg.isArgs())
      throw new IllegalArgumentException(
          "\"args\"-instance expected; actual given: " + arg);
  }

  private void checkIdSet(CouncilId id) throws IllegalArgumentException {
    if (!id.isSet())
      throw new IllegalArgumentException("default id (0) not allowed");
  }

  static void checkId(long id) throws IllegalArgumentException {
    if (id <= 0)
      throw new IllegalArgumentException("positive id expected; actual was " + id);
  }


  private Council toCouncil(ResultSet rs) throws SQLException {
    var id = new CouncilId(rs.getLong(1));
    if (!id.isSet())
      throw new CouncilManagementException(
          "internal error: positive council_id invariant violated: " + id);
    try {
      return new Council(
          id,
          rs.getString(2),
          getString(rs, 3),
          getString(rs, 4),
          CouncilStatus.valueOf(rs.getString(5)),
          new QuorumPolicy(rs.getInt(6), rs.getInt(7) != 0),
          getJson(rs, 8),
          getJson(rs, 9),
          rs.getLong(10),
          rs.getLong(11));
    } catch (IllegalArgumentException | JsonParsingException iax) {
      throw new CouncilManagementException(
          "internal error: malformed council [%s] row: %s".formatted(id, iax.getMessage()),
          iax);
    }
  }

}
