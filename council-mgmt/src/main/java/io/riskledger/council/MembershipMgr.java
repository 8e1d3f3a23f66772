/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;
import static io.riskledger.council.SchemaConstants.*;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.council.Key.LongKey;
import io.riskledger.json.JsonParsingException;
import io.riskledger.util.TaskStack;

/**
 * Manages the {@code memberships} table.
 *
 * <h2>Lifecycle</h2>
 * <p>
 * A user has at most one membership row per council. Adding a user who
 * already has a (revoked, or active) row reactivates that row, replacing its
 * role, permissions, notes, and assignment info. Revoking sets the status to
 * {@code REVOKED} and stamps the revocation time; rows are never deleted.
 * </p>
 *
 * @see SchemaConstants#CREATE_MEMBERSHIPS_TABLE
 */
public class MembershipMgr extends AbstractMgr {

  /**
   * A membership is identified by this typed number.
   */
  public final static class MembershipId extends LongKey {

    MembershipId(long id) {
      super(id);
    }

    @Override
    public boolean equals(Object o) {
      return o == this ||
          o instanceof MembershipId other &&
          other.no() == this.no();
    }
  }


  /**
   * Creates the backing table, if it doesn't exist.
   */
  static void ensureTables(DbEnv env, Connection con) throws SQLException {
    new MembershipMgr(env, con, Clock.systemUTC()).createTables(CREATE_MEMBERSHIPS_TABLE);
  }


  /**
   * Constructs a new instance. The backing table is assumed to
   * already exist.
   */
  public MembershipMgr(DbEnv env, Connection con, Clock clock) {
    super(env, con, clock);
  }


  /**
   * Adds the user to the council, or if the user already has a membership
   * on the council, reactivates it. Either way, there is exactly one row
   * for the (council, user) pair afterward, and it is {@code ACTIVE} with no
   * revocation time.
   *
   * @param council   the council (read from the database); the caller
   *                  checks its status
   * @param args      member arguments
   *
   * @return the active membership
   *
   * @throws CouncilManagementException
   *         if a concurrent add of the same user wins the race
   */
  public Membership addOrReactivate(Council council, MemberArgs args)
      throws UnsupportedOperationException, SQLException {

    checkWrite();
    if (council.isArgs())
      throw new IllegalArgumentException("\"args\"-instance council: " + council);

    final var councilId = council.id();
    final long now = now();

    var existing = findByUser(councilId, args.userId());

    final long id;
    try (var closer = new TaskStack()) {

      if (existing.isPresent()) {

        id = existing.get().id().no();
        var update = prepareStmt(REACTIVATE_MEMBERSHIP, closer);
        update.setString(1, args.role().name());
        update.setString(2, MembershipStatus.ACTIVE.name());
        setJson(update, 3, args.permissions());
        setString(update, 4, args.notes());
        update.setString(5, args.assignedBy());
        update.setLong(6, now);
        update.setLong(7, id);
        checkUpdateCount(update.executeUpdate(), id);

        if (!existing.get().isActive())
          getLogger().log(
              Level.INFO,
              "membership [%d] (user '%s', council [%s]) REACTIVATED"
              .formatted(id, args.userId(), councilId));

      } else {

        var insert = prepareInsert(INSERT_MEMBERSHIP, closer);
        insert.setLong(1, councilId.no());
        insert.setString(2, args.userId());
        insert.setString(3, args.role().name());
        insert.setString(4, MembershipStatus.ACTIVE.name());
        setJson(insert, 5, args.permissions());
        setString(insert, 6, args.notes());
        insert.setString(7, args.assignedBy());
        insert.setLong(8, now);
        try {
          id = executeInsert(insert, closer);
        } catch (SQLIntegrityConstraintViolationException icvx) {
          throw new CouncilManagementException(
              "race on adding user '%s' to council [%s]; retry"
              .formatted(args.userId(), councilId),
              icvx);
        }
        getLogger().log(
            Level.INFO,
            "membership [%d] (user '%s', council [%s]) ADDED as %s"
            .formatted(id, args.userId(), councilId, args.role()));
      }
    }
    return getById(id, false);
  }


  /**
   * Updates the role, permissions, or notes of the specified membership.
   *
   * @throws NoSuchElementException if no such membership exists
   */
  public Membership update(MembershipId id, MembershipUpdate changes)
      throws NoSuchElementException, UnsupportedOperationException, SQLException {

    checkWrite();
    final var existing = getById(id.no(), true);
    if (changes.isEmpty())
      return existing;

    try (var closer = new TaskStack()) {
      var update = prepareStmt(UPDATE_MEMBERSHIP, closer);
      update.setString(1, changes.role().orElse(existing.role()).name());
      setJson(update, 2, changes.permissions().orElse(existing.permissions()));
      setString(
          update, 3,
          changes.notes().isPresent() ? normalize(changes.notes()) : existing.notes());
      update.setLong(4, id.no());
      checkUpdateCount(update.executeUpdate(), id.no());
    }
    return getById(id.no(), false);
  }


  /**
   * Revokes the specified membership. Revoking an already revoked membership
   * changes nothing (its revocation time stays the same).
   *
   * @param id      membership id
   * @param notes   optional notes; if present, replaces the existing notes
   *
   * @return the revoked membership
   *
   * @throws NoSuchElementException if no such membership exists
   */
  public Membership revoke(MembershipId id, Optional<String> notes)
      throws NoSuchElementException, UnsupportedOperationException, SQLException {

    checkWrite();
    notes = checkText(notes, "notes", MAX_TEXT_LENGTH);
    final var existing = getById(id.no(), true);
    if (!existing.isActive())
      return existing;

    try (var closer = new TaskStack()) {
      var update = prepareStmt(REVOKE_MEMBERSHIP, closer);
      update.setString(1, MembershipStatus.REVOKED.name());
      setString(update, 2, notes.isPresent() ? notes : existing.notes());
      update.setLong(3, Math.max(now(), existing.assignedUtc()));
      update.setLong(4, id.no());
      checkUpdateCount(update.executeUpdate(), id.no());
    }
    getLogger().log(
        Level.INFO,
        "membership [%s] (user '%s', council [%s]) REVOKED"
        .formatted(id, existing.userId(), existing.councilId()));
    return getById(id.no(), false);
  }


  /**
   * Returns the membership with the specified {@code id}.
   *
   * @param forUpdate if {@code true}, the row is locked till the end of the
   *                  transaction
   *
   * @throws NoSuchElementException if not found
   */
  public Membership getById(long id, boolean forUpdate)
      throws NoSuchElementException, SQLException {
    return findById(id, forUpdate).orElseThrow(
        () -> new NoSuchElementException("membership not found: " + id));
  }


  /**
   * Finds and returns the membership with the specified {@code id}.
   */
  public Optional<Membership> findById(long id, boolean forUpdate)
      throws IllegalArgumentException, SQLException {

    CouncilMgr.checkId(id);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(
          forUpdate ? SELECT_MEMBERSHIP_BY_ID_FOR_UPDATE : SELECT_MEMBERSHIP_BY_ID,
          closer);
      query.setLong(1, id);
      ResultSet rs = executeQuery(query, closer);
      return rs.next() ? Optional.of(toMembership(rs)) : Optional.empty();
    }
  }


  /**
   * Finds the given user's membership on the given council, locking the
   * row (if found) till the end of the transaction.
   */
  public Optional<Membership> findByUser(CouncilId councilId, String userId)
      throws SQLException {

    userId = checkText(userId, "userId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_MEMBERSHIP_BY_USER_FOR_UPDATE, closer);
      query.setLong(1, councilId.no());
      query.setString(2, userId);
      ResultSet rs = executeQuery(query, closer);
      return rs.next() ? Optional.of(toMembership(rs)) : Optional.empty();
    }
  }


  /**
   * Lists the council's memberships, most recently assigned first.
   *
   * @param status  optional status filter
   *
   * @return immutable list
   */
  public List<Membership> list(CouncilId councilId, Optional<MembershipStatus> status)
      throws SQLException {

    var sql = new StringBuilder(SELECT_MEMBERSHIPS_BY_COUNCIL);
    if (status.isPresent())
      sql.append(" AND status = ?");
    sql.append(" ORDER BY assigned_utc DESC, membership_id DESC");

    try (var closer = new TaskStack()) {
      var query = prepareStmt(sql.toString(), closer);
      query.setLong(1, councilId.no());
      if (status.isPresent())
        query.setString(2, status.get().name());
      ResultSet rs = executeQuery(query, closer);
      List<Membership> members = new ArrayList<>();
      while (rs.next())
        members.add(toMembership(rs));
      return members.isEmpty() ? List.of() : Collections.unmodifiableList(members);
    }
  }



  private void checkUpdateCount(int count, long id) {
    if (count != 1)
      throw new CouncilManagementException(
          "internal error: expected 1 membership [%d] row updated; actual was %d"
          .formatted(id, count));
  }


  private Membership toMembership(ResultSet rs) throws SQLException {
    var id = new MembershipId(rs.getLong(1));
    try {
      return new Membership(
          id,
          new CouncilId(rs.getLong(2)),
          rs.getString(3),
          CouncilRole.valueOf(rs.getString(4)),
          MembershipStatus.valueOf(rs.getString(5)),
          getJson(rs, 6),
          getString(rs, 7),
          rs.getString(8),
          rs.getLong(9),
          getLong(rs, 10));
    } catch (IllegalArgumentException | JsonParsingException x) {
      throw new CouncilManagementException(
          "internal error: malformed membership [%s] row: %s".formatted(id, x.getMessage()),
          x);
    }
  }

}
