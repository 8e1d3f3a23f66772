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
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.util.TaskStack;

/**
 * Manages the {@code assessments} table: the assessment-to-council
 * assignment pointer. Assessments themselves live elsewhere; a row is
 * created the first time an assessment is assigned, and is kept (with a
 * {@code NULL} council) when unassigned.
 *
 * @see SchemaConstants#CREATE_ASSESSMENTS_TABLE
 */
public class AssessmentMgr extends AbstractMgr {


  /**
   * Creates the backing table, if it doesn't exist.
   */
  static void ensureTables(DbEnv env, Connection con) throws SQLException {
    new AssessmentMgr(env, con, Clock.systemUTC()).createTables(CREATE_ASSESSMENTS_TABLE);
  }


  public AssessmentMgr(DbEnv env, Connection con, Clock clock) {
    super(env, con, clock);
  }


  /**
   * Finds the assessment's assignment.
   *
   * @param assessmentId  not blank
   * @param forUpdate     if {@code true}, the row (if found) is locked till
   *                      the end of the transaction
   *
   * @return empty, if the assessment was never assigned
   */
  public Optional<Assignment> find(String assessmentId, boolean forUpdate)
      throws IllegalArgumentException, SQLException {

    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(
          forUpdate ? SELECT_ASSESSMENT_BY_ID_FOR_UPDATE : SELECT_ASSESSMENT_BY_ID,
          closer);
      query.setString(1, assessmentId);
      ResultSet rs = executeQuery(query, closer);
      return rs.next() ? Optional.of(toAssignment(rs)) : Optional.empty();
    }
  }


  /**
   * Returns the id of the council the assessment is assigned to, if any.
   */
  public Optional<CouncilId> findCouncilId(String assessmentId) throws SQLException {
    return find(assessmentId, false).flatMap(Assignment::councilId);
  }


  /**
   * Assigns the assessment to the given council, replacing any previous
   * assignment. The caller checks the council's status.
   *
   * @return the assignment before this call (empty, if never assigned)
   */
  public Optional<Assignment> assign(String assessmentId, CouncilId councilId)
      throws IllegalArgumentException, UnsupportedOperationException, SQLException {
    if (!councilId.isSet())
      throw new IllegalArgumentException("default council id (0) not allowed");
    return setCouncil(assessmentId, Optional.of(councilId));
  }


  /**
   * Clears the assessment's council assignment.
   *
   * @return the assignment before this call (empty, if never assigned)
   */
  public Optional<Assignment> unassign(String assessmentId)
      throws IllegalArgumentException, UnsupportedOperationException, SQLException {
    return setCouncil(assessmentId, Optional.empty());
  }


  private Optional<Assignment> setCouncil(
      String assessmentId, Optional<CouncilId> councilId) throws SQLException {

    checkWrite();
    final var previous = find(assessmentId, true);
    final String id = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);

    if (previous.isPresent() && previous.get().councilId().equals(councilId))
      return previous;
    if (previous.isEmpty() && councilId.isEmpty())
      return previous;

    final long now = now();
    try (var closer = new TaskStack()) {
      if (previous.isPresent()) {
        var update = prepareStmt(UPDATE_ASSESSMENT_COUNCIL, closer);
        setCouncilId(update, 1, councilId);
        update.setLong(2, Math.max(now, previous.get().assignedUtc()));
        update.setString(3, id);
        update.executeUpdate();
      } else {
        var insert = prepareStmt(INSERT_ASSESSMENT, closer);
        insert.setString(1, id);
        setCouncilId(insert, 2, councilId);
        insert.setLong(3, now);
        try {
          insert.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException icvx) {
          throw new CouncilManagementException(
              "race on assigning assessment '%s'; retry".formatted(id), icvx);
        }
      }
    }
    getLogger().log(
        Level.INFO,
        "assessment '%s' %s".formatted(
            id,
            councilId.map(c -> "ASSIGNED to council [" + c + "]").orElse("UNASSIGNED")));
    return previous;
  }


  /**
   * Lists the assessments assigned to the given council, in ascending
   * assessment-id order.
   *
   * @param councilId   the council
   * @param status      if present, only assessments with at least one vote
   *                    (by this council) with this status are listed
   * @param cursor      exclusive lower bound on the assessment id
   * @param limit       page size, in [1, 100]
   *
   * @return immutable list
   */
  public List<CouncilAssessment> listByCouncil(
      CouncilId councilId,
      Optional<ApprovalStatus> status,
      Optional<String> cursor,
      int limit) throws IllegalArgumentException, SQLException {

    checkLimit(limit);
    var sql = new StringBuilder(SELECT_COUNCIL_ASSESSMENTS);
    if (status.isPresent())
      sql.append(AND_HAS_VOTE_STATUS);
    sql.append(" ORDER BY a.assessment_id LIMIT ?");

    try (var closer = new TaskStack()) {
      var query = prepareStmt(sql.toString(), closer);
      int col = 0;
      query.setLong(++col, councilId.no());
      query.setString(++col, normalize(cursor).orElse(""));
      if (status.isPresent())
        query.setString(++col, status.get().name());
      query.setInt(++col, limit);

      ResultSet rs = executeQuery(query, closer);
      List<CouncilAssessment> list = new ArrayList<>();
      while (rs.next())
        list.add(new CouncilAssessment(toAssignment(rs), rs.getLong(4), rs.getLong(5)));
      return list.isEmpty() ? List.of() : Collections.unmodifiableList(list);
    }
  }



  private static void setCouncilId(
      PreparedStatement stmt, int col, Optional<CouncilId> councilId)
          throws SQLException {
    if (councilId.isEmpty())
      stmt.setNull(col, Types.BIGINT);
    else
      stmt.setLong(col, councilId.get().no());
  }


  /** Reads the first 3 columns (assessment_id, council_id, assigned_utc). */
  private Assignment toAssignment(ResultSet rs) throws SQLException {
    return new Assignment(
        rs.getString(1),
        getLong(rs, 2).map(CouncilId::new),
        rs.getLong(3));
  }

}
