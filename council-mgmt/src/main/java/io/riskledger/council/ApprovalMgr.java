/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;
import static io.riskledger.council.SchemaConstants.*;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.json.simple.JSONArray;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.council.Key.LongKey;
import io.riskledger.council.MembershipMgr.MembershipId;
import io.riskledger.json.JsonParsingException;
import io.riskledger.json.JsonValues;
import io.riskledger.util.TaskStack;

/**
 * Manages the {@code approvals} (votes) table. Append-only: there are no
 * update or delete operations.
 *
 * @see SchemaConstants#CREATE_APPROVALS_TABLE
 */
public class ApprovalMgr extends AbstractMgr {

  /**
   * A vote is identified by this typed number. Later votes have larger
   * numbers.
   */
  public final static class ApprovalId extends LongKey {

    ApprovalId(long id) {
      super(id);
    }

    @Override
    public boolean equals(Object o) {
      return o == this ||
          o instanceof ApprovalId other &&
          other.no() == this.no();
    }
  }


  /**
   * Creates the backing table and index, if they don't exist.
   */
  static void ensureTables(DbEnv env, Connection con) throws SQLException {
    new ApprovalMgr(env, con, Clock.systemUTC()).createTables(
        CREATE_APPROVALS_TABLE, CREATE_APPROVALS_INDEX);
  }


  public ApprovalMgr(DbEnv env, Connection con, Clock clock) {
    super(env, con, clock);
  }


  /**
   * Records a vote and returns it. The caller has validated the arguments
   * against the current state (assignment, council status, membership).
   *
   * @param args        the decision
   * @param membership  the voter's (active) membership, read in the same
   *                    transaction
   */
  public Approval insert(DecisionArgs args, Membership membership)
      throws UnsupportedOperationException, SQLException {

    checkWrite();
    if (membership.councilId().no() != args.councilId() ||
        membership.id().no() != args.membershipId())
      throw new IllegalArgumentException(
          "membership %s does not match decision args".formatted(membership));

    try (var closer = new TaskStack()) {
      var insert = prepareInsert(INSERT_APPROVAL, closer);
      insert.setString(1, args.assessmentId());
      insert.setLong(2, args.councilId());
      insert.setLong(3, args.membershipId());
      insert.setString(4, args.partnerId());
      insert.setString(5, args.step());
      insert.setString(6, args.status().name());
      setString(insert, 7, args.decisionNotes());
      setJson(insert, 8, args.reasonCodes());
      setString(insert, 9, args.evidenceSnapshotId());
      setJson(insert, 10, args.attachments());
      insert.setLong(11, now());

      long id = executeInsert(insert, closer);
      return getById(id);
    }
  }


  /**
   * Returns the vote with the given id.
   *
   * @throws NoSuchElementException if not found
   */
  public Approval getById(long id) throws NoSuchElementException, SQLException {
    CouncilMgr.checkId(id);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_APPROVAL_BY_ID, closer);
      query.setLong(1, id);
      ResultSet rs = executeQuery(query, closer);
      if (!rs.next())
        throw new NoSuchElementException("approval not found: " + id);
      return toApproval(rs);
    }
  }


  /**
   * Lists every vote cast on the assessment (by any council, by any member),
   * latest first.
   *
   * @return immutable list
   */
  public List<Approval> list(String assessmentId) throws SQLException {
    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_APPROVALS_BY_ASSESSMENT, closer);
      query.setString(1, assessmentId);
      ResultSet rs = executeQuery(query, closer);
      List<Approval> approvals = new ArrayList<>();
      while (rs.next())
        approvals.add(toApproval(rs));
      return approvals.isEmpty() ? List.of() : Collections.unmodifiableList(approvals);
    }
  }


  /**
   * Lists the status of every vote cast on the assessment by a currently
   * {@code ACTIVE} membership, in the order cast. Votes by revoked members
   * are excluded; repeated votes by the same member are not collapsed.
   *
   * @return immutable list
   */
  public List<ApprovalStatus> listActiveVotes(String assessmentId)
      throws SQLException {

    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_ACTIVE_VOTE_STATUSES, closer);
      query.setString(1, assessmentId);
      ResultSet rs = executeQuery(query, closer);
      List<ApprovalStatus> votes = new ArrayList<>();
      while (rs.next())
        votes.add(toStatus(rs.getString(1)));
      return votes.isEmpty() ? List.of() : Collections.unmodifiableList(votes);
    }
  }



  private Approval toApproval(ResultSet rs) throws SQLException {
    var id = new ApprovalId(rs.getLong(1));
    try {
      return new Approval(
          id,
          rs.getString(2),
          new CouncilId(rs.getLong(3)),
          new MembershipId(rs.getLong(4)),
          rs.getString(5),
          rs.getString(6),
          ApprovalStatus.valueOf(rs.getString(7)),
          getString(rs, 8),
          JsonValues.parseStringList(rs.getString(9)),
          getString(rs, 10),
          toAttachments(getJson(rs, 11)),
          rs.getLong(12));
    } catch (IllegalArgumentException | JsonParsingException x) {
      throw new CouncilManagementException(
          "internal error: malformed approval [%s] row: %s".formatted(id, x.getMessage()),
          x);
    }
  }


  private ApprovalStatus toStatus(String status) {
    try {
      return ApprovalStatus.valueOf(status);
    } catch (IllegalArgumentException iax) {
      throw new CouncilManagementException(
          "internal error: malformed approval status: " + status, iax);
    }
  }


  private Object toAttachments(Object json) {
    if (json == null || json instanceof JSONArray)
      return json;
    throw new JsonParsingException("expected JSON array of attachments: " + json);
  }

}
