/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;

import java.lang.System.Logger.Level;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.consensus.ApprovalVerdict;
import io.riskledger.consensus.QuorumConsensus;
import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.council.MembershipMgr.MembershipId;
import io.riskledger.ledger.EntryDraft;
import io.riskledger.ledger.LedgerEntry;
import io.riskledger.ledger.LedgerEntryType;
import io.riskledger.ledger.VerificationResult;

/**
 * Risk council governance: councils, their memberships, the assignment of
 * assessments to councils, votes, quorum verdicts, and per-assessment
 * evidence ledgers.
 *
 * <h2>Transactions</h2>
 * <p>
 * Instances hold no mutable state. Every operation borrows a pooled
 * connection, runs in a single transaction, and returns the connection.
 * In particular, a {@linkplain #submitDecision(DecisionArgs) decision}'s vote
 * and its ledger entry are committed (or rolled back) together. An operation
 * whose thread is interrupted before it commits is rolled back.
 * </p>
 * <h2>Errors</h2>
 * <ul>
 * <li>{@linkplain IllegalArgumentException}: bad or missing argument</li>
 * <li>{@linkplain IllegalStateException}: lifecycle violation (archived
 *     council, revoked membership, council mismatch)</li>
 * <li>{@linkplain NoSuchElementException}: unknown id (incl.
 *     {@linkplain UnassignedAssessmentException})</li>
 * <li>{@linkplain CouncilManagementException}: persistence failure; may be
 *     retried</li>
 * <li>{@linkplain UnsupportedOperationException}: write attempted in
 *     read-only mode</li>
 * </ul>
 * <p>
 * All are unchecked. Validation failures are raised before anything is
 * written.
 * </p>
 */
public class RiskCouncil implements AutoCloseable {

  /**
   * Creates the backing tables, if they don't exist, and returns a
   * read/write instance. The system table names begin with the
   * given {@code tablePrefix}.
   */
  public static RiskCouncil ensureInstance(
      String tablePrefix, HikariDataSource dataSource)
          throws CouncilManagementException {

    return new RiskCouncil(
        DbEnv.DEFAULT.tablePrefix(tablePrefix).readWrite(true),
        dataSource,
        true);
  }


  /**
   * Creates the backing tables, if they don't exist, and returns a
   * read/write instance. The system table names begin with the standard
   * {@code rc_} prefix.
   */
  public static RiskCouncil ensureInstance(HikariDataSource dataSource)
      throws CouncilManagementException {

    return new RiskCouncil(DbEnv.DEFAULT.readWrite(true), dataSource, true);
  }


  /**
   * Returns an instance per the given configuration. Unless configured
   * read-only, the backing tables are created if they don't exist.
   */
  public static RiskCouncil ensureInstance(CouncilConfig config)
      throws CouncilManagementException {

    var env = config.dbEnv();
    var dataSource = config.newDataSource();
    if (env.readWrite())
      return new RiskCouncil(env, dataSource, true);

    var loaded = load(env, dataSource);
    if (loaded.isEmpty()) {
      dataSource.close();
      throw new CouncilManagementException(
          "read-only configuration but tables with prefix '%s' not found"
          .formatted(env.tablePrefix()));
    }
    return loaded.get();
  }


  /**
   * Loads and returns an existing instance from the database, if found.
   * This loads by using database schema look-ups; no tables are created.
   *
   * @param env         environment opened in (incl. read-only setting)
   * @param dataSource  connection pool; closed by the returned instance
   */
  public static Optional<RiskCouncil> load(DbEnv env, HikariDataSource dataSource)
      throws CouncilManagementException {

    try (Connection con = dataSource.getConnection()) {
      for (var table : SchemaConstants.SYSTEM_TABLES)
        if (!tableExists(con, env.tablePrefix() + table))
          return Optional.empty();

    } catch (SQLException sx) {
      throw new CouncilManagementException("load failed", sx);
    }
    return Optional.of(new RiskCouncil(env, dataSource, false));
  }


  private static boolean tableExists(Connection con, String tableName)
      throws SQLException {
    var meta = con.getMetaData();
    String name =
        meta.storesUpperCaseIdentifiers() ? tableName.toUpperCase() :
          meta.storesLowerCaseIdentifiers() ? tableName.toLowerCase() : tableName;
    try (ResultSet rs = meta.getTables(null, null, name, new String[] { "TABLE" })) {
      return rs.next();
    }
  }




  //       - - -   I N S T A N C E   M E M B E R S   - - -


  private final DbEnv env;
  private final HikariDataSource dataSource;
  private final Clock clock;


  private RiskCouncil(DbEnv env, HikariDataSource dataSource, boolean create)
      throws CouncilManagementException {
    this(env, dataSource, create, Clock.systemUTC());
  }


  /**
   * Full constructor.
   *
   * @param create  if {@code true}, the backing tables are created if
   *                they don't exist
   * @param clock   source of record timestamps
   */
  RiskCouncil(DbEnv env, HikariDataSource dataSource, boolean create, Clock clock)
      throws CouncilManagementException {

    this.env = Objects.requireNonNull(env, "null env");
    this.dataSource = Objects.requireNonNull(dataSource, "null dataSource");
    this.clock = Objects.requireNonNull(clock, "null clock");

    if (create) {
      if (env.readOnly())
        throw new IllegalArgumentException("cannot create tables in read-only mode");
      inTransaction("ensure tables", con -> {
        CouncilMgr.ensureTables(env, con);
        MembershipMgr.ensureTables(env, con);
        AssessmentMgr.ensureTables(env, con);
        ApprovalMgr.ensureTables(env, con);
        SqlEvidenceLedger.ensureTables(env, con);
        return null;
      });
    }
  }


  /** Closes the connection pool. */
  @Override
  public void close() {
    dataSource.close();
  }


  /** Returns the environment this instance was opened in. */
  public DbEnv env() {
    return env;
  }


  /** Returns {@code true} if in read-only mode. */
  public boolean isReadOnly() {
    return env.readOnly();
  }




  //       - - -   C O U N C I L S   - - -


  /**
   * Creates a new council from the given "args"-instance.
   *
   * @see Council#argsInstance(String, String, String)
   */
  public Council createCouncil(Council args) throws CouncilManagementException {
    Objects.requireNonNull(args, "null args");
    checkWrite();
    return inTransaction("createCouncil", con -> councils(con).newCouncil(args));
  }


  /**
   * Returns the council with the given id.
   *
   * @throws NoSuchElementException if not found
   */
  public Council getCouncil(long councilId) throws NoSuchElementException {
    return inTransaction("getCouncil", con -> councils(con).getById(councilId, false));
  }


  /**
   * Lists councils in ascending id order.
   *
   * @param status    optional status filter
   * @param orgId     optional organization filter
   * @param cursor    exclusive council id to list after (0 for the first page)
   * @param limit     page size, in [1, {@linkplain CouncilConstants#MAX_LIMIT}]
   */
  public List<Council> listCouncils(
      Optional<CouncilStatus> status, Optional<String> orgId, long cursor, int limit) {
    Objects.requireNonNull(status, "null status");
    return inTransaction(
        "listCouncils",
        con -> councils(con).list(status, orgId, cursor, limit));
  }


  /**
   * Updates the council's user-settable fields (name, description,
   * organization, quorum policy, approval policy, metadata).
   *
   * @param args    "args"-instance with the new values
   *
   * @throws IllegalStateException if the council is archived
   */
  public Council updateCouncil(long councilId, Council args) {
    Objects.requireNonNull(args, "null args");
    checkWrite();
    var id = councilId(councilId);
    return inTransaction("updateCouncil", con -> councils(con).update(id, args));
  }


  /**
   * Archives the council. Archived councils no longer accept votes,
   * members, or assessments. Archiving is terminal and idempotent.
   */
  public Council archiveCouncil(long councilId) {
    checkWrite();
    var id = councilId(councilId);
    return inTransaction("archiveCouncil", con -> councils(con).archive(id));
  }




  //       - - -   M E M B E R S H I P S   - - -


  /**
   * Adds the user to the council, or reactivates (and updates) their
   * existing membership.
   *
   * @throws IllegalStateException if the council is archived
   */
  public Membership addOrReactivateMember(long councilId, MemberArgs args) {
    Objects.requireNonNull(args, "null args");
    checkWrite();
    CouncilMgr.checkId(councilId);
    return inTransaction("addOrReactivateMember", con -> {
      var council = councils(con).getById(councilId, false);
      checkActive(council);
      return memberships(con).addOrReactivate(council, args);
    });
  }


  /**
   * Updates the membership's role, permissions, or notes.
   */
  public Membership updateMembership(long membershipId, MembershipUpdate changes) {
    Objects.requireNonNull(changes, "null changes");
    checkWrite();
    var id = membershipId(membershipId);
    return inTransaction(
        "updateMembership",
        con -> memberships(con).update(id, changes));
  }


  /**
   * Revokes the membership. Votes cast under a revoked membership no
   * longer count toward verdicts; their ledger entries remain. Revoking a
   * revoked membership is a no-op.
   *
   * @param notes   optional revocation notes
   */
  public Membership revokeMembership(long membershipId, String notes) {
    checkWrite();
    var id = membershipId(membershipId);
    return inTransaction(
        "revokeMembership",
        con -> memberships(con).revoke(id, Optional.ofNullable(notes)));
  }


  /**
   * Returns the membership with the given id.
   *
   * @throws NoSuchElementException if not found
   */
  public Membership getMembership(long membershipId) {
    return inTransaction(
        "getMembership",
        con -> memberships(con).getById(membershipId, false));
  }


  /**
   * Lists the council's memberships, latest assigned first.
   *
   * @throws NoSuchElementException if the council is not found
   */
  public List<Membership> listMembers(long councilId, Optional<MembershipStatus> status) {
    Objects.requireNonNull(status, "null status");
    return inTransaction("listMembers", con -> {
      var council = councils(con).getById(councilId, false);
      return memberships(con).list(council.id(), status);
    });
  }




  //       - - -   A S S E S S M E N T S   - - -


  /**
   * Assigns the assessment to the council, replacing any previous
   * assignment. If the assignment changes, an {@code ASSIGNMENT} entry is
   * appended to the assessment's ledger.
   *
   * @param actorId   optional id of the user making the assignment
   *
   * @return the assignment
   * @throws IllegalStateException if the council is archived
   */
  public Assignment assignAssessmentToCouncil(
      String assessmentId, long councilId, String actorId) {
    checkWrite();
    CouncilMgr.checkId(councilId);
    var aid = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    return inTransaction("assignAssessmentToCouncil", con -> {
      var council = councils(con).getById(councilId, false);
      checkActive(council);
      var assessments = assessments(con);
      var previous = assessments.assign(aid, council.id());
      var previousCouncil = previous.flatMap(Assignment::councilId);
      if (!previousCouncil.equals(Optional.of(council.id())))
        appendAssignmentEntry(con, aid, Optional.of(council.id()), previousCouncil, actorId);
      return assessments.find(aid, false).orElseThrow(
          () -> new CouncilManagementException(
              "internal error: assessment '%s' not found after assign".formatted(aid)));
    });
  }


  /**
   * Clears the assessment's council assignment. If it was assigned, an
   * {@code ASSIGNMENT} entry is appended to the assessment's ledger.
   *
   * @param actorId   optional id of the user clearing the assignment
   *
   * @return the assignment before this call, if any
   */
  public Optional<Assignment> unassignAssessmentFromCouncil(
      String assessmentId, String actorId) {
    checkWrite();
    var aid = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    return inTransaction("unassignAssessmentFromCouncil", con -> {
      var previous = assessments(con).unassign(aid);
      var previousCouncil = previous.flatMap(Assignment::councilId);
      if (previousCouncil.isPresent())
        appendAssignmentEntry(con, aid, Optional.empty(), previousCouncil, actorId);
      return previous;
    });
  }


  private LedgerEntry appendAssignmentEntry(
      Connection con, String assessmentId,
      Optional<CouncilId> councilId, Optional<CouncilId> previousCouncilId,
      String actorId) throws SQLException {

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("action", councilId.isPresent() ? "ASSIGNED" : "UNASSIGNED");
    councilId.ifPresent(id -> payload.put("councilId", id.no()));
    previousCouncilId.ifPresent(id -> payload.put("previousCouncilId", id.no()));

    var draft = new EntryDraft(
        assessmentId,
        councilId.or(() -> previousCouncilId).map(CouncilId::no),
        Optional.empty(),
        Optional.empty(),
        EntryDraft.toActorId(actorId),
        SYSTEM_ROLE,
        LedgerEntryType.ASSIGNMENT,
        payload);
    return ledger(con).append(draft);
  }


  /**
   * Returns the council the assessment is assigned to, if any.
   */
  public Optional<Council> findCouncilOf(String assessmentId) {
    return inTransaction("findCouncilOf", con -> {
      var councilId = assessments(con).findCouncilId(assessmentId);
      return councilId.isEmpty() ?
          Optional.<Council>empty() :
            Optional.of(councils(con).getById(councilId.get().no(), false));
    });
  }


  /**
   * Lists the assessments assigned to the council, with their vote and
   * ledger entry counts, in ascending assessment id order.
   *
   * @param status  if present, only assessments with a vote of this status
   *                (in this council) are listed
   * @param cursor  exclusive assessment id to list after
   * @param limit   page size, in [1, {@linkplain CouncilConstants#MAX_LIMIT}]
   */
  public List<CouncilAssessment> listCouncilAssessments(
      long councilId, Optional<ApprovalStatus> status,
      Optional<String> cursor, int limit) {
    Objects.requireNonNull(status, "null status");
    Objects.requireNonNull(cursor, "null cursor");
    return inTransaction("listCouncilAssessments", con -> {
      var council = councils(con).getById(councilId, false);
      return assessments(con).listByCouncil(council.id(), status, cursor, limit);
    });
  }


  /**
   * Lists every vote cast on the assessment, latest first.
   */
  public List<Approval> listApprovals(String assessmentId) {
    return inTransaction("listApprovals", con -> approvals(con).list(assessmentId));
  }




  //       - - -   D E C I S I O N S   - - -


  /**
   * Records a council member's vote and, in the same transaction, appends
   * the corresponding entry to the assessment's evidence ledger.
   * The entry type is {@code APPROVAL}, {@code REJECTION}, or (for
   * {@code PENDING} votes) {@code STATUS_CHANGE}.
   *
   * @throws UnassignedAssessmentException
   *         if the assessment is not assigned to a council
   * @throws IllegalStateException
   *         if the assessment is assigned to another council, the council
   *         is archived, or the membership belongs to another council or
   *         is revoked
   * @throws NoSuchElementException
   *         if the council or membership is not found
   */
  public Decision submitDecision(DecisionArgs args) {
    Objects.requireNonNull(args, "null args");
    checkWrite();

    return inTransaction("submitDecision", con -> {

      final String assessmentId = args.assessmentId();

      var assignment =
          assessments(con).find(assessmentId, true)
          .filter(Assignment::isAssigned)
          .orElseThrow(() -> new UnassignedAssessmentException(assessmentId));

      var assignedId = assignment.councilId().get();
      if (assignedId.no() != args.councilId())
        throw new IllegalStateException(
            "assessment '%s' is assigned to council [%s], not [%d]"
            .formatted(assessmentId, assignedId, args.councilId()));

      var council = councils(con).getById(args.councilId(), false);
      checkActive(council);

      var membership =
          memberships(con).findById(args.membershipId(), false)
          .orElseThrow(() -> new NoSuchElementException(
              "membership not found: " + args.membershipId()));
      if (!membership.councilId().equals(council.id()))
        throw new IllegalStateException(
            "membership [%s] belongs to council [%s], not [%s]"
            .formatted(membership.id(), membership.councilId(), council.id()));
      if (!membership.isActive())
        throw new IllegalStateException(
            "membership [%s] is %s".formatted(membership.id(), membership.status()));

      var approval = approvals(con).insert(args, membership);
      var entry = appendDecisionEntry(con, approval, args);

      getLogger().log(
          Level.INFO,
          "assessment '%s' step '%s': %s by membership [%s] (approval [%s], ledger seq %d)"
          .formatted(
              assessmentId, args.step(), args.status(), membership.id(),
              approval.id(), entry.seqNo()));

      return new Decision(approval, entry);
    });
  }


  /**
   * Appends the ledger entry for a just-recorded vote. Runs inside the
   * vote's transaction.
   */
  protected LedgerEntry appendDecisionEntry(
      Connection con, Approval approval, DecisionArgs args) throws SQLException {

    var draft = new EntryDraft(
        args.assessmentId(),
        Optional.of(approval.councilId().no()),
        Optional.of(approval.membershipId().no()),
        Optional.of(approval.id().no()),
        Optional.of(args.actorId()),
        args.actorRole(),
        entryType(args.status()),
        args.ledgerPayload());
    return ledger(con).append(draft);
  }


  /**
   * Returns the ledger entry type for the given vote status.
   */
  public static LedgerEntryType entryType(ApprovalStatus status) {
    switch (status) {
    case APPROVED:  return LedgerEntryType.APPROVAL;
    case REJECTED:  return LedgerEntryType.REJECTION;
    case PENDING:   return LedgerEntryType.STATUS_CHANGE;
    default:
      throw new IllegalArgumentException("unknown status: " + status);
    }
  }


  /**
   * Computes the assessment's verdict under its current council's quorum
   * policy. Every vote on the assessment cast by a currently
   * {@code ACTIVE} membership is counted, whichever council it was cast in,
   * and repeated votes are not collapsed. This is a plain read: the verdict
   * may change by the time it's acted on.
   *
   * @throws UnassignedAssessmentException
   *         if the assessment is not assigned to a council
   */
  public ApprovalVerdict checkApprovalStatus(String assessmentId) {
    var aid = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    return inTransaction("checkApprovalStatus", con -> {
      var councilId =
          assessments(con).findCouncilId(aid)
          .orElseThrow(() -> new UnassignedAssessmentException(aid));
      var council = councils(con).getById(councilId.no(), false);
      var votes = approvals(con).listActiveVotes(aid);
      return QuorumConsensus.evaluate(council.policy(), votes);
    });
  }




  //       - - -   E V I D E N C E   L E D G E R   - - -


  /**
   * Appends a non-vote entry (e.g. {@code SYSTEM_EVENT},
   * {@code POLICY_CHANGE}) to the assessment's ledger. The assessment need
   * not be assigned.
   *
   * @throws IllegalArgumentException
   *         if the draft's type is {@code APPROVAL} or {@code REJECTION}:
   *         votes are recorded with {@linkplain #submitDecision(DecisionArgs)}
   */
  public LedgerEntry appendEntry(EntryDraft draft) {
    Objects.requireNonNull(draft, "null draft");
    if (draft.entryType().isDecisive())
      throw new IllegalArgumentException(
          "%s entries are appended by submitDecision".formatted(draft.entryType()));
    checkWrite();
    var entry = inTransaction("appendEntry", con -> ledger(con).append(draft));
    getLogger().log(
        Level.INFO,
        "assessment '%s' ledger: appended %s (seq %d)"
        .formatted(entry.assessmentId(), entry.entryType(), entry.seqNo()));
    return entry;
  }


  /**
   * Returns a page of the assessment's ledger, in ascending sequence
   * order. Payloads are returned as stored.
   */
  public LedgerPage getLedger(String assessmentId, LedgerQuery query) {
    Objects.requireNonNull(query, "null query");
    return inTransaction("getLedger", con -> ledger(con).page(assessmentId, query));
  }


  /** Returns the first page of the assessment's ledger. */
  public LedgerPage getLedger(String assessmentId) {
    return getLedger(assessmentId, LedgerQuery.DEFAULT);
  }


  /**
   * Verifies the assessment's evidence chain. A broken chain is reported,
   * not thrown.
   */
  public VerificationResult verifyLedger(String assessmentId) {
    return inTransaction("verifyLedger", con -> ledger(con).verify(assessmentId));
  }




  //       - - -   T R A N S A C T I O N S   - - -


  /** Unit of work run in a transaction. */
  @FunctionalInterface
  interface TxWork<T> {
    T run(Connection con) throws SQLException;
  }


  /**
   * Runs the given work in a new transaction on a pooled connection and
   * commits it. On any failure (or if the current thread was interrupted)
   * the transaction is rolled back and the failure propagated, with
   * {@linkplain SQLException}s wrapped as
   * {@linkplain CouncilManagementException}s.
   *
   * @param op    operation name (for messages)
   */
  <T> T inTransaction(String op, TxWork<T> work) throws CouncilManagementException {

    try (Connection con = dataSource.getConnection()) {

      con.setAutoCommit(false);
      try {
        T result = work.run(con);
        if (Thread.currentThread().isInterrupted())
          throw new CouncilManagementException(op + " interrupted before commit");
        con.commit();
        return result;

      } catch (Throwable x) {
        rollback(con, op, x);
        throw x;
      }

    } catch (SQLException sqx) {
      getLogger().log(Level.WARNING, op + " failed", sqx);
      throw new CouncilManagementException(op + " failed", sqx);
    }
  }


  private void rollback(Connection con, String op, Throwable cause) {
    try {
      con.rollback();
      if (cause instanceof IllegalArgumentException ||
          cause instanceof IllegalStateException ||
          cause instanceof NoSuchElementException)
        getLogger().log(Level.DEBUG, "%s rejected: %s".formatted(op, cause.getMessage()));
      else
        getLogger().log(Level.WARNING, "%s rolled back on: %s".formatted(op, cause));

    } catch (SQLException rbx) {
      getLogger().log(Level.ERROR, "rollback of " + op + " failed", rbx);
      cause.addSuppressed(rbx);
    }
  }




  //       - - -   H E L P E R S   - - -


  private void checkWrite() throws UnsupportedOperationException {
    if (env.readOnly())
      throw new UnsupportedOperationException(
          "operation not supported without write-privileges");
  }

  private void checkActive(Council council) throws IllegalStateException {
    if (!council.isActive())
      throw new IllegalStateException("council [%s] is archived".formatted(council.id()));
  }

  private CouncilId councilId(long id) {
    CouncilMgr.checkId(id);
    return new CouncilId(id);
  }

  private MembershipId membershipId(long id) {
    CouncilMgr.checkId(id);
    return new MembershipId(id);
  }

  private CouncilMgr councils(Connection con) {
    return new CouncilMgr(env, con, clock);
  }

  private MembershipMgr memberships(Connection con) {
    return new MembershipMgr(env, con, clock);
  }

  private AssessmentMgr assessments(Connection con) {
    return new AssessmentMgr(env, con, clock);
  }

  private ApprovalMgr approvals(Connection con) {
    return new ApprovalMgr(env, con, clock);
  }

  private SqlEvidenceLedger ledger(Connection con) {
    return new SqlEvidenceLedger(env, con, clock);
  }

}
