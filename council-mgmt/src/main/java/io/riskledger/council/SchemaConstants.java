/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * Table definitions and SQL. Table names are prefixed: the {@code "%s"}
 * markers are replaced by the {@linkplain DbEnv#tablePrefix() table prefix}.
 * Times are epoch milliseconds ({@code BIGINT}); JSON values are stored as
 * text ({@code CLOB}).
 *
 * @see DbEnv#applyTablePrefix(String)
 */
public class SchemaConstants {

  // no body calls
  private SchemaConstants() {  }


  /** Councils table-name suffix. */
  public final static String COUNCILS = "councils";
  /** Memberships table-name suffix. */
  public final static String MEMBERSHIPS = "memberships";
  /** Assessment assignments table-name suffix. */
  public final static String ASSESSMENTS = "assessments";
  /** Approvals (votes) table-name suffix. */
  public final static String APPROVALS = "approvals";
  /** Ledger chain-heads table-name suffix. */
  public final static String LEDGER_HEADS = "ledger_heads";
  /** Ledger entries table-name suffix. */
  public final static String LEDGER_ENTRIES = "ledger_entries";


  /** System table-name suffixes, in creation order. */
  public final static String[] SYSTEM_TABLES = {
      COUNCILS,
      MEMBERSHIPS,
      ASSESSMENTS,
      APPROVALS,
      LEDGER_HEADS,
      LEDGER_ENTRIES,
  };



  // COUNCILS

  public final static String CREATE_COUNCILS_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %scouncils (
        council_id BIGINT NOT NULL AUTO_INCREMENT,
        name VARCHAR(255) NOT NULL,
        description VARCHAR(4096),
        org_id VARCHAR(255),
        status VARCHAR(16) NOT NULL,
        quorum INT NOT NULL,
        unanimous INT NOT NULL,
        approval_policy CLOB,
        metadata CLOB,
        created_utc BIGINT NOT NULL,
        updated_utc BIGINT NOT NULL,
        PRIMARY KEY (council_id) )""";


  public final static String COUNCIL_COLUMNS =
      """
      council_id, name, description, org_id, status, quorum, unanimous, \
      approval_policy, metadata, created_utc, updated_utc""";

  public final static String SELECT_COUNCIL_BY_ID =
      "SELECT " + COUNCIL_COLUMNS + " FROM %scouncils WHERE council_id = ?";

  public final static String SELECT_COUNCIL_BY_ID_FOR_UPDATE =
      SELECT_COUNCIL_BY_ID + " FOR UPDATE";

  /** Listing prefix; conditions and the {@code ORDER BY .. LIMIT} are appended. */
  public final static String SELECT_COUNCILS_AFTER =
      "SELECT " + COUNCIL_COLUMNS + " FROM %scouncils WHERE council_id > ?";

  public final static String INSERT_COUNCIL =
      """
      INSERT INTO %scouncils (name, description, org_id, status, quorum, unanimous, \
      approval_policy, metadata, created_utc, updated_utc) \
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

  public final static String UPDATE_COUNCIL =
      """
      UPDATE %scouncils SET name = ?, description = ?, org_id = ?, quorum = ?, \
      unanimous = ?, approval_policy = ?, metadata = ?, updated_utc = ? \
      WHERE council_id = ?""";

  public final static String UPDATE_COUNCIL_STATUS =
      "UPDATE %scouncils SET status = ?, updated_utc = ? WHERE council_id = ?";



  // MEMBERSHIPS

  public final static String CREATE_MEMBERSHIPS_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %smemberships (
        membership_id BIGINT NOT NULL AUTO_INCREMENT,
        council_id BIGINT NOT NULL,
        user_id VARCHAR(255) NOT NULL,
        role VARCHAR(16) NOT NULL,
        status VARCHAR(16) NOT NULL,
        permissions CLOB,
        notes VARCHAR(4096),
        assigned_by VARCHAR(255) NOT NULL,
        assigned_utc BIGINT NOT NULL,
        revoked_utc BIGINT,
        PRIMARY KEY (membership_id),
        UNIQUE (council_id, user_id),
        FOREIGN KEY (council_id) REFERENCES %scouncils (council_id) )""";


  public final static String MEMBERSHIP_COLUMNS =
      """
      membership_id, council_id, user_id, role, status, permissions, notes, \
      assigned_by, assigned_utc, revoked_utc""";

  public final static String SELECT_MEMBERSHIP_BY_ID =
      "SELECT " + MEMBERSHIP_COLUMNS + " FROM %smemberships WHERE membership_id = ?";

  public final static String SELECT_MEMBERSHIP_BY_ID_FOR_UPDATE =
      SELECT_MEMBERSHIP_BY_ID + " FOR UPDATE";

  public final static String SELECT_MEMBERSHIP_BY_USER_FOR_UPDATE =
      """
      SELECT %s FROM %%smemberships WHERE council_id = ? AND user_id = ? FOR UPDATE"""
      .formatted(MEMBERSHIP_COLUMNS);

  public final static String SELECT_MEMBERSHIPS_BY_COUNCIL =
      "SELECT " + MEMBERSHIP_COLUMNS + " FROM %smemberships WHERE council_id = ?";

  public final static String INSERT_MEMBERSHIP =
      """
      INSERT INTO %smemberships (council_id, user_id, role, status, permissions, \
      notes, assigned_by, assigned_utc, revoked_utc) \
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, NULL)""";

  /** Reactivation replaces everything but the council and user. */
  public final static String REACTIVATE_MEMBERSHIP =
      """
      UPDATE %smemberships SET role = ?, status = ?, permissions = ?, notes = ?, \
      assigned_by = ?, assigned_utc = ?, revoked_utc = NULL \
      WHERE membership_id = ?""";

  public final static String UPDATE_MEMBERSHIP =
      """
      UPDATE %smemberships SET role = ?, permissions = ?, notes = ? \
      WHERE membership_id = ?""";

  public final static String REVOKE_MEMBERSHIP =
      """
      UPDATE %smemberships SET status = ?, notes = ?, revoked_utc = ? \
      WHERE membership_id = ?""";



  // ASSESSMENTS

  public final static String CREATE_ASSESSMENTS_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %sassessments (
        assessment_id VARCHAR(255) NOT NULL,
        council_id BIGINT,
        assigned_utc BIGINT NOT NULL,
        PRIMARY KEY (assessment_id),
        FOREIGN KEY (council_id) REFERENCES %scouncils (council_id) )""";


  public final static String SELECT_ASSESSMENT_BY_ID =
      "SELECT assessment_id, council_id, assigned_utc FROM %sassessments WHERE assessment_id = ?";

  public final static String SELECT_ASSESSMENT_BY_ID_FOR_UPDATE =
      SELECT_ASSESSMENT_BY_ID + " FOR UPDATE";

  public final static String INSERT_ASSESSMENT =
      "INSERT INTO %sassessments (assessment_id, council_id, assigned_utc) VALUES (?, ?, ?)";

  public final static String UPDATE_ASSESSMENT_COUNCIL =
      "UPDATE %sassessments SET council_id = ?, assigned_utc = ? WHERE assessment_id = ?";


  /**
   * Council assessment listing with vote and ledger-entry counts. Parameters:
   * council id, cursor (exclusive assessment id). The optional status filter
   * and the {@code ORDER BY .. LIMIT} are appended.
   */
  public final static String SELECT_COUNCIL_ASSESSMENTS =
      """
      SELECT a.assessment_id, a.council_id, a.assigned_utc, \
      (SELECT COUNT(*) FROM %sapprovals v \
      WHERE v.assessment_id = a.assessment_id AND v.council_id = a.council_id), \
      (SELECT COUNT(*) FROM %sledger_entries e WHERE e.assessment_id = a.assessment_id) \
      FROM %sassessments a \
      WHERE a.council_id = ? AND a.assessment_id > ?""";

  /** Status filter appended to {@linkplain #SELECT_COUNCIL_ASSESSMENTS}. */
  public final static String AND_HAS_VOTE_STATUS =
      """
       AND EXISTS (SELECT 1 FROM %sapprovals s \
      WHERE s.assessment_id = a.assessment_id AND s.council_id = a.council_id \
      AND s.status = ?)""";



  // APPROVALS

  public final static String CREATE_APPROVALS_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %sapprovals (
        approval_id BIGINT NOT NULL AUTO_INCREMENT,
        assessment_id VARCHAR(255) NOT NULL,
        council_id BIGINT NOT NULL,
        membership_id BIGINT NOT NULL,
        partner_id VARCHAR(255) NOT NULL,
        step VARCHAR(255) NOT NULL,
        status VARCHAR(16) NOT NULL,
        decision_notes VARCHAR(4096),
        reason_codes CLOB,
        evidence_snapshot_id VARCHAR(255),
        attachments CLOB,
        decided_utc BIGINT NOT NULL,
        PRIMARY KEY (approval_id),
        FOREIGN KEY (council_id) REFERENCES %scouncils (council_id),
        FOREIGN KEY (membership_id) REFERENCES %smemberships (membership_id) )""";

  public final static String CREATE_APPROVALS_INDEX =
      """
      CREATE INDEX IF NOT EXISTS %sapprovals_asmt_idx \
      ON %sapprovals (assessment_id, council_id)""";


  public final static String APPROVAL_COLUMNS =
      """
      approval_id, assessment_id, council_id, membership_id, partner_id, step, \
      status, decision_notes, reason_codes, evidence_snapshot_id, attachments, \
      decided_utc""";

  public final static String SELECT_APPROVAL_BY_ID =
      "SELECT " + APPROVAL_COLUMNS + " FROM %sapprovals WHERE approval_id = ?";

  /** Latest first. */
  public final static String SELECT_APPROVALS_BY_ASSESSMENT =
      """
      SELECT %s FROM %%sapprovals WHERE assessment_id = ? \
      ORDER BY decided_utc DESC, approval_id DESC"""
      .formatted(APPROVAL_COLUMNS);

  /**
   * Selects the status of every vote on an assessment cast by a membership
   * that is currently active, in the order cast.
   */
  public final static String SELECT_ACTIVE_VOTE_STATUSES =
      """
      SELECT v.status \
      FROM %sapprovals v JOIN %smemberships m ON v.membership_id = m.membership_id \
      WHERE v.assessment_id = ? AND m.status = 'ACTIVE' ORDER BY v.approval_id""";

  public final static String INSERT_APPROVAL =
      """
      INSERT INTO %sapprovals (assessment_id, council_id, membership_id, \
      partner_id, step, status, decision_notes, reason_codes, evidence_snapshot_id, \
      attachments, decided_utc) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";



  // LEDGER

  /**
   * One row per assessment with a non-empty chain (or one being started).
   * The row is the lock appenders serialize on; it records the last
   * entry's sequence no. and hash.
   */
  public final static String CREATE_LEDGER_HEADS_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %sledger_heads (
        assessment_id VARCHAR(255) NOT NULL,
        seq_no BIGINT NOT NULL,
        hash CHAR(64),
        PRIMARY KEY (assessment_id) )""";

  public final static String CREATE_LEDGER_ENTRIES_TABLE =
      """
      CREATE TABLE IF NOT EXISTS %sledger_entries (
        entry_no BIGINT NOT NULL AUTO_INCREMENT,
        assessment_id VARCHAR(255) NOT NULL,
        seq_no BIGINT NOT NULL,
        council_id BIGINT,
        membership_id BIGINT,
        approval_id BIGINT,
        actor_id VARCHAR(255),
        actor_role VARCHAR(255) NOT NULL,
        entry_type VARCHAR(32) NOT NULL,
        payload CLOB,
        hash CHAR(64) NOT NULL,
        prev_hash CHAR(64),
        created_utc BIGINT NOT NULL,
        PRIMARY KEY (entry_no),
        UNIQUE (assessment_id, seq_no) )""";

  public final static String CREATE_LEDGER_ENTRIES_INDEX =
      """
      CREATE INDEX IF NOT EXISTS %sledger_chain_idx \
      ON %sledger_entries (assessment_id, created_utc, seq_no)""";


  public final static String SELECT_HEAD =
      "SELECT seq_no, hash FROM %sledger_heads WHERE assessment_id = ?";

  public final static String SELECT_HEAD_FOR_UPDATE =
      "SELECT seq_no, hash FROM %sledger_heads WHERE assessment_id = ? FOR UPDATE";

  public final static String INSERT_HEAD =
      "INSERT INTO %sledger_heads (assessment_id, seq_no, hash) VALUES (?, 0, NULL)";

  public final static String ADVANCE_HEAD =
      """
      UPDATE %sledger_heads SET seq_no = ?, hash = ? \
      WHERE assessment_id = ? AND seq_no = ?""";


  public final static String ENTRY_COLUMNS =
      """
      entry_no, assessment_id, seq_no, council_id, membership_id, approval_id, \
      actor_id, actor_role, entry_type, payload, hash, prev_hash, created_utc""";

  /** Latest by creation time, ties broken by sequence no. */
  public final static String SELECT_TAIL =
      """
      SELECT seq_no, hash, created_utc FROM %sledger_entries WHERE assessment_id = ? \
      ORDER BY created_utc DESC, seq_no DESC LIMIT 1""";

  /** The whole chain, in chain order. */
  public final static String SELECT_CHAIN =
      """
      SELECT %s FROM %%sledger_entries WHERE assessment_id = ? \
      ORDER BY created_utc, seq_no"""
      .formatted(ENTRY_COLUMNS);

  /**
   * Page prefix. Parameters: assessment id, cursor (exclusive seq no.).
   * The optional entry-type filter and the {@code ORDER BY .. LIMIT} are
   * appended.
   */
  public final static String SELECT_ENTRIES_AFTER =
      """
      SELECT %s FROM %%sledger_entries WHERE assessment_id = ? AND seq_no > ?"""
      .formatted(ENTRY_COLUMNS);

  public final static String INSERT_ENTRY =
      """
      INSERT INTO %sledger_entries (assessment_id, seq_no, council_id, membership_id, \
      approval_id, actor_id, actor_role, entry_type, payload, hash, prev_hash, \
      created_utc) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

}
