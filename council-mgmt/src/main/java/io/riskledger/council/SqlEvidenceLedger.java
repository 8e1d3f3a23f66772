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
import java.sql.SQLTransientException;
import java.sql.Savepoint;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import io.riskledger.json.JsonParsingException;
import io.riskledger.ledger.ChainVerifier;
import io.riskledger.ledger.EntryDraft;
import io.riskledger.ledger.EntryHasher;
import io.riskledger.ledger.LedgerEntry;
import io.riskledger.ledger.LedgerEntryType;
import io.riskledger.ledger.VerificationResult;
import io.riskledger.util.TaskStack;

/**
 * Per-assessment, append-only evidence chains in SQL.
 *
 * <h2>Append Protocol</h2>
 * <p>
 * Each assessment's chain has a head row in the {@code ledger_heads} table
 * recording the latest sequence no. and hash. An append locks that row
 * ({@code SELECT .. FOR UPDATE}), so appends to the same assessment are
 * serialized while appends to different assessments don't contend. The
 * head row is created on first use; a concurrent creator losing the race
 * rolls back to a savepoint and selects the winner's row.
 * </p><p>
 * Under the lock, the chain's tail (latest by creation time, then sequence
 * no.) is read and the new entry is linked to it. The entry's creation time
 * is never earlier than the tail's, so chain order and sequence order
 * coincide. The {@code UNIQUE (assessment_id, seq_no)} constraint backs
 * the lock: a forked append fails instead of creating a second successor.
 * </p>
 * <h2>Transactions</h2>
 * <p>
 * Like the other managers, instances work within the caller's transaction.
 * The head lock is held until the caller commits or rolls back.
 * </p>
 *
 * @see ChainVerifier
 */
public class SqlEvidenceLedger extends AbstractMgr {

  /** Expected-hash stand-in for ledger rows that cannot be parsed. */
  public final static String UNREADABLE = "unreadable";


  /**
   * Creates the backing tables and index, if they don't exist.
   */
  static void ensureTables(DbEnv env, Connection con) throws SQLException {
    new SqlEvidenceLedger(env, con, Clock.systemUTC()).createTables(
        CREATE_LEDGER_HEADS_TABLE,
        CREATE_LEDGER_ENTRIES_TABLE,
        CREATE_LEDGER_ENTRIES_INDEX);
  }


  public SqlEvidenceLedger(DbEnv env, Connection con, Clock clock) {
    super(env, con, clock);
  }


  /**
   * Appends a new entry to the draft's assessment chain and returns it.
   * The draft is {@linkplain EntryDraft#normalized() normalized} first.
   *
   * @throws ConcurrentLedgerModificationException
   *         if the head lock could not be acquired in time, or a concurrent
   *         append was detected
   * @throws CouncilManagementException
   *         if the head row and the chain's tail disagree
   */
  public LedgerEntry append(EntryDraft draft)
      throws UnsupportedOperationException, SQLException {

    draft = Objects.requireNonNull(draft, "null draft").normalized();
    checkWrite();

    final String assessmentId = draft.assessmentId();

    try (var closer = new TaskStack()) {

      Head head = lockHead(assessmentId, closer);
      Optional<Tail> tail = selectTail(assessmentId, closer);

      long tailSeq = tail.map(Tail::seqNo).orElse(0L);
      Optional<String> prevHash = tail.map(Tail::hash);
      if (head.seqNo != tailSeq || !head.hash.equals(prevHash))
        throw new CouncilManagementException(
            "internal error: ledger head [%d:%s] out of sync with tail [%d:%s] for assessment '%s'"
            .formatted(
                head.seqNo, head.hash.orElse(null),
                tailSeq, prevHash.orElse(null), assessmentId));

      final long seqNo = tailSeq + 1;
      final long createdUtc = Math.max(now(), tail.map(Tail::createdUtc).orElse(0L));
      final String hash = EntryHasher.computeHash(draft, prevHash, createdUtc);

      var insert = prepareInsert(INSERT_ENTRY, closer);
      insert.setString(1, assessmentId);
      insert.setLong(2, seqNo);
      setLong(insert, 3, draft.councilId());
      setLong(insert, 4, draft.membershipId());
      setLong(insert, 5, draft.approvalId());
      setString(insert, 6, draft.actorId());
      insert.setString(7, draft.actorRole());
      insert.setString(8, draft.entryType().name());
      setJson(insert, 9, draft.payload());
      insert.setString(10, hash);
      setString(insert, 11, prevHash);
      insert.setLong(12, createdUtc);
      long entryNo = executeInsert(insert, closer);

      var advance = prepareStmt(ADVANCE_HEAD, closer);
      advance.setLong(1, seqNo);
      advance.setString(2, hash);
      advance.setString(3, assessmentId);
      advance.setLong(4, head.seqNo);
      if (advance.executeUpdate() != 1)
        throw new ConcurrentLedgerModificationException(
            "ledger head for assessment '%s' moved past seq no. %d"
            .formatted(assessmentId, head.seqNo));

      return new LedgerEntry(entryNo, seqNo, draft, prevHash, createdUtc, hash);

    } catch (SQLIntegrityConstraintViolationException | SQLTransientException sqx) {
      throw new ConcurrentLedgerModificationException(
          "concurrent append on assessment '%s' detected".formatted(assessmentId),
          sqx);
    }
  }


  private record Head(long seqNo, Optional<String> hash) {  }

  private record Tail(long seqNo, String hash, long createdUtc) {  }


  private Head lockHead(String assessmentId, TaskStack closer) throws SQLException {
    Optional<Head> head = selectHead(SELECT_HEAD_FOR_UPDATE, assessmentId, closer);
    if (head.isPresent())
      return head.get();

    // first append: create the head row, racing other first appenders
    final boolean tx = !con.getAutoCommit();
    Savepoint savepoint = tx ? con.setSavepoint() : null;
    try (var insert = prepareStmt(INSERT_HEAD)) {
      insert.setString(1, assessmentId);
      insert.executeUpdate();
      if (tx)
        con.releaseSavepoint(savepoint);
    } catch (SQLIntegrityConstraintViolationException dup) {
      getLogger().log(
          Level.DEBUG,
          "lost race creating ledger head for '%s'; selecting winner's".formatted(assessmentId));
      if (tx)
        con.rollback(savepoint);
    }
    return selectHead(SELECT_HEAD_FOR_UPDATE, assessmentId, closer).orElseThrow(
        () -> new CouncilManagementException(
            "internal error: ledger head for assessment '%s' not found after insert"
            .formatted(assessmentId)));
  }


  private Optional<Head> selectHead(String sql, String assessmentId, TaskStack closer)
      throws SQLException {
    var query = prepareStmt(sql, closer);
    query.setString(1, assessmentId);
    ResultSet rs = executeQuery(query, closer);
    return rs.next() ?
        Optional.of(new Head(rs.getLong(1), getString(rs, 2))) :
          Optional.empty();
  }


  private Optional<Tail> selectTail(String assessmentId, TaskStack closer)
      throws SQLException {
    var query = prepareStmt(SELECT_TAIL, closer);
    query.setString(1, assessmentId);
    ResultSet rs = executeQuery(query, closer);
    return rs.next() ?
        Optional.of(new Tail(rs.getLong(1), rs.getString(2), rs.getLong(3))) :
          Optional.empty();
  }


  /**
   * Returns the number of entries in the assessment's chain.
   */
  public long size(String assessmentId) throws SQLException {
    try (var closer = new TaskStack()) {
      return selectTail(assessmentId, closer).map(Tail::seqNo).orElse(0L);
    }
  }


  /**
   * Returns the assessment's entire chain, in chain order.
   *
   * @return immutable list, empty if the assessment has no entries
   * @throws CouncilManagementException if a row cannot be read back
   */
  public List<LedgerEntry> listChain(String assessmentId) throws SQLException {
    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_CHAIN, closer);
      query.setString(1, assessmentId);
      ResultSet rs = executeQuery(query, closer);
      List<LedgerEntry> chain = new ArrayList<>();
      while (rs.next())
        chain.add(toEntry(rs));
      return chain.isEmpty() ? List.of() : Collections.unmodifiableList(chain);
    }
  }


  /**
   * Returns a page of the assessment's ledger. Entries are in ascending
   * sequence order, which is also chain order.
   */
  public LedgerPage page(String assessmentId, LedgerQuery query) throws SQLException {
    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    Objects.requireNonNull(query, "null query");

    var sql = new StringBuilder(SELECT_ENTRIES_AFTER);
    if (query.isFiltered()) {
      sql.append(" AND entry_type IN (");
      for (int count = query.entryTypes().size(); count-- > 0; )
        sql.append(count == 0 ? "?" : "?, ");
      sql.append(')');
    }
    sql.append(" ORDER BY seq_no LIMIT ?");

    try (var closer = new TaskStack()) {
      var stmt = prepareStmt(sql.toString(), closer);
      int col = 0;
      stmt.setString(++col, assessmentId);
      stmt.setLong(++col, query.cursor());
      for (var type : query.entryTypes())
        stmt.setString(++col, type.name());
      // one extra, to know whether there's a next page
      stmt.setInt(++col, query.limit() + 1);

      ResultSet rs = executeQuery(stmt, closer);
      List<LedgerEntry> entries = new ArrayList<>(query.limit());
      boolean more = false;
      while (rs.next()) {
        if (entries.size() == query.limit()) {
          more = true;
          break;
        }
        entries.add(toEntry(rs));
      }
      var nextCursor = more ?
          OptionalLong.of(entries.get(entries.size() - 1).seqNo()) :
            OptionalLong.empty();
      return new LedgerPage(entries, nextCursor);
    }
  }


  /**
   * Verifies the assessment's chain. A row that cannot be read back (e.g.
   * its payload is no longer valid JSON) fails verification at its index,
   * with expected hash {@code "unreadable"}. An intact chain must also end
   * where the assessment's head row says it does; otherwise verification
   * fails at the index of the first missing (or unaccounted for) entry,
   * with the head's hash as the expected one. This catches entries deleted
   * from the chain's tail.
   *
   * @return {@linkplain VerificationResult#VERIFIED} if the chain is
   *         empty or intact
   */
  public VerificationResult verify(String assessmentId) throws SQLException {
    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    try (var closer = new TaskStack()) {
      var query = prepareStmt(SELECT_CHAIN, closer);
      query.setString(1, assessmentId);
      ResultSet rs = executeQuery(query, closer);
      List<LedgerEntry> chain = new ArrayList<>();
      while (rs.next()) {
        try {
          chain.add(toEntry(rs));
        } catch (CouncilManagementException unreadable) {
          // the readable prefix may already be broken; that failure comes first
          var prefix = ChainVerifier.verify(chain);
          if (!prefix.verified())
            return prefix;
          getLogger().log(
              Level.WARNING,
              "evidence chain for assessment '%s' BROKEN at index %d: %s"
              .formatted(assessmentId, chain.size(), unreadable.getMessage()));
          return VerificationResult.failure(
              chain.size(), UNREADABLE, rs.getString(11));
        }
      }
      var result = ChainVerifier.verify(chain);
      return result.verified() ? checkHead(assessmentId, chain, closer) : result;
    }
  }


  private VerificationResult checkHead(
      String assessmentId, List<LedgerEntry> chain, TaskStack closer)
      throws SQLException {

    Optional<LedgerEntry> last = chain.isEmpty() ?
        Optional.empty() : Optional.of(chain.get(chain.size() - 1));
    long tailSeq = last.map(LedgerEntry::seqNo).orElse(0L);
    Optional<String> tailHash = last.map(LedgerEntry::hash);

    // appends always create the head row, but an empty chain needn't have one
    Head head = selectHead(SELECT_HEAD, assessmentId, closer)
        .orElse(new Head(0L, Optional.empty()));

    if (head.seqNo == tailSeq && head.hash.equals(tailHash))
      return VerificationResult.VERIFIED;

    int index = (int) Math.min(Math.max(head.seqNo, 0L), chain.size());
    var result = VerificationResult.failure(
        index, head.hash.orElse(null), tailHash.orElse(null));
    getLogger().log(
        Level.WARNING,
        "evidence chain for assessment '%s' BROKEN at index %d: head row at seq no. %d, chain ends at %d %s"
        .formatted(assessmentId, index, head.seqNo, tailSeq, result));
    return result;
  }

  private LedgerEntry toEntry(ResultSet rs) throws SQLException {
    final long entryNo = rs.getLong(1);
    try {
      var draft = new EntryDraft(
          rs.getString(2),
          getLong(rs, 4),
          getLong(rs, 5),
          getLong(rs, 6),
          getString(rs, 7),
          rs.getString(8),
          LedgerEntryType.valueOf(rs.getString(9)),
          getJson(rs, 10));
      return new LedgerEntry(
          entryNo,
          rs.getLong(3),
          draft,
          getString(rs, 12),
          rs.getLong(13),
          rs.getString(11));
    } catch (IllegalArgumentException | JsonParsingException x) {
      throw new CouncilManagementException(
          "internal error: malformed ledger entry [%d]: %s".formatted(entryNo, x.getMessage()),
          x);
    }
  }

}
