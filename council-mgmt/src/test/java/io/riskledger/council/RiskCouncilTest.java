/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.consensus.ApprovalVerdict;
import io.riskledger.ledger.EntryDraft;
import io.riskledger.ledger.LedgerEntry;
import io.riskledger.ledger.LedgerEntryType;

/**
 * End-to-end tests of the {@linkplain RiskCouncil} facade over in-memory
 * H2 databases.
 */
public class RiskCouncilTest extends BaseTestCase {

  final static String ASMT = "asmt-500";
  final static String STEP = "credit-review";


  /** A council with active members, ready to vote. */
  record Fixture(RiskCouncil riskCouncil, Council council, List<Membership> members) {

    Membership member(int index) {
      return members.get(index);
    }

    DecisionArgs vote(String assessmentId, int member, ApprovalStatus status) {
      var m = members.get(member);
      return new DecisionArgs(
          assessmentId,
          council.id().no(),
          m.id().no(),
          m.userId(),
          STEP,
          status,
          m.userId(),
          m.role().name());
    }

    Decision submit(String assessmentId, int member, ApprovalStatus status) {
      return riskCouncil.submitDecision(vote(assessmentId, member, status));
    }

    ApprovalVerdict verdict(String assessmentId) {
      return riskCouncil.checkApprovalStatus(assessmentId);
    }
  }


  private Fixture setup(
      RiskCouncil riskCouncil, String name, int quorum, boolean unanimous, int memberCount,
      String... assessmentIds) {

    var council = riskCouncil.createCouncil(
        Council.argsInstance(name, null, "org-1").policy(quorum, unanimous));
    List<Membership> members = new ArrayList<>();
    for (int index = 0; index < memberCount; ++index)
      members.add(riskCouncil.addOrReactivateMember(
          council.id().no(),
          new MemberArgs(
              name + "-partner-" + index,
              index == 0 ? CouncilRole.CHAIR : CouncilRole.PARTNER,
              "admin")));
    for (var assessmentId : assessmentIds)
      riskCouncil.assignAssessmentToCouncil(assessmentId, council.id().no(), "admin");
    return new Fixture(riskCouncil, council, members);
  }


  private void assertVerdict(
      ApprovalStatus expected, int approvals, int rejections, ApprovalVerdict verdict) {
    assertEquals(expected, verdict.status());
    assertEquals(approvals, verdict.totalApprovals());
    assertEquals(rejections, verdict.totalRejections());
  }


  @Test
  public void testEnsureAndLoad() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(RiskCouncil.ensureInstance("t_", newDataSource(label)));
      assertFalse(riskCouncil.isReadOnly());
      assertEquals("t_", riskCouncil.env().tablePrefix());
      var council = riskCouncil.createCouncil(Council.argsInstance("c1", null, null));

      var loaded = RiskCouncil.load(DbEnv.DEFAULT.tablePrefix("t_"), newDataSource(label));
      assertTrue(loaded.isPresent());
      closer.push(loaded.get());
      assertTrue(loaded.get().isReadOnly());
      assertEquals(council, loaded.get().getCouncil(council.id().no()));

      var ds = closer.push(newDataSource(label));
      assertTrue(RiskCouncil.load(DbEnv.DEFAULT, ds).isEmpty());
    }
  }


  @Test
  public void testReadOnly() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "ro", 1, false, 1, ASMT);
      f.submit(ASMT, 0, ApprovalStatus.APPROVED);

      var readOnly = closer.push(
          RiskCouncil.load(DbEnv.DEFAULT, newDataSource(label)).get());
      try {
        readOnly.createCouncil(Council.argsInstance("nope", null, null));
        fail();
      } catch (UnsupportedOperationException expected) {
        printExpected(label, expected);
      }
      try {
        readOnly.submitDecision(f.vote(ASMT, 0, ApprovalStatus.REJECTED));
        fail();
      } catch (UnsupportedOperationException expected) {  }

      assertTrue(readOnly.checkApprovalStatus(ASMT).approved());
      assertTrue(readOnly.verifyLedger(ASMT).verified());
      assertEquals(1, readOnly.listApprovals(ASMT).size());
    }
  }


  @Test
  public void testSubmitDecision() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "credit", 1, false, 2, ASMT);

      var args = f.vote(ASMT, 1, ApprovalStatus.APPROVED)
          .decisionNotes("exposure within limits")
          .reasonCodes(List.of("LIMITS_OK", "COLLATERAL_OK"))
          .evidenceSnapshotId("snap-9")
          .attachments(List.of(Map.of("name", "memo.pdf", "size", 1024)));

      var decision = riskCouncil.submitDecision(args);

      Approval approval = decision.approval();
      assertTrue(approval.id().isSet());
      assertEquals(ASMT, approval.assessmentId());
      assertEquals(f.council().id(), approval.councilId());
      assertEquals(f.member(1).id(), approval.membershipId());
      assertEquals(ApprovalStatus.APPROVED, approval.status());
      assertEquals("exposure within limits", approval.decisionNotes().get());
      assertEquals(List.of("LIMITS_OK", "COLLATERAL_OK"), approval.reasonCodes());
      assertEquals("snap-9", approval.evidenceSnapshotId().get());
      assertEquals(List.of(Map.of("name", "memo.pdf", "size", 1024L)), approval.attachments());

      LedgerEntry entry = decision.ledgerEntry();
      assertEquals(LedgerEntryType.APPROVAL, entry.entryType());
      assertEquals(2, entry.seqNo());   // after the ASSIGNMENT entry
      assertEquals(f.council().id().no(), entry.draft().councilId().get());
      assertEquals(f.member(1).id().no(), entry.draft().membershipId().get());
      assertEquals(approval.id().no(), entry.draft().approvalId().get());
      assertEquals(f.member(1).userId(), entry.actorId().get());
      assertEquals(
          Map.of(
              "step", STEP,
              "status", "APPROVED",
              "notes", "exposure within limits",
              "reasonCodes", List.of("LIMITS_OK", "COLLATERAL_OK"),
              "evidenceSnapshotId", "snap-9",
              "partnerId", f.member(1).userId()),
          entry.payload());

      assertEquals(approval, riskCouncil.listApprovals(ASMT).get(0));

      var ledger = riskCouncil.getLedger(ASMT).entries();
      assertEquals(2, ledger.size());
      assertEquals(LedgerEntryType.ASSIGNMENT, ledger.get(0).entryType());
      assertEquals(entry, ledger.get(1));
      assertTrue(riskCouncil.verifyLedger(ASMT).verified());

      var verdict = riskCouncil.checkApprovalStatus(ASMT);
      assertTrue(verdict.approved());
      assertTrue(verdict.quorumMet());
      assertEquals(1, verdict.requiredQuorum());
      assertFalse(verdict.requiresUnanimous());
    }
  }


  @Test
  public void testEntryTypes() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "types", 3, false, 3, ASMT);

      assertEquals(
          LedgerEntryType.APPROVAL,
          f.submit(ASMT, 0, ApprovalStatus.APPROVED).ledgerEntry().entryType());
      assertEquals(
          LedgerEntryType.REJECTION,
          f.submit(ASMT, 1, ApprovalStatus.REJECTED).ledgerEntry().entryType());
      var pending = f.submit(ASMT, 2, ApprovalStatus.PENDING).ledgerEntry();
      assertEquals(LedgerEntryType.STATUS_CHANGE, pending.entryType());
      assertEquals("PENDING", ((Map<?, ?>) pending.payload()).get("status"));
      assertFalse(((Map<?, ?>) pending.payload()).containsKey("notes"));
    }
  }


  @Test
  public void testDecisionArgsValidation() {
    final Object label = new Object() { };
    try {
      new DecisionArgs(ASMT, 1, 1, "p", " ", ApprovalStatus.APPROVED, "p", "PARTNER");
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
    try {
      new DecisionArgs(ASMT, 1, 1, "p", STEP, null, "p", "PARTNER");
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
    try {
      new DecisionArgs(null, 1, 1, "p", STEP, ApprovalStatus.APPROVED, "p", "PARTNER");
      fail();
    } catch (IllegalArgumentException expected) {  }
    try {
      new DecisionArgs(ASMT, 0, 1, "p", STEP, ApprovalStatus.APPROVED, "p", "PARTNER");
      fail();
    } catch (IllegalArgumentException expected) {  }
    try {
      new DecisionArgs(ASMT, 1, 1, "p", STEP, ApprovalStatus.APPROVED, "p", "PARTNER")
          .reasonCodes(List.of("OK", " "));
      fail();
    } catch (IllegalArgumentException expected) {  }
  }


  @Test
  public void testSubmitRejectedWithoutStateChange() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "main", 1, false, 2, ASMT, "asmt-archived");
      var other = setup(riskCouncil, "other", 1, false, 1, "asmt-other");

      // unassigned
      try {
        f.submit("asmt-unassigned", 0, ApprovalStatus.APPROVED);
        fail();
      } catch (UnassignedAssessmentException expected) {
        assertEquals("asmt-unassigned", expected.assessmentId());
        printExpected(label, expected);
      }

      // council mismatch
      try {
        f.submit("asmt-other", 0, ApprovalStatus.APPROVED);
        fail();
      } catch (IllegalStateException expected) {
        printExpected(label, expected);
      }

      // unknown membership
      var unknownMember = new DecisionArgs(
          ASMT, f.council().id().no(), 999, "ghost", STEP,
          ApprovalStatus.APPROVED, "ghost", "PARTNER");
      try {
        riskCouncil.submitDecision(unknownMember);
        fail();
      } catch (NoSuchElementException expected) {
        assertFalse(expected instanceof UnassignedAssessmentException);
      }

      // membership of another council
      var foreign = other.member(0);
      var foreignArgs = new DecisionArgs(
          ASMT, f.council().id().no(), foreign.id().no(), foreign.userId(), STEP,
          ApprovalStatus.APPROVED, foreign.userId(), "PARTNER");
      try {
        riskCouncil.submitDecision(foreignArgs);
        fail();
      } catch (IllegalStateException expected) {
        printExpected(label, expected);
      }

      // revoked membership
      riskCouncil.revokeMembership(f.member(1).id().no(), "left the firm");
      try {
        f.submit(ASMT, 1, ApprovalStatus.APPROVED);
        fail();
      } catch (IllegalStateException expected) {
        printExpected(label, expected);
      }

      // archived council
      riskCouncil.archiveCouncil(f.council().id().no());
      try {
        f.submit("asmt-archived", 0, ApprovalStatus.APPROVED);
        fail();
      } catch (IllegalStateException expected) {
        printExpected(label, expected);
      }

      for (var assessmentId : List.of(ASMT, "asmt-archived", "asmt-other")) {
        assertTrue(riskCouncil.listApprovals(assessmentId).isEmpty());
        var entries = riskCouncil.getLedger(assessmentId).entries();
        assertEquals(1, entries.size());
        assertEquals(LedgerEntryType.ASSIGNMENT, entries.get(0).entryType());
      }
      assertTrue(riskCouncil.getLedger("asmt-unassigned").entries().isEmpty());
    }
  }


  @Test
  public void testMajorityQuorum() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      final String a = "asmt-a", b = "asmt-b";
      var f = setup(riskCouncil, "majority", 3, false, 4, a, b);

      var verdict = f.verdict(a);
      assertVerdict(ApprovalStatus.PENDING, 0, 0, verdict);
      assertFalse(verdict.quorumMet());
      assertEquals(3, verdict.requiredQuorum());

      f.submit(a, 0, ApprovalStatus.APPROVED);
      f.submit(a, 1, ApprovalStatus.APPROVED);
      verdict = f.verdict(a);
      assertVerdict(ApprovalStatus.PENDING, 2, 0, verdict);
      assertFalse(verdict.quorumMet());

      f.submit(a, 2, ApprovalStatus.APPROVED);
      verdict = f.verdict(a);
      assertVerdict(ApprovalStatus.APPROVED, 3, 0, verdict);
      assertTrue(verdict.quorumMet());

      f.submit(b, 0, ApprovalStatus.APPROVED);
      f.submit(b, 1, ApprovalStatus.APPROVED);
      f.submit(b, 2, ApprovalStatus.REJECTED);
      f.submit(b, 3, ApprovalStatus.REJECTED);
      verdict = f.verdict(b);
      assertVerdict(ApprovalStatus.REJECTED, 2, 2, verdict);
      assertTrue(verdict.quorumMet());

      assertTrue(riskCouncil.verifyLedger(a).verified());
      assertTrue(riskCouncil.verifyLedger(b).verified());
    }
  }


  @Test
  public void testUnanimousQuorum() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      final String a = "asmt-a", b = "asmt-b";
      var f = setup(riskCouncil, "unanimous", 2, true, 2, a, b);

      f.submit(a, 0, ApprovalStatus.APPROVED);
      assertVerdict(ApprovalStatus.PENDING, 1, 0, f.verdict(a));
      f.submit(a, 1, ApprovalStatus.APPROVED);
      var verdict = f.verdict(a);
      assertVerdict(ApprovalStatus.APPROVED, 2, 0, verdict);
      assertTrue(verdict.requiresUnanimous());

      f.submit(b, 0, ApprovalStatus.APPROVED);
      f.submit(b, 1, ApprovalStatus.REJECTED);
      assertVerdict(ApprovalStatus.REJECTED, 1, 1, f.verdict(b));
    }
  }


  @Test
  public void testRepeatedVotesAllCount() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "repeat", 3, false, 1, ASMT);
      var lenient = setup(riskCouncil, "lenient", 1, false, 0);

      f.submit(ASMT, 0, ApprovalStatus.REJECTED);
      assertVerdict(ApprovalStatus.REJECTED, 0, 1, f.verdict(ASMT));

      f.submit(ASMT, 0, ApprovalStatus.APPROVED);
      f.submit(ASMT, 0, ApprovalStatus.APPROVED);
      var verdict = f.verdict(ASMT);
      assertVerdict(ApprovalStatus.REJECTED, 2, 1, verdict);
      assertTrue(verdict.quorumMet());

      // every vote is on record, latest first
      var approvals = riskCouncil.listApprovals(ASMT);
      assertEquals(3, approvals.size());
      assertEquals(ApprovalStatus.APPROVED, approvals.get(0).status());
      assertEquals(ApprovalStatus.REJECTED, approvals.get(2).status());

      // the same votes, under the new council's policy
      riskCouncil.assignAssessmentToCouncil(ASMT, lenient.council().id().no(), "admin");
      verdict = lenient.verdict(ASMT);
      assertVerdict(ApprovalStatus.APPROVED, 2, 1, verdict);
      assertEquals(1, verdict.requiredQuorum());
    }
  }


  @Test
  public void testRevokedMemberExcluded() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "revocation", 2, false, 3, ASMT);

      f.submit(ASMT, 0, ApprovalStatus.APPROVED);
      var revokedVote = f.submit(ASMT, 1, ApprovalStatus.APPROVED);
      assertVerdict(ApprovalStatus.APPROVED, 2, 0, f.verdict(ASMT));

      var revoked = riskCouncil.revokeMembership(f.member(1).id().no(), null);
      assertEquals(MembershipStatus.REVOKED, revoked.status());

      var verdict = f.verdict(ASMT);
      assertVerdict(ApprovalStatus.PENDING, 1, 0, verdict);
      assertFalse(verdict.quorumMet());

      // the revoked member's vote stays on the ledger, which still verifies
      var ledger = riskCouncil.getLedger(ASMT).entries();
      assertTrue(ledger.contains(revokedVote.ledgerEntry()));
      assertTrue(riskCouncil.verifyLedger(ASMT).verified());

      // reactivation restores the vote
      riskCouncil.addOrReactivateMember(
          f.council().id().no(),
          new MemberArgs(f.member(1).userId(), CouncilRole.PARTNER, "admin"));
      assertVerdict(ApprovalStatus.APPROVED, 2, 0, f.verdict(ASMT));

      assertEquals(
          3,
          riskCouncil.listMembers(
              f.council().id().no(), Optional.of(MembershipStatus.ACTIVE)).size());
    }
  }


  @Test
  public void testReassignment() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var first = setup(riskCouncil, "first", 1, false, 1, ASMT);
      var second = setup(riskCouncil, "second", 1, false, 1);

      var vote = first.submit(ASMT, 0, ApprovalStatus.APPROVED);
      assertTrue(first.verdict(ASMT).approved());
      assertEquals(first.council(), riskCouncil.findCouncilOf(ASMT).get());

      var assignment = riskCouncil.assignAssessmentToCouncil(
          ASMT, second.council().id().no(), "admin");
      assertEquals(second.council().id(), assignment.councilId().get());

      // the vote cast in the first council still counts
      assertVerdict(ApprovalStatus.APPROVED, 1, 0, second.verdict(ASMT));
      riskCouncil.revokeMembership(first.member(0).id().no(), null);
      assertVerdict(ApprovalStatus.PENDING, 0, 0, second.verdict(ASMT));
      try {
        first.submit(ASMT, 0, ApprovalStatus.APPROVED);
        fail();
      } catch (IllegalStateException expected) {  }

      // re-assigning to the same council appends nothing
      riskCouncil.assignAssessmentToCouncil(ASMT, second.council().id().no(), "admin");

      var entries = riskCouncil.getLedger(ASMT).entries();
      assertEquals(3, entries.size());
      assertEquals(vote.ledgerEntry(), entries.get(1));
      assertEquals(first.council().id().no(), entries.get(1).draft().councilId().get());
      var reassigned = entries.get(2);
      assertEquals(LedgerEntryType.ASSIGNMENT, reassigned.entryType());
      assertEquals(CouncilConstants.SYSTEM_ROLE, reassigned.actorRole());
      assertEquals(
          Map.of(
              "action", "ASSIGNED",
              "councilId", second.council().id().no(),
              "previousCouncilId", first.council().id().no()),
          reassigned.payload());

      var previous = riskCouncil.unassignAssessmentFromCouncil(ASMT, "admin");
      assertEquals(second.council().id(), previous.get().councilId().get());
      assertTrue(riskCouncil.findCouncilOf(ASMT).isEmpty());
      try {
        riskCouncil.checkApprovalStatus(ASMT);
        fail();
      } catch (UnassignedAssessmentException expected) {
        printExpected(label, expected);
      }

      entries = riskCouncil.getLedger(ASMT).entries();
      assertEquals(4, entries.size());
      assertEquals("UNASSIGNED", ((Map<?, ?>) entries.get(3).payload()).get("action"));
      assertTrue(riskCouncil.verifyLedger(ASMT).verified());

      // unassigning again is a no-op
      assertTrue(riskCouncil.unassignAssessmentFromCouncil(ASMT, "admin").get().councilId().isEmpty());
      assertEquals(4, riskCouncil.getLedger(ASMT).entries().size());
    }
  }


  @Test
  public void testAssignToArchivedCouncil() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var council = riskCouncil.createCouncil(Council.argsInstance("old", null, null));
      riskCouncil.archiveCouncil(council.id().no());
      try {
        riskCouncil.assignAssessmentToCouncil(ASMT, council.id().no(), "admin");
        fail();
      } catch (IllegalStateException expected) {
        printExpected(label, expected);
      }
      try {
        riskCouncil.addOrReactivateMember(
            council.id().no(), new MemberArgs("eve", CouncilRole.PARTNER, "admin"));
        fail();
      } catch (IllegalStateException expected) {  }
      try {
        riskCouncil.assignAssessmentToCouncil(ASMT, 404, "admin");
        fail();
      } catch (NoSuchElementException expected) {  }
      assertTrue(riskCouncil.findCouncilOf(ASMT).isEmpty());
    }
  }


  @Test
  public void testAtomicity() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {

      var failing = closer.push(
          new RiskCouncil(
              DbEnv.DEFAULT.readWrite(true), newDataSource(label), true, new TickingClock()) {
            @Override
            protected LedgerEntry appendDecisionEntry(
                Connection con, Approval approval, DecisionArgs args) throws SQLException {
              throw new SQLException("simulated failure after vote insert");
            }
          });

      var f = setup(failing, "atomic", 1, false, 1, ASMT);
      try {
        f.submit(ASMT, 0, ApprovalStatus.APPROVED);
        fail();
      } catch (CouncilManagementException expected) {
        assertTrue(expected.getCause() instanceof SQLException);
        printExpected(label, expected);
      }

      var riskCouncil = closer.push(newRiskCouncil(label));
      assertTrue(riskCouncil.listApprovals(ASMT).isEmpty());
      var entries = riskCouncil.getLedger(ASMT).entries();
      assertEquals(1, entries.size());
      assertEquals(LedgerEntryType.ASSIGNMENT, entries.get(0).entryType());
      assertTrue(riskCouncil.verifyLedger(ASMT).verified());
      assertVerdict(ApprovalStatus.PENDING, 0, 0, riskCouncil.checkApprovalStatus(ASMT));

      // the same vote succeeds without the injected failure
      var decision = riskCouncil.submitDecision(f.vote(ASMT, 0, ApprovalStatus.APPROVED));
      assertEquals(2, decision.ledgerEntry().seqNo());
      assertEquals(1, riskCouncil.listApprovals(ASMT).size());
    }
  }


  @Test
  public void testInterruptRollsBack() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      // warm up the pool
      assertTrue(riskCouncil.listCouncils(Optional.empty(), Optional.empty(), 0, 10).isEmpty());

      Thread.currentThread().interrupt();
      try {
        riskCouncil.createCouncil(Council.argsInstance("interrupted", null, null));
        fail();
      } catch (CouncilManagementException expected) {
        printExpected(label, expected);
      } finally {
        Thread.interrupted();
      }
      assertTrue(riskCouncil.listCouncils(Optional.empty(), Optional.empty(), 0, 10).isEmpty());
    }
  }


  @Test
  public void testAppendEntry() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));

      var event = riskCouncil.appendEntry(new EntryDraft(
          ASMT, "ops-bot", CouncilConstants.SYSTEM_ROLE,
          LedgerEntryType.SYSTEM_EVENT, Map.of("event", "evidence-refreshed")));
      assertEquals(1, event.seqNo());
      assertTrue(event.isFirst());

      var policy = riskCouncil.appendEntry(new EntryDraft(
          ASMT, null, "CHAIR", LedgerEntryType.POLICY_CHANGE, List.of(1, 2.5, "x", true)));
      assertEquals(event.hash(), policy.prevHash().get());
      assertTrue(policy.actorId().isEmpty());

      for (var type : List.of(LedgerEntryType.APPROVAL, LedgerEntryType.REJECTION)) {
        try {
          riskCouncil.appendEntry(new EntryDraft(ASMT, "x", "PARTNER", type, null));
          fail();
        } catch (IllegalArgumentException expected) {
          printExpected(label, expected);
        }
      }
      assertEquals(List.of(event, policy), riskCouncil.getLedger(ASMT).entries());
      assertTrue(riskCouncil.verifyLedger(ASMT).verified());
    }
  }


  @Test
  public void testGetLedgerFiltered() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "paging", 5, false, 3, ASMT);
      for (int round = 0; round < 4; ++round)
        for (int member = 0; member < 3; ++member)
          f.submit(ASMT, member, member == 2 ? ApprovalStatus.REJECTED : ApprovalStatus.APPROVED);

      var query = LedgerQuery.DEFAULT.entryTypes(LedgerEntryType.REJECTION).limit(3);
      var page = riskCouncil.getLedger(ASMT, query);
      assertEquals(3, page.entries().size());
      assertTrue(page.hasMore());
      page.entries().forEach(e -> assertEquals(LedgerEntryType.REJECTION, e.entryType()));

      page = riskCouncil.getLedger(ASMT, query.after(page.nextCursor().getAsLong()));
      assertEquals(1, page.entries().size());
      assertFalse(page.hasMore());

      page = riskCouncil.getLedger(ASMT, LedgerQuery.DEFAULT.limit(100));
      assertEquals(13, page.entries().size());
      assertFalse(page.hasMore());
    }
  }


  @Test
  public void testListCouncilAssessments() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var f = setup(riskCouncil, "listing", 2, false, 2, "a-1", "a-2", "a-3");
      f.submit("a-1", 0, ApprovalStatus.APPROVED);
      f.submit("a-1", 1, ApprovalStatus.APPROVED);
      f.submit("a-2", 0, ApprovalStatus.REJECTED);

      final long councilId = f.council().id().no();
      var all = riskCouncil.listCouncilAssessments(
          councilId, Optional.empty(), Optional.empty(), 50);
      assertEquals(3, all.size());
      assertEquals("a-1", all.get(0).assessmentId());
      assertEquals(2, all.get(0).voteCount());
      assertEquals(3, all.get(0).entryCount());
      assertEquals(0, all.get(2).voteCount());
      assertEquals(1, all.get(2).entryCount());

      var approved = riskCouncil.listCouncilAssessments(
          councilId, Optional.of(ApprovalStatus.APPROVED), Optional.empty(), 50);
      assertEquals(1, approved.size());
      assertEquals("a-1", approved.get(0).assessmentId());

      var page = riskCouncil.listCouncilAssessments(
          councilId, Optional.empty(), Optional.of("a-1"), 1);
      assertEquals(1, page.size());
      assertEquals("a-2", page.get(0).assessmentId());

      try {
        riskCouncil.listCouncilAssessments(404, Optional.empty(), Optional.empty(), 50);
        fail();
      } catch (NoSuchElementException expected) {  }
    }
  }


  @Test
  public void testCouncilAdmin() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      var riskCouncil = closer.push(newRiskCouncil(label));
      var council = riskCouncil.createCouncil(
          Council.argsInstance("Liquidity", "daily liquidity", "org-2"));
      assertEquals(council, riskCouncil.getCouncil(council.id().no()));

      var updated = riskCouncil.updateCouncil(
          council.id().no(),
          Council.argsInstance("Liquidity", "daily liquidity", "org-2").policy(2, true));
      assertEquals(2, updated.policy().quorum());

      var member = riskCouncil.addOrReactivateMember(
          council.id().no(), new MemberArgs("frank", CouncilRole.OBSERVER, "admin"));
      var changed = riskCouncil.updateMembership(
          member.id().no(), MembershipUpdate.NONE.role(CouncilRole.PARTNER).notes("promoted"));
      assertEquals(CouncilRole.PARTNER, changed.role());
      assertEquals(changed, riskCouncil.getMembership(member.id().no()));

      var archived = riskCouncil.archiveCouncil(council.id().no());
      assertEquals(CouncilStatus.ARCHIVED, archived.status());
      assertEquals(archived, riskCouncil.archiveCouncil(council.id().no()));

      assertEquals(
          List.of(archived),
          riskCouncil.listCouncils(Optional.of(CouncilStatus.ARCHIVED), Optional.empty(), 0, 10));

      try {
        riskCouncil.getCouncil(404);
        fail();
      } catch (NoSuchElementException expected) {  }
      try {
        riskCouncil.getMembership(404);
        fail();
      } catch (NoSuchElementException expected) {  }
      try {
        riskCouncil.getCouncil(0);
        fail();
      } catch (IllegalArgumentException expected) {  }
    }
  }

}
