/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.council.ApprovalMgr.ApprovalId;
import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.council.MembershipMgr.MembershipId;

/**
 * A recorded vote. Votes are immutable and never replaced: a member who
 * votes again adds a vote.
 *
 * @param id                  system identifier
 * @param assessmentId        the assessment voted on
 * @param councilId           the council voted in
 * @param membershipId        the voter's membership
 * @param partnerId           the voting partner's (user) id
 * @param step                workflow step voted on
 * @param status              the decision
 * @param decisionNotes       optional notes
 * @param reasonCodes         reason codes (immutable, possibly empty)
 * @param evidenceSnapshotId  optional id of the evidence reviewed
 * @param attachments         JSON list, or {@code null}
 * @param decidedUtc          when the vote was recorded
 */
public record Approval(
    ApprovalId id,
    String assessmentId,
    CouncilId councilId,
    MembershipId membershipId,
    String partnerId,
    String step,
    ApprovalStatus status,
    Optional<String> decisionNotes,
    List<String> reasonCodes,
    Optional<String> evidenceSnapshotId,
    Object attachments,
    long decidedUtc) {

  public Approval {
    Objects.requireNonNull(id, "null id");
    Objects.requireNonNull(assessmentId, "null assessmentId");
    Objects.requireNonNull(councilId, "null councilId");
    Objects.requireNonNull(membershipId, "null membershipId");
    Objects.requireNonNull(partnerId, "null partnerId");
    Objects.requireNonNull(step, "null step");
    Objects.requireNonNull(status, "null status");
    if (decisionNotes == null)
      decisionNotes = Optional.empty();
    reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
    if (evidenceSnapshotId == null)
      evidenceSnapshotId = Optional.empty();
  }

}
