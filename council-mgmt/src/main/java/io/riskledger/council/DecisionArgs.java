/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.riskledger.consensus.ApprovalStatus;
import io.riskledger.json.JsonValues;

/**
 * A council member's decision on an assessment step, as submitted.
 * Validated on construction: required strings must be non-blank, ids
 * positive.
 *
 * @param assessmentId        the assessment voted on
 * @param councilId           the council the assessment is assigned to
 * @param membershipId        the voter's membership on that council
 * @param partnerId           the voting partner's (user) id
 * @param step                workflow step voted on
 * @param status              the decision
 * @param decisionNotes       optional notes
 * @param reasonCodes         reason codes (possibly empty)
 * @param evidenceSnapshotId  optional id of the evidence reviewed
 * @param attachments         optional JSON list ({@code null} if none)
 * @param actorId             the acting user's id, recorded in the ledger
 * @param actorRole           the role acted in, recorded in the ledger
 *
 * @see RiskCouncil#submitDecision(DecisionArgs)
 */
public record DecisionArgs(
    String assessmentId,
    long councilId,
    long membershipId,
    String partnerId,
    String step,
    ApprovalStatus status,
    Optional<String> decisionNotes,
    List<String> reasonCodes,
    Optional<String> evidenceSnapshotId,
    Object attachments,
    String actorId,
    String actorRole) {


  public DecisionArgs {
    assessmentId = checkText(assessmentId, "assessmentId", MAX_ID_LENGTH);
    if (councilId <= 0)
      throw new IllegalArgumentException("councilId " + councilId);
    if (membershipId <= 0)
      throw new IllegalArgumentException("membershipId " + membershipId);
    partnerId = checkText(partnerId, "partnerId", MAX_ID_LENGTH);
    step = checkText(step, "step", MAX_ID_LENGTH);
    if (status == null)
      throw new IllegalArgumentException("missing status");
    decisionNotes = checkText(decisionNotes, "decisionNotes", MAX_TEXT_LENGTH);
    reasonCodes = checkReasonCodes(reasonCodes);
    evidenceSnapshotId = checkText(evidenceSnapshotId, "evidenceSnapshotId", MAX_ID_LENGTH);
    attachments = JsonValues.normalize(attachments);
    if (attachments != null && !(attachments instanceof Collection))
      throw new IllegalArgumentException(
          "attachments must be a JSON list: " + JsonValues.toJson(attachments));
    actorId = checkText(actorId, "actorId", MAX_ID_LENGTH);
    actorRole = checkText(actorRole, "actorRole", MAX_ID_LENGTH);
  }


  /**
   * Creates an instance with no notes, reason codes, evidence snapshot,
   * or attachments.
   */
  public DecisionArgs(
      String assessmentId,
      long councilId,
      long membershipId,
      String partnerId,
      String step,
      ApprovalStatus status,
      String actorId,
      String actorRole) {
    this(
        assessmentId, councilId, membershipId, partnerId, step, status,
        Optional.empty(), List.of(), Optional.empty(), null,
        actorId, actorRole);
  }


  private static List<String> checkReasonCodes(List<String> codes) {
    if (codes == null || codes.isEmpty())
      return List.of();
    List<String> checked = new ArrayList<>(codes.size());
    for (var code : codes)
      checked.add(checkText(code, "reason code", MAX_ID_LENGTH));
    return Collections.unmodifiableList(checked);
  }


  public DecisionArgs decisionNotes(String notes) {
    return new DecisionArgs(
        assessmentId, councilId, membershipId, partnerId, step, status,
        Optional.ofNullable(notes), reasonCodes, evidenceSnapshotId, attachments,
        actorId, actorRole);
  }

  public DecisionArgs reasonCodes(List<String> codes) {
    return new DecisionArgs(
        assessmentId, councilId, membershipId, partnerId, step, status,
        decisionNotes, codes, evidenceSnapshotId, attachments,
        actorId, actorRole);
  }

  public DecisionArgs evidenceSnapshotId(String snapshotId) {
    return new DecisionArgs(
        assessmentId, councilId, membershipId, partnerId, step, status,
        decisionNotes, reasonCodes, Optional.ofNullable(snapshotId), attachments,
        actorId, actorRole);
  }

  public DecisionArgs attachments(List<?> newAttachments) {
    return new DecisionArgs(
        assessmentId, councilId, membershipId, partnerId, step, status,
        decisionNotes, reasonCodes, evidenceSnapshotId, newAttachments,
        actorId, actorRole);
  }


  /**
   * Returns the evidence-ledger payload recorded for this decision:
   * {@code step}, {@code status}, {@code reasonCodes}, {@code partnerId},
   * and, if present, {@code notes} and {@code evidenceSnapshotId}.
   */
  public Map<String, Object> ledgerPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("step", step);
    payload.put("status", status.name());
    decisionNotes.ifPresent(notes -> payload.put("notes", notes));
    payload.put("reasonCodes", reasonCodes);
    evidenceSnapshotId.ifPresent(snap -> payload.put("evidenceSnapshotId", snap));
    payload.put("partnerId", partnerId);
    return payload;
  }

}
