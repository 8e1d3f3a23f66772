/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * Listing item for an assessment assigned to a council.
 *
 * @param assignment    the assignment
 * @param voteCount     number of votes cast on the assessment by the council
 * @param entryCount    number of entries in the assessment's evidence ledger
 *
 * @see AssessmentMgr#listByCouncil(CouncilMgr.CouncilId, java.util.Optional, java.util.Optional, int)
 */
public record CouncilAssessment(
    Assignment assignment, long voteCount, long entryCount) {

  public String assessmentId() {
    return assignment.assessmentId();
  }

}
