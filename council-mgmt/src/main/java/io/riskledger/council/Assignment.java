/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.Objects;
import java.util.Optional;

import io.riskledger.council.CouncilMgr.CouncilId;

/**
 * An assessment's council assignment.
 *
 * @param assessmentId  the assessment's (external) id
 * @param councilId     the council the assessment is assigned to; empty, if
 *                      unassigned
 * @param assignedUtc   when last assigned (or unassigned)
 */
public record Assignment(
    String assessmentId, Optional<CouncilId> councilId, long assignedUtc) {

  public Assignment {
    Objects.requireNonNull(assessmentId, "null assessmentId");
    if (councilId == null)
      councilId = Optional.empty();
  }

  /** Returns {@code true} iff assigned to a council. */
  public boolean isAssigned() {
    return councilId.isPresent();
  }

}
