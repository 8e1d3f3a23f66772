/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.consensus;

/**
 * A council member's decision on an assessment step.
 */
public enum ApprovalStatus {
  APPROVED,
  REJECTED,
  /** Non-decisive: the member has looked but not decided. */
  PENDING;


  /**
   * Returns {@code true} iff this status counts toward quorum.
   */
  public boolean isDecisive() {
    return this != PENDING;
  }

}
