/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;

/**
 * Kinds of governance events recorded in an evidence ledger.
 */
public enum LedgerEntryType {

  /** A member voted to approve. */
  APPROVAL,
  /** A member voted to reject. */
  REJECTION,
  /** A non-decisive vote, or other workflow status change. */
  STATUS_CHANGE,
  /** The assessment was assigned to, or unassigned from, a council. */
  ASSIGNMENT,
  MEMBER_ADDED,
  MEMBER_REVOKED,
  POLICY_CHANGE,
  SYSTEM_EVENT;


  /** Returns {@code true} iff this is a decisive vote type. */
  public boolean isDecisive() {
    return this == APPROVAL || this == REJECTION;
  }

}
