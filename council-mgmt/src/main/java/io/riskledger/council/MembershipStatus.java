/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * Membership states. Only {@code ACTIVE} memberships' votes count.
 */
public enum MembershipStatus {
  ACTIVE,
  REVOKED;
}
