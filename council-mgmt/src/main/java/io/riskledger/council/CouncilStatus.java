/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * Council lifecycle states. {@code ACTIVE -> ARCHIVED} is the only
 * transition.
 */
public enum CouncilStatus {
  ACTIVE,
  /** Terminal. */
  ARCHIVED;
}
