/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;

/**
 * A member's role on a council.
 */
public enum CouncilRole {
  CHAIR,
  PARTNER,
  OBSERVER;
}
