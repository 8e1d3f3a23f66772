/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.consensus;

/**
 * A council's decision rule.
 *
 * @param quorum            minimum number of decisive votes (&ge; 1)
 * @param requireUnanimous  if {@code true}, a single rejection rejects
 */
public record QuorumPolicy(int quorum, boolean requireUnanimous) {

  /** Quorum of 1, majority rule. */
  public final static QuorumPolicy DEFAULT = new QuorumPolicy(1, false);

  public QuorumPolicy {
    if (quorum < 1)
      throw new IllegalArgumentException("quorum must be positive: " + quorum);
  }

}
