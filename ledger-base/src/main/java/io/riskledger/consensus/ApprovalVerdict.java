/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.consensus;

/**
 * Computed outcome of a council's votes on an assessment. Exactly one of
 * {@linkplain #approved()}, {@linkplain #rejected()}, {@linkplain #pending()}
 * is {@code true}.
 */
public record ApprovalVerdict(
    boolean approved,
    boolean rejected,
    boolean pending,
    boolean quorumMet,
    int totalApprovals,
    int totalRejections,
    int totalPending,
    int requiredQuorum,
    boolean requiresUnanimous) {

  public ApprovalVerdict {
    int trues = (approved ? 1 : 0) + (rejected ? 1 : 0) + (pending ? 1 : 0);
    if (trues != 1)
      throw new IllegalArgumentException(
          "approved (%b), rejected (%b), pending (%b)"
          .formatted(approved, rejected, pending));
    if (totalApprovals < 0 || totalRejections < 0 || totalPending < 0)
      throw new IllegalArgumentException(
          "negative count: %d, %d, %d"
          .formatted(totalApprovals, totalRejections, totalPending));
  }


  /** Returns the verdict's status: approved, rejected or pending. */
  public ApprovalStatus status() {
    return approved ?
        ApprovalStatus.APPROVED :
          rejected ? ApprovalStatus.REJECTED : ApprovalStatus.PENDING;
  }

}
