/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.consensus;


import java.util.Collection;
import java.util.Objects;

/**
 * The quorum-consensus engine. Pure functions; no I/O.
 *
 * <h2>Algorithm</h2>
 * <p>
 * Given a council's {@linkplain QuorumPolicy} (quorum {@code Q}) and the
 * counts of approvals {@code A}, rejections {@code R}, and pending votes:
 * </p>
 * <ul>
 * <li>{@code quorumMet = A + R >= Q}</li>
 * <li><em>unanimous:</em> {@code approved = quorumMet && R == 0 && A >= Q};
 *     {@code rejected = R > 0}</li>
 * <li><em>majority:</em> {@code approved = A >= Q};
 *     {@code rejected = R > 0 && A < Q}</li>
 * <li>{@code pending = !approved && !rejected}</li>
 * </ul>
 * <p>
 * Note under majority rule, approval is sticky: once approvals reach quorum,
 * later rejections don't flip the verdict.
 * </p>
 */
public final class QuorumConsensus {

  // no one calls
  private QuorumConsensus() {  }


  /**
   * Computes the verdict from vote counts.
   */
  public static ApprovalVerdict evaluate(
      QuorumPolicy policy, int approvals, int rejections, int pending) {

    Objects.requireNonNull(policy, "null policy");
    if (approvals < 0 || rejections < 0 || pending < 0)
      throw new IllegalArgumentException(
          "negative count: %d, %d, %d".formatted(approvals, rejections, pending));

    final int q = policy.quorum();
    final boolean quorumMet = approvals + rejections >= q;

    final boolean approved;
    final boolean rejected;
    if (policy.requireUnanimous()) {
      approved = quorumMet && rejections == 0 && approvals >= q;
      rejected = rejections > 0;
    } else {
      approved = approvals >= q;
      rejected = rejections > 0 && approvals < q;
    }

    return new ApprovalVerdict(
        approved,
        rejected,
        !approved && !rejected,
        quorumMet,
        approvals,
        rejections,
        pending,
        q,
        policy.requireUnanimous());
  }


  /**
   * Computes the verdict from the given statuses. Every vote counts: a
   * member who votes twice on the same step is counted twice. The caller
   * filters out ineligible (e.g. revoked) voters.
   */
  public static ApprovalVerdict evaluate(
      QuorumPolicy policy, Collection<ApprovalStatus> votes) {

    int approvals = 0, rejections = 0, pending = 0;
    for (var status : votes) {
      switch (status) {
      case APPROVED:
        ++approvals;
        break;
      case REJECTED:
        ++rejections;
        break;
      case PENDING:
        ++pending;
        break;
      }
    }
    return evaluate(policy, approvals, rejections, pending);
  }

}
