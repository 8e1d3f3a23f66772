/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.Objects;

import io.riskledger.ledger.LedgerEntry;

/**
 * A recorded vote together with the evidence-ledger entry committed with
 * it.
 *
 * @param approval    the vote
 * @param ledgerEntry the entry referencing the vote
 */
public record Decision(Approval approval, LedgerEntry ledgerEntry) {

  public Decision {
    Objects.requireNonNull(approval, "null approval");
    Objects.requireNonNull(ledgerEntry, "null ledgerEntry");
    if (ledgerEntry.draft().approvalId().filter(id -> id == approval.id().no()).isEmpty())
      throw new IllegalArgumentException(
          "ledger entry %d does not reference approval %s"
          .formatted(ledgerEntry.entryNo(), approval.id()));
  }

}
