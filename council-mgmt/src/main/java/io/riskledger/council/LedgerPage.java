/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.List;
import java.util.OptionalLong;

import io.riskledger.ledger.LedgerEntry;

/**
 * A page of ledger entries, in ascending sequence order.
 *
 * @param entries     immutable list
 * @param nextCursor  the cursor for the next page, if there are more entries
 *
 * @see LedgerQuery#after(long)
 */
public record LedgerPage(List<LedgerEntry> entries, OptionalLong nextCursor) {

  public LedgerPage {
    entries = List.copyOf(entries);
    if (nextCursor == null)
      nextCursor = OptionalLong.empty();
  }

  /** Tests whether there are more entries past this page. */
  public boolean hasMore() {
    return nextCursor.isPresent();
  }

}
