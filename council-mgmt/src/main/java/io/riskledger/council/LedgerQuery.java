/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.DEFAULT_LIMIT;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import io.riskledger.ledger.LedgerEntryType;

/**
 * Parameters for paging through an assessment's ledger.
 *
 * @param entryTypes  entry types to include; empty means all
 * @param cursor      exclusive sequence no. to start after ({@code 0} for the
 *                    beginning)
 * @param limit       page size in the range [1, {@linkplain CouncilConstants#MAX_LIMIT}]
 */
public record LedgerQuery(Set<LedgerEntryType> entryTypes, long cursor, int limit) {

  /** First page, all entry types, default page size. */
  public final static LedgerQuery DEFAULT = new LedgerQuery(Set.of(), 0, DEFAULT_LIMIT);


  public LedgerQuery {
    entryTypes = entryTypes == null || entryTypes.isEmpty() ?
        Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(entryTypes));
    if (cursor < 0)
      throw new IllegalArgumentException("negative cursor: " + cursor);
    CouncilConstants.checkLimit(limit);
  }


  /** Returns a copy of this query restricted to the given entry types. */
  public LedgerQuery entryTypes(LedgerEntryType... types) {
    return new LedgerQuery(types.length == 0 ? Set.of() : Set.of(types), cursor, limit);
  }

  /** Returns a copy of this query that starts after the given sequence no. */
  public LedgerQuery after(long seqNo) {
    return new LedgerQuery(entryTypes, seqNo, limit);
  }

  /** Returns a copy of this query with the given page size. */
  public LedgerQuery limit(int size) {
    return new LedgerQuery(entryTypes, cursor, size);
  }

  /** Tests whether this query filters by entry type. */
  public boolean isFiltered() {
    return !entryTypes.isEmpty();
  }

}
