/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import static io.riskledger.ledger.LedgerConstants.NULL_HASH;

import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Objects;

/**
 * Verifies an evidence chain held in memory. Side-effect free.
 *
 * <h2>Checks</h2>
 * <p>
 * Walking the chain in order, for each entry at index {@code i}:
 * </p>
 * <ol>
 * <li>If {@code i == 0}, its previous-hash must be absent.</li>
 * <li>Its recorded hash must equal the hash recomputed from its content.</li>
 * <li>If {@code i > 0}, its previous-hash must equal the recorded hash of
 *     the entry at {@code i - 1}.</li>
 * </ol>
 * <p>
 * The first check that fails determines the (negative) result.
 * </p>
 */
public final class ChainVerifier {

  // no one calls
  private ChainVerifier() {  }


  /**
   * Verifies the given chain.
   *
   * @param chain entries of a single assessment, in chain order
   *              (creation time, then sequence no.)
   */
  public static VerificationResult verify(List<LedgerEntry> chain) {
    Objects.requireNonNull(chain, "null chain");

    final int size = chain.size();
    for (int index = 0; index < size; ++index) {

      LedgerEntry entry = chain.get(index);

      if (index == 0 && entry.prevHash().isPresent())
        return fail(entry, 0, NULL_HASH, entry.prevHash().get());

      String expectedHash = entry.computeHash();
      if (!expectedHash.equals(entry.hash()))
        return fail(entry, index, expectedHash, entry.hash());

      if (index > 0) {
        String prevHash = chain.get(index - 1).hash();
        if (!entry.prevHash().filter(prevHash::equals).isPresent())
          return fail(entry, index, prevHash, entry.prevHash().orElse(null));
      }
    }
    return VerificationResult.VERIFIED;
  }


  private static VerificationResult fail(
      LedgerEntry entry, int index, String expected, String actual) {

    var result = VerificationResult.failure(index, expected, actual);
    LedgerConstants.getLogger().log(
        Level.WARNING,
        "evidence chain for assessment '%s' BROKEN at index %d (entry no. %d): %s"
        .formatted(entry.assessmentId(), index, entry.entryNo(), result));
    return result;
  }

}
