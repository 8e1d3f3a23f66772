/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.util.Optional;
import java.util.OptionalInt;

/**
 * Outcome of verifying an assessment's evidence chain. A negative outcome
 * is a finding about the data, not an error: it pinpoints the first entry
 * that breaks the chain.
 *
 * @param verified        {@code true} iff the chain is intact
 * @param failureIndex    0-based chain index of the first bad entry, if any
 * @param expectedHash    the hash value that should have been found there
 * @param actualHash      the hash value found instead
 */
public record VerificationResult(
    boolean verified,
    OptionalInt failureIndex,
    Optional<String> expectedHash,
    Optional<String> actualHash) {

  /** The positive outcome. */
  public final static VerificationResult VERIFIED =
      new VerificationResult(true, OptionalInt.empty(), Optional.empty(), Optional.empty());


  public VerificationResult {
    if (verified == failureIndex.isPresent())
      throw new IllegalArgumentException(
          "verified (%b) but failureIndex %s".formatted(verified, failureIndex));
    if (failureIndex.isPresent() && failureIndex.getAsInt() < 0)
      throw new IllegalArgumentException("negative failureIndex " + failureIndex);
  }


  /**
   * Returns a negative outcome.
   *
   * @param index       0-based index of the offending entry
   * @param expected    expected hash
   * @param actual      actual (recorded) hash; may be {@code null}
   */
  public static VerificationResult failure(int index, String expected, String actual) {
    return new VerificationResult(
        false,
        OptionalInt.of(index),
        Optional.of(expected),
        Optional.ofNullable(actual));
  }


  @Override
  public String toString() {
    return verified ?
        "[verified]" :
          "[FAILED at index %d: expected %s, actual %s]".formatted(
              failureIndex.getAsInt(),
              expectedHash.orElse(""),
              actualHash.orElse(""));
  }

}
