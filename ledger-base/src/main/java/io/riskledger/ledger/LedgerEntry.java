/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.util.Objects;
import java.util.Optional;

/**
 * An entry in an assessment's evidence ledger. Instances are read from (or
 * were just written to) the backing store; they may not be internally
 * consistent, which is what {@linkplain ChainVerifier} is for.
 *
 * @param entryNo     global insertion key (positive)
 * @param seqNo       1-based position in the assessment's chain
 * @param draft       the entry's content
 * @param prevHash    hash of the previous entry; empty for the first
 * @param createdUtc  creation time (epoch millis)
 * @param hash        the entry's recorded hash
 */
public record LedgerEntry(
    long entryNo,
    long seqNo,
    EntryDraft draft,
    Optional<String> prevHash,
    long createdUtc,
    String hash) {

  public LedgerEntry {
    if (entryNo < 1)
      throw new IllegalArgumentException("entryNo " + entryNo);
    if (seqNo < 1)
      throw new IllegalArgumentException("seqNo " + seqNo);
    Objects.requireNonNull(draft, "null draft");
    if (prevHash == null)
      prevHash = Optional.empty();
    Objects.requireNonNull(hash, "null hash");
  }


  public String assessmentId() {
    return draft.assessmentId();
  }

  public LedgerEntryType entryType() {
    return draft.entryType();
  }

  public Object payload() {
    return draft.payload();
  }

  public Optional<String> actorId() {
    return draft.actorId();
  }

  public String actorRole() {
    return draft.actorRole();
  }

  /** Tests whether this is the first entry in its chain. */
  public boolean isFirst() {
    return seqNo == 1;
  }


  /**
   * Recomputes and returns the hash of this entry's content.
   *
   * @see EntryHasher#computeHash(EntryDraft, Optional, long)
   */
  public String computeHash() {
    return EntryHasher.computeHash(draft, prevHash, createdUtc);
  }


  /** Tests whether the recorded {@linkplain #hash()} is correct. */
  public boolean hashVerified() {
    return hash.equals(computeHash());
  }

}
