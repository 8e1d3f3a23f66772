/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes ledger entry hashes: the hex-encoded SHA-256 of the
 * {@linkplain CanonicalEncoder canonical encoding} of the entry's
 * {@linkplain #content(EntryDraft, Optional, long) content}.
 */
public final class EntryHasher {

  // no one calls
  private EntryHasher() {  }


  public final static String ASSESSMENT_ID = "assessmentId";
  public final static String ENTRY_TYPE = "entryType";
  public final static String PAYLOAD = "payload";
  public final static String PREV_HASH = "prevHash";
  public final static String TIMESTAMP = "timestamp";
  public final static String COUNCIL_ID = "councilId";
  public final static String MEMBERSHIP_ID = "membershipId";
  public final static String APPROVAL_ID = "approvalId";
  public final static String ACTOR_ID = "actorId";
  public final static String ACTOR_ROLE = "actorRole";


  private final static ThreadLocal<MessageDigest> WORK_DIGEST =
      new ThreadLocal<>() {
        @Override
        protected MessageDigest initialValue() {
          try {
            return MessageDigest.getInstance(LedgerConstants.HASH_ALGO);
          } catch (NoSuchAlgorithmException nsax) {
            throw new RuntimeException(
                "on creating digest with algo " + LedgerConstants.HASH_ALGO, nsax);
          }
        }
      };


  /**
   * Returns the logical content of an entry as a map. Absent optional
   * fields map to {@code null} (the keys are always present); the
   * timestamp is epoch milliseconds.
   *
   * @return a new, sorted map
   */
  public static Map<String, Object> content(
      EntryDraft draft, Optional<String> prevHash, long createdUtc) {

    TreeMap<String, Object> content = new TreeMap<>();
    content.put(ASSESSMENT_ID, draft.assessmentId());
    content.put(ENTRY_TYPE, draft.entryType().name());
    content.put(PAYLOAD, draft.payload());
    content.put(PREV_HASH, prevHash.orElse(null));
    content.put(TIMESTAMP, createdUtc);
    content.put(COUNCIL_ID, draft.councilId().orElse(null));
    content.put(MEMBERSHIP_ID, draft.membershipId().orElse(null));
    content.put(APPROVAL_ID, draft.approvalId().orElse(null));
    content.put(ACTOR_ID, draft.actorId().orElse(null));
    content.put(ACTOR_ROLE, draft.actorRole());
    return content;
  }


  /**
   * Computes and returns the hex-encoded hash of the given entry content.
   *
   * @param draft       the entry's draft
   * @param prevHash    the previous entry's hash; empty for the first entry
   * @param createdUtc  creation time (epoch millis)
   *
   * @return lowercase hex, {@linkplain LedgerConstants#HEX_HASH_WIDTH} chars
   */
  public static String computeHash(
      EntryDraft draft, Optional<String> prevHash, long createdUtc) {

    byte[] preimage = CanonicalEncoder.encode(content(draft, prevHash, createdUtc));
    MessageDigest digest = WORK_DIGEST.get();
    digest.reset();
    return HexFormat.of().formatHex(digest.digest(preimage));
  }


  /**
   * Tests whether the given string is a well-formed hex hash.
   */
  public static boolean isHexHash(String hash) {
    if (hash == null || hash.length() != LedgerConstants.HEX_HASH_WIDTH)
      return false;
    for (int index = hash.length(); index-- > 0; ) {
      char c = hash.charAt(index);
      if (!(c >= '0' && c <= '9' || c >= 'a' && c <= 'f'))
        return false;
    }
    return true;
  }

}
