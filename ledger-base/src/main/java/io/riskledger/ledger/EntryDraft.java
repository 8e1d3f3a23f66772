/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.ledger;


import java.util.Objects;
import java.util.Optional;

import io.riskledger.json.JsonValues;

/**
 * The caller-supplied content of a ledger entry: everything but its position
 * in the chain, its timestamp, and its hash. Reference ids (council,
 * membership, approval) are the database keys of those records as they were
 * at the time of the action; they are recorded, never followed.
 *
 * <h2>Validation</h2>
 * <p>
 * The canonical constructor validates but does not transform its string
 * arguments, since it also rebuilds entries read back from storage, whose
 * hashes must be recomputed over exactly what was stored. Appenders
 * trim their input with {@linkplain #normalized()}; the 5-argument
 * convenience constructor does so already.
 * </p>
 *
 * @param assessmentId  the assessment whose chain this entry joins (not blank)
 * @param councilId     optional council key
 * @param membershipId  optional membership key
 * @param approvalId    optional approval (vote) key
 * @param actorId       optional user id of the actor (not blank, if present)
 * @param actorRole     role the actor acted in (not blank)
 * @param entryType     not {@code null}
 * @param payload       opaque JSON value (normalized on construction)
 *
 * @see JsonValues#normalize(Object)
 */
public record EntryDraft(
    String assessmentId,
    Optional<Long> councilId,
    Optional<Long> membershipId,
    Optional<Long> approvalId,
    Optional<String> actorId,
    String actorRole,
    LedgerEntryType entryType,
    Object payload) {

  /** Maximum length of the id and role strings. */
  public final static int MAX_ID_LENGTH = 255;


  public EntryDraft {
    checkText(assessmentId, "assessmentId");
    checkText(actorRole, "actorRole");
    Objects.requireNonNull(entryType, "null entryType");
    if (councilId == null)
      councilId = Optional.empty();
    if (membershipId == null)
      membershipId = Optional.empty();
    if (approvalId == null)
      approvalId = Optional.empty();
    if (actorId == null)
      actorId = Optional.empty();
    else if (actorId.isPresent())
      checkText(actorId.get(), "actorId");
    payload = JsonValues.normalize(payload);
  }


  /**
   * Creates an instance with no council, membership, or approval reference.
   * The string arguments are trimmed; a blank {@code actorId} counts as
   * absent.
   */
  public EntryDraft(
      String assessmentId,
      String actorId,
      String actorRole,
      LedgerEntryType entryType,
      Object payload) {
    this(
        trim(assessmentId),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        toActorId(actorId),
        trim(actorRole),
        entryType,
        payload);
  }


  /**
   * Returns the draft to append: its strings trimmed, and a blank actor id
   * cleared.
   *
   * @return {@code this} instance, if already normalized
   */
  public EntryDraft normalized() {
    var id = trim(assessmentId);
    var actor = actorId.flatMap(EntryDraft::toActorId);
    var role = trim(actorRole);
    if (id.equals(assessmentId) && actor.equals(actorId) && role.equals(actorRole))
      return this;
    return new EntryDraft(
        id, councilId, membershipId, approvalId, actor, role, entryType, payload);
  }


  /**
   * Returns the given actor id trimmed, or empty if {@code null} or blank.
   */
  public static Optional<String> toActorId(String actorId) {
    return actorId == null || actorId.isBlank() ?
        Optional.empty() : Optional.of(actorId.trim());
  }


  private static String trim(String value) {
    return value == null ? null : value.trim();
  }


  private static void checkText(String value, String name) {
    if (value == null)
      throw new IllegalArgumentException("missing " + name);
    if (value.isBlank())
      throw new IllegalArgumentException("blank " + name);
    if (value.length() > MAX_ID_LENGTH)
      throw new IllegalArgumentException(
          "%s too long (%d chars)".formatted(name, value.length()));
  }

}
