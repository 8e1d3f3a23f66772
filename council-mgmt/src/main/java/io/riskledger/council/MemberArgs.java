/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;

import java.util.Optional;

import io.riskledger.json.JsonValues;

/**
 * Arguments for adding (or reactivating) a council member.
 *
 * @param userId        the user's id (not blank)
 * @param role          council role
 * @param permissions   opaque JSON value; may be {@code null}
 * @param notes         optional notes
 * @param assignedBy    user id of the administrator (not blank)
 *
 * @see MembershipMgr#addOrReactivate(Council, MemberArgs)
 */
public record MemberArgs(
    String userId,
    CouncilRole role,
    Object permissions,
    Optional<String> notes,
    String assignedBy) {

  public MemberArgs {
    userId = checkText(userId, "userId", MAX_ID_LENGTH);
    if (role == null)
      throw new IllegalArgumentException("missing role");
    permissions = JsonValues.normalize(permissions);
    notes = checkText(notes, "notes", MAX_TEXT_LENGTH);
    assignedBy = checkText(assignedBy, "assignedBy", MAX_ID_LENGTH);
  }


  /** Creates an instance with no permissions or notes. */
  public MemberArgs(String userId, CouncilRole role, String assignedBy) {
    this(userId, role, null, Optional.empty(), assignedBy);
  }


  /** Returns a copy of this instance with the given notes. */
  public MemberArgs notes(String newNotes) {
    return new MemberArgs(userId, role, permissions, Optional.ofNullable(newNotes), assignedBy);
  }

  /** Returns a copy of this instance with the given (JSON) permissions. */
  public MemberArgs permissions(Object newPermissions) {
    return new MemberArgs(userId, role, newPermissions, notes, assignedBy);
  }

}
