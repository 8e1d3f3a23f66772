/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;

import java.util.Optional;

import io.riskledger.json.JsonValues;

/**
 * Changes to a membership's role, permissions, or notes. Absent fields are
 * left unchanged. Status changes are not made here: see
 * {@linkplain MembershipMgr#revoke(MembershipMgr.MembershipId, Optional)} and
 * {@linkplain MembershipMgr#addOrReactivate(Council, MemberArgs)}.
 *
 * @param role          new role, if present
 * @param permissions   new (JSON) permissions, if present; a present
 *                      {@code Optional} cannot hold JSON {@code null}, so
 *                      permissions can be replaced, but not cleared
 * @param notes         new notes, if present; blank clears the notes
 */
public record MembershipUpdate(
    Optional<CouncilRole> role,
    Optional<Object> permissions,
    Optional<String> notes) {

  /** Changes nothing. */
  public final static MembershipUpdate NONE =
      new MembershipUpdate(Optional.empty(), Optional.empty(), Optional.empty());


  public MembershipUpdate {
    if (role == null)
      role = Optional.empty();
    permissions = permissions == null ?
        Optional.empty() : permissions.map(JsonValues::normalize);
    if (notes == null)
      notes = Optional.empty();
    else if (notes.isPresent() && notes.get().trim().length() > MAX_TEXT_LENGTH)
      throw new IllegalArgumentException(
          "notes too long (%d chars)".formatted(notes.get().length()));
  }


  public MembershipUpdate role(CouncilRole newRole) {
    return new MembershipUpdate(Optional.of(newRole), permissions, notes);
  }

  public MembershipUpdate permissions(Object newPermissions) {
    return new MembershipUpdate(role, Optional.ofNullable(newPermissions), notes);
  }

  public MembershipUpdate notes(String newNotes) {
    return new MembershipUpdate(role, permissions, Optional.of(newNotes));
  }

  /** Returns {@code true} if this instance changes nothing. */
  public boolean isEmpty() {
    return role.isEmpty() && permissions.isEmpty() && notes.isEmpty();
  }

}
