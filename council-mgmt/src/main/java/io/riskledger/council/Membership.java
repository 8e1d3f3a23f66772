/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import java.util.Objects;
import java.util.Optional;

import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.council.MembershipMgr.MembershipId;

/**
 * A user's membership on a council, as read from the database.
 *
 * @param id            system identifier
 * @param councilId     the council
 * @param userId        the member's user id (unique per council)
 * @param role          role on the council
 * @param status        {@code ACTIVE} or {@code REVOKED}
 * @param permissions   opaque JSON value; may be {@code null}
 * @param notes         optional notes
 * @param assignedBy    user id of who added (or reactivated) the member
 * @param assignedUtc   when added (or reactivated)
 * @param revokedUtc    when revoked; present iff revoked
 */
public record Membership(
    MembershipId id,
    CouncilId councilId,
    String userId,
    CouncilRole role,
    MembershipStatus status,
    Object permissions,
    Optional<String> notes,
    String assignedBy,
    long assignedUtc,
    Optional<Long> revokedUtc) {

  public Membership {
    Objects.requireNonNull(id, "null id");
    Objects.requireNonNull(councilId, "null councilId");
    Objects.requireNonNull(userId, "null userId");
    Objects.requireNonNull(role, "null role");
    Objects.requireNonNull(status, "null status");
    Objects.requireNonNull(assignedBy, "null assignedBy");
    if (notes == null)
      notes = Optional.empty();
    if (revokedUtc == null)
      revokedUtc = Optional.empty();
  }


  /** Returns {@code true} iff the status is {@code ACTIVE}. */
  public boolean isActive() {
    return status == MembershipStatus.ACTIVE;
  }

}
