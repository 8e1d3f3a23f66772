/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static io.riskledger.council.CouncilConstants.*;

import java.util.Objects;
import java.util.Optional;

import io.riskledger.consensus.QuorumPolicy;
import io.riskledger.council.CouncilMgr.CouncilId;
import io.riskledger.json.JsonValues;

/**
 * A council in the system. Instances are immutable, but have mutator
 * methods that return modified instances. Instances fall in one of two
 * categories:
 * <ol>
 * <li>those created by the user.</li>
 * <li>those created and returned by the system ({@linkplain CouncilMgr}).
 * </ol>
 * System-created instances have set council IDs. <em>User</em>-created
 * instances don't have an ID and are used as chunky arguments to create and
 * update councils: they are referred to as "args"-instances.
 *
 * @see #argsInstance(String, String, String)
 */
public final class Council {

  /**
   * Returns a new "args"-instance with the default quorum policy (quorum 1,
   * majority rule), and no approval policy or metadata.
   *
   * @param name          1 to 255 chars (after trimming)
   * @param description   optional: {@code null} or blank counts as empty
   * @param orgId         optional: {@code null} or blank counts as empty
   */
  public static Council argsInstance(String name, String description, String orgId) {
    return new Council(
        CouncilMgr.INIT_ID,
        name,
        Optional.ofNullable(description),
        Optional.ofNullable(orgId),
        CouncilStatus.ACTIVE,
        QuorumPolicy.DEFAULT,
        null,
        null,
        0L,
        0L);
  }


  private final CouncilId id;
  private final String name;
  private final Optional<String> description;
  private final Optional<String> orgId;
  private final CouncilStatus status;
  private final QuorumPolicy policy;
  private final Object approvalPolicy;
  private final Object metadata;
  private final long createdUtc;
  private final long updatedUtc;


  /**
   * Package-private, full constructor.
   */
  Council(
      CouncilId id,
      String name,
      Optional<String> description,
      Optional<String> orgId,
      CouncilStatus status,
      QuorumPolicy policy,
      Object approvalPolicy,
      Object metadata,
      long createdUtc,
      long updatedUtc) throws IllegalArgumentException {

    this.id = Objects.requireNonNull(id, "null id");
    this.name = checkText(name, "name", MAX_ID_LENGTH);
    this.description = checkText(description, "description", MAX_TEXT_LENGTH);
    this.orgId = checkText(orgId, "orgId", MAX_ID_LENGTH);
    this.status = Objects.requireNonNull(status, "null status");
    this.policy = Objects.requireNonNull(policy, "null policy");
    this.approvalPolicy = JsonValues.normalize(approvalPolicy);
    this.metadata = JsonValues.normalize(metadata);
    this.createdUtc = createdUtc;
    this.updatedUtc = updatedUtc;
  }


  private Council args(
      String name,
      Optional<String> description,
      Optional<String> orgId,
      QuorumPolicy policy,
      Object approvalPolicy,
      Object metadata) {
    return new Council(
        CouncilMgr.INIT_ID,
        name,
        description,
        orgId,
        CouncilStatus.ACTIVE,
        policy,
        approvalPolicy,
        metadata,
        0L,
        0L);
  }


  /** Tests whether this is an "args"-instance. */
  public boolean isArgs() {
    return !id.isSet();
  }

  /**
   * Returns the council's system identifier.
   *
   * @see CouncilId#isSet()
   */
  public CouncilId id() {
    return id;
  }

  public String name() {
    return name;
  }

  /**
   * Returns an instance with the given new name.
   *
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council name(String newName) {
    if (newName.trim().equals(name))
      return this;
    return args(newName, description, orgId, policy, approvalPolicy, metadata);
  }

  public Optional<String> description() {
    return description;
  }

  /**
   * Returns an instance with the given new description.
   *
   * @param newDescription {@code null} or blank counts as empty
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council description(Optional<String> newDescription) {
    return
        normalize(newDescription).equals(description) ?
            this :
              args(name, newDescription, orgId, policy, approvalPolicy, metadata);
  }

  /** Returns the optional organization id the council belongs to. */
  public Optional<String> orgId() {
    return orgId;
  }

  /**
   * Returns an instance with the given new organization id.
   *
   * @param newOrgId {@code null} or blank counts as empty
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council orgId(Optional<String> newOrgId) {
    return
        normalize(newOrgId).equals(orgId) ?
            this :
              args(name, description, newOrgId, policy, approvalPolicy, metadata);
  }

  public CouncilStatus status() {
    return status;
  }

  /** Returns {@code true} iff the council's status is {@code ACTIVE}. */
  public boolean isActive() {
    return status == CouncilStatus.ACTIVE;
  }

  /** Returns the quorum policy votes are evaluated under. */
  public QuorumPolicy policy() {
    return policy;
  }

  /**
   * Returns an instance with the given new quorum policy.
   *
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council policy(QuorumPolicy newPolicy) {
    return
        policy.equals(newPolicy) ?
            this :
              args(name, description, orgId, newPolicy, approvalPolicy, metadata);
  }

  /** Shorthand for {@code policy(new QuorumPolicy(quorum, requireUnanimous))}. */
  public Council policy(int quorum, boolean requireUnanimous) {
    return policy(new QuorumPolicy(quorum, requireUnanimous));
  }

  /** Returns the opaque (JSON) approval policy; may be {@code null}. */
  public Object approvalPolicy() {
    return approvalPolicy;
  }

  /**
   * Returns an instance with the given opaque (JSON) approval policy.
   *
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council approvalPolicy(Object newPolicy) {
    newPolicy = JsonValues.normalize(newPolicy);
    return
        Objects.equals(newPolicy, approvalPolicy) ?
            this :
              args(name, description, orgId, policy, newPolicy, metadata);
  }

  /** Returns the opaque (JSON) metadata; may be {@code null}. */
  public Object metadata() {
    return metadata;
  }

  /**
   * Returns an instance with the given opaque (JSON) metadata.
   *
   * @return {@code this} instance if unchanged, an "args"-instance, otherwise
   */
  public Council metadata(Object newMetadata) {
    newMetadata = JsonValues.normalize(newMetadata);
    return
        Objects.equals(newMetadata, metadata) ?
            this :
              args(name, description, orgId, policy, approvalPolicy, newMetadata);
  }

  /** Creation time (epoch millis); zero for "args"-instances. */
  public long createdUtc() {
    return createdUtc;
  }

  /** Last-modified time (epoch millis); zero for "args"-instances. */
  public long updatedUtc() {
    return updatedUtc;
  }


  /**
   * Instances are equal, if they are member-wise equal.
   *
   * @see #equalsIgnoringId(Council)
   */
  @Override
  public boolean equals(Object o) {
    return o == this ||
        o instanceof Council other &&
        other.id.equals(id) &&
        other.status == status &&
        other.createdUtc == createdUtc &&
        other.updatedUtc == updatedUtc &&
        equalsIgnoringId(other);
  }

  /** @return {@code id().hashCode()} */
  @Override
  public int hashCode() {
    return id.hashCode();
  }


  /**
   * Tests if this instance's user-settable properties equal the
   * {@code other}'s. Ignores the id, status, and timestamps.
   *
   * @param other   not {@code null}
   */
  public boolean equalsIgnoringId(Council other) {
    return
        other.name.equals(name) &&
        other.description.equals(description) &&
        other.orgId.equals(orgId) &&
        other.policy.equals(policy) &&
        Objects.equals(other.approvalPolicy, approvalPolicy) &&
        Objects.equals(other.metadata, metadata);
  }


  @Override
  public String toString() {
    return
        "[id: " + (id.isSet() ? id : "<args>") +
        ", name: " + name +
        ", status: " + status +
        ", quorum: " + policy.quorum() +
        (policy.requireUnanimous() ? " (unanimous)" : "") +
        orgId.map(o -> ", org: " + o).orElse("") + "]";
  }

}
