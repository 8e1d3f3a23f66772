/*
 * Copyright 2026 Babak Farhang
 */
package io.riskledger.council;


import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.riskledger.council.MembershipMgr.MembershipId;

/**
 * Tests {@linkplain MembershipMgr} against in-memory H2 databases.
 */
public class MembershipMgrTest extends BaseTestCase {

  private final DbEnv env = DbEnv.DEFAULT.readWrite(true);


  private Council setup(Connection con) throws Exception {
    CouncilMgr.ensureTables(env, con);
    MembershipMgr.ensureTables(env, con);
    return new CouncilMgr(env, con, new TickingClock())
        .newCouncil(Council.argsInstance("Market Risk", null, null));
  }


  @Test
  public void testAdd() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      Connection con = newDatabase(label);
      closer.pushClose(con);
      var council = setup(con);
      var manager = new MembershipMgr(env, con, new TickingClock());

      var args = new MemberArgs("alice", CouncilRole.CHAIR, "admin")
          .notes("founding chair")
          .permissions(Map.of("canArchive", true));

      var member = manager.addOrReactivate(council, args);
      assertTrue(member.id().isSet());
      assertEquals(council.id(), member.councilId());
      assertEquals("alice", member.userId());
      assertEquals(CouncilRole.CHAIR, member.role());
      assertTrue(member.isActive());
      assertEquals("founding chair", member.notes().get());
      assertEquals(Map.of("canArchive", true), member.permissions());
      assertEquals("admin", member.assignedBy());
      assertTrue(member.revokedUtc().isEmpty());

      assertEquals(member, manager.getById(member.id().no(), false));
      assertEquals(member, manager.findByUser(council.id(), "alice").get());
      assertTrue(manager.findByUser(council.id(), "bob").isEmpty());
    }
  }


  @Test
  public void testBadArgs() {
    final Object label = new Object() { };
    try {
      new MemberArgs(" ", CouncilRole.PARTNER, "admin");
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
    try {
      new MemberArgs("bob", null, "admin");
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
    try {
      new MemberArgs("bob", CouncilRole.PARTNER, null);
      fail();
    } catch (IllegalArgumentException expected) {
      printExpected(label, expected);
    }
  }


  @Test
  public void testRevoke() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      Connection con = newDatabase(label);
      closer.pushClose(con);
      var council = setup(con);
      var manager = new MembershipMgr(env, con, new TickingClock());

      var member = manager.addOrReactivate(
          council, new MemberArgs("bob", CouncilRole.PARTNER, "admin").notes("n1"));

      var revoked = manager.revoke(member.id(), Optional.empty());
      assertEquals(MembershipStatus.REVOKED, revoked.status());
      assertFalse(revoked.isActive());
      assertTrue(revoked.revokedUtc().isPresent());
      assertEquals("n1", revoked.notes().get());

      // idempotent: revocation time stays the same
      var again = manager.revoke(member.id(), Optional.of("ignored"));
      assertEquals(revoked, again);

      try {
        manager.revoke(new MembershipId(99), Optional.empty());
        fail();
      } catch (NoSuchElementException expected) {  }
    }
  }


  @Test
  public void testIdempotentReactivation() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      Connection con = newDatabase(label);
      closer.pushClose(con);
      var council = setup(con);
      var manager = new MembershipMgr(env, con, new TickingClock());

      var args = new MemberArgs("carol", CouncilRole.PARTNER, "admin");
      var member = manager.addOrReactivate(council, args);
      manager.revoke(member.id(), Optional.of("on leave"));

      var reactivated = manager.addOrReactivate(
          council, new MemberArgs("carol", CouncilRole.OBSERVER, "admin2"));

      assertEquals(member.id(), reactivated.id());
      assertTrue(reactivated.isActive());
      assertTrue(reactivated.revokedUtc().isEmpty());
      assertEquals(CouncilRole.OBSERVER, reactivated.role());
      assertEquals("admin2", reactivated.assignedBy());

      // adding an already active member: still one row
      var again = manager.addOrReactivate(council, args);
      assertEquals(member.id(), again.id());
      assertTrue(again.isActive());

      List<Membership> members = manager.list(council.id(), Optional.empty());
      assertEquals(1, members.size());
      assertEquals(MembershipStatus.ACTIVE, members.get(0).status());
      assertTrue(members.get(0).revokedUtc().isEmpty());
    }
  }


  @Test
  public void testUpdate() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      Connection con = newDatabase(label);
      closer.pushClose(con);
      var council = setup(con);
      var manager = new MembershipMgr(env, con, new TickingClock());

      var member = manager.addOrReactivate(
          council, new MemberArgs("dave", CouncilRole.PARTNER, "admin").notes("old"));

      assertEquals(member, manager.update(member.id(), MembershipUpdate.NONE));

      var updated = manager.update(
          member.id(),
          MembershipUpdate.NONE.role(CouncilRole.CHAIR).permissions(List.of("vote", "archive")));
      assertEquals(CouncilRole.CHAIR, updated.role());
      assertEquals(List.of("vote", "archive"), updated.permissions());
      assertEquals("old", updated.notes().get());
      assertEquals(member.assignedUtc(), updated.assignedUtc());

      var cleared = manager.update(member.id(), MembershipUpdate.NONE.notes("  "));
      assertTrue(cleared.notes().isEmpty());
      assertEquals(CouncilRole.CHAIR, cleared.role());
    }
  }


  @Test
  public void testListByStatus() throws Exception {
    final Object label = new Object() { };

    try (var closer = suppressLogging()) {
      Connection con = newDatabase(label);
      closer.pushClose(con);
      var council = setup(con);
      var manager = new MembershipMgr(env, con, new TickingClock());

      var users = List.of("u1", "u2", "u3", "u4");
      for (var user : users)
        manager.addOrReactivate(council, new MemberArgs(user, CouncilRole.PARTNER, "admin"));
      manager.revoke(manager.findByUser(council.id(), "u2").get().id(), Optional.empty());

      var all = manager.list(council.id(), Optional.empty());
      assertEquals(4, all.size());
      // latest assigned first
      assertEquals("u4", all.get(0).userId());

      var active = manager.list(council.id(), Optional.of(MembershipStatus.ACTIVE));
      assertEquals(3, active.size());
      var revoked = manager.list(council.id(), Optional.of(MembershipStatus.REVOKED));
      assertEquals(1, revoked.size());
      assertEquals("u2", revoked.get(0).userId());
    }
  }

}
