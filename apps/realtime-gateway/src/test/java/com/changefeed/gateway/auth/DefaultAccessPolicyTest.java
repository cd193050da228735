package com.changefeed.gateway.auth;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.domain.sessions.AccessClaims;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultAccessPolicyTest {
  private DefaultAccessPolicy policy;

  @BeforeEach
  void setUp() {
    AccessProperties properties = new AccessProperties();
    AccessProperties.ChannelRule tasks = new AccessProperties.ChannelRule();
    tasks.setOwnerColumn("user_id");
    AccessProperties.ChannelRule invoices = new AccessProperties.ChannelRule();
    invoices.setRequiredRoles(List.of("billing"));
    AccessProperties.ChannelRule projects = new AccessProperties.ChannelRule();
    projects.setOwnerColumn("tenant_id");
    projects.setOwnerClaim("tenant_id");
    properties.getChannels().put("tasks", tasks);
    properties.getChannels().put("invoices", invoices);
    properties.getChannels().put("projects", projects);
    policy = new DefaultAccessPolicy(properties);
  }

  @Test
  void ownerColumnShouldRestrictRowsToSubject() {
    assertTrue(policy.authorizeRow(user("u1"), "tasks", Map.of("user_id", "u1")));
    assertFalse(policy.authorizeRow(user("u1"), "tasks", Map.of("user_id", "u2")));
    assertFalse(policy.authorizeRow(user("u1"), "tasks", Map.of("title", "no owner")));
  }

  @Test
  void eitherImageShouldEstablishOwnershipOfAnEvent() {
    ChangeEvent handedOff =
        event(ChangeOperation.UPDATE, Map.of("user_id", "u1"), Map.of("user_id", "u2"));

    assertTrue(policy.authorize(user("u1"), handedOff));
    assertTrue(policy.authorize(user("u2"), handedOff));
    assertFalse(policy.authorize(user("u3"), handedOff));
  }

  @Test
  void bypassRoleShouldSeeEveryRow() {
    AccessClaims admin = new AccessClaims("ops", Set.of("admin"), null, Map.of());

    assertTrue(policy.authorizeRow(admin, "tasks", Map.of("user_id", "u2")));
    assertTrue(policy.authorizeRow(admin, "unlisted", Map.of()));
  }

  @Test
  void requiredRolesShouldGateChannel() {
    AccessClaims billing = new AccessClaims("b1", Set.of("BILLING"), null, Map.of());

    assertTrue(policy.authorizeRow(billing, "invoices", Map.of("amount", 10)));
    assertFalse(policy.authorizeRow(user("u1"), "invoices", Map.of("amount", 10)));
  }

  @Test
  void unlistedChannelShouldBeDeniedByDefault() {
    assertFalse(policy.authorizeRow(user("u1"), "audit_log", Map.of()));

    AccessProperties open = new AccessProperties();
    open.setAllowUnlistedChannels(true);
    assertTrue(new DefaultAccessPolicy(open).authorizeRow(user("u1"), "audit_log", Map.of()));
  }

  @Test
  void ownerClaimShouldCompareAgainstClaimAttribute() {
    AccessClaims tenantUser = new AccessClaims("u1", Set.of(), null, Map.of("tenant_id", "acme"));

    assertTrue(policy.authorizeRow(tenantUser, "projects", Map.of("tenant_id", "acme")));
    assertFalse(policy.authorizeRow(tenantUser, "projects", Map.of("tenant_id", "globex")));
    assertFalse(policy.authorizeRow(user("u9"), "projects", Map.of("tenant_id", "acme")));
  }

  private static AccessClaims user(String subject) {
    return new AccessClaims(subject, Set.of("USER"), null, Map.of());
  }

  private static ChangeEvent event(
      ChangeOperation operation, Map<String, Object> before, Map<String, Object> after) {
    return new ChangeEvent(
        1L, "tasks", operation, "t-1", before, after, Instant.parse("2026-03-01T00:00:00Z"), "tx-1");
  }
}
