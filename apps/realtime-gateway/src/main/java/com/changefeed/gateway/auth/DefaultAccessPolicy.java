package com.changefeed.gateway.auth;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.sessions.AccessClaims;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration-driven policy: bypass roles see everything, a channel may require roles, and a
 * channel with an owner column only shows rows whose owner equals the subject (or a configured
 * claim). For events either image may establish ownership, so a row handed to someone else is
 * still delivered once to its previous owner.
 */
public class DefaultAccessPolicy implements AccessPolicy {
  private final List<String> bypassRoles;
  private final boolean allowUnlistedChannels;
  private final Map<String, AccessProperties.ChannelRule> rules;

  public DefaultAccessPolicy(AccessProperties properties) {
    this.bypassRoles = List.copyOf(properties.getBypassRoles());
    this.allowUnlistedChannels = properties.isAllowUnlistedChannels();
    this.rules = new HashMap<>(properties.getChannels());
  }

  @Override
  public boolean authorize(AccessClaims claims, ChangeEvent event) {
    AccessProperties.ChannelRule rule = rules.get(event.channel());
    if (!channelAllowed(claims, rule)) {
      return false;
    }
    if (bypass(claims) || rule == null || !hasOwnerColumn(rule)) {
      return true;
    }
    return ownedBy(claims, rule, event.after()) || ownedBy(claims, rule, event.before());
  }

  @Override
  public boolean authorizeRow(AccessClaims claims, String channel, Map<String, Object> row) {
    AccessProperties.ChannelRule rule = rules.get(channel);
    if (!channelAllowed(claims, rule)) {
      return false;
    }
    if (bypass(claims) || rule == null || !hasOwnerColumn(rule)) {
      return true;
    }
    return ownedBy(claims, rule, row);
  }

  private boolean channelAllowed(AccessClaims claims, AccessProperties.ChannelRule rule) {
    if (bypass(claims)) {
      return true;
    }
    if (rule == null) {
      return allowUnlistedChannels;
    }
    List<String> required = rule.getRequiredRoles();
    return required == null || required.isEmpty() || claims.hasAnyRole(required);
  }

  private boolean bypass(AccessClaims claims) {
    return !bypassRoles.isEmpty() && claims.hasAnyRole(bypassRoles);
  }

  private static boolean hasOwnerColumn(AccessProperties.ChannelRule rule) {
    return rule.getOwnerColumn() != null && !rule.getOwnerColumn().isBlank();
  }

  private static boolean ownedBy(
      AccessClaims claims, AccessProperties.ChannelRule rule, Map<String, Object> image) {
    if (image == null) {
      return false;
    }
    Object owner = image.get(rule.getOwnerColumn());
    if (owner == null) {
      return false;
    }
    String claim = rule.getOwnerClaim();
    String expected =
        claim == null || claim.isBlank() || "sub".equals(claim)
            ? claims.subject()
            : claims.attribute(claim);
    return expected != null && Objects.equals(owner.toString(), expected);
  }
}
