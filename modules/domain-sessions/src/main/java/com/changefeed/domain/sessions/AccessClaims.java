package com.changefeed.domain.sessions;

import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Identity facts extracted from a validated bearer credential. Roles are upper-cased so policy
 * checks stay case-insensitive.
 */
public record AccessClaims(
    String subject, Set<String> roles, Instant expiresAt, Map<String, String> attributes) {
  public AccessClaims {
    if (subject == null || subject.isBlank()) {
      throw new SessionDomainException("subject must not be blank");
    }
    roles =
        roles == null
            ? Set.of()
            : Set.copyOf(
                roles.stream()
                    .filter(role -> role != null && !role.isBlank())
                    .map(role -> role.toUpperCase(Locale.ROOT))
                    .toList());
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public boolean hasRole(String role) {
    return role != null && roles.contains(role.toUpperCase(Locale.ROOT));
  }

  public boolean hasAnyRole(Collection<String> candidates) {
    if (candidates == null) {
      return false;
    }
    return candidates.stream().anyMatch(this::hasRole);
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  public String attribute(String name) {
    return attributes.get(name);
  }
}
