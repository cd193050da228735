package com.changefeed.gateway.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps Keycloak realm roles and the gateway client's roles to {@code ROLE_*} authorities. The
 * same role extraction feeds the access claims of stream connections.
 */
public class RealmRoleGrantedAuthoritiesConverter
    implements Converter<Jwt, Collection<GrantedAuthority>> {
  public static final String DEFAULT_CLIENT_ID = "changefeed-gateway";

  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();
  private final String clientId;

  public RealmRoleGrantedAuthoritiesConverter() {
    this(DEFAULT_CLIENT_ID);
  }

  public RealmRoleGrantedAuthoritiesConverter(String clientId) {
    this.clientId = clientId;
  }

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();

    Collection<GrantedAuthority> scopeAuthorities = scopeConverter.convert(jwt);
    if (scopeAuthorities != null) {
      authorities.addAll(scopeAuthorities);
    }

    roleNames(jwt, clientId).stream()
        .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
        .forEach(authorities::add);
    return authorities;
  }

  /** Upper-cased realm roles followed by the client's roles, without duplicates. */
  public static Set<String> roleNames(Jwt jwt, String clientId) {
    List<String> roles = new ArrayList<>(realmRoles(jwt));
    roles.addAll(resourceClientRoles(jwt, clientId));
    Set<String> normalized = new LinkedHashSet<>();
    roles.stream()
        .filter(role -> !role.isBlank())
        .map(String::toUpperCase)
        .forEach(normalized::add);
    return normalized;
  }

  private static Collection<String> realmRoles(Jwt jwt) {
    Object realmAccess = jwt.getClaims().get("realm_access");
    if (realmAccess instanceof Map<?, ?> realmAccessMap) {
      return stringValues(realmAccessMap.get("roles"));
    }
    return List.of();
  }

  private static Collection<String> resourceClientRoles(Jwt jwt, String clientId) {
    Object resourceAccess = jwt.getClaims().get("resource_access");
    if (resourceAccess instanceof Map<?, ?> resourceAccessMap) {
      Object clientAccess = resourceAccessMap.get(clientId);
      if (clientAccess instanceof Map<?, ?> clientAccessMap) {
        return stringValues(clientAccessMap.get("roles"));
      }
    }
    return List.of();
  }

  private static Collection<String> stringValues(Object roles) {
    if (roles instanceof Collection<?> roleValues) {
      return roleValues.stream()
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .toList();
    }
    return List.of();
  }
}
