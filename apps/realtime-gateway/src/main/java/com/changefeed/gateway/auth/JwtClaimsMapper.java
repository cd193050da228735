package com.changefeed.gateway.auth;

import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.gateway.config.RealmRoleGrantedAuthoritiesConverter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.security.oauth2.jwt.Jwt;

/** Extracts {@link AccessClaims} from a decoded JWT, shared by REST requests and stream sessions. */
public class JwtClaimsMapper {
  private final String clientId;
  private final List<String> attributeClaims;

  public JwtClaimsMapper(String clientId, List<String> attributeClaims) {
    this.clientId = clientId;
    this.attributeClaims = attributeClaims == null ? List.of() : List.copyOf(attributeClaims);
  }

  public AccessClaims toAccessClaims(Jwt jwt) {
    String subject = jwt.getSubject();
    if (subject == null || subject.isBlank()) {
      throw CredentialRejectedException.invalid("token has no subject");
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    for (String claim : attributeClaims) {
      Object value = jwt.getClaims().get(claim);
      if (value != null) {
        attributes.put(claim, value.toString());
      }
    }
    return new AccessClaims(
        subject,
        RealmRoleGrantedAuthoritiesConverter.roleNames(jwt, clientId),
        jwt.getExpiresAt(),
        attributes);
  }
}
