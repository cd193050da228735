package com.changefeed.gateway.auth;

import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.domain.sessions.ErrorCode;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;

public class JwtCredentialValidator implements CredentialValidator {
  private final JwtDecoder jwtDecoder;
  private final JwtClaimsMapper claimsMapper;
  private final Clock clock;

  public JwtCredentialValidator(JwtDecoder jwtDecoder, JwtClaimsMapper claimsMapper, Clock clock) {
    this.jwtDecoder = Objects.requireNonNull(jwtDecoder, "jwtDecoder must not be null");
    this.claimsMapper = Objects.requireNonNull(claimsMapper, "claimsMapper must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public AccessClaims validate(String bearerToken) {
    if (bearerToken == null || bearerToken.isBlank()) {
      throw CredentialRejectedException.invalid("missing bearer token");
    }
    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(bearerToken);
    } catch (JwtValidationException ex) {
      if (isExpiry(ex)) {
        throw new CredentialRejectedException(
            ErrorCode.AUTH_EXPIRED, "token expired", ex);
      }
      throw new CredentialRejectedException(
          ErrorCode.AUTH_INVALID, "token rejected", ex);
    } catch (JwtException ex) {
      throw new CredentialRejectedException(
          ErrorCode.AUTH_INVALID, "token could not be decoded", ex);
    }
    AccessClaims claims = claimsMapper.toAccessClaims(jwt);
    if (claims.isExpired(clock.instant())) {
      throw CredentialRejectedException.expired("token expired");
    }
    return claims;
  }

  private static boolean isExpiry(JwtValidationException ex) {
    for (OAuth2Error error : ex.getErrors()) {
      String description = error.getDescription();
      if (description != null && description.toLowerCase(Locale.ROOT).contains("expired")) {
        return true;
      }
    }
    return false;
  }
}
