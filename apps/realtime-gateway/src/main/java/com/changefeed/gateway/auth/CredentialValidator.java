package com.changefeed.gateway.auth;

import com.changefeed.domain.sessions.AccessClaims;

/** Turns an opaque bearer credential into access claims. May block on key retrieval. */
public interface CredentialValidator {
  AccessClaims validate(String bearerToken);
}
