package com.changefeed.gateway.auth;

import com.changefeed.domain.sessions.ErrorCode;

public class CredentialRejectedException extends RuntimeException {
  private final ErrorCode code;

  public CredentialRejectedException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public CredentialRejectedException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public static CredentialRejectedException invalid(String message) {
    return new CredentialRejectedException(ErrorCode.AUTH_INVALID, message);
  }

  public static CredentialRejectedException expired(String message) {
    return new CredentialRejectedException(ErrorCode.AUTH_EXPIRED, message);
  }
}
