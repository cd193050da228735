package com.changefeed.domain.sessions;

public class SessionDomainException extends RuntimeException {
  public SessionDomainException(String message) {
    super(message);
  }
}
