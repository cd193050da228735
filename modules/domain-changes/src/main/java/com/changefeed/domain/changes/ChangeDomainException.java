package com.changefeed.domain.changes;

public class ChangeDomainException extends RuntimeException {
  public ChangeDomainException(String message) {
    super(message);
  }
}
