package com.changefeed.gateway.protocol;

public class MalformedClientMessageException extends RuntimeException {
  public MalformedClientMessageException(String message) {
    super(message);
  }

  public MalformedClientMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
