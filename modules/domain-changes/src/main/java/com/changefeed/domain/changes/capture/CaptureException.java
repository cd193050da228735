package com.changefeed.domain.changes.capture;

public class CaptureException extends RuntimeException {
  private final String sourceName;

  public CaptureException(String sourceName, String message) {
    super(message);
    this.sourceName = sourceName;
  }

  public CaptureException(String sourceName, String message, Throwable cause) {
    super(message, cause);
    this.sourceName = sourceName;
  }

  public String sourceName() {
    return sourceName;
  }
}
