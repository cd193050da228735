package com.changefeed.domain.changes.capture;

/** Transient loss of the upstream change stream; reopening from the last position is safe. */
public class SourceDisconnectedException extends CaptureException {
  public SourceDisconnectedException(String sourceName, String message, Throwable cause) {
    super(sourceName, message, cause);
  }

  public SourceDisconnectedException(String sourceName, String message) {
    super(sourceName, message);
  }
}
