package com.changefeed.integration.kafka;

public class DebeziumEnvelopeException extends RuntimeException {
  public DebeziumEnvelopeException(String message) {
    super(message);
  }

  public DebeziumEnvelopeException(String message, Throwable cause) {
    super(message, cause);
  }
}
