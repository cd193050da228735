package com.changefeed.infra.eventlog.journal;

public class EventLogJournalException extends RuntimeException {
  public EventLogJournalException(String message, Throwable cause) {
    super(message, cause);
  }
}
