package com.changefeed.integration.postgres.snapshot;

public class UnknownSnapshotTableException extends RuntimeException {
  public UnknownSnapshotTableException(String channel) {
    super("Channel is not available for snapshots: " + channel);
  }
}
