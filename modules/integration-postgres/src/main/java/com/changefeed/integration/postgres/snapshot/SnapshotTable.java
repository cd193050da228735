package com.changefeed.integration.postgres.snapshot;

import java.util.regex.Pattern;

/** A table that may be read through the snapshot endpoint, with the column used to order rows. */
public record SnapshotTable(String tableName, String keyColumn) {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  public SnapshotTable {
    requireIdentifier(tableName, "tableName");
    requireIdentifier(keyColumn, "keyColumn");
  }

  private static void requireIdentifier(String value, String fieldName) {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalArgumentException(fieldName + " must be a plain SQL identifier: " + value);
    }
  }
}
