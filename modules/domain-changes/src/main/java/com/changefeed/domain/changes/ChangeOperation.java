package com.changefeed.domain.changes;

import java.util.Locale;

public enum ChangeOperation {
  INSERT,
  UPDATE,
  DELETE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ChangeOperation fromWireName(String value) {
    if (value == null || value.isBlank()) {
      throw new ChangeDomainException("operation must not be blank");
    }
    try {
      return ChangeOperation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ChangeDomainException("Unknown change operation: " + value);
    }
  }
}
