package com.changefeed.domain.changes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class ChangePayloads {
  private ChangePayloads() {}

  static void validateImages(
      ChangeOperation operation, Map<String, Object> before, Map<String, Object> after) {
    switch (operation) {
      case INSERT -> {
        if (after == null) {
          throw new ChangeDomainException("insert requires an after image");
        }
        if (before != null) {
          throw new ChangeDomainException("insert must not carry a before image");
        }
      }
      case UPDATE -> {
        if (after == null) {
          throw new ChangeDomainException("update requires an after image");
        }
      }
      case DELETE -> {
        if (before == null) {
          throw new ChangeDomainException("delete requires a before image");
        }
        if (after != null) {
          throw new ChangeDomainException("delete must not carry an after image");
        }
      }
    }
  }

  // Column values may be null, so Map.copyOf is not an option here.
  static Map<String, Object> freeze(Map<String, Object> image) {
    if (image == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(image));
  }

  static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new ChangeDomainException(fieldName + " must not be blank");
    }
  }
}
