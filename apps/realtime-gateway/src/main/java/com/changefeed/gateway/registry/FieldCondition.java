package com.changefeed.gateway.registry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code field operator operand} test against a row image. The pseudo-field {@value #KEY_FIELD}
 * addresses the event key instead of a column.
 */
public record FieldCondition(String field, FilterOperator operator, Object operand) {
  public static final String KEY_FIELD = "$key";

  public FieldCondition {
    if (field == null || field.isBlank()) {
      throw new InvalidFilterException("filter field must not be blank");
    }
    Objects.requireNonNull(operator, "operator must not be null");
    if (operator == FilterOperator.IN) {
      if (!(operand instanceof List<?> values)) {
        throw new InvalidFilterException("operator 'in' on '" + field + "' needs an array");
      }
      for (Object value : values) {
        requireScalar(field, value);
      }
      operand = Collections.unmodifiableList(new ArrayList<>(values));
    } else {
      requireScalar(field, operand);
      if (operator.isOrdering() && !(operand instanceof Number || operand instanceof String)) {
        throw new InvalidFilterException(
            "operator '" + operator.wireName() + "' on '" + field + "' needs a number or string");
      }
    }
  }

  boolean matches(Map<String, Object> image, String key) {
    Object value;
    if (KEY_FIELD.equals(field)) {
      value = key;
    } else if (image.containsKey(field)) {
      value = image.get(field);
    } else {
      return false;
    }

    return switch (operator) {
      case EQ -> valuesEqual(value, operand);
      case NE -> !valuesEqual(value, operand);
      case IN -> ((List<?>) operand).stream().anyMatch(candidate -> valuesEqual(value, candidate));
      case LT, LTE, GT, GTE -> ordered(value);
    };
  }

  private boolean ordered(Object value) {
    Integer order = compare(value, operand);
    if (order == null) {
      return false;
    }
    return switch (operator) {
      case LT -> order < 0;
      case LTE -> order <= 0;
      case GT -> order > 0;
      default -> order >= 0;
    };
  }

  private static boolean valuesEqual(Object value, Object expected) {
    if (value == null || expected == null) {
      return value == null && expected == null;
    }
    if (eitherNumber(value, expected)) {
      BigDecimal left = numeric(value);
      BigDecimal right = numeric(expected);
      return left != null && right != null && left.compareTo(right) == 0;
    }
    return value.toString().equals(expected.toString());
  }

  /** Null when the two values have no common ordering. */
  private static Integer compare(Object value, Object operand) {
    if (value == null) {
      return null;
    }
    if (eitherNumber(value, operand)) {
      BigDecimal left = numeric(value);
      BigDecimal right = numeric(operand);
      return left != null && right != null ? left.compareTo(right) : null;
    }
    if (value instanceof String text && operand instanceof String expected) {
      return text.compareTo(expected);
    }
    return null;
  }

  /** Two strings always compare as text; a numeric side lets the other side parse as a number. */
  private static boolean eitherNumber(Object left, Object right) {
    return left instanceof Number || right instanceof Number;
  }

  private static BigDecimal numeric(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString());
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return new BigDecimal(text.trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static void requireScalar(String field, Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Number
        || value instanceof Boolean) {
      return;
    }
    throw new InvalidFilterException("filter value for '" + field + "' must be a scalar");
  }
}
