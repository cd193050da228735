package com.changefeed.gateway.registry;

import java.util.Arrays;
import java.util.Optional;

public enum FilterOperator {
  EQ("eq"),
  NE("ne"),
  LT("lt"),
  LTE("lte"),
  GT("gt"),
  GTE("gte"),
  IN("in");

  private final String wireName;

  FilterOperator(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean isOrdering() {
    return this == LT || this == LTE || this == GT || this == GTE;
  }

  public static Optional<FilterOperator> fromWireName(String value) {
    return Arrays.stream(values()).filter(op -> op.wireName.equals(value)).findFirst();
  }
}
