package com.changefeed.gateway.registry;

import com.changefeed.domain.changes.ChangeEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conjunction of {@link FieldCondition}s parsed from a client filter object. An event satisfies
 * the predicate when either its after image or its before image does, so a row moving out of the
 * filtered set is still delivered once.
 */
public final class RowPredicate {
  private final List<FieldCondition> conditions;

  private RowPredicate(List<FieldCondition> conditions) {
    this.conditions = List.copyOf(conditions);
  }

  public static RowPredicate of(List<FieldCondition> conditions) {
    if (conditions == null || conditions.isEmpty()) {
      throw new InvalidFilterException("predicate needs at least one condition");
    }
    return new RowPredicate(conditions);
  }

  /**
   * Parses {@code {"user_id": "u1", "priority": {"gte": 2, "lt": 5}}}. Returns null for an empty
   * filter.
   */
  public static RowPredicate parse(Map<String, Object> filter) {
    if (filter == null || filter.isEmpty()) {
      return null;
    }
    List<FieldCondition> conditions = new ArrayList<>();
    for (Map.Entry<String, Object> entry : filter.entrySet()) {
      String field = entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> operators) {
        if (operators.isEmpty()) {
          throw new InvalidFilterException("operator object for '" + field + "' is empty");
        }
        for (Map.Entry<?, ?> operatorEntry : operators.entrySet()) {
          String name = String.valueOf(operatorEntry.getKey());
          FilterOperator operator =
              FilterOperator.fromWireName(name)
                  .orElseThrow(
                      () ->
                          new InvalidFilterException(
                              "unknown operator '" + name + "' on '" + field + "'"));
          conditions.add(new FieldCondition(field, operator, operatorEntry.getValue()));
        }
      } else {
        conditions.add(new FieldCondition(field, FilterOperator.EQ, value));
      }
    }
    return new RowPredicate(conditions);
  }

  public boolean matches(ChangeEvent event) {
    return (event.after() != null && matchesImage(event.after(), event.key()))
        || (event.before() != null && matchesImage(event.before(), event.key()));
  }

  public boolean matchesImage(Map<String, Object> image, String key) {
    for (FieldCondition condition : conditions) {
      if (!condition.matches(image, key)) {
        return false;
      }
    }
    return true;
  }

  public List<FieldCondition> conditions() {
    return conditions;
  }

  @Override
  public String toString() {
    return "RowPredicate" + conditions;
  }
}
