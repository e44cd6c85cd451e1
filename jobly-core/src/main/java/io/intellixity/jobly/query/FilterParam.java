package io.intellixity.jobly.query;

import java.util.Objects;

/**
 * One recognized filter parameter.
 *
 * @param name     query parameter name as supplied by clients
 * @param operator comparison semantics
 * @param target   column name, or the fixed SQL predicate for {@link FilterOperator#PRESENCE}
 * @param coercion conversion applied to the raw value before binding
 */
public record FilterParam(String name, FilterOperator operator, String target, Coercion coercion) {
  public FilterParam {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(coercion, "coercion");
    if (name.isBlank()) throw new IllegalArgumentException("Filter parameter name must be non-blank");
    if (target.isBlank()) throw new IllegalArgumentException("Filter target must be non-blank for '" + name + "'");
    if ((operator == FilterOperator.GTE || operator == FilterOperator.LTE) && !coercion.numeric()) {
      throw new IllegalArgumentException("Range parameter '" + name + "' needs a numeric coercion");
    }
    if (operator == FilterOperator.CONTAINS && coercion != Coercion.TEXT) {
      throw new IllegalArgumentException("Contains parameter '" + name + "' must use TEXT coercion");
    }
  }

  public static FilterParam equalTo(String name, String column, Coercion coercion) {
    return new FilterParam(name, FilterOperator.EQUALS, column, coercion);
  }

  public static FilterParam contains(String name, String column) {
    return new FilterParam(name, FilterOperator.CONTAINS, column, Coercion.TEXT);
  }

  public static FilterParam atLeast(String name, String column, Coercion coercion) {
    return new FilterParam(name, FilterOperator.GTE, column, coercion);
  }

  public static FilterParam atMost(String name, String column, Coercion coercion) {
    return new FilterParam(name, FilterOperator.LTE, column, coercion);
  }

  public static FilterParam presence(String name, String predicate) {
    return new FilterParam(name, FilterOperator.PRESENCE, predicate, Coercion.TEXT);
  }
}
