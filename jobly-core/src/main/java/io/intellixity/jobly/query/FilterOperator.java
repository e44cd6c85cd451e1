package io.intellixity.jobly.query;

public enum FilterOperator {
  /** Exact match. */
  EQUALS(true),
  /** Case-insensitive substring match. */
  CONTAINS(true),
  /** Inclusive lower bound. */
  GTE(true),
  /** Inclusive upper bound. */
  LTE(true),
  /** Presence of the key activates a fixed predicate; the value is ignored. */
  PRESENCE(false);

  private final boolean requiresValue;

  FilterOperator(boolean requiresValue) {
    this.requiresValue = requiresValue;
  }

  public boolean requiresValue() {
    return requiresValue;
  }
}
