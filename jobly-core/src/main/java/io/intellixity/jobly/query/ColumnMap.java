package io.intellixity.jobly.query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-entity translation from logical field names to physical column names.
 * <p>
 * Fields without an entry map to themselves. Instances are immutable and safe to share between threads.
 */
public final class ColumnMap {
  private static final ColumnMap IDENTITY = new ColumnMap(Map.of());

  private final Map<String, String> columns;

  private ColumnMap(Map<String, String> columns) {
    this.columns = columns;
  }

  public static ColumnMap identity() {
    return IDENTITY;
  }

  public static ColumnMap of(Map<String, String> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    Map<String, String> copy = new LinkedHashMap<>();
    for (var e : overrides.entrySet()) {
      String field = Objects.requireNonNull(e.getKey(), "field");
      String column = Objects.requireNonNull(e.getValue(), "column for " + field);
      if (column.isBlank()) throw new IllegalArgumentException("Blank column for field '" + field + "'");
      copy.put(field, column);
    }
    return new ColumnMap(Map.copyOf(copy));
  }

  public static ColumnMap of(String field, String column) {
    return of(Map.of(field, column));
  }

  public static ColumnMap of(String f1, String c1, String f2, String c2) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put(f1, c1);
    m.put(f2, c2);
    return of(m);
  }

  public static ColumnMap of(String f1, String c1, String f2, String c2, String f3, String c3) {
    Map<String, String> m = new LinkedHashMap<>();
    m.put(f1, c1);
    m.put(f2, c2);
    m.put(f3, c3);
    return of(m);
  }

  public String column(String field) {
    return columns.getOrDefault(field, field);
  }

  @Override
  public String toString() {
    return "ColumnMap" + columns;
  }
}
