package io.intellixity.jobly.store;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One result row keyed by column label. */
public final class Row {
  private final Map<String, Object> values;

  public Row(Map<String, ?> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  public static Row of(Object... labelValuePairs) {
    if (labelValuePairs.length % 2 != 0) throw new IllegalArgumentException("Expected label/value pairs");
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < labelValuePairs.length; i += 2) {
      m.put(String.valueOf(labelValuePairs[i]), labelValuePairs[i + 1]);
    }
    return new Row(m);
  }

  public Object raw(String label) {
    if (!values.containsKey(label)) throw new IllegalArgumentException("Unknown column label: " + label);
    return values.get(label);
  }

  public String string(String label) {
    Object v = raw(label);
    return v == null ? null : String.valueOf(v);
  }

  public Integer integer(String label) {
    Object v = raw(label);
    if (v == null) return null;
    if (v instanceof Number n) return n.intValue();
    return Integer.valueOf(String.valueOf(v).trim());
  }

  public BigDecimal decimal(String label) {
    Object v = raw(label);
    if (v == null) return null;
    if (v instanceof BigDecimal d) return d;
    if (v instanceof Number n) return new BigDecimal(n.toString());
    return new BigDecimal(String.valueOf(v).trim());
  }

  public Boolean bool(String label) {
    Object v = raw(label);
    if (v == null) return null;
    if (v instanceof Boolean b) return b;
    return Boolean.valueOf(String.valueOf(v).trim());
  }

  @Override
  public String toString() {
    return "Row" + values.keySet();
  }
}
