package io.intellixity.jobly.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Ordered, immutable table of the filter parameters an entity recognizes. */
public final class FilterSpec {
  private final Map<String, FilterParam> params;

  private FilterSpec(Map<String, FilterParam> params) {
    this.params = params;
  }

  public static FilterSpec of(FilterParam... params) {
    Map<String, FilterParam> m = new LinkedHashMap<>();
    for (FilterParam p : params) {
      Objects.requireNonNull(p, "param");
      if (m.putIfAbsent(p.name(), p) != null) {
        throw new IllegalArgumentException("Duplicate filter parameter: " + p.name());
      }
    }
    return new FilterSpec(Collections.unmodifiableMap(m));
  }

  public Optional<FilterParam> find(String name) {
    return Optional.ofNullable(params.get(name));
  }

  @Override
  public String toString() {
    return "FilterSpec" + params.keySet();
  }
}
