package io.intellixity.jobly.query;

import java.util.ArrayList;
import java.util.List;

/** Per-call accumulator for fragments and binds. Placeholders are {@code $n}, assigned in emission order. */
final class ClauseBuilder {
  private final List<String> fragments = new ArrayList<>();
  private final List<Object> values = new ArrayList<>();
  private int n;

  ClauseBuilder(int startIndex) {
    if (startIndex < 1) throw new IllegalArgumentException("Placeholder indices start at 1, got " + startIndex);
    this.n = startIndex;
  }

  String bind(Object value) {
    values.add(value);
    return "$" + (n++);
  }

  void fragment(String sql) {
    fragments.add(sql);
  }

  CompiledClause build(String separator) {
    return new CompiledClause(fragments, values, separator, n);
  }
}
