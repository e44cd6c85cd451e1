package io.intellixity.jobly.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement with 1-based positional placeholders ({@code $1..$N}) and its ordered values.
 * Values may contain {@code null}.
 */
public record SqlStatement(String sql, List<Object> values) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    values = (values == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static SqlStatement of(String sql, Object... values) {
    return new SqlStatement(sql, Arrays.asList(values));
  }
}
