package io.intellixity.jobly.store;

import java.util.List;
import java.util.Optional;

/**
 * Rows returned by a statement plus the affected row count.
 * For {@code RETURNING} statements {@code affected} equals {@code rows.size()}.
 */
public record StoreResult(List<Row> rows, long affected) {
  public StoreResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static StoreResult of(Row... rows) {
    return new StoreResult(List.of(rows), rows.length);
  }

  public static StoreResult empty() {
    return new StoreResult(List.of(), 0);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public Optional<Row> first() {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
