package io.intellixity.jobly.store;

/**
 * The relational store's single primitive.
 * <p>
 * Implementations bind {@code statement.values().get(n - 1)} to every {@code $n} placeholder and raise
 * {@link StoreException} on any failure. No retries.
 */
public interface Store {
  StoreResult execute(SqlStatement statement);
}
