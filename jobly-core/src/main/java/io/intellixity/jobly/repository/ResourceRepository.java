package io.intellixity.jobly.repository;

import io.intellixity.jobly.result.Result;

import java.util.List;
import java.util.Map;

/**
 * Uniform persistence contract shared by every entity.
 *
 * @param <K> identifier type
 * @param <N> creation input
 * @param <T> persisted row shape
 */
public interface ResourceRepository<K, N, T> {

  /** Fails with {@code REFERENCE_NOT_FOUND} when a referenced row is missing, {@code DUPLICATE} on a taken key. */
  Result<T> create(N input);

  /**
   * Rows matching the recognized {@code filters}, AND-joined. An empty or {@code null} map reads everything.
   * Fails with {@code EMPTY_RESULT} when nothing matches, filtered or not.
   */
  Result<List<T>> findMany(Map<String, ?> filters);

  /** Fails with {@code NOT_FOUND} when the key does not resolve. */
  Result<T> findOne(K key);

  /** Partial update; fails with {@code INVALID_INPUT} for an empty map, {@code NOT_FOUND} when nothing changed. */
  Result<T> update(K key, Map<String, ?> fields);

  /** Fails with {@code NOT_FOUND} when nothing was deleted. */
  Result<K> remove(K key);
}
