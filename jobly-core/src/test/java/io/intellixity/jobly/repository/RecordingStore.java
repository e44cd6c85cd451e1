package io.intellixity.jobly.repository;

import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.Store;
import io.intellixity.jobly.store.StoreException;
import io.intellixity.jobly.store.StoreResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Records every statement and answers from a queue; an exhausted queue answers empty. */
final class RecordingStore implements Store {
  final List<SqlStatement> executed = new ArrayList<>();
  private final Deque<Object> answers = new ArrayDeque<>();

  RecordingStore answer(StoreResult result) {
    answers.addLast(result);
    return this;
  }

  RecordingStore fail(String message) {
    answers.addLast(new StoreException(message));
    return this;
  }

  @Override
  public StoreResult execute(SqlStatement statement) {
    executed.add(statement);
    Object next = answers.pollFirst();
    if (next == null) return StoreResult.empty();
    if (next instanceof StoreException e) throw e;
    return (StoreResult) next;
  }

  SqlStatement last() {
    return executed.get(executed.size() - 1);
  }
}
