package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.Application;
import io.intellixity.jobly.domain.ApplicationKey;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.StoreResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ApplicationRepositoryTest {
  private static final StoreResult HIT = StoreResult.of(Row.of("?column?", 1));

  @Test
  void createChecksUserThenJobThenDuplicate() {
    Result<Application> noUser = new ApplicationRepository(new RecordingStore())
        .create(new Application("ghost", 1, "applied"));
    assertEquals(ErrorKind.REFERENCE_NOT_FOUND, noUser.error().kind());
    assertEquals("No user: ghost", noUser.error().message());

    Result<Application> noJob = new ApplicationRepository(new RecordingStore().answer(HIT))
        .create(new Application("u1", 9, "applied"));
    assertEquals("No job: 9", noJob.error().message());

    Result<Application> dup = new ApplicationRepository(new RecordingStore().answer(HIT).answer(HIT).answer(HIT))
        .create(new Application("u1", 1, "applied"));
    assertEquals(ErrorKind.DUPLICATE, dup.error().kind());
  }

  @Test
  void compositeKeyBindsInKeyOrder() {
    RecordingStore store = new RecordingStore().answer(StoreResult.of(Row.of("username", "u1", "job_id", 3)));
    ApplicationKey key = new ApplicationKey("u1", 3);

    assertEquals(key, new ApplicationRepository(store).remove(key).orElseThrow());
    assertEquals("DELETE FROM \"applications\" WHERE \"username\" = $1 AND \"job_id\" = $2 "
        + "RETURNING \"username\", \"job_id\"", store.last().sql());
    assertEquals(List.of("u1", 3), store.last().values());
  }

  @Test
  void updateStateBindsCompositeKeyAfterSet() {
    RecordingStore store = new RecordingStore()
        .answer(StoreResult.of(Row.of("username", "u1", "jobId", 3, "state", "accepted")));

    Application a = new ApplicationRepository(store)
        .update(new ApplicationKey("u1", 3), Map.of("state", "accepted")).orElseThrow();

    assertEquals("accepted", a.state());
    assertTrue(store.last().sql().startsWith(
        "UPDATE \"applications\" SET \"state\"=$1 WHERE \"username\" = $2 AND \"job_id\" = $3"));
    assertEquals(List.of("accepted", "u1", 3), store.last().values());
  }

  @Test
  void filtersAreExactMatches() {
    RecordingStore store = new RecordingStore();
    Result<List<Application>> r = new ApplicationRepository(store).findMany(Map.of("jobId", "3"));
    assertEquals(ErrorKind.EMPTY_RESULT, r.error().kind());
    assertTrue(store.last().sql().endsWith(" WHERE job_id = $1 ORDER BY username, job_id"));
    assertEquals(List.of(3), store.last().values());
  }
}
