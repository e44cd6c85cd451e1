package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.NewUser;
import io.intellixity.jobly.domain.PasswordHasher;
import io.intellixity.jobly.domain.User;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.StoreResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UserRepositoryTest {
  private static final PasswordHasher HASHER = raw -> "hashed:" + raw;

  private static Row userRow(String username, boolean admin) {
    return Row.of("username", username, "firstName", "F", "lastName", "L", "email", username + "@x.io",
        "isAdmin", admin);
  }

  @Test
  void createHashesPasswordAndNeverProjectsIt() {
    RecordingStore store = new RecordingStore()
        .answer(StoreResult.empty())
        .answer(StoreResult.of(userRow("u1", false)));

    User u = new UserRepository(store, HASHER)
        .create(new NewUser("u1", "secret", "F", "L", "u1@x.io", false)).orElseThrow();

    assertEquals("u1", u.username());
    String sql = store.last().sql();
    assertTrue(sql.startsWith("INSERT INTO \"users\" (\"username\", \"password\", \"first_name\", \"last_name\", "
        + "\"email\", \"is_admin\") VALUES ($1, $2, $3, $4, $5, $6)"));
    assertFalse(sql.substring(sql.indexOf("RETURNING")).contains("password"));
    assertEquals("hashed:secret", store.last().values().get(1));
  }

  @Test
  void duplicateUsername() {
    RecordingStore store = new RecordingStore().answer(StoreResult.of(Row.of("?column?", 1)));
    Result<User> r = new UserRepository(store, HASHER).create(new NewUser("u1", "pw", "F", "L", "e@x.io", false));
    assertEquals(ErrorKind.DUPLICATE, r.error().kind());
    assertEquals("Duplicate username: u1", r.error().message());
  }

  @Test
  void updateHashesPassword() {
    RecordingStore store = new RecordingStore().answer(StoreResult.of(userRow("u1", false)));
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("firstName", "New");
    fields.put("password", "pw2");

    new UserRepository(store, HASHER).update("u1", fields).orElseThrow();

    assertTrue(store.last().sql().startsWith(
        "UPDATE \"users\" SET \"first_name\"=$1, \"password\"=$2 WHERE \"username\" = $3"));
    assertEquals(List.of("New", "hashed:pw2", "u1"), store.last().values());
  }

  @Test
  void findOneListsAppliedJobs() {
    RecordingStore store = new RecordingStore()
        .answer(StoreResult.of(userRow("u1", true)))
        .answer(StoreResult.of(Row.of("jobId", 2), Row.of("jobId", 5)));

    User u = new UserRepository(store, HASHER).findOne("u1").orElseThrow();

    assertTrue(u.isAdmin());
    assertEquals(List.of(2, 5), u.jobs());
  }

  @Test
  void adminsOnlyIsAPresenceFilter() {
    RecordingStore store = new RecordingStore().answer(StoreResult.of(userRow("root", true)));
    new UserRepository(store, HASHER).findMany(Map.of("adminsOnly", "")).orElseThrow();
    assertTrue(store.last().sql().contains(" WHERE is_admin = TRUE ORDER BY username"));
    assertTrue(store.last().values().isEmpty());
  }
}
