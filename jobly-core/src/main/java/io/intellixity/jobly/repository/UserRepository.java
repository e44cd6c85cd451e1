package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.NewUser;
import io.intellixity.jobly.domain.PasswordHasher;
import io.intellixity.jobly.domain.User;
import io.intellixity.jobly.query.ColumnMap;
import io.intellixity.jobly.query.FilterSpec;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.Store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.intellixity.jobly.query.FilterParam.contains;
import static io.intellixity.jobly.query.FilterParam.presence;

/**
 * Users keyed by username. The password column is written but never projected.
 *
 * <p>Filters: {@code usernameLike}, {@code emailLike} (substring matches) and {@code adminsOnly}
 * (present means is_admin).</p>
 */
public final class UserRepository extends AbstractResourceRepository<String, NewUser, User> {
  static final String PASSWORD = "password";

  public static final EntityTable TABLE = new EntityTable(
      "users",
      "user",
      "users",
      ColumnMap.of("firstName", "first_name", "lastName", "last_name", "isAdmin", "is_admin"),
      List.of("username", "firstName", "lastName", "email", "isAdmin"),
      List.of("username"),
      "username",
      FilterSpec.of(
          contains("usernameLike", "username"),
          contains("emailLike", "email"),
          presence("adminsOnly", "is_admin = TRUE")
      )
  );

  private final PasswordHasher hasher;

  public UserRepository(Store store, PasswordHasher hasher) {
    super(store, TABLE);
    this.hasher = Objects.requireNonNull(hasher, "hasher");
  }

  @Override
  public Result<User> create(NewUser u) {
    if (u.password() == null || u.password().isEmpty()) {
      return Result.failure(ErrorKind.INVALID_INPUT, "Password is required", PASSWORD);
    }
    return guarded("create", () -> {
      if (keyExists(u.username())) {
        return Result.failure(ErrorKind.DUPLICATE, "Duplicate username: " + u.username(), "username");
      }
      LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
      fields.put("username", u.username());
      fields.put(PASSWORD, hasher.hash(u.password()));
      fields.put("firstName", u.firstName());
      fields.put("lastName", u.lastName());
      fields.put("email", u.email());
      fields.put("isAdmin", u.isAdmin());
      return insert(fields);
    });
  }

  @Override
  protected Result<Map<String, ?>> prepareUpdate(Map<String, ?> fields) {
    if (fields == null || !fields.containsKey(PASSWORD)) return Result.success(fields);
    Object raw = fields.get(PASSWORD);
    if (raw == null || String.valueOf(raw).isEmpty()) {
      return Result.failure(ErrorKind.INVALID_INPUT, "Password cannot be empty", PASSWORD);
    }
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    copy.put(PASSWORD, hasher.hash(String.valueOf(raw)));
    return Result.success(copy);
  }

  @Override
  protected User detail(User user) {
    String sql = "SELECT \"job_id\" AS \"jobId\" FROM \"applications\" WHERE \"username\" = $1 ORDER BY \"job_id\"";
    List<Row> rows = store.execute(SqlStatement.of(sql, user.username())).rows();
    List<Integer> jobIds = new ArrayList<>(rows.size());
    for (Row row : rows) jobIds.add(row.integer("jobId"));
    return user.withJobs(jobIds);
  }

  @Override
  protected User map(Row row) {
    Boolean admin = row.bool("isAdmin");
    return new User(
        row.string("username"),
        row.string("firstName"),
        row.string("lastName"),
        row.string("email"),
        admin != null && admin
    );
  }

  @Override
  protected List<Object> keyValues(String username) {
    return List.of(username);
  }
}
