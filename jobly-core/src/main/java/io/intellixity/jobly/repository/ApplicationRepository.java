package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.Application;
import io.intellixity.jobly.domain.ApplicationKey;
import io.intellixity.jobly.query.ColumnMap;
import io.intellixity.jobly.query.Coercion;
import io.intellixity.jobly.query.FilterSpec;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.Store;

import java.util.LinkedHashMap;
import java.util.List;

import static io.intellixity.jobly.query.FilterParam.equalTo;

/**
 * Job applications keyed by (username, job id).
 *
 * <p>Filters: {@code username}, {@code jobId} (whole number) and {@code state}, all exact matches.</p>
 */
public final class ApplicationRepository extends AbstractResourceRepository<ApplicationKey, Application, Application> {
  public static final EntityTable TABLE = new EntityTable(
      "applications",
      "application",
      "applications",
      ColumnMap.of("jobId", "job_id"),
      List.of("username", "jobId", "state"),
      List.of("username", "jobId"),
      "username, job_id",
      FilterSpec.of(
          equalTo("username", "username", Coercion.TEXT),
          equalTo("jobId", "job_id", Coercion.INTEGER),
          equalTo("state", "state", Coercion.TEXT)
      )
  );

  public ApplicationRepository(Store store) {
    super(store, TABLE);
  }

  @Override
  public Result<Application> create(Application a) {
    return guarded("create", () -> {
      if (!exists(UserRepository.TABLE.name(), "username", a.username())) {
        return Result.failure(ErrorKind.REFERENCE_NOT_FOUND, "No user: " + a.username(), "username");
      }
      if (!exists(JobRepository.TABLE.name(), "id", a.jobId())) {
        return Result.failure(ErrorKind.REFERENCE_NOT_FOUND, "No job: " + a.jobId(), "jobId");
      }
      if (keyExists(a.key())) {
        return Result.failure(ErrorKind.DUPLICATE,
            "User '" + a.username() + "' already applied to job " + a.jobId(), "jobId");
      }
      LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
      fields.put("username", a.username());
      fields.put("jobId", a.jobId());
      fields.put("state", a.state());
      return insert(fields);
    });
  }

  @Override
  protected Application map(Row row) {
    return new Application(row.string("username"), row.integer("jobId"), row.string("state"));
  }

  @Override
  protected List<Object> keyValues(ApplicationKey key) {
    return List.of(key.username(), key.jobId());
  }
}
