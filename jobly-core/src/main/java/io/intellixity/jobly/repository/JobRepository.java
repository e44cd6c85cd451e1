package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.Job;
import io.intellixity.jobly.domain.NewJob;
import io.intellixity.jobly.query.ColumnMap;
import io.intellixity.jobly.query.Coercion;
import io.intellixity.jobly.query.FilterSpec;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.Store;

import java.util.LinkedHashMap;
import java.util.List;

import static io.intellixity.jobly.query.FilterParam.atLeast;
import static io.intellixity.jobly.query.FilterParam.contains;
import static io.intellixity.jobly.query.FilterParam.presence;

/**
 * Jobs keyed by generated id.
 *
 * <p>Filters: {@code titleLike} (substring of title), {@code minSalary} (inclusive, whole number),
 * {@code hasEquity} (present means equity &gt; 0, whatever its value).</p>
 */
public final class JobRepository extends AbstractResourceRepository<Integer, NewJob, Job> {
  public static final EntityTable TABLE = new EntityTable(
      "jobs",
      "job",
      "jobs",
      ColumnMap.of("companyHandle", "company_handle"),
      List.of("id", "title", "salary", "equity", "companyHandle"),
      List.of("id"),
      "company_handle, id",
      FilterSpec.of(
          contains("titleLike", "title"),
          atLeast("minSalary", "salary", Coercion.INTEGER),
          presence("hasEquity", "equity > 0")
      )
  );

  public JobRepository(Store store) {
    super(store, TABLE);
  }

  @Override
  public Result<Job> create(NewJob job) {
    return guarded("create", () -> {
      if (!exists(CompanyRepository.TABLE.name(), "handle", job.companyHandle())) {
        return Result.failure(ErrorKind.REFERENCE_NOT_FOUND,
            "Company '" + job.companyHandle() + "' does not exist", "companyHandle");
      }
      LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
      fields.put("title", job.title());
      fields.put("salary", job.salary());
      fields.put("equity", job.equity());
      fields.put("companyHandle", job.companyHandle());
      return insert(fields);
    });
  }

  static Job toJob(Row row) {
    return new Job(
        row.integer("id"),
        row.string("title"),
        row.integer("salary"),
        row.decimal("equity"),
        row.string("companyHandle")
    );
  }

  @Override
  protected Job map(Row row) {
    return toJob(row);
  }

  @Override
  protected List<Object> keyValues(Integer id) {
    return List.of(id);
  }
}
