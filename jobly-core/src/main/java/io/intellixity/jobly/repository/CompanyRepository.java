package io.intellixity.jobly.repository;

import io.intellixity.jobly.domain.Company;
import io.intellixity.jobly.domain.Job;
import io.intellixity.jobly.query.ColumnMap;
import io.intellixity.jobly.query.Coercion;
import io.intellixity.jobly.query.FilterSpec;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.Store;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.jobly.query.FilterParam.atLeast;
import static io.intellixity.jobly.query.FilterParam.atMost;
import static io.intellixity.jobly.query.FilterParam.contains;

/**
 * Companies keyed by handle.
 *
 * <p>Filters: {@code nameLike} (case-insensitive substring of name), {@code minEmployees} and
 * {@code maxEmployees} (inclusive bounds on num_employees, whole numbers).</p>
 */
public final class CompanyRepository extends AbstractResourceRepository<String, Company, Company> {
  public static final EntityTable TABLE = new EntityTable(
      "companies",
      "company",
      "companies",
      ColumnMap.of("numEmployees", "num_employees", "logoUrl", "logo_url"),
      List.of("handle", "name", "description", "numEmployees", "logoUrl"),
      List.of("handle"),
      "name",
      FilterSpec.of(
          contains("nameLike", "name"),
          atLeast("minEmployees", "num_employees", Coercion.INTEGER),
          atMost("maxEmployees", "num_employees", Coercion.INTEGER)
      )
  );

  public CompanyRepository(Store store) {
    super(store, TABLE);
  }

  @Override
  public Result<Company> create(Company c) {
    return guarded("create", () -> {
      if (keyExists(c.handle())) {
        return Result.failure(ErrorKind.DUPLICATE, "Duplicate company: " + c.handle(), "handle");
      }
      LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
      fields.put("handle", c.handle());
      fields.put("name", c.name());
      fields.put("description", c.description());
      fields.put("numEmployees", c.numEmployees());
      fields.put("logoUrl", c.logoUrl());
      return insert(fields);
    });
  }

  @Override
  protected Result<Map<String, ?>> checkFilters(Map<String, ?> filters) {
    BigDecimal min = numberOrNull(filters.get("minEmployees"));
    BigDecimal max = numberOrNull(filters.get("maxEmployees"));
    if (min != null && max != null && min.compareTo(max) > 0) {
      return Result.failure(ErrorKind.INVALID_INPUT, "Minimum employees cannot be greater than maximum", "minEmployees");
    }
    return Result.success(filters);
  }

  // Unparseable values are left for the filter compiler to reject.
  private static BigDecimal numberOrNull(Object raw) {
    if (raw == null) return null;
    try {
      return new BigDecimal(String.valueOf(raw).trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override
  protected Company detail(Company company) {
    String sql = JobRepository.TABLE.select() + " WHERE \"company_handle\" = $1 ORDER BY \"id\"";
    List<Row> rows = store.execute(SqlStatement.of(sql, company.handle())).rows();
    List<Job> jobs = new ArrayList<>(rows.size());
    for (Row row : rows) jobs.add(JobRepository.toJob(row));
    return company.withJobs(jobs);
  }

  @Override
  protected Company map(Row row) {
    return new Company(
        row.string("handle"),
        row.string("name"),
        row.string("description"),
        row.integer("numEmployees"),
        row.string("logoUrl")
    );
  }

  @Override
  protected List<Object> keyValues(String handle) {
    return List.of(handle);
  }
}
