package io.intellixity.jobly.repository;

import io.intellixity.jobly.query.CompiledClause;
import io.intellixity.jobly.query.FilterCompiler;
import io.intellixity.jobly.query.UpdateCompiler;
import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;
import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.Store;
import io.intellixity.jobly.store.StoreException;
import io.intellixity.jobly.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import static io.intellixity.jobly.query.SqlIdentifiers.quote;

/**
 * Generic repository driven by an {@link EntityTable}.
 *
 * <p>Reads, updates and deletes are shared; subclasses supply row mapping, key values and creation.
 * Every operation issues single statements only; store failures become {@code INTERNAL} failures.</p>
 */
public abstract class AbstractResourceRepository<K, N, T> implements ResourceRepository<K, N, T> {
  private static final Logger log = LoggerFactory.getLogger(AbstractResourceRepository.class);

  protected final Store store;
  protected final EntityTable table;

  protected AbstractResourceRepository(Store store, EntityTable table) {
    this.store = Objects.requireNonNull(store, "store");
    this.table = Objects.requireNonNull(table, "table");
  }

  protected abstract T map(Row row);

  /** Values bound to {@link EntityTable#keyPredicate(int)}, in key order. */
  protected abstract List<Object> keyValues(K key);

  /** Cross-parameter checks run before the filter compiler; default accepts everything. */
  protected Result<Map<String, ?>> checkFilters(Map<String, ?> filters) {
    return Result.success(filters);
  }

  /** Rewrites update fields before compiling (e.g. hashing); default passes them through. */
  protected Result<Map<String, ?>> prepareUpdate(Map<String, ?> fields) {
    return Result.success(fields);
  }

  /** Decorates a single-row read; may issue further reads. */
  protected T detail(T entity) {
    return entity;
  }

  @Override
  public Result<List<T>> findMany(Map<String, ?> filters) {
    Map<String, ?> supplied = (filters == null) ? Map.of() : filters;
    boolean filtered = !supplied.isEmpty();
    return checkFilters(supplied)
        .flatMap(f -> FilterCompiler.compile(f, table.filters()))
        .flatMap(where -> guarded("findMany", () -> {
          String sql = table.select() + where.render("WHERE") + " ORDER BY " + table.orderBy();
          StoreResult res = store.execute(new SqlStatement(sql, where.values()));
          if (res.isEmpty()) {
            String message = filtered
                ? "No " + table.plural() + " match the parameters"
                : "No " + table.plural() + " exist in database";
            return Result.failure(ErrorKind.EMPTY_RESULT, message);
          }
          List<T> out = new ArrayList<>(res.rows().size());
          for (Row row : res.rows()) out.add(map(row));
          return Result.success(out);
        }));
  }

  @Override
  public Result<T> findOne(K key) {
    return guarded("findOne", () -> {
      String sql = table.select() + " WHERE " + table.keyPredicate(1);
      Optional<Row> row = store.execute(new SqlStatement(sql, keyValues(key))).first();
      if (row.isEmpty()) return notFound(key);
      return Result.success(detail(map(row.get())));
    });
  }

  @Override
  public Result<T> update(K key, Map<String, ?> fields) {
    return prepareUpdate(fields)
        .flatMap(f -> UpdateCompiler.compile(f, table.columns()))
        .flatMap(set -> guarded("update", () -> {
          Optional<Row> row = store.execute(updateStatement(set, key)).first();
          if (row.isEmpty()) return notFound(key);
          return Result.success(map(row.get()));
        }));
  }

  private SqlStatement updateStatement(CompiledClause set, K key) {
    String sql = "UPDATE " + quote(table.name())
        + " SET " + set.text()
        + " WHERE " + table.keyPredicate(set.nextIndex())
        + " RETURNING " + table.projection();
    List<Object> values = new ArrayList<>(set.values());
    values.addAll(keyValues(key));
    return new SqlStatement(sql, values);
  }

  @Override
  public Result<K> remove(K key) {
    return guarded("remove", () -> {
      String sql = "DELETE FROM " + quote(table.name())
          + " WHERE " + table.keyPredicate(1)
          + " RETURNING " + table.keyColumns();
      StoreResult res = store.execute(new SqlStatement(sql, keyValues(key)));
      if (res.isEmpty()) return notFound(key);
      return Result.success(key);
    });
  }

  /** INSERT of the given logical fields (in order) returning the projection. */
  protected final Result<T> insert(LinkedHashMap<String, Object> fields) {
    List<String> cols = new ArrayList<>(fields.size());
    List<String> placeholders = new ArrayList<>(fields.size());
    int n = 1;
    for (String field : fields.keySet()) {
      cols.add(quote(table.columns().column(field)));
      placeholders.add("$" + (n++));
    }
    String sql = "INSERT INTO " + quote(table.name())
        + " (" + String.join(", ", cols) + ")"
        + " VALUES (" + String.join(", ", placeholders) + ")"
        + " RETURNING " + table.projection();
    Optional<Row> row = store.execute(new SqlStatement(sql, new ArrayList<>(fields.values()))).first();
    if (row.isEmpty()) throw new StoreException("INSERT into " + table.name() + " returned no row");
    return Result.success(map(row.get()));
  }

  /** True when {@code SELECT 1 FROM table WHERE column = $1} matches a row. */
  protected final boolean exists(String tableName, String column, Object value) {
    String sql = "SELECT 1 FROM " + quote(tableName) + " WHERE " + quote(column) + " = $1";
    return !store.execute(SqlStatement.of(sql, value)).isEmpty();
  }

  /** True when the key already resolves in this entity's table. */
  protected final boolean keyExists(K key) {
    String sql = "SELECT 1 FROM " + quote(table.name()) + " WHERE " + table.keyPredicate(1);
    return !store.execute(new SqlStatement(sql, keyValues(key))).isEmpty();
  }

  protected final <R> Result<R> notFound(K key) {
    return Result.failure(ErrorKind.NOT_FOUND, "No " + table.singular() + ": " + key, String.valueOf(key));
  }

  /** Runs store work, turning {@link StoreException} into an {@code INTERNAL} failure. */
  protected final <R> Result<R> guarded(String op, Supplier<Result<R>> work) {
    try {
      return work.get();
    } catch (StoreException e) {
      log.error("jobly.repo op={} entity={} store failure", op, table.singular(), e);
      return Result.failure(ErrorKind.INTERNAL, "Store failure during " + op + " on " + table.plural());
    }
  }
}
