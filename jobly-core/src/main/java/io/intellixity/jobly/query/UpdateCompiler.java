package io.intellixity.jobly.query;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;

import java.util.Map;
import java.util.Objects;

/**
 * Compiles a partial update into a {@code SET} fragment.
 *
 * <p>Example: {@code {firstName: "Aliya", age: 32}} with {@code firstName -> first_name} compiles to
 * {@code "first_name"=$1, "age"=$2} with values {@code ["Aliya", 32]}.</p>
 *
 * <p>Fields are emitted in the iteration order of the supplied map, so callers pass an insertion-ordered map.
 * A {@code null} value is bound as SQL NULL, not skipped.</p>
 */
public final class UpdateCompiler {
  private UpdateCompiler() {}

  public static Result<CompiledClause> compile(Map<String, ?> fields, ColumnMap columns) {
    return compile(fields, columns, 1);
  }

  public static Result<CompiledClause> compile(Map<String, ?> fields, ColumnMap columns, int startIndex) {
    Objects.requireNonNull(columns, "columns");
    if (fields == null || fields.isEmpty()) {
      return Result.failure(ErrorKind.INVALID_INPUT, "No data supplied for update");
    }
    ClauseBuilder b = new ClauseBuilder(startIndex);
    for (var e : fields.entrySet()) {
      String column = columns.column(e.getKey());
      b.fragment(SqlIdentifiers.quote(column) + "=" + b.bind(e.getValue()));
    }
    return Result.success(b.build(", "));
  }
}
