package io.intellixity.jobly.query;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;

import java.util.Map;
import java.util.Objects;

/**
 * Compiles recognized query parameters into an AND-joined {@code WHERE} fragment.
 *
 * <p>An empty or absent parameter map compiles to {@link CompiledClause#none()}. Unknown parameters and
 * missing values fail the whole compilation; nothing is partially compiled. Relations between parameters
 * (e.g. a lower bound above an upper bound) are checked by the caller.</p>
 */
public final class FilterCompiler {
  private FilterCompiler() {}

  public static Result<CompiledClause> compile(Map<String, ?> params, FilterSpec spec) {
    return compile(params, spec, 1);
  }

  public static Result<CompiledClause> compile(Map<String, ?> params, FilterSpec spec, int startIndex) {
    Objects.requireNonNull(spec, "spec");
    if (params == null || params.isEmpty()) return Result.success(CompiledClause.none(startIndex));

    ClauseBuilder b = new ClauseBuilder(startIndex);
    for (var e : params.entrySet()) {
      String name = e.getKey();
      FilterParam param = spec.find(name).orElse(null);
      if (param == null) {
        return Result.failure(ErrorKind.INVALID_FILTER_PARAMETER,
            "Cannot filter results by parameter '" + name + "'", name);
      }
      if (!param.operator().requiresValue()) {
        b.fragment(param.target());
        continue;
      }

      Object raw = e.getValue();
      if (raw == null || String.valueOf(raw).isBlank()) {
        return Result.failure(ErrorKind.MISSING_FILTER_VALUE,
            "Missing value for parameter '" + name + "'", name);
      }
      Result<Object> coerced = param.coercion().apply(name, raw);
      if (coerced.isFailure()) return Result.failure(coerced.error());
      Object value = coerced.orElseThrow();

      String column = param.target();
      switch (param.operator()) {
        case EQUALS -> b.fragment(column + " = " + b.bind(value));
        case CONTAINS -> b.fragment(column + " ILIKE " + b.bind("%" + escapeLike(String.valueOf(value)) + "%"));
        case GTE -> b.fragment(column + " >= " + b.bind(value));
        case LTE -> b.fragment(column + " <= " + b.bind(value));
        default -> throw new IllegalStateException("Unhandled operator: " + param.operator());
      }
    }
    return Result.success(b.build(" AND "));
  }

  /** Escape LIKE metacharacters so they match literally (Postgres default escape is backslash). */
  static String escapeLike(String s) {
    StringBuilder out = new StringBuilder(s.length() + 4);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' || c == '%' || c == '_') out.append('\\');
      out.append(c);
    }
    return out.toString();
  }
}
