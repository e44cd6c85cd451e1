package io.intellixity.jobly.query;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;

import java.math.BigDecimal;

/**
 * How a raw filter value is converted before it is bound.
 *
 * <ul>
 *   <li>{@link #TEXT}: {@code String.valueOf(raw)}, untouched.</li>
 *   <li>{@link #INTEGER}: base-10 integer; fractional or non-numeric input is rejected, never truncated.</li>
 *   <li>{@link #DECIMAL}: {@link BigDecimal} parse of the trimmed text.</li>
 * </ul>
 */
public enum Coercion {
  TEXT {
    @Override
    Result<Object> apply(String param, Object raw) {
      return Result.success(String.valueOf(raw));
    }
  },
  INTEGER {
    @Override
    Result<Object> apply(String param, Object raw) {
      if (raw instanceof Integer || raw instanceof Long) return Result.success(raw);
      String s = String.valueOf(raw).trim();
      try {
        return Result.success(Integer.parseInt(s));
      } catch (NumberFormatException e) {
        return Result.failure(ErrorKind.INVALID_INPUT,
            "Parameter '" + param + "' must be a whole number, got '" + s + "'", param);
      }
    }
  },
  DECIMAL {
    @Override
    Result<Object> apply(String param, Object raw) {
      if (raw instanceof BigDecimal) return Result.success(raw);
      String s = String.valueOf(raw).trim();
      try {
        return Result.success(new BigDecimal(s));
      } catch (NumberFormatException e) {
        return Result.failure(ErrorKind.INVALID_INPUT,
            "Parameter '" + param + "' must be a number, got '" + s + "'", param);
      }
    }
  };

  abstract Result<Object> apply(String param, Object raw);

  public boolean numeric() {
    return this != TEXT;
  }
}
