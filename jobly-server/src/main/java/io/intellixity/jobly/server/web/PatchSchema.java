package io.intellixity.jobly.server.web;

import io.intellixity.jobly.result.ErrorKind;
import io.intellixity.jobly.result.Result;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Allowed fields of a partial update, with type, nullability and limits per field.
 *
 * <p>{@link #check(Map)} reports every violation at once and returns the body with numbers normalized
 * ({@code Integer} for whole numbers, {@code BigDecimal} for decimals) in the order supplied.</p>
 */
public final class PatchSchema {
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final Pattern URL = Pattern.compile("^https?://\\S+$");

  enum Type { TEXT, INTEGER, DECIMAL }

  record Rule(String field, Type type, boolean nullable, int minLength, int maxLength,
              BigDecimal min, BigDecimal max, Pattern format, String formatName, List<String> allowed) {}

  private final Map<String, Rule> rules;

  private PatchSchema(Map<String, Rule> rules) {
    this.rules = Map.copyOf(rules);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Result<Map<String, Object>> check(Map<String, ?> body) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (body == null) return Result.success(out);

    List<String> violations = new ArrayList<>();
    for (var e : body.entrySet()) {
      String field = e.getKey();
      Rule rule = rules.get(field);
      if (rule == null) {
        violations.add(field + ": is not allowed");
        continue;
      }
      Object value = e.getValue();
      if (value == null) {
        if (rule.nullable()) out.put(field, null);
        else violations.add(field + ": must not be null");
        continue;
      }
      Object normalized = switch (rule.type()) {
        case TEXT -> text(rule, value, violations);
        case INTEGER -> whole(rule, value, violations);
        case DECIMAL -> decimal(rule, value, violations);
      };
      if (normalized != null) out.put(field, normalized);
    }

    if (!violations.isEmpty()) return Result.failure(ErrorKind.INVALID_INPUT, String.join("; ", violations));
    return Result.success(out);
  }

  private static String text(Rule rule, Object value, List<String> violations) {
    if (!(value instanceof String s)) {
      violations.add(rule.field() + ": must be a string");
      return null;
    }
    if (s.length() < rule.minLength()) {
      violations.add(rule.field() + ": must be at least " + rule.minLength() + " characters");
      return null;
    }
    if (s.length() > rule.maxLength()) {
      violations.add(rule.field() + ": must be at most " + rule.maxLength() + " characters");
      return null;
    }
    if (rule.format() != null && !rule.format().matcher(s).matches()) {
      violations.add(rule.field() + ": must be a valid " + rule.formatName());
      return null;
    }
    if (rule.allowed() != null && !rule.allowed().contains(s)) {
      violations.add(rule.field() + ": must be one of " + rule.allowed());
      return null;
    }
    return s;
  }

  private static Integer whole(Rule rule, Object value, List<String> violations) {
    if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger)) {
      violations.add(rule.field() + ": must be a whole number");
      return null;
    }
    BigDecimal n = new BigDecimal(value.toString());
    if (!inRange(rule, n, violations)) return null;
    try {
      return n.intValueExact();
    } catch (ArithmeticException ex) {
      violations.add(rule.field() + ": is out of range");
      return null;
    }
  }

  private static BigDecimal decimal(Rule rule, Object value, List<String> violations) {
    BigDecimal n;
    if (value instanceof Number) {
      n = new BigDecimal(value.toString());
    } else if (value instanceof String s) {
      try {
        n = new BigDecimal(s.trim());
      } catch (NumberFormatException ex) {
        violations.add(rule.field() + ": must be a number");
        return null;
      }
    } else {
      violations.add(rule.field() + ": must be a number");
      return null;
    }
    return inRange(rule, n, violations) ? n : null;
  }

  private static boolean inRange(Rule rule, BigDecimal n, List<String> violations) {
    if (rule.min() != null && n.compareTo(rule.min()) < 0) {
      violations.add(rule.field() + ": must be greater than or equal to " + rule.min().toPlainString());
      return false;
    }
    if (rule.max() != null && n.compareTo(rule.max()) > 0) {
      violations.add(rule.field() + ": must be less than or equal to " + rule.max().toPlainString());
      return false;
    }
    return true;
  }

  public static final class Builder {
    private final Map<String, Rule> rules = new LinkedHashMap<>();

    private Builder() {}

    public Builder text(String field, int minLength, int maxLength, boolean nullable) {
      return add(new Rule(field, Type.TEXT, nullable, minLength, maxLength, null, null, null, null, null));
    }

    public Builder email(String field, int maxLength) {
      return add(new Rule(field, Type.TEXT, false, 6, maxLength, null, null, EMAIL, "email", null));
    }

    public Builder url(String field, boolean nullable) {
      return add(new Rule(field, Type.TEXT, nullable, 0, 2048, null, null, URL, "url", null));
    }

    public Builder oneOf(String field, List<String> allowed) {
      return add(new Rule(field, Type.TEXT, false, 0, Integer.MAX_VALUE, null, null, null, null, List.copyOf(allowed)));
    }

    public Builder integer(String field, Integer min, boolean nullable) {
      BigDecimal lo = (min == null) ? null : BigDecimal.valueOf(min);
      return add(new Rule(field, Type.INTEGER, nullable, 0, 0, lo, null, null, null, null));
    }

    public Builder decimal(String field, BigDecimal min, BigDecimal max, boolean nullable) {
      return add(new Rule(field, Type.DECIMAL, nullable, 0, 0, min, max, null, null, null));
    }

    private Builder add(Rule rule) {
      Objects.requireNonNull(rule.field(), "field");
      if (rules.putIfAbsent(rule.field(), rule) != null) {
        throw new IllegalArgumentException("Duplicate patch field: " + rule.field());
      }
      return this;
    }

    public PatchSchema build() {
      return new PatchSchema(rules);
    }
  }
}
