package io.intellixity.jobly.jdbc;

import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.StoreException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code $n} placeholders into JDBC {@code ?} binds.
 *
 * Rules:
 * - A placeholder is '$' followed by one or more digits, numbered from 1.
 * - Placeholders inside single-quoted literals or double-quoted identifiers are left alone.
 * - A placeholder may repeat; its value is bound once per occurrence.
 */
final class PositionalSql {
  private PositionalSql() {}

  record JdbcSql(String sql, List<Object> binds) {}

  static JdbcSql toJdbc(SqlStatement statement) {
    String sql = statement.sql();
    List<Object> values = statement.values();
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> binds = new ArrayList<>(values.size());
    boolean inSingle = false;
    boolean inDouble = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDouble) {
        inSingle = !inSingle;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingle) {
        inDouble = !inDouble;
        out.append(ch);
        continue;
      }

      if (ch == '$' && !inSingle && !inDouble && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n < 1 || n > values.size()) {
          throw new StoreException("Placeholder $" + n + " has no value (" + values.size() + " supplied)");
        }
        binds.add(values.get(n - 1));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }
    return new JdbcSql(out.toString(), binds);
  }
}
