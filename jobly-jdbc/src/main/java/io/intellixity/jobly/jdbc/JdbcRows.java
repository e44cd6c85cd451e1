package io.intellixity.jobly.jdbc;

import io.intellixity.jobly.store.Row;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Drains a result set into {@link Row}s keyed by column label. */
final class JdbcRows {
  private JdbcRows() {}

  static List<Row> read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    String[] labels = new String[cols];
    for (int i = 0; i < cols; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Row> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 0; i < cols; i++) values.put(labels[i], rs.getObject(i + 1));
      out.add(new Row(values));
    }
    return out;
  }
}
