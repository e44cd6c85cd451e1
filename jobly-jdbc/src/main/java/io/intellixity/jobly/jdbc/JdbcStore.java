package io.intellixity.jobly.jdbc;

import io.intellixity.jobly.store.Row;
import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.Store;
import io.intellixity.jobly.store.StoreException;
import io.intellixity.jobly.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Objects;

/**
 * {@link Store} over a JDBC {@link DataSource}. Each statement runs on its own pooled connection in auto-commit mode.
 */
public final class JdbcStore implements Store {
  private static final Logger log = LoggerFactory.getLogger(JdbcStore.class);

  private final DataSource ds;

  public JdbcStore(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public StoreResult execute(SqlStatement statement) {
    Objects.requireNonNull(statement, "statement");
    PositionalSql.JdbcSql jdbc = PositionalSql.toJdbc(statement);
    long start = System.nanoTime();
    debugSql(jdbc);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbc.sql())) {
      bindAll(ps, jdbc.binds());
      StoreResult result;
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          List<Row> rows = JdbcRows.read(rs);
          result = new StoreResult(rows, rows.size());
        }
      } else {
        result = new StoreResult(List.of(), Math.max(ps.getUpdateCount(), 0));
      }
      debugDone(result, System.nanoTime() - start);
      return result;
    } catch (SQLException e) {
      throw new StoreException("Statement failed (sqlState=" + e.getSQLState() + ")", e);
    }
  }

  private static void bindAll(PreparedStatement ps, List<Object> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Object v = binds.get(i);
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private static void debugSql(PositionalSql.JdbcSql jdbc) {
    if (!log.isDebugEnabled()) return;
    log.debug("jobly.jdbc bindCount={} sql={}", jdbc.binds().size(), jdbc.sql());

    // bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : jdbc.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("jobly.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private static void debugDone(StoreResult result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("jobly.jdbc_done durationMs={} rows={} affected={}",
        durationNanos / 1_000_000.0, result.rows().size(), result.affected());
  }
}
