package io.intellixity.jobly.jdbc;

import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.StoreException;
import io.intellixity.jobly.store.StoreResult;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcStoreTest {

  /** Minimal JDBC double: one statement, optional single-column result. */
  private static final class FakeJdbc {
    final List<String> prepared = new ArrayList<>();
    final List<String> bindCalls = new ArrayList<>();
    int closedConnections;
    String label;
    List<Object> rows = List.of();
    int updateCount = -1;
    SQLException failOnExecute;

    DataSource dataSource() {
      return proxy(DataSource.class, (name, args) -> name.equals("getConnection") ? connection() : null);
    }

    private Connection connection() {
      return proxy(Connection.class, (name, args) -> {
        if (name.equals("prepareStatement")) {
          prepared.add((String) args[0]);
          return statement();
        }
        if (name.equals("close")) closedConnections++;
        return null;
      });
    }

    private PreparedStatement statement() {
      return proxy(PreparedStatement.class, (name, args) -> {
        switch (name) {
          case "setObject":
            bindCalls.add(args[0] + "=" + args[1]);
            return null;
          case "setNull":
            bindCalls.add(args[0] + "=NULL");
            return null;
          case "execute":
            if (failOnExecute != null) throw failOnExecute;
            return label != null;
          case "getResultSet":
            return resultSet();
          case "getUpdateCount":
            return updateCount;
          default:
            return null;
        }
      });
    }

    private ResultSet resultSet() {
      int[] cursor = {-1};
      ResultSetMetaData md = proxy(ResultSetMetaData.class, (name, args) -> {
        if (name.equals("getColumnCount")) return 1;
        if (name.equals("getColumnLabel")) return label;
        return null;
      });
      return proxy(ResultSet.class, (name, args) -> {
        switch (name) {
          case "getMetaData":
            return md;
          case "next":
            return ++cursor[0] < rows.size();
          case "getObject":
            return rows.get(cursor[0]);
          default:
            return null;
        }
      });
    }
  }

  private interface Handler {
    Object handle(String method, Object[] args) throws Throwable;
  }

  private static <T> T proxy(Class<T> type, Handler h) {
    Object p = Proxy.newProxyInstance(JdbcStoreTest.class.getClassLoader(), new Class<?>[]{type},
        (self, method, args) -> {
          Object out = h.handle(method.getName(), args);
          if (out == null && method.getReturnType() == boolean.class) return false;
          if (out == null && method.getReturnType() == int.class) return 0;
          return out;
        });
    return type.cast(p);
  }

  @Test
  void queryReturnsRowsByLabel() {
    FakeJdbc jdbc = new FakeJdbc();
    jdbc.label = "handle";
    jdbc.rows = List.of("c1", "c2");

    StoreResult r = new JdbcStore(jdbc.dataSource())
        .execute(SqlStatement.of("SELECT \"handle\" FROM \"companies\" WHERE \"name\" = $1", "N"));

    assertEquals(List.of("SELECT \"handle\" FROM \"companies\" WHERE \"name\" = ?"), jdbc.prepared);
    assertEquals(List.of("1=N"), jdbc.bindCalls);
    assertEquals(2, r.rows().size());
    assertEquals("c2", r.rows().get(1).string("handle"));
    assertEquals(2, r.affected());
    assertEquals(1, jdbc.closedConnections);
  }

  @Test
  void updateWithoutResultSetReportsCount() {
    FakeJdbc jdbc = new FakeJdbc();
    jdbc.updateCount = 3;

    StoreResult r = new JdbcStore(jdbc.dataSource()).execute(SqlStatement.of("UPDATE t SET a = $1", (Object) null));

    assertTrue(r.isEmpty());
    assertEquals(3, r.affected());
    assertEquals(List.of("1=NULL"), jdbc.bindCalls);
  }

  @Test
  void sqlExceptionIsWrapped() {
    FakeJdbc jdbc = new FakeJdbc();
    jdbc.failOnExecute = new SQLException("boom", "23505");

    StoreException e = assertThrows(StoreException.class,
        () -> new JdbcStore(jdbc.dataSource()).execute(SqlStatement.of("INSERT INTO t VALUES ($1)", 1)));

    assertTrue(e.getMessage().contains("23505"));
    assertSame(jdbc.failOnExecute, e.getCause());
    assertEquals(1, jdbc.closedConnections);
  }
}
