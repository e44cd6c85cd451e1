package io.intellixity.jobly.jdbc;

import io.intellixity.jobly.store.SqlStatement;
import io.intellixity.jobly.store.StoreException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PositionalSqlTest {

  @Test
  void rewritesPlaceholdersInOrder() {
    PositionalSql.JdbcSql j = PositionalSql.toJdbc(
        SqlStatement.of("UPDATE \"jobs\" SET \"title\"=$1, \"salary\"=$2 WHERE \"id\" = $3", "X", null, 3));
    assertEquals("UPDATE \"jobs\" SET \"title\"=?, \"salary\"=? WHERE \"id\" = ?", j.sql());
    assertEquals(Arrays.asList("X", null, 3), j.binds());
  }

  @Test
  void multiDigitAndRepeatedPlaceholders() {
    Object[] values = new Object[11];
    for (int i = 0; i < values.length; i++) values[i] = i + 1;
    PositionalSql.JdbcSql j = PositionalSql.toJdbc(SqlStatement.of("a=$11 AND b=$1 AND c=$11", values));
    assertEquals("a=? AND b=? AND c=?", j.sql());
    assertEquals(List.of(11, 1, 11), j.binds());
  }

  @Test
  void quotedTextIsLeftAlone() {
    PositionalSql.JdbcSql j = PositionalSql.toJdbc(SqlStatement.of("SELECT '$1', \"$2\" FROM t WHERE x = $1", 5));
    assertEquals("SELECT '$1', \"$2\" FROM t WHERE x = ?", j.sql());
    assertEquals(List.of(5), j.binds());
  }

  @Test
  void dollarWithoutDigitIsNotAPlaceholder() {
    PositionalSql.JdbcSql j = PositionalSql.toJdbc(SqlStatement.of("SELECT $ FROM t"));
    assertEquals("SELECT $ FROM t", j.sql());
    assertTrue(j.binds().isEmpty());
  }

  @Test
  void placeholderWithoutValueFails() {
    assertThrows(StoreException.class, () -> PositionalSql.toJdbc(SqlStatement.of("x = $2", 1)));
    assertThrows(StoreException.class, () -> PositionalSql.toJdbc(SqlStatement.of("x = $0", 1)));
  }
}
