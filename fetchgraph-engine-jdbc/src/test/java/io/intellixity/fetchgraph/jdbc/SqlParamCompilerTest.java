package io.intellixity.fetchgraph.jdbc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlParamCompilerTest {
  @Test
  void replacesNamedParamsInOrder() {
    String sql = "SELECT * FROM t WHERE a = :b1 AND b IN (:b2, :b3)";
    assertEquals("SELECT * FROM t WHERE a = ? AND b IN (?, ?)", SqlParamCompiler.toJdbcSql(sql));
    assertEquals(List.of("b1", "b2", "b3"), SqlParamCompiler.paramNames(sql));
  }

  @Test
  void leavesQuotedTextAndCastsAlone() {
    String sql = "SELECT x::text, ':nope', \"odd:col\", 'it''s :x' FROM t WHERE y LIKE :p ESCAPE '\\'";
    assertEquals("SELECT x::text, ':nope', \"odd:col\", 'it''s :x' FROM t WHERE y LIKE ? ESCAPE '\\'",
        SqlParamCompiler.toJdbcSql(sql));
    assertEquals(List.of("p"), SqlParamCompiler.paramNames(sql));
  }

  @Test
  void nullSql() {
    assertEquals("", SqlParamCompiler.toJdbcSql(null));
    assertTrue(SqlParamCompiler.paramNames(null).isEmpty());
  }
}
