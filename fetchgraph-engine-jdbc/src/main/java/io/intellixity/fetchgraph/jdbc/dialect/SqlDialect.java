package io.intellixity.fetchgraph.jdbc.dialect;

import io.intellixity.fetchgraph.jdbc.SqlStatement;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.spi.exec.JoinPlan;
import io.intellixity.fetchgraph.spi.exec.ResolvedSemanticClause;

import java.util.List;

/**
 * Renders planned relational queries as SQL. Implementations are discovered by {@link #id()} through
 * {@code META-INF/fetchgraph.factories}, see {@link SqlDialects}.
 */
public interface SqlDialect {
  String id();

  /**
   * @param schema table qualifier, or null
   */
  SqlStatement renderQuery(RelationalQuery query, JoinPlan plan, List<ResolvedSemanticClause> semantic, String schema);
}
