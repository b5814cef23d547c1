package io.intellixity.fetchgraph.jdbc.postgres;

import io.intellixity.fetchgraph.jdbc.dialect.AbstractSqlDialect;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides: {@code ILIKE} and {@code LIMIT .. OFFSET} paging.
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String renderCaseInsensitiveLike(String expr, String pattern, RenderCtx ctx) {
    return expr + " ILIKE " + ctx.add(pattern) + " ESCAPE '\\'";
  }

  @Override
  protected String renderPage(Integer limit, int offset, RenderCtx ctx) {
    StringBuilder sb = new StringBuilder();
    if (limit != null) sb.append(" LIMIT ").append(ctx.add(limit));
    if (offset > 0) sb.append(" OFFSET ").append(ctx.add(offset));
    return sb.toString();
  }
}
