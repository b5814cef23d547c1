package io.intellixity.fetchgraph.jdbc.dialect;

/**
 * Standard SQL with double-quoted identifiers and {@code OFFSET .. FETCH FIRST} paging.
 * <p>
 * Outer joins are emulated, since H2 and MySQL have no {@code FULL OUTER JOIN}.
 */
public class AnsiSqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "ansi"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected boolean supportsFullOuterJoin() {
    return false;
  }
}
