package io.intellixity.fetchgraph.jdbc.dialect;

import io.intellixity.fetchgraph.util.FetchgraphFactories;

import java.util.List;
import java.util.Locale;

/** Looks up {@link SqlDialect}s registered in {@code META-INF/fetchgraph.factories}. */
public final class SqlDialects {
  private SqlDialects() {}

  public static List<SqlDialect> available() {
    return FetchgraphFactories.load(SqlDialect.class);
  }

  public static SqlDialect byId(String id) {
    String wanted = (id == null) ? "" : id.trim().toLowerCase(Locale.ROOT);
    List<SqlDialect> all = available();
    for (SqlDialect d : all) {
      if (d.id().toLowerCase(Locale.ROOT).equals(wanted)) return d;
    }
    throw new IllegalArgumentException("Unknown SQL dialect '" + id + "'; available: "
        + all.stream().map(SqlDialect::id).toList());
  }
}
