package io.intellixity.fetchgraph.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** Data source plus the optional schema that qualifies every table name. */
public final class JdbcHandle {
  private final String id;
  private final DataSource dataSource;
  private final String schema;

  public JdbcHandle(String id, DataSource dataSource, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public JdbcHandle(String id, DataSource dataSource) {
    this(id, dataSource, null);
  }

  public String id() { return id; }
  public DataSource dataSource() { return dataSource; }

  /** Null when tables are unqualified. */
  public String schema() { return schema; }
}
