package io.intellixity.fetchgraph.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SELECT with {@code :bN} named parameters.
 *
 * @param binds   parameter values in the order the parameters appear in {@code sql}
 * @param columns output labels in select-list order
 */
public record SqlStatement(String sql, List<Object> binds, List<String> columns) {
  public SqlStatement {
    binds = Collections.unmodifiableList(new ArrayList<>(binds == null ? List.of() : binds));
    columns = List.copyOf(columns == null ? List.of() : columns);
  }
}
