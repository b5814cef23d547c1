package io.intellixity.fetchgraph.query;

import java.util.Objects;

/** Grouping key. {@code entity} is an optional qualifier; {@code field} may also be {@code qualifier.column}. */
public record GroupBySpec(String entity, String field, String alias) {
  public GroupBySpec {
    Objects.requireNonNull(field, "field");
  }

  public static GroupBySpec of(String field) { return new GroupBySpec(null, field, null); }
  public static GroupBySpec of(String entity, String field) { return new GroupBySpec(entity, field, null); }
}
