package io.intellixity.fetchgraph.query;

import java.util.Objects;

public record AggregationSpec(String field, AggregationOp agg, String alias) {
  public AggregationSpec {
    field = (field == null || field.isBlank()) ? "*" : field;
    Objects.requireNonNull(agg, "agg");
  }

  public static AggregationSpec of(AggregationOp agg, String field) {
    return new AggregationSpec(field, agg, null);
  }

  public boolean isCountAll() {
    return agg == AggregationOp.COUNT && "*".equals(field);
  }

  /** Explicit alias, else {@code <agg>_<field>} with dots flattened; {@code count(*)} is {@code count}. */
  public String resolvedAlias() {
    if (alias != null && !alias.isBlank()) return alias;
    if (isCountAll()) return "count";
    return agg.symbol() + "_" + field.replace(".", "__");
  }
}
