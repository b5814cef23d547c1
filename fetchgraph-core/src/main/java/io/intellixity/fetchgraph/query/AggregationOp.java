package io.intellixity.fetchgraph.query;

import java.util.Locale;

public enum AggregationOp {
  COUNT,
  COUNT_DISTINCT,
  SUM,
  MIN,
  MAX,
  AVG;

  public String symbol() { return name().toLowerCase(Locale.ROOT); }

  public static AggregationOp parse(String raw) {
    if (raw == null) throw new QueryValidationException("Aggregation op is required");
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (AggregationOp op : values()) {
      if (op.symbol().equals(s)) return op;
    }
    if (s.equals("mean")) return AVG;
    throw new QueryValidationException("Unknown aggregation op: " + raw);
  }
}
