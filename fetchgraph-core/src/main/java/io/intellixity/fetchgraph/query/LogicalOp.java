package io.intellixity.fetchgraph.query;

import java.util.Locale;

public enum LogicalOp {
  AND,
  OR;

  public String symbol() { return name().toLowerCase(Locale.ROOT); }

  public static LogicalOp parse(String raw) {
    if (raw == null || raw.isBlank()) return AND;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "and" -> AND;
      case "or" -> OR;
      default -> throw new QueryValidationException("Unknown logical op: " + raw);
    };
  }
}
