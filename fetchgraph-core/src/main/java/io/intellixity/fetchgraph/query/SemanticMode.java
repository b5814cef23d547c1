package io.intellixity.fetchgraph.query;

import java.util.Locale;

public enum SemanticMode {
  /** Keep only rows whose key matched. */
  FILTER,
  /** Keep every row, order by match score. */
  BOOST;

  public String symbol() { return name().toLowerCase(Locale.ROOT); }

  public static SemanticMode parse(String raw) {
    if (raw == null || raw.isBlank()) return FILTER;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "filter" -> FILTER;
      case "boost" -> BOOST;
      default -> throw new QueryValidationException("Unknown semantic mode: " + raw);
    };
  }
}
