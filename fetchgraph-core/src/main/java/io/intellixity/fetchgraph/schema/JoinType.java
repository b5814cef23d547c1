package io.intellixity.fetchgraph.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JoinType {
  INNER,
  LEFT,
  /** Full outer join. */
  OUTER;

  @JsonValue
  public String symbol() { return name().toLowerCase(Locale.ROOT); }

  @JsonCreator
  public static JoinType parse(String raw) {
    if (raw == null || raw.isBlank()) return INNER;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "inner" -> INNER;
      case "left", "left_outer" -> LEFT;
      case "outer", "full", "full_outer" -> OUTER;
      default -> throw new IllegalArgumentException("Unknown join type: " + raw);
    };
  }
}
