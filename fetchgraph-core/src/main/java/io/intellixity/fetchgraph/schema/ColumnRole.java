package io.intellixity.fetchgraph.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ColumnRole {
  NONE,
  PRIMARY_KEY,
  FOREIGN_KEY;

  @JsonValue
  public String symbol() { return name().toLowerCase(Locale.ROOT); }

  @JsonCreator
  public static ColumnRole parse(String raw) {
    if (raw == null || raw.isBlank()) return NONE;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "primary_key", "pk" -> PRIMARY_KEY;
      case "foreign_key", "fk" -> FOREIGN_KEY;
      case "none" -> NONE;
      default -> throw new IllegalArgumentException("Unknown column role: " + raw);
    };
  }
}
