package io.intellixity.fetchgraph.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Cardinality hint for describe output; engines do not use it. */
public enum Cardinality {
  ONE_TO_ONE("1_to_1"),
  ONE_TO_MANY("1_to_many"),
  MANY_TO_ONE("many_to_1"),
  MANY_TO_MANY("many_to_many");

  private final String symbol;

  Cardinality(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String symbol() { return symbol; }

  @JsonCreator
  public static Cardinality parse(String raw) {
    if (raw == null || raw.isBlank()) return null;
    for (Cardinality c : values()) {
      if (c.symbol.equalsIgnoreCase(raw.trim())) return c;
    }
    throw new IllegalArgumentException("Unknown cardinality: " + raw);
  }
}
