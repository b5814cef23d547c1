package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What a provider can answer; declared once per provider type. */
public enum ProviderCapability {
  /** {@code op=schema}. */
  SCHEMA,
  /** {@code op=query} returning joined rows. */
  ROW_QUERY,
  /** group_by and aggregations. */
  AGGREGATE,
  /** semantic clauses and {@code op=semantic_only}; needs a semantic backend. */
  SEMANTIC_SEARCH,
  /** The {@code $dsl} sketch envelope. */
  SKETCH_DIALECT;

  @JsonValue
  public String symbol() { return name().toLowerCase(Locale.ROOT); }
}
