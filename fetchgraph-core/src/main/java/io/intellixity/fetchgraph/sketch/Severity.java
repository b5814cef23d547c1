package io.intellixity.fetchgraph.sketch;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
  ERROR,
  WARNING;

  @JsonValue
  public String symbol() { return name().toLowerCase(Locale.ROOT); }
}
