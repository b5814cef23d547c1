package io.intellixity.fetchgraph.bind;

import java.util.Locale;

public enum AmbiguityStrategy {
  /** Tied candidates raise {@link AmbiguousFieldException}. */
  ASK,
  /** Take the first candidate by ranking and record a diagnostic. */
  BEST;

  public static AmbiguityStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) return BEST;
    return AmbiguityStrategy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
