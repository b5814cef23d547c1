package io.intellixity.fetchgraph.bind;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BindingReason {
  /** Column of the root entity. */
  ROOT,
  /** Reached through relations the caller listed in {@code with}. */
  DECLARED,
  /** Reached through relations the binder added. */
  AUTO,
  /** Explicit {@code qualifier.field} resolved through a relation or entity label. */
  QUALIFIED;

  @JsonValue
  public String symbol() { return name().toLowerCase(Locale.ROOT); }
}
