package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.query.QueryValidationException;

import java.util.List;

/** Several candidates tie; {@link #candidates()} are {@code <relation-or-entity>.<field>}. */
public final class AmbiguousFieldException extends QueryValidationException {
  private final String field;
  private final List<String> candidates;

  public AmbiguousFieldException(String field, List<String> candidates) {
    super("Ambiguous field '" + field + "'; candidates: " + String.join(", ", candidates));
    this.field = field;
    this.candidates = List.copyOf(candidates);
  }

  public String field() { return field; }
  public List<String> candidates() { return candidates; }
}
