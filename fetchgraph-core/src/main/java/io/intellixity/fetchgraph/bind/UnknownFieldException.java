package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.query.QueryValidationException;

import java.util.List;

public final class UnknownFieldException extends QueryValidationException {
  private final String field;
  private final String root;
  private final List<String> candidates;

  public UnknownFieldException(String field, String root, List<String> candidates) {
    super("Unknown field '" + field + "' from root '" + root + "'"
        + (candidates.isEmpty() ? "" : "; entities with that column: " + candidates));
    this.field = field;
    this.root = root;
    this.candidates = List.copyOf(candidates);
  }

  public String field() { return field; }
  public String root() { return root; }
  public List<String> candidates() { return candidates; }
}
