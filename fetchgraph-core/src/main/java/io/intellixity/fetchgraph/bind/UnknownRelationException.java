package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.query.QueryValidationException;

public final class UnknownRelationException extends QueryValidationException {
  private final String relation;

  public UnknownRelationException(String relation) {
    this(relation, "Unknown relation or qualifier: " + relation);
  }

  public UnknownRelationException(String relation, String message) {
    super(message);
    this.relation = relation;
  }

  public String relation() { return relation; }
}
