package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.query.QueryValidationException;

public final class RelationNotFromRootException extends QueryValidationException {
  private final String relation;
  private final String root;
  private final String fromEntity;

  public RelationNotFromRootException(String relation, String root, String fromEntity) {
    super("Relation '" + relation + "' starts at '" + fromEntity + "', which is not reachable from root '" + root + "'");
    this.relation = relation;
    this.root = root;
    this.fromEntity = fromEntity;
  }

  public String relation() { return relation; }
  public String root() { return root; }
  public String fromEntity() { return fromEntity; }
}
