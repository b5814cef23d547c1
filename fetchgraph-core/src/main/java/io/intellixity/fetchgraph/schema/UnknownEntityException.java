package io.intellixity.fetchgraph.schema;

import io.intellixity.fetchgraph.query.QueryValidationException;

public final class UnknownEntityException extends QueryValidationException {
  private final String entity;

  public UnknownEntityException(String entity) {
    super("Unknown entity: " + entity);
    this.entity = entity;
  }

  public String entity() { return entity; }
}
