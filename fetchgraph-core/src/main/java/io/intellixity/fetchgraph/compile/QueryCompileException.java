package io.intellixity.fetchgraph.compile;

import io.intellixity.fetchgraph.query.QueryValidationException;

/** The bound sketch cannot be expressed as a canonical query (unsupported NOT, multi-hop path, bad operand). */
public final class QueryCompileException extends QueryValidationException {
  public QueryCompileException(String message) {
    super(message);
  }
}
